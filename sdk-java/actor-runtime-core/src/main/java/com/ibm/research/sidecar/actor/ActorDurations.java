/*
 * Copyright IBM Corporation 2024
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.ibm.research.sidecar.actor;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Conversions between {@link Duration} and the duration strings the sidecar
 * uses for timers, reminders and runtime configuration, for example
 * <code>1h0m0s</code> or <code>0h0m2s500ms</code>.
 */
public final class ActorDurations {

	private static final Pattern SIDECAR_DURATION = Pattern
			.compile("(?:(\\d+)h)?(?:(\\d+)m(?!s))?(?:(\\d+)s)?(?:(\\d+)ms)?(?:(\\d+)(?:us|µs|μs))?");

	private ActorDurations() {
	}

	/**
	 * Format a duration as <code>&lt;hours&gt;h&lt;minutes&gt;m&lt;seconds&gt;s</code>,
	 * followed by <code>&lt;millis&gt;ms</code> when there is a sub-second part.
	 *
	 * @param duration a non-negative duration
	 * @return the sidecar representation
	 */
	public static String format(Duration duration) {
		if (duration.isNegative()) {
			throw new IllegalArgumentException("Negative duration: " + duration);
		}
		StringBuilder sb = new StringBuilder();
		sb.append(duration.toHours()).append('h');
		sb.append(duration.toMinutesPart()).append('m');
		sb.append(duration.toSecondsPart()).append('s');
		if (duration.toMillisPart() > 0) {
			sb.append(duration.toMillisPart()).append("ms");
		}
		return sb.toString();
	}

	/**
	 * Parse either an ISO-8601 duration (<code>PT30S</code>) or a sidecar
	 * duration (<code>0h0m30s</code>, <code>30s</code>, <code>500ms</code>).
	 *
	 * @param text the text to parse
	 * @return the parsed duration
	 * @throws IllegalArgumentException if text is not a duration
	 */
	public static Duration parse(String text) {
		String s = text == null ? "" : text.trim();
		if (s.isEmpty()) {
			throw new IllegalArgumentException("Empty duration");
		}
		if (s.charAt(0) == 'P' || s.charAt(0) == 'p') {
			try {
				return Duration.parse(s);
			} catch (DateTimeParseException e) {
				throw new IllegalArgumentException("Invalid duration: " + text, e);
			}
		}
		Matcher m = SIDECAR_DURATION.matcher(s);
		if (!m.matches()) {
			throw new IllegalArgumentException("Invalid duration: " + text);
		}
		Duration result = Duration.ZERO;
		result = result.plusHours(group(m, 1));
		result = result.plusMinutes(group(m, 2));
		result = result.plusSeconds(group(m, 3));
		result = result.plusMillis(group(m, 4));
		result = result.plusNanos(group(m, 5) * 1000);
		return result;
	}

	private static long group(Matcher m, int i) {
		String g = m.group(i);
		return g == null ? 0 : Long.parseLong(g);
	}
}
