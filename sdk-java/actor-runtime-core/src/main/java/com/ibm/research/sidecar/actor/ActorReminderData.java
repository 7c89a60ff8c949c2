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
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The schedule and state of a reminder, as exchanged with the sidecar.
 * State travels base64 encoded in the <code>data</code> field.
 */
public final class ActorReminderData {
	private final String reminderName;
	private final byte[] state;
	private final Duration dueTime;
	private final Duration period;

	public ActorReminderData(String reminderName, byte[] state, Duration dueTime, Duration period) {
		this.reminderName = reminderName;
		this.state = state == null ? new byte[0] : state;
		this.dueTime = dueTime;
		this.period = period;
	}

	/**
	 * Decode the reminder envelope delivered by the sidecar when a reminder fires.
	 *
	 * @param reminderName the name of the reminder
	 * @param obj the decoded envelope, may be null
	 * @return the reminder data
	 * @throws IllegalArgumentException if a field has the wrong shape
	 */
	public static ActorReminderData fromMap(String reminderName, Map<?, ?> obj) {
		if (obj == null) {
			return new ActorReminderData(reminderName, null, null, null);
		}
		byte[] state = null;
		Object data = obj.get("data");
		if (data instanceof String) {
			state = Base64.getDecoder().decode((String) data);
		} else if (data != null) {
			throw new IllegalArgumentException("Reminder data must be a base64 string: " + data);
		}
		return new ActorReminderData(reminderName, state, toDuration(obj.get("dueTime")), toDuration(obj.get("period")));
	}

	private static Duration toDuration(Object value) {
		if (value == null || value.toString().isBlank()) {
			return null;
		}
		return ActorDurations.parse(value.toString());
	}

	public String getReminderName() {
		return this.reminderName;
	}

	public byte[] getState() {
		return this.state;
	}

	public Duration getDueTime() {
		return this.dueTime;
	}

	public Duration getPeriod() {
		return this.period;
	}

	/**
	 * @return the registration body for the sidecar
	 */
	public Map<String, Object> toMap() {
		Map<String, Object> map = new LinkedHashMap<>();
		map.put("reminderName", this.reminderName);
		if (this.dueTime != null) {
			map.put("dueTime", ActorDurations.format(this.dueTime));
		}
		if (this.period != null) {
			map.put("period", ActorDurations.format(this.period));
		}
		map.put("data", Base64.getEncoder().encodeToString(this.state));
		return map;
	}

	public String toString() {
		return "{" + " reminderName: " + this.reminderName + ", dueTime: " + this.dueTime + ", period: " + this.period
				+ ", state: " + this.state.length + " bytes}";
	}
}
