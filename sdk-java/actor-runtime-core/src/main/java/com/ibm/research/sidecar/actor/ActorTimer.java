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

/**
 * A timer registered by an actor instance. Timers live in memory with the
 * instance; the sidecar only knows their name and schedule.
 */
public final class ActorTimer {
	private final String name;
	private final Runnable callback;
	private final Duration dueTime;
	private final Duration period;

	public ActorTimer(String name, Runnable callback, Duration dueTime, Duration period) {
		this.name = name;
		this.callback = callback;
		this.dueTime = dueTime;
		this.period = period;
	}

	public String getName() {
		return this.name;
	}

	public Duration getDueTime() {
		return this.dueTime;
	}

	public Duration getPeriod() {
		return this.period;
	}

	public void fire() {
		this.callback.run();
	}

	public String toString() {
		return "{" + " name: " + this.name + ", dueTime: " + this.dueTime + ", period: " + this.period + "}";
	}
}
