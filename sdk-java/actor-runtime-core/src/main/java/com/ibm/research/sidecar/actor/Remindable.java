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
 * Actor types that implement Remindable can receive reminders from the sidecar.
 */
public interface Remindable {

	/**
	 * Invoked when a reminder registered by this actor fires.
	 *
	 * @param reminderName the name the reminder was registered under
	 * @param state the state supplied at registration, empty if none
	 * @param dueTime the due time of the reminder, or null
	 * @param period the period of the reminder, or null for one-shot reminders
	 */
	public void receiveReminder(String reminderName, byte[] state, Duration dueTime, Duration period);
}
