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

package com.ibm.research.sidecar.runtime;

import com.ibm.research.sidecar.actor.ActorId;

/**
 * An ActorManager owns the lifecycle and method dispatch of every instance of
 * one actor type. The {@link ActorRuntime} routes each request to the manager
 * registered for the request's actor type.
 *
 * Implementations must be safe for concurrent use. Failures are reported by
 * throwing; the runtime passes them to its caller unchanged.
 */
public interface ActorManager {

	// allocate the instance if needed and run its activation hook
	public void activateActor(ActorId actorId);

	// remove the instance and run its deactivation hook
	public void deactivateActor(ActorId actorId);

	/**
	 * Invoke a remote method.
	 *
	 * @param actorId the target instance
	 * @param methodName the name the method is dispatched under
	 * @param requestBody the encoded argument, may be empty
	 * @return the encoded result
	 */
	public byte[] dispatch(ActorId actorId, String methodName, byte[] requestBody);

	public void fireReminder(ActorId actorId, String reminderName, byte[] requestBody);

	public void fireTimer(ActorId actorId, String timerName);
}
