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

package com.ibm.research.sidecar.client;

import io.smallrye.mutiny.Uni;

/**
 * ActorSidecarClient defines the actor operations that the runtime and actor
 * instances expect to be able to invoke on the sidecar hosting them.
 *
 * Failed requests complete the returned Uni with a {@link SidecarException}.
 */
public interface ActorSidecarClient extends AutoCloseable {

	// invoke a method on another actor, returns the raw response payload
	public Uni<byte[]> invokeMethod(String actorType, String actorId, String method, byte[] data);

	//
	// Actor state operations
	//

	// returns an empty array when the key has no value
	public Uni<byte[]> getState(String actorType, String actorId, String key);

	public Uni<Void> saveStateTransactionally(String actorType, String actorId, byte[] data);

	//
	// Actor Reminder operations
	//

	public Uni<Void> registerReminder(String actorType, String actorId, String name, byte[] data);

	public Uni<Void> unregisterReminder(String actorType, String actorId, String name);

	//
	// Actor Timer operations
	//

	public Uni<Void> registerTimer(String actorType, String actorId, String name, byte[] data);

	public Uni<Void> unregisterTimer(String actorType, String actorId, String name);

	@Override
	public void close();
}
