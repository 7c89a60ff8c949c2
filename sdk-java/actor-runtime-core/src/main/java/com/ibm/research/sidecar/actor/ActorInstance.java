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

import com.ibm.research.sidecar.runtime.ActorRuntimeContext;

/**
 * The runtime requires all Actor classes to implement the ActorInstance interface.
 *
 * Instances are allocated by the runtime through a public no-argument
 * constructor and then bound to their context and id before any activation
 * hook or remote method runs. {@link ActorSkeleton} provides a default
 * implementation.
 */
public interface ActorInstance {

	/**
	 * @return the actor type this instance belongs to
	 */
	public String getType();

	/**
	 * @return the id of this instance
	 */
	public ActorId getId();

	/**
	 * @return the runtime context of the actor type
	 */
	public ActorRuntimeContext getContext();

	/**
	 * Bind a freshly allocated instance to its type context and id.
	 * Called exactly once by the runtime.
	 */
	public void bind(ActorRuntimeContext context, ActorId id);
}
