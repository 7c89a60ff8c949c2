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

package com.ibm.research.sidecar.actor.exceptions;

/**
 * Wraps a failure thrown by application code: a remote method, an activation
 * hook, or a reminder or timer callback. The failure raised by user code is the cause.
 */
public class ActorMethodInvocationException extends ActorException {
	private static final long serialVersionUID = 6289655259906138150L;

	public ActorMethodInvocationException() {
		super();
	}

	public ActorMethodInvocationException(String errorMessage) {
		super(errorMessage);
	}

	public ActorMethodInvocationException(String errorMessage, Throwable cause) {
		super(errorMessage, cause);
	}
}
