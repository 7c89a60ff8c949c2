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
 * Root of the unchecked exceptions raised by the actor runtime.
 */
public class ActorException extends RuntimeException {
	private static final long serialVersionUID = 5573935028054003171L;

	public ActorException() {
		super();
	}

	public ActorException(Throwable t) {
		super(t);
	}

	public ActorException(String message) {
		super(message);
	}

	public ActorException(String message, Throwable cause) {
		super(message, cause);
	}
}
