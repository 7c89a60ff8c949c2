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
 * Raised when a request names an actor type that is not registered with the runtime.
 */
public class ActorTypeNotFoundException extends ActorException {
	private static final long serialVersionUID = -4220811000416367515L;

	public ActorTypeNotFoundException() {
		super();
	}

	public ActorTypeNotFoundException(String errorMessage) {
		super(errorMessage);
	}

	public ActorTypeNotFoundException(String errorMessage, Throwable cause) {
		super(errorMessage, cause);
	}
}
