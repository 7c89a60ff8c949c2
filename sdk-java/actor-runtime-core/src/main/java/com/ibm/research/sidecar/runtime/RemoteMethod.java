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

import java.lang.invoke.MethodHandle;

/**
 * A method of an actor type that may be invoked through the sidecar.
 */
public final class RemoteMethod {

	// dispatch name
	private final String name;

	// bound to the declaring class, the receiver is the first argument
	private final MethodHandle handle;

	// boxed type of the single parameter, null for methods without one
	private final Class<?> parameterType;

	private final boolean returnsVoid;

	public RemoteMethod(String name, MethodHandle handle, Class<?> parameterType, boolean returnsVoid) {
		this.name = name;
		this.handle = handle;
		this.parameterType = parameterType;
		this.returnsVoid = returnsVoid;
	}

	public String getName() {
		return name;
	}

	public MethodHandle getHandle() {
		return handle;
	}

	public Class<?> getParameterType() {
		return parameterType;
	}

	public boolean returnsVoid() {
		return returnsVoid;
	}
}
