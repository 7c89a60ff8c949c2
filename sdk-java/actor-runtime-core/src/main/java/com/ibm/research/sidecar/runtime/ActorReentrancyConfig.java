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

import javax.json.Json;
import javax.json.JsonObject;

/**
 * Reentrancy settings advertised to the sidecar.
 */
public class ActorReentrancyConfig {

	public static final int DEFAULT_MAX_STACK_DEPTH = 32;

	private volatile boolean enabled;
	private volatile int maxStackDepth;

	public ActorReentrancyConfig() {
		this(false, DEFAULT_MAX_STACK_DEPTH);
	}

	public ActorReentrancyConfig(boolean enabled, int maxStackDepth) {
		this.enabled = enabled;
		this.maxStackDepth = maxStackDepth;
	}

	public boolean isEnabled() {
		return enabled;
	}

	public void setEnabled(boolean enabled) {
		this.enabled = enabled;
	}

	public int getMaxStackDepth() {
		return maxStackDepth;
	}

	public void setMaxStackDepth(int maxStackDepth) {
		this.maxStackDepth = maxStackDepth;
	}

	public JsonObject toJson() {
		return Json.createObjectBuilder().add("enabled", enabled).add("maxStackDepth", maxStackDepth).build();
	}
}
