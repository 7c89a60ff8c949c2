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

import java.util.UUID;

/**
 * Identifies one actor instance within an actor type.
 */
public final class ActorId {

	private final String id;

	/**
	 * @param id the raw id supplied by the sidecar
	 * @throws IllegalArgumentException if id is null or empty
	 */
	public ActorId(String id) {
		if (id == null || id.isEmpty()) {
			throw new IllegalArgumentException("actor id must be a non-empty string");
		}
		this.id = id;
	}

	/**
	 * Create an ActorId from a random UUID.
	 * @return a new ActorId
	 */
	public static ActorId createRandom() {
		return new ActorId(UUID.randomUUID().toString().replace("-", ""));
	}

	public String getId() {
		return id;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof ActorId)) {
			return false;
		}
		return id.equals(((ActorId) obj).id);
	}

	@Override
	public int hashCode() {
		return id.hashCode();
	}

	@Override
	public String toString() {
		return id;
	}
}
