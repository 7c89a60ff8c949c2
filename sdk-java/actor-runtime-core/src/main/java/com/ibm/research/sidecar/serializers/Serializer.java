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

package com.ibm.research.sidecar.serializers;

/**
 * Converts actor messages and actor state to and from bytes.
 * Implementations must be safe for concurrent use.
 */
public interface Serializer {

	/**
	 * @param obj the value to encode, may be null
	 * @return the encoded bytes
	 * @throws com.ibm.research.sidecar.actor.exceptions.SerializationException if obj cannot be encoded
	 */
	public byte[] serialize(Object obj);

	/**
	 * @param data the encoded bytes, may be null or empty
	 * @param type the type to decode into
	 * @return the decoded value, null for empty input
	 * @throws com.ibm.research.sidecar.actor.exceptions.SerializationException if data cannot be decoded as type
	 */
	public <T> T deserialize(byte[] data, Class<T> type);
}
