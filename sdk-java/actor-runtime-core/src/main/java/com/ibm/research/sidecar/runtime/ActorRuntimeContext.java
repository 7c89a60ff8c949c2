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
import com.ibm.research.sidecar.actor.ActorInstance;
import com.ibm.research.sidecar.actor.exceptions.ActorMethodInvocationException;
import com.ibm.research.sidecar.client.ActorSidecarClient;
import com.ibm.research.sidecar.serializers.Serializer;

/**
 * Everything the runtime knows about one registered actor type: its type
 * information, its serializers and the client used to reach the sidecar.
 */
public final class ActorRuntimeContext {

	private final ActorTypeInformation typeInfo;
	private final Serializer messageSerializer;
	private final Serializer stateSerializer;
	private final ActorSidecarClient sidecarClient;

	public ActorRuntimeContext(ActorTypeInformation typeInfo, Serializer messageSerializer, Serializer stateSerializer,
			ActorSidecarClient sidecarClient) {
		this.typeInfo = typeInfo;
		this.messageSerializer = messageSerializer;
		this.stateSerializer = stateSerializer;
		this.sidecarClient = sidecarClient;
	}

	public ActorTypeInformation getTypeInfo() {
		return typeInfo;
	}

	public Serializer getMessageSerializer() {
		return messageSerializer;
	}

	public Serializer getStateSerializer() {
		return stateSerializer;
	}

	public ActorSidecarClient getSidecarClient() {
		return sidecarClient;
	}

	/**
	 * Allocate a new instance of the actor type and bind it to this context.
	 *
	 * @param actorId the id of the new instance
	 * @return the bound instance, not yet activated
	 */
	public ActorInstance createActor(ActorId actorId) {
		ActorInstance actor;
		try {
			actor = (ActorInstance) typeInfo.getConstructor().invoke();
		} catch (Error e) {
			throw e;
		} catch (Throwable t) {
			throw new ActorMethodInvocationException("Failed to construct " + typeInfo.getTypeName() + "[" + actorId + "]", t);
		}
		actor.bind(this, actorId);
		return actor;
	}
}
