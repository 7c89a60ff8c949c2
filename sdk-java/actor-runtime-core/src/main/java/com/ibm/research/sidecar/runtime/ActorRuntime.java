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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.logging.Logger;

import org.eclipse.microprofile.config.ConfigProvider;

import com.ibm.research.sidecar.actor.ActorId;
import com.ibm.research.sidecar.actor.ActorInstance;
import com.ibm.research.sidecar.actor.exceptions.ActorTypeNotFoundException;
import com.ibm.research.sidecar.client.ActorSidecarClient;
import com.ibm.research.sidecar.client.VertxActorSidecarClient;
import com.ibm.research.sidecar.serializers.DefaultJsonSerializer;
import com.ibm.research.sidecar.serializers.Serializer;

/**
 * The ActorRuntime is the registry of the actor types hosted by this process.
 * It keeps one {@link ActorManager} per registered type, routes lifecycle,
 * method, reminder and timer requests to it, and owns the runtime
 * configuration advertised to the sidecar.
 *
 * A single lock guards the registry and the refresh of the advertised actor
 * types. Requests delegated to an ActorManager run outside the lock.
 */
public class ActorRuntime {

	private final static String LOG_PREFIX = "ActorRuntime.";
	private final static Logger logger = Logger.getLogger(ActorRuntime.class.getName());

	/**
	 * Serializer used for actor types registered without an explicit one.
	 */
	public static final Serializer DEFAULT_SERIALIZER = new DefaultJsonSerializer();

	private final ReentrantLock lock = new ReentrantLock();

	private final Map<String, ActorManager> actorManagers = new LinkedHashMap<String, ActorManager>();

	private final Supplier<? extends ActorSidecarClient> clientFactory;

	private final ActorManagerFactory managerFactory;

	private volatile ActorRuntimeConfig config;

	public ActorRuntime() {
		this(ActorRuntimeConfig.fromConfig(ConfigProvider.getConfig()), VertxActorSidecarClient::new,
				DefaultActorManager::new);
	}

	public ActorRuntime(ActorRuntimeConfig config, Supplier<? extends ActorSidecarClient> clientFactory,
			ActorManagerFactory managerFactory) {
		this.config = Objects.requireNonNull(config, "config");
		this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory");
		this.managerFactory = Objects.requireNonNull(managerFactory, "managerFactory");
	}

	/**
	 * Register an actor class using the default serializers.
	 *
	 * @return the actor type name
	 */
	public String registerActor(Class<? extends ActorInstance> actorClass) {
		return registerActor(actorClass, null, null);
	}

	/**
	 * Register an actor class. Registering a type name again replaces the
	 * previous registration.
	 *
	 * @param actorClass the actor implementation class
	 * @param messageSerializer serializer for method arguments and results, null for the default
	 * @param stateSerializer serializer for actor state, null for the default
	 * @return the actor type name
	 * @throws com.ibm.research.sidecar.actor.exceptions.ActorRegistrationException if the class is not a valid actor
	 */
	public String registerActor(Class<? extends ActorInstance> actorClass, Serializer messageSerializer,
			Serializer stateSerializer) {
		ActorTypeInformation typeInfo = ActorTypeInformation.create(actorClass);
		ActorSidecarClient client = clientFactory.get();
		ActorRuntimeContext context = new ActorRuntimeContext(typeInfo,
				messageSerializer != null ? messageSerializer : DEFAULT_SERIALIZER,
				stateSerializer != null ? stateSerializer : DEFAULT_SERIALIZER, client);
		ActorManager manager = managerFactory.create(context);

		String typeName = typeInfo.getTypeName();
		lock.lock();
		try {
			actorManagers.put(typeName, manager);
			config.updateEntities(actorManagers.keySet());
		} finally {
			lock.unlock();
		}
		logger.info(LOG_PREFIX + "registerActor: registered actor type " + typeName + " implemented by "
				+ actorClass.getName());
		return typeName;
	}

	/**
	 * @return a snapshot of the registered actor type names, in registration order
	 */
	public List<String> getRegisteredActorTypes() {
		lock.lock();
		try {
			return new ArrayList<String>(actorManagers.keySet());
		} finally {
			lock.unlock();
		}
	}

	public Optional<ActorManager> getActorManager(String actorTypeName) {
		lock.lock();
		try {
			return Optional.ofNullable(actorManagers.get(actorTypeName));
		} finally {
			lock.unlock();
		}
	}

	public void activate(String actorTypeName, String actorId) {
		ActorId id = new ActorId(actorId);
		route(actorTypeName).activateActor(id);
	}

	public void deactivate(String actorTypeName, String actorId) {
		ActorId id = new ActorId(actorId);
		route(actorTypeName).deactivateActor(id);
	}

	/**
	 * Invoke a remote method. The request and response payloads are passed
	 * through untouched.
	 */
	public byte[] dispatch(String actorTypeName, String actorId, String methodName, byte[] requestBody) {
		ActorId id = new ActorId(actorId);
		return route(actorTypeName).dispatch(id, methodName, requestBody);
	}

	public void fireReminder(String actorTypeName, String actorId, String reminderName, byte[] requestBody) {
		ActorId id = new ActorId(actorId);
		route(actorTypeName).fireReminder(id, reminderName, requestBody);
	}

	public void fireTimer(String actorTypeName, String actorId, String timerName) {
		ActorId id = new ActorId(actorId);
		route(actorTypeName).fireTimer(id, timerName);
	}

	/**
	 * Replace the runtime configuration. The advertised actor types of the new
	 * configuration are overwritten with the registered types.
	 */
	public void setActorConfig(ActorRuntimeConfig config) {
		Objects.requireNonNull(config, "config");
		lock.lock();
		try {
			this.config = config;
			config.updateEntities(actorManagers.keySet());
		} finally {
			lock.unlock();
		}
	}

	/**
	 * @return the live configuration shared with the runtime
	 */
	public ActorRuntimeConfig getActorConfig() {
		return config;
	}

	private ActorManager route(String actorTypeName) {
		Optional<ActorManager> manager = getActorManager(actorTypeName);
		if (manager.isEmpty()) {
			logger.fine(LOG_PREFIX + "route: no actor type " + actorTypeName);
			throw new ActorTypeNotFoundException("Actor type not found: " + actorTypeName);
		}
		return manager.get();
	}
}
