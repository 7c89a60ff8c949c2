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

package com.ibm.research.sidecar.jaxrs;

import java.util.logging.Logger;

import javax.enterprise.context.ApplicationScoped;
import javax.enterprise.inject.Produces;
import javax.inject.Singleton;

import org.eclipse.microprofile.config.ConfigProvider;

import com.ibm.research.sidecar.actor.ActorInstance;
import com.ibm.research.sidecar.actor.exceptions.ActorRegistrationException;
import com.ibm.research.sidecar.runtime.ActorRuntime;

/**
 * Creates the process wide {@link ActorRuntime} and registers the actor
 * classes listed in the <code>actors.classes</code> property.
 */
@ApplicationScoped
public class ActorRuntimeProducer {

	private final static String LOG_PREFIX = "ActorRuntimeProducer.";
	private final static Logger logger = Logger.getLogger(ActorRuntimeProducer.class.getName());

	public static final String ACTOR_CLASSES = "actors.classes";

	@Produces
	@Singleton
	public ActorRuntime actorRuntime() {
		ActorRuntime runtime = new ActorRuntime();
		String classes = ConfigProvider.getConfig().getOptionalValue(ACTOR_CLASSES, String.class).orElse("");
		registerActors(runtime, classes, Thread.currentThread().getContextClassLoader());
		return runtime;
	}

	/**
	 * Register every class of a comma separated list of class names.
	 *
	 * @throws ActorRegistrationException if a class cannot be loaded or is not an actor
	 */
	static void registerActors(ActorRuntime runtime, String classList, ClassLoader loader) {
		for (String className : classList.split("\\s*,\\s*")) {
			if (className.isBlank()) {
				continue;
			}
			Class<?> cls;
			try {
				cls = Class.forName(className.trim(), true, loader);
			} catch (ClassNotFoundException e) {
				throw new ActorRegistrationException("Actor class " + className + " not found", e);
			}
			if (!ActorInstance.class.isAssignableFrom(cls)) {
				throw new ActorRegistrationException(className + " does not implement " + ActorInstance.class.getName());
			}
			String type = runtime.registerActor(cls.asSubclass(ActorInstance.class));
			logger.info(LOG_PREFIX + "registerActors: " + className + " hosts actor type " + type);
		}
	}
}
