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
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

import com.ibm.research.sidecar.actor.ActorInstance;
import com.ibm.research.sidecar.actor.Remindable;
import com.ibm.research.sidecar.actor.annotations.Activate;
import com.ibm.research.sidecar.actor.annotations.Actor;
import com.ibm.research.sidecar.actor.annotations.Deactivate;
import com.ibm.research.sidecar.actor.annotations.Remote;
import com.ibm.research.sidecar.actor.exceptions.ActorRegistrationException;

/**
 * An ActorTypeInformation instance contains the Class and MethodHandle objects
 * that are used to create actor instances and invoke actor methods.
 */
public final class ActorTypeInformation {

	private final static String LOG_PREFIX = "ActorTypeInformation.";
	private final static Logger logger = Logger.getLogger(ActorTypeInformation.class.getName());

	// actor type name
	private final String typeName;

	// java.lang.Class for the Actor
	private final Class<? extends ActorInstance> implementationClass;

	// application interfaces implemented by the Actor
	private final List<Class<?>> actorInterfaces;

	// public no-arg constructor
	private final MethodHandle constructor;

	// Lookup for callable remote methods
	private final Map<String, RemoteMethod> remoteMethods;

	// Lookup for init method
	private final MethodHandle activateMethod;

	// Lookup for deinit method
	private final MethodHandle deactivateMethod;

	private final boolean remindable;

	private ActorTypeInformation(String typeName, Class<? extends ActorInstance> cls, List<Class<?>> interfaces,
			MethodHandle constructor, Map<String, RemoteMethod> methods, MethodHandle activate, MethodHandle deactivate) {
		this.typeName = typeName;
		this.implementationClass = cls;
		this.actorInterfaces = Collections.unmodifiableList(interfaces);
		this.constructor = constructor;
		this.remoteMethods = Collections.unmodifiableMap(methods);
		this.activateMethod = activate;
		this.deactivateMethod = deactivate;
		this.remindable = Remindable.class.isAssignableFrom(cls);
	}

	/**
	 * Build the type information for an actor implementation class.
	 *
	 * @param cls the actor class
	 * @return the type information
	 * @throws ActorRegistrationException if cls is not a valid actor class
	 */
	public static ActorTypeInformation create(Class<?> cls) {
		if (!ActorInstance.class.isAssignableFrom(cls)) {
			throw new ActorRegistrationException(cls.getName() + " does not implement " + ActorInstance.class.getName());
		}
		if (cls.isInterface() || Modifier.isAbstract(cls.getModifiers())) {
			throw new ActorRegistrationException(cls.getName() + " is abstract");
		}
		@SuppressWarnings("unchecked") // can never fail because of the check above
		Class<? extends ActorInstance> actorClass = (Class<? extends ActorInstance>) cls;

		Actor annotation = cls.getAnnotation(Actor.class);
		String typeName = annotation != null && !annotation.type().isBlank() ? annotation.type() : cls.getSimpleName();

		MethodHandles.Lookup lookup = MethodHandles.lookup();
		MethodHandle constructor;
		try {
			constructor = lookup.findConstructor(cls, MethodType.methodType(void.class));
		} catch (NoSuchMethodException | IllegalAccessException e) {
			throw new ActorRegistrationException(cls.getName() + " does not have a public no-argument constructor", e);
		}

		Map<String, RemoteMethod> remoteMethods = new HashMap<String, RemoteMethod>();
		MethodHandle activateMethod = null;
		MethodHandle deactivateMethod = null;

		for (Method method : cls.getMethods()) {
			if (method.isAnnotationPresent(Remote.class)) {
				String name = method.getAnnotation(Remote.class).value();
				if (name.isBlank()) {
					name = method.getName();
				}
				if (Modifier.isStatic(method.getModifiers())) {
					throw new ActorRegistrationException("Remote method " + method + " must not be static");
				}
				if (method.getParameterCount() > 1) {
					throw new ActorRegistrationException("Remote method " + method + " declares more than one parameter");
				}
				if (remoteMethods.containsKey(name)) {
					throw new ActorRegistrationException("Unsupported overload of " + name + " in " + cls.getName());
				}
				Class<?> parameterType = method.getParameterCount() == 1 ? box(method.getParameterTypes()[0]) : null;
				boolean returnsVoid = method.getReturnType().equals(Void.TYPE);
				remoteMethods.put(name, new RemoteMethod(name, unreflect(lookup, method), parameterType, returnsVoid));
				logger.fine(LOG_PREFIX + "create: adding " + name + " to remote methods for " + cls.getName());
			} else if (method.isAnnotationPresent(Activate.class)) {
				if (activateMethod != null) {
					throw new ActorRegistrationException(cls.getName() + " declares more than one @Activate method");
				}
				activateMethod = unreflectHook(lookup, method);
			} else if (method.isAnnotationPresent(Deactivate.class)) {
				if (deactivateMethod != null) {
					throw new ActorRegistrationException(cls.getName() + " declares more than one @Deactivate method");
				}
				deactivateMethod = unreflectHook(lookup, method);
			}
		}

		return new ActorTypeInformation(typeName, actorClass, collectInterfaces(cls), constructor, remoteMethods,
				activateMethod, deactivateMethod);
	}

	private static MethodHandle unreflectHook(MethodHandles.Lookup lookup, Method method) {
		if (method.getParameterCount() != 0 || Modifier.isStatic(method.getModifiers())) {
			throw new ActorRegistrationException("Lifecycle method " + method + " must be an instance method without parameters");
		}
		return unreflect(lookup, method);
	}

	private static MethodHandle unreflect(MethodHandles.Lookup lookup, Method method) {
		try {
			return lookup.unreflect(method);
		} catch (IllegalAccessException e) {
			throw new ActorRegistrationException("Cannot access " + method, e);
		}
	}

	private static List<Class<?>> collectInterfaces(Class<?> cls) {
		Set<Class<?>> result = new LinkedHashSet<>();
		for (Class<?> c = cls; c != null; c = c.getSuperclass()) {
			for (Class<?> i : c.getInterfaces()) {
				addInterface(i, result);
			}
		}
		return new ArrayList<>(result);
	}

	private static void addInterface(Class<?> iface, Set<Class<?>> result) {
		if (iface == ActorInstance.class || iface == Remindable.class) {
			return;
		}
		if (result.add(iface)) {
			for (Class<?> i : iface.getInterfaces()) {
				addInterface(i, result);
			}
		}
	}

	private static Class<?> box(Class<?> type) {
		return MethodType.methodType(type).wrap().returnType();
	}

	public String getTypeName() {
		return typeName;
	}

	public Class<? extends ActorInstance> getImplementationClass() {
		return implementationClass;
	}

	public List<Class<?>> getActorInterfaces() {
		return actorInterfaces;
	}

	public MethodHandle getConstructor() {
		return constructor;
	}

	public Map<String, RemoteMethod> getRemoteMethods() {
		return remoteMethods;
	}

	public MethodHandle getActivateMethod() {
		return activateMethod;
	}

	public MethodHandle getDeactivateMethod() {
		return deactivateMethod;
	}

	public boolean isRemindable() {
		return remindable;
	}
}
