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
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.ibm.research.sidecar.actor.ActorId;
import com.ibm.research.sidecar.actor.ActorInstance;
import com.ibm.research.sidecar.actor.ActorReminderData;
import com.ibm.research.sidecar.actor.ActorSkeleton;
import com.ibm.research.sidecar.actor.Remindable;
import com.ibm.research.sidecar.actor.exceptions.ActorException;
import com.ibm.research.sidecar.actor.exceptions.ActorMethodInvocationException;
import com.ibm.research.sidecar.actor.exceptions.ActorMethodNotFoundException;
import com.ibm.research.sidecar.actor.exceptions.ActorNotActivatedException;
import com.ibm.research.sidecar.actor.exceptions.ActorTimerNotFoundException;
import com.ibm.research.sidecar.actor.exceptions.SerializationException;

import io.smallrye.mutiny.Uni;

/**
 * The ActorManager used for actor classes implementing {@link ActorInstance}.
 * Active instances live in memory until they are deactivated.
 */
public class DefaultActorManager implements ActorManager {

	private final static String LOG_PREFIX = "DefaultActorManager.";
	private final static Logger logger = Logger.getLogger(DefaultActorManager.class.getName());

	private static final byte[] EMPTY = new byte[0];

	private static final int LOCK_STRIPES = 64;

	private final ActorRuntimeContext context;

	private final Map<ActorId, ActorInstance> activeActors = new ConcurrentHashMap<ActorId, ActorInstance>();

	// activation and deactivation of one id are serialized on its stripe
	private final ReentrantLock[] activationLocks = new ReentrantLock[LOCK_STRIPES];

	public DefaultActorManager(ActorRuntimeContext context) {
		this.context = context;
		for (int i = 0; i < LOCK_STRIPES; i++) {
			activationLocks[i] = new ReentrantLock();
		}
	}

	public ActorRuntimeContext getContext() {
		return context;
	}

	public boolean isActive(ActorId actorId) {
		return activeActors.containsKey(actorId);
	}

	/**
	 * @return the in-memory instance, or null if the actor is not active
	 */
	public ActorInstance getActiveActor(ActorId actorId) {
		return activeActors.get(actorId);
	}

	@Override
	public void activateActor(ActorId actorId) {
		activateIfAbsent(actorId);
	}

	@Override
	public void deactivateActor(ActorId actorId) {
		ActorInstance actor;
		ReentrantLock lock = lockFor(actorId);
		lock.lock();
		try {
			actor = activeActors.remove(actorId);
		} finally {
			lock.unlock();
		}
		if (actor == null) {
			throw new ActorNotActivatedException(describe(actorId) + " is not active");
		}
		MethodHandle deactivate = context.getTypeInfo().getDeactivateMethod();
		if (deactivate != null) {
			invoke(deactivate, actor, "deactivate");
		}
		logger.fine(LOG_PREFIX + "deactivateActor: deactivated " + describe(actorId));
	}

	@Override
	public byte[] dispatch(ActorId actorId, String methodName, byte[] requestBody) {
		RemoteMethod method = context.getTypeInfo().getRemoteMethods().get(methodName);
		if (method == null) {
			throw new ActorMethodNotFoundException("Method not found: " + context.getTypeInfo().getTypeName() + "." + methodName);
		}
		ActorInstance actor = activateIfAbsent(actorId);

		Object result;
		if (method.getParameterType() == null) {
			result = invoke(method.getHandle(), actor, methodName);
		} else {
			Object arg = context.getMessageSerializer().deserialize(requestBody, method.getParameterType());
			result = invoke(method.getHandle(), actor, methodName, arg);
		}
		result = await(result, methodName);

		if (method.returnsVoid() || result == null) {
			return EMPTY;
		}
		return context.getMessageSerializer().serialize(result);
	}

	@Override
	public void fireReminder(ActorId actorId, String reminderName, byte[] requestBody) {
		if (!context.getTypeInfo().isRemindable()) {
			throw new ActorException(context.getTypeInfo().getTypeName() + " does not implement Remindable");
		}
		ActorInstance actor = activateIfAbsent(actorId);
		ActorReminderData data;
		try {
			data = ActorReminderData.fromMap(reminderName, context.getMessageSerializer().deserialize(requestBody, Map.class));
		} catch (IllegalArgumentException e) {
			throw new SerializationException("Invalid reminder payload for " + reminderName, e);
		}
		try {
			((Remindable) actor).receiveReminder(reminderName, data.getState(), data.getDueTime(), data.getPeriod());
		} catch (RuntimeException e) {
			throw new ActorMethodInvocationException("Reminder " + reminderName + " failed on " + describe(actorId), e);
		}
	}

	@Override
	public void fireTimer(ActorId actorId, String timerName) {
		ActorInstance actor = activateIfAbsent(actorId);
		if (!(actor instanceof ActorSkeleton) || ((ActorSkeleton) actor).getTimer(timerName) == null) {
			throw new ActorTimerNotFoundException("Timer " + timerName + " not found on " + describe(actorId));
		}
		try {
			((ActorSkeleton) actor).fireTimer(timerName);
		} catch (RuntimeException e) {
			throw new ActorMethodInvocationException("Timer " + timerName + " failed on " + describe(actorId), e);
		}
	}

	private ActorInstance activateIfAbsent(ActorId actorId) {
		ActorInstance actor = activeActors.get(actorId);
		if (actor != null) {
			return actor;
		}
		ReentrantLock lock = lockFor(actorId);
		lock.lock();
		try {
			actor = activeActors.get(actorId);
			if (actor != null) {
				return actor;
			}
			actor = context.createActor(actorId);
			MethodHandle activate = context.getTypeInfo().getActivateMethod();
			if (activate != null) {
				invoke(activate, actor, "activate");
			}
			activeActors.put(actorId, actor);
		} finally {
			lock.unlock();
		}
		logger.fine(LOG_PREFIX + "activateIfAbsent: activated " + describe(actorId));
		return actor;
	}

	private ReentrantLock lockFor(ActorId actorId) {
		return activationLocks[Math.floorMod(actorId.hashCode(), LOCK_STRIPES)];
	}

	private Object invoke(MethodHandle handle, ActorInstance actor, String what, Object... args) {
		Object[] actuals = new Object[args.length + 1];
		actuals[0] = actor;
		System.arraycopy(args, 0, actuals, 1, args.length);
		try {
			return handle.invokeWithArguments(actuals);
		} catch (Error e) {
			throw e;
		} catch (Throwable t) {
			logger.log(Level.FINE, LOG_PREFIX + "invoke: " + what + " failed on " + describe(actor.getId()), t);
			throw new ActorMethodInvocationException(describe(actor.getId()) + "." + what + " raised " + t, t);
		}
	}

	private Object await(Object result, String what) {
		try {
			if (result instanceof Uni) {
				return ((Uni<?>) result).await().indefinitely();
			} else if (result instanceof CompletionStage) {
				return ((CompletionStage<?>) result).toCompletableFuture().join();
			}
			return result;
		} catch (CompletionException e) {
			Throwable cause = e.getCause() != null ? e.getCause() : e;
			throw new ActorMethodInvocationException(what + " raised " + cause, cause);
		} catch (RuntimeException e) {
			throw new ActorMethodInvocationException(what + " raised " + e, e);
		}
	}

	private String describe(ActorId actorId) {
		return context.getTypeInfo().getTypeName() + "[" + actorId + "]";
	}
}
