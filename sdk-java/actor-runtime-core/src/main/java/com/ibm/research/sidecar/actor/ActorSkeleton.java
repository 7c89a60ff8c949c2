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

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

import javax.json.Json;
import javax.json.JsonException;
import javax.json.JsonReader;
import javax.json.JsonValue;

import com.ibm.research.sidecar.runtime.ActorRuntimeContext;
import com.ibm.research.sidecar.serializers.Serializer;

import io.smallrye.mutiny.Uni;

/**
 * Base class for actor implementations. Provides the {@link ActorInstance}
 * plumbing, the in-memory timers of the instance, and helpers for state,
 * timers and reminders that go through the sidecar.
 */
public abstract class ActorSkeleton implements ActorInstance {

	private ActorRuntimeContext context;
	private ActorId id;

	private final Map<String, ActorTimer> timers = new ConcurrentHashMap<String, ActorTimer>();

	@Override
	public String getType() {
		return context.getTypeInfo().getTypeName();
	}

	@Override
	public ActorId getId() {
		return id;
	}

	@Override
	public ActorRuntimeContext getContext() {
		return context;
	}

	@Override
	public void bind(ActorRuntimeContext context, ActorId id) {
		if (this.context != null) {
			throw new IllegalStateException(this + " is already bound");
		}
		this.context = context;
		this.id = id;
	}

	/**
	 * Register a timer that fires callback with state. The timer is recorded
	 * on this instance before the sidecar is asked to schedule it.
	 *
	 * @param period null for a one-shot timer
	 */
	public <T> Uni<Void> registerTimer(String name, Consumer<T> callback, T state, Duration dueTime, Duration period) {
		timers.put(name, new ActorTimer(name, () -> callback.accept(state), dueTime, period));
		Map<String, Object> body = new LinkedHashMap<>();
		body.put("dueTime", ActorDurations.format(dueTime));
		if (period != null) {
			body.put("period", ActorDurations.format(period));
		}
		body.put("callback", name);
		byte[] data = context.getMessageSerializer().serialize(body);
		return context.getSidecarClient().registerTimer(getType(), id.getId(), name, data)
				.onFailure().invoke(() -> timers.remove(name));
	}

	public Uni<Void> unregisterTimer(String name) {
		timers.remove(name);
		return context.getSidecarClient().unregisterTimer(getType(), id.getId(), name);
	}

	public ActorTimer getTimer(String name) {
		return timers.get(name);
	}

	/**
	 * Run the callback of a registered timer.
	 *
	 * @return false if no timer is registered under name
	 */
	public boolean fireTimer(String name) {
		ActorTimer timer = timers.get(name);
		if (timer == null) {
			return false;
		}
		timer.fire();
		return true;
	}

	/**
	 * Register a reminder. Reminders are persisted by the sidecar and delivered
	 * to {@link Remindable#receiveReminder}.
	 */
	public Uni<Void> registerReminder(String name, byte[] state, Duration dueTime, Duration period) {
		ActorReminderData reminder = new ActorReminderData(name, state, dueTime, period);
		byte[] data = context.getMessageSerializer().serialize(reminder.toMap());
		return context.getSidecarClient().registerReminder(getType(), id.getId(), name, data);
	}

	public Uni<Void> unregisterReminder(String name) {
		return context.getSidecarClient().unregisterReminder(getType(), id.getId(), name);
	}

	/**
	 * Read a state entry of this instance.
	 *
	 * @return a Uni of the decoded value, or of null if the key has no value
	 */
	public <T> Uni<T> getState(String key, Class<T> type) {
		Serializer serializer = context.getStateSerializer();
		return context.getSidecarClient().getState(getType(), id.getId(), key)
				.onItem().transform(bytes -> bytes == null || bytes.length == 0 ? null : serializer.deserialize(bytes, type));
	}

	public Uni<Void> setState(String key, Object value) {
		JsonValue encoded = toJsonValue(context.getStateSerializer().serialize(value));
		JsonValue op = Json.createObjectBuilder()
				.add("operation", "upsert")
				.add("request", Json.createObjectBuilder().add("key", key).add("value", encoded))
				.build();
		return saveState(op);
	}

	public Uni<Void> removeState(String key) {
		JsonValue op = Json.createObjectBuilder()
				.add("operation", "delete")
				.add("request", Json.createObjectBuilder().add("key", key))
				.build();
		return saveState(op);
	}

	private Uni<Void> saveState(JsonValue op) {
		byte[] body = Json.createArrayBuilder().add(op).build().toString().getBytes(StandardCharsets.UTF_8);
		return context.getSidecarClient().saveStateTransactionally(getType(), id.getId(), body);
	}

	// state serializers that do not produce JSON are stored as a JSON string
	private static JsonValue toJsonValue(byte[] bytes) {
		try (JsonReader reader = Json.createReader(new ByteArrayInputStream(bytes))) {
			return reader.readValue();
		} catch (JsonException e) {
			return Json.createValue(new String(bytes, StandardCharsets.UTF_8));
		}
	}

	@Override
	public String toString() {
		return (context == null ? getClass().getSimpleName() : getType()) + "[" + id + "]";
	}
}
