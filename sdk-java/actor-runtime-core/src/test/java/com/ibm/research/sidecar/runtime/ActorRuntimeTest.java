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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.ibm.research.sidecar.actor.ActorId;
import com.ibm.research.sidecar.actor.ActorInstance;
import com.ibm.research.sidecar.actor.exceptions.ActorException;
import com.ibm.research.sidecar.actor.exceptions.ActorRegistrationException;
import com.ibm.research.sidecar.actor.exceptions.ActorTypeNotFoundException;
import com.ibm.research.sidecar.client.RecordingSidecarClient;
import com.ibm.research.sidecar.serializers.DefaultJsonSerializer;

public class ActorRuntimeTest {

	private final Map<String, RecordingActorManager> managers = new ConcurrentHashMap<>();
	private ActorRuntime runtime;

	@BeforeEach
	public void setUp() {
		runtime = new ActorRuntime(new ActorRuntimeConfig(), RecordingSidecarClient::new, context -> {
			RecordingActorManager m = new RecordingActorManager(context);
			managers.put(context.getTypeInfo().getTypeName(), m);
			return m;
		});
	}

	@Test
	public void testRegisterDistinctTypes() {
		assertEquals("Counter", runtime.registerActor(Counter.class));
		assertEquals("Plain", runtime.registerActor(TestActors.Plain.class));
		assertEquals("Echo", runtime.registerActor(TestActors.Echo.class));

		assertEquals(List.of("Counter", "Plain", "Echo"), runtime.getRegisteredActorTypes());
		assertEquals(runtime.getRegisteredActorTypes(), runtime.getActorConfig().getEntities());
	}

	@Test
	public void testReRegistrationReplacesManager() {
		runtime.registerActor(Counter.class);
		ActorManager first = runtime.getActorManager("Counter").get();
		runtime.registerActor(Counter.class);
		ActorManager second = runtime.getActorManager("Counter").get();

		assertNotSame(first, second);
		assertSame(managers.get("Counter"), second);
		assertEquals(List.of("Counter"), runtime.getRegisteredActorTypes());
		assertEquals(List.of("Counter"), runtime.getActorConfig().getEntities());
	}

	@Test
	public void testRegisteredTypesIsASnapshot() {
		runtime.registerActor(Counter.class);
		List<String> types = runtime.getRegisteredActorTypes();
		runtime.registerActor(TestActors.Echo.class);
		assertEquals(List.of("Counter"), types);
	}

	@Test
	public void testDefaultSerializers() {
		runtime.registerActor(Counter.class);
		ActorRuntimeContext context = managers.get("Counter").context;
		assertSame(ActorRuntime.DEFAULT_SERIALIZER, context.getMessageSerializer());
		assertSame(ActorRuntime.DEFAULT_SERIALIZER, context.getStateSerializer());

		DefaultJsonSerializer custom = new DefaultJsonSerializer();
		runtime.registerActor(Counter.class, custom, null);
		context = managers.get("Counter").context;
		assertSame(custom, context.getMessageSerializer());
		assertSame(ActorRuntime.DEFAULT_SERIALIZER, context.getStateSerializer());
	}

	@Test
	public void testSetActorConfigSyncsEntities() {
		runtime.registerActor(Counter.class);
		runtime.registerActor(TestActors.Plain.class);

		ActorRuntimeConfig replacement = new ActorRuntimeConfig();
		replacement.updateEntities(List.of("Stale"));
		runtime.setActorConfig(replacement);

		assertSame(replacement, runtime.getActorConfig());
		assertEquals(List.of("Counter", "Plain"), replacement.getEntities());

		runtime.registerActor(TestActors.Echo.class);
		assertEquals(List.of("Counter", "Plain", "Echo"), replacement.getEntities());
	}

	@Test
	public void testSetActorConfigRejectsNull() {
		assertThrows(NullPointerException.class, () -> runtime.setActorConfig(null));
	}

	@Test
	public void testUnknownTypeIsRejected() {
		runtime.registerActor(Counter.class);
		assertFalse(runtime.getActorManager("Unknown").isPresent());
		assertThrows(ActorTypeNotFoundException.class, () -> runtime.dispatch("Unknown", "1", "m", new byte[0]));
		assertThrows(ActorTypeNotFoundException.class, () -> runtime.activate("Unknown", "1"));
		assertThrows(ActorTypeNotFoundException.class, () -> runtime.deactivate("Unknown", "1"));
		assertThrows(ActorTypeNotFoundException.class, () -> runtime.fireReminder("Unknown", "1", "r", new byte[0]));
		assertThrows(ActorTypeNotFoundException.class, () -> runtime.fireTimer("Unknown", "1", "t"));
	}

	@Test
	public void testDispatchIsPayloadTransparent() {
		runtime.registerActor(TestActors.Echo.class);
		byte[] body = { 0, (byte) 0xff, 42, '{' };
		byte[] result = runtime.dispatch("Echo", "e1", "anything", body);
		assertSame(body, result);
		assertArrayEquals(new byte[] { 0, (byte) 0xff, 42, '{' }, result);
	}

	@Test
	public void testRequestsAreForwardedWithExactId() {
		runtime.registerActor(Counter.class);
		RecordingActorManager m = managers.get("Counter");

		runtime.activate("Counter", "a b");
		runtime.dispatch("Counter", "a b", "increment", new byte[0]);
		runtime.fireReminder("Counter", "a b", "r1", new byte[0]);
		runtime.fireTimer("Counter", "a b", "t1");
		runtime.deactivate("Counter", "a b");

		assertEquals(List.of("activate", "dispatch increment", "reminder r1", "timer t1", "deactivate"), m.calls);
		for (ActorId id : m.ids) {
			assertEquals(new ActorId("a b"), id);
			assertEquals("a b", id.getId());
		}
	}

	@Test
	public void testManagerFailurePropagatesUnchanged() {
		runtime.registerActor(Counter.class);
		ActorException failure = new ActorException("handler failed");
		managers.get("Counter").failure = failure;

		assertSame(failure, assertThrows(ActorException.class, () -> runtime.activate("Counter", "1")));
		assertSame(failure, assertThrows(ActorException.class, () -> runtime.dispatch("Counter", "1", "get", null)));
		IllegalStateException other = new IllegalStateException("unexpected");
		managers.get("Counter").failure = other;
		assertSame(other, assertThrows(IllegalStateException.class, () -> runtime.fireTimer("Counter", "1", "t")));
	}

	@Test
	public void testEmptyActorIdIsRejected() {
		runtime.registerActor(Counter.class);
		assertThrows(IllegalArgumentException.class, () -> runtime.activate("Counter", ""));
		assertTrue(managers.get("Counter").calls.isEmpty());
	}

	@Test
	@SuppressWarnings("unchecked")
	public void testInvalidActorClassLeavesStateUnchanged() {
		runtime.registerActor(Counter.class);
		assertThrows(ActorRegistrationException.class, () -> runtime.registerActor(TestActors.Overloaded.class));
		Class<? extends ActorInstance> notAnActor = (Class<? extends ActorInstance>) (Class<?>) TestActors.NotAnActor.class;
		assertThrows(ActorRegistrationException.class, () -> runtime.registerActor(notAnActor));

		assertEquals(List.of("Counter"), runtime.getRegisteredActorTypes());
		assertEquals(List.of("Counter"), runtime.getActorConfig().getEntities());
	}

	@Test
	public void testFailingFactoriesLeaveStateUnchanged() {
		IllegalStateException clientFailure = new IllegalStateException("no sidecar");
		ActorRuntime broken = new ActorRuntime(new ActorRuntimeConfig(), () -> {
			throw clientFailure;
		}, RecordingActorManager::new);
		assertSame(clientFailure, assertThrows(IllegalStateException.class, () -> broken.registerActor(Counter.class)));
		assertTrue(broken.getRegisteredActorTypes().isEmpty());
		assertTrue(broken.getActorConfig().getEntities().isEmpty());

		ActorException managerFailure = new ActorException("no manager");
		ActorRuntime broken2 = new ActorRuntime(new ActorRuntimeConfig(), RecordingSidecarClient::new, context -> {
			throw managerFailure;
		});
		assertSame(managerFailure, assertThrows(ActorException.class, () -> broken2.registerActor(Counter.class)));
		assertTrue(broken2.getRegisteredActorTypes().isEmpty());
	}

	@Test
	public void testConcurrentRegistrations() throws Exception {
		List<Class<? extends ActorInstance>> classes = List.of(Counter.class, TestActors.Plain.class,
				TestActors.Echo.class, TestActors.Timed.class, TestActors.Bare.class, TestActors.FailingActivation.class);
		int rounds = 8;
		ExecutorService pool = Executors.newFixedThreadPool(classes.size() * 2);
		CountDownLatch start = new CountDownLatch(1);
		List<Future<String>> results = new ArrayList<>();
		try {
			for (int i = 0; i < rounds; i++) {
				for (Class<? extends ActorInstance> cls : classes) {
					results.add(pool.submit(() -> {
						start.await();
						return runtime.registerActor(cls);
					}));
				}
			}
			start.countDown();
			for (Future<String> f : results) {
				f.get(10, TimeUnit.SECONDS);
			}
		} finally {
			pool.shutdownNow();
		}

		List<String> types = runtime.getRegisteredActorTypes();
		assertEquals(classes.size(), types.size());
		assertEquals(Set.of("Counter", "Plain", "Echo", "Timed", "Bare", "FailingActivation"), new HashSet<>(types));
		assertEquals(types, runtime.getActorConfig().getEntities());
		for (String type : types) {
			assertTrue(runtime.getActorManager(type).isPresent());
		}
	}

	@Test
	public void testLookupRacingRegistrationSeesAbsentOrComplete() throws Exception {
		int readers = 4;
		ExecutorService pool = Executors.newFixedThreadPool(readers + 1);
		CountDownLatch start = new CountDownLatch(1);
		List<Future<Integer>> observations = new ArrayList<>();
		try {
			for (int i = 0; i < readers; i++) {
				observations.add(pool.submit(() -> {
					start.await();
					int misses = 0;
					while (true) {
						Optional<ActorManager> manager = runtime.getActorManager("Counter");
						if (manager.isEmpty()) {
							misses++;
							Thread.onSpinWait();
							continue;
						}
						RecordingActorManager m = (RecordingActorManager) manager.get();
						assertEquals("Counter", m.context.getTypeInfo().getTypeName());
						assertNotNull(m.context.getSidecarClient());
						assertSame(ActorRuntime.DEFAULT_SERIALIZER, m.context.getMessageSerializer());
						return misses;
					}
				}));
			}
			Future<String> registration = pool.submit(() -> {
				start.await();
				return runtime.registerActor(Counter.class);
			});
			start.countDown();
			assertEquals("Counter", registration.get(10, TimeUnit.SECONDS));
			for (Future<Integer> f : observations) {
				f.get(10, TimeUnit.SECONDS);
			}
		} finally {
			pool.shutdownNow();
		}
		assertEquals(List.of("Counter"), runtime.getActorConfig().getEntities());
	}

	@Test
	public void testCounterScenario() {
		ActorRuntime live = new ActorRuntime(new ActorRuntimeConfig(), RecordingSidecarClient::new,
				DefaultActorManager::new);
		live.registerActor(Counter.class);

		live.activate("Counter", "c1");
		byte[] result = live.dispatch("Counter", "c1", "increment", "5".getBytes(StandardCharsets.UTF_8));
		assertEquals("5", new String(result, StandardCharsets.UTF_8));
		result = live.dispatch("Counter", "c1", "increment", new byte[0]);
		assertEquals("6", new String(result, StandardCharsets.UTF_8));
		live.deactivate("Counter", "c1");

		assertThrows(ActorTypeNotFoundException.class,
				() -> live.dispatch("Unknown", "c1", "increment", new byte[0]));
		assertEquals(List.of("Counter"), live.getActorConfig().getEntities());
	}
}
