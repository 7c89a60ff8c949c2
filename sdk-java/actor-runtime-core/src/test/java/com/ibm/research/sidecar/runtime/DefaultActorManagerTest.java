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
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;

import com.ibm.research.sidecar.actor.ActorId;
import com.ibm.research.sidecar.actor.ActorInstance;
import com.ibm.research.sidecar.actor.exceptions.ActorException;
import com.ibm.research.sidecar.actor.exceptions.ActorMethodInvocationException;
import com.ibm.research.sidecar.actor.exceptions.ActorMethodNotFoundException;
import com.ibm.research.sidecar.actor.exceptions.ActorNotActivatedException;
import com.ibm.research.sidecar.actor.exceptions.ActorTimerNotFoundException;
import com.ibm.research.sidecar.actor.exceptions.SerializationException;
import com.ibm.research.sidecar.client.RecordingSidecarClient;
import com.ibm.research.sidecar.serializers.DefaultJsonSerializer;

public class DefaultActorManagerTest {

	private final RecordingSidecarClient client = new RecordingSidecarClient();

	private DefaultActorManager managerFor(Class<?> cls) {
		ActorRuntimeContext context = new ActorRuntimeContext(ActorTypeInformation.create(cls),
				new DefaultJsonSerializer(), new DefaultJsonSerializer(), client);
		return new DefaultActorManager(context);
	}

	private static byte[] utf8(String s) {
		return s.getBytes(StandardCharsets.UTF_8);
	}

	private static String string(byte[] b) {
		return new String(b, StandardCharsets.UTF_8);
	}

	@Test
	public void testActivateIsIdempotent() {
		DefaultActorManager manager = managerFor(Counter.class);
		ActorId id = new ActorId("c1");
		manager.activateActor(id);
		ActorInstance first = manager.getActiveActor(id);
		manager.activateActor(id);

		assertSame(first, manager.getActiveActor(id));
		assertEquals(1, ((Counter) first).activations);
		assertEquals("Counter", first.getType());
		assertEquals(id, first.getId());
		assertSame(manager.getContext(), first.getContext());
	}

	@Test
	public void testConcurrentActivationRunsHookOnce() throws Exception {
		TestActors.SlowActivation.activations.set(0);
		DefaultActorManager manager = managerFor(TestActors.SlowActivation.class);
		ActorId id = new ActorId("x");
		int threads = 8;
		ExecutorService pool = Executors.newFixedThreadPool(threads);
		CountDownLatch start = new CountDownLatch(1);
		List<Future<?>> results = new ArrayList<>();
		try {
			for (int i = 0; i < threads; i++) {
				boolean viaDispatch = i % 2 == 0;
				results.add(pool.submit(() -> {
					start.await();
					if (viaDispatch) {
						manager.dispatch(id, "activations", null);
					} else {
						manager.activateActor(id);
					}
					return null;
				}));
			}
			start.countDown();
			for (Future<?> f : results) {
				f.get(10, TimeUnit.SECONDS);
			}
		} finally {
			pool.shutdownNow();
		}

		assertEquals(1, TestActors.SlowActivation.activations.get());
		assertTrue(manager.isActive(id));
	}

	@Test
	public void testDeactivate() {
		DefaultActorManager manager = managerFor(Counter.class);
		ActorId id = new ActorId("c1");
		manager.activateActor(id);
		Counter counter = (Counter) manager.getActiveActor(id);
		manager.deactivateActor(id);

		assertFalse(manager.isActive(id));
		assertEquals(1, counter.deactivations);
		assertThrows(ActorNotActivatedException.class, () -> manager.deactivateActor(id));
	}

	@Test
	public void testFailedActivationDoesNotPublishInstance() {
		DefaultActorManager manager = managerFor(TestActors.FailingActivation.class);
		ActorId id = new ActorId("f");
		ActorMethodInvocationException e = assertThrows(ActorMethodInvocationException.class,
				() -> manager.activateActor(id));
		assertInstanceOf(IllegalStateException.class, e.getCause());
		assertFalse(manager.isActive(id));
	}

	@Test
	public void testDispatchActivatesAndEncodes() {
		DefaultActorManager manager = managerFor(Counter.class);
		ActorId id = new ActorId("c1");

		assertEquals("3", string(manager.dispatch(id, "increment", utf8("3"))));
		assertTrue(manager.isActive(id));
		assertEquals(1, ((Counter) manager.getActiveActor(id)).activations);
		assertEquals("4", string(manager.dispatch(id, "increment", new byte[0])));
		assertEquals("4", string(manager.dispatch(id, "get", utf8("ignored"))));
		assertEquals("\"hello bob\"", string(manager.dispatch(id, "say", utf8("\"bob\""))));
	}

	@Test
	public void testVoidAndNullResultsAreEmpty() {
		DefaultActorManager manager = managerFor(Counter.class);
		ActorId id = new ActorId("c1");
		manager.dispatch(id, "increment", utf8("2"));

		assertArrayEquals(new byte[0], manager.dispatch(id, "reset", null));
		assertEquals(0, ((Counter) manager.getActiveActor(id)).count);
		assertArrayEquals(new byte[0], manager.dispatch(id, "nothing", null));
	}

	@Test
	public void testAsynchronousResultsAreAwaited() {
		DefaultActorManager manager = managerFor(Counter.class);
		ActorId id = new ActorId("c1");
		manager.dispatch(id, "increment", utf8("7"));

		assertEquals("7", string(manager.dispatch(id, "later", null)));
		assertEquals("\"done\"", string(manager.dispatch(id, "future", null)));
		ActorMethodInvocationException e = assertThrows(ActorMethodInvocationException.class,
				() -> manager.dispatch(id, "failedFuture", null));
		assertInstanceOf(IllegalArgumentException.class, e.getCause());
	}

	@Test
	public void testUnknownMethod() {
		DefaultActorManager manager = managerFor(Counter.class);
		ActorId id = new ActorId("c1");
		ActorMethodNotFoundException e = assertThrows(ActorMethodNotFoundException.class,
				() -> manager.dispatch(id, "missing", null));
		assertEquals("Method not found: Counter.missing", e.getMessage());
		assertThrows(ActorMethodNotFoundException.class, () -> manager.dispatch(id, "notRemote", null));
		assertThrows(ActorMethodNotFoundException.class, () -> manager.dispatch(id, "greet", null));
		assertFalse(manager.isActive(id));
	}

	@Test
	public void testUserFailureIsWrapped() {
		DefaultActorManager manager = managerFor(Counter.class);
		ActorMethodInvocationException e = assertThrows(ActorMethodInvocationException.class,
				() -> manager.dispatch(new ActorId("c1"), "fail", null));
		assertInstanceOf(IllegalStateException.class, e.getCause());
		assertEquals("boom", e.getCause().getMessage());
	}

	@Test
	public void testMalformedArgument() {
		DefaultActorManager manager = managerFor(Counter.class);
		assertThrows(SerializationException.class, () -> manager.dispatch(new ActorId("c1"), "increment", utf8("{oops")));
	}

	@Test
	public void testFireReminder() {
		DefaultActorManager manager = managerFor(Counter.class);
		ActorId id = new ActorId("c1");
		manager.fireReminder(id, "wake", utf8("{\"data\":\"aGk=\",\"dueTime\":\"0h0m1s\",\"period\":\"0h1m0s\"}"));

		Counter counter = (Counter) manager.getActiveActor(id);
		assertEquals(List.of("wake"), counter.reminders);
		assertEquals("hi", string(counter.lastReminderState));
		assertEquals(Duration.ofMinutes(1), counter.lastReminderPeriod);

		manager.fireReminder(id, "bare", new byte[0]);
		assertEquals(List.of("wake", "bare"), counter.reminders);
		assertArrayEquals(new byte[0], counter.lastReminderState);
		assertNull(counter.lastReminderPeriod);
	}

	@Test
	public void testFireReminderFailures() {
		DefaultActorManager manager = managerFor(Counter.class);
		ActorId id = new ActorId("c1");
		assertThrows(ActorMethodInvocationException.class, () -> manager.fireReminder(id, "explode", null));
		assertThrows(SerializationException.class, () -> manager.fireReminder(id, "r", utf8("{\"data\":5}")));

		DefaultActorManager plain = managerFor(TestActors.Plain.class);
		ActorException e = assertThrows(ActorException.class, () -> plain.fireReminder(id, "r", null));
		assertEquals("Plain does not implement Remindable", e.getMessage());
	}

	@Test
	public void testFireTimer() {
		DefaultActorManager manager = managerFor(TestActors.Timed.class);
		ActorId id = new ActorId("t1");
		manager.dispatch(id, "start", null);

		String body = client.body("timer+ Timed/t1/tick");
		assertTrue(body.contains("\"callback\":\"tick\""), body);
		assertTrue(body.contains("\"dueTime\":\"0h0m1s\""), body);

		manager.fireTimer(id, "tick");
		manager.fireTimer(id, "tick");
		assertEquals(4, ((TestActors.Timed) manager.getActiveActor(id)).ticks);
		assertThrows(ActorTimerNotFoundException.class, () -> manager.fireTimer(id, "tock"));
	}

	@Test
	public void testFireTimerWithoutSkeleton() {
		DefaultActorManager manager = managerFor(TestActors.Bare.class);
		assertThrows(ActorTimerNotFoundException.class, () -> manager.fireTimer(new ActorId("b"), "tick"));
	}
}
