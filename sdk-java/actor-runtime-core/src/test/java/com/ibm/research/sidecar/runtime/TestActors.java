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

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import com.ibm.research.sidecar.actor.ActorId;
import com.ibm.research.sidecar.actor.ActorInstance;
import com.ibm.research.sidecar.actor.ActorSkeleton;
import com.ibm.research.sidecar.actor.annotations.Activate;
import com.ibm.research.sidecar.actor.annotations.Deactivate;
import com.ibm.research.sidecar.actor.annotations.Remote;

/**
 * Actor classes used to exercise registration and dispatch.
 */
public final class TestActors {

	private TestActors() {
	}

	public interface Greeter {
		String greet(String name);
	}

	public interface PoliteGreeter extends Greeter {
	}

	// type name defaults to the simple class name
	public static class Plain extends ActorSkeleton implements PoliteGreeter {
		@Remote
		public String greet(String name) {
			return name;
		}
	}

	public static class Echo extends ActorSkeleton {
		@Remote
		public Object echo(Object value) {
			return value;
		}
	}

	public static class FailingActivation extends ActorSkeleton {
		@Activate
		public void activate() {
			throw new IllegalStateException("cannot activate");
		}
	}

	public static class SlowActivation extends ActorSkeleton {
		public static final AtomicInteger activations = new AtomicInteger();

		@Activate
		public void activate() throws InterruptedException {
			activations.incrementAndGet();
			Thread.sleep(100);
		}

		@Remote
		public int activations() {
			return activations.get();
		}
	}

	public static class Timed extends ActorSkeleton {
		public int ticks;

		@Remote
		public void start() {
			registerTimer("tick", (Integer step) -> ticks += step, 2, Duration.ofSeconds(1), null)
					.await().indefinitely();
		}
	}

	public static class Overloaded extends ActorSkeleton {
		@Remote
		public void op(String s) {
		}

		@Remote("op")
		public void other() {
		}
	}

	public static class TwoParameters extends ActorSkeleton {
		@Remote
		public void op(String a, String b) {
		}
	}

	public static class TwoActivates extends ActorSkeleton {
		@Activate
		public void a() {
		}

		@Activate
		public void b() {
		}
	}

	public static class HookWithParameter extends ActorSkeleton {
		@Deactivate
		public void d(String reason) {
		}
	}

	public static class NoDefaultConstructor extends ActorSkeleton {
		public NoDefaultConstructor(String ignored) {
		}
	}

	public static abstract class AbstractActor extends ActorSkeleton {
	}

	public static class NotAnActor {
	}

	// an actor without the skeleton base class
	public static class Bare implements ActorInstance {
		private ActorRuntimeContext context;
		private ActorId id;

		@Override
		public String getType() {
			return "Bare";
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
			this.context = context;
			this.id = id;
		}
	}
}
