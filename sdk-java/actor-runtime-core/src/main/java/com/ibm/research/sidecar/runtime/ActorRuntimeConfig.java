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
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import javax.json.Json;
import javax.json.JsonArrayBuilder;
import javax.json.JsonObject;
import javax.json.JsonObjectBuilder;

import org.eclipse.microprofile.config.Config;

import com.ibm.research.sidecar.actor.ActorDurations;

/**
 * The settings the runtime advertises to the sidecar, including the list of
 * actor types hosted by this process.
 *
 * The entity list is maintained by {@link ActorRuntime}; after every
 * registration it names exactly the registered actor types.
 */
public class ActorRuntimeConfig {

	public static final String IDLE_TIMEOUT = "actors.idle-timeout";
	public static final String SCAN_INTERVAL = "actors.scan-interval";
	public static final String DRAIN_ONGOING_CALL_TIMEOUT = "actors.drain-ongoing-call-timeout";
	public static final String DRAIN_REBALANCED_ACTORS = "actors.drain-rebalanced-actors";
	public static final String REENTRANCY_ENABLED = "actors.reentrancy.enabled";
	public static final String REENTRANCY_MAX_STACK_DEPTH = "actors.reentrancy.max-stack-depth";
	public static final String REMINDERS_STORAGE_PARTITIONS = "actors.reminders-storage-partitions";

	public static final Duration DEFAULT_IDLE_TIMEOUT = Duration.ofHours(1);
	public static final Duration DEFAULT_SCAN_INTERVAL = Duration.ofSeconds(30);
	public static final Duration DEFAULT_DRAIN_ONGOING_CALL_TIMEOUT = Duration.ofMinutes(1);

	private volatile Duration actorIdleTimeout = DEFAULT_IDLE_TIMEOUT;
	private volatile Duration actorScanInterval = DEFAULT_SCAN_INTERVAL;
	private volatile Duration drainOngoingCallTimeout = DEFAULT_DRAIN_ONGOING_CALL_TIMEOUT;
	private volatile boolean drainRebalancedActors = true;
	private volatile ActorReentrancyConfig reentrancy;
	private volatile Integer remindersStoragePartitions;
	private volatile List<String> entities = Collections.emptyList();

	/**
	 * Read the settings from MicroProfile Config, falling back to the defaults
	 * for absent properties.
	 */
	public static ActorRuntimeConfig fromConfig(Config config) {
		ActorRuntimeConfig result = new ActorRuntimeConfig();
		readDuration(config, IDLE_TIMEOUT).ifPresent(result::setActorIdleTimeout);
		readDuration(config, SCAN_INTERVAL).ifPresent(result::setActorScanInterval);
		readDuration(config, DRAIN_ONGOING_CALL_TIMEOUT).ifPresent(result::setDrainOngoingCallTimeout);
		config.getOptionalValue(DRAIN_REBALANCED_ACTORS, Boolean.class).ifPresent(result::setDrainRebalancedActors);

		Optional<Boolean> reentrant = config.getOptionalValue(REENTRANCY_ENABLED, Boolean.class);
		Optional<Integer> depth = config.getOptionalValue(REENTRANCY_MAX_STACK_DEPTH, Integer.class);
		if (reentrant.isPresent() || depth.isPresent()) {
			result.setReentrancy(new ActorReentrancyConfig(reentrant.orElse(false),
					depth.orElse(ActorReentrancyConfig.DEFAULT_MAX_STACK_DEPTH)));
		}
		config.getOptionalValue(REMINDERS_STORAGE_PARTITIONS, Integer.class).ifPresent(result::setRemindersStoragePartitions);
		return result;
	}

	private static Optional<Duration> readDuration(Config config, String name) {
		return config.getOptionalValue(name, String.class).map(ActorDurations::parse);
	}

	public Duration getActorIdleTimeout() {
		return actorIdleTimeout;
	}

	public void setActorIdleTimeout(Duration actorIdleTimeout) {
		this.actorIdleTimeout = actorIdleTimeout;
	}

	public Duration getActorScanInterval() {
		return actorScanInterval;
	}

	public void setActorScanInterval(Duration actorScanInterval) {
		this.actorScanInterval = actorScanInterval;
	}

	public Duration getDrainOngoingCallTimeout() {
		return drainOngoingCallTimeout;
	}

	public void setDrainOngoingCallTimeout(Duration drainOngoingCallTimeout) {
		this.drainOngoingCallTimeout = drainOngoingCallTimeout;
	}

	public boolean isDrainRebalancedActors() {
		return drainRebalancedActors;
	}

	public void setDrainRebalancedActors(boolean drainRebalancedActors) {
		this.drainRebalancedActors = drainRebalancedActors;
	}

	public ActorReentrancyConfig getReentrancy() {
		return reentrancy;
	}

	public void setReentrancy(ActorReentrancyConfig reentrancy) {
		this.reentrancy = reentrancy;
	}

	public Integer getRemindersStoragePartitions() {
		return remindersStoragePartitions;
	}

	public void setRemindersStoragePartitions(Integer remindersStoragePartitions) {
		this.remindersStoragePartitions = remindersStoragePartitions;
	}

	/**
	 * @return an immutable snapshot of the advertised actor types
	 */
	public List<String> getEntities() {
		return entities;
	}

	/**
	 * Replace the advertised actor types.
	 */
	public void updateEntities(Collection<String> types) {
		this.entities = Collections.unmodifiableList(new ArrayList<>(types));
	}

	/**
	 * @return the JSON document served to the sidecar at <code>GET /config</code>
	 */
	public JsonObject toJson() {
		JsonArrayBuilder types = Json.createArrayBuilder();
		for (String type : entities) {
			types.add(type);
		}
		JsonObjectBuilder ob = Json.createObjectBuilder();
		ob.add("entities", types);
		ob.add("actorIdleTimeout", ActorDurations.format(actorIdleTimeout));
		ob.add("actorScanInterval", ActorDurations.format(actorScanInterval));
		ob.add("drainOngoingCallTimeout", ActorDurations.format(drainOngoingCallTimeout));
		ob.add("drainRebalancedActors", drainRebalancedActors);
		ActorReentrancyConfig r = reentrancy;
		if (r != null) {
			ob.add("reentrancy", r.toJson());
		}
		Integer partitions = remindersStoragePartitions;
		if (partitions != null) {
			ob.add("remindersStoragePartitions", partitions.intValue());
		}
		return ob.build();
	}
}
