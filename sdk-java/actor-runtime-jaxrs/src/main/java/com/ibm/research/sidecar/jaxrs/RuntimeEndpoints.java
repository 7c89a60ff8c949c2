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

import javax.inject.Inject;
import javax.ws.rs.GET;
import javax.ws.rs.Path;
import javax.ws.rs.Produces;
import javax.ws.rs.core.MediaType;
import javax.ws.rs.core.Response;

import com.ibm.research.sidecar.runtime.ActorRuntime;

/**
 * Runtime level endpoints polled by the sidecar.
 */
@Path("/")
public class RuntimeEndpoints {

	@Inject
	ActorRuntime runtime;

	// the hosted actor types and their settings
	@GET
	@Path("config")
	@Produces(MediaType.APPLICATION_JSON)
	public Response getConfig() {
		return Response.ok(runtime.getActorConfig().toJson().toString(), MediaType.APPLICATION_JSON_TYPE).build();
	}

	@GET
	@Path("healthz")
	@Produces(MediaType.TEXT_PLAIN)
	public Response health() {
		return Response.ok("OK", MediaType.TEXT_PLAIN_TYPE).build();
	}
}
