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
import javax.ws.rs.Consumes;
import javax.ws.rs.DELETE;
import javax.ws.rs.HEAD;
import javax.ws.rs.POST;
import javax.ws.rs.PUT;
import javax.ws.rs.Path;
import javax.ws.rs.PathParam;
import javax.ws.rs.Produces;
import javax.ws.rs.core.MediaType;
import javax.ws.rs.core.Response;
import javax.ws.rs.core.Response.Status;

import com.ibm.research.sidecar.runtime.ActorRuntime;

/**
 * The callbacks the sidecar makes into this process for hosted actors.
 * Failures are rendered by {@link ActorExceptionMapper}.
 */
@Path("/actors")
public class ActorEndpoints {

	@Inject
	ActorRuntime runtime;

	@HEAD
	@Path("/{type}")
	public Response checkActorType(@PathParam("type") String type) {
		Status status = runtime.getActorManager(type).isPresent() ? Status.OK : Status.NOT_FOUND;
		return Response.status(status).build();
	}

	/**
	 * Activate an actor instance if it is not already in memory.
	 */
	@POST
	@Path("/{type}/{id}")
	public Response activate(@PathParam("type") String type, @PathParam("id") String id) {
		runtime.activate(type, id);
		return Response.ok().build();
	}

	/**
	 * Deactivate an actor instance and remove it from memory.
	 */
	@DELETE
	@Path("/{type}/{id}")
	public Response deactivate(@PathParam("type") String type, @PathParam("id") String id) {
		runtime.deactivate(type, id);
		return Response.ok().build();
	}

	/**
	 * Invoke an actor method
	 *
	 * @param type The type of the actor
	 * @param id The id of the target instance
	 * @param method The method to invoke
	 * @param body The encoded argument of the method
	 * @return The encoded result of the method
	 */
	@PUT
	@Path("/{type}/{id}/method/{method}")
	@Consumes(MediaType.WILDCARD)
	@Produces(MediaType.APPLICATION_OCTET_STREAM)
	public Response invokeActorMethod(@PathParam("type") String type, @PathParam("id") String id,
			@PathParam("method") String method, byte[] body) {
		byte[] result = runtime.dispatch(type, id, method, body);
		return Response.ok(result, MediaType.APPLICATION_OCTET_STREAM_TYPE).build();
	}

	@PUT
	@Path("/{type}/{id}/method/remind/{name}")
	@Consumes(MediaType.WILDCARD)
	public Response fireReminder(@PathParam("type") String type, @PathParam("id") String id,
			@PathParam("name") String name, byte[] body) {
		runtime.fireReminder(type, id, name, body);
		return Response.ok().build();
	}

	@PUT
	@Path("/{type}/{id}/method/timer/{name}")
	@Consumes(MediaType.WILDCARD)
	public Response fireTimer(@PathParam("type") String type, @PathParam("id") String id,
			@PathParam("name") String name) {
		runtime.fireTimer(type, id, name);
		return Response.ok().build();
	}
}
