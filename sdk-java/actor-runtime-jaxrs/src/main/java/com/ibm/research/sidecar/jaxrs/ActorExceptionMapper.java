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

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.logging.Level;
import java.util.logging.Logger;

import javax.json.Json;
import javax.json.JsonObjectBuilder;
import javax.ws.rs.core.MediaType;
import javax.ws.rs.core.Response;
import javax.ws.rs.core.Response.Status;
import javax.ws.rs.ext.ExceptionMapper;
import javax.ws.rs.ext.Provider;

import org.eclipse.microprofile.config.ConfigProvider;

import com.ibm.research.sidecar.actor.exceptions.ActorException;
import com.ibm.research.sidecar.actor.exceptions.ActorMethodNotFoundException;
import com.ibm.research.sidecar.actor.exceptions.ActorNotActivatedException;
import com.ibm.research.sidecar.actor.exceptions.ActorTimerNotFoundException;
import com.ibm.research.sidecar.actor.exceptions.ActorTypeNotFoundException;

/**
 * Renders actor failures for the sidecar. Requests addressed to something
 * that does not exist are answered with 404 and a plain text message; every
 * other failure is answered with 500 and a JSON error document.
 */
@Provider
public class ActorExceptionMapper implements ExceptionMapper<ActorException> {

	private final static String LOG_PREFIX = "ActorExceptionMapper.";
	private final static Logger logger = Logger.getLogger(ActorExceptionMapper.class.getName());

	public static final String MAX_STACKTRACE_SIZE = "actors.max-stacktrace-size";
	public static final int DEFAULT_MAX_STACKTRACE_SIZE = 512 * 1024;

	private final int maxStacktraceSize;

	public ActorExceptionMapper() {
		this(ConfigProvider.getConfig().getOptionalValue(MAX_STACKTRACE_SIZE, Integer.class)
				.orElse(DEFAULT_MAX_STACKTRACE_SIZE));
	}

	public ActorExceptionMapper(int maxStacktraceSize) {
		this.maxStacktraceSize = maxStacktraceSize;
	}

	@Override
	public Response toResponse(ActorException e) {
		if (e instanceof ActorTypeNotFoundException || e instanceof ActorMethodNotFoundException
				|| e instanceof ActorTimerNotFoundException || e instanceof ActorNotActivatedException) {
			return Response.status(Status.NOT_FOUND).type(MediaType.TEXT_PLAIN_TYPE).entity(e.getMessage()).build();
		}

		logger.log(Level.WARNING, LOG_PREFIX + "toResponse: actor request failed", e);
		JsonObjectBuilder jb = Json.createObjectBuilder();
		jb.add("error", true);
		if (e.getMessage() != null) {
			jb.add("message", e.getMessage());
		}
		jb.add("stack", stacktraceToString(e));
		return Response.status(Status.INTERNAL_SERVER_ERROR).type(MediaType.APPLICATION_JSON_TYPE)
				.entity(jb.build().toString()).build();
	}

	String stacktraceToString(Throwable t) {
		StringWriter sw = new StringWriter();
		PrintWriter pw = new PrintWriter(sw);
		t.printStackTrace(pw);
		String backtrace = sw.toString();
		if (backtrace.length() > maxStacktraceSize) {
			backtrace = backtrace.substring(0, maxStacktraceSize) + "\n...Backtrace truncated due to message length restrictions\n";
		}
		return backtrace;
	}
}
