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

package com.ibm.research.sidecar.client;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

import org.eclipse.microprofile.config.ConfigProvider;
import org.jboss.logging.Logger;

import io.smallrye.mutiny.Uni;
import io.vertx.core.http.HttpVersion;
import io.vertx.ext.web.client.WebClientOptions;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpRequest;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import io.vertx.mutiny.ext.web.client.WebClient;

/**
 * ActorSidecarClient over the sidecar's actor HTTP API, using a Vert.x WebClient.
 *
 * The Vert.x instance and WebClient are created on the first request, so
 * constructing a client is cheap and opens no connections.
 */
public class VertxActorSidecarClient implements ActorSidecarClient {

	private static final Logger LOG = Logger.getLogger(VertxActorSidecarClient.class);

	private final static String ACTOR_API_CONTEXT_ROOT = "/v1.0/actors";

	private final static String HEADER_CONTENT_TYPE = "Content-Type";
	private final static String CONTENT_JSON = "application/json; charset=utf-8";
	private final static String CONTENT_BINARY = "application/octet-stream";

	private final SidecarConfig config;

	private Vertx vertx;
	private WebClient client;

	public VertxActorSidecarClient() {
		this(SidecarConfig.fromConfig(ConfigProvider.getConfig()));
	}

	public VertxActorSidecarClient(SidecarConfig config) {
		this.config = config;
	}

	@Override
	public Uni<byte[]> invokeMethod(String actorType, String actorId, String method, byte[] data) {
		String uri = buildActorUri(actorType, actorId, "method", method);
		return send(client().post(uri).putHeader(HEADER_CONTENT_TYPE, CONTENT_BINARY), data)
				.chain(VertxActorSidecarClient::toBytes);
	}

	@Override
	public Uni<byte[]> getState(String actorType, String actorId, String key) {
		String uri = buildActorUri(actorType, actorId, "state", key);
		return client().get(uri).send().chain(resp -> {
			if (resp.statusCode() == 204 || resp.statusCode() == 404) {
				return Uni.createFrom().item(new byte[0]);
			}
			return toBytes(resp);
		});
	}

	@Override
	public Uni<Void> saveStateTransactionally(String actorType, String actorId, byte[] data) {
		String uri = buildActorUri(actorType, actorId, "state");
		return send(client().put(uri).putHeader(HEADER_CONTENT_TYPE, CONTENT_JSON), data)
				.chain(VertxActorSidecarClient::toVoid);
	}

	@Override
	public Uni<Void> registerReminder(String actorType, String actorId, String name, byte[] data) {
		String uri = buildActorUri(actorType, actorId, "reminders", name);
		return send(client().put(uri).putHeader(HEADER_CONTENT_TYPE, CONTENT_JSON), data)
				.chain(VertxActorSidecarClient::toVoid);
	}

	@Override
	public Uni<Void> unregisterReminder(String actorType, String actorId, String name) {
		String uri = buildActorUri(actorType, actorId, "reminders", name);
		return client().delete(uri).send().chain(VertxActorSidecarClient::toVoid);
	}

	@Override
	public Uni<Void> registerTimer(String actorType, String actorId, String name, byte[] data) {
		String uri = buildActorUri(actorType, actorId, "timers", name);
		return send(client().put(uri).putHeader(HEADER_CONTENT_TYPE, CONTENT_JSON), data)
				.chain(VertxActorSidecarClient::toVoid);
	}

	@Override
	public Uni<Void> unregisterTimer(String actorType, String actorId, String name) {
		String uri = buildActorUri(actorType, actorId, "timers", name);
		return client().delete(uri).send().chain(VertxActorSidecarClient::toVoid);
	}

	@Override
	public synchronized void close() {
		if (client != null) {
			client.close();
			vertx.closeAndAwait();
			client = null;
			vertx = null;
		}
	}

	private synchronized WebClient client() {
		if (client == null) {
			LOG.info("Using sidecar at " + config);
			WebClientOptions options = new WebClientOptions().setDefaultHost(config.getHost())
					.setDefaultPort(config.getPort());
			if (config.isHttp2()) {
				LOG.info("Configuring for HTTP/2");
				options.setProtocolVersion(HttpVersion.HTTP_2).setUseAlpn(true).setHttp2ClearTextUpgrade(false);
			}
			vertx = Vertx.vertx();
			client = WebClient.create(vertx, options);
		}
		return client;
	}

	private static Uni<HttpResponse<Buffer>> send(HttpRequest<Buffer> request, byte[] data) {
		if (data == null) {
			return request.send();
		}
		return request.sendBuffer(Buffer.buffer(data));
	}

	private static boolean isSuccess(HttpResponse<Buffer> resp) {
		return resp.statusCode() >= 200 && resp.statusCode() < 300;
	}

	private static Uni<byte[]> toBytes(HttpResponse<Buffer> resp) {
		if (!isSuccess(resp)) {
			LOG.debugf("Sidecar request failed with %d", resp.statusCode());
			return Uni.createFrom().failure(new SidecarException(resp));
		}
		Buffer body = resp.body();
		return Uni.createFrom().item(body == null ? new byte[0] : body.getBytes());
	}

	private static Uni<Void> toVoid(HttpResponse<Buffer> resp) {
		if (!isSuccess(resp)) {
			LOG.debugf("Sidecar request failed with %d", resp.statusCode());
			return Uni.createFrom().failure(new SidecarException(resp));
		}
		return Uni.createFrom().voidItem();
	}

	/**
	 * Build the sidecar path of an actor, percent-encoding every segment.
	 */
	static String buildActorUri(String type, String id, String... segments) {
		StringBuilder sb = new StringBuilder(ACTOR_API_CONTEXT_ROOT);
		sb.append('/').append(encodeSegment(type)).append('/').append(encodeSegment(id));
		for (String segment : segments) {
			sb.append('/').append(encodeSegment(segment));
		}
		return sb.toString();
	}

	static String encodeSegment(String segment) {
		return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
	}
}
