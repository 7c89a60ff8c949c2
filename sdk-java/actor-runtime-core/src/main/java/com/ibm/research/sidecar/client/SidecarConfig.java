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

import org.eclipse.microprofile.config.Config;

/**
 * Coordinates of the sidecar, read from MicroProfile Config.
 * Environment variables such as ACTORS_SIDECAR_PORT override the defaults.
 */
public final class SidecarConfig {

	public static final String SIDECAR_HOST = "actors.sidecar.host";
	public static final String SIDECAR_PORT = "actors.sidecar.port";
	public static final String SIDECAR_HTTP2 = "actors.sidecar.http2";

	public static final String DEFAULT_HOST = "127.0.0.1";
	public static final int DEFAULT_PORT = 3500;

	private final String host;
	private final int port;
	private final boolean http2;

	public SidecarConfig(String host, int port, boolean http2) {
		this.host = host;
		this.port = port;
		this.http2 = http2;
	}

	public static SidecarConfig fromConfig(Config config) {
		String host = config.getOptionalValue(SIDECAR_HOST, String.class).orElse(DEFAULT_HOST);
		int port = config.getOptionalValue(SIDECAR_PORT, Integer.class).orElse(DEFAULT_PORT);
		boolean http2 = config.getOptionalValue(SIDECAR_HTTP2, Boolean.class).orElse(false);
		return new SidecarConfig(host, port, http2);
	}

	public String getHost() {
		return host;
	}

	public int getPort() {
		return port;
	}

	public boolean isHttp2() {
		return http2;
	}

	@Override
	public String toString() {
		return host + ":" + port + (http2 ? " (HTTP/2)" : "");
	}
}
