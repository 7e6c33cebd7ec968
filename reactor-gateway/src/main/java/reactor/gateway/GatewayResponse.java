/*
 * Copyright (c) 2026 VMware Inc. or its affiliates, All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package reactor.gateway;

import org.jspecify.annotations.Nullable;

/**
 * The outcome of a successful {@link Gateway#handle(GatewayRequest)}.
 */
public final class GatewayResponse {

	final String           sessionId;
	final String           backend;
	final @Nullable Object result;
	final long             latencyMs;

	GatewayResponse(String sessionId, String backend, @Nullable Object result, long latencyMs) {
		this.sessionId = sessionId;
		this.backend = backend;
		this.result = result;
		this.latencyMs = latencyMs;
	}

	/**
	 * @return the id of the session the call ran in, to be presented by the following calls
	 */
	public String sessionId() {
		return sessionId;
	}

	public String backend() {
		return backend;
	}

	/**
	 * @return what the backend handler emitted, null if it completed empty
	 */
	public @Nullable Object result() {
		return result;
	}

	public long latencyMs() {
		return latencyMs;
	}

	@Override
	public String toString() {
		return "GatewayResponse{" +
				"sessionId='" + sessionId + '\'' +
				", backend='" + backend + '\'' +
				", latencyMs=" + latencyMs +
				'}';
	}
}
