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

import java.util.Objects;

import org.jspecify.annotations.Nullable;

/**
 * An inbound call to {@link Gateway#handle(GatewayRequest)}.
 */
public final class GatewayRequest {

	/**
	 * A request opening a session with a backend.
	 *
	 * @param backend the target backend
	 * @param userId the calling user
	 * @param credential the per-user credential to verify
	 * @param serviceSecret the shared service secret, null if the caller has none
	 * @param payload the initialization payload handed to the backend
	 */
	public static GatewayRequest initialize(String backend, String userId, String credential,
			@Nullable String serviceSecret, @Nullable Object payload) {
		return new GatewayRequest(RequestKind.INITIALIZE, backend, userId, null,
				Objects.requireNonNull(credential, "credential"), serviceSecret, payload, 1);
	}

	/**
	 * A request within an open session.
	 */
	public static GatewayRequest call(String backend, String userId, @Nullable String sessionId, @Nullable Object payload) {
		return new GatewayRequest(RequestKind.CALL, backend, userId, sessionId, null, null, payload, 1);
	}

	/**
	 * The last request of a session.
	 */
	public static GatewayRequest terminate(String backend, String userId, @Nullable String sessionId) {
		return new GatewayRequest(RequestKind.TERMINATE, backend, userId, sessionId, null, null, null, 1);
	}

	final RequestKind      kind;
	final String           backend;
	final String           userId;
	final @Nullable String sessionId;
	final @Nullable String credential;
	final @Nullable String serviceSecret;
	final @Nullable Object payload;
	final int              weight;

	GatewayRequest(RequestKind kind, String backend, String userId, @Nullable String sessionId,
			@Nullable String credential, @Nullable String serviceSecret, @Nullable Object payload, int weight) {
		this.kind = kind;
		this.backend = Objects.requireNonNull(backend, "backend");
		this.userId = Objects.requireNonNull(userId, "userId");
		this.sessionId = sessionId;
		this.credential = credential;
		this.serviceSecret = serviceSecret;
		this.payload = payload;
		this.weight = weight;
	}

	/**
	 * @return a copy of this request with another rate limiting weight
	 */
	public GatewayRequest withWeight(int weight) {
		if (weight <= 0) {
			throw new IllegalArgumentException("weight must be strictly positive, got " + weight);
		}
		return new GatewayRequest(kind, backend, userId, sessionId, credential, serviceSecret, payload, weight);
	}

	public RequestKind kind() {
		return kind;
	}

	public String backend() {
		return backend;
	}

	public String userId() {
		return userId;
	}

	public @Nullable String sessionId() {
		return sessionId;
	}

	public @Nullable String credential() {
		return credential;
	}

	public @Nullable String serviceSecret() {
		return serviceSecret;
	}

	public @Nullable Object payload() {
		return payload;
	}

	/**
	 * @return the cost of the request against the token bucket and sliding window of its user and backend
	 */
	public int weight() {
		return weight;
	}

	@Override
	public String toString() {
		return "GatewayRequest{" +
				"kind=" + kind +
				", backend='" + backend + '\'' +
				", userId='" + userId + '\'' +
				", sessionId='" + sessionId + '\'' +
				", weight=" + weight +
				'}';
	}
}
