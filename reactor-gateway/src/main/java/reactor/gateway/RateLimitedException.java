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

import java.time.Duration;

import reactor.gateway.ratelimit.RateLimitGate;

/**
 * Rejects a request because one of the rate limiter's backend or per-key gates denied it.
 * {@link #gate()} names the first gate that blocked.
 */
public class RateLimitedException extends GatewayException {

	private final RateLimitGate gate;

	public RateLimitedException(RateLimitGate gate, String reason, Duration retryAfter) {
		super(ErrorKind.RATE_LIMITED, reason, retryAfter);
		this.gate = gate;
	}

	public RateLimitGate gate() {
		return gate;
	}
}
