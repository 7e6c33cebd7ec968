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

package reactor.gateway.ratelimit;

import java.time.Duration;

import org.jspecify.annotations.Nullable;

/**
 * The verdict of {@link RateLimiter#isAllowed(String, String, String, int)}. An admitted result carries the
 * tokens left in the key's bucket, a rejected one carries the gate that blocked and how long to wait.
 */
public final class RateLimitResult {

	static RateLimitResult allowed(int remaining) {
		return new RateLimitResult(true, null, null, null, remaining);
	}

	static RateLimitResult rejected(RateLimitGate gate, String reason, Duration retryAfter) {
		return new RateLimitResult(false, gate, reason, retryAfter, 0);
	}

	final boolean                 allowed;
	final @Nullable RateLimitGate gate;
	final @Nullable String        reason;
	final @Nullable Duration      retryAfter;
	final int                     remaining;

	RateLimitResult(boolean allowed, @Nullable RateLimitGate gate, @Nullable String reason,
			@Nullable Duration retryAfter, int remaining) {
		this.allowed = allowed;
		this.gate = gate;
		this.reason = reason;
		this.retryAfter = retryAfter;
		this.remaining = remaining;
	}

	public boolean isAllowed() {
		return allowed;
	}

	/**
	 * @return the first gate that blocked, or null if the request was admitted
	 */
	public @Nullable RateLimitGate gate() {
		return gate;
	}

	public @Nullable String reason() {
		return reason;
	}

	/**
	 * @return the window of the gate that blocked, or null if the request was admitted
	 */
	public @Nullable Duration retryAfter() {
		return retryAfter;
	}

	/**
	 * @return {@link #retryAfter()} rounded up to whole seconds, 0 if the request was admitted
	 */
	public long retryAfterSeconds() {
		if (retryAfter == null) {
			return 0L;
		}
		long seconds = retryAfter.getSeconds();
		return retryAfter.getNano() > 0 ? seconds + 1 : seconds;
	}

	/**
	 * @return the whole tokens left in the key's bucket after an admission, 0 for a rejection
	 */
	public int remaining() {
		return remaining;
	}

	@Override
	public String toString() {
		if (allowed) {
			return "RateLimitResult{allowed, remaining=" + remaining + '}';
		}
		return "RateLimitResult{rejected by " + gate + ", reason='" + reason + "', retryAfter=" + retryAfter + '}';
	}
}
