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

import java.util.ArrayDeque;

/**
 * The fixed quota of one user or one backend: tokens refilling linearly up to the limit over the window, plus the
 * log of admission times inside the window. Guarded by its own monitor.
 */
final class QuotaState {

	final int    limit;
	final long   windowMs;
	final ArrayDeque<Long> admissions = new ArrayDeque<>();

	double  tokens;
	long    lastRefillAt;
	long    lastAccessAt;
	boolean evicted;

	QuotaState(int limit, long windowMs, long now) {
		this.limit = limit;
		this.windowMs = windowMs;
		this.tokens = limit;
		this.lastRefillAt = now;
		this.lastAccessAt = now;
	}

	/**
	 * Refill and prune the log, then tell whether one more request fits.
	 */
	boolean check(long now) {
		lastAccessAt = now;
		long elapsed = now - lastRefillAt;
		if (elapsed > 0) {
			tokens = Math.min(limit, tokens + (double) elapsed / windowMs * limit);
			lastRefillAt = now;
		}
		Long oldest;
		while ((oldest = admissions.peekFirst()) != null && now - oldest >= windowMs) {
			admissions.pollFirst();
		}
		return tokens >= 1d && admissions.size() < limit;
	}

	void consume(long now) {
		tokens = Math.max(0d, tokens - 1d);
		admissions.addLast(now);
	}

	boolean isIdle(long now) {
		return now - lastAccessAt > 2 * windowMs;
	}
}
