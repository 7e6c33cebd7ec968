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

/**
 * Refills {@code refillAmount} tokens per window, linearly, up to {@link #maxTokens}. The capacity can be moved by
 * adaptive throttling, the tokens are then clamped to it.
 */
final class TokenBucket {

	final int  refillAmount;
	final long windowMs;

	double tokens;
	double maxTokens;
	long   lastRefillAt;

	TokenBucket(int initialTokens, int maxTokens, long windowMs, long now) {
		this.refillAmount = initialTokens;
		this.windowMs = windowMs;
		this.maxTokens = maxTokens;
		this.tokens = Math.min(initialTokens, maxTokens);
		this.lastRefillAt = now;
	}

	boolean check(int weight, long now) {
		long elapsed = now - lastRefillAt;
		if (elapsed > 0) {
			tokens = Math.min(maxTokens, tokens + (double) elapsed / windowMs * refillAmount);
			lastRefillAt = now;
		}
		return tokens >= weight;
	}

	void consume(int weight) {
		tokens = Math.max(0d, tokens - weight);
	}

	/**
	 * @return the share of the capacity currently spent, between 0 and 1
	 */
	double load() {
		return 1d - tokens / maxTokens;
	}

	void resize(double newMaxTokens) {
		maxTokens = newMaxTokens;
		tokens = Math.min(tokens, newMaxTokens);
	}
}
