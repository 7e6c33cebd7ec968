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
 * A point-in-time snapshot of the {@link RateLimiter} counters and of the number of keys it currently tracks.
 */
public final class RateLimiterMetrics {

	final long totalRequests;
	final long allowedRequests;
	final long rejectedRequests;
	final long rateLimitHits;
	final long adaptiveAdjustments;
	final int  activeKeys;
	final int  activeUsers;
	final int  activeBackends;
	final int  adaptiveKeys;
	final long timestamp;

	RateLimiterMetrics(long totalRequests, long allowedRequests, long rejectedRequests, long rateLimitHits,
			long adaptiveAdjustments, int activeKeys, int activeUsers, int activeBackends, int adaptiveKeys,
			long timestamp) {
		this.totalRequests = totalRequests;
		this.allowedRequests = allowedRequests;
		this.rejectedRequests = rejectedRequests;
		this.rateLimitHits = rateLimitHits;
		this.adaptiveAdjustments = adaptiveAdjustments;
		this.activeKeys = activeKeys;
		this.activeUsers = activeUsers;
		this.activeBackends = activeBackends;
		this.adaptiveKeys = adaptiveKeys;
		this.timestamp = timestamp;
	}

	public long totalRequests() {
		return totalRequests;
	}

	public long allowedRequests() {
		return allowedRequests;
	}

	public long rejectedRequests() {
		return rejectedRequests;
	}

	/**
	 * @return the number of rejections that were reported to the event listener
	 */
	public long rateLimitHits() {
		return rateLimitHits;
	}

	public long adaptiveAdjustments() {
		return adaptiveAdjustments;
	}

	/**
	 * @return the number of composite keys with a token bucket and sliding window
	 */
	public int activeKeys() {
		return activeKeys;
	}

	public int activeUsers() {
		return activeUsers;
	}

	public int activeBackends() {
		return activeBackends;
	}

	/**
	 * @return the number of composite keys adaptive throttling tracks
	 */
	public int adaptiveKeys() {
		return adaptiveKeys;
	}

	/**
	 * @return when the snapshot was taken, in epoch milliseconds of the limiter's clock
	 */
	public long timestamp() {
		return timestamp;
	}

	@Override
	public String toString() {
		return "RateLimiterMetrics{" +
				"total=" + totalRequests +
				", allowed=" + allowedRequests +
				", rejected=" + rejectedRequests +
				", adaptiveAdjustments=" + adaptiveAdjustments +
				", keys=" + activeKeys +
				", users=" + activeUsers +
				", backends=" + activeBackends +
				'}';
	}
}
