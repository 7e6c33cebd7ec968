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

import org.jspecify.annotations.Nullable;

/**
 * Everything the {@link RateLimiter} tracks for one composite key. Guarded by its own monitor.
 */
final class KeyState {

	final TokenBucket   bucket;
	final SlidingWindow window;

	@Nullable AdaptiveState adaptive;
	long                    lastAccessAt;
	boolean                 evicted;

	KeyState(TokenBucket bucket, SlidingWindow window, long now) {
		this.bucket = bucket;
		this.window = window;
		this.lastAccessAt = now;
	}

	boolean isIdle(long now) {
		return now - lastAccessAt > 2 * bucket.windowMs;
	}
}
