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
 * The gates of the {@link RateLimiter}, in evaluation order.
 */
public enum RateLimitGate {

	/**
	 * The quota of the user, across every backend.
	 */
	USER,
	/**
	 * The quota of the backend, across every user.
	 */
	BACKEND,
	/**
	 * The token bucket of the composite key.
	 */
	BUCKET,
	/**
	 * The segmented sliding window of the composite key.
	 */
	WINDOW
}
