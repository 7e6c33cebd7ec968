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

import org.jspecify.annotations.Nullable;

/**
 * Rejects a request because its user went over a per-user limit, either the rate limiter's per-user quota
 * or the pool's ceiling of concurrent connections per user.
 */
public class UserRateLimitedException extends GatewayException {

	private final String userId;

	public UserRateLimitedException(String userId, String reason, @Nullable Duration retryAfter) {
		super(ErrorKind.USER_RATE_LIMITED, reason + " for user '" + userId + "'", retryAfter);
		this.userId = userId;
	}

	public String userId() {
		return userId;
	}
}
