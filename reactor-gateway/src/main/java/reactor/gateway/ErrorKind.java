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

/**
 * The kind of rejection carried by a {@link GatewayException}, stable enough for callers to implement backoff.
 */
public enum ErrorKind {

	/** A connection ceiling was hit and the backend's wait queue is full. */
	QUEUE_FULL,
	/** A queued acquire waited longer than the configured request timeout. */
	QUEUE_TIMEOUT,
	/** The backend's circuit breaker is open. */
	CIRCUIT_OPEN,
	USER_RATE_LIMITED,
	RATE_LIMITED,
	INVALID_SESSION,
	AUTH_INVALID,
	BAD_REQUEST,
	BACKEND_NOT_FOUND,
	BACKEND_CRASHED,
	POOL_SHUTDOWN
}
