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

/**
 * Denotes that a queued acquire has been pending for longer than the configured request timeout. The entry
 * has been removed from the queue by the time this is signalled.
 */
public class QueueTimeoutException extends GatewayException {

	private final Duration acquireTimeout;

	public QueueTimeoutException(String backend, Duration acquireTimeout) {
		super(ErrorKind.QUEUE_TIMEOUT, "Acquire on backend '" + backend
				+ "' has been pending for more than the configured timeout of " + acquireTimeout.toMillis() + "ms", null);
		this.acquireTimeout = acquireTimeout;
	}

	/**
	 * @return the configured timeout that was just overshot
	 */
	public Duration getAcquireTimeout() {
		return acquireTimeout;
	}
}
