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
 * A {@link GatewayException} rejecting an acquire because a connection ceiling is reached and the request cannot
 * wait for a connection.
 */
public abstract class PoolExhaustedException extends GatewayException {

	private final int maxPending;

	PoolExhaustedException(ErrorKind kind, String message, int maxPending) {
		super(kind, message, null);
		this.maxPending = maxPending;
	}

	/**
	 * @return the configured maximum pending size of the backend's wait queue
	 */
	public int getAcquirePendingLimit() {
		return this.maxPending;
	}
}
