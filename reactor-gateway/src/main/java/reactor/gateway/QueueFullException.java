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
 * A {@link PoolExhaustedException} raised when the backend's wait queue is already at the configured maximum size,
 * whether the backend's own connection ceiling or the gateway-wide one is what made the request wait.
 */
public class QueueFullException extends PoolExhaustedException {

	private final boolean gatewayCeiling;

	public QueueFullException(String backend, int maxPending) {
		this(backend, maxPending, false);
	}

	public QueueFullException(String backend, int maxPending, boolean gatewayCeiling) {
		super(ErrorKind.QUEUE_FULL, message(backend, maxPending, gatewayCeiling), maxPending);
		this.gatewayCeiling = gatewayCeiling;
	}

	static String message(String backend, int maxPending, boolean gatewayCeiling) {
		String limit = gatewayCeiling ? "the gateway-wide connection limit" : "its connection limit";
		if (maxPending == 0) {
			return "No pending allowed and backend '" + backend + "' has reached " + limit;
		}
		return "Pending acquire queue of backend '" + backend + "' has reached its maximum size of " + maxPending
				+ " while waiting on " + limit;
	}

	/**
	 * @return true if the gateway-wide connection ceiling, rather than the backend's, made the request wait
	 */
	public boolean isGatewayCeiling() {
		return gatewayCeiling;
	}
}
