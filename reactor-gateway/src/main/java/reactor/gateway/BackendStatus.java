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

import reactor.gateway.pool.CircuitBreaker;

/**
 * A snapshot of the state of one backend registered with a {@link Gateway}.
 */
public final class BackendStatus {

	final String               name;
	final BackendState         state;
	final CircuitBreaker.State circuitState;
	final int                  sessionCount;
	final int                  activeConnections;
	final int                  idleConnections;
	final int                  pendingAcquires;
	final long                 requestCount;
	final long                 errorCount;
	final long                 lastActivityAt;

	BackendStatus(String name, BackendState state, CircuitBreaker.State circuitState, int sessionCount,
			int activeConnections, int idleConnections, int pendingAcquires, long requestCount, long errorCount,
			long lastActivityAt) {
		this.name = name;
		this.state = state;
		this.circuitState = circuitState;
		this.sessionCount = sessionCount;
		this.activeConnections = activeConnections;
		this.idleConnections = idleConnections;
		this.pendingAcquires = pendingAcquires;
		this.requestCount = requestCount;
		this.errorCount = errorCount;
		this.lastActivityAt = lastActivityAt;
	}

	public String name() {
		return name;
	}

	public BackendState state() {
		return state;
	}

	public CircuitBreaker.State circuitState() {
		return circuitState;
	}

	public int sessionCount() {
		return sessionCount;
	}

	public int activeConnections() {
		return activeConnections;
	}

	public int idleConnections() {
		return idleConnections;
	}

	public int pendingAcquires() {
		return pendingAcquires;
	}

	/**
	 * @return the number of calls that reached the backend handler
	 */
	public long requestCount() {
		return requestCount;
	}

	/**
	 * @return the number of calls the backend handler failed
	 */
	public long errorCount() {
		return errorCount;
	}

	/**
	 * @return when the backend last received a call, 0 if it never did
	 */
	public long lastActivityAt() {
		return lastActivityAt;
	}

	@Override
	public String toString() {
		return "BackendStatus{" +
				"name='" + name + '\'' +
				", state=" + state +
				", circuit=" + circuitState +
				", sessions=" + sessionCount +
				", requests=" + requestCount +
				", errors=" + errorCount +
				'}';
	}
}
