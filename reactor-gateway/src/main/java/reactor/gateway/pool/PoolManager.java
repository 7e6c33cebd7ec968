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

package reactor.gateway.pool;

import java.util.Set;

import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.gateway.BackendNotFoundException;
import reactor.gateway.CircuitOpenException;
import reactor.gateway.QueueFullException;
import reactor.gateway.QueueTimeoutException;
import reactor.gateway.UserRateLimitedException;

/**
 * Orchestrates one {@link ConnectionPool connection pool}, wait queue and {@link CircuitBreaker} per backend,
 * and enforces the gateway-wide ceiling of checked out connections as well as the per-user ceiling of
 * outstanding connections.
 */
public interface PoolManager extends Disposable {

	/**
	 * Create the pool, wait queue and circuit breaker of a backend. Calling this for an already initialized
	 * backend has no effect.
	 *
	 * @param backend the backend name
	 */
	void initializePool(String backend);

	/**
	 * @return the names of the backends that have a pool
	 */
	Set<String> backends();

	/**
	 * Obtain a connection to a backend. Nothing happens until the returned {@link Mono} is subscribed.
	 * <p>
	 * The {@link Mono} either emits a {@link PooledConnection} right away, or after waiting in the backend's queue,
	 * or fails with:
	 * <ul>
	 *     <li>{@link BackendNotFoundException} if the backend has no pool</li>
	 *     <li>{@link CircuitOpenException} if the backend's breaker is open</li>
	 *     <li>{@link UserRateLimitedException} if the user already holds or waits for too many connections</li>
	 *     <li>{@link QueueFullException} if the backend or the whole gateway is at capacity and the backend's queue is
	 *     full</li>
	 *     <li>{@link QueueTimeoutException} if the acquire waited in the queue for longer than the request timeout</li>
	 * </ul>
	 * Cancelling the subscription while waiting removes the acquire from the queue.
	 *
	 * @param backend the backend name
	 * @param userId the user on whose behalf the connection is acquired
	 * @param requestId an identifier of the request, for diagnostics
	 * @return a {@link Mono} of the lease
	 */
	Mono<PooledConnection> acquire(String backend, String userId, String requestId);

	/**
	 * Give a connection back. Records the outcome against the backend's circuit breaker and counters, returns the
	 * connection to the idle set if still valid (discarding it otherwise) and serves waiting acquires in FIFO order.
	 * <p>
	 * The returned {@link Mono} never errors. Releasing the same lease twice is a no-op.
	 *
	 * @param lease the lease obtained from {@link #acquire(String, String, String)}
	 * @param success whether the operation performed with the connection succeeded
	 * @return a {@link Mono} completing once the release has been processed
	 */
	Mono<Void> release(PooledConnection lease, boolean success);

	/**
	 * @param backend the backend name
	 * @return the backend's circuit breaker
	 * @throws BackendNotFoundException if the backend has no pool
	 */
	CircuitBreaker circuitBreaker(String backend);

	/**
	 * @param backend the backend name
	 * @return a live view of the backend's pool gauges and counters
	 * @throws BackendNotFoundException if the backend has no pool
	 */
	PoolMetrics metrics(String backend);

	/**
	 * @return the number of connections currently checked out across every backend
	 */
	int totalActiveConnections();

	/**
	 * @param userId the user id
	 * @return the number of connections the user currently holds or waits for
	 */
	int outstandingConnections(String userId);

	/**
	 * Run a sweep immediately: discard idle connections that expired or whose transport died, and time out
	 * queued acquires older than the request timeout. Sweeps also run periodically at the configured
	 * cleanup interval.
	 */
	void cleanup();

	/**
	 * Shut down every pool: queued acquires fail with {@link reactor.gateway.PoolShutdownException}, idle
	 * connections are discarded and connections still checked out become invalid. Nothing happens until the
	 * returned {@link Mono} is subscribed.
	 *
	 * @return a {@link Mono} completing once every pool has been shut down
	 */
	Mono<Void> disposeLater();

	@Override
	default void dispose() {
		disposeLater().subscribe();
	}

	/**
	 * An object that can be used to get live information about a backend's pool, suitable for gauge metrics.
	 */
	interface PoolMetrics {

		/**
		 * @return the number of connections currently checked out
		 */
		int acquiredSize();

		/**
		 * @return the number of connections currently allocated, idle or checked out or being opened
		 */
		int allocatedSize();

		int idleSize();

		/**
		 * @return the number of acquires currently waiting in the queue
		 */
		int pendingAcquireSize();

		int getMaxAllocatedSize();

		int getMaxPendingAcquireSize();

		/**
		 * @return the number of releases processed so far
		 */
		long requestCount();

		/**
		 * @return the ratio of releases reported as successful, 1 if there was none yet
		 */
		double successRate();

		/**
		 * @return the mean checkout duration in milliseconds over every release, 0 if there was none yet
		 */
		double averageLatency();
	}
}
