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

import java.time.Clock;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicIntegerFieldUpdater;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

import org.jspecify.annotations.Nullable;

import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.gateway.CircuitOpenException;
import reactor.gateway.GatewayConfig;
import reactor.gateway.GatewayMetricsRecorder;
import reactor.gateway.PoolShutdownException;
import reactor.gateway.QueueFullException;
import reactor.gateway.QueueTimeoutException;
import reactor.gateway.UserRateLimitedException;
import reactor.util.Logger;
import reactor.util.Loggers;

/**
 * The connection pool of a single backend: a bounded set of {@link BackendConnection connections}, split between
 * an idle deque and an active set, and the {@link WaitQueue} of acquires waiting for one of them.
 * <p>
 * Matching waiting acquires with connections happens in a drain loop guarded by a work-in-progress counter:
 * whichever thread wins the counter serves the queue, the others only enqueue and leave.
 * The number of allocated connections (idle, active or being opened) never exceeds the configured maximum.
 */
final class ConnectionPool implements PoolManager.PoolMetrics {

	static final Logger LOG = Loggers.getLogger(ConnectionPool.class);

	final String                 backend;
	final SimplePoolManager      manager;
	final GatewayConfig          config;
	final TransportAllocator     allocator;
	final CircuitBreaker         breaker;
	final WaitQueue              queue;
	final GatewayMetricsRecorder metricsRecorder;
	final Clock                  clock;
	final int                    maxConnections;
	final long                   idleTimeoutMs;

	final ConcurrentLinkedDeque<BackendConnection> idle   = new ConcurrentLinkedDeque<>();
	final Set<BackendConnection>                   active = ConcurrentHashMap.newKeySet();

	final AtomicLong connectionSequence = new AtomicLong();
	final LongAdder  requestCount       = new LongAdder();
	final LongAdder  successCount       = new LongAdder();
	final LongAdder  totalLatency       = new LongAdder();

	volatile int idleSize;
	static final AtomicIntegerFieldUpdater<ConnectionPool> IDLE_SIZE =
			AtomicIntegerFieldUpdater.newUpdater(ConnectionPool.class, "idleSize");

	volatile int allocated;
	static final AtomicIntegerFieldUpdater<ConnectionPool> ALLOCATED =
			AtomicIntegerFieldUpdater.newUpdater(ConnectionPool.class, "allocated");

	volatile int wip;
	static final AtomicIntegerFieldUpdater<ConnectionPool> WIP =
			AtomicIntegerFieldUpdater.newUpdater(ConnectionPool.class, "wip");

	volatile int disposed;
	static final AtomicIntegerFieldUpdater<ConnectionPool> DISPOSED =
			AtomicIntegerFieldUpdater.newUpdater(ConnectionPool.class, "disposed");

	ConnectionPool(String backend, SimplePoolManager manager, GatewayConfig config, TransportAllocator allocator) {
		this.backend = backend;
		this.manager = manager;
		this.config = config;
		this.allocator = allocator;
		this.clock = config.clock();
		this.metricsRecorder = config.metricsRecorder();
		this.breaker = new CircuitBreaker(config.circuitBreakerThreshold(), config.circuitBreakerTimeout(), clock);
		this.queue = new WaitQueue(config.queueMaxSize(), config.requestTimeout(), config.timer());
		this.maxConnections = config.maxConnectionsPerServer();
		this.idleTimeoutMs = config.idleTimeout().toMillis();
	}

	Mono<PooledConnection> acquire(String userId, String requestId) {
		return new Borrower.BorrowerMono(this, userId, requestId);
	}

	void doAcquire(Borrower borrower) {
		if (!borrower.isPending()) {
			return;
		}
		if (isDisposed()) {
			borrower.fail(new PoolShutdownException("Pool of backend '" + backend + "' has been shut down"));
			return;
		}
		if (breaker.isOpen()) {
			borrower.fail(new CircuitOpenException(backend, config.circuitBreakerTimeout()));
			return;
		}
		if (!manager.tryAcquireUserPermit(borrower.userId)) {
			borrower.fail(new UserRateLimitedException(borrower.userId,
					"Maximum of " + config.maxConcurrentRequestsPerUser() + " concurrent connections reached", null));
			return;
		}
		borrower.admitted = true;
		borrower.enqueuedAt = clock.millis();
		queue.offer(borrower);
		drain();
		queue.startCountdown(borrower);
	}

	void cancelAcquire(Borrower borrower) {
		if (borrower.markCancelled()) {
			queue.remove(borrower);
			if (borrower.admitted) {
				manager.releaseUserPermit(borrower.userId);
			}
		}
	}

	void expire(Borrower borrower) {
		if (!borrower.isPending()) {
			return;
		}
		queue.remove(borrower);
		if (borrower.fail(new QueueTimeoutException(backend, config.requestTimeout()))) {
			manager.releaseUserPermit(borrower.userId);
		}
	}

	void drain() {
		if (WIP.getAndIncrement(this) == 0) {
			drainLoop();
		}
	}

	private void drainLoop() {
		for (;;) {
			if (!isDisposed()) {
				//serve as many heads as capacity allows
				while (serveHead()) {
				}
			}
			if (WIP.decrementAndGet(this) == 0) {
				break;
			}
		}
	}

	/**
	 * @return true if the head of the queue has been served and the next one may be too
	 */
	private boolean serveHead() {
		if (queue.size() == 0) {
			return false;
		}
		if (!manager.tryAcquireGlobalPermit()) {
			/*=========================================*
			 * GATEWAY-WIDE CEILING: wait, cull excess *
			 *=========================================*/
			cull(true);
			return false;
		}
		BackendConnection connection = pollValidIdle();
		if (connection == null && !tryReserveAllocation()) {
			/*======================================*
			 * BACKEND CEILING: wait, cull excess   *
			 *======================================*/
			manager.releaseGlobalPermit();
			cull(false);
			return false;
		}
		Borrower borrower = nextAssignable();
		if (borrower == null) {
			//the waiting entries were terminated concurrently, give back what we reserved
			if (connection != null) {
				idle.offerFirst(connection);
				incrementIdle();
			}
			else {
				ALLOCATED.decrementAndGet(this);
			}
			manager.releaseGlobalPermit();
			return false;
		}
		if (connection != null) {
			/*=====================================*
			 * MATCH: the head gets an IDLE one    *
			 *=====================================*/
			long now = clock.millis();
			long idleFor = now - connection.lastUsedAt();
			connection.markActive(now);
			active.add(connection);
			metricsRecorder.recordIdleTime(backend, idleFor);
			deliver(borrower, connection, now);
		}
		else {
			/*=====================================*
			 * ALLOCATE: open a new transport      *
			 *=====================================*/
			allocate(borrower);
		}
		return true;
	}

	@Nullable
	private Borrower nextAssignable() {
		for (;;) {
			Borrower b = queue.poll();
			if (b == null || b.assign()) {
				return b;
			}
		}
	}

	/**
	 * Fail the most recent entries that are beyond the queue's maximum size.
	 */
	private void cull(boolean gatewayCeiling) {
		int maxPending = queue.maxSize();
		int toCull = queue.size() - maxPending;
		for (int i = 0; i < toCull; i++) {
			Borrower extraneous = queue.pollLast();
			if (extraneous == null) {
				return;
			}
			if (extraneous.fail(new QueueFullException(backend, maxPending, gatewayCeiling))) {
				manager.releaseUserPermit(extraneous.userId);
			}
		}
	}

	@Nullable
	private BackendConnection pollValidIdle() {
		long now = clock.millis();
		BackendConnection c;
		while ((c = idle.pollFirst()) != null) {
			decrementIdle();
			if (c.isValid() && !c.isExpired(now, idleTimeoutMs)) {
				return c;
			}
			discard(c);
		}
		return null;
	}

	private boolean tryReserveAllocation() {
		for (;;) {
			int a = allocated;
			if (a >= maxConnections) {
				return false;
			}
			if (ALLOCATED.compareAndSet(this, a, a + 1)) {
				return true;
			}
		}
	}

	private void allocate(Borrower borrower) {
		long start = clock.millis();
		Mono<Disposable> transport = Mono.defer(() -> allocator.allocate(backend));
		if (!config.connectionTimeout().isZero()) {
			transport = transport.timeout(config.connectionTimeout(), config.timer());
		}
		transport.switchIfEmpty(Mono.error(() -> new IllegalStateException("Transport allocator of backend '" + backend + "' completed empty")))
		         .subscribe(t -> onAllocated(borrower, t, start),
				         e -> onAllocationError(borrower, e, start));
	}

	private void onAllocated(Borrower borrower, Disposable transport, long start) {
		long now = clock.millis();
		metricsRecorder.recordAllocationSuccessAndLatency(backend, now - start);
		BackendConnection connection = new BackendConnection(backend + "-" + connectionSequence.incrementAndGet(),
				backend, transport, now);
		LOG.debug("Opened connection {}", connection.id);
		active.add(connection);
		if (isDisposed()) {
			discardActive(connection);
			manager.releaseGlobalPermit();
			if (borrower.fail(new PoolShutdownException("Pool of backend '" + backend + "' has been shut down"))) {
				manager.releaseUserPermit(borrower.userId);
			}
			return;
		}
		deliver(borrower, connection, now);
	}

	private void onAllocationError(Borrower borrower, Throwable error, long start) {
		metricsRecorder.recordAllocationFailureAndLatency(backend, clock.millis() - start);
		LOG.warn("Failed to open a connection to backend {}: {}", backend, error.toString());
		breaker.recordFailure();
		ALLOCATED.decrementAndGet(this);
		manager.releaseGlobalPermit();
		if (borrower.fail(error)) {
			manager.releaseUserPermit(borrower.userId);
		}
		drain();
	}

	private void deliver(Borrower borrower, BackendConnection connection, long now) {
		PooledConnection lease = new PooledConnection(connection, borrower.userId, borrower.requestId, now);
		if (!borrower.deliver(lease)) {
			//cancelled while being served, its user permit is already back
			recycle(connection, true);
			manager.releaseGlobalPermit();
		}
	}

	/**
	 * Account for the release of a lease: counters, breaker, then back to idle or discarded.
	 *
	 * @return the checkout duration of the lease
	 */
	long release(PooledConnection lease, boolean success) {
		long now = clock.millis();
		long latency = now - lease.acquiredAt;
		if (success) {
			breaker.recordSuccess();
			successCount.increment();
		}
		else {
			breaker.recordFailure();
		}
		requestCount.increment();
		totalLatency.add(latency);
		metricsRecorder.recordReleaseLatency(backend, latency, success);
		recycle(lease.connection, !lease.invalidated);
		return latency;
	}

	private void recycle(BackendConnection connection, boolean reusable) {
		active.remove(connection);
		if (!reusable || isDisposed() || !connection.isValid() || !connection.markIdle(clock.millis())) {
			discard(connection);
			return;
		}
		idle.offerLast(connection);
		incrementIdle();
		if (isDisposed() && idle.remove(connection)) {
			//lost the race with disposeLater
			decrementIdle();
			discard(connection);
		}
	}

	private void discardActive(BackendConnection connection) {
		active.remove(connection);
		discard(connection);
	}

	void discard(BackendConnection connection) {
		if (connection.markDiscarded()) {
			ALLOCATED.decrementAndGet(this);
			metricsRecorder.recordLifetimeDuration(backend, clock.millis() - connection.createdAt);
			LOG.debug("Discarding connection {}", connection.id);
			try {
				connection.transport.dispose();
			}
			catch (RuntimeException e) {
				LOG.warn("Error while closing the transport of connection " + connection.id, e);
			}
		}
	}

	/**
	 * Best effort sweep: skipped if a drain is in progress, in which case that drain runs once more instead.
	 *
	 * @return the number of idle connections and queued acquires that were removed
	 */
	int evict() {
		int removed = 0;
		if (WIP.getAndIncrement(this) == 0) {
			if (!isDisposed()) {
				long now = clock.millis();
				Iterator<BackendConnection> iterator = idle.iterator();
				while (iterator.hasNext()) {
					BackendConnection c = iterator.next();
					if (!c.isValid() || c.isExpired(now, idleTimeoutMs)) {
						if (idle.remove(c)) {
							decrementIdle();
							discard(c);
							removed++;
						}
					}
				}
				List<Borrower> expired = queue.pollExpired(now);
				for (Borrower b : expired) {
					if (b.fail(new QueueTimeoutException(backend, config.requestTimeout()))) {
						manager.releaseUserPermit(b.userId);
						removed++;
					}
				}
			}
			//discarding may have freed capacity for waiting acquires
			while (serveHead()) {
			}
			if (WIP.decrementAndGet(this) > 0) {
				drainLoop();
			}
		}
		return removed;
	}

	Mono<Void> disposeLater() {
		return Mono.fromRunnable(() -> {
			if (!DISPOSED.compareAndSet(this, 0, 1)) {
				return;
			}
			Borrower b;
			while ((b = queue.poll()) != null) {
				if (b.fail(new PoolShutdownException("Pool of backend '" + backend + "' has been shut down"))) {
					manager.releaseUserPermit(b.userId);
				}
			}
			BackendConnection c;
			while ((c = idle.pollFirst()) != null) {
				decrementIdle();
				discard(c);
			}
			//leases still out become invalid, they are removed from the active set once released
			for (BackendConnection connection : active) {
				discard(connection);
			}
			LOG.debug("Pool of backend {} has been shut down", backend);
		});
	}

	boolean isDisposed() {
		return disposed == 1;
	}

	void decrementIdle() {
		if (IDLE_SIZE.decrementAndGet(this) < 0) {
			LOG.warn("unexpected decrement of idle size below 0 for backend {}", backend);
		}
	}

	void incrementIdle() {
		IDLE_SIZE.incrementAndGet(this);
	}

	// == PoolMetrics ==

	@Override
	public int acquiredSize() {
		return active.size();
	}

	@Override
	public int allocatedSize() {
		return allocated;
	}

	@Override
	public int idleSize() {
		return idleSize;
	}

	@Override
	public int pendingAcquireSize() {
		return queue.size();
	}

	@Override
	public int getMaxAllocatedSize() {
		return maxConnections;
	}

	@Override
	public int getMaxPendingAcquireSize() {
		return queue.maxSize();
	}

	@Override
	public long requestCount() {
		return requestCount.sum();
	}

	@Override
	public double successRate() {
		long requests = requestCount.sum();
		if (requests == 0) {
			return 1d;
		}
		return (double) successCount.sum() / requests;
	}

	@Override
	public double averageLatency() {
		long requests = requestCount.sum();
		if (requests == 0) {
			return 0d;
		}
		return (double) totalLatency.sum() / requests;
	}

	@Override
	public String toString() {
		return "ConnectionPool{" +
				"backend='" + backend + '\'' +
				", allocated=" + allocated +
				", idle=" + idleSize +
				", active=" + active.size() +
				", pending=" + queue.size() +
				'}';
	}
}
