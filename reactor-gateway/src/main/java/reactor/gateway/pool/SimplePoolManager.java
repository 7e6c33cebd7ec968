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

import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicIntegerFieldUpdater;

import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Mono;
import reactor.gateway.BackendNotFoundException;
import reactor.gateway.GatewayConfig;
import reactor.gateway.GatewayEventListener;
import reactor.util.Logger;
import reactor.util.Loggers;

/**
 * The default {@link PoolManager}: one {@link ConnectionPool} per backend, a gateway-wide counter of checked out
 * connections and a per-user counter of outstanding connections.
 * <p>
 * A gateway-wide permit is taken when a connection is handed to an acquire and given back on release. A user permit
 * is taken when the acquire is admitted into a backend's queue and given back when the acquire fails, is
 * cancelled, or when its connection is released.
 */
public final class SimplePoolManager implements PoolManager {

	static final Logger LOG = Loggers.getLogger(SimplePoolManager.class);

	final GatewayConfig                       config;
	final TransportAllocator                  allocator;
	final GatewayEventListener                listener;
	final ConcurrentMap<String, ConnectionPool> pools       = new ConcurrentHashMap<>();
	final ConcurrentMap<String, Integer>        outstanding = new ConcurrentHashMap<>();
	final Disposable                            cleanupTask;

	volatile int totalActive;
	static final AtomicIntegerFieldUpdater<SimplePoolManager> TOTAL_ACTIVE =
			AtomicIntegerFieldUpdater.newUpdater(SimplePoolManager.class, "totalActive");

	volatile int disposed;
	static final AtomicIntegerFieldUpdater<SimplePoolManager> DISPOSED =
			AtomicIntegerFieldUpdater.newUpdater(SimplePoolManager.class, "disposed");

	/**
	 * Create a {@link SimplePoolManager} whose connections are logical slots that don't open any transport.
	 *
	 * @param config the gateway configuration
	 */
	public SimplePoolManager(GatewayConfig config) {
		this(config, TransportAllocator.LOGICAL);
	}

	public SimplePoolManager(GatewayConfig config, TransportAllocator allocator) {
		this.config = Objects.requireNonNull(config, "config");
		this.allocator = Objects.requireNonNull(allocator, "allocator");
		this.listener = config.eventListener();
		long interval = config.cleanupInterval().toMillis();
		if (interval > 0) {
			this.cleanupTask = config.timer().schedulePeriodically(this::cleanup, interval, interval, TimeUnit.MILLISECONDS);
		}
		else {
			this.cleanupTask = Disposables.disposed();
		}
	}

	@Override
	public void initializePool(String backend) {
		Objects.requireNonNull(backend, "backend");
		ConnectionPool pool = new ConnectionPool(backend, this, config, allocator);
		if (pools.putIfAbsent(backend, pool) == null) {
			LOG.debug("Initialized pool of backend {} with at most {} connections", backend, pool.maxConnections);
			listener.onPoolInitialized(backend, pool.maxConnections);
		}
	}

	@Override
	public Set<String> backends() {
		return Collections.unmodifiableSet(pools.keySet());
	}

	@Override
	public Mono<PooledConnection> acquire(String backend, String userId, String requestId) {
		return Mono.defer(() -> {
			ConnectionPool pool = pools.get(backend);
			if (pool == null) {
				return Mono.error(new BackendNotFoundException(backend));
			}
			return pool.acquire(userId, requestId);
		});
	}

	@Override
	public Mono<Void> release(PooledConnection lease, boolean success) {
		return Mono.<Void>fromRunnable(() -> {
			if (!lease.markReleased()) {
				LOG.debug("Ignoring second release of {}", lease);
				return;
			}
			ConnectionPool pool = pools.get(lease.backend());
			long latency;
			try {
				latency = pool == null ? 0L : pool.release(lease, success);
			}
			finally {
				releaseGlobalPermit();
				releaseUserPermit(lease.userId);
			}
			listener.onConnectionReleased(lease.backend(), lease.connection.id, latency, success);
			if (pool != null) {
				pool.drain();
			}
			//a freed gateway-wide permit may unblock other backends
			for (ConnectionPool other : pools.values()) {
				if (other != pool && other.pendingAcquireSize() > 0) {
					other.drain();
				}
			}
		})
		.onErrorResume(e -> {
			LOG.warn("Error while releasing " + lease, e);
			return Mono.empty();
		});
	}

	@Override
	public CircuitBreaker circuitBreaker(String backend) {
		return pool(backend).breaker;
	}

	@Override
	public PoolMetrics metrics(String backend) {
		return pool(backend);
	}

	ConnectionPool pool(String backend) {
		ConnectionPool pool = pools.get(backend);
		if (pool == null) {
			throw new BackendNotFoundException(backend);
		}
		return pool;
	}

	@Override
	public int totalActiveConnections() {
		return totalActive;
	}

	@Override
	public int outstandingConnections(String userId) {
		Integer count = outstanding.get(userId);
		return count == null ? 0 : count;
	}

	@Override
	public void cleanup() {
		int removed = 0;
		for (ConnectionPool pool : pools.values()) {
			try {
				removed += pool.evict();
			}
			catch (RuntimeException e) {
				LOG.warn("Error while sweeping the pool of backend " + pool.backend, e);
			}
		}
		if (removed > 0) {
			LOG.debug("Pool sweep removed {} idle connections and expired acquires", removed);
		}
		listener.onCleanupCompleted("pool", removed);
	}

	@Override
	public Mono<Void> disposeLater() {
		return Mono.defer(() -> {
			if (!DISPOSED.compareAndSet(this, 0, 1)) {
				return Mono.empty();
			}
			cleanupTask.dispose();
			Mono<Void> all = Mono.empty();
			for (ConnectionPool pool : pools.values()) {
				all = all.and(pool.disposeLater());
			}
			return all;
		});
	}

	@Override
	public boolean isDisposed() {
		return disposed == 1;
	}

	boolean tryAcquireGlobalPermit() {
		int max = config.maxTotalConnections();
		for (;;) {
			int t = totalActive;
			if (t >= max) {
				return false;
			}
			if (TOTAL_ACTIVE.compareAndSet(this, t, t + 1)) {
				return true;
			}
		}
	}

	void releaseGlobalPermit() {
		for (;;) {
			int t = totalActive;
			if (t <= 0) {
				LOG.warn("unexpected release of a gateway-wide permit while none is held");
				return;
			}
			if (TOTAL_ACTIVE.compareAndSet(this, t, t - 1)) {
				return;
			}
		}
	}

	boolean tryAcquireUserPermit(String userId) {
		int max = config.maxConcurrentRequestsPerUser();
		boolean[] granted = new boolean[1];
		outstanding.compute(userId, (k, count) -> {
			int c = count == null ? 0 : count;
			if (c >= max) {
				return count;
			}
			granted[0] = true;
			return c + 1;
		});
		return granted[0];
	}

	void releaseUserPermit(String userId) {
		//dropping the entry at zero keeps the map bounded to users with outstanding connections
		outstanding.computeIfPresent(userId, (k, count) -> count <= 1 ? null : count - 1);
	}

	@Override
	public String toString() {
		return "SimplePoolManager{" +
				"backends=" + pools.keySet() +
				", totalActive=" + totalActive +
				'}';
	}
}
