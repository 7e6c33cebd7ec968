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

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.gateway.BackendNotFoundException;
import reactor.gateway.CircuitOpenException;
import reactor.gateway.ErrorKind;
import reactor.gateway.GatewayConfig;
import reactor.gateway.GatewayException;
import reactor.gateway.PoolExhaustedException;
import reactor.gateway.PoolShutdownException;
import reactor.gateway.QueueFullException;
import reactor.gateway.QueueTimeoutException;
import reactor.gateway.TestUtils;
import reactor.gateway.TestUtils.RecordingEventListener;
import reactor.gateway.UserRateLimitedException;
import reactor.test.StepVerifier;
import reactor.test.scheduler.VirtualTimeScheduler;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.await;

public class SimplePoolManagerTest {

	VirtualTimeScheduler   vts;
	RecordingEventListener listener;
	SimplePoolManager      manager;

	@BeforeEach
	void setUp() {
		vts = VirtualTimeScheduler.create();
		listener = new RecordingEventListener();
	}

	@AfterEach
	void tearDown() {
		if (manager != null) {
			manager.disposeLater().block(Duration.ofSeconds(5));
		}
	}

	SimplePoolManager manager(GatewayConfig.Builder builder, String... backends) {
		return manager(builder, TransportAllocator.LOGICAL, backends);
	}

	SimplePoolManager manager(GatewayConfig.Builder builder, TransportAllocator allocator, String... backends) {
		manager = new SimplePoolManager(builder.eventListener(listener).build(), allocator);
		for (String backend : backends) {
			manager.initializePool(backend);
		}
		return manager;
	}

	@Test
	void initializePoolIsIdempotent() {
		manager(TestUtils.virtualTime(vts).maxConnectionsPerServer(7), "s1");
		manager.initializePool("s1");

		assertThat(manager.backends()).containsExactly("s1");
		assertThat(manager.metrics("s1").getMaxAllocatedSize()).isEqualTo(7);
		assertThat(listener.events).containsExactly("poolInitialized:s1:7");
	}

	@Test
	void acquireUnknownBackend() {
		manager(TestUtils.virtualTime(vts), "s1");

		StepVerifier.create(manager.acquire("nope", "u1", "r1"))
		            .expectErrorSatisfies(e -> assertThat(e)
				            .isInstanceOf(BackendNotFoundException.class)
				            .hasMessage("Unknown backend 'nope'"))
		            .verify(Duration.ofSeconds(1));
		assertThatExceptionOfType(BackendNotFoundException.class).isThrownBy(() -> manager.metrics("nope"));
	}

	@Test
	void thirdAcquireWaitsForARelease() {
		manager(TestUtils.virtualTime(vts).maxConnectionsPerServer(2), "s1");

		PooledConnection first = manager.acquire("s1", "u1", "r1").block(Duration.ofSeconds(1));
		PooledConnection second = manager.acquire("s1", "u1", "r2").block(Duration.ofSeconds(1));
		assertThat(first).isNotNull();
		assertThat(second).isNotNull();
		assertThat(first.connection()).isNotSameAs(second.connection());

		AtomicReference<PooledConnection> third = new AtomicReference<>();
		manager.acquire("s1", "u1", "r3").subscribe(third::set);

		assertThat(third.get()).as("third acquire served before release").isNull();
		assertThat(manager.metrics("s1").pendingAcquireSize()).isEqualTo(1);
		assertThat(manager.metrics("s1").allocatedSize()).isEqualTo(2);

		manager.release(first, true).block(Duration.ofSeconds(1));

		assertThat(third.get()).as("third acquire served after release").isNotNull();
		assertThat(third.get().connection()).as("reuses the released connection").isSameAs(first.connection());
		assertThat(third.get().requestId()).isEqualTo("r3");
		assertThat(manager.metrics("s1").pendingAcquireSize()).isZero();
		assertThat(manager.metrics("s1").allocatedSize()).isEqualTo(2);
		assertThat(manager.totalActiveConnections()).isEqualTo(2);
	}

	@Test
	void zeroQueueFailsFastWithQueueFull() {
		manager(TestUtils.virtualTime(vts).maxConnectionsPerServer(1).queueMaxSize(0), "s1");

		manager.acquire("s1", "u1", "r1").block(Duration.ofSeconds(1));

		StepVerifier.create(manager.acquire("s1", "u1", "r2"))
		            .expectErrorSatisfies(e -> {
			            assertThat(e).isInstanceOf(QueueFullException.class);
			            assertThat(((GatewayException) e).kind()).isEqualTo(ErrorKind.QUEUE_FULL);
			            assertThat(((QueueFullException) e).isGatewayCeiling()).isFalse();
		            })
		            .verify(Duration.ofSeconds(1));
		assertThat(manager.outstandingConnections("u1")).as("rejected acquire gives back its user permit").isEqualTo(1);
	}

	@Test
	void fullQueueCullsTheMostRecentAcquire() {
		manager(TestUtils.virtualTime(vts).maxConnectionsPerServer(1).queueMaxSize(1), "s1");

		manager.acquire("s1", "u1", "r1").block(Duration.ofSeconds(1));
		AtomicReference<Throwable> waiting = new AtomicReference<>();
		manager.acquire("s1", "u2", "r2").subscribe(null, waiting::set);

		StepVerifier.create(manager.acquire("s1", "u3", "r3"))
		            .verifyError(QueueFullException.class);
		assertThat(waiting.get()).as("older waiter kept").isNull();
		assertThat(manager.metrics("s1").pendingAcquireSize()).isEqualTo(1);
	}

	@Test
	void gatewayWideCeilingQueuesAcrossBackends() {
		manager(TestUtils.virtualTime(vts).maxConnectionsPerServer(2).maxTotalConnections(2), "s1", "s2");

		PooledConnection first = manager.acquire("s1", "u1", "r1").block(Duration.ofSeconds(1));
		manager.acquire("s1", "u2", "r2").block(Duration.ofSeconds(1));
		assertThat(manager.totalActiveConnections()).isEqualTo(2);

		AtomicReference<PooledConnection> other = new AtomicReference<>();
		manager.acquire("s2", "u3", "r3").subscribe(other::set);
		assertThat(other.get()).isNull();
		assertThat(manager.metrics("s2").pendingAcquireSize()).isEqualTo(1);

		manager.release(first, true).block(Duration.ofSeconds(1));

		assertThat(other.get()).as("served once a gateway-wide permit is freed").isNotNull();
		assertThat(other.get().backend()).isEqualTo("s2");
		assertThat(manager.totalActiveConnections()).isEqualTo(2);
	}

	@Test
	void gatewayWideCeilingWithoutQueueIsQueueFull() {
		manager(TestUtils.virtualTime(vts).maxTotalConnections(1).queueMaxSize(0), "s1", "s2");

		manager.acquire("s1", "u1", "r1").block(Duration.ofSeconds(1));

		StepVerifier.create(manager.acquire("s2", "u1", "r2"))
		            .expectErrorSatisfies(e -> {
			            assertThat(e).isExactlyInstanceOf(QueueFullException.class)
			                         .isInstanceOf(PoolExhaustedException.class);
			            assertThat(((GatewayException) e).kind()).isEqualTo(ErrorKind.QUEUE_FULL);
			            assertThat(((QueueFullException) e).isGatewayCeiling()).isTrue();
		            })
		            .verify(Duration.ofSeconds(1));
	}

	@Test
	void queuedAcquireTimesOut() {
		manager(TestUtils.virtualTime(vts).maxConnectionsPerServer(1).requestTimeout(Duration.ofSeconds(5)), "s1");

		manager.acquire("s1", "u1", "r1").block(Duration.ofSeconds(1));
		AtomicReference<Throwable> error = new AtomicReference<>();
		manager.acquire("s1", "u2", "r2").subscribe(null, error::set);

		vts.advanceTimeBy(Duration.ofMillis(4999));
		assertThat(error.get()).isNull();

		vts.advanceTimeBy(Duration.ofMillis(1));
		assertThat(error.get())
				.isInstanceOf(QueueTimeoutException.class)
				.hasMessageContaining("5000ms");
		assertThat(manager.metrics("s1").pendingAcquireSize()).isZero();
		assertThat(manager.outstandingConnections("u2")).isZero();
	}

	@Test
	void waitersAreServedInArrivalOrder() {
		manager(TestUtils.virtualTime(vts).maxConnectionsPerServer(1), "s1");

		PooledConnection first = manager.acquire("s1", "u0", "r0").block(Duration.ofSeconds(1));
		List<PooledConnection> served = new CopyOnWriteArrayList<>();
		for (int i = 1; i <= 3; i++) {
			manager.acquire("s1", "u" + i, "r" + i).subscribe(served::add);
		}
		assertThat(served).isEmpty();

		manager.release(first, true).block(Duration.ofSeconds(1));
		manager.release(served.get(0), true).block(Duration.ofSeconds(1));
		manager.release(served.get(1), true).block(Duration.ofSeconds(1));

		assertThat(served).extracting(PooledConnection::requestId)
		                  .containsExactly("r1", "r2", "r3");
	}

	@Test
	void perUserCeilingCountsWaitingAcquires() {
		manager(TestUtils.virtualTime(vts).maxConnectionsPerServer(1).maxConcurrentRequestsPerUser(2), "s1");

		PooledConnection first = manager.acquire("s1", "u1", "r1").block(Duration.ofSeconds(1));
		AtomicReference<PooledConnection> waiting = new AtomicReference<>();
		manager.acquire("s1", "u1", "r2").subscribe(waiting::set);
		assertThat(manager.outstandingConnections("u1")).isEqualTo(2);

		StepVerifier.create(manager.acquire("s1", "u1", "r3"))
		            .expectErrorSatisfies(e -> {
			            assertThat(e).isInstanceOf(UserRateLimitedException.class);
			            assertThat(((UserRateLimitedException) e).userId()).isEqualTo("u1");
			            assertThat(((GatewayException) e).retryAfter()).isNull();
		            })
		            .verify(Duration.ofSeconds(1));
		assertThat(manager.metrics("s1").pendingAcquireSize()).as("rejected before queueing").isEqualTo(1);

		manager.release(first, true).block(Duration.ofSeconds(1));
		assertThat(waiting.get()).isNotNull();
		assertThat(manager.outstandingConnections("u1")).isEqualTo(1);

		manager.release(waiting.get(), true).block(Duration.ofSeconds(1));
		assertThat(manager.outstandingConnections("u1")).isZero();
	}

	@Test
	void otherUsersAreNotAffectedByAUserCeiling() {
		manager(TestUtils.virtualTime(vts).maxConcurrentRequestsPerUser(1), "s1");

		manager.acquire("s1", "u1", "r1").block(Duration.ofSeconds(1));

		StepVerifier.create(manager.acquire("s1", "u1", "r2"))
		            .verifyError(UserRateLimitedException.class);
		StepVerifier.create(manager.acquire("s1", "u2", "r3"))
		            .expectNextCount(1)
		            .verifyComplete();
	}

	@Test
	void failedReleasesOpenTheCircuit() {
		manager(TestUtils.virtualTime(vts)
		                 .circuitBreakerThreshold(2)
		                 .circuitBreakerTimeout(Duration.ofSeconds(10)), "s1");

		for (int i = 0; i < 2; i++) {
			PooledConnection lease = manager.acquire("s1", "u1", "r" + i).block(Duration.ofSeconds(1));
			manager.release(lease, false).block(Duration.ofSeconds(1));
		}
		assertThat(manager.circuitBreaker("s1").state()).isEqualTo(CircuitBreaker.State.OPEN);

		StepVerifier.create(manager.acquire("s1", "u1", "blocked"))
		            .expectErrorSatisfies(e -> {
			            assertThat(e).isInstanceOf(CircuitOpenException.class);
			            assertThat(((GatewayException) e).retryAfterSeconds()).isEqualTo(10);
		            })
		            .verify(Duration.ofSeconds(1));
		assertThat(manager.outstandingConnections("u1")).isZero();

		vts.advanceTimeBy(Duration.ofSeconds(10));
		PooledConnection probe = manager.acquire("s1", "u1", "probe").block(Duration.ofSeconds(1));
		assertThat(probe).isNotNull();
		StepVerifier.create(manager.acquire("s1", "u2", "during-probe"))
		            .verifyError(CircuitOpenException.class);

		manager.release(probe, true).block(Duration.ofSeconds(1));
		assertThat(manager.circuitBreaker("s1").state()).isEqualTo(CircuitBreaker.State.CLOSED);
		assertThat(manager.metrics("s1").requestCount()).isEqualTo(3);
		assertThat(manager.metrics("s1").successRate()).isEqualTo(1d / 3d);
	}

	@Test
	void allocationFailureIsPropagatedAndCounted() {
		AtomicInteger attempts = new AtomicInteger();
		TransportAllocator failing = backend -> {
			attempts.incrementAndGet();
			return Mono.error(new IllegalStateException("boom"));
		};
		manager(TestUtils.virtualTime(vts), failing, "s1");

		StepVerifier.create(manager.acquire("s1", "u1", "r1"))
		            .verifyErrorMessage("boom");

		assertThat(attempts).hasValue(1);
		assertThat(manager.metrics("s1").allocatedSize()).isZero();
		assertThat(manager.circuitBreaker("s1").failureCount()).isEqualTo(1);
		assertThat(manager.totalActiveConnections()).isZero();
		assertThat(manager.outstandingConnections("u1")).isZero();
	}

	@Test
	void allocationTimeout() {
		manager(TestUtils.virtualTime(vts).connectionTimeout(Duration.ofSeconds(2)),
				backend -> Mono.never(), "s1");

		AtomicReference<Throwable> error = new AtomicReference<>();
		manager.acquire("s1", "u1", "r1").subscribe(null, error::set);
		assertThat(error.get()).isNull();

		vts.advanceTimeBy(Duration.ofSeconds(2));

		assertThat(error.get()).isInstanceOf(java.util.concurrent.TimeoutException.class);
		assertThat(manager.metrics("s1").allocatedSize()).isZero();
		assertThat(manager.circuitBreaker("s1").failureCount()).isEqualTo(1);
	}

	@Test
	void idleConnectionsAreReapedBySweep() {
		List<Disposable> transports = new ArrayList<>();
		TransportAllocator tracking = backend -> Mono.fromSupplier(() -> {
			Disposable d = Disposables.single();
			transports.add(d);
			return d;
		});
		manager(TestUtils.virtualTime(vts)
		                 .idleTimeout(Duration.ofSeconds(10))
		                 .cleanupInterval(Duration.ofSeconds(30)),
				tracking, "s1");

		PooledConnection lease = manager.acquire("s1", "u1", "r1").block(Duration.ofSeconds(1));
		manager.release(lease, true).block(Duration.ofSeconds(1));
		assertThat(manager.metrics("s1").idleSize()).isEqualTo(1);

		vts.advanceTimeBy(Duration.ofSeconds(30));

		assertThat(manager.metrics("s1").idleSize()).isZero();
		assertThat(manager.metrics("s1").allocatedSize()).isZero();
		assertThat(transports).hasSize(1);
		assertThat(transports.get(0).isDisposed()).as("transport closed").isTrue();
		assertThat(listener.events).contains("cleanup:pool:1");
	}

	@Test
	void deadIdleConnectionIsReplaced() {
		List<Disposable> transports = new ArrayList<>();
		TransportAllocator tracking = backend -> Mono.fromSupplier(() -> {
			Disposable d = Disposables.single();
			transports.add(d);
			return d;
		});
		manager(TestUtils.virtualTime(vts), tracking, "s1");

		PooledConnection first = manager.acquire("s1", "u1", "r1").block(Duration.ofSeconds(1));
		manager.release(first, true).block(Duration.ofSeconds(1));
		transports.get(0).dispose();

		PooledConnection second = manager.acquire("s1", "u1", "r2").block(Duration.ofSeconds(1));

		assertThat(second.connection()).isNotSameAs(first.connection());
		assertThat(second.isValid()).isTrue();
		assertThat(manager.metrics("s1").allocatedSize()).isEqualTo(1);
	}

	@Test
	void invalidatedLeaseIsDiscardedOnRelease() {
		manager(TestUtils.virtualTime(vts), "s1");

		PooledConnection lease = manager.acquire("s1", "u1", "r1").block(Duration.ofSeconds(1));
		lease.invalidate();
		manager.release(lease, true).block(Duration.ofSeconds(1));

		assertThat(manager.metrics("s1").idleSize()).isZero();
		assertThat(manager.metrics("s1").allocatedSize()).isZero();
	}

	@Test
	void secondReleaseIsANoOp() {
		manager(TestUtils.virtualTime(vts), "s1");

		PooledConnection lease = manager.acquire("s1", "u1", "r1").block(Duration.ofSeconds(1));
		vts.advanceTimeBy(Duration.ofMillis(250));
		manager.release(lease, true).block(Duration.ofSeconds(1));
		manager.release(lease, false).block(Duration.ofSeconds(1));

		assertThat(lease.isReleased()).isTrue();
		assertThat(manager.totalActiveConnections()).isZero();
		assertThat(manager.outstandingConnections("u1")).isZero();
		assertThat(manager.metrics("s1").idleSize()).isEqualTo(1);
		assertThat(manager.metrics("s1").requestCount()).isEqualTo(1);
		assertThat(manager.metrics("s1").averageLatency()).isEqualTo(250d);
		assertThat(manager.circuitBreaker("s1").failureCount()).isZero();
		assertThat(listener.count("released:")).isEqualTo(1);
	}

	@Test
	void cancelledWaiterLeavesTheQueue() {
		manager(TestUtils.virtualTime(vts).maxConnectionsPerServer(1), "s1");

		PooledConnection first = manager.acquire("s1", "u1", "r1").block(Duration.ofSeconds(1));
		Disposable waiter = manager.acquire("s1", "u2", "r2").subscribe();
		assertThat(manager.metrics("s1").pendingAcquireSize()).isEqualTo(1);

		waiter.dispose();

		assertThat(manager.metrics("s1").pendingAcquireSize()).isZero();
		assertThat(manager.outstandingConnections("u2")).isZero();

		manager.release(first, true).block(Duration.ofSeconds(1));
		assertThat(manager.metrics("s1").idleSize()).as("nobody took the released connection").isEqualTo(1);
	}

	@Test
	void disposeFailsWaitersAndInvalidatesLeases() {
		manager(TestUtils.virtualTime(vts).maxConnectionsPerServer(1), "s1");

		PooledConnection first = manager.acquire("s1", "u1", "r1").block(Duration.ofSeconds(1));
		AtomicReference<Throwable> error = new AtomicReference<>();
		manager.acquire("s1", "u2", "r2").subscribe(null, error::set);

		manager.disposeLater().block(Duration.ofSeconds(1));

		assertThat(manager.isDisposed()).isTrue();
		assertThat(error.get()).isInstanceOf(PoolShutdownException.class);
		assertThat(first.isValid()).as("lease invalidated by shutdown").isFalse();

		manager.release(first, true).block(Duration.ofSeconds(1));
		assertThat(manager.totalActiveConnections()).isZero();
		assertThat(manager.metrics("s1").allocatedSize()).isZero();

		StepVerifier.create(manager.acquire("s1", "u1", "r3"))
		            .verifyError(PoolShutdownException.class);
	}

	@Test
	void ceilingsHoldUnderConcurrentLoad() {
		manager = new SimplePoolManager(GatewayConfig.builder()
		                                             .maxConnectionsPerServer(4)
		                                             .maxConcurrentRequestsPerUser(1000)
		                                             .build());
		manager.initializePool("s1");

		AtomicInteger inUse = new AtomicInteger();
		AtomicInteger maxInUse = new AtomicInteger();
		Flux.range(0, 500)
		    .flatMap(i -> manager.acquire("s1", "u" + (i % 50), "r" + i)
		                         .publishOn(Schedulers.parallel())
		                         .flatMap(lease -> {
			                         int n = inUse.incrementAndGet();
			                         maxInUse.accumulateAndGet(n, Math::max);
			                         return Mono.delay(Duration.ofMillis(1))
			                                    .then(Mono.defer(() -> {
				                                    inUse.decrementAndGet();
				                                    return manager.release(lease, true);
			                                    }));
		                         }))
		    .blockLast(Duration.ofSeconds(30));

		await().atMost(Duration.ofSeconds(5))
		       .untilAsserted(() -> assertThat(manager.totalActiveConnections()).isZero());
		assertThat(maxInUse.get()).isLessThanOrEqualTo(4);
		assertThat(manager.metrics("s1").allocatedSize()).isLessThanOrEqualTo(4);
		assertThat(manager.metrics("s1").pendingAcquireSize()).isZero();
		assertThat(manager.metrics("s1").requestCount()).isEqualTo(500);
	}
}
