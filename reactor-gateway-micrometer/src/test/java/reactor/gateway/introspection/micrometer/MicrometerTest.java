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

package reactor.gateway.introspection.micrometer;

import java.time.Duration;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import reactor.core.publisher.Mono;
import reactor.gateway.GatewayConfig;
import reactor.gateway.pool.PooledConnection;
import reactor.gateway.pool.SimplePoolManager;
import reactor.gateway.ratelimit.RateLimiter;
import reactor.gateway.session.Session;
import reactor.gateway.session.SessionRegistry;

import static org.assertj.core.api.Assertions.assertThat;

class MicrometerTest {

	@Test
	void metersRegisteredForGauge() {
		SimpleMeterRegistry r = new SimpleMeterRegistry();
		SimplePoolManager manager = new SimplePoolManager(GatewayConfig.builder().build());
		try {
			manager.initializePool("testGauge");

			Micrometer.gaugesOf(manager.metrics("testGauge"), "testGauge", r);

			assertThat(r.getMeters().stream()
				.map(m -> {
					String name = m.getId().getName();
					String tags = m.getId().getTags().isEmpty() ? "" : String.valueOf(m.getId().getTags());
					return name + tags;
				}))
				.containsExactlyInAnyOrder(
					"reactor.gateway.connections.acquired[tag(backend=testGauge)]",
					"reactor.gateway.connections.allocated[tag(backend=testGauge)]",
					"reactor.gateway.connections.idle[tag(backend=testGauge)]",
					"reactor.gateway.connections.pendingAcquire[tag(backend=testGauge)]"
				);

			manager.acquire("testGauge", "u1", "r1").block(Duration.ofSeconds(1));
			assertThat(r.get("reactor.gateway.connections.acquired").gauge().value()).isEqualTo(1d);
			assertThat(r.get("reactor.gateway.connections.allocated").gauge().value()).isEqualTo(1d);
			assertThat(r.get("reactor.gateway.connections.idle").gauge().value()).isZero();
		}
		finally {
			manager.dispose();
		}
	}

	@Test
	void metersRegisteredForRecorder() {
		SimpleMeterRegistry r = new SimpleMeterRegistry();
		GatewayConfig config = GatewayConfig.builder()
			.metricsRecorder(Micrometer.recorder(r))
			.build();
		SimplePoolManager manager = new SimplePoolManager(config);
		try {
			manager.initializePool("testRecorder");
			assertThat(r.getMeters()).as("meters are created on first use").isEmpty();

			PooledConnection lease = manager.acquire("testRecorder", "u1", "r1").block(Duration.ofSeconds(1));
			manager.release(lease, true).block(Duration.ofSeconds(1));

			assertThat(r.getMeters().stream()
				.map(m -> {
					String name = m.getId().getName();
					String tags = m.getId().getTags().isEmpty() ? "" : String.valueOf(m.getId().getTags());
					return name + tags;
				}))
				.containsExactlyInAnyOrder(
					"reactor.gateway.allocation[tag(backend=testRecorder), tag(outcome=success)]",
					"reactor.gateway.allocation[tag(backend=testRecorder), tag(outcome=failure)]",
					"reactor.gateway.pending[tag(backend=testRecorder), tag(outcome=success)]",
					"reactor.gateway.pending[tag(backend=testRecorder), tag(outcome=failure)]",
					"reactor.gateway.release[tag(backend=testRecorder), tag(outcome=success)]",
					"reactor.gateway.release[tag(backend=testRecorder), tag(outcome=failure)]",
					"reactor.gateway.connections.summary.idleness[tag(backend=testRecorder)]",
					"reactor.gateway.connections.summary.lifetime[tag(backend=testRecorder)]"
				);
			assertThat(r.get("reactor.gateway.allocation").tag("outcome", "success").timer().count()).isEqualTo(1);
			assertThat(r.get("reactor.gateway.release").tag("outcome", "success").timer().count()).isEqualTo(1);
			assertThat(r.get("reactor.gateway.release").tag("outcome", "failure").timer().count()).isZero();
		}
		finally {
			manager.dispose();
		}
	}

	@Test
	void eventListenerCountsRateLimitHits() {
		SimpleMeterRegistry r = new SimpleMeterRegistry();
		GatewayConfig config = Micrometer.instrument(GatewayConfig.builder().perUserLimit(1), r).build();
		RateLimiter limiter = new RateLimiter(config);
		try {
			limiter.isAllowed("u1-s1", "u1", "s1");
			limiter.isAllowed("u1-s1", "u1", "s1");
			limiter.isAllowed("u1-s1", "u1", "s1");

			assertThat(r.get("reactor.gateway.ratelimit.hits").tag("gate", "user").counter().count()).isEqualTo(2d);

			limiter.cleanup();
			assertThat(r.get("reactor.gateway.cleanup.removed").tag("component", "ratelimit").counter().count()).isZero();
		}
		finally {
			limiter.dispose();
		}
	}

	@Test
	void eventListenerCountsSessions() {
		SimpleMeterRegistry r = new SimpleMeterRegistry();
		GatewayConfig config = Micrometer.instrument(GatewayConfig.builder(), r).build();
		SimplePoolManager manager = new SimplePoolManager(config);
		SessionRegistry registry = new SessionRegistry(manager, (u, b, c) -> Mono.just(true), config);
		try {
			manager.initializePool("s1");
			Session session = registry.createSession("u1", "s1", "key").block(Duration.ofSeconds(1));
			assertThat(session).isNotNull();
			registry.terminate(session.sessionId()).block(Duration.ofSeconds(1));

			assertThat(r.get("reactor.gateway.sessions.created").tag("backend", "s1").counter().count()).isEqualTo(1d);
			assertThat(r.get("reactor.gateway.sessions.closed")
				.tag("backend", "s1")
				.tag("reason", "terminated")
				.counter().count()).isEqualTo(1d);
		}
		finally {
			registry.dispose();
			manager.dispose();
		}
	}
}
