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

package reactor.gateway.session;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import reactor.core.publisher.Mono;
import reactor.scheduler.clock.SchedulerClock;
import reactor.test.StepVerifier;
import reactor.test.scheduler.VirtualTimeScheduler;

import static org.assertj.core.api.Assertions.assertThat;

class CachingCredentialDirectoryTest {

	VirtualTimeScheduler       vts;
	AtomicInteger              lookups;
	CachingCredentialDirectory cache;

	@BeforeEach
	void setUp() {
		vts = VirtualTimeScheduler.create();
		lookups = new AtomicInteger();
	}

	@AfterEach
	void tearDown() {
		if (cache != null) {
			cache.dispose();
		}
	}

	CachingCredentialDirectory cache(Duration ttl, CredentialDirectory delegate) {
		cache = new CachingCredentialDirectory((u, b, c) -> {
			lookups.incrementAndGet();
			return delegate.verify(u, b, c);
		}, ttl, SchedulerClock.of(vts));
		return cache;
	}

	@Test
	void positiveAndNegativeVerdictsAreCached() {
		cache(Duration.ofSeconds(10), (u, b, c) -> Mono.just(c.equals("good")));

		StepVerifier.create(cache.verify("u1", "s1", "good")).expectNext(true).verifyComplete();
		StepVerifier.create(cache.verify("u1", "s1", "good")).expectNext(true).verifyComplete();
		StepVerifier.create(cache.verify("u1", "s1", "bad")).expectNext(false).verifyComplete();
		StepVerifier.create(cache.verify("u1", "s1", "bad")).expectNext(false).verifyComplete();

		assertThat(lookups).hasValue(2);
		assertThat(cache.size()).isEqualTo(2);
	}

	@Test
	void verdictsAreKeyedByUserBackendAndCredential() {
		cache(Duration.ofSeconds(10), (u, b, c) -> Mono.just(true));

		cache.verify("u1", "s1", "k").block();
		cache.verify("u2", "s1", "k").block();
		cache.verify("u1", "s2", "k").block();
		cache.verify("u1", "s1", "k2").block();

		assertThat(lookups).hasValue(4);
	}

	@Test
	void verdictExpiresAfterTtl() {
		cache(Duration.ofSeconds(10), (u, b, c) -> Mono.just(true));

		cache.verify("u1", "s1", "k").block();
		vts.advanceTimeBy(Duration.ofMillis(9999));
		cache.verify("u1", "s1", "k").block();
		assertThat(lookups).hasValue(1);

		vts.advanceTimeBy(Duration.ofMillis(1));
		cache.verify("u1", "s1", "k").block();
		assertThat(lookups).hasValue(2);
	}

	@Test
	void errorsAreNotCached() {
		AtomicInteger calls = new AtomicInteger();
		cache(Duration.ofSeconds(10), (u, b, c) -> calls.incrementAndGet() == 1 ?
				Mono.error(new IllegalStateException("directory down")) :
				Mono.just(true));

		StepVerifier.create(cache.verify("u1", "s1", "k")).verifyErrorMessage("directory down");
		StepVerifier.create(cache.verify("u1", "s1", "k")).expectNext(true).verifyComplete();

		assertThat(lookups).hasValue(2);
	}

	@Test
	void emptyVerdictIsCachedAsRejection() {
		cache(Duration.ofSeconds(10), (u, b, c) -> Mono.empty());

		StepVerifier.create(cache.verify("u1", "s1", "k")).expectNext(false).verifyComplete();
		StepVerifier.create(cache.verify("u1", "s1", "k")).expectNext(false).verifyComplete();
		assertThat(lookups).hasValue(1);
	}

	@Test
	void expiredVerdictsAreDropped() {
		cache(Duration.ofSeconds(10), (u, b, c) -> Mono.just(true));

		cache.verify("u1", "s1", "k").block();
		vts.advanceTimeBy(Duration.ofSeconds(5));
		cache.verify("u2", "s1", "k").block();
		assertThat(cache.size()).isEqualTo(2);

		vts.advanceTimeBy(Duration.ofSeconds(5));
		assertThat(cache.size()).isEqualTo(1);

		vts.advanceTimeBy(Duration.ofSeconds(10));
		assertThat(cache.evictExpired()).isEqualTo(1);
		assertThat(cache.size()).isZero();
	}

	@Test
	void verdictReadAfterExpiryIsLookedUpAgain() {
		AtomicInteger calls = new AtomicInteger();
		cache(Duration.ofSeconds(10), (u, b, c) -> Mono.just(calls.incrementAndGet() == 1));

		StepVerifier.create(cache.verify("u1", "s1", "k")).expectNext(true).verifyComplete();
		vts.advanceTimeBy(Duration.ofSeconds(10));
		StepVerifier.create(cache.verify("u1", "s1", "k")).expectNext(false).verifyComplete();
		StepVerifier.create(cache.verify("u1", "s1", "k")).expectNext(false).verifyComplete();

		assertThat(lookups).hasValue(2);
	}

	@Test
	void zeroTtlDisablesCaching() {
		cache(Duration.ZERO, (u, b, c) -> Mono.just(true));

		cache.verify("u1", "s1", "k").block();
		cache.verify("u1", "s1", "k").block();

		assertThat(lookups).hasValue(2);
		assertThat(cache.size()).isZero();
	}

	@Test
	void disposeForgetsVerdicts() {
		cache(Duration.ofSeconds(10), (u, b, c) -> Mono.just(true));
		cache.verify("u1", "s1", "k").block();

		cache.dispose();

		assertThat(cache.isDisposed()).isTrue();
		assertThat(cache.size()).isZero();
	}
}
