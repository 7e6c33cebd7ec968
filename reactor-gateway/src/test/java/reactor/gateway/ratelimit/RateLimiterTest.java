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

package reactor.gateway.ratelimit;

import java.time.Duration;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;
import reactor.gateway.GatewayConfig;
import reactor.gateway.TestUtils;
import reactor.gateway.TestUtils.RecordingEventListener;
import reactor.test.scheduler.VirtualTimeScheduler;

import static org.assertj.core.api.Assertions.*;

public class RateLimiterTest {

	VirtualTimeScheduler   vts;
	RecordingEventListener listener;
	RateLimiter            limiter;

	@BeforeEach
	void setUp() {
		vts = VirtualTimeScheduler.create();
		listener = new RecordingEventListener();
	}

	@AfterEach
	void tearDown() {
		if (limiter != null) {
			limiter.dispose();
		}
	}

	RateLimiter limiter(GatewayConfig.Builder builder) {
		limiter = new RateLimiter(builder.eventListener(listener).build());
		return limiter;
	}

	GatewayConfig.Builder fiveTokensPerSecond() {
		return TestUtils.virtualTime(vts)
		                .tokensPerWindow(5)
		                .maxBurstSize(5)
		                .windowSize(Duration.ofSeconds(1))
		                .perUserLimit(100)
		                .perServerLimit(100)
		                .enableAdaptive(false);
	}

	@Test
	void bucketAdmitsItsCapacityThenRejectsUntilRefilled() {
		limiter(fiveTokensPerSecond());

		for (int i = 0; i < 5; i++) {
			RateLimitResult result = limiter.isAllowed("u1-s1", "u1", "s1");
			assertThat(result.isAllowed()).as("request %d", i + 1).isTrue();
			assertThat(result.remaining()).isEqualTo(4 - i);
			assertThat(result.retryAfterSeconds()).isZero();
		}

		RateLimitResult sixth = limiter.isAllowed("u1-s1", "u1", "s1");
		assertThat(sixth.isAllowed()).isFalse();
		assertThat(sixth.gate()).isEqualTo(RateLimitGate.BUCKET);
		assertThat(sixth.reason()).isEqualTo("Rate limit exceeded");
		assertThat(sixth.retryAfterSeconds()).isEqualTo(1);

		vts.advanceTimeBy(Duration.ofSeconds(1));

		assertThat(limiter.isAllowed("u1-s1", "u1", "s1").isAllowed()).as("after a window").isTrue();
		assertThat(listener.events).containsExactly("rateLimitHit:BUCKET:u1-s1");
	}

	@Test
	void userQuotaIsTheFirstGate() {
		limiter(fiveTokensPerSecond().perUserLimit(1));

		assertThat(limiter.isAllowed("u1-s1", "u1", "s1").isAllowed()).isTrue();

		RateLimitResult second = limiter.isAllowed("u1-s2", "u1", "s2");
		assertThat(second.isAllowed()).isFalse();
		assertThat(second.gate()).isEqualTo(RateLimitGate.USER);
		assertThat(second.reason()).isEqualTo("User rate limit exceeded");
		assertThat(second.retryAfter()).isEqualTo(GatewayConfig.DEFAULT_PER_USER_WINDOW);
		assertThat(listener.events).containsExactly("rateLimitHit:USER:u1");

		assertThat(limiter.isAllowed("u2-s1", "u2", "s1").isAllowed()).as("other user").isTrue();
	}

	@Test
	void backendQuotaIsSharedByUsers() {
		limiter(fiveTokensPerSecond().perServerLimit(2).perServerWindow(Duration.ofSeconds(30)));

		assertThat(limiter.isAllowed("u1-s1", "u1", "s1").isAllowed()).isTrue();
		assertThat(limiter.isAllowed("u2-s1", "u2", "s1").isAllowed()).isTrue();

		RateLimitResult third = limiter.isAllowed("u3-s1", "u3", "s1");
		assertThat(third.gate()).isEqualTo(RateLimitGate.BACKEND);
		assertThat(third.reason()).isEqualTo("Backend rate limit exceeded");
		assertThat(third.retryAfterSeconds()).isEqualTo(30);

		assertThat(limiter.isAllowed("u3-s2", "u3", "s2").isAllowed()).as("other backend").isTrue();
	}

	@Test
	void rejectionChargesNoGate() {
		limiter(fiveTokensPerSecond().perUserLimit(1).perServerLimit(1));

		assertThat(limiter.isAllowed("u1-s1", "u1", "s1").isAllowed()).isTrue();
		assertThat(limiter.isAllowed("u2-s1", "u2", "s1").gate())
				.as("rejected by the backend quota")
				.isEqualTo(RateLimitGate.BACKEND);

		limiter.resetBackendLimits("s1");

		assertThat(limiter.isAllowed("u2-s1", "u2", "s1").isAllowed())
				.as("user quota untouched by the earlier rejection")
				.isTrue();
	}

	@Test
	void bucketRejectionDoesNotChargeTheUserQuota() {
		limiter(fiveTokensPerSecond().perUserLimit(2).tokensPerWindow(1).maxBurstSize(1));

		assertThat(limiter.isAllowed("u1-s1", "u1", "s1").isAllowed()).isTrue();
		assertThat(limiter.isAllowed("u1-s1", "u1", "s1").gate()).isEqualTo(RateLimitGate.BUCKET);

		assertThat(limiter.isAllowed("u1-s2", "u1", "s2").isAllowed()).as("second of two").isTrue();
		assertThat(limiter.isAllowed("u1-s3", "u1", "s3").gate()).isEqualTo(RateLimitGate.USER);
	}

	@Test
	void slidingWindowCatchesWhatTheBucketRefilled() {
		limiter(fiveTokensPerSecond().maxBurstSize(10));

		for (int i = 0; i < 5; i++) {
			assertThat(limiter.isAllowed("u1-s1", "u1", "s1").isAllowed()).isTrue();
		}
		vts.advanceTimeBy(Duration.ofMillis(600));

		RateLimitResult result = limiter.isAllowed("u1-s1", "u1", "s1");
		assertThat(result.isAllowed()).isFalse();
		assertThat(result.gate()).isEqualTo(RateLimitGate.WINDOW);

		vts.advanceTimeBy(Duration.ofMillis(400));
		assertThat(limiter.isAllowed("u1-s1", "u1", "s1").isAllowed()).as("window slid past").isTrue();
	}

	@Test
	void weightedRequests() {
		limiter(fiveTokensPerSecond());

		RateLimitResult heavy = limiter.isAllowed("u1-s1", "u1", "s1", 3);
		assertThat(heavy.isAllowed()).isTrue();
		assertThat(heavy.remaining()).isEqualTo(2);

		assertThat(limiter.isAllowed("u1-s1", "u1", "s1", 3).gate()).isEqualTo(RateLimitGate.BUCKET);
		assertThat(limiter.isAllowed("u1-s1", "u1", "s1", 2).isAllowed()).isTrue();

		assertThatIllegalArgumentException().isThrownBy(() -> limiter.isAllowed("u1-s1", "u1", "s1", 0));
	}

	@Test
	void adaptiveThrottlingReducesThenRecovers() {
		limiter(TestUtils.virtualTime(vts)
		                 .tokensPerWindow(10)
		                 .maxBurstSize(10)
		                 .windowSize(Duration.ofSeconds(1))
		                 .perUserLimit(100)
		                 .perServerLimit(100)
		                 .enableAdaptive(true)
		                 .adaptiveThreshold(0.8)
		                 .adaptiveReduction(0.5)
		                 .adaptiveRecoveryRate(0.1));

		assertThat(limiter.isAllowed("u1-s1", "u1", "s1").isAllowed()).isTrue();
		vts.advanceTimeBy(Duration.ofMillis(999));
		assertThat(limiter.isAllowed("u1-s1", "u1", "s1", 9).isAllowed()).isTrue();
		assertThat(limiter.currentLimit("u1-s1")).as("not yet due").isEqualTo(10d);

		vts.advanceTimeBy(Duration.ofMillis(1));
		assertThat(limiter.isAllowed("u1-s1", "u1", "s1").isAllowed()).isTrue();
		assertThat(limiter.currentLimit("u1-s1")).as("reduced").isEqualTo(5d);
		assertThat(listener.events).containsExactly("adjustment:u1-s1:REDUCE");

		vts.advanceTimeBy(Duration.ofSeconds(1));
		assertThat(limiter.isAllowed("u1-s1", "u1", "s1").isAllowed()).isTrue();
		assertThat(limiter.currentLimit("u1-s1")).as("recovering").isCloseTo(5.5d, within(1e-9));
		assertThat(listener.events).containsExactly("adjustment:u1-s1:REDUCE", "adjustment:u1-s1:INCREASE");

		RateLimiterMetrics metrics = limiter.metrics();
		assertThat(metrics.adaptiveAdjustments()).isEqualTo(2);
		assertThat(metrics.adaptiveKeys()).isEqualTo(1);
	}

	@Test
	void adaptiveReductionStopsAtTenPercentOfTheBurstSize() {
		limiter(fiveTokensPerSecond().tokensPerWindow(10).maxBurstSize(10).enableAdaptive(true));

		KeyState state = limiter.newKeyState(0L);
		for (int i = 1; i <= 10; i++) {
			state.bucket.tokens = 0d;
			limiter.adapt(state, i * 1000L);
		}

		assertThat(state.adaptive).isNotNull();
		assertThat(state.adaptive.currentLimit).isEqualTo(1d);
		assertThat(state.bucket.maxTokens).isEqualTo(1d);
	}

	@Test
	void adaptiveDisabledNeverAdjusts() {
		limiter(fiveTokensPerSecond());

		for (int i = 0; i < 20; i++) {
			limiter.isAllowed("u1-s1", "u1", "s1");
			vts.advanceTimeBy(Duration.ofMillis(500));
		}

		assertThat(limiter.currentLimit("u1-s1")).isEqualTo(5d);
		assertThat(limiter.metrics().adaptiveKeys()).isZero();
		assertThat(listener.count("adjustment:")).isZero();
	}

	@Test
	void resetLimits() {
		limiter(fiveTokensPerSecond().perUserLimit(1));

		assertThat(limiter.isAllowed("u1-s1", "u1", "s1", 5).isAllowed()).isTrue();
		assertThat(limiter.isAllowed("u1-s1", "u1", "s1").gate()).isEqualTo(RateLimitGate.USER);

		limiter.resetUserLimits("u1");
		assertThat(limiter.isAllowed("u1-s1", "u1", "s1").gate()).isEqualTo(RateLimitGate.BUCKET);

		limiter.resetUserLimits("u1");
		limiter.resetLimits("u1-s1");
		assertThat(limiter.isAllowed("u1-s1", "u1", "s1").isAllowed()).isTrue();
	}

	@Test
	void sweepRemovesStateIdleForTwoWindows() {
		limiter(fiveTokensPerSecond().perUserWindow(Duration.ofSeconds(10)).perServerWindow(Duration.ofSeconds(10)));

		limiter.isAllowed("u1-s1", "u1", "s1");
		RateLimiterMetrics before = limiter.metrics();
		assertThat(before.activeKeys()).isEqualTo(1);
		assertThat(before.activeUsers()).isEqualTo(1);
		assertThat(before.activeBackends()).isEqualTo(1);

		vts.advanceTimeBy(Duration.ofMillis(2000));
		assertThat(limiter.cleanup()).as("not idle yet").isZero();

		vts.advanceTimeBy(Duration.ofMillis(1));
		assertThat(limiter.cleanup()).as("composite key").isEqualTo(1);
		assertThat(limiter.metrics().activeKeys()).isZero();
		assertThat(limiter.metrics().activeUsers()).isEqualTo(1);

		vts.advanceTimeBy(Duration.ofSeconds(18));
		assertThat(limiter.cleanup()).as("user and backend quotas").isEqualTo(2);
		assertThat(limiter.metrics().activeUsers()).isZero();
		assertThat(limiter.metrics().activeBackends()).isZero();

		assertThat(limiter.isAllowed("u1-s1", "u1", "s1").isAllowed()).as("state recreated").isTrue();
		assertThat(listener.events).containsExactly("cleanup:ratelimit:0", "cleanup:ratelimit:1", "cleanup:ratelimit:2");
	}

	@Test
	void sweepRunsPeriodically() {
		limiter(fiveTokensPerSecond().rateLimiterCleanupInterval(Duration.ofSeconds(10)));

		limiter.isAllowed("u1-s1", "u1", "s1");
		vts.advanceTimeBy(Duration.ofSeconds(10));

		assertThat(listener.events).containsExactly("cleanup:ratelimit:1");

		limiter.dispose();
		vts.advanceTimeBy(Duration.ofSeconds(10));
		assertThat(listener.events).hasSize(1);
		assertThat(limiter.isDisposed()).isTrue();
	}

	@Test
	void metricsCountEveryDecision() {
		limiter(fiveTokensPerSecond());

		for (int i = 0; i < 7; i++) {
			limiter.isAllowed("u1-s1", "u1", "s1");
		}

		RateLimiterMetrics metrics = limiter.metrics();
		assertThat(metrics.totalRequests()).isEqualTo(7);
		assertThat(metrics.allowedRequests()).isEqualTo(5);
		assertThat(metrics.rejectedRequests()).isEqualTo(2);
		assertThat(metrics.rateLimitHits()).isEqualTo(2);
	}

	@Test
	void concurrentChecksNeverOverAdmit() {
		limiter(TestUtils.virtualTime(vts)
		                 .tokensPerWindow(50)
		                 .maxBurstSize(50)
		                 .perUserLimit(1000)
		                 .perServerLimit(1000)
		                 .enableAdaptive(false));

		Long admitted = Flux.range(0, 400)
		                    .parallel(8)
		                    .runOn(Schedulers.parallel())
		                    .filter(i -> limiter.isAllowed("u-s1", "u" + (i % 4), "s1").isAllowed())
		                    .sequential()
		                    .count()
		                    .block(Duration.ofSeconds(10));

		assertThat(admitted).isEqualTo(50L);
		assertThat(limiter.metrics().allowedRequests()).isEqualTo(50);
		assertThat(limiter.metrics().rejectedRequests()).isEqualTo(350);
	}
}
