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

import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;

import org.jspecify.annotations.Nullable;

import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.gateway.GatewayConfig;
import reactor.gateway.GatewayEventListener;
import reactor.util.Logger;
import reactor.util.Loggers;

/**
 * Admission gate evaluating, in order and stopping at the first rejection:
 * <ol>
 *     <li>the {@link RateLimitGate#USER per-user quota}</li>
 *     <li>the {@link RateLimitGate#BACKEND per-backend quota}</li>
 *     <li>the {@link RateLimitGate#BUCKET token bucket} of the composite key</li>
 *     <li>the {@link RateLimitGate#WINDOW segmented sliding window} of the composite key</li>
 * </ol>
 * A request is charged against all four only once all four admitted it.
 * <p>
 * When adaptive throttling is enabled, each admission samples the load of the key's bucket and, once per window,
 * the bucket capacity shrinks when the average load is above the threshold or grows back when it is below half of it.
 * <p>
 * State is created lazily per user, backend and composite key, and is reaped by a periodic sweep once idle for two
 * of its windows. Each state object is guarded by its own monitor, taken in user, backend, composite key order.
 */
public final class RateLimiter implements Disposable {

	static final Logger LOG = Loggers.getLogger(RateLimiter.class);

	final GatewayConfig        config;
	final Clock                clock;
	final GatewayEventListener listener;
	final Disposable           cleanupTask;

	final ConcurrentMap<String, QuotaState> userQuotas    = new ConcurrentHashMap<>();
	final ConcurrentMap<String, QuotaState> backendQuotas = new ConcurrentHashMap<>();
	final ConcurrentMap<String, KeyState>   keys          = new ConcurrentHashMap<>();

	final LongAdder totalRequests       = new LongAdder();
	final LongAdder allowedRequests     = new LongAdder();
	final LongAdder rejectedRequests    = new LongAdder();
	final LongAdder rateLimitHits       = new LongAdder();
	final LongAdder adaptiveAdjustments = new LongAdder();

	volatile boolean disposed;

	public RateLimiter(GatewayConfig config) {
		this.config = Objects.requireNonNull(config, "config");
		this.clock = config.clock();
		this.listener = config.eventListener();
		long interval = config.rateLimiterCleanupInterval().toMillis();
		if (interval > 0) {
			this.cleanupTask = config.timer().schedulePeriodically(this::cleanup, interval, interval, TimeUnit.MILLISECONDS);
		}
		else {
			this.cleanupTask = Disposables.disposed();
		}
	}

	/**
	 * Check a request of weight 1.
	 *
	 * @see #isAllowed(String, String, String, int)
	 */
	public RateLimitResult isAllowed(String key, String userId, String backend) {
		return isAllowed(key, userId, backend, 1);
	}

	/**
	 * Check and, if admitted, charge a request against the quotas of its user and backend and the bucket and window
	 * of its composite key. The quotas count requests, the bucket and window count weight.
	 *
	 * @param key the composite key, typically {@code userId + "-" + backend}
	 * @param userId the user issuing the request
	 * @param backend the backend targeted by the request
	 * @param weight the cost of the request, strictly positive
	 * @return the verdict, naming the first gate that blocked in case of rejection
	 */
	public RateLimitResult isAllowed(String key, String userId, String backend, int weight) {
		Objects.requireNonNull(key, "key");
		Objects.requireNonNull(userId, "userId");
		Objects.requireNonNull(backend, "backend");
		if (weight <= 0) {
			throw new IllegalArgumentException("weight must be strictly positive, got " + weight);
		}
		totalRequests.increment();

		for (;;) {
			long now = clock.millis();
			QuotaState user = userQuotas.computeIfAbsent(userId,
					k -> new QuotaState(config.perUserLimit(), config.perUserWindow().toMillis(), now));
			QuotaState server = backendQuotas.computeIfAbsent(backend,
					k -> new QuotaState(config.perServerLimit(), config.perServerWindow().toMillis(), now));
			KeyState state = keys.computeIfAbsent(key, k -> newKeyState(now));

			RateLimitResult result;
			Adjustment adjustment = null;
			synchronized (user) {
				synchronized (server) {
					synchronized (state) {
						if (user.evicted || server.evicted || state.evicted) {
							//lost a race with the sweep or a reset, start over with fresh state
							continue;
						}
						state.lastAccessAt = now;
						if (!user.check(now)) {
							result = RateLimitResult.rejected(RateLimitGate.USER, "User rate limit exceeded",
									config.perUserWindow());
						}
						else if (!server.check(now)) {
							result = RateLimitResult.rejected(RateLimitGate.BACKEND, "Backend rate limit exceeded",
									config.perServerWindow());
						}
						else if (!state.bucket.check(weight, now)) {
							result = RateLimitResult.rejected(RateLimitGate.BUCKET, "Rate limit exceeded",
									config.windowSize());
						}
						else if (!state.window.check(weight, now)) {
							result = RateLimitResult.rejected(RateLimitGate.WINDOW, "Rate limit exceeded",
									config.windowSize());
						}
						else {
							user.consume(now);
							server.consume(now);
							state.bucket.consume(weight);
							state.window.consume(weight);
							if (config.enableAdaptive()) {
								adjustment = adapt(state, now);
							}
							result = RateLimitResult.allowed((int) Math.floor(state.bucket.tokens));
						}
					}
				}
			}

			if (result.isAllowed()) {
				allowedRequests.increment();
			}
			else {
				rejectedRequests.increment();
				rateLimitHits.increment();
				RateLimitGate gate = Objects.requireNonNull(result.gate(), "gate");
				listener.onRateLimitHit(gate, gateKey(gate, key, userId, backend));
			}
			if (adjustment != null) {
				adaptiveAdjustments.increment();
				LOG.debug("Adaptive throttling {} capacity of key {} to {} (average load {})",
						adjustment.direction, key, adjustment.newLimit, adjustment.averageLoad);
				listener.onAdaptiveAdjustment(key, adjustment.direction, adjustment.newLimit, adjustment.averageLoad);
			}
			return result;
		}
	}

	KeyState newKeyState(long now) {
		long windowMs = config.windowSize().toMillis();
		return new KeyState(
				new TokenBucket(config.tokensPerWindow(), config.maxBurstSize(), windowMs, now),
				new SlidingWindow(config.tokensPerWindow(), windowMs, config.slidingWindowSegments(), now),
				now);
	}

	/**
	 * Record the load of an admission and adjust the bucket capacity if a window went by since the last check.
	 * Must be called while holding the monitor of the key state.
	 */
	@Nullable
	Adjustment adapt(KeyState state, long now) {
		AdaptiveState adaptive = state.adaptive;
		if (adaptive == null) {
			adaptive = new AdaptiveState(config.maxBurstSize(), config.windowSize().toMillis(), now);
			state.adaptive = adaptive;
		}
		adaptive.record(state.bucket.load(), now);
		if (!adaptive.isAdjustmentDue(now)) {
			return null;
		}
		adaptive.lastAdjustmentAt = now;
		double averageLoad = adaptive.averageLoad();
		double threshold = config.adaptiveThreshold();

		double newLimit;
		AdjustmentDirection direction;
		if (averageLoad > threshold && adaptive.currentLimit > adaptive.floor()) {
			newLimit = Math.max(adaptive.floor(), adaptive.currentLimit * (1d - config.adaptiveReduction()));
			direction = AdjustmentDirection.REDUCE;
		}
		else if (averageLoad < threshold * 0.5d && adaptive.currentLimit < adaptive.originalLimit) {
			newLimit = Math.min(adaptive.originalLimit, adaptive.currentLimit * (1d + config.adaptiveRecoveryRate()));
			direction = AdjustmentDirection.INCREASE;
		}
		else {
			return null;
		}
		adaptive.currentLimit = newLimit;
		state.bucket.resize(newLimit);
		return new Adjustment(direction, newLimit, averageLoad);
	}

	static String gateKey(RateLimitGate gate, String key, String userId, String backend) {
		switch (gate) {
			case USER:
				return userId;
			case BACKEND:
				return backend;
			default:
				return key;
		}
	}

	/**
	 * @param key the composite key
	 * @return the current capacity of the key's token bucket, the configured burst size if the key is not tracked
	 */
	public double currentLimit(String key) {
		KeyState state = keys.get(key);
		if (state == null) {
			return config.maxBurstSize();
		}
		synchronized (state) {
			return state.bucket.maxTokens;
		}
	}

	/**
	 * Forget the bucket, window and adaptive state of a composite key.
	 */
	public void resetLimits(String key) {
		KeyState state = keys.remove(key);
		if (state != null) {
			synchronized (state) {
				state.evicted = true;
			}
		}
	}

	/**
	 * Forget the quota of a user.
	 */
	public void resetUserLimits(String userId) {
		evict(userQuotas.remove(userId));
	}

	/**
	 * Forget the quota of a backend.
	 */
	public void resetBackendLimits(String backend) {
		evict(backendQuotas.remove(backend));
	}

	static void evict(@Nullable QuotaState quota) {
		if (quota != null) {
			synchronized (quota) {
				quota.evicted = true;
			}
		}
	}

	/**
	 * Remove the state of users, backends and composite keys that went unused for two of their windows.
	 * Also runs periodically at the configured cleanup interval.
	 *
	 * @return the number of state objects removed
	 */
	public int cleanup() {
		long now = clock.millis();
		int removed = sweepQuotas(userQuotas, now) + sweepQuotas(backendQuotas, now);
		for (Map.Entry<String, KeyState> entry : keys.entrySet()) {
			KeyState state = entry.getValue();
			synchronized (state) {
				if (state.isIdle(now) && keys.remove(entry.getKey(), state)) {
					state.evicted = true;
					removed++;
				}
			}
		}
		if (removed > 0) {
			LOG.debug("Rate limiter sweep removed {} idle states", removed);
		}
		listener.onCleanupCompleted("ratelimit", removed);
		return removed;
	}

	static int sweepQuotas(ConcurrentMap<String, QuotaState> quotas, long now) {
		int removed = 0;
		for (Map.Entry<String, QuotaState> entry : quotas.entrySet()) {
			QuotaState quota = entry.getValue();
			synchronized (quota) {
				if (quota.isIdle(now) && quotas.remove(entry.getKey(), quota)) {
					quota.evicted = true;
					removed++;
				}
			}
		}
		return removed;
	}

	public RateLimiterMetrics metrics() {
		int adaptiveKeys = 0;
		for (KeyState state : keys.values()) {
			synchronized (state) {
				if (state.adaptive != null) {
					adaptiveKeys++;
				}
			}
		}
		return new RateLimiterMetrics(totalRequests.sum(), allowedRequests.sum(), rejectedRequests.sum(),
				rateLimitHits.sum(), adaptiveAdjustments.sum(), keys.size(), userQuotas.size(),
				backendQuotas.size(), adaptiveKeys, clock.millis());
	}

	@Override
	public void dispose() {
		disposed = true;
		cleanupTask.dispose();
	}

	@Override
	public boolean isDisposed() {
		return disposed;
	}

	static final class Adjustment {

		final AdjustmentDirection direction;
		final double              newLimit;
		final double              averageLoad;

		Adjustment(AdjustmentDirection direction, double newLimit, double averageLoad) {
			this.direction = direction;
			this.newLimit = newLimit;
			this.averageLoad = averageLoad;
		}
	}

	@Override
	public String toString() {
		return "RateLimiter{" +
				"keys=" + keys.size() +
				", users=" + userQuotas.size() +
				", backends=" + backendQuotas.size() +
				'}';
	}
}
