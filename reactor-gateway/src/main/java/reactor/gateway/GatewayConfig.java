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

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.util.Logger;
import reactor.util.Loggers;

/**
 * Immutable configuration of the gateway core, consumed at construction time by the pool manager, the rate
 * limiter, the session registry and the gateway itself.
 * <p>
 * Instances are obtained from a {@link #builder() builder} or from a flat map of recognized option names
 * (see {@link #fromMap(Map)}). Durations of {@link Duration#ZERO zero} disable the corresponding timeout or sweep.
 */
public final class GatewayConfig {

	static final Logger LOG = Loggers.getLogger(GatewayConfig.class);

	public static final int      DEFAULT_MAX_CONNECTIONS_PER_SERVER    = 50;
	public static final int      DEFAULT_MAX_CONCURRENT_PER_USER       = 10;
	public static final int      DEFAULT_MAX_TOTAL_CONNECTIONS         = 500;
	public static final Duration DEFAULT_CONNECTION_TIMEOUT            = Duration.ofSeconds(30);
	public static final Duration DEFAULT_REQUEST_TIMEOUT               = Duration.ofSeconds(60);
	public static final Duration DEFAULT_IDLE_TIMEOUT                  = Duration.ofMinutes(5);
	public static final int      DEFAULT_QUEUE_MAX_SIZE                = 1000;
	public static final Duration DEFAULT_CLEANUP_INTERVAL              = Duration.ofSeconds(60);
	public static final int      DEFAULT_CIRCUIT_BREAKER_THRESHOLD     = 5;
	public static final Duration DEFAULT_CIRCUIT_BREAKER_TIMEOUT       = Duration.ofSeconds(60);
	public static final int      DEFAULT_TOKENS_PER_WINDOW             = 100;
	public static final Duration DEFAULT_WINDOW_SIZE                   = Duration.ofSeconds(60);
	public static final int      DEFAULT_MAX_BURST_SIZE                = 150;
	public static final int      DEFAULT_SLIDING_WINDOW_SEGMENTS       = 60;
	public static final int      DEFAULT_PER_USER_LIMIT                = 10;
	public static final Duration DEFAULT_PER_USER_WINDOW               = Duration.ofSeconds(60);
	public static final int      DEFAULT_PER_SERVER_LIMIT              = 50;
	public static final Duration DEFAULT_PER_SERVER_WINDOW             = Duration.ofSeconds(60);
	public static final double   DEFAULT_ADAPTIVE_THRESHOLD            = 0.8d;
	public static final double   DEFAULT_ADAPTIVE_REDUCTION            = 0.5d;
	public static final double   DEFAULT_ADAPTIVE_RECOVERY_RATE        = 0.1d;
	public static final Duration DEFAULT_RATE_LIMITER_CLEANUP_INTERVAL = Duration.ofMinutes(5);
	public static final Duration DEFAULT_SESSION_TIMEOUT               = Duration.ofMinutes(30);
	public static final Duration DEFAULT_CREDENTIAL_CACHE_TTL          = Duration.ofMinutes(5);

	/**
	 * @return a new {@link Builder} initialized with the defaults
	 */
	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Create a {@link GatewayConfig} from a flat map of options, as found in a configuration file. Keys are the
	 * option names ({@code maxConnectionsPerServer}, {@code windowSizeMs}, ...), values are either of the expected
	 * type or their {@link String} representation. Durations are expressed in milliseconds. Unrecognized keys are
	 * ignored. Missing keys take their default value.
	 *
	 * @param options the options
	 * @return the corresponding configuration
	 * @throws IllegalArgumentException if a value cannot be converted or is out of range
	 */
	public static GatewayConfig fromMap(Map<String, ?> options) {
		Builder builder = new Builder();
		for (Map.Entry<String, ?> entry : options.entrySet()) {
			String key = entry.getKey();
			Object value = entry.getValue();
			if (value == null) {
				continue;
			}
			switch (key) {
				case "maxConnectionsPerServer":
					builder.maxConnectionsPerServer(asInt(key, value));
					break;
				case "maxConcurrentRequestsPerUser":
					builder.maxConcurrentRequestsPerUser(asInt(key, value));
					break;
				case "maxTotalConnections":
					builder.maxTotalConnections(asInt(key, value));
					break;
				case "connectionTimeout":
					builder.connectionTimeout(asMillis(key, value));
					break;
				case "requestTimeout":
					builder.requestTimeout(asMillis(key, value));
					break;
				case "idleTimeout":
					builder.idleTimeout(asMillis(key, value));
					break;
				case "queueMaxSize":
					builder.queueMaxSize(asInt(key, value));
					break;
				case "cleanupInterval":
					builder.cleanupInterval(asMillis(key, value));
					break;
				case "circuitBreakerThreshold":
					builder.circuitBreakerThreshold(asInt(key, value));
					break;
				case "circuitBreakerTimeout":
					builder.circuitBreakerTimeout(asMillis(key, value));
					break;
				case "tokensPerWindow":
					builder.tokensPerWindow(asInt(key, value));
					break;
				case "windowSizeMs":
					builder.windowSize(asMillis(key, value));
					break;
				case "maxBurstSize":
					builder.maxBurstSize(asInt(key, value));
					break;
				case "slidingWindowSegments":
					builder.slidingWindowSegments(asInt(key, value));
					break;
				case "perUserLimit":
					builder.perUserLimit(asInt(key, value));
					break;
				case "perUserWindowMs":
					builder.perUserWindow(asMillis(key, value));
					break;
				case "perServerLimit":
					builder.perServerLimit(asInt(key, value));
					break;
				case "perServerWindowMs":
					builder.perServerWindow(asMillis(key, value));
					break;
				case "enableAdaptive":
					builder.enableAdaptive(asBoolean(key, value));
					break;
				case "adaptiveThreshold":
					builder.adaptiveThreshold(asDouble(key, value));
					break;
				case "adaptiveReduction":
					builder.adaptiveReduction(asDouble(key, value));
					break;
				case "adaptiveRecoveryRate":
					builder.adaptiveRecoveryRate(asDouble(key, value));
					break;
				case "rateLimiterCleanupInterval":
					builder.rateLimiterCleanupInterval(asMillis(key, value));
					break;
				case "sessionTimeout":
					builder.sessionTimeout(asMillis(key, value));
					break;
				case "credentialCacheTtl":
					builder.credentialCacheTtl(asMillis(key, value));
					break;
				default:
					LOG.debug("Ignoring unrecognized gateway option {}", key);
			}
		}
		return builder.build();
	}

	static int asInt(String key, Object value) {
		if (value instanceof Number) {
			return ((Number) value).intValue();
		}
		try {
			return Integer.parseInt(value.toString().trim());
		}
		catch (NumberFormatException e) {
			throw new IllegalArgumentException("Option " + key + " expects an integer, got " + value, e);
		}
	}

	static Duration asMillis(String key, Object value) {
		if (value instanceof Duration) {
			return (Duration) value;
		}
		if (value instanceof Number) {
			return Duration.ofMillis(((Number) value).longValue());
		}
		try {
			return Duration.ofMillis(Long.parseLong(value.toString().trim()));
		}
		catch (NumberFormatException e) {
			throw new IllegalArgumentException("Option " + key + " expects a number of milliseconds, got " + value, e);
		}
	}

	static double asDouble(String key, Object value) {
		if (value instanceof Number) {
			return ((Number) value).doubleValue();
		}
		try {
			return Double.parseDouble(value.toString().trim());
		}
		catch (NumberFormatException e) {
			throw new IllegalArgumentException("Option " + key + " expects a decimal number, got " + value, e);
		}
	}

	static boolean asBoolean(String key, Object value) {
		if (value instanceof Boolean) {
			return (Boolean) value;
		}
		String s = value.toString().trim();
		if ("true".equalsIgnoreCase(s)) {
			return true;
		}
		if ("false".equalsIgnoreCase(s)) {
			return false;
		}
		throw new IllegalArgumentException("Option " + key + " expects true or false, got " + value);
	}

	final int      maxConnectionsPerServer;
	final int      maxConcurrentRequestsPerUser;
	final int      maxTotalConnections;
	final Duration connectionTimeout;
	final Duration requestTimeout;
	final Duration idleTimeout;
	final int      queueMaxSize;
	final Duration cleanupInterval;
	final int      circuitBreakerThreshold;
	final Duration circuitBreakerTimeout;
	final int      tokensPerWindow;
	final Duration windowSize;
	final int      maxBurstSize;
	final int      slidingWindowSegments;
	final int      perUserLimit;
	final Duration perUserWindow;
	final int      perServerLimit;
	final Duration perServerWindow;
	final boolean  enableAdaptive;
	final double   adaptiveThreshold;
	final double   adaptiveReduction;
	final double   adaptiveRecoveryRate;
	final Duration rateLimiterCleanupInterval;
	final Duration sessionTimeout;
	final Duration credentialCacheTtl;

	final           Clock                  clock;
	final           Scheduler              timer;
	final           GatewayMetricsRecorder metricsRecorder;
	final           GatewayEventListener   eventListener;
	final @Nullable String                 serviceSecret;

	GatewayConfig(Builder builder) {
		this.maxConnectionsPerServer = builder.maxConnectionsPerServer;
		this.maxConcurrentRequestsPerUser = builder.maxConcurrentRequestsPerUser;
		this.maxTotalConnections = builder.maxTotalConnections;
		this.connectionTimeout = builder.connectionTimeout;
		this.requestTimeout = builder.requestTimeout;
		this.idleTimeout = builder.idleTimeout;
		this.queueMaxSize = builder.queueMaxSize;
		this.cleanupInterval = builder.cleanupInterval;
		this.circuitBreakerThreshold = builder.circuitBreakerThreshold;
		this.circuitBreakerTimeout = builder.circuitBreakerTimeout;
		this.tokensPerWindow = builder.tokensPerWindow;
		this.windowSize = builder.windowSize;
		this.maxBurstSize = builder.maxBurstSize;
		this.slidingWindowSegments = builder.slidingWindowSegments;
		this.perUserLimit = builder.perUserLimit;
		this.perUserWindow = builder.perUserWindow;
		this.perServerLimit = builder.perServerLimit;
		this.perServerWindow = builder.perServerWindow;
		this.enableAdaptive = builder.enableAdaptive;
		this.adaptiveThreshold = builder.adaptiveThreshold;
		this.adaptiveReduction = builder.adaptiveReduction;
		this.adaptiveRecoveryRate = builder.adaptiveRecoveryRate;
		this.rateLimiterCleanupInterval = builder.rateLimiterCleanupInterval;
		this.sessionTimeout = builder.sessionTimeout;
		this.credentialCacheTtl = builder.credentialCacheTtl;
		this.clock = builder.clock;
		this.timer = builder.timer;
		this.metricsRecorder = builder.metricsRecorder;
		this.eventListener = builder.eventListener;
		this.serviceSecret = builder.serviceSecret;
	}

	/**
	 * @return a {@link Builder} initialized with the values of this configuration
	 */
	public Builder mutate() {
		return new Builder(this);
	}

	public int maxConnectionsPerServer() {
		return maxConnectionsPerServer;
	}

	public int maxConcurrentRequestsPerUser() {
		return maxConcurrentRequestsPerUser;
	}

	public int maxTotalConnections() {
		return maxTotalConnections;
	}

	/**
	 * @return the maximum time allowed to open a new backend transport
	 */
	public Duration connectionTimeout() {
		return connectionTimeout;
	}

	/**
	 * @return the maximum time an acquire may stay in a backend's wait queue
	 */
	public Duration requestTimeout() {
		return requestTimeout;
	}

	/**
	 * @return the idle time after which a pooled connection is no longer reusable
	 */
	public Duration idleTimeout() {
		return idleTimeout;
	}

	public int queueMaxSize() {
		return queueMaxSize;
	}

	/**
	 * @return the period of the pool and session sweeps
	 */
	public Duration cleanupInterval() {
		return cleanupInterval;
	}

	public int circuitBreakerThreshold() {
		return circuitBreakerThreshold;
	}

	public Duration circuitBreakerTimeout() {
		return circuitBreakerTimeout;
	}

	public int tokensPerWindow() {
		return tokensPerWindow;
	}

	public Duration windowSize() {
		return windowSize;
	}

	public int maxBurstSize() {
		return maxBurstSize;
	}

	public int slidingWindowSegments() {
		return slidingWindowSegments;
	}

	public int perUserLimit() {
		return perUserLimit;
	}

	public Duration perUserWindow() {
		return perUserWindow;
	}

	public int perServerLimit() {
		return perServerLimit;
	}

	public Duration perServerWindow() {
		return perServerWindow;
	}

	public boolean enableAdaptive() {
		return enableAdaptive;
	}

	public double adaptiveThreshold() {
		return adaptiveThreshold;
	}

	public double adaptiveReduction() {
		return adaptiveReduction;
	}

	public double adaptiveRecoveryRate() {
		return adaptiveRecoveryRate;
	}

	public Duration rateLimiterCleanupInterval() {
		return rateLimiterCleanupInterval;
	}

	/**
	 * @return the inactivity after which a session is closed by the idle sweep
	 */
	public Duration sessionTimeout() {
		return sessionTimeout;
	}

	public Duration credentialCacheTtl() {
		return credentialCacheTtl;
	}

	/**
	 * @return the {@link Clock} used for every timestamp and elapsed time computation
	 */
	public Clock clock() {
		return clock;
	}

	/**
	 * @return the {@link Scheduler} on which timeouts and periodic sweeps are scheduled
	 */
	public Scheduler timer() {
		return timer;
	}

	public GatewayMetricsRecorder metricsRecorder() {
		return metricsRecorder;
	}

	public GatewayEventListener eventListener() {
		return eventListener;
	}

	/**
	 * @return the shared service-level secret that session initializations must present, or null if that
	 * authorization factor is disabled
	 */
	public @Nullable String serviceSecret() {
		return serviceSecret;
	}

	@Override
	public String toString() {
		return "GatewayConfig{" +
				"maxConnectionsPerServer=" + maxConnectionsPerServer +
				", maxConcurrentRequestsPerUser=" + maxConcurrentRequestsPerUser +
				", maxTotalConnections=" + maxTotalConnections +
				", connectionTimeout=" + connectionTimeout.toMillis() + "ms" +
				", requestTimeout=" + requestTimeout.toMillis() + "ms" +
				", idleTimeout=" + idleTimeout.toMillis() + "ms" +
				", queueMaxSize=" + queueMaxSize +
				", cleanupInterval=" + cleanupInterval.toMillis() + "ms" +
				", circuitBreakerThreshold=" + circuitBreakerThreshold +
				", circuitBreakerTimeout=" + circuitBreakerTimeout.toMillis() + "ms" +
				", tokensPerWindow=" + tokensPerWindow +
				", windowSize=" + windowSize.toMillis() + "ms" +
				", maxBurstSize=" + maxBurstSize +
				", slidingWindowSegments=" + slidingWindowSegments +
				", perUserLimit=" + perUserLimit +
				", perServerLimit=" + perServerLimit +
				", enableAdaptive=" + enableAdaptive +
				'}';
	}

	/**
	 * A mutable builder of {@link GatewayConfig}. Setters validate their argument eagerly.
	 */
	public static final class Builder {

		int      maxConnectionsPerServer      = DEFAULT_MAX_CONNECTIONS_PER_SERVER;
		int      maxConcurrentRequestsPerUser = DEFAULT_MAX_CONCURRENT_PER_USER;
		int      maxTotalConnections          = DEFAULT_MAX_TOTAL_CONNECTIONS;
		Duration connectionTimeout            = DEFAULT_CONNECTION_TIMEOUT;
		Duration requestTimeout               = DEFAULT_REQUEST_TIMEOUT;
		Duration idleTimeout                  = DEFAULT_IDLE_TIMEOUT;
		int      queueMaxSize                 = DEFAULT_QUEUE_MAX_SIZE;
		Duration cleanupInterval              = DEFAULT_CLEANUP_INTERVAL;
		int      circuitBreakerThreshold      = DEFAULT_CIRCUIT_BREAKER_THRESHOLD;
		Duration circuitBreakerTimeout        = DEFAULT_CIRCUIT_BREAKER_TIMEOUT;
		int      tokensPerWindow              = DEFAULT_TOKENS_PER_WINDOW;
		Duration windowSize                   = DEFAULT_WINDOW_SIZE;
		int      maxBurstSize                 = DEFAULT_MAX_BURST_SIZE;
		int      slidingWindowSegments        = DEFAULT_SLIDING_WINDOW_SEGMENTS;
		int      perUserLimit                 = DEFAULT_PER_USER_LIMIT;
		Duration perUserWindow                = DEFAULT_PER_USER_WINDOW;
		int      perServerLimit               = DEFAULT_PER_SERVER_LIMIT;
		Duration perServerWindow              = DEFAULT_PER_SERVER_WINDOW;
		boolean  enableAdaptive               = true;
		double   adaptiveThreshold            = DEFAULT_ADAPTIVE_THRESHOLD;
		double   adaptiveReduction            = DEFAULT_ADAPTIVE_REDUCTION;
		double   adaptiveRecoveryRate         = DEFAULT_ADAPTIVE_RECOVERY_RATE;
		Duration rateLimiterCleanupInterval   = DEFAULT_RATE_LIMITER_CLEANUP_INTERVAL;
		Duration sessionTimeout               = DEFAULT_SESSION_TIMEOUT;
		Duration credentialCacheTtl           = DEFAULT_CREDENTIAL_CACHE_TTL;

		Clock                  clock           = Clock.systemUTC();
		Scheduler              timer           = Schedulers.parallel();
		GatewayMetricsRecorder metricsRecorder = NoOpGatewayMetricsRecorder.INSTANCE;
		GatewayEventListener   eventListener   = NoOpGatewayEventListener.INSTANCE;
		@Nullable String       serviceSecret;

		Builder() {
		}

		Builder(GatewayConfig source) {
			this.maxConnectionsPerServer = source.maxConnectionsPerServer;
			this.maxConcurrentRequestsPerUser = source.maxConcurrentRequestsPerUser;
			this.maxTotalConnections = source.maxTotalConnections;
			this.connectionTimeout = source.connectionTimeout;
			this.requestTimeout = source.requestTimeout;
			this.idleTimeout = source.idleTimeout;
			this.queueMaxSize = source.queueMaxSize;
			this.cleanupInterval = source.cleanupInterval;
			this.circuitBreakerThreshold = source.circuitBreakerThreshold;
			this.circuitBreakerTimeout = source.circuitBreakerTimeout;
			this.tokensPerWindow = source.tokensPerWindow;
			this.windowSize = source.windowSize;
			this.maxBurstSize = source.maxBurstSize;
			this.slidingWindowSegments = source.slidingWindowSegments;
			this.perUserLimit = source.perUserLimit;
			this.perUserWindow = source.perUserWindow;
			this.perServerLimit = source.perServerLimit;
			this.perServerWindow = source.perServerWindow;
			this.enableAdaptive = source.enableAdaptive;
			this.adaptiveThreshold = source.adaptiveThreshold;
			this.adaptiveReduction = source.adaptiveReduction;
			this.adaptiveRecoveryRate = source.adaptiveRecoveryRate;
			this.rateLimiterCleanupInterval = source.rateLimiterCleanupInterval;
			this.sessionTimeout = source.sessionTimeout;
			this.credentialCacheTtl = source.credentialCacheTtl;
			this.clock = source.clock;
			this.timer = source.timer;
			this.metricsRecorder = source.metricsRecorder;
			this.eventListener = source.eventListener;
			this.serviceSecret = source.serviceSecret;
		}

		/**
		 * Set the maximum number of connections (active and idle) a single backend pool may hold.
		 * Defaults to {@value GatewayConfig#DEFAULT_MAX_CONNECTIONS_PER_SERVER}.
		 *
		 * @param max the per-backend ceiling, strictly positive
		 * @return this builder
		 */
		public Builder maxConnectionsPerServer(int max) {
			this.maxConnectionsPerServer = positive("maxConnectionsPerServer", max);
			return this;
		}

		/**
		 * Set the maximum number of connections a single user may hold or wait for across all backends.
		 * Defaults to {@value GatewayConfig#DEFAULT_MAX_CONCURRENT_PER_USER}.
		 *
		 * @param max the per-user ceiling, strictly positive
		 * @return this builder
		 */
		public Builder maxConcurrentRequestsPerUser(int max) {
			this.maxConcurrentRequestsPerUser = positive("maxConcurrentRequestsPerUser", max);
			return this;
		}

		/**
		 * Set the maximum number of connections checked out at once across every backend.
		 * Defaults to {@value GatewayConfig#DEFAULT_MAX_TOTAL_CONNECTIONS}.
		 *
		 * @param max the gateway-wide ceiling, strictly positive
		 * @return this builder
		 */
		public Builder maxTotalConnections(int max) {
			this.maxTotalConnections = positive("maxTotalConnections", max);
			return this;
		}

		public Builder connectionTimeout(Duration timeout) {
			this.connectionTimeout = notNegative("connectionTimeout", timeout);
			return this;
		}

		public Builder requestTimeout(Duration timeout) {
			this.requestTimeout = notNegative("requestTimeout", timeout);
			return this;
		}

		public Builder idleTimeout(Duration timeout) {
			this.idleTimeout = notNegative("idleTimeout", timeout);
			return this;
		}

		/**
		 * Set the maximum number of acquires that may wait in a single backend's queue. Zero means an acquire
		 * that cannot be served immediately fails right away.
		 *
		 * @param max the queue bound, zero or positive
		 * @return this builder
		 */
		public Builder queueMaxSize(int max) {
			if (max < 0) {
				throw new IllegalArgumentException("queueMaxSize must be >= 0, got " + max);
			}
			this.queueMaxSize = max;
			return this;
		}

		public Builder cleanupInterval(Duration interval) {
			this.cleanupInterval = notNegative("cleanupInterval", interval);
			return this;
		}

		public Builder circuitBreakerThreshold(int threshold) {
			this.circuitBreakerThreshold = positive("circuitBreakerThreshold", threshold);
			return this;
		}

		public Builder circuitBreakerTimeout(Duration timeout) {
			this.circuitBreakerTimeout = notNegative("circuitBreakerTimeout", timeout);
			return this;
		}

		public Builder tokensPerWindow(int tokens) {
			this.tokensPerWindow = positive("tokensPerWindow", tokens);
			return this;
		}

		public Builder windowSize(Duration window) {
			this.windowSize = positive("windowSize", window);
			return this;
		}

		public Builder maxBurstSize(int max) {
			this.maxBurstSize = positive("maxBurstSize", max);
			return this;
		}

		public Builder slidingWindowSegments(int segments) {
			this.slidingWindowSegments = positive("slidingWindowSegments", segments);
			return this;
		}

		public Builder perUserLimit(int limit) {
			this.perUserLimit = positive("perUserLimit", limit);
			return this;
		}

		public Builder perUserWindow(Duration window) {
			this.perUserWindow = positive("perUserWindow", window);
			return this;
		}

		public Builder perServerLimit(int limit) {
			this.perServerLimit = positive("perServerLimit", limit);
			return this;
		}

		public Builder perServerWindow(Duration window) {
			this.perServerWindow = positive("perServerWindow", window);
			return this;
		}

		public Builder enableAdaptive(boolean enable) {
			this.enableAdaptive = enable;
			return this;
		}

		public Builder adaptiveThreshold(double threshold) {
			this.adaptiveThreshold = ratio("adaptiveThreshold", threshold);
			return this;
		}

		public Builder adaptiveReduction(double reduction) {
			this.adaptiveReduction = ratio("adaptiveReduction", reduction);
			return this;
		}

		public Builder adaptiveRecoveryRate(double rate) {
			this.adaptiveRecoveryRate = ratio("adaptiveRecoveryRate", rate);
			return this;
		}

		public Builder rateLimiterCleanupInterval(Duration interval) {
			this.rateLimiterCleanupInterval = notNegative("rateLimiterCleanupInterval", interval);
			return this;
		}

		public Builder sessionTimeout(Duration timeout) {
			this.sessionTimeout = notNegative("sessionTimeout", timeout);
			return this;
		}

		public Builder credentialCacheTtl(Duration ttl) {
			this.credentialCacheTtl = notNegative("credentialCacheTtl", ttl);
			return this;
		}

		/**
		 * Use an {@link Clock} other than {@link Clock#systemUTC()} for timestamps. Mainly useful for tests,
		 * along with {@link #timer(Scheduler)}.
		 *
		 * @param clock the {@link Clock} to use
		 * @return this builder
		 */
		public Builder clock(Clock clock) {
			this.clock = Objects.requireNonNull(clock, "clock");
			return this;
		}

		/**
		 * Use a {@link Scheduler} other than {@link Schedulers#parallel()} for queue timeouts and periodic sweeps.
		 *
		 * @param timer the {@link Scheduler} to use
		 * @return this builder
		 */
		public Builder timer(Scheduler timer) {
			this.timer = Objects.requireNonNull(timer, "timer");
			return this;
		}

		public Builder metricsRecorder(GatewayMetricsRecorder recorder) {
			this.metricsRecorder = Objects.requireNonNull(recorder, "metricsRecorder");
			return this;
		}

		public Builder eventListener(GatewayEventListener listener) {
			this.eventListener = Objects.requireNonNull(listener, "eventListener");
			return this;
		}

		/**
		 * Set the shared service-level secret that session initialization requests must present.
		 * A null secret disables that authorization factor.
		 *
		 * @param secret the secret, or null
		 * @return this builder
		 */
		public Builder serviceSecret(@Nullable String secret) {
			this.serviceSecret = secret;
			return this;
		}

		public GatewayConfig build() {
			return new GatewayConfig(this);
		}

		static int positive(String name, int value) {
			if (value <= 0) {
				throw new IllegalArgumentException(name + " must be strictly positive, got " + value);
			}
			return value;
		}

		static Duration positive(String name, Duration value) {
			Objects.requireNonNull(value, name);
			if (value.isNegative() || value.isZero()) {
				throw new IllegalArgumentException(name + " must be strictly positive, got " + value);
			}
			return value;
		}

		static Duration notNegative(String name, Duration value) {
			Objects.requireNonNull(value, name);
			if (value.isNegative()) {
				throw new IllegalArgumentException(name + " must not be negative, got " + value);
			}
			return value;
		}

		static double ratio(String name, double value) {
			if (!(value > 0d && value <= 1d)) {
				throw new IllegalArgumentException(name + " must be in ]0, 1], got " + value);
			}
			return value;
		}
	}
}
