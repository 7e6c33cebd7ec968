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

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicIntegerFieldUpdater;
import java.util.concurrent.atomic.LongAdder;

import org.jspecify.annotations.Nullable;

import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.gateway.pool.PoolManager;
import reactor.gateway.pool.SimplePoolManager;
import reactor.gateway.ratelimit.RateLimitGate;
import reactor.gateway.ratelimit.RateLimitResult;
import reactor.gateway.ratelimit.RateLimiter;
import reactor.gateway.session.CachingCredentialDirectory;
import reactor.gateway.session.CredentialDirectory;
import reactor.gateway.session.Session;
import reactor.gateway.session.SessionRegistry;
import reactor.util.Logger;
import reactor.util.Loggers;

/**
 * The request pipeline of the gateway. Each call to {@link #handle(GatewayRequest)} goes through:
 * <ol>
 *     <li>backend resolution, failing with {@link BackendNotFoundException} or {@link BackendCrashedException}</li>
 *     <li>a check of the session id: only an {@link RequestKind#INITIALIZE} request may come without one
 *     ({@link BadRequestException}), and a presented id must be known ({@link InvalidSessionException})</li>
 *     <li>the {@link RateLimiter}, keyed by user and backend</li>
 *     <li>for an initialization, the service secret check then the creation of a session, which verifies the user's
 *     credential and acquires a connection. Otherwise, routing to the open session</li>
 *     <li>the backend's {@link BackendHandler}</li>
 *     <li>accounting, and for a {@link RequestKind#TERMINATE} request the closing of the session</li>
 * </ol>
 * Calls within a session don't give its connection back: the session holds it until it closes.
 */
public final class Gateway implements Disposable {

	static final Logger LOG = Loggers.getLogger(Gateway.class);

	final GatewayConfig                      config;
	final Clock                              clock;
	final PoolManager                        poolManager;
	final RateLimiter                        rateLimiter;
	final SessionRegistry                    sessions;
	final @Nullable Disposable               credentialCache;
	final ConcurrentMap<String, Backend>     backends = new ConcurrentHashMap<>();

	volatile int disposed;
	static final AtomicIntegerFieldUpdater<Gateway> DISPOSED =
			AtomicIntegerFieldUpdater.newUpdater(Gateway.class, "disposed");

	/**
	 * Create a {@link Gateway} over logical connections, caching the verdicts of the credential directory.
	 *
	 * @param config the gateway configuration
	 * @param credentials the directory of per-user credentials
	 */
	public Gateway(GatewayConfig config, CredentialDirectory credentials) {
		this(config, new SimplePoolManager(config), credentials);
	}

	public Gateway(GatewayConfig config, PoolManager poolManager, CredentialDirectory credentials) {
		this(config, poolManager, new RateLimiter(config), CachingCredentialDirectory.of(credentials, config));
	}

	Gateway(GatewayConfig config, PoolManager poolManager, RateLimiter rateLimiter,
			CachingCredentialDirectory credentials) {
		this(config, poolManager, rateLimiter, new SessionRegistry(poolManager, credentials, config), credentials);
	}

	/**
	 * Assemble a {@link Gateway} from its components. Disposing the gateway disposes all of them.
	 */
	public Gateway(GatewayConfig config, PoolManager poolManager, RateLimiter rateLimiter, SessionRegistry sessions) {
		this(config, poolManager, rateLimiter, sessions, null);
	}

	Gateway(GatewayConfig config, PoolManager poolManager, RateLimiter rateLimiter, SessionRegistry sessions,
			@Nullable Disposable credentialCache) {
		this.config = Objects.requireNonNull(config, "config");
		this.clock = config.clock();
		this.poolManager = Objects.requireNonNull(poolManager, "poolManager");
		this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
		this.sessions = Objects.requireNonNull(sessions, "sessions");
		this.credentialCache = credentialCache;
		if (config.serviceSecret() == null) {
			LOG.warn("No service secret configured, sessions are opened on the per-user credential alone");
		}
	}

	/**
	 * Make a backend reachable through the gateway and initialize its connection pool.
	 *
	 * @param name the backend name
	 * @param handler the executor of the calls routed to the backend
	 * @throws IllegalArgumentException if a backend of that name is already registered
	 */
	public void registerBackend(String name, BackendHandler handler) {
		Objects.requireNonNull(name, "name");
		Objects.requireNonNull(handler, "handler");
		if (backends.putIfAbsent(name, new Backend(name, handler)) != null) {
			throw new IllegalArgumentException("Backend '" + name + "' is already registered");
		}
		poolManager.initializePool(name);
		LOG.debug("Registered backend {}", name);
	}

	/**
	 * Flag a backend as permanently failed: its calls are rejected with {@link BackendCrashedException} and its
	 * sessions are closed as if their transport closed.
	 *
	 * @throws BackendNotFoundException if the backend is not registered
	 */
	public void markCrashed(String name) {
		Backend backend = backend(name);
		backend.state = BackendState.CRASHED;
		LOG.warn("Backend {} marked as crashed", name);
		for (Session session : sessions.sessions()) {
			if (session.backend().equals(name)) {
				sessions.transportClosed(session.sessionId())
				        .subscribe(null, e -> LOG.warn("Error while closing session " + session.sessionId(), e));
			}
		}
	}

	/**
	 * @throws BackendNotFoundException if the backend is not registered
	 */
	public void markHealthy(String name) {
		backend(name).state = BackendState.HEALTHY;
	}

	Backend backend(String name) {
		Backend backend = backends.get(name);
		if (backend == null) {
			throw new BackendNotFoundException(name);
		}
		return backend;
	}

	/**
	 * Run a call through the pipeline. Every rejection is an error signal of the returned {@link Mono}, with a
	 * {@link GatewayException} describing it.
	 *
	 * @param request the inbound call
	 * @return a {@link Mono} of the response
	 */
	public Mono<GatewayResponse> handle(GatewayRequest request) {
		return Mono.defer(() -> {
			if (isDisposed()) {
				return Mono.error(new PoolShutdownException("Gateway has been shut down"));
			}
			Backend backend = backends.get(request.backend);
			if (backend == null) {
				return Mono.error(new BackendNotFoundException(request.backend));
			}
			if (backend.state == BackendState.CRASHED) {
				return Mono.error(new BackendCrashedException(backend.name));
			}

			String sessionId = request.sessionId;
			if (sessionId == null) {
				if (request.kind != RequestKind.INITIALIZE) {
					return Mono.error(new BadRequestException("Only an initialization request may come without a session id"));
				}
			}
			else {
				Session existing = sessions.find(sessionId);
				if (existing == null) {
					return Mono.error(new InvalidSessionException(sessionId, "unknown or expired session"));
				}
				if (!existing.backend().equals(backend.name) || !existing.userId().equals(request.userId)) {
					return Mono.error(new InvalidSessionException(sessionId, "the session belongs to another user or backend"));
				}
			}

			RateLimitResult verdict = rateLimiter.isAllowed(request.userId + "-" + backend.name, request.userId,
					backend.name, request.weight);
			if (!verdict.isAllowed()) {
				return Mono.error(rejection(verdict, request.userId));
			}

			if (sessionId == null) {
				return authorize(request)
						.then(Mono.defer(() -> sessions.createSession(request.userId, backend.name,
								Objects.requireNonNull(request.credential, "credential"))))
						.flatMap(session -> execute(backend, session, request, true));
			}
			return Mono.fromCallable(() -> sessions.routeToSession(sessionId))
			           .flatMap(session -> execute(backend, session, request, false));
		});
	}

	Mono<Void> authorize(GatewayRequest request) {
		String expected = config.serviceSecret();
		if (expected == null) {
			return Mono.empty();
		}
		String presented = request.serviceSecret;
		if (presented == null || !MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8),
				presented.getBytes(StandardCharsets.UTF_8))) {
			return Mono.error(new AuthInvalidException("Invalid service secret"));
		}
		if (request.credential == null) {
			return Mono.error(new AuthInvalidException("Missing user credential"));
		}
		return Mono.empty();
	}

	static GatewayException rejection(RateLimitResult verdict, String userId) {
		RateLimitGate gate = Objects.requireNonNull(verdict.gate(), "gate");
		String reason = String.valueOf(verdict.reason());
		if (gate == RateLimitGate.USER) {
			return new UserRateLimitedException(userId, reason, verdict.retryAfter());
		}
		return new RateLimitedException(gate, reason, Objects.requireNonNull(verdict.retryAfter(), "retryAfter"));
	}

	Mono<GatewayResponse> execute(Backend backend, Session session, GatewayRequest request, boolean created) {
		long start = clock.millis();
		backend.lastActivityAt = start;
		Mono<GatewayResponse> call = Mono.<Object>defer(() -> backend.handler.handle(session, request))
		                                 .map(result -> new GatewayResponse(session.sessionId(), backend.name, result, clock.millis() - start))
		                                 .switchIfEmpty(Mono.fromSupplier(() -> new GatewayResponse(session.sessionId(), backend.name, null, clock.millis() - start)))
		                                 .doOnNext(response -> backend.requests.increment())
		                                 .doOnError(e -> {
			                                 backend.requests.increment();
			                                 backend.errors.increment();
		                                 });

		boolean closing = request.kind == RequestKind.TERMINATE;
		if (closing) {
			call = call.flatMap(response -> sessions.terminate(session.sessionId()).thenReturn(response));
		}
		if (closing || created) {
			//a session whose initialization failed is not kept around
			call = call.onErrorResume(e -> sessions.failed(session.sessionId()).then(Mono.<GatewayResponse>error(e)));
		}
		return call;
	}

	/**
	 * @return a snapshot of every registered backend
	 */
	public List<BackendStatus> backendStatus() {
		List<BackendStatus> statuses = new ArrayList<>(backends.size());
		for (Backend backend : backends.values()) {
			statuses.add(status(backend));
		}
		return statuses;
	}

	/**
	 * @throws BackendNotFoundException if the backend is not registered
	 */
	public BackendStatus backendStatus(String name) {
		return status(backend(name));
	}

	BackendStatus status(Backend backend) {
		PoolManager.PoolMetrics pool = poolManager.metrics(backend.name);
		return new BackendStatus(backend.name, backend.state, poolManager.circuitBreaker(backend.name).state(),
				sessions.sessionCount(backend.name), pool.acquiredSize(), pool.idleSize(), pool.pendingAcquireSize(),
				backend.requests.sum(), backend.errors.sum(), backend.lastActivityAt);
	}

	public PoolManager poolManager() {
		return poolManager;
	}

	public RateLimiter rateLimiter() {
		return rateLimiter;
	}

	public SessionRegistry sessions() {
		return sessions;
	}

	/**
	 * Shut the gateway down: close every session, then every pool, then stop the rate limiter's sweep. Nothing happens
	 * until the returned {@link Mono} is subscribed.
	 */
	public Mono<Void> disposeLater() {
		return Mono.defer(() -> {
			if (!DISPOSED.compareAndSet(this, 0, 1)) {
				return Mono.empty();
			}
			LOG.debug("Shutting down gateway with {} sessions", sessions.sessionCount());
			return sessions.disposeLater()
			               .then(poolManager.disposeLater())
			               .doFinally(signal -> {
				               rateLimiter.dispose();
				               if (credentialCache != null) {
					               credentialCache.dispose();
				               }
			               });
		});
	}

	@Override
	public void dispose() {
		disposeLater().subscribe();
	}

	@Override
	public boolean isDisposed() {
		return disposed == 1;
	}

	static final class Backend {

		final String         name;
		final BackendHandler handler;
		final LongAdder      requests = new LongAdder();
		final LongAdder      errors   = new LongAdder();

		volatile BackendState state = BackendState.HEALTHY;
		volatile long         lastActivityAt;

		Backend(String name, BackendHandler handler) {
			this.name = name;
			this.handler = handler;
		}
	}
}
