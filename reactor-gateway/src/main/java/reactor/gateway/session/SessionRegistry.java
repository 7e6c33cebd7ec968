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

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicIntegerFieldUpdater;

import org.jspecify.annotations.Nullable;

import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Mono;
import reactor.gateway.AuthInvalidException;
import reactor.gateway.GatewayConfig;
import reactor.gateway.GatewayEventListener;
import reactor.gateway.InvalidSessionException;
import reactor.gateway.PoolShutdownException;
import reactor.gateway.pool.PoolManager;
import reactor.gateway.pool.PooledConnection;
import reactor.util.Logger;
import reactor.util.Loggers;

/**
 * Binds session ids to {@link Session sessions}, each holding one connection of the {@link PoolManager} from its
 * creation until it closes.
 * <p>
 * A session closes once, whichever comes first: {@link #terminate(String) explicit termination},
 * {@link #transportClosed(String) transport close}, a {@link #failed(String) failed opening or closing call}, idle
 * timeout, a connection found invalid on routing, or shutdown. Closing removes it from the registry and releases its connection.
 */
public final class SessionRegistry implements Disposable {

	static final Logger LOG = Loggers.getLogger(SessionRegistry.class);

	final PoolManager                     poolManager;
	final CredentialDirectory             credentials;
	final GatewayEventListener            listener;
	final Clock                           clock;
	final long                            sessionTimeoutMs;
	final ConcurrentMap<String, Session>  sessions = new ConcurrentHashMap<>();
	final Disposable                      sweepTask;

	volatile int disposed;
	static final AtomicIntegerFieldUpdater<SessionRegistry> DISPOSED =
			AtomicIntegerFieldUpdater.newUpdater(SessionRegistry.class, "disposed");

	public SessionRegistry(PoolManager poolManager, CredentialDirectory credentials, GatewayConfig config) {
		this.poolManager = Objects.requireNonNull(poolManager, "poolManager");
		this.credentials = Objects.requireNonNull(credentials, "credentials");
		this.listener = config.eventListener();
		this.clock = config.clock();
		this.sessionTimeoutMs = config.sessionTimeout().toMillis();
		long interval = config.cleanupInterval().toMillis();
		if (interval > 0) {
			this.sweepTask = config.timer().schedulePeriodically(this::cleanup, interval, interval, TimeUnit.MILLISECONDS);
		}
		else {
			this.sweepTask = Disposables.disposed();
		}
	}

	/**
	 * Open a session: verify the user's credential for the backend, acquire a connection, and register the session
	 * under a fresh id.
	 *
	 * @param userId the user opening the session
	 * @param backend the backend the session targets
	 * @param credential the per-user credential
	 * @return a {@link Mono} of the new session, failing with {@link AuthInvalidException} if the credential is
	 * rejected, or with any error of {@link PoolManager#acquire(String, String, String)}
	 */
	public Mono<Session> createSession(String userId, String backend, String credential) {
		return Mono.defer(() -> {
			if (isDisposed()) {
				return Mono.<Session>error(new PoolShutdownException("Session registry has been shut down"));
			}
			String sessionId = UUID.randomUUID().toString();
			return credentials.verify(userId, backend, credential)
			                  .defaultIfEmpty(Boolean.FALSE)
			                  .flatMap(valid -> {
				                  if (!valid) {
					                  return Mono.<Session>error(new AuthInvalidException("Invalid or disabled credential for user '"
							                  + userId + "' on backend '" + backend + "'"));
				                  }
				                  return poolManager.acquire(backend, userId, sessionId)
				                                    .flatMap(lease -> register(sessionId, userId, backend, credential, lease));
			                  });
		});
	}

	Mono<Session> register(String sessionId, String userId, String backend, String credential, PooledConnection lease) {
		Session session = new Session(sessionId, userId, backend, credential, lease, clock.millis());
		sessions.put(sessionId, session);
		if (isDisposed()) {
			//shutdown raced with the creation, the shutdown sweep may have missed this session
			return close(session, CloseReason.SHUTDOWN)
					.then(Mono.<Session>error(new PoolShutdownException("Session registry has been shut down")));
		}
		LOG.debug("Created session {} of user {} on backend {}", sessionId, userId, backend);
		listener.onSessionCreated(session);
		return Mono.just(session);
	}

	/**
	 * @return the open session with that id, or null. Unlike {@link #routeToSession(String)}, doesn't count as activity.
	 */
	@Nullable
	public Session find(String sessionId) {
		return sessions.get(sessionId);
	}

	/**
	 * Look up the session a call belongs to and mark it as active. Never creates a session.
	 *
	 * @param sessionId the session id presented by the call
	 * @return the session
	 * @throws InvalidSessionException if the id is unknown, or if the session's connection is no longer valid in which
	 * case the session is closed
	 */
	public Session routeToSession(String sessionId) {
		Session session = sessions.get(sessionId);
		if (session == null || !session.isOpen()) {
			throw new InvalidSessionException(sessionId, "unknown or expired session");
		}
		if (!session.connection().isValid()) {
			close(session, CloseReason.CONNECTION_INVALID).subscribe();
			throw new InvalidSessionException(sessionId, "the connection of the session is no longer valid");
		}
		session.touch(clock.millis());
		return session;
	}

	/**
	 * Close a session at the client's request. Terminating an unknown or already closed session is a no-op.
	 *
	 * @return a {@link Mono} completing once the session's connection has been released
	 */
	public Mono<Void> terminate(String sessionId) {
		return closeById(sessionId, CloseReason.TERMINATED);
	}

	/**
	 * Close a session because the backend failed the call that opened or ended it. The connection is released as a
	 * failure, counting against the backend's circuit breaker. A no-op for an unknown or already closed session.
	 */
	public Mono<Void> failed(String sessionId) {
		return closeById(sessionId, CloseReason.FAILED);
	}

	/**
	 * Close a session because the backend closed its transport. The session's connection is discarded rather than
	 * returned to the idle set. A no-op for an unknown or already closed session.
	 */
	public Mono<Void> transportClosed(String sessionId) {
		return Mono.defer(() -> {
			Session session = sessions.get(sessionId);
			if (session == null) {
				return Mono.empty();
			}
			session.connection().invalidate();
			return close(session, CloseReason.TRANSPORT_CLOSED);
		});
	}

	Mono<Void> closeById(String sessionId, CloseReason reason) {
		return Mono.defer(() -> {
			Session session = sessions.get(sessionId);
			if (session == null) {
				return Mono.empty();
			}
			return close(session, reason);
		});
	}

	Mono<Void> close(Session session, CloseReason reason) {
		if (!session.markClosed(reason)) {
			return Mono.empty();
		}
		sessions.remove(session.sessionId, session);
		LOG.debug("Closing session {} ({})", session.sessionId, reason);
		return poolManager.release(session.lease, reason.isSuccess())
		                  .then(Mono.fromRunnable(() -> listener.onSessionClosed(session, reason)));
	}

	/**
	 * Close the sessions that went unused for longer than the session timeout, or whose connection is no longer
	 * valid. Also runs periodically at the configured cleanup interval.
	 *
	 * @return the number of sessions closed
	 */
	public int cleanup() {
		long now = clock.millis();
		int closed = 0;
		for (Session session : sessions.values()) {
			CloseReason reason;
			if (session.isIdle(now, sessionTimeoutMs)) {
				reason = CloseReason.IDLE_TIMEOUT;
			}
			else if (!session.connection().isValid()) {
				reason = CloseReason.CONNECTION_INVALID;
			}
			else {
				continue;
			}
			if (session.isOpen()) {
				close(session, reason).subscribe(null,
						e -> LOG.warn("Error while closing session " + session.sessionId, e));
				closed++;
			}
		}
		if (closed > 0) {
			LOG.debug("Session sweep closed {} sessions", closed);
		}
		listener.onCleanupCompleted("sessions", closed);
		return closed;
	}

	public int sessionCount() {
		return sessions.size();
	}

	/**
	 * @return the number of open sessions bound to a backend
	 */
	public int sessionCount(String backend) {
		int count = 0;
		for (Session session : sessions.values()) {
			if (session.backend.equals(backend)) {
				count++;
			}
		}
		return count;
	}

	public Collection<Session> sessions() {
		return Collections.unmodifiableCollection(sessions.values());
	}

	/**
	 * Stop the idle sweep and close every session, releasing their connections. Nothing happens until the returned
	 * {@link Mono} is subscribed.
	 */
	public Mono<Void> disposeLater() {
		return Mono.defer(() -> {
			if (!DISPOSED.compareAndSet(this, 0, 1)) {
				return Mono.empty();
			}
			sweepTask.dispose();
			List<Mono<Void>> closing = new ArrayList<>();
			for (Session session : sessions.values()) {
				closing.add(close(session, CloseReason.SHUTDOWN));
			}
			return Mono.when(closing);
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

	@Override
	public String toString() {
		return "SessionRegistry{sessions=" + sessions.size() + '}';
	}
}
