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

import java.util.concurrent.atomic.AtomicReferenceFieldUpdater;

import org.jspecify.annotations.Nullable;

import reactor.gateway.pool.PooledConnection;

/**
 * A client conversation with one backend, spanning many calls, holding a single {@link PooledConnection} for its
 * whole lifetime. A session closes exactly once, at which point its connection goes back to the pool.
 */
public final class Session {

	final String           sessionId;
	final String           userId;
	final String           backend;
	final String           credential;
	final PooledConnection lease;
	final long             createdAt;

	volatile long lastActiveAt;

	volatile @Nullable CloseReason closeReason;
	static final AtomicReferenceFieldUpdater<Session, CloseReason> CLOSE_REASON =
			AtomicReferenceFieldUpdater.newUpdater(Session.class, CloseReason.class, "closeReason");

	Session(String sessionId, String userId, String backend, String credential, PooledConnection lease, long now) {
		this.sessionId = sessionId;
		this.userId = userId;
		this.backend = backend;
		this.credential = credential;
		this.lease = lease;
		this.createdAt = now;
		this.lastActiveAt = now;
	}

	public String sessionId() {
		return sessionId;
	}

	public String userId() {
		return userId;
	}

	public String backend() {
		return backend;
	}

	/**
	 * @return the reference of the per-user credential the session was opened with
	 */
	public String credential() {
		return credential;
	}

	public PooledConnection connection() {
		return lease;
	}

	public long createdAt() {
		return createdAt;
	}

	public long lastActiveAt() {
		return lastActiveAt;
	}

	public boolean isOpen() {
		return closeReason == null;
	}

	/**
	 * @return true if the session is open and its connection is still usable
	 */
	public boolean isValid() {
		return closeReason == null && lease.isValid();
	}

	/**
	 * @return why the session closed, or null if it is still open
	 */
	public @Nullable CloseReason closeReason() {
		return closeReason;
	}

	void touch(long now) {
		this.lastActiveAt = now;
	}

	boolean isIdle(long now, long timeoutMs) {
		return timeoutMs > 0 && now - lastActiveAt > timeoutMs;
	}

	boolean markClosed(CloseReason reason) {
		return CLOSE_REASON.compareAndSet(this, null, reason);
	}

	@Override
	public String toString() {
		return "Session{" +
				"sessionId='" + sessionId + '\'' +
				", userId='" + userId + '\'' +
				", backend='" + backend + '\'' +
				", connection=" + lease.connection().id() +
				", closeReason=" + closeReason +
				'}';
	}
}
