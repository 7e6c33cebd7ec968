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

import java.util.concurrent.atomic.AtomicReferenceFieldUpdater;

import reactor.core.Disposable;

/**
 * A logical connection slot wrapping one live backend transport. Owned by its backend's {@link ConnectionPool}
 * while {@link State#IDLE}, by exactly one {@link PooledConnection lease} while {@link State#ACTIVE}.
 * A {@link State#DISCARDED} connection never comes back.
 */
public final class BackendConnection {

	/**
	 * The lifecycle of a {@link BackendConnection}.
	 */
	public enum State {
		IDLE, ACTIVE, DISCARDED
	}

	final String    id;
	final String    backend;
	final long      createdAt;
	final Disposable transport;

	volatile long  lastUsedAt;
	volatile State state;
	static final AtomicReferenceFieldUpdater<BackendConnection, State> STATE =
			AtomicReferenceFieldUpdater.newUpdater(BackendConnection.class, State.class, "state");

	BackendConnection(String id, String backend, Disposable transport, long now) {
		this.id = id;
		this.backend = backend;
		this.transport = transport;
		this.createdAt = now;
		this.lastUsedAt = now;
		this.state = State.ACTIVE;
	}

	public String id() {
		return id;
	}

	public String backend() {
		return backend;
	}

	public long createdAt() {
		return createdAt;
	}

	/**
	 * @return the last time this connection was handed out or given back
	 */
	public long lastUsedAt() {
		return lastUsedAt;
	}

	public State state() {
		return state;
	}

	public Disposable transport() {
		return transport;
	}

	/**
	 * @return true if the connection hasn't been discarded and its transport is still live
	 */
	public boolean isValid() {
		return state != State.DISCARDED && !transport.isDisposed();
	}

	boolean isExpired(long now, long idleTimeoutMs) {
		return idleTimeoutMs > 0 && now - lastUsedAt >= idleTimeoutMs;
	}

	boolean markActive(long now) {
		if (STATE.compareAndSet(this, State.IDLE, State.ACTIVE)) {
			this.lastUsedAt = now;
			return true;
		}
		return false;
	}

	boolean markIdle(long now) {
		if (STATE.compareAndSet(this, State.ACTIVE, State.IDLE)) {
			this.lastUsedAt = now;
			return true;
		}
		return false;
	}

	/**
	 * @return true if this call discarded the connection, false if it was already discarded
	 */
	boolean markDiscarded() {
		for (;;) {
			State s = state;
			if (s == State.DISCARDED) {
				return false;
			}
			if (STATE.compareAndSet(this, s, State.DISCARDED)) {
				return true;
			}
		}
	}

	@Override
	public String toString() {
		return "BackendConnection{" +
				"id='" + id + '\'' +
				", state=" + state +
				", lastUsedAt=" + lastUsedAt +
				'}';
	}
}
