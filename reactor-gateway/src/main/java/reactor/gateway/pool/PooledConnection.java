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

import java.util.concurrent.atomic.AtomicIntegerFieldUpdater;

/**
 * A lease on a {@link BackendConnection}, handed out by {@link PoolManager#acquire(String, String, String)}.
 * <p>
 * A new lease is created for every checkout and can be released only once: releasing a stale lease after the
 * connection went back to the pool, and possibly to another caller, is a no-op.
 */
public final class PooledConnection {

	final BackendConnection connection;
	final String            userId;
	final String            requestId;
	final long              acquiredAt;

	volatile boolean invalidated;

	volatile int released;
	static final AtomicIntegerFieldUpdater<PooledConnection> RELEASED =
			AtomicIntegerFieldUpdater.newUpdater(PooledConnection.class, "released");

	PooledConnection(BackendConnection connection, String userId, String requestId, long acquiredAt) {
		this.connection = connection;
		this.userId = userId;
		this.requestId = requestId;
		this.acquiredAt = acquiredAt;
	}

	public BackendConnection connection() {
		return connection;
	}

	public String backend() {
		return connection.backend;
	}

	public String userId() {
		return userId;
	}

	public String requestId() {
		return requestId;
	}

	public long acquiredAt() {
		return acquiredAt;
	}

	public boolean isReleased() {
		return released == 1;
	}

	/**
	 * Flag the underlying connection as broken. It will be discarded instead of going back to the idle set
	 * once this lease is released.
	 */
	public void invalidate() {
		this.invalidated = true;
	}

	/**
	 * @return true if this lease can still be used: not released, not invalidated, and its connection is valid
	 */
	public boolean isValid() {
		return released == 0 && !invalidated && connection.isValid();
	}

	boolean markReleased() {
		return RELEASED.compareAndSet(this, 0, 1);
	}

	@Override
	public String toString() {
		return "PooledConnection{" +
				"connection=" + connection.id +
				", userId='" + userId + '\'' +
				", requestId='" + requestId + '\'' +
				", released=" + (released == 1) +
				'}';
	}
}
