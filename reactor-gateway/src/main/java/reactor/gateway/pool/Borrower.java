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
import java.util.concurrent.atomic.AtomicReferenceFieldUpdater;

import org.reactivestreams.Subscription;

import reactor.core.CoreSubscriber;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Operators;

/**
 * The {@link Subscription} given to the subscriber of an acquire, and at the same time the entry that waits in a
 * backend's {@link WaitQueue}. Also the {@link Runnable} scheduled as the entry's queue timeout.
 * <p>
 * Every transition out of {@link #PENDING} is a compare-and-set, so that serving, timing out, culling and
 * cancelling race safely and exactly one of them terminates the borrower.
 */
final class Borrower implements Subscription, Runnable {

	static final Disposable TIMEOUT_DISPOSED = Disposables.disposed();
	static final Disposable TIMEOUT_STOPPED  = Disposables.disposed();

	static final int PENDING   = 0;
	//taken out of the queue to be served, a connection is being handed or opened
	static final int ASSIGNED  = 1;
	static final int DELIVERED = 2;
	static final int FAILED    = 3;
	static final int CANCELLED = 4;

	final CoreSubscriber<? super PooledConnection> actual;
	final ConnectionPool                           pool;
	final String                                   userId;
	final String                                   requestId;

	long             enqueuedAt;
	volatile boolean admitted;
	volatile boolean queued;

	volatile int state;
	static final AtomicIntegerFieldUpdater<Borrower> STATE =
			AtomicIntegerFieldUpdater.newUpdater(Borrower.class, "state");

	volatile int requested;
	static final AtomicIntegerFieldUpdater<Borrower> REQUESTED =
			AtomicIntegerFieldUpdater.newUpdater(Borrower.class, "requested");

	volatile Disposable timeoutTask;
	static final AtomicReferenceFieldUpdater<Borrower, Disposable> TIMEOUT_TASK =
			AtomicReferenceFieldUpdater.newUpdater(Borrower.class, Disposable.class, "timeoutTask");

	Borrower(CoreSubscriber<? super PooledConnection> actual, ConnectionPool pool, String userId, String requestId) {
		this.actual = actual;
		this.pool = pool;
		this.userId = userId;
		this.requestId = requestId;
		this.timeoutTask = TIMEOUT_DISPOSED;
	}

	@Override
	public void request(long n) {
		if (Operators.validate(n) && REQUESTED.compareAndSet(this, 0, 1)) {
			pool.doAcquire(this);
		}
	}

	@Override
	public void cancel() {
		pool.cancelAcquire(this);
	}

	/**
	 * The queue timeout fired.
	 */
	@Override
	public void run() {
		pool.expire(this);
	}

	boolean isPending() {
		return state == PENDING;
	}

	/**
	 * Atomically set the timeout task if not already stopped.
	 *
	 * @return true if the task was set, false if countdown was already stopped
	 */
	boolean setTimeoutTask(Disposable task) {
		return TIMEOUT_TASK.compareAndSet(this, TIMEOUT_DISPOSED, task);
	}

	void stopPendingCountdown(boolean success) {
		if (queued) {
			long waited = pool.clock.millis() - enqueuedAt;
			if (success) {
				pool.metricsRecorder.recordPendingSuccessAndLatency(pool.backend, waited);
			}
			else {
				pool.metricsRecorder.recordPendingFailureAndLatency(pool.backend, waited);
			}
		}
		TIMEOUT_TASK.getAndSet(this, TIMEOUT_STOPPED).dispose();
	}

	/**
	 * Take the borrower out of the waiting state so that it can be served.
	 *
	 * @return false if it was concurrently terminated, in which case it must be skipped
	 */
	boolean assign() {
		if (STATE.compareAndSet(this, PENDING, ASSIGNED)) {
			stopPendingCountdown(true);
			return true;
		}
		return false;
	}

	/**
	 * @return false if the borrower was cancelled while being served, the lease then hasn't been emitted
	 */
	boolean deliver(PooledConnection lease) {
		if (STATE.compareAndSet(this, ASSIGNED, DELIVERED)) {
			actual.onNext(lease);
			actual.onComplete();
			return true;
		}
		return false;
	}

	/**
	 * Terminate the borrower with an error, from either the waiting or the assigned state.
	 *
	 * @return true if this call terminated the borrower
	 */
	boolean fail(Throwable error) {
		for (;;) {
			int s = state;
			if (s != PENDING && s != ASSIGNED) {
				return false;
			}
			if (STATE.compareAndSet(this, s, FAILED)) {
				if (s == PENDING) {
					stopPendingCountdown(false);
				}
				actual.onError(error);
				return true;
			}
		}
	}

	/**
	 * @return true if this call cancelled the borrower
	 */
	boolean markCancelled() {
		for (;;) {
			int s = state;
			if (s != PENDING && s != ASSIGNED) {
				return false;
			}
			if (STATE.compareAndSet(this, s, CANCELLED)) {
				if (s == PENDING) {
					//not a failure, the subscriber lost interest
					stopPendingCountdown(true);
				}
				return true;
			}
		}
	}

	@Override
	public String toString() {
		return "Borrower{" +
				"requestId='" + requestId + '\'' +
				", userId='" + userId + '\'' +
				", state=" + state +
				'}';
	}

	/**
	 * The {@link Mono} returned by an acquire. Each subscription creates a new {@link Borrower}, unknown to the
	 * pool until requested.
	 */
	static final class BorrowerMono extends Mono<PooledConnection> {

		final ConnectionPool pool;
		final String         userId;
		final String         requestId;

		BorrowerMono(ConnectionPool pool, String userId, String requestId) {
			this.pool = pool;
			this.userId = userId;
			this.requestId = requestId;
		}

		@Override
		public void subscribe(CoreSubscriber<? super PooledConnection> actual) {
			Borrower borrower = new Borrower(actual, pool, userId, requestId);
			actual.onSubscribe(borrower);
		}
	}
}
