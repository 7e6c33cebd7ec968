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

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicIntegerFieldUpdater;

import org.jspecify.annotations.Nullable;

import reactor.core.Disposable;
import reactor.core.scheduler.Scheduler;

/**
 * The FIFO queue of acquires waiting for a connection of one backend, with a timeout per entry.
 * <p>
 * Offering never fails: the owning {@link ConnectionPool} brings the queue back under {@link #maxSize()} by
 * culling the most recent entries with {@link #pollLast()} whenever it finds itself unable to serve the head.
 */
final class WaitQueue {

	final ConcurrentLinkedDeque<Borrower> borrowers = new ConcurrentLinkedDeque<>();
	final int                             maxSize;
	final Duration                        timeout;
	final Scheduler                       timer;

	volatile int size;
	static final AtomicIntegerFieldUpdater<WaitQueue> SIZE =
			AtomicIntegerFieldUpdater.newUpdater(WaitQueue.class, "size");

	WaitQueue(int maxSize, Duration timeout, Scheduler timer) {
		this.maxSize = maxSize;
		this.timeout = timeout;
		this.timer = timer;
	}

	int size() {
		return size;
	}

	int maxSize() {
		return maxSize;
	}

	void offer(Borrower borrower) {
		if (borrowers.offerLast(borrower)) {
			SIZE.incrementAndGet(this);
		}
	}

	/**
	 * @return the oldest entry, or null if the queue is empty
	 */
	@Nullable
	Borrower poll() {
		Borrower b = borrowers.pollFirst();
		if (b != null) {
			SIZE.decrementAndGet(this);
		}
		return b;
	}

	/**
	 * @return the most recent entry, or null if the queue is empty
	 */
	@Nullable
	Borrower pollLast() {
		Borrower b = borrowers.pollLast();
		if (b != null) {
			SIZE.decrementAndGet(this);
		}
		return b;
	}

	boolean remove(Borrower borrower) {
		if (borrowers.remove(borrower)) {
			SIZE.decrementAndGet(this);
			return true;
		}
		return false;
	}

	/**
	 * Arm the timeout of an entry that is still waiting after the first attempt at serving it.
	 */
	void startCountdown(Borrower borrower) {
		if (!borrower.isPending()) {
			return;
		}
		borrower.queued = true;
		if (timeout.isZero()) {
			return;
		}
		Disposable task = timer.schedule(borrower, timeout.toMillis(), TimeUnit.MILLISECONDS);
		if (!borrower.setTimeoutTask(task)) {
			//served or terminated in the meantime
			task.dispose();
		}
	}

	/**
	 * Remove and return the entries that have been waiting for at least the timeout.
	 */
	List<Borrower> pollExpired(long now) {
		if (timeout.isZero() || size == 0) {
			return Collections.emptyList();
		}
		long timeoutMs = timeout.toMillis();
		List<Borrower> expired = new ArrayList<>();
		Iterator<Borrower> iterator = borrowers.iterator();
		while (iterator.hasNext()) {
			Borrower b = iterator.next();
			if (now - b.enqueuedAt >= timeoutMs && remove(b)) {
				expired.add(b);
			}
		}
		return expired;
	}
}
