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

import java.time.Clock;
import java.time.Duration;

/**
 * A tri-state failure isolator guarding one backend.
 * <p>
 * The breaker is memoryless: failures accumulate until a success resets them, there is no decay over time.
 * <ul>
 *     <li>{@link State#CLOSED} to {@link State#OPEN} once the failure count reaches the threshold</li>
 *     <li>{@link State#OPEN} to {@link State#HALF_OPEN} on the first {@link #isOpen()} evaluated after the timeout
 *     elapsed since the last failure. That evaluation returns {@code false}, letting a single probe through</li>
 *     <li>{@link State#HALF_OPEN} to {@link State#CLOSED} on the next success, back to {@link State#OPEN} on the next failure</li>
 * </ul>
 * While a probe is outstanding, further {@link #isOpen()} calls return {@code true}. A probe that never reports
 * back is considered lost once another full timeout has elapsed, at which point a new probe is let through.
 */
public final class CircuitBreaker {

	/**
	 * The states of a {@link CircuitBreaker}.
	 */
	public enum State {
		CLOSED, OPEN, HALF_OPEN
	}

	final int   threshold;
	final long  timeoutMs;
	final Clock clock;

	//guarded by this
	State state = State.CLOSED;
	int   failureCount;
	long  lastFailureAt;
	long  probeStartedAt;

	public CircuitBreaker(int threshold, Duration timeout, Clock clock) {
		if (threshold <= 0) {
			throw new IllegalArgumentException("threshold must be strictly positive, got " + threshold);
		}
		this.threshold = threshold;
		this.timeoutMs = timeout.toMillis();
		this.clock = clock;
	}

	/**
	 * Evaluate whether calls must currently be rejected. This is not a pure read: it drives the
	 * {@link State#OPEN} to {@link State#HALF_OPEN} transition.
	 *
	 * @return true if calls must fail fast
	 */
	public synchronized boolean isOpen() {
		switch (state) {
			case OPEN: {
				long now = clock.millis();
				if (now - lastFailureAt >= timeoutMs) {
					state = State.HALF_OPEN;
					probeStartedAt = now;
					return false;
				}
				return true;
			}
			case HALF_OPEN: {
				long now = clock.millis();
				if (now - probeStartedAt >= timeoutMs) {
					//the previous probe never reported back
					probeStartedAt = now;
					return false;
				}
				return true;
			}
			default:
				return false;
		}
	}

	public synchronized void recordSuccess() {
		failureCount = 0;
		state = State.CLOSED;
	}

	public synchronized void recordFailure() {
		failureCount++;
		lastFailureAt = clock.millis();
		if (state == State.HALF_OPEN || failureCount >= threshold) {
			state = State.OPEN;
		}
	}

	public synchronized State state() {
		return state;
	}

	public synchronized int failureCount() {
		return failureCount;
	}

	/**
	 * @return the timestamp of the last recorded failure, or 0 if none was ever recorded
	 */
	public synchronized long lastFailureAt() {
		return lastFailureAt;
	}

	@Override
	public synchronized String toString() {
		return "CircuitBreaker{" +
				"state=" + state +
				", failureCount=" + failureCount +
				", threshold=" + threshold +
				'}';
	}
}
