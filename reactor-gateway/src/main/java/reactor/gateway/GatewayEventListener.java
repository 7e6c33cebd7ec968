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

import reactor.gateway.ratelimit.AdjustmentDirection;
import reactor.gateway.ratelimit.RateLimitGate;
import reactor.gateway.session.CloseReason;
import reactor.gateway.session.Session;

/**
 * Observer of the notable events of the gateway core, typically bridged to a monitoring system.
 * <p>
 * Callbacks are invoked synchronously from whichever thread triggered the event, outside of any internal
 * lock. Implementations must be fast and must not throw.
 */
public interface GatewayEventListener {

	/**
	 * A connection pool has been created for a backend.
	 *
	 * @param backend the backend name
	 * @param maxConnections the connection ceiling of the new pool
	 */
	void onPoolInitialized(String backend, int maxConnections);

	/**
	 * A connection has been given back to its pool.
	 *
	 * @param backend the backend name
	 * @param connectionId the id of the released connection
	 * @param latencyMs how long the connection was checked out
	 * @param success whether the caller reported success
	 */
	void onConnectionReleased(String backend, String connectionId, long latencyMs, boolean success);

	/**
	 * The rate limiter rejected a request.
	 *
	 * @param gate the first gate that blocked
	 * @param key the key of that gate: a user id, a backend name or a composite key
	 */
	void onRateLimitHit(RateLimitGate gate, String key);

	/**
	 * The adaptive throttling changed the token bucket capacity of a key.
	 *
	 * @param key the composite key
	 * @param direction whether capacity was reduced or increased
	 * @param newLimit the new bucket capacity
	 * @param averageLoad the average load that triggered the adjustment
	 */
	void onAdaptiveAdjustment(String key, AdjustmentDirection direction, double newLimit, double averageLoad);

	/**
	 * A periodic sweep has completed.
	 *
	 * @param component the swept component: {@code "pool"}, {@code "ratelimit"} or {@code "sessions"}
	 * @param removed how many entries the sweep removed
	 */
	void onCleanupCompleted(String component, int removed);

	void onSessionCreated(Session session);

	void onSessionClosed(Session session, CloseReason reason);
}
