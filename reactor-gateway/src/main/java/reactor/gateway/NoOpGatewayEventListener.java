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
 * A No-Op {@link GatewayEventListener}, the default when no listener is configured.
 */
public final class NoOpGatewayEventListener implements GatewayEventListener {

	public static final NoOpGatewayEventListener INSTANCE = new NoOpGatewayEventListener();

	NoOpGatewayEventListener() {

	}

	@Override
	public void onPoolInitialized(String backend, int maxConnections) {

	}

	@Override
	public void onConnectionReleased(String backend, String connectionId, long latencyMs, boolean success) {

	}

	@Override
	public void onRateLimitHit(RateLimitGate gate, String key) {

	}

	@Override
	public void onAdaptiveAdjustment(String key, AdjustmentDirection direction, double newLimit, double averageLoad) {

	}

	@Override
	public void onCleanupCompleted(String component, int removed) {

	}

	@Override
	public void onSessionCreated(Session session) {

	}

	@Override
	public void onSessionClosed(Session session, CloseReason reason) {

	}
}
