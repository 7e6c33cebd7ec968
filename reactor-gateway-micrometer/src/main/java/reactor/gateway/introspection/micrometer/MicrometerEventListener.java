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

package reactor.gateway.introspection.micrometer;

import java.util.Locale;

import io.micrometer.core.instrument.MeterRegistry;

import reactor.gateway.GatewayEventListener;
import reactor.gateway.ratelimit.AdjustmentDirection;
import reactor.gateway.ratelimit.RateLimitGate;
import reactor.gateway.session.CloseReason;
import reactor.gateway.session.Session;

import static reactor.gateway.introspection.micrometer.DocumentedGatewayMeters.*;
import static reactor.gateway.introspection.micrometer.DocumentedGatewayMeters.AdjustmentTags.DIRECTION;
import static reactor.gateway.introspection.micrometer.DocumentedGatewayMeters.CleanupTags.COMPONENT;
import static reactor.gateway.introspection.micrometer.DocumentedGatewayMeters.CommonTags.BACKEND;
import static reactor.gateway.introspection.micrometer.DocumentedGatewayMeters.RateLimitTags.GATE;
import static reactor.gateway.introspection.micrometer.DocumentedGatewayMeters.SessionClosedTags.REASON;

/**
 * Counts the gateway events. Connection releases are not counted here, the {@link MicrometerMetricsRecorder} already
 * times them.
 */
final class MicrometerEventListener implements GatewayEventListener {

	private final MeterRegistry meterRegistry;

	MicrometerEventListener(MeterRegistry registry) {
		this.meterRegistry = registry;
	}

	@Override
	public void onPoolInitialized(String backend, int maxConnections) {
	}

	@Override
	public void onConnectionReleased(String backend, String connectionId, long latencyMs, boolean success) {
	}

	@Override
	public void onRateLimitHit(RateLimitGate gate, String key) {
		//the key is unbounded, only the gate makes a tag
		meterRegistry.counter(RATE_LIMIT_HITS.getName(), GATE.asString(), tagValue(gate)).increment();
	}

	@Override
	public void onAdaptiveAdjustment(String key, AdjustmentDirection direction, double newLimit, double averageLoad) {
		meterRegistry.counter(ADAPTIVE_ADJUSTMENTS.getName(), DIRECTION.asString(), tagValue(direction)).increment();
	}

	@Override
	public void onCleanupCompleted(String component, int removed) {
		meterRegistry.counter(CLEANUP_REMOVED.getName(), COMPONENT.asString(), component).increment(removed);
	}

	@Override
	public void onSessionCreated(Session session) {
		meterRegistry.counter(SESSIONS_CREATED.getName(), BACKEND.asString(), session.backend()).increment();
	}

	@Override
	public void onSessionClosed(Session session, CloseReason reason) {
		meterRegistry.counter(SESSIONS_CLOSED.getName(), BACKEND.asString(), session.backend(),
				REASON.asString(), tagValue(reason)).increment();
	}

	static String tagValue(Enum<?> value) {
		return value.name().toLowerCase(Locale.ROOT);
	}
}
