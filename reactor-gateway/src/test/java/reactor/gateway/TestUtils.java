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

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import reactor.gateway.ratelimit.AdjustmentDirection;
import reactor.gateway.ratelimit.RateLimitGate;
import reactor.gateway.session.CloseReason;
import reactor.gateway.session.Session;
import reactor.scheduler.clock.SchedulerClock;
import reactor.test.scheduler.VirtualTimeScheduler;

public class TestUtils {

	/**
	 * @return a configuration builder whose clock and timer are driven by the given {@link VirtualTimeScheduler}
	 */
	public static GatewayConfig.Builder virtualTime(VirtualTimeScheduler vts) {
		return GatewayConfig.builder()
		                    .clock(SchedulerClock.of(vts))
		                    .timer(vts);
	}

	/**
	 * A {@link GatewayEventListener} keeping a textual trace of every event it receives.
	 */
	public static final class RecordingEventListener implements GatewayEventListener {

		public final List<String> events = new CopyOnWriteArrayList<>();

		@Override
		public void onPoolInitialized(String backend, int maxConnections) {
			events.add("poolInitialized:" + backend + ":" + maxConnections);
		}

		@Override
		public void onConnectionReleased(String backend, String connectionId, long latencyMs, boolean success) {
			events.add("released:" + connectionId + ":" + success);
		}

		@Override
		public void onRateLimitHit(RateLimitGate gate, String key) {
			events.add("rateLimitHit:" + gate + ":" + key);
		}

		@Override
		public void onAdaptiveAdjustment(String key, AdjustmentDirection direction, double newLimit, double averageLoad) {
			events.add("adjustment:" + key + ":" + direction);
		}

		@Override
		public void onCleanupCompleted(String component, int removed) {
			events.add("cleanup:" + component + ":" + removed);
		}

		@Override
		public void onSessionCreated(Session session) {
			events.add("sessionCreated:" + session.sessionId());
		}

		@Override
		public void onSessionClosed(Session session, CloseReason reason) {
			events.add("sessionClosed:" + session.sessionId() + ":" + reason);
		}

		public long count(String prefix) {
			return events.stream().filter(e -> e.startsWith(prefix)).count();
		}
	}
}
