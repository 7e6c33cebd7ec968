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

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

import reactor.gateway.GatewayMetricsRecorder;

import static reactor.gateway.introspection.micrometer.DocumentedGatewayMeters.*;
import static reactor.gateway.introspection.micrometer.DocumentedGatewayMeters.CommonTags.BACKEND;
import static reactor.gateway.introspection.micrometer.DocumentedGatewayMeters.OutcomeTags.OUTCOME_FAILURE;
import static reactor.gateway.introspection.micrometer.DocumentedGatewayMeters.OutcomeTags.OUTCOME_SUCCESS;

final class MicrometerMetricsRecorder implements GatewayMetricsRecorder {

	private final MeterRegistry                        meterRegistry;
	private final ConcurrentMap<String, BackendMeters> meters = new ConcurrentHashMap<>();

	MicrometerMetricsRecorder(MeterRegistry registry) {
		this.meterRegistry = registry;
	}

	BackendMeters meters(String backend) {
		return meters.computeIfAbsent(backend, b -> new BackendMeters(b, meterRegistry));
	}

	@Override
	public void recordAllocationSuccessAndLatency(String backend, long latencyMs) {
		meters(backend).allocationSuccessTimer.record(latencyMs, TimeUnit.MILLISECONDS);
	}

	@Override
	public void recordAllocationFailureAndLatency(String backend, long latencyMs) {
		meters(backend).allocationFailureTimer.record(latencyMs, TimeUnit.MILLISECONDS);
	}

	@Override
	public void recordIdleTime(String backend, long millisecondsIdle) {
		meters(backend).resourceSummaryIdleness.record(millisecondsIdle, TimeUnit.MILLISECONDS);
	}

	@Override
	public void recordLifetimeDuration(String backend, long millisecondsSinceAllocation) {
		meters(backend).resourceSummaryLifetime.record(millisecondsSinceAllocation, TimeUnit.MILLISECONDS);
	}

	@Override
	public void recordPendingSuccessAndLatency(String backend, long latencyMs) {
		meters(backend).pendingSuccessTimer.record(latencyMs, TimeUnit.MILLISECONDS);
	}

	@Override
	public void recordPendingFailureAndLatency(String backend, long latencyMs) {
		meters(backend).pendingFailureTimer.record(latencyMs, TimeUnit.MILLISECONDS);
	}

	@Override
	public void recordReleaseLatency(String backend, long latencyMs, boolean success) {
		BackendMeters m = meters(backend);
		(success ? m.releaseSuccessTimer : m.releaseFailureTimer).record(latencyMs, TimeUnit.MILLISECONDS);
	}

	static final class BackendMeters {

		final Timer allocationSuccessTimer;
		final Timer allocationFailureTimer;
		final Timer pendingSuccessTimer;
		final Timer pendingFailureTimer;
		final Timer releaseSuccessTimer;
		final Timer releaseFailureTimer;
		final Timer resourceSummaryIdleness;
		final Timer resourceSummaryLifetime;

		BackendMeters(String backend, MeterRegistry registry) {
			final Tags nameTag = Tags.of(BACKEND.asString(), backend);

			allocationSuccessTimer = registry.timer(ALLOCATION.getName(), nameTag.and(OUTCOME_SUCCESS));
			allocationFailureTimer = registry.timer(ALLOCATION.getName(), nameTag.and(OUTCOME_FAILURE));

			pendingSuccessTimer = registry.timer(PENDING.getName(), nameTag.and(OUTCOME_SUCCESS));
			pendingFailureTimer = registry.timer(PENDING.getName(), nameTag.and(OUTCOME_FAILURE));

			releaseSuccessTimer = registry.timer(RELEASE.getName(), nameTag.and(OUTCOME_SUCCESS));
			releaseFailureTimer = registry.timer(RELEASE.getName(), nameTag.and(OUTCOME_FAILURE));

			resourceSummaryIdleness = registry.timer(SUMMARY_IDLENESS.getName(), nameTag);
			resourceSummaryLifetime = registry.timer(SUMMARY_LIFETIME.getName(), nameTag);
		}
	}
}
