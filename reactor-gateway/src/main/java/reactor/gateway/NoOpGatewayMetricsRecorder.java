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

/**
 * A No-Op {@link GatewayMetricsRecorder} that can be used as a default if instrumentation is not desired.
 */
public final class NoOpGatewayMetricsRecorder implements GatewayMetricsRecorder {

	public static final NoOpGatewayMetricsRecorder INSTANCE = new NoOpGatewayMetricsRecorder();

	NoOpGatewayMetricsRecorder() {

	}

	@Override
	public void recordAllocationSuccessAndLatency(String backend, long latencyMs) {

	}

	@Override
	public void recordAllocationFailureAndLatency(String backend, long latencyMs) {

	}

	@Override
	public void recordIdleTime(String backend, long millisecondsIdle) {

	}

	@Override
	public void recordLifetimeDuration(String backend, long millisecondsSinceAllocation) {

	}

	@Override
	public void recordPendingSuccessAndLatency(String backend, long latencyMs) {

	}

	@Override
	public void recordPendingFailureAndLatency(String backend, long latencyMs) {

	}

	@Override
	public void recordReleaseLatency(String backend, long latencyMs, boolean success) {

	}
}
