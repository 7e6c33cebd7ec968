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

import io.micrometer.core.instrument.MeterRegistry;

import reactor.gateway.GatewayConfig;
import reactor.gateway.GatewayEventListener;
import reactor.gateway.GatewayMetricsRecorder;
import reactor.gateway.pool.PoolManager;

/**
 * Micrometer supporting utilities for instrumentation of reactor-gateway.
 */
public final class Micrometer {

	/**
	 * Configure a {@link GatewayConfig.Builder} to publish the pool timings and the gateway events to a Micrometer
	 * {@link MeterRegistry}, replacing any recorder and listener it had.
	 * <p>
	 * The steps involved are as follows:
	 * <ol>
	 *     <li> create a {@link GatewayMetricsRecorder} similar to {@link #recorder(MeterRegistry)} </li>
	 *     <li> create a {@link GatewayEventListener} similar to {@link #eventListener(MeterRegistry)} </li>
	 *     <li> set both on the builder and return it </li>
	 * </ol>
	 * Gauges are registered separately, per backend, with {@link #gaugesOf(PoolManager.PoolMetrics, String, MeterRegistry)}.
	 *
	 * @param builder the builder to instrument
	 * @param meterRegistry the registry to use for the meters
	 * @return the same builder
	 * @see DocumentedGatewayMeters
	 */
	public static GatewayConfig.Builder instrument(GatewayConfig.Builder builder, MeterRegistry meterRegistry) {
		return builder.metricsRecorder(recorder(meterRegistry))
		              .eventListener(eventListener(meterRegistry));
	}

	/**
	 * Register Micrometer gauges around the {@link PoolManager.PoolMetrics} of a backend, publishing to the provided
	 * {@link MeterRegistry}. The backend name is set on all meters as the value of the {@code backend} tag.
	 *
	 * @param poolMetrics the metrics obtained from {@link PoolManager#metrics(String)}
	 * @param backend the backend name
	 * @param meterRegistry the registry to use for the gauges
	 * @see BackendGaugesBinder
	 */
	public static void gaugesOf(PoolManager.PoolMetrics poolMetrics, String backend, MeterRegistry meterRegistry) {
		new BackendGaugesBinder(poolMetrics, backend).bindTo(meterRegistry);
	}

	/**
	 * Create a {@link GatewayMetricsRecorder} publishing timers to a provided {@link MeterRegistry}, tagged with
	 * the backend they are about.
	 * <p>
	 * The recorder-specific meters are:
	 * <ul>
	 *     <li> {@link DocumentedGatewayMeters#ALLOCATION} </li>
	 *     <li> {@link DocumentedGatewayMeters#PENDING} </li>
	 *     <li> {@link DocumentedGatewayMeters#RELEASE} </li>
	 *     <li> {@link DocumentedGatewayMeters#SUMMARY_IDLENESS} </li>
	 *     <li> {@link DocumentedGatewayMeters#SUMMARY_LIFETIME} </li>
	 * </ul>
	 *
	 * @param meterRegistry the registry to use for the recorder's meters
	 * @return a Micrometer {@link GatewayMetricsRecorder}
	 */
	public static GatewayMetricsRecorder recorder(MeterRegistry meterRegistry) {
		return new MicrometerMetricsRecorder(meterRegistry);
	}

	/**
	 * Create a {@link GatewayEventListener} counting rate limit hits, adaptive adjustments, session creations and
	 * closings, and what periodic sweeps removed.
	 *
	 * @param meterRegistry the registry to use for the counters
	 * @return a Micrometer {@link GatewayEventListener}
	 */
	public static GatewayEventListener eventListener(MeterRegistry meterRegistry) {
		return new MicrometerEventListener(meterRegistry);
	}

	private Micrometer() {
	}
}
