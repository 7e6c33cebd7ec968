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

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.binder.MeterBinder;

import reactor.gateway.pool.PoolManager;

import static reactor.gateway.introspection.micrometer.DocumentedGatewayMeters.CommonTags.BACKEND;

/**
 * A {@link MeterBinder} that registers Micrometer gauges around the {@link PoolManager.PoolMetrics} of one backend,
 * publishing to the provided {@link MeterRegistry}. The backend name is set on all meters as the value of the
 * {@code backend} tag.
 * <p>
 * The gauges are:
 * <ul>
 *     <li> {@link DocumentedGatewayMeters#ACQUIRED} </li>
 *     <li> {@link DocumentedGatewayMeters#ALLOCATED} </li>
 *     <li> {@link DocumentedGatewayMeters#IDLE} </li>
 *     <li> {@link DocumentedGatewayMeters#PENDING_ACQUIRE} </li>
 * </ul>
 * <p>
 * Note that this doesn't cover timings, which are measured by the recorder of {@link Micrometer#recorder(MeterRegistry)}.
 */
public final class BackendGaugesBinder implements MeterBinder {

	private final PoolManager.PoolMetrics poolMetrics;
	private final String                  backend;

	/**
	 * Create a {@link BackendGaugesBinder}.
	 *
	 * @param poolMetrics the {@link PoolManager.PoolMetrics} to turn into gauges
	 * @param backend the tag value to use on the gauges to differentiate between backends
	 */
	public BackendGaugesBinder(PoolManager.PoolMetrics poolMetrics, String backend) {
		this.poolMetrics = poolMetrics;
		this.backend = backend;
	}

	@Override
	public void bindTo(MeterRegistry meterRegistry) {
		Tags nameTag = Tags.of(BACKEND.asString(), backend);
		Gauge.builder(
				DocumentedGatewayMeters.ACQUIRED.getName(), poolMetrics,
				PoolManager.PoolMetrics::acquiredSize)
			.tags(nameTag)
			.register(meterRegistry);
		Gauge.builder(
				DocumentedGatewayMeters.ALLOCATED.getName(), poolMetrics,
				PoolManager.PoolMetrics::allocatedSize)
			.tags(nameTag)
			.register(meterRegistry);
		Gauge.builder(
				DocumentedGatewayMeters.IDLE.getName(), poolMetrics,
				PoolManager.PoolMetrics::idleSize)
			.tags(nameTag)
			.register(meterRegistry);
		Gauge.builder(
				DocumentedGatewayMeters.PENDING_ACQUIRE.getName(), poolMetrics,
				PoolManager.PoolMetrics::pendingAcquireSize)
			.tags(nameTag)
			.register(meterRegistry);
	}
}
