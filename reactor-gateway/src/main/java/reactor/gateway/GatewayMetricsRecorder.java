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
 * An interface representing ways for the gateway's connection pools to collect instrumentation data.
 * Every method takes the name of the backend the measure relates to, so that a single recorder can serve
 * every pool of a {@link reactor.gateway.pool.PoolManager}.
 */
public interface GatewayMetricsRecorder {

	/**
	 * Record a latency for successfully opening a backend transport. Implies incrementing an allocation success
	 * counter as well.
	 * @param backend the backend name
	 * @param latencyMs the latency in milliseconds
	 */
	void recordAllocationSuccessAndLatency(String backend, long latencyMs);

	/**
	 * Record a latency for failing to open a backend transport. Implies incrementing an allocation failure
	 * counter as well.
	 * @param backend the backend name
	 * @param latencyMs the latency in milliseconds
	 */
	void recordAllocationFailureAndLatency(String backend, long latencyMs);

	/**
	 * Record the time a connection stayed idle before it got reused.
	 * @param backend the backend name
	 * @param millisecondsIdle the idle time in milliseconds
	 */
	void recordIdleTime(String backend, long millisecondsIdle);

	/**
	 * Record the total lifetime of a connection that is being discarded.
	 * @param backend the backend name
	 * @param millisecondsSinceAllocation the lifetime in milliseconds
	 */
	void recordLifetimeDuration(String backend, long millisecondsSinceAllocation);

	/**
	 * Record the time an acquire spent in the wait queue before being handed a connection.
	 * @param backend the backend name
	 * @param latencyMs the time spent pending, in milliseconds
	 */
	void recordPendingSuccessAndLatency(String backend, long latencyMs);

	/**
	 * Record the time an acquire spent in the wait queue before being rejected, timed out or cancelled.
	 * @param backend the backend name
	 * @param latencyMs the time spent pending, in milliseconds
	 */
	void recordPendingFailureAndLatency(String backend, long latencyMs);

	/**
	 * Record how long a connection was checked out, measured when it is released.
	 * @param backend the backend name
	 * @param latencyMs the checkout duration in milliseconds
	 * @param success whether the caller reported the operation as successful
	 */
	void recordReleaseLatency(String backend, long latencyMs, boolean success);
}
