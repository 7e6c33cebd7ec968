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

package reactor.gateway.ratelimit;

import java.util.ArrayDeque;

/**
 * Load samples of one composite key and the capacity adaptive throttling currently grants its bucket.
 * The capacity stays between 10% of the original capacity and the original capacity.
 */
final class AdaptiveState {

	static final double FLOOR_RATIO = 0.1d;

	final double originalLimit;
	final long   windowMs;
	final ArrayDeque<LoadSample> samples = new ArrayDeque<>();

	double currentLimit;
	long   lastAdjustmentAt;

	AdaptiveState(double originalLimit, long windowMs, long now) {
		this.originalLimit = originalLimit;
		this.currentLimit = originalLimit;
		this.windowMs = windowMs;
		this.lastAdjustmentAt = now;
	}

	void record(double load, long now) {
		samples.addLast(new LoadSample(now, load));
		LoadSample oldest;
		while ((oldest = samples.peekFirst()) != null && now - oldest.at >= windowMs) {
			samples.pollFirst();
		}
	}

	boolean isAdjustmentDue(long now) {
		return now - lastAdjustmentAt >= windowMs;
	}

	double averageLoad() {
		if (samples.isEmpty()) {
			return 0d;
		}
		double sum = 0d;
		for (LoadSample sample : samples) {
			sum += sample.load;
		}
		return sum / samples.size();
	}

	double floor() {
		return originalLimit * FLOOR_RATIO;
	}

	static final class LoadSample {

		final long   at;
		final double load;

		LoadSample(long at, double load) {
			this.at = at;
			this.load = load;
		}
	}
}
