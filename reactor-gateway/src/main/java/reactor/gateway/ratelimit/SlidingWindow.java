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

import java.util.Arrays;

/**
 * A window split into equal segments, each counting the weight admitted while it was current. Advancing to a new
 * segment clears the segments skipped over, a whole cycle or more clears everything.
 */
final class SlidingWindow {

	final int    limit;
	final long   windowMs;
	final long[] segments;
	final long   windowStartAt;

	long currentSegment;

	SlidingWindow(int limit, long windowMs, int segmentCount, long now) {
		this.limit = limit;
		this.windowMs = windowMs;
		this.segments = new long[segmentCount];
		this.windowStartAt = now;
	}

	boolean check(int weight, long now) {
		advance(now);
		long sum = 0;
		for (long count : segments) {
			sum += count;
		}
		return sum + weight <= limit;
	}

	void consume(int weight) {
		segments[index(currentSegment)] += weight;
	}

	void advance(long now) {
		long expected = (now - windowStartAt) * segments.length / windowMs;
		long passed = expected - currentSegment;
		if (passed <= 0) {
			return;
		}
		if (passed >= segments.length) {
			Arrays.fill(segments, 0L);
		}
		else {
			for (long s = currentSegment + 1; s <= expected; s++) {
				segments[index(s)] = 0L;
			}
		}
		currentSegment = expected;
	}

	private int index(long segment) {
		return (int) (segment % segments.length);
	}
}
