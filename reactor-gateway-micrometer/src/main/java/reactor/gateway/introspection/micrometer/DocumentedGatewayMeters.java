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

import io.micrometer.common.docs.KeyName;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.docs.DocumentedMeter;

/**
 * Meters used by {@link Micrometer} utility.
 */
enum DocumentedGatewayMeters implements DocumentedMeter {

	ACQUIRED {
		@Override
		public String getName() {
			return "reactor.gateway.connections.acquired";
		}

		@Override
		public Meter.Type getType() {
			return Meter.Type.GAUGE;
		}

		@Override
		public KeyName[] getKeyNames() {
			return CommonTags.values();
		}
	},
	ALLOCATED {
		@Override
		public String getName() {
			return "reactor.gateway.connections.allocated";
		}

		@Override
		public Meter.Type getType() {
			return Meter.Type.GAUGE;
		}

		@Override
		public KeyName[] getKeyNames() {
			return CommonTags.values();
		}
	},
	IDLE {
		@Override
		public String getName() {
			return "reactor.gateway.connections.idle";
		}

		@Override
		public Meter.Type getType() {
			return Meter.Type.GAUGE;
		}

		@Override
		public KeyName[] getKeyNames() {
			return CommonTags.values();
		}
	},
	PENDING_ACQUIRE {
		@Override
		public String getName() {
			return "reactor.gateway.connections.pendingAcquire";
		}

		@Override
		public Meter.Type getType() {
			return Meter.Type.GAUGE;
		}

		@Override
		public KeyName[] getKeyNames() {
			return CommonTags.values();
		}
	},


	ALLOCATION {
		@Override
		public String getName() {
			return "reactor.gateway.allocation";
		}

		@Override
		public Meter.Type getType() {
			return Meter.Type.TIMER;
		}

		@Override
		public KeyName[] getKeyNames() {
			return KeyName.merge(CommonTags.values(), OutcomeTags.values());
		}
	},

	PENDING {
		@Override
		public String getName() {
			return "reactor.gateway.pending";
		}

		@Override
		public Meter.Type getType() {
			return Meter.Type.TIMER;
		}

		@Override
		public KeyName[] getKeyNames() {
			return KeyName.merge(CommonTags.values(), OutcomeTags.values());
		}
	},

	RELEASE {
		@Override
		public String getName() {
			return "reactor.gateway.release";
		}

		@Override
		public Meter.Type getType() {
			return Meter.Type.TIMER;
		}

		@Override
		public KeyName[] getKeyNames() {
			return KeyName.merge(CommonTags.values(), OutcomeTags.values());
		}
	},

	SUMMARY_IDLENESS {
		@Override
		public String getName() {
			return "reactor.gateway.connections.summary.idleness";
		}

		@Override
		public Meter.Type getType() {
			return Meter.Type.TIMER;
		}

		@Override
		public KeyName[] getKeyNames() {
			return CommonTags.values();
		}
	},

	SUMMARY_LIFETIME {
		@Override
		public String getName() {
			return "reactor.gateway.connections.summary.lifetime";
		}

		@Override
		public Meter.Type getType() {
			return Meter.Type.TIMER;
		}

		@Override
		public KeyName[] getKeyNames() {
			return CommonTags.values();
		}
	},


	RATE_LIMIT_HITS {
		@Override
		public String getName() {
			return "reactor.gateway.ratelimit.hits";
		}

		@Override
		public Meter.Type getType() {
			return Meter.Type.COUNTER;
		}

		@Override
		public KeyName[] getKeyNames() {
			return RateLimitTags.values();
		}
	},

	ADAPTIVE_ADJUSTMENTS {
		@Override
		public String getName() {
			return "reactor.gateway.ratelimit.adjustments";
		}

		@Override
		public Meter.Type getType() {
			return Meter.Type.COUNTER;
		}

		@Override
		public KeyName[] getKeyNames() {
			return AdjustmentTags.values();
		}
	},

	SESSIONS_CREATED {
		@Override
		public String getName() {
			return "reactor.gateway.sessions.created";
		}

		@Override
		public Meter.Type getType() {
			return Meter.Type.COUNTER;
		}

		@Override
		public KeyName[] getKeyNames() {
			return CommonTags.values();
		}
	},

	SESSIONS_CLOSED {
		@Override
		public String getName() {
			return "reactor.gateway.sessions.closed";
		}

		@Override
		public Meter.Type getType() {
			return Meter.Type.COUNTER;
		}

		@Override
		public KeyName[] getKeyNames() {
			return KeyName.merge(CommonTags.values(), SessionClosedTags.values());
		}
	},

	CLEANUP_REMOVED {
		@Override
		public String getName() {
			return "reactor.gateway.cleanup.removed";
		}

		@Override
		public Meter.Type getType() {
			return Meter.Type.COUNTER;
		}

		@Override
		public KeyName[] getKeyNames() {
			return CleanupTags.values();
		}
	};

	public enum CommonTags implements KeyName {

		/**
		 * The name of the backend the meter is about.
		 */
		BACKEND {
			@Override
			public String asString() {
				return "backend";
			}
		}
	}

	public enum OutcomeTags implements KeyName {

		/**
		 * Indicates whether the timed operation was a {@code success} or {@code failure}.
		 */
		OUTCOME {
			@Override
			public String asString() {
				return "outcome";
			}
		};

		public static final Tag OUTCOME_SUCCESS = Tag.of(OUTCOME.asString(), "success");
		public static final Tag OUTCOME_FAILURE = Tag.of(OUTCOME.asString(), "failure");
	}

	public enum RateLimitTags implements KeyName {

		/**
		 * The first gate that rejected the request: {@code user}, {@code backend}, {@code bucket} or {@code window}.
		 */
		GATE {
			@Override
			public String asString() {
				return "gate";
			}
		}
	}

	public enum AdjustmentTags implements KeyName {

		/**
		 * Whether the capacity was {@code reduce}d or {@code increase}d.
		 */
		DIRECTION {
			@Override
			public String asString() {
				return "direction";
			}
		}
	}

	public enum SessionClosedTags implements KeyName {

		/**
		 * Why the session closed.
		 */
		REASON {
			@Override
			public String asString() {
				return "reason";
			}
		}
	}

	public enum CleanupTags implements KeyName {

		/**
		 * The swept component: {@code pool}, {@code ratelimit} or {@code sessions}.
		 */
		COMPONENT {
			@Override
			public String asString() {
				return "component";
			}
		}
	}
}
