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

import java.time.Duration;

/**
 * Rejects a request without touching the backend because its circuit breaker is open.
 */
public class CircuitOpenException extends GatewayException {

	public CircuitOpenException(String backend, Duration breakerTimeout) {
		super(ErrorKind.CIRCUIT_OPEN, "Circuit breaker is open for backend '" + backend + "'", breakerTimeout);
	}
}
