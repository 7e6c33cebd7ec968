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
 * Signals that an operation was attempted on, or was pending in, a component that has been disposed.
 */
public class PoolShutdownException extends GatewayException {

	public PoolShutdownException() {
		super(ErrorKind.POOL_SHUTDOWN, "Pool has been shut down", null);
	}

	public PoolShutdownException(String message) {
		super(ErrorKind.POOL_SHUTDOWN, message, null);
	}
}
