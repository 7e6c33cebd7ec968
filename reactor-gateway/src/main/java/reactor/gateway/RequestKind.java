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
 * The role of a {@link GatewayRequest} in the lifecycle of a session.
 */
public enum RequestKind {

	/**
	 * Opens a session. The only kind allowed without a session id.
	 */
	INITIALIZE,
	/**
	 * Any call within an open session.
	 */
	CALL,
	/**
	 * The last call of a session, which is closed once the call completes.
	 */
	TERMINATE
}
