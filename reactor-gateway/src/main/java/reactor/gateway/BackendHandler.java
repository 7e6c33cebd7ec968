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

import reactor.core.publisher.Mono;
import reactor.gateway.session.Session;

/**
 * Executes the calls routed to one backend, over the connection bound to the calling session.
 */
@FunctionalInterface
public interface BackendHandler {

	/**
	 * @param session the session of the call, holding the backend connection
	 * @param request the call
	 * @return a {@link Mono} of the call result, possibly empty
	 */
	Mono<?> handle(Session session, GatewayRequest request);
}
