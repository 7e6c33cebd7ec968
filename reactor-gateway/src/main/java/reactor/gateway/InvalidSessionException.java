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
 * The session id presented by a request is unknown, already closed, or bound to a connection
 * that is no longer valid. Callers are expected to initialize a new session.
 */
public class InvalidSessionException extends GatewayException {

	public InvalidSessionException(String sessionId, String reason) {
		super(ErrorKind.INVALID_SESSION, "Invalid session '" + sessionId + "': " + reason, null);
	}
}
