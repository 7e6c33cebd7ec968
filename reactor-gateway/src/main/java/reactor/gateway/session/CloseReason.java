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

package reactor.gateway.session;

/**
 * Why a {@link Session} ended.
 */
public enum CloseReason {

	/**
	 * The client explicitly ended the session.
	 */
	TERMINATED(true),
	/**
	 * The backend failed the call that opened or ended the session.
	 */
	FAILED(false),
	/**
	 * The backend closed the transport of the session.
	 */
	TRANSPORT_CLOSED(false),
	/**
	 * The session went unused for longer than the session timeout.
	 */
	IDLE_TIMEOUT(true),
	/**
	 * The connection bound to the session was found invalid, for instance discarded by its pool.
	 */
	CONNECTION_INVALID(false),
	/**
	 * The registry is shutting down.
	 */
	SHUTDOWN(true);

	final boolean success;

	CloseReason(boolean success) {
		this.success = success;
	}

	/**
	 * @return the outcome reported to the pool when the session's connection is released for this reason
	 */
	public boolean isSuccess() {
		return success;
	}
}
