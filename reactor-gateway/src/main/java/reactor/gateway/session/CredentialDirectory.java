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

import reactor.core.publisher.Mono;

/**
 * The external directory of per-user credentials a session must present to be opened.
 */
@FunctionalInterface
public interface CredentialDirectory {

	/**
	 * Check that a credential grants a user access to a backend.
	 *
	 * @param userId the user opening the session
	 * @param backend the backend the session targets
	 * @param credential the credential presented by the user
	 * @return a {@link Mono} of the verdict, an empty {@link Mono} being a rejection
	 */
	Mono<Boolean> verify(String userId, String backend, String credential);
}
