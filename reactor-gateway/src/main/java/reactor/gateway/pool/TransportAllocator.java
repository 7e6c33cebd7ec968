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

package reactor.gateway.pool;

import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Mono;

/**
 * Opens the live transport behind a new pooled connection. The transport is opaque to the pool: it is only
 * checked for liveness with {@link Disposable#isDisposed()} and closed with {@link Disposable#dispose()} when the
 * connection is discarded.
 */
@FunctionalInterface
public interface TransportAllocator {

	/**
	 * A {@link TransportAllocator} producing purely logical transports, for backends served in-process.
	 */
	TransportAllocator LOGICAL = backend -> Mono.<Disposable>fromSupplier(Disposables::single);

	/**
	 * @param backend the name of the backend to open a transport to
	 * @return a {@link Mono} of the opened transport, or an error if the backend cannot be reached
	 */
	Mono<Disposable> allocate(String backend);
}
