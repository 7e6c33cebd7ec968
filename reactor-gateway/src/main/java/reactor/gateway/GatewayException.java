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

import org.jspecify.annotations.Nullable;

/**
 * Base class of every rejection the gateway signals. Each exception carries an {@link ErrorKind} and, for the
 * kinds where waiting makes sense, a {@link #retryAfter() retry hint}.
 * <p>
 * These are delivered as {@code onError} signals rather than thrown from the public reactive methods.
 */
public abstract class GatewayException extends RuntimeException {

	private final ErrorKind          kind;
	private final @Nullable Duration retryAfter;

	protected GatewayException(ErrorKind kind, String message, @Nullable Duration retryAfter) {
		super(message);
		this.kind = kind;
		this.retryAfter = retryAfter;
	}

	/**
	 * @return the {@link ErrorKind} of this rejection
	 */
	public ErrorKind kind() {
		return this.kind;
	}

	/**
	 * @return the minimum time a caller should wait before retrying, or null if retrying isn't expected to help
	 */
	public @Nullable Duration retryAfter() {
		return this.retryAfter;
	}

	/**
	 * @return the {@link #retryAfter()} hint in whole seconds (rounded up), or -1 if there is no hint
	 */
	public long retryAfterSeconds() {
		Duration d = this.retryAfter;
		if (d == null) {
			return -1L;
		}
		long seconds = d.getSeconds();
		return d.getNano() > 0 ? seconds + 1 : seconds;
	}
}
