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

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;

import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.gateway.GatewayConfig;
import reactor.util.Logger;
import reactor.util.Loggers;

/**
 * A {@link CredentialDirectory} remembering the verdicts of another one for a time-to-live, positive and negative
 * alike. Errors of the delegate are not cached. Verdicts live in a Caffeine cache expiring them after write, with
 * time read from the configured {@link Clock}.
 * <p>
 * A zero time-to-live disables caching.
 */
public final class CachingCredentialDirectory implements CredentialDirectory, Disposable {

	static final Logger LOG = Loggers.getLogger(CachingCredentialDirectory.class);

	/**
	 * Cache the verdicts of a {@link CredentialDirectory} for the {@link GatewayConfig#credentialCacheTtl() configured
	 * time-to-live}, using the configuration's clock.
	 */
	public static CachingCredentialDirectory of(CredentialDirectory delegate, GatewayConfig config) {
		return new CachingCredentialDirectory(delegate, config.credentialCacheTtl(), config.clock());
	}

	final CredentialDirectory       delegate;
	final long                      ttlMs;
	final Cache<CacheKey, Boolean>  verdicts;

	volatile boolean disposed;

	public CachingCredentialDirectory(CredentialDirectory delegate, Duration ttl, Clock clock) {
		this.delegate = Objects.requireNonNull(delegate, "delegate");
		Objects.requireNonNull(clock, "clock");
		this.ttlMs = Objects.requireNonNull(ttl, "ttl").toMillis();
		this.verdicts = Caffeine.newBuilder()
		                        .expireAfterWrite(Math.max(ttlMs, 0L), TimeUnit.MILLISECONDS)
		                        .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
		                        .executor(Runnable::run)
		                        .removalListener((CacheKey key, Boolean valid, RemovalCause cause) -> {
			                        if (cause.wasEvicted()) {
				                        LOG.debug("Credential verdict of user {} on backend {} expired", key.userId, key.backend);
			                        }
		                        })
		                        .build();
	}

	@Override
	public Mono<Boolean> verify(String userId, String backend, String credential) {
		if (ttlMs <= 0) {
			return delegate.verify(userId, backend, credential);
		}
		return Mono.defer(() -> {
			CacheKey key = new CacheKey(userId, backend, credential);
			Boolean cached = verdicts.getIfPresent(key);
			if (cached != null) {
				return Mono.just(cached);
			}
			return delegate.verify(userId, backend, credential)
			               .defaultIfEmpty(Boolean.FALSE)
			               .doOnNext(valid -> {
				               if (!disposed) {
					               verdicts.put(key, valid);
				               }
			               });
		});
	}

	/**
	 * Drop the verdicts older than the time-to-live right away rather than on the cache's next maintenance.
	 *
	 * @return the number of verdicts removed
	 */
	public int evictExpired() {
		long before = verdicts.estimatedSize();
		verdicts.cleanUp();
		return (int) Math.max(before - verdicts.estimatedSize(), 0L);
	}

	/**
	 * @return the number of live verdicts
	 */
	public int size() {
		verdicts.cleanUp();
		return (int) verdicts.estimatedSize();
	}

	@Override
	public void dispose() {
		disposed = true;
		verdicts.invalidateAll();
	}

	@Override
	public boolean isDisposed() {
		return disposed;
	}

	static final class CacheKey {

		final String userId;
		final String backend;
		final String credential;

		CacheKey(String userId, String backend, String credential) {
			this.userId = userId;
			this.backend = backend;
			this.credential = credential;
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) {
				return true;
			}
			if (!(o instanceof CacheKey)) {
				return false;
			}
			CacheKey other = (CacheKey) o;
			return userId.equals(other.userId) && backend.equals(other.backend) && credential.equals(other.credential);
		}

		@Override
		public int hashCode() {
			return Objects.hash(userId, backend, credential);
		}
	}
}
