/*
 * Copyright 2022-2026 Revetware LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.localeroute;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * The per-request result of {@link LocaleNegotiator#negotiate(Request)}.
 * <p>
 * Exactly one of:
 * <ul>
 *   <li>{@link LocaleAttached} - the request proceeds downstream carrying a locale, possibly with its locale path prefix removed</li>
 *   <li>{@link Redirected} - the client is redirected to a locale-prefixed URL and the downstream handler is never invoked</li>
 *   <li>{@link Excluded} - the request matched an excluded path prefix and proceeds downstream unchanged, with no locale</li>
 * </ul>
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public sealed interface NegotiationOutcome permits NegotiationOutcome.LocaleAttached, NegotiationOutcome.Redirected, NegotiationOutcome.Excluded {
	/**
	 * Outcome which forwards a request that carries its negotiated locale.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@ThreadSafe
	final class LocaleAttached implements NegotiationOutcome {
		@NonNull
		private final Request request;
		@NonNull
		private final LocaleTag localeTag;
		@NonNull
		private final LocaleSource localeSource;

		LocaleAttached(@NonNull Request request,
									 @NonNull LocaleTag localeTag,
									 @NonNull LocaleSource localeSource) {
			requireNonNull(request);
			requireNonNull(localeTag);
			requireNonNull(localeSource);

			this.request = request;
			this.localeTag = localeTag;
			this.localeSource = localeSource;
		}

		/**
		 * The request to forward downstream: the original request with its locale path prefix removed (if any) and the locale attached.
		 *
		 * @return the request to forward
		 */
		@NonNull
		public Request getRequest() {
			return this.request;
		}

		@NonNull
		public LocaleTag getLocaleTag() {
			return this.localeTag;
		}

		@NonNull
		public LocaleSource getLocaleSource() {
			return this.localeSource;
		}

		@Override
		@NonNull
		public String toString() {
			return format("%s{request=%s, localeTag=%s, localeSource=%s}", getClass().getSimpleName(),
					getRequest(), getLocaleTag(), getLocaleSource());
		}

		@Override
		public boolean equals(@Nullable Object object) {
			if (this == object)
				return true;

			if (!(object instanceof LocaleAttached localeAttached))
				return false;

			return Objects.equals(getRequest(), localeAttached.getRequest())
					&& Objects.equals(getLocaleTag(), localeAttached.getLocaleTag())
					&& Objects.equals(getLocaleSource(), localeAttached.getLocaleSource());
		}

		@Override
		public int hashCode() {
			return Objects.hash(getRequest(), getLocaleTag(), getLocaleSource());
		}
	}

	/**
	 * Outcome which redirects the client to a locale-prefixed URL.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@ThreadSafe
	final class Redirected implements NegotiationOutcome {
		@NonNull
		private final String location;
		@NonNull
		private final LocaleTag localeTag;
		@NonNull
		private final LocaleSource localeSource;
		@NonNull
		private final RedirectType redirectType;

		Redirected(@NonNull String location,
							 @NonNull LocaleTag localeTag,
							 @NonNull LocaleSource localeSource,
							 @NonNull RedirectType redirectType) {
			requireNonNull(location);
			requireNonNull(localeTag);
			requireNonNull(localeSource);
			requireNonNull(redirectType);

			this.location = location;
			this.localeTag = localeTag;
			this.localeSource = localeSource;
			this.redirectType = redirectType;
		}

		/**
		 * Builds the bodyless redirect response for this outcome.
		 *
		 * @return the redirect response
		 */
		@NonNull
		public MarshaledResponse toMarshaledResponse() {
			return MarshaledResponse.withStatusCode(getRedirectType().getStatusCode())
					.headers(Map.of("Location", Set.of(getLocation())))
					.build();
		}

		/**
		 * The redirect target, an absolute path beginning with the locale prefix, e.g. {@code /en/?page=1}.
		 *
		 * @return the redirect target
		 */
		@NonNull
		public String getLocation() {
			return this.location;
		}

		/**
		 * The locale the client is being redirected to.
		 *
		 * @return the preferred locale
		 */
		@NonNull
		public LocaleTag getLocaleTag() {
			return this.localeTag;
		}

		@NonNull
		public LocaleSource getLocaleSource() {
			return this.localeSource;
		}

		@NonNull
		public RedirectType getRedirectType() {
			return this.redirectType;
		}

		@Override
		@NonNull
		public String toString() {
			return format("%s{location=%s, localeTag=%s, localeSource=%s, redirectType=%s}", getClass().getSimpleName(),
					getLocation(), getLocaleTag(), getLocaleSource(), getRedirectType());
		}

		@Override
		public boolean equals(@Nullable Object object) {
			if (this == object)
				return true;

			if (!(object instanceof Redirected redirected))
				return false;

			return Objects.equals(getLocation(), redirected.getLocation())
					&& Objects.equals(getLocaleTag(), redirected.getLocaleTag())
					&& Objects.equals(getLocaleSource(), redirected.getLocaleSource())
					&& Objects.equals(getRedirectType(), redirected.getRedirectType());
		}

		@Override
		public int hashCode() {
			return Objects.hash(getLocation(), getLocaleTag(), getLocaleSource(), getRedirectType());
		}
	}

	/**
	 * Outcome which forwards a request for an excluded path untouched.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@ThreadSafe
	final class Excluded implements NegotiationOutcome {
		@NonNull
		private final Request request;
		@NonNull
		private final String excludedPathPrefix;

		Excluded(@NonNull Request request,
						 @NonNull String excludedPathPrefix) {
			requireNonNull(request);
			requireNonNull(excludedPathPrefix);

			this.request = request;
			this.excludedPathPrefix = excludedPathPrefix;
		}

		@NonNull
		public Request getRequest() {
			return this.request;
		}

		/**
		 * The configured prefix that the request path matched.
		 *
		 * @return the matching excluded path prefix
		 */
		@NonNull
		public String getExcludedPathPrefix() {
			return this.excludedPathPrefix;
		}

		@Override
		@NonNull
		public String toString() {
			return format("%s{request=%s, excludedPathPrefix=%s}", getClass().getSimpleName(),
					getRequest(), getExcludedPathPrefix());
		}

		@Override
		public boolean equals(@Nullable Object object) {
			if (this == object)
				return true;

			if (!(object instanceof Excluded excluded))
				return false;

			return Objects.equals(getRequest(), excluded.getRequest())
					&& Objects.equals(getExcludedPathPrefix(), excluded.getExcludedPathPrefix());
		}

		@Override
		public int hashCode() {
			return Objects.hash(getRequest(), getExcludedPathPrefix());
		}
	}
}
