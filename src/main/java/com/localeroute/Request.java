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

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

import static com.localeroute.Utilities.trimAggressivelyToEmpty;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Encapsulates the parts of an HTTP request that locale negotiation examines, plus the negotiated locale once one is attached.
 * <p>
 * Instances can be acquired via the {@link #withRawUrl(String)} builder factory method.  The URL is kept raw (un-decoded);
 * absolute URLs are reduced to their path-and-query form.
 * <p>
 * Header names are case-insensitive.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class Request {
	@NonNull
	private final String rawPath;
	@Nullable
	private final String rawQuery;
	@NonNull
	private final Map<@NonNull String, @NonNull Set<@NonNull String>> headers;
	@Nullable
	private final LocaleTag localeTag;

	/**
	 * Acquires a builder for {@link Request} instances from the URL provided by clients on a "raw" HTTP/1.1 request line.
	 * <p>
	 * The provided {@code rawUrl} must be un-decoded and in either "path-and-query" form (i.e. starts with a {@code /} character) or an absolute URL (i.e. starts with {@code http://} or {@code https://}).
	 *
	 * @param rawUrl the raw (un-decoded) URL for this request, e.g. {@code /en/lists?page=1}
	 * @return the builder
	 */
	@NonNull
	public static Builder withRawUrl(@NonNull String rawUrl) {
		requireNonNull(rawUrl);
		return new Builder(rawUrl);
	}

	/**
	 * Vends a mutable copier seeded with this instance's data, suitable for building new instances.
	 *
	 * @return a copier for this instance
	 */
	@NonNull
	public Copier copy() {
		return new Copier(this);
	}

	private Request(@NonNull Builder builder) {
		requireNonNull(builder);

		String rawUrl = trimAggressivelyToEmpty(builder.rawUrl);

		this.rawPath = Utilities.extractRawPathFromUrl(rawUrl);
		this.rawQuery = Utilities.extractRawQueryFromUrl(rawUrl).orElse(null);
		this.localeTag = builder.localeTag;

		// Header names are case-insensitive.  Enforce that here with a special map
		Map<String, Set<String>> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

		if (builder.headers != null) {
			for (Entry<String, Set<String>> entry : builder.headers.entrySet()) {
				String headerName = requireNonNull(entry.getKey());
				Set<String> headerValues = headers.computeIfAbsent(headerName, ignored -> new LinkedHashSet<>());

				if (entry.getValue() != null)
					headerValues.addAll(entry.getValue());
			}

			for (Entry<String, Set<String>> entry : headers.entrySet())
				entry.setValue(Collections.unmodifiableSet(entry.getValue()));
		}

		this.headers = Collections.unmodifiableMap(headers);
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{rawPathAndQuery=%s, localeTag=%s}", getClass().getSimpleName(),
				getRawPathAndQuery(), getLocaleTag().orElse(null));
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof Request request))
			return false;

		return Objects.equals(getRawPath(), request.getRawPath())
				&& Objects.equals(getRawQuery(), request.getRawQuery())
				&& Objects.equals(getHeaders(), request.getHeaders())
				&& Objects.equals(getLocaleTag(), request.getLocaleTag());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getRawPath(), getRawQuery(), getHeaders(), getLocaleTag());
	}

	/**
	 * The raw (un-decoded) path component of this request's URL, e.g. {@code /en/lists}.
	 *
	 * @return the raw path
	 */
	@NonNull
	public String getRawPath() {
		return this.rawPath;
	}

	/**
	 * The raw (un-decoded) query component of this request's URL, e.g. {@code page=1}.
	 * <p>
	 * A URL ending in a bare {@code ?} has an empty query, which is preserved by {@link #getRawPathAndQuery()}.
	 *
	 * @return the raw query, or {@link Optional#empty()} if the URL has none
	 */
	@NonNull
	public Optional<String> getRawQuery() {
		return Optional.ofNullable(this.rawQuery);
	}

	/**
	 * The raw path and query of this request's URL, e.g. {@code /en/lists?page=1}.
	 *
	 * @return the raw path and query
	 */
	@NonNull
	public String getRawPathAndQuery() {
		return this.rawQuery == null ? this.rawPath : format("%s?%s", this.rawPath, this.rawQuery);
	}

	/**
	 * The request headers, keyed case-insensitively.
	 *
	 * @return the request headers
	 */
	@NonNull
	public Map<@NonNull String, @NonNull Set<@NonNull String>> getHeaders() {
		return this.headers;
	}

	/**
	 * Convenience accessor for a header's values, joined by {@code ", "} if the header was specified more than once.
	 *
	 * @param name the header name, case-insensitive
	 * @return the header value, or {@link Optional#empty()} if the header is not present
	 */
	@NonNull
	public Optional<String> getHeader(@NonNull String name) {
		requireNonNull(name);

		Set<String> values = getHeaders().get(name);

		if (values == null || values.isEmpty())
			return Optional.empty();

		return Optional.of(String.join(", ", values));
	}

	/**
	 * The locale negotiated for this request, if one has been attached.
	 * <p>
	 * Downstream components read the negotiated locale here.  Requests for excluded paths never carry a locale.
	 *
	 * @return the negotiated locale, or {@link Optional#empty()} if none was attached
	 */
	@NonNull
	public Optional<LocaleTag> getLocaleTag() {
		return Optional.ofNullable(this.localeTag);
	}

	/**
	 * Builder used to construct instances of {@link Request} via {@link Request#withRawUrl(String)}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private String rawUrl;
		@Nullable
		private Map<@NonNull String, @NonNull Set<@NonNull String>> headers;
		@Nullable
		private LocaleTag localeTag;

		private Builder(@NonNull String rawUrl) {
			requireNonNull(rawUrl);
			this.rawUrl = rawUrl;
		}

		@NonNull
		public Builder rawUrl(@NonNull String rawUrl) {
			requireNonNull(rawUrl);
			this.rawUrl = rawUrl;
			return this;
		}

		@NonNull
		public Builder headers(@Nullable Map<@NonNull String, @NonNull Set<@NonNull String>> headers) {
			this.headers = headers;
			return this;
		}

		@NonNull
		public Builder localeTag(@Nullable LocaleTag localeTag) {
			this.localeTag = localeTag;
			return this;
		}

		@NonNull
		public Request build() {
			return new Request(this);
		}
	}

	/**
	 * Builder used to copy instances of {@link Request} via {@link Request#copy()}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static final class Copier {
		@NonNull
		private final Builder builder;

		Copier(@NonNull Request request) {
			requireNonNull(request);

			this.builder = new Builder(request.getRawPathAndQuery())
					.headers(request.getHeaders())
					.localeTag(request.getLocaleTag().orElse(null));
		}

		@NonNull
		public Copier rawUrl(@NonNull String rawUrl) {
			requireNonNull(rawUrl);
			this.builder.rawUrl(rawUrl);
			return this;
		}

		@NonNull
		public Copier localeTag(@Nullable LocaleTag localeTag) {
			this.builder.localeTag(localeTag);
			return this;
		}

		@NonNull
		public Request finish() {
			return this.builder.build();
		}
	}
}
