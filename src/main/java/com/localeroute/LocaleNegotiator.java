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

import com.localeroute.NegotiationOutcome.Excluded;
import com.localeroute.NegotiationOutcome.LocaleAttached;
import com.localeroute.NegotiationOutcome.Redirected;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;

import static com.localeroute.Utilities.trimAggressivelyToNull;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.logging.Level.FINE;

/**
 * Decides, per request, which locale governs the response and whether the client must be redirected to a locale-prefixed URL.
 * <p>
 * Instances are immutable once built and may be shared freely across threads.  Acquire one via the
 * {@link #withDefaultLocale(LocaleTag)} builder factory method or load configuration via {@link #fromProperties(Properties)}.
 * <p>
 * Negotiation works like this:
 * <ul>
 *   <li>{@link RedirectMode#NO_REDIRECT}: the {@code Accept-Language} header is consulted, falling back to the default locale.  The request is never redirected and its URL is never changed.</li>
 *   <li>Sub-path modes: the first path segment is consulted first.  If it names a supported locale, that segment is removed from the URL and the locale is attached.
 *   Otherwise, requests for excluded paths pass through untouched, and all others are redirected to the same URL prefixed with the locale from the
 *   {@code Accept-Language} header (or the default locale).</li>
 * </ul>
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class LocaleNegotiator {
	/**
	 * Properties key for the default locale, e.g. {@code en}.
	 */
	@NonNull
	public static final String DEFAULT_LOCALE_PROPERTY_NAME = "localeroute.default-locale";
	/**
	 * Properties key for the comma-separated supported locales, e.g. {@code en,ja}.
	 */
	@NonNull
	public static final String SUPPORTED_LOCALES_PROPERTY_NAME = "localeroute.supported-locales";
	/**
	 * Properties key for the {@link RedirectMode}, e.g. {@code redirect-to-language-subpath}.
	 */
	@NonNull
	public static final String REDIRECT_MODE_PROPERTY_NAME = "localeroute.redirect-mode";
	/**
	 * Properties key for the comma-separated excluded path prefixes, e.g. {@code /static,/api}.
	 */
	@NonNull
	public static final String EXCLUDED_PATH_PREFIXES_PROPERTY_NAME = "localeroute.excluded-path-prefixes";
	/**
	 * Properties key for the redirect HTTP status code, e.g. {@code 302}.
	 */
	@NonNull
	public static final String REDIRECT_STATUS_PROPERTY_NAME = "localeroute.redirect-status";

	@NonNull
	private static final String ACCEPT_LANGUAGE_HEADER_NAME = "Accept-Language";

	@NonNull
	private final LocaleTag defaultLocale;
	@NonNull
	private final SupportedLocales supportedLocales;
	@NonNull
	private final RedirectMode redirectMode;
	@NonNull
	private final List<@NonNull String> excludedPathPrefixes;
	@NonNull
	private final RedirectType redirectType;
	@NonNull
	private final NegotiationObserver negotiationObserver;
	@NonNull
	private final Logger logger = Logger.getLogger(LocaleNegotiator.class.getName());

	/**
	 * Acquires a builder for {@link LocaleNegotiator} instances.
	 *
	 * @param defaultLocale the locale to use when no supported candidate can be determined
	 * @return the builder
	 */
	@NonNull
	public static Builder withDefaultLocale(@NonNull LocaleTag defaultLocale) {
		requireNonNull(defaultLocale);
		return new Builder(defaultLocale);
	}

	/**
	 * Acquires a builder for {@link LocaleNegotiator} instances primed from properties.
	 * <p>
	 * Recognized keys are {@value #DEFAULT_LOCALE_PROPERTY_NAME} (required), {@value #SUPPORTED_LOCALES_PROPERTY_NAME},
	 * {@value #REDIRECT_MODE_PROPERTY_NAME}, {@value #EXCLUDED_PATH_PREFIXES_PROPERTY_NAME} and {@value #REDIRECT_STATUS_PROPERTY_NAME}.
	 * The returned builder may be further customized, e.g. to supply a {@link NegotiationObserver}.
	 *
	 * @param properties the configuration properties
	 * @return the builder
	 * @throws IllegalArgumentException if a property value is invalid
	 * @throws IllegalStateException    if the default locale is not specified
	 */
	@NonNull
	public static Builder fromProperties(@NonNull Properties properties) {
		requireNonNull(properties);

		String defaultLocale = trimAggressivelyToNull(properties.getProperty(DEFAULT_LOCALE_PROPERTY_NAME));

		if (defaultLocale == null)
			throw new IllegalStateException(format("No value was specified for required property '%s'", DEFAULT_LOCALE_PROPERTY_NAME));

		Builder builder = withDefaultLocale(parseLocaleTagProperty(DEFAULT_LOCALE_PROPERTY_NAME, defaultLocale));

		List<String> supportedLocales = splitCommaSeparatedProperty(properties.getProperty(SUPPORTED_LOCALES_PROPERTY_NAME));

		if (supportedLocales.size() > 0) {
			List<LocaleTag> supportedLocaleTags = new ArrayList<>(supportedLocales.size());

			for (String supportedLocale : supportedLocales)
				supportedLocaleTags.add(parseLocaleTagProperty(SUPPORTED_LOCALES_PROPERTY_NAME, supportedLocale));

			builder.supportedLocales(SupportedLocales.of(supportedLocaleTags));
		}

		String redirectMode = trimAggressivelyToNull(properties.getProperty(REDIRECT_MODE_PROPERTY_NAME));

		if (redirectMode != null) {
			try {
				builder.redirectMode(RedirectMode.valueOf(redirectMode.toUpperCase(Locale.ROOT).replace('-', '_')));
			} catch (IllegalArgumentException e) {
				throw new IllegalArgumentException(format("Illegal value '%s' for property '%s'", redirectMode, REDIRECT_MODE_PROPERTY_NAME), e);
			}
		}

		builder.excludedPathPrefixes(splitCommaSeparatedProperty(properties.getProperty(EXCLUDED_PATH_PREFIXES_PROPERTY_NAME)));

		String redirectStatus = trimAggressivelyToNull(properties.getProperty(REDIRECT_STATUS_PROPERTY_NAME));

		if (redirectStatus != null) {
			try {
				builder.redirectType(RedirectType.fromStatusCode(Integer.valueOf(redirectStatus)));
			} catch (IllegalArgumentException e) {
				throw new IllegalArgumentException(format("Illegal value '%s' for property '%s'", redirectStatus, REDIRECT_STATUS_PROPERTY_NAME), e);
			}
		}

		return builder;
	}

	/**
	 * Acquires a builder for {@link LocaleNegotiator} instances primed from a properties file on disk.
	 *
	 * @param propertiesFile the properties file to load
	 * @return the builder
	 * @throws IllegalArgumentException if the file cannot be read or a property value is invalid
	 * @throws IllegalStateException    if the default locale is not specified
	 * @see #fromProperties(Properties)
	 */
	@NonNull
	public static Builder fromPropertiesFile(@NonNull Path propertiesFile) {
		requireNonNull(propertiesFile);

		if (!Files.isRegularFile(propertiesFile))
			throw new IllegalArgumentException(format("Unable to find properties file at %s", propertiesFile.toAbsolutePath()));

		Properties properties = new Properties();

		try (InputStream inputStream = Files.newInputStream(propertiesFile)) {
			properties.load(inputStream);
		} catch (IOException e) {
			throw new IllegalArgumentException(format("Invalid format for properties file at %s", propertiesFile.toAbsolutePath()), e);
		}

		return fromProperties(properties);
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

	private LocaleNegotiator(@NonNull Builder builder) {
		requireNonNull(builder);

		this.defaultLocale = builder.defaultLocale;
		this.supportedLocales = builder.supportedLocales == null ? SupportedLocales.of(builder.defaultLocale) : builder.supportedLocales;
		this.redirectMode = builder.redirectMode == null ? RedirectMode.NO_REDIRECT : builder.redirectMode;
		this.redirectType = builder.redirectType == null ? RedirectType.HTTP_302_FOUND : builder.redirectType;
		this.negotiationObserver = builder.negotiationObserver == null ? NegotiationObserver.defaultInstance() : builder.negotiationObserver;

		if (!this.supportedLocales.isSupported(this.defaultLocale))
			throw new IllegalArgumentException(format("Default locale %s is not one of the supported locales %s",
					this.defaultLocale, this.supportedLocales.getLocaleTags()));

		List<String> excludedPathPrefixes = new ArrayList<>();

		if (builder.excludedPathPrefixes != null) {
			for (String excludedPathPrefix : builder.excludedPathPrefixes) {
				String normalizedExcludedPathPrefix = trimAggressivelyToNull(excludedPathPrefix);

				if (normalizedExcludedPathPrefix == null || !normalizedExcludedPathPrefix.startsWith("/"))
					throw new IllegalArgumentException(format("Excluded path prefix '%s' must start with '/'", excludedPathPrefix));

				excludedPathPrefixes.add(normalizedExcludedPathPrefix);
			}
		}

		this.excludedPathPrefixes = Collections.unmodifiableList(excludedPathPrefixes);
	}

	/**
	 * Negotiates the locale for a request.
	 * <p>
	 * This is a pure computation over the request and this instance's immutable configuration.
	 *
	 * @param request the request to negotiate
	 * @return the outcome for the request
	 * @throws com.localeroute.exception.UriRewriteException if removing the locale path prefix produced an illegal URL
	 */
	@NonNull
	public NegotiationOutcome negotiate(@NonNull Request request) {
		requireNonNull(request);

		NegotiationOutcome negotiationOutcome = switch (getRedirectMode()) {
			case NO_REDIRECT -> negotiateFromHeaders(request);
			case REDIRECT_TO_LANGUAGE_SUBPATH, REDIRECT_TO_FULL_LOCALE_SUBPATH -> negotiateFromPath(request);
		};

		if (logger.isLoggable(FINE))
			logger.fine(format("Negotiated %s for %s", negotiationOutcome, request));

		notifyNegotiationObserver(request, negotiationOutcome);

		return negotiationOutcome;
	}

	/**
	 * Wraps a downstream handler so that every request is negotiated before reaching it.
	 *
	 * @param requestHandler the downstream handler
	 * @return a handler which performs negotiation, then delegates to {@code requestHandler} or redirects
	 */
	@NonNull
	public LocaleNegotiatingRequestHandler wrap(@NonNull RequestHandler requestHandler) {
		requireNonNull(requestHandler);
		return new LocaleNegotiatingRequestHandler(this, requestHandler);
	}

	/**
	 * Determines the client's preferred supported locale from request headers, falling back to the default locale.
	 *
	 * @param request the request to examine
	 * @return the preferred locale and where it came from
	 */
	@NonNull
	LocaleAttached negotiateFromHeaders(@NonNull Request request) {
		requireNonNull(request);

		Optional<LocaleTag> headerLocaleTag = Utilities.extractLocaleTagFromAcceptLanguageHeaderValue(
				request.getHeader(ACCEPT_LANGUAGE_HEADER_NAME).orElse(null), getSupportedLocales());

		LocaleTag localeTag = headerLocaleTag.orElse(getDefaultLocale());
		LocaleSource localeSource = headerLocaleTag.isPresent() ? LocaleSource.ACCEPT_LANGUAGE_HEADER : LocaleSource.DEFAULT;

		return new LocaleAttached(request.copy().localeTag(localeTag).finish(), localeTag, localeSource);
	}

	@NonNull
	private NegotiationOutcome negotiateFromPath(@NonNull Request request) {
		requireNonNull(request);

		String rawPath = request.getRawPath();

		// Path always takes precedence over headers
		Optional<LocaleTag> pathLocaleTag = Utilities.extractLocaleTagFromPath(rawPath, getSupportedLocales());

		if (pathLocaleTag.isPresent()) {
			// Strip exactly the segment that was matched, as it appears in the URL
			String localeSegment = Utilities.extractFirstPathSegment(rawPath).orElseThrow();
			String rewrittenUrl = Utilities.removeLocalePrefixFromUrl(request.getRawPathAndQuery(), localeSegment);

			Request rewrittenRequest = request.copy()
					.rawUrl(rewrittenUrl)
					.localeTag(pathLocaleTag.get())
					.finish();

			return new LocaleAttached(rewrittenRequest, pathLocaleTag.get(), LocaleSource.PATH);
		}

		Optional<String> excludedPathPrefix = matchingExcludedPathPrefix(rawPath);

		if (excludedPathPrefix.isPresent())
			return new Excluded(request, excludedPathPrefix.get());

		LocaleAttached preferred = negotiateFromHeaders(request);

		StringBuilder location = new StringBuilder("/")
				.append(getRedirectMode().localeRepresentation(preferred.getLocaleTag()))
				.append(rawPath);

		request.getRawQuery().ifPresent(rawQuery -> location.append('?').append(rawQuery));

		return new Redirected(location.toString(), preferred.getLocaleTag(), preferred.getLocaleSource(), getRedirectType());
	}

	@NonNull
	private Optional<String> matchingExcludedPathPrefix(@NonNull String rawPath) {
		requireNonNull(rawPath);

		for (String excludedPathPrefix : getExcludedPathPrefixes())
			if (rawPath.startsWith(excludedPathPrefix))
				return Optional.of(excludedPathPrefix);

		return Optional.empty();
	}

	private void notifyNegotiationObserver(@NonNull Request request,
																				 @NonNull NegotiationOutcome negotiationOutcome) {
		requireNonNull(request);
		requireNonNull(negotiationOutcome);

		try {
			if (negotiationOutcome instanceof LocaleAttached localeAttached)
				getNegotiationObserver().didAttachLocale(request, localeAttached);
			else if (negotiationOutcome instanceof Redirected redirected)
				getNegotiationObserver().didRedirect(request, redirected);
			else if (negotiationOutcome instanceof Excluded excluded)
				getNegotiationObserver().didExcludeRequest(request, excluded);
		} catch (RuntimeException e) {
			logger.log(Level.WARNING, format("%s failed while observing %s", NegotiationObserver.class.getSimpleName(), negotiationOutcome), e);
		}
	}

	@NonNull
	private static LocaleTag parseLocaleTagProperty(@NonNull String propertyName,
																									@NonNull String propertyValue) {
		requireNonNull(propertyName);
		requireNonNull(propertyValue);

		try {
			return LocaleTag.fromString(propertyValue);
		} catch (IllegalArgumentException e) {
			throw new IllegalArgumentException(format("Illegal locale '%s' for property '%s'", propertyValue, propertyName), e);
		}
	}

	@NonNull
	private static List<@NonNull String> splitCommaSeparatedProperty(@Nullable String propertyValue) {
		propertyValue = trimAggressivelyToNull(propertyValue);

		if (propertyValue == null)
			return List.of();

		List<String> values = new ArrayList<>();

		for (String value : propertyValue.split(",")) {
			value = trimAggressivelyToNull(value);

			if (value != null)
				values.add(value);
		}

		return values;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{defaultLocale=%s, supportedLocales=%s, redirectMode=%s, excludedPathPrefixes=%s, redirectType=%s}",
				getClass().getSimpleName(), getDefaultLocale(), getSupportedLocales().getLocaleTags(), getRedirectMode(),
				getExcludedPathPrefixes(), getRedirectType());
	}

	@NonNull
	public LocaleTag getDefaultLocale() {
		return this.defaultLocale;
	}

	@NonNull
	public SupportedLocales getSupportedLocales() {
		return this.supportedLocales;
	}

	@NonNull
	public RedirectMode getRedirectMode() {
		return this.redirectMode;
	}

	@NonNull
	public List<@NonNull String> getExcludedPathPrefixes() {
		return this.excludedPathPrefixes;
	}

	@NonNull
	public RedirectType getRedirectType() {
		return this.redirectType;
	}

	@NonNull
	public NegotiationObserver getNegotiationObserver() {
		return this.negotiationObserver;
	}

	/**
	 * Builder used to construct instances of {@link LocaleNegotiator} via {@link LocaleNegotiator#withDefaultLocale(LocaleTag)}.
	 * <p>
	 * If no supported locales are specified, only the default locale is supported.  The redirect mode defaults to
	 * {@link RedirectMode#NO_REDIRECT} and the redirect type to {@link RedirectType#HTTP_302_FOUND}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private LocaleTag defaultLocale;
		@Nullable
		private SupportedLocales supportedLocales;
		@Nullable
		private RedirectMode redirectMode;
		@Nullable
		private List<@NonNull String> excludedPathPrefixes;
		@Nullable
		private RedirectType redirectType;
		@Nullable
		private NegotiationObserver negotiationObserver;

		private Builder(@NonNull LocaleTag defaultLocale) {
			requireNonNull(defaultLocale);
			this.defaultLocale = defaultLocale;
		}

		@NonNull
		public Builder defaultLocale(@NonNull LocaleTag defaultLocale) {
			requireNonNull(defaultLocale);
			this.defaultLocale = defaultLocale;
			return this;
		}

		@NonNull
		public Builder supportedLocales(@Nullable SupportedLocales supportedLocales) {
			this.supportedLocales = supportedLocales;
			return this;
		}

		@NonNull
		public Builder redirectMode(@Nullable RedirectMode redirectMode) {
			this.redirectMode = redirectMode;
			return this;
		}

		@NonNull
		public Builder excludedPathPrefixes(@Nullable List<@NonNull String> excludedPathPrefixes) {
			this.excludedPathPrefixes = excludedPathPrefixes;
			return this;
		}

		@NonNull
		public Builder redirectType(@Nullable RedirectType redirectType) {
			this.redirectType = redirectType;
			return this;
		}

		@NonNull
		public Builder negotiationObserver(@Nullable NegotiationObserver negotiationObserver) {
			this.negotiationObserver = negotiationObserver;
			return this;
		}

		@NonNull
		public LocaleNegotiator build() {
			return new LocaleNegotiator(this);
		}
	}

	/**
	 * Builder used to copy instances of {@link LocaleNegotiator} via {@link LocaleNegotiator#copy()}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static final class Copier {
		@NonNull
		private final Builder builder;

		Copier(@NonNull LocaleNegotiator localeNegotiator) {
			requireNonNull(localeNegotiator);

			this.builder = new Builder(localeNegotiator.getDefaultLocale())
					.supportedLocales(localeNegotiator.getSupportedLocales())
					.redirectMode(localeNegotiator.getRedirectMode())
					.excludedPathPrefixes(new ArrayList<>(localeNegotiator.getExcludedPathPrefixes()))
					.redirectType(localeNegotiator.getRedirectType())
					.negotiationObserver(localeNegotiator.getNegotiationObserver());
		}

		@NonNull
		public Copier defaultLocale(@NonNull LocaleTag defaultLocale) {
			requireNonNull(defaultLocale);
			this.builder.defaultLocale(defaultLocale);
			return this;
		}

		@NonNull
		public Copier supportedLocales(@NonNull SupportedLocales supportedLocales) {
			requireNonNull(supportedLocales);
			this.builder.supportedLocales(supportedLocales);
			return this;
		}

		@NonNull
		public Copier redirectMode(@NonNull RedirectMode redirectMode) {
			requireNonNull(redirectMode);
			this.builder.redirectMode(redirectMode);
			return this;
		}

		@NonNull
		public Copier excludedPathPrefixes(@NonNull List<@NonNull String> excludedPathPrefixes) {
			requireNonNull(excludedPathPrefixes);
			this.builder.excludedPathPrefixes(excludedPathPrefixes);
			return this;
		}

		@NonNull
		public Copier redirectType(@NonNull RedirectType redirectType) {
			requireNonNull(redirectType);
			this.builder.redirectType(redirectType);
			return this;
		}

		@NonNull
		public Copier negotiationObserver(@Nullable NegotiationObserver negotiationObserver) {
			this.builder.negotiationObserver(negotiationObserver);
			return this;
		}

		@NonNull
		public LocaleNegotiator finish() {
			return this.builder.build();
		}
	}
}
