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
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class LocaleNegotiatorTests {
	private static final LocaleTag ENGLISH = LocaleTag.fromString("en");
	private static final LocaleTag AMERICAN_ENGLISH = LocaleTag.fromString("en-US");
	private static final LocaleTag JAPANESE = LocaleTag.fromString("ja");

	@Test
	public void noRedirectUsesAcceptLanguage() {
		LocaleNegotiator localeNegotiator = negotiator(RedirectMode.NO_REDIRECT);
		Request request = request("/lists?page=1", "ja-JP,en;q=0.5");

		LocaleAttached localeAttached = assertInstanceOf(LocaleAttached.class, localeNegotiator.negotiate(request));

		assertEquals(LocaleTag.fromString("ja-JP"), localeAttached.getLocaleTag(), "Client's tag should be attached as written");
		assertEquals(LocaleSource.ACCEPT_LANGUAGE_HEADER, localeAttached.getLocaleSource());
		assertEquals("/lists?page=1", localeAttached.getRequest().getRawPathAndQuery(), "URL must not change");
		assertEquals(Optional.of(LocaleTag.fromString("ja-JP")), localeAttached.getRequest().getLocaleTag());
	}

	@Test
	public void noRedirectFallsBackToDefault() {
		LocaleNegotiator localeNegotiator = negotiator(RedirectMode.NO_REDIRECT);

		for (Request request : List.of(request("/lists", null), request("/lists", "de,fr"), request("/lists", "*"))) {
			LocaleAttached localeAttached = assertInstanceOf(LocaleAttached.class, localeNegotiator.negotiate(request));

			assertEquals(ENGLISH, localeAttached.getLocaleTag());
			assertEquals(LocaleSource.DEFAULT, localeAttached.getLocaleSource());
		}
	}

	@Test
	public void noRedirectIgnoresPath() {
		LocaleNegotiator localeNegotiator = negotiator(RedirectMode.NO_REDIRECT);

		LocaleAttached localeAttached = assertInstanceOf(LocaleAttached.class, localeNegotiator.negotiate(request("/ja/lists", null)));

		assertEquals(ENGLISH, localeAttached.getLocaleTag());
		assertEquals("/ja/lists", localeAttached.getRequest().getRawPath(), "Path prefixes are only stripped in sub-path modes");
	}

	@Test
	public void languageSubpathRedirect() {
		LocaleNegotiator localeNegotiator = negotiator(RedirectMode.REDIRECT_TO_LANGUAGE_SUBPATH);

		Redirected redirected = assertInstanceOf(Redirected.class, localeNegotiator.negotiate(request("/?page=1", "en-US,en;q=0.5")));

		assertEquals("/en/?page=1", redirected.getLocation());
		assertEquals(AMERICAN_ENGLISH, redirected.getLocaleTag());
		assertEquals(LocaleSource.ACCEPT_LANGUAGE_HEADER, redirected.getLocaleSource());
		assertEquals(RedirectType.HTTP_302_FOUND, redirected.getRedirectType());

		MarshaledResponse marshaledResponse = redirected.toMarshaledResponse();

		assertEquals(302, marshaledResponse.getStatusCode());
		assertEquals(Set.of("/en/?page=1"), marshaledResponse.getHeaders().get("location"), "Header names are case-insensitive");
		assertEquals(Optional.empty(), marshaledResponse.getBody());
	}

	@Test
	public void fullLocaleSubpathRedirect() {
		LocaleNegotiator localeNegotiator = negotiator(RedirectMode.REDIRECT_TO_FULL_LOCALE_SUBPATH);

		Redirected redirected = assertInstanceOf(Redirected.class, localeNegotiator.negotiate(request("/lists/1", "en-US")));
		assertEquals("/en-US/lists/1", redirected.getLocation());

		redirected = assertInstanceOf(Redirected.class, localeNegotiator.negotiate(request("/lists/1", null)));
		assertEquals("/en/lists/1", redirected.getLocation());
		assertEquals(LocaleSource.DEFAULT, redirected.getLocaleSource());
	}

	@Test
	public void unsupportedPathLocaleIsRedirected() {
		LocaleNegotiator localeNegotiator = negotiator(RedirectMode.REDIRECT_TO_LANGUAGE_SUBPATH);

		Redirected redirected = assertInstanceOf(Redirected.class, localeNegotiator.negotiate(request("/de/lists", "ja")));
		assertEquals("/ja/de/lists", redirected.getLocation());
	}

	@Test
	public void pathLocaleIsStripped() {
		LocaleNegotiator localeNegotiator = negotiator(RedirectMode.REDIRECT_TO_LANGUAGE_SUBPATH);

		// Path takes precedence over the header
		LocaleAttached localeAttached = assertInstanceOf(LocaleAttached.class,
				localeNegotiator.negotiate(request("/ja/enrollment/details?step=2", "en-US")));

		assertEquals(JAPANESE, localeAttached.getLocaleTag());
		assertEquals(LocaleSource.PATH, localeAttached.getLocaleSource());
		assertEquals("/enrollment/details", localeAttached.getRequest().getRawPath());
		assertEquals(Optional.of("step=2"), localeAttached.getRequest().getRawQuery());
		assertEquals(Optional.of("en-US"), localeAttached.getRequest().getHeader("Accept-Language"), "Headers must be preserved");

		localeAttached = assertInstanceOf(LocaleAttached.class, localeNegotiator.negotiate(request("/en/?page=1", null)));
		assertEquals("/?page=1", localeAttached.getRequest().getRawPathAndQuery());

		localeAttached = assertInstanceOf(LocaleAttached.class, localeNegotiator.negotiate(request("/en", null)));
		assertEquals("/", localeAttached.getRequest().getRawPathAndQuery());
	}

	@Test
	public void pathLocaleWithRegionIsStrippedInLanguageMode() {
		LocaleNegotiator localeNegotiator = negotiator(RedirectMode.REDIRECT_TO_LANGUAGE_SUBPATH);

		LocaleAttached localeAttached = assertInstanceOf(LocaleAttached.class, localeNegotiator.negotiate(request("/en-US/lists", null)));

		assertEquals(AMERICAN_ENGLISH, localeAttached.getLocaleTag());
		assertEquals("/lists", localeAttached.getRequest().getRawPath());
	}

	@Test
	public void redirectTargetIsAccepted() {
		LocaleNegotiator localeNegotiator = negotiator(RedirectMode.REDIRECT_TO_LANGUAGE_SUBPATH);

		Redirected redirected = assertInstanceOf(Redirected.class, localeNegotiator.negotiate(request("/lists?page=2", "ja")));
		NegotiationOutcome followUp = localeNegotiator.negotiate(request(redirected.getLocation(), "ja"));

		LocaleAttached localeAttached = assertInstanceOf(LocaleAttached.class, followUp, "Following a redirect must not redirect again");
		assertEquals("/lists?page=2", localeAttached.getRequest().getRawPathAndQuery());
	}

	@Test
	public void emptyQueryIsPreserved() {
		LocaleNegotiator localeNegotiator = negotiator(RedirectMode.REDIRECT_TO_LANGUAGE_SUBPATH);

		Redirected redirected = assertInstanceOf(Redirected.class, localeNegotiator.negotiate(request("/lists?", null)));
		assertEquals("/en/lists?", redirected.getLocation());

		LocaleAttached localeAttached = assertInstanceOf(LocaleAttached.class, localeNegotiator.negotiate(request("/en/lists?", null)));
		assertEquals("/lists?", localeAttached.getRequest().getRawPathAndQuery());
		assertEquals(Optional.of(""), localeAttached.getRequest().getRawQuery());

		localeAttached = assertInstanceOf(LocaleAttached.class, localeNegotiator.negotiate(request("/en?", null)));
		assertEquals("/?", localeAttached.getRequest().getRawPathAndQuery());
	}

	@Test
	public void excludedPaths() {
		LocaleNegotiator localeNegotiator = negotiator(RedirectMode.REDIRECT_TO_LANGUAGE_SUBPATH).copy()
				.excludedPathPrefixes(List.of("/static", "/api/"))
				.finish();

		Request request = request("/static/app.css", "ja");
		Excluded excluded = assertInstanceOf(Excluded.class, localeNegotiator.negotiate(request));

		assertEquals("/static", excluded.getExcludedPathPrefix());
		assertEquals(request, excluded.getRequest(), "Excluded requests pass through untouched");
		assertEquals(Optional.empty(), excluded.getRequest().getLocaleTag());

		assertInstanceOf(Excluded.class, localeNegotiator.negotiate(request("/api/v1/lists", null)));
		assertInstanceOf(Redirected.class, localeNegotiator.negotiate(request("/apiary", null)));

		// A locale prefix is honored even in front of an excluded path
		LocaleAttached localeAttached = assertInstanceOf(LocaleAttached.class, localeNegotiator.negotiate(request("/ja/static/app.css", null)));
		assertEquals("/static/app.css", localeAttached.getRequest().getRawPath());
	}

	@Test
	public void customRedirectType() {
		LocaleNegotiator localeNegotiator = negotiator(RedirectMode.REDIRECT_TO_LANGUAGE_SUBPATH).copy()
				.redirectType(RedirectType.HTTP_307_TEMPORARY_REDIRECT)
				.finish();

		Redirected redirected = assertInstanceOf(Redirected.class, localeNegotiator.negotiate(request("/", null)));

		assertEquals("/en/", redirected.getLocation());
		assertEquals(307, redirected.toMarshaledResponse().getStatusCode());
	}

	@Test
	public void defaults() {
		LocaleNegotiator localeNegotiator = LocaleNegotiator.withDefaultLocale(ENGLISH).build();

		assertEquals(List.of(ENGLISH), localeNegotiator.getSupportedLocales().getLocaleTags());
		assertEquals(RedirectMode.NO_REDIRECT, localeNegotiator.getRedirectMode());
		assertEquals(RedirectType.HTTP_302_FOUND, localeNegotiator.getRedirectType());
		assertEquals(List.of(), localeNegotiator.getExcludedPathPrefixes());
	}

	@Test
	public void illegalConfiguration() {
		assertThrows(IllegalArgumentException.class, () -> LocaleNegotiator.withDefaultLocale(LocaleTag.fromString("de"))
				.supportedLocales(SupportedLocales.of(ENGLISH, JAPANESE))
				.build(), "Default locale must be supported");

		assertThrows(IllegalArgumentException.class, () -> LocaleNegotiator.withDefaultLocale(ENGLISH)
				.excludedPathPrefixes(List.of("static"))
				.build(), "Excluded prefixes must be absolute paths");

		assertThrows(IllegalArgumentException.class, () -> LocaleNegotiator.withDefaultLocale(ENGLISH)
				.excludedPathPrefixes(List.of(" "))
				.build());

		assertThrows(IllegalArgumentException.class, () -> RedirectType.fromStatusCode(200));
	}

	@Test
	public void fromProperties() {
		Properties properties = new Properties();
		properties.setProperty(LocaleNegotiator.DEFAULT_LOCALE_PROPERTY_NAME, "ja");
		properties.setProperty(LocaleNegotiator.SUPPORTED_LOCALES_PROPERTY_NAME, "en, ja ,");
		properties.setProperty(LocaleNegotiator.REDIRECT_MODE_PROPERTY_NAME, "REDIRECT_TO_FULL_LOCALE_SUBPATH");

		LocaleNegotiator localeNegotiator = LocaleNegotiator.fromProperties(properties).build();

		assertEquals(JAPANESE, localeNegotiator.getDefaultLocale());
		assertEquals(List.of(ENGLISH, JAPANESE), localeNegotiator.getSupportedLocales().getLocaleTags());
		assertEquals(RedirectMode.REDIRECT_TO_FULL_LOCALE_SUBPATH, localeNegotiator.getRedirectMode());
		assertEquals(RedirectType.HTTP_302_FOUND, localeNegotiator.getRedirectType());
	}

	@Test
	public void fromPropertiesFile() throws Exception {
		Path propertiesFile = Paths.get(LocaleNegotiatorTests.class.getResource("/localeroute.properties").toURI());
		LocaleNegotiator localeNegotiator = LocaleNegotiator.fromPropertiesFile(propertiesFile).build();

		assertEquals(ENGLISH, localeNegotiator.getDefaultLocale());
		assertEquals(List.of(ENGLISH, JAPANESE), localeNegotiator.getSupportedLocales().getLocaleTags());
		assertEquals(RedirectMode.REDIRECT_TO_LANGUAGE_SUBPATH, localeNegotiator.getRedirectMode());
		assertEquals(List.of("/static", "/api"), localeNegotiator.getExcludedPathPrefixes());
		assertEquals(RedirectType.HTTP_307_TEMPORARY_REDIRECT, localeNegotiator.getRedirectType());

		assertThrows(IllegalArgumentException.class, () -> LocaleNegotiator.fromPropertiesFile(Paths.get("does-not-exist.properties")));
	}

	@Test
	public void illegalProperties() {
		assertThrows(IllegalStateException.class, () -> LocaleNegotiator.fromProperties(new Properties()), "Default locale is required");

		Properties properties = new Properties();
		properties.setProperty(LocaleNegotiator.DEFAULT_LOCALE_PROPERTY_NAME, "en");
		properties.setProperty(LocaleNegotiator.REDIRECT_MODE_PROPERTY_NAME, "sometimes");

		IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> LocaleNegotiator.fromProperties(properties));
		assertTrue(e.getMessage().contains(LocaleNegotiator.REDIRECT_MODE_PROPERTY_NAME));

		properties.remove(LocaleNegotiator.REDIRECT_MODE_PROPERTY_NAME);
		properties.setProperty(LocaleNegotiator.REDIRECT_STATUS_PROPERTY_NAME, "200");
		assertThrows(IllegalArgumentException.class, () -> LocaleNegotiator.fromProperties(properties));

		properties.setProperty(LocaleNegotiator.REDIRECT_STATUS_PROPERTY_NAME, "abc");
		assertThrows(IllegalArgumentException.class, () -> LocaleNegotiator.fromProperties(properties));

		properties.remove(LocaleNegotiator.REDIRECT_STATUS_PROPERTY_NAME);
		properties.setProperty(LocaleNegotiator.SUPPORTED_LOCALES_PROPERTY_NAME, "en,not a locale");
		e = assertThrows(IllegalArgumentException.class, () -> LocaleNegotiator.fromProperties(properties));
		assertTrue(e.getMessage().contains(LocaleNegotiator.SUPPORTED_LOCALES_PROPERTY_NAME));
	}

	@Test
	public void negotiationObserver() {
		List<String> events = new ArrayList<>();

		LocaleNegotiator localeNegotiator = negotiator(RedirectMode.REDIRECT_TO_LANGUAGE_SUBPATH).copy()
				.excludedPathPrefixes(List.of("/static"))
				.negotiationObserver(new NegotiationObserver() {
					@Override
					public void didAttachLocale(@NonNull Request request, @NonNull LocaleAttached localeAttached) {
						events.add("attached " + localeAttached.getLocaleTag());
					}

					@Override
					public void didRedirect(@NonNull Request request, @NonNull Redirected redirected) {
						events.add("redirected " + redirected.getLocation());
					}

					@Override
					public void didExcludeRequest(@NonNull Request request, @NonNull Excluded excluded) {
						events.add("excluded " + request.getRawPath());
					}
				})
				.finish();

		localeNegotiator.negotiate(request("/ja/lists", null));
		localeNegotiator.negotiate(request("/lists", null));
		localeNegotiator.negotiate(request("/static/a.js", null));

		assertEquals(List.of("attached ja", "redirected /en/lists", "excluded /static/a.js"), events);
	}

	@Test
	public void failingNegotiationObserverDoesNotBreakNegotiation() {
		LocaleNegotiator localeNegotiator = negotiator(RedirectMode.REDIRECT_TO_LANGUAGE_SUBPATH).copy()
				.negotiationObserver(new NegotiationObserver() {
					@Override
					public void didRedirect(@NonNull Request request, @NonNull Redirected redirected) {
						throw new IllegalStateException("Observer failure");
					}
				})
				.finish();

		Assertions.assertDoesNotThrow(() -> localeNegotiator.negotiate(request("/lists", null)));
	}

	@NonNull
	private static LocaleNegotiator negotiator(@NonNull RedirectMode redirectMode) {
		return LocaleNegotiator.withDefaultLocale(ENGLISH)
				.supportedLocales(SupportedLocales.of(ENGLISH, JAPANESE))
				.redirectMode(redirectMode)
				.build();
	}

	@NonNull
	private static Request request(@NonNull String rawUrl,
																 String acceptLanguageHeaderValue) {
		return Request.withRawUrl(rawUrl)
				.headers(acceptLanguageHeaderValue == null ? Map.of() : Map.of("Accept-Language", Set.of(acceptLanguageHeaderValue)))
				.build();
	}
}
