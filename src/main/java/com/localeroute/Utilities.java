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

import com.localeroute.exception.UriRewriteException;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A non-instantiable collection of utility methods.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class Utilities {
	@NonNull
	private static final Pattern HEAD_WHITESPACE_PATTERN;
	@NonNull
	private static final Pattern TAIL_WHITESPACE_PATTERN;
	@NonNull
	private static final Pattern LEADING_SLASHES_PATTERN;

	static {
		// See https://www.regular-expressions.info/unicode.html
		// \p{Z} or \p{Separator}: any kind of whitespace or invisible separator.
		//
		// First pattern matches all whitespace at the head of a string, second matches the same for tail.
		// Useful for a "stronger" trim() function, which is almost always what we want in a web context
		// with user-supplied input.
		HEAD_WHITESPACE_PATTERN = Pattern.compile("^(\\p{Z}|\\s)+");
		TAIL_WHITESPACE_PATTERN = Pattern.compile("(\\p{Z}|\\s)+$");

		LEADING_SLASHES_PATTERN = Pattern.compile("^/+");
	}

	private Utilities() {
		// Non-instantiable
	}

	/**
	 * Determines the locale preferred by a client from its {@code Accept-Language} header value, restricted to the supported set.
	 * <p>
	 * The algorithm is:
	 * <ol>
	 *   <li>If the entire (trimmed) value is itself a single supported tag, e.g. {@code en-US}, it is returned immediately.</li>
	 *   <li>Otherwise the value is split on {@code ,}, empty entries are discarded, anything from the first {@code ;} onward
	 *   (the quality value) is cut, and the first entry in header order that parses and is supported is returned.
	 *   Entries which do not parse, including the {@code *} wildcard, are skipped.</li>
	 * </ol>
	 * <p>
	 * Quality values are not used for ordering: header order is the client's preference order.
	 * For example, {@code "de,en-US;q=0.5"} with supported set {@code [en, ja]} yields {@code en-US}.
	 *
	 * @param acceptLanguageHeaderValue the raw header value, may be {@code null}
	 * @param supportedLocales          the supported set
	 * @return the first supported preference, or {@link Optional#empty()} if none
	 */
	@NonNull
	public static Optional<LocaleTag> extractLocaleTagFromAcceptLanguageHeaderValue(@Nullable String acceptLanguageHeaderValue,
																																									@NonNull SupportedLocales supportedLocales) {
		requireNonNull(supportedLocales);

		acceptLanguageHeaderValue = trimAggressivelyToNull(acceptLanguageHeaderValue);

		if (acceptLanguageHeaderValue == null)
			return Optional.empty();

		// Fast path for simple single-value headers
		Optional<LocaleTag> wholeValueLocaleTag = LocaleTag.tryFromString(acceptLanguageHeaderValue);

		if (wholeValueLocaleTag.isPresent() && supportedLocales.isSupported(wholeValueLocaleTag.get()))
			return wholeValueLocaleTag;

		for (String entry : acceptLanguageHeaderValue.split(",")) {
			int semicolonIndex = entry.indexOf(';');

			if (semicolonIndex != -1)
				entry = entry.substring(0, semicolonIndex);

			entry = trimAggressivelyToNull(entry);

			if (entry == null)
				continue;

			Optional<LocaleTag> localeTag = LocaleTag.tryFromString(entry);

			if (localeTag.isPresent() && supportedLocales.isSupported(localeTag.get()))
				return localeTag;
		}

		return Optional.empty();
	}

	/**
	 * Determines the locale specified by the first segment of a URL path, restricted to the supported set.
	 * <p>
	 * For example, {@code "/ja/lists"} with supported set {@code [en, ja]} yields {@code ja}, while {@code "/de/lists"} yields nothing.
	 *
	 * @param path             the URL path (a query string, if present, is ignored)
	 * @param supportedLocales the supported set
	 * @return the supported tag named by the first path segment, or {@link Optional#empty()} if there is none
	 */
	@NonNull
	public static Optional<LocaleTag> extractLocaleTagFromPath(@NonNull String path,
																														 @NonNull SupportedLocales supportedLocales) {
		requireNonNull(path);
		requireNonNull(supportedLocales);

		return extractFirstPathSegment(path)
				.flatMap(LocaleTag::tryFromString)
				.filter(supportedLocales::isSupported);
	}

	/**
	 * Extracts the first segment of a URL path, e.g. {@code "ja"} for {@code "/ja/lists?page=1"}.
	 *
	 * @param path the URL path
	 * @return the first path segment, or {@link Optional#empty()} if the path has none
	 */
	@NonNull
	public static Optional<String> extractFirstPathSegment(@NonNull String path) {
		requireNonNull(path);

		int queryIndex = path.indexOf('?');

		if (queryIndex != -1)
			path = path.substring(0, queryIndex);

		// The first element is whatever precedes the leading '/', normally the empty string
		String[] segments = path.split("/", -1);

		if (segments.length < 2)
			return Optional.empty();

		return Optional.of(segments[1]);
	}

	/**
	 * Removes a leading locale segment from a path-and-query URL, preserving everything else exactly.
	 * <p>
	 * Only the leading occurrence is removed, and only when it is a complete path segment.  For example, with segment {@code en}:
	 * <ul>
	 *   <li>{@code "/en/enrollment/details"} becomes {@code "/enrollment/details"}</li>
	 *   <li>{@code "/en/?page=1"} becomes {@code "/?page=1"}</li>
	 *   <li>{@code "/en"} becomes {@code "/"}</li>
	 *   <li>{@code "/enrollment/details"} is returned unchanged</li>
	 * </ul>
	 * <p>
	 * Segment comparison is case-insensitive.
	 *
	 * @param url           the path-and-query URL, e.g. {@code "/en/one?two=three"}
	 * @param localeSegment the locale segment to remove, e.g. {@code "en"} or {@code "en-US"}
	 * @return the rewritten URL, or the input if it does not start with the locale segment
	 * @throws UriRewriteException if the rewritten URL is not a valid path-and-query URL
	 */
	@NonNull
	public static String removeLocalePrefixFromUrl(@NonNull String url,
																								 @NonNull String localeSegment) {
		requireNonNull(url);
		requireNonNull(localeSegment);

		String prefix = "/" + localeSegment;

		if (localeSegment.isEmpty() || !url.regionMatches(true, 0, prefix, 0, prefix.length()))
			return url;

		String remainder = url.substring(prefix.length());
		String rewrittenUrl;

		if (remainder.isEmpty())
			rewrittenUrl = "/";
		else if (remainder.startsWith("/"))
			rewrittenUrl = "/" + LEADING_SLASHES_PATTERN.matcher(remainder).replaceFirst("");
		else if (remainder.startsWith("?") || remainder.startsWith("#"))
			rewrittenUrl = "/" + remainder;
		else
			// Segment merely shares a prefix with the locale, e.g. "/enrollment"
			return url;

		if (!rewrittenUrl.startsWith("/") || rewrittenUrl.startsWith("//"))
			throw new UriRewriteException(format("Removing locale segment '%s' from '%s' produced illegal URL '%s'",
					localeSegment, url, rewrittenUrl), url, rewrittenUrl);

		return rewrittenUrl;
	}

	/**
	 * Extracts the raw (un-decoded) path component from a URL, without any normalization.
	 * <p>
	 * For example, {@code "https://www.example.com/en/one?two=three"} and {@code "/en/one?two=three"} both yield {@code "/en/one"}.
	 *
	 * @param url a raw URL or path-and-query
	 * @return the raw path, {@code "/"} for empty input
	 */
	@NonNull
	public static String extractRawPathFromUrl(@NonNull String url) {
		requireNonNull(url);

		url = trimAggressivelyToEmpty(url);

		if (isAbsoluteUrl(url)) {
			try {
				URI uri = new URI(url);
				String rawPath = uri.getRawPath();
				return rawPath == null || rawPath.isEmpty() ? "/" : rawPath;
			} catch (URISyntaxException ignored) {
				// Fall through to manual extraction
			}
		}

		String path = stripSchemeAndAuthority(url);
		int fragmentIndex = path.indexOf('#');

		if (fragmentIndex != -1)
			path = path.substring(0, fragmentIndex);

		int queryIndex = path.indexOf('?');

		if (queryIndex != -1)
			path = path.substring(0, queryIndex);

		if (!path.startsWith("/"))
			path = "/" + path;

		return path;
	}

	/**
	 * Extracts the raw (un-decoded) query component from a URL.
	 * <p>
	 * For example, {@code "/path?a=b&c=d%20e"} would return {@code "a=b&c=d%20e"}.
	 * A {@code ?} with nothing after it is an empty query, not an absent one: {@code "/path?"} returns {@code ""}.
	 *
	 * @param url a raw URL or path
	 * @return the raw query component, or {@link Optional#empty()} if the URL has no {@code ?}
	 */
	@NonNull
	public static Optional<String> extractRawQueryFromUrl(@NonNull String url) {
		requireNonNull(url);

		url = trimAggressivelyToEmpty(url);

		int fragmentIndex = url.indexOf('#');

		if (fragmentIndex != -1)
			url = url.substring(0, fragmentIndex);

		int queryIndex = url.indexOf('?');

		if (queryIndex == -1)
			return Optional.empty();

		return Optional.of(url.substring(queryIndex + 1));
	}

	/**
	 * A "stronger" version of {@link String#trim()} which discards any kind of whitespace or invisible separator.
	 * <p>
	 * In a web environment with user-supplied inputs, this is the behavior we want the vast majority of the time.
	 * For example, users copy-paste URLs from Microsoft Word or Outlook and it's easy to accidentally include a {@code U+202F
	 * "Narrow No-Break Space (NNBSP)"} character at the end, which might break parsing.
	 * <p>
	 * See <a href="https://www.compart.com/en/unicode/U+202F">https://www.compart.com/en/unicode/U+202F</a> for details.
	 *
	 * @param string the string to trim
	 * @return the trimmed string, or {@code null} if the input string is {@code null} or the trimmed representation is of length {@code 0}
	 */
	@Nullable
	public static String trimAggressively(@Nullable String string) {
		if (string == null)
			return null;

		string = HEAD_WHITESPACE_PATTERN.matcher(string).replaceAll("");

		if (string.length() == 0)
			return string;

		string = TAIL_WHITESPACE_PATTERN.matcher(string).replaceAll("");

		return string;
	}

	/**
	 * Aggressively trims Unicode whitespace from the given string and returns {@code null} if the result is empty.
	 *
	 * @param string the input string; may be {@code null}
	 * @return a trimmed, non-empty string; or {@code null} if input was {@code null} or trimmed to empty
	 */
	@Nullable
	public static String trimAggressivelyToNull(@Nullable String string) {
		if (string == null)
			return null;

		string = trimAggressively(string);
		return string.length() == 0 ? null : string;
	}

	/**
	 * Aggressively trims Unicode whitespace from the given string and returns {@code ""} if the input is {@code null}.
	 *
	 * @param string the input string; may be {@code null}
	 * @return a trimmed string (never {@code null}); {@code ""} if input was {@code null}
	 */
	@NonNull
	public static String trimAggressivelyToEmpty(@Nullable String string) {
		if (string == null)
			return "";

		return trimAggressively(string);
	}

	@NonNull
	static Boolean isAbsoluteUrl(@NonNull String url) {
		requireNonNull(url);

		String lowercaseUrl = url.toLowerCase(Locale.ROOT);
		return lowercaseUrl.startsWith("http://") || lowercaseUrl.startsWith("https://");
	}

	@NonNull
	private static String stripSchemeAndAuthority(@NonNull String url) {
		requireNonNull(url);

		if (!isAbsoluteUrl(url))
			return url;

		int authorityStart = url.indexOf("//") + 2;
		int pathStart = -1;

		for (int i = authorityStart; i < url.length(); ++i) {
			char c = url.charAt(i);
			if (c == '/' || c == '?' || c == '#') {
				pathStart = i;
				break;
			}
		}

		return pathStart == -1 ? "/" : url.substring(pathStart);
	}
}
