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

import com.localeroute.exception.LocaleTagParseException;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Immutable, normalized language identifier, e.g. {@code en}, {@code en-US} or {@code zh-Hant-TW}.
 * <p>
 * A tag consists of a required primary language subtag followed by optional script, region and variant subtags.
 * Subtags may be separated by either {@code -} or {@code _}.  Parsing is all-or-nothing: text which does not conform to
 * the language tag grammar results in a {@link LocaleTagParseException}, never a partially-populated tag.
 * <p>
 * Two notions of equality are supported:
 * <ul>
 *   <li><em>Full equality</em> via {@link #equals(Object)} - all subtags must match</li>
 *   <li><em>Language equality</em> via {@link #matchesLanguage(LocaleTag)} - only the primary language subtag must match</li>
 * </ul>
 * <p>
 * Instances can be acquired via the {@link #fromString(String)} and {@link #tryFromString(String)} factory methods.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class LocaleTag {
	@NonNull
	private final String language;
	@Nullable
	private final String script;
	@Nullable
	private final String region;
	@NonNull
	private final List<@NonNull String> variants;
	@NonNull
	private final String languageTag;

	/**
	 * Parses the given text into a {@link LocaleTag}.
	 *
	 * @param text the text to parse, e.g. {@code "en-US"}
	 * @return the parsed tag
	 * @throws LocaleTagParseException if the text does not conform to the language tag grammar
	 */
	@NonNull
	public static LocaleTag fromString(@NonNull String text) {
		requireNonNull(text);

		if (text.isEmpty())
			throw new LocaleTagParseException("Locale tag is empty", text);

		String[] subtags = text.split("[-_]", -1);
		int index = 0;

		String language = subtags[index];

		if (!isLanguageSubtag(language))
			throw new LocaleTagParseException(format("Illegal language subtag '%s'", language), text);

		++index;

		String script = null;

		if (index < subtags.length && isScriptSubtag(subtags[index])) {
			script = subtags[index];
			++index;
		}

		String region = null;

		if (index < subtags.length && isRegionSubtag(subtags[index])) {
			region = subtags[index];
			++index;
		}

		List<String> variants = new ArrayList<>();

		for (; index < subtags.length; ++index) {
			String variant = subtags[index];

			if (!isVariantSubtag(variant))
				throw new LocaleTagParseException(format("Illegal subtag '%s'", variant), text);

			String normalizedVariant = variant.toLowerCase(Locale.ROOT);

			if (variants.contains(normalizedVariant))
				throw new LocaleTagParseException(format("Duplicate variant subtag '%s'", variant), text);

			variants.add(normalizedVariant);
		}

		return new LocaleTag(language, script, region, variants);
	}

	/**
	 * Parses the given text into a {@link LocaleTag}, treating malformed input as absence.
	 *
	 * @param text the text to parse, may be {@code null}
	 * @return the parsed tag, or {@link Optional#empty()} if the text is {@code null} or does not conform to the language tag grammar
	 */
	@NonNull
	public static Optional<LocaleTag> tryFromString(@Nullable String text) {
		if (text == null)
			return Optional.empty();

		try {
			return Optional.of(fromString(text));
		} catch (LocaleTagParseException ignored) {
			// Malformed input is simply "no tag"
			return Optional.empty();
		}
	}

	private LocaleTag(@NonNull String language,
										@Nullable String script,
										@Nullable String region,
										@NonNull List<@NonNull String> variants) {
		requireNonNull(language);
		requireNonNull(variants);

		this.language = language.toLowerCase(Locale.ROOT);
		this.script = script == null ? null : script.substring(0, 1).toUpperCase(Locale.ROOT) + script.substring(1).toLowerCase(Locale.ROOT);
		this.region = region == null ? null : region.toUpperCase(Locale.ROOT);
		this.variants = Collections.unmodifiableList(new ArrayList<>(variants));

		StringBuilder languageTag = new StringBuilder(this.language);

		if (this.script != null)
			languageTag.append('-').append(this.script);

		if (this.region != null)
			languageTag.append('-').append(this.region);

		for (String variant : this.variants)
			languageTag.append('-').append(variant);

		this.languageTag = languageTag.toString();
	}

	/**
	 * Does this tag have the same primary language subtag as the given tag?
	 * <p>
	 * Script, region and variants are ignored, so {@code en-US} matches {@code en} and {@code en-GB}.
	 *
	 * @param localeTag the tag to compare against
	 * @return {@code true} if the language subtags are equal, {@code false} otherwise
	 */
	@NonNull
	public Boolean matchesLanguage(@NonNull LocaleTag localeTag) {
		requireNonNull(localeTag);
		return getLanguage().equals(localeTag.getLanguage());
	}

	/**
	 * Converts this tag to the equivalent {@link Locale}.
	 *
	 * @return the locale for this tag
	 */
	@NonNull
	public Locale toLocale() {
		return Locale.forLanguageTag(toLanguageTag());
	}

	/**
	 * The canonical text form of this tag, e.g. {@code zh-Hant-TW}.
	 *
	 * @return the canonical language tag
	 */
	@NonNull
	public String toLanguageTag() {
		return this.languageTag;
	}

	@Override
	@NonNull
	public String toString() {
		return toLanguageTag();
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof LocaleTag localeTag))
			return false;

		return Objects.equals(toLanguageTag(), localeTag.toLanguageTag());
	}

	@Override
	public int hashCode() {
		return Objects.hash(toLanguageTag());
	}

	/**
	 * The primary language subtag, normalized to lowercase, e.g. {@code en}.
	 *
	 * @return the language subtag
	 */
	@NonNull
	public String getLanguage() {
		return this.language;
	}

	/**
	 * The script subtag, normalized to titlecase, e.g. {@code Hant}.
	 *
	 * @return the script subtag, or {@link Optional#empty()} if none was specified
	 */
	@NonNull
	public Optional<String> getScript() {
		return Optional.ofNullable(this.script);
	}

	/**
	 * The region subtag, normalized to uppercase, e.g. {@code US} or {@code 419}.
	 *
	 * @return the region subtag, or {@link Optional#empty()} if none was specified
	 */
	@NonNull
	public Optional<String> getRegion() {
		return Optional.ofNullable(this.region);
	}

	/**
	 * The variant subtags in declaration order, normalized to lowercase.
	 *
	 * @return the variant subtags, or an empty list if none were specified
	 */
	@NonNull
	public List<@NonNull String> getVariants() {
		return this.variants;
	}

	@NonNull
	private static Boolean isLanguageSubtag(@NonNull String subtag) {
		return ((subtag.length() >= 2 && subtag.length() <= 3) || (subtag.length() >= 5 && subtag.length() <= 8))
				&& isAsciiAlpha(subtag);
	}

	@NonNull
	private static Boolean isScriptSubtag(@NonNull String subtag) {
		return subtag.length() == 4 && isAsciiAlpha(subtag);
	}

	@NonNull
	private static Boolean isRegionSubtag(@NonNull String subtag) {
		return (subtag.length() == 2 && isAsciiAlpha(subtag)) || (subtag.length() == 3 && isAsciiDigit(subtag));
	}

	@NonNull
	private static Boolean isVariantSubtag(@NonNull String subtag) {
		if (!isAsciiAlphanumeric(subtag))
			return false;

		if (subtag.length() >= 5 && subtag.length() <= 8)
			return true;

		// e.g. "1996"
		return subtag.length() == 4 && isAsciiDigit(subtag.substring(0, 1));
	}

	@NonNull
	private static Boolean isAsciiAlpha(@NonNull String string) {
		for (int i = 0; i < string.length(); ++i) {
			char c = string.charAt(i);
			if (!((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z')))
				return false;
		}

		return true;
	}

	@NonNull
	private static Boolean isAsciiDigit(@NonNull String string) {
		for (int i = 0; i < string.length(); ++i) {
			char c = string.charAt(i);
			if (!(c >= '0' && c <= '9'))
				return false;
		}

		return true;
	}

	@NonNull
	private static Boolean isAsciiAlphanumeric(@NonNull String string) {
		for (int i = 0; i < string.length(); ++i) {
			char c = string.charAt(i);
			if (!((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')))
				return false;
		}

		return true;
	}
}
