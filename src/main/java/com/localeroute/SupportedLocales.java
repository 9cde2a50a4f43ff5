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
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Ordered, immutable set of the locales an application supports.
 * <p>
 * Membership tests are always by language equality - see {@link LocaleMatcher#isSupported(LocaleTag, SupportedLocales)}.
 * <p>
 * Instances can be acquired via the {@link #of(List)} and {@link #fromStrings(List)} factory methods.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class SupportedLocales {
	@NonNull
	private final List<@NonNull LocaleTag> localeTags;

	/**
	 * Acquires a {@link SupportedLocales} for the given tags, preserving their order and discarding exact duplicates.
	 *
	 * @param localeTags the supported tags, must not be empty
	 * @return the supported set
	 */
	@NonNull
	public static SupportedLocales of(@NonNull List<@NonNull LocaleTag> localeTags) {
		requireNonNull(localeTags);
		return new SupportedLocales(localeTags);
	}

	/**
	 * Acquires a {@link SupportedLocales} for the given tags, preserving their order and discarding exact duplicates.
	 *
	 * @param localeTags the supported tags, must not be empty
	 * @return the supported set
	 */
	@NonNull
	public static SupportedLocales of(@NonNull LocaleTag... localeTags) {
		requireNonNull(localeTags);
		return new SupportedLocales(List.of(localeTags));
	}

	/**
	 * Acquires a {@link SupportedLocales} by parsing each of the given strings.
	 *
	 * @param localeTags the supported tags in text form, must not be empty
	 * @return the supported set
	 * @throws com.localeroute.exception.LocaleTagParseException if any of the strings is not a valid tag
	 */
	@NonNull
	public static SupportedLocales fromStrings(@NonNull List<@NonNull String> localeTags) {
		requireNonNull(localeTags);

		return new SupportedLocales(localeTags.stream()
				.map(LocaleTag::fromString)
				.collect(Collectors.toList()));
	}

	private SupportedLocales(@NonNull List<@NonNull LocaleTag> localeTags) {
		requireNonNull(localeTags);

		if (localeTags.isEmpty())
			throw new IllegalArgumentException(format("At least one locale must be supplied to %s", getClass().getSimpleName()));

		for (LocaleTag localeTag : localeTags)
			requireNonNull(localeTag);

		this.localeTags = Collections.unmodifiableList(new ArrayList<>(new LinkedHashSet<>(localeTags)));
	}

	/**
	 * Is the given tag supported, by language equality?
	 *
	 * @param localeTag the candidate tag
	 * @return {@code true} if supported, {@code false} otherwise
	 */
	@NonNull
	public Boolean isSupported(@NonNull LocaleTag localeTag) {
		requireNonNull(localeTag);
		return LocaleMatcher.isSupported(localeTag, this);
	}

	/**
	 * Finds the configured entry that best matches the given tag: an exact match if one is configured, otherwise the first configured entry with the same language.
	 *
	 * @param localeTag the candidate tag
	 * @return the configured entry, or {@link Optional#empty()} if the tag is unsupported
	 */
	@NonNull
	public Optional<LocaleTag> resolve(@NonNull LocaleTag localeTag) {
		requireNonNull(localeTag);
		return LocaleMatcher.resolveKey(localeTag, getLocaleTags());
	}

	/**
	 * The supported tags in configuration order.
	 *
	 * @return the supported tags
	 */
	@NonNull
	public List<@NonNull LocaleTag> getLocaleTags() {
		return this.localeTags;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{localeTags=%s}", getClass().getSimpleName(), getLocaleTags());
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof SupportedLocales supportedLocales))
			return false;

		return Objects.equals(getLocaleTags(), supportedLocales.getLocaleTags());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getLocaleTags());
	}
}
