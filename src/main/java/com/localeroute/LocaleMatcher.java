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

import javax.annotation.concurrent.ThreadSafe;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Matching rules shared by content negotiation and by anything that looks up per-locale data, e.g. a message catalog.
 * <p>
 * Lookups are two-stage: an exact (full tag) match is preferred, and if none exists, the first entry whose primary
 * language subtag matches is used.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class LocaleMatcher {
	private LocaleMatcher() {
		// Non-instantiable
	}

	/**
	 * Is the given tag supported?
	 * <p>
	 * Membership is by language equality, never full equality: a supported set containing {@code en} supports {@code en-US}.
	 *
	 * @param localeTag        the candidate tag
	 * @param supportedLocales the configured supported set
	 * @return {@code true} if some supported entry has the same language subtag, {@code false} otherwise
	 */
	@NonNull
	public static Boolean isSupported(@NonNull LocaleTag localeTag,
																		@NonNull SupportedLocales supportedLocales) {
		requireNonNull(localeTag);
		requireNonNull(supportedLocales);

		for (LocaleTag supportedLocaleTag : supportedLocales.getLocaleTags())
			if (supportedLocaleTag.matchesLanguage(localeTag))
				return true;

		return false;
	}

	/**
	 * Finds the key which best matches the given tag: the key itself if present, otherwise the first key (in iteration order) with the same language subtag.
	 *
	 * @param localeTag the tag to look up
	 * @param keys      the candidate keys, iterated in their natural order
	 * @return the matching key, or {@link Optional#empty()} if no key has the same language
	 */
	@NonNull
	public static Optional<LocaleTag> resolveKey(@NonNull LocaleTag localeTag,
																							 @NonNull Collection<@NonNull LocaleTag> keys) {
		requireNonNull(localeTag);
		requireNonNull(keys);

		if (keys.contains(localeTag))
			return Optional.of(localeTag);

		for (LocaleTag key : keys)
			if (key.matchesLanguage(localeTag))
				return Optional.of(key);

		return Optional.empty();
	}

	/**
	 * Looks up the registry entry for the given tag using exact-then-language matching.
	 * <p>
	 * When several keys share the tag's language but none matches exactly, the first in the registry's iteration order wins,
	 * so callers that need a predictable winner should supply an ordered map such as {@link java.util.LinkedHashMap}.
	 *
	 * @param localeTag the tag to look up
	 * @param registry  per-locale entries
	 * @param <T>       the entry type
	 * @return the matching entry, or {@link Optional#empty()} if no key has the same language
	 */
	@NonNull
	public static <T> Optional<T> resolve(@NonNull LocaleTag localeTag,
																				@NonNull Map<@NonNull LocaleTag, T> registry) {
		requireNonNull(localeTag);
		requireNonNull(registry);

		return resolveKey(localeTag, registry.keySet()).map(registry::get);
	}
}
