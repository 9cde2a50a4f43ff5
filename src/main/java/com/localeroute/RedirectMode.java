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

import static java.util.Objects.requireNonNull;

/**
 * How a {@link LocaleNegotiator} treats requests whose path does not begin with a supported locale.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public enum RedirectMode {
	/**
	 * Never redirect.  The locale is taken from the {@code Accept-Language} header, falling back to the default locale, and the URL is left untouched.
	 */
	NO_REDIRECT,
	/**
	 * Redirect to a language-only sub-path, e.g. {@code /lists} becomes {@code /en/lists}.
	 */
	REDIRECT_TO_LANGUAGE_SUBPATH,
	/**
	 * Redirect to a full locale sub-path, e.g. {@code /lists} becomes {@code /en-US/lists}.
	 */
	REDIRECT_TO_FULL_LOCALE_SUBPATH;

	/**
	 * The text used for the given tag in locale-prefixed URLs under this mode.
	 * <p>
	 * {@link #REDIRECT_TO_LANGUAGE_SUBPATH} uses the language subtag only, the other modes use the full tag.
	 *
	 * @param localeTag the tag to represent
	 * @return the URL representation of the tag, e.g. {@code en} or {@code en-US}
	 */
	@NonNull
	public String localeRepresentation(@NonNull LocaleTag localeTag) {
		requireNonNull(localeTag);

		return switch (this) {
			case REDIRECT_TO_LANGUAGE_SUBPATH -> localeTag.getLanguage();
			case REDIRECT_TO_FULL_LOCALE_SUBPATH, NO_REDIRECT -> localeTag.toLanguageTag();
		};
	}
}
