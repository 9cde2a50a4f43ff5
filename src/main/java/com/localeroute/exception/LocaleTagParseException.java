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

package com.localeroute.exception;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;

import static java.util.Objects.requireNonNull;

/**
 * Exception thrown when text does not conform to the language tag grammar.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@NotThreadSafe
public class LocaleTagParseException extends IllegalArgumentException {
	@NonNull
	private final String localeTagText;

	public LocaleTagParseException(@Nullable String message,
																 @NonNull String localeTagText) {
		super(message);
		this.localeTagText = requireNonNull(localeTagText);
	}

	/**
	 * The text that failed to parse.
	 *
	 * @return the offending text
	 */
	@NonNull
	public String getLocaleTagText() {
		return this.localeTagText;
	}
}
