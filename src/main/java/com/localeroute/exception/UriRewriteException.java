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
 * Exception thrown when stripping a locale prefix from a URL produces something that is not a valid path-and-query.
 * <p>
 * Rewritten URLs are always derived from a previously-valid URL, so this indicates an internal bug rather than bad client input.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@NotThreadSafe
public class UriRewriteException extends IllegalStateException {
	@NonNull
	private final String originalUrl;
	@NonNull
	private final String rewrittenUrl;

	public UriRewriteException(@Nullable String message,
														 @NonNull String originalUrl,
														 @NonNull String rewrittenUrl) {
		super(message);
		this.originalUrl = requireNonNull(originalUrl);
		this.rewrittenUrl = requireNonNull(rewrittenUrl);
	}

	@NonNull
	public String getOriginalUrl() {
		return this.originalUrl;
	}

	@NonNull
	public String getRewrittenUrl() {
		return this.rewrittenUrl;
	}
}
