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

/**
 * Read-only hooks into negotiation decisions, e.g. for metrics or audit logging.
 * <p>
 * All methods have no-op default implementations.  Exceptions thrown by an observer are logged by {@link LocaleNegotiator} and do not affect request handling.
 * <p>
 * A standard threadsafe implementation can be acquired via {@link #defaultInstance()}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public interface NegotiationObserver {
	/**
	 * Called when a locale has been attached to a request which will proceed downstream.
	 *
	 * @param request        the request as originally received
	 * @param localeAttached the outcome, including the request that will be forwarded
	 */
	default void didAttachLocale(@NonNull Request request,
															 @NonNull LocaleAttached localeAttached) {
		// No-op by default
	}

	/**
	 * Called when a request will be answered with a redirect to a locale-prefixed URL.
	 *
	 * @param request    the request as originally received
	 * @param redirected the outcome, including the redirect target
	 */
	default void didRedirect(@NonNull Request request,
													 @NonNull Redirected redirected) {
		// No-op by default
	}

	/**
	 * Called when a request bypasses negotiation because its path matched an excluded prefix.
	 *
	 * @param request  the request as originally received
	 * @param excluded the outcome
	 */
	default void didExcludeRequest(@NonNull Request request,
																 @NonNull Excluded excluded) {
		// No-op by default
	}

	/**
	 * Acquires a threadsafe {@link NegotiationObserver} instance which does nothing.
	 *
	 * @return a {@code NegotiationObserver} with default settings
	 */
	@NonNull
	static NegotiationObserver defaultInstance() {
		return DefaultNegotiationObserver.defaultInstance();
	}
}
