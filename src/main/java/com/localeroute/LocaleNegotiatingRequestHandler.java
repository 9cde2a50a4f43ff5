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

import javax.annotation.concurrent.ThreadSafe;
import java.util.function.Consumer;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * {@link RequestHandler} which negotiates each request's locale before handing it to a downstream handler.
 * <p>
 * Requests which carry (or are excluded from) a locale are forwarded to the downstream handler, whose response and
 * exceptions pass through untouched.  Requests which must be redirected are answered directly with a bodyless redirect
 * response and never reach the downstream handler.
 * <p>
 * Nothing is buffered or queued: the downstream handler sees each request on the calling thread, immediately after negotiation.
 * <p>
 * Instances are usually acquired via {@link LocaleNegotiator#wrap(RequestHandler)}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class LocaleNegotiatingRequestHandler implements RequestHandler {
	@NonNull
	private final LocaleNegotiator localeNegotiator;
	@NonNull
	private final RequestHandler requestHandler;

	public LocaleNegotiatingRequestHandler(@NonNull LocaleNegotiator localeNegotiator,
																				 @NonNull RequestHandler requestHandler) {
		requireNonNull(localeNegotiator);
		requireNonNull(requestHandler);

		this.localeNegotiator = localeNegotiator;
		this.requestHandler = requestHandler;
	}

	@Override
	public void handleRequest(@NonNull Request request,
														@NonNull Consumer<MarshaledResponse> marshaledResponseConsumer) {
		requireNonNull(request);
		requireNonNull(marshaledResponseConsumer);

		NegotiationOutcome negotiationOutcome = getLocaleNegotiator().negotiate(request);

		if (negotiationOutcome instanceof LocaleAttached localeAttached)
			getRequestHandler().handleRequest(localeAttached.getRequest(), marshaledResponseConsumer);
		else if (negotiationOutcome instanceof Excluded excluded)
			getRequestHandler().handleRequest(excluded.getRequest(), marshaledResponseConsumer);
		else if (negotiationOutcome instanceof Redirected redirected)
			marshaledResponseConsumer.accept(redirected.toMarshaledResponse());
		else
			// Should never occur
			throw new IllegalStateException(format("Unexpected %s: %s", NegotiationOutcome.class.getSimpleName(), negotiationOutcome));
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{localeNegotiator=%s, requestHandler=%s}", getClass().getSimpleName(),
				getLocaleNegotiator(), getRequestHandler());
	}

	@NonNull
	public LocaleNegotiator getLocaleNegotiator() {
		return this.localeNegotiator;
	}

	/**
	 * The downstream handler.
	 *
	 * @return the wrapped handler
	 */
	@NonNull
	public RequestHandler getRequestHandler() {
		return this.requestHandler;
	}
}
