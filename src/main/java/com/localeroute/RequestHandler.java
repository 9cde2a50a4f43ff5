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

import java.util.function.Consumer;

/**
 * A unit of work that consumes a {@link Request} and produces a {@link MarshaledResponse}.
 * <p>
 * Implementations may complete synchronously, by invoking {@code marshaledResponseConsumer} before returning, or
 * asynchronously, by invoking it later from another thread.  Failures are signaled by throwing.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@FunctionalInterface
public interface RequestHandler {
	/**
	 * Handles a request.
	 *
	 * @param request                   the request to handle
	 * @param marshaledResponseConsumer receives the response to send to the client
	 */
	void handleRequest(@NonNull Request request,
										 @NonNull Consumer<MarshaledResponse> marshaledResponseConsumer);
}
