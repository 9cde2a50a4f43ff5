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

/**
 * Where a negotiated locale came from.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public enum LocaleSource {
	/**
	 * The first segment of the request path, e.g. {@code /ja/lists}.
	 */
	PATH,
	/**
	 * The request's {@code Accept-Language} header.
	 */
	ACCEPT_LANGUAGE_HEADER,
	/**
	 * No candidate was found, so the configured default locale was used.
	 */
	DEFAULT
}
