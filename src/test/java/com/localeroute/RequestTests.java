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

import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class RequestTests {
	@Test
	public void rawUrlHandling() {
		Request request = Request.withRawUrl("https://www.example.com/en/one%20two?three=four%26five").build();

		assertEquals("/en/one%20two", request.getRawPath());
		assertEquals(Optional.of("three=four%26five"), request.getRawQuery());
		assertEquals("/en/one%20two?three=four%26five", request.getRawPathAndQuery());
		assertEquals(Optional.empty(), request.getLocaleTag());

		assertEquals("/", Request.withRawUrl("").build().getRawPathAndQuery());
	}

	@Test
	public void headersAreCaseInsensitive() {
		Request request = Request.withRawUrl("/")
				.headers(Map.of("Accept-Language", new LinkedHashSet<>(List.of("ja", "en;q=0.5"))))
				.build();

		assertEquals(Optional.of("ja, en;q=0.5"), request.getHeader("accept-language"), "Repeated header values should be joined");
		assertEquals(Optional.empty(), request.getHeader("Cookie"));
		assertThrows(UnsupportedOperationException.class, () -> request.getHeaders().put("Cookie", Set.of("a=b")));
	}

	@Test
	public void copy() {
		Request original = Request.withRawUrl("/ja/lists?page=1")
				.headers(Map.of("Accept-Language", Set.of("ja")))
				.build();

		Request copy = original.copy()
				.rawUrl("/lists?page=1")
				.localeTag(LocaleTag.fromString("ja"))
				.finish();

		assertEquals("/ja/lists?page=1", original.getRawPathAndQuery(), "Copying must not mutate the original");
		assertEquals(Optional.empty(), original.getLocaleTag());
		assertEquals("/lists?page=1", copy.getRawPathAndQuery());
		assertEquals(Optional.of(LocaleTag.fromString("ja")), copy.getLocaleTag());
		assertEquals(Optional.of("ja"), copy.getHeader("accept-language"));

		assertEquals(original, original.copy().finish());
		assertNotEquals(original, copy);
	}

	@Test
	public void emptyQuery() {
		Request request = Request.withRawUrl("/lists?").build();

		assertEquals("/lists", request.getRawPath());
		assertEquals(Optional.of(""), request.getRawQuery());
		assertEquals("/lists?", request.getRawPathAndQuery(), "A bare '?' must survive");
		assertEquals("/lists?", request.copy().finish().getRawPathAndQuery());

		assertEquals(Optional.empty(), Request.withRawUrl("/lists").build().getRawQuery());
	}

	@Test
	public void marshaledResponse() {
		MarshaledResponse marshaledResponse = MarshaledResponse.withStatusCode(302)
				.headers(Map.of("Location", Set.of("/en/")))
				.build();

		assertEquals(302, marshaledResponse.getStatusCode());
		assertEquals(Set.of("/en/"), marshaledResponse.getHeaders().get("LOCATION"), "Header names are case-insensitive");
		assertEquals(Optional.empty(), marshaledResponse.getBody());

		MarshaledResponse withBody = MarshaledResponse.withStatusCode(200)
				.body("ok".getBytes(StandardCharsets.UTF_8))
				.build();

		assertArrayEquals("ok".getBytes(StandardCharsets.UTF_8), withBody.getBody().get());
	}
}
