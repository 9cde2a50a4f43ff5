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

package com.localeroute.servlet;

import com.localeroute.LocaleNegotiator;
import com.localeroute.LocaleTag;
import com.localeroute.NegotiationOutcome;
import com.localeroute.NegotiationOutcome.Excluded;
import com.localeroute.NegotiationOutcome.LocaleAttached;
import com.localeroute.NegotiationOutcome.Redirected;
import com.localeroute.Request;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.inject.Inject;
import javax.inject.Singleton;
import javax.servlet.Filter;
import javax.servlet.FilterChain;
import javax.servlet.FilterConfig;
import javax.servlet.RequestDispatcher;
import javax.servlet.ServletException;
import javax.servlet.ServletRequest;
import javax.servlet.ServletResponse;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletRequestWrapper;
import javax.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Collections;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.logging.Level.FINE;

/**
 * Servlet {@link Filter} which applies a {@link LocaleNegotiator} to every HTTP request.
 * <p>
 * The negotiator is either injected via {@link #LocaleNegotiationFilter(LocaleNegotiator)} or built in {@link #init(FilterConfig)}
 * from filter init parameters, whose names are the {@link LocaleNegotiator} property names without the {@code localeroute.} prefix
 * (e.g. {@code default-locale}, {@code supported-locales}, {@code redirect-mode}).
 * <p>
 * Paths are negotiated relative to the context path, so with context path {@code /app} a request for {@code /app/lists}
 * is redirected to {@code /app/en/lists}.
 * <p>
 * When a locale is attached, downstream code can read it via {@link #getLocaleTag(ServletRequest)}, and
 * {@link HttpServletRequest#getLocale()} reports it as well.  If the locale path prefix was removed, the request is forwarded
 * to the rewritten path so that servlet mappings see the prefix-free URL.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@Singleton
public class LocaleNegotiationFilter implements Filter {
	/**
	 * Request attribute under which the negotiated {@link LocaleTag} is stored.
	 */
	@NonNull
	public static final String LOCALE_TAG_REQUEST_ATTRIBUTE_NAME = "com.localeroute.LocaleTag";

	@NonNull
	private static final String PROPERTY_NAME_PREFIX = "localeroute.";

	@NonNull
	private final Logger logger = Logger.getLogger(LocaleNegotiationFilter.class.getName());
	@Nullable
	private volatile LocaleNegotiator localeNegotiator;

	/**
	 * Creates a filter whose {@link LocaleNegotiator} is built from init parameters in {@link #init(FilterConfig)}.
	 */
	public LocaleNegotiationFilter() {
		this.localeNegotiator = null;
	}

	@Inject
	public LocaleNegotiationFilter(@NonNull LocaleNegotiator localeNegotiator) {
		this.localeNegotiator = requireNonNull(localeNegotiator);
	}

	/**
	 * Acquires the locale negotiated for the given request by a {@link LocaleNegotiationFilter}.
	 *
	 * @param servletRequest the request
	 * @return the negotiated locale, or {@link Optional#empty()} if none was attached (e.g. for excluded paths)
	 */
	@NonNull
	public static Optional<LocaleTag> getLocaleTag(@NonNull ServletRequest servletRequest) {
		requireNonNull(servletRequest);

		Object localeTag = servletRequest.getAttribute(LOCALE_TAG_REQUEST_ATTRIBUTE_NAME);
		return localeTag instanceof LocaleTag ? Optional.of((LocaleTag) localeTag) : Optional.empty();
	}

	@Override
	public void init(@NonNull FilterConfig filterConfig) throws ServletException {
		requireNonNull(filterConfig);

		if (this.localeNegotiator != null)
			return;

		Properties properties = new Properties();
		Enumeration<String> initParameterNames = filterConfig.getInitParameterNames();

		if (initParameterNames != null)
			for (String initParameterName : Collections.list(initParameterNames))
				properties.setProperty(PROPERTY_NAME_PREFIX + initParameterName, filterConfig.getInitParameter(initParameterName));

		try {
			this.localeNegotiator = LocaleNegotiator.fromProperties(properties).build();
		} catch (IllegalArgumentException | IllegalStateException e) {
			throw new ServletException(format("Unable to configure %s from init parameters of filter '%s'",
					getClass().getSimpleName(), filterConfig.getFilterName()), e);
		}

		if (logger.isLoggable(FINE))
			logger.fine(format("Configured %s", this.localeNegotiator));
	}

	@Override
	public void destroy() {
		// Nothing to release
	}

	@Override
	public void doFilter(@NonNull ServletRequest servletRequest,
											 @NonNull ServletResponse servletResponse,
											 @NonNull FilterChain filterChain) throws IOException, ServletException {
		requireNonNull(servletRequest);
		requireNonNull(servletResponse);
		requireNonNull(filterChain);

		LocaleNegotiator localeNegotiator = this.localeNegotiator;

		if (localeNegotiator == null)
			throw new IllegalStateException(format("%s has not been initialized", getClass().getSimpleName()));

		// Non-HTTP requests, and requests which have already been negotiated (e.g. forwards), pass through untouched
		if (!(servletRequest instanceof HttpServletRequest httpServletRequest)
				|| !(servletResponse instanceof HttpServletResponse httpServletResponse)
				|| servletRequest.getAttribute(LOCALE_TAG_REQUEST_ATTRIBUTE_NAME) != null) {
			filterChain.doFilter(servletRequest, servletResponse);
			return;
		}

		String contextPath = httpServletRequest.getContextPath() == null ? "" : httpServletRequest.getContextPath();
		Request request = toRequest(httpServletRequest, contextPath);
		NegotiationOutcome negotiationOutcome = localeNegotiator.negotiate(request);

		if (negotiationOutcome instanceof Redirected redirected) {
			String location = contextPath + redirected.getLocation();

			if (logger.isLoggable(FINE))
				logger.fine(format("Redirecting %s to %s", request.getRawPathAndQuery(), location));

			httpServletResponse.setStatus(redirected.getRedirectType().getStatusCode());
			httpServletResponse.setHeader("Location", location);
		} else if (negotiationOutcome instanceof Excluded excluded) {
			if (logger.isLoggable(FINE))
				logger.fine(format("Path %s matches excluded prefix %s, skipping negotiation", request.getRawPath(), excluded.getExcludedPathPrefix()));

			filterChain.doFilter(httpServletRequest, httpServletResponse);
		} else if (negotiationOutcome instanceof LocaleAttached localeAttached) {
			Request forwardedRequest = localeAttached.getRequest();
			LocaleTag localeTag = localeAttached.getLocaleTag();

			httpServletRequest.setAttribute(LOCALE_TAG_REQUEST_ATTRIBUTE_NAME, localeTag);
			HttpServletRequest localizedHttpServletRequest = new LocalizedHttpServletRequest(httpServletRequest, localeTag);

			if (forwardedRequest.getRawPathAndQuery().equals(request.getRawPathAndQuery())) {
				filterChain.doFilter(localizedHttpServletRequest, httpServletResponse);
			} else {
				if (logger.isLoggable(FINE))
					logger.fine(format("Forwarding %s to %s with locale %s", request.getRawPathAndQuery(), forwardedRequest.getRawPathAndQuery(), localeTag));

				RequestDispatcher requestDispatcher = httpServletRequest.getRequestDispatcher(forwardedRequest.getRawPathAndQuery());

				if (requestDispatcher == null)
					throw new ServletException(format("No request dispatcher is available for %s", forwardedRequest.getRawPathAndQuery()));

				requestDispatcher.forward(localizedHttpServletRequest, httpServletResponse);
			}
		} else {
			// Should never occur
			throw new IllegalStateException(format("Unexpected %s: %s", NegotiationOutcome.class.getSimpleName(), negotiationOutcome));
		}
	}

	@NonNull
	protected Request toRequest(@NonNull HttpServletRequest httpServletRequest,
															@NonNull String contextPath) {
		requireNonNull(httpServletRequest);
		requireNonNull(contextPath);

		String requestUri = httpServletRequest.getRequestURI() == null ? "/" : httpServletRequest.getRequestURI();

		if (contextPath.length() > 0 && requestUri.startsWith(contextPath))
			requestUri = requestUri.substring(contextPath.length());

		if (!requestUri.startsWith("/"))
			requestUri = "/" + requestUri;

		String queryString = httpServletRequest.getQueryString();
		String rawUrl = queryString == null ? requestUri : format("%s?%s", requestUri, queryString);

		Map<String, Set<String>> headers = new LinkedHashMap<>();
		Enumeration<String> headerNames = httpServletRequest.getHeaderNames();

		if (headerNames != null) {
			for (String headerName : Collections.list(headerNames)) {
				Enumeration<String> headerValues = httpServletRequest.getHeaders(headerName);
				headers.put(headerName, headerValues == null ? Set.of() : new LinkedHashSet<>(Collections.list(headerValues)));
			}
		}

		return Request.withRawUrl(rawUrl)
				.headers(headers)
				.build();
	}

	@Nullable
	protected LocaleNegotiator getLocaleNegotiator() {
		return this.localeNegotiator;
	}

	/**
	 * Reports the negotiated locale through the standard servlet locale accessors.
	 */
	private static final class LocalizedHttpServletRequest extends HttpServletRequestWrapper {
		@NonNull
		private final Locale locale;

		LocalizedHttpServletRequest(@NonNull HttpServletRequest httpServletRequest,
																@NonNull LocaleTag localeTag) {
			super(requireNonNull(httpServletRequest));
			this.locale = requireNonNull(localeTag).toLocale();
		}

		@Override
		@NonNull
		public Locale getLocale() {
			return this.locale;
		}

		@Override
		@NonNull
		public Enumeration<Locale> getLocales() {
			return Collections.enumeration(Set.of(this.locale));
		}
	}
}
