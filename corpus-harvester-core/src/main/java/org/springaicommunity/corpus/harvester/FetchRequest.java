package org.springaicommunity.corpus.harvester;

import org.jspecify.annotations.Nullable;

import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An outgoing HTTP request, independent of the HTTP library that executes it.
 *
 * @param method HTTP method, {@code GET} or {@code POST}
 * @param uri absolute request URI
 * @param headers request headers in insertion order
 * @param body request body for {@code POST}, {@code null} otherwise
 */
public record FetchRequest(String method, URI uri, Map<String, String> headers, @Nullable String body) {

	public FetchRequest {
		headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
	}

	/**
	 * Create a GET request.
	 * @param url absolute URL including the query string
	 * @param headers request headers
	 * @return GET request
	 */
	public static FetchRequest get(String url, Map<String, String> headers) {
		return new FetchRequest("GET", URI.create(url), headers, null);
	}

	/**
	 * Create a POST request with a JSON body.
	 * @param url absolute URL
	 * @param body request body
	 * @param headers request headers
	 * @return POST request
	 */
	public static FetchRequest post(String url, String body, Map<String, String> headers) {
		return new FetchRequest("POST", URI.create(url), headers, body);
	}

	/**
	 * Short description used in log messages, without query parameters that may carry
	 * keys.
	 * @return method and path
	 */
	public String describe() {
		return method + " " + uri.getHost() + uri.getPath();
	}

}
