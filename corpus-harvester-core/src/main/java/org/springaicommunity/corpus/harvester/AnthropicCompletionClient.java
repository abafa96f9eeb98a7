package org.springaicommunity.corpus.harvester;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * {@link CompletionClient} for the Anthropic Messages API.
 */
public class AnthropicCompletionClient implements CompletionClient {

	private static final Logger logger = LoggerFactory.getLogger(AnthropicCompletionClient.class);

	public static final String MESSAGES_ENDPOINT = "https://api.anthropic.com/v1/messages";

	static final String API_VERSION = "2023-06-01";

	private final HttpFetcher fetcher;

	private final ObjectMapper objectMapper;

	private final String apiKey;

	private final String endpoint;

	public AnthropicCompletionClient(HttpFetcher fetcher, ObjectMapper objectMapper, String apiKey) {
		this(fetcher, objectMapper, apiKey, MESSAGES_ENDPOINT);
	}

	public AnthropicCompletionClient(HttpFetcher fetcher, ObjectMapper objectMapper, String apiKey,
			String endpoint) {
		this.fetcher = fetcher;
		this.objectMapper = objectMapper;
		this.apiKey = apiKey;
		this.endpoint = endpoint;
	}

	@Override
	public String complete(String model, String prompt, int maxTokens) {
		String body;
		try {
			body = objectMapper.writeValueAsString(Map.of("model", model, "max_tokens", maxTokens, "messages",
					List.of(Map.of("role", "user", "content", prompt))));
		}
		catch (JsonProcessingException e) {
			throw new CompletionApiException("Failed to serialize completion request", e);
		}

		FetchResponse response;
		try {
			response = fetcher.fetch(FetchRequest.post(endpoint, body, Map.of("x-api-key", apiKey,
					"anthropic-version", API_VERSION, "content-type", "application/json")));
		}
		catch (FetchException e) {
			throw new CompletionApiException("Completion request failed with status " + e.getStatusCode() + ": "
					+ e.getMessage(), e);
		}

		try {
			JsonNode root = objectMapper.readTree(response.body());
			JsonNode text = root.path("content").path(0).path("text");
			if (!text.isTextual()) {
				throw new CompletionApiException("Completion response has no text content");
			}
			logger.debug("Completion of {} chars, stop reason {}", text.asText().length(),
					root.path("stop_reason").asText("unknown"));
			return text.asText().strip();
		}
		catch (JsonProcessingException e) {
			throw new CompletionApiException("Malformed completion response: " + e.getOriginalMessage(), e);
		}
	}

}
