package org.springaicommunity.corpus.harvester;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Finds the first well-formed JSON array in free-form model output.
 *
 * <p>
 * Each {@code [} is tried in turn: its matching {@code ]} is located by bracket counting
 * that skips brackets inside string literals and escaped quotes, and the candidate is
 * parsed with Jackson. Prose before and after the array is ignored.
 */
public class JsonArrayExtractor {

	private static final Logger logger = LoggerFactory.getLogger(JsonArrayExtractor.class);

	private final ObjectMapper objectMapper;

	public JsonArrayExtractor(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	/**
	 * Locate and parse the first well-formed top-level array.
	 * @param text model output
	 * @return the array, or empty if none parses
	 */
	public Optional<ArrayNode> findArray(String text) {
		int start = text.indexOf('[');
		while (start >= 0) {
			int end = matchingBracket(text, start);
			if (end >= 0) {
				try {
					JsonNode node = objectMapper.readTree(text.substring(start, end + 1));
					if (node instanceof ArrayNode array) {
						return Optional.of(array);
					}
				}
				catch (JsonProcessingException e) {
					logger.debug("Candidate array at offset {} is not valid JSON: {}", start,
							e.getOriginalMessage());
				}
			}
			start = text.indexOf('[', start + 1);
		}
		return Optional.empty();
	}

	/**
	 * Extract a string field from every element of the first array.
	 * @param text model output
	 * @param field field to read from each element
	 * @return non-blank values in array order; empty when no array is found
	 */
	public List<String> extract(String text, String field) {
		List<String> values = new ArrayList<>();
		findArray(text).ifPresent(array -> {
			for (JsonNode element : array) {
				JsonNode value = element.path(field);
				if (value.isTextual() && !value.asText().isBlank()) {
					values.add(value.asText().strip());
				}
			}
		});
		return values;
	}

	/**
	 * Index of the bracket closing the one at {@code start}, or -1 if it is never closed.
	 */
	static int matchingBracket(String text, int start) {
		int depth = 0;
		boolean inString = false;
		boolean escaped = false;
		for (int i = start; i < text.length(); i++) {
			char c = text.charAt(i);
			if (inString) {
				if (escaped) {
					escaped = false;
				}
				else if (c == '\\') {
					escaped = true;
				}
				else if (c == '"') {
					inString = false;
				}
				continue;
			}
			switch (c) {
				case '"' -> inString = true;
				case '[' -> depth++;
				case ']' -> {
					depth--;
					if (depth == 0) {
						return i;
					}
				}
				default -> {
				}
			}
		}
		return -1;
	}

}
