package org.springaicommunity.corpus.harvester;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Null-tolerant helpers for navigating provider JSON at the service boundary.
 */
public final class JsonNodeUtils {

	private static final Logger logger = LoggerFactory.getLogger(JsonNodeUtils.class);

	private JsonNodeUtils() {
	}

	/**
	 * Text at a path, empty string when missing or JSON null.
	 * @param node root node
	 * @param path field names to descend through
	 * @return text value
	 */
	public static String text(JsonNode node, String... path) {
		JsonNode target = descend(node, path);
		return target.isMissingNode() || target.isNull() ? "" : target.asText();
	}

	/**
	 * ISO-8601 timestamp at a path.
	 * @param node root node
	 * @param path field names to descend through
	 * @return the instant, or {@code null} when missing or malformed
	 */
	@Nullable
	public static Instant instant(JsonNode node, String... path) {
		String value = text(node, path);
		if (value.isEmpty()) {
			return null;
		}
		try {
			return Instant.parse(value);
		}
		catch (DateTimeParseException e) {
			logger.warn("Failed to parse datetime: {}", value);
			return null;
		}
	}

	/**
	 * Epoch-seconds timestamp at a path, as used by Stack Exchange.
	 * @param node root node
	 * @param path field names to descend through
	 * @return the instant, or {@code null} when missing
	 */
	@Nullable
	public static Instant epochSeconds(JsonNode node, String... path) {
		JsonNode target = descend(node, path);
		return target.canConvertToLong() ? Instant.ofEpochSecond(target.asLong()) : null;
	}

	/**
	 * Array elements at a path.
	 * @param node root node
	 * @param path field names to descend through
	 * @return elements, empty when the path is not an array
	 */
	public static List<JsonNode> array(JsonNode node, String... path) {
		JsonNode target = descend(node, path);
		List<JsonNode> result = new ArrayList<>();
		if (target.isArray()) {
			target.forEach(result::add);
		}
		return result;
	}

	/**
	 * Text of a field in each element of an array.
	 * @param node root node
	 * @param field field to read from each element, or empty for textual elements
	 * @param path field names leading to the array
	 * @return non-empty values in array order
	 */
	public static List<String> texts(JsonNode node, String field, String... path) {
		List<String> result = new ArrayList<>();
		for (JsonNode element : array(node, path)) {
			String value = field.isEmpty() ? element.asText("") : text(element, field);
			if (!value.isEmpty()) {
				result.add(value);
			}
		}
		return result;
	}

	private static JsonNode descend(JsonNode node, String... path) {
		JsonNode target = node;
		for (String p : path) {
			target = target.path(p);
		}
		return target;
	}

}
