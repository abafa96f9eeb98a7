package org.springaicommunity.corpus.harvester;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A training conversation: system prompt, user prompt, assistant response, plus metadata
 * that travels with the example but is never part of the prompt.
 *
 * @param messages exactly three messages in system, user, assistant order
 * @param meta metadata; always contains {@code key}, {@code source} and {@code tech}
 */
public record TrainingExample(List<ChatMessage> messages, @JsonProperty("_meta") Map<String, Object> meta) {

	public static final String KEY = "key";

	public static final String SOURCE = "source";

	public static final String TECH = "tech";

	public TrainingExample {
		if (messages.size() != 3 || !ChatMessage.SYSTEM.equals(messages.get(0).role())
				|| !ChatMessage.USER.equals(messages.get(1).role())
				|| !ChatMessage.ASSISTANT.equals(messages.get(2).role())) {
			throw new IllegalArgumentException("A training example needs system, user and assistant messages");
		}
		if (!(meta.get(KEY) instanceof String)) {
			throw new IllegalArgumentException("A training example needs a '" + KEY + "' in its metadata");
		}
		messages = List.copyOf(messages);
		meta = Collections.unmodifiableMap(new LinkedHashMap<>(meta));
	}

	/**
	 * Create an example.
	 * @param system system prompt
	 * @param user user prompt
	 * @param assistant target response
	 * @param meta metadata, iteration order is preserved in the output
	 * @return example
	 */
	public static TrainingExample of(String system, String user, String assistant, Map<String, Object> meta) {
		return new TrainingExample(
				List.of(ChatMessage.system(system), ChatMessage.user(user), ChatMessage.assistant(assistant)), meta);
	}

	/**
	 * Returns the unique key from the metadata.
	 * @return natural key or content-derived id
	 */
	public String naturalKey() {
		return (String) meta.get(KEY);
	}

	/**
	 * Returns a metadata entry as a string.
	 * @param name metadata key
	 * @return value, or {@code "unknown"} if absent
	 */
	public String metaString(String name) {
		Object value = meta.get(name);
		return value != null ? value.toString() : "unknown";
	}

	public String assistantContent() {
		return messages.get(2).content();
	}

}
