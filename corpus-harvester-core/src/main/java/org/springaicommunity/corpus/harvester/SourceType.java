package org.springaicommunity.corpus.harvester;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where a record came from. The id is used in natural keys, file names and example
 * metadata.
 */
public enum SourceType {

	GITHUB_ISSUES("github_issues"),

	GITHUB_DISCUSSIONS("github_discussions"),

	STACKOVERFLOW("stackoverflow"),

	GITHUB_REVIEWS("github_reviews"),

	SYNTHETIC("synthetic");

	private final String id;

	SourceType(String id) {
		this.id = id;
	}

	@JsonValue
	public String id() {
		return id;
	}

	/**
	 * Resolve a source from its id.
	 * @param id source id such as {@code github_issues}
	 * @return the source type
	 * @throws IllegalArgumentException if the id is unknown
	 */
	@JsonCreator
	public static SourceType fromId(String id) {
		for (SourceType type : values()) {
			if (type.id.equals(id)) {
				return type;
			}
		}
		throw new IllegalArgumentException("Unknown source: " + id);
	}

}
