package org.springaicommunity.corpus.harvester;

import org.jspecify.annotations.Nullable;

/**
 * One synthetic-generation scenario.
 *
 * @param tech technology the scenario belongs to, e.g. {@code kubernetes} or
 * {@code python}
 * @param category failure or bug category
 * @param scenario short scenario description
 * @param input error log or code shown to the model and placed in the user prompt
 * @param hint optional hint about the defect, for code review
 * @param variant 1-based position among catalog templates sharing the same tech,
 * category and scenario
 */
public record PromptTemplate(String tech, String category, String scenario, String input, @Nullable String hint,
		int variant) {

	public PromptTemplate {
		if (variant < 1) {
			throw new IllegalArgumentException("variant must be at least 1");
		}
	}

	public PromptTemplate(String tech, String category, String scenario, String input, @Nullable String hint) {
		this(tech, category, scenario, input, hint, 1);
	}

	/**
	 * Stable identifier of this template within its catalog.
	 * @return {@code tech/category/scenario}, suffixed with {@code #variant} from the
	 * second variant on
	 */
	public String templateKey() {
		String base = scenarioKey();
		return variant == 1 ? base : base + "#" + variant;
	}

	String scenarioKey() {
		return tech + "/" + category + "/" + scenario;
	}

}
