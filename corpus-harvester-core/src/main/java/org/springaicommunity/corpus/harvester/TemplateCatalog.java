package org.springaicommunity.corpus.harvester;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.springaicommunity.corpus.harvester.JsonNodeUtils.text;

/**
 * A profile of synthetic-generation templates with the prompts used to render them.
 *
 * <p>
 * Prompts use {@code {placeholder}} substitution with the keys {@code tech},
 * {@code category}, {@code scenario}, {@code input}, {@code hint} and {@code count}.
 * Templates repeating a scenario with different input are numbered as variants so that
 * every template keeps its own quota.
 */
public class TemplateCatalog {

	public static final String INCIDENT_RESOURCE = "incident-templates.json";

	public static final String CODE_REVIEW_RESOURCE = "code-review-templates.json";

	private final String profile;

	private final String systemPrompt;

	private final String userPromptFormat;

	private final String generationPrompt;

	private final List<PromptTemplate> templates;

	public TemplateCatalog(String profile, String systemPrompt, String userPromptFormat, String generationPrompt,
			List<PromptTemplate> templates) {
		this.profile = profile;
		this.systemPrompt = systemPrompt;
		this.userPromptFormat = userPromptFormat;
		this.generationPrompt = generationPrompt;
		this.templates = List.copyOf(templates);
		Set<String> keys = new HashSet<>();
		for (PromptTemplate template : this.templates) {
			if (!keys.add(template.templateKey())) {
				throw new IllegalArgumentException("Duplicate template key in " + profile + ": "
						+ template.templateKey());
			}
		}
	}

	/**
	 * Load a catalog from the classpath.
	 * @param objectMapper mapper used to read the document
	 * @param resource classpath resource name
	 * @return the catalog
	 */
	public static TemplateCatalog load(ObjectMapper objectMapper, String resource) {
		try (InputStream in = TemplateCatalog.class.getClassLoader().getResourceAsStream(resource)) {
			if (in == null) {
				throw new IllegalStateException("Template catalog not found on classpath: " + resource);
			}
			JsonNode root = objectMapper.readTree(in);
			List<PromptTemplate> templates = new ArrayList<>();
			Map<String, Integer> variants = new HashMap<>();
			for (JsonNode node : root.path("templates")) {
				String hint = text(node, "hint");
				PromptTemplate first = new PromptTemplate(text(node, "tech"), text(node, "category"),
						text(node, "scenario"), text(node, "input"), hint.isEmpty() ? null : hint);
				int variant = variants.merge(first.scenarioKey(), 1, Integer::sum);
				templates.add(new PromptTemplate(first.tech(), first.category(), first.scenario(), first.input(),
						first.hint(), variant));
			}
			if (templates.isEmpty()) {
				throw new IllegalStateException("Template catalog has no templates: " + resource);
			}
			return new TemplateCatalog(text(root, "profile"), text(root, "system_prompt"),
					text(root, "user_prompt_format"), text(root, "generation_prompt"), templates);
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to read template catalog " + resource, e);
		}
	}

	/**
	 * Resolve a profile name to its bundled catalog.
	 * @param objectMapper mapper used to read the document
	 * @param profile {@code incident} or {@code code_review}
	 * @return the catalog
	 */
	public static TemplateCatalog forProfile(ObjectMapper objectMapper, String profile) {
		return switch (profile) {
			case "incident" -> load(objectMapper, INCIDENT_RESOURCE);
			case "code_review", "code-review" -> load(objectMapper, CODE_REVIEW_RESOURCE);
			default -> throw new IllegalArgumentException("Unknown profile: " + profile
					+ ". Must be 'incident' or 'code_review'");
		};
	}

	/**
	 * Templates grouped by technology, in catalog order.
	 * @return technology to templates
	 */
	public Map<String, List<PromptTemplate>> byTech() {
		Map<String, List<PromptTemplate>> grouped = new LinkedHashMap<>();
		for (PromptTemplate template : templates) {
			grouped.computeIfAbsent(template.tech(), k -> new ArrayList<>()).add(template);
		}
		grouped.replaceAll((tech, list) -> Collections.unmodifiableList(list));
		return grouped;
	}

	public String profile() {
		return profile;
	}

	public String systemPrompt() {
		return systemPrompt;
	}

	public List<PromptTemplate> templates() {
		return templates;
	}

	/**
	 * User prompt of a training example built from a template.
	 * @param template the template
	 * @return rendered prompt
	 */
	public String userPrompt(PromptTemplate template) {
		return render(userPromptFormat, template, 1);
	}

	/**
	 * Prompt asking the model for several responses to a template.
	 * @param template the template
	 * @param count number of responses requested
	 * @return rendered prompt
	 */
	public String generationPrompt(PromptTemplate template, int count) {
		return render(generationPrompt, template, count);
	}

	private static String render(String format, PromptTemplate template, int count) {
		return format.replace("{tech}", template.tech())
			.replace("{category}", template.category())
			.replace("{scenario}", template.scenario())
			.replace("{hint}", template.hint() != null ? template.hint() : "")
			.replace("{count}", String.valueOf(count))
			.replace("{input}", template.input());
	}

}
