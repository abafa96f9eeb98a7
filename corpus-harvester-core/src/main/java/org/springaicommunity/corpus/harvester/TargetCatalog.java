package org.springaicommunity.corpus.harvester;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Harvest targets per source: technology tag to the repositories or tags harvested for
 * it.
 *
 * <p>
 * Loaded from a classpath JSON document keyed by source id:
 *
 * <pre>
 * {"github_issues": {"kubernetes": ["kubernetes/kubernetes", ...]}, "stackoverflow": {...}}
 * </pre>
 */
public class TargetCatalog {

	private final Map<SourceType, Map<String, List<String>>> targets;

	public TargetCatalog(Map<SourceType, Map<String, List<String>>> targets) {
		Map<SourceType, Map<String, List<String>>> copy = new EnumMap<>(SourceType.class);
		targets.forEach((source, byTech) -> {
			Map<String, List<String>> techCopy = new LinkedHashMap<>();
			byTech.forEach((tech, units) -> techCopy.put(tech, List.copyOf(units)));
			copy.put(source, techCopy);
		});
		this.targets = copy;
	}

	/**
	 * Load a catalog from the classpath.
	 * @param objectMapper mapper used to read the document
	 * @param resource classpath resource name
	 * @return the catalog
	 * @throws IllegalStateException if the resource is missing
	 */
	public static TargetCatalog load(ObjectMapper objectMapper, String resource) {
		try (InputStream in = TargetCatalog.class.getClassLoader().getResourceAsStream(resource)) {
			if (in == null) {
				throw new IllegalStateException("Target catalog not found on classpath: " + resource);
			}
			Map<String, LinkedHashMap<String, List<String>>> raw = objectMapper.readValue(in,
					new TypeReference<Map<String, LinkedHashMap<String, List<String>>>>() {
					});
			Map<SourceType, Map<String, List<String>>> parsed = new EnumMap<>(SourceType.class);
			raw.forEach((sourceId, byTech) -> parsed.put(SourceType.fromId(sourceId), byTech));
			return new TargetCatalog(parsed);
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to read target catalog " + resource, e);
		}
	}

	/**
	 * Targets of a source, optionally restricted to some technologies.
	 * @param source the source
	 * @param technologies technologies to keep; empty keeps all
	 * @return technology to units, in catalog order
	 */
	public Map<String, List<String>> targets(SourceType source, Collection<String> technologies) {
		Map<String, List<String>> byTech = targets.getOrDefault(source, Map.of());
		Map<String, List<String>> result = new LinkedHashMap<>();
		byTech.forEach((tech, units) -> {
			if (technologies.isEmpty() || technologies.contains(tech)) {
				result.put(tech, units);
			}
		});
		return result;
	}

	public Map<String, List<String>> targets(SourceType source) {
		return targets(source, List.of());
	}

}
