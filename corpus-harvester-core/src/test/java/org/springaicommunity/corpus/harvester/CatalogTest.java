package org.springaicommunity.corpus.harvester;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the bundled {@link TargetCatalog} and {@link TemplateCatalog} resources.
 */
@DisplayName("Catalog Tests")
class CatalogTest {

	private final ObjectMapper objectMapper = ObjectMapperFactory.create();

	@Nested
	@DisplayName("Target Catalog Tests")
	class TargetCatalogTest {

		private final TargetCatalog catalog = TargetCatalog.load(objectMapper, "harvest-targets.json");

		@Test
		@DisplayName("Should list repositories per technology in catalog order")
		void shouldLoadIssueTargets() {
			Map<String, List<String>> issues = catalog.targets(SourceType.GITHUB_ISSUES);

			assertThat(issues).hasSize(11);
			assertThat(issues.keySet()).startsWith("kubernetes", "docker", "terraform");
			assertThat(issues.get("kubernetes")).contains("kubernetes/kubernetes");
		}

		@Test
		@DisplayName("Should restrict targets to the requested technologies")
		void shouldRestrictTechnologies() {
			assertThat(catalog.targets(SourceType.STACKOVERFLOW, List.of("docker", "unknown"))).containsOnlyKeys(
					"docker");
		}

		@Test
		@DisplayName("Should return no targets for a source without entries")
		void shouldReturnEmptyForSynthetic() {
			assertThat(catalog.targets(SourceType.SYNTHETIC)).isEmpty();
		}

		@Test
		@DisplayName("Should fail for a missing resource")
		void shouldFailForMissingResource() {
			assertThatThrownBy(() -> TargetCatalog.load(objectMapper, "no-such-targets.json"))
				.isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("no-such-targets.json");
		}

	}

	@Nested
	@DisplayName("Template Catalog Tests")
	class TemplateCatalogTest {

		@Test
		@DisplayName("Should load the incident profile grouped by technology")
		void shouldLoadIncidentProfile() {
			TemplateCatalog catalog = TemplateCatalog.forProfile(objectMapper, "incident");

			assertThat(catalog.profile()).isEqualTo("incident");
			assertThat(catalog.templates()).hasSize(58);
			assertThat(catalog.byTech()).containsKey("kubernetes");
			assertThat(catalog.byTech().values().stream().mapToInt(List::size).sum()).isEqualTo(58);
		}

		@Test
		@DisplayName("Should render user and generation prompts")
		void shouldRenderPrompts() {
			TemplateCatalog catalog = TemplateCatalog.forProfile(objectMapper, "incident");
			PromptTemplate first = catalog.templates().get(0);

			assertThat(catalog.userPrompt(first)).startsWith("Analyze this kubernetes incident")
				.contains(first.input())
				.doesNotContain("{");
			assertThat(catalog.generationPrompt(first, 3)).contains("Write 3 distinct")
				.contains("Pod CrashLoopBackOff");
		}

		@Test
		@DisplayName("Should load code review templates with hints under either profile spelling")
		void shouldLoadCodeReviewProfile() {
			TemplateCatalog catalog = TemplateCatalog.forProfile(objectMapper, "code-review");
			PromptTemplate first = catalog.templates().get(0);

			assertThat(catalog.templates()).hasSize(42).allMatch(t -> t.tech().equals("python"));
			assertThat(first.hint()).isEqualTo("No null check before accessing .email");
			assertThat(catalog.generationPrompt(first, 2)).contains("Hint: No null check before accessing .email");
			assertThat(TemplateCatalog.forProfile(objectMapper, "code_review").templates()).hasSize(42);
		}

		@Test
		@DisplayName("Should give every bundled template its own key")
		void shouldGiveEveryTemplateUniqueKey() {
			for (String profile : List.of("incident", "code_review")) {
				List<PromptTemplate> templates = TemplateCatalog.forProfile(objectMapper, profile).templates();

				assertThat(templates).extracting(PromptTemplate::templateKey).doesNotHaveDuplicates();
			}
		}

		@Test
		@DisplayName("Should number templates that repeat a scenario as variants")
		void shouldNumberScenarioVariants() {
			List<PromptTemplate> templates = TemplateCatalog.forProfile(objectMapper, "code_review").templates();
			PromptTemplate first = templates.get(0);

			assertThat(first.variant()).isEqualTo(1);
			assertThat(first.templateKey()).doesNotContain("#");
			assertThat(templates).filteredOn(t -> t.scenario().equals(first.scenario())
					&& t.category().equals(first.category()))
				.extracting(PromptTemplate::variant)
				.startsWith(1, 2);
			assertThat(templates).anyMatch(t -> t.templateKey().endsWith("#2"));
		}

		@Test
		@DisplayName("Should reject a catalog with two templates under one key")
		void shouldRejectDuplicateKeys() {
			PromptTemplate template = new PromptTemplate("python", "null-check", "missing guard", "def f(): pass",
					null);

			assertThatThrownBy(() -> new TemplateCatalog("code_review", "system", "{input}", "{count}",
					List.of(template, template)))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("python/null-check/missing guard");
		}

		@Test
		@DisplayName("Should reject an unknown profile")
		void shouldRejectUnknownProfile() {
			assertThatThrownBy(() -> TemplateCatalog.forProfile(objectMapper, "poetry"))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("poetry");
		}

	}

}
