package org.springaicommunity.corpus.harvester;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

@DisplayName("JsonArrayExtractor Tests")
class JsonArrayExtractorTest {

	private final JsonArrayExtractor extractor = new JsonArrayExtractor(ObjectMapperFactory.create());

	@Nested
	@DisplayName("Extraction Tests")
	class ExtractionTest {

		@Test
		@DisplayName("Should extract the array surrounded by prose")
		void shouldExtractFromNoise() {
			String text = "noise [{\"response\":\"a\"},{\"response\":\"b\"}] trailing";

			assertThat(extractor.extract(text, "response")).containsExactly("a", "b");
		}

		@ParameterizedTest
		@ValueSource(strings = { "no array here", "", "[unterminated", "[not json]" })
		@DisplayName("Should return an empty list when no array parses")
		void shouldReturnEmptyWithoutArray(String text) {
			assertThat(extractor.extract(text, "response")).isEmpty();
		}

		@Test
		@DisplayName("Should skip a bracket that is not JSON and use the next array")
		void shouldSkipMalformedCandidate() {
			String text = "Step [one] of the plan:\n```json\n[{\"response\":\"fixed\"}]\n```";

			assertThat(extractor.extract(text, "response")).containsExactly("fixed");
		}

		@Test
		@DisplayName("Should take the first well-formed array")
		void shouldTakeFirstWellFormedArray() {
			String text = "Step [1] of the plan: [{\"response\":\"fixed\"}]";

			assertThat(extractor.findArray(text)).isPresent();
			assertThat(extractor.extract(text, "response")).isEmpty();
		}

		@Test
		@DisplayName("Should skip an unclosed bracket and use a later array")
		void shouldSkipUnclosedBracket() {
			String text = "see [note\n[{\"response\":\"ok\"}]";

			assertThat(extractor.extract(text, "response")).containsExactly("ok");
		}

		@Test
		@DisplayName("Should ignore brackets inside strings")
		void shouldIgnoreBracketsInStrings() {
			String text = "[{\"response\":\"use arr[0] and \\\"]\\\" safely\"}]";

			assertThat(extractor.extract(text, "response")).containsExactly("use arr[0] and \"]\" safely");
		}

		@Test
		@DisplayName("Should drop blank and non-text values")
		void shouldDropBlankValues() {
			String text = "[{\"response\":\"  \"},{\"response\":42},{\"other\":\"x\"},{\"response\":\" kept \"}]";

			assertThat(extractor.extract(text, "response")).containsExactly("kept");
		}

	}

	@Nested
	@DisplayName("Bracket Matching Tests")
	class BracketMatchingTest {

		@Test
		@DisplayName("Should find the matching bracket of nested arrays")
		void shouldMatchNested() {
			String text = "x [[1],[2]] y";

			assertThat(JsonArrayExtractor.matchingBracket(text, 2)).isEqualTo(10);
		}

		@Test
		@DisplayName("Should return -1 for an unclosed bracket")
		void shouldReturnMinusOneWhenUnclosed() {
			assertThat(JsonArrayExtractor.matchingBracket("[[1]", 0)).isEqualTo(-1);
		}

	}

}
