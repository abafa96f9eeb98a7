package org.springaicommunity.corpus.harvester;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("TextCleaner Tests")
class TextCleanerTest {

	@Nested
	@DisplayName("Plain Text Tests")
	class PlainTextTest {

		@Test
		@DisplayName("Should normalise line endings, blank lines and spaces")
		void shouldNormalise() {
			assertThat(TextCleaner.clean("  a  b\r\n\r\n\r\n\r\nc  ")).isEqualTo("a b\n\nc");
		}

		@Test
		@DisplayName("Should return empty for empty input")
		void shouldHandleEmpty() {
			assertThat(TextCleaner.clean("")).isEmpty();
			assertThat(TextCleaner.cleanHtml("  ")).isEmpty();
			assertThat(TextCleaner.cleanDiffHunk("")).isEmpty();
			assertThat(TextCleaner.cleanReviewComment("")).isEmpty();
		}

	}

	@Nested
	@DisplayName("HTML Tests")
	class HtmlTest {

		@Test
		@DisplayName("Should convert Stack Exchange HTML to Markdown-flavoured text")
		void shouldConvertHtml() {
			String html = "<p>Run &amp; check</p><pre><code>kubectl get pods</code></pre><p>Use <code>--force</code></p>";

			String text = TextCleaner.cleanHtml(html);

			assertThat(text).contains("Run & check")
				.contains("```\nkubectl get pods\n```")
				.contains("Use `--force`")
				.doesNotContain("<")
				.doesNotContain("\n\n\n");
		}

		@Test
		@DisplayName("Should render list items on their own lines")
		void shouldRenderLists() {
			String text = TextCleaner.cleanHtml("<ul><li>first</li><li>second</li></ul>");

			assertThat(text).isEqualTo("- first\n- second");
		}

	}

	@Nested
	@DisplayName("Error Snippet Tests")
	class ErrorSnippetTest {

		@Test
		@DisplayName("Should keep short text unchanged")
		void shouldKeepShortText() {
			assertThat(TextCleaner.extractErrorSnippet("short error", 100)).isEqualTo("short error");
		}

		@Test
		@DisplayName("Should keep the error block of a long description")
		void shouldExtractErrorBlock() {
			String intro = "some background about the deployment setup\n".repeat(5);
			String text = intro + "Traceback (most recent call last):\n  File app.py\nValueError: bad value";

			String snippet = TextCleaner.extractErrorSnippet(text, 200);

			assertThat(snippet).startsWith("Traceback").endsWith("ValueError: bad value").doesNotContain("background");
		}

		@Test
		@DisplayName("Should truncate text without error lines")
		void shouldTruncateWithoutErrors() {
			String text = "plain words ".repeat(50);

			String snippet = TextCleaner.extractErrorSnippet(text, 100);

			assertThat(snippet).hasSize(100 + "\n... (truncated)".length()).endsWith("(truncated)");
		}

	}

	@Nested
	@DisplayName("Review Text Tests")
	class ReviewTextTest {

		@Test
		@DisplayName("Should strip diff markers and hunk headers")
		void shouldCleanDiffHunk() {
			String hunk = "@@ -1,3 +1,4 @@\n def f():\n-    return 1\n+    return 2";

			assertThat(TextCleaner.cleanDiffHunk(hunk)).isEqualTo("def f():\n    return 1\n    return 2");
		}

		@Test
		@DisplayName("Should remove mentions and images and keep link text")
		void shouldCleanReviewComment() {
			String comment = "@alice see [docs](https://x.org) ![img](https://i.png)\r\n\r\n\r\n\r\nUse a timeout.";

			String cleaned = TextCleaner.cleanReviewComment(comment);

			assertThat(cleaned).doesNotContain("@alice")
				.doesNotContain("https")
				.startsWith("see docs")
				.endsWith("\n\nUse a timeout.")
				.doesNotContain("\n\n\n");
		}

	}

}
