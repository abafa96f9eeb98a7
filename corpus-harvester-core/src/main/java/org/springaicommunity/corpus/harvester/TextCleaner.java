package org.springaicommunity.corpus.harvester;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Text normalisation applied to harvested records before they become training examples.
 */
public final class TextCleaner {

	private static final Pattern CRLF = Pattern.compile("\r\n?");

	private static final Pattern BLANK_LINES = Pattern.compile("\n{3,}");

	private static final Pattern SPACES = Pattern.compile(" {2,}");

	private static final Pattern MENTION = Pattern.compile("@[\\w-]+");

	private static final Pattern IMAGE_LINK = Pattern.compile("!\\[.*?]\\(.*?\\)");

	private static final Pattern LINK = Pattern.compile("\\[(.*?)]\\(.*?\\)");

	private static final Pattern ERROR_START = Pattern.compile("(error|exception|failed|fatal)[:\\s]|traceback");

	private static final List<String> ERROR_KEYWORDS = List.of("error", "exception", "fail", "denied", "refused");

	private static final Set<String> BLOCK_TAGS = Set.of("p", "div", "blockquote", "h1", "h2", "h3", "h4", "h5",
			"h6", "ul", "ol", "table", "tr", "hr");

	private static final String TRUNCATED_MARKER = "\n... (truncated)";

	private TextCleaner() {
	}

	/**
	 * Normalise line endings, collapse runs of blank lines and of spaces, trim.
	 * @param text raw text, may be empty
	 * @return cleaned text
	 */
	public static String clean(String text) {
		if (text.isEmpty()) {
			return "";
		}
		String cleaned = CRLF.matcher(text).replaceAll("\n");
		cleaned = BLANK_LINES.matcher(cleaned).replaceAll("\n\n");
		cleaned = SPACES.matcher(cleaned).replaceAll(" ");
		return cleaned.strip();
	}

	/**
	 * Convert a Stack Exchange HTML body to Markdown-flavoured plain text. Entities are
	 * decoded, {@code <pre>} blocks become fenced blocks, inline {@code <code>} becomes
	 * backticks, and every other tag is dropped.
	 * @param html HTML fragment
	 * @return plain text
	 */
	public static String cleanHtml(String html) {
		if (html.isBlank()) {
			return "";
		}
		StringBuilder out = new StringBuilder();
		for (Node node : Jsoup.parseBodyFragment(html).body().childNodes()) {
			render(node, out);
		}
		return BLANK_LINES.matcher(out.toString()).replaceAll("\n\n").strip();
	}

	private static void render(Node node, StringBuilder out) {
		if (node instanceof TextNode text) {
			out.append(text.getWholeText());
			return;
		}
		if (!(node instanceof Element element)) {
			return;
		}
		String tag = element.normalName();
		switch (tag) {
			case "pre" -> out.append("\n```\n").append(element.wholeText().strip()).append("\n```\n");
			case "code" -> out.append('`').append(element.wholeText()).append('`');
			case "br" -> out.append('\n');
			case "li" -> {
				out.append("\n- ");
				element.childNodes().forEach(child -> render(child, out));
			}
			default -> {
				element.childNodes().forEach(child -> render(child, out));
				if (BLOCK_TAGS.contains(tag)) {
					out.append("\n\n");
				}
			}
		}
	}

	/**
	 * Shorten a long problem description to the lines that matter: from the first line
	 * that opens an error block, plus any line mentioning an error keyword. Text without
	 * such lines is truncated with a marker.
	 * @param text problem description
	 * @param maxLength maximum length of the snippet
	 * @return the text itself if short enough, otherwise the snippet
	 */
	public static String extractErrorSnippet(String text, int maxLength) {
		if (text.length() <= maxLength) {
			return text;
		}
		List<String> relevant = new ArrayList<>();
		int length = 0;
		boolean inErrorBlock = false;
		for (String line : text.split("\n", -1)) {
			String lower = line.toLowerCase(Locale.ROOT);
			if (ERROR_START.matcher(lower).find()) {
				inErrorBlock = true;
			}
			if (inErrorBlock || ERROR_KEYWORDS.stream().anyMatch(lower::contains)) {
				relevant.add(line);
				length += line.length() + 1;
			}
			if (length > maxLength) {
				break;
			}
		}
		if (!relevant.isEmpty()) {
			String snippet = String.join("\n", relevant);
			return snippet.length() > maxLength ? snippet.substring(0, maxLength) : snippet;
		}
		return text.substring(0, maxLength) + TRUNCATED_MARKER;
	}

	/**
	 * Turn a unified diff hunk into plain code: drops {@code @@} headers and the leading
	 * {@code +}, {@code -} or space of each line.
	 * @param diffHunk diff hunk from a review comment
	 * @return code
	 */
	public static String cleanDiffHunk(String diffHunk) {
		if (diffHunk.isEmpty()) {
			return "";
		}
		List<String> lines = new ArrayList<>();
		for (String line : diffHunk.split("\n", -1)) {
			if (line.startsWith("@@")) {
				continue;
			}
			if (line.startsWith("+") || line.startsWith("-") || line.startsWith(" ")) {
				lines.add(line.substring(1));
			}
			else {
				lines.add(line);
			}
		}
		return String.join("\n", lines).strip();
	}

	/**
	 * Clean a review comment: removes mentions and images, keeps link text, collapses
	 * blank lines.
	 * @param comment review comment body
	 * @return cleaned comment
	 */
	public static String cleanReviewComment(String comment) {
		if (comment.isEmpty()) {
			return "";
		}
		String cleaned = MENTION.matcher(comment).replaceAll("");
		cleaned = IMAGE_LINK.matcher(cleaned).replaceAll("");
		cleaned = LINK.matcher(cleaned).replaceAll("$1");
		cleaned = BLANK_LINES.matcher(CRLF.matcher(cleaned).replaceAll("\n")).replaceAll("\n\n");
		return cleaned.strip();
	}

}
