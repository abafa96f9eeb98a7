package org.springaicommunity.corpus.harvester;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Factory methods for the {@link QualityPredicate}s that {@link QualityFilters} composes.
 * Every predicate is pure and can be tested on its own.
 */
public final class QualityPredicates {

	private QualityPredicates() {
	}

	/**
	 * Require at least {@code min} characters of trimmed text.
	 * @param field text to measure
	 * @param min minimum length, inclusive
	 * @param reason reported on rejection
	 * @return predicate
	 */
	public static QualityPredicate minLength(TextField field, int min, RejectReason reason) {
		return new QualityPredicate("min-length:" + key(field), reason, c -> field.extract(c).trim().length() >= min);
	}

	/**
	 * Allow at most {@code max} characters of trimmed text.
	 * @param field text to measure
	 * @param max maximum length, inclusive
	 * @param reason reported on rejection
	 * @return predicate
	 */
	public static QualityPredicate maxLength(TextField field, int max, RejectReason reason) {
		return new QualityPredicate("max-length:" + key(field), reason, c -> field.extract(c).trim().length() <= max);
	}

	/**
	 * Require the problem (or title) to contain error or incident vocabulary.
	 * @param terms lower-case terms, any of which is sufficient
	 * @return predicate rejecting with {@link RejectReason#NO_ERROR_INDICATOR}
	 */
	public static QualityPredicate errorVocabulary(Collection<String> terms) {
		return mentionsAny("error-vocabulary", TextField.TITLE_AND_PROBLEM, terms, RejectReason.NO_ERROR_INDICATOR);
	}

	/**
	 * Require the solution to contain actionable or causal vocabulary.
	 * @param terms lower-case terms, any of which is sufficient
	 * @return predicate rejecting with {@link RejectReason#NO_ACTIONABLE_SOLUTION}
	 */
	public static QualityPredicate actionVocabulary(Collection<String> terms) {
		return mentionsAny("action-vocabulary", TextField.SOLUTION, terms, RejectReason.NO_ACTIONABLE_SOLUTION);
	}

	/**
	 * Require the text to contain at least one of the terms, case-insensitively.
	 * @param name predicate name
	 * @param field text to search
	 * @param terms lower-case terms
	 * @param reason reported on rejection
	 * @return predicate
	 */
	public static QualityPredicate mentionsAny(String name, TextField field, Collection<String> terms,
			RejectReason reason) {
		List<String> vocabulary = List.copyOf(terms);
		return new QualityPredicate(name, reason, c -> containsAny(lower(field.extract(c)), vocabulary));
	}

	/**
	 * Reject records whose labels (or discussion category) match a denied category.
	 * @param denied lower-case category fragments
	 * @return predicate rejecting with {@link RejectReason#EXCLUDED_CATEGORY}
	 */
	public static QualityPredicate labelsExclude(Collection<String> denied) {
		List<String> vocabulary = List.copyOf(denied);
		return new QualityPredicate("labels-exclude", RejectReason.EXCLUDED_CATEGORY,
				c -> c.labels().stream().map(QualityPredicates::lower).noneMatch(l -> containsAny(l, vocabulary)));
	}

	/**
	 * Reject records whose title carries a feature-request style marker.
	 * @param markers lower-case title fragments such as {@code [rfc]}
	 * @return predicate rejecting with {@link RejectReason#EXCLUDED_CATEGORY}
	 */
	public static QualityPredicate titleExcludes(Collection<String> markers) {
		List<String> vocabulary = List.copyOf(markers);
		return new QualityPredicate("title-exclude", RejectReason.EXCLUDED_CATEGORY,
				c -> !containsAny(lower(c.title()), vocabulary));
	}

	/**
	 * Require a minimum share of ASCII characters, excluding text that is mostly not
	 * English. Empty text passes; length rules handle it.
	 * @param field text to measure
	 * @param threshold minimum ratio, e.g. 0.8
	 * @return predicate rejecting with {@link RejectReason#NON_ENGLISH}
	 */
	public static QualityPredicate asciiRatioAtLeast(TextField field, double threshold) {
		return new QualityPredicate("ascii-ratio:" + key(field), RejectReason.NON_ENGLISH,
				c -> asciiRatio(field.extract(c)) >= threshold);
	}

	/**
	 * Reject text dominated by fenced code blocks, which signals a suggested diff rather
	 * than an explanation: at least {@code minFences} fence markers and a fence density
	 * above {@code maxDensity} per character.
	 * @param field text to measure
	 * @param minFences fence count from which the density rule applies
	 * @param maxDensity fence markers per character above which the text is rejected
	 * @return predicate rejecting with {@link RejectReason#MOSTLY_CODE_BLOCKS}
	 */
	public static QualityPredicate notDominatedByCodeFences(TextField field, int minFences, double maxDensity) {
		return new QualityPredicate("code-fences:" + key(field), RejectReason.MOSTLY_CODE_BLOCKS, c -> {
			String text = field.extract(c);
			int fences = countOccurrences(text, "```");
			return !(fences >= minFences && text.length() > 0 && (double) fences / text.length() > maxDensity);
		});
	}

	/**
	 * Reject short texts that open with a low-value phrase such as "lgtm" or "+1".
	 * @param field text to check
	 * @param phrases lower-case opening phrases
	 * @param shortBelow only texts shorter than this are rejected
	 * @return predicate rejecting with {@link RejectReason#LOW_VALUE}
	 */
	public static QualityPredicate noLowValueOpening(TextField field, Collection<String> phrases, int shortBelow) {
		List<String> vocabulary = List.copyOf(phrases);
		return new QualityPredicate("low-value-opening:" + key(field), RejectReason.LOW_VALUE, c -> {
			String text = lower(field.extract(c)).trim();
			return text.length() >= shortBelow || vocabulary.stream().noneMatch(text::startsWith);
		});
	}

	/**
	 * Reject texts whose opening matches one of the patterns.
	 * @param name predicate name
	 * @param field text to check
	 * @param patterns patterns matched against the start of the trimmed text
	 * @param reason reported on rejection
	 * @return predicate
	 */
	public static QualityPredicate notOpeningWith(String name, TextField field, Collection<Pattern> patterns,
			RejectReason reason) {
		List<Pattern> compiled = List.copyOf(patterns);
		return new QualityPredicate(name, reason, c -> {
			String text = field.extract(c).trim();
			return compiled.stream().noneMatch(p -> p.matcher(text).lookingAt());
		});
	}

	/**
	 * Reject texts that end with a question and contain more question marks than full
	 * stops.
	 * @param field text to check
	 * @return predicate rejecting with {@link RejectReason#MOSTLY_QUESTIONS}
	 */
	public static QualityPredicate notMostlyQuestions(TextField field) {
		return new QualityPredicate("mostly-questions:" + key(field), RejectReason.MOSTLY_QUESTIONS, c -> {
			String text = field.extract(c).trim();
			return !(text.endsWith("?") && countOccurrences(text, "?") > countOccurrences(text, "."));
		});
	}

	/**
	 * Require a minimum score.
	 * @param min minimum score, inclusive
	 * @return predicate rejecting with {@link RejectReason#LOW_SCORE}
	 */
	public static QualityPredicate minScore(int min) {
		return new QualityPredicate("min-score", RejectReason.LOW_SCORE, c -> c.score() >= min);
	}

	/**
	 * Require the title, which holds the file path for review comments, to end with one
	 * of the extensions.
	 * @param extensions allowed extensions including the dot, e.g. {@code .py}
	 * @return predicate rejecting with {@link RejectReason#UNSUPPORTED_FILE}
	 */
	public static QualityPredicate fileExtensionIn(Collection<String> extensions) {
		List<String> allowed = List.copyOf(extensions);
		return new QualityPredicate("file-extension", RejectReason.UNSUPPORTED_FILE,
				c -> allowed.stream().anyMatch(ext -> c.title().endsWith(ext)));
	}

	/**
	 * Share of characters in the ASCII range.
	 * @param text text to measure
	 * @return ratio between 0 and 1, 1 for empty text
	 */
	public static double asciiRatio(String text) {
		if (text.isEmpty()) {
			return 1.0;
		}
		long ascii = text.chars().filter(ch -> ch < 128).count();
		return (double) ascii / text.length();
	}

	static int countOccurrences(String text, String token) {
		int count = 0;
		int index = text.indexOf(token);
		while (index >= 0) {
			count++;
			index = text.indexOf(token, index + token.length());
		}
		return count;
	}

	private static boolean containsAny(String text, List<String> terms) {
		for (String term : terms) {
			if (text.contains(term)) {
				return true;
			}
		}
		return false;
	}

	private static String lower(String text) {
		return text.toLowerCase(Locale.ROOT);
	}

	private static String key(TextField field) {
		return field.name().toLowerCase(Locale.ROOT).replace('_', '-');
	}

}
