package org.springaicommunity.corpus.harvester;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

import static org.springaicommunity.corpus.harvester.QualityPredicates.*;

/**
 * Preset {@link QualityFilter}s and the vocabularies they use.
 *
 * <p>
 * The source prefilters run on the raw upstream record before any follow-up request
 * (comments, answers) is made, so that obviously unsuitable records cost nothing. The
 * {@link #incidents()} and {@link #codeReview()} presets run on complete candidates.
 */
public final class QualityFilters {

	/**
	 * Vocabulary that marks a problem description as an incident.
	 */
	public static final List<String> INCIDENT_ERROR_TERMS = List.of("error", "fail", "exception", "crash", "timeout",
			"not working", "broken", "issue", "problem", "unable", "cannot", "can't", "doesn't", "refused", "denied",
			"rejected", "invalid", "missing");

	/**
	 * Vocabulary that marks a solution as actionable or causal.
	 */
	public static final List<String> ACTION_TERMS = List.of("try", "use", "change", "set", "add", "remove",
			"install", "update", "run", "execute", "configure", "the issue", "the problem", "because", "caused by",
			"solution", "fix", "resolve", "workaround");

	public static final List<String> ISSUE_ERROR_TERMS = List.of("error", "fail", "crash", "exception", "timeout",
			"refused", "denied", "not working", "broken", "issue", "problem", "bug", "stack trace");

	public static final List<String> DISCUSSION_ERROR_TERMS = List.of("error", "fail", "crash", "exception",
			"timeout", "not working", "broken", "issue", "problem", "help", "how to fix", "how do i", "why does",
			"doesn't work");

	public static final List<String> STACKOVERFLOW_ERROR_TERMS = List.of("error", "fail", "exception", "crash",
			"timeout", "not working", "broken", "issue", "problem", "unable to", "cannot", "can't", "doesn't work",
			"refused", "denied", "rejected", "invalid");

	public static final List<String> FEATURE_REQUEST_MARKERS = List.of("feature request", "enhancement", "proposal",
			"[rfc]");

	public static final List<String> DENIED_DISCUSSION_CATEGORIES = List.of("announcement", "show", "ideas", "rfc");

	public static final List<String> LOW_VALUE_OPENINGS = List.of("lgtm", "looks good", "nit:", "nit ", "+1",
			"thanks!", "thank you", "nice!", "great!", "awesome", "ship it", "approved");

	public static final List<Pattern> LOW_QUALITY_OPENINGS = compile("LGTM", "\\+1", "Looks good", "Ship it",
			"Approved", "It's a draft", "draft version", "WIP", "TODO");

	public static final List<Pattern> AUTHOR_RESPONSE_OPENINGS = compile("I've fixed", "I'll fix", "I've updated",
			"I'll update", "I've changed", "I'll change", "I've removed", "I'll remove", "I've added", "I'll add",
			"Fixed it", "Done!", "Done\\.", "Good catch!", "Thanks for", "Thank you for", "Addressed", "Updated",
			"Changed as suggested", "Applied", "Resolved", "Good point!", "Nice catch", "Ah yes", "Ah,", "Oops",
			"My bad", "You're right", "Makes sense");

	private QualityFilters() {
	}

	/**
	 * Incident preset: problem 50 to 5000 characters, solution 50 to 3000 characters,
	 * incident vocabulary in the problem, actionable vocabulary in the solution.
	 * @return filter
	 */
	public static QualityFilter incidents() {
		return new QualityFilter(List.of(minLength(TextField.PROBLEM, 50, RejectReason.PROBLEM_TOO_SHORT),
				maxLength(TextField.PROBLEM, 5000, RejectReason.PROBLEM_TOO_LONG),
				minLength(TextField.SOLUTION, 50, RejectReason.SOLUTION_TOO_SHORT),
				maxLength(TextField.SOLUTION, 3000, RejectReason.SOLUTION_TOO_LONG),
				errorVocabulary(INCIDENT_ERROR_TERMS), actionVocabulary(ACTION_TERMS)));
	}

	/**
	 * Code-review preset: Python file, code context 20 to 3000 characters, comment 30 to
	 * 1500 characters, no low-value or author-response opening, not dominated by code
	 * fences, mostly ASCII, not mostly questions.
	 * @return filter
	 */
	public static QualityFilter codeReview() {
		return new QualityFilter(List.of(fileExtensionIn(List.of(".py")),
				minLength(TextField.PROBLEM, 20, RejectReason.PROBLEM_TOO_SHORT),
				maxLength(TextField.PROBLEM, 3000, RejectReason.PROBLEM_TOO_LONG),
				minLength(TextField.SOLUTION, 30, RejectReason.SOLUTION_TOO_SHORT),
				maxLength(TextField.SOLUTION, 1500, RejectReason.SOLUTION_TOO_LONG),
				noLowValueOpening(TextField.SOLUTION, LOW_VALUE_OPENINGS, 100),
				notOpeningWith("low-quality-opening", TextField.SOLUTION, LOW_QUALITY_OPENINGS,
						RejectReason.LOW_VALUE),
				notOpeningWith("author-response", TextField.SOLUTION, AUTHOR_RESPONSE_OPENINGS,
						RejectReason.AUTHOR_RESPONSE),
				notDominatedByCodeFences(TextField.SOLUTION, 4, 0.01), asciiRatioAtLeast(TextField.SOLUTION, 0.8),
				notMostlyQuestions(TextField.SOLUTION)));
	}

	/**
	 * Issue prefilter: body of at least 100 characters, no feature-request marker in the
	 * title, bug vocabulary in title or body.
	 * @return filter
	 */
	public static QualityFilter issuePrefilter() {
		return new QualityFilter(List.of(minLength(TextField.PROBLEM, 100, RejectReason.PROBLEM_TOO_SHORT),
				titleExcludes(FEATURE_REQUEST_MARKERS), errorVocabulary(ISSUE_ERROR_TERMS)));
	}

	/**
	 * Discussion prefilter: body of at least 50 characters, category not denied, help or
	 * error vocabulary in title or body.
	 * @return filter
	 */
	public static QualityFilter discussionPrefilter() {
		return new QualityFilter(List.of(minLength(TextField.PROBLEM, 50, RejectReason.PROBLEM_TOO_SHORT),
				labelsExclude(DENIED_DISCUSSION_CATEGORIES), errorVocabulary(DISCUSSION_ERROR_TERMS)));
	}

	/**
	 * Stack Overflow prefilter: question and accepted answer of at least 100 characters
	 * each, a positive score, error vocabulary in title or question.
	 * @return filter
	 */
	public static QualityFilter stackOverflowPrefilter() {
		return new QualityFilter(List.of(minScore(1), minLength(TextField.PROBLEM, 100, RejectReason.PROBLEM_TOO_SHORT),
				minLength(TextField.SOLUTION, 100, RejectReason.SOLUTION_TOO_SHORT),
				errorVocabulary(STACKOVERFLOW_ERROR_TERMS)));
	}

	private static List<Pattern> compile(String... openings) {
		return Arrays.stream(openings).map(o -> Pattern.compile(o, Pattern.CASE_INSENSITIVE)).toList();
	}

}
