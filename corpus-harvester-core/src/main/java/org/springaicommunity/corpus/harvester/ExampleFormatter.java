package org.springaicommunity.corpus.harvester;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Turns curated {@link CandidateRecord}s into {@link TrainingExample}s.
 *
 * <p>
 * Incident records (issues, discussions, Stack Overflow) become a diagnosis conversation
 * with the DevOps system prompt; review comments become a code-review conversation.
 */
public class ExampleFormatter {

	public static final String INCIDENT_SYSTEM_PROMPT = """
			You are an expert DevOps engineer and SRE. Analyze the provided error logs, stack traces, or incident descriptions.

			Your response should include:
			1. **Root Cause**: What is causing this issue
			2. **Severity**: Low / Medium / High / Critical
			3. **Fix**: Step-by-step solution to resolve the issue
			4. **Prevention**: How to prevent this in the future (optional)

			Be direct, specific, and actionable. Reference exact commands, config changes, or code fixes when applicable.""";

	public static final String REVIEW_SYSTEM_PROMPT = "You are an expert code reviewer. Analyze the provided Python "
			+ "code and give constructive, specific feedback. Focus on bugs, potential issues, code quality, and "
			+ "improvements. Be direct and actionable.";

	private static final int MAX_SNIPPET_LENGTH = 1500;

	/**
	 * Format a record according to its source.
	 * @param candidate curated record
	 * @return training example
	 */
	public TrainingExample format(CandidateRecord candidate) {
		return candidate.provenance().source() == SourceType.GITHUB_REVIEWS ? formatReview(candidate)
				: formatIncident(candidate);
	}

	/**
	 * Format an incident: cleaned problem prefixed with the title unless it already
	 * contains it, shortened to its error snippet, wrapped in the diagnosis prompt.
	 * @param candidate issue, discussion or Stack Overflow record
	 * @return training example
	 */
	public TrainingExample formatIncident(CandidateRecord candidate) {
		String problem = TextCleaner.clean(candidate.problem());
		String title = candidate.title();
		if (!title.isBlank() && !problem.toLowerCase(Locale.ROOT).contains(title.toLowerCase(Locale.ROOT))) {
			problem = title + "\n\n" + problem;
		}
		problem = TextCleaner.extractErrorSnippet(problem, MAX_SNIPPET_LENGTH);

		return TrainingExample.of(INCIDENT_SYSTEM_PROMPT, incidentPrompt(candidate.category(), problem),
				TextCleaner.clean(candidate.solution()), metadata(candidate));
	}

	/**
	 * Format a review comment: the code under review with its file name, answered by
	 * the reviewer's comment.
	 * @param candidate review comment record; the title holds the file path
	 * @return training example
	 */
	public TrainingExample formatReview(CandidateRecord candidate) {
		Map<String, Object> meta = metadata(candidate);
		meta.put("file_path", candidate.title());
		return TrainingExample.of(REVIEW_SYSTEM_PROMPT, reviewPrompt(candidate.title(), candidate.problem()),
				candidate.solution(), meta);
	}

	/**
	 * User prompt for an incident.
	 * @param tech technology tag
	 * @param problem problem text
	 * @return prompt
	 */
	public static String incidentPrompt(String tech, String problem) {
		return "Analyze this " + tech + " incident and provide diagnosis and fix:\n\n```\n" + problem + "\n```";
	}

	/**
	 * User prompt for a code review.
	 * @param filePath path of the reviewed file
	 * @param code code under review
	 * @return prompt
	 */
	public static String reviewPrompt(String filePath, String code) {
		String filename = filePath.isBlank() ? "code.py" : filePath.substring(filePath.lastIndexOf('/') + 1);
		return "Review this Python code from `" + filename + "`:\n\n```python\n" + code + "\n```";
	}

	private static Map<String, Object> metadata(CandidateRecord candidate) {
		Map<String, Object> meta = new LinkedHashMap<>();
		meta.put(TrainingExample.KEY, candidate.naturalKey());
		meta.put(TrainingExample.SOURCE, candidate.provenance().source().id());
		meta.put(TrainingExample.TECH, candidate.category());
		meta.put("url", candidate.provenance().url());
		return meta;
	}

}
