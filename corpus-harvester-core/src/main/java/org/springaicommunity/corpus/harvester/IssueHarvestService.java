package org.springaicommunity.corpus.harvester;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * Harvests closed GitHub issues whose comments contain a resolution.
 *
 * <p>
 * Per repository: closed issues created on or after the date floor are listed, issues
 * without an error description are prefiltered, and for the first prefiltered issues the
 * comments are fetched and searched for a solution.
 */
public class IssueHarvestService extends BaseHarvestService {

	private static final Logger logger = LoggerFactory.getLogger(IssueHarvestService.class);

	static final List<String> SOLUTION_INDICATORS = List.of("fixed by", "solved by", "the fix is", "the solution is",
			"this was fixed", "this was resolved", "workaround:", "workaround is", "i fixed it by", "i solved it by",
			"the issue was", "root cause", "the problem was", "this happens because", "you need to", "try this:",
			"the answer is", "solution:");

	static final List<String> SOLUTION_COMMENT_TERMS = List.of("fixed", "solved", "solution", "workaround",
			"try this", "you need to", "the issue", "the problem", "root cause");

	static final int MIN_SOLUTION_LENGTH = 50;

	static final int MAX_SOLUTION_COMMENTS = 3;

	static final String SOLUTION_SEPARATOR = "\n\n---\n\n";

	private final RestService restService;

	private final PaginatedCollector collector;

	private final QualityFilter prefilter = QualityFilters.issuePrefilter();

	private final QualityFilter incidentFilter = QualityFilters.incidents();

	public IssueHarvestService(RestService restService, TargetCatalog targets, CorpusRepository repository,
			HarvestProperties properties) {
		super(targets, repository, properties);
		this.restService = restService;
		this.collector = new PaginatedCollector(properties.getMaxPages());
	}

	@Override
	public SourceType getSourceType() {
		return SourceType.GITHUB_ISSUES;
	}

	@Override
	protected List<CandidateRecord> harvestUnit(String tech, String repo, HarvestRequest request,
			HarvestContext context) {
		Instant floor = request.minDateInstant();
		int perPage = properties.getPerPage();
		PageSource<GitHubIssue> pages = cursor -> restService.listClosedIssues(repo, floor, perPage,
				Page.pageNumber(cursor));
		Predicate<GitHubIssue> keep = DateFloor.onOrAfter(floor, GitHubIssue::createdAt);

		List<Draft> drafts = new ArrayList<>();
		collector.collect(pages, request.capOr(properties.getMaxIssuesPerRepo()), keep, context).forEach(issue -> {
			CandidateRecord draft = toDraft(issue, tech, repo);
			ItemResult<CandidateRecord> screened = screen(draft, prefilter);
			if (screened.isAccepted()) {
				drafts.add(new Draft(issue.number(), draft));
			}
			else {
				context.recordOutcome(screened);
			}
		});
		logger.info("{}: {} issues passed the prefilter", repo, drafts.size());

		List<CandidateRecord> kept = new ArrayList<>();
		for (Draft draft : drafts.subList(0, Math.min(drafts.size(), properties.getMaxDetailedIssuesPerRepo()))) {
			settle(resolve(draft.number(), draft.candidate(), repo), kept, context);
		}
		return kept;
	}

	private ItemResult<CandidateRecord> resolve(int number, CandidateRecord draft, String repo) {
		List<IssueComment> comments;
		try {
			comments = restService.listIssueComments(repo, number);
		}
		catch (FetchException e) {
			// Retries are exhausted at this point; only this issue is lost
			logger.warn("Skipping {}: comments unavailable ({})", draft.naturalKey(), e.getMessage());
			return ItemResult.failed(e.getMessage());
		}

		if (!hasSolutionIndicators(draft, comments)) {
			return ItemResult.skipped(RejectReason.NO_SOLUTION);
		}
		String solution = extractSolution(comments);
		if (solution.length() < MIN_SOLUTION_LENGTH) {
			return ItemResult.skipped(RejectReason.NO_SOLUTION);
		}
		CandidateRecord candidate = new CandidateRecord(draft.naturalKey(), draft.category(), draft.title(),
				draft.problem(), solution, draft.labels(), draft.provenance(), comments.size());
		return screen(candidate, incidentFilter);
	}

	private static CandidateRecord toDraft(GitHubIssue issue, String tech, String repo) {
		return new CandidateRecord(CandidateRecord.key(SourceType.GITHUB_ISSUES, repo, issue.number()), tech,
				issue.title(), TextCleaner.clean(issue.body()), "", issue.labels(),
				new Provenance(SourceType.GITHUB_ISSUES, repo, issue.url(), issue.createdAt()), issue.comments());
	}

	/**
	 * An issue is considered resolved when its text or comments use a resolution phrase,
	 * or when it was closed after discussion.
	 */
	static boolean hasSolutionIndicators(CandidateRecord draft, List<IssueComment> comments) {
		StringBuilder all = new StringBuilder(draft.problem().toLowerCase(Locale.ROOT));
		for (IssueComment comment : comments) {
			all.append(' ').append(comment.body().toLowerCase(Locale.ROOT));
		}
		String text = all.toString();
		if (SOLUTION_INDICATORS.stream().anyMatch(text::contains)) {
			return true;
		}
		// Every listed issue is closed, so any discussion before closing counts
		return !comments.isEmpty();
	}

	/**
	 * Join the first few substantial comments that read like a solution.
	 */
	static String extractSolution(List<IssueComment> comments) {
		List<String> parts = new ArrayList<>();
		for (IssueComment comment : comments) {
			String body = comment.body();
			if (body.length() < MIN_SOLUTION_LENGTH) {
				continue;
			}
			String lower = body.toLowerCase(Locale.ROOT);
			if (SOLUTION_COMMENT_TERMS.stream().anyMatch(lower::contains)) {
				parts.add(TextCleaner.clean(body));
			}
			if (parts.size() == MAX_SOLUTION_COMMENTS) {
				break;
			}
		}
		return String.join(SOLUTION_SEPARATOR, parts);
	}

	private record Draft(int number, CandidateRecord candidate) {
	}

}
