package org.springaicommunity.corpus.harvester;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link ReviewCommentHarvestService}.
 */
@DisplayName("ReviewCommentHarvestService Tests")
@ExtendWith(MockitoExtension.class)
class ReviewCommentHarvestServiceTest {

	private static final String REPO = "psf/requests";

	private static final Instant CREATED = Instant.parse("2023-06-01T08:00:00Z");

	private static final String HUNK = "@@ -10,6 +10,8 @@ def send(self, request, **kwargs):\n"
			+ "     adapter = self.get_adapter(url=request.url)\n" + "+    r = adapter.send(request, **kwargs)\n"
			+ "+    return r";

	private static final String REVIEW = "This call can raise a ConnectionError when the adapter is closed, "
			+ "so wrap it and close the response in a finally block.";

	@Mock
	private RestService restService;

	@Mock
	private CorpusRepository repository;

	@TempDir
	Path tempDir;

	private ReviewCommentHarvestService service;

	@BeforeEach
	void setUp() {
		TargetCatalog targets = new TargetCatalog(Map.of(SourceType.GITHUB_REVIEWS, Map.of("python", List.of(REPO))));
		service = new ReviewCommentHarvestService(restService, targets, repository, new HarvestProperties());
	}

	private static ReviewComment comment(long id, String path, String body) {
		return new ReviewComment(id, path, HUNK, body, "reviewer",
				"https://github.com/psf/requests/pull/1#discussion_r" + id, 12, "RIGHT", CREATED);
	}

	@Test
	@DisplayName("Should pair diff hunks with substantial comments on merged pull requests")
	void shouldHarvestReviewComments() {
		List<PullRequestSummary> pulls = List.of(
				new PullRequestSummary(1, "Close adapters", "https://github.com/psf/requests/pull/1", CREATED,
						CREATED.plusSeconds(600)),
				new PullRequestSummary(2, "Draft", "https://github.com/psf/requests/pull/2", CREATED, null));
		when(restService.listClosedPullRequests(REPO, 100, 1)).thenReturn(Page.offset(pulls, 2, 1, 100));
		when(restService.listReviewComments(REPO, 1, 100, 1)).thenReturn(Page.offset(
				List.of(comment(7, "src/requests/sessions.py", REVIEW), comment(8, "src/requests/sessions.py", "LGTM"),
						comment(9, "docs/index.rst", REVIEW)),
				3, 1, 100));

		HarvestResult result = service.harvest(new HarvestRequest(List.of(), "2023-01-01", tempDir, true, null));

		assertThat(result.records()).singleElement().satisfies(record -> {
			assertThat(record.naturalKey()).isEqualTo("github_reviews:psf/requests#7");
			assertThat(record.category()).isEqualTo("python");
			assertThat(record.title()).isEqualTo("src/requests/sessions.py");
			assertThat(record.problem()).startsWith("adapter = self.get_adapter").doesNotContain("@@");
			assertThat(record.solution()).isEqualTo(REVIEW);
		});
		assertThat(result.context().getDroppedAtFetch()).isEqualTo(1);
		assertThat(result.context().getRejected(RejectReason.SOLUTION_TOO_SHORT)).isEqualTo(1);
		assertThat(result.context().getRejected(RejectReason.UNSUPPORTED_FILE)).isEqualTo(1);
		verify(restService, never()).listReviewComments(REPO, 2, 100, 1);
	}

	@Test
	@DisplayName("Should skip a pull request whose comments cannot be fetched and continue")
	void shouldIsolateFailingPullRequest() {
		List<PullRequestSummary> pulls = List.of(
				new PullRequestSummary(1, "Close adapters", "https://github.com/psf/requests/pull/1", CREATED,
						CREATED.plusSeconds(600)),
				new PullRequestSummary(3, "Retry adapters", "https://github.com/psf/requests/pull/3", CREATED,
						CREATED.plusSeconds(900)));
		when(restService.listClosedPullRequests(REPO, 100, 1)).thenReturn(Page.offset(pulls, 2, 1, 100));
		when(restService.listReviewComments(REPO, 1, 100, 1))
			.thenThrow(new FetchException("Server Error", FailureKind.TRANSIENT, 502, null, null, null));
		when(restService.listReviewComments(REPO, 3, 100, 1))
			.thenReturn(Page.offset(List.of(comment(11, "src/requests/adapters.py", REVIEW)), 1, 1, 100));

		HarvestResult result = service.harvest(new HarvestRequest(List.of(), "2023-01-01", tempDir, true, null));

		assertThat(result.records()).extracting(CandidateRecord::naturalKey)
			.containsExactly("github_reviews:psf/requests#11");
		assertThat(result.context().getFailedItems()).isEqualTo(1);
		assertThat(result.context().getFailedUnits()).isEmpty();
	}

}
