package org.springaicommunity.corpus.harvester;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.springaicommunity.corpus.harvester.JsonNodeUtils.*;

/**
 * Service for GitHub REST API operations.
 *
 * <p>
 * Converts GitHub API JSON responses to strongly-typed DTOs at the service boundary.
 */
public class GitHubRestService implements RestService {

	private static final Logger logger = LoggerFactory.getLogger(GitHubRestService.class);

	public static final String GITHUB_API_BASE = "https://api.github.com";

	private final HttpFetcher fetcher;

	private final ObjectMapper objectMapper;

	private final String token;

	private final String baseUrl;

	public GitHubRestService(HttpFetcher fetcher, ObjectMapper objectMapper, String token) {
		this(fetcher, objectMapper, token, GITHUB_API_BASE);
	}

	public GitHubRestService(HttpFetcher fetcher, ObjectMapper objectMapper, String token, String baseUrl) {
		this.fetcher = fetcher;
		this.objectMapper = objectMapper;
		this.token = token;
		this.baseUrl = baseUrl;
	}

	@Override
	public Page<GitHubIssue> listClosedIssues(String repository, Instant since, int perPage, int page) {
		String url = baseUrl + "/repos/" + repository + "/issues?state=closed&sort=updated&direction=desc"
				+ "&per_page=" + perPage + "&page=" + page + "&since=" + since.truncatedTo(ChronoUnit.SECONDS);
		JsonNode nodes = get(url);

		List<GitHubIssue> issues = new ArrayList<>();
		for (JsonNode node : nodes) {
			// The issues endpoint also lists pull requests
			if (node.has("pull_request")) {
				continue;
			}
			issues.add(parseIssue(node));
		}
		logger.debug("{} page {}: {} issues of {} records", repository, page, issues.size(), nodes.size());
		return Page.offset(issues, nodes.size(), page, perPage);
	}

	@Override
	public List<IssueComment> listIssueComments(String repository, int issueNumber) {
		JsonNode nodes = get(baseUrl + "/repos/" + repository + "/issues/" + issueNumber + "/comments?per_page=100");
		List<IssueComment> comments = new ArrayList<>();
		for (JsonNode node : nodes) {
			comments.add(new IssueComment(text(node, "user", "login"), text(node, "body"), instant(node, "created_at")));
		}
		return comments;
	}

	@Override
	public Page<PullRequestSummary> listClosedPullRequests(String repository, int perPage, int page) {
		String url = baseUrl + "/repos/" + repository + "/pulls?state=closed&sort=updated&direction=desc&per_page="
				+ perPage + "&page=" + page;
		JsonNode nodes = get(url);
		List<PullRequestSummary> pulls = new ArrayList<>();
		for (JsonNode node : nodes) {
			pulls.add(new PullRequestSummary(node.path("number").asInt(), text(node, "title"), text(node, "html_url"),
					instant(node, "created_at"), instant(node, "merged_at")));
		}
		return Page.offset(pulls, nodes.size(), page, perPage);
	}

	@Override
	public Page<ReviewComment> listReviewComments(String repository, int pullNumber, int perPage, int page) {
		String url = baseUrl + "/repos/" + repository + "/pulls/" + pullNumber + "/comments?per_page=" + perPage
				+ "&page=" + page;
		JsonNode nodes = get(url);
		List<ReviewComment> comments = new ArrayList<>();
		for (JsonNode node : nodes) {
			int line = node.hasNonNull("original_line") ? node.path("original_line").asInt()
					: node.path("line").asInt(-1);
			comments.add(new ReviewComment(node.path("id").asLong(), text(node, "path"), text(node, "diff_hunk"),
					text(node, "body"), text(node, "user", "login"), text(node, "html_url"), line, text(node, "side"),
					instant(node, "created_at")));
		}
		return Page.offset(comments, nodes.size(), page, perPage);
	}

	private JsonNode get(String url) {
		FetchResponse response = fetcher.fetch(FetchRequest.get(url,
				Map.of("Authorization", "token " + token, "Accept", "application/vnd.github.v3+json", "User-Agent",
						"corpus-harvester")));
		try {
			JsonNode root = objectMapper.readTree(response.body());
			if (!root.isArray()) {
				throw FetchException.malformed("Expected a JSON array from " + url, response.body());
			}
			return root;
		}
		catch (JsonProcessingException e) {
			throw FetchException.malformed("Malformed JSON from " + url + ": " + e.getOriginalMessage(),
					response.body());
		}
	}

	private static GitHubIssue parseIssue(JsonNode node) {
		return new GitHubIssue(node.path("number").asInt(), text(node, "title"), text(node, "body"),
				text(node, "html_url"), text(node, "user", "login"), instant(node, "created_at"),
				instant(node, "closed_at"), node.path("comments").asInt(0), texts(node, "name", "labels"));
	}

}
