package org.springaicommunity.corpus.harvester;

import java.time.Instant;
import java.util.List;

/**
 * Interface for GitHub REST API operations.
 *
 * <p>
 * All methods return strongly-typed DTOs and throw {@link FetchException} when the
 * provider call fails.
 */
public interface RestService {

	/**
	 * Fetch one page of closed issues, most recently updated first. Pull requests are
	 * removed from the page but still count towards its raw size.
	 * @param repository repository in {@code owner/repo} format
	 * @param since only issues updated at or after this time
	 * @param perPage page size
	 * @param page 1-based page number
	 * @return page of issues
	 */
	Page<GitHubIssue> listClosedIssues(String repository, Instant since, int perPage, int page);

	/**
	 * Fetch the comments of an issue.
	 * @param repository repository in {@code owner/repo} format
	 * @param issueNumber issue number
	 * @return comments in creation order
	 */
	List<IssueComment> listIssueComments(String repository, int issueNumber);

	/**
	 * Fetch one page of closed pull requests, most recently updated first.
	 * @param repository repository in {@code owner/repo} format
	 * @param perPage page size
	 * @param page 1-based page number
	 * @return page of pull requests, merged or not
	 */
	Page<PullRequestSummary> listClosedPullRequests(String repository, int perPage, int page);

	/**
	 * Fetch one page of inline review comments of a pull request.
	 * @param repository repository in {@code owner/repo} format
	 * @param pullNumber pull request number
	 * @param perPage page size
	 * @param page 1-based page number
	 * @return page of review comments
	 */
	Page<ReviewComment> listReviewComments(String repository, int pullNumber, int perPage, int page);

}
