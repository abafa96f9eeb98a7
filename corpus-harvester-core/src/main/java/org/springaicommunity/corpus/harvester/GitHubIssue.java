package org.springaicommunity.corpus.harvester;

import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.List;

/**
 * A closed GitHub issue as returned by the REST issues listing.
 *
 * @param number issue number
 * @param title issue title
 * @param body issue body, empty if none
 * @param url HTML URL of the issue
 * @param author login of the issue author
 * @param createdAt creation time
 * @param closedAt close time, {@code null} if open
 * @param comments number of comments
 * @param labels label names
 */
public record GitHubIssue(int number, String title, String body, String url, String author,
		@Nullable Instant createdAt, @Nullable Instant closedAt, int comments, List<String> labels) {
}
