package org.springaicommunity.corpus.harvester;

import org.jspecify.annotations.Nullable;

import java.time.Instant;

/**
 * A comment on a GitHub issue.
 *
 * @param author login of the commenter
 * @param body comment text
 * @param createdAt creation time
 */
public record IssueComment(String author, String body, @Nullable Instant createdAt) {
}
