package org.springaicommunity.corpus.harvester;

import org.jspecify.annotations.Nullable;

import java.time.Instant;

/**
 * An inline pull request review comment.
 *
 * @param id comment id
 * @param path path of the commented file
 * @param diffHunk diff context the comment is attached to, empty if none
 * @param body comment text
 * @param author login of the reviewer
 * @param url HTML URL
 * @param line line the comment refers to, or -1
 * @param side {@code LEFT} or {@code RIGHT}, empty if unknown
 * @param createdAt creation time
 */
public record ReviewComment(long id, String path, String diffHunk, String body, String author, String url, int line,
		String side, @Nullable Instant createdAt) {
}
