package org.springaicommunity.corpus.harvester;

import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.List;

/**
 * A GitHub discussion with its answer and top-level comments.
 *
 * @param number discussion number
 * @param title discussion title
 * @param body question text
 * @param url HTML URL
 * @param category category name, empty if none
 * @param createdAt creation time
 * @param answer body of the chosen answer, {@code null} if none was chosen
 * @param comments top-level comments
 * @param upvotes upvote count
 */
public record Discussion(int number, String title, String body, String url, String category,
		@Nullable Instant createdAt, @Nullable String answer, List<DiscussionComment> comments, int upvotes) {
}
