package org.springaicommunity.corpus.harvester;

/**
 * A top-level comment on a GitHub discussion.
 *
 * @param body comment text
 * @param isAnswer whether the comment was marked as the answer
 */
public record DiscussionComment(String body, boolean isAnswer) {
}
