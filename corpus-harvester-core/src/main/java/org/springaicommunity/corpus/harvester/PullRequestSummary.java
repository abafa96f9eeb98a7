package org.springaicommunity.corpus.harvester;

import org.jspecify.annotations.Nullable;

import java.time.Instant;

/**
 * A pull request from the REST pulls listing.
 *
 * @param number pull request number
 * @param title pull request title
 * @param url HTML URL
 * @param createdAt creation time
 * @param mergedAt merge time, {@code null} if closed without merging
 */
public record PullRequestSummary(int number, String title, String url, @Nullable Instant createdAt,
		@Nullable Instant mergedAt) {

	public boolean isMerged() {
		return mergedAt != null;
	}

}
