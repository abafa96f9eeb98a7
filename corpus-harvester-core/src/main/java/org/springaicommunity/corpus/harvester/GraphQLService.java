package org.springaicommunity.corpus.harvester;

import org.jspecify.annotations.Nullable;

/**
 * Interface for GitHub GraphQL API operations.
 */
public interface GraphQLService {

	/**
	 * Fetch one page of discussions, most recently updated first, with their category,
	 * marked answer and top-level comments.
	 * @param owner repository owner
	 * @param repo repository name
	 * @param first page size
	 * @param after end cursor of the previous page, or null for the first page
	 * @return page of discussions; empty when the repository is unknown or has
	 * discussions disabled
	 */
	Page<Discussion> listDiscussions(String owner, String repo, int first, @Nullable String after);

}
