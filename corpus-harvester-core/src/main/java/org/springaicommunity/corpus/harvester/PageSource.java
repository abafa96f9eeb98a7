package org.springaicommunity.corpus.harvester;

import org.jspecify.annotations.Nullable;

/**
 * Fetches one page of a paginated listing. The cursor is opaque to the caller: a page
 * number for REST and Stack Exchange listings, an end cursor for GraphQL connections.
 *
 * @param <T> the type of items in each page
 */
@FunctionalInterface
public interface PageSource<T> {

	/**
	 * Fetch a page.
	 * @param cursor cursor returned by the previous page, {@code null} for the first page
	 * @return the page
	 * @throws FetchException if the provider call fails
	 */
	Page<T> fetchPage(@Nullable String cursor);

}
