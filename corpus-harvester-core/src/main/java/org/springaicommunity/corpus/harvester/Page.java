package org.springaicommunity.corpus.harvester;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * One page of a paginated listing together with the information needed to fetch the
 * next one.
 *
 * @param <T> the type of items in the page
 * @param items the items returned on this page, after any source-side filtering
 * @param nextCursor opaque cursor for the next page ({@code null} if no more pages)
 * @param hasMore whether the provider reports more pages
 * @param rawCount number of records the provider returned before source-side filtering
 */
public record Page<T>(List<T> items, @Nullable String nextCursor, boolean hasMore, int rawCount) {

	public Page {
		items = List.copyOf(items);
	}

	/**
	 * Create an empty page with no more pages.
	 * @param <T> the item type
	 * @return empty Page
	 */
	public static <T> Page<T> empty() {
		return new Page<>(List.of(), null, false, 0);
	}

	/**
	 * Page of a REST listing addressed by page number. There are more pages iff the
	 * provider returned a full page.
	 * @param <T> the item type
	 * @param items the items kept from this page
	 * @param rawCount number of records the provider returned on this page
	 * @param page the 1-based page number just fetched
	 * @param perPage the requested page size
	 * @return Page whose cursor is the next page number
	 */
	public static <T> Page<T> offset(List<T> items, int rawCount, int page, int perPage) {
		boolean hasMore = rawCount >= perPage;
		return new Page<>(items, hasMore ? String.valueOf(page + 1) : null, hasMore, rawCount);
	}

	/**
	 * Page of a GraphQL connection.
	 * @param <T> the item type
	 * @param items the items on this page
	 * @param hasNextPage {@code pageInfo.hasNextPage}
	 * @param endCursor {@code pageInfo.endCursor}
	 * @return Page whose cursor is the end cursor
	 */
	public static <T> Page<T> cursor(List<T> items, boolean hasNextPage, @Nullable String endCursor) {
		boolean hasMore = hasNextPage && endCursor != null;
		return new Page<>(items, hasMore ? endCursor : null, hasMore, items.size());
	}

	/**
	 * Page of a listing that reports {@code has_more} explicitly, such as Stack Exchange.
	 * @param <T> the item type
	 * @param items the items on this page
	 * @param page the 1-based page number just fetched
	 * @param hasMore provider's {@code has_more} flag
	 * @return Page whose cursor is the next page number
	 */
	public static <T> Page<T> indexed(List<T> items, int page, boolean hasMore) {
		return new Page<>(items, hasMore ? String.valueOf(page + 1) : null, hasMore, items.size());
	}

	/**
	 * Parse a page-number cursor produced by {@link #offset} or {@link #indexed}.
	 * @param cursor the cursor, {@code null} for the first page
	 * @return the 1-based page number
	 */
	public static int pageNumber(@Nullable String cursor) {
		if (cursor == null || cursor.isBlank()) {
			return 1;
		}
		try {
			return Integer.parseInt(cursor);
		}
		catch (NumberFormatException e) {
			throw new IllegalArgumentException("Not a page-number cursor: " + cursor, e);
		}
	}

}
