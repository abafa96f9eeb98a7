package org.springaicommunity.corpus.harvester;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Predicate;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Drives a {@link PageSource} until it is exhausted and exposes the kept records as a
 * lazy stream.
 *
 * <p>
 * Pages are fetched on demand as the stream is consumed. Pagination stops when the
 * provider reports no more pages, an empty page arrives, {@code cap} kept records have
 * been emitted, or {@code maxPages} pages have been fetched. Every fetched record is
 * counted as raw before the keep predicate runs. A provider error propagates out of the
 * stream to the caller.
 */
public class PaginatedCollector {

	private static final Logger logger = LoggerFactory.getLogger(PaginatedCollector.class);

	private final int maxPages;

	public PaginatedCollector(int maxPages) {
		if (maxPages <= 0) {
			throw new IllegalArgumentException("maxPages must be positive: " + maxPages);
		}
		this.maxPages = maxPages;
	}

	/**
	 * Collect records from a paginated listing.
	 * @param <T> the record type
	 * @param source fetches individual pages
	 * @param cap maximum number of kept records to emit
	 * @param keep per-record predicate, typically a {@link DateFloor}
	 * @param context receives page and raw-record counts
	 * @return lazy, finite, single-use stream of kept records in fetch order
	 */
	public <T> Stream<T> collect(PageSource<T> source, int cap, Predicate<? super T> keep, HarvestContext context) {
		if (cap <= 0) {
			return Stream.empty();
		}
		PageIterator<T> iterator = new PageIterator<>(source, cap, keep, context);
		return StreamSupport.stream(Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED), false);
	}

	public int getMaxPages() {
		return maxPages;
	}

	private final class PageIterator<T> implements Iterator<T> {

		private final PageSource<T> source;

		private final int cap;

		private final Predicate<? super T> keep;

		private final HarvestContext context;

		private final Deque<T> buffer = new ArrayDeque<>();

		@Nullable
		private String cursor;

		private boolean exhausted;

		private int pages;

		private int emitted;

		PageIterator(PageSource<T> source, int cap, Predicate<? super T> keep, HarvestContext context) {
			this.source = source;
			this.cap = cap;
			this.keep = keep;
			this.context = context;
		}

		@Override
		public boolean hasNext() {
			if (emitted >= cap) {
				return false;
			}
			while (buffer.isEmpty() && !exhausted) {
				fetchNextPage();
			}
			return !buffer.isEmpty();
		}

		@Override
		public T next() {
			if (!hasNext()) {
				throw new NoSuchElementException();
			}
			emitted++;
			return buffer.removeFirst();
		}

		private void fetchNextPage() {
			if (pages >= maxPages) {
				logger.info("Reached page limit of {} for {}", maxPages, context.getSource());
				exhausted = true;
				return;
			}

			Page<T> page = source.fetchPage(cursor);
			pages++;
			context.recordPage(page.rawCount());

			int kept = 0;
			for (T item : page.items()) {
				if (keep.test(item)) {
					buffer.addLast(item);
					kept++;
				}
				else {
					context.recordDroppedAtFetch();
				}
			}
			logger.debug("Page {} of {}: {} raw, {} kept", pages, context.getSource(), page.rawCount(), kept);

			if (page.rawCount() == 0 || !page.hasMore() || page.nextCursor() == null) {
				exhausted = true;
			}
			cursor = page.nextCursor();
		}

	}

}
