package org.springaicommunity.corpus.harvester;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.*;

@DisplayName("PaginatedCollector Tests")
class PaginatedCollectorTest {

	private final HarvestContext context = new HarvestContext("github_issues");

	/**
	 * Page source over fixed page sizes, numbering items consecutively from 1.
	 */
	private static final class SizedPages implements PageSource<Integer> {

		private final int[] sizes;

		private final int perPage;

		private final List<String> requestedCursors = new ArrayList<>();

		SizedPages(int perPage, int... sizes) {
			this.perPage = perPage;
			this.sizes = sizes;
		}

		@Override
		public Page<Integer> fetchPage(String cursor) {
			requestedCursors.add(cursor);
			int page = Page.pageNumber(cursor);
			int start = 1;
			for (int i = 0; i < page - 1; i++) {
				start += sizes[i];
			}
			int size = page - 1 < sizes.length ? sizes[page - 1] : 0;
			List<Integer> items = IntStream.range(start, start + size).boxed().collect(Collectors.toList());
			return Page.offset(items, size, page, perPage);
		}

	}

	@Nested
	@DisplayName("Pagination Tests")
	class PaginationTest {

		@Test
		@DisplayName("Should follow pages until a short page arrives")
		void shouldCountEveryRawRecord() {
			SizedPages source = new SizedPages(100, 100, 100, 40);

			List<Integer> kept = new PaginatedCollector(50).collect(source, Integer.MAX_VALUE, item -> true, context)
				.toList();

			assertThat(kept).hasSize(240);
			assertThat(context.getRawRecords()).isEqualTo(240);
			assertThat(context.getPagesFetched()).isEqualTo(3);
			assertThat(source.requestedCursors).containsExactly(null, "2", "3");
		}

		@Test
		@DisplayName("Should stop on an empty page")
		void shouldStopOnEmptyPage() {
			SizedPages source = new SizedPages(100, 100, 0);

			List<Integer> kept = new PaginatedCollector(50).collect(source, 1000, item -> true, context).toList();

			assertThat(kept).hasSize(100);
			assertThat(context.getPagesFetched()).isEqualTo(2);
		}

		@Test
		@DisplayName("Should stop at the page limit")
		void shouldStopAtMaxPages() {
			SizedPages source = new SizedPages(10, 10, 10, 10, 10, 10);

			List<Integer> kept = new PaginatedCollector(2).collect(source, 1000, item -> true, context).toList();

			assertThat(kept).hasSize(20);
			assertThat(context.getPagesFetched()).isEqualTo(2);
		}

		@Test
		@DisplayName("Should follow GraphQL end cursors")
		void shouldFollowCursors() {
			PageSource<String> source = cursor -> cursor == null ? Page.cursor(List.of("a", "b"), true, "c1")
					: Page.cursor(List.of("c"), false, null);

			List<String> kept = new PaginatedCollector(10).collect(source, 10, item -> true, context).toList();

			assertThat(kept).containsExactly("a", "b", "c");
		}

	}

	@Nested
	@DisplayName("Cap and Filter Tests")
	class CapAndFilterTest {

		@Test
		@DisplayName("Should stop fetching once the cap is reached")
		void shouldStopAtCap() {
			SizedPages source = new SizedPages(100, 100, 100, 100);

			List<Integer> kept = new PaginatedCollector(50).collect(source, 150, item -> true, context).toList();

			assertThat(kept).hasSize(150).startsWith(1, 2, 3).endsWith(150);
			assertThat(context.getPagesFetched()).isEqualTo(2);
		}

		@Test
		@DisplayName("Should return nothing for a zero cap without fetching")
		void shouldNotFetchForZeroCap() {
			SizedPages source = new SizedPages(100, 100);

			assertThat(new PaginatedCollector(5).collect(source, 0, item -> true, context)).isEmpty();
			assertThat(source.requestedCursors).isEmpty();
		}

		@Test
		@DisplayName("Should drop records before the date floor on every page without stopping early")
		void shouldApplyDateFloorPerRecord() {
			Instant floor = Instant.parse("2021-01-01T00:00:00Z");
			Instant recent = Instant.parse("2023-06-01T00:00:00Z");
			Instant old = Instant.parse("2019-06-01T00:00:00Z");
			PageSource<Instant> source = cursor -> {
				int page = Page.pageNumber(cursor);
				List<Instant> items = page == 1 ? List.of(old, old) : List.of(recent, old);
				return Page.offset(items, 2, page, page == 1 ? 2 : 3);
			};
			Predicate<Instant> keep = DateFloor.onOrAfter(floor, created -> created);

			List<Instant> kept = new PaginatedCollector(10).collect(source, 10, keep, context).toList();

			assertThat(kept).containsExactly(recent);
			assertThat(context.getRawRecords()).isEqualTo(4);
			assertThat(context.getDroppedAtFetch()).isEqualTo(3);
		}

		@Test
		@DisplayName("Should propagate provider errors to the caller")
		void shouldPropagateErrors() {
			PageSource<String> source = cursor -> {
				throw FetchException.malformed("bad page", "{}");
			};

			assertThatThrownBy(() -> new PaginatedCollector(5).collect(source, 10, item -> true, context).toList())
				.isInstanceOf(FetchException.class)
				.hasMessage("bad page");
		}

		@Test
		@DisplayName("Should reject a non-positive page limit")
		void shouldRejectZeroMaxPages() {
			assertThatThrownBy(() -> new PaginatedCollector(0)).isInstanceOf(IllegalArgumentException.class);
		}

	}

	@Nested
	@DisplayName("DateFloor Tests")
	class DateFloorTest {

		@Test
		@DisplayName("Should parse dates as UTC midnight")
		void shouldParseUtcMidnight() {
			assertThat(DateFloor.parse("2021-01-01")).isEqualTo(Instant.parse("2021-01-01T00:00:00Z"));
		}

		@Test
		@DisplayName("Should reject malformed dates")
		void shouldRejectMalformed() {
			assertThatThrownBy(() -> DateFloor.parse("2021/01/01")).isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("YYYY-MM-DD");
		}

		@Test
		@DisplayName("Should keep the floor instant itself and drop missing dates")
		void shouldKeepBoundary() {
			Instant floor = Instant.parse("2021-01-01T00:00:00Z");
			Predicate<Instant> keep = DateFloor.onOrAfter(floor, created -> created);

			assertThat(keep.test(floor)).isTrue();
			assertThat(keep.test(floor.minusSeconds(1))).isFalse();
			assertThat(DateFloor.<String>onOrAfter(floor, s -> null).test("x")).isFalse();
		}

	}

}
