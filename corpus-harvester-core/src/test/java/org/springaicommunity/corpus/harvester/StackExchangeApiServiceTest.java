package org.springaicommunity.corpus.harvester;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link StackExchangeApiService} JSON mapping.
 */
@DisplayName("StackExchangeApiService Tests")
class StackExchangeApiServiceTest {

	private final RecordingFetcher fetcher = new RecordingFetcher();

	@Test
	@DisplayName("Should map questions with embedded answers and unescape titles")
	void shouldListQuestions() {
		fetcher.reply("""
				{"items": [{"question_id": 101, "title": "Why does &quot;kubectl apply&quot; fail?", "body": "<p>x</p>",
				  "score": 12, "accepted_answer_id": 201, "creation_date": 1682935200,
				  "link": "https://stackoverflow.com/q/101", "tags": ["kubernetes", "kubectl"],
				  "answers": [{"answer_id": 201, "body": "<p>Use --force</p>", "score": 9}]},
				  {"question_id": 102, "title": "Other", "body": "", "score": 1, "creation_date": 1682935200,
				  "link": "l", "tags": []}],
				 "has_more": true, "quota_remaining": 250}
				""");
		StackExchangeApiService service = new StackExchangeApiService(fetcher, ObjectMapperFactory.create(), "key1",
				"stackoverflow", "http://localhost");

		Page<StackQuestion> page = service.listQuestions("kubernetes", 1672531200L, 100, 1);

		assertThat(page.nextCursor()).isEqualTo("2");
		StackQuestion first = page.items().get(0);
		assertThat(first.title()).isEqualTo("Why does \"kubectl apply\" fail?");
		assertThat(first.createdAt()).isEqualTo(Instant.ofEpochSecond(1682935200L));
		assertThat(first.tags()).containsExactly("kubernetes", "kubectl");
		assertThat(first.embeddedAcceptedAnswer()).map(StackAnswer::score).contains(9);
		assertThat(page.items().get(1).hasAcceptedAnswer()).isFalse();
		assertThat(fetcher.lastRequest().uri().toString()).contains("tagged=kubernetes")
			.contains("fromdate=1672531200")
			.contains("filter=" + StackExchangeApiService.BODY_FILTER)
			.contains("site=stackoverflow")
			.contains("key=key1");
	}

	@Test
	@DisplayName("Should omit the key parameter when no key is configured")
	void shouldOmitMissingKey() {
		fetcher.reply("{\"items\": [], \"has_more\": false}");
		StackExchangeApiService service = new StackExchangeApiService(fetcher, ObjectMapperFactory.create(), null,
				"serverfault", "http://localhost");

		Page<StackQuestion> page = service.listQuestions("nginx", 0L, 100, 4);

		assertThat(page.hasMore()).isFalse();
		assertThat(fetcher.lastRequest().uri().toString()).contains("site=serverfault").doesNotContain("key=");
	}

	@Test
	@DisplayName("Should fetch a single answer or report it missing")
	void shouldGetAnswer() {
		fetcher.reply("{\"items\": [{\"answer_id\": 5, \"body\": \"<p>b</p>\", \"score\": 2}]}")
			.reply("{\"items\": []}");
		StackExchangeApiService service = new StackExchangeApiService(fetcher, ObjectMapperFactory.create(), null,
				"stackoverflow", "http://localhost");

		Optional<StackAnswer> found = service.getAnswer(5);
		Optional<StackAnswer> missing = service.getAnswer(6);

		assertThat(found).contains(new StackAnswer(5, "<p>b</p>", 2));
		assertThat(missing).isEmpty();
		assertThat(fetcher.requests.get(0).uri().getPath()).isEqualTo("/answers/5");
	}

}
