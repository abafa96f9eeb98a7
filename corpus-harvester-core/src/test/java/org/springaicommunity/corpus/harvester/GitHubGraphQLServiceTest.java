package org.springaicommunity.corpus.harvester;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link GitHubGraphQLService} JSON mapping.
 */
@DisplayName("GitHubGraphQLService Tests")
class GitHubGraphQLServiceTest {

	private RecordingFetcher fetcher;

	private GitHubGraphQLService service;

	@BeforeEach
	void setUp() {
		fetcher = new RecordingFetcher();
		service = new GitHubGraphQLService(fetcher, ObjectMapperFactory.create(), "ghp_test", "http://localhost/graphql");
	}

	@Test
	@DisplayName("Should map discussions and expose the end cursor")
	void shouldListDiscussions() {
		fetcher.reply("""
				{"data": {"repository": {"discussions": {
				  "pageInfo": {"hasNextPage": true, "endCursor": "Y3Vyc29yOjUw"},
				  "nodes": [{"number": 7, "title": "Build fails", "body": "error", "url": "https://github.com/o/r/discussions/7",
				    "createdAt": "2023-05-01T10:00:00Z", "upvoteCount": 3, "category": {"name": "Q&A"},
				    "answer": null, "comments": {"nodes": [{"body": "Try this", "isAnswer": true}]}}]
				}}}}
				""");

		Page<Discussion> page = service.listDiscussions("o", "r", 50, "prev");

		assertThat(page.nextCursor()).isEqualTo("Y3Vyc29yOjUw");
		assertThat(page.items()).singleElement().satisfies(d -> {
			assertThat(d.number()).isEqualTo(7);
			assertThat(d.category()).isEqualTo("Q&A");
			assertThat(d.answer()).isNull();
			assertThat(d.upvotes()).isEqualTo(3);
			assertThat(d.comments()).singleElement().satisfies(c -> assertThat(c.isAnswer()).isTrue());
		});
		FetchRequest request = fetcher.lastRequest();
		assertThat(request.method()).isEqualTo("POST");
		assertThat(request.body()).contains("\"after\":\"prev\"").contains("\"first\":50");
		assertThat(request.headers()).containsEntry("Authorization", "Bearer ghp_test");
	}

	@Test
	@DisplayName("Should stop paging when there is no next page")
	void shouldEndWithoutNextPage() {
		fetcher.reply("{\"data\":{\"repository\":{\"discussions\":{\"pageInfo\":{\"hasNextPage\":false,"
				+ "\"endCursor\":null},\"nodes\":[]}}}}");

		Page<Discussion> page = service.listDiscussions("o", "r", 50, null);

		assertThat(page.hasMore()).isFalse();
		assertThat(page.nextCursor()).isNull();
	}

	@Test
	@DisplayName("Should return an empty page for a missing repository")
	void shouldReturnEmptyForMissingRepository() {
		fetcher.reply("{\"data\":{\"repository\":null}}");

		assertThat(service.listDiscussions("o", "gone", 50, null).items()).isEmpty();
	}

	@Test
	@DisplayName("Should surface GraphQL errors as a permanent failure")
	void shouldSurfaceErrors() {
		fetcher.reply("{\"errors\":[{\"message\":\"Could not resolve to a Repository\"}]}");

		assertThatThrownBy(() -> service.listDiscussions("o", "r", 50, null)).isInstanceOf(FetchException.class)
			.hasMessageContaining("Could not resolve");
	}

}
