package org.springaicommunity.corpus.harvester;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.springaicommunity.corpus.harvester.JsonNodeUtils.*;

/**
 * Service for GitHub GraphQL API operations.
 *
 * <p>
 * Converts GitHub API JSON responses to strongly-typed DTOs at the service boundary,
 * encapsulating all JSON parsing logic here.
 */
public class GitHubGraphQLService implements GraphQLService {

	private static final Logger logger = LoggerFactory.getLogger(GitHubGraphQLService.class);

	public static final String GRAPHQL_ENDPOINT = "https://api.github.com/graphql";

	private static final String DISCUSSIONS_QUERY = """
			query($owner: String!, $repo: String!, $first: Int!, $after: String) {
			    repository(owner: $owner, name: $repo) {
			        discussions(first: $first, after: $after, orderBy: {field: UPDATED_AT, direction: DESC}) {
			            pageInfo {
			                hasNextPage
			                endCursor
			            }
			            nodes {
			                number
			                title
			                body
			                url
			                createdAt
			                upvoteCount
			                category { name }
			                answer { body }
			                comments(first: 10) {
			                    nodes {
			                        body
			                        isAnswer
			                    }
			                }
			            }
			        }
			    }
			}
			""";

	private final HttpFetcher fetcher;

	private final ObjectMapper objectMapper;

	private final String token;

	private final String endpoint;

	public GitHubGraphQLService(HttpFetcher fetcher, ObjectMapper objectMapper, String token) {
		this(fetcher, objectMapper, token, GRAPHQL_ENDPOINT);
	}

	public GitHubGraphQLService(HttpFetcher fetcher, ObjectMapper objectMapper, String token, String endpoint) {
		this.fetcher = fetcher;
		this.objectMapper = objectMapper;
		this.token = token;
		this.endpoint = endpoint;
	}

	@Override
	public Page<Discussion> listDiscussions(String owner, String repo, int first, @Nullable String after) {
		Map<String, Object> variables = new HashMap<>();
		variables.put("owner", owner);
		variables.put("repo", repo);
		variables.put("first", first);
		variables.put("after", after);

		JsonNode repository = executeGraphQL(DISCUSSIONS_QUERY, variables).path("data").path("repository");
		if (repository.isMissingNode() || repository.isNull()) {
			logger.warn("Repository {}/{} not found or discussions unavailable", owner, repo);
			return Page.empty();
		}

		JsonNode discussions = repository.path("discussions");
		List<Discussion> result = new ArrayList<>();
		for (JsonNode node : array(discussions, "nodes")) {
			result.add(parseDiscussion(node));
		}

		JsonNode pageInfo = discussions.path("pageInfo");
		String endCursor = pageInfo.path("endCursor").isTextual() ? pageInfo.path("endCursor").asText() : null;
		return Page.cursor(result, pageInfo.path("hasNextPage").asBoolean(false), endCursor);
	}

	private Discussion parseDiscussion(JsonNode node) {
		List<DiscussionComment> comments = new ArrayList<>();
		for (JsonNode comment : array(node, "comments", "nodes")) {
			comments.add(new DiscussionComment(text(comment, "body"), comment.path("isAnswer").asBoolean(false)));
		}
		String answer = text(node, "answer", "body");
		return new Discussion(node.path("number").asInt(), text(node, "title"), text(node, "body"), text(node, "url"),
				text(node, "category", "name"), instant(node, "createdAt"), answer.isEmpty() ? null : answer,
				comments, node.path("upvoteCount").asInt(0));
	}

	private JsonNode executeGraphQL(String query, Map<String, Object> variables) {
		String requestBody;
		try {
			requestBody = objectMapper.writeValueAsString(Map.of("query", query, "variables", variables));
		}
		catch (JsonProcessingException e) {
			throw new IllegalStateException("Failed to serialize GraphQL request", e);
		}

		FetchResponse response = fetcher.fetch(FetchRequest.post(endpoint, requestBody,
				Map.of("Authorization", "Bearer " + token, "Content-Type", "application/json", "User-Agent",
						"corpus-harvester")));
		JsonNode root;
		try {
			root = objectMapper.readTree(response.body());
		}
		catch (JsonProcessingException e) {
			throw FetchException.malformed("Malformed GraphQL response: " + e.getOriginalMessage(), response.body());
		}
		if (root.hasNonNull("errors")) {
			throw FetchException.malformed("GraphQL errors: " + root.path("errors"), response.body());
		}
		return root;
	}

}
