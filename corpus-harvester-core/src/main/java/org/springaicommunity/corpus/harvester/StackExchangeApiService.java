package org.springaicommunity.corpus.harvester;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jsoup.parser.Parser;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.springaicommunity.corpus.harvester.JsonNodeUtils.*;

/**
 * Stack Exchange API 2.3 client.
 *
 * <p>
 * Quota is reported in the response body ({@code quota_remaining}) rather than headers,
 * so the fetcher passed here should be wrapped with a {@link BodyQuotaInspector}.
 */
public class StackExchangeApiService implements StackExchangeService {

	private static final Logger logger = LoggerFactory.getLogger(StackExchangeApiService.class);

	public static final String API_BASE = "https://api.stackexchange.com/2.3";

	/**
	 * Response filter that includes question bodies and their answers.
	 */
	static final String BODY_FILTER = "!nNPvSNdWme";

	private static final int LOW_QUOTA_WARNING = 10;

	private final HttpFetcher fetcher;

	private final ObjectMapper objectMapper;

	private final @Nullable String apiKey;

	private final String site;

	private final String baseUrl;

	public StackExchangeApiService(HttpFetcher fetcher, ObjectMapper objectMapper, @Nullable String apiKey,
			String site) {
		this(fetcher, objectMapper, apiKey, site, API_BASE);
	}

	public StackExchangeApiService(HttpFetcher fetcher, ObjectMapper objectMapper, @Nullable String apiKey,
			String site, String baseUrl) {
		this.fetcher = fetcher;
		this.objectMapper = objectMapper;
		this.apiKey = apiKey;
		this.site = site;
		this.baseUrl = baseUrl;
	}

	@Override
	public Page<StackQuestion> listQuestions(String tag, long fromEpochSecond, int pageSize, int page) {
		String url = baseUrl + "/questions?tagged=" + URLEncoder.encode(tag, StandardCharsets.UTF_8)
				+ "&sort=votes&order=desc&pagesize=" + pageSize + "&page=" + page + "&fromdate=" + fromEpochSecond
				+ "&filter=" + BODY_FILTER + commonParams();
		JsonNode root = get(url);

		List<StackQuestion> questions = new ArrayList<>();
		for (JsonNode item : array(root, "items")) {
			questions.add(parseQuestion(item));
		}
		return Page.indexed(questions, page, root.path("has_more").asBoolean(false));
	}

	@Override
	public Optional<StackAnswer> getAnswer(long answerId) {
		JsonNode root = get(baseUrl + "/answers/" + answerId + "?filter=" + BODY_FILTER + commonParams());
		List<JsonNode> items = array(root, "items");
		if (items.isEmpty()) {
			return Optional.empty();
		}
		return Optional.of(parseAnswer(items.get(0)));
	}

	@Override
	public String getSite() {
		return site;
	}

	private String commonParams() {
		String params = "&site=" + URLEncoder.encode(site, StandardCharsets.UTF_8);
		if (apiKey != null && !apiKey.isBlank()) {
			params += "&key=" + URLEncoder.encode(apiKey, StandardCharsets.UTF_8);
		}
		return params;
	}

	private JsonNode get(String url) {
		FetchResponse response = fetcher.fetch(FetchRequest.get(url, Map.of("Accept", "application/json")));
		JsonNode root;
		try {
			root = objectMapper.readTree(response.body());
		}
		catch (JsonProcessingException e) {
			throw FetchException.malformed("Malformed Stack Exchange response: " + e.getOriginalMessage(),
					response.body());
		}
		int remaining = root.path("quota_remaining").asInt(-1);
		if (remaining >= 0 && remaining < LOW_QUOTA_WARNING) {
			logger.warn("Stack Exchange quota low: {} requests remaining", remaining);
		}
		return root;
	}

	private static StackQuestion parseQuestion(JsonNode item) {
		List<StackAnswer> answers = new ArrayList<>();
		for (JsonNode answer : array(item, "answers")) {
			answers.add(parseAnswer(answer));
		}
		Long accepted = item.hasNonNull("accepted_answer_id") ? item.path("accepted_answer_id").asLong() : null;
		return new StackQuestion(item.path("question_id").asLong(), Parser.unescapeEntities(text(item, "title"), false),
				text(item, "body"), item.path("score").asInt(0), accepted, epochSeconds(item, "creation_date"),
				text(item, "link"), texts(item, "", "tags"), answers);
	}

	private static StackAnswer parseAnswer(JsonNode node) {
		return new StackAnswer(node.path("answer_id").asLong(), text(node, "body"), node.path("score").asInt(0));
	}

}
