package org.springaicommunity.corpus.harvester;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Optional;

/**
 * Reads the Stack Exchange quota wrapper fields ({@code quota_remaining},
 * {@code quota_max}, {@code backoff}) from the JSON response body.
 *
 * <p>
 * Stack Exchange quotas reset daily at UTC midnight, so the reset time is derived from the
 * injected clock rather than reported by the provider.
 */
public class BodyQuotaInspector implements QuotaInspector {

	private static final Logger logger = LoggerFactory.getLogger(BodyQuotaInspector.class);

	private final ObjectMapper objectMapper;

	private final Clock clock;

	public BodyQuotaInspector(ObjectMapper objectMapper, Clock clock) {
		this.objectMapper = objectMapper;
		this.clock = clock;
	}

	@Override
	public Optional<RateLimitInfo> inspect(FetchResponse response) {
		JsonNode root = parse(response);
		if (root == null || !root.has("quota_remaining")) {
			return Optional.empty();
		}
		int remaining = root.path("quota_remaining").asInt(-1);
		int max = root.path("quota_max").asInt(-1);
		int used = max >= 0 && remaining >= 0 ? max - remaining : -1;
		long reset = LocalDate.now(clock.withZone(ZoneOffset.UTC))
			.plusDays(1)
			.atStartOfDay(ZoneOffset.UTC)
			.toEpochSecond();
		return Optional.of(new RateLimitInfo(max, remaining, reset, used));
	}

	@Override
	public Optional<Duration> backoffHint(FetchResponse response) {
		JsonNode root = parse(response);
		if (root == null) {
			return Optional.empty();
		}
		int backoff = root.path("backoff").asInt(0);
		return backoff > 0 ? Optional.of(Duration.ofSeconds(backoff)) : Optional.empty();
	}

	@Nullable
	private JsonNode parse(FetchResponse response) {
		String body = response.body();
		if (body.isBlank() || body.charAt(0) != '{') {
			return null;
		}
		try {
			return objectMapper.readTree(body);
		}
		catch (JsonProcessingException e) {
			logger.debug("Response body is not JSON, no quota fields: {}", e.getOriginalMessage());
			return null;
		}
	}

}
