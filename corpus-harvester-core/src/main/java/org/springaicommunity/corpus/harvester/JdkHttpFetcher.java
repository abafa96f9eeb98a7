package org.springaicommunity.corpus.harvester;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import java.util.zip.GZIPInputStream;

/**
 * {@link HttpFetcher} backed by the JDK {@link HttpClient}.
 *
 * <p>
 * Classifies every non-2xx response and transport error into a {@link FetchException}:
 * <ul>
 * <li>5xx, timeouts and I/O errors are {@link FailureKind#TRANSIENT}</li>
 * <li>429, and 403 with no remaining quota, are {@link FailureKind#RATE_LIMITED}</li>
 * <li>a body carrying an explicit {@code backoff} instruction is
 * {@link FailureKind#TRANSIENT} whatever its status</li>
 * <li>every other 4xx is {@link FailureKind#PERMANENT}</li>
 * </ul>
 *
 * <p>
 * Gzip-encoded bodies (Stack Exchange compresses its responses) are decoded
 * transparently. The quota snapshot of every response, 2xx included, is available via
 * {@link #getLastRateLimitInfo()}.
 */
public class JdkHttpFetcher implements HttpFetcher {

	private static final Logger logger = LoggerFactory.getLogger(JdkHttpFetcher.class);

	private final HttpClient httpClient;

	private final QuotaInspector quotaInspector;

	private final Duration requestTimeout;

	@Nullable
	private volatile RateLimitInfo lastRateLimitInfo;

	public JdkHttpFetcher(QuotaInspector quotaInspector) {
		this(quotaInspector, Duration.ofSeconds(30), Duration.ofSeconds(60));
	}

	public JdkHttpFetcher(QuotaInspector quotaInspector, Duration connectTimeout, Duration requestTimeout) {
		this.quotaInspector = quotaInspector;
		this.requestTimeout = requestTimeout;
		this.httpClient = HttpClient.newBuilder()
			.connectTimeout(connectTimeout)
			.followRedirects(HttpClient.Redirect.NORMAL)
			.build();
	}

	@Override
	@Nullable
	public RateLimitInfo getLastRateLimitInfo() {
		return lastRateLimitInfo;
	}

	@Override
	public FetchResponse fetch(FetchRequest request) {
		logger.debug("{} {}", request.method(), request.uri());
		long start = System.currentTimeMillis();

		HttpRequest.Builder builder = HttpRequest.newBuilder().uri(request.uri()).timeout(requestTimeout);
		request.headers().forEach(builder::header);
		if ("POST".equals(request.method())) {
			builder.POST(HttpRequest.BodyPublishers.ofString(request.body() != null ? request.body() : ""));
		}
		else {
			builder.GET();
		}

		try {
			HttpResponse<byte[]> raw = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofByteArray());
			FetchResponse response = new FetchResponse(raw.statusCode(), decodeBody(raw), raw.headers().map());
			logger.debug("{} completed in {}ms with status {} ({} chars)", request.describe(),
					System.currentTimeMillis() - start, response.statusCode(), response.body().length());
			return classify(request, response);
		}
		catch (IOException e) {
			logger.debug("{} failed after {}ms: {}", request.describe(), System.currentTimeMillis() - start,
					e.getMessage());
			throw new FetchException("HTTP request failed: " + e.getMessage(), FailureKind.TRANSIENT, e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new FetchException("HTTP request interrupted", FailureKind.PERMANENT, e);
		}
	}

	private FetchResponse classify(FetchRequest request, FetchResponse response) {
		RateLimitInfo quota = quotaInspector.inspect(response).orElse(null);
		if (quota != null) {
			this.lastRateLimitInfo = quota;
			if (quota.remaining() < 100) {
				logger.info("Quota low: {}/{} remaining, resets at epoch {}", quota.remaining(), quota.limit(),
						quota.reset());
			}
			else {
				logger.debug("Quota: {}/{} remaining, resets at epoch {}", quota.remaining(), quota.limit(),
						quota.reset());
			}
		}

		int status = response.statusCode();
		if (response.isSuccess()) {
			return response;
		}

		Duration retryAfter = quotaInspector.backoffHint(response).orElse(null);
		FailureKind kind = classifyStatus(status, quota, retryAfter);
		String message = switch (kind) {
			case RATE_LIMITED -> "Rate limit exceeded (" + status + ") for " + request.describe()
					+ (quota != null ? ". Resets at epoch: " + quota.reset() : "");
			case TRANSIENT -> "Transient error " + status + " for " + request.describe();
			case PERMANENT -> status == 401 ? "Unauthorized: bad credentials for " + request.describe()
					: "Request rejected with " + status + " for " + request.describe();
		};
		throw new FetchException(message, kind, status, response.body(), quota, retryAfter);
	}

	/**
	 * Classify a non-2xx status.
	 * @param status HTTP status code
	 * @param quota quota snapshot from the same response, if any
	 * @param retryAfter provider backoff instruction from the same response, if any
	 * @return the failure kind
	 */
	static FailureKind classifyStatus(int status, @Nullable RateLimitInfo quota, @Nullable Duration retryAfter) {
		if (status == 429 || (status == 403 && quota != null && quota.remaining() == 0)) {
			return FailureKind.RATE_LIMITED;
		}
		if (status >= 500 || retryAfter != null) {
			return FailureKind.TRANSIENT;
		}
		return FailureKind.PERMANENT;
	}

	static String decodeBody(HttpResponse<byte[]> response) throws IOException {
		byte[] bytes = response.body();
		boolean gzip = response.headers()
			.firstValue("Content-Encoding")
			.map(v -> v.toLowerCase(Locale.ROOT).contains("gzip"))
			.orElse(false);
		if (!gzip) {
			return new String(bytes, StandardCharsets.UTF_8);
		}
		try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(bytes))) {
			return new String(in.readAllBytes(), StandardCharsets.UTF_8);
		}
	}

}
