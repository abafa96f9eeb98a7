package org.springaicommunity.corpus.harvester;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Builder for creating harvest, synthesis and assembly services without a container.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * HarvestProperties props = new HarvestProperties();
 * props.setMinDate("2022-01-01");
 *
 * IssueHarvestService issues = HarvesterBuilder.create()
 *     .githubTokenFromEnv()
 *     .properties(props)
 *     .buildIssueHarvester();
 * HarvestResult result = issues.harvest(HarvestRequest.defaults(props));
 *
 * // For testing with a mock fetcher
 * HttpFetcher fetcher = mock(HttpFetcher.class);
 * IssueHarvestService testHarvester = HarvesterBuilder.create()
 *     .githubFetcher(fetcher)
 *     .buildIssueHarvester();
 * }
 * </pre>
 *
 * <p>
 * Every built service gets its own {@link RateLimitedFetcher}, so quota state is never
 * shared between API identities or sources.
 */
public class HarvesterBuilder {

	private @Nullable String githubToken;

	private @Nullable String stackExchangeKey;

	private @Nullable String anthropicApiKey;

	private HarvestProperties properties = new HarvestProperties();

	private @Nullable ObjectMapper objectMapper;

	private @Nullable HttpFetcher githubFetcher;

	private @Nullable HttpFetcher stackExchangeFetcher;

	private @Nullable CompletionClient completionClient;

	private @Nullable CorpusRepository corpusRepository;

	private @Nullable TargetCatalog targetCatalog;

	private Sleeper sleeper = Sleeper.SYSTEM;

	private HarvesterBuilder() {
	}

	/**
	 * Create a new builder instance.
	 * @return new HarvesterBuilder
	 */
	public static HarvesterBuilder create() {
		return new HarvesterBuilder();
	}

	public HarvesterBuilder githubToken(String token) {
		this.githubToken = token;
		return this;
	}

	/**
	 * Read the GitHub token from {@code GITHUB_TOKEN}.
	 * @return this builder
	 * @throws IllegalStateException if GITHUB_TOKEN is not set
	 */
	public HarvesterBuilder githubTokenFromEnv() {
		this.githubToken = EnvironmentSupport.require(EnvironmentSupport.GITHUB_TOKEN);
		return this;
	}

	public HarvesterBuilder stackExchangeKey(@Nullable String key) {
		this.stackExchangeKey = key;
		return this;
	}

	/**
	 * Read the optional Stack Exchange key from {@code STACKEXCHANGE_API_KEY}. Without a
	 * key the API allows far fewer requests per day.
	 * @return this builder
	 */
	public HarvesterBuilder stackExchangeKeyFromEnv() {
		this.stackExchangeKey = EnvironmentSupport.get(EnvironmentSupport.STACKEXCHANGE_API_KEY);
		return this;
	}

	public HarvesterBuilder anthropicApiKey(String apiKey) {
		this.anthropicApiKey = apiKey;
		return this;
	}

	/**
	 * Read the Anthropic key from {@code ANTHROPIC_API_KEY}.
	 * @return this builder
	 * @throws IllegalStateException if ANTHROPIC_API_KEY is not set
	 */
	public HarvesterBuilder anthropicApiKeyFromEnv() {
		this.anthropicApiKey = EnvironmentSupport.require(EnvironmentSupport.ANTHROPIC_API_KEY);
		return this;
	}

	/**
	 * Set harvest properties.
	 * @param properties configuration properties (null to use defaults)
	 * @return this builder
	 */
	public HarvesterBuilder properties(@Nullable HarvestProperties properties) {
		if (properties != null) {
			this.properties = properties;
		}
		return this;
	}

	public HarvesterBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Use this fetcher for GitHub calls instead of a rate-limited HTTP fetcher. When set,
	 * no token is required.
	 * @param fetcher custom fetcher (null to use default)
	 * @return this builder
	 */
	public HarvesterBuilder githubFetcher(@Nullable HttpFetcher fetcher) {
		this.githubFetcher = fetcher;
		return this;
	}

	/**
	 * Use this fetcher for Stack Exchange calls instead of a rate-limited HTTP fetcher.
	 * @param fetcher custom fetcher (null to use default)
	 * @return this builder
	 */
	public HarvesterBuilder stackExchangeFetcher(@Nullable HttpFetcher fetcher) {
		this.stackExchangeFetcher = fetcher;
		return this;
	}

	/**
	 * Use this completion client instead of the Anthropic client. When set, no API key is
	 * required.
	 * @param client custom client (null to use default)
	 * @return this builder
	 */
	public HarvesterBuilder completionClient(@Nullable CompletionClient client) {
		this.completionClient = client;
		return this;
	}

	public HarvesterBuilder corpusRepository(@Nullable CorpusRepository repository) {
		this.corpusRepository = repository;
		return this;
	}

	public HarvesterBuilder targetCatalog(@Nullable TargetCatalog catalog) {
		this.targetCatalog = catalog;
		return this;
	}

	/**
	 * Set the sleeper used for rate limiting and synthesis pacing.
	 * @param sleeper sleeper, typically a recording one in tests
	 * @return this builder
	 */
	public HarvesterBuilder sleeper(Sleeper sleeper) {
		this.sleeper = sleeper;
		return this;
	}

	public IssueHarvestService buildIssueHarvester() {
		return new IssueHarvestService(buildRestService(), targets(), repository(), properties);
	}

	public DiscussionHarvestService buildDiscussionHarvester() {
		return new DiscussionHarvestService(buildGraphQLService(), targets(), repository(), properties);
	}

	public StackOverflowHarvestService buildStackOverflowHarvester() {
		return new StackOverflowHarvestService(buildStackExchangeService(), targets(), repository(), properties);
	}

	public ReviewCommentHarvestService buildReviewHarvester() {
		return new ReviewCommentHarvestService(buildRestService(), targets(), repository(), properties);
	}

	/**
	 * Build the harvest service of a source.
	 * @param source the source
	 * @return configured service
	 * @throws IllegalArgumentException for {@link SourceType#SYNTHETIC}
	 */
	public BaseHarvestService buildHarvester(SourceType source) {
		return switch (source) {
			case GITHUB_ISSUES -> buildIssueHarvester();
			case GITHUB_DISCUSSIONS -> buildDiscussionHarvester();
			case STACKOVERFLOW -> buildStackOverflowHarvester();
			case GITHUB_REVIEWS -> buildReviewHarvester();
			case SYNTHETIC -> throw new IllegalArgumentException("Synthetic examples are generated, not harvested");
		};
	}

	/**
	 * Build an orchestrator running the given sources in parallel.
	 * @param sources sources to harvest
	 * @return configured orchestrator
	 */
	public HarvestOrchestrator buildOrchestrator(List<SourceType> sources) {
		List<BaseHarvestService> services = new ArrayList<>();
		for (SourceType source : sources) {
			services.add(buildHarvester(source));
		}
		return new HarvestOrchestrator(services);
	}

	/**
	 * Build the RestService directly (for advanced usage).
	 * @return configured RestService
	 */
	public RestService buildRestService() {
		return new GitHubRestService(githubFetcher(), mapper(), githubTokenOrEmpty());
	}

	/**
	 * Build the GraphQLService directly (for advanced usage).
	 * @return configured GraphQLService
	 */
	public GraphQLService buildGraphQLService() {
		return new GitHubGraphQLService(githubFetcher(), mapper(), githubTokenOrEmpty());
	}

	public StackExchangeService buildStackExchangeService() {
		HttpFetcher fetcher = stackExchangeFetcher != null ? stackExchangeFetcher
				: rateLimited(new BodyQuotaInspector(mapper(), Clock.systemUTC()));
		return new StackExchangeApiService(fetcher, mapper(), stackExchangeKey, properties.getStackExchangeSite());
	}

	/**
	 * Build a synthesizer that checkpoints to the given file.
	 * @param checkpointFile checkpoint location
	 * @return configured synthesizer
	 */
	public BatchSynthesizer buildSynthesizer(Path checkpointFile) {
		return new BatchSynthesizer(buildCompletionClient(), new JsonArrayExtractor(mapper()),
				buildCheckpointStore(checkpointFile), SynthesisOptions.from(properties), sleeper);
	}

	public CheckpointStore buildCheckpointStore(Path checkpointFile) {
		return new FileCheckpointStore(checkpointFile, mapper());
	}

	public CompletionClient buildCompletionClient() {
		if (completionClient != null) {
			return completionClient;
		}
		if (anthropicApiKey == null || anthropicApiKey.isBlank()) {
			throw new IllegalStateException(
					"Anthropic API key is required. Call anthropicApiKey() or anthropicApiKeyFromEnv() first.");
		}
		// Completion calls are paced by the synthesizer; the fetcher only retries
		HttpFetcher fetcher = RateLimitedFetcher.builder()
			.wrapping(new JdkHttpFetcher(new HeaderQuotaInspector(), Duration.ofSeconds(30), Duration.ofMinutes(2)))
			.maxRetries(properties.getMaxRetries())
			.initialDelayMs(properties.getRetryDelayMs())
			.lowWaterMark(0)
			.politeDelay(Duration.ZERO)
			.sleeper(sleeper)
			.build();
		return new AnthropicCompletionClient(fetcher, mapper(), anthropicApiKey);
	}

	public DatasetAssembler buildAssembler() {
		return new DatasetAssembler(repository(), new ExampleFormatter());
	}

	public CorpusRepository buildCorpusRepository() {
		return repository();
	}

	public HarvestProperties getProperties() {
		return properties;
	}

	private HttpFetcher githubFetcher() {
		if (githubFetcher != null) {
			return githubFetcher;
		}
		if (githubToken == null || githubToken.trim().isEmpty()) {
			throw new IllegalStateException(
					"GitHub token is required. Call githubToken() or githubTokenFromEnv() first.");
		}
		return rateLimited(new HeaderQuotaInspector());
	}

	private String githubTokenOrEmpty() {
		return githubToken != null ? githubToken : "";
	}

	private RateLimitedFetcher rateLimited(QuotaInspector inspector) {
		return RateLimitedFetcher.builder()
			.wrapping(new JdkHttpFetcher(inspector))
			.quotaInspector(inspector)
			.maxRetries(properties.getMaxRetries())
			.initialDelayMs(properties.getRetryDelayMs())
			.lowWaterMark(properties.getLowWaterMark())
			.safetyMargin(Duration.ofSeconds(properties.getSafetyMarginSeconds()))
			.politeDelay(Duration.ofMillis(properties.getRequestDelayMs()))
			.sleeper(sleeper)
			.build();
	}

	private ObjectMapper mapper() {
		if (objectMapper == null) {
			objectMapper = ObjectMapperFactory.create();
		}
		return objectMapper;
	}

	private CorpusRepository repository() {
		if (corpusRepository == null) {
			corpusRepository = new FileSystemCorpusRepository(mapper());
		}
		return corpusRepository;
	}

	private TargetCatalog targets() {
		if (targetCatalog == null) {
			targetCatalog = TargetCatalog.load(mapper(), properties.getTargetsResource());
		}
		return targetCatalog;
	}

}
