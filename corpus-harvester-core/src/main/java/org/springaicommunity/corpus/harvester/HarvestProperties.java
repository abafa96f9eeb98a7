package org.springaicommunity.corpus.harvester;

/**
 * Configuration properties for harvesting, synthesis and dataset assembly.
 *
 * <p>
 * Properties can be set directly via setters or passed to {@link HarvesterBuilder}.
 * Default values are suitable for a single full run. Raise the caps for larger corpora.
 */
public class HarvestProperties {

	/**
	 * Base directory for raw corpora, checkpoints and dataset partitions.
	 */
	private String outputDir = "data";

	/**
	 * Only records created on or after this date ({@code YYYY-MM-DD}, UTC) are harvested.
	 */
	private String minDate = "2021-01-01";

	/**
	 * Page size for GitHub REST listings.
	 */
	private int perPage = 100;

	/**
	 * Maximum number of date-eligible closed issues fetched per repository.
	 */
	private int maxIssuesPerRepo = 300;

	/**
	 * Maximum number of prefiltered issues per repository whose comments are fetched.
	 */
	private int maxDetailedIssuesPerRepo = 100;

	/**
	 * Page size for GraphQL discussion listings.
	 */
	private int discussionPageSize = 50;

	/**
	 * Maximum number of date-eligible discussions fetched per repository.
	 */
	private int maxDiscussionsPerRepo = 200;

	/**
	 * Maximum number of eligible questions fetched per Stack Exchange tag.
	 */
	private int maxQuestionsPerTag = 150;

	/**
	 * Page size for Stack Exchange listings.
	 */
	private int stackPageSize = 100;

	/**
	 * Safety limit on pages fetched per Stack Exchange tag.
	 */
	private int stackMaxPages = 10;

	/**
	 * Safety limit on pages fetched per GitHub listing.
	 */
	private int maxPages = 50;

	/**
	 * Maximum number of merged pull requests examined per repository.
	 */
	private int maxPullRequestsPerRepo = 300;

	/**
	 * Maximum number of retry attempts for failed API requests.
	 */
	private int maxRetries = 3;

	/**
	 * Initial retry delay in milliseconds, doubled on each attempt.
	 */
	private int retryDelayMs = 1000;

	/**
	 * Remaining quota below which the fetcher waits for the quota reset.
	 */
	private int lowWaterMark = 10;

	/**
	 * Seconds added to the quota reset time before resuming.
	 */
	private int safetyMarginSeconds = 5;

	/**
	 * Polite delay in milliseconds between consecutive requests to one API.
	 */
	private int requestDelayMs = 300;

	/**
	 * Stack Exchange site questions are harvested from.
	 */
	private String stackExchangeSite = "stackoverflow";

	/**
	 * Classpath resource listing repositories and tags per technology.
	 */
	private String targetsResource = "harvest-targets.json";

	/**
	 * Model used for synthetic example generation.
	 */
	private String model = "claude-3-5-haiku-latest";

	/**
	 * Total number of synthetic examples to generate.
	 */
	private int targetExamples = 1500;

	/**
	 * Number of responses requested per completion call.
	 */
	private int batchSize = 5;

	/**
	 * Maximum tokens per completion.
	 */
	private int maxTokens = 2000;

	/**
	 * Accepted synthetic examples between checkpoints.
	 */
	private int checkpointEvery = 50;

	/**
	 * Maximum completion calls per template, successful or not.
	 */
	private int maxBatchesPerTemplate = 10;

	/**
	 * Completion request budget used to derive the delay between calls.
	 */
	private int requestsPerMinute = 50;

	/**
	 * Seconds to wait after a failed completion call.
	 */
	private int apiErrorBackoffSeconds = 2;

	/**
	 * Fraction of examples placed in the training partition.
	 */
	private double trainRatio = 0.9;

	/**
	 * Seed for the dataset shuffle.
	 */
	private long seed = 42;

	/**
	 * Enable verbose logging output.
	 */
	private boolean verbose = false;

	public String getOutputDir() {
		return outputDir;
	}

	public void setOutputDir(String outputDir) {
		this.outputDir = outputDir;
	}

	public String getMinDate() {
		return minDate;
	}

	public void setMinDate(String minDate) {
		this.minDate = minDate;
	}

	public int getPerPage() {
		return perPage;
	}

	public void setPerPage(int perPage) {
		this.perPage = perPage;
	}

	public int getMaxIssuesPerRepo() {
		return maxIssuesPerRepo;
	}

	public void setMaxIssuesPerRepo(int maxIssuesPerRepo) {
		this.maxIssuesPerRepo = maxIssuesPerRepo;
	}

	public int getMaxDetailedIssuesPerRepo() {
		return maxDetailedIssuesPerRepo;
	}

	public void setMaxDetailedIssuesPerRepo(int maxDetailedIssuesPerRepo) {
		this.maxDetailedIssuesPerRepo = maxDetailedIssuesPerRepo;
	}

	public int getDiscussionPageSize() {
		return discussionPageSize;
	}

	public void setDiscussionPageSize(int discussionPageSize) {
		this.discussionPageSize = discussionPageSize;
	}

	public int getMaxDiscussionsPerRepo() {
		return maxDiscussionsPerRepo;
	}

	public void setMaxDiscussionsPerRepo(int maxDiscussionsPerRepo) {
		this.maxDiscussionsPerRepo = maxDiscussionsPerRepo;
	}

	public int getMaxQuestionsPerTag() {
		return maxQuestionsPerTag;
	}

	public void setMaxQuestionsPerTag(int maxQuestionsPerTag) {
		this.maxQuestionsPerTag = maxQuestionsPerTag;
	}

	public int getStackPageSize() {
		return stackPageSize;
	}

	public void setStackPageSize(int stackPageSize) {
		this.stackPageSize = stackPageSize;
	}

	public int getStackMaxPages() {
		return stackMaxPages;
	}

	public void setStackMaxPages(int stackMaxPages) {
		this.stackMaxPages = stackMaxPages;
	}

	public int getMaxPages() {
		return maxPages;
	}

	public void setMaxPages(int maxPages) {
		this.maxPages = maxPages;
	}

	public int getMaxPullRequestsPerRepo() {
		return maxPullRequestsPerRepo;
	}

	public void setMaxPullRequestsPerRepo(int maxPullRequestsPerRepo) {
		this.maxPullRequestsPerRepo = maxPullRequestsPerRepo;
	}

	public int getMaxRetries() {
		return maxRetries;
	}

	public void setMaxRetries(int maxRetries) {
		this.maxRetries = maxRetries;
	}

	public int getRetryDelayMs() {
		return retryDelayMs;
	}

	public void setRetryDelayMs(int retryDelayMs) {
		this.retryDelayMs = retryDelayMs;
	}

	public int getLowWaterMark() {
		return lowWaterMark;
	}

	public void setLowWaterMark(int lowWaterMark) {
		this.lowWaterMark = lowWaterMark;
	}

	public int getSafetyMarginSeconds() {
		return safetyMarginSeconds;
	}

	public void setSafetyMarginSeconds(int safetyMarginSeconds) {
		this.safetyMarginSeconds = safetyMarginSeconds;
	}

	public int getRequestDelayMs() {
		return requestDelayMs;
	}

	public void setRequestDelayMs(int requestDelayMs) {
		this.requestDelayMs = requestDelayMs;
	}

	public String getStackExchangeSite() {
		return stackExchangeSite;
	}

	public void setStackExchangeSite(String stackExchangeSite) {
		this.stackExchangeSite = stackExchangeSite;
	}

	public String getTargetsResource() {
		return targetsResource;
	}

	public void setTargetsResource(String targetsResource) {
		this.targetsResource = targetsResource;
	}

	public String getModel() {
		return model;
	}

	public void setModel(String model) {
		this.model = model;
	}

	public int getTargetExamples() {
		return targetExamples;
	}

	public void setTargetExamples(int targetExamples) {
		this.targetExamples = targetExamples;
	}

	public int getBatchSize() {
		return batchSize;
	}

	public void setBatchSize(int batchSize) {
		this.batchSize = batchSize;
	}

	public int getMaxTokens() {
		return maxTokens;
	}

	public void setMaxTokens(int maxTokens) {
		this.maxTokens = maxTokens;
	}

	public int getCheckpointEvery() {
		return checkpointEvery;
	}

	public void setCheckpointEvery(int checkpointEvery) {
		this.checkpointEvery = checkpointEvery;
	}

	public int getMaxBatchesPerTemplate() {
		return maxBatchesPerTemplate;
	}

	public void setMaxBatchesPerTemplate(int maxBatchesPerTemplate) {
		this.maxBatchesPerTemplate = maxBatchesPerTemplate;
	}

	public int getRequestsPerMinute() {
		return requestsPerMinute;
	}

	public void setRequestsPerMinute(int requestsPerMinute) {
		this.requestsPerMinute = requestsPerMinute;
	}

	public int getApiErrorBackoffSeconds() {
		return apiErrorBackoffSeconds;
	}

	public void setApiErrorBackoffSeconds(int apiErrorBackoffSeconds) {
		this.apiErrorBackoffSeconds = apiErrorBackoffSeconds;
	}

	public double getTrainRatio() {
		return trainRatio;
	}

	public void setTrainRatio(double trainRatio) {
		this.trainRatio = trainRatio;
	}

	public long getSeed() {
		return seed;
	}

	public void setSeed(long seed) {
		this.seed = seed;
	}

	public boolean isVerbose() {
		return verbose;
	}

	public void setVerbose(boolean verbose) {
		this.verbose = verbose;
	}

}
