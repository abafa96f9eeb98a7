package org.springaicommunity.corpus.harvester;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Runs several harvest services in parallel, one worker per source.
 *
 * <p>
 * Each service owns its own rate-limited fetcher, so sources never share quota state. A
 * failing source is reported in its {@link HarvestResult} and never cancels the others.
 * A {@link CorpusWriteException} is rethrown once every source has finished.
 */
public class HarvestOrchestrator {

	private static final Logger logger = LoggerFactory.getLogger(HarvestOrchestrator.class);

	private final List<BaseHarvestService> services;

	public HarvestOrchestrator(List<BaseHarvestService> services) {
		this.services = List.copyOf(services);
	}

	/**
	 * Harvest every source.
	 * @param request parameters shared by every source
	 * @return one result per service, in service order
	 */
	public List<HarvestResult> harvestAll(HarvestRequest request) {
		if (services.isEmpty()) {
			return List.of();
		}
		ExecutorService executor = Executors.newFixedThreadPool(services.size());
		try {
			List<CompletableFuture<HarvestResult>> futures = new ArrayList<>();
			for (BaseHarvestService service : services) {
				futures.add(CompletableFuture.supplyAsync(() -> service.harvest(request), executor));
			}

			List<HarvestResult> results = new ArrayList<>();
			CorpusWriteException writeFailure = null;
			for (int i = 0; i < futures.size(); i++) {
				SourceType source = services.get(i).getSourceType();
				try {
					results.add(futures.get(i).join());
				}
				catch (CompletionException e) {
					Throwable cause = e.getCause() != null ? e.getCause() : e;
					logger.error("Harvest of {} failed: {}", source.id(), cause.getMessage());
					if (cause instanceof CorpusWriteException cwe && writeFailure == null) {
						writeFailure = cwe;
					}
					results.add(HarvestResult.failed(source, String.valueOf(cause.getMessage())));
				}
			}
			if (writeFailure != null) {
				throw writeFailure;
			}
			return results;
		}
		finally {
			shutdown(executor);
		}
	}

	private static void shutdown(ExecutorService executor) {
		executor.shutdown();
		try {
			if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
				executor.shutdownNow();
			}
		}
		catch (InterruptedException e) {
			executor.shutdownNow();
			Thread.currentThread().interrupt();
		}
	}

}
