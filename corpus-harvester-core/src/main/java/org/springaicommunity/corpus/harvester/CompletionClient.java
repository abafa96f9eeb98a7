package org.springaicommunity.corpus.harvester;

/**
 * Text completion endpoint used for synthetic example generation.
 */
public interface CompletionClient {

	/**
	 * Send a single-turn prompt.
	 * @param model model identifier
	 * @param prompt user prompt
	 * @param maxTokens completion token limit
	 * @return the completion text
	 * @throws CompletionApiException if the call fails
	 */
	String complete(String model, String prompt, int maxTokens);

}
