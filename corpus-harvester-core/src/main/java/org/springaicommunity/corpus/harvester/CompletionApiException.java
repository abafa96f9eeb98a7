package org.springaicommunity.corpus.harvester;

/**
 * Thrown when a completion call fails or returns an unusable payload.
 */
public class CompletionApiException extends RuntimeException {

	public CompletionApiException(String message) {
		super(message);
	}

	public CompletionApiException(String message, Throwable cause) {
		super(message, cause);
	}

}
