package org.springaicommunity.corpus.harvester;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * {@link HttpFetcher} test double that replays canned bodies and records every request.
 */
final class RecordingFetcher implements HttpFetcher {

	final List<FetchRequest> requests = new ArrayList<>();

	private final Deque<Object> replies = new ArrayDeque<>();

	RecordingFetcher reply(String body) {
		replies.add(body);
		return this;
	}

	RecordingFetcher fail(FetchException exception) {
		replies.add(exception);
		return this;
	}

	FetchRequest lastRequest() {
		return requests.get(requests.size() - 1);
	}

	@Override
	public FetchResponse fetch(FetchRequest request) {
		requests.add(request);
		Object reply = replies.poll();
		if (reply == null) {
			throw new IllegalStateException("No reply queued for " + request.describe());
		}
		if (reply instanceof FetchException exception) {
			throw exception;
		}
		return new FetchResponse(200, (String) reply, Map.of());
	}

}
