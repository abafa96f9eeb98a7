package org.springaicommunity.corpus.harvester;

import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * A Stack Exchange question.
 *
 * @param questionId question id
 * @param title title, HTML entities decoded
 * @param body HTML body
 * @param score vote score
 * @param acceptedAnswerId id of the accepted answer, {@code null} if none
 * @param createdAt creation time
 * @param link public URL
 * @param tags tags
 * @param answers answers included in the listing response, possibly empty
 */
public record StackQuestion(long questionId, String title, String body, int score, @Nullable Long acceptedAnswerId,
		@Nullable Instant createdAt, String link, List<String> tags, List<StackAnswer> answers) {

	public boolean hasAcceptedAnswer() {
		return acceptedAnswerId != null;
	}

	/**
	 * Find the accepted answer among the embedded answers.
	 * @return the accepted answer if it was included in the listing
	 */
	public Optional<StackAnswer> embeddedAcceptedAnswer() {
		if (acceptedAnswerId == null) {
			return Optional.empty();
		}
		return answers.stream().filter(a -> a.answerId() == acceptedAnswerId).findFirst();
	}

}
