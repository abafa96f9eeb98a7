package org.springaicommunity.corpus.harvester;

import java.util.Optional;

/**
 * Interface for Stack Exchange API operations against a single site.
 */
public interface StackExchangeService {

	/**
	 * Fetch one page of questions with the given tag, highest voted first, including
	 * their bodies and answers.
	 * @param tag site tag
	 * @param fromEpochSecond only questions created at or after this epoch second
	 * @param pageSize page size, at most 100
	 * @param page 1-based page number
	 * @return page of questions
	 */
	Page<StackQuestion> listQuestions(String tag, long fromEpochSecond, int pageSize, int page);

	/**
	 * Fetch a single answer with its body.
	 * @param answerId answer id
	 * @return the answer, or empty when the site does not return it
	 */
	Optional<StackAnswer> getAnswer(long answerId);

	/**
	 * @return the site these questions come from, such as {@code stackoverflow}
	 */
	String getSite();

}
