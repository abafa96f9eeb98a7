package org.springaicommunity.corpus.harvester;

/**
 * A Stack Exchange answer.
 *
 * @param answerId answer id
 * @param body HTML body
 * @param score vote score
 */
public record StackAnswer(long answerId, String body, int score) {
}
