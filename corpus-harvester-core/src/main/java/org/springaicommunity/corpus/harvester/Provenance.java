package org.springaicommunity.corpus.harvester;

import org.jspecify.annotations.Nullable;

import java.time.Instant;

/**
 * Where and when a candidate record was published.
 *
 * @param source the API the record was fetched from
 * @param origin repository ({@code owner/repo}) or tag the record was found under
 * @param url public link to the record
 * @param createdAt creation time reported by the provider
 */
public record Provenance(SourceType source, String origin, String url, @Nullable Instant createdAt) {
}
