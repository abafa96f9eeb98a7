package org.springaicommunity.corpus.harvester;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Candidate record fixtures shared by the tests.
 */
final class TestRecords {

	static final Instant CREATED = Instant.parse("2023-03-15T10:00:00Z");

	static final String PROBLEM = "Pod is stuck in CrashLoopBackOff after upgrading the ingress controller. "
			+ "The container exits with error code 137 and the events show the liveness probe failing.";

	static final String SOLUTION = "The issue is caused by the memory limit being too low for the new version. "
			+ "Increase the limit to 512Mi and run kubectl rollout restart to apply the change.";

	private TestRecords() {
	}

	static CandidateRecord incident(String key, String title, String problem, String solution) {
		return new CandidateRecord(key, "kubernetes", title, problem, solution, List.of(),
				new Provenance(SourceType.GITHUB_ISSUES, "kubernetes/kubernetes",
						"https://github.com/kubernetes/kubernetes/issues/1", CREATED),
				3);
	}

	static CandidateRecord incident(String key) {
		return incident(key, "CrashLoopBackOff after upgrade", PROBLEM, SOLUTION);
	}

	static CandidateRecord review(String path, String code, String comment) {
		return new CandidateRecord(CandidateRecord.key(SourceType.GITHUB_REVIEWS, "psf/requests", 7), "python", path,
				code, comment, List.of(), new Provenance(SourceType.GITHUB_REVIEWS, "psf/requests",
						"https://github.com/psf/requests/pull/1#discussion_r7", CREATED),
				0);
	}

	static TrainingExample example(String key, String source, String tech) {
		Map<String, Object> meta = new LinkedHashMap<>();
		meta.put(TrainingExample.KEY, key);
		meta.put(TrainingExample.SOURCE, source);
		meta.put(TrainingExample.TECH, tech);
		return TrainingExample.of("system", "user " + key, "assistant " + key, meta);
	}

}
