package com.forecastplatform.engine.collaborator;

import com.forecastplatform.common.model.OutcomeCandidate;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Turns research into raw candidate successor scenarios.
 *
 * <p>Output is untrusted: the orchestrator validates every candidate and normalizes the
 * probabilities before anything reaches the tree.
 */
public interface SynthesisCollaborator {

    String NAME = "synthesis";

    /**
     * @param parentEvent    the scenario being expanded
     * @param depth          depth of that scenario
     * @param researchDigest formatted research findings for the scenario
     * @param timeframe      forecasting horizon, may be {@code null}
     * @param ancestryPath   event texts from the root down to {@code parentEvent}, inclusive
     */
    Mono<List<OutcomeCandidate>> synthesize(String parentEvent, int depth, String researchDigest,
                                            String timeframe, List<String> ancestryPath);
}
