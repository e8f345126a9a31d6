package com.forecastplatform.engine.collaborator;

import com.forecastplatform.common.model.ResearchResult;
import reactor.core.publisher.Mono;

/**
 * Gathers source material for one scenario before its successors are synthesized.
 *
 * <p>Implementations may fail or time out; the orchestrator treats any error signal as a
 * per-node failure.
 */
public interface ResearchCollaborator {

    String NAME = "research";

    /**
     * @param eventText   the scenario being expanded
     * @param contextText background for the search, may be empty
     * @param depth       depth of the scenario in its tree
     */
    Mono<ResearchResult> research(String eventText, String contextText, int depth);
}
