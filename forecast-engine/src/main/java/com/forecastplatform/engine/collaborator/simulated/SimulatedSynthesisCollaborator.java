package com.forecastplatform.engine.collaborator.simulated;

import com.forecastplatform.common.model.OutcomeCandidate;
import com.forecastplatform.engine.collaborator.SynthesisCollaborator;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic stand-in for probability synthesis, active in profile {@code simulated}.
 *
 * <p>Emits four outcomes up to depth 2 and three below that, built from fixed suffix
 * templates. Raw probabilities are left unnormalized on purpose so the normalizer runs
 * exactly as it does against real model output.
 */
@Component
@Profile("simulated")
public class SimulatedSynthesisCollaborator implements SynthesisCollaborator {

    record Template(String suffix, int sentiment, double probability) {}

    static final List<Template> TEMPLATES = List.of(
        new Template("accelerates rapidly",              60, 0.35),
        new Template("proceeds gradually",               20, 0.30),
        new Template("faces significant obstacles",     -40, 0.20),
        new Template("triggers unexpected consequences", -20, 0.10),
        new Template("leads to policy reforms",          40, 0.05)
    );

    private static final int EVENT_PREFIX_LENGTH = 40;

    private final long delayMs;

    public SimulatedSynthesisCollaborator(@Value("${forecast.simulated.synthesis-delay-ms:0}") long delayMs) {
        this.delayMs = delayMs;
    }

    @Override
    public Mono<List<OutcomeCandidate>> synthesize(String parentEvent, int depth, String researchDigest,
                                                   String timeframe, List<String> ancestryPath) {
        int count = depth <= 2 ? 4 : 3;
        String prefix = parentEvent.length() > EVENT_PREFIX_LENGTH
            ? parentEvent.substring(0, EVENT_PREFIX_LENGTH).trim()
            : parentEvent;

        List<OutcomeCandidate> candidates = new ArrayList<>(count);
        for (Template t : TEMPLATES.subList(0, count)) {
            candidates.add(new OutcomeCandidate(
                prefix + " " + t.suffix(),
                t.probability(),
                String.format("Simulated analysis rates this outcome at %.0f%% raw likelihood based on "
                              + "historical patterns, stakeholder responses and systemic constraints.",
                              t.probability() * 100),
                t.sentiment()));
        }
        return delayMs > 0
            ? Mono.delay(Duration.ofMillis(delayMs)).thenReturn(List.copyOf(candidates))
            : Mono.just(List.copyOf(candidates));
    }
}
