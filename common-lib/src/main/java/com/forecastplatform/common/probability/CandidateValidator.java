package com.forecastplatform.common.probability;

import com.forecastplatform.common.exception.ScenarioValidationException;
import com.forecastplatform.common.model.OutcomeCandidate;

import java.util.List;

/**
 * Strict schema for synthesized candidates. Loosely structured model output is rejected,
 * never coerced: out-of-range values fail validation instead of being clamped.
 *
 * <ul>
 *   <li>between {@value #MIN_CANDIDATES} and {@value #MAX_CANDIDATES} candidates</li>
 *   <li>{@code event} of at least {@code minEventLength} characters</li>
 *   <li>{@code justification} of at least {@code minJustificationLength} characters</li>
 *   <li>finite {@code probability} in [0,1]</li>
 *   <li>{@code sentiment} in [-100,100]</li>
 * </ul>
 *
 * <p>Stateless after construction and safe to share across threads.
 */
public class CandidateValidator {

    public static final int MIN_CANDIDATES = 1;
    public static final int MAX_CANDIDATES = 5;

    public static final int DEFAULT_MIN_EVENT_LENGTH         = 10;
    public static final int DEFAULT_MIN_JUSTIFICATION_LENGTH = 20;

    private final int minEventLength;
    private final int minJustificationLength;

    public CandidateValidator(int minEventLength, int minJustificationLength) {
        this.minEventLength         = Math.max(1, minEventLength);
        this.minJustificationLength = Math.max(0, minJustificationLength);
    }

    public static CandidateValidator defaults() {
        return new CandidateValidator(DEFAULT_MIN_EVENT_LENGTH, DEFAULT_MIN_JUSTIFICATION_LENGTH);
    }

    /**
     * @return the same list, unchanged, when every candidate passes
     * @throws ScenarioValidationException naming the first offending candidate
     */
    public List<OutcomeCandidate> validate(List<OutcomeCandidate> candidates) {
        if (candidates == null) {
            throw new ScenarioValidationException("Synthesis returned no candidate list");
        }
        if (candidates.size() < MIN_CANDIDATES || candidates.size() > MAX_CANDIDATES) {
            throw new ScenarioValidationException(
                "Expected " + MIN_CANDIDATES + "-" + MAX_CANDIDATES + " candidates, got " + candidates.size());
        }
        for (int i = 0; i < candidates.size(); i++) {
            validateOne(i, candidates.get(i));
        }
        return candidates;
    }

    private void validateOne(int index, OutcomeCandidate c) {
        if (c == null) {
            throw new ScenarioValidationException("Candidate " + index + " is null");
        }
        String event = c.event() != null ? c.event().trim() : "";
        if (event.length() < minEventLength) {
            throw new ScenarioValidationException(
                "Candidate " + index + " event shorter than " + minEventLength + " characters");
        }
        String justification = c.justification() != null ? c.justification().trim() : "";
        if (justification.length() < minJustificationLength) {
            throw new ScenarioValidationException(
                "Candidate " + index + " justification shorter than " + minJustificationLength + " characters");
        }
        if (!Double.isFinite(c.probability()) || c.probability() < 0.0 || c.probability() > 1.0) {
            throw new ScenarioValidationException(
                "Candidate " + index + " probability out of [0,1]: " + c.probability());
        }
        if (c.sentiment() < -100 || c.sentiment() > 100) {
            throw new ScenarioValidationException(
                "Candidate " + index + " sentiment out of [-100,100]: " + c.sentiment());
        }
    }
}
