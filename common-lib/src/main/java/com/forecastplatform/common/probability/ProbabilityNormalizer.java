package com.forecastplatform.common.probability;

import com.forecastplatform.common.exception.InvariantViolationException;
import com.forecastplatform.common.model.OutcomeCandidate;

import java.util.List;

/**
 * Rescales one expansion's candidate outcomes so their probabilities sum to 1.0.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>{@code sum = Σ p_i}.</li>
 *   <li>{@code sum == 0} → uniform {@code 1/N} for each of the N candidates.</li>
 *   <li>Otherwise {@code p_i' = p_i / sum}.</li>
 *   <li>If the result still misses 1.0 by more than {@value #SUM_TOLERANCE}, run one more
 *       pass over the result; a second miss is an {@link InvariantViolationException}.</li>
 * </ol>
 *
 * <p>Pure static utility: no state, no logging, never mutates its input.
 */
public final class ProbabilityNormalizer {

    /** Allowed deviation of a sibling set's probability sum from 1.0. */
    public static final double SUM_TOLERANCE = 1e-3;

    private ProbabilityNormalizer() {}

    /**
     * @param candidates 1..N raw candidates
     * @return new candidates with rescaled probabilities, same order
     * @throws InvariantViolationException if the set is empty or cannot be brought within
     *                                     tolerance (non-finite values)
     */
    public static List<OutcomeCandidate> normalize(List<OutcomeCandidate> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            throw new InvariantViolationException("Cannot normalize an empty candidate set");
        }
        List<OutcomeCandidate> result = rescale(candidates);
        if (!isNormalized(result)) {
            result = rescale(result);
            if (!isNormalized(result)) {
                throw new InvariantViolationException(
                    "Candidate probabilities failed to normalize. sum=" + sum(result));
            }
        }
        return result;
    }

    public static boolean isNormalized(List<OutcomeCandidate> candidates) {
        return Math.abs(sum(candidates) - 1.0) <= SUM_TOLERANCE;
    }

    static double sum(List<OutcomeCandidate> candidates) {
        double total = 0.0;
        for (OutcomeCandidate c : candidates) {
            total += c.probability();
        }
        return total;
    }

    private static List<OutcomeCandidate> rescale(List<OutcomeCandidate> candidates) {
        double total = sum(candidates);
        if (total == 0.0) {
            double uniform = 1.0 / candidates.size();
            return candidates.stream().map(c -> c.withProbability(uniform)).toList();
        }
        return candidates.stream().map(c -> c.withProbability(c.probability() / total)).toList();
    }
}
