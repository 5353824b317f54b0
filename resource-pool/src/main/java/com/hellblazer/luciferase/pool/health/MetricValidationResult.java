package com.hellblazer.luciferase.pool.health;

import java.util.ArrayList;
import java.util.List;

/**
 * Score in [0, 1] for one metric family, with what was violated and what to do about it.
 * A result is valid when its score is at least {@link #VALID_SCORE}.
 */
public record MetricValidationResult(boolean valid, List<String> violations, List<String> recommendations,
                                     double score) {

    public static final double VALID_SCORE = 0.8;

    public MetricValidationResult {
        violations = List.copyOf(violations);
        recommendations = List.copyOf(recommendations);
    }

    public static MetricValidationResult of(double score, List<String> violations, List<String> recommendations) {
        return new MetricValidationResult(score >= VALID_SCORE, violations, recommendations, score);
    }

    /**
     * Copy with extra recommendations appended.
     */
    public MetricValidationResult withRecommendations(List<String> extra) {
        var all = new ArrayList<>(recommendations);
        all.addAll(extra);
        return new MetricValidationResult(valid, violations, all, score);
    }
}
