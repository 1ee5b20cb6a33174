package com.bulwark.core.review;

import com.bulwark.core.model.SecurityRecommendation;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Orders recommendations for display: vulnerability recommendations first, most severe first,
 * then finding-type recommendations in their original order.
 */
public final class RecommendationPrioritizer {

    private static final Comparator<SecurityRecommendation> PRIORITY = Comparator
            .comparingInt((SecurityRecommendation r) -> r.isVulnerability() ? 0 : 1)
            .thenComparingInt(r -> r.isVulnerability() && r.getSeverity() != null
                    ? r.getSeverity().rank()
                    : Integer.MAX_VALUE);

    private RecommendationPrioritizer() {
    }

    /** Stable sort; returns a new list. */
    public static List<SecurityRecommendation> prioritize(List<SecurityRecommendation> recommendations) {
        List<SecurityRecommendation> sorted = new ArrayList<>(recommendations);
        sorted.sort(PRIORITY);
        return sorted;
    }

    public static List<SecurityRecommendation> top(List<SecurityRecommendation> recommendations, int limit) {
        List<SecurityRecommendation> sorted = prioritize(recommendations);
        return sorted.subList(0, Math.min(limit, sorted.size()));
    }
}
