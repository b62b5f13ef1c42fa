package com.researchmatch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Tuning for similarity search and recommendations.
 *
 * <p>The candidate caps bound how many stored records a single search or
 * recommendation scores. Ranking is exact only within that window: once the
 * store holds more records than the cap, older records are never considered.
 */
@Data
@Component
@ConfigurationProperties(prefix = "researchmatch.similarity")
public class SimilarityProperties {

    /**
     * Length of every stored and compared vector.
     */
    private int dimension = 1536;

    private int searchCandidateCap = 1000;

    private int recommendationCandidateCap = 500;

    private int defaultSearchLimit = 5;

    private double defaultSearchThreshold = 0.7;

    private double recommendationThreshold = 0.6;

    /**
     * Number of the owner's most recent records averaged into the profile vector.
     */
    private int recommendationHistorySize = 10;

    private int defaultRecommendationLimit = 5;

    private int defaultPageSize = 20;
}
