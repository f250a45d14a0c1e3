package com.adlanda.apidocsrag.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Ranking weights, bonuses and context limits.
 *
 * Maps to properties prefixed with 'apidocs.retrieval'. Field weights keep the order
 * path &gt; name &gt; description &gt; parameters &gt; tags by default.
 */
@Component
@ConfigurationProperties(prefix = "apidocs.retrieval")
public class RetrievalProperties {

    private double pathWeight = 3.0;

    private double nameWeight = 2.0;

    private double descriptionWeight = 1.5;

    private double parameterWeight = 1.0;

    private double tagWeight = 0.5;

    /**
     * Added when the whole normalized query occurs inside the normalized path.
     */
    private double pathMatchBonus = 2.0;

    /**
     * Added when every distinct query term matched the record.
     */
    private double fullCoverageBonus = 1.0;

    private int defaultMaxResults = 5;

    /**
     * Upper bound, in characters, of the context handed to answer generation.
     */
    private int maxContextLength = 6000;

    /**
     * Top score at which the score component of the confidence saturates.
     */
    private double confidenceSaturation = 5.0;

    public double getPathWeight() {
        return pathWeight;
    }

    public void setPathWeight(double pathWeight) {
        this.pathWeight = pathWeight;
    }

    public double getNameWeight() {
        return nameWeight;
    }

    public void setNameWeight(double nameWeight) {
        this.nameWeight = nameWeight;
    }

    public double getDescriptionWeight() {
        return descriptionWeight;
    }

    public void setDescriptionWeight(double descriptionWeight) {
        this.descriptionWeight = descriptionWeight;
    }

    public double getParameterWeight() {
        return parameterWeight;
    }

    public void setParameterWeight(double parameterWeight) {
        this.parameterWeight = parameterWeight;
    }

    public double getTagWeight() {
        return tagWeight;
    }

    public void setTagWeight(double tagWeight) {
        this.tagWeight = tagWeight;
    }

    public double getPathMatchBonus() {
        return pathMatchBonus;
    }

    public void setPathMatchBonus(double pathMatchBonus) {
        this.pathMatchBonus = pathMatchBonus;
    }

    public double getFullCoverageBonus() {
        return fullCoverageBonus;
    }

    public void setFullCoverageBonus(double fullCoverageBonus) {
        this.fullCoverageBonus = fullCoverageBonus;
    }

    public int getDefaultMaxResults() {
        return defaultMaxResults;
    }

    public void setDefaultMaxResults(int defaultMaxResults) {
        this.defaultMaxResults = defaultMaxResults;
    }

    public int getMaxContextLength() {
        return maxContextLength;
    }

    public void setMaxContextLength(int maxContextLength) {
        this.maxContextLength = maxContextLength;
    }

    public double getConfidenceSaturation() {
        return confidenceSaturation;
    }

    public void setConfidenceSaturation(double confidenceSaturation) {
        this.confidenceSaturation = confidenceSaturation;
    }
}
