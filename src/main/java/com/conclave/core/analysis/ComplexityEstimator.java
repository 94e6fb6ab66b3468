package com.conclave.core.analysis;

import com.conclave.core.config.ConclaveProperties;
import com.conclave.core.model.Complexity;
import com.conclave.core.model.Task;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Scores a task on a 0..10 scale from its size signals and buckets the score.
 *
 * <p>Weights: target files 3.0, dependencies 1.5, components/interfaces/data models 2.0,
 * description length 1.5, high-risk keywords 2.0. Each signal saturates at its own cap.
 */
@Component
public class ComplexityEstimator {

    static final double FILE_WEIGHT = 3.0;
    static final double DEPENDENCY_WEIGHT = 1.5;
    static final double STRUCTURE_WEIGHT = 2.0;
    static final double LENGTH_WEIGHT = 1.5;
    static final double RISK_WEIGHT = 2.0;

    static final double LOW_BELOW = 3.5;
    static final double MEDIUM_BELOW = 7.0;

    /**
     * Score, bucket and duration estimate for one task.
     */
    public record Estimate(double score, Complexity complexity, Duration duration) {}

    private final List<String> highRiskKeywords;

    @Autowired
    public ComplexityEstimator(ConclaveProperties properties) {
        this(properties.getAnalysis().getHighRiskKeywords());
    }

    public ComplexityEstimator(List<String> highRiskKeywords) {
        this.highRiskKeywords = highRiskKeywords.stream()
                .map(k -> k.toLowerCase(Locale.ROOT))
                .distinct()
                .toList();
    }

    /**
     * Estimates the task.
     *
     * @param task             the task to score
     * @param estimatedMinutes explicit override for the duration, or null for the heuristic
     */
    public Estimate estimate(Task task, Integer estimatedMinutes) {
        double score = fraction(task.targetFiles().size(), 10) * FILE_WEIGHT
                + fraction(task.dependencies().size(), 5) * DEPENDENCY_WEIGHT
                + fraction(task.components().size() + task.interfaces().size() + task.dataModels().size(), 5)
                        * STRUCTURE_WEIGHT
                + fraction(wordCount(task.description()), 400) * LENGTH_WEIGHT
                + fraction(riskHits(task), 3) * RISK_WEIGHT;
        score = Math.round(Math.min(score, 10.0) * 100.0) / 100.0;

        Duration duration = estimatedMinutes != null
                ? Duration.ofMinutes(estimatedMinutes)
                : Duration.ofMinutes(5 + Math.round(score * 6) + task.targetFiles().size());
        return new Estimate(score, bucket(score), duration);
    }

    /** Returns the task with its complexity fields filled in. */
    public Task score(Task task, Integer estimatedMinutes) {
        Estimate estimate = estimate(task, estimatedMinutes);
        return task.withComplexity(estimate.complexity(), estimate.score(), estimate.duration());
    }

    static Complexity bucket(double score) {
        if (score < LOW_BELOW) return Complexity.LOW;
        if (score < MEDIUM_BELOW) return Complexity.MEDIUM;
        return Complexity.HIGH;
    }

    private int riskHits(Task task) {
        String text = ((task.title() != null ? task.title() : "") + " "
                + (task.description() != null ? task.description() : "")).toLowerCase(Locale.ROOT);
        int hits = 0;
        for (String keyword : highRiskKeywords) {
            if (text.contains(keyword)) {
                hits++;
            }
        }
        return hits;
    }

    private static int wordCount(String text) {
        if (text == null || text.isBlank()) return 0;
        return text.strip().split("\\s+").length;
    }

    private static double fraction(int value, int cap) {
        return Math.min((double) value / cap, 1.0);
    }
}
