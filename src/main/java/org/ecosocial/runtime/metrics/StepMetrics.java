package org.ecosocial.runtime.metrics;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import org.ecosocial.runtime.model.Personality;

/**
 * Summary statistics of the world after a step.
 *
 * @param step the number of completed steps
 * @param survivalRate fraction of agents with a score above zero
 * @param avgScore mean score over all agents
 * @param totalFoodCollected sum of all scores
 * @param cooperationEvents cumulative successful shares
 * @param theftEvents cumulative successful thefts
 * @param allianceFormations cumulative alliances founded
 * @param numAlliances alliances currently registered
 * @param avgHealth mean health over all agents
 * @param personalityScores mean score per personality, 0.0 for a personality nobody has
 */
public record StepMetrics(
    int step,
    double survivalRate,
    double avgScore,
    int totalFoodCollected,
    int cooperationEvents,
    int theftEvents,
    int allianceFormations,
    int numAlliances,
    double avgHealth,
    Map<Personality, Double> personalityScores
) {
    public StepMetrics {
        Map<Personality, Double> copy = new EnumMap<>(Personality.class);
        copy.putAll(personalityScores);
        personalityScores = Collections.unmodifiableMap(copy);
    }

    /**
     * Returns the mean score of one personality group.
     * @param personality the group
     * @return the mean score, 0.0 if the group is empty
     */
    public double personalityScore(Personality personality) {
        return personalityScores.getOrDefault(personality, 0.0);
    }

    /**
     * Renders the metrics as an info map with snake_case keys, for drivers and telemetry.
     * @return an ordered map
     */
    public Map<String, Object> toMap() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("step", step);
        info.put("survival_rate", survivalRate);
        info.put("avg_score", avgScore);
        info.put("total_food_collected", totalFoodCollected);
        info.put("cooperation_events", cooperationEvents);
        info.put("theft_events", theftEvents);
        info.put("alliance_formations", allianceFormations);
        info.put("num_alliances", numAlliances);
        info.put("avg_health", avgHealth);
        Map<String, Double> byPersonality = new LinkedHashMap<>();
        for (Personality p : Personality.values()) {
            byPersonality.put(p.name().toLowerCase(Locale.ROOT), personalityScore(p));
        }
        info.put("personality_scores", byPersonality);
        return info;
    }
}
