package org.ecosocial.runtime.metrics;

import java.util.EnumMap;
import java.util.Map;

import org.ecosocial.runtime.model.Agent;
import org.ecosocial.runtime.model.Personality;
import org.ecosocial.runtime.model.World;

/**
 * Derives {@link StepMetrics} from the world. Read-only.
 * <p>
 * The mean score of a personality that no agent has is reported as 0.0.
 */
public final class MetricsAggregator {

    private MetricsAggregator() {}

    /**
     * Computes the metrics for the current world state.
     *
     * @param world the world
     * @return the metrics
     */
    public static StepMetrics aggregate(World world) {
        int count = world.getAgentCount();
        int scored = 0;
        int totalScore = 0;
        double totalHealth = 0.0;
        Map<Personality, int[]> groups = new EnumMap<>(Personality.class);
        for (Personality p : Personality.values()) {
            groups.put(p, new int[2]); // [sum, count]
        }

        for (Agent agent : world.getAgents()) {
            if (agent.getScore() > 0) scored++;
            totalScore += agent.getScore();
            totalHealth += agent.getHealth();
            int[] group = groups.get(agent.getPersonality());
            group[0] += agent.getScore();
            group[1]++;
        }

        Map<Personality, Double> personalityScores = new EnumMap<>(Personality.class);
        for (Map.Entry<Personality, int[]> entry : groups.entrySet()) {
            int[] group = entry.getValue();
            personalityScores.put(entry.getKey(), group[1] == 0 ? 0.0 : (double) group[0] / group[1]);
        }

        return new StepMetrics(
                world.getStep(),
                (double) scored / count,
                (double) totalScore / count,
                totalScore,
                world.getCooperationEvents(),
                world.getTheftEvents(),
                world.getAllianceFormations(),
                world.getAlliances().size(),
                totalHealth / count,
                personalityScores);
    }
}
