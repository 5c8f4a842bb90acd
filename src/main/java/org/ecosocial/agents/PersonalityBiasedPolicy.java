package org.ecosocial.agents;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.ecosocial.runtime.model.Action;
import org.ecosocial.runtime.model.Personality;
import org.ecosocial.runtime.spi.IDecisionPolicy;
import org.ecosocial.runtime.spi.IRandomProvider;

import com.typesafe.config.Config;

/**
 * Exploration policy that draws each agent's action from a table biased by its personality.
 * <p>
 * <ul>
 *   <li>Cooperative agents mostly move, and sometimes share, ally or call for help.</li>
 *   <li>Aggressive agents mostly move and sometimes steal.</li>
 *   <li>Neutral agents only stay or move, uniformly.</li>
 * </ul>
 * Observations are ignored. The policy does not learn; its only state is its random stream.
 * <p>
 * Options:
 * <ul>
 *   <li>{@code name} - agent type recorded in telemetry (default {@code "personality-biased"})</li>
 * </ul>
 */
public class PersonalityBiasedPolicy implements IDecisionPolicy {

    private static final Map<Personality, ActionTable> TABLES = new EnumMap<>(Personality.class);

    static {
        TABLES.put(Personality.COOPERATIVE, new ActionTable(
                new Action[] {Action.STAY, Action.UP, Action.DOWN, Action.LEFT, Action.RIGHT,
                        Action.SHARE, Action.FORM_ALLIANCE, Action.SIGNAL_HELP},
                new double[] {0.2, 0.15, 0.15, 0.15, 0.15, 0.1, 0.05, 0.05}));
        TABLES.put(Personality.AGGRESSIVE, new ActionTable(
                new Action[] {Action.STAY, Action.UP, Action.DOWN, Action.LEFT, Action.RIGHT, Action.STEAL},
                new double[] {0.1, 0.2, 0.2, 0.2, 0.2, 0.1}));
        TABLES.put(Personality.NEUTRAL, new ActionTable(
                new Action[] {Action.STAY, Action.UP, Action.DOWN, Action.LEFT, Action.RIGHT},
                new double[] {0.2, 0.2, 0.2, 0.2, 0.2}));
    }

    private final IRandomProvider random;
    private final String name;

    public PersonalityBiasedPolicy(IRandomProvider random, Config options) {
        this.random = random;
        this.name = options.hasPath("name") ? options.getString("name") : "personality-biased";
    }

    @Override
    public int[] selectActions(float[][] observations, List<Personality> personalities) {
        if (observations.length != personalities.size()) {
            throw new IllegalArgumentException("Got " + observations.length + " observations for "
                    + personalities.size() + " agents");
        }
        int[] actions = new int[personalities.size()];
        for (int i = 0; i < actions.length; i++) {
            actions[i] = TABLES.get(personalities.get(i)).draw(random.nextDouble()).getCode();
        }
        return actions;
    }

    @Override
    public String getName() {
        return name;
    }

    /**
     * Returns the probability with which an agent of the given personality picks the action.
     *
     * @param personality the personality
     * @param action the action
     * @return the probability, 0.0 if the action is never chosen
     */
    public static double probability(Personality personality, Action action) {
        return TABLES.get(personality).probability(action);
    }

    private record ActionTable(Action[] actions, double[] weights) {

        Action draw(double u) {
            double cumulative = 0.0;
            for (int i = 0; i < actions.length; i++) {
                cumulative += weights[i];
                if (u < cumulative) {
                    return actions[i];
                }
            }
            return actions[actions.length - 1];
        }

        double probability(Action action) {
            for (int i = 0; i < actions.length; i++) {
                if (actions[i] == action) {
                    return weights[i];
                }
            }
            return 0.0;
        }
    }
}
