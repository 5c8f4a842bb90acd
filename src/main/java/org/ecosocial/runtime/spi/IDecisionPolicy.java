package org.ecosocial.runtime.spi;

import java.util.List;

import org.ecosocial.runtime.model.Personality;

/**
 * Chooses one action per agent from the current observations.
 * <p>
 * The engine never calls a policy itself; the episode runner feeds the observations returned
 * by reset and step into the policy and passes the chosen codes back to the engine.
 * <p>
 * Implementations must provide a constructor with signature:
 * {@code (IRandomProvider rng, com.typesafe.config.Config options)}
 */
public interface IDecisionPolicy {

    /**
     * Selects actions for all agents.
     *
     * @param observations one observation vector per agent, in id order
     * @param personalities the personality of each agent, in id order
     * @return one action code in [0, 8] per agent
     */
    int[] selectActions(float[][] observations, List<Personality> personalities);

    /**
     * Returns a short label recorded as the agent type in telemetry and history.
     * @return the policy name
     */
    String getName();
}
