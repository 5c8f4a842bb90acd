package org.ecosocial.runtime;

import org.ecosocial.runtime.metrics.StepMetrics;

/**
 * Outcome of {@link Simulation#step(int[])}.
 *
 * @param observations one 40-element vector per agent, in id order
 * @param rewards the reward of each agent for this step
 * @param terminated true once the episode length has been reached
 * @param truncated always false; episodes end only by termination
 * @param info summary statistics after the step
 */
public record StepResult(
    float[][] observations,
    double[] rewards,
    boolean terminated,
    boolean truncated,
    StepMetrics info
) {
    /**
     * Returns the sum of all agent rewards for this step.
     * @return the total reward
     */
    public double totalReward() {
        double total = 0.0;
        for (double r : rewards) {
            total += r;
        }
        return total;
    }
}
