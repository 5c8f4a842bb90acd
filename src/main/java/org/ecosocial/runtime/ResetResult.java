package org.ecosocial.runtime;

import java.util.Map;

/**
 * Outcome of {@link Simulation#reset(Long)}.
 *
 * @param observations one 40-element vector per agent, in id order
 * @param info auxiliary information, empty after a reset
 */
public record ResetResult(float[][] observations, Map<String, Object> info) {}
