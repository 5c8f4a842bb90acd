package org.ecosocial.runtime.model;

/**
 * One-step communication flag carried by an agent and observable by neighbours.
 * <p>
 * Only {@link #HELP} is emitted by the engine. {@link #FOOD} and {@link #DANGER} are
 * recognised by the feature encoder but reserved for future actions.
 */
public enum Signal {
    NONE,
    HELP,
    FOOD,
    DANGER
}
