package com.portfoliotracker.engine.domain.scoring;

import java.util.EnumSet;
import java.util.Set;

/**
 * How a fired signal rule changes the running action.
 */
@FunctionalInterface
public interface ActionAdjustment {

    ActionAdjustment NONE = (action, inputs) -> action;

    SignalAction adjust(SignalAction current, SignalInputs inputs);

    /**
     * Replace the action with {@code target} when it is one of {@code from}.
     */
    static ActionAdjustment when(Set<SignalAction> from, SignalAction target) {
        return (action, inputs) -> from.contains(action) ? target : action;
    }

    static ActionAdjustment when(SignalAction from, SignalAction target) {
        return when(EnumSet.of(from), target);
    }

    /**
     * Replace the action with {@code target} unless it is one of {@code kept}.
     */
    static ActionAdjustment unless(Set<SignalAction> kept, SignalAction target) {
        return (action, inputs) -> kept.contains(action) ? action : target;
    }
}
