package com.hellblazer.luciferase.pool.health;

import java.util.Objects;
import java.util.function.BiPredicate;

/**
 * A named predicate that must hold for a health transition to be accepted.
 * Built-in rules and user rules share this interface.
 */
public interface GuardCondition {

    boolean evaluate(HealthState from, HealthState to);

    /**
     * Why the guard rejects, reported when {@link #evaluate} returns false.
     */
    String reason();

    static GuardCondition of(String reason, BiPredicate<HealthState, HealthState> predicate) {
        Objects.requireNonNull(reason, "reason");
        Objects.requireNonNull(predicate, "predicate");
        return new GuardCondition() {
            @Override
            public boolean evaluate(HealthState from, HealthState to) {
                return predicate.test(from, to);
            }

            @Override
            public String reason() {
                return reason;
            }

            @Override
            public String toString() {
                return "GuardCondition[" + reason + "]";
            }
        };
    }
}
