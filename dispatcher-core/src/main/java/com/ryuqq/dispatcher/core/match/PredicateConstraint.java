package com.ryuqq.dispatcher.core.match;

import java.util.function.Predicate;

/**
 * predicate 기반 능력 제약.
 */
record PredicateConstraint(String description, Predicate<Object> predicate) implements TypeConstraint {

    PredicateConstraint {
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("description cannot be null or blank");
        }
        if (predicate == null) {
            throw new IllegalArgumentException("predicate cannot be null");
        }
    }

    @Override
    public boolean accepts(Object value) {
        return predicate.test(value);
    }

    @Override
    public String toString() {
        return description;
    }
}
