package com.ryuqq.dispatcher.core.contract;

import com.ryuqq.dispatcher.core.signature.Signature;

import java.util.function.Predicate;

/**
 * Predicate 기반 Condition 구현.
 */
record PredicateCondition(
    String name,
    Signature signature,
    Predicate<Arguments> predicate
) implements Condition {

    PredicateCondition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (signature == null) {
            throw new IllegalArgumentException("signature cannot be null");
        }
        if (predicate == null) {
            throw new IllegalArgumentException("predicate cannot be null");
        }
    }

    @Override
    public boolean test(Arguments arguments) {
        return predicate.test(arguments);
    }

    @Override
    public String toString() {
        return name + signature;
    }
}
