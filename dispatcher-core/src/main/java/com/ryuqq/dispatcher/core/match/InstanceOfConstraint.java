package com.ryuqq.dispatcher.core.match;

/**
 * 클래스 참조에 의한 타입 제약.
 */
record InstanceOfConstraint(Class<?> type) implements TypeConstraint {

    InstanceOfConstraint {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (type.isPrimitive()) {
            throw new IllegalArgumentException("Primitive type is not supported, use its wrapper: " + type);
        }
    }

    @Override
    public boolean accepts(Object value) {
        return type.isInstance(value);
    }

    @Override
    public String toString() {
        return type.getSimpleName();
    }
}
