package com.ryuqq.dispatcher.core.contract;

import com.ryuqq.dispatcher.core.signature.Signature;

import java.util.function.Function;

/**
 * 함수 기반 Handler 구현.
 */
record FunctionHandler<R>(
    String name,
    Signature signature,
    Function<Arguments, ? extends R> body
) implements Handler<R> {

    FunctionHandler {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (signature == null) {
            throw new IllegalArgumentException("signature cannot be null");
        }
        if (body == null) {
            throw new IllegalArgumentException("body cannot be null");
        }
    }

    @Override
    public R apply(Arguments arguments) {
        return body.apply(arguments);
    }

    @Override
    public String toString() {
        return name + signature;
    }
}
