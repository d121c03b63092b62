package com.ryuqq.dispatcher.core.registry;

import com.ryuqq.dispatcher.core.contract.Condition;
import com.ryuqq.dispatcher.core.contract.Handler;
import com.ryuqq.dispatcher.core.match.TypeConstraint;
import com.ryuqq.dispatcher.core.signature.Signature;

import java.util.List;

/**
 * Condition을 가진 Registry 엔트리.
 *
 * @param handler Handler
 * @param condition Condition (Handler와 구조적으로 같은 시그니처)
 * @param signature 등록 시점에 해석된 Handler 시그니처
 * @param types 위치별 타입 제약 (null 허용)
 * @param <R> 결과 타입
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public record ConditionedEntry<R>(
    Handler<? extends R> handler,
    Condition condition,
    Signature signature,
    List<TypeConstraint> types
) implements RegistryEntry<R> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 types에 null 원소가 있는 경우
     */
    public ConditionedEntry {
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        if (condition == null) {
            throw new IllegalArgumentException("condition cannot be null");
        }
        if (signature == null) {
            throw new IllegalArgumentException("signature cannot be null");
        }
        types = UnconditionedEntry.copyTypes(types);
    }
}
