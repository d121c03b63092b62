package com.ryuqq.dispatcher.core.registry;

import com.ryuqq.dispatcher.core.contract.Handler;
import com.ryuqq.dispatcher.core.match.TypeConstraint;
import com.ryuqq.dispatcher.core.signature.Signature;

import java.util.List;

/**
 * Condition이 없는 catch-all Registry 엔트리.
 *
 * <p>모든 ConditionedEntry 다음에 검토되며, 시그니처/타입 게이트만 통과하면 선택됩니다.</p>
 *
 * @param handler Handler
 * @param signature 등록 시점에 해석된 Handler 시그니처
 * @param types 위치별 타입 제약 (null 허용)
 * @param <R> 결과 타입
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public record UnconditionedEntry<R>(
    Handler<? extends R> handler,
    Signature signature,
    List<TypeConstraint> types
) implements RegistryEntry<R> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 types에 null 원소가 있는 경우
     */
    public UnconditionedEntry {
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        if (signature == null) {
            throw new IllegalArgumentException("signature cannot be null");
        }
        types = copyTypes(types);
    }

    static List<TypeConstraint> copyTypes(List<TypeConstraint> types) {
        if (types == null) {
            return null;
        }
        for (TypeConstraint type : types) {
            if (type == null) {
                throw new IllegalArgumentException("types cannot contain null");
            }
        }
        return List.copyOf(types);
    }
}
