package com.ryuqq.dispatcher.core.registry;

import com.ryuqq.dispatcher.core.contract.Handler;
import com.ryuqq.dispatcher.core.match.TypeConstraint;
import com.ryuqq.dispatcher.core.signature.Signature;

import java.util.List;

/**
 * Registry 엔트리.
 *
 * <p>두 가지 형태가 있습니다:</p>
 * <ul>
 *   <li>{@link ConditionedEntry}: Condition을 가진 엔트리</li>
 *   <li>{@link UnconditionedEntry}: Condition이 없는 catch-all 엔트리</li>
 * </ul>
 *
 * <p>Handler의 시그니처는 등록 시점에 한 번 해석되어 엔트리에 보관됩니다.</p>
 *
 * @param <R> 결과 타입
 * @author Dispatcher Team
 * @since 1.0.0
 */
public sealed interface RegistryEntry<R> permits ConditionedEntry, UnconditionedEntry {

    /**
     * 등록된 Handler.
     *
     * @return Handler
     */
    Handler<? extends R> handler();

    /**
     * 등록 시점에 해석된 Handler 시그니처.
     *
     * @return 시그니처
     */
    Signature signature();

    /**
     * 위치별 타입 제약.
     *
     * @return 제약 목록 (null이면 타입 게이트 없음)
     */
    List<TypeConstraint> types();

    /**
     * 타입 게이트 존재 여부.
     *
     * <p>빈 제약 목록도 타입 게이트로 취급하여 인자 바인딩을 수행합니다.</p>
     *
     * @return types가 null이 아니면 true
     */
    default boolean hasTypes() {
        return types() != null;
    }
}
