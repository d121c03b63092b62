package com.ryuqq.dispatcher.core.contract;

import com.ryuqq.dispatcher.core.signature.Signature;
import com.ryuqq.dispatcher.core.signature.Signed;

import java.util.function.Predicate;

/**
 * Handler와 짝을 이루는 선택 조건.
 *
 * <p>Condition은 시그니처/타입 게이트를 통과한 호출에 대해서만,
 * <strong>바인딩되지 않은 원본 인자</strong>로 평가됩니다.
 * 따라서 호출에 포함되지 않은 파라미터는 Condition 자신의 기본값으로만 보입니다.</p>
 *
 * <p><strong>불변식:</strong> Condition의 시그니처는 짝이 되는 Handler의 시그니처와
 * 구조적으로 동일해야 합니다 (이름, 순서, 기본값을 가진 파라미터 집합, 가변 인자 여부).
 * 다르면 등록이 거부됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Condition positive = Condition.of(
 *     Signature.of("x"),
 *     p -&gt; p.get("x", Integer.class) &gt; 0
 * );
 * </pre>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public interface Condition extends Signed {

    /**
     * 원본 호출 인자로 조건 평가.
     *
     * @param arguments 원본 호출 인자
     * @return 수락 여부
     */
    boolean test(Arguments arguments);

    /**
     * 자신의 시그니처로 바인딩된 파라미터를 받는 Condition 생성.
     *
     * @param signature 시그니처 (가변 인자 불가)
     * @param predicate 조건
     * @return Condition
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    static Condition of(Signature signature, Predicate<Parameters> predicate) {
        return of("condition", signature, predicate);
    }

    /**
     * 이름을 가진 Condition 생성 (로그 및 toString용 이름).
     *
     * @param name 이름
     * @param signature 시그니처 (가변 인자 불가)
     * @param predicate 조건
     * @return Condition
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    static Condition of(String name, Signature signature, Predicate<Parameters> predicate) {
        if (predicate == null) {
            throw new IllegalArgumentException("predicate cannot be null");
        }
        return new PredicateCondition(name, signature, arguments -> predicate.test(Parameters.bind(signature, arguments)));
    }

    /**
     * 원본 Arguments를 그대로 받는 Condition 생성.
     *
     * @param signature 시그니처
     * @param predicate 조건
     * @return Condition
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    static Condition raw(Signature signature, Predicate<Arguments> predicate) {
        return new PredicateCondition("condition", signature, predicate);
    }
}
