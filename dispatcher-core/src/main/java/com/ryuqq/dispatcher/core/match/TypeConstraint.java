package com.ryuqq.dispatcher.core.match;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;

/**
 * 바인딩된 인자 하나에 대한 타입/능력 검사.
 *
 * <p>클래스 참조에 의한 명목적 검사({@link #instanceOf(Class)}) 외에도
 * 임의의 능력 검사를 predicate로 표현할 수 있습니다. 암묵적 타입 변환은 하지 않습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * List&lt;TypeConstraint&gt; types = List.of(
 *     TypeConstraint.instanceOf(String.class),
 *     TypeConstraint.of("non-empty collection", v -&gt; v instanceof Collection&lt;?&gt; c &amp;&amp; !c.isEmpty())
 * );
 * </pre>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface TypeConstraint {

    /**
     * 값이 제약을 만족하는지 검사.
     *
     * @param value 바인딩된 인자 값 (null 가능)
     * @return 만족하면 true
     */
    boolean accepts(Object value);

    /**
     * 명목적 타입 검사. null은 항상 거부합니다.
     *
     * @param type 기대 타입 (primitive 불가)
     * @return TypeConstraint
     * @throws IllegalArgumentException type이 null이거나 primitive 타입인 경우
     */
    static TypeConstraint instanceOf(Class<?> type) {
        return new InstanceOfConstraint(type);
    }

    /**
     * 여러 타입에 대한 명목적 검사 목록.
     *
     * @param types 기대 타입 (위치 순서)
     * @return 읽기 전용 TypeConstraint 목록
     * @throws IllegalArgumentException types 또는 원소가 null인 경우
     */
    static List<TypeConstraint> instancesOf(Class<?>... types) {
        if (types == null) {
            throw new IllegalArgumentException("types cannot be null");
        }
        List<TypeConstraint> constraints = new ArrayList<>(types.length);
        for (Class<?> type : types) {
            constraints.add(instanceOf(type));
        }
        return Collections.unmodifiableList(constraints);
    }

    /**
     * 모든 값(null 포함)을 허용하는 제약.
     *
     * @return TypeConstraint
     */
    static TypeConstraint any() {
        return new PredicateConstraint("any", value -> true);
    }

    /**
     * predicate 기반 능력 검사.
     *
     * @param description 설명 (toString 및 로그용)
     * @param predicate 검사
     * @return TypeConstraint
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    static TypeConstraint of(String description, Predicate<Object> predicate) {
        return new PredicateConstraint(description, predicate);
    }

    /**
     * 두 제약을 모두 만족해야 하는 제약.
     *
     * @param other 다른 제약
     * @return 결합된 TypeConstraint
     */
    default TypeConstraint and(TypeConstraint other) {
        if (other == null) {
            throw new IllegalArgumentException("other cannot be null");
        }
        return new PredicateConstraint("(" + this + " and " + other + ")", value -> accepts(value) && other.accepts(value));
    }

    /**
     * 둘 중 하나만 만족하면 되는 제약.
     *
     * @param other 다른 제약
     * @return 결합된 TypeConstraint
     */
    default TypeConstraint or(TypeConstraint other) {
        if (other == null) {
            throw new IllegalArgumentException("other cannot be null");
        }
        return new PredicateConstraint("(" + this + " or " + other + ")", value -> accepts(value) || other.accepts(value));
    }
}
