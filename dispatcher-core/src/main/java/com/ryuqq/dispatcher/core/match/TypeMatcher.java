package com.ryuqq.dispatcher.core.match;

import java.util.List;

/**
 * 바인딩된 인자 목록에 대한 위치별 타입 제약 검사.
 *
 * <p>{@code min(bound.size(), constraints.size())}개까지 위치별로 짝을 지어 검사합니다.
 * 제약이 없는 뒤쪽 인자는 검사하지 않으며, 빈 제약 목록은 항상 통과합니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public final class TypeMatcher {

    // Utility class - prevent instantiation
    private TypeMatcher() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 위치별 타입 제약 검사.
     *
     * @param bound 바인딩된 인자 값 (기본값 포함)
     * @param constraints 위치 순서의 제약 (인자 수보다 짧아도 됨)
     * @return 모든 짝이 제약을 만족하면 true
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public static boolean matches(List<?> bound, List<? extends TypeConstraint> constraints) {
        if (bound == null) {
            throw new IllegalArgumentException("bound cannot be null");
        }
        if (constraints == null) {
            throw new IllegalArgumentException("constraints cannot be null");
        }
        int paired = Math.min(bound.size(), constraints.size());
        for (int i = 0; i < paired; i++) {
            if (!constraints.get(i).accepts(bound.get(i))) {
                return false;
            }
        }
        return true;
    }
}
