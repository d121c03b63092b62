package com.ryuqq.dispatcher.core.signature;

/**
 * 자신의 형식 시그니처를 선언하는 호출 대상.
 *
 * <p>Handler와 Condition은 모두 Signed이며, {@link SignatureIntrospector}는
 * 이 선언을 통해 시그니처를 얻습니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public interface Signed {

    /**
     * 형식 시그니처 조회.
     *
     * <p>바인딩된 리시버 파라미터는 포함하지 않아야 합니다.</p>
     *
     * @return 시그니처 (null이면 시그니처를 알 수 없는 것으로 취급)
     */
    Signature signature();
}
