package com.ryuqq.dispatcher.core.error;

/**
 * 호출 대상의 형식 시그니처를 알아낼 수 없을 때 발생.
 *
 * <p>예: 시그니처를 선언하지 않은 람다, 파라미터 이름이 컴파일 시 보존되지 않은 메서드.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public class IntrospectionException extends DispatchException {

    public IntrospectionException(String message) {
        super(message);
    }

    public IntrospectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
