package com.ryuqq.dispatcher.core.error;

/**
 * Dispatcher가 발생시키는 모든 예외의 상위 타입.
 *
 * <p>등록 시점 오류(시그니처 불일치, 시그니처 해석 실패)와 호출 시점 오류(바인딩 실패,
 * 선택 실패)를 하나의 계층으로 묶습니다.</p>
 *
 * <p><strong>주의:</strong> 선택된 Handler 또는 Condition 내부에서 발생한 예외는
 * 이 타입으로 감싸지지 않고 호출자에게 그대로 전파됩니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public abstract class DispatchException extends RuntimeException {

    protected DispatchException(String message) {
        super(message);
    }

    protected DispatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
