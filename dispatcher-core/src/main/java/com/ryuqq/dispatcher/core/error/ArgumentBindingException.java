package com.ryuqq.dispatcher.core.error;

/**
 * 실제 인자를 시그니처에 바인딩할 수 없을 때 발생.
 *
 * <p>필수 파라미터 누락, 초과 위치 인자, 위치 인자와 이름 인자의 중복 지정 등
 * 시그니처 매칭을 거치지 않은 잘못된 사용에서 발생합니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public class ArgumentBindingException extends DispatchException {

    public ArgumentBindingException(String message) {
        super(message);
    }
}
