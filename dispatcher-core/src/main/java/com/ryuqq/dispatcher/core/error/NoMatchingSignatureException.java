package com.ryuqq.dispatcher.core.error;

import com.ryuqq.dispatcher.core.contract.Arguments;

/**
 * 등록된 어떤 엔트리의 시그니처/타입 게이트도 호출 형태를 받아들이지 않을 때 발생.
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public class NoMatchingSignatureException extends DispatchFailureException {

    public NoMatchingSignatureException(String registryName, Arguments arguments) {
        super(registryName, arguments, "There are no handlers matching the input parameter signature");
    }
}
