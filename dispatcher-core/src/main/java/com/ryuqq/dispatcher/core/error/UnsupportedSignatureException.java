package com.ryuqq.dispatcher.core.error;

import com.ryuqq.dispatcher.core.signature.Signature;

/**
 * 가변 인자를 받는 시그니처에 대해 인자 바인딩을 시도했을 때 발생.
 *
 * <p>바인딩 결과는 유한한 위치 인자 목록이어야 하므로
 * {@code varPositional} 또는 {@code varNamed}가 설정된 시그니처는 지원하지 않습니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public class UnsupportedSignatureException extends DispatchException {

    private final Signature signature;

    public UnsupportedSignatureException(Signature signature) {
        super("Cannot bind arguments against a variadic signature: " + signature);
        this.signature = signature;
    }

    public Signature getSignature() {
        return signature;
    }
}
