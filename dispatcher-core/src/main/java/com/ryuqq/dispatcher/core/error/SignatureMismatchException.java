package com.ryuqq.dispatcher.core.error;

import com.ryuqq.dispatcher.core.signature.Signature;

/**
 * 등록 시점에 Condition의 시그니처가 Handler의 시그니처와 다를 때 발생.
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public class SignatureMismatchException extends DispatchException {

    private final Signature handlerSignature;
    private final Signature conditionSignature;

    public SignatureMismatchException(Signature handlerSignature, Signature conditionSignature) {
        super("Signature of condition must match signature of handler (handler: "
            + handlerSignature + ", condition: " + conditionSignature + ")");
        this.handlerSignature = handlerSignature;
        this.conditionSignature = conditionSignature;
    }

    public Signature getHandlerSignature() {
        return handlerSignature;
    }

    public Signature getConditionSignature() {
        return conditionSignature;
    }
}
