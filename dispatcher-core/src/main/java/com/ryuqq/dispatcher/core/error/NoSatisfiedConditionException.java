package com.ryuqq.dispatcher.core.error;

import com.ryuqq.dispatcher.core.contract.Arguments;

/**
 * 하나 이상의 엔트리가 게이트를 통과했지만 모든 Condition이 false를 반환했고
 * 게이트를 통과하는 무조건 엔트리도 없을 때 발생.
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public class NoSatisfiedConditionException extends DispatchFailureException {

    public NoSatisfiedConditionException(String registryName, Arguments arguments) {
        super(registryName, arguments, "The input did not fulfill the condition of any handler");
    }
}
