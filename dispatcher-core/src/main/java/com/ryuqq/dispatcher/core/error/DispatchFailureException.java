package com.ryuqq.dispatcher.core.error;

import com.ryuqq.dispatcher.core.contract.Arguments;

/**
 * 호출 시점에 어떤 Handler도 선택되지 않았음을 나타내는 예외.
 *
 * <p>두 가지 하위 타입으로 구분됩니다:</p>
 * <ul>
 *   <li>{@link NoMatchingSignatureException}: 호출 형태를 받아들이는 엔트리가 없음</li>
 *   <li>{@link NoSatisfiedConditionException}: 형태는 맞았지만 모든 Condition이 거부함</li>
 * </ul>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public abstract class DispatchFailureException extends DispatchException {

    private final String registryName;
    private final Arguments arguments;

    protected DispatchFailureException(String registryName, Arguments arguments, String reason) {
        super("[" + registryName + "] " + reason + " (call: " + arguments.describeShape() + ")");
        this.registryName = registryName;
        this.arguments = arguments;
    }

    public String getRegistryName() {
        return registryName;
    }

    public Arguments getArguments() {
        return arguments;
    }
}
