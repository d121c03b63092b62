package com.ryuqq.dispatcher.core.signature;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 리플렉션으로 해석되는 메서드 파라미터의 이름 지정.
 *
 * <p>컴파일러가 파라미터 이름을 보존하지 않는 경우({@code -parameters} 미사용)에도
 * 시그니처를 해석할 수 있게 합니다. 지정된 경우 컴파일러가 보존한 이름보다 우선합니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.PARAMETER)
public @interface Param {

    /**
     * 파라미터 이름.
     *
     * @return 이름
     */
    String value();
}
