package com.ryuqq.dispatcher.core.signature;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 남는 이름 인자를 모두 받는 마지막 {@code Map<String, Object>} 파라미터 표시.
 *
 * <p>이 파라미터가 있으면 시그니처의 {@code varNamed}가 true가 되며,
 * 파라미터 자체는 이름 목록에서 제외됩니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.PARAMETER)
public @interface NamedRest {
}
