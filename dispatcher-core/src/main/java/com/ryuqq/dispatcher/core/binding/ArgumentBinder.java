package com.ryuqq.dispatcher.core.binding;

import com.ryuqq.dispatcher.core.contract.Arguments;
import com.ryuqq.dispatcher.core.error.ArgumentBindingException;
import com.ryuqq.dispatcher.core.error.UnsupportedSignatureException;
import com.ryuqq.dispatcher.core.signature.Signature;
import com.ryuqq.dispatcher.core.signature.SignatureIntrospector;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 원본 호출 인자를 선언 순서의 위치 인자 목록으로 바인딩.
 *
 * <p>결과 목록은 모든 파라미터를 선언 순서대로 위치 인자로 넘긴 것과 같은 호출을 나타냅니다:</p>
 * <pre>
 * signature: (x, y=10, z=20)
 * call:      f(1, z=3)
 * bound:     [1, 10, 3]
 * </pre>
 *
 * <p><strong>규칙:</strong></p>
 * <ol>
 *   <li>가변 인자 시그니처 → {@link UnsupportedSignatureException}</li>
 *   <li>위치 인자는 앞에서부터 그대로 사용</li>
 *   <li>나머지 파라미터는 이름 인자에서 찾고, 없으면 선언된 기본값 사용</li>
 *   <li>값을 찾을 수 없는 필수 파라미터, 초과 위치 인자, 알 수 없거나 중복된 이름 인자
 *       → {@link ArgumentBindingException}</li>
 * </ol>
 *
 * <p>호출자는 보통 {@link com.ryuqq.dispatcher.core.match.SignatureMatcher}로 먼저 걸러낸 뒤
 * 바인딩하므로, {@link ArgumentBindingException}은 잘못된 사용을 의미합니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public final class ArgumentBinder {

    // Utility class - prevent instantiation
    private ArgumentBinder() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 호출 대상의 선언된 시그니처로 바인딩.
     *
     * @param callable 호출 대상 ({@link com.ryuqq.dispatcher.core.signature.Signed})
     * @param arguments 원본 호출 인자
     * @return 선언 순서의 값 목록 (읽기 전용, null 원소 가능)
     * @throws com.ryuqq.dispatcher.core.error.IntrospectionException 시그니처를 알 수 없는 경우
     */
    public static List<Object> bind(Object callable, Arguments arguments) {
        return bind(SignatureIntrospector.introspect(callable), arguments);
    }

    /**
     * 시그니처로 바인딩.
     *
     * @param signature 시그니처
     * @param arguments 원본 호출 인자
     * @return 선언 순서의 값 목록 (읽기 전용, null 원소 가능)
     * @throws IllegalArgumentException 인자가 null인 경우
     * @throws UnsupportedSignatureException 가변 인자 시그니처인 경우
     * @throws ArgumentBindingException 바인딩할 수 없는 경우
     */
    public static List<Object> bind(Signature signature, Arguments arguments) {
        if (signature == null) {
            throw new IllegalArgumentException("signature cannot be null");
        }
        if (arguments == null) {
            throw new IllegalArgumentException("arguments cannot be null");
        }
        if (signature.isVariadic()) {
            throw new UnsupportedSignatureException(signature);
        }

        List<String> names = signature.parameterNames();
        int given = arguments.positionalCount();
        if (given > names.size()) {
            throw new ArgumentBindingException(
                "Too many positional arguments for " + signature + ": expected at most "
                    + names.size() + ", got " + given
            );
        }

        for (String key : arguments.namedKeys()) {
            int index = names.indexOf(key);
            if (index < 0) {
                throw new ArgumentBindingException("Unexpected named argument '" + key + "' for " + signature);
            }
            if (index < given) {
                throw new ArgumentBindingException("Multiple values for parameter '" + key + "' of " + signature);
            }
        }

        List<Object> bound = new ArrayList<>(arguments.positional());
        for (String name : names.subList(given, names.size())) {
            if (arguments.hasNamed(name)) {
                bound.add(arguments.named(name));
            } else if (signature.hasDefault(name)) {
                bound.add(signature.defaultValue(name));
            } else {
                throw new ArgumentBindingException("Missing value for parameter '" + name + "' of " + signature);
            }
        }
        return Collections.unmodifiableList(bound);
    }
}
