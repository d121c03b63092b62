package com.ryuqq.dispatcher.core.signature;

import com.ryuqq.dispatcher.core.error.IntrospectionException;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Parameter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 호출 대상의 형식 시그니처 해석기.
 *
 * <p>두 가지 경로를 제공합니다:</p>
 * <ul>
 *   <li><strong>선언 경로:</strong> {@link Signed} 구현체가 선언한 {@link Signature}를 그대로 사용</li>
 *   <li><strong>리플렉션 경로:</strong> {@link Method}의 파라미터 정보로 Signature를 구성</li>
 * </ul>
 *
 * <p><strong>리플렉션 규칙:</strong></p>
 * <ul>
 *   <li>파라미터 이름: {@link Param} 어노테이션 → 컴파일러가 보존한 이름 순으로 조회</li>
 *   <li>Java 가변 인자 파라미터 → {@code varPositional}, 이름 목록에서 제외</li>
 *   <li>마지막 {@link NamedRest} Map 파라미터 → {@code varNamed}, 이름 목록에서 제외</li>
 *   <li>리시버가 바인딩되지 않은 인스턴스 메서드 → 맨 앞에 {@value #RECEIVER} 파라미터 추가</li>
 * </ul>
 *
 * <p>모든 메서드는 부수 효과가 없으며 같은 입력에 대해 같은 결과를 반환합니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public final class SignatureIntrospector {

    /**
     * 바인딩되지 않은 인스턴스 메서드의 리시버 파라미터 이름.
     */
    public static final String RECEIVER = "self";

    // Utility class - prevent instantiation
    private SignatureIntrospector() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 선언된 시그니처 조회.
     *
     * @param callable 호출 대상
     * @return 시그니처
     * @throws IntrospectionException callable이 null이거나 시그니처를 선언하지 않은 경우
     */
    public static Signature introspect(Object callable) {
        if (callable == null) {
            throw new IntrospectionException("Cannot introspect a null callable");
        }
        if (!(callable instanceof Signed)) {
            throw new IntrospectionException(
                "Callable does not declare a signature: " + callable.getClass().getName()
            );
        }
        Signature signature = ((Signed) callable).signature();
        if (signature == null) {
            throw new IntrospectionException("Callable declared a null signature: " + callable);
        }
        return signature;
    }

    /**
     * 기본값 없이 메서드 시그니처 해석.
     *
     * @param method 대상 메서드
     * @param bound 리시버가 바인딩되었는지 여부 (static 메서드는 false)
     * @return 시그니처
     * @throws IntrospectionException 파라미터 이름을 알 수 없는 경우
     */
    public static Signature introspect(Method method, boolean bound) {
        return introspect(method, bound, Map.of());
    }

    /**
     * 메서드 시그니처 해석.
     *
     * <p>Java 메서드에는 기본값 개념이 없으므로 파라미터 이름별 기본값을 별도로 받습니다.</p>
     *
     * @param method 대상 메서드
     * @param bound 리시버가 바인딩되었는지 여부 (static 메서드는 false)
     * @param defaults 파라미터 이름별 기본값 (null 값 허용)
     * @return 시그니처
     * @throws IllegalArgumentException method 또는 defaults가 null이거나 static 메서드에 bound=true인 경우
     * @throws IntrospectionException 파라미터 이름을 알 수 없거나 기본값 구성이 유효하지 않은 경우
     */
    public static Signature introspect(Method method, boolean bound, Map<String, ?> defaults) {
        if (method == null) {
            throw new IllegalArgumentException("method cannot be null");
        }
        if (defaults == null) {
            throw new IllegalArgumentException("defaults cannot be null");
        }
        boolean isStatic = Modifier.isStatic(method.getModifiers());
        if (isStatic && bound) {
            throw new IllegalArgumentException("Static method cannot be bound to a receiver: " + describe(method));
        }

        Parameter[] parameters = method.getParameters();
        int regular = parameters.length;
        boolean varNamed = false;
        boolean varPositional = false;

        if (regular > 0 && parameters[regular - 1].isAnnotationPresent(NamedRest.class)) {
            if (!Map.class.isAssignableFrom(parameters[regular - 1].getType())) {
                throw new IntrospectionException("@NamedRest parameter must be a Map: " + describe(method));
            }
            varNamed = true;
            regular--;
        } else if (method.isVarArgs()) {
            varPositional = true;
            regular--;
        }

        List<String> names = new ArrayList<>(regular + 1);
        if (!isStatic && !bound) {
            names.add(RECEIVER);
        }
        for (int i = 0; i < regular; i++) {
            names.add(parameterName(method, parameters[i]));
        }

        for (String name : defaults.keySet()) {
            if (!names.contains(name)) {
                throw new IntrospectionException(
                    "Default given for unknown parameter '" + name + "' of " + describe(method)
                );
            }
        }

        try {
            return new Signature(names, new LinkedHashMap<>(defaults), varPositional, varNamed);
        } catch (IllegalArgumentException e) {
            throw new IntrospectionException(describe(method) + ": " + e.getMessage(), e);
        }
    }

    private static String parameterName(Method method, Parameter parameter) {
        Param param = parameter.getAnnotation(Param.class);
        if (param != null) {
            return param.value();
        }
        if (parameter.isNamePresent()) {
            return parameter.getName();
        }
        throw new IntrospectionException(
            "Parameter names of " + describe(method)
                + " are not available; compile with -parameters or annotate with @Param"
        );
    }

    static String describe(Method method) {
        return method.getDeclaringClass().getSimpleName() + "#" + method.getName();
    }
}
