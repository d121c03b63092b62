package com.ryuqq.dispatcher.core.reflect;

import com.ryuqq.dispatcher.core.contract.Arguments;
import com.ryuqq.dispatcher.core.contract.Condition;
import com.ryuqq.dispatcher.core.contract.Handler;
import com.ryuqq.dispatcher.core.error.ArgumentBindingException;
import com.ryuqq.dispatcher.core.signature.Signature;
import com.ryuqq.dispatcher.core.signature.SignatureIntrospector;

import java.lang.reflect.Array;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.UndeclaredThrowableException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 리플렉션으로 해석한 메서드를 Handler로 사용하는 어댑터.
 *
 * <p>시그니처는 생성 시점에 {@link SignatureIntrospector}로 한 번 해석되어 보관됩니다.</p>
 *
 * <p><strong>리시버 처리:</strong></p>
 * <ul>
 *   <li>{@link #ofStatic(Method)}: static 메서드, 리시버 없음</li>
 *   <li>{@link #bind(Object, Method)}: 인스턴스에 바인딩, 리시버는 시그니처에서 제외</li>
 *   <li>{@link #unbound(Method)}: 바인딩되지 않은 인스턴스 메서드,
 *       첫 번째 파라미터 {@value SignatureIntrospector#RECEIVER}가 리시버</li>
 * </ul>
 *
 * <p><strong>예외 처리:</strong> 대상 메서드가 던진 unchecked 예외와 Error는 그대로 전파되고,
 * checked 예외는 {@link UndeclaredThrowableException}으로 감싸집니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * MethodFunction fromFile = MethodFunction.bind(loader, "fromFile");
 * registry.register(fromFile, isFile, TypeConstraint.instancesOf(String.class));
 * </pre>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public final class MethodFunction implements Handler<Object> {

    private final Method method;
    private final Object receiver;
    private final boolean unboundInstance;
    private final Signature signature;

    private MethodFunction(Method method, Object receiver, boolean bound, Map<String, ?> defaults) {
        if (method == null) {
            throw new IllegalArgumentException("method cannot be null");
        }
        boolean isStatic = Modifier.isStatic(method.getModifiers());
        if (bound && !method.getDeclaringClass().isInstance(receiver)) {
            throw new IllegalArgumentException(
                "receiver is not an instance of " + method.getDeclaringClass().getName()
            );
        }
        this.signature = SignatureIntrospector.introspect(method, bound, defaults);
        this.method = method;
        this.receiver = receiver;
        this.unboundInstance = !isStatic && !bound;
        method.trySetAccessible();
    }

    /**
     * static 메서드 어댑터 생성.
     *
     * @param method static 메서드
     * @return MethodFunction
     * @throws IllegalArgumentException static 메서드가 아닌 경우
     * @throws com.ryuqq.dispatcher.core.error.IntrospectionException 시그니처를 알 수 없는 경우
     */
    public static MethodFunction ofStatic(Method method) {
        return ofStatic(method, Map.of());
    }

    /**
     * 기본값을 지정한 static 메서드 어댑터 생성.
     *
     * @param method static 메서드
     * @param defaults 파라미터 이름별 기본값
     * @return MethodFunction
     */
    public static MethodFunction ofStatic(Method method, Map<String, ?> defaults) {
        if (method == null || !Modifier.isStatic(method.getModifiers())) {
            throw new IllegalArgumentException("method must be a static method");
        }
        return new MethodFunction(method, null, false, defaults);
    }

    /**
     * 인스턴스에 바인딩된 메서드 어댑터 생성.
     *
     * @param receiver 리시버
     * @param method 인스턴스 메서드
     * @return MethodFunction
     * @throws IllegalArgumentException receiver가 null이거나 static 메서드인 경우
     */
    public static MethodFunction bind(Object receiver, Method method) {
        return bind(receiver, method, Map.of());
    }

    /**
     * 기본값을 지정한, 인스턴스에 바인딩된 메서드 어댑터 생성.
     *
     * @param receiver 리시버
     * @param method 인스턴스 메서드
     * @param defaults 파라미터 이름별 기본값
     * @return MethodFunction
     */
    public static MethodFunction bind(Object receiver, Method method, Map<String, ?> defaults) {
        if (receiver == null) {
            throw new IllegalArgumentException("receiver cannot be null");
        }
        return new MethodFunction(method, receiver, true, defaults);
    }

    /**
     * 리시버 클래스의 public 메서드를 이름으로 찾아 바인딩.
     *
     * @param receiver 리시버
     * @param methodName 메서드 이름 (오버로드 없이 유일해야 함)
     * @return MethodFunction
     * @throws IllegalArgumentException 메서드가 없거나 여러 개인 경우
     */
    public static MethodFunction bind(Object receiver, String methodName) {
        if (receiver == null) {
            throw new IllegalArgumentException("receiver cannot be null");
        }
        return bind(receiver, findMethod(receiver.getClass(), methodName));
    }

    /**
     * 바인딩되지 않은 인스턴스 메서드 어댑터 생성.
     *
     * @param method 인스턴스 메서드
     * @return MethodFunction
     */
    public static MethodFunction unbound(Method method) {
        return unbound(method, Map.of());
    }

    /**
     * 기본값을 지정한, 바인딩되지 않은 인스턴스 메서드 어댑터 생성.
     *
     * @param method 인스턴스 메서드
     * @param defaults 파라미터 이름별 기본값
     * @return MethodFunction
     */
    public static MethodFunction unbound(Method method, Map<String, ?> defaults) {
        if (method == null || Modifier.isStatic(method.getModifiers())) {
            throw new IllegalArgumentException("method must be an instance method");
        }
        return new MethodFunction(method, null, false, defaults);
    }

    /**
     * 타입의 public 메서드를 이름으로 조회.
     *
     * @param type 타입
     * @param methodName 메서드 이름
     * @return 유일한 메서드
     * @throws IllegalArgumentException 메서드가 없거나 여러 개인 경우
     */
    public static Method findMethod(Class<?> type, String methodName) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (methodName == null || methodName.isBlank()) {
            throw new IllegalArgumentException("methodName cannot be null or blank");
        }
        Method found = null;
        for (Method candidate : type.getMethods()) {
            if (!candidate.getName().equals(methodName) || candidate.isBridge()) {
                continue;
            }
            if (found != null) {
                throw new IllegalArgumentException("Method name is overloaded: " + type.getSimpleName() + "#" + methodName);
            }
            found = candidate;
        }
        if (found == null) {
            throw new IllegalArgumentException("No public method: " + type.getSimpleName() + "#" + methodName);
        }
        return found;
    }

    @Override
    public Signature signature() {
        return signature;
    }

    @Override
    public Object apply(Arguments arguments) {
        if (arguments == null) {
            throw new IllegalArgumentException("arguments cannot be null");
        }
        List<Object> values = new ArrayList<>(resolve(arguments));
        Object target = receiver;
        if (unboundInstance) {
            target = values.remove(0);
        }
        try {
            return method.invoke(target, values.toArray());
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Cannot access " + method, e);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new UndeclaredThrowableException(cause);
        }
    }

    /**
     * boolean을 반환하는 메서드를 Condition으로 사용.
     *
     * <p>null 결과는 false로 취급합니다.</p>
     *
     * @return 같은 시그니처의 Condition
     * @throws IllegalStateException 반환 타입이 boolean이 아닌 경우
     */
    public Condition asCondition() {
        Class<?> returnType = method.getReturnType();
        if (returnType != boolean.class && returnType != Boolean.class) {
            throw new IllegalStateException("Condition method must return boolean: " + method);
        }
        return new Condition() {
            @Override
            public boolean test(Arguments arguments) {
                return Boolean.TRUE.equals(apply(arguments));
            }

            @Override
            public Signature signature() {
                return signature;
            }

            @Override
            public String toString() {
                return MethodFunction.this.toString();
            }
        };
    }

    /**
     * Java 호출 인자 배열 구성 (리시버 포함, 가변 인자 수집).
     */
    private List<Object> resolve(Arguments arguments) {
        List<String> names = signature.parameterNames();
        List<Object> positional = arguments.positional();
        int given = positional.size();

        if (given > names.size() && !signature.varPositional()) {
            throw new ArgumentBindingException(
                "Too many positional arguments for " + this + ": expected at most " + names.size() + ", got " + given
            );
        }

        List<Object> values = new ArrayList<>(names.size() + 2);
        values.addAll(positional.subList(0, Math.min(given, names.size())));

        Map<String, Object> rest = new LinkedHashMap<>();
        for (Map.Entry<String, Object> named : arguments.named().entrySet()) {
            int index = names.indexOf(named.getKey());
            if (index >= 0 && index < given) {
                throw new ArgumentBindingException("Multiple values for parameter '" + named.getKey() + "' of " + this);
            }
            if (index < 0) {
                if (!signature.varNamed()) {
                    throw new ArgumentBindingException("Unexpected named argument '" + named.getKey() + "' for " + this);
                }
                rest.put(named.getKey(), named.getValue());
            }
        }

        for (int i = values.size(); i < names.size(); i++) {
            String name = names.get(i);
            if (arguments.hasNamed(name)) {
                values.add(arguments.named(name));
            } else if (signature.hasDefault(name)) {
                values.add(signature.defaultValue(name));
            } else {
                throw new ArgumentBindingException("Missing value for parameter '" + name + "' of " + this);
            }
        }

        if (signature.varPositional()) {
            Class<?>[] parameterTypes = method.getParameterTypes();
            Class<?> componentType = parameterTypes[parameterTypes.length - 1].getComponentType();
            List<Object> surplus = given > names.size() ? positional.subList(names.size(), given) : List.of();
            Object array = Array.newInstance(componentType, surplus.size());
            for (int i = 0; i < surplus.size(); i++) {
                Array.set(array, i, surplus.get(i));
            }
            values.add(array);
        }
        if (signature.varNamed()) {
            values.add(rest);
        }
        return values;
    }

    @Override
    public String toString() {
        return method.getDeclaringClass().getSimpleName() + "#" + method.getName() + signature;
    }
}
