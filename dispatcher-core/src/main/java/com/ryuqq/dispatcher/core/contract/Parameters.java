package com.ryuqq.dispatcher.core.contract;

import com.ryuqq.dispatcher.core.binding.ArgumentBinder;
import com.ryuqq.dispatcher.core.signature.Signature;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 호출 대상 자신의 시그니처로 바인딩된 파라미터 값.
 *
 * <p>{@link Handler#of}와 {@link Condition#of}로 만든 람다 기반 호출 대상은
 * 원본 {@link Arguments}를 자신의 시그니처로 바인딩한 Parameters를 받습니다.
 * 호출에 포함되지 않은 파라미터는 자신의 시그니처에 선언된 기본값으로 채워집니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public final class Parameters {

    private final Signature signature;
    private final Map<String, Object> values;

    private Parameters(Signature signature, Map<String, Object> values) {
        this.signature = signature;
        this.values = values;
    }

    /**
     * 원본 인자를 시그니처로 바인딩.
     *
     * @param signature 시그니처 (가변 인자 불가)
     * @param arguments 원본 인자
     * @return Parameters 인스턴스
     * @throws com.ryuqq.dispatcher.core.error.UnsupportedSignatureException 가변 인자 시그니처인 경우
     * @throws com.ryuqq.dispatcher.core.error.ArgumentBindingException 바인딩할 수 없는 경우
     */
    public static Parameters bind(Signature signature, Arguments arguments) {
        List<Object> bound = ArgumentBinder.bind(signature, arguments);
        Map<String, Object> values = new LinkedHashMap<>();
        List<String> names = signature.parameterNames();
        for (int i = 0; i < names.size(); i++) {
            values.put(names.get(i), bound.get(i));
        }
        return new Parameters(signature, Collections.unmodifiableMap(values));
    }

    /**
     * 파라미터 값 조회.
     *
     * @param name 파라미터 이름
     * @return 값 (null 가능)
     * @throws IllegalArgumentException 선언되지 않은 파라미터인 경우
     */
    public Object get(String name) {
        if (!values.containsKey(name)) {
            throw new IllegalArgumentException("Unknown parameter: " + name + " (declared: " + values.keySet() + ")");
        }
        return values.get(name);
    }

    /**
     * 파라미터 값을 지정 타입으로 조회.
     *
     * @param name 파라미터 이름
     * @param type 기대 타입
     * @param <T> 타입
     * @return 값 (null 가능)
     * @throws IllegalArgumentException 선언되지 않은 파라미터인 경우
     * @throws ClassCastException 값이 기대 타입이 아닌 경우
     */
    public <T> T get(String name, Class<T> type) {
        return type.cast(get(name));
    }

    /**
     * 선언 순서대로의 이름-값 Map.
     *
     * @return 읽기 전용 Map
     */
    public Map<String, Object> asMap() {
        return values;
    }

    public Signature signature() {
        return signature;
    }

    @Override
    public String toString() {
        return "Parameters" + values;
    }
}
