package com.ryuqq.dispatcher.core.signature;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;

/**
 * 호출 대상(Handler, Condition)의 형식 시그니처.
 *
 * <p>Signature는 Dispatcher가 호출 형태를 판단하는 데 필요한 모든 정보를 담습니다:</p>
 * <ul>
 *   <li><strong>parameterNames:</strong> 선언 순서대로의 파라미터 이름</li>
 *   <li><strong>defaults:</strong> 기본값을 가진 파라미터와 그 값 (선언 순서 유지, null 값 허용)</li>
 *   <li><strong>varPositional:</strong> 추가 위치 인자를 무제한으로 받는지 여부</li>
 *   <li><strong>varNamed:</strong> 추가 이름 인자를 무제한으로 받는지 여부</li>
 * </ul>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>파라미터 이름은 null 또는 빈 문자열 불가, 중복 불가</li>
 *   <li>기본값은 선언된 파라미터에만 지정 가능</li>
 *   <li>기본값이 없는 파라미터는 기본값이 있는 파라미터 뒤에 올 수 없음</li>
 * </ul>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * // (x, y=10)
 * Signature signature = Signature.builder()
 *     .param("x")
 *     .param("y", 10)
 *     .build();
 *
 * // (filename)
 * Signature single = Signature.of("filename");
 * </pre>
 *
 * @param parameterNames 파라미터 이름 (선언 순서)
 * @param defaults 기본값을 가진 파라미터 이름과 기본값
 * @param varPositional 추가 위치 인자 허용 여부
 * @param varNamed 추가 이름 인자 허용 여부
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public record Signature(
    List<String> parameterNames,
    Map<String, Object> defaults,
    boolean varPositional,
    boolean varNamed
) {

    private static final Signature EMPTY = new Signature(List.of(), Map.of(), false, false);

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 파라미터 이름 또는 기본값 구성이 유효하지 않은 경우
     */
    public Signature {
        if (parameterNames == null) {
            throw new IllegalArgumentException("parameterNames cannot be null");
        }
        if (defaults == null) {
            throw new IllegalArgumentException("defaults cannot be null");
        }

        Set<String> seen = new HashSet<>();
        for (String name : parameterNames) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Parameter name cannot be null or blank");
            }
            if (!seen.add(name)) {
                throw new IllegalArgumentException("Duplicate parameter name: " + name);
            }
        }
        for (String name : defaults.keySet()) {
            if (!seen.contains(name)) {
                throw new IllegalArgumentException("Default given for undeclared parameter: " + name);
            }
        }

        // 기본값은 선언 순서대로 정렬해서 보관
        Map<String, Object> ordered = new LinkedHashMap<>();
        boolean defaultSeen = false;
        for (String name : parameterNames) {
            if (defaults.containsKey(name)) {
                defaultSeen = true;
                ordered.put(name, defaults.get(name));
            } else if (defaultSeen) {
                throw new IllegalArgumentException(
                    "Parameter without default follows parameter with default: " + name
                );
            }
        }

        parameterNames = List.copyOf(parameterNames);
        defaults = Collections.unmodifiableMap(ordered);
    }

    /**
     * 기본값과 가변 인자가 없는 Signature 생성.
     *
     * @param parameterNames 파라미터 이름 (선언 순서)
     * @return Signature 인스턴스
     * @throws IllegalArgumentException 이름이 유효하지 않은 경우
     */
    public static Signature of(String... parameterNames) {
        if (parameterNames == null) {
            throw new IllegalArgumentException("parameterNames cannot be null");
        }
        return new Signature(List.of(parameterNames), Map.of(), false, false);
    }

    /**
     * 파라미터가 없는 Signature.
     *
     * @return 빈 Signature
     */
    public static Signature empty() {
        return EMPTY;
    }

    /**
     * Builder 생성.
     *
     * @return 새 Builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * 가변 인자를 제외한 형식 파라미터 수.
     *
     * @return 파라미터 수
     */
    public int arity() {
        return parameterNames.size();
    }

    /**
     * 기본값을 가진 파라미터 이름 집합 (선언 순서).
     *
     * @return 읽기 전용 이름 집합
     */
    public Set<String> defaulted() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(defaults.keySet()));
    }

    /**
     * 파라미터가 기본값을 가지는지 확인.
     *
     * @param name 파라미터 이름
     * @return 기본값이 있으면 true
     */
    public boolean hasDefault(String name) {
        return defaults.containsKey(name);
    }

    /**
     * 파라미터의 기본값 조회.
     *
     * @param name 파라미터 이름
     * @return 기본값 (null 가능)
     * @throws IllegalArgumentException 기본값이 없는 파라미터인 경우
     */
    public Object defaultValue(String name) {
        if (!defaults.containsKey(name)) {
            throw new IllegalArgumentException("Parameter has no default: " + name);
        }
        return defaults.get(name);
    }

    /**
     * 가변 위치 인자 또는 가변 이름 인자를 받는지 확인.
     *
     * @return 가변 인자를 받으면 true
     */
    public boolean isVariadic() {
        return varPositional || varNamed;
    }

    /**
     * 구조적 동일성 비교.
     *
     * <p>이름, 순서, 기본값을 가진 파라미터 집합, 가변 인자 플래그를 비교합니다.
     * 기본값 자체는 비교하지 않습니다.</p>
     *
     * @param other 비교할 Signature
     * @return 구조가 같으면 true
     */
    public boolean sameShapeAs(Signature other) {
        if (other == null) {
            return false;
        }
        return parameterNames.equals(other.parameterNames)
            && defaults.keySet().equals(other.defaults.keySet())
            && varPositional == other.varPositional
            && varNamed == other.varNamed;
    }

    @Override
    public String toString() {
        StringJoiner joiner = new StringJoiner(", ", "Signature(", ")");
        for (String name : parameterNames) {
            joiner.add(defaults.containsKey(name) ? name + "=" + defaults.get(name) : name);
        }
        if (varPositional) {
            joiner.add("...positional");
        }
        if (varNamed) {
            joiner.add("...named");
        }
        return joiner.toString();
    }

    /**
     * Signature Builder.
     *
     * <p>파라미터를 선언 순서대로 추가합니다.</p>
     */
    public static final class Builder {

        private final List<String> names = new ArrayList<>();
        private final Map<String, Object> defaults = new LinkedHashMap<>();
        private boolean varPositional;
        private boolean varNamed;

        private Builder() {
        }

        /**
         * 기본값 없는 파라미터 추가.
         *
         * @param name 파라미터 이름
         * @return this
         */
        public Builder param(String name) {
            names.add(name);
            return this;
        }

        /**
         * 기본값을 가진 파라미터 추가.
         *
         * @param name 파라미터 이름
         * @param defaultValue 기본값 (null 허용)
         * @return this
         */
        public Builder param(String name, Object defaultValue) {
            names.add(name);
            defaults.put(name, defaultValue);
            return this;
        }

        /**
         * 추가 위치 인자 허용.
         *
         * @return this
         */
        public Builder varPositional() {
            this.varPositional = true;
            return this;
        }

        /**
         * 추가 이름 인자 허용.
         *
         * @return this
         */
        public Builder varNamed() {
            this.varNamed = true;
            return this;
        }

        /**
         * Signature 생성.
         *
         * @return Signature 인스턴스
         * @throws IllegalArgumentException 구성이 유효하지 않은 경우
         */
        public Signature build() {
            return new Signature(names, defaults, varPositional, varNamed);
        }
    }
}
