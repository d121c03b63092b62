package com.ryuqq.dispatcher.core.contract;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 실제 호출 인자.
 *
 * <p>Arguments는 바인딩 전의 원본 호출을 그대로 표현합니다:</p>
 * <ul>
 *   <li><strong>positional:</strong> 순서가 있는 위치 인자 목록</li>
 *   <li><strong>named:</strong> 이름 인자 (입력 순서 유지, 키 중복 불가)</li>
 * </ul>
 *
 * <p>Condition과 선택된 Handler는 모두 이 원본 인자를 받습니다.
 * 값으로 null을 허용합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * // f(5)
 * Arguments a = Arguments.of(5);
 *
 * // f(1, y=2)
 * Arguments b = Arguments.builder().add(1).put("y", 2).build();
 * </pre>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public final class Arguments {

    private static final Arguments EMPTY = new Arguments(List.of(), Map.of());

    private final List<Object> positional;
    private final Map<String, Object> named;

    private Arguments(List<Object> positional, Map<String, Object> named) {
        this.positional = positional;
        this.named = named;
    }

    /**
     * 위치 인자만으로 Arguments 생성.
     *
     * @param positional 위치 인자 (null 원소 허용)
     * @return Arguments 인스턴스
     * @throws IllegalArgumentException 배열이 null인 경우
     */
    public static Arguments of(Object... positional) {
        if (positional == null) {
            throw new IllegalArgumentException("positional cannot be null");
        }
        if (positional.length == 0) {
            return EMPTY;
        }
        return new Arguments(Collections.unmodifiableList(new ArrayList<>(Arrays.asList(positional))), Map.of());
    }

    /**
     * 위치 인자와 이름 인자로 Arguments 생성.
     *
     * @param positional 위치 인자
     * @param named 이름 인자
     * @return Arguments 인스턴스
     * @throws IllegalArgumentException 인자가 null이거나 이름이 null 또는 빈 문자열인 경우
     */
    public static Arguments of(List<?> positional, Map<String, ?> named) {
        if (positional == null) {
            throw new IllegalArgumentException("positional cannot be null");
        }
        if (named == null) {
            throw new IllegalArgumentException("named cannot be null");
        }
        Builder builder = builder();
        positional.forEach(builder::add);
        named.forEach(builder::put);
        return builder.build();
    }

    /**
     * 빈 Arguments.
     *
     * @return 인자가 없는 Arguments
     */
    public static Arguments empty() {
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
     * 위치 인자 목록 조회.
     *
     * @return 읽기 전용 목록
     */
    public List<Object> positional() {
        return positional;
    }

    /**
     * 이름 인자 조회.
     *
     * @return 읽기 전용 Map (입력 순서)
     */
    public Map<String, Object> named() {
        return named;
    }

    public int positionalCount() {
        return positional.size();
    }

    public Set<String> namedKeys() {
        return named.keySet();
    }

    /**
     * 위치 인자 조회.
     *
     * @param index 인덱스
     * @return 값 (null 가능)
     * @throws IndexOutOfBoundsException 범위를 벗어난 경우
     */
    public Object positional(int index) {
        return positional.get(index);
    }

    public boolean hasNamed(String name) {
        return named.containsKey(name);
    }

    /**
     * 이름 인자 조회.
     *
     * @param name 이름
     * @return 값 (없거나 null이면 null)
     */
    public Object named(String name) {
        return named.get(name);
    }

    /**
     * 호출 형태 요약 (오류 메시지 및 로그용).
     *
     * <p>값은 포함하지 않습니다.</p>
     *
     * @return 예: {@code "2 positional, named [x, y]"}
     */
    public String describeShape() {
        return positional.size() + " positional, named " + named.keySet();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Arguments that = (Arguments) o;
        return positional.equals(that.positional) && named.equals(that.named);
    }

    @Override
    public int hashCode() {
        return Objects.hash(positional, named);
    }

    @Override
    public String toString() {
        return "Arguments{positional=" + positional + ", named=" + named + '}';
    }

    /**
     * Arguments Builder.
     */
    public static final class Builder {

        private final List<Object> positional = new ArrayList<>();
        private final Map<String, Object> named = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * 위치 인자 추가.
         *
         * @param value 값 (null 허용)
         * @return this
         */
        public Builder add(Object value) {
            positional.add(value);
            return this;
        }

        /**
         * 이름 인자 추가.
         *
         * @param name 이름
         * @param value 값 (null 허용)
         * @return this
         * @throws IllegalArgumentException 이름이 null, 빈 문자열이거나 이미 지정된 경우
         */
        public Builder put(String name, Object value) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Named argument key cannot be null or blank");
            }
            if (named.containsKey(name)) {
                throw new IllegalArgumentException("Duplicate named argument: " + name);
            }
            named.put(name, value);
            return this;
        }

        /**
         * Arguments 생성.
         *
         * @return Arguments 인스턴스
         */
        public Arguments build() {
            if (positional.isEmpty() && named.isEmpty()) {
                return EMPTY;
            }
            return new Arguments(
                Collections.unmodifiableList(new ArrayList<>(positional)),
                Collections.unmodifiableMap(new LinkedHashMap<>(named))
            );
        }
    }
}
