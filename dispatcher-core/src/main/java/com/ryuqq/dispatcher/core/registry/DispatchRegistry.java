package com.ryuqq.dispatcher.core.registry;

import com.ryuqq.dispatcher.core.binding.ArgumentBinder;
import com.ryuqq.dispatcher.core.contract.Arguments;
import com.ryuqq.dispatcher.core.contract.Condition;
import com.ryuqq.dispatcher.core.contract.Handler;
import com.ryuqq.dispatcher.core.error.NoMatchingSignatureException;
import com.ryuqq.dispatcher.core.error.NoSatisfiedConditionException;
import com.ryuqq.dispatcher.core.error.SignatureMismatchException;
import com.ryuqq.dispatcher.core.match.SignatureMatcher;
import com.ryuqq.dispatcher.core.match.TypeConstraint;
import com.ryuqq.dispatcher.core.match.TypeMatcher;
import com.ryuqq.dispatcher.core.signature.Signature;
import com.ryuqq.dispatcher.core.signature.SignatureIntrospector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * 조건부 Dispatch Registry.
 *
 * <p>하나의 다형 호출을 여러 후보 Handler 중 하나로 라우팅합니다.
 * 후보는 호출 형태(인자 수, 이름 인자)와 타입으로 먼저 걸러진 뒤,
 * 각 Handler의 Condition으로 최종 선택됩니다.</p>
 *
 * <p><strong>선택 흐름:</strong></p>
 * <pre>
 * invoke(arguments)
 *   ↓
 * 1. ConditionedEntry를 등록 순서대로 검토
 *    a. SignatureMatcher 통과?
 *    b. types가 있으면 TypeMatcher(ArgumentBinder(arguments), types) 통과?
 *    c. Condition(원본 arguments) == true → Handler(원본 arguments) 실행 후 즉시 반환
 * 2. UnconditionedEntry를 등록 순서대로 검토
 *    a, b 통과 → Handler 실행 후 즉시 반환
 * 3. 선택 실패
 *    - 게이트를 통과한 ConditionedEntry가 없음 → NoMatchingSignatureException
 *    - 게이트는 통과했지만 모든 Condition이 false → NoSatisfiedConditionException
 * </pre>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>UnconditionedEntry는 등록 순서와 무관하게 항상 모든 ConditionedEntry 다음에 검토</li>
 *   <li>각 목록 내에서는 등록 순서가 우선순위 (first-match-wins)</li>
 *   <li>엔트리는 추가만 가능하며 제거나 재정렬은 불가</li>
 *   <li>등록 실패 시 Registry는 변경되지 않음</li>
 * </ul>
 *
 * <p><strong>동시성:</strong> thread-safe하지 않습니다. 모든 등록을 마친 뒤
 * 여러 스레드에서 {@code invoke}만 호출하는 read-mostly 사용을 전제로 합니다.</p>
 *
 * <p><strong>예외 전파:</strong> Condition 또는 선택된 Handler에서 발생한 예외는
 * 감싸지 않고 그대로 호출자에게 전파됩니다.</p>
 *
 * @param <R> Handler 결과 타입
 * @author Dispatcher Team
 * @since 1.0.0
 */
public final class DispatchRegistry<R> {

    private static final Logger log = LoggerFactory.getLogger(DispatchRegistry.class);
    private static final String DEFAULT_NAME = "dispatch";

    private final String name;
    private final List<ConditionedEntry<R>> conditioned = new ArrayList<>();
    private final List<UnconditionedEntry<R>> unconditioned = new ArrayList<>();

    /**
     * 기본 이름으로 빈 Registry 생성.
     */
    public DispatchRegistry() {
        this(DEFAULT_NAME);
    }

    /**
     * 빈 Registry 생성.
     *
     * @param name Dispatch 지점 이름 (로그 및 오류 메시지용)
     * @throws IllegalArgumentException name이 null이거나 빈 문자열인 경우
     */
    public DispatchRegistry(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        this.name = name;
    }

    /**
     * 조건 없는 Handler 등록.
     *
     * @param handler Handler
     * @throws IllegalArgumentException handler가 null인 경우
     * @throws com.ryuqq.dispatcher.core.error.IntrospectionException 시그니처를 알 수 없는 경우
     */
    public void register(Handler<? extends R> handler) {
        register(handler, null, null);
    }

    /**
     * Condition과 함께 Handler 등록.
     *
     * @param handler Handler
     * @param condition Condition (null이면 조건 없는 엔트리)
     * @throws SignatureMismatchException Condition과 Handler의 시그니처가 다른 경우
     */
    public void register(Handler<? extends R> handler, Condition condition) {
        register(handler, condition, null);
    }

    /**
     * 타입 제약과 함께 조건 없는 Handler 등록.
     *
     * @param handler Handler
     * @param types 위치별 타입 제약 (null이면 타입 게이트 없음)
     */
    public void register(Handler<? extends R> handler, List<TypeConstraint> types) {
        register(handler, null, types);
    }

    /**
     * Handler 등록.
     *
     * <p>condition이 null이면 UnconditionedEntry로, 아니면 ConditionedEntry로 추가됩니다.
     * ConditionedEntry는 Handler와 Condition의 시그니처가 구조적으로 같아야 합니다.</p>
     *
     * <p>등록은 원자적입니다. 예외가 발생하면 Registry는 변경되지 않습니다.</p>
     *
     * @param handler Handler
     * @param condition Condition (null 허용)
     * @param types 위치별 타입 제약 (null 허용)
     * @throws IllegalArgumentException handler가 null이거나 types에 null 원소가 있는 경우
     * @throws com.ryuqq.dispatcher.core.error.IntrospectionException 시그니처를 알 수 없는 경우
     * @throws SignatureMismatchException Condition과 Handler의 시그니처가 다른 경우
     */
    public void register(Handler<? extends R> handler, Condition condition, List<TypeConstraint> types) {
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        Signature handlerSignature = SignatureIntrospector.introspect(handler);

        if (condition == null) {
            UnconditionedEntry<R> entry = new UnconditionedEntry<>(handler, handlerSignature, types);
            unconditioned.add(entry);
            log.debug("[{}] Registered unconditioned entry #{}: {} types={}",
                name, unconditioned.size() - 1, handler, entry.types());
            return;
        }

        Signature conditionSignature = SignatureIntrospector.introspect(condition);
        if (!handlerSignature.sameShapeAs(conditionSignature)) {
            log.warn("[{}] Rejected condition {} for handler {}: signature mismatch", name, condition, handler);
            throw new SignatureMismatchException(handlerSignature, conditionSignature);
        }

        ConditionedEntry<R> entry = new ConditionedEntry<>(handler, condition, handlerSignature, types);
        conditioned.add(entry);
        log.debug("[{}] Registered conditioned entry #{}: {} when {} types={}",
            name, conditioned.size() - 1, handler, condition, entry.types());
    }

    /**
     * Condition을 고정한 등록 함수.
     *
     * <p>반환된 함수는 {@code register(handler, condition)}을 수행한 뒤
     * Handler를 그대로 반환하므로 등록과 선언을 한 번에 할 수 있습니다.</p>
     *
     * <pre>
     * Handler&lt;String&gt; positive = registry.registerDecorator(isPositive)
     *     .apply(Handler.of(Signature.of("x"), p -&gt; "positive"));
     * </pre>
     *
     * @param condition Condition
     * @return Handler를 등록하고 그대로 반환하는 함수
     */
    public UnaryOperator<Handler<R>> registerDecorator(Condition condition) {
        return handler -> {
            register(handler, condition);
            return handler;
        };
    }

    /**
     * 위치 인자만으로 호출.
     *
     * <p>varargs 규칙에 따라 배열 하나를 넘기면 원소들이 각각의 위치 인자가 됩니다.
     * 배열 자체를 하나의 인자로 넘기려면
     * {@code invoke(List.of(array), Map.of())}처럼 {@link #invoke(List, Map)}을 사용합니다.</p>
     *
     * @param positional 위치 인자
     * @return 선택된 Handler의 결과
     * @see #invoke(Arguments)
     */
    public R invoke(Object... positional) {
        return invoke(Arguments.of(positional));
    }

    /**
     * 위치 인자와 이름 인자로 호출.
     *
     * @param positional 위치 인자
     * @param named 이름 인자
     * @return 선택된 Handler의 결과
     * @throws IllegalArgumentException 인자가 null인 경우
     * @see #invoke(Arguments)
     */
    public R invoke(List<?> positional, Map<String, ?> named) {
        return invoke(Arguments.of(positional, named));
    }

    /**
     * 호출.
     *
     * @param arguments 원본 호출 인자
     * @return 선택된 Handler의 결과
     * @throws IllegalArgumentException arguments가 null인 경우
     * @throws NoMatchingSignatureException 게이트를 통과하는 엔트리가 없는 경우
     * @throws NoSatisfiedConditionException 게이트는 통과했지만 모든 Condition이 거부한 경우
     * @throws com.ryuqq.dispatcher.core.error.UnsupportedSignatureException 타입 제약이 있는 가변 인자 Handler를 검토한 경우
     */
    public R invoke(Arguments arguments) {
        if (arguments == null) {
            throw new IllegalArgumentException("arguments cannot be null");
        }

        boolean anySignatureMatched = false;

        for (int i = 0; i < conditioned.size(); i++) {
            ConditionedEntry<R> entry = conditioned.get(i);
            if (!gatesPass(entry, arguments)) {
                continue;
            }
            anySignatureMatched = true;
            if (entry.condition().test(arguments)) {
                log.debug("[{}] Selected conditioned entry #{} ({}) for call [{}]",
                    name, i, entry.handler(), arguments.describeShape());
                return entry.handler().apply(arguments);
            }
        }

        for (int i = 0; i < unconditioned.size(); i++) {
            UnconditionedEntry<R> entry = unconditioned.get(i);
            if (gatesPass(entry, arguments)) {
                log.debug("[{}] Selected unconditioned entry #{} ({}) for call [{}]",
                    name, i, entry.handler(), arguments.describeShape());
                return entry.handler().apply(arguments);
            }
        }

        if (anySignatureMatched) {
            log.debug("[{}] No condition satisfied for call [{}]", name, arguments.describeShape());
            throw new NoSatisfiedConditionException(name, arguments);
        }
        log.debug("[{}] No signature matched call [{}]", name, arguments.describeShape());
        throw new NoMatchingSignatureException(name, arguments);
    }

    private boolean gatesPass(RegistryEntry<R> entry, Arguments arguments) {
        if (!SignatureMatcher.matches(entry.signature(), arguments)) {
            return false;
        }
        return !entry.hasTypes()
            || TypeMatcher.matches(ArgumentBinder.bind(entry.signature(), arguments), entry.types());
    }

    public String name() {
        return name;
    }

    /**
     * 전체 엔트리 수.
     *
     * @return ConditionedEntry 수 + UnconditionedEntry 수
     */
    public int size() {
        return conditioned.size() + unconditioned.size();
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    /**
     * ConditionedEntry 스냅샷 (등록 순서).
     *
     * @return 읽기 전용 목록
     */
    public List<ConditionedEntry<R>> conditionedEntries() {
        return List.copyOf(conditioned);
    }

    /**
     * UnconditionedEntry 스냅샷 (등록 순서).
     *
     * @return 읽기 전용 목록
     */
    public List<UnconditionedEntry<R>> unconditionedEntries() {
        return List.copyOf(unconditioned);
    }

    /**
     * 검토 순서대로의 전체 엔트리 스냅샷.
     *
     * @return ConditionedEntry 다음 UnconditionedEntry 순서의 읽기 전용 목록
     */
    public List<RegistryEntry<R>> entries() {
        List<RegistryEntry<R>> all = new ArrayList<>(size());
        all.addAll(conditioned);
        all.addAll(unconditioned);
        return List.copyOf(all);
    }

    @Override
    public String toString() {
        return "DispatchRegistry{name=" + name + ", conditioned=" + conditioned.size()
            + ", unconditioned=" + unconditioned.size() + '}';
    }
}
