package com.ryuqq.dispatcher.core.contract;

import com.ryuqq.dispatcher.core.signature.Signature;
import com.ryuqq.dispatcher.core.signature.Signed;

import java.util.function.Function;

/**
 * Dispatch 후보가 되는 호출 대상.
 *
 * <p>Handler는 자신의 형식 시그니처를 선언하고({@link Signed}),
 * 선택되었을 때 원본 호출 인자로 실행됩니다.</p>
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>시그니처는 정적으로 알 수 있어야 하며 호출마다 바뀌지 않아야 합니다.</li>
 *   <li>Registry는 Handler를 변경하지 않습니다.</li>
 *   <li>Handler에서 발생한 예외는 Registry를 거쳐 호출자에게 그대로 전파됩니다.</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Handler&lt;String&gt; positive = Handler.of(
 *     Signature.of("x"),
 *     p -&gt; "positive: " + p.get("x")
 * );
 * </pre>
 *
 * @param <R> 결과 타입
 * @author Dispatcher Team
 * @since 1.0.0
 */
public interface Handler<R> extends Signed {

    /**
     * 원본 호출 인자로 실행.
     *
     * @param arguments 원본 호출 인자
     * @return 실행 결과
     */
    R apply(Arguments arguments);

    /**
     * 자신의 시그니처로 바인딩된 파라미터를 받는 Handler 생성.
     *
     * @param signature 시그니처 (가변 인자 불가)
     * @param body 실행 본문
     * @param <R> 결과 타입
     * @return Handler
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    static <R> Handler<R> of(Signature signature, Function<Parameters, ? extends R> body) {
        return of("handler", signature, body);
    }

    /**
     * 이름을 가진 Handler 생성 (로그 및 toString용 이름).
     *
     * @param name 이름
     * @param signature 시그니처 (가변 인자 불가)
     * @param body 실행 본문
     * @param <R> 결과 타입
     * @return Handler
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    static <R> Handler<R> of(String name, Signature signature, Function<Parameters, ? extends R> body) {
        if (body == null) {
            throw new IllegalArgumentException("body cannot be null");
        }
        return new FunctionHandler<>(name, signature, arguments -> body.apply(Parameters.bind(signature, arguments)));
    }

    /**
     * 원본 Arguments를 그대로 받는 Handler 생성.
     *
     * <p>가변 인자 시그니처를 쓰려면 이 팩토리를 사용해야 합니다.</p>
     *
     * @param signature 시그니처
     * @param body 실행 본문
     * @param <R> 결과 타입
     * @return Handler
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    static <R> Handler<R> raw(Signature signature, Function<Arguments, ? extends R> body) {
        return new FunctionHandler<>("handler", signature, body);
    }
}
