package com.ryuqq.dispatcher.core.match;

import com.ryuqq.dispatcher.core.contract.Arguments;
import com.ryuqq.dispatcher.core.signature.Signature;

import java.util.List;
import java.util.Set;

/**
 * 시그니처 호환성 판정.
 *
 * <p>호출 형태(위치 인자 수, 이름 인자 키 집합)를 형식 시그니처가 받아들일 수 있는지
 * 판정합니다. 값은 보지 않으며 부수 효과가 없습니다.</p>
 *
 * <p><strong>판정 규칙 (순서대로):</strong></p>
 * <ol>
 *   <li>위치 인자 수 &gt; 파라미터 수이고 varPositional이 아니면 → 불일치</li>
 *   <li>위치 인자로 채워지지 않은 파라미터 = remaining</li>
 *   <li>varNamed가 아니면 모든 이름 인자 키가 remaining에 있어야 함</li>
 *   <li>remaining 중 이름 인자로 채워지지 않은 파라미터는 모두 기본값을 가져야 함</li>
 *   <li>그 외 → 일치</li>
 * </ol>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public final class SignatureMatcher {

    // Utility class - prevent instantiation
    private SignatureMatcher() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 원본 인자의 형태로 판정.
     *
     * @param signature 형식 시그니처
     * @param arguments 원본 호출 인자
     * @return 호환되면 true
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public static boolean matches(Signature signature, Arguments arguments) {
        if (arguments == null) {
            throw new IllegalArgumentException("arguments cannot be null");
        }
        return matches(signature, arguments.positionalCount(), arguments.namedKeys());
    }

    /**
     * 호출 형태로 판정.
     *
     * @param signature 형식 시그니처
     * @param positionalCount 위치 인자 수
     * @param namedKeys 이름 인자 키 집합
     * @return 호환되면 true
     * @throws IllegalArgumentException signature 또는 namedKeys가 null이거나 positionalCount가 음수인 경우
     */
    public static boolean matches(Signature signature, int positionalCount, Set<String> namedKeys) {
        if (signature == null) {
            throw new IllegalArgumentException("signature cannot be null");
        }
        if (namedKeys == null) {
            throw new IllegalArgumentException("namedKeys cannot be null");
        }
        if (positionalCount < 0) {
            throw new IllegalArgumentException("positionalCount must be non-negative (current: " + positionalCount + ")");
        }

        List<String> names = signature.parameterNames();
        if (positionalCount > names.size() && !signature.varPositional()) {
            return false;
        }

        List<String> remaining = names.subList(Math.min(positionalCount, names.size()), names.size());

        if (!signature.varNamed()) {
            for (String key : namedKeys) {
                if (!remaining.contains(key)) {
                    return false;
                }
            }
        }

        for (String name : remaining) {
            if (!namedKeys.contains(name) && !signature.hasDefault(name)) {
                return false;
            }
        }
        return true;
    }
}
