package com.ryuqq.dispatcher.core.signature;

import com.ryuqq.dispatcher.core.error.IntrospectionException;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Method;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

/**
 * SignatureIntrospector 테스트.
 *
 * <p>선언 경로와 리플렉션 경로를 검증합니다:</p>
 * <ul>
 *   <li>Signed 선언 → 그대로 반환</li>
 *   <li>시그니처를 선언하지 않은 객체 → IntrospectionException</li>
 *   <li>bound 인스턴스 메서드 → 리시버 제외</li>
 *   <li>unbound 인스턴스 메서드 → "self" 포함</li>
 *   <li>가변 인자, NamedRest → 플래그 설정</li>
 * </ul>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
class SignatureIntrospectorTest {

    static class Sample {

        public String instance(@Param("first") String a, @Param("second") int b) {
            return a + b;
        }

        public static String fixed(@Param("value") String value) {
            return value;
        }

        public String spread(@Param("head") String head, String... tail) {
            return head + tail.length;
        }

        public String options(@Param("target") String target, @NamedRest Map<String, Object> options) {
            return target + options;
        }

        public String compilerNames(String filename, int count) {
            return filename + count;
        }

        public String badRest(@Param("target") String target, @NamedRest List<String> options) {
            return target;
        }
    }

    private static Method method(String name) {
        for (Method m : Sample.class.getMethods()) {
            if (m.getName().equals(name)) {
                return m;
            }
        }
        throw new AssertionError("no method " + name);
    }

    @Test
    void introspect_SignedCallable_ReturnsDeclaredSignature() {
        // Given
        Signature declared = Signature.of("x");
        Signed signed = () -> declared;

        // When & Then
        assertSame(declared, SignatureIntrospector.introspect(signed));
    }

    @Test
    void introspect_PlainLambda_ThrowsIntrospectionException() {
        // Given
        Function<Object, Object> opaque = x -> x;

        // When & Then
        assertThatThrownBy(() -> SignatureIntrospector.introspect(opaque))
            .isInstanceOf(IntrospectionException.class)
            .hasMessageContaining("does not declare a signature");
    }

    @Test
    void introspect_Null_ThrowsIntrospectionException() {
        assertThrows(IntrospectionException.class, () -> SignatureIntrospector.introspect((Object) null));
    }

    @Test
    void introspect_SignedReturningNull_ThrowsIntrospectionException() {
        Signed broken = () -> null;
        assertThrows(IntrospectionException.class, () -> SignatureIntrospector.introspect(broken));
    }

    @Test
    void introspect_BoundInstanceMethod_ExcludesReceiver() {
        // When
        Signature signature = SignatureIntrospector.introspect(method("instance"), true);

        // Then
        assertEquals(List.of("first", "second"), signature.parameterNames());
        assertFalse(signature.isVariadic());
    }

    @Test
    void introspect_UnboundInstanceMethod_IncludesReceiverFirst() {
        // When
        Signature signature = SignatureIntrospector.introspect(method("instance"), false);

        // Then
        assertEquals(List.of(SignatureIntrospector.RECEIVER, "first", "second"), signature.parameterNames());
    }

    @Test
    void introspect_StaticMethod_HasNoReceiver() {
        // When
        Signature signature = SignatureIntrospector.introspect(method("fixed"), false);

        // Then
        assertEquals(List.of("value"), signature.parameterNames());
    }

    @Test
    void introspect_StaticMethodBound_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> SignatureIntrospector.introspect(method("fixed"), true));
    }

    @Test
    void introspect_VarArgsMethod_SetsVarPositional() {
        // When
        Signature signature = SignatureIntrospector.introspect(method("spread"), true);

        // Then
        assertEquals(List.of("head"), signature.parameterNames());
        assertTrue(signature.varPositional());
        assertFalse(signature.varNamed());
    }

    @Test
    void introspect_NamedRestMethod_SetsVarNamed() {
        // When
        Signature signature = SignatureIntrospector.introspect(method("options"), true);

        // Then
        assertEquals(List.of("target"), signature.parameterNames());
        assertTrue(signature.varNamed());
        assertFalse(signature.varPositional());
    }

    @Test
    void introspect_NamedRestOnNonMap_ThrowsIntrospectionException() {
        assertThrows(IntrospectionException.class, () -> SignatureIntrospector.introspect(method("badRest"), true));
    }

    @Test
    void introspect_CompilerRetainedNames_AreUsed() {
        // When
        Signature signature = SignatureIntrospector.introspect(method("compilerNames"), true);

        // Then
        assertEquals(List.of("filename", "count"), signature.parameterNames());
    }

    @Test
    void introspect_MethodWithoutRetainedNames_ThrowsIntrospectionException() throws Exception {
        // Given: JDK 클래스는 파라미터 이름을 보존하지 않음
        Method parseInt = Integer.class.getMethod("parseInt", String.class);

        // When & Then
        assertThatThrownBy(() -> SignatureIntrospector.introspect(parseInt, false))
            .isInstanceOf(IntrospectionException.class)
            .hasMessageContaining("-parameters");
    }

    @Test
    void introspect_WithDefaults_MarksDefaulted() {
        // When
        Signature signature = SignatureIntrospector.introspect(method("instance"), true, Map.of("second", 7));

        // Then
        assertThat(signature.defaulted()).containsExactly("second");
        assertEquals(7, signature.defaultValue("second"));
    }

    @Test
    void introspect_DefaultForUnknownParameter_ThrowsIntrospectionException() {
        assertThrows(
            IntrospectionException.class,
            () -> SignatureIntrospector.introspect(method("instance"), true, Map.of("third", 1))
        );
    }

    @Test
    void introspect_DefaultBeforeRequired_ThrowsIntrospectionException() {
        assertThrows(
            IntrospectionException.class,
            () -> SignatureIntrospector.introspect(method("instance"), true, Map.of("first", "a"))
        );
    }
}
