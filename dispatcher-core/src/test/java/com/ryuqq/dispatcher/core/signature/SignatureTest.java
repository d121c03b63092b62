package com.ryuqq.dispatcher.core.signature;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Signature Record 테스트.
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
class SignatureTest {

    @Test
    void builder_RequiredAndDefaulted_KeepsDeclarationOrder() {
        // When
        Signature signature = Signature.builder()
            .param("x")
            .param("y", 10)
            .param("z", null)
            .build();

        // Then
        assertEquals(List.of("x", "y", "z"), signature.parameterNames());
        assertThat(signature.defaulted()).containsExactly("y", "z");
        assertEquals(10, signature.defaultValue("y"));
        assertNull(signature.defaultValue("z"));
        assertTrue(signature.hasDefault("z"));
        assertFalse(signature.hasDefault("x"));
        assertEquals(3, signature.arity());
        assertFalse(signature.isVariadic());
    }

    @Test
    void of_NamesOnly_HasNoDefaults() {
        // When
        Signature signature = Signature.of("a", "b");

        // Then
        assertThat(signature.defaulted()).isEmpty();
        assertFalse(signature.varPositional());
        assertFalse(signature.varNamed());
    }

    @Test
    void constructor_DuplicateName_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> Signature.of("x", "x")
        );
        assertTrue(exception.getMessage().contains("Duplicate parameter name"));
    }

    @Test
    void constructor_BlankName_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> Signature.of("x", " "));
    }

    @Test
    void constructor_DefaultForUndeclaredParameter_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new Signature(List.of("x"), Map.of("y", 1), false, false)
        );
        assertTrue(exception.getMessage().contains("undeclared parameter: y"));
    }

    @Test
    void constructor_RequiredAfterDefaulted_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> Signature.builder().param("x", 1).param("y").build()
        );
        assertTrue(exception.getMessage().contains("y"));
    }

    @Test
    void defaultValue_NotDefaulted_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> Signature.of("x").defaultValue("x"));
    }

    @Test
    void sameShapeAs_DifferentDefaultValues_IsSameShape() {
        // Given
        Signature handler = Signature.builder().param("x").param("y", 10).build();
        Signature condition = Signature.builder().param("x").param("y", 99).build();

        // When & Then
        assertTrue(handler.sameShapeAs(condition));
        assertNotEquals(handler, condition);
    }

    @Test
    void sameShapeAs_DifferentStructure_IsNotSameShape() {
        // Given
        Signature base = Signature.builder().param("x").param("y", 10).build();

        // When & Then
        assertFalse(base.sameShapeAs(Signature.of("x", "y")));
        assertFalse(base.sameShapeAs(Signature.builder().param("y").param("x", 10).build()));
        assertFalse(base.sameShapeAs(Signature.builder().param("x").param("y", 10).varPositional().build()));
        assertFalse(base.sameShapeAs(Signature.builder().param("x").param("y", 10).varNamed().build()));
        assertFalse(base.sameShapeAs(Signature.of("x")));
        assertFalse(base.sameShapeAs(null));
    }

    @Test
    void toString_ShowsDefaultsAndVariadics() {
        // Given
        Signature signature = Signature.builder().param("x").param("y", 10).varPositional().varNamed().build();

        // When & Then
        assertEquals("Signature(x, y=10, ...positional, ...named)", signature.toString());
    }

    @Test
    void defaulted_IsReadOnly() {
        Signature signature = Signature.builder().param("y", 1).build();
        assertThrows(UnsupportedOperationException.class, () -> signature.defaulted().add("z"));
    }
}
