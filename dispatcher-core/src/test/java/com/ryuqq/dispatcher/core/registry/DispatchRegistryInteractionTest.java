package com.ryuqq.dispatcher.core.registry;

import com.ryuqq.dispatcher.core.contract.Arguments;
import com.ryuqq.dispatcher.core.contract.Condition;
import com.ryuqq.dispatcher.core.contract.Handler;
import com.ryuqq.dispatcher.core.error.NoMatchingSignatureException;
import com.ryuqq.dispatcher.core.signature.Signature;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * DispatchRegistry 호출 상호작용 테스트.
 *
 * <p>게이트를 통과하지 못한 엔트리의 Condition은 평가되지 않고,
 * Condition과 Handler의 예외는 그대로 전파되는지 검증합니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class DispatchRegistryInteractionTest {

    private static final Signature X = Signature.of("x");

    @Mock
    private Handler<String> handler;

    @Mock
    private Condition condition;

    @Mock
    private Handler<String> secondHandler;

    @Mock
    private Condition secondCondition;

    @Test
    void invoke_SignatureGateRejects_ConditionNotEvaluated() {
        // Given
        when(handler.signature()).thenReturn(X);
        when(condition.signature()).thenReturn(X);
        DispatchRegistry<String> registry = new DispatchRegistry<>();
        registry.register(handler, condition);

        // When & Then
        assertThrows(NoMatchingSignatureException.class, () -> registry.invoke(1, 2));
        verify(condition, never()).test(any());
        verify(handler, never()).apply(any());
    }

    @Test
    void invoke_ConditionTrue_HandlerReceivesOriginalArguments() {
        // Given
        Arguments arguments = Arguments.of(7);
        when(handler.signature()).thenReturn(X);
        when(condition.signature()).thenReturn(X);
        when(condition.test(arguments)).thenReturn(true);
        when(handler.apply(arguments)).thenReturn("selected");
        DispatchRegistry<String> registry = new DispatchRegistry<>();
        registry.register(handler, condition);

        // When
        String result = registry.invoke(arguments);

        // Then
        assertEquals("selected", result);
        verify(condition, times(1)).test(arguments);
    }

    @Test
    void invoke_FirstConditionTrue_LaterConditionNotEvaluated() {
        // Given
        when(handler.signature()).thenReturn(X);
        when(condition.signature()).thenReturn(X);
        when(condition.test(any())).thenReturn(true);
        when(handler.apply(any())).thenReturn("first");
        when(secondHandler.signature()).thenReturn(X);
        when(secondCondition.signature()).thenReturn(X);
        DispatchRegistry<String> registry = new DispatchRegistry<>();
        registry.register(handler, condition);
        registry.register(secondHandler, secondCondition);

        // When
        String result = registry.invoke(1);

        // Then
        assertEquals("first", result);
        verify(secondCondition, never()).test(any());
        verify(secondHandler, never()).apply(any());
    }

    @Test
    void invoke_ConditionThrows_PropagatesAndHandlerNotCalled() {
        // Given
        IllegalStateException failure = new IllegalStateException("condition failed");
        when(handler.signature()).thenReturn(X);
        when(condition.signature()).thenReturn(X);
        when(condition.test(any())).thenThrow(failure);
        DispatchRegistry<String> registry = new DispatchRegistry<>();
        registry.register(handler, condition);

        // When
        IllegalStateException thrown = assertThrows(IllegalStateException.class, () -> registry.invoke(1));

        // Then
        assertSame(failure, thrown);
        verify(handler, never()).apply(any());
    }
}
