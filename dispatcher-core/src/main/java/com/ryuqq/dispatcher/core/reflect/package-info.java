/**
 * Reflection adapter turning {@link java.lang.reflect.Method}s into handlers and conditions.
 *
 * <p>Signatures are introspected once when a
 * {@link com.ryuqq.dispatcher.core.reflect.MethodFunction} is created. Parameter names come from
 * {@link com.ryuqq.dispatcher.core.signature.Param} or from names retained with {@code -parameters}.</p>
 *
 * @since 1.0.0
 * @author Dispatcher Team
 */
package com.ryuqq.dispatcher.core.reflect;
