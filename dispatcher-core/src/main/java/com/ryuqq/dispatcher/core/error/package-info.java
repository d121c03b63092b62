/**
 * Dispatcher exception hierarchy.
 *
 * <h2>Registration-time</h2>
 * <ul>
 *   <li>{@link com.ryuqq.dispatcher.core.error.IntrospectionException} - signature cannot be determined</li>
 *   <li>{@link com.ryuqq.dispatcher.core.error.SignatureMismatchException} - condition and handler signatures differ</li>
 * </ul>
 *
 * <h2>Invocation-time</h2>
 * <ul>
 *   <li>{@link com.ryuqq.dispatcher.core.error.UnsupportedSignatureException} - binding against a variadic signature</li>
 *   <li>{@link com.ryuqq.dispatcher.core.error.ArgumentBindingException} - binding with missing or surplus values</li>
 *   <li>{@link com.ryuqq.dispatcher.core.error.NoMatchingSignatureException} - no entry accepts the call shape</li>
 *   <li>{@link com.ryuqq.dispatcher.core.error.NoSatisfiedConditionException} - shapes matched, every condition rejected</li>
 * </ul>
 *
 * <p>All types are unchecked. Exceptions thrown by a condition or a selected handler are
 * never wrapped.</p>
 *
 * @since 1.0.0
 * @author Dispatcher Team
 */
package com.ryuqq.dispatcher.core.error;
