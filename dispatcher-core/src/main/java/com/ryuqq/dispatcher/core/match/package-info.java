/**
 * Dispatch gates.
 *
 * <ul>
 *   <li>{@link com.ryuqq.dispatcher.core.match.SignatureMatcher} - call shape vs formal signature</li>
 *   <li>{@link com.ryuqq.dispatcher.core.match.TypeMatcher} - bound values vs positional {@link com.ryuqq.dispatcher.core.match.TypeConstraint}s</li>
 * </ul>
 *
 * <p>Both gates are pure predicates with no side effects.</p>
 *
 * @since 1.0.0
 * @author Dispatcher Team
 */
package com.ryuqq.dispatcher.core.match;
