/**
 * Call contract package.
 *
 * <h2>Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.dispatcher.core.contract.Arguments} - original call (positional + named)</li>
 *   <li>{@link com.ryuqq.dispatcher.core.contract.Parameters} - arguments bound by a callable's own signature</li>
 *   <li>{@link com.ryuqq.dispatcher.core.contract.Handler} - dispatch candidate</li>
 *   <li>{@link com.ryuqq.dispatcher.core.contract.Condition} - acceptance predicate paired with a handler</li>
 * </ul>
 *
 * <p>Handlers and conditions always receive the original {@code Arguments}. The
 * {@code of(...)} factories bind them against the callable's own signature before
 * calling the lambda body.</p>
 *
 * @since 1.0.0
 * @author Dispatcher Team
 */
package com.ryuqq.dispatcher.core.contract;
