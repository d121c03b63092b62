/**
 * Conditional dispatch registry.
 *
 * <p>{@link com.ryuqq.dispatcher.core.registry.DispatchRegistry} holds conditioned entries and
 * unconditioned (catch-all) entries in two append-only lists and selects the first entry whose
 * gates pass and whose condition accepts the call.</p>
 *
 * <h2>Selection Order</h2>
 * <pre>
 * conditioned[0..n]   (signature gate → type gate → condition)
 * unconditioned[0..m] (signature gate → type gate)
 * </pre>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * DispatchRegistry<String> registry = new DispatchRegistry<>("sign");
 * registry.register(
 *     Handler.of(Signature.of("x"), p -> "positive"),
 *     Condition.of(Signature.of("x"), p -> p.get("x", Integer.class) > 0),
 *     TypeConstraint.instancesOf(Integer.class)
 * );
 * registry.register(Handler.of(Signature.of("x"), p -> "other"));
 *
 * registry.invoke(5);   // "positive"
 * registry.invoke(-1);  // "other"
 * }</pre>
 *
 * @since 1.0.0
 * @author Dispatcher Team
 */
package com.ryuqq.dispatcher.core.registry;
