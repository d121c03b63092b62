/**
 * Formal signature model and introspection.
 *
 * <p>{@link com.ryuqq.dispatcher.core.signature.Signature} describes parameter names,
 * defaults and variadic acceptance. {@link com.ryuqq.dispatcher.core.signature.SignatureIntrospector}
 * obtains a signature either from a declared {@link com.ryuqq.dispatcher.core.signature.Signed}
 * callable or from a reflected {@link java.lang.reflect.Method}.</p>
 *
 * <h2>Annotations</h2>
 * <ul>
 *   <li>{@link com.ryuqq.dispatcher.core.signature.Param} - explicit parameter name</li>
 *   <li>{@link com.ryuqq.dispatcher.core.signature.NamedRest} - trailing map collecting extra named arguments</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Dispatcher Team
 */
package com.ryuqq.dispatcher.core.signature;
