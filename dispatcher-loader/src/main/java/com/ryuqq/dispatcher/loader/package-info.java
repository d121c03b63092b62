/**
 * Data-loading façade built on the conditional dispatch registry.
 *
 * <p>{@link com.ryuqq.dispatcher.loader.SourceLoader} routes a caller-supplied value (file path,
 * directory, glob pattern, list of paths, URL, or instrument with a time range) to the loader
 * whose condition matches the value's shape. Every loader is a reflected
 * {@link com.ryuqq.dispatcher.core.reflect.MethodFunction} bound to the façade.</p>
 *
 * <h2>Configuration</h2>
 * <ul>
 *   <li>{@link com.ryuqq.dispatcher.loader.LoaderConfig} - wildcard marker and result ordering</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Dispatcher Team
 */
package com.ryuqq.dispatcher.loader;
