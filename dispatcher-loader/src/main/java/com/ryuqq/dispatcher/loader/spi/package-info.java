/**
 * Service provider interfaces of the source loader.
 *
 * <ul>
 *   <li>{@link com.ryuqq.dispatcher.loader.spi.SourceReader} - reads one file or URL</li>
 *   <li>{@link com.ryuqq.dispatcher.loader.spi.LocationResolver} - file checks, directory listing, glob expansion</li>
 *   <li>{@link com.ryuqq.dispatcher.loader.spi.RangeQuery} - locates data of an instrument within a time range</li>
 * </ul>
 *
 * <p>The loader performs no I/O of its own; every implementation is supplied by the caller.</p>
 *
 * @since 1.0.0
 * @author Dispatcher Team
 */
package com.ryuqq.dispatcher.loader.spi;
