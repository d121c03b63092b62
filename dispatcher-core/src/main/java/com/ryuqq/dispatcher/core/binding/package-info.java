/**
 * Argument binding: turns an original call into the ordered value list of a signature.
 *
 * @since 1.0.0
 * @author Dispatcher Team
 */
package com.ryuqq.dispatcher.core.binding;
