/**
 * REST presentation layer: the controller exposing word analysis and the
 * {@code @ControllerAdvice} mapping domain exceptions to HTTP status codes.
 *
 * @since 1.0
 */
package com.phillippitts.wordcomplexity.presentation;
