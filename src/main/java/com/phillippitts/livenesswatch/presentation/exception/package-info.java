/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@code MethodArgumentNotValidException} → 400 Bad Request (e.g. negative {@code timeoutMs})</li>
 *   <li>{@code HttpMessageNotReadableException} → 400 Bad Request (malformed JSON)</li>
 *   <li>{@code IllegalArgumentException} → 400 Bad Request</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "errorCode": "MethodArgumentNotValidException",
 *   "message": "Invalid watchdog parameters",
 *   "details": "timeoutMs: timeoutMs must not be negative",
 *   "timestamp": "2025-10-17T15:42:32.529Z"
 * }
 * </pre>
 *
 * @since 1.0
 */
package com.phillippitts.livenesswatch.presentation.exception;
