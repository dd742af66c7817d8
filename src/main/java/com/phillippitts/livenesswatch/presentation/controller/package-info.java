/**
 * REST API controllers for HTTP endpoints.
 *
 * <p>Current Endpoints:
 * <ul>
 *   <li>{@code POST /api/v1/watchdog/feed} - feed (and arm) the watchdog; optional
 *       {@code timeoutMs} and {@code info}</li>
 *   <li>{@code POST /api/v1/watchdog/stop} - stop a running watchdog; optional {@code info}</li>
 *   <li>{@code GET /api/v1/watchdog} - current watchdog state</li>
 * </ul>
 *
 * <p>Controllers validate request shape only and delegate to the watchdog; errors are mapped by
 * {@code GlobalExceptionHandler}.
 *
 * @see com.phillippitts.livenesswatch.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.livenesswatch.presentation.controller;
