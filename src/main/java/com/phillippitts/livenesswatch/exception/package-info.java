/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.livenesswatch.exception.LivenessWatchException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.livenesswatch.exception.NotificationException} - Thrown by a channel
 *       transport when its backend rejects or cannot receive a message</li>
 * </ul>
 *
 * <p>All exceptions are unchecked. Watchdog operations never let them escape: channel faults are
 * recovered by the notification router and reported through its boolean result and the logs.
 *
 * @see com.phillippitts.livenesswatch.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.livenesswatch.exception;
