/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.sodam.exception.SodamException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.sodam.exception.SessionStartupException} - Thrown when
 *       required configuration is invalid at startup; aborts the process</li>
 *   <li>{@link com.phillippitts.sodam.exception.TranscriptStoreException} - Thrown when a
 *       transcript write to the side store fails; logged and absorbed by the recorder</li>
 *   <li>{@link com.phillippitts.sodam.exception.NotificationException} - Thrown when a
 *       post-session notification call fails; logged and absorbed per task</li>
 * </ul>
 *
 * <p>Only {@code SessionStartupException} may terminate the process. Everything raised while a
 * session is live is caught at the component that owns the operation.
 *
 * @since 1.0
 */
package com.phillippitts.sodam.exception;
