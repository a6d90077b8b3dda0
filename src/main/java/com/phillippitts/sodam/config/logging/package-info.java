/**
 * Logging configuration helpers.
 *
 * <p>Contains {@link com.phillippitts.sodam.config.logging.SessionMdc}, which populates
 * Log4j2's ThreadContext with session identifiers and propagates them to executor threads.
 */
package com.phillippitts.sodam.config.logging;
