/**
 * Session lifecycle: identity resolution, counterpart discovery, per-session wiring and the
 * blocking run loop in {@link com.phillippitts.sodam.service.session.SessionOrchestrator}.
 *
 * @since 1.0
 */
package com.phillippitts.sodam.service.session;
