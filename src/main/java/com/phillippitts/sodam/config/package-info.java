/**
 * Spring configuration: thread pools, HTTP client wiring and startup validation.
 *
 * <p>Typed properties live in {@code config.properties}; logging helpers in
 * {@code config.logging}.
 */
package com.phillippitts.sodam.config;
