/**
 * Immutable domain types shared across the session core.
 */
package com.phillippitts.sodam.domain;
