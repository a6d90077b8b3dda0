/**
 * Boundary to the real-time room transport: snapshot queries, event subscription, data
 * messages, and lenient parsing of room metadata.
 */
package com.phillippitts.sodam.service.room;
