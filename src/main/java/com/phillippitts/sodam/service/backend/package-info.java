/**
 * HTTP access to the ops backend: call lookup during identity resolution and post-session
 * notifications.
 */
package com.phillippitts.sodam.service.backend;
