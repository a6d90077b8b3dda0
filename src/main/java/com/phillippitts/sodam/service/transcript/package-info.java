/**
 * Per-session transcript capture.
 *
 * <p>{@link com.phillippitts.sodam.service.transcript.TranscriptRecorder} keeps a bounded,
 * ordered in-memory transcript and mirrors it to a shared
 * {@link com.phillippitts.sodam.service.transcript.TranscriptStore} (Redis or no-op) and to the
 * room for live display. Mirroring is best-effort and never fails a session.
 *
 * @since 1.0
 */
package com.phillippitts.sodam.service.transcript;
