/**
 * Work performed once a session ends.
 *
 * <p>{@link com.phillippitts.sodam.service.postsession.PostSessionCoordinator} fans the
 * {@link com.phillippitts.sodam.service.postsession.PostSessionTask} beans out on the
 * notification executor under one overall timeout and then fires a one-shot completion signal.
 * The task set is the call-ended report, the call-analysis trigger and the RAG indexing trigger.
 *
 * @since 1.0
 */
package com.phillippitts.sodam.service.postsession;
