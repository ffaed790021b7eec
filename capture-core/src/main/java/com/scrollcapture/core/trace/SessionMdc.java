package com.scrollcapture.core.trace;

import org.slf4j.MDC;

/**
 * Bridges the capture session id into MDC for the duration of a single log statement.
 *
 * <p>Tick, sensor and capture-completion callbacks all run on scheduler threads that are
 * shared with other work, so the id is never left behind as a persistent ThreadLocal.
 *
 * <pre>
 *     SessionMdc.withMdc(sessionId, () -&gt; log.info("[CaptureSession] started"));
 * </pre>
 */
public final class SessionMdc {

    public static final String SESSION_ID_KEY = "sessionId";

    private SessionMdc() {}

    /**
     * Runs {@code logAction} with {@code sessionId} in MDC, then removes the entry.
     *
     * @param sessionId the id to bridge; {@code null} is logged as {@code "none"}
     * @param logAction the log statement to execute
     */
    public static void withMdc(String sessionId, Runnable logAction) {
        MDC.put(SESSION_ID_KEY, sessionId != null ? sessionId : "none");
        try {
            logAction.run();
        } finally {
            MDC.remove(SESSION_ID_KEY);
        }
    }
}
