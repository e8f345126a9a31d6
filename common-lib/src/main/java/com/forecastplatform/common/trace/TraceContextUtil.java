package com.forecastplatform.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

/**
 * Carries the generation session id through reactive pipelines.
 *
 * <p>The Reactor Context is the source of truth for {@code sessionId}. MDC is written only
 * around a single log call and cleared straight after, so pooled threads never leak
 * one session's id into another session's log lines.
 *
 * <pre>
 *     return TraceContextUtil.withSessionId(pipeline, session.id());
 * </pre>
 */
public final class TraceContextUtil {

    public static final String SESSION_ID_KEY = "sessionId";
    public static final String UNKNOWN        = "unknown";

    private TraceContextUtil() {}

    public static <T> Mono<T> withSessionId(Mono<T> mono, String sessionId) {
        return mono.contextWrite(ctx -> ctx.put(SESSION_ID_KEY, sessionId));
    }

    /** Session id from the Reactor Context, or {@value #UNKNOWN}; never {@code null}. */
    public static String getSessionId(ContextView ctx) {
        return ctx.getOrDefault(SESSION_ID_KEY, UNKNOWN);
    }

    /** Runs {@code logAction} with {@code sessionId} bridged into MDC, then removes it. */
    public static void withMdc(String sessionId, Runnable logAction) {
        MDC.put(SESSION_ID_KEY, sessionId);
        try {
            logAction.run();
        } finally {
            MDC.remove(SESSION_ID_KEY);
        }
    }
}
