package com.flowgraph.engine.logging;

import com.flowgraph.core.model.DefinitionId;
import com.flowgraph.core.model.SubjectRef;
import org.slf4j.MDC;
import java.util.UUID;

/**
 * MDC (Mapped Diagnostic Context) helper for structured logging.
 * Every log line written inside an engine operation carries the instance,
 * definition, subject and actor it concerns.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forInstance(instanceId)) {
 *     ctx.actor("nurse-7");
 *     log.info("Committed transition"); // includes instanceId, actor, traceId
 * }
 * </pre>
 *
 * Log output with MDC:
 * 2024-01-15 10:30:45.123 [http-1] INFO  c.f.e.c.TransitionEngine - Committed transition
 *   instanceId=9b1f... definitionId=repair-job:2 subjectKind=order subjectId=456 actor=nurse-7
 */
public final class LoggingContext implements AutoCloseable {

    public static final String INSTANCE_ID = "instanceId";
    public static final String DEFINITION_ID = "definitionId";
    public static final String SUBJECT_KIND = "subjectKind";
    public static final String SUBJECT_ID = "subjectId";
    public static final String ACTOR = "actor";
    public static final String TRACE_ID = "traceId";

    private LoggingContext() {
    }

    /**
     * Create a logging context for operations on one instance.
     */
    public static LoggingContext forInstance(UUID instanceId) {
        LoggingContext ctx = new LoggingContext();
        ctx.instance(instanceId);
        ensureTraceId();
        return ctx;
    }

    /**
     * Create a logging context for operations addressed by definition key or id.
     */
    public static LoggingContext forDefinition(String keyOrId) {
        LoggingContext ctx = new LoggingContext();
        putIfPresent(DEFINITION_ID, keyOrId);
        ensureTraceId();
        return ctx;
    }

    public LoggingContext instance(UUID instanceId) {
        if (instanceId != null) {
            MDC.put(INSTANCE_ID, instanceId.toString());
        }
        return this;
    }

    public LoggingContext definition(DefinitionId definitionId) {
        if (definitionId != null) {
            MDC.put(DEFINITION_ID, definitionId.toString());
        }
        return this;
    }

    public LoggingContext subject(SubjectRef subject) {
        if (subject != null) {
            MDC.put(SUBJECT_KIND, subject.kind());
            MDC.put(SUBJECT_ID, subject.id());
        }
        return this;
    }

    public LoggingContext actor(String actor) {
        putIfPresent(ACTOR, actor);
        return this;
    }

    public static String getInstanceId() {
        return MDC.get(INSTANCE_ID);
    }

    public static String getTraceId() {
        return MDC.get(TRACE_ID);
    }

    private static void putIfPresent(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        }
    }

    /**
     * Ensure a trace ID exists in the context.
     */
    private static void ensureTraceId() {
        if (MDC.get(TRACE_ID) == null) {
            MDC.put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
        }
    }

    @Override
    public void close() {
        MDC.remove(INSTANCE_ID);
        MDC.remove(DEFINITION_ID);
        MDC.remove(SUBJECT_KIND);
        MDC.remove(SUBJECT_ID);
        MDC.remove(ACTOR);
        // Keep TRACE_ID for request-scoped tracing
    }

    /**
     * Clear all MDC context. Call at the end of a request.
     */
    public static void clearAll() {
        MDC.clear();
    }
}
