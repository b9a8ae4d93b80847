/*
 * Licensed to Elasticsearch B.V. under one or more contributor
 * license agreements. See the NOTICE file distributed with
 * this work for additional information regarding copyright
 * ownership. Elasticsearch B.V. licenses this file to you under
 * the Apache License, Version 2.0 (the "License"); you may
 * not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package io.flowtrace.opentracing;

import io.opentracing.Span;
import io.opentracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.io.Closeable;
import java.util.function.BiFunction;

/**
 * Attaches spans to flows which suspend and resume on arbitrary worker threads.
 * <p>
 * The flow an operation belongs to is always looked up through the {@link FlowContextResolver},
 * callers never pass a span or flow handle around.
 * All spans of a process share a single root span named {@value #ROOT_SPAN_NAME}.
 * Below it, every flow gets exactly one flow-level span, which lives from the first traced operation of the flow until {@link #endFlow()}.
 * Named spans created within a flow are children of its flow-level span.
 * </p>
 * <p>
 * When no flow is resumed on the calling thread, all operations are no-ops
 * and {@link #scopedSpan(String, SpanCallback)} just runs the callback.
 * </p>
 */
public class FlowTracer implements Closeable {

    public static final String ROOT_SPAN_NAME = "Execution";

    private static final Logger logger = LoggerFactory.getLogger(FlowTracer.class);

    private final Tracer tracer;
    private final FlowContextResolver flowContextResolver;
    private final SpanRegistry spanRegistry;
    private final Object rootSpanLock = new Object();
    @Nullable
    private volatile Span rootSpan;
    private volatile boolean terminated;

    FlowTracer(Tracer tracer, FlowContextResolver flowContextResolver, SpanRegistry spanRegistry) {
        this.tracer = tracer;
        this.flowContextResolver = flowContextResolver;
        this.spanRegistry = spanRegistry;
    }

    public static FlowTracerBuilder builder() {
        return new FlowTracerBuilder();
    }

    /**
     * Returns the flow-level span of the current flow, starting it (and the root span) on first use.
     *
     * @return the flow-level span or {@code null} if no flow is resumed on the calling thread
     */
    @Nullable
    public Span ensureFlowSpan() {
        final FlowContext flow = currentFlow();
        if (flow == null) {
            return null;
        }
        return getOrCreateFlowSpan(flow);
    }

    /**
     * Invokes {@code function} with the flow-level span and the context of the current flow.
     *
     * @return the result of {@code function} or {@code null} if no flow is resumed on the calling thread
     */
    @Nullable
    public <T> T withFlowSpan(BiFunction<Span, FlowContext, T> function) {
        final FlowContext flow = currentFlow();
        if (flow == null) {
            return null;
        }
        return function.apply(getOrCreateFlowSpan(flow), flow);
    }

    /**
     * Starts a span named {@code name} as child of the current flow-level span.
     * The caller has to finish the returned span.
     *
     * @return the started span or {@code null} if no flow is resumed on the calling thread
     */
    @Nullable
    public Span span(final String name) {
        return withFlowSpan((flowSpan, flow) -> decorate(tracer.buildSpan(name).asChildOf(flowSpan), flow).start());
    }

    /**
     * Runs {@code action} within a span named {@code name}, child of the current flow-level span.
     * <p>
     * The span is finished exactly once, however {@code action} completes.
     * If {@code action} throws, the span is tagged with {@code error=true} and gets an {@code error} event
     * with the message and the exception, which is then rethrown unchanged.
     * If no flow is resumed on the calling thread, {@code action} is invoked with {@code null}.
     * </p>
     *
     * @return the result of {@code action}
     */
    public <T, E extends Exception> T scopedSpan(String name, SpanCallback<T, E> action) throws E {
        final Span span = startScopedSpan(name);
        if (span == null) {
            return action.call(null);
        }
        try {
            return action.call(span);
        } catch (Throwable t) {
            recordError(span, t);
            throw t;
        } finally {
            finish(span);
        }
    }

    /**
     * Finishes the flow-level span of the current flow.
     * Does nothing if the flow has no flow-level span, so it is safe to call it more than once.
     * Flows may still be ended after {@link #terminate()}.
     */
    public void endFlow() {
        final FlowContext flow = flowContextResolver.currentFlow();
        if (flow == null) {
            return;
        }
        final Span span = spanRegistry.remove(flow.getFlowId());
        if (span != null) {
            finish(span);
            logger.debug("Ended flow span of {}", flow.getFlowId());
        }
    }

    /**
     * Finishes the root span, if it has been started.
     * <p>
     * Flow-level spans of flows which did not call {@link #endFlow()} yet are not finished.
     * Afterwards, this tracer does not start new spans anymore.
     * </p>
     */
    public void terminate() {
        synchronized (rootSpanLock) {
            if (terminated) {
                return;
            }
            terminated = true;
            final Span span = rootSpan;
            if (span != null) {
                finish(span);
            }
        }
        final int unfinishedFlows = spanRegistry.size();
        if (unfinishedFlows > 0) {
            logger.warn("Terminating while {} flow span(s) have not been ended", unfinishedFlows);
        }
    }

    /**
     * {@linkplain #terminate() Terminates} this tracer and closes the underlying {@link Tracer}.
     */
    @Override
    public void close() {
        terminate();
        tracer.close();
    }

    public boolean isTerminated() {
        return terminated;
    }

    /**
     * @return the number of flows whose flow-level span has been started but not ended
     */
    public int getActiveFlowSpanCount() {
        return spanRegistry.size();
    }

    public Tracer getTracer() {
        return tracer;
    }

    @Nullable
    private FlowContext currentFlow() {
        if (terminated) {
            return null;
        }
        return flowContextResolver.currentFlow();
    }

    private Span getOrCreateFlowSpan(final FlowContext flow) {
        return spanRegistry.getOrCreate(flow.getFlowId(), flowId -> {
            Span flowSpan = decorate(tracer.buildSpan(flow.getLogic()).asChildOf(getOrCreateRootSpan()), flow).start();
            logger.debug("Started flow span of {}", flowId);
            return flowSpan;
        });
    }

    private Span getOrCreateRootSpan() {
        Span span = rootSpan;
        if (span == null) {
            synchronized (rootSpanLock) {
                span = rootSpan;
                if (span == null) {
                    span = tracer.buildSpan(ROOT_SPAN_NAME).ignoreActiveSpan().start();
                    rootSpan = span;
                    logger.debug("Started root span");
                }
            }
        }
        return span;
    }

    @Nullable
    private Span startScopedSpan(String name) {
        try {
            return span(name);
        } catch (RuntimeException e) {
            logger.warn("Failed to start span " + name + ", continuing without tracing", e);
            return null;
        }
    }

    private static void recordError(Span span, Throwable t) {
        try {
            FlowSpans.error(span, t.getMessage(), t);
        } catch (RuntimeException e) {
            logger.warn("Failed to record error on span " + span, e);
        }
    }

    private static void finish(Span span) {
        try {
            span.finish();
        } catch (RuntimeException e) {
            logger.warn("Failed to finish span " + span, e);
        }
    }

    private static Tracer.SpanBuilder decorate(Tracer.SpanBuilder spanBuilder, FlowContext flow) {
        return spanBuilder
            .withTag(FlowTags.FLOW_ID, flow.getFlowId())
            .withTag(FlowTags.FIBER_ID, flow.getFiberId())
            .withTag(FlowTags.THREAD_ID, flow.getThreadId());
    }
}
