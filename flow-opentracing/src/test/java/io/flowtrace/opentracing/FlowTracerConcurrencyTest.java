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
import io.opentracing.mock.MockSpan;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class FlowTracerConcurrencyTest {

    private static final int FLOWS = 64;
    private static final int STEPS_PER_FLOW = 5;
    private static final int THREADS = 8;

    private CountingMockTracer mockTracer;
    private ThreadLocalFlowContextResolver resolver;
    private FlowTracer flowTracer;
    private ExecutorService executorService;

    @BeforeEach
    void setUp() {
        mockTracer = new CountingMockTracer();
        resolver = new ThreadLocalFlowContextResolver();
        flowTracer = FlowTracer.builder()
            .tracer(mockTracer)
            .flowContextResolver(resolver)
            .build();
        executorService = Executors.newFixedThreadPool(THREADS);
    }

    @AfterEach
    void tearDown() throws Exception {
        executorService.shutdownNow();
        assertThat(executorService.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        mockTracer.assertNoSpanFinishedTwice();
    }

    @Test
    void testConcurrentFlowsShareOneRootSpan() throws Exception {
        final CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int flow = 0; flow < FLOWS; flow++) {
            final String flowId = "flow-" + flow;
            // every step is a separate resumption, potentially on another worker thread
            for (int step = 0; step < STEPS_PER_FLOW; step++) {
                final String stepName = flowId + "-step-" + step;
                futures.add(executorService.submit(() -> {
                    start.await();
                    try (FlowScope scope = resolver.resume(flowId, logicOf(flowId), "fiber-" + flowId)) {
                        return flowTracer.scopedSpan(stepName, span -> span);
                    }
                }));
            }
        }
        start.countDown();
        for (Future<?> future : futures) {
            assertThat(future.get(10, TimeUnit.SECONDS)).isNotNull();
        }

        assertThat(mockTracer.getBuildCount(FlowTracer.ROOT_SPAN_NAME)).isEqualTo(1);
        assertThat(flowTracer.getActiveFlowSpanCount()).isEqualTo(FLOWS);
        for (int flow = 0; flow < FLOWS; flow++) {
            assertThat(mockTracer.getBuildCount(logicOf("flow-" + flow))).isEqualTo(1);
        }

        for (int flow = 0; flow < FLOWS; flow++) {
            String flowId = "flow-" + flow;
            try (FlowScope scope = resolver.resume(flowId, logicOf(flowId), "fiber-" + flowId)) {
                flowTracer.endFlow();
            }
        }
        flowTracer.terminate();

        MockSpan root = mockTracer.getFinishedSpan(FlowTracer.ROOT_SPAN_NAME);
        for (int flow = 0; flow < FLOWS; flow++) {
            String flowId = "flow-" + flow;
            MockSpan flowSpan = mockTracer.getFinishedSpan(logicOf(flowId));
            assertThat(flowSpan.parentId()).isEqualTo(root.context().spanId());
            assertThat(flowSpan.tags()).containsEntry(FlowTags.FLOW_ID.getKey(), flowId);
            for (int step = 0; step < STEPS_PER_FLOW; step++) {
                MockSpan stepSpan = mockTracer.getFinishedSpan(flowId + "-step-" + step);
                assertThat(stepSpan.parentId()).isEqualTo(flowSpan.context().spanId());
                assertThat(stepSpan.tags()).containsEntry(FlowTags.FLOW_ID.getKey(), flowId);
            }
        }
        assertThat(mockTracer.finishedSpans()).hasSize(1 + FLOWS + FLOWS * STEPS_PER_FLOW);
    }

    @Test
    void testTwoFlowsOnTwoThreads() throws Exception {
        final CountDownLatch start = new CountDownLatch(1);
        Future<?> first = executorService.submit(() -> runFlow(start, "F1"));
        Future<?> second = executorService.submit(() -> runFlow(start, "F2"));
        start.countDown();
        first.get(10, TimeUnit.SECONDS);
        second.get(10, TimeUnit.SECONDS);

        assertThat(mockTracer.getBuildCount(FlowTracer.ROOT_SPAN_NAME)).isEqualTo(1);
        // the root span is still open, so it is not among the finished spans yet
        MockSpan f1 = mockTracer.getFinishedSpan(logicOf("F1"));
        MockSpan f2 = mockTracer.getFinishedSpan(logicOf("F2"));
        assertThat(f1).isNotSameAs(f2);
        assertThat(f1.context().spanId()).isNotEqualTo(f2.context().spanId());
        assertThat(f1.parentId()).isEqualTo(f2.parentId()).isNotZero();

        flowTracer.terminate();
        assertThat(mockTracer.getFinishedSpan(FlowTracer.ROOT_SPAN_NAME).context().spanId()).isEqualTo(f1.parentId());
    }

    @Test
    void testRacingResumptionsOfTheSameFlow() throws Exception {
        final CountDownLatch start = new CountDownLatch(1);
        List<Future<Span>> futures = new ArrayList<>();
        for (int i = 0; i < THREADS * 4; i++) {
            futures.add(executorService.submit(() -> {
                start.await();
                try (FlowScope scope = resolver.resume("racing-flow", "RacingFlow", "fiber-racing")) {
                    return flowTracer.ensureFlowSpan();
                }
            }));
        }
        start.countDown();

        Set<Span> flowSpans = new HashSet<>();
        for (Future<Span> future : futures) {
            flowSpans.add(future.get(10, TimeUnit.SECONDS));
        }
        assertThat(flowSpans).hasSize(1);
        assertThat(mockTracer.getBuildCount("RacingFlow")).isEqualTo(1);
        assertThat(mockTracer.getBuildCount(FlowTracer.ROOT_SPAN_NAME)).isEqualTo(1);
    }

    private Void runFlow(CountDownLatch start, String flowId) throws InterruptedException {
        start.await();
        try (FlowScope scope = resolver.resume(flowId, logicOf(flowId), "fiber-" + flowId)) {
            flowTracer.scopedSpan("stepA", span -> "ok");
            flowTracer.endFlow();
        }
        return null;
    }

    private static String logicOf(String flowId) {
        return "Logic(" + flowId + ")";
    }
}
