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

import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ThreadLocalFlowContextResolverTest {

    private final ThreadLocalFlowContextResolver resolver = new ThreadLocalFlowContextResolver();

    @Test
    void testNoFlowResumed() {
        assertThat(resolver.currentFlow()).isNull();
    }

    @Test
    void testQueryingLeavesNoStateOnThread() {
        assertThat(resolver.currentFlow()).isNull();
        assertThat(resolver.hasBoundFlows()).isFalse();
    }

    @Test
    void testLastSuspendReleasesThreadState() {
        FlowScope outer = resolver.resume("outer", "OuterFlow", "fiber-1");
        FlowScope inner = resolver.resume("inner", "InnerFlow", "fiber-2");
        assertThat(resolver.hasBoundFlows()).isTrue();

        inner.close();
        assertThat(resolver.hasBoundFlows()).isTrue();

        outer.close();
        assertThat(resolver.hasBoundFlows()).isFalse();
    }

    @Test
    void testResumeAndSuspend() {
        try (FlowScope scope = resolver.resume("flow-1", "PaymentFlow", "fiber-7")) {
            FlowContext flow = resolver.currentFlow();
            assertThat(flow).isNotNull();
            assertThat(flow).isSameAs(scope.getFlowContext());
            assertThat(flow.getFlowId()).isEqualTo("flow-1");
            assertThat(flow.getLogic()).isEqualTo("PaymentFlow");
            assertThat(flow.getFiberId()).isEqualTo("fiber-7");
            assertThat(flow.getThreadId()).isEqualTo(Long.toString(Thread.currentThread().getId()));
        }
        assertThat(resolver.currentFlow()).isNull();
    }

    @Test
    void testNestedScopes() {
        try (FlowScope outer = resolver.resume("outer", "OuterFlow", "fiber-1")) {
            try (FlowScope inner = resolver.resume("inner", "InnerFlow", "fiber-2")) {
                assertThat(resolver.currentFlow().getFlowId()).isEqualTo("inner");
            }
            assertThat(resolver.currentFlow().getFlowId()).isEqualTo("outer");
        }
        assertThat(resolver.currentFlow()).isNull();
    }

    @Test
    void testClosingOuterScopeFirstUnbindsAllFlows() {
        FlowScope outer = resolver.resume("outer", "OuterFlow", "fiber-1");
        FlowScope inner = resolver.resume("inner", "InnerFlow", "fiber-2");

        outer.close();
        assertThat(resolver.currentFlow()).isNull();
        assertThat(resolver.hasBoundFlows()).isFalse();

        inner.close();
        assertThat(resolver.currentFlow()).isNull();
        assertThat(resolver.hasBoundFlows()).isFalse();
    }

    @Test
    void testFlowIsOnlyVisibleOnItsThread() throws Exception {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try (FlowScope scope = resolver.resume("flow-1", "PaymentFlow", "fiber-7")) {
            FlowContext onOtherThread = executor.submit(resolver::currentFlow).get(5, TimeUnit.SECONDS);
            assertThat(onOtherThread).isNull();
        } finally {
            executor.shutdownNow();
        }
    }
}
