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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * A {@link FlowContextResolver} which the flow engine drives explicitly:
 * whenever a flow is resumed on a worker thread, the scheduler calls {@link #resume(String, String, String)}
 * and closes the returned {@link FlowScope} when the flow suspends again or completes.
 * <p>
 * Scopes may be nested, the innermost one is the current flow.
 * </p>
 */
public class ThreadLocalFlowContextResolver implements FlowContextResolver {

    private static final Logger logger = LoggerFactory.getLogger(ThreadLocalFlowContextResolver.class);

    private final ThreadLocal<Deque<FlowScope>> activeStack = new ThreadLocal<Deque<FlowScope>>();

    /**
     * Binds a flow to the calling thread.
     *
     * @param flowId  the id of the resumed flow
     * @param logic   description of the flow's logic
     * @param fiberId the id of the fiber the flow runs on
     * @return the scope which has to be closed on the same thread when the flow suspends
     */
    public FlowScope resume(String flowId, String logic, String fiberId) {
        FlowContext flowContext = FlowContext.of(flowId, logic, fiberId, Long.toString(Thread.currentThread().getId()));
        FlowScope scope = new FlowScope(this, flowContext);
        Deque<FlowScope> stack = activeStack.get();
        if (stack == null) {
            stack = new ArrayDeque<FlowScope>();
            activeStack.set(stack);
        }
        stack.push(scope);
        logger.debug("Resumed flow {} on thread {}", flowId, flowContext.getThreadId());
        return scope;
    }

    void suspend(FlowScope scope) {
        FlowScope activeScope = null;
        Deque<FlowScope> stack = activeStack.get();

        if (stack != null && !stack.isEmpty()) {
            activeScope = stack.pop();
        }

        if (scope == activeScope) {
            logger.debug("Suspended flow {}", scope.getFlowContext().getFlowId());
        } else {
            // closing a scope which is not the innermost one - clearing the stack so that no flow stays bound to this thread
            if (stack != null) {
                stack.clear();
            }
            logger.warn("Trying to suspend flow {} which is not the flow resumed on this thread", scope.getFlowContext().getFlowId());
        }
        if (stack != null && stack.isEmpty()) {
            activeStack.remove();
        }
    }

    boolean hasBoundFlows() {
        return activeStack.get() != null;
    }

    @Override
    @Nullable
    public FlowContext currentFlow() {
        Deque<FlowScope> stack = activeStack.get();
        if (stack == null) {
            return null;
        }
        FlowScope scope = stack.peek();
        return scope != null ? scope.getFlowContext() : null;
    }
}
