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

/**
 * Identifies the flow which is currently resumed on a thread,
 * together with the execution details that are recorded as span tags.
 * <p>
 * The flow id is produced by the flow engine and stays the same for the whole lifetime of the flow,
 * while the fiber and thread ids describe where the flow happens to run at the moment it has been resolved.
 * </p>
 */
public final class FlowContext {

    private final String flowId;
    private final String logic;
    private final String fiberId;
    private final String threadId;

    private FlowContext(String flowId, String logic, String fiberId, String threadId) {
        this.flowId = flowId;
        this.logic = logic;
        this.fiberId = fiberId;
        this.threadId = threadId;
    }

    /**
     * @param flowId   the stable, globally unique id of the flow
     * @param logic    a human-readable description of the flow's logic, used as the name of the flow-level span
     * @param fiberId  the id of the fiber or strand the flow is resumed on
     * @param threadId the id of the physical thread the flow is resumed on
     */
    public static FlowContext of(String flowId, String logic, String fiberId, String threadId) {
        if (flowId == null) {
            throw new IllegalArgumentException("flowId must not be null");
        }
        return new FlowContext(flowId, String.valueOf(logic), String.valueOf(fiberId), String.valueOf(threadId));
    }

    public String getFlowId() {
        return flowId;
    }

    public String getLogic() {
        return logic;
    }

    public String getFiberId() {
        return fiberId;
    }

    public String getThreadId() {
        return threadId;
    }

    @Override
    public String toString() {
        return "FlowContext{" +
            "flowId='" + flowId + '\'' +
            ", logic='" + logic + '\'' +
            ", fiberId='" + fiberId + '\'' +
            ", threadId='" + threadId + '\'' +
            '}';
    }
}
