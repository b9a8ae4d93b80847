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
 * The binding of a flow to the thread it has been resumed on.
 * Closing the scope suspends the flow on that thread.
 */
public class FlowScope implements AutoCloseable {

    private final ThreadLocalFlowContextResolver resolver;
    private final FlowContext flowContext;

    FlowScope(ThreadLocalFlowContextResolver resolver, FlowContext flowContext) {
        this.resolver = resolver;
        this.flowContext = flowContext;
    }

    public FlowContext getFlowContext() {
        return flowContext;
    }

    @Override
    public void close() {
        resolver.suspend(this);
    }

    @Override
    public String toString() {
        return String.format("FlowScope(%s)", flowContext);
    }
}
