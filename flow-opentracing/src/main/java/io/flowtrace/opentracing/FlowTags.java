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

import io.opentracing.tag.StringTag;

public class FlowTags {

    /**
     * The id of the flow a span belongs to.
     * Set on flow-level spans and on all named spans within the flow.
     */
    public static final StringTag FLOW_ID = new StringTag("flow-id");

    /**
     * The id of the fiber the flow was resumed on when the span was started
     */
    public static final StringTag FIBER_ID = new StringTag("fiber-id");

    /**
     * The id of the thread the flow was resumed on when the span was started
     */
    public static final StringTag THREAD_ID = new StringTag("thread-id");

    private FlowTags() {
    }
}
