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

import javax.annotation.Nullable;
import java.util.function.Function;

/**
 * Holds the flow-level span of every flow which has started tracing and has not ended yet.
 */
public interface SpanRegistry {

    /**
     * Returns the span registered for the flow or atomically registers the one created by {@code createFunction}.
     * <p>
     * {@code createFunction} is invoked at most once per absent flow id, even if several threads race on the same id.
     * Callers working on different flow ids must not block each other.
     * </p>
     *
     * @param flowId         the id of the flow
     * @param createFunction creates and starts the flow-level span
     * @return the flow-level span
     */
    Span getOrCreate(String flowId, Function<String, Span> createFunction);

    /**
     * Atomically removes the span registered for the flow.
     * The caller is responsible for finishing it.
     *
     * @param flowId the id of the flow
     * @return the removed span or {@code null} if there was none
     */
    @Nullable
    Span remove(String flowId);

    /**
     * @return the number of flows which have a registered span
     */
    int size();
}
