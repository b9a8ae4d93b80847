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
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;

/**
 * A {@link SpanRegistry} backed by a {@link ConcurrentHashMap}.
 * <p>
 * {@link ConcurrentHashMap#computeIfAbsent} only locks the bin of the key being created,
 * so first creations of different flows proceed in parallel.
 * The create function must not access this registry.
 * </p>
 */
public class ConcurrentSpanRegistry implements SpanRegistry {

    private final ConcurrentMap<String, Span> flowSpans = new ConcurrentHashMap<>();

    @Override
    public Span getOrCreate(String flowId, Function<String, Span> createFunction) {
        final Span span = flowSpans.get(flowId);
        if (span != null) {
            return span;
        }
        return flowSpans.computeIfAbsent(flowId, createFunction);
    }

    @Override
    @Nullable
    public Span remove(String flowId) {
        return flowSpans.remove(flowId);
    }

    @Override
    public int size() {
        return flowSpans.size();
    }

    @Override
    public String toString() {
        return "ConcurrentSpanRegistry" + flowSpans.keySet();
    }
}
