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
import io.opentracing.log.Fields;
import io.opentracing.tag.Tags;

import javax.annotation.Nullable;
import java.util.HashMap;
import java.util.Map;

/**
 * Helpers for annotating spans which may be absent, for example the span passed to a {@link SpanCallback}
 * while no flow is being traced.
 */
public final class FlowSpans {

    static final String ERROR_EVENT = "error";

    private FlowSpans() {
    }

    /**
     * Sets the string representation of {@code value} as tag, does nothing if {@code span} is {@code null}.
     */
    public static void tag(@Nullable Span span, String key, @Nullable Object value) {
        if (span != null) {
            span.setTag(key, value != null ? value.toString() : null);
        }
    }

    /**
     * Marks the span as erroneous and logs an {@code error} event, does nothing if {@code span} is {@code null}.
     *
     * @param span      the span to annotate
     * @param message   the message of the event
     * @param throwable the error object of the event, if any
     */
    public static void error(@Nullable Span span, @Nullable String message, @Nullable Throwable throwable) {
        if (span == null) {
            return;
        }
        Tags.ERROR.set(span, true);
        // the log map may contain a null message
        Map<String, Object> fields = new HashMap<>();
        fields.put(Fields.EVENT, ERROR_EVENT);
        fields.put(Fields.MESSAGE, message);
        if (throwable != null) {
            fields.put(Fields.ERROR_OBJECT, throwable);
        }
        span.log(fields);
    }

    public static void error(@Nullable Span span, String message) {
        error(span, message, null);
    }
}
