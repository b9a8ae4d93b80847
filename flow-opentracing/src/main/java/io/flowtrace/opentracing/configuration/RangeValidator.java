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
package io.flowtrace.opentracing.configuration;

import org.stagemonitor.configuration.ConfigurationOption;

import javax.annotation.Nullable;

/**
 * Rejects option values below a lower bound.
 * A rejected value is skipped by the {@link org.stagemonitor.configuration.ConfigurationRegistry},
 * which then falls back to the next configuration source or the default.
 */
public class RangeValidator<T extends Comparable<T>> implements ConfigurationOption.Validator<T> {

    private final T min;

    private RangeValidator(T min) {
        this.min = min;
    }

    public static <T extends Comparable<T>> RangeValidator<T> min(T min) {
        return new RangeValidator<>(min);
    }

    @Override
    public void assertValid(@Nullable T value) {
        if (value != null && min.compareTo(value) > 0) {
            throw new IllegalArgumentException(value + " must be greater than or equal to " + min);
        }
    }
}
