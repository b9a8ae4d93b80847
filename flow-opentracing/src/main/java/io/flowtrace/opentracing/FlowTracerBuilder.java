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

import io.flowtrace.opentracing.configuration.ConfigSources;
import io.flowtrace.opentracing.configuration.FlowTracerConfiguration;
import io.opentracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stagemonitor.configuration.ConfigurationOptionProvider;
import org.stagemonitor.configuration.ConfigurationRegistry;
import org.stagemonitor.configuration.source.ConfigurationSource;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;

public class FlowTracerBuilder {

    private static final Logger logger = LoggerFactory.getLogger(FlowTracerBuilder.class);

    @Nullable
    private ConfigurationRegistry configurationRegistry;
    @Nullable
    private Tracer tracer;
    @Nullable
    private FlowContextResolver flowContextResolver;
    @Nullable
    private SpanRegistry spanRegistry;

    FlowTracerBuilder() {
    }

    public FlowTracerBuilder configurationRegistry(ConfigurationRegistry configurationRegistry) {
        this.configurationRegistry = configurationRegistry;
        return this;
    }

    /**
     * Sets the backend spans are reported to.
     * If not set, a Jaeger tracer is created from the {@link FlowTracerConfiguration}.
     */
    public FlowTracerBuilder tracer(Tracer tracer) {
        this.tracer = tracer;
        return this;
    }

    public FlowTracerBuilder flowContextResolver(FlowContextResolver flowContextResolver) {
        this.flowContextResolver = flowContextResolver;
        return this;
    }

    public FlowTracerBuilder spanRegistry(SpanRegistry spanRegistry) {
        this.spanRegistry = spanRegistry;
        return this;
    }

    public FlowTracer build() {
        if (flowContextResolver == null) {
            throw new IllegalStateException("A FlowContextResolver is required to build a FlowTracer");
        }
        if (tracer == null) {
            if (configurationRegistry == null) {
                configurationRegistry = getDefaultConfigurationRegistry(ConfigSources.getDefaultConfigSources());
            }
            tracer = JaegerTracerFactory.create(configurationRegistry.getConfig(FlowTracerConfiguration.class));
        }
        if (spanRegistry == null) {
            spanRegistry = new ConcurrentSpanRegistry();
        }
        logger.debug("Building flow tracer with {} and {}", tracer, spanRegistry);
        return new FlowTracer(tracer, flowContextResolver, spanRegistry);
    }

    static ConfigurationRegistry getDefaultConfigurationRegistry(List<ConfigurationSource> configSources) {
        List<ConfigurationOptionProvider> providers = new ArrayList<>();
        for (ConfigurationOptionProvider provider : ServiceLoader.load(ConfigurationOptionProvider.class, FlowTracerBuilder.class.getClassLoader())) {
            providers.add(provider);
        }
        return ConfigurationRegistry.builder()
            .configSources(configSources)
            .optionProviders(providers)
            .build();
    }
}
