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

import io.flowtrace.opentracing.configuration.FlowTracerConfiguration;
import io.jaegertracing.Configuration;
import io.jaegertracing.Configuration.ReporterConfiguration;
import io.jaegertracing.Configuration.SamplerConfiguration;
import io.jaegertracing.Configuration.SenderConfiguration;
import io.opentracing.Tracer;
import io.opentracing.util.GlobalTracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates the Jaeger tracer spans are reported to, when no other {@link Tracer} has been provided to the {@link FlowTracerBuilder}.
 */
class JaegerTracerFactory {

    private static final Logger logger = LoggerFactory.getLogger(JaegerTracerFactory.class);

    private JaegerTracerFactory() {
    }

    static Tracer create(FlowTracerConfiguration config) {
        SamplerConfiguration sampler = SamplerConfiguration.fromEnv()
            .withType(config.getSamplerType())
            .withParam(config.getSamplerParam());
        SenderConfiguration sender = SenderConfiguration.fromEnv()
            .withEndpoint(config.getEndpoint());
        ReporterConfiguration reporter = ReporterConfiguration.fromEnv()
            .withSender(sender)
            .withLogSpans(config.isLogSpans())
            .withFlushInterval(config.getFlushInterval());
        Tracer tracer = new Configuration(config.getServiceName())
            .withSampler(sampler)
            .withReporter(reporter)
            .getTracer();
        logger.info("Reporting spans of service {} to {}", config.getServiceName(), config.getEndpoint());

        if (config.isRegisterGlobalTracer() && !GlobalTracer.registerIfAbsent(tracer)) {
            logger.info("Not registering the flow tracer as GlobalTracer as another tracer has already been registered");
        }
        return tracer;
    }
}
