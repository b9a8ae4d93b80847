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
import org.stagemonitor.configuration.ConfigurationOptionProvider;

import javax.annotation.Nullable;

import static io.flowtrace.opentracing.configuration.RangeValidator.min;

/**
 * Settings of the tracing backend.
 * None of them is interpreted by the flow tracer itself, they are handed to the backend as they are.
 */
public class FlowTracerConfiguration extends ConfigurationOptionProvider {

    public static final String SERVICE_NAME = "service_name";
    public static final String ENDPOINT = "endpoint";
    public static final String SAMPLER_TYPE = "sampler_type";
    public static final String SAMPLER_PARAM = "sampler_param";
    public static final String LOG_SPANS = "log_spans";
    public static final String FLUSH_INTERVAL = "flush_interval";
    public static final String REGISTER_GLOBAL_TRACER = "register_global_tracer";
    public static final String CONFIG_FILE = "config_file";

    private static final String FLOW_TRACER_CATEGORY = "Flow Tracer";

    private final ConfigurationOption<String> serviceName = ConfigurationOption.stringOption()
        .key(SERVICE_NAME)
        .configurationCategory(FLOW_TRACER_CATEGORY)
        .label("The name of the traced service")
        .description("All spans are reported under this service name.")
        .buildWithDefault("flow-tracer");

    private final ConfigurationOption<String> endpoint = ConfigurationOption.stringOption()
        .key(ENDPOINT)
        .configurationCategory(FLOW_TRACER_CATEGORY)
        .label("The collector endpoint spans are sent to")
        .description("The URL must be fully qualified, including protocol and port.")
        .buildWithDefault("http://localhost:14268/api/traces");

    private final ConfigurationOption<String> samplerType = ConfigurationOption.stringOption()
        .key(SAMPLER_TYPE)
        .configurationCategory(FLOW_TRACER_CATEGORY)
        .description("The sampler of the backend, for example `const` or `probabilistic`.\n" +
            "\n" +
            "With the default `const` sampler, `sampler_param` 1 records all flows and 0 records none.")
        .buildWithDefault("const");

    private final ConfigurationOption<Double> samplerParam = ConfigurationOption.doubleOption()
        .key(SAMPLER_PARAM)
        .configurationCategory(FLOW_TRACER_CATEGORY)
        .description("The parameter of the sampler configured by `sampler_type`.")
        .addValidator(min(0d))
        .buildWithDefault(1d);

    private final ConfigurationOption<Boolean> logSpans = ConfigurationOption.booleanOption()
        .key(LOG_SPANS)
        .configurationCategory(FLOW_TRACER_CATEGORY)
        .description("Whether the backend logs every reported span.")
        .buildWithDefault(true);

    private final ConfigurationOption<Integer> flushInterval = ConfigurationOption.integerOption()
        .key(FLUSH_INTERVAL)
        .configurationCategory(FLOW_TRACER_CATEGORY)
        .description("The interval in milliseconds in which buffered spans are sent to the `endpoint`.")
        .addValidator(min(0))
        .buildWithDefault(200);

    private final ConfigurationOption<Boolean> registerGlobalTracer = ConfigurationOption.booleanOption()
        .key(REGISTER_GLOBAL_TRACER)
        .configurationCategory(FLOW_TRACER_CATEGORY)
        .description("Registers the backend tracer as OpenTracing `GlobalTracer`, unless another tracer has been registered before.")
        .buildWithDefault(true);

    private final ConfigurationOption<String> configFileLocation = ConfigurationOption.stringOption()
        .key(CONFIG_FILE)
        .configurationCategory(FLOW_TRACER_CATEGORY)
        .description("The path of a properties file which contains the configuration of the flow tracer.\n" +
            "Settings in this file take precedence over all other sources.\n" +
            "\n" +
            "NOTE: This option can only be set with system properties or environment variables.")
        .build();

    public String getServiceName() {
        return serviceName.get();
    }

    public String getEndpoint() {
        return endpoint.get();
    }

    public String getSamplerType() {
        return samplerType.get();
    }

    public double getSamplerParam() {
        return samplerParam.get();
    }

    public boolean isLogSpans() {
        return logSpans.get();
    }

    public int getFlushInterval() {
        return flushInterval.get();
    }

    public boolean isRegisterGlobalTracer() {
        return registerGlobalTracer.get();
    }

    @Nullable
    public String getConfigFileLocation() {
        return configFileLocation.get();
    }
}
