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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stagemonitor.configuration.source.ConfigurationSource;
import org.stagemonitor.configuration.source.EnvironmentVariableConfigurationSource;
import org.stagemonitor.configuration.source.SimpleSource;
import org.stagemonitor.configuration.source.SystemPropertyConfigurationSource;

import javax.annotation.Nullable;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * Static factory class for configuration sources
 */
public class ConfigSources {

    public static final String SYSTEM_PROPERTY_PREFIX = "flow.tracer.";
    public static final String ENVIRONMENT_VARIABLE_PREFIX = "FLOW_TRACER_";
    public static final String CLASSPATH_PROPERTIES = "flowtracer.properties";

    private static final Logger logger = LoggerFactory.getLogger(ConfigSources.class);

    private ConfigSources() {
    }

    /**
     * Provides the local configuration sources, sorted in decreasing priority (first wins)
     *
     * @return ordered list of configuration sources
     */
    public static List<ConfigurationSource> getDefaultConfigSources() {
        List<ConfigurationSource> result = new ArrayList<>();
        result.add(new PrefixingConfigurationSourceWrapper(new SystemPropertyConfigurationSource(), SYSTEM_PROPERTY_PREFIX));
        result.add(new PrefixingConfigurationSourceWrapper(new EnvironmentVariableConfigurationSource(), ENVIRONMENT_VARIABLE_PREFIX));

        ConfigurationSource configFileSource = fromFileSystem(getConfigFileLocation(result));
        if (configFileSource != null) {
            result.add(0, configFileSource);
        }

        ConfigurationSource classpathSource = fromClasspath(CLASSPATH_PROPERTIES, ConfigSources.class.getClassLoader());
        if (classpathSource != null) {
            result.add(classpathSource);
        }
        return result;
    }

    @Nullable
    static String getConfigFileLocation(List<ConfigurationSource> configSources) {
        for (ConfigurationSource configSource : configSources) {
            String location = configSource.getValue(FlowTracerConfiguration.CONFIG_FILE);
            if (location != null) {
                return location;
            }
        }
        return null;
    }

    @Nullable
    public static ConfigurationSource fromClasspath(String location, ClassLoader classLoader) {
        return buildSimpleSource("classpath:" + location, getPropertiesFromClasspath(location, classLoader));
    }

    @Nullable
    public static ConfigurationSource fromFileSystem(@Nullable String location) {
        if (location == null) {
            return null;
        }
        return buildSimpleSource(location, getPropertiesFromFilesystem(location));
    }

    @Nullable
    private static SimpleSource buildSimpleSource(String name, @Nullable Properties properties) {
        if (properties == null) {
            return null;
        }
        SimpleSource source = new SimpleSource(name);
        for (String key : properties.stringPropertyNames()) {
            source.add(key, properties.getProperty(key));
        }
        return source;
    }

    @Nullable
    private static Properties getPropertiesFromFilesystem(String location) {
        Properties props = new Properties();
        try (InputStream input = new FileInputStream(location)) {
            props.load(input);
            return props;
        } catch (FileNotFoundException ex) {
            logger.warn("Configuration file {} does not exist", location);
        } catch (IOException e) {
            logger.warn("Failed to read configuration file " + location, e);
        }
        return null;
    }

    @Nullable
    private static Properties getPropertiesFromClasspath(String classpathLocation, ClassLoader classLoader) {
        final Properties props = new Properties();
        try (InputStream resourceStream = classLoader.getResourceAsStream(classpathLocation)) {
            if (resourceStream != null) {
                props.load(resourceStream);
                return props;
            }
        } catch (IOException e) {
            logger.warn("Failed to read " + classpathLocation + " from the classpath", e);
        }
        return null;
    }
}
