/*
 * Copyright (c) 2014-2022 Dell Inc. or its subsidiaries. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.emc.ecs.bulkimport.config;

import com.emc.ecs.bulkimport.config.annotation.Documentation;
import com.emc.ecs.bulkimport.config.annotation.Label;
import com.emc.ecs.bulkimport.config.annotation.Option;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Options;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.BeanWrapper;
import org.springframework.beans.PropertyAccessorFactory;
import org.springframework.beans.TypeMismatchException;

import java.beans.BeanInfo;
import java.beans.IntrospectionException;
import java.beans.Introspector;
import java.beans.PropertyDescriptor;
import java.lang.reflect.InvocationTargetException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ConfigWrapper<C> {
    private static final Logger log = LoggerFactory.getLogger(ConfigWrapper.class);

    public static final String SENSITIVE_MASK = "******";

    public static String toString(Object value) {
        if (value == null) {
            return null;
        } else if (value instanceof int[]) {
            return Arrays.toString((int[]) value);
        } else if (value instanceof long[]) {
            return Arrays.toString((long[]) value);
        } else if (value instanceof Object[]) {
            return Arrays.toString((Object[]) value);
        } else {
            return value.toString();
        }
    }

    private final Class<C> targetClass;
    private String label;
    private String documentation;
    private final Map<String, ConfigPropertyWrapper> propertyMap = new LinkedHashMap<>();

    public ConfigWrapper(Class<C> targetClass) {
        try {
            this.targetClass = targetClass;
            if (targetClass.isAnnotationPresent(Label.class))
                this.label = targetClass.getAnnotation(Label.class).value();
            if (targetClass.isAnnotationPresent(Documentation.class))
                this.documentation = targetClass.getAnnotation(Documentation.class).value();
            BeanInfo beanInfo = Introspector.getBeanInfo(targetClass);
            List<ConfigPropertyWrapper> properties = new ArrayList<>();
            for (PropertyDescriptor descriptor : beanInfo.getPropertyDescriptors()) {
                if (descriptor.getReadMethod() != null && descriptor.getReadMethod().isAnnotationPresent(Option.class)) {
                    properties.add(new ConfigPropertyWrapper(descriptor));
                }
            }
            // keep help text and summaries in a stable, author-defined order
            properties.sort(Comparator.comparingInt(ConfigPropertyWrapper::getOrderIndex)
                    .thenComparing(ConfigPropertyWrapper::getName));
            for (ConfigPropertyWrapper property : properties) {
                propertyMap.put(property.getName(), property);
            }
            if (propertyMap.isEmpty()) log.info("no @Option annotations found in {}", targetClass.getSimpleName());
        } catch (IntrospectionException e) {
            throw new RuntimeException(e);
        }
    }

    public Options getOptions() {
        Options options = new Options();
        for (String name : propertyNames()) {
            options.addOption(getPropertyWrapper(name).getCliOption());
        }
        return options;
    }

    /**
     * @param advanced whether to return the advanced options or the everyday ones
     */
    public Options getOptions(boolean advanced) {
        Options options = new Options();
        for (String name : propertyNames()) {
            ConfigPropertyWrapper propertyWrapper = getPropertyWrapper(name);
            if (propertyWrapper.isAdvanced() == advanced) options.addOption(propertyWrapper.getCliOption());
        }
        return options;
    }

    public C parse(CommandLine commandLine) {
        try {
            C object = getTargetClass().getDeclaredConstructor().newInstance();
            BeanWrapper beanWrapper = PropertyAccessorFactory.forBeanPropertyAccess(object);

            for (String name : propertyNames()) {
                ConfigPropertyWrapper propertyWrapper = getPropertyWrapper(name);

                org.apache.commons.cli.Option option = propertyWrapper.getCliOption();

                if (commandLine.hasOption(option.getLongOpt())) {

                    Object value = commandLine.getOptionValue(option.getLongOpt());
                    if (propertyWrapper.getDescriptor().getPropertyType().isArray())
                        value = commandLine.getOptionValues(option.getLongOpt());

                    if (Boolean.class == propertyWrapper.getDescriptor().getPropertyType()
                            || "boolean".equals(propertyWrapper.getDescriptor().getPropertyType().getName()))
                        value = Boolean.toString(!propertyWrapper.isCliInverted());

                    try {
                        beanWrapper.setPropertyValue(name, value);
                    } catch (TypeMismatchException e) {
                        throw new ConfigurationException("invalid value for --" + option.getLongOpt() + ": "
                                + commandLine.getOptionValue(option.getLongOpt()), e);
                    }
                }
            }

            return object;
        } catch (InstantiationException | IllegalAccessException | NoSuchMethodException | InvocationTargetException e) {
            throw new RuntimeException(e);
        }
    }

    public String summarize(C object) {
        BeanWrapper beanWrapper = PropertyAccessorFactory.forBeanPropertyAccess(object);

        StringBuilder summary = new StringBuilder();
        if (getLabel() == null) summary.append(object.getClass().getSimpleName()).append("\n");
        else summary.append(getLabel()).append("\n");
        for (String name : propertyNames()) {
            Object value = beanWrapper.getPropertyValue(name);
            String valueString = getPropertyWrapper(name).isSensitive() && value != null ? SENSITIVE_MASK : toString(value);
            summary.append(" - ").append(name).append(": ").append(valueString).append("\n");
        }

        return summary.toString();
    }

    public Class<C> getTargetClass() {
        return targetClass;
    }

    public String getLabel() {
        return label;
    }

    public String getDocumentation() {
        return documentation;
    }

    public Iterable<String> propertyNames() {
        return new ArrayList<>(propertyMap.keySet());
    }

    public ConfigPropertyWrapper getPropertyWrapper(String name) {
        return propertyMap.get(name);
    }
}
