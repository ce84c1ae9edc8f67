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

import com.emc.ecs.bulkimport.config.annotation.Option;

import java.beans.PropertyDescriptor;
import java.lang.reflect.InvocationTargetException;
import java.util.HashMap;
import java.util.Map;

public final class ConfigUtil {
    private static final Map<Class<?>, ConfigWrapper<?>> wrapperCache = new HashMap<>();

    @SuppressWarnings("unchecked")
    public static synchronized <C> ConfigWrapper<C> wrapperFor(Class<C> targetClass) {
        ConfigWrapper<C> configWrapper = (ConfigWrapper<C>) wrapperCache.get(targetClass);
        if (configWrapper == null) {
            configWrapper = new ConfigWrapper<>(targetClass);
            wrapperCache.put(targetClass, configWrapper);
        }
        return configWrapper;
    }

    public static String hyphenate(String name) {
        StringBuilder hyphenated = new StringBuilder();
        for (char c : name.toCharArray()) {
            if (Character.isUpperCase(c) && hyphenated.length() > 0)
                hyphenated.append('-');
            hyphenated.append(Character.toLowerCase(c));
        }
        return hyphenated.toString();
    }

    public static String labelize(String name) {
        StringBuilder label = new StringBuilder();
        for (char c : name.toCharArray()) {
            if (Character.isUpperCase(c) && label.length() > 0)
                label.append(' ');
            label.append(label.length() == 0 ? Character.toUpperCase(c) : c);
        }
        return label.toString();
    }

    @SuppressWarnings("unchecked")
    public static <C> String summarize(C configObject) {
        return wrapperFor((Class<C>) configObject.getClass()).summarize(configObject);
    }

    /**
     * Checks that every required option of <code>configObject</code> has a value. Blank strings and empty arrays
     * count as missing.
     *
     * @throws ConfigurationException naming the first missing option (by its CLI name)
     */
    public static void validate(Object configObject) {
        try {
            ConfigWrapper<?> wrapper = wrapperFor(configObject.getClass());
            for (String property : wrapper.propertyNames()) {
                ConfigPropertyWrapper propertyWrapper = wrapper.getPropertyWrapper(property);
                if (!propertyWrapper.isRequired()) continue;
                Object value = propertyWrapper.getDescriptor().getReadMethod().invoke(configObject);
                if (isMissing(value))
                    throw new ConfigurationException(String.format("%s (--%s) is required",
                            propertyWrapper.getLabel(), propertyWrapper.getCliOption().getLongOpt()));
            }
        } catch (InvocationTargetException | IllegalAccessException e) {
            throw new RuntimeException(e);
        }
    }

    private static boolean isMissing(Object value) {
        if (value == null) return true;
        if (value instanceof String) return ((String) value).trim().isEmpty();
        if (value instanceof Object[]) {
            for (Object element : (Object[]) value) {
                if (!isMissing(element)) return false;
            }
            return true;
        }
        return false;
    }

    /**
     * convert an annotated getter into a commons-cli Option
     */
    public static org.apache.commons.cli.Option cliOptionFromAnnotation(PropertyDescriptor descriptor, Option _option) {
        org.apache.commons.cli.Option option = new org.apache.commons.cli.Option(null, _option.description());

        // required
        if (_option.required()) option.setRequired(true);

        // long name
        String longName;
        if (_option.cliName().length() > 0) {
            longName = _option.cliName();
        } else {
            longName = hyphenate(descriptor.getName());
            if ((Boolean.class == descriptor.getPropertyType() || "boolean".equals(descriptor.getPropertyType().getName()))
                    && _option.cliInverted())
                longName = "no-" + longName;
        }
        option.setLongOpt(longName);

        // parameter[s]
        if (descriptor.getPropertyType().isArray()) {
            option.setArgs(org.apache.commons.cli.Option.UNLIMITED_VALUES);
        } else if (Boolean.class != descriptor.getPropertyType() && !"boolean".equals(descriptor.getPropertyType().getName())) {
            // non-booleans *must* have an argument
            option.setArgs(1);
        }
        if (option.hasArg()) {
            if (_option.valueHint().length() > 0) option.setArgName(_option.valueHint());
            else if (_option.valueList().length > 0) option.setArgName(String.join("|", _option.valueList()));
            else option.setArgName(option.getLongOpt());
        }

        return option;
    }

    private ConfigUtil() {
    }
}
