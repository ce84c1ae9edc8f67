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

public class ConfigPropertyWrapper {
    private final PropertyDescriptor descriptor;
    private final Option option;
    private final org.apache.commons.cli.Option cliOption;

    public ConfigPropertyWrapper(PropertyDescriptor descriptor) {
        if (!descriptor.getReadMethod().isAnnotationPresent(Option.class))
            throw new IllegalArgumentException(descriptor.getName() + " is not an @Option");
        this.descriptor = descriptor;
        this.option = descriptor.getReadMethod().getAnnotation(Option.class);
        this.cliOption = ConfigUtil.cliOptionFromAnnotation(descriptor, option);
    }

    public PropertyDescriptor getDescriptor() {
        return descriptor;
    }

    public String getName() {
        return descriptor.getName();
    }

    public boolean isRequired() {
        return option.required();
    }

    public String getLabel() {
        return (option.label().trim().isEmpty()) ? ConfigUtil.labelize(getName()) : option.label();
    }

    public boolean isCliInverted() {
        return option.cliInverted();
    }

    public int getOrderIndex() {
        return option.orderIndex();
    }

    public boolean isAdvanced() {
        return option.advanced();
    }

    public boolean isSensitive() {
        return option.sensitive();
    }

    public org.apache.commons.cli.Option getCliOption() {
        return cliOption;
    }
}
