/*
 * Copyright 2006 Amazon Technologies, Inc. or its affiliates.
 * Amazon, Amazon.com and Basalt are trademarks or registered trademarks
 * of Amazon Technologies, Inc. or its affiliates.  All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.amazon.basalt.property;

/**
 * Floating point property, standardized to a {@code Double}. Booleans become
 * 0.0 or 1.0, and text is parsed as a decimal number.
 */
public class FloatProperty extends Property<Double> {
    public FloatProperty() {
        this(null);
    }

    public FloatProperty(PropertyOptions options) {
        super(options);
    }

    @Override
    protected Double coerce(Object value) {
        if (value instanceof Double) {
            return (Double) value;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof Boolean) {
            return ((Boolean) value) ? 1.0 : 0.0;
        }
        if (value instanceof CharSequence) {
            try {
                return Double.parseDouble(value.toString().trim());
            } catch (NumberFormatException e) {
                throw typeError(value, "numeric text", e);
            }
        }
        throw typeError(value, "a number, a boolean or numeric text");
    }

    @Override
    protected boolean isInDomain(Object value) {
        if (value instanceof Number || value instanceof Boolean) {
            return true;
        }
        if (value instanceof CharSequence) {
            try {
                Double.parseDouble(value.toString().trim());
                return true;
            } catch (NumberFormatException e) {
                return false;
            }
        }
        return false;
    }
}
