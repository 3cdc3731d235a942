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
 * Text property. Any value is converted to text with {@code toString}.
 */
public class StringProperty extends Property<String> {
    public StringProperty() {
        this(null);
    }

    public StringProperty(PropertyOptions options) {
        super(options);
    }

    @Override
    protected String coerce(Object value) {
        if (value instanceof char[]) {
            return new String((char[]) value);
        }
        return value.toString();
    }
}
