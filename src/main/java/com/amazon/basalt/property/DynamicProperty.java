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
 * Property which accepts values of any type, performing no coercion. Only the
 * configured processors and validators apply. Values must already be storage
 * safe.
 */
public class DynamicProperty extends Property<Object> {
    public DynamicProperty() {
        this(null);
    }

    public DynamicProperty(PropertyOptions options) {
        super(options);
    }

    @Override
    protected Object coerce(Object value) {
        return value;
    }
}
