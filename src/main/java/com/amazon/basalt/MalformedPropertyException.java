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

package com.amazon.basalt;

import java.util.List;

/**
 * A MalformedPropertyException indicates that a property is declared in a way
 * that can never work, regardless of the values later given to it. It is
 * thrown when the property is constructed or declared on a schema, never
 * during conversion.
 */
public class MalformedPropertyException extends MalformedArgumentException {

    private static final long serialVersionUID = 1L;

    private final String mPropertyName;

    public MalformedPropertyException(String message) {
        this(null, message);
    }

    /**
     * @param propertyName name of offending property, which may be null if not bound yet
     */
    public MalformedPropertyException(String propertyName, String message) {
        super(message);
        mPropertyName = propertyName;
    }

    public MalformedPropertyException(String propertyName, List<String> messages) {
        super(messages);
        mPropertyName = propertyName;
    }

    /**
     * Returns first message, prefixed with the property name.
     */
    @Override
    public String getMessage() {
        String message = super.getMessage();
        if (mPropertyName != null) {
            message = '"' + mPropertyName + "\": " + message;
        }
        return message;
    }

    /**
     * @return property name, or null if not known
     */
    public String getPropertyName() {
        return mPropertyName;
    }
}
