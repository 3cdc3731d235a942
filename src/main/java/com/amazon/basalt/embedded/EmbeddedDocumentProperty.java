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

package com.amazon.basalt.embedded;

import java.util.Map;

import com.amazon.basalt.EmbeddedDocument;

import com.amazon.basalt.property.Property;
import com.amazon.basalt.property.PropertyOptions;

/**
 * Property holding a single embedded document, stored inline as the map
 * produced by {@link EmbeddedDocument#serialize}.
 *
 * @param <E> embedded document type
 */
public class EmbeddedDocumentProperty<E extends EmbeddedDocument> extends Property<E> {
    private final EmbeddedType<E> mType;

    /**
     * Convenience constructor for JavaBean documents.
     */
    public EmbeddedDocumentProperty(Class<E> documentClass) {
        this(BeanEmbeddedType.forClass(documentClass), null);
    }

    public EmbeddedDocumentProperty(EmbeddedType<E> type, PropertyOptions options) {
        super(options);
        if (type == null) {
            throw new IllegalArgumentException("Null embedded type");
        }
        mType = type;
    }

    public EmbeddedType<E> getType() {
        return mType;
    }

    @Override
    protected E coerce(Object value) {
        return new EmbeddedElementStandardizer<E>(mType, getName()).standardize(value);
    }

    @Override
    protected boolean isInDomain(Object value) {
        return mType.getDocumentClass().isInstance(value) || value instanceof Map;
    }

    @Override
    protected Object toStorage(Object value) {
        return coerce(value).serialize();
    }

    @Override
    @SuppressWarnings("unchecked")
    protected E fromStorage(Object dbValue) {
        if (dbValue instanceof Map) {
            return mType.constructObject((Map<String, ?>) dbValue);
        }
        throw typeError(dbValue, "a stored map");
    }
}
