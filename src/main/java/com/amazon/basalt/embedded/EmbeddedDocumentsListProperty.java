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

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

import com.amazon.basalt.EmbeddedDocument;

import com.amazon.basalt.property.Property;
import com.amazon.basalt.property.PropertyOptions;

/**
 * Property holding a list of embedded documents, stored as a list of maps.
 * Null is standardized into an empty list.
 *
 * @param <E> embedded document type
 */
public class EmbeddedDocumentsListProperty<E extends EmbeddedDocument>
    extends Property<EmbeddedDocumentList<E>>
{
    private final EmbeddedType<E> mType;

    public EmbeddedDocumentsListProperty(Class<E> documentClass) {
        this(BeanEmbeddedType.forClass(documentClass), null);
    }

    public EmbeddedDocumentsListProperty(EmbeddedType<E> type, PropertyOptions options) {
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
    protected EmbeddedDocumentList<E> coerce(Object value) {
        if (value instanceof EmbeddedDocumentList
            && ((EmbeddedDocumentList<?>) value).getType() == mType)
        {
            @SuppressWarnings("unchecked")
            EmbeddedDocumentList<E> list = (EmbeddedDocumentList<E>) value;
            return list;
        }
        if (value instanceof Collection) {
            return new EmbeddedDocumentList<E>(mType, getName(), (Collection<?>) value);
        }
        throw typeError(value, "a list of " + mType.getDocumentClass().getSimpleName());
    }

    @Override
    protected EmbeddedDocumentList<E> coerceDefault(Object value) {
        if (value instanceof Collection) {
            return new EmbeddedDocumentList<E>(mType, getName(), (Collection<?>) value);
        }
        return coerce(value);
    }

    @Override
    protected EmbeddedDocumentList<E> coerceNull() {
        return emptyValue();
    }

    @Override
    protected boolean isInDomain(Object value) {
        if (!(value instanceof Collection)) {
            return false;
        }
        Class<E> clazz = mType.getDocumentClass();
        for (Object element : (Collection<?>) value) {
            if (element != null && !clazz.isInstance(element) && !(element instanceof Map)) {
                return false;
            }
        }
        return true;
    }

    @Override
    protected Object toStorage(Object value) {
        EmbeddedDocumentList<E> list = coerce(value);
        List<Object> serialized = new ArrayList<Object>(list.size());
        for (E element : list) {
            serialized.add(element == null ? null : element.serialize());
        }
        return serialized;
    }

    @Override
    protected Object toStorageNull() {
        return new ArrayList<Object>();
    }

    @Override
    @SuppressWarnings("unchecked")
    protected EmbeddedDocumentList<E> fromStorage(Object dbValue) {
        if (!(dbValue instanceof Collection)) {
            throw typeError(dbValue, "a stored list");
        }
        EmbeddedDocumentList<E> list = emptyValue();
        for (Object element : (Collection<?>) dbValue) {
            if (element == null) {
                list.add(null);
            } else if (element instanceof Map) {
                list.add(mType.constructObject((Map<String, ?>) element));
            } else {
                throw typeError(element, "a stored map");
            }
        }
        return list;
    }

    @Override
    protected EmbeddedDocumentList<E> emptyValue() {
        return new EmbeddedDocumentList<E>(mType, getName(), null);
    }
}
