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

package com.amazon.basalt.reference;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

import com.amazon.basalt.Document;
import com.amazon.basalt.FetchException;
import com.amazon.basalt.MalformedPropertyException;

import com.amazon.basalt.property.PropertyOptions;

/**
 * Property referring to documents by text keys of its own, stored as a map of
 * document keys. Inverse collections are not supported.
 *
 * @param <D> referenced document type
 */
public class DictReferenceProperty<D extends Document>
    extends AbstractReferenceProperty<D, Map<String, Reference<D>>>
{
    public DictReferenceProperty(ReferenceType<D> type) {
        this(type, null, null);
    }

    /**
     * @throws MalformedPropertyException if a collection name is given
     */
    public DictReferenceProperty(ReferenceType<D> type, String collectionName,
                                 PropertyOptions options)
    {
        super(type, collectionName, options);
        if (collectionName != null) {
            throw new MalformedPropertyException
                ("Dictionary reference property cannot have an inverse collection: " +
                 collectionName);
        }
    }

    @Override
    public Map<String, Reference<D>> attemptLoad(Object value) throws FetchException {
        Map<String, Reference<D>> refs = value == null ? emptyValue() : coerce(value);
        for (Map.Entry<String, Reference<D>> entry : refs.entrySet()) {
            entry.setValue(attemptLoadOne(entry.getValue()));
        }
        return refs;
    }

    /**
     * Removes the first entry of the stored map whose value refers to the
     * given document. The stored map is modified in place.
     */
    @Override
    public boolean deleteReference(Document doc, Document ref) {
        Object stored = storedValue(doc);
        if (!(stored instanceof Map)) {
            return false;
        }
        Iterator<?> it = ((Map<?, ?>) stored).values().iterator();
        while (it.hasNext()) {
            if (matches(it.next(), ref)) {
                it.remove();
                logRemoval(doc, ref);
                return true;
            }
        }
        return false;
    }

    @Override
    protected Map<String, Reference<D>> coerce(Object value) {
        if (!(value instanceof Map)) {
            throw typeError(value, "a map of references");
        }
        Map<?, ?> values = (Map<?, ?>) value;
        Map<String, Reference<D>> refs = new LinkedHashMap<String, Reference<D>>(values.size() * 2);
        for (Map.Entry<?, ?> entry : values.entrySet()) {
            refs.put(keyOf(value, entry), toReference(entry.getValue()));
        }
        return refs;
    }

    @Override
    protected boolean isInDomain(Object value) {
        if (!(value instanceof Map)) {
            return false;
        }
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
            if (entry.getKey() == null || !isReferenceValue(entry.getValue())) {
                return false;
            }
        }
        return true;
    }

    @Override
    protected Object toStorage(Object value) {
        if (!(value instanceof Map)) {
            throw typeError(value, "a map of references");
        }
        Map<?, ?> values = (Map<?, ?>) value;
        Map<String, Object> keys = new LinkedHashMap<String, Object>(values.size() * 2);
        for (Map.Entry<?, ?> entry : values.entrySet()) {
            keys.put(keyOf(value, entry), attemptToDb(entry.getValue()));
        }
        return keys;
    }

    @Override
    protected Object toStorageNull() {
        return new LinkedHashMap<String, Object>();
    }

    @Override
    protected Map<String, Reference<D>> emptyValue() {
        return new LinkedHashMap<String, Reference<D>>();
    }

    private String keyOf(Object value, Map.Entry<?, ?> entry) {
        Object key = entry.getKey();
        if (key == null) {
            throw typeError(value, "a map of references without null keys");
        }
        return key.toString();
    }
}
