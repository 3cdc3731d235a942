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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;

import com.amazon.basalt.Document;
import com.amazon.basalt.FetchException;

import com.amazon.basalt.property.PropertyOptions;

/**
 * Property referring to a list of documents, stored as a list of keys.
 *
 * @param <D> referenced document type
 */
public class MultiReferenceProperty<D extends Document>
    extends AbstractReferenceProperty<D, List<Reference<D>>>
{
    public MultiReferenceProperty(ReferenceType<D> type) {
        this(type, null, null);
    }

    public MultiReferenceProperty(ReferenceType<D> type, String collectionName,
                                  PropertyOptions options)
    {
        super(type, collectionName, options);
    }

    @Override
    public List<Reference<D>> attemptLoad(Object value) throws FetchException {
        List<Reference<D>> refs = value == null ? emptyValue() : coerce(value);
        for (int i=0; i<refs.size(); i++) {
            refs.set(i, attemptLoadOne(refs.get(i)));
        }
        return refs;
    }

    /**
     * Removes the first element of the stored list which refers to the given
     * document. The stored list is modified in place.
     */
    @Override
    public boolean deleteReference(Document doc, Document ref) {
        Object stored = storedValue(doc);
        if (!(stored instanceof Collection)) {
            return false;
        }
        Iterator<?> it = ((Collection<?>) stored).iterator();
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
    protected List<Reference<D>> coerce(Object value) {
        if (!(value instanceof Collection)) {
            throw typeError(value, "a list of references");
        }
        Collection<?> values = (Collection<?>) value;
        List<Reference<D>> refs = new ArrayList<Reference<D>>(values.size());
        for (Object element : values) {
            refs.add(toReference(element));
        }
        return refs;
    }

    @Override
    protected boolean isInDomain(Object value) {
        if (!(value instanceof Collection)) {
            return false;
        }
        for (Object element : (Collection<?>) value) {
            if (!isReferenceValue(element)) {
                return false;
            }
        }
        return true;
    }

    @Override
    protected Object toStorage(Object value) {
        if (!(value instanceof Collection)) {
            throw typeError(value, "a list of references");
        }
        Collection<?> values = (Collection<?>) value;
        List<Object> keys = new ArrayList<Object>(values.size());
        for (Object element : values) {
            keys.add(attemptToDb(element));
        }
        return keys;
    }

    @Override
    protected Object toStorageNull() {
        return new ArrayList<Object>();
    }

    @Override
    protected List<Reference<D>> emptyValue() {
        return new ArrayList<Reference<D>>();
    }
}
