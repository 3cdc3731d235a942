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

import com.amazon.basalt.Document;
import com.amazon.basalt.FetchException;

import com.amazon.basalt.property.PropertyOptions;

/**
 * Property referring to a single document, stored as its key.
 *
 * @param <D> referenced document type
 */
public class ReferenceProperty<D extends Document>
    extends AbstractReferenceProperty<D, Reference<D>>
{
    public ReferenceProperty(ReferenceType<D> type) {
        this(type, null, null);
    }

    public ReferenceProperty(ReferenceType<D> type, String collectionName,
                             PropertyOptions options)
    {
        super(type, collectionName, options);
    }

    @Override
    public Reference<D> attemptLoad(Object value) throws FetchException {
        return attemptLoadOne(toReference(value));
    }

    /**
     * Clears the stored value, unless already null. The given document is
     * assumed to be the one referred to, as a single reference has nothing
     * else to remove. Call {@link #holdsReference} first to check.
     */
    @Override
    public boolean deleteReference(Document doc, Document ref) {
        if (storedValue(doc) == null) {
            return false;
        }
        doc.getData().put(getName(), null);
        logRemoval(doc, ref);
        return true;
    }

    @Override
    protected Reference<D> coerce(Object value) {
        return toReference(value);
    }

    @Override
    protected boolean isInDomain(Object value) {
        return isReferenceValue(value);
    }

    @Override
    protected Object toStorage(Object value) {
        return attemptToDb(value);
    }
}
