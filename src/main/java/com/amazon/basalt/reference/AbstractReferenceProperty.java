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

import java.util.Collection;
import java.util.Map;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import com.amazon.basalt.Document;
import com.amazon.basalt.FetchException;
import com.amazon.basalt.FetchNoneException;
import com.amazon.basalt.MalformedPropertyException;

import com.amazon.basalt.property.Property;
import com.amazon.basalt.property.PropertyOptions;

/**
 * Base class for properties which refer to other documents. Each referenced
 * value may be given as a key, a document, or a {@link Reference}, and is
 * standardized into a {@code Reference}. Storage always holds keys.
 *
 * <p>A reference property may name a collection on the referenced document
 * class. The document registry then declares an inverse property there,
 * flagged as a {@link #isReferenceBack reference back}.
 *
 * @param <D> referenced document type
 * @param <T> standardized value type
 */
public abstract class AbstractReferenceProperty<D extends Document, T> extends Property<T> {
    protected final Log mLog = LogFactory.getLog(getClass());

    private final ReferenceType<D> mType;
    private final String mCollectionName;

    private volatile boolean mReferenceBack;

    /**
     * @param type capability of the referenced document class
     * @param collectionName optional name of the inverse collection
     * @throws MalformedPropertyException if type is null or not referenceable
     */
    protected AbstractReferenceProperty(ReferenceType<D> type, String collectionName,
                                        PropertyOptions options)
    {
        super(options);
        if (type == null) {
            throw new MalformedPropertyException("Reference property requires a reference type");
        }
        if (type.getKind() == null || !type.getKind().isReferenceable()) {
            throw new MalformedPropertyException
                ("Documents of kind " + type.getKind() + " cannot be referenced: " +
                 type.getDocumentClass().getName());
        }
        mType = type;
        mCollectionName = collectionName;
    }

    public ReferenceType<D> getReferenceType() {
        return mType;
    }

    /**
     * @return null if no inverse collection
     */
    public String getCollectionName() {
        return mCollectionName;
    }

    /**
     * Returns true if this property was declared by the registry as the
     * inverse side of another reference property.
     */
    public boolean isReferenceBack() {
        return mReferenceBack;
    }

    public void setReferenceBack(boolean referenceBack) {
        mReferenceBack = referenceBack;
    }

    /**
     * Loads any unresolved references in the given value, returning the
     * standardized value with resolved references. References to documents
     * of {@link DocumentKind#SIMPLE simple} kind are returned as-is.
     *
     * @throws FetchNoneException if a referenced document does not exist
     * @throws FetchException if load failed
     * @throws com.amazon.basalt.PropertyTypeException if value is malformed
     */
    public abstract T attemptLoad(Object value) throws FetchException;

    /**
     * Removes a reference to the given document from the value this property
     * holds in a document's data. Collections held in the data are modified
     * in place.
     *
     * @param doc document whose data holds this property's value
     * @param ref referenced document to remove
     * @return true if a reference was removed
     * @throws IllegalStateException if this property has no name bound
     */
    public abstract boolean deleteReference(Document doc, Document ref);

    /**
     * Returns true if the value this property holds in a document's data
     * refers to the given document.
     *
     * @throws IllegalStateException if this property has no name bound
     */
    public boolean holdsReference(Document doc, Document ref) {
        Object stored = storedValue(doc);
        if (stored instanceof Collection) {
            for (Object element : (Collection<?>) stored) {
                if (matches(element, ref)) {
                    return true;
                }
            }
            return false;
        }
        if (stored instanceof Map) {
            for (Object element : ((Map<?, ?>) stored).values()) {
                if (matches(element, ref)) {
                    return true;
                }
            }
            return false;
        }
        return matches(stored, ref);
    }

    /**
     * Converts a single referenced value into a reference.
     *
     * @return null if value is null
     * @throws com.amazon.basalt.PropertyTypeException if value is not a key,
     * a reference or a document of the referenced class
     */
    @SuppressWarnings("unchecked")
    protected Reference<D> toReference(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Reference) {
            Reference<?> ref = (Reference<?>) value;
            if (!ref.isResolved() || mType.getDocumentClass().isInstance(ref.getDocument())) {
                return (Reference<D>) ref;
            }
        } else if (value instanceof String) {
            return Reference.forKey((String) value);
        } else if (mType.getDocumentClass().isInstance(value)) {
            return Reference.forDocument(mType.getDocumentClass().cast(value));
        }
        throw typeError(value, "a key or a " + mType.getDocumentClass().getSimpleName());
    }

    /**
     * Returns true if the single referenced value is acceptable to {@link
     * #toReference}.
     */
    protected boolean isReferenceValue(Object value) {
        if (value == null || value instanceof String) {
            return true;
        }
        if (value instanceof Reference) {
            Reference<?> ref = (Reference<?>) value;
            return !ref.isResolved() || mType.getDocumentClass().isInstance(ref.getDocument());
        }
        return mType.getDocumentClass().isInstance(value);
    }

    /**
     * Converts a single referenced value into its stored key.
     *
     * @return null if value is null
     * @throws IllegalStateException if a referenced document has no key
     */
    protected String attemptToDb(Object value) {
        Reference<D> ref = toReference(value);
        if (ref == null) {
            return null;
        }
        String key = ref.getKey();
        if (key == null) {
            throw new IllegalStateException
                ("Referenced document has no key, and so it must be saved first: " +
                 ref.getDocument());
        }
        return key;
    }

    /**
     * Resolves a single reference, loading it by key if required.
     *
     * @return null if ref is null
     */
    protected Reference<D> attemptLoadOne(Reference<D> ref) throws FetchException {
        if (ref == null || ref.isResolved() || mType.getKind() == DocumentKind.SIMPLE) {
            return ref;
        }
        String key = ref.getKey();
        if (mLog.isDebugEnabled()) {
            mLog.debug("Loading " + mType.getDocumentClass().getSimpleName() +
                       " \"" + key + "\" for " + this);
        }
        D document = mType.load(key);
        if (document == null) {
            throw new FetchNoneException(key);
        }
        return Reference.forDocument(document);
    }

    /**
     * Returns the value this property holds in the given document's data.
     */
    protected Object storedValue(Document doc) {
        String name = getName();
        if (name == null) {
            throw new IllegalStateException("Reference property has no name bound: " + this);
        }
        return doc.getData().get(name);
    }

    /**
     * Returns true if the single stored value refers to the given document.
     */
    protected boolean matches(Object stored, Document ref) {
        if (stored == null || ref == null) {
            return false;
        }
        if (stored instanceof Reference) {
            return ((Reference<?>) stored).refersTo(ref);
        }
        if (stored instanceof Document) {
            return stored == ref || (ref.getKey() != null &&
                                     ref.getKey().equals(((Document) stored).getKey()));
        }
        return stored.equals(ref.getKey());
    }

    protected void logRemoval(Document doc, Document ref) {
        if (mLog.isDebugEnabled()) {
            mLog.debug("Removed reference to \"" + ref.getKey() + "\" from " + this +
                       " of \"" + doc.getKey() + '"');
        }
    }
}
