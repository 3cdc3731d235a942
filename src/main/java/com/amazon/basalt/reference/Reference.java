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

/**
 * Value of a reference field, which is either an unresolved key or a
 * resolved document. Both forms have a key, and two references are equal if
 * their keys are equal. Absence of a reference is represented by null.
 *
 * @param <D> document type
 */
public final class Reference<D extends Document> {
    /**
     * @throws IllegalArgumentException if key is null
     */
    public static <D extends Document> Reference<D> forKey(String key) {
        if (key == null) {
            throw new IllegalArgumentException("Null reference key");
        }
        return new Reference<D>(key, null);
    }

    /**
     * @throws IllegalArgumentException if document is null
     */
    public static <D extends Document> Reference<D> forDocument(D document) {
        if (document == null) {
            throw new IllegalArgumentException("Null referenced document");
        }
        return new Reference<D>(null, document);
    }

    private final String mKey;
    private final D mDocument;

    private Reference(String key, D document) {
        mKey = key;
        mDocument = document;
    }

    /**
     * Returns the key of the referenced document. A resolved reference
     * returns the document's current key, which is null if it was never
     * saved.
     */
    public String getKey() {
        return mDocument == null ? mKey : mDocument.getKey();
    }

    public boolean isResolved() {
        return mDocument != null;
    }

    /**
     * @return null if not resolved
     */
    public D getDocument() {
        return mDocument;
    }

    /**
     * Returns true if this reference points to the given document, compared
     * by key.
     */
    public boolean refersTo(Document document) {
        if (document == null) {
            return false;
        }
        if (document == mDocument) {
            return true;
        }
        String key = getKey();
        return key != null && key.equals(document.getKey());
    }

    @Override
    public int hashCode() {
        String key = getKey();
        return key == null ? System.identityHashCode(mDocument) : key.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj instanceof Reference) {
            Reference<?> other = (Reference<?>) obj;
            String key = getKey();
            if (key == null) {
                return mDocument != null && mDocument == other.mDocument;
            }
            return key.equals(other.getKey());
        }
        return false;
    }

    @Override
    public String toString() {
        if (mDocument == null) {
            return "Reference {key=" + mKey + '}';
        }
        return "Reference {key=" + getKey() + ", document=" + mDocument + '}';
    }
}
