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

package com.amazon.basalt.stored;

import java.util.HashMap;
import java.util.Map;

import com.amazon.basalt.FetchException;

import com.amazon.basalt.reference.DocumentKind;
import com.amazon.basalt.reference.ReferenceType;

/**
 * Reference type backed by an in-memory map, counting loads.
 */
public class StoredDocumentType implements ReferenceType<StoredDocument> {
    private final DocumentKind mKind;
    private final Map<String, StoredDocument> mDocuments = new HashMap<String, StoredDocument>();

    public int mLoadCount;
    public FetchException mFailure;

    public StoredDocumentType() {
        this(DocumentKind.STORED);
    }

    public StoredDocumentType(DocumentKind kind) {
        mKind = kind;
    }

    public StoredDocument put(String key) {
        StoredDocument doc = new StoredDocument(key);
        mDocuments.put(key, doc);
        return doc;
    }

    public Class<StoredDocument> getDocumentClass() {
        return StoredDocument.class;
    }

    public DocumentKind getKind() {
        return mKind;
    }

    public StoredDocument load(String key) throws FetchException {
        mLoadCount++;
        if (mFailure != null) {
            throw mFailure;
        }
        return mDocuments.get(key);
    }
}
