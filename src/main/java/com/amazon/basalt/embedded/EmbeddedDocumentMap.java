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

import com.amazon.basalt.container.ConvertingMap;

/**
 * Map of text keys to embedded documents. A map of fields stored as a value
 * is constructed into a document first.
 *
 * @param <E> embedded document type
 */
public class EmbeddedDocumentMap<E extends EmbeddedDocument> extends ConvertingMap<E> {
    private final EmbeddedType<E> mType;

    public EmbeddedDocumentMap(EmbeddedType<E> type) {
        this(type, null, null);
    }

    /**
     * @param propertyName name reported in type errors, which may be null
     * @param initial initial entries, which may be null
     */
    public EmbeddedDocumentMap(EmbeddedType<E> type, String propertyName, Map<?, ?> initial) {
        super(new EmbeddedElementStandardizer<E>(type, propertyName), initial);
        mType = type;
    }

    public EmbeddedType<E> getType() {
        return mType;
    }
}
