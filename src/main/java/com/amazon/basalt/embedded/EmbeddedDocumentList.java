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

import java.util.Collection;

import com.amazon.basalt.EmbeddedDocument;

import com.amazon.basalt.container.ConvertingList;

/**
 * List of embedded documents. A map of fields appended or assigned to the
 * list is constructed into a document first.
 *
 * @param <E> embedded document type
 */
public class EmbeddedDocumentList<E extends EmbeddedDocument> extends ConvertingList<E> {
    private final EmbeddedType<E> mType;

    public EmbeddedDocumentList(EmbeddedType<E> type) {
        this(type, null, null);
    }

    /**
     * @param propertyName name reported in type errors, which may be null
     * @param initial initial elements, which may be null
     */
    public EmbeddedDocumentList(EmbeddedType<E> type, String propertyName,
                                Collection<?> initial)
    {
        super(new EmbeddedElementStandardizer<E>(type, propertyName), initial);
        mType = type;
    }

    public EmbeddedType<E> getType() {
        return mType;
    }
}
