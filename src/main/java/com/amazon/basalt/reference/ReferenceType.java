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

/**
 * Capability of a referenceable document class. Reference properties consult
 * it to check values and to load documents by key.
 *
 * <p>A type whose document class is {@code Document.class} accepts
 * references to any document.
 *
 * @param <D> document type
 */
public interface ReferenceType<D extends Document> {
    Class<D> getDocumentClass();

    DocumentKind getKind();

    /**
     * Loads a document by key.
     *
     * @return null if no document exists for the key
     * @throws FetchException if load failed
     */
    D load(String key) throws FetchException;
}
