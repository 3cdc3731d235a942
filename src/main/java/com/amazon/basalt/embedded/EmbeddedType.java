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

/**
 * Capability of an embeddable document class: constructs instances from
 * fields or from their serialized form.
 *
 * @param <E> embedded document type
 * @see BeanEmbeddedType
 */
public interface EmbeddedType<E extends EmbeddedDocument> {
    Class<E> getDocumentClass();

    /**
     * Constructs a new document from application supplied field values.
     */
    E newInstance(Map<String, ?> fields);

    /**
     * Constructs a document from the map produced by {@link
     * EmbeddedDocument#serialize}.
     */
    E constructObject(Map<String, ?> serialized);
}
