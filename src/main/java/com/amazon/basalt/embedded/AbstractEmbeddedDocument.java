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
 * Convenient base class for embedded documents written as JavaBeans. Every
 * property with both a getter and a setter is serialized. Subclasses must be
 * public and have a public no-arg constructor.
 *
 * <p>Two embedded documents are equal if they are of the same class and
 * serialize to equal maps.
 *
 * @see BeanEmbeddedType
 */
public abstract class AbstractEmbeddedDocument implements EmbeddedDocument {
    protected AbstractEmbeddedDocument() {
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> serialize() {
        BeanEmbeddedType<AbstractEmbeddedDocument> type =
            BeanEmbeddedType.forClass((Class<AbstractEmbeddedDocument>) getClass());
        return type.serialize(this);
    }

    @Override
    public int hashCode() {
        return getClass().hashCode() + serialize().hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || obj.getClass() != getClass()) {
            return false;
        }
        return serialize().equals(((AbstractEmbeddedDocument) obj).serialize());
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + serialize();
    }
}
