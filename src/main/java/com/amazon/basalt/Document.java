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

package com.amazon.basalt;

import java.util.Map;

/**
 * Capability required of documents which can be the target of a reference
 * property. A document is identified by its key, and it exposes the raw value
 * of each declared property through a live data map.
 *
 * <p>The data map is owned by the document. Reference deletion mutates the
 * collections stored in it, and so callers must not hand out copies.
 *
 * @see com.amazon.basalt.reference.ReferenceType
 */
public interface Document {
    /**
     * Returns the key which identifies this document in storage, or null if
     * not assigned yet.
     */
    String getKey();

    /**
     * Returns the live map of property name to raw property value.
     */
    Map<String, Object> getData();
}
