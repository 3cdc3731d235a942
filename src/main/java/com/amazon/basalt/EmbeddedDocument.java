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
 * Capability required of documents which are stored inline within a parent
 * document. Construction is performed by an {@link
 * com.amazon.basalt.embedded.EmbeddedType EmbeddedType}, since Java has no
 * class-level factory methods to dispatch on.
 */
public interface EmbeddedDocument {
    /**
     * Returns a storage-safe map of this document's fields. Values must be
     * null, strings, numbers, booleans, lists or maps of such.
     */
    Map<String, Object> serialize();
}
