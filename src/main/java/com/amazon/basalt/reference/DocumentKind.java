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

/**
 * Describes how documents of a class may be referred to.
 */
public enum DocumentKind {
    /**
     * Document is stored inline within another and has no key of its own. It
     * cannot be referenced.
     */
    EMBEDDED(false),

    /**
     * Document is always held in memory and never needs loading.
     */
    SIMPLE(true),

    /**
     * Document is stored independently, and is loaded by key.
     */
    STORED(true);

    private final boolean mReferenceable;

    private DocumentKind(boolean referenceable) {
        mReferenceable = referenceable;
    }

    public boolean isReferenceable() {
        return mReferenceable;
    }
}
