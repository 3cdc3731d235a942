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

/**
 * Thrown when a referenced document does not exist.
 */
public class FetchNoneException extends FetchException {

    private static final long serialVersionUID = 1L;

    private final String mKey;

    public FetchNoneException(String key) {
        super("No document found for key \"" + key + '"');
        mKey = key;
    }

    public FetchNoneException(String key, String message) {
        super(message);
        mKey = key;
    }

    public String getKey() {
        return mKey;
    }
}
