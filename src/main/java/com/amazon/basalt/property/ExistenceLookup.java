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

package com.amazon.basalt.property;

import com.amazon.basalt.FetchException;

/**
 * Storage client capability used by unique properties to check if a value is
 * already taken. The check is advisory: nothing prevents another writer from
 * claiming the value between the check and the save.
 */
public interface ExistenceLookup {
    /**
     * @param value raw value to look up, exactly as given to {@link Property#hasValue}
     * @return true if a document already holds the value
     * @throws FetchException if the storage client fails
     */
    boolean exists(Object value) throws FetchException;
}
