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

package com.amazon.basalt.container;

/**
 * Converts an element at every point it enters a converting container.
 *
 * @param <E> element type held by the container
 * @see ConvertingList
 * @see ConvertingMap
 */
public interface ElementStandardizer<E> {
    /**
     * @param element element to convert, which may be null
     * @return converted element
     * @throws com.amazon.basalt.PropertyTypeException if element is of the wrong type
     */
    E standardize(Object element);
}
