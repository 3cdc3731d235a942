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

import java.util.Map;

/**
 * Map with text keys whose nested maps are themselves dot dictionaries, so
 * that a path of keys can be followed without casting. Any map stored into a
 * dot dictionary, at construction or later, is converted.
 *
 * <p>Java has no attribute syntax for map entries, so dot access is offered
 * through {@link #getPath} and {@link #setPath}, which accept keys joined by
 * periods.
 */
public class DotDict extends ConvertingMap<Object> {
    private static final ElementStandardizer<Object> NESTING = new ElementStandardizer<Object>() {
        public Object standardize(Object element) {
            if (element instanceof Map && !(element instanceof DotDict)) {
                return new DotDict((Map<?, ?>) element);
            }
            return element;
        }
    };

    public DotDict() {
        super(NESTING);
    }

    /**
     * @param initial initial entries, which may be null
     */
    public DotDict(Map<?, ?> initial) {
        super(NESTING, initial);
    }

    /**
     * Same as {@link #putValue}, but returns this dictionary for chaining.
     */
    public DotDict set(String key, Object value) {
        putValue(key, value);
        return this;
    }

    /**
     * Returns the value as text, or null if absent.
     */
    public String getString(String key) {
        Object value = get(key);
        return value == null ? null : value.toString();
    }

    /**
     * Returns a nested dictionary, or null if absent.
     *
     * @throws ClassCastException if the value is not a dictionary
     */
    public DotDict getDict(String key) {
        return (DotDict) get(key);
    }

    /**
     * Follows a path of period separated keys through nested dictionaries.
     *
     * @return null if any step of the path is absent or not a dictionary
     */
    public Object getPath(String path) {
        DotDict dict = this;
        int start = 0;
        int end;
        while ((end = path.indexOf('.', start)) >= 0) {
            Object next = dict.get(path.substring(start, end));
            if (!(next instanceof DotDict)) {
                return null;
            }
            dict = (DotDict) next;
            start = end + 1;
        }
        return dict.get(path.substring(start));
    }

    /**
     * Stores a value at a path of period separated keys, creating missing
     * nested dictionaries along the way.
     *
     * @throws IllegalArgumentException if a step of the path holds a
     * non-dictionary value
     */
    public DotDict setPath(String path, Object value) {
        DotDict dict = this;
        int start = 0;
        int end;
        while ((end = path.indexOf('.', start)) >= 0) {
            String key = path.substring(start, end);
            Object next = dict.get(key);
            if (next == null) {
                next = new DotDict();
                dict.putValue(key, next);
            } else if (!(next instanceof DotDict)) {
                throw new IllegalArgumentException
                    ("Path step \"" + key + "\" of \"" + path + "\" is not a dictionary");
            }
            dict = (DotDict) next;
            start = end + 1;
        }
        dict.putValue(path.substring(start), value);
        return this;
    }
}
