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

import java.util.AbstractMap;
import java.util.AbstractSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Insertion-ordered map with text keys which passes every value through an
 * {@link ElementStandardizer} before storing it. The backing map is never
 * exposed. All {@code Map} mutators route through {@link #put} or through
 * {@code Map.Entry.setValue}, which converts as well.
 *
 * @param <V> value type
 */
public class ConvertingMap<V> extends AbstractMap<String, V> {
    private final ElementStandardizer<? extends V> mStandardizer;
    private final LinkedHashMap<String, V> mEntries;

    private transient Set<Map.Entry<String, V>> mEntrySet;

    public ConvertingMap(ElementStandardizer<? extends V> standardizer) {
        this(standardizer, null);
    }

    /**
     * @param initial initial entries, which may be null
     */
    public ConvertingMap(ElementStandardizer<? extends V> standardizer, Map<?, ?> initial) {
        if (standardizer == null) {
            throw new IllegalArgumentException("Null standardizer");
        }
        mStandardizer = standardizer;
        mEntries = new LinkedHashMap<String, V>();
        if (initial != null) {
            update(initial);
        }
    }

    @Override
    public int size() {
        return mEntries.size();
    }

    @Override
    public boolean containsKey(Object key) {
        return mEntries.containsKey(key);
    }

    @Override
    public V get(Object key) {
        return mEntries.get(key);
    }

    @Override
    public V put(String key, V value) {
        return putValue(key, value);
    }

    @Override
    public V remove(Object key) {
        return mEntries.remove(key);
    }

    @Override
    public void clear() {
        mEntries.clear();
    }

    /**
     * Converts and stores a value of any form.
     *
     * @return previous value
     */
    public V putValue(String key, Object value) {
        if (key == null) {
            throw new IllegalArgumentException("Null key");
        }
        return mEntries.put(key, mStandardizer.standardize(value));
    }

    /**
     * Returns the value for the key, first storing the converted default if
     * the key is absent.
     *
     * @throws IllegalArgumentException if key is null
     */
    public V setDefault(String key, Object defaultValue) {
        if (key == null) {
            throw new IllegalArgumentException("Null key");
        }
        if (mEntries.containsKey(key)) {
            return mEntries.get(key);
        }
        V converted = mStandardizer.standardize(defaultValue);
        mEntries.put(key, converted);
        return converted;
    }

    /**
     * Converts and stores all entries of the given map, with keys converted
     * to text. If any value fails to convert, this map is left unchanged.
     */
    public void update(Map<?, ?> entries) {
        LinkedHashMap<String, V> converted = new LinkedHashMap<String, V>(entries.size() * 2);
        for (Map.Entry<?, ?> entry : entries.entrySet()) {
            Object key = entry.getKey();
            if (key == null) {
                throw new IllegalArgumentException("Null key");
            }
            converted.put(key.toString(), mStandardizer.standardize(entry.getValue()));
        }
        mEntries.putAll(converted);
    }

    @Override
    public Set<Map.Entry<String, V>> entrySet() {
        Set<Map.Entry<String, V>> entrySet = mEntrySet;
        if (entrySet == null) {
            mEntrySet = entrySet = new EntrySet();
        }
        return entrySet;
    }

    private class EntrySet extends AbstractSet<Map.Entry<String, V>> {
        @Override
        public Iterator<Map.Entry<String, V>> iterator() {
            final Iterator<Map.Entry<String, V>> it = mEntries.entrySet().iterator();
            return new Iterator<Map.Entry<String, V>>() {
                public boolean hasNext() {
                    return it.hasNext();
                }

                public Map.Entry<String, V> next() {
                    return new ConvertingEntry(it.next());
                }

                public void remove() {
                    it.remove();
                }
            };
        }

        @Override
        public int size() {
            return mEntries.size();
        }

        @Override
        public void clear() {
            mEntries.clear();
        }
    }

    private class ConvertingEntry implements Map.Entry<String, V> {
        private final Map.Entry<String, V> mEntry;

        ConvertingEntry(Map.Entry<String, V> entry) {
            mEntry = entry;
        }

        public String getKey() {
            return mEntry.getKey();
        }

        public V getValue() {
            return mEntry.getValue();
        }

        public V setValue(V value) {
            return mEntry.setValue(mStandardizer.standardize(value));
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) {
                return true;
            }
            if (obj instanceof Map.Entry) {
                Map.Entry<?, ?> other = (Map.Entry<?, ?>) obj;
                return eq(getKey(), other.getKey()) && eq(getValue(), other.getValue());
            }
            return false;
        }

        @Override
        public int hashCode() {
            return mEntry.hashCode();
        }

        @Override
        public String toString() {
            return mEntry.toString();
        }

        private boolean eq(Object a, Object b) {
            return a == null ? b == null : a.equals(b);
        }
    }
}
