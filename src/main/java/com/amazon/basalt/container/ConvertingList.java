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

import java.lang.reflect.Array;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.Collection;
import java.util.RandomAccess;

/**
 * List which passes every element through an {@link ElementStandardizer}
 * before storing it, and so can never hold an unconverted element. The
 * backing list is never exposed. All {@code List} mutators route through
 * {@link #set} and {@link #add(int, Object)}, including those of iterators and
 * sub-lists.
 *
 * <p>Since elements usually arrive in a different form than they are held,
 * untyped variants of the mutators are also provided.
 *
 * @param <E> element type
 */
public class ConvertingList<E> extends AbstractList<E> implements RandomAccess {
    private final ElementStandardizer<? extends E> mStandardizer;
    private final ArrayList<E> mElements;

    public ConvertingList(ElementStandardizer<? extends E> standardizer) {
        this(standardizer, null);
    }

    /**
     * @param initial initial elements, which may be null
     */
    public ConvertingList(ElementStandardizer<? extends E> standardizer, Collection<?> initial) {
        if (standardizer == null) {
            throw new IllegalArgumentException("Null standardizer");
        }
        mStandardizer = standardizer;
        mElements = new ArrayList<E>(initial == null ? 10 : initial.size());
        if (initial != null) {
            extend(initial);
        }
    }

    @Override
    public E get(int index) {
        return mElements.get(index);
    }

    @Override
    public int size() {
        return mElements.size();
    }

    @Override
    public E set(int index, E element) {
        return replace(index, element);
    }

    @Override
    public void add(int index, E element) {
        insert(index, element);
    }

    @Override
    public E remove(int index) {
        modCount++;
        return mElements.remove(index);
    }

    @Override
    public void clear() {
        modCount++;
        mElements.clear();
    }

    /**
     * Converts and appends an element.
     */
    public void append(Object element) {
        insert(mElements.size(), element);
    }

    /**
     * Converts and inserts an element at the given index.
     */
    public void insert(int index, Object element) {
        E converted = mStandardizer.standardize(element);
        modCount++;
        mElements.add(index, converted);
    }

    /**
     * Converts and replaces the element at the given index.
     *
     * @return previous element
     */
    public E replace(int index, Object element) {
        E converted = mStandardizer.standardize(element);
        return mElements.set(index, converted);
    }

    /**
     * Converts and appends all elements of a collection or array. If any
     * element fails to convert, the list is left unchanged.
     */
    public void extend(Object elements) {
        ArrayList<E> converted;
        if (elements instanceof Iterable) {
            converted = new ArrayList<E>();
            for (Object element : (Iterable<?>) elements) {
                converted.add(mStandardizer.standardize(element));
            }
        } else if (elements != null && elements.getClass().isArray()) {
            int length = Array.getLength(elements);
            converted = new ArrayList<E>(length);
            for (int i=0; i<length; i++) {
                converted.add(mStandardizer.standardize(Array.get(elements, i)));
            }
        } else {
            throw new IllegalArgumentException("Not a collection or array: " + elements);
        }
        if (!converted.isEmpty()) {
            modCount++;
            mElements.addAll(converted);
        }
    }
}
