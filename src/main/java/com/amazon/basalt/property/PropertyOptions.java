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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import java.util.function.Supplier;

/**
 * An immutable set of options shared by all property types. Options are
 * built up from {@link #defaults()}, each {@code with} method returning a new
 * instance:
 *
 * <pre>
 * PropertyOptions options = PropertyOptions.defaults()
 *     .withRequired()
 *     .withUnique(lookup)
 *     .withDefaultSupplier(() -&gt; new DateTime())
 *     .withValidator(new LengthValidator(1, 80));
 * </pre>
 *
 * Required and unique are only exposed as flags. The owning document enforces
 * them; a property merely offers {@link Property#hasValue}.
 */
public class PropertyOptions {
    private static final PropertyOptions DEFAULTS = new PropertyOptions
        (false, null, null, null,
         Collections.<Validator>emptyList(),
         Collections.<Processor>emptyList(),
         Collections.<Processor>emptyList(),
         Collections.<Processor>emptyList());

    public static PropertyOptions defaults() {
        return DEFAULTS;
    }

    private static <E> List<E> append(List<E> list, E element, String what) {
        if (element == null) {
            throw new IllegalArgumentException("Null " + what);
        }
        List<E> copy = new ArrayList<E>(list.size() + 1);
        copy.addAll(list);
        copy.add(element);
        return Collections.unmodifiableList(copy);
    }

    private final boolean mRequired;
    private final ExistenceLookup mLookup;
    private final Object mDefault;
    private final Supplier<?> mDefaultSupplier;
    private final List<Validator> mValidators;
    private final List<Processor> mForward;
    private final List<Processor> mBackward;
    private final List<Processor> mStandard;

    private PropertyOptions(boolean required, ExistenceLookup lookup,
                            Object defaultValue, Supplier<?> defaultSupplier,
                            List<Validator> validators,
                            List<Processor> forward,
                            List<Processor> backward,
                            List<Processor> standard)
    {
        mRequired = required;
        mLookup = lookup;
        mDefault = defaultValue;
        mDefaultSupplier = defaultSupplier;
        mValidators = validators;
        mForward = forward;
        mBackward = backward;
        mStandard = standard;
    }

    public PropertyOptions withRequired() {
        return withRequired(true);
    }

    public PropertyOptions withRequired(boolean required) {
        if (required == mRequired) {
            return this;
        }
        return new PropertyOptions(required, mLookup, mDefault, mDefaultSupplier,
                                   mValidators, mForward, mBackward, mStandard);
    }

    /**
     * Returns options for a unique property, checked through the given lookup.
     *
     * @throws IllegalArgumentException if lookup is null
     */
    public PropertyOptions withUnique(ExistenceLookup lookup) {
        if (lookup == null) {
            throw new IllegalArgumentException("Unique property requires an existence lookup");
        }
        return new PropertyOptions(mRequired, lookup, mDefault, mDefaultSupplier,
                                   mValidators, mForward, mBackward, mStandard);
    }

    /**
     * Returns options without the unique flag.
     */
    public PropertyOptions withoutUnique() {
        if (mLookup == null) {
            return this;
        }
        return new PropertyOptions(mRequired, null, mDefault, mDefaultSupplier,
                                   mValidators, mForward, mBackward, mStandard);
    }

    /**
     * Returns options with a fixed default value, replacing any default
     * supplier. A container default is copied each time it is needed, but
     * its elements are not. Use a {@link #withDefaultSupplier supplier} for
     * defaults holding mutable elements.
     *
     * @param defaultValue default value, or null for none
     */
    public PropertyOptions withDefault(Object defaultValue) {
        return new PropertyOptions(mRequired, mLookup, defaultValue, null,
                                   mValidators, mForward, mBackward, mStandard);
    }

    /**
     * Returns options with a default value supplier, invoked each time a
     * default is needed.
     *
     * @throws IllegalArgumentException if supplier is null
     */
    public PropertyOptions withDefaultSupplier(Supplier<?> supplier) {
        if (supplier == null) {
            throw new IllegalArgumentException("Null default supplier");
        }
        return new PropertyOptions(mRequired, mLookup, null, supplier,
                                   mValidators, mForward, mBackward, mStandard);
    }

    public PropertyOptions withValidator(Validator validator) {
        return new PropertyOptions(mRequired, mLookup, mDefault, mDefaultSupplier,
                                   append(mValidators, validator, "validator"),
                                   mForward, mBackward, mStandard);
    }

    /**
     * Appends a processor run by {@link Property#convertToDb} before the
     * value is converted to its storage form.
     */
    public PropertyOptions withForwardProcessor(Processor processor) {
        return new PropertyOptions(mRequired, mLookup, mDefault, mDefaultSupplier,
                                   mValidators, append(mForward, processor, "processor"),
                                   mBackward, mStandard);
    }

    /**
     * Appends a processor run by {@link Property#convertFromDb} after the
     * value is converted from its storage form.
     */
    public PropertyOptions withBackwardProcessor(Processor processor) {
        return new PropertyOptions(mRequired, mLookup, mDefault, mDefaultSupplier,
                                   mValidators, mForward,
                                   append(mBackward, processor, "processor"), mStandard);
    }

    /**
     * Appends a processor run by {@link Property#standardize} before the
     * value is coerced.
     */
    public PropertyOptions withStandardProcessor(Processor processor) {
        return new PropertyOptions(mRequired, mLookup, mDefault, mDefaultSupplier,
                                   mValidators, mForward, mBackward,
                                   append(mStandard, processor, "processor"));
    }

    public boolean isRequired() {
        return mRequired;
    }

    public boolean isUnique() {
        return mLookup != null;
    }

    /**
     * @return null if not unique
     */
    public ExistenceLookup getExistenceLookup() {
        return mLookup;
    }

    /**
     * Returns the default value, invoking the supplier if one was given.
     *
     * @return null if no default
     */
    public Object resolveDefault() {
        return mDefaultSupplier != null ? mDefaultSupplier.get() : mDefault;
    }

    /**
     * @return non-null, unmodifiable list
     */
    public List<Validator> getValidators() {
        return mValidators;
    }

    /**
     * @return non-null, unmodifiable list
     */
    public List<Processor> getForwardProcessors() {
        return mForward;
    }

    /**
     * @return non-null, unmodifiable list
     */
    public List<Processor> getBackwardProcessors() {
        return mBackward;
    }

    /**
     * @return non-null, unmodifiable list
     */
    public List<Processor> getStandardProcessors() {
        return mStandard;
    }

    @Override
    public String toString() {
        StringBuilder b = new StringBuilder("PropertyOptions: {");
        b.append("required=").append(mRequired);
        b.append(", unique=").append(isUnique());
        if (mDefaultSupplier != null) {
            b.append(", default=").append(mDefaultSupplier);
        } else if (mDefault != null) {
            b.append(", default=").append(mDefault);
        }
        b.append(", validators=").append(mValidators.size());
        b.append(", forward=").append(mForward.size());
        b.append(", backward=").append(mBackward.size());
        b.append(", standard=").append(mStandard.size());
        return b.append('}').toString();
    }
}
