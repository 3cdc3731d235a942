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
import com.amazon.basalt.PropertyTypeException;

/**
 * Declarative descriptor for one document field, converting between the
 * application-facing value and the storage value. The owning document calls
 * the stages at fixed points of its lifecycle:
 *
 * <ul>
 * <li>{@link #standardize} when a field is assigned
 * <li>{@link #validate} and then {@link #convertToDb} before saving
 * <li>{@link #convertFromDb} after loading raw storage data
 * </ul>
 *
 * <p>The stage methods are final. They always run the configured processors,
 * validators and default back-fill, and call out to narrow hooks for the
 * type-specific work. Every stage accepts null.
 *
 * <p>Instances are shared by all documents of a type and hold no per-document
 * state. The only mutation after construction is the one-time binding of the
 * property name.
 *
 * @param <T> standardized value type
 */
public abstract class Property<T> {
    private final PropertyOptions mOptions;

    private volatile String mName;

    protected Property(PropertyOptions options) {
        mOptions = options == null ? PropertyOptions.defaults() : options;
    }

    /**
     * Returns the name bound by the owning document, or null if not bound yet.
     */
    public String getName() {
        return mName;
    }

    /**
     * Binds the field name of this property. Binding the same name again is
     * allowed.
     *
     * @throws IllegalArgumentException if name is null or empty
     * @throws IllegalStateException if already bound to a different name
     */
    public synchronized void bindName(String name) {
        if (name == null || name.length() == 0) {
            throw new IllegalArgumentException("Property name must not be empty");
        }
        if (mName != null && !mName.equals(name)) {
            throw new IllegalStateException
                ("Property is already bound to \"" + mName + "\", cannot rebind to \"" +
                 name + '"');
        }
        mName = name;
    }

    public PropertyOptions getOptions() {
        return mOptions;
    }

    public boolean isRequired() {
        return mOptions.isRequired();
    }

    public boolean isUnique() {
        return mOptions.isUnique();
    }

    /**
     * Converts a value from any form (input or storage) into the standard form
     * used by application code. Standard processors run first, then the value
     * is coerced.
     *
     * @throws PropertyTypeException if value cannot be coerced
     */
    public final T standardize(Object value) {
        value = Processors.apply(value, mOptions.getStandardProcessors());
        return value == null ? coerceNull() : coerce(value);
    }

    /**
     * Returns true if the value is in this property's domain and every
     * validator accepts it. The domain check never throws; validators are
     * only consulted for values in the domain.
     */
    public final boolean validate(Object value) {
        if (value != null && !isInDomain(value)) {
            return false;
        }
        for (Validator validator : mOptions.getValidators()) {
            if (!validator.isValid(value)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Converts a value into a storage-safe form: null, text, numbers,
     * booleans, lists and maps. Forward processors run first.
     *
     * @throws PropertyTypeException if value has no storage form
     */
    public final Object convertToDb(Object value) {
        value = Processors.apply(value, mOptions.getForwardProcessors());
        return value == null ? toStorageNull() : toStorage(value);
    }

    /**
     * Converts a raw storage value into the standard form, then runs the
     * backward processors. A null storage value is replaced by the {@link
     * #defaultValue default}, which back-fills fields added after existing
     * records were written.
     *
     * @throws PropertyTypeException if stored value is malformed
     */
    @SuppressWarnings("unchecked")
    public final T convertFromDb(Object dbValue) {
        Object value = dbValue == null ? defaultValue() : fromStorage(dbValue);
        return (T) Processors.apply(value, mOptions.getBackwardProcessors());
    }

    /**
     * Returns the configured default in standard form. If no default is
     * configured, returns the {@link #emptyValue empty value}.
     */
    public final T defaultValue() {
        Object value = mOptions.resolveDefault();
        return value == null ? emptyValue() : coerceDefault(value);
    }

    /**
     * Checks if a value already exists in storage, for unique properties.
     *
     * @param value raw value to check, passed to the lookup unprocessed
     * @return null if this property is not unique
     * @throws FetchException if the lookup fails
     */
    public Boolean hasValue(Object value) throws FetchException {
        ExistenceLookup lookup = mOptions.getExistenceLookup();
        if (lookup == null) {
            return null;
        }
        return lookup.exists(value);
    }

    /**
     * Coerces a non-null value into the standard form.
     *
     * @throws PropertyTypeException if value cannot be coerced
     */
    protected abstract T coerce(Object value);

    /**
     * Converts a non-null configured default into the standard form. Default
     * implementation coerces it. Container variants copy the default, since
     * the same default object is handed out for every document.
     *
     * @throws PropertyTypeException if default cannot be converted
     */
    protected T coerceDefault(Object value) {
        return coerce(value);
    }

    /**
     * Returns the standard form of null, which is null unless overridden.
     */
    protected T coerceNull() {
        return null;
    }

    /**
     * Structural check of a non-null value. Implementations must return false
     * rather than throw.
     */
    protected boolean isInDomain(Object value) {
        return true;
    }

    /**
     * Converts a non-null, forward processed value into storage form. Default
     * implementation returns the value as-is.
     */
    protected Object toStorage(Object value) {
        return value;
    }

    /**
     * Returns the storage form of null, which is null unless overridden.
     */
    protected Object toStorageNull() {
        return null;
    }

    /**
     * Converts a non-null storage value into the standard form. Default
     * implementation coerces it.
     */
    protected T fromStorage(Object dbValue) {
        return coerce(dbValue);
    }

    /**
     * Returns the value used when no default is configured, which is null
     * unless overridden. Containers must be created fresh on each call.
     */
    protected T emptyValue() {
        return null;
    }

    protected PropertyTypeException typeError(Object value, String expected) {
        return new PropertyTypeException(mName, value, expected);
    }

    protected PropertyTypeException typeError(Object value, String expected, Throwable cause) {
        return new PropertyTypeException(mName, value, expected, cause);
    }

    @Override
    public String toString() {
        String name = mName;
        return getClass().getSimpleName() + (name == null ? "" : " \"" + name + '"');
    }
}
