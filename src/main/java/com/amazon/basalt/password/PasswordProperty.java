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

package com.amazon.basalt.password;

import java.util.Map;

import com.amazon.basalt.container.DotDict;

import com.amazon.basalt.property.Property;
import com.amazon.basalt.property.PropertyOptions;

/**
 * Property which never holds a plain text password. Assigning text replaces
 * it with a dictionary holding a fresh random {@code salt} and the salted
 * {@code hash}. Loading wraps the stored dictionary without hashing again.
 *
 * <p>Since standardizing always hashes, a value already in hashed form must
 * not be standardized again. Loaded values pass through {@link
 * #convertFromDb} only.
 */
public class PasswordProperty extends Property<DotDict> {
    public static final String SALT = "salt";
    public static final String HASH = "hash";

    private final PasswordHasher mHasher;

    public PasswordProperty() {
        this(new BCryptPasswordHasher(), null);
    }

    public PasswordProperty(PasswordHasher hasher, PropertyOptions options) {
        super(options);
        if (hasher == null) {
            throw new IllegalArgumentException("Null password hasher");
        }
        mHasher = hasher;
    }

    public PasswordHasher getHasher() {
        return mHasher;
    }

    /**
     * Returns true if the plain text matches a hashed password value.
     *
     * @param stored hashed password, as a map with salt and hash entries
     * @return false if stored value is null or malformed
     */
    public boolean checkPassword(Object stored, String plainText) {
        if (!(stored instanceof Map) || plainText == null) {
            return false;
        }
        Map<?, ?> map = (Map<?, ?>) stored;
        Object salt = map.get(SALT);
        Object hash = map.get(HASH);
        if (!(salt instanceof String) || !(hash instanceof String)) {
            return false;
        }
        return mHasher.checkPassword(plainText, (String) salt, (String) hash);
    }

    @Override
    protected DotDict coerce(Object value) {
        if (!(value instanceof String)) {
            throw typeError(value, "a password string");
        }
        String salt = mHasher.generateSalt();
        return new DotDict()
            .set(SALT, salt)
            .set(HASH, mHasher.hashPassword((String) value, salt));
    }

    /**
     * Accepts only an already hashed default, as a map with salt and hash
     * entries. Plain text defaults are rejected, since loading must never
     * hash.
     */
    @Override
    protected DotDict coerceDefault(Object value) {
        if (value instanceof Map) {
            return new DotDict((Map<?, ?>) value);
        }
        throw typeError(value, "a hashed password default");
    }

    @Override
    protected DotDict coerceNull() {
        throw typeError(null, "a password string");
    }

    @Override
    protected DotDict fromStorage(Object dbValue) {
        if (dbValue instanceof Map) {
            return new DotDict((Map<?, ?>) dbValue);
        }
        throw typeError(dbValue, "a stored password");
    }
}
