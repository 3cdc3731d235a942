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

package com.amazon.basalt.embedded;

import java.lang.ref.Reference;
import java.lang.ref.SoftReference;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import org.cojen.util.BeanIntrospector;
import org.cojen.util.BeanProperty;
import org.cojen.util.WeakIdentityMap;

import com.amazon.basalt.EmbeddedDocument;
import com.amazon.basalt.MalformedPropertyException;
import com.amazon.basalt.PropertyTypeException;

/**
 * Embedded type for JavaBean documents. Each readable and writable bean
 * property is a document field. Fields are assigned through setters, and
 * numbers are adapted to the setter's parameter type. A map assigned to a
 * property whose type is itself an embedded bean is constructed into one.
 *
 * <p>Map keys with no matching bean property are ignored, so that fields
 * removed from a class do not prevent older records from loading.
 *
 * @param <E> embedded document type
 */
public class BeanEmbeddedType<E extends EmbeddedDocument> implements EmbeddedType<E> {
    private static final Log cLog = LogFactory.getLog(BeanEmbeddedType.class);

    @SuppressWarnings("unchecked")
    private static final Map<Class<?>, Reference<BeanEmbeddedType<?>>> cCache =
        new WeakIdentityMap();

    /**
     * Returns the embedded type for the given bean class, which must have a
     * public no-arg constructor.
     *
     * @throws MalformedPropertyException if class cannot be instantiated
     */
    @SuppressWarnings("unchecked")
    public static <E extends EmbeddedDocument> BeanEmbeddedType<E> forClass(Class<E> clazz) {
        if (clazz == null) {
            throw new IllegalArgumentException("Null embedded document class");
        }
        synchronized (cCache) {
            Reference<BeanEmbeddedType<?>> ref = cCache.get(clazz);
            BeanEmbeddedType<E> type;
            if (ref != null) {
                type = (BeanEmbeddedType<E>) ref.get();
                if (type != null) {
                    return type;
                }
            }
            type = new BeanEmbeddedType<E>(clazz);
            // Values refer to their class, so hold them softly or the weak key never clears.
            cCache.put(clazz, new SoftReference<BeanEmbeddedType<?>>(type));
            return type;
        }
    }

    private final Class<E> mClass;
    private final Constructor<E> mConstructor;
    private final Map<String, BeanProperty> mProperties;

    private BeanEmbeddedType(Class<E> clazz) {
        if (clazz.isInterface() || Modifier.isAbstract(clazz.getModifiers())) {
            throw new MalformedPropertyException
                ("Embedded document class must be concrete: " + clazz.getName());
        }
        try {
            mConstructor = clazz.getConstructor();
        } catch (NoSuchMethodException e) {
            throw new MalformedPropertyException
                ("Embedded document class must have a public no-arg constructor: " +
                 clazz.getName());
        }
        mClass = clazz;

        Map<String, BeanProperty> properties = new LinkedHashMap<String, BeanProperty>();
        for (BeanProperty bp : BeanIntrospector.getAllProperties(clazz).values()) {
            if (bp.getReadMethod() != null && bp.getWriteMethod() != null) {
                properties.put(bp.getName(), bp);
            }
        }
        mProperties = Collections.unmodifiableMap(properties);

        if (cLog.isDebugEnabled()) {
            cLog.debug("Introspected embedded document " + clazz.getName() +
                       ": " + mProperties.keySet());
        }
    }

    public Class<E> getDocumentClass() {
        return mClass;
    }

    /**
     * @return unmodifiable map of field name to bean property
     */
    public Map<String, BeanProperty> getProperties() {
        return mProperties;
    }

    public E newInstance(Map<String, ?> fields) {
        E document;
        try {
            document = mConstructor.newInstance();
        } catch (InvocationTargetException e) {
            throw new IllegalStateException
                ("Cannot construct " + mClass.getName(), e.getCause());
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException("Cannot construct " + mClass.getName(), e);
        }

        if (fields != null) {
            for (Map.Entry<String, ?> entry : fields.entrySet()) {
                BeanProperty bp = mProperties.get(entry.getKey());
                if (bp == null) {
                    if (cLog.isDebugEnabled()) {
                        cLog.debug("Ignoring unknown field \"" + entry.getKey() +
                                   "\" of " + mClass.getName());
                    }
                    continue;
                }
                Object value = adapt(bp, entry.getValue());
                invoke(bp.getWriteMethod(), document, value);
            }
        }

        return document;
    }

    public E constructObject(Map<String, ?> serialized) {
        return newInstance(serialized);
    }

    /**
     * Reads every field of the given document into a new map, serializing
     * nested embedded documents.
     */
    public Map<String, Object> serialize(E document) {
        Map<String, Object> map = new LinkedHashMap<String, Object>(mProperties.size() * 2);
        for (BeanProperty bp : mProperties.values()) {
            map.put(bp.getName(), serializeValue(invoke(bp.getReadMethod(), document)));
        }
        return map;
    }

    @Override
    public String toString() {
        return "BeanEmbeddedType " + mClass.getName();
    }

    private static Object serializeValue(Object value) {
        if (value instanceof EmbeddedDocument) {
            return ((EmbeddedDocument) value).serialize();
        }
        if (value instanceof List) {
            List<?> list = (List<?>) value;
            List<Object> copy = new ArrayList<Object>(list.size());
            for (Object element : list) {
                copy.add(serializeValue(element));
            }
            return copy;
        }
        if (value instanceof Map) {
            Map<?, ?> map = (Map<?, ?>) value;
            Map<String, Object> copy = new LinkedHashMap<String, Object>(map.size() * 2);
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                copy.put(String.valueOf(entry.getKey()), serializeValue(entry.getValue()));
            }
            return copy;
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    private Object adapt(BeanProperty bp, Object value) {
        Class<?> type = bp.getType();
        if (value == null) {
            if (type.isPrimitive()) {
                throw new PropertyTypeException(bp.getName(), null, type.getName());
            }
            return null;
        }
        if (type.isInstance(value)) {
            return value;
        }
        if (value instanceof Map && EmbeddedDocument.class.isAssignableFrom(type)) {
            return forClass((Class<EmbeddedDocument>) type).constructObject((Map<String, ?>) value);
        }
        if (value instanceof Number) {
            Number n = (Number) value;
            if (type == int.class || type == Integer.class) {
                return n.intValue();
            } else if (type == long.class || type == Long.class) {
                return n.longValue();
            } else if (type == double.class || type == Double.class) {
                return n.doubleValue();
            } else if (type == float.class || type == Float.class) {
                return n.floatValue();
            } else if (type == short.class || type == Short.class) {
                return n.shortValue();
            } else if (type == byte.class || type == Byte.class) {
                return n.byteValue();
            }
        }
        if (value instanceof Boolean && type == boolean.class) {
            return value;
        }
        if (value instanceof Character && type == char.class) {
            return value;
        }
        throw new PropertyTypeException(bp.getName(), value, type.getName());
    }

    private Object invoke(Method method, Object document, Object... args) {
        try {
            return method.invoke(document, args);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException("Cannot invoke " + method, cause);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Cannot invoke " + method, e);
        }
    }
}
