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

package com.amazon.basalt.info;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import com.amazon.basalt.Document;
import com.amazon.basalt.MalformedPropertyException;

import com.amazon.basalt.property.Property;

import com.amazon.basalt.reference.AbstractReferenceProperty;

/**
 * Ordered set of named properties declared for a document class. Declaring a
 * property binds its name. A schema is built once, when its document class is
 * defined, and is then shared by all documents of the class.
 *
 * <p>Example:<pre>
 * DocumentSchema users = new DocumentSchema("User")
 *     .declare("name", new StringProperty(PropertyOptions.defaults().withRequired()))
 *     .declare("age", new IntegerProperty())
 *     .declare("groups", new MultiReferenceProperty&lt;Group&gt;(groupType, "members", null));
 * </pre>
 */
public class DocumentSchema {
    private static final Log cLog = LogFactory.getLog(DocumentSchema.class);

    private final String mName;
    private final Map<String, Property<?>> mProperties;

    /**
     * @param name name of the document class, used in messages
     */
    public DocumentSchema(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Null schema name");
        }
        mName = name;
        mProperties = new LinkedHashMap<String, Property<?>>();
    }

    public String getName() {
        return mName;
    }

    /**
     * Declares a property and binds its name.
     *
     * @return this schema, for chaining
     * @throws MalformedPropertyException if name is already declared
     * @throws IllegalStateException if property is bound to another name
     */
    public synchronized DocumentSchema declare(String name, Property<?> property) {
        if (property == null) {
            throw new IllegalArgumentException("Null property");
        }
        if (mProperties.containsKey(name)) {
            throw new MalformedPropertyException
                (name, "Property is already declared on " + mName);
        }
        property.bindName(name);
        mProperties.put(name, property);

        if (property instanceof AbstractReferenceProperty && cLog.isDebugEnabled()) {
            AbstractReferenceProperty<?, ?> ref = (AbstractReferenceProperty<?, ?>) property;
            if (ref.isReferenceBack()) {
                cLog.debug("Declared " + mName + '.' + name + " as inverse reference");
            } else if (ref.getCollectionName() != null) {
                cLog.debug("Declared " + mName + '.' + name + " linked to " +
                           ref.getReferenceType().getDocumentClass().getSimpleName() + '.' +
                           ref.getCollectionName());
            }
        }

        return this;
    }

    /**
     * Declares the inverse side of a linked reference property, flagging it
     * as a reference back.
     *
     * @param name collection name given by the linked reference property
     */
    public DocumentSchema declareReferenceBack(String name,
                                               AbstractReferenceProperty<?, ?> property)
    {
        if (property == null) {
            throw new IllegalArgumentException("Null property");
        }
        property.setReferenceBack(true);
        return declare(name, property);
    }

    /**
     * @return null if not declared
     */
    public synchronized Property<?> getProperty(String name) {
        return mProperties.get(name);
    }

    /**
     * @return unmodifiable snapshot of properties in declaration order
     */
    public synchronized Map<String, Property<?>> getProperties() {
        return Collections.unmodifiableMap(new LinkedHashMap<String, Property<?>>(mProperties));
    }

    /**
     * @return all reference properties in declaration order
     */
    public synchronized List<AbstractReferenceProperty<?, ?>> getReferenceProperties() {
        List<AbstractReferenceProperty<?, ?>> refs =
            new ArrayList<AbstractReferenceProperty<?, ?>>();
        for (Property<?> property : mProperties.values()) {
            if (property instanceof AbstractReferenceProperty) {
                refs.add((AbstractReferenceProperty<?, ?>) property);
            }
        }
        return refs;
    }

    /**
     * @return reference properties which name an inverse collection
     */
    public List<AbstractReferenceProperty<?, ?>> getLinkedReferenceProperties() {
        List<AbstractReferenceProperty<?, ?>> refs = getReferenceProperties();
        List<AbstractReferenceProperty<?, ?>> linked =
            new ArrayList<AbstractReferenceProperty<?, ?>>();
        for (AbstractReferenceProperty<?, ?> ref : refs) {
            if (ref.getCollectionName() != null) {
                linked.add(ref);
            }
        }
        return linked;
    }

    /**
     * Removes references to a document from every reference property of
     * another. Collections held in the document's data are modified in place.
     *
     * @param doc document whose references are removed
     * @param ref referenced document, usually one being deleted
     * @return number of references removed
     */
    public int deleteReferences(Document doc, Document ref) {
        int count = 0;
        for (AbstractReferenceProperty<?, ?> property : getReferenceProperties()) {
            while (property.holdsReference(doc, ref) && property.deleteReference(doc, ref)) {
                count++;
            }
        }
        return count;
    }

    @Override
    public String toString() {
        return "DocumentSchema " + mName + ' ' + getProperties().keySet();
    }
}
