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
import java.util.Arrays;
import java.util.List;

import junit.framework.TestCase;
import junit.framework.TestSuite;

import com.amazon.basalt.MalformedPropertyException;

import com.amazon.basalt.property.IntegerProperty;
import com.amazon.basalt.property.StringProperty;

import com.amazon.basalt.reference.DictReferenceProperty;
import com.amazon.basalt.reference.MultiReferenceProperty;
import com.amazon.basalt.reference.ReferenceProperty;

import com.amazon.basalt.stored.StoredDocument;
import com.amazon.basalt.stored.StoredDocumentType;

/**
 *
 */
public class TestDocumentSchema extends TestCase {
    public static void main(String[] args) {
        junit.textui.TestRunner.run(suite());
    }

    public static TestSuite suite() {
        return new TestSuite(TestDocumentSchema.class);
    }

    private StoredDocumentType mType;
    private DocumentSchema mSchema;

    public TestDocumentSchema(String name) {
        super(name);
    }

    @Override
    protected void setUp() {
        mType = new StoredDocumentType();
        mSchema = new DocumentSchema("Post")
            .declare("title", new StringProperty())
            .declare("views", new IntegerProperty())
            .declare("author", new ReferenceProperty<StoredDocument>(mType, "posts", null))
            .declare("editor", new ReferenceProperty<StoredDocument>(mType))
            .declare("readers", new MultiReferenceProperty<StoredDocument>(mType))
            .declare("links", new DictReferenceProperty<StoredDocument>(mType));
    }

    public void test_declare() {
        assertEquals(Arrays.asList("title", "views", "author", "editor", "readers", "links"),
                     new ArrayList<String>(mSchema.getProperties().keySet()));
        assertEquals("views", mSchema.getProperty("views").getName());
        assertNull(mSchema.getProperty("nothing"));
        assertEquals(4, mSchema.getReferenceProperties().size());
        assertEquals(1, mSchema.getLinkedReferenceProperties().size());
        assertEquals("posts", mSchema.getLinkedReferenceProperties().get(0).getCollectionName());
    }

    public void test_rejectsDuplicate() {
        try {
            mSchema.declare("title", new StringProperty());
            fail();
        } catch (MalformedPropertyException e) {
            assertEquals("title", e.getPropertyName());
        }

        StringProperty shared = new StringProperty();
        new DocumentSchema("A").declare("name", shared);
        try {
            new DocumentSchema("B").declare("other", shared);
            fail();
        } catch (IllegalStateException e) {
        }
    }

    public void test_referenceBack() {
        DocumentSchema users = new DocumentSchema("User");
        MultiReferenceProperty<StoredDocument> posts =
            new MultiReferenceProperty<StoredDocument>(mType);
        users.declareReferenceBack("posts", posts);
        assertTrue(posts.isReferenceBack());
        assertEquals("posts", posts.getName());
    }

    public void test_deleteReferences() {
        StoredDocument gone = new StoredDocument("gone");
        List<Object> readers = new ArrayList<Object>(Arrays.asList("a", "gone", "b", "gone"));
        StoredDocument post = new StoredDocument("p1")
            .with("title", "Hello")
            .with("author", "gone")
            .with("editor", "someone")
            .with("readers", readers)
            .with("links", new java.util.LinkedHashMap<String, Object>());

        assertEquals(3, mSchema.deleteReferences(post, gone));
        assertNull(post.getData().get("author"));
        assertEquals("someone", post.getData().get("editor"));
        assertEquals(Arrays.asList("a", "b"), readers);
        assertEquals("Hello", post.getData().get("title"));

        assertEquals(0, mSchema.deleteReferences(post, gone));
    }
}
