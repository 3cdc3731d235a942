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

package com.amazon.basalt.reference;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import junit.framework.TestCase;
import junit.framework.TestSuite;

import com.amazon.basalt.Document;
import com.amazon.basalt.FetchException;
import com.amazon.basalt.FetchNoneException;
import com.amazon.basalt.MalformedPropertyException;
import com.amazon.basalt.PropertyTypeException;

import com.amazon.basalt.stored.StoredDocument;
import com.amazon.basalt.stored.StoredDocumentType;

/**
 *
 */
public class TestReferenceProperties extends TestCase {
    public static void main(String[] args) {
        junit.textui.TestRunner.run(suite());
    }

    public static TestSuite suite() {
        return new TestSuite(TestReferenceProperties.class);
    }

    private StoredDocumentType mType;

    public TestReferenceProperties(String name) {
        super(name);
    }

    @Override
    protected void setUp() {
        mType = new StoredDocumentType();
    }

    public void test_reference() {
        StoredDocument doc = new StoredDocument("k1");
        Reference<StoredDocument> byKey = Reference.forKey("k1");
        Reference<StoredDocument> byDoc = Reference.forDocument(doc);

        assertFalse(byKey.isResolved());
        assertNull(byKey.getDocument());
        assertTrue(byDoc.isResolved());
        assertSame(doc, byDoc.getDocument());
        assertEquals("k1", byDoc.getKey());
        assertEquals(byKey, byDoc);
        assertEquals(byKey.hashCode(), byDoc.hashCode());
        assertTrue(byKey.refersTo(doc));
        assertFalse(byKey.refersTo(new StoredDocument("k2")));
        assertFalse(byKey.refersTo(null));

        try {
            Reference.forKey(null);
            fail();
        } catch (IllegalArgumentException e) {
        }
    }

    public void test_malformed() {
        try {
            new ReferenceProperty<StoredDocument>(null);
            fail();
        } catch (MalformedPropertyException e) {
        }
        try {
            new ReferenceProperty<StoredDocument>(new StoredDocumentType(DocumentKind.EMBEDDED));
            fail();
        } catch (MalformedPropertyException e) {
        }
        try {
            new DictReferenceProperty<StoredDocument>(mType, "owners", null);
            fail();
        } catch (MalformedPropertyException e) {
        }
    }

    public void test_single() {
        ReferenceProperty<StoredDocument> p = new ReferenceProperty<StoredDocument>(mType);
        StoredDocument doc = new StoredDocument("k1");

        assertEquals(Reference.forKey("k1"), p.standardize("k1"));
        assertSame(doc, p.standardize(doc).getDocument());
        assertNull(p.standardize(null));

        assertEquals("k1", p.convertToDb(doc));
        assertEquals("k1", p.convertToDb("k1"));
        assertEquals("k1", p.convertToDb(Reference.forDocument(doc)));
        assertNull(p.convertToDb(null));

        assertEquals(Reference.forKey("k1"), p.convertFromDb("k1"));
        assertNull(p.convertFromDb(null));

        assertTrue(p.validate("k1"));
        assertTrue(p.validate(doc));
        assertTrue(p.validate(null));
        assertFalse(p.validate(12));

        try {
            p.convertToDb(12);
            fail();
        } catch (PropertyTypeException e) {
        }
        try {
            p.convertToDb(new StoredDocument(null));
            fail();
        } catch (IllegalStateException e) {
        }
    }

    public void test_singleDelete() {
        ReferenceProperty<StoredDocument> p = new ReferenceProperty<StoredDocument>(mType);
        p.bindName("owner");
        StoredDocument owner = new StoredDocument("o1");
        StoredDocument doc = new StoredDocument("d1").with("owner", "o1");

        assertTrue(p.holdsReference(doc, owner));
        assertTrue(p.deleteReference(doc, owner));
        assertNull(doc.getData().get("owner"));
        assertFalse(p.holdsReference(doc, owner));
        assertFalse(p.deleteReference(doc, owner));
    }

    public void test_deleteRequiresName() {
        ReferenceProperty<StoredDocument> p = new ReferenceProperty<StoredDocument>(mType);
        try {
            p.deleteReference(new StoredDocument("d1"), new StoredDocument("o1"));
            fail();
        } catch (IllegalStateException e) {
        }
    }

    public void test_attemptLoad() throws Exception {
        StoredDocument stored = mType.put("k1");
        ReferenceProperty<StoredDocument> p = new ReferenceProperty<StoredDocument>(mType);

        Reference<StoredDocument> ref = p.attemptLoad("k1");
        assertTrue(ref.isResolved());
        assertSame(stored, ref.getDocument());
        assertEquals(1, mType.mLoadCount);

        assertSame(ref, p.attemptLoad(ref));
        assertEquals(1, mType.mLoadCount);
        assertNull(p.attemptLoad(null));

        try {
            p.attemptLoad("missing");
            fail();
        } catch (FetchNoneException e) {
            assertEquals("missing", e.getKey());
        }

        mType.mFailure = new FetchException("down");
        try {
            p.attemptLoad("k1");
            fail();
        } catch (FetchNoneException e) {
            fail();
        } catch (FetchException e) {
            assertEquals("down", e.getMessage());
        }
    }

    public void test_attemptLoadSimple() throws Exception {
        StoredDocumentType simple = new StoredDocumentType(DocumentKind.SIMPLE);
        ReferenceProperty<StoredDocument> p = new ReferenceProperty<StoredDocument>(simple);
        Reference<StoredDocument> ref = p.attemptLoad("k1");
        assertFalse(ref.isResolved());
        assertEquals(0, simple.mLoadCount);
    }

    public void test_multi() {
        MultiReferenceProperty<StoredDocument> p =
            new MultiReferenceProperty<StoredDocument>(mType);
        StoredDocument doc = new StoredDocument("k2");

        List<Reference<StoredDocument>> refs = p.standardize(Arrays.asList("k1", doc));
        assertEquals(2, refs.size());
        assertSame(doc, refs.get(1).getDocument());
        assertNull(p.standardize(null));

        assertEquals(Arrays.asList("k1", "k2"), p.convertToDb(Arrays.asList("k1", doc)));
        assertEquals(Arrays.asList("k1", "k2"), p.convertToDb(refs));
        assertEquals(new ArrayList<Object>(), p.convertToDb(null));

        assertEquals(Arrays.asList(Reference.forKey("k1")), p.convertFromDb(Arrays.asList("k1")));
        assertTrue(p.convertFromDb(null).isEmpty());
        assertNotSame(p.defaultValue(), p.defaultValue());

        assertTrue(p.validate(Arrays.asList("k1", doc)));
        assertFalse(p.validate(Arrays.asList("k1", 5)));
        assertFalse(p.validate("k1"));

        try {
            p.convertToDb(Arrays.asList(5));
            fail();
        } catch (PropertyTypeException e) {
        }
    }

    public void test_multiDelete() {
        MultiReferenceProperty<StoredDocument> p =
            new MultiReferenceProperty<StoredDocument>(mType);
        p.bindName("friends");

        StoredDocument r = new StoredDocument("r");
        List<Object> friends = new ArrayList<Object>();
        friends.add("a");
        friends.add(Reference.forKey("r"));
        friends.add(new StoredDocument("b"));
        friends.add("r");
        StoredDocument doc = new StoredDocument("d").with("friends", friends);

        assertTrue(p.deleteReference(doc, r));
        assertSame(friends, doc.getData().get("friends"));
        assertEquals(3, friends.size());
        assertEquals("r", friends.get(2));

        assertTrue(p.deleteReference(doc, r));
        assertEquals(2, friends.size());

        assertFalse(p.deleteReference(doc, r));
        assertEquals(2, friends.size());

        assertTrue(p.deleteReference(doc, new StoredDocument("b")));
        assertEquals(Arrays.asList((Object) "a"), friends);
    }

    public void test_dict() throws Exception {
        DictReferenceProperty<StoredDocument> p = new DictReferenceProperty<StoredDocument>(mType);
        StoredDocument stored = mType.put("k1");

        Map<String, Object> input = new LinkedHashMap<String, Object>();
        input.put("first", "k1");
        input.put("second", stored);

        Map<String, Reference<StoredDocument>> refs = p.standardize(input);
        assertEquals(Reference.forKey("k1"), refs.get("first"));

        Map<String, Object> expected = new LinkedHashMap<String, Object>();
        expected.put("first", "k1");
        expected.put("second", "k1");
        assertEquals(expected, p.convertToDb(input));
        assertEquals(new LinkedHashMap<String, Object>(), p.convertToDb(null));
        assertTrue(p.convertFromDb(null).isEmpty());

        assertTrue(p.validate(input));
        input.put("third", 3);
        assertFalse(p.validate(input));
        assertFalse(p.validate(Arrays.asList("k1")));

        Map<String, Reference<StoredDocument>> loaded = p.attemptLoad(expected);
        assertSame(stored, loaded.get("first").getDocument());
        assertSame(stored, loaded.get("second").getDocument());
    }

    public void test_dictRejectsNullKey() {
        DictReferenceProperty<StoredDocument> p = new DictReferenceProperty<StoredDocument>(mType);
        Map<String, Object> input = new HashMap<String, Object>();
        input.put(null, "k1");

        assertFalse(p.validate(input));
        try {
            p.standardize(input);
            fail();
        } catch (PropertyTypeException e) {
        }
        try {
            p.convertToDb(input);
            fail();
        } catch (PropertyTypeException e) {
        }
    }

    public void test_dictDelete() {
        DictReferenceProperty<StoredDocument> p = new DictReferenceProperty<StoredDocument>(mType);
        p.bindName("links");

        Map<String, Object> links = new LinkedHashMap<String, Object>();
        links.put("a", "x");
        links.put("b", "y");
        StoredDocument doc = new StoredDocument("d").with("links", links);

        assertTrue(p.deleteReference(doc, new StoredDocument("y")));
        assertEquals(1, links.size());
        assertTrue(links.containsKey("a"));
        assertFalse(p.deleteReference(doc, new StoredDocument("y")));
    }

    public void test_referenceBack() {
        MultiReferenceProperty<StoredDocument> p =
            new MultiReferenceProperty<StoredDocument>(mType, "members", null);
        assertEquals("members", p.getCollectionName());
        assertFalse(p.isReferenceBack());
        p.setReferenceBack(true);
        assertTrue(p.isReferenceBack());
    }

    public void test_anyDocument() {
        ReferenceType<Document> any = new ReferenceType<Document>() {
            public Class<Document> getDocumentClass() {
                return Document.class;
            }

            public DocumentKind getKind() {
                return DocumentKind.STORED;
            }

            public Document load(String key) {
                return null;
            }
        };
        ReferenceProperty<Document> p = new ReferenceProperty<Document>(any);
        assertEquals("k", p.convertToDb(new StoredDocument("k")));
    }
}
