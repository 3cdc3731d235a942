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
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import junit.framework.TestCase;
import junit.framework.TestSuite;

import com.amazon.basalt.PropertyTypeException;

import com.amazon.basalt.container.DotDict;

/**
 *
 */
public class TestCollectionProperties extends TestCase {
    public static void main(String[] args) {
        junit.textui.TestRunner.run(suite());
    }

    public static TestSuite suite() {
        return new TestSuite(TestCollectionProperties.class);
    }

    public TestCollectionProperties(String name) {
        super(name);
    }

    public void test_independentDefaults() {
        DictProperty dict = new DictProperty();
        DotDict d1 = dict.defaultValue();
        DotDict d2 = dict.defaultValue();
        d1.put("a", 1);
        assertTrue(d2.isEmpty());

        ListProperty list = new ListProperty();
        List<Object> l1 = list.defaultValue();
        List<Object> l2 = list.defaultValue();
        l1.add("x");
        assertTrue(l2.isEmpty());

        SetProperty set = new SetProperty();
        Set<Object> s1 = set.defaultValue();
        Set<Object> s2 = set.defaultValue();
        s1.add("x");
        assertTrue(s2.isEmpty());

        assertNotSame(set.convertFromDb(null), set.convertFromDb(null));
    }

    public void test_configuredDefaultsCopied() {
        ListProperty list = new ListProperty
            (PropertyOptions.defaults().withDefault(new ArrayList<Object>()));
        List<Object> l1 = list.defaultValue();
        l1.add("x");
        List<Object> l2 = list.defaultValue();
        assertNotSame(l1, l2);
        assertTrue(l2.isEmpty());
        assertTrue(list.convertFromDb(null).isEmpty());

        SetProperty set = new SetProperty
            (PropertyOptions.defaults().withDefault(new LinkedHashSet<Object>(Arrays.asList("a"))));
        set.defaultValue().add("b");
        assertEquals(new LinkedHashSet<Object>(Arrays.asList("a")), set.defaultValue());

        DictProperty dict = new DictProperty
            (PropertyOptions.defaults().withDefault(new DotDict().set("a", 1)));
        dict.defaultValue().put("b", 2);
        DotDict d = dict.defaultValue();
        assertEquals(1, d.size());
        assertEquals(1, d.get("a"));
    }

    public void test_dict() {
        DictProperty p = new DictProperty();
        Map<String, Object> inner = new HashMap<String, Object>();
        inner.put("c", 3);
        Map<String, Object> map = new HashMap<String, Object>();
        map.put("a", 1);
        map.put("b", inner);

        DotDict dict = p.standardize(map);
        assertEquals(1, dict.get("a"));
        assertTrue(dict.get("b") instanceof DotDict);
        assertEquals(3, dict.getPath("b.c"));
        assertSame(dict, p.standardize(dict));

        assertTrue(p.validate(map));
        assertFalse(p.validate("text"));
        assertSame(dict, p.convertToDb(dict));

        DotDict loaded = p.convertFromDb(map);
        assertEquals(dict, loaded);
        assertNull(p.standardize(null));

        try {
            p.standardize("text");
            fail();
        } catch (PropertyTypeException e) {
        }
    }

    public void test_list() {
        ListProperty p = new ListProperty();
        List<Object> list = new ArrayList<Object>(Arrays.asList(1, "two"));
        assertSame(list, p.standardize(list));
        assertEquals(list, p.standardize(new LinkedHashSet<Object>(list)));
        assertEquals(Arrays.asList(1, 2), p.standardize(new int[] {1, 2}));
        assertSame(list, p.convertToDb(list));
        assertEquals(list, p.convertFromDb(list));
        assertTrue(p.convertFromDb(null).isEmpty());

        try {
            p.standardize("text");
            fail();
        } catch (PropertyTypeException e) {
        }
    }

    public void test_set() {
        SetProperty p = new SetProperty();
        Set<Object> set = p.standardize(Arrays.asList("b", "a", "b"));
        assertEquals(2, set.size());
        assertEquals(Arrays.asList("b", "a"), new ArrayList<Object>(set));

        Map<String, Object> map = new HashMap<String, Object>();
        map.put("k", 1);
        assertEquals(1, p.standardize(map).size());
        assertEquals(3, p.standardize(new String[] {"x", "y", "z"}).size());

        Object db = p.convertToDb(set);
        assertTrue(db instanceof List);
        assertEquals(Arrays.asList("b", "a"), db);
        assertNull(p.convertToDb(null));

        Set<Object> loaded = p.convertFromDb(db);
        assertEquals(set, loaded);

        assertTrue(p.validate(Arrays.asList(1)));
        assertTrue(p.validate(new Object[0]));
        assertFalse(p.validate("abc"));
        assertFalse(p.validate(5));

        try {
            p.standardize("abc");
            fail();
        } catch (PropertyTypeException e) {
        }
    }
}
