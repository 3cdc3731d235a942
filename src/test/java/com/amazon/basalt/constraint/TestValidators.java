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

package com.amazon.basalt.constraint;

import java.util.Arrays;
import java.util.Collections;

import junit.framework.TestCase;
import junit.framework.TestSuite;

import com.amazon.basalt.MalformedPropertyException;

import com.amazon.basalt.property.IntegerProperty;
import com.amazon.basalt.property.PropertyOptions;
import com.amazon.basalt.property.StringProperty;

/**
 *
 */
public class TestValidators extends TestCase {
    public static void main(String[] args) {
        junit.textui.TestRunner.run(suite());
    }

    public static TestSuite suite() {
        return new TestSuite(TestValidators.class);
    }

    public TestValidators(String name) {
        super(name);
    }

    public void test_range() {
        RangeValidator v = RangeValidator.between(0, 120);
        assertTrue(v.isValid(null));
        assertTrue(v.isValid(0));
        assertTrue(v.isValid(120L));
        assertTrue(v.isValid(99.5));
        assertTrue(v.isValid("42"));
        assertFalse(v.isValid(-1));
        assertFalse(v.isValid(120.5));
        assertFalse(v.isValid("old"));
        assertFalse(v.isValid(Double.NaN));
        assertFalse(v.isValid(true));
    }

    public void test_rangeAllowedAndDisallowed() {
        RangeValidator allowed = RangeValidator.oneOf(1, 2, 4);
        assertTrue(allowed.isValid(2));
        assertTrue(allowed.isValid(4.0));
        assertFalse(allowed.isValid(3));
        assertFalse(allowed.isValid(2.5));

        RangeValidator disallowed = new RangeValidator(0, 10, null, new long[] {5});
        assertTrue(disallowed.isValid(4));
        assertFalse(disallowed.isValid(5));
        assertFalse(disallowed.isValid(5.0));
        assertTrue(disallowed.isValid(5.5));
    }

    public void test_rangeMalformed() {
        try {
            RangeValidator.between(10, 0);
            fail();
        } catch (MalformedPropertyException e) {
        }
        try {
            new RangeValidator(0, 10, new long[] {11}, null);
            fail();
        } catch (MalformedPropertyException e) {
        }
        try {
            new RangeValidator(0, 10, new long[] {3}, new long[] {3});
            fail();
        } catch (MalformedPropertyException e) {
        }
    }

    public void test_length() {
        LengthValidator v = new LengthValidator(1, 3);
        assertTrue(v.isValid(null));
        assertTrue(v.isValid("abc"));
        assertFalse(v.isValid(""));
        assertFalse(v.isValid("abcd"));
        assertTrue(v.isValid(Arrays.asList(1, 2)));
        assertFalse(v.isValid(Collections.emptyMap()));
        assertTrue(v.isValid(new int[] {1}));
        assertFalse(v.isValid(12));

        assertTrue(new LengthValidator(2).isValid("a long piece of text"));

        try {
            new LengthValidator(-1, 3);
            fail();
        } catch (MalformedPropertyException e) {
        }
        try {
            new LengthValidator(3, 2);
            fail();
        } catch (MalformedPropertyException e) {
        }
    }

    public void test_text() {
        TextValidator allowed = TextValidator.oneOf("Y", "N");
        assertTrue(allowed.isValid("Y"));
        assertTrue(allowed.isValid('N'));
        assertTrue(allowed.isValid(new char[] {'Y'}));
        assertFalse(allowed.isValid("y"));
        assertFalse(allowed.isValid(1));
        assertTrue(allowed.isValid(null));

        TextValidator disallowed = TextValidator.noneOf("root");
        assertTrue(disallowed.isValid("alice"));
        assertFalse(disallowed.isValid("root"));

        try {
            new TextValidator(new String[] {"a"}, new String[] {"a"});
            fail();
        } catch (MalformedPropertyException e) {
        }
    }

    public void test_withProperties() {
        IntegerProperty age = new IntegerProperty
            (PropertyOptions.defaults().withValidator(RangeValidator.between(0, 120)));
        assertTrue(age.validate(30));
        assertFalse(age.validate(300));
        assertTrue(age.validate(null));

        StringProperty code = new StringProperty
            (PropertyOptions.defaults()
             .withValidator(new LengthValidator(2, 2))
             .withValidator(TextValidator.noneOf("XX")));
        assertTrue(code.validate("US"));
        assertFalse(code.validate("USA"));
        assertFalse(code.validate("XX"));
    }
}
