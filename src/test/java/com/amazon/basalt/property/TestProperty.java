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
import java.util.List;

import java.util.function.Supplier;

import junit.framework.TestCase;
import junit.framework.TestSuite;

import com.amazon.basalt.FetchException;

/**
 * Tests the stage methods common to all properties.
 */
public class TestProperty extends TestCase {
    public static void main(String[] args) {
        junit.textui.TestRunner.run(suite());
    }

    public static TestSuite suite() {
        return new TestSuite(TestProperty.class);
    }

    static Processor append(final String suffix) {
        return new Processor() {
            public Object process(Object value) {
                return value == null ? suffix : value + suffix;
            }
        };
    }

    public TestProperty(String name) {
        super(name);
    }

    public void test_nullAtEveryStage() {
        Property<?>[] properties = {
            new StringProperty(), new IntegerProperty(), new FloatProperty(),
            new BooleanProperty(), new DynamicProperty(), new EnumProperty("a", "b"),
        };
        for (Property<?> p : properties) {
            assertNull(p.toString(), p.standardize(null));
            assertTrue(p.toString(), p.validate(null));
            assertNull(p.toString(), p.convertToDb(null));
            assertNull(p.toString(), p.convertFromDb(null));
        }
    }

    public void test_processorOrder() {
        PropertyOptions options = PropertyOptions.defaults()
            .withStandardProcessor(append("1"))
            .withStandardProcessor(append("2"))
            .withForwardProcessor(append("f"))
            .withBackwardProcessor(append("b"));
        StringProperty p = new StringProperty(options);

        assertEquals("x12", p.standardize("x"));
        assertEquals("xf", p.convertToDb("x"));
        assertEquals("xb", p.convertFromDb("x"));
    }

    public void test_processorsSeeNull() {
        StringProperty p = new StringProperty
            (PropertyOptions.defaults().withForwardProcessor(append("!")));
        assertEquals("!", p.convertToDb(null));
    }

    public void test_standardProcessorRunsBeforeCoercion() {
        Processor trim = new Processor() {
            public Object process(Object value) {
                return value == null ? null : value.toString().trim();
            }
        };
        IntegerProperty p = new IntegerProperty
            (PropertyOptions.defaults().withStandardProcessor(trim));
        assertEquals(Long.valueOf(42), p.standardize(" 42 "));
    }

    public void test_convertFromDbNullUsesDefault() {
        IntegerProperty p = new IntegerProperty(PropertyOptions.defaults().withDefault(7));
        assertEquals(Long.valueOf(7), p.defaultValue());
        assertEquals(Long.valueOf(7), p.convertFromDb(null));

        IntegerProperty none = new IntegerProperty();
        assertNull(none.defaultValue());
        assertNull(none.convertFromDb(null));
    }

    public void test_defaultPassesThroughBackwardProcessors() {
        StringProperty p = new StringProperty
            (PropertyOptions.defaults().withDefault("d").withBackwardProcessor(append("b")));
        assertEquals("db", p.convertFromDb(null));
    }

    public void test_defaultSupplierInvokedEachTime() {
        final int[] calls = new int[1];
        Supplier<List<Object>> supplier = new Supplier<List<Object>>() {
            public List<Object> get() {
                calls[0]++;
                return new ArrayList<Object>();
            }
        };
        ListProperty p = new ListProperty(PropertyOptions.defaults().withDefaultSupplier(supplier));

        List<Object> a = p.defaultValue();
        List<Object> b = p.defaultValue();
        assertEquals(2, calls[0]);
        assertNotSame(a, b);
    }

    public void test_validatorsAreAnded() {
        Validator notEmpty = new Validator() {
            public boolean isValid(Object value) {
                return value == null || value.toString().length() > 0;
            }
        };
        Validator shortText = new Validator() {
            public boolean isValid(Object value) {
                return value == null || value.toString().length() < 4;
            }
        };
        StringProperty p = new StringProperty
            (PropertyOptions.defaults().withValidator(notEmpty).withValidator(shortText));

        assertTrue(p.validate("abc"));
        assertFalse(p.validate(""));
        assertFalse(p.validate("abcd"));
    }

    public void test_validatorsSkippedOutsideDomain() {
        Validator failing = new Validator() {
            public boolean isValid(Object value) {
                throw new AssertionError("should not be called");
            }
        };
        IntegerProperty p = new IntegerProperty
            (PropertyOptions.defaults().withValidator(failing));
        assertFalse(p.validate("not a number"));
    }

    public void test_noValidatorsAlwaysValid() {
        assertTrue(new StringProperty().validate("anything"));
        assertTrue(new IntegerProperty().validate(12));
        assertTrue(new FloatProperty().validate(1.5));
        assertTrue(new BooleanProperty().validate(new Object()));
        assertTrue(new DynamicProperty().validate(new Object()));
        assertTrue(new ListProperty().validate(new ArrayList<Object>()));
    }

    public void test_hasValue() throws Exception {
        assertNull(new StringProperty().hasValue("x"));

        final List<Object> seen = new ArrayList<Object>();
        ExistenceLookup lookup = new ExistenceLookup() {
            public boolean exists(Object value) {
                seen.add(value);
                return "taken".equals(value);
            }
        };
        StringProperty p = new StringProperty(PropertyOptions.defaults().withUnique(lookup));
        assertTrue(p.isUnique());
        assertEquals(Boolean.TRUE, p.hasValue("taken"));
        assertEquals(Boolean.FALSE, p.hasValue("free"));
        assertEquals(2, seen.size());
    }

    public void test_hasValueFailurePropagates() {
        ExistenceLookup lookup = new ExistenceLookup() {
            public boolean exists(Object value) throws FetchException {
                throw new FetchException("unavailable");
            }
        };
        StringProperty p = new StringProperty(PropertyOptions.defaults().withUnique(lookup));
        try {
            p.hasValue("x");
            fail();
        } catch (FetchException e) {
            assertEquals("unavailable", e.getMessage());
        }
    }

    public void test_options() {
        PropertyOptions options = PropertyOptions.defaults();
        assertFalse(options.isRequired());
        assertFalse(options.isUnique());
        assertSame(options, options.withRequired(false));
        assertTrue(options.withRequired().isRequired());

        try {
            options.withUnique(null);
            fail();
        } catch (IllegalArgumentException e) {
        }
        try {
            options.withValidator(null);
            fail();
        } catch (IllegalArgumentException e) {
        }
        try {
            options.getValidators().add(null);
            fail();
        } catch (UnsupportedOperationException e) {
        }
    }

    public void test_bindName() {
        StringProperty p = new StringProperty();
        assertNull(p.getName());
        p.bindName("title");
        assertEquals("title", p.getName());
        p.bindName("title");

        try {
            p.bindName("other");
            fail();
        } catch (IllegalStateException e) {
        }
        try {
            new StringProperty().bindName("");
            fail();
        } catch (IllegalArgumentException e) {
        }
    }

    public void test_typeErrorNamesProperty() {
        IntegerProperty p = new IntegerProperty();
        p.bindName("age");
        try {
            p.standardize("old");
            fail();
        } catch (com.amazon.basalt.PropertyTypeException e) {
            assertEquals("age", e.getPropertyName());
            assertEquals("old", e.getRejectedValue());
            assertTrue(e.getMessage().contains("\"age\""));
        }
    }
}
