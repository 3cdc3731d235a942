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
import java.util.Collections;
import java.util.List;

/**
 * Ordered composition of {@link Processor processors}. The output of each
 * processor is fed into the next, and an empty chain is the identity.
 */
public class Processors {
    /**
     * Applies a single processor, which may be null.
     */
    public static Object apply(Object value, Processor processor) {
        return processor == null ? value : processor.process(value);
    }

    /**
     * Applies each processor in order, threading the result through.
     *
     * @param processors processors to apply, which may be null or empty
     */
    public static Object apply(Object value, List<? extends Processor> processors) {
        if (processors != null) {
            for (Processor processor : processors) {
                value = processor.process(value);
            }
        }
        return value;
    }

    /**
     * Returns a processor which applies the given processors in order.
     */
    public static Processor chain(Processor... processors) {
        if (processors == null || processors.length == 0) {
            return identity();
        }
        if (processors.length == 1 && processors[0] != null) {
            return processors[0];
        }
        for (Processor p : processors) {
            if (p == null) {
                throw new IllegalArgumentException("Null processor in chain");
            }
        }
        return new Chain(Arrays.asList(processors.clone()));
    }

    /**
     * Returns a processor which returns its input unchanged.
     */
    public static Processor identity() {
        return Identity.THE;
    }

    private Processors() {
    }

    private static class Identity implements Processor {
        static final Identity THE = new Identity();

        public Object process(Object value) {
            return value;
        }

        @Override
        public String toString() {
            return "identity";
        }
    }

    private static class Chain implements Processor {
        private final List<Processor> mProcessors;

        Chain(List<Processor> processors) {
            mProcessors = Collections.unmodifiableList(new ArrayList<Processor>(processors));
        }

        public Object process(Object value) {
            return apply(value, mProcessors);
        }

        @Override
        public String toString() {
            return "chain" + mProcessors;
        }
    }
}
