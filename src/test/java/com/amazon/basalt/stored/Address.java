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

package com.amazon.basalt.stored;

import com.amazon.basalt.embedded.AbstractEmbeddedDocument;

/**
 *
 */
public class Address extends AbstractEmbeddedDocument {
    private String mLine1;
    private String mCity;
    private int mUnit;
    private Point mLocation;

    public String getLine1() {
        return mLine1;
    }

    public void setLine1(String value) {
        mLine1 = value;
    }

    public String getCity() {
        return mCity;
    }

    public void setCity(String value) {
        mCity = value;
    }

    public int getUnit() {
        return mUnit;
    }

    public void setUnit(int value) {
        mUnit = value;
    }

    public Point getLocation() {
        return mLocation;
    }

    public void setLocation(Point value) {
        mLocation = value;
    }
}
