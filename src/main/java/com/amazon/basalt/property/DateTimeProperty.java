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

import java.util.Date;

import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;
import org.joda.time.ReadableInstant;

import org.joda.time.format.DateTimeFormatter;
import org.joda.time.format.ISODateTimeFormat;

/**
 * Date-time property, standardized to a Joda-Time {@link DateTime}. Values are
 * stored as Unix timestamps in seconds: a {@code Long} for whole seconds and
 * a {@code Double} otherwise.
 *
 * <p>A {@code DateTime} has millisecond precision, so fractional timestamps
 * are rounded to the nearest millisecond. A stored value such as {@code
 * 1.2346} loads as 1.235 seconds, and is written back as {@code 1.235}.
 *
 * <p>When no default is configured, the default is the current time.
 */
public class DateTimeProperty extends Property<DateTime> {
    // 0001-01-01T00:00:00Z and 9999-12-31T23:59:59Z
    private static final double MIN_SECONDS = -62135596800.0;
    private static final double MAX_SECONDS = 253402300799.0;

    private static final DateTimeFormatter cIsoParser = ISODateTimeFormat.dateTimeParser();

    private final DateTimeZone mZone;
    private final DateTimeFormatter mParser;

    public DateTimeProperty() {
        this(null, null);
    }

    public DateTimeProperty(PropertyOptions options) {
        this(null, options);
    }

    /**
     * @param zone time zone to apply to produced values, or null for the default
     */
    public DateTimeProperty(DateTimeZone zone, PropertyOptions options) {
        super(options);
        mZone = zone;
        mParser = cIsoParser.withZone(zone);
    }

    /**
     * @return null if default time zone is used
     */
    public DateTimeZone getTimeZone() {
        return mZone;
    }

    @Override
    protected DateTime coerce(Object value) {
        if (value instanceof DateTime) {
            return (DateTime) value;
        }
        if (value instanceof Number) {
            return adaptToDateTime((Number) value);
        }
        if (value instanceof ReadableInstant) {
            return new DateTime(((ReadableInstant) value).getMillis(), mZone);
        }
        if (value instanceof Date) {
            return new DateTime(((Date) value).getTime(), mZone);
        }
        throw typeError(value, "a timestamp, a date-time or null");
    }

    @Override
    protected boolean isInDomain(Object value) {
        if (value instanceof Number) {
            return isValidTimestamp((Number) value);
        }
        return value instanceof ReadableInstant || value instanceof Date;
    }

    @Override
    protected Object toStorage(Object value) {
        if (value instanceof Number) {
            return value;
        }
        if (value instanceof ReadableInstant) {
            return adaptToTimestamp(((ReadableInstant) value).getMillis());
        }
        if (value instanceof Date) {
            return adaptToTimestamp(((Date) value).getTime());
        }
        throw typeError(value, "a timestamp or a date-time");
    }

    @Override
    protected DateTime fromStorage(Object dbValue) {
        if (dbValue instanceof Number) {
            return adaptToDateTime((Number) dbValue);
        }
        if (dbValue instanceof CharSequence) {
            try {
                return mParser.parseDateTime(dbValue.toString());
            } catch (IllegalArgumentException e) {
                throw typeError(dbValue, "a stored timestamp or ISO-8601 text", e);
            }
        }
        throw typeError(dbValue, "a stored timestamp");
    }

    @Override
    protected DateTime emptyValue() {
        return new DateTime(mZone);
    }

    private DateTime adaptToDateTime(Number timestamp) {
        if (!isValidTimestamp(timestamp)) {
            throw new IllegalArgumentException
                ("Timestamp for \"" + getName() + "\" is out of range: " + timestamp);
        }
        long millis;
        if (timestamp instanceof Long || timestamp instanceof Integer ||
            timestamp instanceof Short || timestamp instanceof Byte)
        {
            millis = timestamp.longValue() * 1000L;
        } else {
            millis = Math.round(timestamp.doubleValue() * 1000.0);
        }
        return new DateTime(millis, mZone);
    }

    private static Number adaptToTimestamp(long millis) {
        if (millis % 1000L == 0) {
            return millis / 1000L;
        }
        return millis / 1000.0;
    }

    private static boolean isValidTimestamp(Number timestamp) {
        double seconds = timestamp.doubleValue();
        return !Double.isNaN(seconds) && seconds >= MIN_SECONDS && seconds <= MAX_SECONDS;
    }
}
