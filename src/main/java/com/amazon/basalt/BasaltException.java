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

package com.amazon.basalt;

/**
 * General checked exception thrown by the collaborators a property calls out
 * to, such as the document loader and the existence lookup. Properties never
 * retry or suppress these; recovery policy belongs to the caller.
 */
public class BasaltException extends Exception {

    private static final long serialVersionUID = 1L;

    public BasaltException() {
        super();
    }

    public BasaltException(String message) {
        super(message);
    }

    public BasaltException(String message, Throwable cause) {
        super(message, cause);
    }

    public BasaltException(Throwable cause) {
        super(cause);
    }

    /**
     * Recursively calls getCause, until the root cause is found. Returns this
     * if no root cause.
     */
    public Throwable getRootCause() {
        Throwable cause = this;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }
}
