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

package com.amazon.basalt.password;

/**
 * Capability for hashing passwords with a salt. Salts and hashes are text,
 * so that they can be stored as-is.
 *
 * @see BCryptPasswordHasher
 */
public interface PasswordHasher {
    /**
     * Returns a new random salt.
     */
    String generateSalt();

    String hashPassword(String plainText, String salt);

    /**
     * Returns true if the plain text hashes with the salt to the given hash.
     */
    boolean checkPassword(String plainText, String salt, String hash);
}
