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

import java.nio.charset.StandardCharsets;

import java.security.MessageDigest;
import java.security.SecureRandom;

import at.favre.lib.crypto.bcrypt.BCrypt;
import at.favre.lib.crypto.bcrypt.LongPasswordStrategies;

/**
 * Hashes passwords with bcrypt. Salts are 16 random bytes from a {@link
 * SecureRandom}, encoded as lowercase hex. The hash is the bcrypt encoded
 * form, which also carries the version, cost and salt. Passwords longer than
 * bcrypt's 72 byte limit are first reduced with SHA-512.
 */
public class BCryptPasswordHasher implements PasswordHasher {
    public static final int DEFAULT_COST = 12;

    /** Number of salt bytes bcrypt requires. */
    public static final int SALT_LENGTH = 16;

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private final int mCost;
    private final BCrypt.Hasher mHasher;
    private final SecureRandom mRandom;

    public BCryptPasswordHasher() {
        this(DEFAULT_COST);
    }

    /**
     * @param cost log2 of the number of key expansion rounds
     * @throws IllegalArgumentException if cost is outside bcrypt's range
     */
    public BCryptPasswordHasher(int cost) {
        if (cost < 4 || cost > 31) {
            throw new IllegalArgumentException("Cost must be from 4 to 31: " + cost);
        }
        mCost = cost;
        mHasher = BCrypt.with(LongPasswordStrategies.hashSha512(BCrypt.Version.VERSION_2A));
        mRandom = new SecureRandom();
    }

    public int getCost() {
        return mCost;
    }

    public String generateSalt() {
        byte[] salt = new byte[SALT_LENGTH];
        synchronized (mRandom) {
            mRandom.nextBytes(salt);
        }
        return toHex(salt);
    }

    /**
     * @throws IllegalArgumentException if salt is not 16 bytes of hex
     */
    public String hashPassword(String plainText, String salt) {
        if (plainText == null || salt == null) {
            throw new IllegalArgumentException("Null password or salt");
        }
        byte[] password = plainText.getBytes(StandardCharsets.UTF_8);
        byte[] hash = mHasher.hash(mCost, fromHex(salt), password);
        return new String(hash, StandardCharsets.UTF_8);
    }

    public boolean checkPassword(String plainText, String salt, String hash) {
        if (plainText == null || salt == null || hash == null || !isSalt(salt)) {
            return false;
        }
        byte[] expected = hashPassword(plainText, salt).getBytes(StandardCharsets.UTF_8);
        return MessageDigest.isEqual(expected, hash.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public String toString() {
        return "BCryptPasswordHasher {cost=" + mCost + '}';
    }

    private static boolean isSalt(String salt) {
        if (salt.length() != SALT_LENGTH * 2) {
            return false;
        }
        for (int i=0; i<salt.length(); i++) {
            if (Character.digit(salt.charAt(i), 16) < 0) {
                return false;
            }
        }
        return true;
    }

    private static byte[] fromHex(String salt) {
        if (!isSalt(salt)) {
            throw new IllegalArgumentException
                ("Salt must be " + SALT_LENGTH * 2 + " hex digits: " + salt);
        }
        byte[] bytes = new byte[SALT_LENGTH];
        for (int i=0; i<SALT_LENGTH; i++) {
            bytes[i] = (byte) ((Character.digit(salt.charAt(i * 2), 16) << 4)
                               | Character.digit(salt.charAt(i * 2 + 1), 16));
        }
        return bytes;
    }

    private static String toHex(byte[] bytes) {
        char[] chars = new char[bytes.length * 2];
        for (int i=0; i<bytes.length; i++) {
            int b = bytes[i] & 0xff;
            chars[i * 2] = HEX[b >> 4];
            chars[i * 2 + 1] = HEX[b & 0x0f];
        }
        return new String(chars);
    }
}
