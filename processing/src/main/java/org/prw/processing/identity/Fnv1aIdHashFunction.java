package org.prw.processing.identity;

import java.nio.charset.StandardCharsets;

/**
 * 32-bit FNV-1a over the UTF-8 bytes of the input, rendered as an unsigned decimal string.
 * Not cryptographic; uniqueness is enforced by the resolver, not by the hash.
 */
public class Fnv1aIdHashFunction implements IdHashFunction {

    private static final int OFFSET_BASIS = 0x811c9dc5;
    private static final int PRIME = 0x01000193;

    @Override
    public String hash(String input) {
        return Integer.toUnsignedString(fnv1a32(input.getBytes(StandardCharsets.UTF_8)));
    }

    static int fnv1a32(byte[] data) {
        int hash = OFFSET_BASIS;
        for (byte b : data) {
            hash ^= (b & 0xff);
            hash *= PRIME;
        }
        return hash;
    }
}
