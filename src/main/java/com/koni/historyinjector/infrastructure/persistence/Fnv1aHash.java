package com.koni.historyinjector.infrastructure.persistence;

/**
 * 32-bit FNV-1a digest, the function Home Assistant uses for {@code state_attributes.hash}.
 */
public final class Fnv1aHash {

    private static final long OFFSET_BASIS = 0x811c9dc5L;
    private static final long PRIME = 0x01000193L;
    private static final long MASK = 0xffffffffL;

    private Fnv1aHash() {
    }

    /**
     * @return the unsigned 32-bit digest of {@code data}
     */
    public static long hash32(byte[] data) {
        long hash = OFFSET_BASIS;
        for (byte b : data) {
            hash ^= (b & 0xff);
            hash = (hash * PRIME) & MASK;
        }
        return hash;
    }
}
