package com.ciro.jlive.rendered;

import java.nio.charset.StandardCharsets;
import java.util.List;

/** FNV-1a de 64 bits sobre los statics con prefijo de longitud. */
public final class Fingerprint {

    private static final long OFFSET = 0xcbf29ce484222325L;
    private static final long PRIME = 0x100000001b3L;

    private Fingerprint() {}

    public static long of(List<String> statics) {
        long h = OFFSET;
        h = mixInt(h, statics.size());
        for (String s : statics) {
            byte[] bytes = s.getBytes(StandardCharsets.UTF_8);
            h = mixInt(h, bytes.length);
            for (byte b : bytes) {
                h ^= (b & 0xff);
                h *= PRIME;
            }
        }
        return h;
    }

    private static long mixInt(long h, int v) {
        for (int shift = 24; shift >= 0; shift -= 8) {
            h ^= (v >>> shift) & 0xff;
            h *= PRIME;
        }
        return h;
    }
}
