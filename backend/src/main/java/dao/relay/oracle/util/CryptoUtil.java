package dao.relay.oracle.util;

import org.bouncycastle.crypto.digests.Blake2bDigest;

import java.nio.charset.StandardCharsets;

/**
 * Hashing primitives used by Substrate storage keys.
 *
 * IMPORTANT:
 * - "twox" is xxHash64 with seeds 0, 1, ... concatenated, each output written little-endian.
 * - "blake2_128" is Blake2b with a 16-byte digest, no key.
 */
public final class CryptoUtil {
    private CryptoUtil() {}

    private static final long PRIME64_1 = 0x9E3779B185EBCA87L;
    private static final long PRIME64_2 = 0xC2B2AE3D27D4EB4FL;
    private static final long PRIME64_3 = 0x165667B19E3779F9L;
    private static final long PRIME64_4 = 0x85EBCA77C2B2AE63L;
    private static final long PRIME64_5 = 0x27D4EB2F165667C5L;

    public static byte[] twox128(String value) {
        return twox128(value.getBytes(StandardCharsets.UTF_8));
    }

    public static byte[] twox128(byte[] data) {
        byte[] out = new byte[16];
        writeLongLE(out, 0, xxHash64(data, 0));
        writeLongLE(out, 8, xxHash64(data, 1));
        return out;
    }

    public static byte[] twox64(byte[] data) {
        byte[] out = new byte[8];
        writeLongLE(out, 0, xxHash64(data, 0));
        return out;
    }

    public static byte[] blake2b128(byte[] data) {
        Blake2bDigest digest = new Blake2bDigest(128);
        digest.update(data, 0, data.length);
        byte[] out = new byte[16];
        digest.doFinal(out, 0);
        return out;
    }

    public static long xxHash64(byte[] input, long seed) {
        int len = input.length;
        int p = 0;
        long h;

        if (len >= 32) {
            long v1 = seed + PRIME64_1 + PRIME64_2;
            long v2 = seed + PRIME64_2;
            long v3 = seed;
            long v4 = seed - PRIME64_1;
            int limit = len - 32;
            do {
                v1 = round(v1, readLongLE(input, p));
                v2 = round(v2, readLongLE(input, p + 8));
                v3 = round(v3, readLongLE(input, p + 16));
                v4 = round(v4, readLongLE(input, p + 24));
                p += 32;
            } while (p <= limit);

            h = Long.rotateLeft(v1, 1) + Long.rotateLeft(v2, 7) + Long.rotateLeft(v3, 12) + Long.rotateLeft(v4, 18);
            h = mergeRound(h, v1);
            h = mergeRound(h, v2);
            h = mergeRound(h, v3);
            h = mergeRound(h, v4);
        } else {
            h = seed + PRIME64_5;
        }

        h += len;

        while (p + 8 <= len) {
            h ^= round(0, readLongLE(input, p));
            h = Long.rotateLeft(h, 27) * PRIME64_1 + PRIME64_4;
            p += 8;
        }
        if (p + 4 <= len) {
            h ^= (readIntLE(input, p) & 0xFFFFFFFFL) * PRIME64_1;
            h = Long.rotateLeft(h, 23) * PRIME64_2 + PRIME64_3;
            p += 4;
        }
        while (p < len) {
            h ^= (input[p] & 0xFFL) * PRIME64_5;
            h = Long.rotateLeft(h, 11) * PRIME64_1;
            p++;
        }

        h ^= h >>> 33;
        h *= PRIME64_2;
        h ^= h >>> 29;
        h *= PRIME64_3;
        h ^= h >>> 32;
        return h;
    }

    public static String toHex0x(byte[] bytes) {
        StringBuilder sb = new StringBuilder(2 + bytes.length * 2).append("0x");
        for (byte b : bytes) sb.append(String.format("%02x", b & 0xff));
        return sb.toString();
    }

    public static byte[] concat(byte[]... parts) {
        int len = 0;
        for (byte[] part : parts) len += part.length;
        byte[] out = new byte[len];
        int pos = 0;
        for (byte[] part : parts) {
            System.arraycopy(part, 0, out, pos, part.length);
            pos += part.length;
        }
        return out;
    }

    private static long round(long acc, long input) {
        acc += input * PRIME64_2;
        acc = Long.rotateLeft(acc, 31);
        return acc * PRIME64_1;
    }

    private static long mergeRound(long acc, long val) {
        acc ^= round(0, val);
        return acc * PRIME64_1 + PRIME64_4;
    }

    private static long readLongLE(byte[] b, int i) {
        return (b[i] & 0xFFL)
                | (b[i + 1] & 0xFFL) << 8
                | (b[i + 2] & 0xFFL) << 16
                | (b[i + 3] & 0xFFL) << 24
                | (b[i + 4] & 0xFFL) << 32
                | (b[i + 5] & 0xFFL) << 40
                | (b[i + 6] & 0xFFL) << 48
                | (b[i + 7] & 0xFFL) << 56;
    }

    private static int readIntLE(byte[] b, int i) {
        return (b[i] & 0xFF)
                | (b[i + 1] & 0xFF) << 8
                | (b[i + 2] & 0xFF) << 16
                | (b[i + 3] & 0xFF) << 24;
    }

    private static void writeLongLE(byte[] out, int offset, long v) {
        for (int i = 0; i < 8; i++) {
            out[offset + i] = (byte) (v >>> (8 * i));
        }
    }
}
