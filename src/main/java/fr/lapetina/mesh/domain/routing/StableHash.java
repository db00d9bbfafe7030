package fr.lapetina.mesh.domain.routing;

import java.nio.charset.StandardCharsets;
import java.util.zip.CRC32;

/**
 * Deterministic bucketing of routing keys into [0, 100).
 *
 * The same (salt, key) pair always lands in the same bucket, across calls
 * and restarts. CRC32 is followed by the murmur3 finalizer so that
 * sequential keys ("user-1", "user-2", ...) spread evenly.
 */
public final class StableHash {

    public static final int BUCKETS = 100;

    private StableHash() {
        // Utility class
    }

    public static int bucket(String salt, String routingKey) {
        CRC32 crc = new CRC32();
        crc.update((salt + ":" + routingKey).getBytes(StandardCharsets.UTF_8));
        int h = (int) crc.getValue();
        h ^= h >>> 16;
        h *= 0x85ebca6b;
        h ^= h >>> 13;
        h *= 0xc2b2ae35;
        h ^= h >>> 16;
        return (int) (Integer.toUnsignedLong(h) % BUCKETS);
    }
}
