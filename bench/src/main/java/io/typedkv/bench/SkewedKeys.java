// file: bench/src/main/java/io/typedkv/bench/SkewedKeys.java
package io.typedkv.bench;

import java.util.Arrays;
import java.util.Random;

/**
 * Zipf-distributed key ids in [0, keyspace). Id 0 is the hottest.
 * <p>
 * The cumulative distribution is built once; sampling is a binary search,
 * with the random source supplied by the caller so worker threads do not
 * contend on one generator.
 */
public final class SkewedKeys {
    private final double[] cumulative;

    public SkewedKeys(int keyspace, double skew) {
        if (keyspace <= 0) throw new IllegalArgumentException("keyspace must be > 0");
        if (skew <= 0.0) throw new IllegalArgumentException("skew must be > 0");

        cumulative = new double[keyspace];
        double total = 0.0;
        for (int rank = 1; rank <= keyspace; rank++) {
            total += Math.pow(rank, -skew);
            cumulative[rank - 1] = total;
        }
        for (int i = 0; i < keyspace; i++) {
            cumulative[i] /= total;
        }
        cumulative[keyspace - 1] = 1.0;
    }

    public int keyspace() {
        return cumulative.length;
    }

    public int next(Random rnd) {
        int idx = Arrays.binarySearch(cumulative, rnd.nextDouble());
        // Not found: insertion point is the first bucket whose upper bound exceeds u.
        return idx >= 0 ? idx : -idx - 1;
    }
}
