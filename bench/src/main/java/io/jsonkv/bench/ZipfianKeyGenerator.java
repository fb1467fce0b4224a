// file: bench/src/main/java/io/jsonkv/bench/ZipfianKeyGenerator.java
package io.jsonkv.bench;

import java.util.Random;

/**
 * Zipfian distribution over key ids in [0, n); id 0 is the hottest.
 *
 * The CDF is computed once and is read-only afterwards, so one generator can
 * be shared by all bench threads. Randomness comes from the caller: each
 * thread passes its own Random.
 */
public final class ZipfianKeyGenerator {

    private final double[] cdf;
    private final double skew;

    public ZipfianKeyGenerator(int n, double skew) {
        if (n <= 0) throw new IllegalArgumentException("n must be > 0");
        if (!(skew > 0.0)) throw new IllegalArgumentException("skew must be > 0");
        this.skew = skew;

        double norm = 0.0;
        for (int rank = 1; rank <= n; rank++) {
            norm += Math.pow(rank, -skew);
        }
        this.cdf = new double[n];
        double acc = 0.0;
        for (int i = 0; i < n; i++) {
            acc += Math.pow(i + 1, -skew) / norm;
            cdf[i] = acc;
        }
        cdf[n - 1] = 1.0; // rounding must not leave a gap at the top
    }

    public int keyspace() {
        return cdf.length;
    }

    public double skew() {
        return skew;
    }

    /** Key id for a uniform draw u in [0, 1). */
    public int keyFor(double u) {
        if (u < 0.0 || u >= 1.0) throw new IllegalArgumentException("u must be in [0, 1): " + u);
        int lo = 0;
        int hi = cdf.length - 1;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (u < cdf[mid]) {
                hi = mid;
            } else {
                lo = mid + 1;
            }
        }
        return lo;
    }

    public int nextKey(Random rnd) {
        return keyFor(rnd.nextDouble());
    }
}
