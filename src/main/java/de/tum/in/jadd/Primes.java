/*
 * This file is part of JADD.
 * Copyright (c) 2024 The JADD Authors.
 *
 * JADD is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * JADD is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with JADD. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.jadd;

// Adapted from the Miller-Rabin test of Guava, restricted to int-sized values
@SuppressWarnings({"MagicNumber", "PMD.AvoidReassigningParameters"})
final class Primes {
    private static final int SIEVE_30 =
            ~((1 << 1) | (1 << 7) | (1 << 11) | (1 << 13) | (1 << 17) | (1 << 19) | (1 << 23) | (1 << 29));
    /* Deterministic for all n < 3,215,031,751, which covers every int. */
    private static final long[] MILLER_RABIN_BASES = {2L, 3L, 5L, 7L};

    private Primes() {}

    static int nextPrime(int value) {
        int candidate = Math.max(3, value | 1);
        while (!isPrime(candidate)) {
            candidate += 2;
        }
        return candidate;
    }

    static boolean isPrime(int value) {
        assert value >= 0;
        long n = value;
        if (n < 2L) {
            return false;
        }
        if (n == 2L || n == 3L || n == 5L || n == 7L || n == 11L || n == 13L) {
            return true;
        }
        if ((SIEVE_30 & (1 << (n % 30L))) != 0) {
            return false;
        }
        if (n % 7L == 0L || n % 11L == 0L || n % 13L == 0L) {
            return false;
        }
        if (n < 17L * 17L) {
            return true;
        }
        for (long base : MILLER_RABIN_BASES) {
            if (!testWitness(base, n)) {
                return false;
            }
        }
        return true;
    }

    // n < 2^31, hence all products fit into a long
    private static boolean testWitness(long base, long n) {
        int r = Long.numberOfTrailingZeros(n - 1L);
        long d = (n - 1L) >> r;
        base %= n;
        if (base == 0L) {
            return true;
        }
        long a = powMod(base, d, n);
        if (a == 1L) {
            return true;
        }
        int j = 0;
        while (a != n - 1L) {
            j += 1;
            if (j == r) {
                return false;
            }
            a = (a * a) % n;
        }
        return true;
    }

    private static long powMod(long a, long p, long m) {
        long result = 1L;
        for (; p != 0L; p >>= 1L) {
            if ((p & 1L) != 0L) {
                result = (result * a) % m;
            }
            a = (a * a) % m;
        }
        return result;
    }
}
