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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

import java.util.BitSet;
import org.junit.jupiter.api.Test;

public class PrimesTest {
    private static BitSet sieve(int bound) {
        BitSet composite = new BitSet(bound);
        composite.set(0);
        composite.set(1);
        for (int i = 2; (long) i * i < bound; i++) {
            if (!composite.get(i)) {
                for (int j = i * i; j < bound; j += i) {
                    composite.set(j);
                }
            }
        }
        return composite;
    }

    @Test
    public void testAgainstSieve() {
        int bound = 200_000;
        BitSet composite = sieve(bound);
        for (int i = 0; i < bound; i++) {
            assertThat("Primality of " + i, Primes.isPrime(i), is(!composite.get(i)));
        }
    }

    @Test
    public void testNextPrime() {
        assertThat(Primes.nextPrime(0), is(3));
        assertThat(Primes.nextPrime(1000), is(1009));
        assertThat(Primes.nextPrime(1009), is(1009));
        assertThat(Primes.nextPrime(1024), is(1031));
        assertThat(Primes.nextPrime(20_000), is(20_011));
    }

    @Test
    public void testLargeValues() {
        assertThat(Primes.isPrime(Integer.MAX_VALUE), is(true));
        assertThat(Primes.isPrime(2_147_483_629), is(true));
        assertThat(Primes.isPrime(2_147_483_637), is(false));
        // Strong pseudoprime to the bases 2, 3 and 5
        assertThat(Primes.isPrime(25_326_001), is(false));
        assertThat(Primes.isPrime(46_337 * 46_337), is(false));
    }
}
