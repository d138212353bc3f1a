/*
 * This file is part of JRDD.
 * Copyright (c) 2024 The JRDD authors.
 *
 * JRDD is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * JRDD is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with JRDD. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.jrdd;

final class Primes {
    private Primes() {}

    /**
     * Smallest prime strictly larger than the given number, at least 3.
     */
    static int nextPrime(int number) {
        if (number < 3) {
            return 3;
        }
        Util.checkArgument(number < Integer.MAX_VALUE - 1, "No int prime above %d", number);
        int candidate = (number + 1) | 1;
        while (!isPrime(candidate)) {
            candidate += 2;
        }
        return candidate;
    }

    /**
     * Deterministic test by 6k +/- 1 trial division. Only called when the arena grows.
     */
    static boolean isPrime(int number) {
        if (number < 4) {
            return number > 1;
        }
        if (number % 2 == 0 || number % 3 == 0) {
            return false;
        }
        for (long divisor = 5; divisor * divisor <= number; divisor += 6) {
            if (number % divisor == 0 || number % (divisor + 2) == 0) {
                return false;
            }
        }
        return true;
    }
}
