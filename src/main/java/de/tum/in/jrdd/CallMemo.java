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

import java.util.Arrays;
import java.util.function.IntConsumer;

/**
 * Open addressing map from {@code int} triples to {@code int} results, scoped to a single top-level operation and
 * dropped afterwards. Keys and values are references, hence never negative.
 */
final class CallMemo {
    private static final int NO_VALUE = -1;
    private static final int INITIAL_CAPACITY = 64;

    private int[] keys;
    private int[] values;
    private int size = 0;

    CallMemo() {
        keys = new int[3 * INITIAL_CAPACITY];
        values = new int[INITIAL_CAPACITY];
        Arrays.fill(values, NO_VALUE);
    }

    /**
     * Returns the stored value or -1.
     */
    int get(int first, int second, int third) {
        int capacity = values.length;
        int index = HashUtil.bucket(HashUtil.hash(first, second, third), capacity);
        while (values[index] != NO_VALUE) {
            if (keys[3 * index] == first && keys[3 * index + 1] == second && keys[3 * index + 2] == third) {
                return values[index];
            }
            index = index + 1 == capacity ? 0 : index + 1;
        }
        return NO_VALUE;
    }

    int get(int key) {
        return get(key, 0, 0);
    }

    void put(int first, int second, int third, int value) {
        assert value >= 0 && get(first, second, third) == NO_VALUE;
        if (2 * (size + 1) > values.length) {
            resize();
        }
        insert(first, second, third, value);
        size += 1;
    }

    void put(int key, int value) {
        put(key, 0, 0, value);
    }

    private void insert(int first, int second, int third, int value) {
        int capacity = values.length;
        int index = HashUtil.bucket(HashUtil.hash(first, second, third), capacity);
        while (values[index] != NO_VALUE) {
            index = index + 1 == capacity ? 0 : index + 1;
        }
        keys[3 * index] = first;
        keys[3 * index + 1] = second;
        keys[3 * index + 2] = third;
        values[index] = value;
    }

    private void resize() {
        int[] oldKeys = keys;
        int[] oldValues = values;
        keys = new int[oldKeys.length * 2];
        values = new int[oldValues.length * 2];
        Arrays.fill(values, NO_VALUE);
        for (int i = 0; i < oldValues.length; i++) {
            if (oldValues[i] != NO_VALUE) {
                insert(oldKeys[3 * i], oldKeys[3 * i + 1], oldKeys[3 * i + 2], oldValues[i]);
            }
        }
    }

    void forEachValue(IntConsumer action) {
        for (int value : values) {
            if (value != NO_VALUE) {
                action.accept(value);
            }
        }
    }

    int size() {
        return size;
    }
}
