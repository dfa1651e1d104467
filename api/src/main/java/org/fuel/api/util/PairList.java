/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.fuel.api.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The {@code PairList} class provides an efficient way to access a list of key-value pairs in
 * insertion order. Keys may be looked up by value, which is linear in the size of the list.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public class PairList<K, V> {

    private List<K> keys;
    private List<V> values;

    /** Constructs an empty {@code PairList}. */
    public PairList() {
        keys = new ArrayList<>();
        values = new ArrayList<>();
    }

    /**
     * Constructs a {@code PairList} containing the elements of the specified keys and values.
     *
     * @param keys the key list containing the elements to be placed into this PairList
     * @param values the value list containing the elements to be placed into this PairList
     * @throws IllegalArgumentException if the keys and values size are different
     */
    public PairList(List<K> keys, List<V> values) {
        if (keys.size() != values.size()) {
            throw new IllegalArgumentException("key value size mismatch.");
        }
        this.keys = new ArrayList<>(keys);
        this.values = new ArrayList<>(values);
    }

    /**
     * Adds a key and value to the list.
     *
     * @param key the key
     * @param value the value
     */
    public void add(K key, V value) {
        keys.add(key);
        values.add(value);
    }

    /**
     * Replaces the value at the specified position.
     *
     * @param index the index of the pair to update
     * @param value the new value
     * @return the previous value
     */
    public V set(int index, V value) {
        return values.set(index, value);
    }

    /**
     * Returns the size of the list.
     *
     * @return the size of the list
     */
    public int size() {
        return keys.size();
    }

    /**
     * Checks whether the list is empty.
     *
     * @return whether the list is empty
     */
    public boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Returns the value for the first key found in the list.
     *
     * @param key the key of the element to get
     * @return the value for the first key found in the list, or {@code null}
     */
    public V get(K key) {
        int index = keys.indexOf(key);
        if (index == -1) {
            return null;
        }
        return values.get(index);
    }

    /**
     * Returns the index of the first occurrence of a key.
     *
     * @param key the key to look for
     * @return the index of the key, or -1 if absent
     */
    public int indexOf(K key) {
        return keys.indexOf(key);
    }

    /**
     * Returns the value at the specified position in this list.
     *
     * @param index the index of the element to return
     * @return the value at the specified position in this list
     */
    public V valueAt(int index) {
        return values.get(index);
    }

    /**
     * Returns all keys of the list.
     *
     * @return an unmodifiable view of the keys
     */
    public List<K> keys() {
        return Collections.unmodifiableList(keys);
    }

    /**
     * Returns all values of the list.
     *
     * @return an unmodifiable view of the values
     */
    public List<V> values() {
        return Collections.unmodifiableList(values);
    }

    /**
     * Returns {@code true} if this list contains the specified key.
     *
     * @param key the key whose presence will be tested
     * @return {@code true} if this list contains the specified key
     */
    public boolean contains(K key) {
        return keys.contains(key);
    }
}
