/* ____  ______________  ________________________  __________
 * \   \/   /      \   \/   /   __/   /      \   \/   /      \
 *  \______/___/\___\______/___/_____/___/\___\______/___/\___\
 *
 * The MIT License (MIT)
 *
 * Copyright 2023 Vavr, https://vavr.io
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package ch.randelshofer.persistent;

import ch.randelshofer.persistent.ChampTrie.BitmapIndexedNode;
import ch.randelshofer.persistent.ChampTrie.BulkChangeEvent;
import ch.randelshofer.persistent.ChampTrie.ChangeEvent;
import ch.randelshofer.persistent.ChampTrie.IdentityObject;
import ch.randelshofer.persistent.ChampTrie.Node;
import io.vavr.Tuple;
import io.vavr.Tuple2;
import io.vavr.collection.Iterator;
import io.vavr.control.Option;

import java.io.IOException;
import java.io.InvalidObjectException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.Serializable;
import java.util.AbstractMap.SimpleImmutableEntry;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Spliterator;
import java.util.function.BiPredicate;
import java.util.function.Predicate;

/**
 * Implements an immutable map using a Compressed Hash-Array Mapped Prefix-tree
 * (CHAMP).
 * <p>
 * Features:
 * <ul>
 *     <li>supports up to 2<sup>31</sup> - 1 entries</li>
 *     <li>allows null keys and null values</li>
 *     <li>is immutable</li>
 *     <li>is thread-safe</li>
 *     <li>does not guarantee a specific iteration order</li>
 * </ul>
 * <p>
 * Performance characteristics:
 * <ul>
 *     <li>put: O(1)</li>
 *     <li>remove: O(1)</li>
 *     <li>containsKey: O(1)</li>
 *     <li>removeAll, merge with another trie: O(n) in the size of the
 *     differing parts of both tries</li>
 * </ul>
 * <p>
 * The map stores {@link SimpleImmutableEntry} objects, two entries are equal
 * if their keys are equal. The key view returned by {@link #keys()} shares
 * the trie of the map, so that a {@link ChampSet} can be subtracted by it
 * without copying.
 *
 * <p>
 * This class does not implement {@link io.vavr.collection.Map}. It works
 * with vavr through {@link Option}, {@link Tuple2} entries, the vavr
 * {@link Iterator} it returns, and {@link #toVavrMap()}.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public final class ChampMap<K, V> implements Iterable<Tuple2<K, V>>, Serializable {

    private static final long serialVersionUID = 1L;

    private static final ChampMap<?, ?> EMPTY = new ChampMap<>(BitmapIndexedNode.emptyNode(), 0);

    final transient BitmapIndexedNode<SimpleImmutableEntry<K, V>> root;
    private final int size;

    ChampMap(BitmapIndexedNode<SimpleImmutableEntry<K, V>> root, int size) {
        this.root = root;
        this.size = size;
    }

    @SuppressWarnings("unchecked")
    public static <K, V> ChampMap<K, V> empty() {
        return (ChampMap<K, V>) EMPTY;
    }

    public static <K, V> ChampMap<K, V> of(K key, V value) {
        return ChampMap.<K, V>empty().put(key, value);
    }

    public static <K, V> ChampMap<K, V> of(K k1, V v1, K k2, V v2) {
        return ChampMap.<K, V>empty().put(k1, v1).put(k2, v2);
    }

    public static <K, V> ChampMap<K, V> of(K k1, V v1, K k2, V v2, K k3, V v3) {
        return ChampMap.<K, V>empty().put(k1, v1).put(k2, v2).put(k3, v3);
    }

    @SafeVarargs
    public static <K, V> ChampMap<K, V> ofEntries(Tuple2<? extends K, ? extends V>... entries) {
        Objects.requireNonNull(entries, "entries is null");
        return ChampMap.<K, V>empty().putAllTuples(java.util.Arrays.asList(entries));
    }

    public static <K, V> ChampMap<K, V> ofEntries(Iterable<? extends Tuple2<? extends K, ? extends V>> entries) {
        Objects.requireNonNull(entries, "entries is null");
        return ChampMap.<K, V>empty().putAllTuples(entries);
    }

    public static <K, V> ChampMap<K, V> ofAll(Map<? extends K, ? extends V> map) {
        Objects.requireNonNull(map, "map is null");
        IdentityObject owner = new IdentityObject();
        BitmapIndexedNode<SimpleImmutableEntry<K, V>> newRoot = BitmapIndexedNode.emptyNode();
        ChangeEvent<SimpleImmutableEntry<K, V>> details = new ChangeEvent<>();
        int newSize = 0;
        for (Map.Entry<? extends K, ? extends V> entry : map.entrySet()) {
            details.reset();
            newRoot = putEntry(owner, newRoot, new SimpleImmutableEntry<>(entry.getKey(), entry.getValue()), details);
            if (details.isAdded()) {
                newSize++;
            }
        }
        return newMap(newRoot, newSize);
    }

    private static <K, V> ChampMap<K, V> newMap(BitmapIndexedNode<SimpleImmutableEntry<K, V>> root, int size) {
        return size == 0 ? empty() : new ChampMap<>(root, size);
    }

    // -- entry functions

    static int keyHash(Object key) {
        return ChampSet.keyHash(key);
    }

    static int entryKeyHash(Map.Entry<?, ?> e) {
        return keyHash(e.getKey());
    }

    static boolean entryKeyEquals(Map.Entry<?, ?> a, Map.Entry<?, ?> b) {
        return Objects.equals(a.getKey(), b.getKey());
    }

    static boolean entryHasKey(Map.Entry<?, ?> entry, Object key) {
        return Objects.equals(entry.getKey(), key);
    }

    /**
     * Keeps the old entry if the values are equal, so that putting an equal
     * value does not create a new map.
     */
    static <K, V> SimpleImmutableEntry<K, V> updateEntry(SimpleImmutableEntry<K, V> oldEntry,
                                                         SimpleImmutableEntry<K, V> newEntry) {
        return Objects.equals(oldEntry.getValue(), newEntry.getValue()) ? oldEntry : newEntry;
    }

    private static <K, V> BitmapIndexedNode<SimpleImmutableEntry<K, V>> putEntry(
            IdentityObject owner, BitmapIndexedNode<SimpleImmutableEntry<K, V>> root,
            SimpleImmutableEntry<K, V> entry, ChangeEvent<SimpleImmutableEntry<K, V>> details) {
        return BitmapIndexedNode.asRoot(root.put(owner, entry, keyHash(entry.getKey()), 0, details,
                ChampMap::updateEntry, ChampMap::entryKeyEquals, ChampMap::entryKeyHash));
    }

    // -- point operations

    public ChampMap<K, V> put(K key, V value) {
        ChangeEvent<SimpleImmutableEntry<K, V>> details = new ChangeEvent<>();
        BitmapIndexedNode<SimpleImmutableEntry<K, V>> newRoot =
                putEntry(null, root, new SimpleImmutableEntry<>(key, value), details);
        if (details.isModified()) {
            if (details.isReplaced()) {
                return new ChampMap<>(newRoot, size);
            }
            return new ChampMap<>(newRoot, size + 1);
        }
        return this;
    }

    public ChampMap<K, V> put(Tuple2<? extends K, ? extends V> entry) {
        Objects.requireNonNull(entry, "entry is null");
        return put(entry._1, entry._2);
    }

    public ChampMap<K, V> remove(K key) {
        ChangeEvent<SimpleImmutableEntry<K, V>> details = new ChangeEvent<>();
        BitmapIndexedNode<SimpleImmutableEntry<K, V>> newRoot = BitmapIndexedNode.asRoot(
                root.remove(null, key, keyHash(key), 0, details, ChampMap::entryHasKey));
        if (details.isModified()) {
            return newMap(newRoot, size - 1);
        }
        return this;
    }

    public Option<V> get(K key) {
        Object result = root.find(key, keyHash(key), 0, ChampMap::entryHasKey);
        if (result == Node.NO_DATA) {
            return Option.none();
        }
        @SuppressWarnings("unchecked")
        SimpleImmutableEntry<K, V> entry = (SimpleImmutableEntry<K, V>) result;
        return Option.some(entry.getValue());
    }

    public V getOrElse(K key, V defaultValue) {
        return get(key).getOrElse(defaultValue);
    }

    public boolean containsKey(K key) {
        return root.find(key, keyHash(key), 0, ChampMap::entryHasKey) != Node.NO_DATA;
    }

    // -- bulk operations

    private ChampMap<K, V> putAllTuples(Iterable<? extends Tuple2<? extends K, ? extends V>> entries) {
        IdentityObject owner = new IdentityObject();
        BitmapIndexedNode<SimpleImmutableEntry<K, V>> newRoot = root;
        int newSize = size;
        boolean modified = false;
        ChangeEvent<SimpleImmutableEntry<K, V>> details = new ChangeEvent<>();
        for (Tuple2<? extends K, ? extends V> entry : entries) {
            details.reset();
            newRoot = putEntry(owner, newRoot, new SimpleImmutableEntry<>(entry._1, entry._2), details);
            modified |= details.isModified();
            if (details.isAdded()) {
                newSize++;
            }
        }
        return modified ? new ChampMap<>(newRoot, newSize) : this;
    }

    /**
     * Merges the entries of another map into this map.
     * <p>
     * If a key is present in both maps, the value of {@code that} map wins.
     *
     * @param that another map
     * @return the merged map
     */
    public ChampMap<K, V> merge(ChampMap<K, V> that) {
        Objects.requireNonNull(that, "that is null");
        if (isEmpty()) {
            return that;
        }
        if (that.isEmpty()) {
            return this;
        }
        BulkChangeEvent bulkChange = new BulkChangeEvent();
        ChampNodeBuilder<SimpleImmutableEntry<K, V>> builder = ChampAlgebra.union(new IdentityObject(),
                root, that.root, 0, bulkChange,
                ChampMap::updateEntry, ChampMap::entryKeyEquals, ChampMap::entryKeyHash);
        if (builder == null) {
            return this;
        }
        BitmapIndexedNode<SimpleImmutableEntry<K, V>> newRoot = builder.buildRoot();
        assert ChampInvariants.verify(newRoot, ChampMap::entryKeyHash, ChampMap::entryKeyEquals);
        return newMap(newRoot, size + that.size - bulkChange.inBoth);
    }

    /**
     * Removes the entries with the given keys.
     * <p>
     * A {@link ChampSet} or the key view of another {@code ChampMap} is
     * subtracted trie by trie. A collection with a fast membership test is
     * used as a filter. Any other iterable is traversed once.
     *
     * @param keys the keys to remove
     * @return this map if nothing was removed, otherwise a new map
     */
    @SuppressWarnings("unchecked")
    public ChampMap<K, V> removeAll(Iterable<? extends K> keys) {
        Objects.requireNonNull(keys, "keys is null");
        if (keys instanceof ChampSet) {
            return subtractTrie(((ChampSet<? extends K>) keys).root, ChampMap::entryHasKey, ChampSet::keyHash);
        }
        if (keys instanceof Keys) {
            return subtractTrie(((Keys<? extends K>) keys).map.root, ChampMap::entryKeyEquals, ChampMap::entryKeyHash);
        }
        if (isEmpty()) {
            return this;
        }
        Option<Predicate<K>> membership = FastMembership.of(keys);
        if (membership.isDefined()) {
            return filterKeys(membership.get().negate());
        }
        IdentityObject owner = new IdentityObject();
        BitmapIndexedNode<SimpleImmutableEntry<K, V>> newRoot = root;
        int newSize = size;
        ChangeEvent<SimpleImmutableEntry<K, V>> details = new ChangeEvent<>();
        for (K key : keys) {
            details.reset();
            newRoot = BitmapIndexedNode.asRoot(newRoot.remove(owner, key, keyHash(key), 0, details, ChampMap::entryHasKey));
            if (details.isModified() && --newSize == 0) {
                return empty();
            }
        }
        return newSize == size ? this : new ChampMap<>(newRoot, newSize);
    }

    /**
     * Keeps only the entries whose key is in the given iterable.
     */
    @SuppressWarnings("unchecked")
    public ChampMap<K, V> retainAll(Iterable<? extends K> keys) {
        Objects.requireNonNull(keys, "keys is null");
        if (keys instanceof ChampSet) {
            return intersectTrie(((ChampSet<? extends K>) keys).root, ChampMap::entryHasKey, ChampSet::keyHash);
        }
        if (keys instanceof Keys) {
            return intersectTrie(((Keys<? extends K>) keys).map.root, ChampMap::entryKeyEquals, ChampMap::entryKeyHash);
        }
        if (isEmpty()) {
            return this;
        }
        Option<Predicate<K>> membership = FastMembership.of(keys);
        if (membership.isDefined()) {
            return filterKeys(membership.get());
        }
        HashSet<Object> retained = new HashSet<>();
        keys.forEach(retained::add);
        return filterKeys(retained::contains);
    }

    public ChampMap<K, V> filter(BiPredicate<? super K, ? super V> predicate) {
        Objects.requireNonNull(predicate, "predicate is null");
        if (isEmpty()) {
            return this;
        }
        BulkChangeEvent bulkChange = new BulkChangeEvent();
        ChampNodeBuilder<SimpleImmutableEntry<K, V>> builder = ChampAlgebra.filter(new IdentityObject(), root, 0,
                bulkChange, e -> predicate.test(e.getKey(), e.getValue()));
        if (builder == null) {
            return this;
        }
        BitmapIndexedNode<SimpleImmutableEntry<K, V>> newRoot = builder.buildRoot();
        assert ChampInvariants.verify(newRoot, ChampMap::entryKeyHash, ChampMap::entryKeyEquals);
        return newMap(newRoot, size - bulkChange.removed);
    }

    public ChampMap<K, V> filterKeys(Predicate<? super K> predicate) {
        Objects.requireNonNull(predicate, "predicate is null");
        return filter((k, v) -> predicate.test(k));
    }

    private <X> ChampMap<K, V> subtractTrie(BitmapIndexedNode<X> otherRoot,
                                            BiPredicate<? super SimpleImmutableEntry<K, V>, ? super X> equalsFunction,
                                            java.util.function.ToIntFunction<? super X> otherHashFunction) {
        if (isEmpty() || otherRoot.isEmpty()) {
            return this;
        }
        BulkChangeEvent bulkChange = new BulkChangeEvent();
        ChampNodeBuilder<SimpleImmutableEntry<K, V>> builder = ChampAlgebra.subtract(new IdentityObject(),
                root, otherRoot, 0, bulkChange, equalsFunction, ChampMap::entryKeyHash, otherHashFunction);
        if (builder == null) {
            return this;
        }
        BitmapIndexedNode<SimpleImmutableEntry<K, V>> newRoot = builder.buildRoot();
        assert ChampInvariants.verify(newRoot, ChampMap::entryKeyHash, ChampMap::entryKeyEquals);
        return newMap(newRoot, size - bulkChange.removed);
    }

    private <X> ChampMap<K, V> intersectTrie(BitmapIndexedNode<X> otherRoot,
                                             BiPredicate<? super SimpleImmutableEntry<K, V>, ? super X> equalsFunction,
                                             java.util.function.ToIntFunction<? super X> otherHashFunction) {
        if (isEmpty()) {
            return this;
        }
        if (otherRoot.isEmpty()) {
            return empty();
        }
        BulkChangeEvent bulkChange = new BulkChangeEvent();
        ChampNodeBuilder<SimpleImmutableEntry<K, V>> builder = ChampAlgebra.intersect(new IdentityObject(),
                root, otherRoot, 0, bulkChange, equalsFunction, ChampMap::entryKeyHash, otherHashFunction);
        if (builder == null) {
            return this;
        }
        BitmapIndexedNode<SimpleImmutableEntry<K, V>> newRoot = builder.buildRoot();
        assert ChampInvariants.verify(newRoot, ChampMap::entryKeyHash, ChampMap::entryKeyEquals);
        return newMap(newRoot, size - bulkChange.removed);
    }

    // -- queries and views

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * Returns a view of the keys of this map.
     */
    public Keys<K> keys() {
        return new Keys<>(this);
    }

    public Iterator<V> values() {
        return Iterator.ofAll(new ChampIteration.IteratorFacade<>(
                new ChampIteration.ChampSpliterator<SimpleImmutableEntry<K, V>, V>(root, SimpleImmutableEntry::getValue,
                        Spliterator.SIZED | Spliterator.IMMUTABLE, size)));
    }

    @Override
    public Iterator<Tuple2<K, V>> iterator() {
        return Iterator.ofAll(new ChampIteration.IteratorFacade<>(spliterator()));
    }

    @Override
    public Spliterator<Tuple2<K, V>> spliterator() {
        return new ChampIteration.ChampSpliterator<SimpleImmutableEntry<K, V>, Tuple2<K, V>>(root,
                e -> Tuple.of(e.getKey(), e.getValue()),
                Spliterator.SIZED | Spliterator.IMMUTABLE | Spliterator.DISTINCT, size);
    }

    public java.util.Map<K, V> toJavaMap() {
        java.util.Map<K, V> map = new java.util.HashMap<>(Math.max(16, size * 4 / 3 + 1));
        forEach(t -> map.put(t._1, t._2));
        return map;
    }

    public io.vavr.collection.Map<K, V> toVavrMap() {
        return io.vavr.collection.HashMap.ofEntries(this);
    }

    @Override
    public boolean equals(Object o) {
        if (o == this) {
            return true;
        }
        if (!(o instanceof ChampMap)) {
            return false;
        }
        @SuppressWarnings("unchecked")
        ChampMap<Object, Object> that = (ChampMap<Object, Object>) o;
        if (size != that.size) {
            return false;
        }
        if ((Object) root == that.root) {
            return true;
        }
        for (Tuple2<K, V> entry : this) {
            Option<Object> value = that.get(entry._1);
            if (value.isEmpty() || !Objects.equals(value.get(), entry._2)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int hash = 0;
        for (Tuple2<K, V> entry : this) {
            hash += Objects.hashCode(entry._1) ^ Objects.hashCode(entry._2);
        }
        return hash;
    }

    @Override
    public String toString() {
        return iterator().map(t -> t._1 + " -> " + t._2).mkString(stringPrefix() + "(", ", ", ")");
    }

    public String stringPrefix() {
        return "ChampMap";
    }

    /**
     * A read-only view of the keys of a {@link ChampMap}.
     * <p>
     * The view shares the trie of its map.
     *
     * @param <K> the key type
     */
    public static final class Keys<K> implements Iterable<K>, FastMembership<K> {
        private final ChampMap<K, ?> map;

        Keys(ChampMap<K, ?> map) {
            this.map = map;
        }

        ChampMap<K, ?> map() {
            return map;
        }

        @Override
        public boolean contains(K key) {
            return map.containsKey(key);
        }

        public int size() {
            return map.size();
        }

        public boolean isEmpty() {
            return map.isEmpty();
        }

        @Override
        public Iterator<K> iterator() {
            return map.iterator().map(t -> t._1);
        }

        /**
         * Copies the keys into a set.
         */
        public ChampSet<K> toSet() {
            return ChampSet.ofAll(this);
        }

        @Override
        public String toString() {
            return iterator().mkString("Keys(", ", ", ")");
        }
    }

    // -- Serialization

    private Object writeReplace() {
        return new SerializationProxy<>(this);
    }

    private void readObject(ObjectInputStream stream) throws InvalidObjectException {
        throw new InvalidObjectException("Proxy required");
    }

    /**
     * Writes the size, then each key followed by its value.
     */
    private static final class SerializationProxy<K, V> implements Serializable {

        private static final long serialVersionUID = 1L;

        private transient ChampMap<K, V> map;

        SerializationProxy(ChampMap<K, V> map) {
            this.map = map;
        }

        private void writeObject(ObjectOutputStream s) throws IOException {
            s.defaultWriteObject();
            s.writeInt(map.size());
            for (Tuple2<K, V> e : map) {
                s.writeObject(e._1);
                s.writeObject(e._2);
            }
        }

        private void readObject(ObjectInputStream s) throws ClassNotFoundException, IOException {
            s.defaultReadObject();
            final int size = s.readInt();
            if (size < 0) {
                throw new InvalidObjectException("No elements");
            }
            IdentityObject owner = new IdentityObject();
            BitmapIndexedNode<SimpleImmutableEntry<K, V>> newRoot = BitmapIndexedNode.emptyNode();
            ChangeEvent<SimpleImmutableEntry<K, V>> details = new ChangeEvent<>();
            int newSize = 0;
            for (int i = 0; i < size; i++) {
                @SuppressWarnings("unchecked") final K key = (K) s.readObject();
                @SuppressWarnings("unchecked") final V value = (V) s.readObject();
                details.reset();
                newRoot = putEntry(owner, newRoot, new SimpleImmutableEntry<>(key, value), details);
                if (details.isAdded()) {
                    newSize++;
                }
            }
            map = newMap(newRoot, newSize);
        }

        private Object readResolve() {
            return map;
        }
    }
}
