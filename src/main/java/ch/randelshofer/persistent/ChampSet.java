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
import io.vavr.collection.Iterator;
import io.vavr.control.Option;

import java.io.IOException;
import java.io.InvalidObjectException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.Serializable;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Objects;
import java.util.Spliterator;
import java.util.function.BiConsumer;
import java.util.function.BiPredicate;
import java.util.function.BinaryOperator;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.function.ToIntFunction;
import java.util.stream.Collector;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Implements an immutable set using a Compressed Hash-Array Mapped Prefix-tree
 * (CHAMP).
 * <p>
 * Features:
 * <ul>
 *     <li>supports up to 2<sup>31</sup> - 1 elements</li>
 *     <li>allows null elements</li>
 *     <li>is immutable</li>
 *     <li>is thread-safe</li>
 *     <li>does not guarantee a specific iteration order</li>
 * </ul>
 * <p>
 * Performance characteristics:
 * <ul>
 *     <li>add: O(1)</li>
 *     <li>remove: O(1)</li>
 *     <li>contains: O(1)</li>
 *     <li>subtract, intersect, addAll with another {@code ChampSet}: O(n)
 *     in the size of the differing parts of both tries; sub-tries that are
 *     shared by both sets are skipped</li>
 *     <li>iterator.next: O(1)</li>
 * </ul>
 * <p>
 * Bulk operations with another {@code ChampSet} or with the key view of a
 * {@link ChampMap} walk both tries in parallel. Sub-tries that are not
 * affected by the operation are shared with the result.
 *
 * <p>
 * This class does not implement {@link io.vavr.collection.Set}. It works
 * with vavr through {@link Option}, the vavr {@link Iterator} it returns,
 * {@link #toVavrSet()}, and by accepting a vavr {@code HashSet} or
 * {@code LinkedHashSet} as a fast membership test in {@link #subtract(Iterable)}
 * and {@link #intersect(Iterable)}.
 *
 * @param <T> the element type
 */
public final class ChampSet<T> implements Iterable<T>, FastMembership<T>, Serializable {

    private static final long serialVersionUID = 1L;

    private static final ChampSet<?> EMPTY = new ChampSet<>(BitmapIndexedNode.emptyNode(), 0);

    /**
     * We do not guarantee an iteration order. Make sure that nobody accidentally
     * relies on it.
     */
    static final int SALT = 0;

    final transient BitmapIndexedNode<T> root;
    private final int size;

    ChampSet(BitmapIndexedNode<T> root, int size) {
        this.root = root;
        this.size = size;
    }

    // -- factories

    @SuppressWarnings("unchecked")
    public static <T> ChampSet<T> empty() {
        return (ChampSet<T>) EMPTY;
    }

    public static <T> Collector<T, ArrayList<T>, ChampSet<T>> collector() {
        final Supplier<ArrayList<T>> supplier = ArrayList::new;
        final BiConsumer<ArrayList<T>, T> accumulator = ArrayList::add;
        final BinaryOperator<ArrayList<T>> combiner = (left, right) -> {
            left.addAll(right);
            return left;
        };
        final Function<ArrayList<T>, ChampSet<T>> finisher = ChampSet::ofAll;
        return Collector.of(supplier, accumulator, combiner, finisher);
    }

    /**
     * Narrows a widened {@code ChampSet<? extends T>} to {@code ChampSet<T>}
     * by performing a type-safe cast.
     */
    @SuppressWarnings("unchecked")
    public static <T> ChampSet<T> narrow(ChampSet<? extends T> set) {
        return (ChampSet<T>) set;
    }

    public static <T> ChampSet<T> of(T element) {
        return ChampSet.<T>empty().add(element);
    }

    @SafeVarargs
    public static <T> ChampSet<T> of(T... elements) {
        Objects.requireNonNull(elements, "elements is null");
        return ChampSet.<T>empty().addAll(java.util.Arrays.asList(elements));
    }

    @SuppressWarnings("unchecked")
    public static <T> ChampSet<T> ofAll(Iterable<? extends T> elements) {
        Objects.requireNonNull(elements, "elements is null");
        return elements instanceof ChampSet ? (ChampSet<T>) elements : ChampSet.<T>empty().addAll(elements);
    }

    public static <T> ChampSet<T> ofAll(Stream<? extends T> javaStream) {
        Objects.requireNonNull(javaStream, "javaStream is null");
        return ChampSet.ofAll(Iterator.ofAll(javaStream.iterator()));
    }

    private static <T> ChampSet<T> newSet(BitmapIndexedNode<T> root, int size) {
        return size == 0 ? empty() : new ChampSet<>(root, size);
    }

    // -- entry functions

    static int keyHash(Object e) {
        return SALT ^ Objects.hashCode(e);
    }

    /**
     * Keeps the element that is already in the set.
     */
    static <E> E updateElement(E oldElement, E newElement) {
        return oldElement;
    }

    // -- point operations

    public ChampSet<T> add(T element) {
        int keyHash = keyHash(element);
        ChangeEvent<T> details = new ChangeEvent<>();
        BitmapIndexedNode<T> newRoot = BitmapIndexedNode.asRoot(
                root.put(null, element, keyHash, 0, details, ChampSet::updateElement, Objects::equals, ChampSet::keyHash));
        if (details.isModified()) {
            return new ChampSet<>(newRoot, size + 1);
        }
        return this;
    }

    public ChampSet<T> remove(T element) {
        int keyHash = keyHash(element);
        ChangeEvent<T> details = new ChangeEvent<>();
        BitmapIndexedNode<T> newRoot = BitmapIndexedNode.asRoot(
                root.remove(null, element, keyHash, 0, details, Objects::equals));
        if (details.isModified()) {
            return newSet(newRoot, size - 1);
        }
        return this;
    }

    @Override
    public boolean contains(T element) {
        return root.find(element, keyHash(element), 0, Objects::equals) != Node.NO_DATA;
    }

    // -- bulk operations

    /**
     * Adds all given elements to this set.
     * <p>
     * Elements that are already in this set are kept, the given duplicates
     * are discarded.
     *
     * @param elements the elements to add
     * @return a set with the elements of this set and the given elements
     */
    @SuppressWarnings("unchecked")
    public ChampSet<T> addAll(Iterable<? extends T> elements) {
        Objects.requireNonNull(elements, "elements is null");
        if (elements instanceof ChampSet) {
            ChampSet<T> that = (ChampSet<T>) elements;
            if (isEmpty()) {
                return that;
            }
            BulkChangeEvent bulkChange = new BulkChangeEvent();
            ChampNodeBuilder<T> builder = ChampAlgebra.union(new IdentityObject(), root, that.root, 0, bulkChange,
                    ChampSet::updateElement, Objects::equals, ChampSet::keyHash);
            if (builder == null) {
                return this;
            }
            BitmapIndexedNode<T> newRoot = builder.buildRoot();
            assert ChampInvariants.verify(newRoot, ChampSet::keyHash);
            return newSet(newRoot, size + that.size - bulkChange.inBoth);
        }
        IdentityObject owner = new IdentityObject();
        BitmapIndexedNode<T> newRoot = root;
        int newSize = size;
        ChangeEvent<T> details = new ChangeEvent<>();
        for (T element : elements) {
            details.reset();
            newRoot = BitmapIndexedNode.asRoot(newRoot.put(owner, element, keyHash(element), 0, details,
                    ChampSet::updateElement, Objects::equals, ChampSet::keyHash));
            if (details.isModified()) {
                newSize++;
            }
        }
        return newSize == size ? this : new ChampSet<>(newRoot, newSize);
    }

    /**
     * Alias for {@link #addAll(Iterable)}.
     */
    public ChampSet<T> union(Iterable<? extends T> elements) {
        return addAll(elements);
    }

    /**
     * Removes all elements of the other set from this set.
     * <p>
     * Walks both tries in parallel. The result shares every sub-trie of this
     * set that contains no element of the other set.
     *
     * @param other another set
     * @return this set if nothing was removed, otherwise a new set
     */
    public ChampSet<T> subtract(ChampSet<? extends T> other) {
        Objects.requireNonNull(other, "other is null");
        return subtractTrie(other.root, Objects::equals, ChampSet::keyHash);
    }

    /**
     * Removes all keys of a map from this set.
     *
     * @param keys the key view of a map
     * @return this set if nothing was removed, otherwise a new set
     */
    public ChampSet<T> subtract(ChampMap.Keys<? extends T> keys) {
        Objects.requireNonNull(keys, "keys is null");
        return subtractKeys(keys.map());
    }

    /**
     * Removes all elements of the given iterable from this set.
     * <p>
     * A {@code ChampSet} or the key view of a {@link ChampMap} is subtracted
     * trie by trie. A collection with a fast membership test ({@link FastMembership},
     * {@link java.util.Set}, {@link io.vavr.collection.Set}) is used as a
     * filter. Any other iterable is traversed once, and each of its elements
     * is removed. Duplicates in the iterable are harmless.
     *
     * @param elements the elements to remove
     * @return this set if nothing was removed, otherwise a new set
     */
    @SuppressWarnings("unchecked")
    public ChampSet<T> subtract(Iterable<? extends T> elements) {
        Objects.requireNonNull(elements, "elements is null");
        if (elements instanceof ChampSet) {
            return subtract((ChampSet<? extends T>) elements);
        }
        if (elements instanceof ChampMap.Keys) {
            return subtract((ChampMap.Keys<? extends T>) elements);
        }
        if (isEmpty()) {
            return this;
        }
        Option<Predicate<T>> membership = FastMembership.of(elements);
        if (membership.isDefined()) {
            return reject(membership.get());
        }
        IdentityObject owner = new IdentityObject();
        BitmapIndexedNode<T> newRoot = root;
        int newSize = size;
        ChangeEvent<T> details = new ChangeEvent<>();
        for (T element : elements) {
            details.reset();
            newRoot = BitmapIndexedNode.asRoot(newRoot.remove(owner, element, keyHash(element), 0, details, Objects::equals));
            if (details.isModified() && --newSize == 0) {
                return empty();
            }
        }
        return newSize == size ? this : new ChampSet<>(newRoot, newSize);
    }

    /**
     * Alias for {@link #subtract(Iterable)}.
     */
    public ChampSet<T> removeAll(Iterable<? extends T> elements) {
        return subtract(elements);
    }

    public ChampSet<T> diff(io.vavr.collection.Set<? extends T> elements) {
        return subtract(elements);
    }

    /**
     * Keeps only the elements of this set that are also in the given iterable.
     *
     * @param elements the elements to retain
     * @return this set if nothing was removed, otherwise a new set
     */
    @SuppressWarnings("unchecked")
    public ChampSet<T> intersect(Iterable<? extends T> elements) {
        Objects.requireNonNull(elements, "elements is null");
        if (elements instanceof ChampSet) {
            return intersectTrie(((ChampSet<? extends T>) elements).root, Objects::equals, ChampSet::keyHash);
        }
        if (elements instanceof ChampMap.Keys) {
            return intersectKeys(((ChampMap.Keys<? extends T>) elements).map());
        }
        if (isEmpty()) {
            return this;
        }
        Option<Predicate<T>> membership = FastMembership.of(elements);
        if (membership.isDefined()) {
            return filter(membership.get());
        }
        HashSet<Object> retained = new HashSet<>();
        elements.forEach(retained::add);
        return filter(retained::contains);
    }

    /**
     * Alias for {@link #intersect(Iterable)}.
     */
    public ChampSet<T> retainAll(Iterable<? extends T> elements) {
        return intersect(elements);
    }

    /**
     * Returns the elements that are in exactly one of the two sets.
     */
    public ChampSet<T> symmetricDifference(ChampSet<T> other) {
        Objects.requireNonNull(other, "other is null");
        return subtract(other).addAll(other.subtract(this));
    }

    public ChampSet<T> filter(Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate, "predicate is null");
        if (isEmpty()) {
            return this;
        }
        BulkChangeEvent bulkChange = new BulkChangeEvent();
        ChampNodeBuilder<T> builder = ChampAlgebra.filter(new IdentityObject(), root, 0, bulkChange, predicate);
        if (builder == null) {
            return this;
        }
        BitmapIndexedNode<T> newRoot = builder.buildRoot();
        assert ChampInvariants.verify(newRoot, ChampSet::keyHash);
        return newSet(newRoot, size - bulkChange.removed);
    }

    public ChampSet<T> reject(Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate, "predicate is null");
        return filter(predicate.negate());
    }

    private <X> ChampSet<T> subtractTrie(BitmapIndexedNode<X> otherRoot,
                                         BiPredicate<? super T, ? super X> equalsFunction,
                                         ToIntFunction<? super X> otherHashFunction) {
        if (isEmpty() || otherRoot.isEmpty()) {
            return this;
        }
        BulkChangeEvent bulkChange = new BulkChangeEvent();
        ChampNodeBuilder<T> builder = ChampAlgebra.subtract(new IdentityObject(), root, otherRoot, 0, bulkChange,
                equalsFunction, ChampSet::keyHash, otherHashFunction);
        if (builder == null) {
            return this;
        }
        BitmapIndexedNode<T> newRoot = builder.buildRoot();
        assert ChampInvariants.verify(newRoot, ChampSet::keyHash);
        return newSet(newRoot, size - bulkChange.removed);
    }

    private <X> ChampSet<T> intersectTrie(BitmapIndexedNode<X> otherRoot,
                                          BiPredicate<? super T, ? super X> equalsFunction,
                                          ToIntFunction<? super X> otherHashFunction) {
        if (isEmpty()) {
            return this;
        }
        if (otherRoot.isEmpty()) {
            return empty();
        }
        BulkChangeEvent bulkChange = new BulkChangeEvent();
        ChampNodeBuilder<T> builder = ChampAlgebra.intersect(new IdentityObject(), root, otherRoot, 0, bulkChange,
                equalsFunction, ChampSet::keyHash, otherHashFunction);
        if (builder == null) {
            return this;
        }
        BitmapIndexedNode<T> newRoot = builder.buildRoot();
        assert ChampInvariants.verify(newRoot, ChampSet::keyHash);
        return newSet(newRoot, size - bulkChange.removed);
    }

    private <K, V> ChampSet<T> subtractKeys(ChampMap<K, V> map) {
        return subtractTrie(map.root, ChampSet::elementEqualsKey, ChampMap::entryKeyHash);
    }

    private <K, V> ChampSet<T> intersectKeys(ChampMap<K, V> map) {
        return intersectTrie(map.root, ChampSet::elementEqualsKey, ChampMap::entryKeyHash);
    }

    private static boolean elementEqualsKey(Object element, AbstractMap.SimpleImmutableEntry<?, ?> entry) {
        return Objects.equals(element, entry.getKey());
    }

    // -- queries

    public int size() {
        return size;
    }

    public int length() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * Returns the first element in iteration order.
     *
     * @throws java.util.NoSuchElementException if this set is empty
     */
    public T head() {
        if (isEmpty()) {
            throw new java.util.NoSuchElementException("head of empty set");
        }
        return Node.getFirst(root);
    }

    public Option<T> headOption() {
        return isEmpty() ? Option.none() : Option.some(head());
    }

    // -- conversions

    @Override
    public Iterator<T> iterator() {
        return Iterator.ofAll(new ChampIteration.IteratorFacade<>(spliterator()));
    }

    @Override
    public Spliterator<T> spliterator() {
        return new ChampIteration.ChampSpliterator<>(root, Function.identity(),
                Spliterator.SIZED | Spliterator.IMMUTABLE | Spliterator.DISTINCT, size);
    }

    public Stream<T> toJavaStream() {
        return StreamSupport.stream(spliterator(), false);
    }

    public java.util.Set<T> toJavaSet() {
        java.util.Set<T> set = new HashSet<>(Math.max(16, size * 4 / 3 + 1));
        forEach(set::add);
        return set;
    }

    public io.vavr.collection.Set<T> toVavrSet() {
        return io.vavr.collection.HashSet.ofAll(this);
    }

    // -- object methods

    @Override
    public boolean equals(Object o) {
        if (o == this) {
            return true;
        }
        if (!(o instanceof ChampSet)) {
            return false;
        }
        @SuppressWarnings("unchecked")
        ChampSet<Object> that = (ChampSet<Object>) o;
        if (size != that.size) {
            return false;
        }
        if ((Object) root == that.root) {
            return true;
        }
        for (T element : this) {
            if (!that.contains(element)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int hash = 0;
        for (T element : this) {
            hash += Objects.hashCode(element);
        }
        return hash;
    }

    @Override
    public String toString() {
        return iterator().mkString(stringPrefix() + "(", ", ", ")");
    }

    public String stringPrefix() {
        return "ChampSet";
    }

    // -- Serialization

    /**
     * The presence of this method causes the serialization system to emit a
     * SerializationProxy instance instead of an instance of the enclosing class.
     */
    private Object writeReplace() {
        return new SerializationProxy<>(this);
    }

    /**
     * Instances of the enclosing class are always serialized through their
     * SerializationProxy.
     */
    private void readObject(ObjectInputStream stream) throws InvalidObjectException {
        throw new InvalidObjectException("Proxy required");
    }

    private static final class SerializationProxy<T> implements Serializable {

        private static final long serialVersionUID = 1L;

        private transient ChampSet<T> set;

        SerializationProxy(ChampSet<T> set) {
            this.set = set;
        }

        private void writeObject(ObjectOutputStream s) throws IOException {
            s.defaultWriteObject();
            s.writeInt(set.size());
            for (T e : set) {
                s.writeObject(e);
            }
        }

        private void readObject(ObjectInputStream s) throws ClassNotFoundException, IOException {
            s.defaultReadObject();
            final int size = s.readInt();
            if (size < 0) {
                throw new InvalidObjectException("No elements");
            }
            IdentityObject owner = new IdentityObject();
            BitmapIndexedNode<T> newRoot = BitmapIndexedNode.emptyNode();
            ChangeEvent<T> details = new ChangeEvent<>();
            int newSize = 0;
            for (int i = 0; i < size; i++) {
                @SuppressWarnings("unchecked") final T element = (T) s.readObject();
                details.reset();
                newRoot = BitmapIndexedNode.asRoot(newRoot.put(owner, element, keyHash(element), 0, details,
                        ChampSet::updateElement, Objects::equals, ChampSet::keyHash));
                if (details.isModified()) {
                    newSize++;
                }
            }
            set = newSet(newRoot, newSize);
        }

        private Object readResolve() {
            return set;
        }
    }
}
