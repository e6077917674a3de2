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
import ch.randelshofer.persistent.ChampTrie.HashCollisionNode;
import ch.randelshofer.persistent.ChampTrie.IdentityObject;
import ch.randelshofer.persistent.ChampTrie.Node;

import java.util.Arrays;
import java.util.function.BiFunction;
import java.util.function.BiPredicate;
import java.util.function.Predicate;
import java.util.function.ToIntFunction;

import static ch.randelshofer.persistent.HashPath.BIT_PARTITION_SIZE;
import static ch.randelshofer.persistent.HashPath.bitpos;

/**
 * Set algebra on CHAMP tries.
 * <p>
 * The operations walk two tries slot by slot and record their edits in a
 * {@link ChampNodeBuilder} per level. A level without edits yields
 * {@code null}, so that the caller can keep the original node. Sub-tries that
 * are the same object in both operands are handled without descending into
 * them.
 * <p>
 * The left operand has entries of type {@code D}, the right operand entries of
 * type {@code X}. Both tries must have been built with hash functions that
 * agree on equal keys.
 */
final class ChampAlgebra {
    private ChampAlgebra() {
    }

    /**
     * Removes all entries of {@code other} from {@code self}.
     *
     * @param owner             the owner of the new nodes, or null
     * @param self              the left operand
     * @param other             the right operand
     * @param shift             the shift of both nodes
     * @param bulkChange        receives the number of removed entries
     * @param equalsFunction    compares an entry of {@code self} with an entry of {@code other}
     * @param selfHashFunction  computes the hash of an entry of {@code self}
     * @param otherHashFunction computes the hash of an entry of {@code other}
     * @return the edits of this level, or null if {@code self} is unchanged
     */
    static <D, X> ChampNodeBuilder<D> subtract(IdentityObject owner,
                                               BitmapIndexedNode<D> self, BitmapIndexedNode<X> other, int shift,
                                               BulkChangeEvent bulkChange,
                                               BiPredicate<? super D, ? super X> equalsFunction,
                                               ToIntFunction<? super D> selfHashFunction,
                                               ToIntFunction<? super X> otherHashFunction) {
        return new Subtraction<>(owner, bulkChange, equalsFunction, selfHashFunction, otherHashFunction)
                .subtract(self, other, shift);
    }

    /**
     * Keeps only the entries of {@code self} that are also in {@code other}.
     *
     * @return the edits of this level, or null if {@code self} is unchanged
     */
    static <D, X> ChampNodeBuilder<D> intersect(IdentityObject owner,
                                                BitmapIndexedNode<D> self, BitmapIndexedNode<X> other, int shift,
                                                BulkChangeEvent bulkChange,
                                                BiPredicate<? super D, ? super X> equalsFunction,
                                                ToIntFunction<? super D> selfHashFunction,
                                                ToIntFunction<? super X> otherHashFunction) {
        return new Intersection<>(owner, bulkChange, equalsFunction, selfHashFunction, otherHashFunction)
                .intersect(self, other, shift);
    }

    /**
     * Adds all entries of {@code other} to {@code self}.
     * <p>
     * Entries that are in both tries are resolved with the update function,
     * which receives the entry of {@code self} first. Their number is added
     * to {@link BulkChangeEvent#inBoth}.
     *
     * @return the edits of this level, or null if {@code self} is unchanged
     */
    static <D> ChampNodeBuilder<D> union(IdentityObject owner,
                                         BitmapIndexedNode<D> self, BitmapIndexedNode<D> other, int shift,
                                         BulkChangeEvent bulkChange,
                                         BiFunction<D, D, D> updateFunction,
                                         BiPredicate<? super D, ? super D> equalsFunction,
                                         ToIntFunction<? super D> hashFunction) {
        return new Union<>(owner, bulkChange, updateFunction, equalsFunction, hashFunction)
                .union(self, other, shift);
    }

    /**
     * Keeps only the entries that satisfy the predicate.
     *
     * @return the edits of this level, or null if {@code node} is unchanged
     */
    static <D> ChampNodeBuilder<D> filter(IdentityObject owner,
                                          BitmapIndexedNode<D> node, int shift,
                                          BulkChangeEvent bulkChange,
                                          Predicate<? super D> predicate) {
        return new Filter<D>(owner, bulkChange, predicate).filter(node, shift);
    }

    /**
     * Keeps the entries of a collision node that satisfy the predicate.
     * <p>
     * A single surviving entry is returned as a singleton node, so that the
     * parent inlines it.
     */
    static <D> Node<D> filterCollisionNode(IdentityObject owner, HashCollisionNode<D> node,
                                           Predicate<? super D> predicate, BulkChangeEvent bulkChange) {
        Object[] kept = new Object[node.dataArity()];
        int count = 0;
        for (int i = 0; i < node.dataArity(); i++) {
            D data = node.getData(i);
            if (predicate.test(data)) {
                kept[count++] = data;
            }
        }
        if (count == node.dataArity()) {
            return node;
        }
        bulkChange.removed += node.dataArity() - count;
        switch (count) {
            case 0:
                return BitmapIndexedNode.emptyNode();
            case 1:
                @SuppressWarnings("unchecked")
                D survivor = (D) kept[0];
                return Node.newSingletonNode(owner, survivor, node.hash());
            default:
                return Node.newHashCollisionNode(owner, node.hash(), Arrays.copyOf(kept, count));
        }
    }

    /**
     * State shared by the recursive steps of an operation on two tries.
     */
    private abstract static class PairwiseOperation<D, X> {
        final IdentityObject owner;
        final BulkChangeEvent bulkChange;
        final BiPredicate<? super D, ? super X> equalsFunction;
        final BiPredicate<X, D> reversedEqualsFunction;
        final ToIntFunction<? super D> selfHashFunction;
        final ToIntFunction<? super X> otherHashFunction;

        PairwiseOperation(IdentityObject owner, BulkChangeEvent bulkChange,
                          BiPredicate<? super D, ? super X> equalsFunction,
                          ToIntFunction<? super D> selfHashFunction,
                          ToIntFunction<? super X> otherHashFunction) {
            this.owner = owner;
            this.bulkChange = bulkChange;
            this.equalsFunction = equalsFunction;
            this.reversedEqualsFunction = (x, d) -> equalsFunction.test(d, x);
            this.selfHashFunction = selfHashFunction;
            this.otherHashFunction = otherHashFunction;
        }

        /**
         * Returns true if the slot {@code bitpos} of {@code other} holds an
         * entry equal to {@code data}.
         */
        boolean containsData(D data, BitmapIndexedNode<X> other, int bitpos, int shift) {
            int dataHash = selfHashFunction.applyAsInt(data);
            if (other.isDataAt(bitpos)) {
                X otherData = other.dataAt(bitpos);
                return dataHash == otherHashFunction.applyAsInt(otherData) && equalsFunction.test(data, otherData);
            }
            return other.nodeAt(bitpos).find(data, dataHash, shift + BIT_PARTITION_SIZE, reversedEqualsFunction) != Node.NO_DATA;
        }

        boolean containsData(D data, int dataHash, Node<X> other, int shift) {
            return other.find(data, dataHash, shift, reversedEqualsFunction) != Node.NO_DATA;
        }

        ChampNodeBuilder<D> edit(ChampNodeBuilder<D> builder, BitmapIndexedNode<D> self) {
            return builder != null ? builder : ChampNodeBuilder.fromExisting(owner, self);
        }
    }

    private static final class Subtraction<D, X> extends PairwiseOperation<D, X> {
        Subtraction(IdentityObject owner, BulkChangeEvent bulkChange,
                    BiPredicate<? super D, ? super X> equalsFunction,
                    ToIntFunction<? super D> selfHashFunction,
                    ToIntFunction<? super X> otherHashFunction) {
            super(owner, bulkChange, equalsFunction, selfHashFunction, otherHashFunction);
        }

        ChampNodeBuilder<D> subtract(BitmapIndexedNode<D> self, BitmapIndexedNode<X> other, int shift) {
            if (self.isEmpty() || other.isEmpty()) {
                return null;
            }
            if ((Object) self == other) {
                bulkChange.removed += Node.count(self);
                return ChampNodeBuilder.empty(owner);
            }
            ChampNodeBuilder<D> builder = null;
            int shared = (self.dataMap() | self.nodeMap()) & (other.dataMap() | other.nodeMap());
            for (int bits = shared; bits != 0; bits &= bits - 1) {
                int mask = Integer.numberOfTrailingZeros(bits);
                int bitpos = bitpos(mask);
                if (self.isDataAt(bitpos)) {
                    if (containsData(self.dataAt(bitpos), other, bitpos, shift)) {
                        builder = edit(builder, self);
                        builder.removeSlot(mask);
                        bulkChange.removed++;
                    }
                } else {
                    Node<D> child = self.nodeAt(bitpos);
                    Node<D> newChild = other.isDataAt(bitpos)
                            ? removeData(child, other.dataAt(bitpos), shift + BIT_PARTITION_SIZE)
                            : subtractNodes(child, other.nodeAt(bitpos), shift + BIT_PARTITION_SIZE);
                    if (newChild != child) {
                        builder = edit(builder, self);
                        builder.replaceChild(mask, newChild);
                    }
                }
            }
            return builder;
        }

        private Node<D> subtractNodes(Node<D> self, Node<X> other, int shift) {
            if ((Object) self == other) {
                bulkChange.removed += Node.count(self);
                return BitmapIndexedNode.emptyNode();
            }
            if (self instanceof HashCollisionNode) {
                HashCollisionNode<D> collisionNode = (HashCollisionNode<D>) self;
                int hash = collisionNode.hash();
                return filterCollisionNode(owner, collisionNode, d -> !containsData(d, hash, other, shift), bulkChange);
            }
            BitmapIndexedNode<D> bitmapNode = (BitmapIndexedNode<D>) self;
            if (other instanceof BitmapIndexedNode) {
                ChampNodeBuilder<D> builder = subtract(bitmapNode, (BitmapIndexedNode<X>) other, shift);
                return builder == null ? self : builder.build(shift);
            }
            Node<D> result = self;
            for (int i = 0; i < other.dataArity(); i++) {
                X otherData = other.getData(i);
                if (result.isSingleton()) {
                    // The bitmap of a singleton is only valid at the root level.
                    D last = result.getData(0);
                    if (selfHashFunction.applyAsInt(last) == otherHashFunction.applyAsInt(otherData)
                            && equalsFunction.test(last, otherData)) {
                        bulkChange.removed++;
                        return BitmapIndexedNode.emptyNode();
                    }
                } else {
                    result = removeData(result, otherData, shift);
                }
            }
            return result;
        }

        private Node<D> removeData(Node<D> self, X otherData, int shift) {
            ChangeEvent<D> details = new ChangeEvent<>();
            Node<D> result = self.remove(owner, otherData, otherHashFunction.applyAsInt(otherData), shift, details, equalsFunction);
            if (details.isRemoved()) {
                bulkChange.removed++;
            }
            return result;
        }
    }

    private static final class Intersection<D, X> extends PairwiseOperation<D, X> {
        Intersection(IdentityObject owner, BulkChangeEvent bulkChange,
                     BiPredicate<? super D, ? super X> equalsFunction,
                     ToIntFunction<? super D> selfHashFunction,
                     ToIntFunction<? super X> otherHashFunction) {
            super(owner, bulkChange, equalsFunction, selfHashFunction, otherHashFunction);
        }

        ChampNodeBuilder<D> intersect(BitmapIndexedNode<D> self, BitmapIndexedNode<X> other, int shift) {
            if (self.isEmpty() || (Object) self == other) {
                return null;
            }
            ChampNodeBuilder<D> builder = null;
            int otherMap = other.dataMap() | other.nodeMap();
            for (int bits = self.dataMap() | self.nodeMap(); bits != 0; bits &= bits - 1) {
                int mask = Integer.numberOfTrailingZeros(bits);
                int bitpos = bitpos(mask);
                if ((otherMap & bitpos) == 0) {
                    builder = edit(builder, self);
                    builder.removeSlot(mask);
                    bulkChange.removed += self.isDataAt(bitpos) ? 1 : Node.count(self.nodeAt(bitpos));
                } else if (self.isDataAt(bitpos)) {
                    if (!containsData(self.dataAt(bitpos), other, bitpos, shift)) {
                        builder = edit(builder, self);
                        builder.removeSlot(mask);
                        bulkChange.removed++;
                    }
                } else if (other.isDataAt(bitpos)) {
                    Node<D> child = self.nodeAt(bitpos);
                    X otherData = other.dataAt(bitpos);
                    Object found = child.find(otherData, otherHashFunction.applyAsInt(otherData),
                            shift + BIT_PARTITION_SIZE, equalsFunction);
                    builder = edit(builder, self);
                    if (found == Node.NO_DATA) {
                        builder.removeSlot(mask);
                        bulkChange.removed += Node.count(child);
                    } else {
                        @SuppressWarnings("unchecked")
                        D foundData = (D) found;
                        builder.replaceData(mask, foundData);
                        bulkChange.removed += Node.count(child) - 1;
                    }
                } else {
                    Node<D> child = self.nodeAt(bitpos);
                    Node<D> newChild = intersectNodes(child, other.nodeAt(bitpos), shift + BIT_PARTITION_SIZE);
                    if (newChild != child) {
                        builder = edit(builder, self);
                        builder.replaceChild(mask, newChild);
                    }
                }
            }
            return builder;
        }

        private Node<D> intersectNodes(Node<D> self, Node<X> other, int shift) {
            if ((Object) self == other) {
                return self;
            }
            if (self instanceof HashCollisionNode) {
                HashCollisionNode<D> collisionNode = (HashCollisionNode<D>) self;
                int hash = collisionNode.hash();
                return filterCollisionNode(owner, collisionNode, d -> containsData(d, hash, other, shift), bulkChange);
            }
            BitmapIndexedNode<D> bitmapNode = (BitmapIndexedNode<D>) self;
            if (other instanceof BitmapIndexedNode) {
                ChampNodeBuilder<D> builder = intersect(bitmapNode, (BitmapIndexedNode<X>) other, shift);
                return builder == null ? self : builder.build(shift);
            }
            HashCollisionNode<X> otherCollisionNode = (HashCollisionNode<X>) other;
            int hash = otherCollisionNode.hash();
            Object[] found = new Object[otherCollisionNode.dataArity()];
            int count = 0;
            for (int i = 0; i < otherCollisionNode.dataArity(); i++) {
                Object data = self.find(otherCollisionNode.getData(i), hash, shift, equalsFunction);
                if (data != Node.NO_DATA) {
                    found[count++] = data;
                }
            }
            bulkChange.removed += Node.count(self) - count;
            switch (count) {
                case 0:
                    return BitmapIndexedNode.emptyNode();
                case 1:
                    @SuppressWarnings("unchecked")
                    D survivor = (D) found[0];
                    return Node.newSingletonNode(owner, survivor, hash);
                default:
                    return Node.newHashCollisionNode(owner, hash, Arrays.copyOf(found, count));
            }
        }
    }

    private static final class Union<D> extends PairwiseOperation<D, D> {
        private final BiFunction<D, D, D> updateFunction;
        private final BiFunction<D, D, D> reversedUpdateFunction;

        Union(IdentityObject owner, BulkChangeEvent bulkChange,
              BiFunction<D, D, D> updateFunction,
              BiPredicate<? super D, ? super D> equalsFunction,
              ToIntFunction<? super D> hashFunction) {
            super(owner, bulkChange, equalsFunction, hashFunction, hashFunction);
            this.updateFunction = updateFunction;
            this.reversedUpdateFunction = (otherData, selfData) -> updateFunction.apply(selfData, otherData);
        }

        ChampNodeBuilder<D> union(BitmapIndexedNode<D> self, BitmapIndexedNode<D> other, int shift) {
            if (other.isEmpty()) {
                return null;
            }
            if (self == other) {
                bulkChange.inBoth += Node.count(self);
                return null;
            }
            ChampNodeBuilder<D> builder = null;
            int selfMap = self.dataMap() | self.nodeMap();
            for (int bits = other.dataMap() | other.nodeMap(); bits != 0; bits &= bits - 1) {
                int mask = Integer.numberOfTrailingZeros(bits);
                int bitpos = bitpos(mask);
                if ((selfMap & bitpos) == 0) {
                    builder = edit(builder, self);
                    if (other.isDataAt(bitpos)) {
                        builder.insert(mask, other.dataAt(bitpos));
                    } else {
                        builder.insertChild(mask, other.nodeAt(bitpos));
                    }
                } else if (self.isDataAt(bitpos) && other.isDataAt(bitpos)) {
                    D selfData = self.dataAt(bitpos);
                    D otherData = other.dataAt(bitpos);
                    int selfHash = selfHashFunction.applyAsInt(selfData);
                    int otherHash = otherHashFunction.applyAsInt(otherData);
                    if (selfHash == otherHash && equalsFunction.test(selfData, otherData)) {
                        bulkChange.inBoth++;
                        D updatedData = updateFunction.apply(selfData, otherData);
                        if (updatedData != selfData) {
                            builder = edit(builder, self);
                            builder.replaceData(mask, updatedData);
                        }
                    } else {
                        builder = edit(builder, self);
                        builder.replaceChild(mask, Node.mergeTwoDataEntriesIntoNode(owner,
                                selfData, selfHash, otherData, otherHash, shift + BIT_PARTITION_SIZE));
                    }
                } else if (self.isDataAt(bitpos)) {
                    D selfData = self.dataAt(bitpos);
                    ChangeEvent<D> details = new ChangeEvent<>();
                    Node<D> newChild = other.nodeAt(bitpos).put(owner, selfData, selfHashFunction.applyAsInt(selfData),
                            shift + BIT_PARTITION_SIZE, details, reversedUpdateFunction, equalsFunction, selfHashFunction);
                    if (!details.isAdded()) {
                        bulkChange.inBoth++;
                    }
                    builder = edit(builder, self);
                    builder.replaceChild(mask, newChild);
                } else if (other.isDataAt(bitpos)) {
                    Node<D> child = self.nodeAt(bitpos);
                    D otherData = other.dataAt(bitpos);
                    ChangeEvent<D> details = new ChangeEvent<>();
                    Node<D> newChild = child.put(owner, otherData, otherHashFunction.applyAsInt(otherData),
                            shift + BIT_PARTITION_SIZE, details, updateFunction, equalsFunction, selfHashFunction);
                    if (!details.isAdded()) {
                        bulkChange.inBoth++;
                    }
                    if (newChild != child) {
                        builder = edit(builder, self);
                        builder.replaceChild(mask, newChild);
                    }
                } else {
                    Node<D> child = self.nodeAt(bitpos);
                    Node<D> newChild = unionNodes(child, other.nodeAt(bitpos), shift + BIT_PARTITION_SIZE);
                    if (newChild != child) {
                        builder = edit(builder, self);
                        builder.replaceChild(mask, newChild);
                    }
                }
            }
            return builder;
        }

        private Node<D> unionNodes(Node<D> self, Node<D> other, int shift) {
            if (self == other) {
                bulkChange.inBoth += Node.count(self);
                return self;
            }
            if (self instanceof BitmapIndexedNode && other instanceof BitmapIndexedNode) {
                ChampNodeBuilder<D> builder = union((BitmapIndexedNode<D>) self, (BitmapIndexedNode<D>) other, shift);
                return builder == null ? self : builder.build(shift);
            }
            if (other instanceof HashCollisionNode) {
                return putAll(self, other, shift, updateFunction);
            }
            return putAll(other, self, shift, reversedUpdateFunction);
        }

        /**
         * Puts the entries of a collision node into another node.
         */
        private Node<D> putAll(Node<D> target, Node<D> collisionNode, int shift, BiFunction<D, D, D> update) {
            Node<D> result = target;
            ChangeEvent<D> details = new ChangeEvent<>();
            for (int i = 0; i < collisionNode.dataArity(); i++) {
                D data = collisionNode.getData(i);
                details.reset();
                result = result.put(owner, data, selfHashFunction.applyAsInt(data), shift,
                        details, update, equalsFunction, selfHashFunction);
                if (!details.isAdded()) {
                    bulkChange.inBoth++;
                }
            }
            return result;
        }
    }

    private static final class Filter<D> {
        private final IdentityObject owner;
        private final BulkChangeEvent bulkChange;
        private final Predicate<? super D> predicate;

        Filter(IdentityObject owner, BulkChangeEvent bulkChange, Predicate<? super D> predicate) {
            this.owner = owner;
            this.bulkChange = bulkChange;
            this.predicate = predicate;
        }

        ChampNodeBuilder<D> filter(BitmapIndexedNode<D> node, int shift) {
            ChampNodeBuilder<D> builder = null;
            for (int bits = node.dataMap() | node.nodeMap(); bits != 0; bits &= bits - 1) {
                int mask = Integer.numberOfTrailingZeros(bits);
                int bitpos = bitpos(mask);
                if (node.isDataAt(bitpos)) {
                    if (!predicate.test(node.dataAt(bitpos))) {
                        builder = builder != null ? builder : ChampNodeBuilder.fromExisting(owner, node);
                        builder.removeSlot(mask);
                        bulkChange.removed++;
                    }
                } else {
                    Node<D> child = node.nodeAt(bitpos);
                    Node<D> newChild = filterNode(child, shift + BIT_PARTITION_SIZE);
                    if (newChild != child) {
                        builder = builder != null ? builder : ChampNodeBuilder.fromExisting(owner, node);
                        builder.replaceChild(mask, newChild);
                    }
                }
            }
            return builder;
        }

        private Node<D> filterNode(Node<D> node, int shift) {
            if (node instanceof HashCollisionNode) {
                return filterCollisionNode(owner, (HashCollisionNode<D>) node, predicate, bulkChange);
            }
            ChampNodeBuilder<D> builder = filter((BitmapIndexedNode<D>) node, shift);
            return builder == null ? node : builder.build(shift);
        }
    }
}
