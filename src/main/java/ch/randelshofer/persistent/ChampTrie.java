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

import java.io.Serializable;
import java.util.NoSuchElementException;
import java.util.function.BiFunction;
import java.util.function.BiPredicate;
import java.util.function.ToIntFunction;

import static ch.randelshofer.persistent.HashPath.BIT_PARTITION_SIZE;
import static ch.randelshofer.persistent.HashPath.bitpos;
import static ch.randelshofer.persistent.HashPath.mask;

/**
 * Provides the nodes of a Compressed Hash-Array Mapped Prefix-tree (CHAMP)
 * and their point operations.
 * <p>
 * A node is either a {@link BitmapIndexedNode} or a {@link HashCollisionNode}.
 * Nodes are immutable once they have been published. During a single bulk
 * operation, nodes that carry the {@link IdentityObject} of that operation may
 * be updated in place; all other nodes are copied on write.
 * <p>
 * All operations take the data hash and the current shift explicitly, see
 * {@link HashPath}. The data type {@code D} is the element of a set, or the
 * entry of a map. Equality and hashing are passed in as functions, so that the
 * same nodes can serve sets and maps.
 * <p>
 * References:
 * <dl>
 *     <dt>Michael J. Steindorfer (2017).
 *     Efficient Immutable Collections.</dt>
 *     <dd><a href="https://michael.steindorfer.name/publications/phd-thesis-efficient-immutable-collections">michael.steindorfer.name</a>
 *     </dd>
 * </dl>
 */
final class ChampTrie {
    private ChampTrie() {
    }

    /**
     * An object with a unique identity within this VM.
     * <p>
     * Nodes that are created while an owner is active carry it, and may be
     * updated in place by operations that present the same owner.
     */
    static final class IdentityObject implements Serializable {
        private static final long serialVersionUID = 0L;

        IdentityObject() {
        }
    }

    /**
     * Describes the effect of a point operation on a trie.
     *
     * @param <D> the data type
     */
    static final class ChangeEvent<D> {
        enum Type {
            UNCHANGED,
            ADDED,
            REMOVED,
            REPLACED
        }

        private Type type = Type.UNCHANGED;
        private D oldData;

        ChangeEvent() {
        }

        /**
         * The data was already present and has been kept.
         */
        void found(D oldData) {
            this.oldData = oldData;
        }

        void setAdded() {
            this.type = Type.ADDED;
        }

        void setRemoved(D oldData) {
            this.oldData = oldData;
            this.type = Type.REMOVED;
        }

        void setReplaced(D oldData) {
            this.oldData = oldData;
            this.type = Type.REPLACED;
        }

        D getOldData() {
            return oldData;
        }

        boolean isModified() {
            return type != Type.UNCHANGED;
        }

        boolean isAdded() {
            return type == Type.ADDED;
        }

        boolean isRemoved() {
            return type == Type.REMOVED;
        }

        boolean isReplaced() {
            return type == Type.REPLACED;
        }

        void reset() {
            type = Type.UNCHANGED;
            oldData = null;
        }
    }

    /**
     * Counts the effect of a bulk operation on a trie.
     */
    static final class BulkChangeEvent {
        /**
         * Number of entries that are present in both operands.
         */
        int inBoth;
        /**
         * Number of entries that have been removed from the left operand.
         */
        int removed;

        void reset() {
            inBoth = 0;
            removed = 0;
        }
    }

    /**
     * Base class of all trie nodes.
     *
     * @param <D> the data type
     */
    abstract static class Node<D> {
        /**
         * Returned by {@link #find} if the trie does not contain the key.
         */
        static final Object NO_DATA = new Object();

        Node() {
        }

        /**
         * Counts all entries in the sub-trie rooted at the given node.
         */
        static int count(Node<?> node) {
            int count = node.dataArity();
            for (int i = 0, n = node.nodeArity(); i < n; i++) {
                count += count(node.getNode(i));
            }
            return count;
        }

        /**
         * Returns the first entry in iteration order.
         *
         * @throws NoSuchElementException if the node is empty
         */
        static <E> E getFirst(Node<E> node) {
            while (!node.hasData()) {
                if (!node.hasNodes()) {
                    throw new NoSuchElementException("empty trie");
                }
                node = node.getNode(0);
            }
            return node.getData(0);
        }

        static <D> BitmapIndexedNode<D> newBitmapIndexedNode(IdentityObject owner, int nodeMap, int dataMap, Object[] mixed) {
            return owner == null
                    ? new BitmapIndexedNode<>(nodeMap, dataMap, mixed)
                    : new MutableBitmapIndexedNode<>(owner, nodeMap, dataMap, mixed);
        }

        static <D> HashCollisionNode<D> newHashCollisionNode(IdentityObject owner, int hash, Object[] data) {
            return owner == null
                    ? new HashCollisionNode<>(hash, data)
                    : new MutableHashCollisionNode<>(owner, hash, data);
        }

        /**
         * Creates a node that holds a single entry.
         * <p>
         * The bitmap is computed for the root level. A node with a single entry
         * is only valid as the root, any parent inlines it.
         */
        static <D> BitmapIndexedNode<D> newSingletonNode(IdentityObject owner, D data, int dataHash) {
            return newBitmapIndexedNode(owner, 0, bitpos(mask(dataHash, 0)), new Object[]{data});
        }

        /**
         * Creates the sub-trie that holds two distinct entries which collide
         * on all levels above {@code shift}.
         */
        static <D> Node<D> mergeTwoDataEntriesIntoNode(IdentityObject owner,
                                                       D data0, int dataHash0,
                                                       D data1, int dataHash1,
                                                       int shift) {
            if (dataHash0 == dataHash1) {
                return newHashCollisionNode(owner, dataHash0, new Object[]{data0, data1});
            }
            int mask0 = mask(dataHash0, shift);
            int mask1 = mask(dataHash1, shift);
            if (mask0 != mask1) {
                int dataMap = bitpos(mask0) | bitpos(mask1);
                return mask0 < mask1
                        ? newBitmapIndexedNode(owner, 0, dataMap, new Object[]{data0, data1})
                        : newBitmapIndexedNode(owner, 0, dataMap, new Object[]{data1, data0});
            }
            Node<D> node = mergeTwoDataEntriesIntoNode(owner, data0, dataHash0, data1, dataHash1, shift + BIT_PARTITION_SIZE);
            return newBitmapIndexedNode(owner, bitpos(mask0), 0, new Object[]{node});
        }

        /**
         * Creates the sub-trie that holds a collision node and an entry with a
         * different hash, which collide on all levels above {@code shift}.
         */
        static <D> Node<D> mergeCollisionAndDataIntoNode(IdentityObject owner,
                                                         HashCollisionNode<D> collisionNode,
                                                         D data, int dataHash,
                                                         int shift) {
            int collisionMask = mask(collisionNode.hash(), shift);
            int dataMask = mask(dataHash, shift);
            if (collisionMask != dataMask) {
                return newBitmapIndexedNode(owner, bitpos(collisionMask), bitpos(dataMask), new Object[]{data, collisionNode});
            }
            Node<D> node = mergeCollisionAndDataIntoNode(owner, collisionNode, data, dataHash, shift + BIT_PARTITION_SIZE);
            return newBitmapIndexedNode(owner, bitpos(collisionMask), 0, new Object[]{node});
        }

        abstract int dataArity();

        abstract int nodeArity();

        abstract D getData(int index);

        abstract Node<D> getNode(int index);

        boolean hasData() {
            return dataArity() > 0;
        }

        boolean hasNodes() {
            return nodeArity() > 0;
        }

        boolean isEmpty() {
            return dataArity() == 0 && nodeArity() == 0;
        }

        /**
         * Returns true if this node holds exactly one entry and no children.
         */
        boolean isSingleton() {
            return dataArity() == 1 && nodeArity() == 0;
        }

        boolean isAllowedToUpdate(IdentityObject owner) {
            return false;
        }

        /**
         * Finds the entry that is equal to the given key.
         *
         * @param key            a key, it may be of a different type than the entries
         * @param keyHash        the hash code of the key
         * @param shift          the shift of this node
         * @param equalsFunction compares an entry with the key
         * @param <K>            the key type
         * @return the entry, or {@link #NO_DATA}
         */
        abstract <K> Object find(K key, int keyHash, int shift, BiPredicate<? super D, ? super K> equalsFunction);

        /**
         * Inserts or replaces an entry.
         *
         * @param owner          the owner of the current operation, or null
         * @param newData        the entry
         * @param dataHash       the hash code of the entry
         * @param shift          the shift of this node
         * @param details        receives the effect of the operation
         * @param updateFunction given the old and the new entry, returns the entry
         *                       to be stored; returning the old entry leaves the
         *                       trie unchanged
         * @param equalsFunction compares two entries
         * @param hashFunction   computes the hash code of an entry
         * @return the updated node, or this node if nothing changed or if this
         * node has been updated in place
         */
        abstract Node<D> put(IdentityObject owner, D newData, int dataHash, int shift,
                             ChangeEvent<D> details,
                             BiFunction<D, D, D> updateFunction,
                             BiPredicate<? super D, ? super D> equalsFunction,
                             ToIntFunction<? super D> hashFunction);

        /**
         * Removes the entry that is equal to the given key.
         *
         * @param owner          the owner of the current operation, or null
         * @param key            a key, it may be of a different type than the entries
         * @param keyHash        the hash code of the key
         * @param shift          the shift of this node
         * @param details        receives the effect of the operation
         * @param equalsFunction compares an entry with the key
         * @param <K>            the key type
         * @return the updated node, or this node if the key is absent or if this
         * node has been updated in place
         */
        abstract <K> Node<D> remove(IdentityObject owner, K key, int keyHash, int shift,
                                    ChangeEvent<D> details,
                                    BiPredicate<? super D, ? super K> equalsFunction);
    }

    /**
     * A node that holds up to 32 slots. Each slot is either empty, holds an
     * entry, or links to a child node.
     * <p>
     * Entries are stored at the start of {@link #mixed} in ascending slot
     * order, child nodes are stored at the end in descending slot order.
     *
     * @param <D> the data type
     */
    static class BitmapIndexedNode<D> extends Node<D> {
        static final BitmapIndexedNode<?> EMPTY_NODE = new BitmapIndexedNode<>(0, 0, new Object[]{});

        final Object[] mixed;
        private final int nodeMap;
        private final int dataMap;

        BitmapIndexedNode(int nodeMap, int dataMap, Object[] mixed) {
            this.nodeMap = nodeMap;
            this.dataMap = dataMap;
            this.mixed = mixed;
            assert (nodeMap & dataMap) == 0 : "slot is occupied by data and node";
            assert mixed.length == Integer.bitCount(nodeMap) + Integer.bitCount(dataMap) : "bitmap does not match array";
        }

        @SuppressWarnings("unchecked")
        static <D> BitmapIndexedNode<D> emptyNode() {
            return (BitmapIndexedNode<D>) EMPTY_NODE;
        }

        /**
         * Narrows the result of a point operation on a root node.
         * <p>
         * Only nodes below the root are ever replaced by a collision node, so
         * a root always stays a bitmap indexed node.
         */
        static <D> BitmapIndexedNode<D> asRoot(Node<D> node) {
            return (BitmapIndexedNode<D>) node;
        }

        int dataMap() {
            return dataMap;
        }

        int nodeMap() {
            return nodeMap;
        }

        int dataIndex(int bitpos) {
            return Integer.bitCount(dataMap & (bitpos - 1));
        }

        int nodeIndex(int bitpos) {
            return Integer.bitCount(nodeMap & (bitpos - 1));
        }

        boolean isDataAt(int bitpos) {
            return (dataMap & bitpos) != 0;
        }

        boolean isNodeAt(int bitpos) {
            return (nodeMap & bitpos) != 0;
        }

        D dataAt(int bitpos) {
            return getData(dataIndex(bitpos));
        }

        Node<D> nodeAt(int bitpos) {
            return getNode(nodeIndex(bitpos));
        }

        @Override
        int dataArity() {
            return Integer.bitCount(dataMap);
        }

        @Override
        int nodeArity() {
            return Integer.bitCount(nodeMap);
        }

        @Override
        @SuppressWarnings("unchecked")
        D getData(int index) {
            return (D) mixed[index];
        }

        @Override
        @SuppressWarnings("unchecked")
        Node<D> getNode(int index) {
            return (Node<D>) mixed[mixed.length - 1 - index];
        }

        @Override
        <K> Object find(K key, int keyHash, int shift, BiPredicate<? super D, ? super K> equalsFunction) {
            int bitpos = bitpos(mask(keyHash, shift));
            if ((nodeMap & bitpos) != 0) {
                return nodeAt(bitpos).find(key, keyHash, shift + BIT_PARTITION_SIZE, equalsFunction);
            }
            if ((dataMap & bitpos) != 0) {
                D data = dataAt(bitpos);
                if (equalsFunction.test(data, key)) {
                    return data;
                }
            }
            return NO_DATA;
        }

        @Override
        Node<D> put(IdentityObject owner, D newData, int dataHash, int shift,
                    ChangeEvent<D> details,
                    BiFunction<D, D, D> updateFunction,
                    BiPredicate<? super D, ? super D> equalsFunction,
                    ToIntFunction<? super D> hashFunction) {
            int bitpos = bitpos(mask(dataHash, shift));
            if ((dataMap & bitpos) != 0) {
                int dataIndex = dataIndex(bitpos);
                D oldData = getData(dataIndex);
                if (equalsFunction.test(oldData, newData)) {
                    D updatedData = updateFunction.apply(oldData, newData);
                    if (updatedData == oldData) {
                        details.found(oldData);
                        return this;
                    }
                    details.setReplaced(oldData);
                    return copyAndSetData(owner, dataIndex, updatedData);
                }
                Node<D> subNode = mergeTwoDataEntriesIntoNode(owner,
                        oldData, hashFunction.applyAsInt(oldData),
                        newData, dataHash, shift + BIT_PARTITION_SIZE);
                details.setAdded();
                return copyAndMigrateFromDataToNode(owner, bitpos, subNode);
            }
            if ((nodeMap & bitpos) != 0) {
                Node<D> subNode = nodeAt(bitpos);
                Node<D> updatedSubNode = subNode.put(owner, newData, dataHash, shift + BIT_PARTITION_SIZE,
                        details, updateFunction, equalsFunction, hashFunction);
                return subNode == updatedSubNode ? this : copyAndSetNode(owner, bitpos, updatedSubNode);
            }
            details.setAdded();
            return copyAndInsertData(owner, bitpos, newData);
        }

        @Override
        <K> Node<D> remove(IdentityObject owner, K key, int keyHash, int shift,
                           ChangeEvent<D> details,
                           BiPredicate<? super D, ? super K> equalsFunction) {
            int bitpos = bitpos(mask(keyHash, shift));
            if ((dataMap & bitpos) != 0) {
                int dataIndex = dataIndex(bitpos);
                D oldData = getData(dataIndex);
                if (!equalsFunction.test(oldData, key)) {
                    return this;
                }
                details.setRemoved(oldData);
                if (dataArity() == 2 && !hasNodes()) {
                    // All entries below the root share the root chunk of the removed key.
                    int newDataMap = shift == 0 ? dataMap ^ bitpos : bitpos(mask(keyHash, 0));
                    return newBitmapIndexedNode(owner, 0, newDataMap, new Object[]{getData(dataIndex ^ 1)});
                }
                if (shift > 0 && dataArity() == 1 && nodeArity() == 1 && getNode(0) instanceof HashCollisionNode) {
                    return getNode(0);
                }
                return copyAndRemoveData(owner, bitpos);
            }
            if ((nodeMap & bitpos) != 0) {
                Node<D> subNode = nodeAt(bitpos);
                Node<D> updatedSubNode = subNode.remove(owner, key, keyHash, shift + BIT_PARTITION_SIZE, details, equalsFunction);
                if (subNode == updatedSubNode) {
                    return this;
                }
                if (updatedSubNode.isSingleton()) {
                    if (!hasData() && nodeArity() == 1) {
                        return updatedSubNode;
                    }
                    return copyAndMigrateFromNodeToData(owner, bitpos, updatedSubNode.getData(0));
                }
                if (shift > 0 && !hasData() && nodeArity() == 1 && updatedSubNode instanceof HashCollisionNode) {
                    return updatedSubNode;
                }
                return copyAndSetNode(owner, bitpos, updatedSubNode);
            }
            return this;
        }

        BitmapIndexedNode<D> copyAndSetData(IdentityObject owner, int dataIndex, D data) {
            if (isAllowedToUpdate(owner)) {
                mixed[dataIndex] = data;
                return this;
            }
            return newBitmapIndexedNode(owner, nodeMap, dataMap, ChampListHelper.copySet(mixed, dataIndex, data));
        }

        BitmapIndexedNode<D> copyAndSetNode(IdentityObject owner, int bitpos, Node<D> node) {
            int index = mixed.length - 1 - nodeIndex(bitpos);
            if (isAllowedToUpdate(owner)) {
                mixed[index] = node;
                return this;
            }
            return newBitmapIndexedNode(owner, nodeMap, dataMap, ChampListHelper.copySet(mixed, index, node));
        }

        BitmapIndexedNode<D> copyAndInsertData(IdentityObject owner, int bitpos, D data) {
            int index = dataIndex(bitpos);
            Object[] dst = ChampListHelper.copyComponentAdd(mixed, index, 1);
            dst[index] = data;
            return newBitmapIndexedNode(owner, nodeMap, dataMap | bitpos, dst);
        }

        BitmapIndexedNode<D> copyAndRemoveData(IdentityObject owner, int bitpos) {
            int index = dataIndex(bitpos);
            Object[] dst = ChampListHelper.copyComponentRemove(mixed, index, 1);
            return newBitmapIndexedNode(owner, nodeMap, dataMap ^ bitpos, dst);
        }

        BitmapIndexedNode<D> copyAndMigrateFromDataToNode(IdentityObject owner, int bitpos, Node<D> node) {
            int idxOld = dataIndex(bitpos);
            int idxNew = mixed.length - 1 - nodeIndex(bitpos);
            assert idxOld <= idxNew;

            Object[] dst = new Object[mixed.length];
            System.arraycopy(mixed, 0, dst, 0, idxOld);
            System.arraycopy(mixed, idxOld + 1, dst, idxOld, idxNew - idxOld);
            System.arraycopy(mixed, idxNew + 1, dst, idxNew + 1, mixed.length - idxNew - 1);
            dst[idxNew] = node;
            return newBitmapIndexedNode(owner, nodeMap | bitpos, dataMap ^ bitpos, dst);
        }

        BitmapIndexedNode<D> copyAndMigrateFromNodeToData(IdentityObject owner, int bitpos, D data) {
            int idxOld = mixed.length - 1 - nodeIndex(bitpos);
            int idxNew = dataIndex(bitpos);

            Object[] dst = new Object[mixed.length];
            System.arraycopy(mixed, 0, dst, 0, idxNew);
            System.arraycopy(mixed, idxNew, dst, idxNew + 1, idxOld - idxNew);
            System.arraycopy(mixed, idxOld + 1, dst, idxOld + 1, mixed.length - idxOld - 1);
            dst[idxNew] = data;
            return newBitmapIndexedNode(owner, nodeMap ^ bitpos, dataMap | bitpos, dst);
        }
    }

    /**
     * A bitmap indexed node that may be updated in place by its owner.
     *
     * @param <D> the data type
     */
    static final class MutableBitmapIndexedNode<D> extends BitmapIndexedNode<D> {
        private final IdentityObject owner;

        MutableBitmapIndexedNode(IdentityObject owner, int nodeMap, int dataMap, Object[] mixed) {
            super(nodeMap, dataMap, mixed);
            this.owner = owner;
        }

        @Override
        boolean isAllowedToUpdate(IdentityObject y) {
            return this.owner == y;
        }
    }

    /**
     * A node that holds two or more distinct entries with the same full hash
     * code.
     * <p>
     * A collision node is linked into the trie at the first level where its
     * entries share a slot.
     *
     * @param <D> the data type
     */
    static class HashCollisionNode<D> extends Node<D> {
        final Object[] data;
        private final int hash;

        HashCollisionNode(int hash, Object[] data) {
            this.hash = hash;
            this.data = data;
        }

        int hash() {
            return hash;
        }

        @Override
        int dataArity() {
            return data.length;
        }

        @Override
        int nodeArity() {
            return 0;
        }

        @Override
        @SuppressWarnings("unchecked")
        D getData(int index) {
            return (D) data[index];
        }

        @Override
        Node<D> getNode(int index) {
            throw new IllegalStateException("Is leaf node.");
        }

        @Override
        <K> Object find(K key, int keyHash, int shift, BiPredicate<? super D, ? super K> equalsFunction) {
            if (keyHash != hash) {
                return NO_DATA;
            }
            for (int i = 0; i < data.length; i++) {
                D entry = getData(i);
                if (equalsFunction.test(entry, key)) {
                    return entry;
                }
            }
            return NO_DATA;
        }

        @Override
        Node<D> put(IdentityObject owner, D newData, int dataHash, int shift,
                    ChangeEvent<D> details,
                    BiFunction<D, D, D> updateFunction,
                    BiPredicate<? super D, ? super D> equalsFunction,
                    ToIntFunction<? super D> hashFunction) {
            if (dataHash != hash) {
                details.setAdded();
                return mergeCollisionAndDataIntoNode(owner, this, newData, dataHash, shift);
            }
            for (int i = 0; i < data.length; i++) {
                D oldData = getData(i);
                if (equalsFunction.test(oldData, newData)) {
                    D updatedData = updateFunction.apply(oldData, newData);
                    if (updatedData == oldData) {
                        details.found(oldData);
                        return this;
                    }
                    details.setReplaced(oldData);
                    if (isAllowedToUpdate(owner)) {
                        data[i] = updatedData;
                        return this;
                    }
                    return newHashCollisionNode(owner, hash, ChampListHelper.copySet(data, i, updatedData));
                }
            }
            Object[] entries = ChampListHelper.copyComponentAdd(data, data.length, 1);
            entries[data.length] = newData;
            details.setAdded();
            return newHashCollisionNode(owner, hash, entries);
        }

        @Override
        <K> Node<D> remove(IdentityObject owner, K key, int keyHash, int shift,
                           ChangeEvent<D> details,
                           BiPredicate<? super D, ? super K> equalsFunction) {
            if (keyHash != hash) {
                return this;
            }
            for (int i = 0; i < data.length; i++) {
                D oldData = getData(i);
                if (equalsFunction.test(oldData, key)) {
                    details.setRemoved(oldData);
                    if (data.length == 2) {
                        return newSingletonNode(owner, getData(i ^ 1), hash);
                    }
                    return newHashCollisionNode(owner, hash, ChampListHelper.copyComponentRemove(data, i, 1));
                }
            }
            return this;
        }
    }

    /**
     * A hash collision node that may be updated in place by its owner.
     *
     * @param <D> the data type
     */
    static final class MutableHashCollisionNode<D> extends HashCollisionNode<D> {
        private final IdentityObject owner;

        MutableHashCollisionNode(IdentityObject owner, int hash, Object[] data) {
            super(hash, data);
            this.owner = owner;
        }

        @Override
        boolean isAllowedToUpdate(IdentityObject y) {
            return this.owner == y;
        }
    }
}
