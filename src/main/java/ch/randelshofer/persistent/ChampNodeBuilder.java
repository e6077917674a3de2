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
import ch.randelshofer.persistent.ChampTrie.HashCollisionNode;
import ch.randelshofer.persistent.ChampTrie.IdentityObject;
import ch.randelshofer.persistent.ChampTrie.Node;

import static ch.randelshofer.persistent.HashPath.BIT_PARTITION_MASK;
import static ch.randelshofer.persistent.HashPath.bitpos;

/**
 * Stages the edits of one level of a trie.
 * <p>
 * A builder starts out reading through to its source node. The first edit
 * copies the slots of the source into a private array with one entry per
 * slot; all further edits update that array in place. The source node is
 * never modified.
 * <p>
 * {@link #build(int)} finalizes the builder exactly once. Afterwards all
 * operations throw {@link IllegalStateException}.
 * <p>
 * Slots are addressed by their mask, that is the chunk of the hash code on
 * this level (0..31).
 *
 * @param <D> the data type
 */
final class ChampNodeBuilder<D> {
    private static final int SLOT_COUNT = BIT_PARTITION_MASK + 1;

    private final IdentityObject owner;
    private final BitmapIndexedNode<D> source;
    private Object[] slots;
    private int dataMap;
    private int nodeMap;
    private boolean built;

    private ChampNodeBuilder(IdentityObject owner, BitmapIndexedNode<D> source) {
        this.owner = owner;
        this.source = source;
        this.dataMap = source.dataMap();
        this.nodeMap = source.nodeMap();
    }

    /**
     * Creates a builder that starts with the contents of the given node.
     *
     * @param owner the owner that the built node will carry, or null
     * @param node  the source node
     */
    static <D> ChampNodeBuilder<D> fromExisting(IdentityObject owner, BitmapIndexedNode<D> node) {
        return new ChampNodeBuilder<>(owner, node);
    }

    static <D> ChampNodeBuilder<D> empty(IdentityObject owner) {
        return new ChampNodeBuilder<>(owner, BitmapIndexedNode.emptyNode());
    }

    int dataArity() {
        return Integer.bitCount(dataMap);
    }

    int nodeArity() {
        return Integer.bitCount(nodeMap);
    }

    /**
     * Returns true if an edit has been made since the builder was created.
     */
    boolean isModified() {
        return slots != null;
    }

    /**
     * Inserts an entry into an empty slot.
     */
    void insert(int mask, D data) {
        int bitpos = bitpos(mask);
        checkFree(mask, bitpos);
        writableSlots()[mask] = data;
        dataMap |= bitpos;
    }

    /**
     * Links a child node into an empty slot.
     */
    void insertChild(int mask, Node<D> child) {
        int bitpos = bitpos(mask);
        checkFree(mask, bitpos);
        writableSlots()[mask] = child;
        nodeMap |= bitpos;
    }

    /**
     * Empties an occupied slot.
     */
    void removeSlot(int mask) {
        int bitpos = bitpos(mask);
        checkOccupied(mask, bitpos);
        writableSlots()[mask] = null;
        dataMap &= ~bitpos;
        nodeMap &= ~bitpos;
    }

    /**
     * Replaces the content of an occupied slot with an entry.
     */
    void replaceData(int mask, D data) {
        int bitpos = bitpos(mask);
        checkOccupied(mask, bitpos);
        writableSlots()[mask] = data;
        nodeMap &= ~bitpos;
        dataMap |= bitpos;
    }

    /**
     * Replaces the content of an occupied slot with a child node.
     * <p>
     * An empty child empties the slot. A child with a single entry is
     * inlined as an entry.
     */
    void replaceChild(int mask, Node<D> child) {
        if (child.isEmpty()) {
            removeSlot(mask);
        } else if (child.isSingleton()) {
            replaceData(mask, child.getData(0));
        } else {
            int bitpos = bitpos(mask);
            checkOccupied(mask, bitpos);
            writableSlots()[mask] = child;
            dataMap &= ~bitpos;
            nodeMap |= bitpos;
        }
    }

    /**
     * Finalizes this builder into a node for the level with the given shift.
     * <p>
     * Returns the source node if no edit has been made. Below the root, a
     * level that only links a single collision node is replaced by that
     * collision node. Levels with fewer than two entries are returned as
     * they are, the parent inlines them through
     * {@link #replaceChild(int, Node)}.
     *
     * @param shift the shift of this level
     * @return the node
     */
    Node<D> build(int shift) {
        checkNotBuilt();
        built = true;
        if (!isModified()) {
            return source;
        }
        if (dataArity() == 0 && nodeArity() == 0) {
            return BitmapIndexedNode.emptyNode();
        }
        if (shift > 0 && dataArity() == 0 && nodeArity() == 1) {
            Object child = slots[Integer.numberOfTrailingZeros(nodeMap)];
            if (child instanceof HashCollisionNode) {
                @SuppressWarnings("unchecked")
                Node<D> collisionNode = (Node<D>) child;
                return collisionNode;
            }
        }
        return compact();
    }

    /**
     * Finalizes this builder into a root node.
     */
    BitmapIndexedNode<D> buildRoot() {
        checkNotBuilt();
        built = true;
        if (!isModified()) {
            return source;
        }
        if (dataArity() == 0 && nodeArity() == 0) {
            return BitmapIndexedNode.emptyNode();
        }
        return compact();
    }

    private BitmapIndexedNode<D> compact() {
        Object[] mixed = new Object[dataArity() + nodeArity()];
        int dataIndex = 0;
        int nodeIndex = mixed.length - 1;
        for (int bits = dataMap | nodeMap; bits != 0; bits &= bits - 1) {
            int mask = Integer.numberOfTrailingZeros(bits);
            if ((dataMap & bitpos(mask)) != 0) {
                mixed[dataIndex++] = slots[mask];
            } else {
                mixed[nodeIndex--] = slots[mask];
            }
        }
        slots = null;
        return Node.newBitmapIndexedNode(owner, nodeMap, dataMap, mixed);
    }

    private Object[] writableSlots() {
        checkNotBuilt();
        if (!isModified()) {
            Object[] copy = new Object[SLOT_COUNT];
            for (int bits = dataMap | nodeMap; bits != 0; bits &= bits - 1) {
                int mask = Integer.numberOfTrailingZeros(bits);
                int bitpos = bitpos(mask);
                copy[mask] = (dataMap & bitpos) != 0 ? source.dataAt(bitpos) : source.nodeAt(bitpos);
            }
            slots = copy;
        }
        return slots;
    }

    private void checkFree(int mask, int bitpos) {
        checkNotBuilt();
        if (((dataMap | nodeMap) & bitpos) != 0) {
            throw new IllegalArgumentException("slot " + mask + " is occupied");
        }
    }

    private void checkOccupied(int mask, int bitpos) {
        checkNotBuilt();
        if (((dataMap | nodeMap) & bitpos) == 0) {
            throw new IllegalArgumentException("slot " + mask + " is empty");
        }
    }

    private void checkNotBuilt() {
        if (built) {
            throw new IllegalStateException("builder has already been built");
        }
    }
}
