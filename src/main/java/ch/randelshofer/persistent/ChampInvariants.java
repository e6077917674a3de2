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
import ch.randelshofer.persistent.ChampTrie.Node;

import java.util.Objects;
import java.util.function.BiPredicate;
import java.util.function.ToIntFunction;

import static ch.randelshofer.persistent.HashPath.bitpos;

/**
 * Verifies the structural invariants of a CHAMP trie.
 * <p>
 * A violation means that the trie has been corrupted by a defect in this
 * package. It is reported with an {@link AssertionError}.
 * <p>
 * The collections run the check after bulk operations when assertions are
 * enabled:
 * <pre>{@code assert ChampInvariants.verify(root, ChampSet::keyHash);}</pre>
 */
final class ChampInvariants {
    private ChampInvariants() {
    }

    /**
     * Verifies the trie with the given root.
     *
     * @param root         the root node
     * @param hashFunction computes the hash code of an entry
     * @return always true, so that the call can be used in an
     * {@code assert} statement
     * @throws AssertionError if an invariant is violated
     */
    static <D> boolean verify(BitmapIndexedNode<D> root, ToIntFunction<? super D> hashFunction) {
        verifyAndCount(root, hashFunction, Objects::equals);
        return true;
    }

    static <D> boolean verify(BitmapIndexedNode<D> root, ToIntFunction<? super D> hashFunction,
                              BiPredicate<? super D, ? super D> equalsFunction) {
        verifyAndCount(root, hashFunction, equalsFunction);
        return true;
    }

    /**
     * Verifies the trie with the given root, and counts its entries.
     *
     * @return the number of entries in the trie
     * @throws AssertionError if an invariant is violated
     */
    static <D> int verifyAndCount(BitmapIndexedNode<D> root, ToIntFunction<? super D> hashFunction,
                                  BiPredicate<? super D, ? super D> equalsFunction) {
        if (root == null) {
            throw new AssertionError("root is null");
        }
        return verifyBitmapNode(root, HashPath.top(0), true, hashFunction, equalsFunction);
    }

    private static <D> int verifyBitmapNode(BitmapIndexedNode<D> node, HashPath path, boolean isRoot,
                                            ToIntFunction<? super D> hashFunction,
                                            BiPredicate<? super D, ? super D> equalsFunction) {
        if (path.isExhausted()) {
            throw new AssertionError("bitmap node below the last level at " + path);
        }
        int dataMap = node.dataMap();
        int nodeMap = node.nodeMap();
        if ((dataMap & nodeMap) != 0) {
            throw new AssertionError("slots " + Integer.toBinaryString(dataMap & nodeMap) + " hold data and node at " + path);
        }
        if (node.mixed.length != Integer.bitCount(dataMap) + Integer.bitCount(nodeMap)) {
            throw new AssertionError("bitmap does not match array length " + node.mixed.length + " at " + path);
        }
        if (!isRoot) {
            if (node.isEmpty()) {
                throw new AssertionError("empty node at " + path);
            }
            if (node.isSingleton()) {
                throw new AssertionError("node with a single entry at " + path);
            }
            if (!node.hasData() && node.nodeArity() == 1 && node.getNode(0) instanceof HashCollisionNode) {
                throw new AssertionError("node with a single collision child at " + path);
            }
        }

        int count = 0;
        for (int bits = dataMap | nodeMap; bits != 0; bits &= bits - 1) {
            int mask = Integer.numberOfTrailingZeros(bits);
            int bitpos = bitpos(mask);
            if ((dataMap & bitpos) != 0) {
                D data = node.dataAt(bitpos);
                int dataHash = hashFunction.applyAsInt(data);
                if (!path.isPrefixOf(dataHash) || path.withHash(dataHash).bitpos() != bitpos) {
                    throw new AssertionError("entry " + data + " is stored in slot " + mask + " at " + path);
                }
                count++;
            } else {
                Node<D> child = node.nodeAt(bitpos);
                HashPath childPath = path.child(mask);
                if (child == null) {
                    throw new AssertionError("null child at " + childPath);
                }
                count += child instanceof HashCollisionNode
                        ? verifyCollisionNode((HashCollisionNode<D>) child, childPath, hashFunction, equalsFunction)
                        : verifyBitmapNode((BitmapIndexedNode<D>) child, childPath, false, hashFunction, equalsFunction);
            }
        }
        return count;
    }

    private static <D> int verifyCollisionNode(HashCollisionNode<D> node, HashPath path,
                                               ToIntFunction<? super D> hashFunction,
                                               BiPredicate<? super D, ? super D> equalsFunction) {
        int n = node.dataArity();
        if (n < 2) {
            throw new AssertionError("collision node with " + n + " entries at " + path);
        }
        if (!path.isPrefixOf(node.hash())) {
            throw new AssertionError("collision node with hash " + Integer.toHexString(node.hash()) + " is stored at " + path);
        }
        for (int i = 0; i < n; i++) {
            D data = node.getData(i);
            if (hashFunction.applyAsInt(data) != node.hash()) {
                throw new AssertionError("entry " + data + " does not have the hash of its collision node at " + path);
            }
            for (int j = i + 1; j < n; j++) {
                if (equalsFunction.test(data, node.getData(j))) {
                    throw new AssertionError("collision node contains duplicate entry " + data + " at " + path);
                }
            }
        }
        return n;
    }
}
