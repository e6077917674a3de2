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

import java.util.Objects;

/**
 * The path of a 32-bit hash code through the levels of a CHAMP trie.
 * <p>
 * The hash code is consumed in chunks of {@value #BIT_PARTITION_SIZE} bits,
 * starting with the least significant bits at the root. The chunk of a level
 * selects one of the 32 slots of a node on that level.
 * <p>
 * Seven levels consume all 32 bits (the last level only uses 2 bits). Entries
 * that still share a slot after that have identical hash codes and must be
 * stored in a {@link ChampTrie.HashCollisionNode}.
 * <p>
 * The hot paths of the trie use the static helpers {@link #mask(int, int)} and
 * {@link #bitpos(int)} on a plain {@code int} shift; instances of this class are
 * used where a path has to be carried along explicitly.
 */
final class HashPath {
    static final int HASH_CODE_LENGTH = 32;
    static final int BIT_PARTITION_SIZE = 5;
    static final int BIT_PARTITION_MASK = (1 << BIT_PARTITION_SIZE) - 1;
    /**
     * Number of levels needed to consume all bits of a hash code.
     */
    static final int MAX_DEPTH = (HASH_CODE_LENGTH + BIT_PARTITION_SIZE - 1) / BIT_PARTITION_SIZE;

    private final int hash;
    private final int shift;

    private HashPath(int hash, int shift) {
        this.hash = hash;
        this.shift = shift;
    }

    /**
     * Returns the unconsumed path of the given hash code.
     *
     * @param hash a hash code
     * @return the path at the root level
     */
    static HashPath top(int hash) {
        return new HashPath(hash, 0);
    }

    static int mask(int hash, int shift) {
        return (hash >>> shift) & BIT_PARTITION_MASK;
    }

    static int bitpos(int mask) {
        return 1 << mask;
    }

    static boolean isExhausted(int shift) {
        return shift >= HASH_CODE_LENGTH;
    }

    /**
     * Returns true if the bits below {@code shift} of the two hash codes are
     * equal, that is, if both hash codes lead to the same node on the level
     * with the given shift.
     */
    static boolean samePrefix(int hash1, int hash2, int shift) {
        if (shift >= HASH_CODE_LENGTH) {
            return hash1 == hash2;
        }
        int prefixMask = (1 << shift) - 1;
        return (hash1 & prefixMask) == (hash2 & prefixMask);
    }

    int hash() {
        return hash;
    }

    int shift() {
        return shift;
    }

    int depth() {
        return shift / BIT_PARTITION_SIZE;
    }

    /**
     * Returns the slot index of this path on the current level.
     */
    int chunk() {
        return mask(hash, shift);
    }

    int bitpos() {
        return bitpos(chunk());
    }

    boolean isExhausted() {
        return isExhausted(shift);
    }

    /**
     * Consumes the chunk of the current level.
     *
     * @return the path one level deeper
     * @throws IllegalStateException if all bits have been consumed
     */
    HashPath descend() {
        if (isExhausted()) {
            throw new IllegalStateException("hash path is exhausted at depth " + depth());
        }
        return new HashPath(hash, shift + BIT_PARTITION_SIZE);
    }

    /**
     * Returns the path to the child in the given slot of the current level.
     * <p>
     * The bits of the returned path below its shift are the prefix that all
     * hash codes in that child share.
     *
     * @param mask the slot on the current level
     * @return the path one level deeper
     */
    HashPath child(int mask) {
        return withHash((hash & ~(BIT_PARTITION_MASK << shift)) | (mask << shift)).descend();
    }

    /**
     * Returns the path of another hash code on the current level.
     */
    HashPath withHash(int otherHash) {
        return new HashPath(otherHash, shift);
    }

    /**
     * Returns true if the given hash code has the same bits below the current
     * shift as this path.
     */
    boolean isPrefixOf(int otherHash) {
        return samePrefix(hash, otherHash, shift);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof HashPath)) {
            return false;
        }
        HashPath that = (HashPath) o;
        return hash == that.hash && shift == that.shift;
    }

    @Override
    public int hashCode() {
        return Objects.hash(hash, shift);
    }

    @Override
    public String toString() {
        return "HashPath{hash=" + Integer.toHexString(hash) + ", depth=" + depth() + "}";
    }
}
