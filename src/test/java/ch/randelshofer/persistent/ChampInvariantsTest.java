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
import org.junit.jupiter.api.Test;

import static ch.randelshofer.persistent.HashPath.bitpos;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ChampInvariantsTest {

    private static <D> BitmapIndexedNode<D> rootWithChild(int mask, Object child) {
        return new BitmapIndexedNode<>(bitpos(mask), 0, new Object[]{child});
    }

    @Test
    public void shouldAcceptValidTrieAndCountEntries() {
        ChampSet<Integer> set = ChampSet.ofAll(io.vavr.collection.List.range(0, 2000));
        assertThat(ChampInvariants.verify(set.root, ChampSet::keyHash)).isTrue();
        assertThat(ChampInvariants.verifyAndCount(set.root, ChampSet::keyHash, java.util.Objects::equals)).isEqualTo(2000);
    }

    @Test
    public void shouldAcceptEmptyAndSingletonRoot() {
        assertThat(ChampInvariants.verify(BitmapIndexedNode.emptyNode(), ChampSet::keyHash)).isTrue();
        assertThat(ChampInvariants.verify(ChampSet.of(42).root, ChampSet::keyHash)).isTrue();
    }

    @Test
    public void shouldRejectEntryInWrongSlot() {
        BitmapIndexedNode<Integer> root = new BitmapIndexedNode<>(0, bitpos(1), new Object[]{2});
        assertThatThrownBy(() -> ChampInvariants.verify(root, ChampSet::keyHash))
                .isInstanceOf(AssertionError.class)
                .hasMessageContaining("is stored in slot 1");
    }

    @Test
    public void shouldRejectSingletonBelowRoot() {
        BitmapIndexedNode<Integer> child = new BitmapIndexedNode<>(0, bitpos(0), new Object[]{1});
        BitmapIndexedNode<Integer> root = rootWithChild(1, child);
        assertThatThrownBy(() -> ChampInvariants.verify(root, ChampSet::keyHash))
                .isInstanceOf(AssertionError.class)
                .hasMessageContaining("single entry");
    }

    @Test
    public void shouldRejectEmptyNodeBelowRoot() {
        BitmapIndexedNode<Integer> root = rootWithChild(1, BitmapIndexedNode.emptyNode());
        assertThatThrownBy(() -> ChampInvariants.verify(root, ChampSet::keyHash))
                .isInstanceOf(AssertionError.class)
                .hasMessageContaining("empty node");
    }

    @Test
    public void shouldRejectLoneCollisionChildBelowRoot() {
        HashCollisionNode<Key> collision = new HashCollisionNode<>(1, new Object[]{new Key(1, 1), new Key(2, 1)});
        BitmapIndexedNode<Key> child = rootWithChild(0, collision);
        BitmapIndexedNode<Key> root = rootWithChild(1, child);
        assertThatThrownBy(() -> ChampInvariants.verify(root, ChampSet::keyHash))
                .isInstanceOf(AssertionError.class)
                .hasMessageContaining("single collision child");
    }

    @Test
    public void shouldRejectCollisionNodeWithOneEntry() {
        HashCollisionNode<Key> collision = new HashCollisionNode<>(1, new Object[]{new Key(1, 1)});
        BitmapIndexedNode<Key> root = rootWithChild(1, collision);
        assertThatThrownBy(() -> ChampInvariants.verify(root, ChampSet::keyHash))
                .isInstanceOf(AssertionError.class)
                .hasMessageContaining("collision node with 1 entries");
    }

    @Test
    public void shouldRejectCollisionEntryWithOtherHash() {
        HashCollisionNode<Key> collision = new HashCollisionNode<>(1, new Object[]{new Key(1, 1), new Key(2, 33)});
        BitmapIndexedNode<Key> root = rootWithChild(1, collision);
        assertThatThrownBy(() -> ChampInvariants.verify(root, ChampSet::keyHash))
                .isInstanceOf(AssertionError.class)
                .hasMessageContaining("does not have the hash");
    }

    @Test
    public void shouldRejectDuplicateInCollisionNode() {
        HashCollisionNode<Key> collision = new HashCollisionNode<>(1, new Object[]{new Key(1, 1), new Key(1, 1)});
        BitmapIndexedNode<Key> root = rootWithChild(1, collision);
        assertThatThrownBy(() -> ChampInvariants.verify(root, ChampSet::keyHash))
                .isInstanceOf(AssertionError.class)
                .hasMessageContaining("duplicate");
    }

    @Test
    public void shouldRejectCollisionNodeInWrongSlot() {
        HashCollisionNode<Key> collision = new HashCollisionNode<>(2, new Object[]{new Key(1, 2), new Key(2, 2)});
        BitmapIndexedNode<Key> root = rootWithChild(1, collision);
        assertThatThrownBy(() -> ChampInvariants.verify(root, ChampSet::keyHash))
                .isInstanceOf(AssertionError.class)
                .hasMessageContaining("is stored at");
    }
}
