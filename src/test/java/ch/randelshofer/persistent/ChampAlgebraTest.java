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
import ch.randelshofer.persistent.ChampTrie.IdentityObject;
import ch.randelshofer.persistent.ChampTrie.Node;
import io.vavr.collection.List;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Objects;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

public class ChampAlgebraTest {

    private static ChampSet<Integer> randomSet(Random random, int size, int bound) {
        ChampSet<Integer> set = ChampSet.empty();
        for (int i = 0; i < size; i++) {
            set = set.add(random.nextInt(bound));
        }
        return set;
    }

    /**
     * Keys with 21 distinct hash codes spread over the first two levels, so
     * that collision nodes appear below bitmap nodes.
     */
    private static ChampSet<Key> randomCollidingSet(Random random, int size) {
        ChampSet<Key> set = ChampSet.empty();
        for (int i = 0; i < size; i++) {
            int value = random.nextInt(200);
            set = set.add(collidingKey(value));
        }
        return set;
    }

    private static Key collidingKey(int value) {
        return new Key(value, ((value % 7) << 5) | (value % 3));
    }

    private static <T> void assertValid(ChampSet<T> set) {
        assertThat(ChampInvariants.verifyAndCount(set.root, ChampSet::keyHash, Objects::equals)).isEqualTo(set.size());
    }

    // -- subtraction scenarios

    @Test
    public void shouldSubtractSet() {
        ChampSet<Integer> a = ChampSet.of(1, 2, 3, 4);
        ChampSet<Integer> b = ChampSet.of(0, 2, 4, 6);
        assertThat(a.subtract(b)).containsExactlyInAnyOrder(1, 3);
        assertThat(a.subtract(b).size()).isEqualTo(2);
    }

    @Test
    public void shouldSubtractSequence() {
        ChampSet<Integer> a = ChampSet.of(1, 2, 3, 4);
        assertThat(a.subtract(java.util.Arrays.asList(0, 2, 4, 6))).containsExactlyInAnyOrder(1, 3);
    }

    @Test
    public void shouldSubtractFromEmptySet() {
        ChampSet<Integer> empty = ChampSet.empty();
        assertThat(empty.subtract(ChampSet.of(1, 2))).isEmpty();
        assertThat(empty.subtract(ChampSet.of(1, 2))).isSameAs(empty);
    }

    @Test
    public void shouldSubtractEqualSet() {
        ChampSet<Integer> a = ChampSet.of(1, 2, 3);
        ChampSet<Integer> result = a.subtract(ChampSet.of(1, 2, 3));
        assertThat(result).isEmpty();
        assertThat(result.size()).isZero();
        assertThat(result).isSameAs(ChampSet.empty());
    }

    @Test
    public void shouldSubtractKeysOfMap() {
        ChampMap<Integer, String> m = ChampMap.<Integer, String>empty().put(0, "a").put(2, "b").put(4, "c").put(6, "d");
        ChampSet<Integer> a = ChampSet.of(1, 2, 3, 4);
        assertThat(a.subtract(m.keys())).containsExactlyInAnyOrder(1, 3);
    }

    @Test
    public void shouldOnlyRemoveEqualElementFromCollision() {
        Key x = new Key(1, 99);
        Key y = new Key(2, 99);
        Key z = new Key(3, 99);
        ChampSet<Key> a = ChampSet.of(x, y, new Key(4, 5));
        ChampSet<Key> b = ChampSet.of(new Key(1, 99), z);
        ChampSet<Key> result = a.subtract(b);
        assertThat(result).containsExactlyInAnyOrder(y, new Key(4, 5));
        assertValid(result);
        assertThat(result.root.nodeArity()).isZero();
    }

    @Test
    public void shouldSubtractCollisionFromBitmapNode() {
        // Both sets share the root slot 1. In a the slot holds a bitmap node,
        // in b it holds a collision node.
        Key k1 = new Key(1, 1);
        ChampSet<Key> a = ChampSet.of(k1, new Key(2, 33), new Key(3, 65));
        ChampSet<Key> b = ChampSet.of(new Key(1, 1), new Key(4, 1));
        ChampSet<Key> result = a.subtract(b);
        assertThat(result).containsExactlyInAnyOrder(new Key(2, 33), new Key(3, 65));
        assertValid(result);

        ChampSet<Key> two = ChampSet.of(k1, new Key(2, 33));
        ChampSet<Key> single = two.subtract(b);
        assertThat(single).containsExactly(new Key(2, 33));
        assertThat(single.root.nodeArity()).isZero();
        assertValid(single);
    }

    @Test
    public void shouldSubtractBitmapNodeFromCollision() {
        ChampSet<Key> a = ChampSet.of(new Key(1, 1), new Key(4, 1), new Key(5, 1));
        ChampSet<Key> b = ChampSet.of(new Key(1, 1), new Key(2, 33), new Key(4, 1));
        ChampSet<Key> result = a.subtract(b);
        assertThat(result).containsExactly(new Key(5, 1));
        assertValid(result);
    }

    // -- subtraction properties

    @Test
    public void shouldBeEmptyWhenSubtractingItself() {
        Random random = new Random(1);
        for (int i = 0; i < 20; i++) {
            ChampSet<Integer> a = randomSet(random, random.nextInt(500), 1000);
            assertThat(a.subtract(a)).isEmpty();
            assertThat(a.subtract(ChampSet.ofAll(a.toJavaSet()))).isEmpty();
        }
    }

    @Test
    public void shouldReturnSameSetWhenSubtractingEmptySet() {
        ChampSet<Integer> a = ChampSet.ofAll(List.range(0, 100));
        assertThat(a.subtract(ChampSet.<Integer>empty())).isSameAs(a);
        assertThat(a.subtract(java.util.Collections.<Integer>emptyList())).isSameAs(a);
    }

    @Test
    public void shouldReturnSameSetWhenSetsAreDisjoint() {
        ChampSet<Integer> a = ChampSet.ofAll(List.range(0, 500));
        ChampSet<Integer> b = ChampSet.ofAll(List.range(500, 1000));
        assertThat(a.subtract(b)).isSameAs(a);

        BulkChangeEvent bulkChange = new BulkChangeEvent();
        ChampNodeBuilder<Integer> builder = ChampAlgebra.subtract(new IdentityObject(), a.root, b.root, 0, bulkChange,
                Objects::equals, ChampSet::keyHash, ChampSet::keyHash);
        assertThat(builder).isNull();
        assertThat(bulkChange.removed).isZero();
    }

    @Test
    public void shouldShareUntouchedSubTries() {
        ChampSet<Integer> a = ChampSet.ofAll(List.range(0, 1000));
        ChampSet<Integer> result = a.subtract(ChampSet.of(5));
        assertThat(result.size()).isEqualTo(999);
        BitmapIndexedNode<Integer> before = a.root;
        BitmapIndexedNode<Integer> after = result.root;
        assertThat(after.nodeMap()).isEqualTo(before.nodeMap());
        for (int mask = 0; mask < 32; mask++) {
            int bitpos = HashPath.bitpos(mask);
            if (mask != 5 && before.isNodeAt(bitpos)) {
                assertThat(after.nodeAt(bitpos)).isSameAs(before.nodeAt(bitpos));
            }
        }
        assertThat(after.nodeAt(HashPath.bitpos(5))).isNotSameAs(before.nodeAt(HashPath.bitpos(5)));
    }

    @Test
    public void shouldCountSharedSubTrieAsRemoved() {
        ChampSet<Integer> a = ChampSet.ofAll(List.range(0, 1000));
        ChampSet<Integer> b = a.remove(5);
        ChampSet<Integer> result = a.subtract(b);
        assertThat(result).containsExactly(5);
        assertThat(result.size()).isEqualTo(1);
        assertValid(result);
    }

    @Test
    public void shouldContainExactlyElementsNotInOtherSet() {
        Random random = new Random(2);
        for (int i = 0; i < 30; i++) {
            ChampSet<Integer> a = randomSet(random, random.nextInt(400), 600);
            ChampSet<Integer> b = randomSet(random, random.nextInt(400), 600);
            ChampSet<Integer> result = a.subtract(b);
            assertValid(result);
            for (int e = 0; e < 600; e++) {
                assertThat(result.contains(e)).isEqualTo(a.contains(e) && !b.contains(e));
            }
            assertThat(result.size()).isEqualTo(a.size() - a.intersect(b).size());
        }
    }

    @Test
    public void shouldSubtractCollidingSets() {
        Random random = new Random(3);
        for (int i = 0; i < 30; i++) {
            ChampSet<Key> a = randomCollidingSet(random, random.nextInt(150));
            ChampSet<Key> b = randomCollidingSet(random, random.nextInt(150));
            ChampSet<Key> result = a.subtract(b);
            assertValid(result);
            for (int value = 0; value < 200; value++) {
                Key key = collidingKey(value);
                assertThat(result.contains(key)).isEqualTo(a.contains(key) && !b.contains(key));
            }
            assertThat(result.size()).isEqualTo(a.size() - a.intersect(b).size());
        }
    }

    @Test
    public void shouldNotDependOnOrderOfSuccessiveSubtractions() {
        Random random = new Random(4);
        for (int i = 0; i < 20; i++) {
            ChampSet<Integer> a = randomSet(random, 300, 500);
            ChampSet<Integer> b = randomSet(random, 100, 500);
            ChampSet<Integer> c = randomSet(random, 100, 500);
            assertThat(a.subtract(b).subtract(c)).isEqualTo(a.subtract(b.addAll(c)));
            assertThat(a.subtract(b).subtract(c)).isEqualTo(a.subtract(c).subtract(b));
        }
    }

    @Test
    public void shouldSubtractSequenceLikeSet() {
        Random random = new Random(5);
        for (int i = 0; i < 20; i++) {
            ChampSet<Integer> a = randomSet(random, 300, 500);
            java.util.List<Integer> sequence = new ArrayList<>();
            for (int j = 0, n = random.nextInt(300); j < n; j++) {
                sequence.add(random.nextInt(500));
            }
            sequence.addAll(sequence);
            ChampSet<Integer> viaSequence = a.subtract(sequence);
            assertValid(viaSequence);
            assertThat(viaSequence).isEqualTo(a.subtract(ChampSet.ofAll(sequence)));
        }
    }

    @Test
    public void shouldNotModifyOperands() {
        ChampSet<Integer> a = ChampSet.ofAll(List.range(0, 300));
        ChampSet<Integer> b = ChampSet.ofAll(List.range(100, 200));
        java.util.Set<Integer> aBefore = a.toJavaSet();
        java.util.Set<Integer> bBefore = b.toJavaSet();
        a.subtract(b);
        a.subtract(List.range(150, 250));
        assertThat(a.toJavaSet()).isEqualTo(aBefore);
        assertThat(b.toJavaSet()).isEqualTo(bBefore);
        assertValid(a);
        assertValid(b);
    }

    // -- union, intersection, filter

    @Test
    public void shouldUnionSets() {
        Random random = new Random(6);
        for (int i = 0; i < 20; i++) {
            ChampSet<Key> a = randomCollidingSet(random, random.nextInt(150));
            ChampSet<Key> b = randomCollidingSet(random, random.nextInt(150));
            ChampSet<Key> union = a.addAll(b);
            assertValid(union);
            java.util.Set<Key> expected = a.toJavaSet();
            expected.addAll(b.toJavaSet());
            assertThat(union.toJavaSet()).isEqualTo(expected);
            assertThat(union.size()).isEqualTo(expected.size());
        }
    }

    @Test
    public void shouldKeepExistingElementsOnUnion() {
        Key original = new Key(1, 1);
        ChampSet<Key> a = ChampSet.of(original, new Key(2, 2));
        ChampSet<Key> union = a.addAll(ChampSet.of(new Key(1, 1), new Key(3, 3)));
        assertThat(union.size()).isEqualTo(3);
        assertThat(union.iterator().find(k -> k.value == 1).get()).isSameAs(original);
        assertThat(a.addAll(ChampSet.of(new Key(1, 1)))).isSameAs(a);
    }

    @Test
    public void shouldIntersectSets() {
        Random random = new Random(7);
        for (int i = 0; i < 20; i++) {
            ChampSet<Key> a = randomCollidingSet(random, random.nextInt(150));
            ChampSet<Key> b = randomCollidingSet(random, random.nextInt(150));
            ChampSet<Key> intersection = a.intersect(b);
            assertValid(intersection);
            java.util.Set<Key> expected = a.toJavaSet();
            expected.retainAll(b.toJavaSet());
            assertThat(intersection.toJavaSet()).isEqualTo(expected);
            assertThat(intersection.size()).isEqualTo(expected.size());
        }
    }

    @Test
    public void shouldIntersectWithKeysOfMap() {
        ChampMap<Integer, String> m = ChampMap.of(1, "a", 3, "b", 5, "c");
        assertThat(ChampSet.of(1, 2, 3, 4).intersect(m.keys())).containsExactlyInAnyOrder(1, 3);
    }

    @Test
    public void shouldFilterCollisionNodes() {
        ChampSet<Key> a = ChampSet.of(new Key(1, 9), new Key(2, 9), new Key(3, 9), new Key(4, 41));
        ChampSet<Key> odd = a.filter(k -> k.value % 2 == 1);
        assertThat(odd).containsExactlyInAnyOrder(new Key(1, 9), new Key(3, 9));
        assertValid(odd);
        ChampSet<Key> one = a.filter(k -> k.value == 2);
        assertThat(one).containsExactly(new Key(2, 9));
        assertThat(one.root.nodeArity()).isZero();
        assertValid(one);
    }

    @Test
    public void shouldCountEntriesOfFilteredCollisionNode() {
        ChampTrie.HashCollisionNode<Key> collision = new ChampTrie.HashCollisionNode<>(9,
                new Object[]{new Key(1, 9), new Key(2, 9), new Key(3, 9)});
        BulkChangeEvent bulkChange = new BulkChangeEvent();
        Node<Key> result = ChampAlgebra.filterCollisionNode(null, collision, k -> k.value != 2, bulkChange);
        assertThat(result.dataArity()).isEqualTo(2);
        assertThat(bulkChange.removed).isEqualTo(1);

        bulkChange.reset();
        assertThat(ChampAlgebra.filterCollisionNode(null, collision, k -> true, bulkChange)).isSameAs(collision);
        assertThat(bulkChange.removed).isZero();
    }
}
