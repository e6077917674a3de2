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

import io.vavr.Tuple;
import io.vavr.Tuple2;
import io.vavr.collection.List;
import io.vavr.control.Option;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.util.Arrays;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.assertThat;

public class ChampMapTest {

    @SuppressWarnings("unchecked")
    private static <T> T serializeAndDeserialize(T obj) throws IOException, ClassNotFoundException {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        try (ObjectOutputStream out = new ObjectOutputStream(buf)) {
            out.writeObject(obj);
        }
        try (ObjectInputStream in = new ObjectInputStream(new ByteArrayInputStream(buf.toByteArray()))) {
            return (T) in.readObject();
        }
    }

    private static ChampMap<Integer, String> mapOf(int from, int to) {
        ChampMap<Integer, String> map = ChampMap.empty();
        for (int i = from; i < to; i++) {
            map = map.put(i, "v" + i);
        }
        return map;
    }

    // -- point operations

    @Test
    public void shouldPutAndGet() {
        ChampMap<Integer, String> map = ChampMap.of(1, "a", 2, "b");
        assertThat(map.size()).isEqualTo(2);
        assertThat(map.get(1)).isEqualTo(Option.some("a"));
        assertThat(map.get(3)).isEqualTo(Option.none());
        assertThat(map.getOrElse(3, "z")).isEqualTo("z");
        assertThat(map.containsKey(2)).isTrue();
        assertThat(map.containsKey(3)).isFalse();
    }

    @Test
    public void shouldReplaceValueOfExistingKey() {
        ChampMap<Integer, String> map = ChampMap.of(1, "a");
        ChampMap<Integer, String> replaced = map.put(1, "b");
        assertThat(replaced.size()).isEqualTo(1);
        assertThat(replaced.get(1)).isEqualTo(Option.some("b"));
        assertThat(map.get(1)).isEqualTo(Option.some("a"));
    }

    @Test
    public void shouldReturnSameMapWhenPuttingEqualValue() {
        ChampMap<Integer, String> map = ChampMap.of(1, "a");
        assertThat(map.put(1, new String("a"))).isSameAs(map);
        assertThat(map.put(Tuple.of(1, "a"))).isSameAs(map);
    }

    @Test
    public void shouldSupportNullKeysAndValues() {
        ChampMap<Integer, String> map = ChampMap.<Integer, String>empty().put(null, "n").put(0, null);
        assertThat(map.size()).isEqualTo(2);
        assertThat(map.get(null)).isEqualTo(Option.some("n"));
        assertThat(map.get(0)).isEqualTo(Option.some(null));
        assertThat(map.remove(null).containsKey(null)).isFalse();
        assertThat(map.remove(null).size()).isEqualTo(1);
    }

    @Test
    public void shouldRemoveKeys() {
        ChampMap<Integer, String> map = mapOf(0, 100);
        ChampMap<Integer, String> removed = map.remove(42);
        assertThat(removed.size()).isEqualTo(99);
        assertThat(removed.containsKey(42)).isFalse();
        assertThat(removed.remove(42)).isSameAs(removed);
        assertThat(ChampMap.of(1, "a").remove(1)).isSameAs(ChampMap.empty());
    }

    @Test
    public void shouldKeepCollidingKeysApart() {
        ChampMap<String, Integer> map = ChampMap.of("Aa", 1, "BB", 2, "C#", 3);
        assertThat(map.get("Aa")).isEqualTo(Option.some(1));
        assertThat(map.get("BB")).isEqualTo(Option.some(2));
        assertThat(map.remove("BB").get("C#")).isEqualTo(Option.some(3));
        assertThat(ChampInvariants.verify(map.root, ChampMap::entryKeyHash, ChampMap::entryKeyEquals)).isTrue();
    }

    // -- factories

    @Test
    public void shouldCreateMapFromEntries() {
        ChampMap<Integer, String> map = ChampMap.ofEntries(Tuple.of(1, "a"), Tuple.of(2, "b"), Tuple.of(1, "c"));
        assertThat(map.size()).isEqualTo(2);
        assertThat(map.get(1)).isEqualTo(Option.some("c"));
        assertThat(ChampMap.ofEntries(List.of(Tuple.of(3, "x")))).isEqualTo(ChampMap.of(3, "x"));
    }

    @Test
    public void shouldWrapJavaMap() {
        java.util.Map<Integer, Integer> source = new java.util.HashMap<>();
        source.put(1, 2);
        source.put(3, 4);
        assertThat(ChampMap.ofAll(source)).isEqualTo(ChampMap.<Integer, Integer>empty().put(1, 2).put(3, 4));
        assertThat(ChampMap.ofAll(source).toJavaMap()).isEqualTo(source);
    }

    // -- bulk operations

    @Test
    public void shouldRemoveKeysOfSet() {
        ChampMap<Integer, String> map = mapOf(0, 200);
        ChampMap<Integer, String> result = map.removeAll(ChampSet.ofAll(List.range(50, 250)));
        assertThat(result.size()).isEqualTo(50);
        assertThat(result.containsKey(49)).isTrue();
        assertThat(result.containsKey(50)).isFalse();
        assertThat(ChampInvariants.verify(result.root, ChampMap::entryKeyHash, ChampMap::entryKeyEquals)).isTrue();
    }

    @Test
    public void shouldRemoveKeysOfOtherMap() {
        ChampMap<Integer, String> map = mapOf(0, 10);
        ChampMap<Integer, Integer> other = ChampMap.of(1, 100, 3, 300, 11, 1100);
        ChampMap<Integer, String> result = map.removeAll(other.keys());
        assertThat(result.keys().toSet()).containsExactlyInAnyOrder(0, 2, 4, 5, 6, 7, 8, 9);
        assertThat(result.get(2)).isEqualTo(Option.some("v2"));
    }

    @Test
    public void shouldRemoveKeysOfSequence() {
        ChampMap<Integer, String> map = mapOf(0, 10);
        assertThat(map.removeAll(Arrays.asList(1, 1, 2, 42)).size()).isEqualTo(8);
        assertThat(map.removeAll(new java.util.HashSet<>(Arrays.asList(1, 2))).size()).isEqualTo(8);
        assertThat(map.removeAll(List.empty())).isSameAs(map);
        assertThat(map.removeAll(List.range(0, 10))).isSameAs(ChampMap.empty());
    }

    @Test
    public void shouldRemoveKeysOfNullHostileSets() {
        ChampMap<Integer, String> map = ChampMap.of(null, "n", 1, "a", 2, "b");
        ChampMap<Integer, String> removed = map.removeAll(java.util.Set.of(1));
        assertThat(removed.size()).isEqualTo(2);
        assertThat(removed.get(null)).isEqualTo(Option.some("n"));
        assertThat(map.retainAll(new TreeSet<>(Arrays.asList(1, 2))).keys().toSet()).containsExactlyInAnyOrder(1, 2);
    }

    @Test
    public void shouldMatchKeysByEquals() {
        TreeSet<String> caseInsensitive = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        caseInsensitive.add("A");
        ChampMap<String, Integer> map = ChampMap.of("a", 1, "b", 2);
        assertThat(map.removeAll(caseInsensitive)).isSameAs(map);
        assertThat(map.retainAll(caseInsensitive).isEmpty()).isTrue();
    }

    @Test
    public void shouldRetainKeys() {
        ChampMap<Integer, String> map = mapOf(0, 10);
        assertThat(map.retainAll(ChampSet.of(1, 2, 42)).keys().toSet()).containsExactlyInAnyOrder(1, 2);
        assertThat(map.retainAll(List.of(3, 4)).keys().toSet()).containsExactlyInAnyOrder(3, 4);
        assertThat(map.retainAll(mapOf(5, 20).keys()).size()).isEqualTo(5);
    }

    @Test
    public void shouldFilterEntries() {
        ChampMap<Integer, String> map = mapOf(0, 10);
        assertThat(map.filter((k, v) -> k % 2 == 0 && !v.equals("v4")).keys().toSet())
                .containsExactlyInAnyOrder(0, 2, 6, 8);
        assertThat(map.filterKeys(k -> k < 2).size()).isEqualTo(2);
    }

    @Test
    public void shouldMergeWithValuesOfOtherMap() {
        ChampMap<Integer, String> left = ChampMap.of(1, "a", 2, "b", 3, "c");
        ChampMap<Integer, String> right = ChampMap.of(3, "C", 4, "D");
        ChampMap<Integer, String> merged = left.merge(right);
        assertThat(merged.size()).isEqualTo(4);
        assertThat(merged.get(3)).isEqualTo(Option.some("C"));
        assertThat(merged.get(1)).isEqualTo(Option.some("a"));
        assertThat(left.merge(ChampMap.of(1, "a"))).isSameAs(left);
        assertThat(ChampMap.<Integer, String>empty().merge(right)).isSameAs(right);
    }

    @Test
    public void shouldMergeLargeMaps() {
        ChampMap<Integer, String> merged = mapOf(0, 600).merge(mapOf(400, 1000));
        assertThat(merged.size()).isEqualTo(1000);
        assertThat(ChampInvariants.verifyAndCount(merged.root, ChampMap::entryKeyHash, ChampMap::entryKeyEquals))
                .isEqualTo(1000);
    }

    // -- views and iteration

    @Test
    public void shouldExposeKeysAndValues() {
        ChampMap<Integer, String> map = ChampMap.of(1, "a", 2, "b", 3, "c");
        ChampMap.Keys<Integer> keys = map.keys();
        assertThat(keys).containsExactlyInAnyOrder(1, 2, 3);
        assertThat(keys.size()).isEqualTo(3);
        assertThat(keys.contains(2)).isTrue();
        assertThat(keys.contains(4)).isFalse();
        assertThat(keys.isEmpty()).isFalse();
        assertThat(map.values().toJavaList()).containsExactlyInAnyOrder("a", "b", "c");
    }

    @Test
    public void shouldIterateEntriesAsTuples() {
        ChampMap<Integer, String> map = ChampMap.of(1, "a", 2, "b");
        java.util.List<Tuple2<Integer, String>> entries = map.iterator().toJavaList();
        assertThat(entries).containsExactlyInAnyOrder(Tuple.of(1, "a"), Tuple.of(2, "b"));
    }

    // -- object methods

    @Test
    public void shouldEqualsIgnoreOrder() {
        ChampMap<String, Integer> map = ChampMap.<String, Integer>empty().put("Aa", 1).put("BB", 2);
        ChampMap<String, Integer> map2 = ChampMap.<String, Integer>empty().put("BB", 2).put("Aa", 1);
        assertThat(map.hashCode()).isEqualTo(map2.hashCode());
        assertThat(map).isEqualTo(map2);
        assertThat(map).isNotEqualTo(map2.put("Aa", 3));
        assertThat(map.hashCode()).isEqualTo(map.toJavaMap().hashCode());
    }

    @Test
    public void shouldBeEqualWhenSharingTheTrie() {
        ChampMap<Integer, String> map = mapOf(0, 100);
        ChampMap<Integer, String> sharing = new ChampMap<>(map.root, map.size());
        assertThat(sharing).isNotSameAs(map);
        assertThat(sharing).isEqualTo(map);
        assertThat(map.equals(mapOf(0, 99))).isFalse();
        assertThat(map.equals(ChampSet.of(1))).isFalse();
    }

    @Test
    public void shouldConvertToVavrMap() {
        ChampMap<String, Integer> map = ChampMap.of("Aa", 1, "BB", 2, null, 3);
        assertThat(map.toVavrMap()).isEqualTo(io.vavr.collection.HashMap.of("Aa", 1, "BB", 2, null, 3));
        assertThat(ChampMap.empty().toVavrMap().isEmpty()).isTrue();
    }

    @Test
    public void shouldPrintEntries() {
        assertThat(ChampMap.empty().toString()).isEqualTo("ChampMap()");
        assertThat(ChampMap.of(1, "a").toString()).isEqualTo("ChampMap(1 -> a)");
        assertThat(ChampMap.of(1, "a").keys().toString()).isEqualTo("Keys(1)");
    }

    @Test
    public void shouldSerializeAndDeserialize() throws Exception {
        ChampMap<String, Integer> map = ChampMap.of("Aa", 1, "BB", 2, "x", 3);
        ChampMap<String, Integer> copy = serializeAndDeserialize(map);
        assertThat(copy).isEqualTo(map);
        assertThat(copy.size()).isEqualTo(3);
        assertThat(serializeAndDeserialize(ChampMap.empty())).isSameAs(ChampMap.empty());
    }
}
