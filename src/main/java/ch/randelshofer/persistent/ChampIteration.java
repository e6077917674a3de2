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

import ch.randelshofer.persistent.ChampTrie.Node;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Iteration over the entries of a CHAMP trie.
 * <p>
 * Entries are visited depth-first: the entries of a node come before the
 * entries of its children, children are visited in slot order.
 */
final class ChampIteration {
    private ChampIteration() {
    }

    /**
     * Adapts a {@link Spliterator} to the {@link Iterator} interface.
     *
     * @param <E> the element type
     */
    static final class IteratorFacade<E> implements Iterator<E>, Consumer<E> {
        private final Spliterator<E> spliterator;
        private boolean hasCurrent;
        private E current;

        IteratorFacade(Spliterator<E> spliterator) {
            this.spliterator = spliterator;
        }

        @Override
        public void accept(E e) {
            hasCurrent = true;
            current = e;
        }

        @Override
        public boolean hasNext() {
            return hasCurrent || spliterator.tryAdvance(this);
        }

        @Override
        public E next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            E e = current;
            hasCurrent = false;
            current = null;
            return e;
        }
    }

    /**
     * Data iterator over a CHAMP trie.
     * <p>
     * Uses a stack with a fixed maximal depth.
     *
     * @param <K> the data type
     * @param <E> the element type
     */
    static final class ChampSpliterator<K, E> extends Spliterators.AbstractSpliterator<E> {
        private final Function<K, E> mappingFunction;
        private final Deque<StackElement<K>> stack = new ArrayDeque<>(HashPath.MAX_DEPTH + 1);
        private K current;

        ChampSpliterator(Node<K> root, Function<K, E> mappingFunction, int characteristics, long size) {
            super(size, characteristics);
            this.mappingFunction = mappingFunction;
            if (!root.isEmpty()) {
                stack.push(new StackElement<>(root));
            }
        }

        @Override
        public boolean tryAdvance(Consumer<? super E> action) {
            if (moveNext()) {
                action.accept(mappingFunction.apply(current));
                return true;
            }
            return false;
        }

        private boolean moveNext() {
            while (!stack.isEmpty()) {
                StackElement<K> elem = stack.peek();
                Node<K> node = elem.node;
                if (elem.dataIndex < node.dataArity()) {
                    current = node.getData(elem.dataIndex++);
                    return true;
                }
                if (elem.nodeIndex < node.nodeArity()) {
                    stack.push(new StackElement<>(node.getNode(elem.nodeIndex++)));
                } else {
                    stack.pop();
                }
            }
            return false;
        }

        private static final class StackElement<K> {
            final Node<K> node;
            int dataIndex;
            int nodeIndex;

            StackElement(Node<K> node) {
                this.node = node;
            }
        }
    }
}
