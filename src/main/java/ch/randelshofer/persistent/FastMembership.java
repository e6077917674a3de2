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

import io.vavr.control.Option;

import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.function.Predicate;

/**
 * A collection that can tell in (effectively) constant time whether it
 * contains an element.
 * <p>
 * Bulk removal uses this capability to filter a set through the other
 * collection instead of removing the elements of the other collection one by
 * one.
 *
 * @param <T> the element type
 */
public interface FastMembership<T> {

    /**
     * Tests whether this collection contains the given element.
     *
     * @param element an element
     * @return true if the element is contained
     */
    boolean contains(T element);

    /**
     * Returns a fast membership test for the given iterable, if it has one.
     * <p>
     * Recognizes implementations of this interface, and the hash based sets
     * of {@code java.util} and vavr. Only these are known to compare their
     * elements with {@code equals} and to accept {@code null} in
     * {@code contains}. Sorted, identity based or null hostile sets, such as
     * {@link java.util.TreeSet} or {@code Set.of(...)}, have no fast
     * membership test.
     *
     * @param iterable an iterable
     * @param <T>      the element type
     * @return the membership test, or none
     */
    @SuppressWarnings("unchecked")
    static <T> Option<Predicate<T>> of(Iterable<? extends T> iterable) {
        if (iterable instanceof FastMembership<?>) {
            FastMembership<T> membership = (FastMembership<T>) iterable;
            return Option.some(membership::contains);
        }
        if (isEqualsBasedJavaSet(iterable)) {
            Collection<?> set = (Collection<?>) iterable;
            return Option.some(set::contains);
        }
        if (iterable instanceof io.vavr.collection.HashSet<?> || iterable instanceof io.vavr.collection.LinkedHashSet<?>) {
            io.vavr.collection.Set<T> set = (io.vavr.collection.Set<T>) iterable;
            return Option.some(set::contains);
        }
        return Option.none();
    }

    /**
     * Subclasses may override {@code contains}, so only the exact classes
     * qualify.
     */
    private static boolean isEqualsBasedJavaSet(Iterable<?> iterable) {
        Class<?> type = iterable.getClass();
        return type == HashSet.class || type == LinkedHashSet.class;
    }
}
