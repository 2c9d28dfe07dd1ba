/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.fp.list;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.function.BiFunction;

/**
 * Mutable list builder.
 *
 * <p>Elements are buffered in encounter order and folded onto a terminal
 * node from last to first, so the first element buffered becomes the head
 * of the built list. A buffer is confined to the thread that fills it and
 * must not be used after {@link #build()}.</p>
 */
final class ListBuffer<T> {
    private final ArrayList<T> buf;

    ListBuffer() {
        this.buf = new ArrayList<>();
    }

    ListBuffer(int expectedSize) {
        this.buf = new ArrayList<>(Math.max(expectedSize, 0));
    }

    ListBuffer<T> add(T x) {
        buf.add(x);
        return this;
    }

    ListBuffer<T> addAll(ListBuffer<? extends T> other) {
        buf.addAll(other.buf);
        return this;
    }

    int size() {
        return buf.size();
    }

    T last() {
        return buf.get(buf.size() - 1);
    }

    void sort(Comparator<? super T> comparator) {
        buf.sort(comparator);
    }

    /**
     * Sorts buffered elements in place without extra storage. Equal
     * elements may be reordered.
     */
    void heapSort(Comparator<? super T> comparator) {
        int n = buf.size();
        for (int i = n / 2 - 1; i >= 0; i--) {
            siftDown(i, n, comparator);
        }
        for (int end = n - 1; end > 0; end--) {
            T top = buf.get(0);
            buf.set(0, buf.get(end));
            buf.set(end, top);
            siftDown(0, end, comparator);
        }
    }

    private void siftDown(int i, int n, Comparator<? super T> comparator) {
        T x = buf.get(i);
        int child;
        while ((child = 2 * i + 1) < n) {
            if (child + 1 < n && comparator.compare(buf.get(child + 1), buf.get(child)) > 0)
                child++;
            if (comparator.compare(x, buf.get(child)) >= 0)
                break;
            buf.set(i, buf.get(child));
            i = child;
        }
        buf.set(i, x);
    }

    /**
     * Iterates buffered elements from last to first, accumulating the
     * result of each step.
     */
    <R> R foldBackward(R z, BiFunction<? super T, R, R> op) {
        R acc = z;
        for (int i = buf.size(); --i >= 0; ) {
            acc = op.apply(buf.get(i), acc);
        }
        return acc;
    }

    /**
     * Builds a list that contains the buffered elements followed by the
     * given list. The whole of {@code rest} is shared.
     */
    PList<T> buildOnto(PList<T> rest) {
        Node<T> node = rest.root();
        for (int i = buf.size(); --i >= 0; ) {
            node = Node.cons(buf.get(i), node);
        }
        return PList.wrap(buf.size() + rest.size(), node);
    }

    /**
     * Builds a list that contains the buffered elements followed by the
     * given chain of {@code restSize} nodes.
     */
    PList<T> buildOnto(Node<T> rest, int restSize) {
        Node<T> node = rest;
        for (int i = buf.size(); --i >= 0; ) {
            node = Node.cons(buf.get(i), node);
        }
        return PList.wrap(buf.size() + restSize, node);
    }

    PList<T> build() {
        return buildOnto(Node.nil(), 0);
    }
}
