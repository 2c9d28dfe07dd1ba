/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.fp.list;

/**
 * A node in the persistent chain. Nodes are never mutated after construction,
 * so any number of lists may share a common suffix.
 */
abstract class Node<T> {
    private Node() {}

    abstract boolean isNil();

    abstract T head();

    abstract Node<T> tail();

    @SuppressWarnings("rawtypes")
    private static final Node NIL = new Node() {
        @Override
        boolean isNil() {
            return true;
        }

        @Override
        Object head() {
            throw new IllegalStateException("head of terminal node");
        }

        @Override
        Node tail() {
            throw new IllegalStateException("tail of terminal node");
        }

        @Override
        public String toString() {
            return "Nil";
        }
    };

    private static final class Cons<T> extends Node<T> {
        private final T head;
        private final Node<T> tail;

        Cons(T head, Node<T> tail) {
            this.head = head;
            this.tail = tail;
        }

        @Override
        boolean isNil() {
            return false;
        }

        @Override
        T head() {
            return head;
        }

        @Override
        Node<T> tail() {
            return tail;
        }

        @Override
        public String toString() {
            return "Cons(" + head + ", ...)";
        }
    }

    @SuppressWarnings("unchecked")
    static <T> Node<T> nil() {
        return (Node<T>)NIL;
    }

    static <T> Node<T> cons(T head, Node<T> tail) {
        return new Cons<>(head, tail);
    }

    /**
     * Skips {@code n} nodes. The caller guarantees the chain is long enough.
     */
    static <T> Node<T> skip(Node<T> node, int n) {
        for (; n > 0; n--) {
            node = node.tail();
        }
        return node;
    }
}
