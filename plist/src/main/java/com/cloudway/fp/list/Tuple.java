/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.fp.list;

import java.io.Serializable;
import java.util.Objects;

/**
 * A tuple with two elements.
 */
public final class Tuple<A, B> implements Serializable
{
    private static final long serialVersionUID = 6021746465072972306L;

    private final A first;
    private final B second;

    /**
     * Construct a new Tuple with two arguments.
     *
     * @param first the first argument
     * @param second the second argument
     */
    public Tuple(A first, B second) {
        this.first = first;
        this.second = second;
    }

    /**
     * Construct a new Tuple with two arguments.
     *
     * @param first the first argument
     * @param second the second argument
     */
    public static <A, B> Tuple<A, B> of(A first, B second) {
        return new Tuple<>(first, second);
    }

    /**
     * Returns the first element.
     */
    public A first() {
        return first;
    }

    /**
     * Returns the second element.
     */
    public B second() {
        return second;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this)
            return true;
        if (!(obj instanceof Tuple))
            return false;
        Tuple<?,?> other = (Tuple<?,?>)obj;
        return Objects.equals(first, other.first) && Objects.equals(second, other.second);
    }

    @Override
    public int hashCode() {
        return Objects.hash(first, second);
    }

    @Override
    public String toString() {
        return "(" + first + ", " + second + ")";
    }
}
