/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.fp.list;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Comparator;
import java.util.Optional;
import java.util.function.BinaryOperator;

import static java.util.Objects.requireNonNull;

/**
 * A class for monoids (types with an associative binary operation that has
 * an identity) with various general-purpose instances. Instances should satisfy
 * the following laws:
 *
 * <pre>{@code
 *      0 + x = x
 *      x + 0 = x
 *      x + (y + z) = (x + y) + z
 * }</pre>
 *
 * <p>Folding a {@link PList} with a monoid is the order-insensitive
 * counterpart of a left fold.</p>
 */
public abstract class Monoid<A> {
    /**
     * Returns the identity value for this monoid.
     *
     * @return the identity value for this monoid
     */
    public abstract A empty();

    /**
     * Appends the two given values.
     *
     * @param a1 a value to append with another
     * @param a2 a value to append with another
     * @return the concatenation of the two given values
     */
    public abstract A append(A a1, A a2);

    /**
     * Fold a list using the monoid.
     */
    public A concat(PList<A> xs) {
        return xs.foldLeft(empty(), this::append);
    }

    private static final class Strict<A> extends Monoid<A> {
        private final A empty;
        private final BinaryOperator<A> append;

        Strict(A empty, BinaryOperator<A> append) {
            this.empty = empty;
            this.append = append;
        }

        @Override
        public A empty() {
            return empty;
        }

        @Override
        public A append(A a1, A a2) {
            return append.apply(a1, a2);
        }
    }

    /**
     * Construct a monoid from the given append function and empty value, which
     * must follow the monoidal laws.
     *
     * @param empty the empty for the monoid
     * @param append the append function for the monoid
     * @return a monoid instance that uses the given empty value and append function
     */
    public static <A> Monoid<A> monoid(A empty, BinaryOperator<A> append) {
        return new Strict<>(empty, requireNonNull(append));
    }

    // Monoid instances

    /**
     * A monoid that adds integers.
     */
    public static final Monoid<Integer> intSum =
        monoid(0, Integer::sum);

    /**
     * A monoid that multiplies integers.
     */
    public static final Monoid<Integer> intProduct =
        monoid(1, (a, b) -> a * b);

    /**
     * A monoid that adds long integers.
     */
    public static final Monoid<Long> longSum =
        monoid(0L, Long::sum);

    /**
     * A monoid that multiplies long integers.
     */
    public static final Monoid<Long> longProduct =
        monoid(1L, (a, b) -> a * b);

    /**
     * A monoid that adds doubles. Floating point addition is only
     * approximately associative.
     */
    public static final Monoid<Double> doubleSum =
        monoid(0.0, Double::sum);

    /**
     * A monoid that multiplies doubles.
     */
    public static final Monoid<Double> doubleProduct =
        monoid(1.0, (a, b) -> a * b);

    /**
     * A monoid that adds big integers.
     */
    public static final Monoid<BigInteger> bigIntSum =
        monoid(BigInteger.ZERO, BigInteger::add);

    /**
     * A monoid that multiplies big integers.
     */
    public static final Monoid<BigInteger> bigIntProduct =
        monoid(BigInteger.ONE, BigInteger::multiply);

    /**
     * A monoid that adds big decimals.
     */
    public static final Monoid<BigDecimal> bigDecimalSum =
        monoid(BigDecimal.ZERO, BigDecimal::add);

    /**
     * A monoid that ANDs booleans.
     */
    public static final Monoid<Boolean> conjunction =
        monoid(true, (a, b) -> a && b);

    /**
     * A monoid that ORs booleans.
     */
    public static final Monoid<Boolean> disjunction =
        monoid(false, (a, b) -> a || b);

    /**
     * A monoid that appends strings.
     */
    public static final Monoid<String> stringConcat =
        monoid("", String::concat);

    /**
     * A monoid that concatenates lists, sharing the right operand.
     */
    public static <A> Monoid<PList<A>> ofList() {
        return monoid(PList.nil(), PList::concat);
    }

    /**
     * A monoid for optionals that take the first available value.
     */
    public static <A> Monoid<Optional<A>> first() {
        return monoid(Optional.empty(), (a1, a2) -> a1.isPresent() ? a1 : a2);
    }

    /**
     * A monoid for optionals that take the maximum value.
     */
    public static <A> Monoid<Optional<A>> max(Comparator<? super A> c) {
        return monoid(Optional.empty(), (a1, a2) ->
            !a1.isPresent() ? a2 :
            !a2.isPresent() ? a1 :
            c.compare(a1.get(), a2.get()) >= 0 ? a1 : a2);
    }
}
