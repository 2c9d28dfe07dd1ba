/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.fp.list;

import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.StringJoiner;
import java.util.function.BiFunction;
import java.util.function.BinaryOperator;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collector;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import static java.util.Objects.requireNonNull;

import com.google.common.base.Preconditions;
import com.google.common.collect.Ordering;

/**
 * An immutable singly linked list with structural sharing.
 *
 * <p>A list is a handle on a chain of nodes together with the cached number
 * of elements. Nodes are never modified once created, so operations that
 * leave a suffix untouched ({@link #tail()}, {@link #drop(int)},
 * {@link #dropWhile(Predicate)}, {@link #prepend(Object)}, the right operand
 * of {@link #concat(PList)}, the remainder after {@link #updated(int, Object)})
 * share that suffix with the source instead of copying it. Other operations
 * buffer their results and rebuild the chain in a single pass from the last
 * element to the first.</p>
 *
 * <p>Lists may be read concurrently by any number of threads without
 * synchronization. Null elements are permitted.</p>
 *
 * @param <T> the element type
 */
public final class PList<T> implements Iterable<T>
{
    private final int size;
    private final Node<T> root;

    @SuppressWarnings("rawtypes")
    private static final PList NIL = new PList<>(0, Node.nil());

    private PList(int size, Node<T> root) {
        this.size = size;
        this.root = root;
    }

    static <T> PList<T> wrap(int size, Node<T> root) {
        return size == 0 ? nil() : new PList<>(size, root);
    }

    Node<T> root() {
        return root;
    }

    // Constructors

    /**
     * Construct an empty list.
     *
     * @return the empty list
     */
    @SuppressWarnings("unchecked")
    public static <T> PList<T> nil() {
        return (PList<T>)NIL;
    }

    /**
     * Construct a list with single element.
     */
    public static <T> PList<T> of(T value) {
        return new PList<>(1, Node.cons(value, Node.nil()));
    }

    /**
     * Construct a list with given elements. The iteration order of the list
     * is the order of the arguments.
     */
    @SafeVarargs
    public static <T> PList<T> of(T... elements) {
        Node<T> node = Node.nil();
        for (int i = elements.length; --i >= 0; ) {
            node = Node.cons(elements[i], node);
        }
        return wrap(elements.length, node);
    }

    /**
     * Construct a list with head and tail. The tail is shared, not copied.
     *
     * @param head the first element in the list
     * @param tail the remaining elements in the list
     * @return the list that concatenate from head and tail
     */
    public static <T> PList<T> cons(T head, PList<T> tail) {
        return tail.prepend(head);
    }

    /**
     * Copy elements of an iterable into a list. If the iterable is already
     * a {@code PList} then it is returned as is.
     */
    @SuppressWarnings("unchecked")
    public static <T> PList<T> copyOf(Iterable<? extends T> elements) {
        if (elements instanceof PList) {
            return (PList<T>)elements;
        }
        return copyOf(elements.iterator());
    }

    /**
     * Copy remaining elements of an iterator into a list.
     */
    public static <T> PList<T> copyOf(Iterator<? extends T> iterator) {
        ListBuffer<T> buf = new ListBuffer<>();
        while (iterator.hasNext()) {
            buf.add(iterator.next());
        }
        return buf.build();
    }

    /**
     * Copy elements of a stream into a list in encounter order.
     */
    public static <T> PList<T> copyOf(Stream<? extends T> stream) {
        return copyOf(stream.iterator());
    }

    /**
     * Returns the list of integers from {@code from} (inclusive) up until
     * {@code until} (exclusive). The list is empty if {@code from >= until}.
     *
     * @throws IllegalArgumentException if the range has more than
     * {@code Integer.MAX_VALUE} elements
     */
    public static PList<Integer> range(int from, int until) {
        if (from >= until) {
            return nil();
        }
        long span = (long)until - from;
        Preconditions.checkArgument(span <= Integer.MAX_VALUE,
            "range [%s, %s) is too large", from, until);
        Node<Integer> node = Node.nil();
        for (int i = until; i != from; ) {
            node = Node.cons(--i, node);
        }
        return new PList<>((int)span, node);
    }

    /**
     * Returns a {@code Collector} that accumulates input elements into a list
     * in encounter order.
     */
    public static <T> Collector<T, ?, PList<T>> toPList() {
        return Collector.<T, ListBuffer<T>, PList<T>>of(
            ListBuffer::new, ListBuffer::add, ListBuffer::addAll, ListBuffer::build);
    }

    // Accessors

    /**
     * Returns {@code true} if this list contains no elements.
     *
     * @return {@code true} if this list contains no elements
     */
    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * Returns the number of elements in this list.
     */
    public int size() {
        return size;
    }

    /**
     * Returns the first element in the list.
     *
     * @return the first element in the list
     * @throws EmptyListException if this list is empty
     */
    public T head() {
        if (isEmpty())
            throw new EmptyListException("head of empty list");
        return root.head();
    }

    /**
     * Peek the head element as an optional.
     *
     * @return {@code Optional.empty()} if the list is empty, otherwise
     * an optional wrapping the head value.
     * @throws NullPointerException if the list is not empty but the head
     * element is {@code null}.
     */
    public Optional<T> headOption() {
        return isEmpty() ? Optional.empty() : Optional.of(root.head());
    }

    /**
     * Returns remaining elements in the list. The result shares all nodes
     * of this list except the first one.
     *
     * @return remaining elements in the list
     * @throws EmptyListException if this list is empty
     */
    public PList<T> tail() {
        if (isEmpty())
            throw new EmptyListException("tail of empty list");
        return wrap(size - 1, root.tail());
    }

    /**
     * Returns the head and the tail of this list together.
     *
     * @throws EmptyListException if this list is empty
     */
    public Tuple<T, PList<T>> uncons() {
        if (isEmpty())
            throw new EmptyListException("uncons on empty list");
        return Tuple.of(root.head(), wrap(size - 1, root.tail()));
    }

    /**
     * Returns the last element of this list.
     *
     * @throws EmptyListException if this list is empty
     */
    public T last() {
        if (isEmpty())
            throw new EmptyListException("last of empty list");
        return Node.skip(root, size - 1).head();
    }

    /**
     * Returns all elements of this list except the last one.
     *
     * @throws EmptyListException if this list is empty
     */
    public PList<T> init() {
        if (isEmpty())
            throw new EmptyListException("init of empty list");
        return take(size - 1);
    }

    /**
     * Returns the element at the specified position of this list. This is
     * a linear time operation.
     *
     * @throws IndexOutOfBoundsException if {@code index < 0 || index >= size()}
     */
    public T get(int index) {
        Preconditions.checkElementIndex(index, size);
        return Node.skip(root, index).head();
    }

    // Traversal

    /**
     * Performs an action for each element of this list, from head to tail.
     *
     * @param action an action to perform on the elements
     */
    public void foreach(Consumer<? super T> action) {
        requireNonNull(action);
        for (Node<T> n = root; !n.isNil(); n = n.tail()) {
            action.accept(n.head());
        }
    }

    @Override
    public void forEach(Consumer<? super T> action) {
        foreach(action);
    }

    /**
     * Returns a read-only iterator over elements of this list.
     */
    @Override
    public Iterator<T> iterator() {
        return new Itr<>(root);
    }

    private static final class Itr<T> implements Iterator<T> {
        private Node<T> cur;

        Itr(Node<T> start) {
            this.cur = start;
        }

        @Override
        public boolean hasNext() {
            return !cur.isNil();
        }

        @Override
        public T next() {
            if (cur.isNil())
                throw new NoSuchElementException();
            T res = cur.head();
            cur = cur.tail();
            return res;
        }
    }

    @Override
    public Spliterator<T> spliterator() {
        return Spliterators.spliterator(iterator(), size,
            Spliterator.ORDERED | Spliterator.IMMUTABLE);
    }

    /**
     * Returns a sequential stream over elements of this list.
     */
    public Stream<T> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    // Transformations

    /**
     * Returns a list consisting of the results of applying the given function
     * to the elements of this list. The function is applied exactly once to
     * each element, from head to tail.
     *
     * @param <R> the element type of the new list
     * @param mapper a function to apply to each element
     * @return the new list
     */
    public <R> PList<R> map(Function<? super T, ? extends R> mapper) {
        requireNonNull(mapper);
        ListBuffer<R> buf = new ListBuffer<>(size);
        foreach(x -> buf.add(mapper.apply(x)));
        return buf.build();
    }

    /**
     * Returns a list consisting of the elements of this list that match
     * the given predicate. The order of elements is preserved.
     *
     * @param predicate a predicate to apply to each element to determine if it
     * should be included
     * @return the new list
     */
    public PList<T> filter(Predicate<? super T> predicate) {
        requireNonNull(predicate);
        ListBuffer<T> buf = new ListBuffer<>();
        foreach(x -> {
            if (predicate.test(x))
                buf.add(x);
        });
        return buf.size() == size ? this : buf.build();
    }

    /**
     * Returns a list consisting of the elements of this list that violate
     * the given predicate. The order of elements is preserved.
     */
    public PList<T> filterNot(Predicate<? super T> predicate) {
        requireNonNull(predicate);
        return filter(x -> !predicate.test(x));
    }

    /**
     * Reverse elements in this list.
     */
    public PList<T> reverse() {
        if (size <= 1) {
            return this;
        }
        Node<T> res = Node.nil();
        for (Node<T> n = root; !n.isNil(); n = n.tail()) {
            res = Node.cons(n.head(), res);
        }
        return new PList<>(size, res);
    }

    /**
     * Returns a list consisting of the results of replacing each element of
     * this list with the contents of a mapped list produced by applying the
     * provided mapping function to each element.
     *
     * @param <R> the element type of the new list
     * @param mapper a function to apply to each element which produces a list
     * of new values
     * @return the new list
     */
    public <R> PList<R> flatMap(Function<? super T, ? extends PList<? extends R>> mapper) {
        requireNonNull(mapper);
        ListBuffer<R> buf = new ListBuffer<>(size);
        foreach(x -> mapper.apply(x).foreach(buf::add));
        return buf.build();
    }

    /**
     * Flatten a list of lists.
     */
    public static <T> PList<T> flatten(PList<? extends PList<? extends T>> lists) {
        ListBuffer<T> buf = new ListBuffer<>();
        lists.foreach(xs -> xs.foreach(buf::add));
        return buf.build();
    }

    // Positional operations

    /**
     * Returns a list with given limited elements taken. A negative count is
     * treated as zero.
     */
    public PList<T> take(int n) {
        if (n <= 0) {
            return nil();
        }
        if (n >= size) {
            return this;
        }
        ListBuffer<T> buf = new ListBuffer<>(n);
        for (Node<T> node = root; n > 0; node = node.tail(), n--) {
            buf.add(node.head());
        }
        return buf.build();
    }

    /**
     * Returns the last {@code n} elements of this list. The result shares
     * nodes with this list.
     */
    public PList<T> takeRight(int n) {
        return drop(size - clamp(n));
    }

    /**
     * Returns the longest prefix of this list whose elements satisfy the
     * given predicate.
     */
    public PList<T> takeWhile(Predicate<? super T> predicate) {
        requireNonNull(predicate);
        ListBuffer<T> buf = new ListBuffer<>();
        for (Node<T> n = root; !n.isNil() && predicate.test(n.head()); n = n.tail()) {
            buf.add(n.head());
        }
        return buf.size() == size ? this : buf.build();
    }

    /**
     * Returns a list with given number of elements dropped. The result shares
     * nodes with this list. A negative count is treated as zero.
     */
    public PList<T> drop(int n) {
        if (n <= 0) {
            return this;
        }
        if (n >= size) {
            return nil();
        }
        return new PList<>(size - n, Node.skip(root, n));
    }

    /**
     * Returns all elements of this list except the last {@code n} ones.
     */
    public PList<T> dropRight(int n) {
        return take(size - clamp(n));
    }

    /**
     * Returns the longest suffix of this list whose first element does not
     * satisfy the given predicate. The result shares nodes with this list.
     */
    public PList<T> dropWhile(Predicate<? super T> predicate) {
        requireNonNull(predicate);
        int remaining = size;
        Node<T> n = root;
        while (!n.isNil() && predicate.test(n.head())) {
            n = n.tail();
            remaining--;
        }
        return remaining == size ? this : wrap(remaining, n);
    }

    /**
     * Returns the elements from position {@code from} (inclusive) up until
     * position {@code until} (exclusive). A negative {@code from} is treated
     * as zero. The result is empty if {@code from >= until} or
     * {@code from >= size()}.
     */
    public PList<T> slice(int from, int until) {
        from = clamp(from);
        if (from >= until || from >= size) {
            return nil();
        }
        return drop(from).take(until - from);
    }

    /**
     * Returns a copy of this list with one single replaced element. Elements
     * after {@code index} are shared with this list.
     *
     * @throws IndexOutOfBoundsException if {@code index < 0 || index >= size()}
     */
    public PList<T> updated(int index, T value) {
        Preconditions.checkElementIndex(index, size);
        ListBuffer<T> buf = new ListBuffer<>(index);
        Node<T> n = root;
        for (int i = index; i > 0; i--, n = n.tail()) {
            buf.add(n.head());
        }
        return buf.buildOnto(Node.cons(value, n.tail()), size - index);
    }

    /**
     * Returns a list with the given element in front of this list. This list
     * is shared as the tail of the result.
     */
    public PList<T> prepend(T elem) {
        return new PList<>(size + 1, Node.cons(elem, root));
    }

    /**
     * Append a single element at end of this list. This is a linear time
     * operation.
     */
    public PList<T> append(T elem) {
        return concat(of(elem));
    }

    /**
     * Concatenate this list to other list. The other list is shared as the
     * suffix of the result; elements of this list are copied.
     */
    @SuppressWarnings("unchecked")
    public PList<T> concat(PList<? extends T> that) {
        if (isEmpty()) {
            return (PList<T>)that;
        }
        if (that.isEmpty()) {
            return this;
        }
        ListBuffer<T> buf = new ListBuffer<>(size);
        foreach(buf::add);
        return buf.buildOnto((PList<T>)that);
    }

    // Folds, scans and reductions

    /**
     * Reduce the list using the binary operator, from left to right.
     */
    public <R> R foldLeft(R identity, BiFunction<R, ? super T, R> accumulator) {
        requireNonNull(accumulator);
        R result = identity;
        for (Node<T> n = root; !n.isNil(); n = n.tail()) {
            result = accumulator.apply(result, n.head());
        }
        return result;
    }

    /**
     * Reduce the list using the binary operator, from right to left.
     */
    public <R> R foldRight(R identity, BiFunction<? super T, R, R> accumulator) {
        requireNonNull(accumulator);
        ListBuffer<T> buf = new ListBuffer<>(size);
        foreach(buf::add);
        return buf.foldBackward(identity, accumulator);
    }

    /**
     * Folds elements using an associative operator and its neutral element.
     * The order of evaluation is unspecified; callers must not rely on it.
     */
    public T fold(T identity, BinaryOperator<T> op) {
        return foldLeft(identity, op);
    }

    /**
     * Folds elements using the given monoid.
     */
    public T fold(Monoid<T> monoid) {
        return monoid.concat(this);
    }

    /**
     * Returns the sum of integers in the list, or 0 if the list is empty.
     */
    public static int sum(PList<Integer> xs) {
        return xs.fold(Monoid.intSum);
    }

    /**
     * Returns the product of integers in the list, or 1 if the list is empty.
     */
    public static int product(PList<Integer> xs) {
        return xs.fold(Monoid.intProduct);
    }

    /**
     * Just like foldLeft but accumulate intermediate accumulator result in the
     * form of a list. The first element of the result is {@code identity}.
     */
    public <R> PList<R> scanLeft(R identity, BiFunction<R, ? super T, R> accumulator) {
        requireNonNull(accumulator);
        ListBuffer<R> buf = new ListBuffer<>(size + 1);
        buf.add(identity);
        foreach(x -> buf.add(accumulator.apply(buf.last(), x)));
        return buf.build();
    }

    /**
     * A prefix scan with an associative operator and its neutral element.
     */
    public PList<T> scan(T identity, BinaryOperator<T> op) {
        return scanLeft(identity, op);
    }

    /**
     * Just like foldRight but accumulate intermediate accumulator result in the
     * form of a list. The last element of the result is {@code identity}.
     */
    public <R> PList<R> scanRight(R identity, BiFunction<? super T, R, R> accumulator) {
        requireNonNull(accumulator);
        ListBuffer<T> buf = new ListBuffer<>(size);
        foreach(buf::add);
        Node<R> res = buf.foldBackward(Node.cons(identity, Node.nil()),
            (x, acc) -> Node.cons(accumulator.apply(x, acc.head()), acc));
        return new PList<>(size + 1, res);
    }

    /**
     * Reduce the list with an associative operator and no starting value.
     *
     * @throws EmptyListException if this list is empty
     */
    public T reduce(BinaryOperator<T> op) {
        if (isEmpty())
            throw new EmptyListException("reduce on empty list");
        return reduceLeft(op);
    }

    /**
     * A variant of {@link #foldLeft(Object,BiFunction)} that uses the first
     * element as the starting value.
     *
     * @throws EmptyListException if this list is empty
     */
    public T reduceLeft(BinaryOperator<T> op) {
        if (isEmpty())
            throw new EmptyListException("reduceLeft on empty list");
        return wrap(size - 1, root.tail()).foldLeft(root.head(), op);
    }

    /**
     * A variant of {@link #foldRight(Object,BiFunction)} that uses the last
     * element as the starting value.
     *
     * @throws EmptyListException if this list is empty
     */
    public T reduceRight(BinaryOperator<T> op) {
        if (isEmpty())
            throw new EmptyListException("reduceRight on empty list");
        requireNonNull(op);
        ListBuffer<T> buf = new ListBuffer<>(size - 1);
        Node<T> n = root;
        for (; !n.tail().isNil(); n = n.tail()) {
            buf.add(n.head());
        }
        return buf.foldBackward(n.head(), op);
    }

    // Queries

    /**
     * Returns whether any elements of this list match the provided
     * predicate. Stops at the first matching element. If the list is
     * empty then {@code false} is returned and the predicate is not
     * evaluated.
     */
    public boolean exists(Predicate<? super T> predicate) {
        requireNonNull(predicate);
        for (Node<T> n = root; !n.isNil(); n = n.tail()) {
            if (predicate.test(n.head()))
                return true;
        }
        return false;
    }

    /**
     * Returns whether all elements of this list match the provided predicate.
     * Stops at the first violating element. If the list is empty then
     * {@code true} is returned and the predicate is not evaluated.
     */
    public boolean forall(Predicate<? super T> predicate) {
        requireNonNull(predicate);
        for (Node<T> n = root; !n.isNil(); n = n.tail()) {
            if (!predicate.test(n.head()))
                return false;
        }
        return true;
    }

    /**
     * Returns {@code true} if this list has an element equal to the given one.
     */
    public boolean contains(Object elem) {
        return indexOf(elem) >= 0;
    }

    /**
     * Returns the index of the first element equal to the given one, or -1.
     */
    public int indexOf(Object elem) {
        int i = 0;
        for (Node<T> n = root; !n.isNil(); n = n.tail(), i++) {
            if (Objects.equals(elem, n.head()))
                return i;
        }
        return -1;
    }

    /**
     * Returns the number of elements equal to the given one.
     */
    public int count(Object elem) {
        int count = 0;
        for (Node<T> n = root; !n.isNil(); n = n.tail()) {
            if (Objects.equals(elem, n.head()))
                count++;
        }
        return count;
    }

    /**
     * Returns the number of elements that satisfy the given predicate.
     */
    public int count(Predicate<? super T> predicate) {
        requireNonNull(predicate);
        int count = 0;
        for (Node<T> n = root; !n.isNil(); n = n.tail()) {
            if (predicate.test(n.head()))
                count++;
        }
        return count;
    }

    /**
     * Search for an element that satisfy the given predicate.
     *
     * @param predicate the predicate to be tested on element
     * @return {@code Optional.empty()} if element not found in the list, otherwise
     * a {@code Optional} wrapping the found element.
     * @throws NullPointerException if found the element but the element is {@code null}
     */
    public Optional<T> find(Predicate<? super T> predicate) {
        requireNonNull(predicate);
        for (Node<T> n = root; !n.isNil(); n = n.tail()) {
            T val = n.head();
            if (predicate.test(val))
                return Optional.of(val);
        }
        return Optional.empty();
    }

    // Ordering

    /**
     * Returns a list consisting of the elements of this list, sorted
     * according to natural order. If elements of this list are not
     * {@code Comparable}, a {@code java.lang.ClassCastException} may be thrown.
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    public PList<T> sorted() {
        return sorted((Comparator<? super T>)(Comparator)Ordering.natural());
    }

    /**
     * Returns a list consisting of the elements of this list, sorted
     * according to the provided {@code Comparator}. Stability follows
     * {@link ListConfig#sortStable()}.
     */
    public PList<T> sorted(Comparator<? super T> comparator) {
        return sorted(comparator, ListConfig.getDefault().sortStable());
    }

    /**
     * Returns a list consisting of the elements of this list, sorted
     * according to the provided {@code Comparator}. A stable sort keeps
     * equal elements in their original order. An unstable sort is an
     * in-place heap sort and may reorder equal elements.
     */
    public PList<T> sorted(Comparator<? super T> comparator, boolean stable) {
        requireNonNull(comparator);
        if (size <= 1) {
            return this;
        }
        ListBuffer<T> buf = new ListBuffer<>(size);
        foreach(buf::add);
        if (stable) {
            buf.sort(comparator);
        } else {
            buf.heapSort(comparator);
        }
        return buf.build();
    }

    // Pairing

    /**
     * Zip two lists into one list of tuples. The result is as long as the
     * shorter list.
     */
    public <U> PList<Tuple<T, U>> zip(PList<? extends U> other) {
        return zip(other, Tuple::of);
    }

    /**
     * Zip two lists into one using a function to produce result values.
     * <p>
     * {@code <pre>
     * // ("1:a", "2:b")
     * PList.of(1, 2).zip(PList.of("a", "b", "c"), (i,s) -> i + ":" + s)
     * </pre>}
     * </p>
     */
    public <U, R> PList<R> zip(PList<? extends U> other, BiFunction<? super T, ? super U, ? extends R> zipper) {
        requireNonNull(zipper);
        int n = Math.min(size, other.size());
        ListBuffer<R> buf = new ListBuffer<>(n);
        Node<T> a = root;
        Node<? extends U> b = other.root();
        for (; n > 0; n--, a = a.tail(), b = b.tail()) {
            buf.add(zipper.apply(a.head(), b.head()));
        }
        return buf.build();
    }

    /**
     * Transforms a list of pairs into a list of first components and a list
     * of second components.
     *
     * @param xs the list of pairs to transform
     * @return a list of first components and a list of second components
     */
    public static <A, B> Tuple<PList<A>, PList<B>> unzip(PList<Tuple<A, B>> xs) {
        ListBuffer<A> as = new ListBuffer<>(xs.size());
        ListBuffer<B> bs = new ListBuffer<>(xs.size());
        xs.foreach(t -> {
            as.add(t.first());
            bs.add(t.second());
        });
        return Tuple.of(as.build(), bs.build());
    }

    // Conversions

    /**
     * Returns an array containing all elements of this list in order.
     */
    public Object[] toArray() {
        Object[] res = new Object[size];
        int i = 0;
        for (Node<T> n = root; !n.isNil(); n = n.tail()) {
            res[i++] = n.head();
        }
        return res;
    }

    /**
     * Returns an unmodifiable {@code java.util.List} copy of this list.
     */
    @SuppressWarnings("unchecked")
    public List<T> toList() {
        return Collections.unmodifiableList((List<T>)Arrays.asList(toArray()));
    }

    // Equality

    /**
     * Compares this list with the given object for equality. Two lists are
     * equal if they have the same size and pairwise equal elements, whether
     * or not they share any nodes.
     */
    @Override
    public boolean equals(Object obj) {
        if (obj == this)
            return true;
        if (!(obj instanceof PList))
            return false;

        PList<?> that = (PList<?>)obj;
        if (size != that.size)
            return false;

        Node<?> a = root, b = that.root;
        for (; !a.isNil(); a = a.tail(), b = b.tail()) {
            if (a == b)
                return true; // shared suffix
            if (!Objects.equals(a.head(), b.head()))
                return false;
        }
        return true;
    }

    /**
     * Returns the hash code as defined by {@link java.util.List#hashCode()}.
     */
    @Override
    public int hashCode() {
        int h = 1;
        for (Node<T> n = root; !n.isNil(); n = n.tail()) {
            h = 31 * h + Objects.hashCode(n.head());
        }
        return h;
    }

    // Rendering

    /**
     * Returns the string representation of this list, showing at most
     * {@link ListConfig#showLimit()} elements.
     */
    @Override
    public String toString() {
        return show(ListConfig.getDefault().showLimit());
    }

    /**
     * Returns the string representation of this list.
     *
     * @param n number of elements to be shown
     */
    public String show(int n) {
        return show(n, ", ", "[", "]");
    }

    /**
     * Returns the string representation of this list.
     *
     * @param delimiter the sequence of characters to be used between each element
     * @param prefix the sequence of characters to be used at the beginning
     * @param suffix the sequence of characters to be used at the end
     */
    public String show(CharSequence delimiter, CharSequence prefix, CharSequence suffix) {
        return show(Integer.MAX_VALUE, delimiter, prefix, suffix);
    }

    /**
     * Returns the string representation of this list.
     *
     * @param n number of elements to be shown
     * @param delimiter the sequence of characters to be used between each element
     * @param prefix the sequence of characters to be used at the beginning
     * @param suffix the sequence of characters to be used at the end
     */
    public String show(int n, CharSequence delimiter, CharSequence prefix, CharSequence suffix) {
        StringJoiner joiner = new StringJoiner(delimiter, prefix, suffix);
        Node<T> xs = root; int i = 0;
        for (; !xs.isNil() && i < n; xs = xs.tail(), i++) {
            joiner.add(String.valueOf(xs.head()));
        }
        if (!xs.isNil()) {
            joiner.add("...");
        }
        return joiner.toString();
    }

    private int clamp(int n) {
        return n < 0 ? 0 : Math.min(n, size);
    }
}
