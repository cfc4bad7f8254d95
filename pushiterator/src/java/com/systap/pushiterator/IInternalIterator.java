/*

Copyright (C) SYSTAP, LLC 2006-2008.  All rights reserved.

Contact:
     SYSTAP, LLC
     4501 Tower Road
     Greensboro, NC 27410
     licenses@bigdata.com

This program is free software; you can redistribute it and/or modify
it under the terms of the GNU General Public License as published by
the Free Software Foundation; version 2 of the License.

This program is distributed in the hope that it will be useful,
but WITHOUT ANY WARRANTY; without even the implied warranty of
MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
GNU General Public License for more details.

You should have received a copy of the GNU General Public License
along with this program; if not, write to the Free Software
Foundation, Inc., 59 Temple Place, Suite 330, Boston, MA  02111-1307  USA

*/
package com.systap.pushiterator;

import java.util.Comparator;
import java.util.Optional;

/**
 * Internal (push) iterator. Rather than handing out its elements one at a time
 * on request, the producer drives the traversal itself and pushes each element
 * into a caller supplied {@link IStep step function}. The step function may
 * stop the traversal at any element.
 * <p>
 * There is exactly one primitive, {@link #traverse(Object, IStep)}. Every
 * other operation declared here is derived from it. Producers normally extend
 * {@link AbstractInternalIterator}, which implements all of them.
 * <p>
 * An internal iterator is single use. Each terminal operation consumes it and
 * each adapter method links it into the new adapter, after which it may not be
 * used again.
 * <p>
 * Operations which may find no element report that with
 * {@link Optional#empty()}. Since an {@link Optional} can not hold
 * <code>null</code>, those operations throw a {@link NullPointerException} if
 * the element they would return is <code>null</code>.
 * <p>
 * Two-source combination (<i>zip</i>) is not offered: a push producer can not
 * be paused to wait for another producer.
 *
 * @param <E>
 *            The generic type of the elements.
 */
public interface IInternalIterator<E> extends IIntoInternalIterator<E> {

    /*
     * Primitive.
     */

    /**
     * Push the elements, in order, into the step function, threading the
     * accumulator from each step into the next. The traversal ends at the
     * first element for which the step function returns
     * {@link StepResult#stop(Object)}: no further element is visited and no
     * wrapped source is advanced past that element.
     *
     * @param init
     *            The initial accumulator.
     * @param step
     *            The step function.
     *
     * @return The {@link StepResult#stop(Object)} result which ended the
     *         traversal -or- {@link StepResult#proceed(Object)} with the final
     *         accumulator if every element was visited.
     *
     * @throws IteratorConsumedException
     *             if this iterator was already consumed or linked.
     */
    public <A> StepResult<A> traverse(A init, IStep<? super E, A> step);

    /*
     * Terminal operations.
     */

    /**
     * Visit every element.
     */
    public void forEach(IVisitor<? super E> visitor);

    /**
     * The number of elements.
     */
    public long count();

    /**
     * The element at index <i>n</i> (origin ZERO). No element after index
     * <i>n</i> is visited or passed to any closure.
     *
     * @throws IllegalArgumentException
     *             if <i>n</i> is negative.
     */
    public Optional<E> nth(long n);

    /**
     * The first element.
     */
    public Optional<E> first();

    /**
     * The last element.
     */
    public Optional<E> last();

    /**
     * Accumulate over all elements.
     */
    public <A> A fold(A init, IFold<A, ? super E> f);

    /**
     * The first element satisfying the predicate. Stops on that element.
     */
    public Optional<E> find(IPredicate<? super E> p);

    /**
     * The first present result of the function. Stops on the element which
     * produced it.
     */
    public <R> Optional<R> findMap(IFunction<? super E, Optional<R>> f);

    /**
     * The index of the first element satisfying the predicate. Stops on that
     * element.
     */
    public Optional<Long> position(IPredicate<? super E> p);

    /**
     * <code>true</code> iff some element satisfies the predicate. Stops on
     * the first such element.
     */
    public boolean any(IPredicate<? super E> p);

    /**
     * <code>true</code> iff every element satisfies the predicate. Stops on
     * the first element which does not.
     */
    public boolean all(IPredicate<? super E> p);

    /**
     * The least element. When several elements are least, the first one
     * visited is returned.
     */
    public Optional<E> min(Comparator<? super E> comparator);

    /**
     * The greatest element. When several elements are greatest, the last one
     * visited is returned.
     */
    public Optional<E> max(Comparator<? super E> comparator);

    /**
     * The element with the least key. When several elements share the least
     * key, the first one visited is returned. The key function is applied
     * once per element.
     */
    public <K extends Comparable<? super K>> Optional<E> minByKey(
            IFunction<? super E, ? extends K> key);

    /**
     * The element with the greatest key. When several elements share the
     * greatest key, the last one visited is returned. The key function is
     * applied once per element.
     */
    public <K extends Comparable<? super K>> Optional<E> maxByKey(
            IFunction<? super E, ? extends K> key);

    /**
     * Feed every element, in order, to the materializer and return the
     * container which it builds.
     */
    public <C> C collect(IMaterializer<? super E, C> materializer);

    /*
     * Adapters.
     */

    /**
     * Transform each element.
     */
    public <F> IInternalIterator<F> map(IFunction<? super E, ? extends F> f);

    /**
     * Only the elements satisfying the predicate. The predicate is evaluated
     * exactly once for each element visited.
     */
    public IInternalIterator<E> filter(IPredicate<? super E> p);

    /**
     * Transform each element, dropping the elements for which the function
     * returns {@link Optional#empty()}.
     */
    public <F> IInternalIterator<F> filterMap(
            IFunction<? super E, Optional<F>> f);

    /**
     * Replace each element by the elements of the iterator into which the
     * function converts it.
     */
    public <F> IInternalIterator<F> flatMap(
            IFunction<? super E, ? extends IIntoInternalIterator<? extends F>> f);

    /**
     * Only the first <i>n</i> elements. The element at index <i>n</i> is never
     * visited.
     *
     * @throws IllegalArgumentException
     *             if <i>n</i> is negative.
     */
    public IInternalIterator<E> take(long n);

    /**
     * All but the first <i>n</i> elements.
     *
     * @throws IllegalArgumentException
     *             if <i>n</i> is negative.
     */
    public IInternalIterator<E> skip(long n);

    /**
     * Every <i>n</i>th element, starting with the first.
     *
     * @throws IllegalArgumentException
     *             unless <i>n</i> is positive.
     */
    public IInternalIterator<E> stepBy(long n);

    /**
     * The leading elements which satisfy the predicate. The first element
     * which does not ends the traversal.
     */
    public IInternalIterator<E> takeWhile(IPredicate<? super E> p);

    /**
     * The elements after the leading run which satisfies the predicate.
     */
    public IInternalIterator<E> skipWhile(IPredicate<? super E> p);

    /**
     * Pair each element with its index (origin ZERO).
     */
    public IInternalIterator<IndexedValue<E>> enumerate();

    /**
     * Invoke the visitor on each element before passing it on unchanged.
     */
    public IInternalIterator<E> inspect(IVisitor<? super E> visitor);

    /**
     * The elements of this iterator followed by the elements of the other.
     */
    public IInternalIterator<E> chain(IIntoInternalIterator<? extends E> other);

}
