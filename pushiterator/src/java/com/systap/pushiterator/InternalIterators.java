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

import java.util.Collection;
import java.util.Iterator;
import java.util.List;

/**
 * Static factories for {@link IInternalIterator}s: conversions from arrays,
 * collections and pull iterators, ranges, generators, and flattening.
 * <p>
 * Every call returns a new single use iterator. A source which is a
 * collection is not copied and must not be modified while the iterator is in
 * use.
 */
public class InternalIterators {

    private InternalIterators() {

    }

    /**
     * An iterator which visits nothing.
     */
    public static <E> IInternalIterator<E> empty() {

        return new EmptyInternalIterator<E>();

    }

    /**
     * Visits the given elements in order.
     */
    @SafeVarargs
    public static <E> IInternalIterator<E> of(final E... a) {

        return new ArrayInternalIterator<E>(a);

    }

    /**
     * Visits the elements of the iterable in its iteration order. Lists and
     * other collections report their size without a traversal.
     */
    @SuppressWarnings("unchecked")
    public static <E> IInternalIterator<E> of(final Iterable<? extends E> src) {

        if (src == null)
            throw new IllegalArgumentException();

        if (src instanceof List<?>)
            return new ListInternalIterator<E>((List<E>) src);

        if (src instanceof Collection<?>)
            return new IteratorInternalIterator<E>(src.iterator(),
                    ((Collection<?>) src).size());

        return new IteratorInternalIterator<E>(src.iterator(), -1L/* size */);

    }

    /**
     * Drives a pull iterator. The iterator is advanced only as far as the
     * traversal requires.
     */
    public static <E> IInternalIterator<E> of(final Iterator<? extends E> src) {

        return new IteratorInternalIterator<E>(src, -1L/* size */);

    }

    /**
     * Visits <code>from, from+1, ..., to-1</code>.
     */
    public static IInternalIterator<Long> range(final long from, final long to) {

        return new RangeInternalIterator(from, to);

    }

    /**
     * Visits the elements pushed by the generator.
     */
    public static <E> IInternalIterator<E> fromGenerator(
            final IGenerator<E> generator) {

        return new GeneratorInternalIterator<E>(generator);

    }

    /**
     * Visits the elements of each inner iterator in turn. Each inner iterator
     * is converted only when its turn comes.
     */
    public static <F> IInternalIterator<F> flatten(
            final IInternalIterator<? extends IIntoInternalIterator<? extends F>> src) {

        return flattenCapture(src);

    }

    private static <T extends IIntoInternalIterator<? extends F>, F> IInternalIterator<F> flattenCapture(
            final IInternalIterator<T> src) {

        return src.<F> flatMap(new IFunction<T, T>() {

            public T apply(final T e) {

                return e;

            }

        });

    }

}
