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

import java.util.Iterator;

/**
 * Drives a (pull) {@link Iterator} as an internal iterator. The iterator is
 * never advanced past the element on which a step function stops. The count
 * and the indexed lookups advance the iterator directly, without building a
 * step function, and the count is taken from the source collection when its
 * size is known.
 *
 * @param <E>
 *            The generic type of the elements.
 */
class IteratorInternalIterator<E> extends AbstractInternalIterator<E> {

    private final Iterator<? extends E> itr;

    /**
     * The number of elements -or- <code>-1</code> if not known.
     */
    private final long size;

    /**
     * @param itr
     *            The source iterator.
     * @param size
     *            The number of elements it will visit -or- <code>-1</code> if
     *            not known.
     */
    IteratorInternalIterator(final Iterator<? extends E> itr, final long size) {

        if (itr == null)
            throw new IllegalArgumentException();

        if (size < -1)
            throw new IllegalArgumentException();

        this.itr = itr;

        this.size = size;

    }

    @Override
    protected <A> StepResult<A> doTraverse(final A init,
            final IStep<? super E, A> step) {

        A acc = init;

        while (itr.hasNext()) {

            final StepResult<A> r = step.step(acc, itr.next());

            if (r.isStop())
                return r;

            acc = r.get();

        }

        return StepResult.proceed(acc);

    }

    @Override
    protected long doCount() {

        if (size != -1)
            return size;

        long n = 0;

        while (itr.hasNext()) {

            itr.next();

            n++;

        }

        return n;

    }

    @Override
    protected Holder<E> doNth(final long n) {

        long remaining = n;

        while (itr.hasNext()) {

            final E e = itr.next();

            if (remaining == 0)
                return new Holder<E>(e);

            remaining--;

        }

        return new Holder<E>();

    }

    @Override
    protected Holder<E> doLast() {

        final Holder<E> h = new Holder<E>();

        while (itr.hasNext()) {

            h.set(itr.next());

        }

        return h;

    }

}
