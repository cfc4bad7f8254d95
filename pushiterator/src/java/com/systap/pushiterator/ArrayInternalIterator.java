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

/**
 * Visits the elements of an array. The length is known, so the count and the
 * indexed lookups do not traverse.
 *
 * @param <E>
 *            The generic type of the elements.
 */
class ArrayInternalIterator<E> extends AbstractInternalIterator<E> {

    private final E[] a;

    /**
     * @param a
     *            The array (not copied).
     */
    ArrayInternalIterator(final E[] a) {

        if (a == null)
            throw new IllegalArgumentException();

        this.a = a;

    }

    @Override
    protected <A> StepResult<A> doTraverse(final A init,
            final IStep<? super E, A> step) {

        A acc = init;

        for (int i = 0; i < a.length; i++) {

            final StepResult<A> r = step.step(acc, a[i]);

            if (r.isStop())
                return r;

            acc = r.get();

        }

        return StepResult.proceed(acc);

    }

    @Override
    protected long doCount() {

        return a.length;

    }

    @Override
    protected Holder<E> doNth(final long n) {

        if (n >= a.length)
            return new Holder<E>();

        return new Holder<E>(a[(int) n]);

    }

    @Override
    protected Holder<E> doLast() {

        if (a.length == 0)
            return new Holder<E>();

        return new Holder<E>(a[a.length - 1]);

    }

}
