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
import java.util.List;
import java.util.RandomAccess;

/**
 * Visits the elements of a {@link List} in list order. The size is known, so
 * the count and the indexed lookups do not traverse. The list must not be
 * modified while the iterator is in use.
 *
 * @param <E>
 *            The generic type of the elements.
 */
class ListInternalIterator<E> extends AbstractInternalIterator<E> {

    private final List<E> list;

    ListInternalIterator(final List<E> list) {

        if (list == null)
            throw new IllegalArgumentException();

        this.list = list;

    }

    @Override
    protected <A> StepResult<A> doTraverse(final A init,
            final IStep<? super E, A> step) {

        A acc = init;

        if (list instanceof RandomAccess) {

            final int n = list.size();

            for (int i = 0; i < n; i++) {

                final StepResult<A> r = step.step(acc, list.get(i));

                if (r.isStop())
                    return r;

                acc = r.get();

            }

        } else {

            final Iterator<E> itr = list.iterator();

            while (itr.hasNext()) {

                final StepResult<A> r = step.step(acc, itr.next());

                if (r.isStop())
                    return r;

                acc = r.get();

            }

        }

        return StepResult.proceed(acc);

    }

    @Override
    protected long doCount() {

        return list.size();

    }

    @Override
    protected Holder<E> doNth(final long n) {

        if (n >= list.size())
            return new Holder<E>();

        return new Holder<E>(list.get((int) n));

    }

    @Override
    protected Holder<E> doLast() {

        if (list.isEmpty())
            return new Holder<E>();

        return new Holder<E>(list.get(list.size() - 1));

    }

}
