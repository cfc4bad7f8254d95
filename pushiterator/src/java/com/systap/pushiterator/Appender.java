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
 * Appender pattern visits the elements of a second iterator once the first
 * iterator is exhausted (<i>chain</i>). A stop inside the first iterator ends
 * the traversal without touching the second.
 *
 * @param <E>
 *            The generic type of the elements.
 */
class Appender<E> extends AbstractInternalIterator<E> {

    private final AbstractInternalIterator<E> first;

    private final AbstractInternalIterator<? extends E> second;

    Appender(final IInternalIterator<E> first,
            final IIntoInternalIterator<? extends E> second) {

        if (second == null)
            throw new IllegalArgumentException();

        this.first = link(first);

        this.second = link(second.internalIterator());

    }

    @Override
    protected <A> StepResult<A> doTraverse(final A init,
            final IStep<? super E, A> step) {

        final StepResult<A> r = first.doTraverse(init, step);

        if (r.isStop())
            return r;

        return second.doTraverse(r.get(), AbstractInternalIterator
                .<E, A> narrow(step));

    }

    @Override
    protected long doCount() {

        final long n1 = first.doCount();

        return n1 + second.doCount();

    }

    /**
     * Both sources are traversed in order, just as the default would.
     */
    @Override
    protected Holder<E> doLast() {

        final Holder<E> a = first.doLast();

        final Holder<? extends E> b = second.doLast();

        if (b.isFound())
            return new Holder<E>(b.get());

        return a;

    }

}
