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
 * Pairs each element with its index (<i>enumerate</i>). No closure is
 * involved, so the count and the indexed lookup are answered by the source.
 *
 * @param <E>
 *            The generic type of the source elements.
 */
class Enumerator<E> extends AbstractInternalIterator<IndexedValue<E>> {

    private final AbstractInternalIterator<E> src;

    Enumerator(final IInternalIterator<E> src) {

        this.src = link(src);

    }

    @Override
    protected <A> StepResult<A> doTraverse(final A init,
            final IStep<? super IndexedValue<E>, A> step) {

        return src.doTraverse(init, new IStep<E, A>() {

            private long index = 0L;

            public StepResult<A> step(final A acc, final E e) {

                return step.step(acc, new IndexedValue<E>(index++, e));

            }

        });

    }

    @Override
    protected long doCount() {

        return src.doCount();

    }

    @Override
    protected Holder<IndexedValue<E>> doNth(final long n) {

        final Holder<E> h = src.doNth(n);

        if (!h.isFound())
            return new Holder<IndexedValue<E>>();

        return new Holder<IndexedValue<E>>(new IndexedValue<E>(n, h.get()));

    }

}
