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
 * Replaces each element by the elements of an inner iterator
 * (<i>flatMap</i>). Each inner iterator is obtained only when its outer
 * element is visited and is traversed with the same downstream step function,
 * so a stop anywhere inside an inner iterator ends the whole traversal and no
 * further outer element is visited.
 *
 * @param <E>
 *            The generic type of the outer elements.
 * @param <F>
 *            The generic type of the elements of the inner iterators.
 */
class Expander<E, F> extends AbstractInternalIterator<F> {

    private final AbstractInternalIterator<E> src;

    private final IFunction<? super E, ? extends IIntoInternalIterator<? extends F>> f;

    Expander(
            final IInternalIterator<E> src,
            final IFunction<? super E, ? extends IIntoInternalIterator<? extends F>> f) {

        if (f == null)
            throw new IllegalArgumentException();

        this.f = f;

        this.src = link(src);

    }

    @Override
    protected <A> StepResult<A> doTraverse(final A init,
            final IStep<? super F, A> step) {

        final IStep<F, A> downstream = AbstractInternalIterator
                .<F, A> narrow(step);

        return src.doTraverse(init, new IStep<E, A>() {

            public StepResult<A> step(final A acc, final E e) {

                final IIntoInternalIterator<? extends F> inner = f.apply(e);

                if (inner == null)
                    throw new IllegalStateException("No iterator for: " + e);

                return expand(inner.internalIterator(), acc, downstream);

            }

        });

    }

    private static <T, A> StepResult<A> expand(
            final IInternalIterator<T> inner, final A acc,
            final IStep<? super T, A> downstream) {

        return link(inner).doTraverse(acc, downstream);

    }

}
