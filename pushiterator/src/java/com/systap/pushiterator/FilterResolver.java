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

import java.util.Optional;

/**
 * Transforms each element, passing on only the present results
 * (<i>filterMap</i>). A <code>null</code> result is treated as absent.
 *
 * @param <E>
 *            The generic type of the source elements.
 * @param <F>
 *            The generic type of the resolved elements.
 */
class FilterResolver<E, F> extends AbstractInternalIterator<F> {

    private final AbstractInternalIterator<E> src;

    private final IFunction<? super E, Optional<F>> f;

    FilterResolver(final IInternalIterator<E> src,
            final IFunction<? super E, Optional<F>> f) {

        if (f == null)
            throw new IllegalArgumentException();

        this.f = f;

        this.src = link(src);

    }

    @Override
    protected <A> StepResult<A> doTraverse(final A init,
            final IStep<? super F, A> step) {

        return src.doTraverse(init, new IStep<E, A>() {

            public StepResult<A> step(final A acc, final E e) {

                final Optional<F> r = f.apply(e);

                if (r != null && r.isPresent())
                    return step.step(acc, r.get());

                return StepResult.proceed(acc);

            }

        });

    }

}
