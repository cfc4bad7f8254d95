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
 * Discards the first <i>n</i> elements (<i>skip</i>). Skipping more elements
 * than there are yields nothing.
 *
 * @param <E>
 *            The generic type of the elements.
 */
class Skip<E> extends AbstractInternalIterator<E> {

    private final AbstractInternalIterator<E> src;

    private final long n;

    Skip(final IInternalIterator<E> src, final long n) {

        if (n < 0)
            throw new IllegalArgumentException();

        this.n = n;

        this.src = link(src);

    }

    @Override
    protected <A> StepResult<A> doTraverse(final A init,
            final IStep<? super E, A> step) {

        return src.doTraverse(init, new IStep<E, A>() {

            private long remaining = n;

            public StepResult<A> step(final A acc, final E e) {

                if (remaining == 0)
                    return step.step(acc, e);

                remaining--;

                return StepResult.proceed(acc);

            }

        });

    }

    @Override
    protected long doCount() {

        return Math.max(0L, src.doCount() - n);

    }

    @Override
    protected Holder<E> doNth(final long k) {

        if (k > Long.MAX_VALUE - n) {

            // index overflows the source.
            return super.doNth(k);

        }

        return src.doNth(k + n);

    }

    public String toString() {

        return "skip(" + n + ")";

    }

}
