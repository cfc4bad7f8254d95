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

import org.apache.log4j.Logger;

/**
 * Passes on only the first <i>n</i> elements (<i>take</i>). The traversal of
 * the source is stopped as soon as the <i>n</i>th element has been passed on,
 * so the element at index <i>n</i> is never produced and no closure anywhere
 * in the pipeline sees it. When <i>n</i> is ZERO the source is not traversed
 * at all.
 *
 * @param <E>
 *            The generic type of the elements.
 */
class Limit<E> extends AbstractInternalIterator<E> {

    private static final transient Logger log = Logger.getLogger(Limit.class);

    private final AbstractInternalIterator<E> src;

    private final long n;

    Limit(final IInternalIterator<E> src, final long n) {

        if (n < 0)
            throw new IllegalArgumentException();

        this.n = n;

        this.src = link(src);

    }

    @Override
    protected <A> StepResult<A> doTraverse(final A init,
            final IStep<? super E, A> step) {

        if (n == 0)
            return StepResult.proceed(init);

        final LimitStep<A> limiter = new LimitStep<A>(step);

        final StepResult<A> r = src.doTraverse(init, limiter);

        if (limiter.limitReached) {

            if (log.isDebugEnabled())
                log.debug("Limit reached: " + this);

            // The downstream step did not ask to stop.
            return StepResult.proceed(r.get());

        }

        return r;

    }

    /**
     * Answered by the source when the index is within the limit. Otherwise
     * the default applies, which visits the first <i>n</i> elements and finds
     * nothing.
     */
    @Override
    protected Holder<E> doNth(final long k) {

        if (k < n)
            return src.doNth(k);

        return super.doNth(k);

    }

    public String toString() {

        return "take(" + n + ")";

    }

    /**
     * Forwards to the downstream step and turns the <i>n</i>th continue into
     * a stop of the source.
     */
    private class LimitStep<A> implements IStep<E, A> {

        private final IStep<? super E, A> downstream;

        private long remaining = n;

        /**
         * Set when the source was stopped by the limit rather than by the
         * downstream step.
         */
        boolean limitReached = false;

        LimitStep(final IStep<? super E, A> downstream) {

            this.downstream = downstream;

        }

        public StepResult<A> step(final A acc, final E e) {

            remaining--;

            final StepResult<A> r = downstream.step(acc, e);

            if (r.isStop())
                return r;

            if (remaining == 0) {

                limitReached = true;

                return StepResult.stop(r.get());

            }

            return r;

        }

    }

}
