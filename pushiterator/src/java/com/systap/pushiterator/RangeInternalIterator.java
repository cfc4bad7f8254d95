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
 * Visits the half-open range <code>[from:to)</code> in ascending order.
 */
class RangeInternalIterator extends AbstractInternalIterator<Long> {

    private final long from;

    private final long to;

    /**
     * @param from
     *            The first value (inclusive).
     * @param to
     *            The exclusive upper bound. The range is empty unless
     *            <code>from &lt; to</code>.
     */
    RangeInternalIterator(final long from, final long to) {

        this.from = from;

        this.to = to;

    }

    @Override
    protected <A> StepResult<A> doTraverse(final A init,
            final IStep<? super Long, A> step) {

        A acc = init;

        for (long i = from; i < to; i++) {

            final StepResult<A> r = step.step(acc, i);

            if (r.isStop())
                return r;

            acc = r.get();

        }

        return StepResult.proceed(acc);

    }

    @Override
    protected long doCount() {

        if (from >= to)
            return 0L;

        final long n = to - from;

        if (n < 0)
            throw new ArithmeticException("count overflows a long: from="
                    + from + ", to=" + to);

        return n;

    }

    @Override
    protected Holder<Long> doNth(final long n) {

        // The width is compared unsigned since to - from may exceed a long.
        if (from >= to || Long.compareUnsigned(n, to - from) >= 0)
            return new Holder<Long>();

        return new Holder<Long>(from + n);

    }

    @Override
    protected Holder<Long> doLast() {

        if (from >= to)
            return new Holder<Long>();

        return new Holder<Long>(to - 1);

    }

    public String toString() {

        return "range[" + from + ":" + to + ")";

    }

}
