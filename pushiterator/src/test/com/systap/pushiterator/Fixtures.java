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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Sources and closures shared by the unit tests.
 */
class Fixtures {

    private Fixtures() {

    }

    static List<Integer> ints(final Integer... a) {

        return new ArrayList<Integer>(Arrays.asList(a));

    }

    /**
     * Collect the elements into a {@link List}.
     */
    static <E> List<E> toList(final IInternalIterator<E> itr) {

        return itr.collect(Materializers.<E> toList());

    }

    /**
     * A source with none of the analytic overrides, so every operation takes
     * the traversing default.
     */
    static <E> IInternalIterator<E> generate(final List<E> elements) {

        return recording(elements, new ArrayList<E>());

    }

    /**
     * A source with none of the analytic overrides which records each element
     * as it is produced.
     *
     * @param elements
     *            The elements to produce.
     * @param produced
     *            Each element is added to this list just before it is pushed.
     */
    static <E> IInternalIterator<E> recording(final List<E> elements,
            final List<E> produced) {

        return InternalIterators.fromGenerator(new IGenerator<E>() {

            public void generate(final IEmitter<E> emitter) {

                for (E e : elements) {

                    produced.add(e);

                    if (!emitter.emit(e))
                        return;

                }

            }

        });

    }

    /**
     * Records the elements it visits.
     */
    static class Recorder<E> implements IVisitor<E> {

        final List<E> seen = new ArrayList<E>();

        public void visit(final E e) {

            seen.add(e);

        }

    }

    static class LessThan implements IPredicate<Integer> {

        private final int bound;

        LessThan(final int bound) {
            this.bound = bound;
        }

        public boolean accept(final Integer e) {
            return e < bound;
        }

    }

    static class GreaterThan implements IPredicate<Integer> {

        private final int bound;

        GreaterThan(final int bound) {
            this.bound = bound;
        }

        public boolean accept(final Integer e) {
            return e > bound;
        }

    }

    static class EqualTo<E> implements IPredicate<E> {

        private final E value;

        EqualTo(final E value) {
            this.value = value;
        }

        public boolean accept(final E e) {
            return value.equals(e);
        }

    }

    static class Constant<E> implements IPredicate<E> {

        private final boolean value;

        Constant(final boolean value) {
            this.value = value;
        }

        public boolean accept(final E e) {
            return value;
        }

    }

    static class Times implements IFunction<Integer, Integer> {

        private final int k;

        Times(final int k) {
            this.k = k;
        }

        public Integer apply(final Integer e) {
            return e * k;
        }

    }

    /**
     * Counts the calls to a predicate.
     */
    static class CountingPredicate<E> implements IPredicate<E> {

        private final IPredicate<E> delegate;

        int ncalls = 0;

        CountingPredicate(final IPredicate<E> delegate) {
            this.delegate = delegate;
        }

        public boolean accept(final E e) {
            ncalls++;
            return delegate.accept(e);
        }

    }

    /**
     * Records the arguments of a function.
     */
    static class RecordingFunction<E, F> implements IFunction<E, F> {

        private final IFunction<E, F> delegate;

        final List<E> args = new ArrayList<E>();

        RecordingFunction(final IFunction<E, F> delegate) {
            this.delegate = delegate;
        }

        public F apply(final E e) {
            args.add(e);
            return delegate.apply(e);
        }

    }

    /**
     * Sums the elements, stopping on the given value (which is included in
     * the result).
     */
    static class SumUntil implements IStep<Integer, Integer> {

        private final int stopAt;

        SumUntil(final int stopAt) {
            this.stopAt = stopAt;
        }

        public StepResult<Integer> step(final Integer acc, final Integer e) {

            final int sum = acc + e;

            if (e == stopAt)
                return StepResult.stop(sum);

            return StepResult.proceed(sum);

        }

    }

}
