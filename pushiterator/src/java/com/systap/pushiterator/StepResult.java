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
 * The outcome of a single application of an {@link IStep}: either
 * <em>continue</em> the traversal with an updated accumulator, or
 * <em>stop</em> the traversal now with a final result.
 * <p>
 * Once a nested step function has produced a {@link #stop(Object) stop}
 * result, every enclosing adapter MUST return that same result without
 * delivering any further elements.
 *
 * @param <A>
 *            The generic type of the accumulator / result.
 */
public abstract class StepResult<A> {

    /**
     * Shared instance for <code>proceed(null)</code>, which is what the
     * visitor style operations return for every element.
     */
    @SuppressWarnings("rawtypes")
    private static final StepResult PROCEED_NULL = new Proceed<Object>(null);

    private final A value;

    private StepResult(final A value) {

        this.value = value;

    }

    /**
     * Continue the traversal with the given accumulator.
     *
     * @param value
     *            The accumulator (MAY be <code>null</code>).
     */
    @SuppressWarnings("unchecked")
    public static <A> StepResult<A> proceed(final A value) {

        if (value == null)
            return (StepResult<A>) PROCEED_NULL;

        return new Proceed<A>(value);

    }

    /**
     * Stop the traversal with the given final result.
     *
     * @param value
     *            The result (MAY be <code>null</code>).
     */
    public static <A> StepResult<A> stop(final A value) {

        return new Stop<A>(value);

    }

    /**
     * <code>true</code> iff the traversal must stop.
     */
    abstract public boolean isStop();

    /**
     * <code>true</code> iff the traversal may continue.
     */
    final public boolean isContinue() {

        return !isStop();

    }

    /**
     * The accumulator (when continuing) or the final result (when stopped).
     */
    final public A get() {

        return value;

    }

    public int hashCode() {

        final int h = value == null ? 0 : value.hashCode();

        return isStop() ? ~h : h;

    }

    public boolean equals(final Object o) {

        if (this == o)
            return true;

        if (!(o instanceof StepResult<?>))
            return false;

        final StepResult<?> t = (StepResult<?>) o;

        if (isStop() != t.isStop())
            return false;

        return value == null ? t.value == null : value.equals(t.value);

    }

    public String toString() {

        return (isStop() ? "Stop(" : "Continue(") + value + ")";

    }

    private static final class Proceed<A> extends StepResult<A> {

        Proceed(final A value) {
            super(value);
        }

        public boolean isStop() {
            return false;
        }

    }

    private static final class Stop<A> extends StepResult<A> {

        Stop(final A value) {
            super(value);
        }

        public boolean isStop() {
            return true;
        }

    }

}
