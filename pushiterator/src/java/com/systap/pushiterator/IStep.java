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
 * A step function: caller logic invoked once per element during a traversal.
 * A step function is owned by the operation which created it for the duration
 * of a single traversal and is never retained beyond that traversal.
 * 
 * @param <E>
 *            The generic type of the elements.
 * @param <A>
 *            The generic type of the accumulator threaded through the
 *            traversal.
 */
public interface IStep<E, A> {

    /**
     * Apply the step function to an element.
     * 
     * @param acc
     *            The accumulator returned by the previous step, or the initial
     *            value for the first element.
     * @param e
     *            The element.
     * 
     * @return Either {@link StepResult#proceed(Object)} with the new
     *         accumulator or {@link StepResult#stop(Object)} with the final
     *         result.
     */
    public StepResult<A> step(A acc, E e);

}
