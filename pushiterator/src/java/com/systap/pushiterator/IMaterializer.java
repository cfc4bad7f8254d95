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
 * Builds a container from the elements of a traversal. The elements are
 * {@link #accept(Object) accepted} in traversal order and then the container
 * is {@link #finish() finished}. A materializer is used for a single
 * {@link IInternalIterator#collect(IMaterializer)}.
 * 
 * @param <E>
 *            The generic type of the elements.
 * @param <C>
 *            The generic type of the container.
 * 
 * @see Materializers
 */
public interface IMaterializer<E, C> {

    /**
     * Accept one element.
     */
    public void accept(E e);

    /**
     * Return the container.
     */
    public C finish();

}
