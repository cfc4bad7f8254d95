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
 * A producer written as a single callback which pushes its elements into an
 * {@link IEmitter}. This is the simplest way to turn recursive code (a tree
 * walk, a visitor) into an {@link IInternalIterator}.
 * 
 * @param <E>
 *            The generic type of the elements.
 * 
 * @see InternalIterators#fromGenerator(IGenerator)
 */
public interface IGenerator<E> {

    /**
     * Emit the elements, in order, until either there are no more elements or
     * {@link IEmitter#emit(Object)} returns <code>false</code>.
     */
    public void generate(IEmitter<E> emitter);

}
