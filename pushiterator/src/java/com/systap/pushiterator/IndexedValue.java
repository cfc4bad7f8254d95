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
 * An element paired with its index in a traversal.
 * 
 * @param <E>
 *            The generic type of the element.
 * 
 * @see IInternalIterator#enumerate()
 */
public class IndexedValue<E> {

    private final long index;

    private final E value;

    /**
     * @param index
     *            The index (origin ZERO).
     * @param value
     *            The element (MAY be <code>null</code>).
     * 
     * @throws IllegalArgumentException
     *             if the <i>index</i> is negative.
     */
    public IndexedValue(final long index, final E value) {

        if (index < 0)
            throw new IllegalArgumentException();

        this.index = index;

        this.value = value;

    }

    public long getIndex() {

        return index;

    }

    public E getValue() {

        return value;

    }

    public String toString() {

        return index + "=" + value;

    }

    public int hashCode() {

        return (int) (index ^ (index >>> 32)) * 31
                + (value == null ? 0 : value.hashCode());

    }

    public boolean equals(final Object o) {

        if (this == o)
            return true;

        if (!(o instanceof IndexedValue<?>))
            return false;

        final IndexedValue<?> t = (IndexedValue<?>) o;

        return index == t.index
                && (value == null ? t.value == null : value.equals(t.value));

    }

}
