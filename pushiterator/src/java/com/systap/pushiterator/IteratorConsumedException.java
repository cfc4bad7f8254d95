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
 * Thrown when an {@link IInternalIterator} is traversed, or wrapped by an
 * adapter, after it has already been consumed or wrapped.
 * 
 * @see AbstractInternalIterator.Options#TRACK_CONSUMPTION
 */
public class IteratorConsumedException extends IllegalStateException {

    private static final long serialVersionUID = -5130935424519302316L;

    public IteratorConsumedException(final String msg) {

        super(msg);

    }

    /**
     * @param msg
     *            The message.
     * @param firstUse
     *            The stack trace of the first use of the iterator.
     */
    public IteratorConsumedException(final String msg, final Throwable firstUse) {

        super(msg, firstUse);

    }

}
