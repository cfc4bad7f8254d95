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
 * Views an {@link IInternalIterator} which does not extend
 * {@link AbstractInternalIterator} as one, so that adapters can link it. The
 * wrapped iterator is consumed through its public operations, exactly once.
 */
class ForeignInternalIterator<E> extends AbstractInternalIterator<E> {

    private final IInternalIterator<E> src;

    ForeignInternalIterator(final IInternalIterator<E> src) {

        this.src = src;

    }

    @Override
    protected <A> StepResult<A> doTraverse(final A init,
            final IStep<? super E, A> step) {

        return src.traverse(init, step);

    }

    @Override
    protected long doCount() {

        return src.count();

    }

}
