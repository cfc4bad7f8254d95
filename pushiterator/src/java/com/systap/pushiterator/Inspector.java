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
 * Invokes a visitor on each element and passes the element on unchanged
 * (<i>inspect</i>).
 *
 * @param <E>
 *            The generic type of the elements.
 */
class Inspector<E> extends AbstractInternalIterator<E> {

    private final AbstractInternalIterator<E> src;

    private final IVisitor<? super E> visitor;

    Inspector(final IInternalIterator<E> src, final IVisitor<? super E> visitor) {

        if (visitor == null)
            throw new IllegalArgumentException();

        this.visitor = visitor;

        this.src = link(src);

    }

    @Override
    protected <A> StepResult<A> doTraverse(final A init,
            final IStep<? super E, A> step) {

        return src.doTraverse(init, new IStep<E, A>() {

            public StepResult<A> step(final A acc, final E e) {

                visitor.visit(e);

                return step.step(acc, e);

            }

        });

    }

}
