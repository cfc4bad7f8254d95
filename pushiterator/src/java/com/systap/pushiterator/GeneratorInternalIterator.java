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

import org.apache.log4j.Logger;

/**
 * Adapts an {@link IGenerator} to the traversal contract. The emitter threads
 * the accumulator between calls and reports back to the generator once the
 * step function has stopped.
 *
 * @param <E>
 *            The generic type of the elements.
 */
class GeneratorInternalIterator<E> extends AbstractInternalIterator<E> {

    private static final transient Logger log = Logger
            .getLogger(GeneratorInternalIterator.class);

    private final IGenerator<E> generator;

    GeneratorInternalIterator(final IGenerator<E> generator) {

        if (generator == null)
            throw new IllegalArgumentException();

        this.generator = generator;

    }

    @Override
    protected <A> StepResult<A> doTraverse(final A init,
            final IStep<? super E, A> step) {

        final Emitter<A> emitter = new Emitter<A>(init, step);

        generator.generate(emitter);

        emitter.closed = true;

        if (emitter.stopped)
            return StepResult.stop(emitter.acc);

        return StepResult.proceed(emitter.acc);

    }

    private class Emitter<A> implements IEmitter<E> {

        private final IStep<? super E, A> step;

        A acc;

        boolean stopped = false;

        /**
         * Set once the generator has returned.
         */
        boolean closed = false;

        Emitter(final A init, final IStep<? super E, A> step) {

            this.acc = init;

            this.step = step;

        }

        public boolean emit(final E e) {

            if (closed)
                throw new IllegalStateException("Generator has returned");

            if (stopped)
                throw new IllegalStateException("Consumer has stopped");

            final StepResult<A> r = step.step(acc, e);

            acc = r.get();

            if (r.isStop()) {

                stopped = true;

                if (log.isDebugEnabled())
                    log.debug("Consumer stopped generator: " + generator);

                return false;

            }

            return true;

        }

    }

}
