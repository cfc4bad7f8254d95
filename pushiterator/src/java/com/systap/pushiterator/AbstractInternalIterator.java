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

import java.util.Comparator;
import java.util.Optional;

import org.apache.log4j.Logger;

import com.systap.pushiterator.config.BooleanValidator;
import com.systap.pushiterator.config.Configuration;

/**
 * Base class for internal iterators. A producer implements the single
 * primitive {@link #doTraverse(Object, IStep)} and inherits every operation of
 * {@link IInternalIterator}.
 * <p>
 * The public operations are final. They enforce the single use rule and then
 * delegate to the protected hooks. A producer MAY override the hooks
 * {@link #doCount()}, {@link #doNth(long)} and {@link #doLast()} when it can
 * answer them without a traversal (e.g., a source whose length is known). An
 * override MUST be observably identical to the default: in particular it may
 * only avoid running a closure which the default would not have run either,
 * and it MUST report a <code>null</code> element rather than fail on it.
 * <p>
 * Adapters reach their sources through the hooks rather than through the
 * public operations since the source was already linked when the adapter was
 * constructed.
 *
 * @param <E>
 *            The generic type of the elements.
 */
abstract public class AbstractInternalIterator<E> implements
        IInternalIterator<E> {

    protected static final transient Logger log = Logger
            .getLogger(AbstractInternalIterator.class);

    /**
     * Options understood by {@link AbstractInternalIterator}. The options are
     * read from the system properties when the class is loaded.
     */
    public interface Options {

        /**
         * When <code>true</code>, the stack trace of the first use of each
         * internal iterator is recorded and reported as the cause of any
         * {@link IteratorConsumedException} for that iterator. This is a
         * debugging aid. It costs an exception per iterator.
         */
        String TRACK_CONSUMPTION = "com.systap.pushiterator.trackConsumption";

        String DEFAULT_TRACK_CONSUMPTION = "false";

    }

    /**
     * @see Options#TRACK_CONSUMPTION
     */
    static boolean trackConsumption = Configuration.getProperty(
            System.getProperties(), Options.TRACK_CONSUMPTION,
            Options.DEFAULT_TRACK_CONSUMPTION, BooleanValidator.DEFAULT);

    /**
     * Set when the iterator is consumed by a terminal operation or linked
     * into an adapter.
     */
    private boolean linkedOrConsumed = false;

    /**
     * The first use of the iterator iff {@link #trackConsumption}.
     */
    private Throwable firstUse = null;

    protected AbstractInternalIterator() {

    }

    /**
     * Returns <code>this</code>.
     */
    final public IInternalIterator<E> internalIterator() {

        return this;

    }

    /*
     * Hooks.
     */

    /**
     * The primitive traversal. See {@link #traverse(Object, IStep)} for the
     * contract. Implementations MUST stop as soon as the step function returns
     * {@link StepResult#stop(Object)} and MUST return that result.
     */
    abstract protected <A> StepResult<A> doTraverse(A init,
            IStep<? super E, A> step);

    /**
     * Counts the elements visited by a full traversal.
     */
    protected long doCount() {

        return doTraverse(Long.valueOf(0L), new IStep<E, Long>() {

            public StepResult<Long> step(final Long acc, final E e) {

                return StepResult.proceed(acc + 1);

            }

        }).get();

    }

    /**
     * Stops on the element at index <i>n</i>.
     *
     * @param n
     *            A non-negative index.
     *
     * @return The element, which MAY be <code>null</code>, or an empty
     *         {@link Holder} if there are not <i>n+1</i> elements.
     */
    protected Holder<E> doNth(final long n) {

        return doTraverse(new Holder<E>(), new IStep<E, Holder<E>>() {

            private long remaining = n;

            public StepResult<Holder<E>> step(final Holder<E> acc, final E e) {

                if (remaining == 0) {

                    acc.set(e);

                    return StepResult.stop(acc);

                }

                remaining--;

                return StepResult.proceed(acc);

            }

        }).get();

    }

    /**
     * Remembers each element of a full traversal.
     *
     * @return The final element, which MAY be <code>null</code>, or an empty
     *         {@link Holder} if there are no elements.
     */
    protected Holder<E> doLast() {

        return doTraverse(new Holder<E>(), new IStep<E, Holder<E>>() {

            public StepResult<Holder<E>> step(final Holder<E> acc, final E e) {

                acc.set(e);

                return StepResult.proceed(acc);

            }

        }).get();

    }

    /*
     * Single use.
     */

    /**
     * Mark this iterator as consumed by a terminal operation.
     *
     * @throws IteratorConsumedException
     *             if it was already consumed or linked.
     */
    protected final void consume() {

        claim("consumed");

    }

    private void claim(final String how) {

        if (linkedOrConsumed) {

            final String msg = getClass().getSimpleName()
                    + " already linked or consumed";

            if (log.isDebugEnabled())
                log.debug(msg + " (attempt: " + how + ")");

            if (firstUse != null)
                throw new IteratorConsumedException(msg, firstUse);

            throw new IteratorConsumedException(msg);

        }

        linkedOrConsumed = true;

        if (trackConsumption) {

            firstUse = new Throwable("first " + how + ": "
                    + getClass().getSimpleName());

        }

    }

    /**
     * Link a source into an adapter. The source may not be used again except
     * through the hooks by the adapter which linked it.
     *
     * @param src
     *            The source.
     *
     * @return The source viewed as an {@link AbstractInternalIterator}.
     *         Sources which do not extend this class are wrapped.
     *
     * @throws IllegalArgumentException
     *             if <i>src</i> is <code>null</code>.
     * @throws IteratorConsumedException
     *             if the source was already consumed or linked.
     */
    protected static <T> AbstractInternalIterator<T> link(
            final IInternalIterator<T> src) {

        if (src == null)
            throw new IllegalArgumentException();

        if (src instanceof AbstractInternalIterator<?>) {

            final AbstractInternalIterator<T> tmp = (AbstractInternalIterator<T>) src;

            tmp.claim("linked");

            return tmp;

        }

        return new ForeignInternalIterator<T>(src);

    }

    /**
     * A step function accepting any super type of <code>T</code> also accepts
     * <code>T</code>.
     */
    @SuppressWarnings("unchecked")
    static <T, A> IStep<T, A> narrow(final IStep<? super T, A> step) {

        return (IStep<T, A>) step;

    }

    /*
     * Primitive.
     */

    final public <A> StepResult<A> traverse(final A init,
            final IStep<? super E, A> step) {

        if (step == null)
            throw new IllegalArgumentException();

        consume();

        return doTraverse(init, step);

    }

    /*
     * Terminal operations.
     */

    final public void forEach(final IVisitor<? super E> visitor) {

        if (visitor == null)
            throw new IllegalArgumentException();

        consume();

        visitAll(visitor);

    }

    private void visitAll(final IVisitor<? super E> visitor) {

        doTraverse(null, new IStep<E, Void>() {

            public StepResult<Void> step(final Void acc, final E e) {

                visitor.visit(e);

                return StepResult.proceed(null);

            }

        });

    }

    final public long count() {

        consume();

        return doCount();

    }

    final public Optional<E> nth(final long n) {

        if (n < 0)
            throw new IllegalArgumentException();

        consume();

        return doNth(n).toOptional();

    }

    final public Optional<E> first() {

        consume();

        return doNth(0L).toOptional();

    }

    final public Optional<E> last() {

        consume();

        return doLast().toOptional();

    }

    final public <A> A fold(final A init, final IFold<A, ? super E> f) {

        if (f == null)
            throw new IllegalArgumentException();

        consume();

        return doTraverse(init, new IStep<E, A>() {

            public StepResult<A> step(final A acc, final E e) {

                return StepResult.proceed(f.apply(acc, e));

            }

        }).get();

    }

    final public Optional<E> find(final IPredicate<? super E> p) {

        if (p == null)
            throw new IllegalArgumentException();

        consume();

        return doTraverse(Optional.<E> empty(), new IStep<E, Optional<E>>() {

            public StepResult<Optional<E>> step(final Optional<E> acc,
                    final E e) {

                if (p.accept(e))
                    return StepResult.stop(Optional.of(e));

                return StepResult.proceed(acc);

            }

        }).get();

    }

    final public <R> Optional<R> findMap(
            final IFunction<? super E, Optional<R>> f) {

        if (f == null)
            throw new IllegalArgumentException();

        consume();

        return doTraverse(Optional.<R> empty(), new IStep<E, Optional<R>>() {

            public StepResult<Optional<R>> step(final Optional<R> acc,
                    final E e) {

                final Optional<R> r = f.apply(e);

                if (r != null && r.isPresent())
                    return StepResult.stop(r);

                return StepResult.proceed(acc);

            }

        }).get();

    }

    final public Optional<Long> position(final IPredicate<? super E> p) {

        if (p == null)
            throw new IllegalArgumentException();

        consume();

        return doTraverse(Optional.<Long> empty(),
                new IStep<E, Optional<Long>>() {

                    private long index = 0L;

                    public StepResult<Optional<Long>> step(
                            final Optional<Long> acc, final E e) {

                        if (p.accept(e))
                            return StepResult.stop(Optional.of(index));

                        index++;

                        return StepResult.proceed(acc);

                    }

                }).get();

    }

    final public boolean any(final IPredicate<? super E> p) {

        if (p == null)
            throw new IllegalArgumentException();

        consume();

        return doTraverse(Boolean.FALSE, new IStep<E, Boolean>() {

            public StepResult<Boolean> step(final Boolean acc, final E e) {

                if (p.accept(e))
                    return StepResult.stop(Boolean.TRUE);

                return StepResult.proceed(acc);

            }

        }).get();

    }

    final public boolean all(final IPredicate<? super E> p) {

        if (p == null)
            throw new IllegalArgumentException();

        consume();

        return doTraverse(Boolean.TRUE, new IStep<E, Boolean>() {

            public StepResult<Boolean> step(final Boolean acc, final E e) {

                if (!p.accept(e))
                    return StepResult.stop(Boolean.FALSE);

                return StepResult.proceed(acc);

            }

        }).get();

    }

    final public Optional<E> min(final Comparator<? super E> comparator) {

        return select(comparator, false/* max */);

    }

    final public Optional<E> max(final Comparator<? super E> comparator) {

        return select(comparator, true/* max */);

    }

    /**
     * A later element replaces the current selection if it is strictly less
     * (min) or greater than or equal (max).
     */
    private Optional<E> select(final Comparator<? super E> comparator,
            final boolean max) {

        if (comparator == null)
            throw new IllegalArgumentException();

        consume();

        return doTraverse(new Holder<E>(), new IStep<E, Holder<E>>() {

            public StepResult<Holder<E>> step(final Holder<E> acc, final E e) {

                if (!acc.found) {

                    acc.set(e);

                } else {

                    final int cmp = comparator.compare(e, acc.value);

                    if (max ? cmp >= 0 : cmp < 0)
                        acc.set(e);

                }

                return StepResult.proceed(acc);

            }

        }).get().toOptional();

    }

    final public <K extends Comparable<? super K>> Optional<E> minByKey(
            final IFunction<? super E, ? extends K> key) {

        return selectByKey(key, false/* max */);

    }

    final public <K extends Comparable<? super K>> Optional<E> maxByKey(
            final IFunction<? super E, ? extends K> key) {

        return selectByKey(key, true/* max */);

    }

    private <K extends Comparable<? super K>> Optional<E> selectByKey(
            final IFunction<? super E, ? extends K> key, final boolean max) {

        if (key == null)
            throw new IllegalArgumentException();

        consume();

        final KeyedHolder<E, K> h = doTraverse(new KeyedHolder<E, K>(),
                new IStep<E, KeyedHolder<E, K>>() {

                    public StepResult<KeyedHolder<E, K>> step(
                            final KeyedHolder<E, K> acc, final E e) {

                        final K k = key.apply(e);

                        if (!acc.found) {

                            acc.set(e, k);

                        } else {

                            final int cmp = k.compareTo(acc.key);

                            if (max ? cmp >= 0 : cmp < 0)
                                acc.set(e, k);

                        }

                        return StepResult.proceed(acc);

                    }

                }).get();

        return h.toOptional();

    }

    final public <C> C collect(final IMaterializer<? super E, C> materializer) {

        if (materializer == null)
            throw new IllegalArgumentException();

        consume();

        visitAll(new IVisitor<E>() {

            public void visit(final E e) {

                materializer.accept(e);

            }

        });

        return materializer.finish();

    }

    /*
     * Adapters.
     */

    final public <F> IInternalIterator<F> map(
            final IFunction<? super E, ? extends F> f) {

        return new Resolver<E, F>(this, f);

    }

    final public IInternalIterator<E> filter(final IPredicate<? super E> p) {

        return new Filter<E>(this, p);

    }

    final public <F> IInternalIterator<F> filterMap(
            final IFunction<? super E, Optional<F>> f) {

        return new FilterResolver<E, F>(this, f);

    }

    final public <F> IInternalIterator<F> flatMap(
            final IFunction<? super E, ? extends IIntoInternalIterator<? extends F>> f) {

        return new Expander<E, F>(this, f);

    }

    final public IInternalIterator<E> take(final long n) {

        return new Limit<E>(this, n);

    }

    final public IInternalIterator<E> skip(final long n) {

        return new Skip<E>(this, n);

    }

    final public IInternalIterator<E> stepBy(final long n) {

        return new StepBy<E>(this, n);

    }

    final public IInternalIterator<E> takeWhile(final IPredicate<? super E> p) {

        return new TakeWhile<E>(this, p);

    }

    final public IInternalIterator<E> skipWhile(final IPredicate<? super E> p) {

        return new SkipWhile<E>(this, p);

    }

    final public IInternalIterator<IndexedValue<E>> enumerate() {

        return new Enumerator<E>(this);

    }

    final public IInternalIterator<E> inspect(final IVisitor<? super E> visitor) {

        return new Inspector<E>(this, visitor);

    }

    final public IInternalIterator<E> chain(
            final IIntoInternalIterator<? extends E> other) {

        return new Appender<E>(this, other);

    }

    /**
     * An element which MAY be <code>null</code>, or nothing. The hooks report
     * their answer in a holder so that a <code>null</code> element only fails
     * when a public operation selects it.
     */
    protected static class Holder<E> {

        boolean found = false;

        E value = null;

        /**
         * An empty holder.
         */
        public Holder() {

        }

        /**
         * A holder for the given element.
         */
        public Holder(final E e) {

            set(e);

        }

        public void set(final E e) {

            found = true;

            value = e;

        }

        public boolean isFound() {

            return found;

        }

        /**
         * The element (MAY be <code>null</code>).
         *
         * @throws IllegalStateException
         *             if the holder is empty.
         */
        public E get() {

            if (!found)
                throw new IllegalStateException();

            return value;

        }

        /**
         * @throws NullPointerException
         *             if the element is <code>null</code>.
         */
        public Optional<E> toOptional() {

            return found ? Optional.of(value) : Optional.<E> empty();

        }

    }

    private static class KeyedHolder<E, K> extends Holder<E> {

        K key = null;

        void set(final E e, final K k) {

            set(e);

            key = k;

        }

    }

}
