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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import com.systap.pushiterator.config.Configuration;
import com.systap.pushiterator.config.IntegerValidator;

/**
 * Static factories for {@link IMaterializer}s building the common
 * {@link java.util} containers. Each call returns a new materializer, which
 * must be used for a single {@link IInternalIterator#collect(IMaterializer)}.
 */
public class Materializers {

    /**
     * Options understood by {@link Materializers}. The options are read from
     * the system properties when the class is loaded.
     */
    public interface Options {

        /**
         * The initial capacity of the {@link List} built by
         * {@link Materializers#toList()}.
         */
        String INITIAL_CAPACITY = "com.systap.pushiterator.initialCapacity";

        String DEFAULT_INITIAL_CAPACITY = "10";

    }

    /**
     * @see Options#INITIAL_CAPACITY
     */
    static final int initialCapacity = Configuration.getProperty(
            System.getProperties(), Options.INITIAL_CAPACITY,
            Options.DEFAULT_INITIAL_CAPACITY, IntegerValidator.GT_ZERO);

    private Materializers() {

    }

    /**
     * An {@link ArrayList} in traversal order.
     */
    public static <E> IMaterializer<E, List<E>> toList() {

        return into((List<E>) new ArrayList<E>(initialCapacity));

    }

    /**
     * A {@link HashSet}.
     */
    public static <E> IMaterializer<E, Set<E>> toSet() {

        return into((Set<E>) new HashSet<E>());

    }

    /**
     * A {@link TreeSet} in the natural order of the elements.
     */
    public static <E> IMaterializer<E, SortedSet<E>> toSortedSet() {

        return into((SortedSet<E>) new TreeSet<E>());

    }

    /**
     * A {@link TreeSet} in the order of the comparator.
     */
    public static <E> IMaterializer<E, SortedSet<E>> toSortedSet(
            final Comparator<? super E> comparator) {

        if (comparator == null)
            throw new IllegalArgumentException();

        return into((SortedSet<E>) new TreeSet<E>(comparator));

    }

    /**
     * Adds the elements to the given collection, which is returned.
     */
    public static <E, C extends Collection<? super E>> IMaterializer<E, C> into(
            final C target) {

        if (target == null)
            throw new IllegalArgumentException();

        return new IMaterializer<E, C>() {

            public void accept(final E e) {

                target.add(e);

            }

            public C finish() {

                return target;

            }

        };

    }

    /**
     * A {@link HashMap} from the entries. A later entry replaces an earlier
     * entry with an equal key.
     */
    public static <K, V> IMaterializer<Map.Entry<? extends K, ? extends V>, Map<K, V>> toMap() {

        return putAll((Map<K, V>) new HashMap<K, V>());

    }

    /**
     * A {@link TreeMap} from the entries in the natural order of the keys. A
     * later entry replaces an earlier entry with an equal key.
     */
    public static <K, V> IMaterializer<Map.Entry<? extends K, ? extends V>, SortedMap<K, V>> toSortedMap() {

        return putAll((SortedMap<K, V>) new TreeMap<K, V>());

    }

    private static <K, V, M extends Map<K, V>> IMaterializer<Map.Entry<? extends K, ? extends V>, M> putAll(
            final M target) {

        return new IMaterializer<Map.Entry<? extends K, ? extends V>, M>() {

            public void accept(final Map.Entry<? extends K, ? extends V> e) {

                target.put(e.getKey(), e.getValue());

            }

            public M finish() {

                return target;

            }

        };

    }

    /**
     * The {@link String#valueOf(Object) string values} of the elements
     * separated by the delimiter.
     */
    public static IMaterializer<Object, String> joining(
            final CharSequence delimiter) {

        if (delimiter == null)
            throw new IllegalArgumentException();

        return new IMaterializer<Object, String>() {

            private final StringBuilder sb = new StringBuilder();

            private boolean first = true;

            public void accept(final Object e) {

                if (!first)
                    sb.append(delimiter);

                sb.append(e);

                first = false;

            }

            public String finish() {

                return sb.toString();

            }

        };

    }

}
