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

import java.util.AbstractMap;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;

import junit.framework.TestCase;

/**
 * Unit tests for {@link Materializers}.
 */
public class TestMaterializers extends TestCase {

    public TestMaterializers() {
    }

    public TestMaterializers(String name) {
        super(name);
    }

    public void test_toList() {

        final List<Integer> expected = Fixtures.ints(3, 1, 3, 2);

        assertEquals(expected, InternalIterators.of(expected).collect(
                Materializers.<Integer> toList()));

        assertTrue(InternalIterators.<Integer> empty().collect(
                Materializers.<Integer> toList()).isEmpty());

    }

    public void test_toSet() {

        final Set<Integer> actual = InternalIterators.of(3, 1, 3, 2).collect(
                Materializers.<Integer> toSet());

        assertEquals(new HashSet<Integer>(Arrays.asList(1, 2, 3)), actual);

    }

    public void test_toSortedSet() {

        final SortedSet<Integer> actual = InternalIterators.of(3, 1, 3, 2)
                .collect(Materializers.<Integer> toSortedSet());

        assertEquals(Fixtures.ints(1, 2, 3), Fixtures
                .toList(InternalIterators.of(actual)));

    }

    public void test_toSortedSet_comparator() {

        final SortedSet<Integer> actual = InternalIterators.of(3, 1, 3, 2)
                .collect(
                        Materializers.<Integer> toSortedSet(Collections
                                .<Integer> reverseOrder()));

        assertEquals(Integer.valueOf(3), actual.first());

        assertEquals(Integer.valueOf(1), actual.last());

    }

    public void test_into() {

        final LinkedList<Object> target = new LinkedList<Object>();

        target.add("x");

        final LinkedList<Object> actual = InternalIterators.of(1, 2).collect(
                Materializers.<Integer, LinkedList<Object>> into(target));

        assertSame(target, actual);

        assertEquals(Arrays.<Object> asList("x", 1, 2), actual);

    }

    /**
     * A later entry replaces an earlier entry with the same key.
     */
    public void test_toMap() {

        final Map<String, Integer> actual = InternalIterators.of(
                entry("a", 1), entry("b", 2), entry("a", 3)).collect(
                Materializers.<String, Integer> toMap());

        assertEquals(2, actual.size());

        assertEquals(Integer.valueOf(3), actual.get("a"));

        assertEquals(Integer.valueOf(2), actual.get("b"));

    }

    public void test_toSortedMap() {

        final SortedMap<String, Integer> actual = InternalIterators.of(
                entry("c", 1), entry("a", 2), entry("b", 3)).collect(
                Materializers.<String, Integer> toSortedMap());

        assertEquals(Arrays.asList("a", "b", "c"), Fixtures
                .toList(InternalIterators.of(actual.keySet())));

    }

    /**
     * Entries produced by {@link IInternalIterator#enumerate()} and a map.
     */
    public void test_toMap_fromPipeline() {

        final IFunction<IndexedValue<String>, Map.Entry<String, Long>> swap = new IFunction<IndexedValue<String>, Map.Entry<String, Long>>() {

            public Map.Entry<String, Long> apply(final IndexedValue<String> e) {
                return new AbstractMap.SimpleImmutableEntry<String, Long>(e
                        .getValue(), e.getIndex());
            }

        };

        final Map<String, Long> actual = InternalIterators.of("x", "y")
                .enumerate().map(swap).collect(
                        Materializers.<String, Long> toMap());

        assertEquals(Long.valueOf(0L), actual.get("x"));

        assertEquals(Long.valueOf(1L), actual.get("y"));

    }

    public void test_joining() {

        assertEquals("1, 2, 3", InternalIterators.of(1, 2, 3).collect(
                Materializers.joining(", ")));

        assertEquals("", InternalIterators.empty().collect(
                Materializers.joining(", ")));

        assertEquals("a", InternalIterators.of("a").collect(
                Materializers.joining(", ")));

    }

    public void test_nullArguments() {

        try {
            Materializers.joining(null);
            fail("Expecting: " + IllegalArgumentException.class);
        } catch (IllegalArgumentException ex) {
            // ignore
        }

        try {
            Materializers.<Integer, List<Integer>> into(null);
            fail("Expecting: " + IllegalArgumentException.class);
        } catch (IllegalArgumentException ex) {
            // ignore
        }

    }

    public void test_initialCapacity() {

        assertTrue(Materializers.initialCapacity > 0);

    }

    private static Map.Entry<String, Integer> entry(final String k,
            final int v) {

        return new AbstractMap.SimpleImmutableEntry<String, Integer>(k, v);

    }

}
