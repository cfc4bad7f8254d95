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
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import junit.framework.TestCase;

import com.systap.pushiterator.Fixtures.Constant;
import com.systap.pushiterator.Fixtures.CountingPredicate;
import com.systap.pushiterator.Fixtures.EqualTo;
import com.systap.pushiterator.Fixtures.GreaterThan;
import com.systap.pushiterator.Fixtures.LessThan;
import com.systap.pushiterator.Fixtures.Recorder;

/**
 * Unit tests for the terminal operations. Most run against a generator
 * source so that the traversing defaults are exercised.
 */
public class TestDerivedOperations extends TestCase {

    public TestDerivedOperations() {
    }

    public TestDerivedOperations(String name) {
        super(name);
    }

    private static IInternalIterator<Integer> gen(final Integer... a) {

        return Fixtures.generate(Arrays.asList(a));

    }

    public void test_forEach() {

        final Recorder<Integer> recorder = new Recorder<Integer>();

        gen(3, 1, 2).forEach(recorder);

        assertEquals(Fixtures.ints(3, 1, 2), recorder.seen);

    }

    public void test_fold() {

        final int sum = gen(1, 2, 3, 4, 5, 6).filter(new GreaterThan(3))
                .fold(0, new IFold<Integer, Integer>() {

                    public Integer apply(final Integer acc, final Integer e) {
                        return acc + e;
                    }

                });

        assertEquals(15, sum);

    }

    /**
     * The accumulator of a fold may have a different type than the elements.
     */
    public void test_fold_differentType() {

        final StringBuilder sb = gen(1, 2, 3).fold(new StringBuilder(),
                new IFold<StringBuilder, Object>() {

                    public StringBuilder apply(final StringBuilder acc,
                            final Object e) {
                        return acc.append(e);
                    }

                });

        assertEquals("123", sb.toString());

    }

    public void test_count() {

        assertEquals(0L, gen().count());

        assertEquals(3L, gen(1, 2, 3).count());

        assertEquals(2L, gen(1, 2, 3, 4).filter(new GreaterThan(2)).count());

    }

    public void test_nth() {

        assertEquals(Optional.of(7), gen(7).nth(0));

        assertEquals(Optional.<Integer> empty(), gen(7).nth(1));

        assertEquals(Optional.of(3), gen(1, 2, 3, 4).nth(2));

        assertEquals(Optional.<Integer> empty(), gen().nth(0));

    }

    public void test_nth_negative() {

        try {
            gen(1).nth(-1);
            fail("Expecting: " + IllegalArgumentException.class);
        } catch (IllegalArgumentException ex) {
            // ignore
        }

    }

    /**
     * No element beyond the requested index is produced.
     */
    public void test_nth_stopsAtIndex() {

        final List<Integer> produced = new ArrayList<Integer>();

        assertEquals(Optional.of(20), Fixtures.recording(
                Fixtures.ints(10, 20, 30, 40), produced).nth(1));

        assertEquals(Fixtures.ints(10, 20), produced);

    }

    public void test_first_last() {

        assertEquals(Optional.of(4), gen(4, 5, 6).first());

        assertEquals(Optional.of(6), gen(4, 5, 6).last());

        assertEquals(Optional.<Integer> empty(), gen().first());

        assertEquals(Optional.<Integer> empty(), gen().last());

    }

    public void test_find() {

        assertEquals(Optional.of(3), gen(1, 2, 3, 4).find(new GreaterThan(2)));

        assertEquals(Optional.<Integer> empty(), gen(1, 2).find(
                new GreaterThan(2)));

    }

    public void test_find_shortCircuits() {

        final CountingPredicate<Integer> p = new CountingPredicate<Integer>(
                new EqualTo<Integer>(2));

        gen(1, 2, 3, 4).find(p);

        assertEquals(2, p.ncalls);

    }

    public void test_findMap() {

        final IFunction<String, Optional<Integer>> parse = new IFunction<String, Optional<Integer>>() {

            public Optional<Integer> apply(final String s) {

                try {
                    return Optional.of(Integer.parseInt(s));
                } catch (NumberFormatException ex) {
                    return Optional.empty();
                }

            }

        };

        assertEquals(Optional.of(12), InternalIterators.of("a", "12", "b",
                "7").findMap(parse));

        assertEquals(Optional.<Integer> empty(), InternalIterators.of("a",
                "b").findMap(parse));

    }

    public void test_position() {

        assertEquals(Optional.of(2L), gen(5, 6, 7, 8).position(
                new EqualTo<Integer>(7)));

        assertEquals(Optional.<Long> empty(), gen(5, 6).position(
                new EqualTo<Integer>(7)));

    }

    public void test_any() {

        assertTrue(gen(1, 2, 3).any(new GreaterThan(2)));

        assertFalse(gen(1, 2, 3).any(new GreaterThan(3)));

        assertFalse(gen().any(new Constant<Integer>(true)));

        final CountingPredicate<Integer> p = new CountingPredicate<Integer>(
                new GreaterThan(0));

        assertTrue(gen(1, 2, 3).any(p));

        assertEquals(1, p.ncalls);

    }

    public void test_all() {

        assertTrue(gen(1, 2, 3).all(new LessThan(4)));

        assertFalse(gen(1, 2, 3).all(new LessThan(3)));

        assertTrue(gen().all(new Constant<Integer>(false)));

        final CountingPredicate<Integer> p = new CountingPredicate<Integer>(
                new LessThan(0));

        assertFalse(gen(1, 2, 3).all(p));

        assertEquals(1, p.ncalls);

    }

    /**
     * Compares only the first component of a pair.
     */
    private static final Comparator<int[]> byFirst = new Comparator<int[]>() {

        public int compare(final int[] a, final int[] b) {

            return a[0] < b[0] ? -1 : a[0] > b[0] ? 1 : 0;

        }

    };

    /**
     * Of equal elements, min reports the first and max reports the last.
     */
    public void test_min_max_ties() {

        final int[] a = new int[] { 1, 0 };
        final int[] b = new int[] { 3, 1 };
        final int[] c = new int[] { 1, 2 };
        final int[] d = new int[] { 3, 3 };

        assertSame(a, InternalIterators.of(a, b, c, d).min(byFirst).get());

        assertSame(d, InternalIterators.of(a, b, c, d).max(byFirst).get());

        assertFalse(InternalIterators.<int[]> empty().min(byFirst)
                .isPresent());

        assertFalse(InternalIterators.<int[]> empty().max(byFirst)
                .isPresent());

    }

    public void test_minByKey_maxByKey() {

        final IFunction<IndexedValue<Integer>, Integer> value = new IFunction<IndexedValue<Integer>, Integer>() {

            public Integer apply(final IndexedValue<Integer> e) {
                return e.getValue();
            }

        };

        assertEquals(new IndexedValue<Integer>(3, 2), gen(3, 5, 5, 2)
                .enumerate().minByKey(value).get());

        assertEquals(new IndexedValue<Integer>(2, 5), gen(3, 5, 5, 2)
                .enumerate().maxByKey(value).get());

    }

    /**
     * The key function is called exactly once per element.
     */
    public void test_byKey_keyCalledOncePerElement() {

        final Fixtures.RecordingFunction<String, Integer> length = new Fixtures.RecordingFunction<String, Integer>(
                new IFunction<String, Integer>() {

                    public Integer apply(final String s) {
                        return s.length();
                    }

                });

        assertEquals(Optional.of("ccc"), InternalIterators.of("bb", "a",
                "ccc", "dd").maxByKey(length));

        assertEquals(Arrays.asList("bb", "a", "ccc", "dd"), length.args);

    }

    public void test_collect() {

        assertEquals(Fixtures.ints(2, 4, 6), gen(1, 2, 3).map(
                new Fixtures.Times(2)).collect(
                Materializers.<Integer> toList()));

    }

    public void test_nullArguments() {

        try {
            gen(1).forEach(null);
            fail("Expecting: " + IllegalArgumentException.class);
        } catch (IllegalArgumentException ex) {
            // ignore
        }

        try {
            gen(1).find(null);
            fail("Expecting: " + IllegalArgumentException.class);
        } catch (IllegalArgumentException ex) {
            // ignore
        }

        try {
            gen(1).min(null);
            fail("Expecting: " + IllegalArgumentException.class);
        } catch (IllegalArgumentException ex) {
            // ignore
        }

        try {
            gen(1).collect(null);
            fail("Expecting: " + IllegalArgumentException.class);
        } catch (IllegalArgumentException ex) {
            // ignore
        }

    }

}
