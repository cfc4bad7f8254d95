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

import junit.framework.TestCase;

/**
 * Unit tests for {@link StepResult}.
 */
public class TestStepResult extends TestCase {

    public TestStepResult() {
    }

    public TestStepResult(String name) {
        super(name);
    }

    public void test_proceed() {

        final StepResult<String> r = StepResult.proceed("a");

        assertFalse(r.isStop());
        assertTrue(r.isContinue());
        assertEquals("a", r.get());
        assertEquals("Continue(a)", r.toString());

    }

    public void test_stop() {

        final StepResult<String> r = StepResult.stop("b");

        assertTrue(r.isStop());
        assertFalse(r.isContinue());
        assertEquals("b", r.get());
        assertEquals("Stop(b)", r.toString());

    }

    public void test_null_values() {

        assertNull(StepResult.proceed(null).get());
        assertNull(StepResult.stop(null).get());
        assertTrue(StepResult.stop(null).isStop());

        // shared instance.
        assertSame(StepResult.proceed(null), StepResult.proceed(null));

    }

    public void test_equals() {

        assertEquals(StepResult.proceed(1), StepResult.proceed(1));
        assertEquals(StepResult.stop(1), StepResult.stop(1));
        assertEquals(StepResult.stop(1).hashCode(), StepResult.stop(1)
                .hashCode());
        assertEquals(StepResult.stop(null), StepResult.stop(null));

        assertFalse(StepResult.proceed(1).equals(StepResult.stop(1)));
        assertFalse(StepResult.proceed(1).equals(StepResult.proceed(2)));
        assertFalse(StepResult.proceed(null).equals(StepResult.stop(null)));
        assertFalse(StepResult.proceed(1).equals(Integer.valueOf(1)));

    }

}
