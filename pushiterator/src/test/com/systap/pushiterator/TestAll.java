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

import junit.framework.Test;
import junit.framework.TestCase;
import junit.framework.TestSuite;

import org.apache.log4j.Level;
import org.apache.log4j.Logger;

/**
 * Aggregates test suites into increasing dependency order.
 */
public class TestAll extends TestCase {

    public TestAll() {
    }

    public TestAll(String arg0) {
        super(arg0);
    }

    public static Test suite() {

        /*
         * Debug logging from the adapters is verbose, so default the level to
         * WARN unless a log4j configuration says otherwise.
         */
        {

            final Logger log = Logger.getRootLogger();

            if (Level.DEBUG.equals(log.getLevel())) {

                log.setLevel(Level.WARN);

                log.warn("Defaulting debugging level to WARN for the unit tests");

            }

        }

        final TestSuite suite = new TestSuite("pushiterator");

        suite.addTest(com.systap.pushiterator.config.TestAll.suite());

        suite.addTestSuite(TestStepResult.class);

        // sources and the primitive.
        suite.addTestSuite(TestPrimitiveTraversal.class);

        // terminal operations.
        suite.addTestSuite(TestDerivedOperations.class);

        suite.addTestSuite(TestAdapters.class);

        // count, nth and last without a traversal.
        suite.addTestSuite(TestSpecializations.class);

        suite.addTestSuite(TestSingleUse.class);

        suite.addTestSuite(TestMaterializers.class);

        return suite;

    }

}
