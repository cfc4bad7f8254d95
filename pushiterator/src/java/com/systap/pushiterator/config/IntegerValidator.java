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
package com.systap.pushiterator.config;

/**
 * Base impl for {@link Integer}.
 */
public class IntegerValidator implements IValidator<Integer> {

    /**
     * Allows all values.
     */
    public static final transient IValidator<Integer> DEFAULT = new IntegerValidator();

    /**
     * Only allows positive values (GT ZERO).
     */
    public static final transient IValidator<Integer> GT_ZERO = new IntegerValidator() {

        public void accept(final String key, final String val, final Integer arg) {

            if (arg <= 0)
                throw new ConfigurationException(key, val, "Must be positive");

        }

    };

    protected IntegerValidator() {

    }

    public Integer parse(final String key, final String val) {

        try {

            return Integer.valueOf(val.trim());

        } catch (NumberFormatException ex) {

            throw new ConfigurationException(key, val, "Not an integer", ex);

        }

    }

    /**
     * Accepts all values by default.
     */
    public void accept(final String key, final String val, final Integer arg)
            throws ConfigurationException {

    }

}
