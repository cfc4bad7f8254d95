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
 * Strict parser for {@link Boolean} properties. Unlike
 * {@link Boolean#parseBoolean(String)}, anything other than <code>true</code>
 * or <code>false</code> (ignoring case) is rejected rather than read as
 * <code>false</code>.
 */
public class BooleanValidator implements IValidator<Boolean> {

    public static final transient IValidator<Boolean> DEFAULT = new BooleanValidator();

    protected BooleanValidator() {

    }

    public Boolean parse(final String key, final String val) {

        final String s = val.trim();

        if ("true".equalsIgnoreCase(s))
            return Boolean.TRUE;

        if ("false".equalsIgnoreCase(s))
            return Boolean.FALSE;

        throw new ConfigurationException(key, val, "Not a boolean");

    }

    public void accept(final String key, final String val, final Boolean arg)
            throws ConfigurationException {

    }

}
