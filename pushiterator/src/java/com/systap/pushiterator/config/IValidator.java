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
 * Parses and validates the value of a configuration property.
 * 
 * @param <E>
 *            The generic type of the parsed value.
 */
public interface IValidator<E> {

    /**
     * Convert the string value of the property.
     * 
     * @param key
     *            The property name.
     * @param val
     *            The property value (never <code>null</code>).
     * 
     * @throws ConfigurationException
     *             if the value can not be parsed.
     */
    public E parse(String key, String val) throws ConfigurationException;

    /**
     * Validate the parsed value.
     * 
     * @param key
     *            The property name.
     * @param val
     *            The property value.
     * @param arg
     *            The parsed value.
     * 
     * @throws ConfigurationException
     *             if the value is not acceptable.
     */
    public void accept(String key, String val, E arg)
            throws ConfigurationException;

}
