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

import java.util.Properties;

import org.apache.log4j.Logger;

/**
 * Resolves the value of a configuration property. The names and defaults of
 * the properties are declared by the <code>Options</code> interfaces of the
 * configured classes. Those classes resolve their options once, against the
 * {@link System#getProperties() system properties}, when they are loaded.
 */
public class Configuration {

    /**
     * Property values are logged at INFO.
     */
    protected static final transient Logger log = Logger.getLogger(Configuration.class);

    private Configuration() {

    }

    /**
     * Return the value for the property, which is either the value given in
     * <i>properties</i> or the caller's default.
     * 
     * @param properties
     *            The properties against which the value will be resolved.
     * @param name
     *            The name of the property.
     * @param defaultValue
     *            The value returned if the property is not set (optional).
     * 
     * @return The resolved value.
     * 
     * @throws IllegalArgumentException
     *             if <i>properties</i> or <i>name</i> is <code>null</code>.
     */
    public static String getProperty(final Properties properties,
            final String name, final String defaultValue) {

        if (properties == null)
            throw new IllegalArgumentException();

        if (name == null)
            throw new IllegalArgumentException();

        // defaultValue MAY be null.

        String val = properties.getProperty(name);

        if (val == null) {

            // no override.
            val = defaultValue;

        }

        if (log.isInfoEnabled())
            log.info(name + "=" + val);

        return val;

    }

    /**
     * Variant converts to the specified generic type and validates the value.
     * 
     * @param properties
     *            The properties against which the value will be resolved.
     * @param name
     *            The name of the property.
     * @param defaultValue
     *            The value used if the property is not set (optional).
     * @param validator
     *            Parses and validates the value.
     * 
     * @return The validated value -or- <code>null</code> if the property was
     *         not set and there was no default.
     * 
     * @throws ConfigurationException
     *             if the value is rejected by the <i>validator</i>.
     */
    public static <E> E getProperty(final Properties properties,
            final String name, final String defaultValue,
            final IValidator<E> validator) throws ConfigurationException {

        if (validator == null)
            throw new IllegalArgumentException();

        final String val = getProperty(properties, name, defaultValue);

        if (val == null)
            return null;

        final E e = validator.parse(name, val);

        validator.accept(name, val, e);

        return e;

    }

}
