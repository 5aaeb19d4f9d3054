/*
 * Copyright (c) 2026 Tada AB and other contributors, as listed below.
 *
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the The BSD 3-Clause License
 * which accompanies this distribution, and is available at
 * http://opensource.org/licenses/BSD-3-Clause
 *
 * Contributors:
 *   Tada AB
 */
package org.postgresql.pointers;

import java.util.Arrays;

/**
 * Thrown when a value offered as an identifier is not a well-formed one.
 * Malformed identifiers are never coerced.
 */
public class InvalidIdentifierException extends IllegalArgumentException
{
	private static final long serialVersionUID = 6612418023715566093L;

	private final String m_value;

	public InvalidIdentifierException(Object value, String reason)
	{
		super(String.format("invalid identifier %s: %s",
			describe(value), reason));
		m_value = value instanceof byte[]
			? Arrays.toString((byte[])value) : String.valueOf(value);
	}

	/**
	 * The offending value, as text, without the quoting used in the
	 * message.
	 */
	public String getValue()
	{
		return m_value;
	}

	private static String describe(Object value)
	{
		if ( value instanceof byte[] )
			return Arrays.toString((byte[])value);
		if ( value instanceof CharSequence )
			return "\"" + value + "\"";
		return String.valueOf(value);
	}
}
