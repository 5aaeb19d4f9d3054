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

/**
 * Thrown when a table, named directly or through a schema class, has no
 * entry in the table registry where one is required.
 */
public class UnknownTableException extends RuntimeException
{
	private static final long serialVersionUID = -1720917270734520428L;

	private final String m_table;

	public UnknownTableException(String table)
	{
		this(table, "table " + table
			+ " does not participate in the pointers abstraction");
	}

	public UnknownTableException(String table, String message)
	{
		super(message);
		m_table = table;
	}

	/**
	 * The table name that could not be resolved, or the schema class name
	 * when the class carried no table name at all.
	 */
	public String getTable()
	{
		return m_table;
	}
}
