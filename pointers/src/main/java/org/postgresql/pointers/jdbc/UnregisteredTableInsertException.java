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
package org.postgresql.pointers.jdbc;

import java.util.regex.Pattern;

import org.springframework.dao.DataIntegrityViolationException;

/**
 * An insert was attempted into a table that has the pointer trigger but no
 * row in the table registry, and the trigger aborted the transaction.
 *<p>
 * This is a migration-ordering mistake (a table given the trigger without
 * going through registration), never a condition to recover from.
 */
public class UnregisteredTableInsertException
extends DataIntegrityViolationException
{
	private static final long serialVersionUID = 3592160813358735122L;

	/**
	 * The SQLSTATE of a PL/pgSQL {@code raise exception} without an explicit
	 * code.
	 */
	public static final String RAISE_EXCEPTION = "P0001";

	/**
	 * Message raised by the trigger function, with the table name as its
	 * only placeholder (PL/pgSQL {@code %} style).
	 */
	public static final String TRIGGER_MESSAGE =
		"Table % does not participate in the pointers abstraction";

	/**
	 * Recognizes {@link #TRIGGER_MESSAGE} in a server error, capturing the
	 * table name in group {@code table}.
	 */
	public static final Pattern TRIGGER_MESSAGE_PATTERN = Pattern.compile(
		"Table (?<table>.+?) does not participate in the pointers abstraction"
	);

	private final String m_table;

	public UnregisteredTableInsertException(
		String message, String table, Throwable cause)
	{
		super(message, cause);
		m_table = table;
	}

	/**
	 * The table the insert was refused for.
	 */
	public String getTable()
	{
		return m_table;
	}
}
