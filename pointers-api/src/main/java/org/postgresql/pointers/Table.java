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

import java.io.Serializable;

import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * A row of the table registry: one table participating in the pointers
 * abstraction, with the identifier that tags its pointers.
 */
public final class Table implements Serializable
{
	private static final long serialVersionUID = 2289513105474813790L;

	/**
	 * The registry identifier of the registry table itself, which is made
	 * pointable when the abstraction is initialised.
	 */
	public static final Ulid TABLE_TABLE_ID =
		Ulid.parse("601NTAB1EP01NTERSTAB1ESTAB");

	private final Ulid m_id;
	private final String m_table;

	public Table(Ulid id, String table)
	{
		m_id = requireNonNull(id);
		m_table = requireNonNull(table);
	}

	public Ulid getId()
	{
		return m_id;
	}

	/**
	 * The table's exact name.
	 */
	public String getTable()
	{
		return m_table;
	}

	@Override
	public boolean equals(Object other)
	{
		if ( this == other )
			return true;
		if ( ! (other instanceof Table) )
			return false;
		Table o = (Table)other;
		return m_id.equals(o.m_id) && m_table.equals(o.m_table);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(m_id, m_table);
	}

	@Override
	public String toString()
	{
		return "Table[" + m_table + ", " + m_id + "]";
	}
}
