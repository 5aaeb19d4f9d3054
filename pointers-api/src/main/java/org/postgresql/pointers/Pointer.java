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
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * A row of the pointer table: a global foreign key standing for one row of
 * some participating table.
 *<p>
 * The pointer's identifier is the identifier of the row it stands for, and
 * its table identifier names, through the registry, the table that row lives
 * in. Pointers are only ever created by the insert trigger.
 */
public final class Pointer implements Serializable
{
	private static final long serialVersionUID = -5017442250843163359L;

	private final Ulid m_id;
	private final Ulid m_tableId;
	private final Table m_table;

	public Pointer(Ulid id, Ulid tableId)
	{
		this(id, tableId, null);
	}

	/**
	 * @param table the registry row for {@code tableId}, when it was loaded
	 * along with the pointer; may be null
	 */
	public Pointer(Ulid id, Ulid tableId, Table table)
	{
		m_id = requireNonNull(id);
		m_tableId = requireNonNull(tableId);
		if ( null != table && ! tableId.equals(table.getId()) )
			throw new IllegalArgumentException(
				"table " + table + " does not have id " + tableId);
		m_table = table;
	}

	public Ulid getId()
	{
		return m_id;
	}

	public Ulid getTableId()
	{
		return m_tableId;
	}

	/**
	 * The registry row of the owning table, if it was loaded.
	 */
	public Optional<Table> getTable()
	{
		return Optional.ofNullable(m_table);
	}

	@Override
	public boolean equals(Object other)
	{
		if ( this == other )
			return true;
		if ( ! (other instanceof Pointer) )
			return false;
		Pointer o = (Pointer)other;
		return m_id.equals(o.m_id) && m_tableId.equals(o.m_tableId);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(m_id, m_tableId);
	}

	@Override
	public String toString()
	{
		return "Pointer[" + m_id + " -> "
			+ (null == m_table ? m_tableId.toString() : m_table.getTable())
			+ "]";
	}
}
