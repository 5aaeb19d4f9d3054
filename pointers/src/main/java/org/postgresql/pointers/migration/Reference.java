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
package org.postgresql.pointers.migration;

import org.postgresql.pointers.PointerType;
import org.postgresql.pointers.ReferentialAction;
import org.postgresql.pointers.sqlgen.Lexicals.Identifier.Simple;

import static java.util.Objects.requireNonNull;

/**
 * A foreign key to the {@code id} of another table, with the actions taken
 * when the referenced row is deleted or its key changed.
 *<p>
 * References to the pointer table are normally obtained from
 * {@link PointerMigration#pointer(PointerType) PointerMigration.pointer}.
 */
public final class Reference
{
	private static final Simple ID = Simple.from("id");
	private static final String TYPE = "uuid";

	private final Simple m_table;
	private final ReferentialAction m_onDelete;
	private final ReferentialAction m_onUpdate;

	public Reference(
		Simple table, ReferentialAction onDelete, ReferentialAction onUpdate)
	{
		m_table = requireNonNull(table);
		m_onDelete = requireNonNull(onDelete);
		m_onUpdate = requireNonNull(onUpdate);
	}

	/**
	 * A reference to {@code table} with the actions of a pointer type.
	 */
	public static Reference to(Simple table, PointerType type)
	{
		return new Reference(table, type.onDelete(), type.onUpdate());
	}

	public Simple table()
	{
		return m_table;
	}

	public ReferentialAction onDelete()
	{
		return m_onDelete;
	}

	public ReferentialAction onUpdate()
	{
		return m_onUpdate;
	}

	/**
	 * The column type a referencing column takes.
	 */
	public String type()
	{
		return TYPE;
	}

	/**
	 * The {@code references} clause of a column definition.
	 */
	public String sql()
	{
		return "references " + m_table.deparse() + " (" + ID.deparse() + ")"
			+ " on delete " + m_onDelete.sql()
			+ " on update " + m_onUpdate.sql();
	}

	@Override
	public String toString()
	{
		return sql();
	}
}
