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

/**
 * Optional extras for a table created by a migration.
 */
public final class TableOptions
{
	private static final TableOptions NONE = new TableOptions(null, null);

	private final String m_comment;
	private final String m_storage;

	private TableOptions(String comment, String storage)
	{
		m_comment = comment;
		m_storage = storage;
	}

	public static TableOptions none()
	{
		return NONE;
	}

	/**
	 * A comment to record on the table.
	 */
	public TableOptions withComment(String comment)
	{
		return new TableOptions(comment, m_storage);
	}

	/**
	 * Text appended verbatim after the column list, such as
	 * {@code with (fillfactor = 70)}.
	 */
	public TableOptions withStorage(String storage)
	{
		return new TableOptions(m_comment, storage);
	}

	public String comment()
	{
		return m_comment;
	}

	public String storage()
	{
		return m_storage;
	}
}
