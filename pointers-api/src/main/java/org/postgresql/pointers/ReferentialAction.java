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
 * The actions a foreign key can take when the referenced row is deleted or
 * its key updated.
 */
public enum ReferentialAction
{
	CASCADE("cascade"),
	SET_NULL("set null"),
	RESTRICT("restrict");

	private final String m_sql;

	ReferentialAction(String sql)
	{
		m_sql = sql;
	}

	/**
	 * The action as written in a {@code references} clause.
	 */
	public String sql()
	{
		return m_sql;
	}
}
