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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.postgresql.pointers.sqlgen.Lexicals.Identifier.Simple;

import static java.util.stream.Collectors.joining;

/**
 * A multi-row {@code insert ... values} statement with its parameters in
 * binding order.
 */
public final class InsertStatement
{
	private final String m_sql;
	private final Object[] m_args;

	private InsertStatement(String sql, Object[] args)
	{
		m_sql = sql;
		m_args = args;
	}

	/**
	 * @throws IllegalArgumentException if there are no rows, or the rows do
	 * not all have the same columns
	 */
	public static InsertStatement of(
		Simple table, List<Map<String, Object>> rows, OnConflict onConflict)
	{
		if ( rows.isEmpty() )
			throw new IllegalArgumentException("no rows to insert");
		Set<String> columns = rows.get(0).keySet();
		if ( columns.isEmpty() )
			throw new IllegalArgumentException("no columns to insert");

		List<Object> args = new ArrayList<>();
		for ( Map<String, Object> row : rows )
		{
			if ( ! columns.equals(row.keySet()) )
				throw new IllegalArgumentException(
					"rows to insert into " + table + " differ in columns: "
					+ columns + ", " + row.keySet());
			for ( String c : columns )
				args.add(row.get(c));
		}

		String tuple = String.join(", ",
			Collections.nCopies(columns.size(), "?"));
		String sql = "insert into " + table.deparse()
			+ columns.stream().map(c -> Simple.fromJava(c).deparse())
				.collect(joining(", ", " (", ")"))
			+ " values "
			+ String.join(", ", Collections.nCopies(rows.size(),
				"(" + tuple + ")"))
			+ onConflict.sql();
		return new InsertStatement(sql, args.toArray());
	}

	public String sql()
	{
		return m_sql;
	}

	public Object[] args()
	{
		return m_args.clone();
	}
}
