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

import java.util.ArrayList;
import java.util.List;

import org.postgresql.pointers.sqlgen.Lexicals;
import org.postgresql.pointers.sqlgen.Lexicals.Identifier.Simple;

import static java.util.stream.Collectors.joining;

/**
 * An index on the pointer tables, named {@code <table>_<columns>_index}.
 */
final class IndexDefinition
{
	private final Simple m_table;
	private final List<Simple> m_columns;
	private final boolean m_unique;
	private final Simple m_name;

	private IndexDefinition(Simple table, boolean unique, String... columns)
	{
		m_table = table;
		m_unique = unique;
		m_columns = new ArrayList<>();
		StringBuilder name = new StringBuilder(table.name());
		for ( String c : columns )
		{
			Simple column = Simple.fromJava(c);
			m_columns.add(column);
			name.append('_').append(column.name());
		}
		name.append("_index");
		m_name = Simple.from(Lexicals.truncate(name.toString()));
	}

	static IndexDefinition unique(Simple table, String... columns)
	{
		return new IndexDefinition(table, true, columns);
	}

	static IndexDefinition of(Simple table, String... columns)
	{
		return new IndexDefinition(table, false, columns);
	}

	Simple name()
	{
		return m_name;
	}

	String createSql()
	{
		return "create " + (m_unique ? "unique " : "") + "index if not exists "
			+ m_name.deparse() + " on " + m_table.deparse()
			+ m_columns.stream().map(Simple::deparse)
				.collect(joining(", ", " (", ")"));
	}

	String dropSql()
	{
		return "drop index if exists " + m_name.deparse();
	}
}
