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

import org.postgresql.pointers.sqlgen.Lexicals.Identifier.Simple;

import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;
import static java.util.stream.Collectors.toList;
import static org.apache.commons.lang3.StringUtils.isNotBlank;
import static org.postgresql.pointers.sqlgen.Lexicals.literal;

/**
 * The columns of a table being created by a migration, collected by the body
 * passed to {@link PointerMigration#createPointableTable
 * createPointableTable} and its siblings.
 */
public final class TableDefinition
{
	private final Simple m_name;
	private final TableOptions m_options;
	private final List<ColumnDefinition> m_columns = new ArrayList<>();

	public TableDefinition(Simple name, TableOptions options)
	{
		m_name = requireNonNull(name);
		m_options = requireNonNull(options);
	}

	/**
	 * Add a column of the given SQL type.
	 */
	public ColumnDefinition add(String column, String type)
	{
		return add(new ColumnDefinition(Simple.fromJava(column), type, null));
	}

	/**
	 * Add a column referencing another table.
	 */
	public ColumnDefinition add(String column, Reference reference)
	{
		return add(new ColumnDefinition(
			Simple.fromJava(column), reference.type(), reference));
	}

	private ColumnDefinition add(ColumnDefinition column)
	{
		for ( ColumnDefinition c : m_columns )
			if ( c.name().equals(column.name()) )
				throw new IllegalArgumentException(
					"column " + column.name() + " already defined in "
					+ m_name);
		m_columns.add(column);
		return column;
	}

	public Simple name()
	{
		return m_name;
	}

	/**
	 * The statements that create the table: {@code create table if not
	 * exists}, then any comment.
	 */
	public List<String> createStatements()
	{
		if ( m_columns.isEmpty() )
			throw new IllegalStateException("table " + m_name + " has no columns");

		List<ColumnDefinition> keys = m_columns.stream()
			.filter(ColumnDefinition::isPrimaryKey).collect(toList());
		boolean inline = 1 == keys.size();

		List<String> parts = new ArrayList<>();
		for ( ColumnDefinition c : m_columns )
			parts.add(c.sql(inline));
		if ( keys.size() > 1 )
			parts.add(keys.stream().map(c -> c.name().deparse())
				.collect(joining(", ", "primary key (", ")")));

		StringBuilder sb = new StringBuilder("create table if not exists ")
			.append(m_name.deparse())
			.append(parts.stream().collect(joining(",\n\t", " (\n\t", "\n)")));
		if ( isNotBlank(m_options.storage()) )
			sb.append(' ').append(m_options.storage());

		List<String> statements = new ArrayList<>();
		statements.add(sb.toString());
		if ( null != m_options.comment() )
			statements.add("comment on table " + m_name.deparse() + " is "
				+ literal(m_options.comment()));
		return statements;
	}
}
