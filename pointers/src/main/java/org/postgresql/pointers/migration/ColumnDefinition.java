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

import org.postgresql.pointers.sqlgen.Lexicals.Identifier.Simple;

import static java.util.Objects.requireNonNull;
import static org.apache.commons.lang3.StringUtils.isBlank;

/**
 * One column of a {@link TableDefinition}, refined fluently after
 * {@link TableDefinition#add(String, String) add}.
 */
public final class ColumnDefinition
{
	private final Simple m_name;
	private final String m_type;
	private final Reference m_reference;
	private boolean m_primaryKey;
	private boolean m_notNull;
	private boolean m_unique;
	private String m_default;

	ColumnDefinition(Simple name, String type, Reference reference)
	{
		m_name = requireNonNull(name);
		if ( isBlank(type) )
			throw new IllegalArgumentException(
				"column " + name + " needs a type");
		m_type = type;
		m_reference = reference;
	}

	public ColumnDefinition primaryKey()
	{
		m_primaryKey = true;
		return this;
	}

	public ColumnDefinition notNull()
	{
		m_notNull = true;
		return this;
	}

	public ColumnDefinition unique()
	{
		m_unique = true;
		return this;
	}

	/**
	 * @param expression an SQL expression, emitted verbatim
	 */
	public ColumnDefinition defaultsTo(String expression)
	{
		m_default = expression;
		return this;
	}

	public Simple name()
	{
		return m_name;
	}

	public boolean isPrimaryKey()
	{
		return m_primaryKey;
	}

	/**
	 * The column definition as it appears inside {@code create table}.
	 * @param inlinePrimaryKey whether the column alone is the primary key
	 */
	String sql(boolean inlinePrimaryKey)
	{
		StringBuilder sb = new StringBuilder(m_name.deparse())
			.append(' ').append(m_type);
		if ( m_primaryKey && inlinePrimaryKey )
			sb.append(" primary key");
		else if ( m_notNull )
			sb.append(" not null");
		if ( m_unique )
			sb.append(" unique");
		if ( null != m_default )
			sb.append(" default ").append(m_default);
		if ( null != m_reference )
			sb.append(' ').append(m_reference.sql());
		return sb.toString();
	}
}
