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

import java.sql.SQLException;

import java.util.regex.Matcher;

import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.support.SQLExceptionSubclassTranslator;
import org.springframework.jdbc.support.SQLExceptionTranslator;

import static java.util.Objects.requireNonNull;
import static org.postgresql.pointers.jdbc.UnregisteredTableInsertException.RAISE_EXCEPTION;
import static org.postgresql.pointers.jdbc.UnregisteredTableInsertException.TRIGGER_MESSAGE_PATTERN;

/**
 * Translates the pointer trigger's refusal of an insert into an
 * {@link UnregisteredTableInsertException}, and everything else the way the
 * fallback translator does.
 *<p>
 * Install it on the {@code JdbcTemplate} used for application inserts as
 * well as on the one behind the {@link JdbcRepository}.
 */
public class PointerSQLExceptionTranslator implements SQLExceptionTranslator
{
	private final SQLExceptionTranslator m_fallback;

	public PointerSQLExceptionTranslator()
	{
		this(new SQLExceptionSubclassTranslator());
	}

	public PointerSQLExceptionTranslator(SQLExceptionTranslator fallback)
	{
		m_fallback = requireNonNull(fallback);
	}

	@Override
	public DataAccessException translate(
		String task, String sql, SQLException ex)
	{
		for ( Throwable t = ex; null != t; t = t.getCause() )
		{
			if ( ! (t instanceof SQLException) )
				continue;
			SQLException s = (SQLException)t;
			if ( ! RAISE_EXCEPTION.equals(s.getSQLState())
				|| null == s.getMessage() )
				continue;
			Matcher m = TRIGGER_MESSAGE_PATTERN.matcher(s.getMessage());
			if ( m.find() )
				return new UnregisteredTableInsertException(
					task + "; " + m.group(), m.group("table"), ex);
		}
		return m_fallback.translate(task, sql, ex);
	}
}
