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

import java.util.List;
import java.util.Map;

import org.postgresql.pointers.Ulid;
import org.postgresql.pointers.sqlgen.Lexicals.Identifier.Simple;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcOperations;

import static java.util.Objects.requireNonNull;

/**
 * {@link SqlRepository} over Spring's {@link JdbcOperations}.
 *<p>
 * Statements run on the connection bound to the current Spring transaction,
 * if any, so a migration wrapped in a transaction is applied atomically.
 */
public class JdbcRepository implements SqlRepository
{
	private static final Logger LOG =
		LoggerFactory.getLogger(JdbcRepository.class);

	private final JdbcOperations m_jdbc;

	public JdbcRepository(JdbcOperations jdbc)
	{
		m_jdbc = requireNonNull(jdbc);
	}

	@Override
	public void execute(String sql)
	{
		LOG.debug("execute: {}", sql);
		m_jdbc.execute(sql);
	}

	@Override
	public int update(String sql, Object... args)
	{
		LOG.debug("update: {}", sql);
		return m_jdbc.update(sql, storageForm(args));
	}

	@Override
	public <T> List<T> queryForList(
		String sql, Class<T> elementType, Object... args)
	{
		LOG.debug("query: {}", sql);
		return m_jdbc.queryForList(sql, elementType, storageForm(args));
	}

	@Override
	public List<Map<String, Object>> queryForRows(String sql, Object... args)
	{
		LOG.debug("query: {}", sql);
		return m_jdbc.queryForList(sql, storageForm(args));
	}

	@Override
	public int insertAll(
		Simple table, List<Map<String, Object>> rows, OnConflict onConflict)
	{
		InsertStatement insert = InsertStatement.of(table, rows, onConflict);
		LOG.debug("insert: {}", insert.sql());
		return m_jdbc.update(insert.sql(), storageForm(insert.args()));
	}

	/*
	 * The database only ever sees identifiers as uuid.
	 */
	static Object[] storageForm(Object[] args)
	{
		Object[] bound = args.clone();
		for ( int i = 0; i < bound.length; ++ i )
			if ( bound[i] instanceof Ulid )
				bound[i] = ((Ulid)bound[i]).dump();
		return bound;
	}
}
