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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Map;

import org.postgresql.pointers.sqlgen.Lexicals.Identifier.Simple;

/**
 * A {@link SqlRepository} that runs nothing, recording each statement in
 * order and answering queries from a script.
 */
public class RecordingRepository implements SqlRepository
{
	private final List<String> m_statements = new ArrayList<>();
	private final List<Object[]> m_args = new ArrayList<>();
	private final Deque<List<?>> m_answers = new ArrayDeque<>();
	private int m_updateCount = 1;

	/**
	 * Queue the result of the next query not yet answered.
	 */
	public RecordingRepository answer(List<?> rows)
	{
		m_answers.add(rows);
		return this;
	}

	/**
	 * What every update and insert reports as its row count.
	 */
	public RecordingRepository updateCount(int n)
	{
		m_updateCount = n;
		return this;
	}

	public List<String> statements()
	{
		return m_statements;
	}

	public Object[] args(int i)
	{
		return m_args.get(i);
	}

	public String last()
	{
		return m_statements.get(m_statements.size() - 1);
	}

	/**
	 * The statements that are not queries.
	 */
	public List<String> changes()
	{
		List<String> changes = new ArrayList<>();
		for ( String s : m_statements )
			if ( ! s.startsWith("select") )
				changes.add(s);
		return changes;
	}

	public void clear()
	{
		m_statements.clear();
		m_args.clear();
	}

	@Override
	public void execute(String sql)
	{
		record(sql);
	}

	@Override
	public int update(String sql, Object... args)
	{
		record(sql, args);
		return m_updateCount;
	}

	@Override
	@SuppressWarnings("unchecked")
	public <T> List<T> queryForList(
		String sql, Class<T> elementType, Object... args)
	{
		record(sql, args);
		List<?> rows = m_answers.poll();
		if ( null == rows )
			return new ArrayList<>();
		for ( Object o : rows )
			elementType.cast(o);
		return (List<T>)rows;
	}

	@Override
	@SuppressWarnings("unchecked")
	public List<Map<String, Object>> queryForRows(String sql, Object... args)
	{
		record(sql, args);
		List<?> rows = m_answers.poll();
		if ( null == rows )
			return new ArrayList<>();
		return (List<Map<String, Object>>)rows;
	}

	@Override
	public int insertAll(
		Simple table, List<Map<String, Object>> rows, OnConflict onConflict)
	{
		InsertStatement insert = InsertStatement.of(table, rows, onConflict);
		record(insert.sql(), insert.args());
		return m_updateCount;
	}

	private void record(String sql, Object... args)
	{
		m_statements.add(sql);
		m_args.add(Arrays.copyOf(args, args.length));
	}
}
