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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import junit.framework.TestCase;

import org.postgresql.pointers.sqlgen.Lexicals.Identifier.Simple;

import static java.util.Arrays.asList;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.CoreMatchers.is;

public class InsertStatementTest extends TestCase
{
	public InsertStatementTest(String name) { super(name); }

	private static Map<String,Object> row(Object id, Object table)
	{
		Map<String,Object> m = new LinkedHashMap<>();
		m.put("id", id);
		m.put("table", table);
		return m;
	}

	public void testOnConflictClauses() throws Exception
	{
		assertEquals(" on conflict do nothing", OnConflict.doNothing().sql());
		assertEquals(" on conflict (\"table\") do nothing",
			OnConflict.doNothing("table").sql());
		assertEquals(" on conflict (\"a\", \"B\") do nothing",
			OnConflict.doNothing("a", "B").sql());
	}

	public void testMultiRow() throws Exception
	{
		InsertStatement s = InsertStatement.of(Simple.from("pointers_table"),
			asList(row(1, "a"), row(2, "b")), OnConflict.doNothing("table"));
		assertEquals(
			"insert into \"pointers_table\" (\"id\", \"table\")" +
			" values (?, ?), (?, ?) on conflict (\"table\") do nothing",
			s.sql());
		assertThat(asList(s.args()), is(asList(1, "a", 2, "b")));
	}

	public void testRowsMustAgree() throws Exception
	{
		Map<String,Object> odd = new LinkedHashMap<>();
		odd.put("id", 3);
		try
		{
			InsertStatement.of(Simple.from("t"), asList(row(1, "a"), odd),
				OnConflict.doNothing());
			fail("rows with different columns were accepted");
		}
		catch ( IllegalArgumentException e )
		{
		}
	}

	public void testNoRows() throws Exception
	{
		try
		{
			InsertStatement.of(Simple.from("t"), List.of(), OnConflict.doNothing());
			fail("an empty insert was accepted");
		}
		catch ( IllegalArgumentException e )
		{
		}
	}
}
