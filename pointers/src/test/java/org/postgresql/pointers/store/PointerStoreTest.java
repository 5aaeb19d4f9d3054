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
package org.postgresql.pointers.store;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import junit.framework.TestCase;

import org.postgresql.pointers.Pointer;
import org.postgresql.pointers.Ulid;
import org.postgresql.pointers.config.PointerSettings;
import org.postgresql.pointers.jdbc.RecordingRepository;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.MatcherAssert.assertThat;

public class PointerStoreTest extends TestCase
{
	public PointerStoreTest(String name) { super(name); }

	private RecordingRepository m_repo;
	private PointerStore m_store;

	@Override
	protected void setUp() throws Exception
	{
		m_repo = new RecordingRepository();
		m_store = new PointerStore(m_repo, PointerSettings.defaults());
	}

	public void testCreateIgnoresConflict() throws Exception
	{
		Ulid id = Ulid.generate();
		Ulid table = Ulid.generate();
		assertTrue(m_store.create(id, table));
		assertEquals(
			"insert into \"pointers_pointer\" (\"id\", \"table_id\")" +
			" values (?, ?) on conflict do nothing", m_repo.last());

		m_repo.updateCount(0);
		assertFalse(m_store.create(id, table));
	}

	public void testRepoint() throws Exception
	{
		Ulid id = Ulid.generate();
		Ulid table = Ulid.generate();
		assertTrue(m_store.repoint(id, table));
		assertEquals("update \"pointers_pointer\" set \"table_id\" = ?" +
			" where \"id\" = ?", m_repo.last());
		assertEquals(table, m_repo.args(0)[0]);
		assertEquals(id, m_repo.args(0)[1]);
	}

	public void testFindAttachesTable() throws Exception
	{
		Ulid id = Ulid.generate();
		Ulid table = Ulid.generate();
		Map<String,Object> row = new HashMap<>();
		row.put("id", id.dump());
		row.put("table_id", table.dump());
		row.put("table", "widgets");
		m_repo.answer(List.of(row));

		Optional<Pointer> p = m_store.find(id);
		assertTrue(p.isPresent());
		assertEquals(id, p.get().getId());
		assertEquals(table, p.get().getTableId());
		assertEquals("widgets", p.get().getTable().get().getTable());
		assertThat(m_repo.last(), containsString("left join \"pointers_table\""));
	}

	public void testFindMissing() throws Exception
	{
		assertFalse(m_store.find(Ulid.generate()).isPresent());
	}

	public void testCount() throws Exception
	{
		m_repo.answer(List.of(3L));
		assertEquals(3L, m_store.count(Ulid.generate()));
		assertEquals(0L, m_store.count(Ulid.generate()));
	}
}
