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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.postgresql.pointers.Pointer;
import org.postgresql.pointers.Table;
import org.postgresql.pointers.Ulid;
import org.postgresql.pointers.config.PointerSettings;
import org.postgresql.pointers.jdbc.OnConflict;
import org.postgresql.pointers.jdbc.SqlRepository;
import org.postgresql.pointers.sqlgen.Lexicals.Identifier.Simple;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

/**
 * The central table of pointers, one per row of every participating table.
 *<p>
 * Pointers are created by the insert trigger, which does in SQL what
 * {@link #create create} does here; application code does not create them.
 * There is no delete: pointers go away only by the cascades of the table
 * registry and of the references to them.
 */
public class PointerStore
{
	private static final Logger LOG =
		LoggerFactory.getLogger(PointerStore.class);

	static final String ID = "id";
	static final String TABLE_ID = "table_id";

	private final SqlRepository m_repository;
	private final Simple m_pointers;
	private final Simple m_registry;

	public PointerStore(SqlRepository repository, PointerSettings settings)
	{
		m_repository = requireNonNull(repository);
		m_pointers = settings.pointerTable();
		m_registry = settings.tableTable();
	}

	/**
	 * Create a pointer, doing nothing if one with the same identifier
	 * exists.
	 * @return whether a pointer was created
	 */
	public boolean create(Ulid id, Ulid tableId)
	{
		Map<String, Object> row = new LinkedHashMap<>();
		row.put(ID, requireNonNull(id));
		row.put(TABLE_ID, requireNonNull(tableId));
		return 0 < m_repository.insertAll(
			m_pointers, List.of(row), OnConflict.doNothing());
	}

	/**
	 * Reassign a pointer to another registered table. For maintenance only.
	 * @return whether the pointer existed
	 */
	public boolean repoint(Ulid pointerId, Ulid newTableId)
	{
		int n = m_repository.update("update " + m_pointers.deparse()
			+ " set " + q(TABLE_ID) + " = ? where " + q(ID) + " = ?",
			requireNonNull(newTableId), requireNonNull(pointerId));
		if ( 0 < n )
			LOG.info("repointed {} to table {}", pointerId, newTableId);
		return 0 < n;
	}

	/**
	 * A pointer together with the registry row of its table.
	 */
	public Optional<Pointer> find(Ulid id)
	{
		List<Map<String, Object>> rows = m_repository.queryForRows(
			"select p." + q(ID) + ", p." + q(TABLE_ID) + ", t." + q("table")
			+ " from " + m_pointers.deparse() + " p left join "
			+ m_registry.deparse() + " t on t." + q(ID) + " = p."
			+ q(TABLE_ID) + " where p." + q(ID) + " = ?", requireNonNull(id));
		if ( rows.isEmpty() )
			return Optional.empty();
		Map<String, Object> row = rows.get(0);
		Ulid tableId = Ulid.cast(row.get(TABLE_ID));
		Object name = row.get("table");
		return Optional.of(new Pointer(Ulid.cast(row.get(ID)), tableId,
			null == name ? null : new Table(tableId, (String)name)));
	}

	/**
	 * How many pointers a table owns.
	 */
	public long count(Ulid tableId)
	{
		List<Long> n = m_repository.queryForList(
			"select count(*) from " + m_pointers.deparse()
			+ " where " + q(TABLE_ID) + " = ?", Long.class,
			requireNonNull(tableId));
		return n.isEmpty() ? 0L : n.get(0);
	}

	private static String q(String column)
	{
		return Simple.from(column).deparse();
	}
}
