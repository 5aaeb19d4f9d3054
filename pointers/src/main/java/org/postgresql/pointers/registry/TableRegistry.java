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
package org.postgresql.pointers.registry;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import org.postgresql.pointers.Table;
import org.postgresql.pointers.Ulid;
import org.postgresql.pointers.UnknownTableException;
import org.postgresql.pointers.annotation.Pointable;
import org.postgresql.pointers.config.PointerSettings;
import org.postgresql.pointers.jdbc.OnConflict;
import org.postgresql.pointers.jdbc.SqlRepository;
import org.postgresql.pointers.sqlgen.Lexicals.Identifier.Simple;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;
import static org.postgresql.pointers.sqlgen.Lexicals.literal;

/**
 * The mapping from the name of each participating table to the identifier
 * that tags its pointers.
 *<p>
 * A name is bound to its identifier the first time it is registered and
 * keeps it for as long as the table participates: registering the name again
 * with any other identifier changes nothing and yields the first one.
 * Registrations of the same name take a transaction-scoped advisory lock, so
 * concurrent first registrations inside transactions run one after the
 * other; the unique index on the name column backs that up.
 */
public class TableRegistry
{
	private static final Logger LOG =
		LoggerFactory.getLogger(TableRegistry.class);

	static final String ID = "id";
	static final String TABLE = "table";

	private final SqlRepository m_repository;
	private final Simple m_registry;

	public TableRegistry(SqlRepository repository, PointerSettings settings)
	{
		m_repository = requireNonNull(repository);
		m_registry = settings.tableTable();
	}

	/**
	 * Register a table under a candidate identifier.
	 * @return the identifier the table is registered under, which is the
	 * candidate only if the name was not already registered
	 */
	public Ulid register(Ulid id, String name)
	{
		requireNonNull(id);
		String table = Simple.fromJava(name).name();

		/*
		 * The registry's own insert trigger runs before conflict detection,
		 * so an insert that loses to an existing row still leaves a pointer
		 * behind. Hold the lock, then look before inserting.
		 */
		lock(table);
		Optional<Ulid> existing = find(table);
		if ( existing.isPresent() )
		{
			if ( ! existing.get().equals(id) )
				LOG.info("table {} already registered as {}; keeping it",
					table, existing.get());
			return existing.get();
		}

		Map<String, Object> row = new LinkedHashMap<>();
		row.put(ID, id);
		row.put(TABLE, table);
		m_repository.insertAll(m_registry, List.of(row),
			OnConflict.doNothing(TABLE));

		Ulid registered = find(table).orElseThrow(
			() -> new UnknownTableException(table,
				"table " + table + " vanished from the registry while it" +
				" was being registered"));
		LOG.info("registered table {} as {}", table, registered);
		return registered;
	}

	/*
	 * Released at the end of the transaction; in autocommit mode, at the end
	 * of this statement, which serializes nothing.
	 */
	private void lock(String table)
	{
		m_repository.execute("select pg_catalog.pg_advisory_xact_lock("
			+ "pg_catalog.hashtext(" + literal(m_registry.name() + "." + table)
			+ "))");
	}

	/**
	 * Remove a table's registry row. Its pointers go with it, by cascade.
	 * The table's trigger should already have been dropped.
	 * @return whether a row was removed
	 */
	public boolean deregister(Ulid id)
	{
		int n = m_repository.update("delete from " + m_registry.deparse()
			+ " where " + q(ID) + " = ?", requireNonNull(id));
		if ( 0 < n )
			LOG.info("deregistered table {}", id);
		return 0 < n;
	}

	/**
	 * @throws UnknownTableException if the table is not registered
	 */
	public Ulid resolve(String name)
	{
		String table = Simple.fromJava(name).name();
		return find(table).orElseThrow(() -> new UnknownTableException(table));
	}

	/**
	 * Resolve the table a schema class stands for.
	 * @throws UnknownTableException if the class is not annotated
	 * {@link Pointable @Pointable}, or its table is not registered
	 */
	public Ulid resolve(Class<?> schema)
	{
		return resolve(tableOf(schema));
	}

	public Optional<Ulid> find(String name)
	{
		List<UUID> ids = m_repository.queryForList(
			"select " + q(ID) + " from " + m_registry.deparse()
			+ " where " + q(TABLE) + " = ?", UUID.class,
			Simple.fromJava(name).name());
		return ids.stream().findFirst().map(Ulid::load);
	}

	/**
	 * The name registered under an identifier.
	 */
	public Optional<String> nameOf(Ulid id)
	{
		List<String> names = m_repository.queryForList(
			"select " + q(TABLE) + " from " + m_registry.deparse()
			+ " where " + q(ID) + " = ?", String.class, requireNonNull(id));
		return names.stream().findFirst();
	}

	/**
	 * Every registered table, by name.
	 */
	public List<Table> list()
	{
		List<Table> tables = new ArrayList<>();
		for ( Map<String, Object> row : m_repository.queryForRows(
			"select " + q(ID) + ", " + q(TABLE) + " from "
			+ m_registry.deparse() + " order by " + q(TABLE)) )
			tables.add(new Table(
				Ulid.cast(row.get(ID)), (String)row.get(TABLE)));
		return tables;
	}

	/**
	 * The table named by a schema class's {@link Pointable @Pointable}.
	 * @throws UnknownTableException if there is no such annotation
	 */
	public static String tableOf(Class<?> schema)
	{
		Pointable p = schema.getAnnotation(Pointable.class);
		if ( null == p )
			throw new UnknownTableException(schema.getName(),
				schema.getName() + " is not annotated @Pointable");
		return p.table();
	}

	private static String q(String column)
	{
		return Simple.from(column).deparse();
	}
}
