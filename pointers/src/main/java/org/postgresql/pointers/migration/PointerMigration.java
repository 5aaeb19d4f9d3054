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

import java.util.function.Consumer;

import org.postgresql.pointers.PointerType;
import org.postgresql.pointers.Table;
import org.postgresql.pointers.Ulid;
import org.postgresql.pointers.UnknownTableException;
import org.postgresql.pointers.annotation.Mixin;
import org.postgresql.pointers.annotation.Pointable;
import org.postgresql.pointers.config.PointerSettings;
import org.postgresql.pointers.jdbc.SqlRepository;
import org.postgresql.pointers.registry.TableRegistry;
import org.postgresql.pointers.sqlgen.Lexicals.Identifier.Simple;
import org.postgresql.pointers.trigger.PointerTriggers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;
import static org.postgresql.pointers.ReferentialAction.CASCADE;

/**
 * Helpers for writing migrations that take part in the pointers abstraction.
 *<p>
 * Every method issues its statements immediately through the
 * {@link SqlRepository}. A migration runner is expected to call them inside
 * one transaction per migration, so a failure part way leaves nothing
 * behind; the DDL is written with {@code if exists} / {@code if not exists}
 * wherever PostgreSQL allows, so re-running after a partial failure is
 * harmless.
 *<p>
 * A pointable table has a {@code uuid} primary key {@code id}, a registry
 * row, and the pointer trigger. A mixin table has an {@code id} that is a
 * strong pointer, and nothing else special.
 */
public class PointerMigration
{
	private static final Logger LOG =
		LoggerFactory.getLogger(PointerMigration.class);

	/**
	 * The SQL function installed by {@link #initUlidExtra initUlidExtra}.
	 */
	public static final String ULID_TIMESTAMP_FUNCTION =
		"pointers_ulid_timestamp";

	private final SqlRepository m_repository;
	private final PointerSettings m_settings;
	private final TableRegistry m_registry;
	private final PointerTriggers m_triggers;

	public PointerMigration(SqlRepository repository, PointerSettings settings)
	{
		this(repository, settings, new TableRegistry(repository, settings),
			new PointerTriggers(repository, settings));
	}

	public PointerMigration(SqlRepository repository, PointerSettings settings,
		TableRegistry registry, PointerTriggers triggers)
	{
		m_repository = requireNonNull(repository);
		m_settings = requireNonNull(settings);
		m_registry = requireNonNull(registry);
		m_triggers = requireNonNull(triggers);
	}

	public PointerSettings settings()
	{
		return m_settings;
	}

	public TableRegistry registry()
	{
		return m_registry;
	}

	public PointerTriggers triggers()
	{
		return m_triggers;
	}

	/**
	 * Install ({@code UP}) or remove ({@code DOWN}) the registry and pointer
	 * tables, their indexes, and the trigger function.
	 *<p>
	 * Installing also registers the registry table itself, under
	 * {@link Table#TABLE_TABLE_ID}, and gives it the trigger, so that
	 * registrations can be pointed to. Removing undoes each step in reverse.
	 */
	public void initPointers(Direction direction)
	{
		Simple tables = m_settings.tableTable();
		Simple pointers = m_settings.pointerTable();
		IndexDefinition tableIndex = IndexDefinition.unique(tables, "table");
		IndexDefinition pointerIndex = IndexDefinition.of(pointers, "table_id");

		if ( Direction.DOWN == requireNonNull(direction) )
		{
			LOG.info("removing pointers ({}, {})", tables, pointers);
			m_triggers.dropTrigger(tables.name());
			m_triggers.dropTriggerFunction();
			m_repository.execute(pointerIndex.dropSql());
			m_repository.execute(tableIndex.dropSql());
			dropTable(pointers.name());
			dropTable(tables.name());
			return;
		}

		LOG.info("initialising pointers ({}, {})", tables, pointers);

		TableDefinition t = new TableDefinition(tables, TableOptions.none());
		addPointerPk(t);
		t.add("table", "text").notNull();
		create(t);

		TableDefinition p = new TableDefinition(pointers, TableOptions.none());
		addPointerPk(p);
		p.add("table_id", new Reference(tables, CASCADE, CASCADE)).notNull();
		create(p);

		m_repository.execute(tableIndex.createSql());
		m_repository.execute(pointerIndex.createSql());

		insertTableRecord(Table.TABLE_TABLE_ID, tables.name());
		m_triggers.createTriggerFunction();
		m_triggers.createTrigger(tables.name());
	}

	/**
	 * Install ({@code UP}) or remove ({@code DOWN}) a SQL function
	 * {@value #ULID_TIMESTAMP_FUNCTION}{@code (uuid)} returning, as a
	 * {@code timestamptz}, the creation time carried in an identifier.
	 */
	public void initUlidExtra(Direction direction)
	{
		Simple f = Simple.from(ULID_TIMESTAMP_FUNCTION);
		if ( Direction.DOWN == requireNonNull(direction) )
		{
			m_repository.execute(
				"drop function if exists " + f.deparse() + "(uuid)");
			return;
		}
		m_repository.execute(
			"create or replace function " + f.deparse()
			+ "(id uuid) returns timestamptz as $$\n" +
			"  select to_timestamp(('x' || lpad(substr(" +
			"replace(id::text, '-', ''), 1, 12), 16, '0'))" +
			"::bit(64)::bigint / 1000.0)\n" +
			"$$ language sql immutable strict");
	}

	/**
	 * Create a pointable table: register it under {@code id}, create it with
	 * an {@code id} primary key and the columns {@code body} adds, and
	 * install the trigger.
	 * @param id the table's registry identifier, in any form
	 * {@link Ulid#cast Ulid.cast} accepts
	 * @throws org.postgresql.pointers.InvalidIdentifierException if {@code id}
	 * is malformed, before anything is done
	 */
	public void createPointableTable(String name, Object id,
		TableOptions options, Consumer<TableDefinition> body)
	{
		Ulid tableId = Ulid.cast(id);
		Simple table = Simple.fromJava(name);
		LOG.info("creating pointable table {} ({})", table, tableId);

		insertTableRecord(tableId, table.name());
		TableDefinition t = new TableDefinition(table, options);
		addPointerPk(t);
		body.accept(t);
		create(t);
		m_triggers.createTrigger(table.name());
	}

	public void createPointableTable(
		String name, Object id, Consumer<TableDefinition> body)
	{
		createPointableTable(name, id, TableOptions.none(), body);
	}

	/**
	 * Create the pointable table a schema class stands for.
	 */
	public void createPointableTable(
		Class<?> schema, TableOptions options, Consumer<TableDefinition> body)
	{
		Pointable p = pointable(schema);
		createPointableTable(p.table(), p.id(), options, body);
	}

	/**
	 * Drop a pointable table: its trigger, its registry row (and, by
	 * cascade, its pointers), then the table.
	 */
	public void dropPointableTable(String name, Object id)
	{
		Ulid tableId = Ulid.cast(id);
		LOG.info("dropping pointable table {} ({})", name, tableId);
		m_triggers.dropTrigger(name);
		deleteTableRecord(tableId);
		dropTable(name);
	}

	public void dropPointableTable(Class<?> schema)
	{
		Pointable p = pointable(schema);
		dropPointableTable(p.table(), p.id());
	}

	/**
	 * Create a mixin table: its {@code id} primary key is a strong pointer,
	 * and it has no trigger.
	 */
	public void createMixinTable(
		String name, TableOptions options, Consumer<TableDefinition> body)
	{
		Simple table = Simple.fromJava(name);
		LOG.info("creating mixin table {}", table);
		TableDefinition t = new TableDefinition(table, options);
		addPointerRefPk(t);
		body.accept(t);
		create(t);
	}

	public void createMixinTable(String name, Consumer<TableDefinition> body)
	{
		createMixinTable(name, TableOptions.none(), body);
	}

	public void createMixinTable(
		Class<?> schema, TableOptions options, Consumer<TableDefinition> body)
	{
		createMixinTable(mixin(schema).table(), options, body);
	}

	/**
	 * Drop a mixin table. It is only a cascading drop.
	 */
	public void dropMixinTable(String name)
	{
		LOG.info("dropping mixin table {}", name);
		dropTable(name);
	}

	public void dropMixinTable(Class<?> schema)
	{
		dropMixinTable(mixin(schema).table());
	}

	/**
	 * A reference to the pointer table of the given strength.
	 */
	public Reference pointer(PointerType type)
	{
		return Reference.to(m_settings.pointerTable(), requireNonNull(type));
	}

	/**
	 * A reference of the given strength to some other table keyed by
	 * pointer.
	 */
	public Reference pointer(String table, PointerType type)
	{
		return Reference.to(Simple.fromJava(table), requireNonNull(type));
	}

	/**
	 * A reference of the given strength to the table a schema class stands
	 * for.
	 * @throws UnknownTableException if the class is annotated neither
	 * {@link Pointable @Pointable} nor {@link Mixin @Mixin}
	 */
	public Reference pointer(Class<?> schema, PointerType type)
	{
		return pointer(tableOf(schema), type);
	}

	/**
	 * A reference deleted along with what it points to.
	 */
	public Reference strongPointer()
	{
		return pointer(PointerType.STRONG);
	}

	public Reference strongPointer(Class<?> schema)
	{
		return pointer(schema, PointerType.STRONG);
	}

	/**
	 * A reference set null when what it points to is deleted.
	 */
	public Reference weakPointer()
	{
		return pointer(PointerType.WEAK);
	}

	public Reference weakPointer(Class<?> schema)
	{
		return pointer(schema, PointerType.WEAK);
	}

	/**
	 * A reference that prevents what it points to from being deleted.
	 */
	public Reference unbreakablePointer()
	{
		return pointer(PointerType.UNBREAKABLE);
	}

	public Reference unbreakablePointer(Class<?> schema)
	{
		return pointer(schema, PointerType.UNBREAKABLE);
	}

	/**
	 * Add the {@code uuid} primary key {@code id}. Not needed with
	 * {@link #createPointableTable createPointableTable}.
	 */
	public ColumnDefinition addPointerPk(TableDefinition table)
	{
		return table.add("id", "uuid").primaryKey();
	}

	/**
	 * Add a primary key {@code id} that is a strong pointer. Not needed with
	 * {@link #createMixinTable createMixinTable}.
	 */
	public ColumnDefinition addPointerRefPk(TableDefinition table)
	{
		return table.add("id", strongPointer()).primaryKey();
	}

	/**
	 * Register a table. Not needed with
	 * {@link #createPointableTable createPointableTable}.
	 * @return the identifier the table is registered under
	 */
	public Ulid insertTableRecord(Object id, String name)
	{
		return m_registry.register(Ulid.cast(id), name);
	}

	/**
	 * Remove a table's registry row. Not needed with
	 * {@link #dropPointableTable dropPointableTable}.
	 */
	public boolean deleteTableRecord(Object id)
	{
		return m_registry.deregister(Ulid.cast(id));
	}

	public void dropTable(String name)
	{
		m_repository.execute("drop table if exists "
			+ Simple.fromJava(name).deparse() + " cascade");
	}

	private void create(TableDefinition table)
	{
		for ( String sql : table.createStatements() )
			m_repository.execute(sql);
	}

	static String tableOf(Class<?> schema)
	{
		Pointable p = schema.getAnnotation(Pointable.class);
		if ( null != p )
			return p.table();
		Mixin m = schema.getAnnotation(Mixin.class);
		if ( null != m )
			return m.table();
		throw new UnknownTableException(schema.getName(),
			schema.getName() + " is annotated neither @Pointable nor @Mixin");
	}

	private static Pointable pointable(Class<?> schema)
	{
		Pointable p = schema.getAnnotation(Pointable.class);
		if ( null == p )
			throw new UnknownTableException(schema.getName(),
				schema.getName() + " is not annotated @Pointable");
		return p;
	}

	private static Mixin mixin(Class<?> schema)
	{
		Mixin m = schema.getAnnotation(Mixin.class);
		if ( null == m )
			throw new UnknownTableException(schema.getName(),
				schema.getName() + " is not annotated @Mixin");
		return m;
	}
}
