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
package org.postgresql.pointers.trigger;

import java.util.List;

import org.postgresql.pointers.config.PointerSettings;
import org.postgresql.pointers.jdbc.SqlRepository;
import org.postgresql.pointers.sqlgen.Lexicals;
import org.postgresql.pointers.sqlgen.Lexicals.Identifier.Simple;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;
import static org.postgresql.pointers.jdbc.UnregisteredTableInsertException.TRIGGER_MESSAGE;
import static org.postgresql.pointers.sqlgen.Lexicals.literal;

/**
 * The trigger function that keeps the pointer table in step with every
 * participating table, and the per-table triggers that call it.
 *<p>
 * One function serves every table, through two triggers on each. Fired
 * before each inserted row, it looks up the registry identifier of the table
 * by {@code TG_TABLE_NAME} and inserts a pointer with the row's {@code id},
 * ignoring an existing one. A table with no registry row cannot accept rows
 * at all: the function raises an exception and the transaction aborts.
 *<p>
 * Fired after each deleted row, it deletes the row's pointer, so references
 * to it cascade, go null, or refuse the delete according to their strength.
 * The delete trigger must be an {@code after} trigger: a strong reference
 * from a table to itself would otherwise cascade into rows the same
 * statement has not yet deleted, which PostgreSQL refuses.
 */
public class PointerTriggers
{
	/** Appended to the insert trigger's name to name the delete trigger. */
	public static final String DELETE_SUFFIX = "_delete";

	private static final Logger LOG =
		LoggerFactory.getLogger(PointerTriggers.class);

	private final SqlRepository m_repository;
	private final PointerSettings m_settings;

	public PointerTriggers(SqlRepository repository, PointerSettings settings)
	{
		m_repository = requireNonNull(repository);
		m_settings = requireNonNull(settings);
	}

	/**
	 * The {@code create or replace function} statement for the trigger
	 * function.
	 */
	public String functionSql()
	{
		String registry = m_settings.tableTable().deparse();
		String pointers = m_settings.pointerTable().deparse();
		return
			"create or replace function "
			+ m_settings.triggerFunction().deparse()
			+ "() returns trigger as $$\n" +
			"declare registered_id uuid;\n" +
			"begin\n" +
			"  if TG_OP = 'DELETE' then\n" +
			"    delete from " + pointers + " where \"id\" = OLD.id;\n" +
			"    return null;\n" +
			"  end if;\n" +
			"  select \"id\" into registered_id from " + registry + "\n" +
			"    where " + registry + ".\"table\" = TG_TABLE_NAME;\n" +
			"  if registered_id is null then\n" +
			"    raise exception " + literal(TRIGGER_MESSAGE)
				+ ", TG_TABLE_NAME;\n" +
			"  end if;\n" +
			"  insert into " + pointers + " (\"id\", \"table_id\")\n" +
			"    values (NEW.id, registered_id)\n" +
			"    on conflict do nothing;\n" +
			"  return NEW;\n" +
			"end;\n" +
			"$$ language plpgsql";
	}

	public void createTriggerFunction()
	{
		LOG.info("creating trigger function {}", m_settings.triggerFunction());
		m_repository.execute(functionSql());
	}

	/**
	 * Drop the trigger function, and with it every trigger that calls it.
	 */
	public void dropTriggerFunction()
	{
		LOG.info("dropping trigger function {}", m_settings.triggerFunction());
		m_repository.execute("drop function if exists "
			+ m_settings.triggerFunction().deparse() + "() cascade");
	}

	/**
	 * Install the insert and delete triggers on a table, replacing any
	 * already there.
	 */
	public void createTrigger(String table)
	{
		Simple t = Simple.fromJava(table);
		String function = m_settings.triggerFunction().deparse();
		/* there is no create trigger if not exists */
		dropTrigger(table);
		LOG.info("creating triggers {} and {} on {}",
			triggerName(table), deleteTriggerName(table), t);
		m_repository.execute("create trigger " + triggerName(table).deparse()
			+ "\nbefore insert on " + t.deparse()
			+ "\nfor each row\nexecute procedure " + function + "()");
		m_repository.execute("create trigger "
			+ deleteTriggerName(table).deparse()
			+ "\nafter delete on " + t.deparse()
			+ "\nfor each row\nexecute procedure " + function + "()");
	}

	public void dropTrigger(String table)
	{
		String t = Simple.fromJava(table).deparse();
		m_repository.execute("drop trigger if exists "
			+ triggerName(table).deparse() + " on " + t);
		m_repository.execute("drop trigger if exists "
			+ deleteTriggerName(table).deparse() + " on " + t);
	}

	/**
	 * Whether the table has both triggers.
	 */
	public boolean hasTrigger(String table)
	{
		List<Long> n = m_repository.queryForList(
			"select count(*) from pg_catalog.pg_trigger" +
			" where tgname in (?, ?) and tgrelid = to_regclass(?)", Long.class,
			triggerName(table).name(), deleteTriggerName(table).name(),
			Simple.fromJava(table).deparse());
		return ! n.isEmpty() && 2 == n.get(0);
	}

	/**
	 * The name of the insert trigger on a table: the configured prefix
	 * followed by the table name, clipped as PostgreSQL would clip it.
	 */
	public Simple triggerName(String table)
	{
		return Simple.from(Lexicals.truncate(
			m_settings.triggerPrefix().name()
			+ Simple.fromJava(table).name()));
	}

	/**
	 * The name of the delete trigger on a table: the insert trigger's
	 * unclipped name, clipped short enough that {@link #DELETE_SUFFIX} still
	 * fits, then the suffix.
	 */
	public Simple deleteTriggerName(String table)
	{
		return Simple.from(Lexicals.truncate(
			m_settings.triggerPrefix().name() + Simple.fromJava(table).name(),
			Lexicals.PG_MAX_IDENTIFIER_BYTES - DELETE_SUFFIX.length())
			+ DELETE_SUFFIX);
	}
}
