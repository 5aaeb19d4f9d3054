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
package org.postgresql.pointers.config;

import org.postgresql.pointers.sqlgen.Lexicals.Identifier.Simple;

import static org.apache.commons.lang3.StringUtils.isBlank;

/**
 * The names under which the pointers abstraction is installed: the trigger
 * function, the prefix of each per-table trigger, and the registry and pointer
 * tables.
 *<p>
 * Resolved once, when the application starts, and passed explicitly to every
 * component that generates SQL.
 */
public final class PointerSettings
{
	public static final String DEFAULT_TRIGGER_FUNCTION = "insert_pointer";
	public static final String DEFAULT_TRIGGER_PREFIX = "insert_pointer_";
	public static final String DEFAULT_TABLE_TABLE = "pointers_table";
	public static final String DEFAULT_POINTER_TABLE = "pointers_pointer";

	private static final PointerSettings DEFAULTS = builder().build();

	private final Simple m_triggerFunction;
	private final Simple m_triggerPrefix;
	private final Simple m_tableTable;
	private final Simple m_pointerTable;

	private PointerSettings(Builder b)
	{
		m_triggerFunction = name(b.triggerFunction, DEFAULT_TRIGGER_FUNCTION);
		m_triggerPrefix = name(b.triggerPrefix, DEFAULT_TRIGGER_PREFIX);
		m_tableTable = name(b.tableTable, DEFAULT_TABLE_TABLE);
		m_pointerTable = name(b.pointerTable, DEFAULT_POINTER_TABLE);
		if ( m_tableTable.equals(m_pointerTable) )
			throw new IllegalArgumentException(
				"registry and pointer tables must differ: " + m_tableTable);
	}

	public static PointerSettings defaults()
	{
		return DEFAULTS;
	}

	public static Builder builder()
	{
		return new Builder();
	}

	public Simple triggerFunction()
	{
		return m_triggerFunction;
	}

	public Simple triggerPrefix()
	{
		return m_triggerPrefix;
	}

	/**
	 * The table registry.
	 */
	public Simple tableTable()
	{
		return m_tableTable;
	}

	/**
	 * The pointer store.
	 */
	public Simple pointerTable()
	{
		return m_pointerTable;
	}

	@Override
	public String toString()
	{
		return String.format(
			"PointerSettings[function=%s, prefix=%s, tables=%s, pointers=%s]",
			m_triggerFunction, m_triggerPrefix, m_tableTable, m_pointerTable);
	}

	private static Simple name(String configured, String fallback)
	{
		return Simple.fromJava(isBlank(configured) ? fallback : configured);
	}

	/**
	 * Builder; any name left unset, or set blank, takes its default.
	 */
	public static final class Builder
	{
		private String triggerFunction;
		private String triggerPrefix;
		private String tableTable;
		private String pointerTable;

		private Builder() { }

		public Builder triggerFunction(String name)
		{
			triggerFunction = name;
			return this;
		}

		public Builder triggerPrefix(String prefix)
		{
			triggerPrefix = prefix;
			return this;
		}

		public Builder tableTable(String name)
		{
			tableTable = name;
			return this;
		}

		public Builder pointerTable(String name)
		{
			pointerTable = name;
			return this;
		}

		public PointerSettings build()
		{
			return new PointerSettings(this);
		}
	}
}
