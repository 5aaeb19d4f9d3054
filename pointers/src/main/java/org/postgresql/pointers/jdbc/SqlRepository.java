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

import org.postgresql.pointers.sqlgen.Lexicals.Identifier.Simple;

/**
 * The storage collaborator through which every statement of the pointers
 * abstraction is issued.
 *<p>
 * Implementations run each call as a single statement on whatever connection
 * and transaction the caller has in effect; transaction boundaries, retries
 * and cancellation belong to the caller. {@link org.postgresql.pointers.Ulid
 * Ulid} arguments are bound in their storage form.
 */
public interface SqlRepository
{
	/**
	 * Run a statement that returns no rows and takes no parameters, such as
	 * DDL.
	 */
	void execute(String sql);

	/**
	 * Run a parameterised data-modifying statement.
	 * @return the number of rows affected
	 */
	int update(String sql, Object... args);

	/**
	 * Run a query returning a single column.
	 */
	<T> List<T> queryForList(String sql, Class<T> elementType, Object... args);

	/**
	 * Run a query returning rows keyed by column label.
	 */
	List<Map<String, Object>> queryForRows(String sql, Object... args);

	/**
	 * Insert rows, all having the same columns, into a table in one
	 * statement.
	 * @return the number of rows actually inserted
	 */
	int insertAll(
		Simple table, List<Map<String, Object>> rows, OnConflict onConflict);
}
