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
/**
 * The storage collaborator: the statements issued by the registry, the
 * pointer store, the triggers and migrations all go through a
 * {@link org.postgresql.pointers.jdbc.SqlRepository SqlRepository}, normally
 * the Spring-backed {@link org.postgresql.pointers.jdbc.JdbcRepository
 * JdbcRepository}.
 *<p>
 * Errors surface as Spring {@code DataAccessException}s. The one error raised
 * on purpose by the pointers abstraction, the refusal of an insert into an
 * unregistered table, is recognized by
 * {@link org.postgresql.pointers.jdbc.PointerSQLExceptionTranslator
 * PointerSQLExceptionTranslator}.
 */
package org.postgresql.pointers.jdbc;
