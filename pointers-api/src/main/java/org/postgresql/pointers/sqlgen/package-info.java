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
 * <p>Lexical helpers for the identifiers and literals that appear in the SQL
 * generated for the pointer tables and triggers.
 */
package org.postgresql.pointers.sqlgen;
