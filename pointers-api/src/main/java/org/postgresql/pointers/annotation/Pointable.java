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
package org.postgresql.pointers.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a class as the schema of a table participating in the pointers
 * abstraction, naming the table and its registry identifier.
 *<p>
 * The identifier is chosen once, when the table is first created, and written
 * into the class so that migrations and foreign keys can refer to the table
 * by a value that never changes.
 */
@Documented
@Target(ElementType.TYPE) @Retention(RetentionPolicy.RUNTIME)
public @interface Pointable
{
	/**
	 * Name of the table.
	 */
	String table();

	/**
	 * The table's registry identifier, in the 26-character text form.
	 */
	String id();
}
