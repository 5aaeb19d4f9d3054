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
 * Marks a class as the schema of a mixin table: one keyed by a strong
 * pointer, carrying extra columns for rows of pointable tables, with no
 * trigger and no registry entry of its own.
 */
@Documented
@Target(ElementType.TYPE) @Retention(RetentionPolicy.RUNTIME)
public @interface Mixin
{
	/**
	 * Name of the table.
	 */
	String table();
}
