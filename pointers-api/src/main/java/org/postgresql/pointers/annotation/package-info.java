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
 * Annotations naming the tables that schema classes stand for, so migrations
 * and references can be written against a class rather than a string.
 */
package org.postgresql.pointers.annotation;
