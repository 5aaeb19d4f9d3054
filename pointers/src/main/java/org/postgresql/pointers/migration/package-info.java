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
 * Schema migration helpers: install the pointer tables, and create tables that
 * take part in them.
 *<p>
 * A migration typically looks like:
 *<pre>
 * migration.initPointers(Direction.UP);
 * migration.createPointableTable("widgets", "01ARZ3NDEKTSV4RRFFQ69G5FAV",
 *     t -&gt; t.add("name", "text").notNull());
 * migration.createMixinTable("widget_notes",
 *     t -&gt; t.add("note", "text"));
 * migration.createPointableTable("links", "01ARZ3NDEKTSV4RRFFQ69G5FAW",
 *     t -&gt; t.add("target", migration.weakPointer()));
 *</pre>
 */
package org.postgresql.pointers.migration;
