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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.postgresql.pointers.sqlgen.Lexicals.Identifier.Simple;

import static java.util.stream.Collectors.joining;

/**
 * The {@code on conflict} clause of an insert. Only skipping the conflicting
 * row is offered: an existing registry or pointer row is never overwritten.
 */
public final class OnConflict
{
	private final List<Simple> m_target;

	private OnConflict(List<Simple> target)
	{
		m_target = target;
	}

	/**
	 * Skip the conflicting row. Without a target, any unique constraint
	 * counts.
	 */
	public static OnConflict doNothing(String... target)
	{
		List<Simple> names = new ArrayList<>(target.length);
		for ( String c : target )
			names.add(Simple.fromJava(c));
		return new OnConflict(Collections.unmodifiableList(names));
	}

	/**
	 * The clause to append to an {@code insert}, with a leading space.
	 */
	public String sql()
	{
		StringBuilder sb = new StringBuilder(" on conflict");
		if ( ! m_target.isEmpty() )
			sb.append(m_target.stream().map(Simple::deparse)
				.collect(joining(", ", " (", ")")));
		return sb.append(" do nothing").toString();
	}

	@Override
	public String toString()
	{
		return sql().trim();
	}
}
