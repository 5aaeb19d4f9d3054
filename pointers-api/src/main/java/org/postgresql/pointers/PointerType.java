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
package org.postgresql.pointers;

import static org.postgresql.pointers.ReferentialAction.CASCADE;
import static org.postgresql.pointers.ReferentialAction.RESTRICT;
import static org.postgresql.pointers.ReferentialAction.SET_NULL;

/**
 * The strength of a reference to the pointer table, chosen per column by the
 * author of the referencing table.
 *<p>
 * All three follow a change of the pointer's key. They differ only in what
 * happens to the referencing row when the pointer goes away.
 */
public enum PointerType
{
	/**
	 * The referencing row is deleted along with the thing pointed to.
	 */
	STRONG(CASCADE, CASCADE),

	/**
	 * The reference is set null when the thing pointed to is deleted.
	 */
	WEAK(SET_NULL, CASCADE),

	/**
	 * The thing pointed to cannot be deleted while the reference exists.
	 */
	UNBREAKABLE(RESTRICT, CASCADE);

	private final ReferentialAction m_onDelete;
	private final ReferentialAction m_onUpdate;

	PointerType(ReferentialAction onDelete, ReferentialAction onUpdate)
	{
		m_onDelete = onDelete;
		m_onUpdate = onUpdate;
	}

	public ReferentialAction onDelete()
	{
		return m_onDelete;
	}

	public ReferentialAction onUpdate()
	{
		return m_onUpdate;
	}
}
