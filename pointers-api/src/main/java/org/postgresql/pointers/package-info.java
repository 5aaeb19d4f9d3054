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
 * Types shared by every user of the pointers abstraction: the {@link
 * org.postgresql.pointers.Ulid Ulid} identifier codec, the registry and
 * pointer rows, and the strengths a reference to a pointer can have.
 */
package org.postgresql.pointers;
