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
package org.postgresql.pointers.sqlgen;

import java.io.Serializable;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * A few SQL lexical definitions needed to emit the DDL that maintains the
 * pointer tables and triggers.
 *
 * The names involved (tables, triggers, the trigger function) come from
 * configuration and from migration code, and the trigger function compares
 * them, exactly, against {@code TG_TABLE_NAME}. So every name is carried as
 * its exact, non-folded spelling and always emitted in delimited form; a name
 * that would be silently truncated by PostgreSQL is rejected up front.
 */
public abstract class Lexicals
{
	private Lexicals() { } // do not instantiate

	/**
	 * PostgreSQL's {@code NAMEDATALEN - 1}: the longest identifier, in bytes
	 * of the server encoding, that is stored without truncation.
	 */
	public static final int PG_MAX_IDENTIFIER_BYTES = 63;

	/** An ISO delimited identifier with a single capturing group named
	 * {@code xd} that captures the content (which still needs to have ""
	 * replaced with " throughout).
	 */
	public static final Pattern ISO_DELIMITED_IDENTIFIER_CAPTURING =
	Pattern.compile(
		"\"(?<xd>(?:[^\"]|\"\")++)\""
	);

	/**
	 * A string literal in standard-conforming form, with embedded single
	 * quotes doubled.
	 */
	public static String literal(String s)
	{
		requireNonNull(s);
		if ( -1 != s.indexOf('\0') )
			throw new IllegalArgumentException(
				"string literal may not contain NUL");
		return '\'' + s.replace("'", "''") + '\'';
	}

	/**
	 * Clip a name to {@link #PG_MAX_IDENTIFIER_BYTES} UTF-8 bytes without
	 * splitting a character, as PostgreSQL itself does to an over-long name.
	 */
	public static String truncate(String s)
	{
		return truncate(s, PG_MAX_IDENTIFIER_BYTES);
	}

	/**
	 * Clip a name to at most {@code maxBytes} UTF-8 bytes without splitting a
	 * character.
	 */
	public static String truncate(String s, int maxBytes)
	{
		if ( s.getBytes(UTF_8).length <= maxBytes )
			return s;
		int bytes = 0;
		int end = 0;
		while ( end < s.length() )
		{
			int cp = s.codePointAt(end);
			int len = new String(Character.toChars(cp)).getBytes(UTF_8).length;
			if ( bytes + len > maxBytes )
				break;
			bytes += len;
			end += Character.charCount(cp);
		}
		return s.substring(0, end);
	}

	/**
	 * An SQL identifier.
	 */
	public static abstract class Identifier implements Serializable
	{
		private static final long serialVersionUID = 4071528338210271117L;

		Identifier() { } // not API

		/**
		 * This Identifier represented as it would be in SQL source.
		 */
		public abstract String deparse();

		@Override
		public String toString()
		{
			return deparse();
		}

		/**
		 * An unqualified name, kept in its exact spelling and always deparsed
		 * as a delimited identifier.
		 */
		public static final class Simple extends Identifier
		{
			private static final long serialVersionUID = -2275045370129813044L;

			private final String m_name;

			private Simple(String name)
			{
				String diag = check(name);
				if ( null != diag )
					throw new IllegalArgumentException(diag);
				m_name = name;
			}

			/**
			 * Create an {@code Identifier.Simple} from its exact spelling.
			 * @throws IllegalArgumentException if the name is empty, contains
			 * NUL, or is longer than PostgreSQL stores without truncation.
			 */
			public static Simple from(String s)
			{
				return new Simple(requireNonNull(s));
			}

			/**
			 * Create an {@code Identifier.Simple} from a name supplied in Java
			 * code or configuration.
			 *<p>
			 * A name wrapped in double quotes is unwrapped, with doubled quotes
			 * inside it undoubled. Any other name is taken as its exact
			 * spelling; no case folding is applied, because the same spelling
			 * is what the trigger function later compares against.
			 */
			public static Simple fromJava(String s)
			{
				requireNonNull(s);
				Matcher m = ISO_DELIMITED_IDENTIFIER_CAPTURING.matcher(s);
				if ( m.matches() )
					return new Simple(m.group("xd").replace("\"\"", "\""));
				return new Simple(s.trim());
			}

			/**
			 * The exact spelling, as it will appear in the catalogs.
			 */
			public String name()
			{
				return m_name;
			}

			@Override
			public String deparse()
			{
				return '"' + m_name.replace("\"", "\"\"") + '"';
			}

			@Override
			public boolean equals(Object other)
			{
				if ( this == other )
					return true;
				if ( ! (other instanceof Simple) )
					return false;
				return m_name.equals(((Simple)other).m_name);
			}

			@Override
			public int hashCode()
			{
				return m_name.hashCode();
			}

			private static String check(String s)
			{
				if ( s.isEmpty() )
					return "identifier may not be empty";
				if ( -1 != s.indexOf('\0') )
					return "identifier may not contain NUL";
				if ( s.getBytes(UTF_8).length > PG_MAX_IDENTIFIER_BYTES )
					return String.format(
						"identifier longer than %d bytes would be truncated: " +
						"\"%s\"", PG_MAX_IDENTIFIER_BYTES, s);
				return null; /* check has passed */
			}
		}
	}
}
