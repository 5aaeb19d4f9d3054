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

import java.io.Serializable;

import java.nio.ByteBuffer;

import java.security.SecureRandom;

import java.util.Arrays;
import java.util.UUID;

/**
 * The identifier used as primary key by every table taking part in the
 * pointers abstraction: 48 bits of milliseconds since the epoch followed by
 * 80 random bits.
 *<p>
 * The canonical text form is 26 characters of Crockford's base 32, which sorts
 * lexicographically in the same order as the 128-bit value. The storage form,
 * the only one the database sees, is a PostgreSQL {@code uuid} carrying the
 * same 128 bits, so {@link #dump dump} and {@link #load load} are lossless.
 *<p>
 * Instances are immutable. Generation needs no coordination between threads
 * or processes; the only shared state is the random number source.
 */
public final class Ulid implements Comparable<Ulid>, Serializable
{
	private static final long serialVersionUID = -3409626547931542106L;

	/** Length of the canonical text form. */
	public static final int TEXT_LENGTH = 26;

	/** Length of the binary form. */
	public static final int BYTE_LENGTH = 16;

	/** One more than the largest timestamp that fits in 48 bits. */
	public static final long TIMESTAMP_LIMIT = 1L << 48;

	private static final char[] ALPHABET =
		"0123456789ABCDEFGHJKMNPQRSTVWXYZ".toCharArray();

	private static final byte[] DECODE = new byte[128];

	static
	{
		Arrays.fill(DECODE, (byte)-1);
		for ( int i = 0; i < ALPHABET.length; ++ i )
		{
			DECODE[ALPHABET[i]] = (byte)i;
			DECODE[Character.toLowerCase(ALPHABET[i])] = (byte)i;
		}
	}

	private static final SecureRandom s_random = new SecureRandom();

	private final long m_msb;
	private final long m_lsb;

	private Ulid(long msb, long lsb)
	{
		m_msb = msb;
		m_lsb = lsb;
	}

	/**
	 * A fresh identifier stamped with the current time.
	 */
	public static Ulid generate()
	{
		return generate(System.currentTimeMillis());
	}

	/**
	 * A fresh identifier stamped with the given time.
	 * @param epochMillis milliseconds since 1970-01-01T00:00Z
	 * @throws IllegalArgumentException if the time does not fit in 48 bits
	 */
	public static Ulid generate(long epochMillis)
	{
		if ( epochMillis < 0 || epochMillis >= TIMESTAMP_LIMIT )
			throw new IllegalArgumentException(
				"timestamp out of range for an identifier: " + epochMillis);
		byte[] random = new byte[10];
		s_random.nextBytes(random);
		long msb = epochMillis << 16
			| (random[0] & 0xffL) << 8
			| (random[1] & 0xffL);
		long lsb = 0;
		for ( int i = 2; i < 10; ++ i )
			lsb = lsb << 8 | (random[i] & 0xffL);
		return new Ulid(msb, lsb);
	}

	/**
	 * Validate and convert a value to an identifier.
	 *<p>
	 * Accepts an existing {@code Ulid}, the 26-character text form (in either
	 * case), a {@link UUID}, or the 16-byte binary form.
	 * @throws InvalidIdentifierException for anything else
	 */
	public static Ulid cast(Object value)
	{
		if ( value instanceof Ulid )
			return (Ulid)value;
		if ( value instanceof CharSequence )
			return parse(value.toString());
		if ( value instanceof UUID )
			return load((UUID)value);
		if ( value instanceof byte[] )
			return fromBytes((byte[])value);
		throw new InvalidIdentifierException(value,
			null == value ? "null" : "unsupported type "
				+ value.getClass().getName());
	}

	/**
	 * The storage form of any value {@link #cast cast} accepts.
	 */
	public static UUID dump(Object value)
	{
		return cast(value).dump();
	}

	/**
	 * Parse the 26-character text form.
	 * @throws InvalidIdentifierException if the text is malformed
	 */
	public static Ulid parse(String text)
	{
		if ( null == text || TEXT_LENGTH != text.length() )
			throw new InvalidIdentifierException(text,
				"expected " + TEXT_LENGTH + " characters");
		long msb = 0;
		long lsb = 0;
		for ( int i = 0; i < TEXT_LENGTH; ++ i )
		{
			char c = text.charAt(i);
			int v = c < DECODE.length ? DECODE[c] : -1;
			if ( v < 0 )
				throw new InvalidIdentifierException(text,
					"invalid character '" + c + "' at position " + i);
			if ( 0 == i && v > 7 )
				throw new InvalidIdentifierException(text,
					"value exceeds 128 bits");
			msb = msb << 5 | lsb >>> 59;
			lsb = lsb << 5 | v;
		}
		return new Ulid(msb, lsb);
	}

	/**
	 * The identifier carried by a {@code uuid} read back from the database.
	 */
	public static Ulid load(UUID uuid)
	{
		if ( null == uuid )
			throw new InvalidIdentifierException(null, "null");
		return new Ulid(
			uuid.getMostSignificantBits(), uuid.getLeastSignificantBits());
	}

	/**
	 * The identifier carried by 16 big-endian bytes.
	 */
	public static Ulid fromBytes(byte[] bytes)
	{
		if ( null == bytes || BYTE_LENGTH != bytes.length )
			throw new InvalidIdentifierException(bytes,
				"expected " + BYTE_LENGTH + " bytes");
		ByteBuffer b = ByteBuffer.wrap(bytes);
		return new Ulid(b.getLong(), b.getLong());
	}

	/**
	 * The storage form.
	 */
	public UUID dump()
	{
		return new UUID(m_msb, m_lsb);
	}

	/**
	 * The 16-byte big-endian binary form.
	 */
	public byte[] toBytes()
	{
		return ByteBuffer.allocate(BYTE_LENGTH)
			.putLong(m_msb).putLong(m_lsb).array();
	}

	/**
	 * Milliseconds since the epoch at which this identifier was generated.
	 */
	public long timestamp()
	{
		return m_msb >>> 16;
	}

	/**
	 * The canonical 26-character text form.
	 */
	@Override
	public String toString()
	{
		char[] chars = new char[TEXT_LENGTH];
		for ( int i = 0; i < TEXT_LENGTH; ++ i )
			chars[i] = ALPHABET[fiveBits(125 - 5 * i)];
		return new String(chars);
	}

	/*
	 * The five bits starting at the given bit of the 128-bit value, counted
	 * from the least significant. The topmost group has only three bits.
	 */
	private int fiveBits(int shift)
	{
		long v;
		if ( shift >= 64 )
			v = m_msb >>> (shift - 64);
		else if ( shift > 59 )
			v = m_msb << (64 - shift) | m_lsb >>> shift;
		else
			v = m_lsb >>> shift;
		return (int)(v & 31);
	}

	@Override
	public int compareTo(Ulid other)
	{
		int c = Long.compareUnsigned(m_msb, other.m_msb);
		if ( 0 != c )
			return c;
		return Long.compareUnsigned(m_lsb, other.m_lsb);
	}

	@Override
	public boolean equals(Object other)
	{
		if ( this == other )
			return true;
		if ( ! (other instanceof Ulid) )
			return false;
		Ulid o = (Ulid)other;
		return m_msb == o.m_msb && m_lsb == o.m_lsb;
	}

	@Override
	public int hashCode()
	{
		long h = m_msb ^ m_lsb;
		return (int)(h >> 32) ^ (int)h;
	}
}
