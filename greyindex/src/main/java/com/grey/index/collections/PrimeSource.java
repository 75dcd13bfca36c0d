/*
 * Copyright 2024 Yusef Badri - All rights reserved.
 * NAF is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.grey.index.collections;

import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;

import org.slf4j.LoggerFactory;

import com.grey.index.config.SysProps;
import com.grey.index.errors.ExhaustedPrimeTableException;
import com.grey.index.errors.IndexConfigException;

/**
 * Serves primes from a precomputed table, for use as hash-table capacities.
 * <br>
 * The default table is a classpath resource holding a flat sequence of big-endian 32-bit ints in strictly ascending
 * order. It lists every prime below 65536 followed by a sparse tail (the first prime at or above each power of two,
 * up to 2^31-1), so small tables grow through closely spaced primes and large tables at least double.
 * No primality testing is done here, so any request beyond the largest prime in the table fails with
 * {@link ExhaustedPrimeTableException}.
 * <p>
 * Instances are immutable and may be shared.
 */
public class PrimeSource
{
	private static final org.slf4j.Logger Logger = LoggerFactory.getLogger(PrimeSource.class);

	public static final String SYSPROP_RESOURCE = "grey.primes.resource";
	public static final String DFLT_RESOURCE = "primes.bin";

	private final int[] primes;

	public int size() {return primes.length;}
	public int largest() {return primes[primes.length - 1];}
	public int get(int idx) {return primes[idx];}

	public static PrimeSource getDefault() {
		return DefaultHolder.INSTANCE;
	}

	public PrimeSource(int[] table)
	{
		this(table.clone(), "int[]");
	}

	private PrimeSource(int[] table, String label)
	{
		primes = validate(table, label);
	}

	/**
	 * Loads a prime table from the classpath, resolving the name relative to this class.
	 */
	public static PrimeSource load(String resource)
	{
		try (InputStream strm = PrimeSource.class.getResourceAsStream(resource)) {
			if (strm == null) throw new IndexConfigException("Prime table resource not found="+resource);
			int[] table = readTable(strm);
			PrimeSource src = new PrimeSource(table, resource);
			Logger.info("Loaded prime table="+resource+" with primes="+src.size()+", largest="+src.largest());
			return src;
		} catch (IOException ex) {
			throw new IndexConfigException("Failed to read prime table="+resource, ex);
		}
	}

	/**
	 * Returns the smallest prime in the table that is greater than or equal to n.
	 */
	public int nextPrimeAtLeast(long n)
	{
		if (n > largest()) throw new ExhaustedPrimeTableException(n, largest());
		if (n <= primes[0]) return primes[0];
		int idx = java.util.Arrays.binarySearch(primes, (int)n);
		if (idx < 0) idx = -idx - 1;
		return primes[idx];
	}

	/**
	 * Returns the largest prime in the table that is strictly less than n.
	 */
	public int previousPrimeBelow(long n)
	{
		if (n <= primes[0]) throw new ExhaustedPrimeTableException(n, largest());
		if (n > largest()) return largest();
		int idx = java.util.Arrays.binarySearch(primes, (int)n);
		if (idx < 0) idx = -idx - 1; //insertion point, ie. index of first prime above n
		return primes[idx - 1];
	}

	@Override
	public String toString() {
		return getClass().getName()+"/primes="+primes.length+"/largest="+largest();
	}

	private static int[] readTable(InputStream strm) throws IOException
	{
		byte[] raw = strm.readAllBytes();
		if (raw.length % 4 != 0) throw new EOFException("Truncated prime table - bytes="+raw.length);
		int[] table = new int[raw.length / 4];
		DataInputStream dstrm = new DataInputStream(new java.io.ByteArrayInputStream(raw));
		for (int idx = 0; idx != table.length; idx++) {
			table[idx] = dstrm.readInt();
		}
		return table;
	}

	private static int[] validate(int[] table, String label)
	{
		if (table.length == 0) throw new IndexConfigException("Empty prime table="+label);
		if (table[0] < 2) throw new IndexConfigException("Invalid prime table="+label+" - first entry="+table[0]);
		for (int idx = 1; idx != table.length; idx++) {
			if (table[idx] <= table[idx-1]) {
				throw new IndexConfigException("Prime table="+label+" is not ascending at index="+idx+": "+table[idx-1]+" then "+table[idx]);
			}
		}
		return table;
	}

	private static final class DefaultHolder {
		static final PrimeSource INSTANCE = load(SysProps.get(SYSPROP_RESOURCE, DFLT_RESOURCE));
	}
}
