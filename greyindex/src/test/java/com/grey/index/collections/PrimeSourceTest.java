/*
 * Copyright 2024 Yusef Badri - All rights reserved.
 * NAF is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.grey.index.collections;

import java.math.BigInteger;

import com.grey.index.errors.ExhaustedPrimeTableException;
import com.grey.index.errors.IndexConfigException;
import com.grey.index.errors.IndexException;

public class PrimeSourceTest
{
	@org.junit.Test
	public void testDefaultTable() {
		PrimeSource src = PrimeSource.getDefault();
		org.junit.Assert.assertSame(src, PrimeSource.getDefault());
		org.junit.Assert.assertEquals(6558, src.size());
		org.junit.Assert.assertEquals(2, src.get(0));
		org.junit.Assert.assertEquals(Integer.MAX_VALUE, src.largest());
		for (int idx = 0; idx != src.size(); idx++) {
			if (idx != 0) org.junit.Assert.assertTrue(src.get(idx) > src.get(idx-1));
		}
		// spot-check primality across the dense section and the sparse tail
		int[] samples = new int[]{0, 1, 100, 1000, 6541, 6542, 6543, src.size()-2, src.size()-1};
		for (int idx : samples) {
			org.junit.Assert.assertTrue("index="+idx, BigInteger.valueOf(src.get(idx)).isProbablePrime(30));
		}
	}

	@org.junit.Test
	public void testNextPrimeAtLeast() {
		PrimeSource src = PrimeSource.getDefault();
		org.junit.Assert.assertEquals(2, src.nextPrimeAtLeast(-5));
		org.junit.Assert.assertEquals(2, src.nextPrimeAtLeast(0));
		org.junit.Assert.assertEquals(2, src.nextPrimeAtLeast(2));
		org.junit.Assert.assertEquals(7, src.nextPrimeAtLeast(7));
		org.junit.Assert.assertEquals(17, src.nextPrimeAtLeast(14));
		org.junit.Assert.assertEquals(17, src.nextPrimeAtLeast(17));
		org.junit.Assert.assertEquals(65521, src.nextPrimeAtLeast(65520));
		org.junit.Assert.assertEquals(65537, src.nextPrimeAtLeast(65522));
		org.junit.Assert.assertEquals(131101, src.nextPrimeAtLeast(100000));
		org.junit.Assert.assertEquals(Integer.MAX_VALUE, src.nextPrimeAtLeast(Integer.MAX_VALUE));
		try {
			src.nextPrimeAtLeast(Integer.MAX_VALUE + 1L);
			org.junit.Assert.fail("Expected exhaustion beyond largest prime");
		} catch (ExhaustedPrimeTableException ex) {
			org.junit.Assert.assertEquals(Integer.MAX_VALUE + 1L, ex.getRequested());
			org.junit.Assert.assertTrue(ex.error());
			org.junit.Assert.assertTrue(IndexException.isError(ex));
		}
	}

	@org.junit.Test
	public void testPreviousPrimeBelow() {
		PrimeSource src = PrimeSource.getDefault();
		org.junit.Assert.assertEquals(2, src.previousPrimeBelow(3));
		org.junit.Assert.assertEquals(13, src.previousPrimeBelow(14));
		org.junit.Assert.assertEquals(13, src.previousPrimeBelow(17));
		org.junit.Assert.assertEquals(65521, src.previousPrimeBelow(65536));
		org.junit.Assert.assertEquals(Integer.MAX_VALUE, src.previousPrimeBelow(Long.MAX_VALUE));
		try {
			src.previousPrimeBelow(2);
			org.junit.Assert.fail("Expected exhaustion below smallest prime");
		} catch (ExhaustedPrimeTableException ex) {
			org.junit.Assert.assertEquals(2, ex.getRequested());
		}
	}

	@org.junit.Test
	public void testExplicitTable() {
		int[] table = new int[]{3, 5, 7, 11};
		PrimeSource src = new PrimeSource(table);
		table[0] = 99; //source must have taken a copy
		org.junit.Assert.assertEquals(3, src.nextPrimeAtLeast(2));
		org.junit.Assert.assertEquals(11, src.nextPrimeAtLeast(8));
		org.junit.Assert.assertEquals(11, src.largest());
		try {
			src.nextPrimeAtLeast(12);
			org.junit.Assert.fail("Expected exhaustion");
		} catch (ExhaustedPrimeTableException ex) {}
	}

	@org.junit.Test
	public void testMalformedTable() {
		verifyRejected(new int[0]);
		verifyRejected(new int[]{1, 2, 3});
		verifyRejected(new int[]{2, 5, 3});
		verifyRejected(new int[]{2, 3, 3, 5});
	}

	@org.junit.Test
	public void testMissingResource() {
		try {
			PrimeSource.load("no-such-primes.bin");
			org.junit.Assert.fail("Expected failure on missing resource");
		} catch (IndexConfigException ex) {
			org.junit.Assert.assertTrue(ex.getMessage(), ex.getMessage().contains("no-such-primes.bin"));
		}
	}

	private static void verifyRejected(int[] table) {
		try {
			new PrimeSource(table);
			org.junit.Assert.fail("Expected rejection of table="+java.util.Arrays.toString(table));
		} catch (IndexConfigException ex) {
			org.junit.Assert.assertTrue(ex.error());
		}
	}
}
