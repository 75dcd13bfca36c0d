/*
 * Copyright 2024 Yusef Badri - All rights reserved.
 * NAF is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.grey.index.collections;

import java.math.BigInteger;

import com.grey.index.config.SysProps;
import com.grey.index.errors.ExhaustedPrimeTableException;
import com.grey.index.errors.IndexConfigException;
import com.grey.index.errors.InvalidCapacityException;

public class DoubleHashingResizeTest
{
	// A key whose hash code is fixed by the test, so that collisions can be arranged
	private static final class FixedHashKey
	{
		final String id;
		final int hash;
		FixedHashKey(String id, int hash) {this.id=id; this.hash=hash;}
		@Override
		public int hashCode() {return hash;}
		@Override
		public boolean equals(Object obj) {
			if (!(obj instanceof FixedHashKey)) return false;
			return id.equals(((FixedHashKey)obj).id);
		}
		@Override
		public String toString() {return id+"/"+hash;}
	}

	@org.junit.After
	public void cleanup() {
		SysProps.clearAppEnv();
	}

	@org.junit.Test
	public void testResizeOnLoad()
	{
		PrimeSource primes = org.mockito.Mockito.spy(PrimeSource.getDefault());
		DoubleHashingHashMap<Integer,String> hmap = new DoubleHashingHashMap<>(7, 0.75, 2.0, primes);
		org.junit.Assert.assertEquals(7, hmap.capacity());
		for (int idx = 1; idx <= 5; idx++) {
			hmap.put(idx, "v"+idx);
			org.junit.Assert.assertEquals(7, hmap.capacity());
		}
		hmap.put(6, "v6"); //takes the load to 6/7
		org.junit.Assert.assertEquals(17, hmap.capacity());
		hmap.put(7, "v7");
		hmap.put(8, "v8");
		org.junit.Assert.assertEquals(17, hmap.capacity());
		org.junit.Assert.assertEquals(8, hmap.size());
		for (int idx = 1; idx <= 8; idx++) {
			org.junit.Assert.assertEquals("v"+idx, hmap.get(idx));
		}
		org.mockito.Mockito.verify(primes, org.mockito.Mockito.times(1)).nextPrimeAtLeast(14L);
	}

	@org.junit.Test
	public void testLoadBound()
	{
		DoubleHashingHashMap<Integer,Integer> hmap = new DoubleHashingHashMap<>(2, 0.5, 1.5);
		java.util.Map<Integer,Integer> shadow = new java.util.HashMap<>();
		java.util.Random rnd = new java.util.Random(1071);
		long prevcoll = 0;
		int prevcap = hmap.capacity();
		for (int loop = 0; loop != 20000; loop++) {
			Integer key = rnd.nextInt(5000);
			if (rnd.nextInt(3) == 0) {
				org.junit.Assert.assertEquals(shadow.remove(key), hmap.remove(key));
			} else {
				org.junit.Assert.assertEquals(shadow.put(key, loop), hmap.put(key, loop));
			}
			int cap = hmap.capacity();
			org.junit.Assert.assertTrue((double)hmap.size() / cap <= hmap.loadFactor());
			org.junit.Assert.assertTrue(hmap.collisions() >= prevcoll);
			org.junit.Assert.assertTrue(cap >= prevcap);
			if (cap != prevcap) {
				org.junit.Assert.assertTrue("capacity="+cap, BigInteger.valueOf(cap).isProbablePrime(30));
				org.junit.Assert.assertEquals(0, hmap.tombstones());
			}
			org.junit.Assert.assertTrue(hmap.size() + hmap.tombstones() <= cap);
			prevcoll = hmap.collisions();
			prevcap = cap;
		}
		org.junit.Assert.assertEquals(shadow, hmap);
	}

	@org.junit.Test
	public void testTombstones()
	{
		DoubleHashingHashMap<FixedHashKey,String> hmap = new DoubleHashingHashMap<>(11, 0.75, 2.0);
		FixedHashKey a = new FixedHashKey("A", 3);
		FixedHashKey b = new FixedHashKey("B", 3);
		FixedHashKey c = new FixedHashKey("C", 3);
		FixedHashKey d = new FixedHashKey("D", 3);
		hmap.put(a, "a");
		hmap.put(b, "b");
		hmap.put(c, "c");
		org.junit.Assert.assertEquals(3, hmap.collisions()); //B probed once past A, and C twice
		int[] seq = ProbeSequence.sequence(c, hmap.capacity(), 3);

		long coll = hmap.collisions();
		org.junit.Assert.assertEquals("b", hmap.remove(b));
		org.junit.Assert.assertEquals(1, hmap.tombstones());
		org.junit.Assert.assertEquals(2, hmap.size());
		org.junit.Assert.assertFalse(hmap.containsKey(b));
		org.junit.Assert.assertNull(hmap.get(b));
		org.junit.Assert.assertEquals("c", hmap.get(c)); //found beyond the tombstone
		org.junit.Assert.assertEquals(coll, hmap.collisions()); //lookups and removals don't count

		// an existing key beyond a tombstone is overwritten, not duplicated into the tombstone
		org.junit.Assert.assertEquals("c", hmap.put(c, "c2"));
		org.junit.Assert.assertEquals(2, hmap.size());
		org.junit.Assert.assertEquals(1, hmap.tombstones());
		org.junit.Assert.assertEquals("c2", hmap.get(c));
		org.junit.Assert.assertEquals(seq[2], indexOf(hmap, c));

		// a new key reuses the first tombstone on its path, which is B's old slot
		hmap.put(d, "d");
		org.junit.Assert.assertEquals(3, hmap.size());
		org.junit.Assert.assertEquals(0, hmap.tombstones());
		org.junit.Assert.assertEquals(seq[1], indexOf(hmap, d));
		org.junit.Assert.assertEquals(seq[2], indexOf(hmap, c));
		org.junit.Assert.assertEquals("d", hmap.get(d));
		org.junit.Assert.assertEquals("c2", hmap.get(c));
		org.junit.Assert.assertEquals("a", hmap.get(a));
	}

	@org.junit.Test
	public void testProbeExhaustion()
	{
		DoubleHashingHashMap<FixedHashKey,Integer> hmap = new DoubleHashingHashMap<>(5, 0.9, 2.0);
		org.junit.Assert.assertEquals(5, hmap.capacity());
		FixedHashKey[] keys = new FixedHashKey[6];
		for (int idx = 0; idx != keys.length; idx++) {
			keys[idx] = new FixedHashKey("K"+idx, idx);
		}
		for (int idx = 0; idx != 4; idx++) {
			hmap.put(keys[idx], idx);
		}
		org.junit.Assert.assertEquals(0, hmap.collisions());
		hmap.remove(keys[0]);
		hmap.put(keys[4], 4);
		org.junit.Assert.assertEquals(5, hmap.capacity());
		org.junit.Assert.assertEquals(1, hmap.tombstones());

		// every slot is now live or a tombstone, so this key's probe cycle finds no empty slot
		hmap.put(keys[5], 5);
		org.junit.Assert.assertEquals(11, hmap.capacity());
		org.junit.Assert.assertEquals(0, hmap.tombstones());
		org.junit.Assert.assertEquals(5, hmap.size());
		org.junit.Assert.assertFalse(hmap.containsKey(keys[0]));
		for (int idx = 1; idx != keys.length; idx++) {
			org.junit.Assert.assertEquals(Integer.valueOf(idx), hmap.get(keys[idx]));
		}
	}

	@org.junit.Test
	public void testExhaustedPrimeTable()
	{
		PrimeSource primes = new PrimeSource(new int[]{2, 3, 5, 7});
		DoubleHashingHashMap<Integer,Integer> hmap = new DoubleHashingHashMap<>(7, 0.75, 2.0, primes);
		for (int idx = 1; idx <= 5; idx++) {
			hmap.put(idx, idx);
		}
		try {
			hmap.put(6, 6);
			org.junit.Assert.fail("Expected prime table to be exhausted");
		} catch (ExhaustedPrimeTableException ex) {
			org.junit.Assert.assertEquals(14, ex.getRequested());
		}
		// the failed insert leaves the map untouched
		org.junit.Assert.assertEquals(5, hmap.size());
		org.junit.Assert.assertEquals(7, hmap.capacity());
		org.junit.Assert.assertFalse(hmap.containsKey(6));
		for (int idx = 1; idx <= 5; idx++) {
			org.junit.Assert.assertEquals(Integer.valueOf(idx), hmap.get(idx));
		}
		// existing keys can still be updated
		org.junit.Assert.assertEquals(Integer.valueOf(5), hmap.put(5, 50));

		try {
			new DoubleHashingHashMap<Integer,Integer>(8, 0.75, 2.0, primes);
			org.junit.Assert.fail("Expected initial capacity beyond prime table to fail");
		} catch (ExhaustedPrimeTableException ex) {}
	}

	@org.junit.Test
	public void testInvalidSettings()
	{
		verifyInvalid(1, 0.75, 2.0);
		verifyInvalid(0, 0.75, 2.0);
		verifyInvalid(-5, 0.75, 2.0);
		verifyInvalid(10, 0, 2.0);
		verifyInvalid(10, 1.0, 2.0);
		verifyInvalid(10, -0.5, 2.0);
		verifyInvalid(10, Double.NaN, 2.0);
		verifyInvalid(10, 0.75, 1.0);
		verifyInvalid(10, 0.75, 0.5);
		DoubleHashingHashMap<String,String> hmap = new DoubleHashingHashMap<>(2, 0.01, 1.01);
		org.junit.Assert.assertEquals(2, hmap.capacity());
		hmap.put("one", "1");
		org.junit.Assert.assertTrue(hmap.capacity() >= 100);
	}

	@org.junit.Test
	public void testDefaults()
	{
		DoubleHashingHashMap<String,String> hmap = new DoubleHashingHashMap<>();
		org.junit.Assert.assertEquals(17, hmap.capacity());
		org.junit.Assert.assertEquals(0.75, hmap.loadFactor(), 0);
		org.junit.Assert.assertEquals(2.0, hmap.growthFactor(), 0);
		org.junit.Assert.assertEquals(0, hmap.collisions());
		org.junit.Assert.assertEquals(0, hmap.tombstones());
	}

	@org.junit.Test
	public void testConfigOverrides()
	{
		SysProps.setAppEnv(DoubleHashingHashMap.SYSPROP_INITCAP, "30");
		SysProps.setAppEnv(DoubleHashingHashMap.SYSPROP_LOADFACTOR, "0.5");
		SysProps.setAppEnv(DoubleHashingHashMap.SYSPROP_GROWTH, "3");
		DoubleHashingHashMap<String,String> hmap = new DoubleHashingHashMap<>();
		org.junit.Assert.assertEquals(31, hmap.capacity());
		org.junit.Assert.assertEquals(0.5, hmap.loadFactor(), 0);
		org.junit.Assert.assertEquals(3.0, hmap.growthFactor(), 0);

		SysProps.setAppEnv(DoubleHashingHashMap.SYSPROP_LOADFACTOR, "high");
		try {
			new DoubleHashingHashMap<String,String>();
			org.junit.Assert.fail("Expected malformed load factor to be rejected");
		} catch (IndexConfigException ex) {
			org.junit.Assert.assertTrue(ex.getMessage(), ex.getMessage().contains(DoubleHashingHashMap.SYSPROP_LOADFACTOR));
		}
		SysProps.setAppEnv(DoubleHashingHashMap.SYSPROP_LOADFACTOR, "1.5");
		try {
			new DoubleHashingHashMap<String,String>();
			org.junit.Assert.fail("Expected out-of-range load factor to be rejected");
		} catch (InvalidCapacityException ex) {}
	}

	@org.junit.Test
	public void testNullKey()
	{
		DoubleHashingHashMap<String,String> hmap = new DoubleHashingHashMap<>(5);
		try {
			hmap.put(null, "v");
			org.junit.Assert.fail("Null key was accepted");
		} catch (NullPointerException ex) {}
		try {
			hmap.get(null);
			org.junit.Assert.fail("Null key was accepted by get");
		} catch (NullPointerException ex) {}
		try {
			hmap.remove(null);
			org.junit.Assert.fail("Null key was accepted by remove");
		} catch (NullPointerException ex) {}
		org.junit.Assert.assertTrue(hmap.isEmpty());
	}

	@org.junit.Test
	public void testClearRetainsHistory()
	{
		DoubleHashingHashMap<FixedHashKey,Integer> hmap = new DoubleHashingHashMap<>(11, 0.75, 2.0);
		for (int idx = 0; idx != 5; idx++) {
			hmap.put(new FixedHashKey("K"+idx, 4), idx);
		}
		hmap.remove(new FixedHashKey("K2", 4));
		int cap = hmap.capacity();
		long coll = hmap.collisions();
		org.junit.Assert.assertEquals(11, cap);
		org.junit.Assert.assertEquals(10, coll); //each key probes once past every key inserted before it
		org.junit.Assert.assertEquals(1, hmap.tombstones());
		hmap.clear();
		org.junit.Assert.assertEquals(0, hmap.size());
		org.junit.Assert.assertEquals(0, hmap.tombstones());
		org.junit.Assert.assertEquals(cap, hmap.capacity());
		org.junit.Assert.assertEquals(coll, hmap.collisions());

		// the table is empty again, so a fresh insert adds nothing to the count
		hmap.put(new FixedHashKey("K0", 4), 0);
		org.junit.Assert.assertEquals(coll, hmap.collisions());
	}

	@org.junit.Test
	public void testFailedGrowthLeavesCollisions()
	{
		PrimeSource primes = new PrimeSource(new int[]{2, 3, 5, 7});
		DoubleHashingHashMap<Integer,Integer> hmap = new DoubleHashingHashMap<>(7, 0.75, 2.0, primes);
		for (int idx = 1; idx <= 5; idx++) {
			hmap.put(idx * 7, idx);
		}
		long coll = hmap.collisions();
		org.junit.Assert.assertTrue(coll > 0);
		try {
			hmap.put(42, 6); //shares home slot 0 with every other key, so its probe collides before growth fails
			org.junit.Assert.fail("Expected prime table to be exhausted");
		} catch (ExhaustedPrimeTableException ex) {}
		org.junit.Assert.assertEquals(coll, hmap.collisions());
		org.junit.Assert.assertEquals(5, hmap.size());
		org.junit.Assert.assertFalse(hmap.containsKey(42));
	}

	@org.junit.Test
	public void testToString()
	{
		DoubleHashingHashMap<String,Integer> hmap = new DoubleHashingHashMap<>(5);
		hmap.put("EUR", 1);
		String str = hmap.toString();
		org.junit.Assert.assertTrue(str, str.endsWith("=1/5 {EUR=1}"));
	}

	private static void verifyInvalid(int initcap, double factor, double growth)
	{
		try {
			new DoubleHashingHashMap<String,String>(initcap, factor, growth);
			org.junit.Assert.fail("Expected rejection of initcap="+initcap+", factor="+factor+", growth="+growth);
		} catch (InvalidCapacityException ex) {
			org.junit.Assert.assertTrue(ex.error());
		}
	}

	private static int indexOf(DoubleHashingHashMap<?,?> hmap, Object key)
	{
		for (int slot = 0; slot != hmap.capacity(); slot++) {
			if (hmap.isLive(slot) && hmap.getSlotKey(slot).equals(key)) return slot;
		}
		return -1;
	}
}
