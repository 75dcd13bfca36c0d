/*
 * Copyright 2024 Yusef Badri - All rights reserved.
 * NAF is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.grey.index.collections;

/**
 * The double-hashing probe functions.
 * <br>
 * Attempt i for a key examines slot (h1 + i*h2) mod capacity, where h1 is the home slot derived from the key's primary hash
 * and h2 is a step in [1, capacity-1] derived from an independent secondary hash. For a prime capacity every such step is
 * coprime with it, so the first capacity attempts visit each slot exactly once.
 * <br>
 * These are pure functions of their arguments, so a key's probe sequence can be reproduced without reference to any table.
 */
public final class ProbeSequence
{
	private ProbeSequence() {} //not instantiable

	// Folds the high bits of hashCode() into the low ones, since weak hashes (eg. Integer) vary mainly in the low bits.
	public static int hash(Object key)
	{
		int h = key.hashCode();
		return (h ^ (h >>> 16)) & Integer.MAX_VALUE;
	}

	// The 32-bit finaliser from MurmurHash3, which decorrelates the step from the home slot.
	public static int hash2(Object key)
	{
		int h = key.hashCode();
		h ^= h >>> 16;
		h *= 0x85ebca6b;
		h ^= h >>> 13;
		h *= 0xc2b2ae35;
		h ^= h >>> 16;
		return h & Integer.MAX_VALUE;
	}

	public static int home(int hash, int capacity)
	{
		return hash % capacity;
	}

	public static int step(int hash2, int capacity)
	{
		return 1 + (hash2 % (capacity - 1));
	}

	public static int slot(int home, int step, int attempt, int capacity)
	{
		return (int)((home + (long)attempt * step) % capacity);
	}

	/**
	 * Returns the first n slots of the probe sequence of the given key, mainly as a diagnostic.
	 */
	public static int[] sequence(Object key, int capacity, int n)
	{
		int home = home(hash(key), capacity);
		int step = step(hash2(key), capacity);
		int[] slots = new int[n];
		for (int idx = 0; idx != n; idx++) {
			slots[idx] = slot(home, step, idx, capacity);
		}
		return slots;
	}
}
