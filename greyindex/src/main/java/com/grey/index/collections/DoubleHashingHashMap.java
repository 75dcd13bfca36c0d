/*
 * Copyright 2024 Yusef Badri - All rights reserved.
 * NAF is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.grey.index.collections;

import java.util.ConcurrentModificationException;

import org.slf4j.LoggerFactory;

import com.grey.index.config.SysProps;
import com.grey.index.errors.ExhaustedPrimeTableException;
import com.grey.index.errors.InvalidCapacityException;

/**
 * This class implements the {@link java.util.Map} interface as an open-addressing hash table which resolves collisions by
 * double hashing.
 * <br>
 * Keys and values are held in two parallel arrays whose length (the capacity) is always a prime taken from a {@link PrimeSource}.
 * A key is sought along its probe sequence, as defined by {@link ProbeSequence}, which visits every slot once per cycle.
 * Removed keys leave a tombstone behind so that the probe sequences of other keys which passed over that slot remain intact.
 * Lookups skip tombstones, and insertions reuse the first one they pass. Tombstones are only purged when the table is resized,
 * since removals never shrink it.
 * <p>
 * The table grows (to the first prime at or above capacity*growthFactor) whenever an insertion takes the ratio of live entries
 * to capacity above the load factor, or when an insertion finds no empty slot along its entire probe sequence.
 * The resized table is rebuilt by re-inserting each live entry.
 * <p>
 * Each probe beyond the first attempt of an insertion counts as a collision, and {@link #collisions()} reports the cumulative
 * count over the lifetime of the map. Neither resizing nor {@link #clear()} resets it.
 * <p>
 * Null keys are not supported, but null values are.<br>
 * Beware that this class is single-threaded and non-reentrant. Callers which share an instance between threads must hold their
 * own lock around every call, including iteration.
 */
public class DoubleHashingHashMap<K,V>
	implements java.util.Map<K,V>
{
	private static final org.slf4j.Logger Logger = LoggerFactory.getLogger(DoubleHashingHashMap.class);

	public static final String SYSPROP_INITCAP = "grey.dhmap.initcap";
	public static final String SYSPROP_LOADFACTOR = "grey.dhmap.loadfactor";
	public static final String SYSPROP_GROWTH = "grey.dhmap.growth";

	private static final int DFLT_CAP = 17;
	private static final double DFLT_LOADFACTOR = 0.75;
	private static final double DFLT_GROWTH = 2.0;

	private static final Object TOMBSTONE = new Object(); //marks slots vacated by a removal
	private static final int PROBE_EXHAUSTED = Integer.MIN_VALUE;

	private final PrimeSource primes;
	private final double loadfactor;
	private final double growth;

	private Object[] keys; //null means never occupied
	private Object[] vals;
	private int capacity;
	private int entrycnt;
	private int tombstonecnt;
	private long collisions;
	int modcnt;

	//these classes are stateless, so allocate just once, on first usage
	private KeysCollection<K,V> keysview;
	private ValuesCollection<K,V> valuesview;
	private EntriesCollection<K,V> entriesview;

	public DoubleHashingHashMap() {
		this(SysProps.get(SYSPROP_INITCAP, DFLT_CAP));
	}

	public DoubleHashingHashMap(int initcap) {
		this(initcap, SysProps.get(SYSPROP_LOADFACTOR, DFLT_LOADFACTOR), SysProps.get(SYSPROP_GROWTH, DFLT_GROWTH));
	}

	public DoubleHashingHashMap(int initcap, double factor, double growthFactor) {
		this(initcap, factor, growthFactor, PrimeSource.getDefault());
	}

	/**
	 * @param initcap The requested initial capacity, which is rounded up to the nearest prime in the table. Must exceed 1.
	 * @param factor The load factor threshold, in the open range (0, 1)
	 * @param growthFactor The minimum ratio of new capacity to old when the table grows. Must exceed 1.
	 * @param primes The source of table capacities
	 */
	public DoubleHashingHashMap(int initcap, double factor, double growthFactor, PrimeSource primes)
	{
		if (initcap <= 1) throw new InvalidCapacityException("Initial capacity must exceed 1 - "+initcap);
		if (!(factor > 0 && factor < 1)) throw new InvalidCapacityException("Load factor must be in (0,1) - "+factor);
		if (!(growthFactor > 1)) throw new InvalidCapacityException("Growth factor must exceed 1 - "+growthFactor);
		this.primes = primes;
		loadfactor = factor;
		growth = growthFactor;
		capacity = primes.nextPrimeAtLeast(initcap);
		keys = new Object[capacity];
		vals = new Object[capacity];
	}

	@Override
	public int size() {return entrycnt;}
	@Override
	public boolean isEmpty() {return (entrycnt == 0);}

	public int capacity() {return capacity;}
	public long collisions() {return collisions;}
	public int tombstones() {return tombstonecnt;}
	public double loadFactor() {return loadfactor;}
	public double growthFactor() {return growth;}

	@Override
	public boolean containsKey(Object key)
	{
		return (probe(key, false) >= 0);
	}

	@Override
	public V get(Object key)
	{
		int slot = probe(key, false);
		if (slot < 0) return null;
		@SuppressWarnings("unchecked") V val = (V)vals[slot];
		return val;
	}

	@Override
	public V put(K key, V value)
	{
		for (;;) {
			final long prevcoll = collisions;
			int slot = probe(key, true);
			if (slot >= 0) {
				// updating the value of an existing key
				@SuppressWarnings("unchecked") V oldval = (V)vals[slot];
				vals[slot] = value;
				return oldval;
			}
			int newcap = 0;
			try {
				if (slot == PROBE_EXHAUSTED) {
					// every slot on this key's cycle is live or a tombstone, so rebuild into a larger table and try again
					resize(targetCapacity(entrycnt + 1));
					continue;
				}
				if (exceedsLoad(entrycnt + 1, capacity)) {
					// work out the new size before touching the table, so that an exhausted prime table leaves it intact
					newcap = targetCapacity(entrycnt + 1);
				}
			} catch (ExhaustedPrimeTableException ex) {
				collisions = prevcoll; //the failed insert leaves no trace, not even in the counter
				throw ex;
			}
			slot = -slot - 1;
			if (keys[slot] == TOMBSTONE) tombstonecnt--;
			keys[slot] = key;
			vals[slot] = value;
			entrycnt++;
			modcnt++;
			if (newcap != 0) resize(newcap);
			return null;
		}
	}

	@Override
	public V remove(Object key)
	{
		int slot = probe(key, false);
		if (slot < 0) return null;
		@SuppressWarnings("unchecked") V oldval = (V)vals[slot];
		removeSlot(slot);
		return oldval;
	}

	void removeSlot(int slot)
	{
		keys[slot] = TOMBSTONE;
		vals[slot] = null;
		entrycnt--;
		tombstonecnt++;
		modcnt++;
	}

	// Capacity and the collision count survive this, as the table never shrinks.
	@Override
	public void clear()
	{
		java.util.Arrays.fill(keys, null);
		java.util.Arrays.fill(vals, null);
		entrycnt = 0;
		tombstonecnt = 0;
		modcnt++;
	}

	@Override
	public boolean containsValue(Object val)
	{
		for (int idx = 0; idx != capacity; idx++) {
			if (isLive(idx) && compareObjects(val, vals[idx])) return true;
		}
		return false;
	}

	@Override
	public void putAll(java.util.Map<? extends K, ? extends V> srcmap)
	{
		for (java.util.Map.Entry<? extends K, ? extends V> entry : srcmap.entrySet()) {
			put(entry.getKey(), entry.getValue());
		}
	}

	/*
	 * Walks the key's probe sequence for at most one full cycle.
	 * Returns the slot holding the key if found. Otherwise returns -(slot)-1 where slot is the first tombstone passed over,
	 * or else the empty slot which terminated the search, or PROBE_EXHAUSTED if the cycle contained no empty slot.
	 */
	private int probe(Object key, boolean countCollisions)
	{
		if (key == null) throw new NullPointerException("Null keys are not supported");
		final int home = ProbeSequence.home(ProbeSequence.hash(key), capacity);
		final int step = ProbeSequence.step(ProbeSequence.hash2(key), capacity);
		int firstAvail = -1;

		for (int attempt = 0; attempt != capacity; attempt++) {
			if (countCollisions && attempt != 0) collisions++;
			int slot = ProbeSequence.slot(home, step, attempt, capacity);
			Object k = keys[slot];
			if (k == null) {
				return -(firstAvail == -1 ? slot : firstAvail) - 1;
			}
			if (k == TOMBSTONE) {
				if (firstAvail == -1) firstAvail = slot;
			} else if (k == key || k.equals(key)) {
				return slot;
			}
		}
		return PROBE_EXHAUSTED;
	}

	private boolean exceedsLoad(int population, int cap)
	{
		return ((double)population / cap > loadfactor);
	}

	private int targetCapacity(int population)
	{
		int newcap = capacity;
		do {
			newcap = primes.nextPrimeAtLeast((long)Math.ceil(newcap * growth));
		} while (exceedsLoad(population, newcap));
		return newcap;
	}

	private void resize(int newcap)
	{
		final Object[] oldkeys = keys;
		final Object[] oldvals = vals;
		final int oldcap = capacity;
		final int purged = tombstonecnt;
		capacity = newcap;
		keys = new Object[capacity];
		vals = new Object[capacity];
		tombstonecnt = 0;

		// The new table has no tombstones and no duplicates, so each key simply goes into the first empty slot of its sequence.
		for (int idx = 0; idx != oldcap; idx++) {
			Object k = oldkeys[idx];
			if (k == null || k == TOMBSTONE) continue;
			int slot = -probe(k, true) - 1;
			keys[slot] = k;
			vals[slot] = oldvals[idx];
		}
		modcnt++;
		if (Logger.isDebugEnabled()) {
			Logger.debug("Resized capacity="+oldcap+" to "+capacity+" with entries="+entrycnt+", purged tombstones="+purged
					+", collisions="+collisions);
		}
	}

	boolean isLive(int slot)
	{
		Object k = keys[slot];
		return (k != null && k != TOMBSTONE);
	}

	// provide access to private members for the inner classes
	@SuppressWarnings("unchecked")
	K getSlotKey(int slot) {return (K)keys[slot];}
	@SuppressWarnings("unchecked")
	V getSlotValue(int slot) {return (V)vals[slot];}

	static boolean compareObjects(Object o1, Object o2) {
		if (o1 == null) return (o2 == null);
		return (o1 == o2 || o1.equals(o2));
	}

	@Override
	public boolean equals(Object obj)
	{
		if (obj == this) return true;
		if (!(obj instanceof java.util.Map)) return false;
		java.util.Map<?,?> other = (java.util.Map<?,?>)obj;
		if (other.size() != size()) return false;
		for (int idx = 0; idx != capacity; idx++) {
			if (!isLive(idx)) continue;
			Object k = keys[idx];
			Object v = vals[idx];
			if (v == null) {
				if (other.get(k) != null || !other.containsKey(k)) return false;
			} else {
				if (!v.equals(other.get(k))) return false;
			}
		}
		return true;
	}

	@Override
	public int hashCode()
	{
		int h = 0;
		for (int idx = 0; idx != capacity; idx++) {
			if (!isLive(idx)) continue;
			h += keys[idx].hashCode() ^ (vals[idx] == null ? 0 : vals[idx].hashCode());
		}
		return h;
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder(size() * 8);
		sb.append(getClass().getName()).append('=').append(size()).append('/').append(capacity).append(" {");
		String dlm = "";
		for (int idx = 0; idx != capacity; idx++) {
			if (!isLive(idx)) continue;
			sb.append(dlm).append(keys[idx]).append('=').append(vals[idx]);
			dlm = ", ";
		}
		sb.append("}");
		return sb.toString();
	}

	/*
	 * These required Map methods provide Collections views of this object.
	 */
	@Override
	public java.util.Set<K> keySet()
	{
		if (keysview == null) keysview = new KeysCollection<K,V>(this);
		return keysview;
	}

	@Override
	public java.util.Collection<V> values()
	{
		if (valuesview == null) valuesview = new ValuesCollection<K,V>(this);
		return valuesview;
	}

	@Override
	public java.util.Set<java.util.Map.Entry<K,V>> entrySet()
	{
		if (entriesview == null) entriesview = new EntriesCollection<K,V>(this);
		return entriesview;
	}


	/*
	 * ===================================================================================================================
	 * These inner classes all exist purely to support the required Collections views of this map.
	 * ===================================================================================================================
	 */

	private static final class KeysCollection<K, V>
		extends java.util.AbstractSet<K>
	{
		private final DoubleHashingHashMap<K, V> map;
		KeysCollection(DoubleHashingHashMap<K, V> m) {map = m;}
		@Override
		public int size() {return map.size();}
		@Override
		public java.util.Iterator<K> iterator() {return new KeysIterator<K,V>(map);}
		@Override
		public boolean contains(Object obj) {return map.containsKey(obj);}
		@Override
		public boolean remove(Object obj) {if (!map.containsKey(obj)) return false; map.remove(obj); return true;}
		@Override
		public void clear() {map.clear();}
	}


	private static final class ValuesCollection<K, V>
		extends java.util.AbstractCollection<V>
	{
		private final DoubleHashingHashMap<K, V> map;
		ValuesCollection(DoubleHashingHashMap<K, V> m) {map = m;}
		@Override
		public int size() {return map.size();}
		@Override
		public java.util.Iterator<V> iterator() {return new ValuesIterator<K,V>(map);}
		@Override
		public boolean contains(Object obj) {return map.containsValue(obj);}
		@Override
		public void clear() {map.clear();}
	}


	private static final class EntriesCollection<K, V>
		extends java.util.AbstractSet<java.util.Map.Entry<K,V>>
	{
		private final DoubleHashingHashMap<K, V> map;
		EntriesCollection(DoubleHashingHashMap<K, V> m) {map = m;}
		@Override
		public int size() {return map.size();}
		@Override
		public java.util.Iterator<java.util.Map.Entry<K, V>> iterator() {return new EntriesIterator<K,V>(map);}

		@Override
		public boolean contains(Object obj) {
			if (!(obj instanceof java.util.Map.Entry)) return false;
			java.util.Map.Entry<?,?> entry2 = (java.util.Map.Entry<?,?>)obj;
			Object k2 = entry2.getKey();
			if (k2 == null || !map.containsKey(k2)) return false;
			return compareObjects(map.get(k2), entry2.getValue());
		}

		@Override
		public boolean remove(Object obj) {
			if (!contains(obj)) return false;
			map.remove(((java.util.Map.Entry<?,?>)obj).getKey());
			return true;
		}

		@Override
		public void clear() {map.clear();}
	}


	// An entry that reads and writes through to the map, for as long as its key remains a member.
	static final class LinkedEntry<K,V>
		implements java.util.Map.Entry<K,V>
	{
		private final DoubleHashingHashMap<K,V> map;
		private final K key;
		LinkedEntry(DoubleHashingHashMap<K,V> m, K k) {map=m; key=k;}
		@Override
		public K getKey() {return key;}
		@Override
		public V getValue() {return map.get(key);}
		@Override
		public V setValue(V v) {
			V oldval = getValue();
			if (oldval != null || map.containsKey(key)) map.put(key, v); //is still a member of the map
			return oldval;
		}
		@Override
		public boolean equals(Object obj) {
			if (obj == this) return true;
			if (!(obj instanceof java.util.Map.Entry)) return false;
			java.util.Map.Entry<?,?> ment = (java.util.Map.Entry<?,?>)obj;
			return (compareObjects(key, ment.getKey()) && compareObjects(getValue(), ment.getValue()));
		}
		@Override
		public int hashCode() {
			V v = getValue();
			return key.hashCode() ^ (v == null ? 0 : v.hashCode());
		}
		@Override
		public String toString() {return key+"="+getValue();}
	}


	private static final class KeysIterator<K, V>
		extends SlotIterator<K, K, V>
	{
		KeysIterator(DoubleHashingHashMap<K, V> m) {super(m);}
		@Override
		protected K getCurrentElement(int slot) {return map.getSlotKey(slot);}
	}

	private static final class ValuesIterator<K, V>
		extends SlotIterator<V, K, V>
	{
		ValuesIterator(DoubleHashingHashMap<K, V> m) {super(m);}
		@Override
		protected V getCurrentElement(int slot) {return map.getSlotValue(slot);}
	}

	private static final class EntriesIterator<K, V>
		extends SlotIterator<java.util.Map.Entry<K, V>, K, V>
	{
		EntriesIterator(DoubleHashingHashMap<K, V> m) {super(m);}
		@Override
		protected java.util.Map.Entry<K, V> getCurrentElement(int slot) {return new LinkedEntry<K,V>(map, map.getSlotKey(slot));}
	}


	// Scans the slots in index order. Removal just tombstones the current slot, so it doesn't disturb the scan.
	private static abstract class SlotIterator<T, K, V>
		implements java.util.Iterator<T>
	{
		protected final DoubleHashingHashMap<K, V> map;
		private int slot = -1;
		private int next_slot = -1;
		private int expmodcnt;

		protected abstract T getCurrentElement(int slot);

		SlotIterator(DoubleHashingHashMap<K, V> m) {
			map = m;
			expmodcnt = map.modcnt;
			moveNext();
		}

		@Override
		public final boolean hasNext()
		{
			return (next_slot != map.capacity());
		}

		@Override
		public final T next()
		{
			if (map.modcnt != expmodcnt) throw new ConcurrentModificationException("Next on "+getClass().getName());
			if (!hasNext()) throw new java.util.NoSuchElementException();
			slot = next_slot;
			moveNext();
			return getCurrentElement(slot);
		}

		@Override
		public final void remove()
		{
			if (slot == -1) throw new IllegalStateException();
			if (map.modcnt != expmodcnt) throw new ConcurrentModificationException("Remove on "+getClass().getName());
			map.removeSlot(slot);
			slot = -1;
			expmodcnt = map.modcnt;
		}

		private void moveNext()
		{
			while (++next_slot != map.capacity()) {
				if (map.isLive(next_slot)) break;
			}
		}
	}
}
