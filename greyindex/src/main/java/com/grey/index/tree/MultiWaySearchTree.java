/*
 * Copyright 2024 Yusef Badri - All rights reserved.
 * NAF is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.grey.index.tree;

import java.util.Comparator;
import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.Map;

import org.slf4j.LoggerFactory;

import com.grey.index.config.SysProps;
import com.grey.index.errors.DuplicateKeyException;
import com.grey.index.errors.InvalidCapacityException;

/**
 * A balanced multiway search tree of order m, mapping unique keys to values.
 * <br>
 * Each node holds up to m-1 entries in ascending key order, and an internal node with k entries has k+1 children, where the
 * keys in child i lie strictly between entries i-1 and i. Every node apart from the root holds at least ceil(m/2)-1 entries and
 * all the leaves are at the same depth, so for order 4 this is the familiar 2-3-4 tree.
 * <p>
 * Insertions go into a leaf, and a node which overflows is split about its median entry, which is promoted into the parent.
 * Splits may cascade up to the root, whose own split adds a level to the tree.
 * A removal from an internal node is replaced by the removal of its in-order predecessor from a leaf. A node which underflows
 * borrows an entry from an adjacent sibling via the parent if either sibling can spare one, or else merges with a sibling and
 * the parent entry separating them. Merges may cascade up to the root, and a root emptied in this way is replaced by its only
 * child, removing a level.
 * <p>
 * Keys are ordered by the supplied {@link Comparator}, or by their natural ordering if none is supplied. Duplicate keys are
 * rejected with {@link DuplicateKeyException}, and lookups for absent keys return null. Null keys are not supported.
 * <p>
 * Beware that this class is single-threaded and non-reentrant. Callers which share an instance between threads must hold their
 * own lock around every call, including iteration.
 */
public class MultiWaySearchTree<K,V>
{
	private static final org.slf4j.Logger Logger = LoggerFactory.getLogger(MultiWaySearchTree.class);

	public static final String SYSPROP_ORDER = "grey.mwtree.order";
	private static final int DFLT_ORDER = 4;
	private static final int MIN_ORDER = 3;

	private final int order;
	private final int maxEntries;
	private final int minEntries;
	private final Comparator<? super K> cmp;

	private MultiWayNode<K,V> root;
	private int levels;
	private int entrycnt;
	private int modcnt;

	public int order() {return order;}
	public int size() {return entrycnt;}
	public boolean isEmpty() {return (entrycnt == 0);}
	public int height() {return levels;}

	public MultiWaySearchTree() {
		this(SysProps.get(SYSPROP_ORDER, DFLT_ORDER));
	}

	public MultiWaySearchTree(int order) {
		this(order, null);
	}

	/**
	 * @param order The maximum number of children per node, which must be at least 3
	 * @param comparator The key ordering, or null for the natural ordering of the keys
	 */
	public MultiWaySearchTree(int order, Comparator<? super K> comparator)
	{
		if (order < MIN_ORDER) throw new InvalidCapacityException("Tree order must be at least "+MIN_ORDER+" - "+order);
		this.order = order;
		maxEntries = order - 1;
		minEntries = (order + 1) / 2 - 1;
		if (comparator == null) {
			cmp = MultiWaySearchTree.<K>naturalOrder();
		} else {
			cmp = comparator;
		}
		root = new MultiWayNode<>(order);
		levels = 1;
	}

	public void clear()
	{
		root = new MultiWayNode<>(order);
		levels = 1;
		entrycnt = 0;
		modcnt++;
	}

	public V get(Object key)
	{
		K k = castKey(key);
		MultiWayNode<K,V> node = root;
		for (;;) {
			int idx = node.find(k, cmp);
			if (idx >= 0) return node.value(idx);
			if (node.isLeaf()) return null;
			node = node.child(-idx - 1);
		}
	}

	public boolean containsKey(Object key)
	{
		K k = castKey(key);
		MultiWayNode<K,V> node = root;
		for (;;) {
			int idx = node.find(k, cmp);
			if (idx >= 0) return true;
			if (node.isLeaf()) return false;
			node = node.child(-idx - 1);
		}
	}

	/**
	 * Adds a new key.
	 * @throws DuplicateKeyException if the key is already present, in which case the tree is left unchanged
	 */
	public void insert(K key, V value)
	{
		if (key == null) throw new NullPointerException("Null keys are not supported");
		@SuppressWarnings("unchecked") MultiWayNode<K,V>[] path = (MultiWayNode<K,V>[])new MultiWayNode<?,?>[levels];
		int[] slots = new int[levels];
		MultiWayNode<K,V> node = root;
		int depth = 0;

		// descend to the leaf, recording the child index taken at each level
		for (;;) {
			int idx = node.find(key, cmp);
			if (idx >= 0) throw new DuplicateKeyException(key);
			path[depth] = node;
			slots[depth] = -idx - 1;
			if (node.isLeaf()) break;
			node = node.child(slots[depth++]);
		}
		node.insertEntry(slots[depth], key, value, null, cmp);
		entrycnt++;
		modcnt++;

		while (node.count() > maxEntries) {
			int mid = node.count() / 2;
			K midkey = node.key(mid);
			V midval = node.value(mid);
			MultiWayNode<K,V> right = node.splitOff();
			if (depth == 0) {
				root = new MultiWayNode<>(order, node, midkey, midval, right);
				levels++;
				if (Logger.isTraceEnabled()) Logger.trace("Root split on key="+midkey+" - height="+levels+", size="+entrycnt);
				break;
			}
			node = path[--depth];
			node.insertEntry(slots[depth], midkey, midval, right, cmp);
		}
	}

	/**
	 * Removes a key.
	 * @return the value it was mapped to, or null if the key was not found
	 */
	public V remove(Object key)
	{
		K k = castKey(key);
		@SuppressWarnings("unchecked") MultiWayNode<K,V>[] path = (MultiWayNode<K,V>[])new MultiWayNode<?,?>[levels];
		int[] slots = new int[levels];
		MultiWayNode<K,V> node = root;
		int depth = 0;
		int idx;

		for (;;) {
			idx = node.find(k, cmp);
			path[depth] = node;
			if (idx >= 0) break;
			if (node.isLeaf()) return null;
			slots[depth] = -idx - 1;
			node = node.child(slots[depth++]);
		}
		V oldval = node.value(idx);

		if (node.isLeaf()) {
			node.removeEntry(idx);
		} else {
			// replace with the in-order predecessor, ie. the final entry of the rightmost leaf of the left subtree
			MultiWayNode<K,V> target = node;
			slots[depth] = idx;
			node = node.child(idx);
			depth++;
			while (!node.isLeaf()) {
				path[depth] = node;
				slots[depth++] = node.count();
				node = node.child(node.count());
			}
			path[depth] = node;
			int last = node.count() - 1;
			target.replaceEntry(idx, node.key(last), node.value(last));
			node.removeEntry(last);
		}
		entrycnt--;
		modcnt++;

		while (depth != 0 && node.count() < minEntries) {
			MultiWayNode<K,V> parent = path[depth - 1];
			int pos = slots[depth - 1];
			MultiWayNode<K,V> lsib = (pos == 0 ? null : parent.child(pos - 1));
			MultiWayNode<K,V> rsib = (pos == parent.count() ? null : parent.child(pos + 1));

			if (lsib != null && lsib.count() > minEntries) {
				rotateRight(parent, pos - 1, lsib, node);
				break;
			}
			if (rsib != null && rsib.count() > minEntries) {
				rotateLeft(parent, pos, node, rsib);
				break;
			}
			if (lsib != null) {
				merge(parent, pos - 1, lsib, node);
			} else {
				merge(parent, pos, node, rsib);
			}
			node = parent;
			depth--;
		}

		if (root.count() == 0 && !root.isLeaf()) {
			root = root.child(0);
			levels--;
			if (Logger.isTraceEnabled()) Logger.trace("Root collapsed - height="+levels+", size="+entrycnt);
		}
		return oldval;
	}

	// Moves the separator at sep down into node (left of its entries), and the final entry of its left sibling up to replace it.
	private void rotateRight(MultiWayNode<K,V> parent, int sep, MultiWayNode<K,V> lsib, MultiWayNode<K,V> node)
	{
		int last = lsib.count() - 1;
		K k = lsib.key(last);
		V v = lsib.value(last);
		MultiWayNode<K,V> movedChild = lsib.removeEntry(last);
		node.insertFirst(parent.key(sep), parent.value(sep), movedChild, cmp);
		parent.replaceEntry(sep, k, v);
	}

	// Moves the separator at sep down into node (right of its entries), and the first entry of its right sibling up to replace it.
	private void rotateLeft(MultiWayNode<K,V> parent, int sep, MultiWayNode<K,V> node, MultiWayNode<K,V> rsib)
	{
		K k = rsib.key(0);
		V v = rsib.value(0);
		MultiWayNode<K,V> movedChild = rsib.removeFirst();
		node.insertEntry(node.count(), parent.key(sep), parent.value(sep), movedChild, cmp);
		parent.replaceEntry(sep, k, v);
	}

	// Folds the separator at sep and the right-hand node into the left-hand one, and detaches the right one from the parent.
	private void merge(MultiWayNode<K,V> parent, int sep, MultiWayNode<K,V> left, MultiWayNode<K,V> right)
	{
		left.absorb(parent.key(sep), parent.value(sep), right);
		parent.removeEntry(sep);
	}

	public K firstKey()
	{
		if (entrycnt == 0) return null;
		MultiWayNode<K,V> node = root;
		while (!node.isLeaf()) node = node.child(0);
		return node.key(0);
	}

	public K lastKey()
	{
		if (entrycnt == 0) return null;
		return maxKey(root);
	}

	/**
	 * Returns the greatest key strictly less than the given one, or null if there is none.
	 */
	public K lowerKey(K key)
	{
		MultiWayNode<K,V> node = root;
		K best = null;
		for (;;) {
			int idx = node.find(key, cmp);
			if (idx >= 0) {
				if (!node.isLeaf()) return maxKey(node.child(idx));
				return (idx == 0 ? best : node.key(idx - 1));
			}
			int pos = -idx - 1;
			if (pos != 0) best = node.key(pos - 1);
			if (node.isLeaf()) return best;
			node = node.child(pos);
		}
	}

	/**
	 * Returns the least key strictly greater than the given one, or null if there is none.
	 */
	public K higherKey(K key)
	{
		MultiWayNode<K,V> node = root;
		K best = null;
		for (;;) {
			int idx = node.find(key, cmp);
			if (idx >= 0) {
				if (!node.isLeaf()) return minKey(node.child(idx + 1));
				return (idx == node.count() - 1 ? best : node.key(idx + 1));
			}
			int pos = -idx - 1;
			if (pos != node.count()) best = node.key(pos);
			if (node.isLeaf()) return best;
			node = node.child(pos);
		}
	}

	private K minKey(MultiWayNode<K,V> node)
	{
		while (!node.isLeaf()) node = node.child(0);
		return node.key(0);
	}

	private K maxKey(MultiWayNode<K,V> node)
	{
		while (!node.isLeaf()) node = node.child(node.count());
		return node.key(node.count() - 1);
	}

	/**
	 * Returns the entries in ascending key order.
	 * The traversal is lazy, and each call to iterator() starts a fresh one. The iterators are fail-fast.
	 */
	public Iterable<Map.Entry<K,V>> entries()
	{
		return () -> new EntryIterator<>(this, false);
	}

	public Iterable<Map.Entry<K,V>> descendingEntries()
	{
		return () -> new EntryIterator<>(this, true);
	}

	public Iterable<K> keys()
	{
		return () -> new Iterator<K>() {
			private final Iterator<Map.Entry<K,V>> it = new EntryIterator<>(MultiWaySearchTree.this, false);
			@Override
			public boolean hasNext() {return it.hasNext();}
			@Override
			public K next() {return it.next().getKey();}
		};
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder(entrycnt * 8);
		sb.append(getClass().getName()).append("/order=").append(order).append('=').append(entrycnt).append(" {");
		String dlm = "";
		for (Map.Entry<K,V> ent : entries()) {
			sb.append(dlm).append(ent.getKey()).append('=').append(ent.getValue());
			dlm = ", ";
		}
		sb.append("}");
		return sb.toString();
	}

	/*
	 * Walks the entire tree checking the structural invariants. Intended for tests, as it costs O(n).
	 */
	void verify()
	{
		int total = verifyNode(root, 1, null, null);
		if (total != entrycnt) throw new IllegalStateException("Tree holds entries="+total+" but size="+entrycnt);
	}

	private int verifyNode(MultiWayNode<K,V> node, int depth, K lobound, K hibound)
	{
		int cnt = node.count();
		if (cnt > maxEntries) throw new IllegalStateException("Node overflow="+cnt+" at depth="+depth+" - "+node);
		if (node != root && cnt < minEntries) throw new IllegalStateException("Node underflow="+cnt+" at depth="+depth+" - "+node);
		for (int idx = 0; idx != cnt; idx++) {
			K k = node.key(idx);
			if (idx != 0 && cmp.compare(node.key(idx-1), k) >= 0) throw new IllegalStateException("Keys out of order in "+node);
			if (lobound != null && cmp.compare(k, lobound) <= 0) throw new IllegalStateException("Key="+k+" not above bound="+lobound);
			if (hibound != null && cmp.compare(k, hibound) >= 0) throw new IllegalStateException("Key="+k+" not below bound="+hibound);
		}
		if (node.isLeaf()) {
			if (depth != levels) throw new IllegalStateException("Leaf at depth="+depth+" in tree of height="+levels+" - "+node);
			return cnt;
		}
		int total = cnt;
		for (int idx = 0; idx <= cnt; idx++) {
			MultiWayNode<K,V> child = node.child(idx);
			if (child == null) throw new IllegalStateException("Missing child="+idx+" in "+node);
			K lo = (idx == 0 ? lobound : node.key(idx - 1));
			K hi = (idx == cnt ? hibound : node.key(idx));
			total += verifyNode(child, depth + 1, lo, hi);
		}
		return total;
	}

	MultiWayNode<K,V> root() {return root;}

	@SuppressWarnings("unchecked")
	private K castKey(Object key)
	{
		if (key == null) throw new NullPointerException("Null keys are not supported");
		return (K)key;
	}

	@SuppressWarnings("unchecked")
	private static <K> Comparator<K> naturalOrder()
	{
		return (k1, k2) -> ((Comparable<Object>)k1).compareTo(k2);
	}


	/*
	 * Traverses the tree using an explicit stack of nodes, along with the position reached within each one.
	 * In ascending mode the position is the index of the next entry to return, while in descending mode it is one more than that.
	 */
	private static final class EntryIterator<K,V>
		implements Iterator<Map.Entry<K,V>>
	{
		private final MultiWaySearchTree<K,V> tree;
		private final boolean descending;
		private final MultiWayNode<K,V>[] stack;
		private final int[] positions;
		private int depth;
		private final int expmodcnt;

		@SuppressWarnings("unchecked")
		EntryIterator(MultiWaySearchTree<K,V> t, boolean desc)
		{
			tree = t;
			descending = desc;
			stack = (MultiWayNode<K,V>[])new MultiWayNode<?,?>[tree.levels];
			positions = new int[tree.levels];
			expmodcnt = tree.modcnt;
			descend(tree.root);
			settle();
		}

		@Override
		public boolean hasNext()
		{
			return (depth != 0);
		}

		@Override
		public Map.Entry<K,V> next()
		{
			if (tree.modcnt != expmodcnt) throw new ConcurrentModificationException("Next on "+getClass().getName());
			if (!hasNext()) throw new java.util.NoSuchElementException();
			MultiWayNode<K,V> node = stack[depth - 1];
			int idx;
			MultiWayNode<K,V> subtree = null;
			if (descending) {
				idx = --positions[depth - 1];
				if (!node.isLeaf()) subtree = node.child(idx);
			} else {
				idx = positions[depth - 1]++;
				if (!node.isLeaf()) subtree = node.child(idx + 1);
			}
			Map.Entry<K,V> ent = new java.util.AbstractMap.SimpleImmutableEntry<>(node.key(idx), node.value(idx));
			if (subtree != null) descend(subtree);
			settle();
			return ent;
		}

		// Push the path to the outermost leaf of this subtree, ie. leftmost when ascending, rightmost when descending
		private void descend(MultiWayNode<K,V> node)
		{
			for (;;) {
				stack[depth] = node;
				positions[depth++] = (descending ? node.count() : 0);
				if (node.isLeaf()) break;
				node = node.child(descending ? node.count() : 0);
			}
		}

		// Pop the nodes whose entries are exhausted
		private void settle()
		{
			while (depth != 0) {
				int pos = positions[depth - 1];
				if (descending ? pos != 0 : pos != stack[depth - 1].count()) break;
				stack[--depth] = null;
			}
		}
	}
}
