/*
 * Copyright 2024 Yusef Badri - All rights reserved.
 * NAF is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.grey.index.tree;

import java.util.Arrays;
import java.util.Comparator;

/*
 * A node of a multiway search tree of order m.
 * The entries are held in ascending key order in fixed arrays, which have room for m entries (one more than a settled node
 * may hold) so that an insertion can overflow the node before it gets split. The child array likewise has room for m+1.
 * A node with no children is a leaf, and an internal node always has exactly one more child than it has entries, so every
 * mutator below moves an entry together with the child on one side of it.
 * Each node exclusively owns its children, so moving a range of children between nodes transfers their ownership.
 */
final class MultiWayNode<K,V>
{
	private final Object[] keys;
	private final Object[] vals;
	private MultiWayNode<K,V>[] children; //null for a leaf
	private int count;

	int count() {return count;}
	boolean isLeaf() {return (children == null);}
	int childCount() {return (children == null ? 0 : count + 1);}

	@SuppressWarnings("unchecked")
	K key(int idx) {return (K)keys[idx];}
	@SuppressWarnings("unchecked")
	V value(int idx) {return (V)vals[idx];}
	MultiWayNode<K,V> child(int idx) {return children[idx];}

	MultiWayNode(int order)
	{
		keys = new Object[order];
		vals = new Object[order];
	}

	// Creates a new root above a node which has just split, with the promoted median as its sole entry.
	MultiWayNode(int order, MultiWayNode<K,V> left, K key, V val, MultiWayNode<K,V> right)
	{
		this(order);
		allocateChildren();
		keys[0] = key;
		vals[0] = val;
		children[0] = left;
		children[1] = right;
		count = 1;
	}

	/*
	 * Binary search within this node's entries.
	 * Returns the index of the key if present, else -(insertionPoint)-1. The insertion point is also the index of the child
	 * whose subtree would hold the key.
	 */
	int find(K key, Comparator<? super K> cmp)
	{
		int lo = 0;
		int hi = count - 1;
		while (lo <= hi) {
			int mid = (lo + hi) >>> 1;
			int diff = cmp.compare(key(mid), key);
			if (diff < 0) {
				lo = mid + 1;
			} else if (diff > 0) {
				hi = mid - 1;
			} else {
				return mid;
			}
		}
		return -(lo + 1);
	}

	/*
	 * Inserts an entry at idx, and for an internal node also the child that follows it (ie. the subtree of keys between
	 * this entry and the next one). Leaves take a null child.
	 */
	void insertEntry(int idx, K key, V val, MultiWayNode<K,V> rchild, Comparator<? super K> cmp)
	{
		assert count < keys.length : "Node overflow beyond capacity="+keys.length;
		assert (rchild == null) == isLeaf() : "Child mismatch on insert - leaf="+isLeaf();
		assert idx == 0 || cmp.compare(key(idx-1), key) < 0 : "Out of order insert at "+idx+" - "+key+" in "+this;
		assert idx == count || cmp.compare(key, key(idx)) < 0 : "Out of order insert at "+idx+" - "+key+" in "+this;
		System.arraycopy(keys, idx, keys, idx+1, count - idx);
		System.arraycopy(vals, idx, vals, idx+1, count - idx);
		keys[idx] = key;
		vals[idx] = val;
		if (rchild != null) {
			System.arraycopy(children, idx+1, children, idx+2, count - idx);
			children[idx+1] = rchild;
		}
		count++;
	}

	// Prepends an entry, along with the child that precedes it
	void insertFirst(K key, V val, MultiWayNode<K,V> lchild, Comparator<? super K> cmp)
	{
		assert count < keys.length : "Node overflow beyond capacity="+keys.length;
		assert (lchild == null) == isLeaf() : "Child mismatch on prepend - leaf="+isLeaf();
		assert count == 0 || cmp.compare(key, key(0)) < 0 : "Out of order prepend - "+key+" in "+this;
		System.arraycopy(keys, 0, keys, 1, count);
		System.arraycopy(vals, 0, vals, 1, count);
		keys[0] = key;
		vals[0] = val;
		if (lchild != null) {
			System.arraycopy(children, 0, children, 1, count + 1);
			children[0] = lchild;
		}
		count++;
	}

	// Removes the entry at idx, along with the child that follows it, which is returned (null for leaves)
	MultiWayNode<K,V> removeEntry(int idx)
	{
		MultiWayNode<K,V> rchild = null;
		if (children != null) {
			rchild = children[idx+1];
			System.arraycopy(children, idx+2, children, idx+1, count - idx - 1);
			children[count] = null;
		}
		count--;
		System.arraycopy(keys, idx+1, keys, idx, count - idx);
		System.arraycopy(vals, idx+1, vals, idx, count - idx);
		keys[count] = null;
		vals[count] = null;
		return rchild;
	}

	// Removes the first entry, along with the child that precedes it, which is returned (null for leaves)
	MultiWayNode<K,V> removeFirst()
	{
		MultiWayNode<K,V> lchild = null;
		if (children != null) {
			lchild = children[0];
			System.arraycopy(children, 1, children, 0, count);
			children[count] = null;
		}
		count--;
		System.arraycopy(keys, 1, keys, 0, count);
		System.arraycopy(vals, 1, vals, 0, count);
		keys[count] = null;
		vals[count] = null;
		return lchild;
	}

	// Overwrites the entry at idx. The caller guarantees the new key still lies between its neighbours.
	void replaceEntry(int idx, K key, V val)
	{
		keys[idx] = key;
		vals[idx] = val;
	}

	/*
	 * Splits an overflowing node about its median entry.
	 * The entries above the median, and the children to either side of them, move into a new right-hand sibling which is
	 * returned. The median itself is dropped from this node, so the caller must read it beforehand and promote it into
	 * the parent.
	 */
	MultiWayNode<K,V> splitOff()
	{
		int mid = count / 2;
		int nright = count - mid - 1;
		MultiWayNode<K,V> right = new MultiWayNode<>(keys.length);
		System.arraycopy(keys, mid+1, right.keys, 0, nright);
		System.arraycopy(vals, mid+1, right.vals, 0, nright);
		if (children != null) {
			right.allocateChildren();
			System.arraycopy(children, mid+1, right.children, 0, nright+1);
			Arrays.fill(children, mid+1, count+1, null);
		}
		Arrays.fill(keys, mid, count, null);
		Arrays.fill(vals, mid, count, null);
		right.count = nright;
		count = mid;
		return right;
	}

	// Appends the separator and then the whole of the right-hand sibling, which the caller then discards.
	void absorb(K sepkey, V sepval, MultiWayNode<K,V> right)
	{
		assert count + 1 + right.count < keys.length : "Merged node would overflow - "+count+"+1+"+right.count;
		assert isLeaf() == right.isLeaf() : "Cannot merge leaf with internal node";
		keys[count] = sepkey;
		vals[count] = sepval;
		System.arraycopy(right.keys, 0, keys, count+1, right.count);
		System.arraycopy(right.vals, 0, vals, count+1, right.count);
		if (children != null) {
			System.arraycopy(right.children, 0, children, count+1, right.count+1);
		}
		count += 1 + right.count;
	}

	private void allocateChildren()
	{
		@SuppressWarnings("unchecked") MultiWayNode<K,V>[] arr = (MultiWayNode<K,V>[])new MultiWayNode<?,?>[keys.length + 1];
		children = arr;
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder(count * 6);
		sb.append('[');
		for (int idx = 0; idx != count; idx++) {
			if (idx != 0) sb.append(", ");
			sb.append(keys[idx]);
		}
		sb.append(']');
		return sb.toString();
	}
}
