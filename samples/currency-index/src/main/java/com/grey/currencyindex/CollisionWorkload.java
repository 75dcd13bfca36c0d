/*
 * Copyright 2024 Yusef Badri - All rights reserved.
 * NAF is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.grey.currencyindex;

import org.slf4j.LoggerFactory;

import com.grey.index.collections.DoubleHashingHashMap;
import com.grey.index.config.SysProps;

/**
 * Measures how many probe collisions a {@link DoubleHashingHashMap} incurs under a random workload of currency codes.
 * <br>
 * Each trial builds a fresh map and performs the configured number of inserts, each of a code picked at random (so the same
 * code may be picked more than once, in which case it overwrites), followed by the configured number of deletes of randomly
 * picked codes, some of which will not be present. The collision count of each map is recorded, and averaged over all trials.
 */
public class CollisionWorkload
{
	private static final org.slf4j.Logger Logger = LoggerFactory.getLogger(CollisionWorkload.class);

	public static final String SYSPROP_INSERTS = "grey.currencyindex.inserts";
	public static final String SYSPROP_DELETES = "grey.currencyindex.deletes";
	public static final String SYSPROP_TRIALS = "grey.currencyindex.trials";

	public static final int DFLT_INSERTS = SysProps.get(SYSPROP_INSERTS, 70);
	public static final int DFLT_DELETES = SysProps.get(SYSPROP_DELETES, 30);
	public static final int DFLT_TRIALS = SysProps.get(SYSPROP_TRIALS, 1000);

	public static final class Result
	{
		private final long[] collisions;
		private final int[] sizes;

		Result(long[] collisions, int[] sizes) {
			this.collisions = collisions;
			this.sizes = sizes;
		}

		public int getTrials() {return collisions.length;}
		public long getCollisions(int trial) {return collisions[trial];}
		public int getFinalSize(int trial) {return sizes[trial];}

		public double getMeanCollisions()
		{
			long total = 0;
			for (int idx = 0; idx != collisions.length; idx++) total += collisions[idx];
			return (double)total / collisions.length;
		}

		@Override
		public String toString() {
			return "Trials="+getTrials()+", mean collisions="+String.format("%.3f", getMeanCollisions());
		}
	}

	private final int inserts;
	private final int deletes;
	private final int trials;
	private final java.util.List<String> codes;

	public CollisionWorkload() {
		this(DFLT_INSERTS, DFLT_DELETES, DFLT_TRIALS);
	}

	public CollisionWorkload(int inserts, int deletes, int trials) {
		this(inserts, deletes, trials, Currency.allCodes());
	}

	public CollisionWorkload(int inserts, int deletes, int trials, java.util.List<String> codes)
	{
		if (inserts < 0 || deletes < 0) throw new IllegalArgumentException("Negative workload - inserts="+inserts+", deletes="+deletes);
		if (trials <= 0) throw new IllegalArgumentException("Trials must be positive - "+trials);
		if (codes.isEmpty()) throw new IllegalArgumentException("No currency codes to work with");
		this.inserts = inserts;
		this.deletes = deletes;
		this.trials = trials;
		this.codes = java.util.Collections.unmodifiableList(new java.util.ArrayList<>(codes));
	}

	public Result run(long seed)
	{
		java.util.Random rnd = new java.util.Random(seed);
		long[] collisions = new long[trials];
		int[] sizes = new int[trials];
		Logger.info("Running collision workload with trials="+trials+", inserts="+inserts+", deletes="+deletes
				+", codes="+codes.size()+", seed="+seed);

		for (int trial = 0; trial != trials; trial++) {
			DoubleHashingHashMap<String,Currency> map = new DoubleHashingHashMap<>();
			for (int idx = 0; idx != inserts; idx++) {
				String code = pick(rnd);
				map.put(code, new Currency(code));
			}
			for (int idx = 0; idx != deletes; idx++) {
				map.remove(pick(rnd));
			}
			collisions[trial] = map.collisions();
			sizes[trial] = map.size();
			if (Logger.isDebugEnabled()) {
				Logger.debug("Trial "+(trial+1)+"/"+trials+": collisions="+collisions[trial]+", size="+sizes[trial]
						+", capacity="+map.capacity()+", tombstones="+map.tombstones());
			}
		}
		Result result = new Result(collisions, sizes);
		Logger.info("Collision workload completed - "+result);
		return result;
	}

	private String pick(java.util.Random rnd) {
		return codes.get(rnd.nextInt(codes.size()));
	}
}
