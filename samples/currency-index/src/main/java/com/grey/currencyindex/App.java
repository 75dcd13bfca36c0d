/*
 * Copyright 2024 Yusef Badri - All rights reserved.
 * NAF is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.grey.currencyindex;

import java.math.BigDecimal;
import java.util.Map;

import org.slf4j.LoggerFactory;

import com.grey.index.config.SysProps;
import com.grey.index.errors.IndexException;
import com.grey.index.tree.MultiWaySearchTree;

/**
 * Command-line driver for the currency index demonstrations.
 */
public class App
{
	private static final org.slf4j.Logger Logger = LoggerFactory.getLogger(App.class);

	public static final int RC_OK = 0;
	public static final int RC_USAGE = 1;
	public static final int RC_FAILED = 2;

	static final BigDecimal[] EURO_DENOMINATIONS = new BigDecimal[] {
		new BigDecimal("0.01"), new BigDecimal("0.02"), new BigDecimal("0.05"), new BigDecimal("0.10"), new BigDecimal("0.20"),
		new BigDecimal("0.50"), new BigDecimal("1"), new BigDecimal("2"), new BigDecimal("5"), new BigDecimal("10"),
		new BigDecimal("20"), new BigDecimal("50"), new BigDecimal("100"), new BigDecimal("200"), new BigDecimal("500")
	};

	private static final String[] opts = new String[]{"collisions", "inserts:", "deletes:", "trials:", "seed:",
			"tree", "order:", "change:"};

	static class OptsHandler
		extends CommandParser.OptionsHandler
	{
		boolean collisions;
		boolean tree;
		BigDecimal changeAmount;
		int inserts = CollisionWorkload.DFLT_INSERTS;
		int deletes = CollisionWorkload.DFLT_DELETES;
		int trials = CollisionWorkload.DFLT_TRIALS;
		int order = SysProps.get(MultiWaySearchTree.SYSPROP_ORDER, 4);
		long seed = System.nanoTime();

		OptsHandler() {super(opts, 0, 0);}

		@Override
		public void setOption(String opt) {
			if (opt.equals("collisions")) {
				collisions = true;
			} else if (opt.equals("tree")) {
				tree = true;
			} else {
				throw new IllegalStateException("Missing case for bool-option="+opt);
			}
		}

		@Override
		public void setOption(String opt, String val) {
			if (opt.equals("inserts")) {
				inserts = Integer.parseInt(val);
			} else if (opt.equals("deletes")) {
				deletes = Integer.parseInt(val);
			} else if (opt.equals("trials")) {
				trials = Integer.parseInt(val);
			} else if (opt.equals("seed")) {
				seed = Long.parseLong(val);
			} else if (opt.equals("order")) {
				order = Integer.parseInt(val);
			} else if (opt.equals("change")) {
				changeAmount = new BigDecimal(val);
			} else {
				throw new IllegalStateException("Missing case for value-option="+opt);
			}
		}

		@Override
		public String displayUsage()
		{
			String txt = "\t-collisions [-inserts n] [-deletes n] [-trials n] [-seed n]";
			txt += "\n\t-tree [-order m] [-seed n]";
			txt += "\n\t-change amount";
			txt += "\nThe modes may be combined. The collision workload defaults to "
					+CollisionWorkload.DFLT_INSERTS+" inserts and "+CollisionWorkload.DFLT_DELETES+" deletes over "
					+CollisionWorkload.DFLT_TRIALS+" trials.";
			return txt;
		}
	}

	private final OptsHandler options = new OptsHandler();
	private final CommandParser cmdParser;
	private final String[] cmdlineArgs;
	private final java.io.PrintStream out;

	public static void main(String[] args) {
		App app = new App(args, System.out);
		int rc = app.exec();
		if (rc != RC_OK) System.exit(rc);
	}

	public App(String[] args, java.io.PrintStream out)
	{
		cmdlineArgs = args;
		this.out = out;
		cmdParser = new CommandParser(options, out);
	}

	public int exec()
	{
		if (cmdParser.parse(cmdlineArgs) == -1) return RC_USAGE;
		if (!options.collisions && !options.tree && options.changeAmount == null) {
			cmdParser.usage(cmdlineArgs, "No mode specified");
			return RC_USAGE;
		}
		try {
			if (options.collisions) runCollisions();
			if (options.tree) runTree();
			if (options.changeAmount != null) runChange();
		} catch (IllegalArgumentException | IndexException ex) {
			Logger.error("Demonstration failed - "+ex.getMessage());
			out.println("FAILED: "+ex.getMessage());
			return RC_FAILED;
		}
		return RC_OK;
	}

	private void runCollisions()
	{
		CollisionWorkload workload = new CollisionWorkload(options.inserts, options.deletes, options.trials);
		CollisionWorkload.Result result = workload.run(options.seed);
		out.println("Collision workload: inserts="+options.inserts+", deletes="+options.deletes+", seed="+options.seed);
		out.println(result);
	}

	private void runTree()
	{
		java.util.List<String> codes = Currency.allCodes();
		java.util.Random rnd = new java.util.Random(options.seed);
		java.util.Collections.shuffle(codes, rnd);
		MultiWaySearchTree<Currency,String> tree = new MultiWaySearchTree<>(options.order);
		for (String code : codes) {
			Currency cur = new Currency(code, BigDecimal.valueOf(rnd.nextInt(1000000), 2));
			tree.insert(cur, cur.getDisplayName());
		}
		out.println("Currency tree: order="+tree.order()+", entries="+tree.size()+", height="+tree.height());
		for (Map.Entry<Currency,String> ent : tree.entries()) {
			out.println("\t"+ent.getKey()+" - "+ent.getValue());
		}
	}

	private void runChange()
	{
		CurrencyProfile eur = euroProfile();
		java.util.List<BigDecimal> coins = ChangeMaker.change(options.changeAmount, eur);
		StringBuilder sb = new StringBuilder();
		sb.append("Change for EUR ").append(options.changeAmount.toPlainString()).append(": coins=").append(coins.size());
		String dlm = " - ";
		for (BigDecimal coin : coins) {
			sb.append(dlm).append(coin.toPlainString());
			dlm = " + ";
		}
		out.println(sb);
	}

	static CurrencyProfile euroProfile()
	{
		CurrencyProfile eur = new CurrencyProfile("EUR");
		for (BigDecimal den : EURO_DENOMINATIONS) {
			eur.addDenomination(den);
		}
		return eur;
	}
}
