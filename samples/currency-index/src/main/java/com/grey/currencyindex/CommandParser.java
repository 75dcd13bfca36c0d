/*
 * Copyright 2024 Yusef Badri - All rights reserved.
 * NAF is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.grey.currencyindex;

/*
 * Parses hyphen-prefixed command-line options, followed by positional parameters.
 * Option names may be more than one letter long, so options cannot be concatenated getopts-style, but getopts' convention of
 * declaring a value-taking option with a trailing colon is followed. A lone hyphen marks the end of the options.
 */
public final class CommandParser
{
	public abstract static class OptionsHandler
	{
		private final java.util.Set<String> opts_solo = new java.util.HashSet<String>();
		private final java.util.Set<String> opts_withval = new java.util.HashSet<String>();
		final int min_params;
		final int max_params;

		public void setOption(String opt) {throw new IllegalStateException("Missing handler for bool-option="+opt);}
		public void setOption(String opt, String val) {throw new IllegalStateException("Missing handler for option="+opt+"="+val);}
		public String displayUsage() {return null;}

		boolean containsSoloOption(String opt) {return opts_solo.contains(opt);}
		boolean containsValueOption(String opt) {return opts_withval.contains(opt);}

		/**
		 * @param opts The supported option names, with value-taking ones suffixed by a colon
		 * @param min The minimum number of positional parameters
		 * @param max The maximum number of positional parameters, or -1 for no limit
		 */
		public OptionsHandler(String[] opts, int min, int max)
		{
			for (int idx = 0; idx != opts.length; idx++) {
				if (opts[idx].endsWith(":")) {
					opts_withval.add(opts[idx].substring(0, opts[idx].length() - 1));
				} else {
					opts_solo.add(opts[idx]);
				}
			}
			min_params = min;
			max_params = max;
		}
	}

	private final OptionsHandler handler;
	private final java.io.PrintStream out;

	public CommandParser(OptionsHandler handler, java.io.PrintStream out)
	{
		this.handler = handler;
		this.out = out;
	}

	/**
	 * Returns the index of the first positional parameter (equal to args.length if there are none), or -1 if the arguments
	 * are invalid or help was requested, in which case the usage has already been displayed.
	 * Handlers may reject an option value by throwing IllegalArgumentException.
	 */
	public int parse(String[] args)
	{
		int arg = 0;
		while (arg < args.length && args[arg].length() != 0 && args[arg].charAt(0) == '-') {
			String opt = args[arg++].substring(1);
			if (opt.length() == 0) break; //end-of-options marker
			try {
				if (handler.containsSoloOption(opt)) {
					handler.setOption(opt);
				} else if (handler.containsValueOption(opt)) {
					if (arg == args.length) return fail(args, "Missing value for option="+opt+" at arg="+arg);
					handler.setOption(opt, args[arg++]);
				} else if (opt.equals("h") || opt.equals("help")) {
					out.print(usage());
					return -1;
				} else {
					return fail(args, "Unrecognised option="+opt+" at arg="+(arg-1));
				}
			} catch (IllegalArgumentException ex) {
				return fail(args, "Invalid option="+opt+" - "+ex.getMessage());
			}
		}
		int param_cnt = args.length - arg;
		if (param_cnt < handler.min_params) return fail(args, "Insufficient params="+param_cnt+" vs min="+handler.min_params);
		if (handler.max_params != -1 && param_cnt > handler.max_params) return fail(args, "Excess params="+param_cnt+" vs max="+handler.max_params);
		return arg;
	}

	public String usage(String[] args, String errmsg)
	{
		StringBuilder sb = new StringBuilder();
		sb.append("\nInvalid parameters=").append(args.length).append(":\n");
		for (int idx = 0; idx != args.length; idx++) sb.append(' ').append(args[idx]);
		sb.append("\n*** ").append(errmsg).append('\n');
		sb.append(usage());
		String txt = sb.toString();
		out.print(txt);
		return txt;
	}

	private String usage()
	{
		String txt = handler.displayUsage();
		if (txt == null) txt = "\tNo help available";
		return "Command-line syntax:\n"+txt+"\n";
	}

	private int fail(String[] args, String errmsg)
	{
		usage(args, errmsg);
		return -1;
	}
}
