/*
 * Copyright 2024 Yusef Badri - All rights reserved.
 * NAF is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.grey.index.config;

import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import com.grey.index.errors.IndexConfigException;

/**
 * Tuning properties for the index structures.
 * <br>
 * A property is looked up in the application overrides first (see {@link #setAppEnv(String, String)}), then in the
 * environment under its upper-cased name with dots turned into underscores (eg. grey.dhmap.loadfactor becomes
 * GREY_DHMAP_LOADFACTOR), then among the JVM system properties. The caller's default applies if none of these
 * yields a non-empty value.
 */
public class SysProps
{
	private static final Map<String,String> AppEnv = new ConcurrentHashMap<>(); //primarily intended for the benefit of tests

	public static final String NULLMARKER = "-";  // placeholder value that translates to null - prevents us traversing a chain of defaults

	public static String get(String name)
	{
		return get(name, null);
	}

	public static String get(String name, String dflt)
	{
		String envName = envName(name);
		String val = AppEnv.get(envName);
		if (val == null || val.isEmpty()) val = System.getenv(envName);
		if (val == null || val.isEmpty()) val = System.getProperty(name);
		if (val == null || val.isEmpty()) val = dflt;
		if (val == null || val.isEmpty() || NULLMARKER.equals(val)) val = null;
		return val;
	}

	public static int get(String name, int dflt)
	{
		String val = get(name, Integer.toString(dflt));
		try {
			return Integer.parseInt(val.trim());
		} catch (NumberFormatException ex) {
			throw new IndexConfigException("Invalid integer property "+name+"="+val, ex);
		}
	}

	public static double get(String name, double dflt)
	{
		String val = get(name, Double.toString(dflt));
		try {
			return Double.parseDouble(val.trim());
		} catch (NumberFormatException ex) {
			throw new IndexConfigException("Invalid numeric property "+name+"="+val, ex);
		}
	}

	public static String set(String name, String newval)
	{
		java.util.Properties props = System.getProperties();
		String oldval = (newval == null || newval.isEmpty() ? (String)props.remove(name) : (String)props.setProperty(name, newval));
		if (oldval != null && oldval.isEmpty()) oldval = null;
		return oldval;
	}

	public static void setAppEnv(String name, String val) {
		name = envName(name);
		if (val == null || val.isEmpty()) {
			AppEnv.remove(name);
		} else {
			AppEnv.put(name, val);
		}
	}

	public static void clearAppEnv() {
		AppEnv.clear();
	}

	public static Map<String,String> getAppEnv() {
		return Collections.unmodifiableMap(AppEnv);
	}

	private static String envName(String name) {
		return name.replace('.', '_').toUpperCase();
	}
}
