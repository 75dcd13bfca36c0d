/*
 * Copyright 2024 Yusef Badri - All rights reserved.
 * NAF is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.grey.currencyindex;

import java.math.BigDecimal;

/**
 * An amount of money in a given ISO-4217 currency.
 * <br>
 * Identity is the currency code alone, so two instances with the same code are equal (and compare as equal) whatever their
 * amounts. This is what lets a search tree keyed on Currency hold at most one entry per code.
 */
public final class Currency
	implements Comparable<Currency>
{
	private final String code;
	private final BigDecimal amount;

	public String getCode() {return code;}
	public BigDecimal getAmount() {return amount;}

	public Currency(String code) {
		this(code, BigDecimal.ZERO);
	}

	public Currency(String code, BigDecimal amount)
	{
		this.code = validateCode(code);
		if (amount == null) throw new NullPointerException("Null amount for currency="+code);
		this.amount = amount;
	}

	public Currency withAmount(BigDecimal newAmount) {
		return new Currency(code, newAmount);
	}

	public String getDisplayName() {
		return java.util.Currency.getInstance(code).getDisplayName(java.util.Locale.ENGLISH);
	}

	public static boolean isValidCode(String code)
	{
		if (code == null || code.length() != 3) return false;
		try {
			java.util.Currency.getInstance(code);
			return true;
		} catch (IllegalArgumentException ex) {
			return false;
		}
	}

	/**
	 * @throws IllegalArgumentException if the code is not a currently registered ISO-4217 code
	 */
	public static String validateCode(String code)
	{
		if (!isValidCode(code)) throw new IllegalArgumentException("Invalid ISO-4217 currency code="+code);
		return code;
	}

	/**
	 * Returns every ISO-4217 code known to the JDK, in ascending order.
	 */
	public static java.util.List<String> allCodes()
	{
		java.util.List<String> codes = new java.util.ArrayList<>();
		for (java.util.Currency cur : java.util.Currency.getAvailableCurrencies()) {
			codes.add(cur.getCurrencyCode());
		}
		java.util.Collections.sort(codes);
		return codes;
	}

	@Override
	public int compareTo(Currency other) {
		return code.compareTo(other.code);
	}

	@Override
	public boolean equals(Object obj)
	{
		if (obj == this) return true;
		if (!(obj instanceof Currency)) return false;
		return code.equals(((Currency)obj).code);
	}

	@Override
	public int hashCode() {
		return code.hashCode();
	}

	@Override
	public String toString() {
		return code+" "+amount.toPlainString();
	}
}
