/*
 * Copyright 2024 Yusef Badri - All rights reserved.
 * NAF is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.grey.currencyindex;

import java.math.BigDecimal;

/**
 * Breaks an amount down into the denominations of a currency, greedily taking as many of the largest denomination as will
 * fit before moving on to the next one down.
 * <br>
 * For canonical coin systems such as the Euro's, this yields the fewest coins.
 */
public final class ChangeMaker
{
	private ChangeMaker() {} //not instantiable

	/**
	 * @return the denominations making up the amount, largest first. An amount of zero yields an empty list.
	 * @throws IllegalArgumentException if the amount is negative or cannot be made up exactly
	 */
	public static java.util.List<BigDecimal> change(BigDecimal amount, CurrencyProfile profile)
	{
		if (amount.signum() < 0) throw new IllegalArgumentException("Cannot make change for negative amount="+amount);
		java.util.List<BigDecimal> coins = new java.util.ArrayList<>();
		BigDecimal remaining = amount;

		for (BigDecimal den : profile.denominations(true)) {
			if (remaining.signum() == 0) break;
			while (remaining.compareTo(den) >= 0) {
				remaining = remaining.subtract(den);
				coins.add(den);
			}
		}
		if (remaining.signum() != 0) {
			throw new IllegalArgumentException("Cannot make change for "+profile.getCode()+" "+amount.toPlainString()
					+" - remainder="+remaining.toPlainString());
		}
		return coins;
	}
}
