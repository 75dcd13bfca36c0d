/*
 * Copyright 2024 Yusef Badri - All rights reserved.
 * NAF is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.grey.currencyindex;

import java.math.BigDecimal;
import java.util.NoSuchElementException;

import org.slf4j.LoggerFactory;

import com.grey.index.collections.DoubleHashingHashMap;
import com.grey.index.errors.DuplicateKeyException;
import com.grey.index.tree.MultiWaySearchTree;

/**
 * The coin and note denominations of one currency, along with its exchange rates into other currencies.
 * <br>
 * Denominations are held in a {@link MultiWaySearchTree}, which provides the ordered navigation, and the exchange rates in a
 * {@link DoubleHashingHashMap} keyed on the target currency code.
 * Denominations are compared numerically, so 0.5 and 0.50 are the same denomination.
 */
public class CurrencyProfile
{
	private static final org.slf4j.Logger Logger = LoggerFactory.getLogger(CurrencyProfile.class);

	private final String code;
	private final MultiWaySearchTree<BigDecimal,BigDecimal> denominations;
	private final DoubleHashingHashMap<String,BigDecimal> changes;

	public String getCode() {return code;}
	public boolean hasDenominations() {return !denominations.isEmpty();}
	public int numDenominations() {return denominations.size();}
	public int numChanges() {return changes.size();}

	public CurrencyProfile(String code)
	{
		this.code = Currency.validateCode(code);
		denominations = new MultiWaySearchTree<>();
		changes = new DoubleHashingHashMap<>();
	}

	/**
	 * Returns an independent copy of this profile, which can be modified without affecting the original.
	 */
	public CurrencyProfile copy()
	{
		CurrencyProfile dup = new CurrencyProfile(code);
		for (BigDecimal den : denominations.keys()) {
			dup.denominations.insert(den, den);
		}
		dup.changes.putAll(changes);
		return dup;
	}

	/**
	 * @throws IllegalArgumentException if the value is not positive
	 * @throws DuplicateKeyException if this is already a denomination
	 */
	public void addDenomination(BigDecimal value)
	{
		validateValue(value);
		denominations.insert(value, value);
	}

	/**
	 * @throws NoSuchElementException if this is not a denomination
	 */
	public void removeDenomination(BigDecimal value)
	{
		validateValue(value);
		if (denominations.remove(value) == null) throw new NoSuchElementException(value+" is not a denomination of "+code);
	}

	public BigDecimal minDenomination()
	{
		requireDenominations();
		return denominations.firstKey();
	}

	/**
	 * Returns the smallest denomination greater than the given value.
	 * @throws NoSuchElementException if there are no denominations, or none above the value
	 */
	public BigDecimal minDenomination(BigDecimal above)
	{
		requireDenominations();
		BigDecimal den = denominations.higherKey(above);
		if (den == null) throw new NoSuchElementException("No "+code+" denomination greater than "+above);
		return den;
	}

	public BigDecimal maxDenomination()
	{
		requireDenominations();
		return denominations.lastKey();
	}

	/**
	 * Returns the largest denomination less than the given value.
	 * @throws NoSuchElementException if there are no denominations, or none below the value
	 */
	public BigDecimal maxDenomination(BigDecimal below)
	{
		requireDenominations();
		BigDecimal den = denominations.lowerKey(below);
		if (den == null) throw new NoSuchElementException("No "+code+" denomination less than "+below);
		return den;
	}

	/**
	 * Returns the denomination following the given one, or null if it is the largest.
	 * @throws IllegalArgumentException if the given value is not itself a denomination
	 */
	public BigDecimal nextDenomination(BigDecimal den)
	{
		requireDenominations();
		requireDenomination(den);
		return denominations.higherKey(den);
	}

	/**
	 * Returns the denomination preceding the given one, or null if it is the smallest.
	 * @throws IllegalArgumentException if the given value is not itself a denomination
	 */
	public BigDecimal prevDenomination(BigDecimal den)
	{
		requireDenominations();
		requireDenomination(den);
		return denominations.lowerKey(den);
	}

	public void clearDenominations() {
		denominations.clear();
	}

	/**
	 * Iterates over the denominations, smallest first unless reverse is set.
	 */
	public Iterable<BigDecimal> denominations(boolean reverse)
	{
		if (!reverse) return denominations.keys();
		return () -> new java.util.Iterator<BigDecimal>() {
			private final java.util.Iterator<java.util.Map.Entry<BigDecimal,BigDecimal>> it = denominations.descendingEntries().iterator();
			@Override
			public boolean hasNext() {return it.hasNext();}
			@Override
			public BigDecimal next() {return it.next().getKey();}
		};
	}

	/**
	 * Records the rate at which this currency converts into another.
	 * @throws IllegalArgumentException if the code or rate is invalid, or a rate for that code already exists
	 */
	public void addChange(String currencyCode, BigDecimal rate)
	{
		validateChange(currencyCode, rate);
		if (changes.containsKey(currencyCode)) throw new IllegalArgumentException("Exchange rate "+code+"/"+currencyCode+" is already present");
		changes.put(currencyCode, rate);
	}

	/**
	 * @return the rate that was removed
	 * @throws NoSuchElementException if there is no rate for the given code
	 */
	public BigDecimal removeChange(String currencyCode)
	{
		Currency.validateCode(currencyCode);
		BigDecimal rate = changes.remove(currencyCode);
		if (rate == null) throw new NoSuchElementException("Exchange rate "+code+"/"+currencyCode+" is not present");
		return rate;
	}

	/**
	 * Sets the rate into another currency, whether or not one already exists.
	 */
	public void updateChange(String currencyCode, BigDecimal rate)
	{
		validateChange(currencyCode, rate);
		BigDecimal oldrate = changes.put(currencyCode, rate);
		if (Logger.isDebugEnabled()) Logger.debug("Updated exchange rate "+code+"/"+currencyCode+"="+rate+" - old="+oldrate);
	}

	/**
	 * Returns the rate into another currency, or null if there is none.
	 */
	public BigDecimal getChange(String currencyCode)
	{
		Currency.validateCode(currencyCode);
		return changes.get(currencyCode);
	}

	private void validateChange(String currencyCode, BigDecimal rate)
	{
		Currency.validateCode(currencyCode);
		validateValue(rate);
		if (currencyCode.equals(code) && rate.compareTo(BigDecimal.ONE) != 0) {
			throw new IllegalArgumentException("Exchange rate of "+code+" into itself must be 1 - "+rate);
		}
	}

	private void requireDenominations() {
		if (denominations.isEmpty()) throw new NoSuchElementException("No denominations are defined for "+code);
	}

	private void requireDenomination(BigDecimal den) {
		if (!denominations.containsKey(den)) throw new IllegalArgumentException(den+" is not a denomination of "+code);
	}

	private static void validateValue(BigDecimal value) {
		if (value.signum() <= 0) throw new IllegalArgumentException("Value must be positive - "+value);
	}

	@Override
	public String toString() {
		return getClass().getSimpleName()+"/"+code+"/denominations="+denominations.size()+"/changes="+changes.size();
	}
}
