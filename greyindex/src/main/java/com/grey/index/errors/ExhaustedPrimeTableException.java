/*
 * Copyright 2024 Yusef Badri - All rights reserved.
 * NAF is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.grey.index.errors;

public class ExhaustedPrimeTableException extends IndexConfigException {
	private static final long serialVersionUID = 1L;
	private final long requested;

	public ExhaustedPrimeTableException(long requested, int largest) {
		super("No prime available for "+requested+" - largest in table="+largest);
		this.requested = requested;
	}

	public long getRequested() {
		return requested;
	}
}
