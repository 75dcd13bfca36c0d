/*
 * Copyright 2024 Yusef Badri - All rights reserved.
 * NAF is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.grey.index.errors;

public class DuplicateKeyException extends IndexException {
	private static final long serialVersionUID = 1L;
	private final Object key;

	public DuplicateKeyException(Object key) {
		super(false, "Duplicate key="+key);
		this.key = key;
	}

	public Object getKey() {
		return key;
	}
}
