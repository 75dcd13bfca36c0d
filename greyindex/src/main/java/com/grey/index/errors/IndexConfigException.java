/*
 * Copyright 2024 Yusef Badri - All rights reserved.
 * NAF is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.grey.index.errors;

public class IndexConfigException extends IndexException {
	private static final long serialVersionUID = 1L;

	public IndexConfigException(String msg) {
		super(true, msg);
	}

	public IndexConfigException(String msg, Throwable cause) {
		super(true, msg, cause);
	}
}
