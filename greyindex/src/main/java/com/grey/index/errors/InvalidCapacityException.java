/*
 * Copyright 2024 Yusef Badri - All rights reserved.
 * NAF is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.grey.index.errors;

/*
 * Raised when a structure is asked to take on a size or shape it cannot support, eg. a hash table of capacity 1,
 * a load factor outside (0,1) or a tree order below 3.
 */
public class InvalidCapacityException extends IndexConfigException {
	private static final long serialVersionUID = 1L;

	public InvalidCapacityException(String msg) {
		super(msg);
	}
}
