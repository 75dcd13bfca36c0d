/*
 * Copyright 2024 Yusef Badri - All rights reserved.
 * NAF is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.grey.index.errors;

/*
 * Base of the unchecked exceptions raised by the index structures.
 * The error flag distinguishes faults that make an index unusable (bad configuration, exhausted resources)
 * from outcomes that are merely policy, such as rejecting a duplicate key.
 */
public class IndexException extends RuntimeException {
	private static final long serialVersionUID = 1L;
	private final boolean is_error;

	public IndexException(boolean error, String msg, Throwable cause) {
		super(msg, cause);
		this.is_error = error;
	}

	public IndexException(boolean error, String msg) {
		this(error, msg, null);
	}

	public boolean error() {
		return is_error;
	}

	@Override
	public String toString() {
		return super.toString()+" - error="+error();
	}

	public static boolean isError(Throwable ex) {
		if (ex instanceof IndexException) return ((IndexException)ex).error();
		return (ex instanceof Error
				|| ex instanceof RuntimeException);
	}
}
