/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.agentgateway.util;

import reactor.util.annotation.Nullable;

/**
 * Miscellaneous utility methods.
 *
 * @author Christian Tzolov
 */
public final class Utils {

	private Utils() {
	}

	/**
	 * Check whether the given {@code String} contains actual <em>text</em>.
	 * @param str the {@code String} to check (may be {@code null})
	 * @return {@code true} if the {@code String} is not {@code null}, its length is
	 * greater than 0, and it does not contain whitespace only
	 */
	public static boolean hasText(@Nullable String str) {
		return (str != null && !str.isBlank());
	}

	/**
	 * Extracts the message of a throwable, falling back to its string form when the
	 * message is missing.
	 * @param t the throwable
	 * @return a non-null description
	 */
	public static String describe(Throwable t) {
		return (t.getMessage() != null) ? t.getMessage() : t.toString();
	}

}
