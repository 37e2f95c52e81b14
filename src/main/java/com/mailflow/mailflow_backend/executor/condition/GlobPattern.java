package com.mailflow.mailflow_backend.executor.condition;

import java.util.regex.Pattern;

/**
 * Glob to regex: regex metacharacters are escaped first, then '*' becomes '.*'.
 * The result is anchored and case-insensitive. '?' is passed through unchanged.
 */
public final class GlobPattern {

    private static final Pattern META = Pattern.compile("[.+^${}()|\\[\\]\\\\]");

    private GlobPattern() {}

    public static Pattern compile(String glob) {
        String escaped = META.matcher(glob).replaceAll("\\\\$0").replace("*", ".*");
        return Pattern.compile("^" + escaped + "$", Pattern.CASE_INSENSITIVE);
    }

    public static boolean matches(String glob, String value) {
        return compile(glob).matcher(value).matches();
    }
}
