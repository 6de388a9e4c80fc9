/*
 * Copyright Logrepl Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.logrepl.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * String-related utility methods.
 */
public final class Strings {

    private Strings() {
    }

    /**
     * Split the input on the given delimiter, trim each item and convert it with the factory. Blank items and items for which
     * the factory returns {@code null} are skipped.
     *
     * @param input the input string; may be null
     * @param delimiter the character separating the items
     * @param factory converts each trimmed item; may not be null
     * @return the converted items in input order; never null
     */
    public static <T> List<T> listOfTrimmed(String input, char delimiter, Function<String, T> factory) {
        if (input == null) {
            return Collections.emptyList();
        }
        List<T> items = new ArrayList<>();
        for (String item : input.split(Pattern.quote(String.valueOf(delimiter)))) {
            String trimmed = item.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            T obj = factory.apply(trimmed);
            if (obj != null) {
                items.add(obj);
            }
        }
        return items;
    }

    /**
     * Same as {@link #listOfTrimmed(String, char, Function)} with a comma as delimiter.
     */
    public static <T> List<T> listOfTrimmed(String input, Function<String, T> factory) {
        return listOfTrimmed(input, ',', factory);
    }

    public static <T> String join(CharSequence delimiter, Iterable<T> values) {
        StringBuilder sb = new StringBuilder();
        Iterator<T> iter = values.iterator();
        while (iter.hasNext()) {
            sb.append(iter.next());
            if (iter.hasNext()) {
                sb.append(delimiter);
            }
        }
        return sb.toString();
    }

    public static boolean isNullOrEmpty(String str) {
        return str == null || str.isEmpty();
    }

    public static boolean isNullOrBlank(String str) {
        return str == null || str.trim().isEmpty();
    }

    /**
     * Returns the default value if the given value is null or blank, otherwise the value itself.
     */
    public static String defaultIfBlank(String value, String defaultValue) {
        return isNullOrBlank(value) ? defaultValue : value;
    }
}
