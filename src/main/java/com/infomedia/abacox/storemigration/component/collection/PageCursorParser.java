package com.infomedia.abacox.storemigration.component.collection;

import okhttp3.HttpUrl;

import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the target page number out of a {@code next} link.
 */
public final class PageCursorParser {

    private static final Pattern PAGE_PARAM = Pattern.compile("[?&]page=(\\d+)");

    private PageCursorParser() {
    }

    public static OptionalInt parseNextPage(String next) {
        if (next == null || next.isBlank()) {
            return OptionalInt.empty();
        }
        HttpUrl url = HttpUrl.parse(next.trim());
        String value = url != null ? url.queryParameter("page") : null;
        if (value == null) {
            // relative links such as "?page=3&limit=1000"
            Matcher matcher = PAGE_PARAM.matcher(next);
            value = matcher.find() ? matcher.group(1) : null;
        }
        if (value == null) {
            return OptionalInt.empty();
        }
        try {
            int page = Integer.parseInt(value.trim());
            return page >= 0 ? OptionalInt.of(page) : OptionalInt.empty();
        } catch (NumberFormatException e) {
            return OptionalInt.empty();
        }
    }
}
