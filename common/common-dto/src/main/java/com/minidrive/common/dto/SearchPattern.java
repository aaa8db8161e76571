package com.minidrive.common.dto;

import java.util.Locale;

/**
 * 검색어 → JPQL LIKE 패턴 ("%term%").
 *
 * <p>검색어 안의 {@code %}, {@code _} 는 와일드카드가 아니라 글자로 취급한다.
 * 쿼리에는 {@code LIKE :pattern ESCAPE '!'} 로 써야 한다.</p>
 */
public final class SearchPattern {

    public static final char ESCAPE_CHAR = '!';

    private SearchPattern() {
    }

    public static String contains(String term) {
        String normalized = term.trim().toLowerCase(Locale.ROOT);
        StringBuilder pattern = new StringBuilder(normalized.length() + 2).append('%');
        for (char c : normalized.toCharArray()) {
            if (c == '%' || c == '_' || c == ESCAPE_CHAR) {
                pattern.append(ESCAPE_CHAR);
            }
            pattern.append(c);
        }
        return pattern.append('%').toString();
    }
}
