package com.keysort.canonical;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Digit-aware ordering key: "view2" sorts before "view10".
 * <p>
 * The text is split into alternating text and digit runs (always starting with a
 * possibly empty text run). Digit runs compare by numeric value, text runs
 * lexicographically, case-insensitive unless requested otherwise.
 */
public final class NaturalKey implements Comparable<NaturalKey> {

    private final List<String> segments;

    private NaturalKey(List<String> segments) {
        this.segments = segments;
    }

    public static NaturalKey of(String text) {
        return of(text, false);
    }

    public static NaturalKey caseSensitive(String text) {
        return of(text, true);
    }

    public static NaturalKey of(String text, boolean caseSensitive) {
        String source = text == null ? "" : text;
        List<String> segments = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inDigits = false;
        for (int i = 0; i < source.length(); i++) {
            char c = source.charAt(i);
            boolean digit = c >= '0' && c <= '9';
            if (digit != inDigits) {
                segments.add(finish(current, inDigits, caseSensitive));
                current.setLength(0);
                inDigits = digit;
            }
            current.append(c);
        }
        segments.add(finish(current, inDigits, caseSensitive));
        return new NaturalKey(segments);
    }

    private static String finish(StringBuilder run, boolean digits, boolean caseSensitive) {
        String s = run.toString();
        if (digits) {
            // compare by value: drop leading zeros
            int i = 0;
            while (i < s.length() - 1 && s.charAt(i) == '0') {
                i++;
            }
            return s.substring(i);
        }
        return caseSensitive ? s : s.toLowerCase(Locale.ROOT);
    }

    @Override
    public int compareTo(NaturalKey other) {
        int n = Math.min(segments.size(), other.segments.size());
        for (int i = 0; i < n; i++) {
            String a = segments.get(i);
            String b = other.segments.get(i);
            int cmp;
            if (i % 2 == 1) {
                cmp = Integer.compare(a.length(), b.length());
                if (cmp == 0) {
                    cmp = a.compareTo(b);
                }
            } else {
                cmp = a.compareTo(b);
            }
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(segments.size(), other.segments.size());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return segments.equals(((NaturalKey) o).segments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(segments);
    }

    @Override
    public String toString() {
        return "NaturalKey" + segments;
    }
}
