package com.keysort.document;

/**
 * Comma handling on trivia text. Only commas outside comments are touched.
 */
public final class Trivia {

    private Trivia() {
    }

    public static boolean hasComma(String trivia) {
        return JsoncScanner.indexOfCode(trivia, ',', 0, trivia.length()) >= 0;
    }

    /**
     * Remove every comma outside comments.
     */
    public static String withoutCommas(String trivia) {
        StringBuilder sb = new StringBuilder(trivia.length());
        JsoncScanner scanner = new JsoncScanner(trivia);
        while (scanner.hasNext()) {
            int at = scanner.position();
            char c = trivia.charAt(at);
            if (scanner.next() != JsoncScanner.State.CODE || c != ',') {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * Remove commas outside comments except those separating a non-object value
     * (a string, number or nested array left between rules) from what follows.
     */
    public static String withoutStrayCommas(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        JsoncScanner scanner = new JsoncScanner(text);
        boolean afterValue = false;
        while (scanner.hasNext()) {
            int at = scanner.position();
            char c = text.charAt(at);
            JsoncScanner.State state = scanner.next();
            if (state == JsoncScanner.State.CODE && c == ',') {
                if (afterValue) {
                    sb.append(c);
                    afterValue = false;
                }
                continue;
            }
            if (state.isString() || (state == JsoncScanner.State.CODE && !Character.isWhitespace(c))) {
                afterValue = true;
            }
            sb.append(c);
        }
        return sb.toString();
    }

    /**
     * Keep exactly one comma: the first existing one, or a new one at the start.
     */
    public static String withOneComma(String trivia) {
        int first = JsoncScanner.indexOfCode(trivia, ',', 0, trivia.length());
        if (first < 0) {
            return "," + trivia;
        }
        return trivia.substring(0, first + 1) + withoutCommas(trivia.substring(first + 1));
    }
}
