package com.keysort.document;

/**
 * Character-by-character lexical state tracker for commented JSON.
 * <p>
 * Each call to {@link #next()} consumes one character and reports the state it
 * belongs to. Quote characters belong to their string, comment delimiters to
 * their comment, and the line break ending a line comment is code.
 * Both quote styles are recognized; backslash escapes are honored inside strings.
 */
public final class JsoncScanner {

    /**
     * Lexical context of a character.
     */
    public enum State {
        CODE,
        SINGLE_QUOTE,
        DOUBLE_QUOTE,
        LINE_COMMENT,
        BLOCK_COMMENT;

        public boolean isString() {
            return this == SINGLE_QUOTE || this == DOUBLE_QUOTE;
        }

        public boolean isComment() {
            return this == LINE_COMMENT || this == BLOCK_COMMENT;
        }
    }

    private final String text;
    private final int end;
    private int pos;
    private State state = State.CODE;
    private boolean escaped;
    private int blockBodyStart;
    private boolean closingBlock;

    public JsoncScanner(String text) {
        this(text, 0, text.length());
    }

    /**
     * Scan {@code text[start, end)}, starting in code state.
     */
    public JsoncScanner(String text, int start, int end) {
        this.text = text;
        this.pos = start;
        this.end = end;
    }

    public boolean hasNext() {
        return pos < end;
    }

    /**
     * Index of the character the next call to {@link #next()} consumes.
     */
    public int position() {
        return pos;
    }

    /**
     * State the scanner is in before the next character.
     */
    public State state() {
        return state;
    }

    /**
     * Consume one character.
     *
     * @return State of the consumed character
     */
    public State next() {
        char c = text.charAt(pos);
        char following = pos + 1 < end ? text.charAt(pos + 1) : 0;
        State result;

        switch (state) {
            case CODE -> {
                if (c == '/' && following == '/') {
                    state = State.LINE_COMMENT;
                } else if (c == '/' && following == '*') {
                    state = State.BLOCK_COMMENT;
                    blockBodyStart = pos + 2;
                } else if (c == '"') {
                    state = State.DOUBLE_QUOTE;
                } else if (c == '\'') {
                    state = State.SINGLE_QUOTE;
                }
                result = state;
            }
            case LINE_COMMENT -> {
                if (c == '\n') {
                    state = State.CODE;
                }
                result = state;
            }
            case BLOCK_COMMENT -> {
                result = State.BLOCK_COMMENT;
                if (closingBlock) {
                    closingBlock = false;
                    state = State.CODE;
                } else if (c == '*' && following == '/' && pos >= blockBodyStart) {
                    closingBlock = true;
                }
            }
            default -> {
                result = state;
                char quote = state == State.DOUBLE_QUOTE ? '"' : '\'';
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == quote) {
                    state = State.CODE;
                }
            }
        }

        pos++;
        return result;
    }

    /**
     * Index of the first code-state occurrence of {@code target} in {@code text[from, to)}, or -1.
     */
    public static int indexOfCode(String text, char target, int from, int to) {
        JsoncScanner scanner = new JsoncScanner(text, from, to);
        while (scanner.hasNext()) {
            int at = scanner.position();
            if (scanner.next() == State.CODE && text.charAt(at) == target) {
                return at;
            }
        }
        return -1;
    }

    /**
     * Index of the bracket closing the one at {@code open}, counting only code-state
     * brackets of the same kind, or -1 when it is never closed before {@code to}.
     */
    public static int matchingClose(String text, int open, int to) {
        char opening = text.charAt(open);
        char closing = opening == '[' ? ']' : '}';
        int depth = 0;
        JsoncScanner scanner = new JsoncScanner(text, open, to);
        while (scanner.hasNext()) {
            int at = scanner.position();
            if (scanner.next() != State.CODE) {
                continue;
            }
            char c = text.charAt(at);
            if (c == opening) {
                depth++;
            } else if (c == closing) {
                depth--;
                if (depth == 0) {
                    return at;
                }
            }
        }
        return -1;
    }
}
