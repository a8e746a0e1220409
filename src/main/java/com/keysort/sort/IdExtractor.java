package com.keysort.sort;

import com.keysort.document.RuleFieldNames;
import com.keysort.document.RuleRecord;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the short identifier a rule carries.
 * <p>
 * Lookup order: a standalone 4-hex word in the action, a commented-out action member
 * ending in 4 hex digits inside the object, a 4-hex or 5-alphanumeric word in the
 * leading comments.
 */
public class IdExtractor {

    private static final Pattern ACTION_ID = Pattern.compile("\\b[0-9a-fA-F]{4}\\b");
    private static final Pattern COMMENT_ID = Pattern.compile("\\b([0-9a-fA-F]{4}|[A-Za-z0-9]{5})\\b");

    private final Pattern commentedAction;

    public IdExtractor(RuleFieldNames names) {
        this.commentedAction = Pattern.compile("['\"]" + Pattern.quote(names.action())
                + "['\"]\\s*:\\s*['\"][^'\"]*?([0-9a-fA-F]{4})");
    }

    public Optional<String> extract(RuleRecord record) {
        if (!record.parseOk()) {
            return Optional.empty();
        }
        Matcher matcher = ACTION_ID.matcher(record.fields().action());
        if (matcher.find()) {
            return Optional.of(matcher.group());
        }
        matcher = commentedAction.matcher(record.rawText());
        if (matcher.find()) {
            return Optional.of(matcher.group(1));
        }
        matcher = COMMENT_ID.matcher(record.leadingComments());
        if (matcher.find()) {
            return Optional.of(matcher.group(1));
        }
        return Optional.empty();
    }
}
