package com.keysort.sort;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Normalizes key chords so equivalent triggers compare equal.
 * <p>
 * {@code Shift+Ctrl+K  ctrl+ctrl+c} becomes {@code ctrl+shift+k ctrl+c}: lower case,
 * chords separated by one space, modifiers de-duplicated and ordered by the configured
 * modifier order with unknown modifiers after them in alphabetical order.
 */
public class ChordNormalizer {

    private final List<String> modifierOrder;

    public ChordNormalizer(List<String> modifierOrder) {
        this.modifierOrder = modifierOrder.stream().map(modifier -> modifier.toLowerCase(Locale.ROOT)).toList();
    }

    public String normalize(String trigger) {
        if (trigger == null || trigger.isBlank()) {
            return "";
        }
        List<String> chords = new ArrayList<>();
        for (String chord : trigger.strip().toLowerCase(Locale.ROOT).split("\\s+")) {
            chords.add(normalizeChord(chord));
        }
        return String.join(" ", chords);
    }

    private String normalizeChord(String chord) {
        String[] parts = chord.split("\\+", -1);
        String key = parts[parts.length - 1];
        // "ctrl++" binds the plus key itself
        if (key.isEmpty() && chord.endsWith("+")) {
            key = "+";
        }

        Set<String> modifiers = new LinkedHashSet<>();
        for (int i = 0; i < parts.length - 1; i++) {
            if (!parts[i].isEmpty()) {
                modifiers.add(parts[i]);
            }
        }

        List<String> ordered = new ArrayList<>();
        for (String modifier : modifierOrder) {
            if (modifiers.remove(modifier)) {
                ordered.add(modifier);
            }
        }
        modifiers.stream().sorted().forEach(ordered::add);
        ordered.add(key);
        return String.join("+", ordered);
    }
}
