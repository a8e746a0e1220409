package com.keysort.sort;

import java.util.Optional;
import java.util.Random;
import java.util.Set;

/**
 * Draws random 4-hex identifiers that are not in use yet.
 */
public class IdAllocator {

    /**
     * Attempts before giving up on one allocation.
     */
    public static final int MAX_ATTEMPTS = 100;

    private final Random random;
    private final int maxAttempts;

    public IdAllocator(Random random) {
        this(random, MAX_ATTEMPTS);
    }

    public IdAllocator(Random random, int maxAttempts) {
        this.random = random;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Allocate an identifier absent from {@code used} and add it there.
     *
     * @return The identifier, or empty when every attempt collided
     */
    public Optional<String> allocate(Set<String> used) {
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            String candidate = String.format("%04x", random.nextInt(0x10000));
            if (used.add(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
