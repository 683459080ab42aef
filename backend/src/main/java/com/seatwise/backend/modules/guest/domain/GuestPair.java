package com.seatwise.backend.modules.guest.domain;

import java.util.Objects;
import java.util.UUID;

/**
 * Unordered pair of guests stored in canonical order: {@code first} sorts before {@code second}
 * by textual UUID, which is also how PostgreSQL orders uuid values.
 */
public record GuestPair(UUID first, UUID second) {

    public GuestPair {
        Objects.requireNonNull(first, "first");
        Objects.requireNonNull(second, "second");
        if (first.equals(second)) {
            throw new IllegalArgumentException("A guest cannot be paired with themselves");
        }
        if (first.toString().compareTo(second.toString()) > 0) {
            throw new IllegalArgumentException("GuestPair must be normalized; use GuestPair.of");
        }
    }

    public static GuestPair of(UUID a, UUID b) {
        Objects.requireNonNull(a, "a");
        Objects.requireNonNull(b, "b");
        return a.toString().compareTo(b.toString()) <= 0 ? new GuestPair(a, b) : new GuestPair(b, a);
    }

    public UUID other(UUID guestId) {
        if (first.equals(guestId)) {
            return second;
        }
        if (second.equals(guestId)) {
            return first;
        }
        throw new IllegalArgumentException("Guest " + guestId + " is not part of " + this);
    }
}
