package com.billsync.web;

import java.util.UUID;
import java.util.regex.Pattern;

/** Server-issued identifiers are canonical lowercase UUIDs; anything else cannot exist in the store. */
public final class Identifiers {

    private static final Pattern CANONICAL_UUID =
            Pattern.compile("[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}");

    private Identifiers() {}

    public static String newId() {
        return UUID.randomUUID().toString();
    }

    public static boolean isWellFormed(String id) {
        return id != null && CANONICAL_UUID.matcher(id).matches();
    }
}
