package com.billsync.protocol;

import java.util.regex.Pattern;

/**
 * Rules for the 6-digit device-sync pairing code, shared by the relay and the client.
 */
public final class PairingCodes {

    public static final int LENGTH = 6;
    public static final int LOWEST = 100_000;
    public static final int HIGHEST = 999_999;

    private static final Pattern FORMAT = Pattern.compile("^\\d{6}$");

    private PairingCodes() {
    }

    public static boolean isWellFormed(String code) {
        return code != null && FORMAT.matcher(code).matches();
    }

    /**
     * Normalises typed input ("482 913", " 482913\n") to the bare code.
     *
     * @throws BillSyncException VALIDATION_FAILURE if the result is not six digits
     */
    public static String normalize(String input) {
        String digits = input == null ? "" : input.replaceAll("\\s", "");
        if (!isWellFormed(digits)) {
            throw BillSyncException.invalid("Please enter a valid 6-digit code.");
        }
        return digits;
    }
}
