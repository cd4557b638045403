package com.safepocket.categorizer.transfer;

/**
 * Account identifiers are commonly written as {@code number/bankcode}. Two identifiers refer to the same
 * account when they are equal or when their numbers before the routing suffix are equal.
 */
public final class AccountNumbers {

    private AccountNumbers() {
    }

    public static String baseNumber(String account) {
        if (account == null) {
            return "";
        }
        String trimmed = account.trim();
        int slash = trimmed.indexOf('/');
        return slash >= 0 ? trimmed.substring(0, slash).trim() : trimmed;
    }

    public static boolean sameAccount(String left, String right) {
        if (left == null || right == null || left.isBlank() || right.isBlank()) {
            return false;
        }
        if (left.trim().equals(right.trim())) {
            return true;
        }
        String leftBase = baseNumber(left);
        return !leftBase.isEmpty() && leftBase.equals(baseNumber(right));
    }
}
