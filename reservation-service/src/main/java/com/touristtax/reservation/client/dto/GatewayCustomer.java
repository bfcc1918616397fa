package com.touristtax.reservation.client.dto;

public record GatewayCustomer(
        String firstName,
        String lastName,
        String email
) {
    /**
     * Splits a full guest name on the first space; a single-word name becomes the first name.
     */
    public static GatewayCustomer fromFullName(String fullName, String email) {
        String trimmed = fullName == null ? "" : fullName.trim();
        int space = trimmed.indexOf(' ');
        if (space < 0) {
            return new GatewayCustomer(trimmed, "", email);
        }
        return new GatewayCustomer(trimmed.substring(0, space), trimmed.substring(space + 1).trim(), email);
    }
}
