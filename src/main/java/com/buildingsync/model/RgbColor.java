package com.buildingsync.model;

import lombok.Value;

import java.util.Locale;
import java.util.Optional;

/**
 * Display color derived from a hex token such as {@code #66b032} or {@code 66B032}
 */
@Value
public class RgbColor {
    
    public static final RgbColor MID_GRAY = new RgbColor(128, 128, 128);
    
    int red;
    int green;
    int blue;
    
    /**
     * Parse a 6-digit hex token, optionally prefixed with '#'
     */
    public static Optional<RgbColor> parseHex(String token) {
        return canonicalHex(token).map(hex -> new RgbColor(
                Integer.parseInt(hex.substring(1, 3), 16),
                Integer.parseInt(hex.substring(3, 5), 16),
                Integer.parseInt(hex.substring(5, 7), 16)));
    }
    
    /**
     * Canonical form of a hex token: lowercase, '#'-prefixed.
     * Empty when the token is not 6 hex digits.
     */
    public static Optional<String> canonicalHex(String token) {
        if (token == null) {
            return Optional.empty();
        }
        String hex = token.trim();
        if (hex.startsWith("#")) {
            hex = hex.substring(1);
        }
        if (hex.length() != 6) {
            return Optional.empty();
        }
        for (int i = 0; i < hex.length(); i++) {
            if (Character.digit(hex.charAt(i), 16) < 0) {
                return Optional.empty();
            }
        }
        return Optional.of("#" + hex.toLowerCase(Locale.ROOT));
    }
    
    public String toHex() {
        return String.format("#%02x%02x%02x", red, green, blue);
    }
}
