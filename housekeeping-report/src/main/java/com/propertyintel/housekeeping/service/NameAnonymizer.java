package com.propertyintel.housekeeping.service;

import org.springframework.stereotype.Component;

/**
 * Shortens personal names to "First L." before they reach any report artifact.
 *
 * "Smith, Jane"      → "Jane S."
 * "Jane Ann Smith"   → "Jane S."
 * "jsmith"           → "jsmith"
 */
@Component
public class NameAnonymizer {

    public String anonymize(String name) {
        if (name == null) return "";
        String s = name.trim().replaceAll("\\s+", " ");
        if (s.isEmpty()) return "";

        int comma = s.indexOf(',');
        if (comma >= 0) {
            String last = s.substring(0, comma).trim();
            String first = s.substring(comma + 1).trim();
            if (!first.isEmpty()) {
                s = (first + " " + last).trim();
            }
        }

        String[] parts = s.split(" ");
        if (parts.length == 1) return parts[0];
        String last = parts[parts.length - 1];
        return parts[0] + " " + Character.toUpperCase(last.charAt(0)) + ".";
    }
}
