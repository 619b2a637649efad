package com.ozmeta.compiler.naming;

import java.util.Locale;

import com.ozmeta.compiler.model.canonical.ConstraintProfile;
import com.ozmeta.compiler.model.canonical.NormalizeRule;
import com.ozmeta.compiler.util.Hashing;

/**
 * Turns canonical names into platform identifiers. Pure: the result depends
 * only on the name and the profile, and normalizing a result again with the
 * same profile returns it unchanged.
 */
public final class IdentifierNormalizer {

    static final int HASH_LENGTH = 6;
    private static final String EMPTY_PLACEHOLDER = "x";

    private IdentifierNormalizer() {
        // Utility class
    }

    public static String normalizeIdentifier(String canonicalName, ConstraintProfile profile) {
        String cased = applyCase(canonicalName, profile);
        String cleaned = applyCharset(cased, profile);
        if (cleaned.isEmpty()) {
            cleaned = applyCase(EMPTY_PLACEHOLDER, profile);
        }
        if (cleaned.length() <= profile.getMaxLength()) {
            return cleaned;
        }
        return withHashSuffix(cleaned, canonicalName, profile);
    }

    /**
     * Truncates {@code physicalName} so that a separator and the six-character
     * hash of {@code canonicalName} fit within the profile's maximum length.
     */
    public static String withHashSuffix(String physicalName, String canonicalName, ConstraintProfile profile) {
        String separator = separator(profile);
        String hash = applyCase(Hashing.sha256Hex(canonicalName).substring(0, HASH_LENGTH), profile);
        int keep = Math.max(0, profile.getMaxLength() - HASH_LENGTH - separator.length());
        String prefix = physicalName.length() > keep ? physicalName.substring(0, keep) : physicalName;
        return prefix + separator + hash;
    }

    /**
     * True when {@code physicalName} satisfies length, case and charset rules.
     */
    public static boolean conforms(String physicalName, ConstraintProfile profile) {
        if (physicalName.isEmpty() || physicalName.length() > profile.getMaxLength()) {
            return false;
        }
        if (!applyCase(physicalName, profile).equals(physicalName)) {
            return false;
        }
        for (int i = 0; i < physicalName.length(); i++) {
            if (!profile.allows(physicalName.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static String applyCase(String name, ConstraintProfile profile) {
        switch (profile.getCasePolicy()) {
            case LOWER:
                return name.toLowerCase(Locale.ROOT);
            case UPPER:
                return name.toUpperCase(Locale.ROOT);
            default:
                return name;
        }
    }

    private static String applyCharset(String name, ConstraintProfile profile) {
        NormalizeRule rule = profile.getNormalizeRule();
        StringBuilder sb = new StringBuilder(name.length());
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (profile.allows(c)) {
                sb.append(c);
            } else if (!rule.isStrip()) {
                sb.append(rule.getReplacement());
            }
        }
        return sb.toString();
    }

    private static String separator(ConstraintProfile profile) {
        if (profile.allows('_')) {
            return "_";
        }
        NormalizeRule rule = profile.getNormalizeRule();
        if (!rule.isStrip() && profile.allows(rule.getReplacement())) {
            return String.valueOf(rule.getReplacement());
        }
        return "";
    }
}
