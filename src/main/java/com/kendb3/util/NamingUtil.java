package com.kendb3.util;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Naming conventions shared by the API layer and the declaration exporter.
 */
public class NamingUtil {

    private NamingUtil() {
        // Utility class
    }

    /**
     * Converts a Java type name to its API name: an underscore is inserted before
     * every uppercase letter except the first character, then everything is
     * lowercased ({@code MinecraftVersion -> minecraft_version}).
     */
    public static String toApiName(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        StringBuilder sb = new StringBuilder(name.length() + 4);
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (i > 0 && Character.isUpperCase(c)) {
                sb.append('_');
            }
            sb.append(Character.toLowerCase(c));
        }
        return sb.toString();
    }

    /**
     * Converts a Java member name to an API field name. Same rule as
     * {@link #toApiName(String)}, except that constant-style names
     * ({@code DISPLAY_NAME}) are only lowercased.
     */
    public static String toFieldName(String memberName) {
        if (memberName != null && isConstantName(memberName)) {
            return memberName.toLowerCase();
        }
        return toApiName(memberName);
    }

    /**
     * Converts api_name or API-NAME to PascalCase.
     */
    public static String toPascalCase(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        return Arrays.stream(name.split("[-_]"))
                .map(NamingUtil::capitalize)
                .collect(Collectors.joining(""));
    }

    private static boolean isConstantName(String name) {
        boolean hasLetter = false;
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (Character.isLowerCase(c)) {
                return false;
            }
            hasLetter |= Character.isLetter(c);
        }
        return hasLetter && name.length() > 1;
    }

    private static String capitalize(String str) {
        if (str.isEmpty()) return str;
        return str.substring(0, 1).toUpperCase() + str.substring(1).toLowerCase();
    }
}
