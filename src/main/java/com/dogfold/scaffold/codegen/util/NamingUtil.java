package com.dogfold.scaffold.codegen.util;

import java.util.Arrays;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import com.dogfold.scaffold.codegen.exception.InvalidNameException;

/**
 * Naming conventions shared by the generation flows.
 */
public class NamingUtil {

    private static final Pattern WORD_BOUNDARY = Pattern.compile("(.)([A-Z][a-z]+)");
    private static final Pattern LOWER_TO_UPPER = Pattern.compile("([a-z0-9])([A-Z])");
    private static final Pattern SEPARATORS = Pattern.compile("[^A-Za-z0-9]+");

    private NamingUtil() {
        // Utility class
    }

    /**
     * Converts CamelCase to snake_case.
     * Splits before a capitalized word ("InvoiceItem" -> "invoice_item") and between an
     * acronym and the next word ("HTTPServer" -> "http_server").
     */
    public static String toSnakeCase(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        String result = WORD_BOUNDARY.matcher(name).replaceAll("$1_$2");
        result = LOWER_TO_UPPER.matcher(result).replaceAll("$1_$2");
        return result.toLowerCase(Locale.ROOT);
    }

    /**
     * Converts a verb or domain name to a type name: "invoice" -> "Invoice",
     * "send_reminder" -> "SendReminder", "sendReminder" -> "SendReminder".
     */
    public static String toTypeName(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        return Arrays.stream(SEPARATORS.split(name))
                .filter(part -> !part.isEmpty())
                .map(NamingUtil::capitalize)
                .collect(Collectors.joining(""));
    }

    /**
     * Converts a target package name to a Java package segment: "spec-core" -> "spec_core".
     */
    public static String toPackageSegment(String name) {
        return name.replace('-', '_').replace('.', '_').toLowerCase(Locale.ROOT);
    }

    /**
     * Rejects blank names and names that would escape the directory they are generated into.
     */
    public static String requireSimpleName(String kind, String name) {
        if (name == null || name.isBlank()) {
            throw new InvalidNameException(kind + " name must not be blank");
        }
        if (name.contains("/") || name.contains("\\") || name.equals(".") || name.equals("..")) {
            throw new InvalidNameException("Invalid " + kind.toLowerCase(Locale.ROOT) + " name: " + name);
        }
        return name;
    }

    private static String capitalize(String str) {
        return str.substring(0, 1).toUpperCase(Locale.ROOT) + str.substring(1);
    }
}
