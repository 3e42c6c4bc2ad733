package com.filerelay.proxy.codec;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Naming of transaction artifacts: {@code <flattened path>_<sha256 of the canonical request>}.
 */
public final class IdentityNames {

    public static final String EXTENSION = ".json";

    static final int MAX_PREFIX = 100;

    private static final Pattern UNSAFE = Pattern.compile("[^a-zA-Z0-9\\-]");
    private static final Pattern UNDERSCORES = Pattern.compile("_+");
    private static final Pattern LEADING = Pattern.compile("^[_\\-]+");

    private IdentityNames() {}

    public static String of(String path, String canonicalJson) {
        return flatten(path) + "_" + sha256Hex(canonicalJson);
    }

    public static String flatten(String path) {
        String flat = UNSAFE.matcher(path == null ? "" : path).replaceAll("_");
        flat = UNDERSCORES.matcher(flat).replaceAll("_");
        flat = LEADING.matcher(flat).replaceFirst("");
        if (flat.length() > MAX_PREFIX) {
            flat = flat.substring(0, MAX_PREFIX);
        }
        return flat.isEmpty() ? "root" : flat;
    }

    public static String sha256Hex(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static String fileName(String name) {
        return name + EXTENSION;
    }

    public static Optional<String> fromFileName(String fileName) {
        if (fileName == null || !fileName.endsWith(EXTENSION) || fileName.startsWith(".")) {
            return Optional.empty();
        }
        return Optional.of(fileName.substring(0, fileName.length() - EXTENSION.length()));
    }
}
