package com.cratepilot.app.util;

import com.cratepilot.app.exception.InvalidInputException;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Harmonic-mixing arithmetic on the 24-position Camelot wheel (1-12, A = minor, B = major).
 */
public final class CamelotWheel {

    public enum Compatibility { PERFECT, COMPATIBLE, INCOMPATIBLE }

    public static final int DIFFERENT_MODE = Integer.MAX_VALUE;

    private static final Pattern KEY_PATTERN = Pattern.compile("^(1[0-2]|[1-9])([AB])$");

    private static final List<String> ALL_KEYS;

    static {
        List<String> keys = new ArrayList<>(24);
        for (int number = 1; number <= 12; number++) {
            keys.add(number + "A");
            keys.add(number + "B");
        }
        ALL_KEYS = List.copyOf(keys);
    }

    private CamelotWheel() {
    }

    public static List<String> allKeys() {
        return ALL_KEYS;
    }

    public static boolean isValidKey(String key) {
        return key != null && KEY_PATTERN.matcher(key).matches();
    }

    /**
     * Same key, relative key, then the two neighbours on the same letter.
     * Always four distinct entries; malformed keys are rejected.
     */
    public static List<String> compatibleKeys(String key) {
        Position position = parse(key);
        Set<String> compatible = new LinkedHashSet<>();
        compatible.add(key);
        compatible.add(position.relative().notation());
        compatible.add(position.shift(1).notation());
        compatible.add(position.shift(-1).notation());
        return List.copyOf(compatible);
    }

    public static boolean areCompatible(String first, String second) {
        return compatibleKeys(first).contains(second);
    }

    public static String relativeKey(String key) {
        return parse(key).relative().notation();
    }

    public static List<String> adjacentKeys(String key) {
        Position position = parse(key);
        return List.of(position.shift(1).notation(), position.shift(-1).notation());
    }

    public static Compatibility compatibilityLevel(String first, String second) {
        if (first.equals(second)) {
            return Compatibility.PERFECT;
        }
        return areCompatible(first, second) ? Compatibility.COMPATIBLE : Compatibility.INCOMPATIBLE;
    }

    /**
     * Circular distance (0-6) between two keys of the same letter, {@link #DIFFERENT_MODE} otherwise.
     */
    public static int keyDistance(String first, String second) {
        Position a = parse(first);
        Position b = parse(second);
        if (a.letter() != b.letter()) {
            return DIFFERENT_MODE;
        }
        int diff = Math.abs(a.number() - b.number());
        return Math.min(diff, 12 - diff);
    }

    public static Position parse(String key) {
        Matcher matcher = key != null ? KEY_PATTERN.matcher(key) : null;
        if (matcher == null || !matcher.matches()) {
            throw new InvalidInputException("Invalid Camelot key: " + key);
        }
        return new Position(Integer.parseInt(matcher.group(1)), matcher.group(2).charAt(0));
    }

    public record Position(int number, char letter) {

        public String notation() {
            return number + String.valueOf(letter);
        }

        public boolean isMinor() {
            return letter == 'A';
        }

        Position relative() {
            return new Position(number, letter == 'A' ? 'B' : 'A');
        }

        Position shift(int steps) {
            int shifted = Math.floorMod(number - 1 + steps, 12) + 1;
            return new Position(shifted, letter);
        }
    }
}
