package io.tickwork.core.schedule;

import java.util.BitSet;

enum CronField {
    MINUTE("minute", 0, 59),
    HOUR("hour", 0, 23),
    DAY_OF_MONTH("day-of-month", 1, 31),
    MONTH("month", 1, 12),
    DAY_OF_WEEK("day-of-week", 0, 6);

    private final String label;
    private final int min;
    private final int max;

    CronField(String label, int min, int max) {
        this.label = label;
        this.min = min;
        this.max = max;
    }

    BitSet parse(String text) {
        if (text.isEmpty()) {
            throw new IllegalArgumentException(label + " field is empty");
        }
        BitSet values = new BitSet(max + 1);
        for (String item : text.split(",", -1)) {
            parseItem(item, values);
        }
        return values;
    }

    private void parseItem(String item, BitSet values) {
        if (item.isEmpty()) {
            throw new IllegalArgumentException("empty list item in " + label + " field");
        }

        String range = item;
        int step = 1;
        int slash = item.indexOf('/');
        if (slash >= 0) {
            range = item.substring(0, slash);
            step = number(item.substring(slash + 1));
            if (step < 1) {
                throw new IllegalArgumentException("step must be >= 1 in " + label + " field: " + item);
            }
        }

        int from;
        int to;
        if ("*".equals(range)) {
            from = min;
            to = max;
        } else {
            int dash = range.indexOf('-');
            if (dash >= 0) {
                from = bounded(range.substring(0, dash));
                to = bounded(range.substring(dash + 1));
                if (from > to) {
                    throw new IllegalArgumentException("inverted range in " + label + " field: " + item);
                }
            } else {
                if (slash >= 0) {
                    throw new IllegalArgumentException("step requires '*' or a range in " + label + " field: " + item);
                }
                from = bounded(range);
                to = from;
            }
        }

        for (int value = from; value <= to; value += step) {
            values.set(value);
        }
    }

    private int bounded(String token) {
        int value = number(token);
        if (value < min || value > max) {
            throw new IllegalArgumentException(label + " value out of range " + min + "-" + max + ": " + token);
        }
        return value;
    }

    private int number(String token) {
        if (token.isEmpty() || !token.chars().allMatch(Character::isDigit)) {
            throw new IllegalArgumentException("invalid number in " + label + " field: '" + token + "'");
        }
        try {
            return Integer.parseInt(token);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid number in " + label + " field: '" + token + "'", e);
        }
    }
}
