package com.example.audiobook.utils.constants;

import java.util.regex.Pattern;

public class RegexPatterns {
    public static final Pattern DECODE_ERROR_PATTERN = Pattern.compile("error|invalid data", Pattern.CASE_INSENSITIVE);
    public static final Pattern INVALID_PATH_CHARS = Pattern.compile("[<>:|?*\"\\p{Cntrl}]");
    public static final Pattern PATH_SEPARATORS = Pattern.compile("[/\\\\]");
    public static final Pattern TRAILING_DOTS = Pattern.compile("\\.+$");
}
