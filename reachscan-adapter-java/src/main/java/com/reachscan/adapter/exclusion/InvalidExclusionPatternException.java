package com.reachscan.adapter.exclusion;

public class InvalidExclusionPatternException extends RuntimeException {

    private final String pattern;

    public InvalidExclusionPatternException(String pattern, String message) {
        super("Invalid exclusion pattern '" + pattern + "': " + message);
        this.pattern = pattern;
    }

    public String getPattern() {
        return pattern;
    }
}
