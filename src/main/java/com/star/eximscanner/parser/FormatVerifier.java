package com.star.eximscanner.parser;

import java.util.regex.Pattern;

/**
 * Cheap first-line probe deciding whether a file is worth a full parse.
 *
 * <p>The probe only checks the fixed-width date-time prefix, so every line
 * the full grammar accepts also passes here.
 */
public class FormatVerifier {

    private final Pattern verificationPattern;

    public FormatVerifier(String verificationRegex) {
        this.verificationPattern = Pattern.compile(verificationRegex);
    }

    public boolean verify(String line) {
        if (line == null || line.isEmpty()) {
            return false;
        }
        return verificationPattern.matcher(line).lookingAt();
    }

    public String pattern() {
        return verificationPattern.pattern();
    }
}
