package com.examparse.core.validation;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves a raw answer token ("④", "4", "④ DDP") to the option it designates.
 */
@Slf4j
public final class AnswerMatcher {

    private static final Pattern FIRST_NUMBER = Pattern.compile("(\\d+)");

    private AnswerMatcher() {}

    /**
     * @return the exact option string, or {@code ""} when no rule matches
     */
    public static String match(String rawAnswer, List<String> options) {
        if (rawAnswer == null || rawAnswer.isBlank() || options == null || options.isEmpty()) {
            return "";
        }
        String token = rawAnswer.strip();

        Optional<String> direct = exactOrPrefix(token, options);
        if (direct.isPresent()) {
            return direct.get();
        }

        Matcher number = FIRST_NUMBER.matcher(token);
        if (number.find() && number.group(1).length() <= 2) {
            String glyph = CircledDigits.forNumber(Integer.parseInt(number.group(1)));
            if (!glyph.isEmpty()) {
                Optional<String> byGlyph = exactOrPrefix(glyph, options);
                if (byGlyph.isPresent()) {
                    return byGlyph.get();
                }
            }
        }

        log.debug("[MERGE] Answer did not match any option | answer={}", token);
        return "";
    }

    private static Optional<String> exactOrPrefix(String token, List<String> options) {
        if (options.contains(token)) {
            return Optional.of(token);
        }
        return options.stream()
            .filter(option -> option.strip().startsWith(token))
            .findFirst();
    }
}
