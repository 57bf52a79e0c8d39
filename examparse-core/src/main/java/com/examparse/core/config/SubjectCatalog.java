package com.examparse.core.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Closed vocabulary of subject names printed as section headers in the exam booklets.
 *
 * <p>Headers are often typeset with letter spacing ("무 역 규 범"), so every name is matched with
 * optional inline whitespace between its characters. Newlines are never bridged.
 *
 * <p>A header is a line holding nothing but the name, optionally after an ordinal
 * ("제1과목 무역규범"). Subject names quoted in question text are not headers.
 */
@Configuration
@ConfigurationProperties(prefix = "examparse.subjects")
@Getter
@Setter
public class SubjectCatalog {

    private static final String INLINE_SPACE = "[^\\S\\n]*";
    private static final String ORDINAL_HEADERS = "제[^\\S\\n]?\\d[^\\S\\n]?과목|제[^\\S\\n]?\\d[^\\S\\n]?교시";

    private List<String> names = new ArrayList<>(List.of("무역규범", "무역결제", "무역계약", "무역영어"));
    private List<String> headerAliases = new ArrayList<>(List.of("무역물류"));
    private String fallback = "일반";

    /**
     * Pattern matching a whole header line: a subject name, an alias or an ordinal header
     * ("제1과목", "제 2 교시"). Group 1 holds the header text used as the section's subject hint.
     */
    public Pattern headerPattern() {
        List<String> alternatives = new ArrayList<>();
        names.forEach(name -> alternatives.add(spaced(name)));
        headerAliases.forEach(alias -> alternatives.add(spaced(alias)));
        alternatives.add(ORDINAL_HEADERS);
        String ordinalPrefix = "(?:(?:" + ORDINAL_HEADERS + ")" + INLINE_SPACE + "[.:]?" + INLINE_SPACE + ")?";
        return Pattern.compile("(?m)^" + INLINE_SPACE + ordinalPrefix
            + "(" + String.join("|", alternatives) + ")" + INLINE_SPACE + "$");
    }

    /**
     * Subject names from {@link #names} that occur in the text, ordered by first occurrence.
     */
    public List<String> detectSubjects(String text) {
        Map<String, Integer> firstSeen = new LinkedHashMap<>();
        for (String name : names) {
            Matcher matcher = Pattern.compile(spaced(name)).matcher(text);
            if (matcher.find()) {
                firstSeen.put(name, matcher.start());
            }
        }
        return firstSeen.entrySet().stream()
            .sorted(Map.Entry.comparingByValue(Comparator.naturalOrder()))
            .map(Map.Entry::getKey)
            .collect(Collectors.toList());
    }

    public static String normalizeHeader(String header) {
        return header.replaceAll("\\s+", "");
    }

    private static String spaced(String name) {
        return name.codePoints()
            .mapToObj(cp -> Pattern.quote(new String(Character.toChars(cp))))
            .collect(Collectors.joining(INLINE_SPACE));
    }
}
