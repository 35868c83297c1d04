package com.phillippitts.multishot.service.output;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Human-readable run folder names: {@code 2025-08-10_14-05_react-auth-perf}.
 *
 * <p>The topic part is made of up to three keywords taken from the prompt. Well-known
 * technical terms are abbreviated and ranked first. When the prompt yields no usable
 * keyword a category such as {@code how-to} or {@code debugging} is used instead.
 */
final class FolderNames {

    static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd_HH-mm", Locale.ROOT);
    static final int MAX_TOPIC_LENGTH = 40;

    private static final Pattern STAMPED = Pattern.compile("^(\\d{4}-\\d{2}-\\d{2}_\\d{2}-\\d{2})_.+");

    private static final Set<String> STOP_WORDS = Set.of(
            "a", "an", "and", "are", "as", "at", "be", "by", "for", "from", "has", "in", "is", "it",
            "its", "of", "on", "that", "the", "to", "was", "will", "with", "you", "your", "me", "my",
            "we", "us", "our", "they", "them", "this", "these", "those", "can", "could", "should",
            "would", "do", "does", "did", "have", "had", "what", "when", "where", "who", "why", "how",
            "help", "please");

    // Checked in order; the first term contained in a word wins.
    private static final List<Map.Entry<String, String>> TECH_TERMS = List.of(
            Map.entry("javascript", "js"), Map.entry("typescript", "ts"), Map.entry("python", "py"),
            Map.entry("kubernetes", "k8s"), Map.entry("database", "db"), Map.entry("postgresql", "postgres"),
            Map.entry("authentication", "auth"), Map.entry("authorization", "authz"),
            Map.entry("performance", "perf"), Map.entry("optimization", "optimize"),
            Map.entry("architecture", "arch"), Map.entry("algorithm", "algo"),
            Map.entry("deployment", "deploy"), Map.entry("debugging", "debug"),
            Map.entry("testing", "test"), Map.entry("security", "security"), Map.entry("react", "react"),
            Map.entry("docker", "docker"), Map.entry("graphql", "gql"), Map.entry("java", "java"));

    private FolderNames() {
    }

    static String folderName(String prompt, LocalDateTime timestamp) {
        return STAMP.format(timestamp) + "_" + topic(prompt);
    }

    static String topic(String prompt) {
        String clean = prompt == null ? "" : prompt.toLowerCase(Locale.ROOT).strip();
        Map<String, Integer> scores = new LinkedHashMap<>();
        for (String word : clean.replaceAll("[^\\w\\s-]", " ").split("\\s+")) {
            if (word.length() <= 2 || STOP_WORDS.contains(word)) {
                continue;
            }
            int score = 1;
            String key = word;
            for (Map.Entry<String, String> term : TECH_TERMS) {
                if (word.contains(term.getKey())) {
                    score += 3;
                    key = term.getValue();
                    break;
                }
            }
            if (word.length() >= 6) {
                score++;
            }
            scores.merge(key, score, Integer::sum);
        }

        List<Map.Entry<String, Integer>> top = scores.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder()))
                .limit(3)
                .collect(Collectors.toList());

        String topic;
        if (!top.isEmpty() && top.get(0).getValue() >= 2) {
            topic = top.stream().map(e -> sanitize(e.getKey())).filter(s -> !s.isEmpty())
                    .collect(Collectors.joining("-"));
        } else {
            topic = fallback(clean);
        }
        if (topic.isEmpty()) {
            topic = fallback(clean);
        }
        if (topic.length() > MAX_TOPIC_LENGTH) {
            topic = topic.substring(0, MAX_TOPIC_LENGTH).replaceAll("-[^-]*$", "");
        }
        return topic;
    }

    /**
     * Parses the timestamp prefix of a run folder name.
     */
    static Optional<LocalDateTime> parseTimestamp(String folderName) {
        Matcher m = STAMPED.matcher(folderName);
        if (!m.matches()) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDateTime.parse(m.group(1), STAMP));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static String fallback(String prompt) {
        if (prompt.contains("optimize") || prompt.contains("improve")) {
            return "optimization";
        }
        if (prompt.contains("implement") || prompt.contains("create")) {
            return "implementation";
        }
        if (prompt.contains("debug") || prompt.contains("error")) {
            return "debugging";
        }
        if (prompt.contains("what")) {
            return "explanation";
        }
        if (prompt.contains("how")) {
            return "how-to";
        }
        return "general-query";
    }

    private static String sanitize(String text) {
        return text.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9\\s-]", "")
                .replaceAll("[\\s_]+", "-")
                .replaceAll("-+", "-")
                .replaceAll("^-|-$", "");
    }
}
