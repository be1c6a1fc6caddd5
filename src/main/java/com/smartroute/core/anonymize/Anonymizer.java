package com.smartroute.core.anonymize;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Reversible substitution of identifiers and string literals, used on the
 * CLOUD_ANONYMIZED path.
 * <p>
 * Identifiers longer than two characters that are not keywords, and the
 * contents of quoted literals longer than three characters, are replaced by
 * placeholders of the form {@code __ph_<nonce>_<n>__}. Each call draws a
 * fresh nonce, so placeholders from concurrent requests never collide.
 * The same original always maps to the same placeholder within one call.
 * <p>
 * Instances hold no per-request state and are safe to share.
 */
public class Anonymizer {

    private static final Logger log = LoggerFactory.getLogger(Anonymizer.class);

    static final Pattern PLACEHOLDER_SHAPE = Pattern.compile("__ph_[0-9a-f]+_\\d+__");

    private static final Pattern TOKENS = Pattern.compile(
            "\"([^\"\\\\\\n]{4,})\"|'([^'\\\\\\n]{4,})'|\\b[A-Za-z_][A-Za-z0-9_]*\\b");

    static final Set<String> KEYWORDS = Set.of(
            // Python
            "and", "as", "assert", "async", "await", "break", "class", "continue", "def", "del", "elif",
            "else", "except", "False", "finally", "for", "from", "global", "if", "import", "in", "is",
            "lambda", "None", "nonlocal", "not", "or", "pass", "raise", "return", "True", "try", "while",
            "with", "yield", "self", "print", "len", "range", "str", "int", "float", "list", "dict", "set",
            "tuple", "bool", "open", "super", "type", "object",
            // Java and C-family
            "abstract", "boolean", "byte", "case", "catch", "char", "const", "default", "do", "double",
            "enum", "extends", "final", "goto", "implements", "instanceof", "interface", "long", "native",
            "new", "null", "package", "private", "protected", "public", "short", "static", "strictfp",
            "switch", "synchronized", "this", "throw", "throws", "transient", "void", "volatile", "var",
            "true", "false", "String", "Object", "Integer", "List", "Map", "function", "let",
            "undefined", "export", "require",
            // Prose
            "the", "that", "are", "was", "but", "all",
            "can", "has", "have", "will", "use", "into", "than", "then", "when", "what", "which");

    private final AtomicLong nonces = new AtomicLong();

    public AnonymizationResult anonymize(String text) {
        if (text == null || text.isEmpty()) {
            return new AnonymizationResult(text == null ? "" : text, Map.of());
        }
        String nonce = Long.toHexString(nonces.incrementAndGet());
        Map<String, String> byOriginal = new HashMap<>();
        Map<String, String> mapping = new LinkedHashMap<>();

        Matcher m = TOKENS.matcher(text);
        var out = new StringBuilder(text.length());
        int last = 0;
        while (m.find()) {
            String replacement;
            if (m.group(1) != null || m.group(2) != null) {
                String quote = m.group(1) != null ? "\"" : "'";
                String inner = m.group(1) != null ? m.group(1) : m.group(2);
                replacement = quote + placeholderFor(inner, nonce, byOriginal, mapping) + quote;
            } else {
                String identifier = m.group();
                if (identifier.length() <= 2 || KEYWORDS.contains(identifier)) {
                    continue;
                }
                replacement = placeholderFor(identifier, nonce, byOriginal, mapping);
            }
            out.append(text, last, m.start()).append(replacement);
            last = m.end();
        }
        out.append(text, last, text.length());
        log.debug("Anonymized {} distinct values (nonce {})", mapping.size(), nonce);
        return new AnonymizationResult(out.toString(), mapping);
    }

    /**
     * Replaces every mapped placeholder with its original, longest placeholder
     * first. Placeholder-shaped tokens with no mapping entry are left verbatim
     * and reported as warnings. Never throws.
     */
    public RestoreResult restore(String text, Map<String, String> mapping) {
        if (text == null || text.isEmpty()) {
            return new RestoreResult(text == null ? "" : text, List.of());
        }
        List<String> keys = mapping.keySet().stream()
                .sorted(Comparator.comparingInt(String::length).reversed())
                .toList();
        String keyAlternation = keys.stream().map(Pattern::quote).collect(Collectors.joining("|"));
        Pattern pattern = keys.isEmpty()
                ? PLACEHOLDER_SHAPE
                : Pattern.compile("(?:" + keyAlternation + ")|" + PLACEHOLDER_SHAPE.pattern());

        Set<String> unmatched = new LinkedHashSet<>();
        Matcher m = pattern.matcher(text);
        var out = new StringBuilder(text.length());
        while (m.find()) {
            String token = m.group();
            String original = mapping.get(token);
            if (original == null) {
                unmatched.add(token);
                original = token;
            }
            m.appendReplacement(out, Matcher.quoteReplacement(original));
        }
        m.appendTail(out);

        var warnings = new ArrayList<String>();
        for (String token : unmatched) {
            warnings.add("Unmatched anonymization placeholder left in output: " + token);
        }
        if (!warnings.isEmpty()) {
            log.warn("{} placeholder(s) could not be restored", warnings.size());
        }
        return new RestoreResult(out.toString(), warnings);
    }

    private static String placeholderFor(String original, String nonce, Map<String, String> byOriginal,
                                         Map<String, String> mapping) {
        return byOriginal.computeIfAbsent(original, o -> {
            String placeholder = "__ph_" + nonce + "_" + mapping.size() + "__";
            mapping.put(placeholder, o);
            return placeholder;
        });
    }
}
