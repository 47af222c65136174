package com.purchasingpower.hsn.query;

import com.google.common.collect.ImmutableSet;
import com.purchasingpower.hsn.conversation.DialoguePhase;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rule-based intent classification. Rules are applied in order:
 * <ol>
 *   <li>an 8-digit code anywhere in the text is a direct lookup;</li>
 *   <li>while awaiting a selection, a bare number or a selection keyword is a selection;</li>
 *   <li>a summary keyword is a summarization request;</li>
 *   <li>anything else is classified by retrieval.</li>
 * </ol>
 * Keywords match common inflections ("options", "chose", "categories").
 */
@Slf4j
@Component
public class IntentClassifier {

    private static final Pattern HSN_CODE = Pattern.compile("\\b(\\d{8})\\b");
    private static final Pattern BARE_NUMBER = Pattern.compile("\\d+");
    private static final Pattern TOKEN_SEPARATOR = Pattern.compile("[^\\p{L}\\p{N}]+");

    private static final Set<String> SELECTION_KEYWORDS = inflected(
            "select", "choose", "option", "first", "second", "third");
    private static final Set<String> SUMMARY_KEYWORDS = inflected(
            "overview", "category", "type", "kind", "classification");

    public ParsedQuery classify(String query, DialoguePhase phase) {
        Matcher code = HSN_CODE.matcher(query);
        if (code.find()) {
            return new ParsedQuery(query, QueryIntent.DIRECT_LOOKUP, code.group(1));
        }

        String trimmed = query.strip();
        QueryIntent intent = QueryIntent.CLASSIFICATION;
        if (phase == DialoguePhase.AWAITING_SELECTION
                && (BARE_NUMBER.matcher(trimmed).matches() || containsAny(trimmed, SELECTION_KEYWORDS))) {
            intent = QueryIntent.SELECTION;
        } else if (containsAny(trimmed, SUMMARY_KEYWORDS)) {
            intent = QueryIntent.SUMMARIZATION;
        }

        log.debug("Query '{}' parsed with intent: {}", query, intent);
        return ParsedQuery.of(query, intent);
    }

    private static boolean containsAny(String text, Set<String> keywords) {
        return Arrays.stream(TOKEN_SEPARATOR.split(text.toLowerCase(Locale.ROOT)))
                .anyMatch(keywords::contains);
    }

    private static Set<String> inflected(String... lemmas) {
        ImmutableSet.Builder<String> forms = ImmutableSet.builder();
        for (String lemma : lemmas) {
            forms.add(lemma, lemma + "s", lemma + "ed", lemma + "ing");
            if (lemma.endsWith("y")) {
                forms.add(lemma.substring(0, lemma.length() - 1) + "ies");
            }
            if (lemma.endsWith("e")) {
                String stem = lemma.substring(0, lemma.length() - 1);
                forms.add(lemma + "d", stem + "ing");
            }
            if (lemma.equals("choose")) {
                forms.add("chose", "chosen");
            }
        }
        return forms.build();
    }
}
