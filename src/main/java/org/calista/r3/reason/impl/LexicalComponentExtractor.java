package org.calista.r3.reason.impl;

import org.calista.r3.reason.ComponentExtractor;
import org.calista.r3.reason.Components;
import org.calista.r3.reason.Relation;
import org.calista.r3.text.Tokenizer;
import org.calista.r3.text.WhitespaceTokenizer;

import java.util.*;

/**
 * LexicalComponentExtractor — closed-class vocabularies plus casing and suffix heuristics.
 *
 * <p>Per token, first match wins: entity (pronoun or capitalized word longer than two characters),
 * then relation, quantifier, modality, connective (all on the lowercased token), then action
 * (suffix "ing" / "ed"). A capitalized "Every" or "Can" is therefore an entity.</p>
 */
public final class LexicalComponentExtractor implements ComponentExtractor {

    public static final Set<String> RELATIONS = Relation.VOCABULARY;
    public static final Set<String> QUANTIFIERS = Set.of("all", "every", "some", "no", "none");
    public static final Set<String> MODALITIES = Set.of("possible", "necessary", "impossible");
    public static final Set<String> CONNECTIVES = Set.of(
            "if", "then", "and", "or", "not", "but", "however", "although", "because");
    public static final Set<String> PRONOUNS = Set.of("I", "you", "he", "she", "it", "we", "they");

    private final Tokenizer tokenizer;

    public LexicalComponentExtractor() {
        this(new WhitespaceTokenizer());
    }

    public LexicalComponentExtractor(Tokenizer tokenizer) {
        this.tokenizer = Objects.requireNonNull(tokenizer, "tokenizer");
    }

    @Override
    public Components extract(String query) {
        List<String> tokens = tokenizer.tokenize(query);
        if (tokens.isEmpty()) return Components.none();

        ArrayList<String> entities = new ArrayList<>();
        ArrayList<Relation> relations = new ArrayList<>();
        ArrayList<String> quantifiers = new ArrayList<>();
        ArrayList<String> modalities = new ArrayList<>();
        ArrayList<String> actions = new ArrayList<>();
        ArrayList<String> connectives = new ArrayList<>();

        for (int i = 0; i < tokens.size(); i++) {
            String t = tokens.get(i);
            String lower = t.toLowerCase(Locale.ROOT);

            if (isEntity(t)) {
                entities.add(t);
            } else if (RELATIONS.contains(lower)) {
                String subject = i > 0 ? tokens.get(i - 1) : "";
                String object = i + 1 < tokens.size() ? tokens.get(i + 1) : "";
                relations.add(new Relation(subject, lower, object));
            } else if (QUANTIFIERS.contains(lower)) {
                quantifiers.add(lower);
            } else if (MODALITIES.contains(lower)) {
                modalities.add(lower);
            } else if (CONNECTIVES.contains(lower)) {
                connectives.add(lower);
            } else if (lower.endsWith("ing") || lower.endsWith("ed")) {
                actions.add(lower);
            }
        }

        return new Components(entities, relations, quantifiers, modalities, actions, connectives);
    }

    static boolean isEntity(String token) {
        if (PRONOUNS.contains(token)) return true;
        return token.length() > 2 && Character.isUpperCase(token.charAt(0));
    }
}
