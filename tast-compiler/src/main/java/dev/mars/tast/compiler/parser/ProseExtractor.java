/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package dev.mars.tast.compiler.parser;

import dev.mars.tast.core.LiteralValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Extracts data bindings, {@code <placeholder>} parameters and a normalized form
 * from the free text of a step.
 *
 * <p>The scan is a single left-to-right pass over words, quoted strings, numbers
 * and placeholders. Noise words ({@code a an the some any}) and binding verbs
 * ({@code is has with having contains}) are dropped. A quoted or numeric literal
 * binds to the nearest preceding word, so {@code user with email "x"},
 * {@code the user has email "x"} and {@code email is "x"} all bind
 * {@code email}. A literal with no word before it since the last literal is
 * anonymous and bound to {@code $0}, {@code $1}, ... The connectives
 * {@code and}/{@code or} never become keys.
 *
 * <p>The normalized text keeps words lowercased and literals re-quoted, and it
 * drops binding verbs as well as noise words. {@code a user with email "x"} and
 * {@code the user has email "x"} therefore both normalize to {@code user email "x"}.
 *
 * <p>The phrase {@code from fixture Name} names a fixture whose fields are
 * merged into the step's data during IR building.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-03
 * @version 1.0
 */
public class ProseExtractor {

    public static final Set<String> NOISE_WORDS = Set.of("a", "an", "the", "some", "any");
    public static final Set<String> BINDING_VERBS = Set.of("is", "has", "with", "having", "contains");
    private static final Set<String> CONNECTIVES = Set.of("and", "or");

    public Extraction extract(String text) {
        Objects.requireNonNull(text, "Text cannot be null");
        List<ProseToken> tokens = scan(text);

        Map<String, LiteralValue> data = new LinkedHashMap<>();
        List<String> parameters = new ArrayList<>();
        List<String> normalized = new ArrayList<>();
        String fixtureReference = null;
        String lastWord = null;
        int anonymous = 0;

        for (int i = 0; i < tokens.size(); i++) {
            ProseToken token = tokens.get(i);
            switch (token.kind) {
                case WORD:
                    String word = token.text.toLowerCase(Locale.ROOT);
                    if (word.equals("from") && isWord(tokens, i + 1, "fixture") && isWord(tokens, i + 2, null)) {
                        fixtureReference = tokens.get(i + 2).text;
                        normalized.add("from fixture " + fixtureReference.toLowerCase(Locale.ROOT));
                        lastWord = null;
                        i += 2;
                    } else if (NOISE_WORDS.contains(word) || BINDING_VERBS.contains(word)) {
                        continue;
                    } else {
                        normalized.add(word);
                        lastWord = CONNECTIVES.contains(word) ? null : word;
                    }
                    break;
                case LITERAL:
                    normalized.add(token.text);
                    String key = lastWord != null ? lastWord : "$" + anonymous++;
                    data.put(key, token.literal);
                    lastWord = null;
                    break;
                case PLACEHOLDER:
                    normalized.add("<" + token.text + ">");
                    if (!parameters.contains(token.text)) {
                        parameters.add(token.text);
                    }
                    lastWord = null;
                    break;
                default:
                    break;
            }
        }

        return new Extraction(String.join(" ", normalized), data, parameters, fixtureReference);
    }

    private static boolean isWord(List<ProseToken> tokens, int index, String expected) {
        if (index >= tokens.size() || tokens.get(index).kind != ProseToken.Kind.WORD) {
            return false;
        }
        return expected == null || tokens.get(index).text.equalsIgnoreCase(expected);
    }

    private static List<ProseToken> scan(String text) {
        List<ProseToken> tokens = new ArrayList<>();
        int pos = 0;
        int length = text.length();
        while (pos < length) {
            char c = text.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == '"') {
                StringBuilder value = new StringBuilder();
                pos++;
                while (pos < length && text.charAt(pos) != '"') {
                    char ch = text.charAt(pos);
                    if (ch == '\\' && pos + 1 < length) {
                        char escaped = text.charAt(pos + 1);
                        switch (escaped) {
                            case 'n':
                                value.append('\n');
                                break;
                            case 't':
                                value.append('\t');
                                break;
                            case '"':
                            case '\\':
                                value.append(escaped);
                                break;
                            default:
                                value.append('\\').append(escaped);
                                break;
                        }
                        pos += 2;
                    } else {
                        value.append(ch);
                        pos++;
                    }
                }
                pos++; // closing quote
                LiteralValue literal = LiteralValue.ofString(value.toString());
                tokens.add(new ProseToken(ProseToken.Kind.LITERAL, quote(value.toString()), literal));
            } else if (c == '<' && pos + 1 < length && isWordStart(text.charAt(pos + 1))) {
                int end = pos + 1;
                while (end < length && isWordPart(text.charAt(end))) {
                    end++;
                }
                if (end < length && text.charAt(end) == '>') {
                    tokens.add(new ProseToken(ProseToken.Kind.PLACEHOLDER, text.substring(pos + 1, end), null));
                    pos = end + 1;
                } else {
                    pos++;
                }
            } else if (isDigit(c) || (c == '-' && pos + 1 < length && isDigit(text.charAt(pos + 1)))) {
                int start = pos;
                pos++;
                while (pos < length && isDigit(text.charAt(pos))) {
                    pos++;
                }
                if (pos + 1 < length && text.charAt(pos) == '.' && isDigit(text.charAt(pos + 1))) {
                    pos++;
                    while (pos < length && isDigit(text.charAt(pos))) {
                        pos++;
                    }
                }
                int suffixStart = pos;
                while (pos < length && isWordPart(text.charAt(pos))) {
                    pos++;
                }
                String lexeme = text.substring(start, pos);
                String suffix = text.substring(suffixStart, pos);
                if (suffix.isEmpty()) {
                    tokens.add(new ProseToken(ProseToken.Kind.LITERAL, lexeme, LiteralValue.ofNumber(lexeme)));
                } else if (LiteralValue.isDurationUnit(suffix) && c != '-') {
                    tokens.add(new ProseToken(ProseToken.Kind.LITERAL, lexeme, LiteralValue.ofDuration(lexeme)));
                } else {
                    tokens.add(new ProseToken(ProseToken.Kind.WORD, lexeme, null));
                }
            } else if (isWordStart(c)) {
                int start = pos;
                while (pos < length && (isWordPart(text.charAt(pos)) || text.charAt(pos) == '-')) {
                    pos++;
                }
                tokens.add(new ProseToken(ProseToken.Kind.WORD, text.substring(start, pos), null));
            } else {
                pos++;
            }
        }
        return tokens;
    }

    private static String quote(String value) {
        return '"' + value.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isWordStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isWordPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private static final class ProseToken {
        enum Kind { WORD, LITERAL, PLACEHOLDER }

        final Kind kind;
        final String text;
        final LiteralValue literal;

        ProseToken(Kind kind, String text, LiteralValue literal) {
            this.kind = kind;
            this.text = text;
            this.literal = literal;
        }
    }

    /**
     * What the prose of one step yields.
     */
    public static final class Extraction {
        private final String normalizedText;
        private final Map<String, LiteralValue> data;
        private final List<String> parameters;
        private final String fixtureReference;

        Extraction(String normalizedText, Map<String, LiteralValue> data,
                   List<String> parameters, String fixtureReference) {
            this.normalizedText = normalizedText;
            this.data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
            this.parameters = List.copyOf(parameters);
            this.fixtureReference = fixtureReference;
        }

        public String getNormalizedText() {
            return normalizedText;
        }

        public Map<String, LiteralValue> getData() {
            return data;
        }

        public List<String> getParameters() {
            return parameters;
        }

        public String getFixtureReference() {
            return fixtureReference;
        }

        @Override
        public String toString() {
            return "Extraction{'" + normalizedText + "', data=" + data + ", parameters=" + parameters + '}';
        }
    }
}
