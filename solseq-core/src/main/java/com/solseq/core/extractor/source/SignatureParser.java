package com.solseq.core.extractor.source;

import com.solseq.core.model.EventParameter;
import com.solseq.core.model.EventUnit;
import com.solseq.core.model.FunctionKind;
import com.solseq.core.model.Parameter;
import com.solseq.core.model.StateMutability;
import com.solseq.core.model.StateVariable;
import com.solseq.core.model.Visibility;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;

import static com.solseq.core.extractor.source.SolidityPatterns.DATA_LOCATION;
import static com.solseq.core.extractor.source.SolidityPatterns.IDENTIFIER;
import static com.solseq.core.extractor.source.SolidityPatterns.LEADING_WORD;
import static com.solseq.core.extractor.source.SolidityPatterns.OVERRIDE_SPECIFIER;
import static com.solseq.core.extractor.source.SolidityPatterns.RETURNS_CLAUSE;
import static com.solseq.core.extractor.source.SolidityPatterns.STATE_VARIABLE_MODIFIERS;
import static com.solseq.core.extractor.source.SolidityPatterns.TRAILING_NAME;
import static com.solseq.core.extractor.source.SolidityPatterns.VISIBILITY_KEYWORDS;

/**
 * Parses member headers: function signatures, event declarations and state variables.
 *
 * <p>Headers arrive with comments removed and without their body or trailing semicolon.
 * Parsing is keyword driven; anything that does not fit yields an empty result.
 */
final class SignatureParser {

    private SignatureParser() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Parsed function header, without body effects.
     */
    record FunctionSignature(
        String name,
        FunctionKind kind,
        Visibility visibility,
        StateMutability mutability,
        List<Parameter> parameters,
        List<Parameter> returns
    ) {
    }

    /**
     * Parses a {@code function}, {@code constructor}, {@code fallback} or {@code receive} header.
     *
     * @param header member header text
     * @param contractName enclosing contract, used to recognise pre-0.5 constructors
     * @return signature, or empty when the header has no parameter list
     */
    static Optional<FunctionSignature> parseFunction(String header, String contractName) {
        Matcher keyword = LEADING_WORD.matcher(header);
        if (!keyword.find()) {
            return Optional.empty();
        }
        String leading = keyword.group(1);
        String afterKeyword = header.substring(keyword.end());

        int open = afterKeyword.indexOf('(');
        if (open < 0) {
            return Optional.empty();
        }
        String name = "function".equals(leading) ? afterKeyword.substring(0, open).trim() : leading;
        if (!name.isEmpty() && !name.matches(IDENTIFIER)) {
            return Optional.empty();
        }
        int close = SourceText.matching(afterKeyword, open, '(', ')');
        if (close < 0) {
            return Optional.empty();
        }

        FunctionKind kind = FunctionKind.FUNCTION;
        if ("constructor".equals(leading) || name.equals(contractName)) {
            kind = FunctionKind.CONSTRUCTOR;
            name = "constructor";
        } else if (name.isEmpty()) {
            name = "fallback";
        }

        List<Parameter> parameters = parseParameters(afterKeyword.substring(open + 1, close));
        String trailer = afterKeyword.substring(close + 1);

        List<Parameter> returns = List.of();
        Matcher returnsClause = RETURNS_CLAUSE.matcher(trailer);
        if (returnsClause.find()) {
            int returnsOpen = returnsClause.end() - 1;
            int returnsClose = SourceText.matching(trailer, returnsOpen, '(', ')');
            if (returnsClose > 0) {
                returns = parseParameters(trailer.substring(returnsOpen + 1, returnsClose));
                trailer = trailer.substring(0, returnsClause.start()) + " " + trailer.substring(returnsClose + 1);
            }
        }

        Visibility visibility = Visibility.PUBLIC;
        StateMutability mutability = StateMutability.NONE;
        for (String word : topLevelWords(trailer)) {
            Optional<Visibility> declaredVisibility = Visibility.fromKeyword(word);
            if (declaredVisibility.isPresent()) {
                visibility = declaredVisibility.get();
                continue;
            }
            Optional<StateMutability> declaredMutability = StateMutability.fromKeyword(word);
            if (declaredMutability.isPresent()) {
                mutability = declaredMutability.get();
            }
        }

        return Optional.of(new FunctionSignature(name, kind, visibility, mutability, parameters, returns));
    }

    /**
     * Parses an {@code event Name(...)} header.
     *
     * @param header member header text
     * @return event, or empty when no name or parameter list is found
     */
    static Optional<EventUnit> parseEvent(String header) {
        String rest = header.trim().replaceFirst("^event\\s+", "");
        int open = rest.indexOf('(');
        if (open < 0) {
            return Optional.empty();
        }
        String name = rest.substring(0, open).trim();
        int close = SourceText.matching(rest, open, '(', ')');
        if (!name.matches(IDENTIFIER) || close < 0) {
            return Optional.empty();
        }

        List<EventParameter> parameters = new ArrayList<>();
        for (String declaration : splitTopLevel(rest.substring(open + 1, close))) {
            boolean indexed = declaration.matches(".*\\bindexed\\b.*");
            Parameter parameter = parseParameter(declaration.replaceAll("\\bindexed\\b", " "));
            parameters.add(new EventParameter(parameter.name(), parameter.type(), indexed));
        }
        return Optional.of(new EventUnit(name, parameters));
    }

    /**
     * Parses a state variable declaration such as {@code IERC20 public immutable token = IERC20(x)}.
     *
     * @param header declaration text without the trailing semicolon
     * @return variable, or empty when no type and name pair is found
     */
    static Optional<StateVariable> parseStateVariable(String header) {
        String declaration = stripInitializer(header);
        declaration = OVERRIDE_SPECIFIER.matcher(declaration).replaceAll(" ");

        Matcher trailing = TRAILING_NAME.matcher(declaration);
        if (!trailing.find()) {
            return Optional.empty();
        }
        String name = trailing.group(1);
        if (STATE_VARIABLE_MODIFIERS.contains(name)) {
            return Optional.empty();
        }

        Matcher leading = LEADING_WORD.matcher(declaration);
        if (leading.find() && "function".equals(leading.group(1))) {
            return parseFunctionTypeVariable(declaration.substring(0, trailing.start()), name);
        }

        Visibility visibility = Visibility.INTERNAL;
        StringBuilder type = new StringBuilder();
        for (String word : declaration.substring(0, trailing.start()).trim().split("\\s+(?![^(]*\\))")) {
            if (VISIBILITY_KEYWORDS.contains(word)) {
                visibility = Visibility.fromKeyword(word).orElse(Visibility.INTERNAL);
            } else if (!STATE_VARIABLE_MODIFIERS.contains(word) && !word.isEmpty()) {
                type.append(type.length() == 0 ? "" : " ").append(word);
            }
        }

        String typeText = normalizeType(type.toString());
        if (typeText.isEmpty() || !Character.isJavaIdentifierStart(typeText.charAt(0))) {
            return Optional.empty();
        }
        return Optional.of(new StateVariable(name, typeText, visibility, typeText.startsWith("mapping")));
    }

    /**
     * Function-typed variable. Trailing state variable modifiers belong to the variable,
     * every attribute before them belongs to the function type.
     */
    private static Optional<StateVariable> parseFunctionTypeVariable(String typePart, String name) {
        int open = typePart.indexOf('(');
        int close = open < 0 ? -1 : SourceText.matching(typePart, open, '(', ')');
        if (close < 0) {
            return Optional.empty();
        }
        int typeEnd = close + 1;
        Matcher returnsClause = RETURNS_CLAUSE.matcher(typePart);
        if (returnsClause.find(typeEnd)) {
            int returnsClose = SourceText.matching(typePart, returnsClause.end() - 1, '(', ')');
            if (returnsClose < 0) {
                return Optional.empty();
            }
            typeEnd = returnsClose + 1;
        }

        List<String> words = topLevelWords(typePart.substring(typeEnd));
        int typeWords = words.size();
        while (typeWords > 0 && STATE_VARIABLE_MODIFIERS.contains(words.get(typeWords - 1))) {
            typeWords--;
        }

        StringBuilder type = new StringBuilder(typePart.substring(0, typeEnd));
        words.subList(0, typeWords).forEach(word -> type.append(' ').append(word));
        Visibility visibility = Visibility.INTERNAL;
        for (String word : words.subList(typeWords, words.size())) {
            if (VISIBILITY_KEYWORDS.contains(word)) {
                visibility = Visibility.fromKeyword(word).orElse(Visibility.INTERNAL);
            }
        }
        return Optional.of(new StateVariable(name, normalizeType(type.toString()), visibility, false));
    }

    // ==================== Helpers ====================

    static List<Parameter> parseParameters(String list) {
        List<Parameter> parameters = new ArrayList<>();
        for (String declaration : splitTopLevel(list)) {
            parameters.add(parseParameter(declaration));
        }
        return parameters;
    }

    private static Parameter parseParameter(String declaration) {
        String cleaned = DATA_LOCATION.matcher(declaration).replaceAll(" ").trim();
        Matcher trailing = TRAILING_NAME.matcher(cleaned);
        if (trailing.find() && !"payable".equals(trailing.group(1))) {
            return new Parameter(trailing.group(1), normalizeType(cleaned.substring(0, trailing.start())));
        }
        return new Parameter("", normalizeType(cleaned));
    }

    /**
     * Splits at commas outside parentheses and brackets.
     */
    static List<String> splitTopLevel(String text) {
        List<String> parts = new ArrayList<>();
        int level = 0;
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(' || c == '[' || c == '{') {
                level++;
            } else if (c == ')' || c == ']' || c == '}') {
                level--;
            } else if (c == ',' && level == 0) {
                addIfNotBlank(parts, text.substring(start, i));
                start = i + 1;
            }
        }
        addIfNotBlank(parts, text.substring(start));
        return parts;
    }

    private static void addIfNotBlank(List<String> parts, String part) {
        if (!part.isBlank()) {
            parts.add(part.trim());
        }
    }

    private static List<String> topLevelWords(String text) {
        List<String> words = new ArrayList<>();
        int level = 0;
        StringBuilder word = new StringBuilder();
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(') {
                level++;
            } else if (c == ')') {
                level--;
            }
            if (level == 0 && Character.isJavaIdentifierPart(c)) {
                word.append(c);
            } else if (word.length() > 0) {
                words.add(word.toString());
                word.setLength(0);
            }
        }
        if (word.length() > 0) {
            words.add(word.toString());
        }
        return words;
    }

    private static String stripInitializer(String header) {
        int level = 0;
        for (int i = 0; i < header.length(); i++) {
            char c = header.charAt(i);
            if (c == '(' || c == '[') {
                level++;
            } else if (c == ')' || c == ']') {
                level--;
            } else if (c == '=' && level == 0) {
                char next = i + 1 < header.length() ? header.charAt(i + 1) : '\0';
                char previous = i > 0 ? header.charAt(i - 1) : '\0';
                if (next != '>' && next != '=' && "!<>=".indexOf(previous) < 0) {
                    return header.substring(0, i);
                }
            }
        }
        return header;
    }

    private static String normalizeType(String type) {
        return type.trim()
            .replaceAll("\\s+", " ")
            .replaceAll("\\s*\\(\\s*", "(")
            .replaceAll("\\s*\\)", ")")
            .replaceAll("\\s*=>\\s*", " => ")
            .replaceAll("\\s*\\[\\s*", "[")
            .replaceAll("\\s*]", "]");
    }
}
