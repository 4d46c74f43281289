package com.example.mathverify.service;

import com.example.mathverify.model.FinalAnswer;
import com.example.mathverify.model.Outcome;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.matheclipse.core.interfaces.IExpr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses FINAL_ANSWER text into a {@link FinalAnswer}.
 * <p>
 * Accepted forms:
 * <ul>
 *   <li>{@code {x: 2, y: -1}} / {@code {"x": 2}} / {@code {'x_star': sqrt(2)}}: mapping</li>
 *   <li>{@code [1, 2]} / {@code {-2, 2}}: ordered list (or set) of candidates</li>
 *   <li>anything else: a single symbolic expression</li>
 * </ul>
 * Values are parsed symbolically first; a mapping whose values cannot be parsed that way
 * is read as a literal with a lenient {@link ObjectMapper} and its values re-parsed.
 */
@Service
public class FinalAnswerParser {

    private static final Logger log = LoggerFactory.getLogger(FinalAnswerParser.class);

    /** Lenient ObjectMapper that tolerates unquoted keys, single quotes and trailing commas. */
    private static final ObjectMapper LENIENT_MAPPER = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
            .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
            .enable(JsonReadFeature.ALLOW_LEADING_PLUS_SIGN_FOR_NUMBERS)
            .enable(JsonReadFeature.ALLOW_LEADING_DECIMAL_POINT_FOR_NUMBERS)
            .build();

    private static final Pattern BRACE_BLOCK = Pattern.compile("\\{.*}", Pattern.DOTALL);

    private final SymbolicEngine engine;

    public FinalAnswerParser(SymbolicEngine engine) {
        this.engine = engine;
    }

    /**
     * @param text FINAL_ANSWER content
     * @return the parsed answer, or the reason it could not be parsed
     */
    public Outcome<FinalAnswer> parse(String text) {
        if (text == null || text.isBlank()) {
            return Outcome.failure("FINAL_ANSWER vide");
        }
        String s = text.strip();

        if (ExpressionSyntax.isEnclosed(s, '{', '}') && looksLikeMapping(s)) {
            return parseMapping(s);
        }
        if (ExpressionSyntax.isEnclosed(s, '[', ']') && !isMatrixLiteral(s)
                || ExpressionSyntax.isEnclosed(s, '{', '}') && !isMatrixLiteral(s)) {
            return parseList(s);
        }
        return engine.parse(s).map(expr -> FinalAnswer.scalar(s, expr));
    }

    /**
     * Mapping embedded anywhere in the text: the first {@code {...}} block is parsed.
     */
    public Outcome<FinalAnswer> parseMappingIn(String text) {
        if (text == null || text.isBlank()) {
            return Outcome.failure("FINAL_ANSWER vide");
        }
        String s = text.strip();
        if (!ExpressionSyntax.isEnclosed(s, '{', '}')) {
            Matcher m = BRACE_BLOCK.matcher(s);
            if (!m.find()) {
                return Outcome.failure("aucun bloc {...} dans FINAL_ANSWER");
            }
            s = m.group();
        }
        return parseMapping(s);
    }

    private Outcome<FinalAnswer> parseMapping(String s) {
        Outcome<FinalAnswer> symbolic = parseMappingSymbolically(s);
        if (symbolic.isSuccess()) {
            return symbolic;
        }
        log.debug("FinalAnswerParser: symbolic mapping parse failed ({}), trying literal", symbolic.error());

        Outcome<FinalAnswer> literal = parseMappingLiterally(s);
        if (literal.isSuccess()) {
            return literal;
        }
        return Outcome.failure(symbolic.error() + "; " + literal.error());
    }

    private Outcome<FinalAnswer> parseMappingSymbolically(String s) {
        Map<String, IExpr> entries = new LinkedHashMap<>();
        for (String part : ExpressionSyntax.splitTopLevel(ExpressionSyntax.inner(s), ',')) {
            int colon = topLevelColon(part);
            if (colon <= 0) {
                return Outcome.failure("entrée sans ':' dans " + s);
            }
            String key = unquote(part.substring(0, colon).strip());
            String valueText = part.substring(colon + 1).strip();
            if (key.isEmpty()) {
                return Outcome.failure("clé vide dans " + s);
            }
            Outcome<IExpr> value = engine.parse(valueText);
            if (value.isFailure()) {
                return Outcome.failure("valeur de '" + key + "' non parsable: " + value.error());
            }
            entries.put(key, value.value());
        }
        if (entries.isEmpty()) {
            return Outcome.failure("mapping vide");
        }
        return Outcome.success(FinalAnswer.mapping(s, entries));
    }

    private Outcome<FinalAnswer> parseMappingLiterally(String s) {
        Map<String, Object> raw;
        try {
            raw = LENIENT_MAPPER.readValue(s, new TypeReference<LinkedHashMap<String, Object>>() {});
        } catch (JsonProcessingException e) {
            return Outcome.failure("littéral non lisible: " + e.getOriginalMessage());
        }
        Map<String, IExpr> entries = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : raw.entrySet()) {
            Outcome<IExpr> value = engine.parse(String.valueOf(e.getValue()));
            if (value.isFailure()) {
                return Outcome.failure("valeur de '" + e.getKey() + "' non parsable: " + value.error());
            }
            entries.put(e.getKey(), value.value());
        }
        if (entries.isEmpty()) {
            return Outcome.failure("mapping vide");
        }
        return Outcome.success(FinalAnswer.mapping(s, entries));
    }

    private Outcome<FinalAnswer> parseList(String s) {
        List<IExpr> values = new ArrayList<>();
        for (String part : ExpressionSyntax.splitTopLevel(ExpressionSyntax.inner(s), ',')) {
            Outcome<IExpr> value = engine.parse(part);
            if (value.isFailure()) {
                return Outcome.failure("élément '" + part + "' non parsable: " + value.error());
            }
            values.add(value.value());
        }
        return Outcome.success(FinalAnswer.list(s, values));
    }

    private static boolean looksLikeMapping(String s) {
        List<String> parts = ExpressionSyntax.splitTopLevel(ExpressionSyntax.inner(s), ',');
        return !parts.isEmpty() && parts.stream().allMatch(p -> topLevelColon(p) > 0);
    }

    private static boolean isMatrixLiteral(String s) {
        String inner = ExpressionSyntax.inner(s);
        return inner.startsWith("[") || inner.startsWith("{");
    }

    private static int topLevelColon(String part) {
        int depth = 0;
        for (int i = 0; i < part.length(); i++) {
            char c = part.charAt(i);
            if (c == '(' || c == '[' || c == '{') depth++;
            else if (c == ')' || c == ']' || c == '}') depth--;
            else if (c == ':' && depth == 0) return i;
        }
        return -1;
    }

    private static String unquote(String key) {
        if (key.length() >= 2 && (key.startsWith("\"") && key.endsWith("\"")
                || key.startsWith("'") && key.endsWith("'"))) {
            return key.substring(1, key.length() - 1).strip();
        }
        return key;
    }
}
