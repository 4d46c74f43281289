package com.example.mathverify.service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static java.util.Map.entry;

/**
 * Text-level helpers for the expression notation used in FINAL_ANSWER and CHECK blocks.
 * <p>
 * Exercises are written in SymPy notation ({@code x**2}, {@code Eq(a, b)}, {@code sqrt(x)},
 * {@code Matrix([[1, 2], [3, 4]])}); {@link #toSymja(String)} rewrites that notation into
 * Symja input. The remaining helpers split text at top-level separators without
 * breaking bracketed sub-expressions.
 */
public final class ExpressionSyntax {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private static final Pattern ASSIGNMENT_CALL = Pattern.compile(
            "(?i)(?<![A-Za-z0-9_])(Set|SetDelayed|UpSet|UpSetDelayed|TagSet|TagSetDelayed|Unset|Clear|ClearAll"
                    + "|Remove|AddTo|SubtractFrom|TimesBy|DivideBy|Increment|Decrement|PreIncrement|PreDecrement"
                    + "|AppendTo|PrependTo)\\s*\\(");

    private static final Pattern ASSIGNMENT_OPERATOR = Pattern.compile("[:^+\\-*/]=(?!=)");

    private static final Pattern SCIENTIFIC = Pattern.compile(
            "(?<![A-Za-z0-9_.])(\\d+(?:\\.\\d+)?)[eE]([-+]?\\d+)(?![A-Za-z0-9_])");

    /** Function names understood by the generator, keyed in lower case. */
    private static final Map<String, String> FUNCTIONS = Map.ofEntries(
            entry("sin", "Sin"), entry("cos", "Cos"), entry("tan", "Tan"), entry("cot", "Cot"),
            entry("asin", "ArcSin"), entry("acos", "ArcCos"), entry("atan", "ArcTan"),
            entry("arcsin", "ArcSin"), entry("arccos", "ArcCos"), entry("arctan", "ArcTan"),
            entry("sinh", "Sinh"), entry("cosh", "Cosh"), entry("tanh", "Tanh"),
            entry("log", "Log"), entry("ln", "Log"), entry("exp", "Exp"), entry("sqrt", "Sqrt"),
            entry("abs", "Abs"), entry("det", "Det"), entry("diff", "D"), entry("derivative", "D"),
            entry("limit", "Limit"), entry("simplify", "Simplify"), entry("factorial", "Factorial"),
            entry("floor", "Floor"), entry("ceiling", "Ceiling"), entry("re", "Re"), entry("im", "Im"),
            entry("conjugate", "Conjugate"), entry("arg", "Arg"), entry("rational", "Rational"),
            entry("binomial", "Binomial"), entry("transpose", "Transpose"), entry("inverse", "Inverse"),
            entry("eq", "Equal"));

    private static final Map<String, String> CONSTANTS = Map.of(
            "pi", "Pi",
            "oo", "Infinity",
            "infinity", "Infinity",
            "true", "True",
            "false", "False");

    private ExpressionSyntax() {
        // utility class
    }

    /** Both sides of an equality, still in source notation. */
    public record Equation(String lhs, String rhs) {

        /** {@code (lhs)-(rhs)}, zero exactly when the equality holds. */
        public String residual() {
            return "(" + lhs + ")-(" + rhs + ")";
        }
    }

    /**
     * Rewrites generator notation into Symja input syntax.
     *
     * @param text expression in generator notation
     * @return equivalent Symja input
     */
    public static String toSymja(String text) {
        if (text == null) {
            return "";
        }
        String s = text.strip()
                .replace("**", "^")
                .replace("≤", "<=")
                .replace("≥", ">=")
                .replace("−", "-")
                .replace("×", "*");
        s = expandScientific(s);
        s = unwrapCalls(s, "Matrix");
        s = s.replace('[', '{').replace(']', '}');
        s = rewriteIdentifiers(s);
        return lonelyEqualsToEqual(s);
    }

    /**
     * True when the text would assign or clear a definition in the engine
     * ({@code Set(x, 5)}, {@code x := 5}, {@code x += 1}, ...).
     */
    public static boolean hasAssignment(String text) {
        return text != null && (ASSIGNMENT_CALL.matcher(text).find() || ASSIGNMENT_OPERATOR.matcher(text).find());
    }

    /**
     * Same as {@link #toSymja(String)} but lower-case {@code i} is also read as the imaginary unit.
     */
    public static String toSymjaComplex(String text) {
        return toSymja(text).replaceAll("(?<![A-Za-z0-9_])i(?![A-Za-z0-9_(])", "I");
    }

    /** Sanitized symbol name of a variable as it appears after {@link #toSymja(String)}. */
    public static String symbolName(String variable) {
        return variable == null ? "" : variable.strip().replace("_", "");
    }

    /**
     * Recognizes {@code Eq(a, b)}, {@code a == b} and {@code a = b}.
     *
     * @return both sides, or empty when the text is not an equality
     */
    public static Optional<Equation> splitEquality(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String s = text.strip();

        Optional<List<String>> eqArgs = callArguments(s, "Eq");
        if (eqArgs.isPresent()) {
            List<String> args = eqArgs.get();
            return args.size() == 2 ? Optional.of(new Equation(args.get(0), args.get(1))) : Optional.empty();
        }

        int depth = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '(' || c == '[' || c == '{') depth++;
            else if (c == ')' || c == ']' || c == '}') depth--;
            else if (c == '=' && depth == 0) {
                char prev = i > 0 ? s.charAt(i - 1) : ' ';
                if (prev == '<' || prev == '>' || prev == '!' || prev == ':') {
                    continue;
                }
                int end = i + 1 < s.length() && s.charAt(i + 1) == '=' ? i + 2 : i + 1;
                String lhs = s.substring(0, i).strip();
                String rhs = s.substring(end).strip();
                if (lhs.isEmpty() || rhs.isEmpty()) {
                    return Optional.empty();
                }
                return Optional.of(new Equation(lhs, rhs));
            }
        }
        return Optional.empty();
    }

    /**
     * Arguments of a call spanning the whole text, e.g. {@code Eq(x+1, 2)} with name {@code Eq}.
     */
    public static Optional<List<String>> callArguments(String text, String name) {
        String s = text.strip();
        if (!s.startsWith(name + "(") && !s.startsWith(name + " (")) {
            return Optional.empty();
        }
        int open = s.indexOf('(');
        int close = matchingClose(s, open);
        if (close != s.length() - 1) {
            return Optional.empty();
        }
        return Optional.of(splitTopLevel(s.substring(open + 1, close), ','));
    }

    /**
     * Arguments of the first call to any of the given names found anywhere in the text.
     */
    public static Optional<List<String>> findCall(String text, Collection<String> names) {
        Matcher m = IDENTIFIER.matcher(text);
        while (m.find()) {
            if (!names.contains(m.group())) {
                continue;
            }
            int open = skipBlanks(text, m.end());
            if (open >= text.length() || text.charAt(open) != '(') {
                continue;
            }
            int close = matchingClose(text, open);
            if (close < 0) {
                return Optional.empty();
            }
            return Optional.of(splitTopLevel(text.substring(open + 1, close), ','));
        }
        return Optional.empty();
    }

    /**
     * Splits at a separator that is not nested inside (), [] or {}; parts are trimmed
     * and empty parts dropped.
     */
    public static List<String> splitTopLevel(String text, char separator) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(' || c == '[' || c == '{') depth++;
            else if (c == ')' || c == ']' || c == '}') depth--;
            else if (c == separator && depth == 0) {
                addPart(parts, text.substring(start, i));
                start = i + 1;
            }
        }
        addPart(parts, text.substring(start));
        return parts;
    }

    /** True when the text is a single bracketed group with the given delimiters. */
    public static boolean isEnclosed(String text, char open, char close) {
        String s = text.strip();
        return s.length() >= 2 && s.charAt(0) == open && s.charAt(s.length() - 1) == close
                && matchingClose(s, 0, open, close) == s.length() - 1;
    }

    /** Content between the outer delimiters of an enclosed group. */
    public static String inner(String text) {
        String s = text.strip();
        return s.substring(1, s.length() - 1).strip();
    }

    static int matchingClose(String s, int open) {
        return matchingClose(s, open, '(', ')');
    }

    private static int matchingClose(String s, int open, char openChar, char closeChar) {
        int depth = 0;
        for (int i = open; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == openChar) depth++;
            else if (c == closeChar) {
                depth--;
                if (depth == 0) return i;
            }
        }
        return -1;
    }

    private static void addPart(List<String> parts, String part) {
        String p = part.strip();
        if (!p.isEmpty()) {
            parts.add(p);
        }
    }

    private static int skipBlanks(String s, int from) {
        int i = from;
        while (i < s.length() && Character.isWhitespace(s.charAt(i))) i++;
        return i;
    }

    /** Removes {@code Name(} ... {@code )} wrappers, keeping the wrapped argument. */
    private static String unwrapCalls(String s, String name) {
        String result = s;
        int idx = result.indexOf(name + "(");
        while (idx >= 0) {
            int open = idx + name.length();
            int close = matchingClose(result, open);
            if (close < 0) {
                break;
            }
            result = result.substring(0, idx) + result.substring(open + 1, close) + result.substring(close + 1);
            idx = result.indexOf(name + "(");
        }
        return result;
    }

    private static String rewriteIdentifiers(String s) {
        StringBuilder sb = new StringBuilder();
        Matcher m = IDENTIFIER.matcher(s);
        int last = 0;
        while (m.find()) {
            sb.append(s, last, m.start());
            sb.append(rewriteIdentifier(m.group(), s, m.end()));
            last = m.end();
        }
        sb.append(s.substring(last));
        return sb.toString();
    }

    private static String rewriteIdentifier(String id, String s, int end) {
        String lower = id.toLowerCase(Locale.ROOT);
        boolean call = skipBlanks(s, end) < s.length() && s.charAt(skipBlanks(s, end)) == '(';
        if (call && FUNCTIONS.containsKey(lower)) {
            return FUNCTIONS.get(lower);
        }
        if (!call && CONSTANTS.containsKey(lower)) {
            return CONSTANTS.get(lower);
        }
        return id.replace("_", "");
    }

    /** {@code 1e-3} reads as {@code 1*E-3} in Symja; spell such literals out as plain decimals. */
    private static String expandScientific(String s) {
        Matcher m = SCIENTIFIC.matcher(s);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String plain = new BigDecimal(m.group(1) + "E" + m.group(2)).toPlainString();
            m.appendReplacement(sb, Matcher.quoteReplacement(plain));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    private static String lonelyEqualsToEqual(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 4);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c != '=') {
                sb.append(c);
                continue;
            }
            char prev = i > 0 ? s.charAt(i - 1) : ' ';
            char next = i + 1 < s.length() ? s.charAt(i + 1) : ' ';
            if (next == '=') {
                sb.append("==");
                i++;
            } else if (prev == '<' || prev == '>' || prev == '!') {
                sb.append('=');
            } else {
                sb.append("==");
            }
        }
        return sb.toString();
    }
}
