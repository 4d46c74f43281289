package com.example.mathverify.service;

import com.example.mathverify.config.VerificationProperties;
import com.example.mathverify.model.AutoFix;
import com.example.mathverify.model.DirectiveKind;
import com.example.mathverify.model.Heading;
import com.example.mathverify.model.NormalizedSolution;
import com.example.mathverify.model.Outcome;
import org.matheclipse.core.interfaces.IExpr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Repairs common malformations of generated solutions before verification ("auto-fix").
 * <p>
 * Steps, in order:
 * <ol>
 *   <li>strip ellipsis placeholders from statement and solution</li>
 *   <li>pad statements shorter than the configured minimum with a generic clause</li>
 *   <li>move {@code HEADING: content} onto two lines</li>
 *   <li>synthesize blocks when the text is unstructured</li>
 *   <li>move a DERIVATIVE directive written under FINAL_ANSWER into an empty CHECK</li>
 *   <li>rewrite {@code DERIVATIVE; Eq(Derivative(f, x), ...)} into {@code DERIVATIVE; var=x; func=f}</li>
 *   <li>wrap a scalar answer to a one-variable SYSTEM into {@code {var: value}}</li>
 *   <li>rebuild the heading text</li>
 * </ol>
 * Every applied step is reported in {@link NormalizedSolution#fixes()}. Normalizing an
 * already normalized solution changes nothing.
 */
@Service
public class DirectiveNormalizer {

    private static final Logger log = LoggerFactory.getLogger(DirectiveNormalizer.class);

    private static final Pattern INLINE_HEADING = Pattern.compile(
            "(?m)^[ \\t]*(EXERCICE|SOLUTION|FINAL_ANSWER|CHECK)[ \\t]*:[ \\t]*(\\S.*)$");

    private static final Pattern HAS_FUNC = Pattern.compile("(?i)(^|[;\\s])func\\s*=");

    private static final Set<String> DERIVATIVE_CALLS = Set.of("Derivative", "diff", "D");

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final BlockParser blockParser;
    private final SymbolicEngine engine;
    private final VerificationProperties.Normalization settings;

    public DirectiveNormalizer(BlockParser blockParser, SymbolicEngine engine, VerificationProperties properties) {
        this.blockParser = blockParser;
        this.engine = engine;
        this.settings = properties.autoFix();
    }

    /**
     * @param statement    exercise statement, may be null
     * @param solutionText raw solution text, may be null
     * @return normalized statement and solution text plus the fixes that were applied
     */
    public NormalizedSolution normalize(String statement, String solutionText) {
        List<AutoFix> fixes = new ArrayList<>();

        String rawStatement = statement == null ? "" : statement;
        String rawSolution = solutionText == null ? "" : solutionText.replace("\r\n", "\n");

        String fixedStatement = stripEllipsis(rawStatement);
        String text = stripEllipsis(rawSolution);
        if (StructuralChecker.hasPlaceholder(rawStatement) || StructuralChecker.hasPlaceholder(rawSolution)) {
            fixes.add(AutoFix.ELLIPSIS_STRIPPED);
        }

        if (fixedStatement.length() < settings.minStatementLength()) {
            do {
                fixedStatement = (fixedStatement + settings.paddingClause()).strip();
            } while (fixedStatement.length() < settings.minStatementLength());
            fixes.add(AutoFix.STATEMENT_PADDED);
        }

        String reflowed = INLINE_HEADING.matcher(text).replaceAll("$1:\n$2");
        if (!reflowed.equals(text)) {
            fixes.add(AutoFix.HEADINGS_REFLOWED);
            text = reflowed;
        }

        if (text.isBlank()) {
            return done(fixedStatement, "", fixes);
        }

        Map<Heading, String> blocks = new EnumMap<>(blockParser.extractBlocks(text));
        if (blocks.isEmpty()) {
            blocks.put(Heading.EXERCICE, fixedStatement);
            blocks.put(Heading.SOLUTION, text.strip());
            blocks.put(Heading.FINAL_ANSWER, "");
            blocks.put(Heading.CHECK, "");
            fixes.add(AutoFix.BLOCKS_SYNTHESIZED);
        }

        String finalAnswer = blocks.getOrDefault(Heading.FINAL_ANSWER, "").strip();
        String check = blocks.getOrDefault(Heading.CHECK, "").strip();

        if (finalAnswer.toUpperCase(Locale.ROOT).startsWith("DERIVATIVE;") && check.isEmpty()) {
            check = finalAnswer;
            finalAnswer = "";
            fixes.add(AutoFix.DERIVATIVE_MOVED_TO_CHECK);
        }

        if (!check.isEmpty()) {
            Optional<String> rewritten = rewriteDerivativeEquality(check);
            if (rewritten.isPresent()) {
                check = rewritten.get();
                fixes.add(AutoFix.DERIVATIVE_CHECK_REWRITTEN);
            }
        }

        if (!finalAnswer.isEmpty() && !check.isEmpty()) {
            Optional<String> promoted = promoteSystemAnswer(finalAnswer, check);
            if (promoted.isPresent()) {
                finalAnswer = promoted.get();
                fixes.add(AutoFix.SYSTEM_ANSWER_PROMOTED);
            }
        }

        blocks.put(Heading.FINAL_ANSWER, finalAnswer);
        blocks.put(Heading.CHECK, check);
        blocks.put(Heading.EXERCICE, fixedStatement);
        return done(fixedStatement, blockParser.rebuild(blocks), fixes);
    }

    private NormalizedSolution done(String statement, String solutionText, List<AutoFix> fixes) {
        if (!fixes.isEmpty()) {
            log.debug("DirectiveNormalizer: applied {}", fixes);
        }
        return new NormalizedSolution(statement, solutionText, fixes);
    }

    private static String stripEllipsis(String text) {
        String t = text;
        String previous;
        do {
            previous = t;
            t = t.replace("...", "").replace("…", "");
        } while (!t.equals(previous));
        return t.strip();
    }

    /**
     * {@code DERIVATIVE; Eq(Derivative(log(x), x), 1/x)} → {@code DERIVATIVE; var=x; func=log(x)}.
     */
    Optional<String> rewriteDerivativeEquality(String check) {
        if (!DirectiveKind.DERIVATIVE.leads(check) || HAS_FUNC.matcher(check).find()) {
            return Optional.empty();
        }
        String[] headAndPayload = check.split(";", 2);
        if (headAndPayload.length < 2 || headAndPayload[1].isBlank()) {
            return Optional.empty();
        }
        Optional<ExpressionSyntax.Equation> equation = ExpressionSyntax.splitEquality(headAndPayload[1].strip());
        if (equation.isEmpty()) {
            return Optional.empty();
        }

        Optional<List<String>> call = ExpressionSyntax.findCall(equation.get().lhs(), DERIVATIVE_CALLS)
                .or(() -> ExpressionSyntax.findCall(equation.get().rhs(), DERIVATIVE_CALLS));
        if (call.isEmpty() || call.get().isEmpty()) {
            return Optional.empty();
        }

        List<String> args = call.get();
        String func = args.get(0);
        String var = args.size() > 1 && IDENTIFIER.matcher(args.get(1)).matches() ? args.get(1) : "x";
        return Optional.of("DERIVATIVE; var=" + var + "; func=" + func);
    }

    /**
     * {@code SYSTEM; Eq(2*x, 4)} with answer {@code 2} → {@code {x: 2}}, only when the
     * system has exactly one free variable.
     */
    Optional<String> promoteSystemAnswer(String finalAnswer, String check) {
        if (!check.strip().toUpperCase(Locale.ROOT).startsWith("SYSTEM;")) {
            return Optional.empty();
        }
        String fa = finalAnswer.strip();
        if (fa.startsWith("{") && fa.endsWith("}")) {
            return Optional.empty();
        }

        String payload = check.split(";", 2)[1];
        Set<String> variables = new TreeSet<>();
        for (String line : payload.split("\n")) {
            for (String eq : ExpressionSyntax.splitTopLevel(line, ';')) {
                Optional<ExpressionSyntax.Equation> equation = ExpressionSyntax.splitEquality(eq);
                if (equation.isEmpty()) {
                    return Optional.empty();
                }
                Outcome<List<String>> vars = engine.residual(equation.get()).flatMap(engine::freeVariables);
                if (vars.isFailure()) {
                    return Optional.empty();
                }
                variables.addAll(vars.value());
            }
        }
        if (variables.size() != 1) {
            return Optional.empty();
        }

        Outcome<IExpr> value = engine.parse(fa);
        if (value.isFailure()) {
            return Optional.empty();
        }
        return Optional.of("{" + variables.iterator().next() + ": " + fa + "}");
    }
}
