package org.physlang.dsl;

import org.physlang.dsl.definition.CallStmt;
import org.physlang.dsl.definition.ConditionExpr;
import org.physlang.dsl.definition.DetectorDecl;
import org.physlang.dsl.definition.DetectorKind;
import org.physlang.dsl.definition.ForStmt;
import org.physlang.dsl.definition.ForceDecl;
import org.physlang.dsl.definition.ForceKind;
import org.physlang.dsl.definition.FunctionDecl;
import org.physlang.dsl.definition.IfStmt;
import org.physlang.dsl.definition.LetStmt;
import org.physlang.dsl.definition.LoopDecl;
import org.physlang.dsl.definition.LoopKind;
import org.physlang.dsl.definition.MatchArm;
import org.physlang.dsl.definition.MatchPattern;
import org.physlang.dsl.definition.MatchStmt;
import org.physlang.dsl.definition.NameRef;
import org.physlang.dsl.definition.Observable;
import org.physlang.dsl.definition.ParticleDecl;
import org.physlang.dsl.definition.Program;
import org.physlang.dsl.definition.PushAction;
import org.physlang.dsl.definition.ReturnStmt;
import org.physlang.dsl.definition.SimulateDecl;
import org.physlang.dsl.definition.Stmt;
import org.physlang.dsl.definition.WellDecl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-oriented parser for PhysLang programs.
 *
 * Top-level lines are dispatched on their leading keyword. Block constructs
 * ({@code fn}, {@code loop}, {@code if}, {@code for}, {@code match}) collect
 * their body by scanning for the matching closing brace, possibly across
 * many lines, and the body is parsed recursively. Text that follows a
 * closing brace on the same line (as in {@code "} else {"}) is parsed as if
 * it started a new line.
 *
 * The parser performs no semantic validation; that is the job of the
 * static analyzer.
 */
public final class PhysParser {

    private static final Logger LOG = LoggerFactory.getLogger(PhysParser.class);

    private static final String NAME = "(\"[^\"]+\"|'[^']+'|[A-Za-z_][A-Za-z0-9_]*)";
    private static final String IDENT = "([A-Za-z_][A-Za-z0-9_]*)";

    private static final Pattern LET = Pattern.compile("let\\s+" + IDENT + "\\s*=\\s*(.+)");
    private static final Pattern FN_HEADER = Pattern.compile("fn\\s+" + IDENT + "\\s*\\(([^)]*)\\)\\s*");
    private static final Pattern PARTICLE = Pattern.compile(
            "particle\\s+" + NAME + "\\s+at\\s*\\((.*)\\)\\s*mass\\s+(.+)");
    private static final Pattern GRAVITY = Pattern.compile(
            "force\\s+gravity\\s*\\(\\s*" + NAME + "\\s*,\\s*" + NAME + "\\s*\\)\\s*G\\s*=\\s*(.+)");
    private static final Pattern SPRING = Pattern.compile(
            "force\\s+spring\\s*\\(\\s*" + NAME + "\\s*,\\s*" + NAME
                    + "\\s*\\)\\s*k\\s*=\\s*(.+?)\\s+rest\\s*=\\s*(.+)");
    private static final Pattern PUSH = Pattern.compile(
            "force\\s+push\\s*\\(\\s*" + NAME + "\\s*\\)\\s*magnitude\\s+(.+?)\\s+direction\\s*\\((.*)\\)\\s*");
    private static final Pattern SIMULATE = Pattern.compile("simulate\\s+dt\\s*=\\s*(.+?)\\s+steps\\s*=\\s*(.+)");
    private static final Pattern DETECT = Pattern.compile(
            "detect\\s+" + IDENT + "\\s*=\\s*(position|distance)\\s*\\((.*)\\)\\s*");
    private static final Pattern LOOP_FOR = Pattern.compile(
            "loop\\s+(?:" + IDENT + "\\s+)?for\\s+(.+?)\\s+cycles\\s+with\\s+frequency\\s+(.+?)"
                    + "\\s+damping\\s+(.+?)\\s+on\\s+" + NAME + "\\s*");
    private static final Pattern LOOP_WHILE = Pattern.compile(
            "loop\\s+(?:" + IDENT + "\\s+)?while\\s+(.+?)\\s+with\\s+frequency\\s+(.+?)"
                    + "\\s+damping\\s+(.+?)\\s+on\\s+" + NAME + "\\s*");
    private static final Pattern WELL = Pattern.compile(
            "well\\s+" + IDENT + "\\s+on\\s+" + NAME + "\\s+if\\s+(.+?)\\s*>=\\s*(.+?)\\s+depth\\s+(.+)");
    private static final Pattern POSITION_AXIS = Pattern.compile(
            "position\\s*\\(\\s*" + NAME + "\\s*\\)\\s*\\.\\s*([xy])");
    private static final Pattern DISTANCE = Pattern.compile(
            "distance\\s*\\(\\s*" + NAME + "\\s*,\\s*" + NAME + "\\s*\\)");
    private static final Pattern CONDITION = Pattern.compile("(.+?)\\s*([<>])\\s*(.+)");
    private static final Pattern IF_HEADER = Pattern.compile("if\\s+(.+)");
    private static final Pattern FOR_HEADER = Pattern.compile("for\\s+" + IDENT + "\\s+in\\s+(.+?)\\s*\\.\\.\\s*(.+)");
    private static final Pattern MATCH_HEADER = Pattern.compile("match\\s+(.+)");
    private static final Pattern ARM_HEADER = Pattern.compile("(_|-?\\d+)\\s*=>\\s*");
    private static final Pattern RETURN = Pattern.compile("return\\s+(.+)");
    private static final Pattern CALL = Pattern.compile(IDENT + "\\s*\\((.*)\\)\\s*");
    private static final Pattern KEYWORD = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final boolean trace;

    public PhysParser() {
        this(false);
    }

    /**
     * @param trace Log every dispatched line at DEBUG level
     */
    public PhysParser(boolean trace) {
        this.trace = trace;
    }

    /**
     * Parses PhysLang source with tracing disabled.
     *
     * @param source The program text
     * @return The parsed, not yet elaborated program
     * @throws PhysParseException on the first syntax error
     */
    public static Program parse(String source) {
        return new PhysParser().parseProgram(source);
    }

    public Program parseProgram(String source) {
        Program program = new Program();
        new Cursor(splitLines(source), program).parseTopLevel();
        if (program.simulateOptional().isEmpty()) {
            throw new PhysParseException("Missing 'simulate' declaration");
        }
        if (trace) {
            LOG.debug("Parsed {}", program);
        }
        return program;
    }

    private static Deque<Segment> splitLines(String source) {
        Deque<Segment> lines = new ArrayDeque<>();
        int offset = 0;
        int number = 1;
        while (offset <= source.length()) {
            int end = source.indexOf('\n', offset);
            if (end < 0) {
                end = source.length();
            }
            String text = source.substring(offset, end);
            if (text.endsWith("\r")) {
                text = text.substring(0, text.length() - 1);
            }
            SourceLine line = new SourceLine(number, offset, text);
            lines.add(new Segment(text, offset, line));
            offset = end + 1;
            number++;
        }
        return lines;
    }

    /**
     * A physical source line.
     */
    private record SourceLine(int number, int offset, String text) {
    }

    /**
     * A piece of a source line: a whole line, or the part before or after a brace.
     */
    private record Segment(String text, int offset, SourceLine line) {

        Segment slice(int from) {
            return slice(from, text.length());
        }

        Segment slice(int from, int to) {
            return new Segment(text.substring(from, to), offset + from, line);
        }

        String trimmed() {
            return text.trim();
        }

        boolean isBlankOrComment() {
            String t = trimmed();
            return t.isEmpty() || t.startsWith("#");
        }

        int firstNonBlank() {
            int i = 0;
            while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
                i++;
            }
            return offset + i;
        }

        Span span() {
            return Span.of(firstNonBlank(), Math.max(firstNonBlank(), offset + text.stripTrailing().length()));
        }
    }

    /**
     * Where a block of statements appears, which governs the allowed statements.
     */
    private enum BlockContext {
        TOP_LEVEL,
        FUNCTION_BODY,
        NESTED
    }

    /**
     * Parsing state over a queue of pending segments.
     */
    private final class Cursor {

        private final Deque<Segment> pending;
        private final Program program;

        Cursor(Deque<Segment> pending, Program program) {
            this.pending = pending;
            this.program = program;
        }

        void parseTopLevel() {
            Segment segment;
            while ((segment = nextStatement()) != null) {
                String text = statementText(segment);
                if (trace) {
                    LOG.debug("line {}: {}", segment.line().number(), text);
                }
                switch (keyword(text)) {
                    case "let" -> program.addLet(parseLet(segment, text));
                    case "fn" -> program.addFunction(parseFunction(segment));
                    case "simulate" -> {
                        if (program.simulateOptional().isPresent()) {
                            throw error(segment, "Duplicate 'simulate' declaration");
                        }
                        program.setSimulate(parseSimulate(segment, text));
                    }
                    case "return" -> throw error(segment, "'return' is only allowed inside a function body");
                    default -> {
                        Stmt stmt = parseStatement(segment, text, BlockContext.TOP_LEVEL);
                        if (stmt instanceof ParticleDecl particle) {
                            program.addParticle(particle);
                        } else if (stmt instanceof ForceDecl force) {
                            program.addForce(force);
                        } else if (stmt instanceof LoopDecl loop) {
                            program.addLoop(loop);
                        } else if (stmt instanceof WellDecl well) {
                            program.addWell(well);
                        } else if (stmt instanceof DetectorDecl detector) {
                            program.addDetector(detector);
                        } else {
                            program.addStatement(stmt);
                        }
                    }
                }
            }
        }

        List<Stmt> parseBlock(BlockContext context) {
            List<Stmt> statements = new ArrayList<>();
            Segment segment;
            while ((segment = nextStatement()) != null) {
                String text = statementText(segment);
                if (trace) {
                    LOG.debug("line {}: {}", segment.line().number(), text);
                }
                switch (keyword(text)) {
                    case "fn" -> throw error(segment, "Functions can only be declared at top level");
                    case "simulate" -> throw error(segment, "'simulate' can only be declared at top level");
                    case "let" -> statements.add(parseLet(segment, text));
                    case "return" -> {
                        if (context != BlockContext.FUNCTION_BODY) {
                            throw error(segment, "'return' is only allowed inside a function body");
                        }
                        statements.add(parseReturn(segment, text));
                    }
                    default -> statements.add(parseStatement(segment, text, context));
                }
            }
            return statements;
        }

        private Stmt parseStatement(Segment segment, String text, BlockContext context) {
            BlockContext nested = context == BlockContext.TOP_LEVEL ? BlockContext.NESTED : context;
            return switch (keyword(text)) {
                case "particle" -> parseParticle(segment, text);
                case "force" -> parseForce(segment, text);
                case "detect" -> parseDetector(segment, text);
                case "loop" -> parseLoop(segment);
                case "well" -> parseWell(segment, text);
                case "if" -> parseIf(segment, nested);
                case "for" -> parseFor(segment, nested);
                case "match" -> parseMatch(segment, nested);
                default -> parseCall(segment, text);
            };
        }

        // ==================== Simple statements ====================

        private LetStmt parseLet(Segment segment, String text) {
            Matcher m = match(LET, text, segment, "Invalid let syntax, expected 'let name = expr'");
            return new LetStmt(m.group(1), expr(m.group(2), segment), segment.span());
        }

        private ReturnStmt parseReturn(Segment segment, String text) {
            Matcher m = match(RETURN, text, segment, "Invalid return syntax, expected 'return expr'");
            return new ReturnStmt(expr(m.group(1), segment), segment.span());
        }

        private SimulateDecl parseSimulate(Segment segment, String text) {
            Matcher m = match(SIMULATE, text, segment,
                    "Invalid simulate syntax, expected 'simulate dt = expr steps = expr'");
            return new SimulateDecl(expr(m.group(1), segment), expr(m.group(2), segment), segment.span());
        }

        private ParticleDecl parseParticle(Segment segment, String text) {
            Matcher m = match(PARTICLE, text, segment,
                    "Invalid particle syntax, expected 'particle name at (x, y) mass m'");
            List<String> coords = ExpressionParser.splitArguments(m.group(2));
            if (coords.size() != 2) {
                throw error(segment, "Particle position must have exactly two coordinates");
            }
            return new ParticleDecl(nameRef(m.group(1)), expr(coords.get(0), segment),
                    expr(coords.get(1), segment), expr(m.group(3), segment), segment.span());
        }

        private ForceDecl parseForce(Segment segment, String text) {
            Matcher gravity = GRAVITY.matcher(text);
            if (gravity.matches()) {
                return new ForceDecl(nameRef(gravity.group(1)), nameRef(gravity.group(2)),
                        new ForceKind.Gravity(expr(gravity.group(3), segment)), segment.span());
            }
            Matcher spring = SPRING.matcher(text);
            if (spring.matches()) {
                return new ForceDecl(nameRef(spring.group(1)), nameRef(spring.group(2)),
                        new ForceKind.Spring(expr(spring.group(3), segment), expr(spring.group(4), segment)),
                        segment.span());
            }
            if (text.matches("force\\s+push\\b.*")) {
                throw error(segment, "'force push' is only allowed inside a loop body");
            }
            throw error(segment, "Invalid force syntax, expected 'force gravity(a, b) G = expr' "
                    + "or 'force spring(a, b) k = expr rest = expr'");
        }

        private DetectorDecl parseDetector(Segment segment, String text) {
            Matcher m = match(DETECT, text, segment,
                    "Invalid detector syntax, expected 'detect name = position(a)' or 'detect name = distance(a, b)'");
            List<String> args = ExpressionParser.splitArguments(m.group(3));
            DetectorKind kind;
            if (m.group(2).equals("position")) {
                if (args.size() != 1) {
                    throw error(segment, "position() detector takes exactly one particle");
                }
                kind = new DetectorKind.Position(particleName(args.get(0), segment));
            } else {
                if (args.size() != 2) {
                    throw error(segment, "distance() detector takes exactly two particles");
                }
                kind = new DetectorKind.Distance(particleName(args.get(0), segment),
                        particleName(args.get(1), segment));
            }
            return new DetectorDecl(m.group(1), kind, segment.span());
        }

        private WellDecl parseWell(Segment segment, String text) {
            Matcher m = match(WELL, text, segment,
                    "Invalid well syntax, expected 'well name on a if position(b).x >= expr depth expr'");
            Observable observable = parseObservable(m.group(3).trim(), segment);
            return new WellDecl(m.group(1), nameRef(m.group(2)), observable,
                    expr(m.group(4), segment), expr(m.group(5), segment), segment.span());
        }

        private CallStmt parseCall(Segment segment, String text) {
            Matcher m = CALL.matcher(text);
            if (!m.matches()) {
                throw error(segment, "Unrecognized statement '" + text + "'");
            }
            List<Expr> args = new ArrayList<>();
            for (String arg : ExpressionParser.splitArguments(m.group(2))) {
                if (arg.isEmpty()) {
                    throw error(segment, "Empty argument in call to '" + m.group(1) + "'");
                }
                args.add(expr(arg, segment));
            }
            return new CallStmt(m.group(1), args, segment.span());
        }

        // ==================== Block statements ====================

        private FunctionDecl parseFunction(Segment segment) {
            Block block = readBlock(segment, "function");
            Matcher m = match(FN_HEADER, block.header(), segment,
                    "Invalid function syntax, expected 'fn name(p1, p2) {'");
            List<String> params = new ArrayList<>();
            for (String param : ExpressionParser.splitArguments(m.group(2))) {
                if (!KEYWORD.matcher(param).matches()) {
                    throw error(segment, "Invalid parameter name '" + param + "'");
                }
                params.add(param);
            }
            List<Stmt> body = block.parse(BlockContext.FUNCTION_BODY);
            return new FunctionDecl(m.group(1), params, body, segment.span());
        }

        private LoopDecl parseLoop(Segment segment) {
            Block block = readBlock(segment, "loop");
            String header = block.header().trim();
            LoopKind kind;
            Matcher m = LOOP_FOR.matcher(header);
            if (m.matches()) {
                kind = new LoopKind.ForCycles(expr(m.group(2), segment));
            } else {
                m = LOOP_WHILE.matcher(header);
                if (!m.matches()) {
                    throw error(segment, "Invalid loop syntax, expected 'loop for N cycles with frequency F "
                            + "damping D on target {' or 'loop while COND with frequency F damping D on target {'");
                }
                kind = new LoopKind.WhileCondition(parseCondition(m.group(2).trim(), segment));
            }
            List<PushAction> body = parsePushActions(block);
            return new LoopDecl(m.group(1), kind, expr(m.group(3), segment), expr(m.group(4), segment),
                    nameRef(m.group(5)), body, segment.span());
        }

        private List<PushAction> parsePushActions(Block block) {
            Cursor inner = block.cursor();
            List<PushAction> actions = new ArrayList<>();
            Segment segment;
            while ((segment = inner.nextStatement()) != null) {
                String text = statementText(segment);
                Matcher m = PUSH.matcher(text);
                if (!m.matches()) {
                    throw error(segment, "Loop bodies may only contain "
                            + "'force push(target) magnitude M direction (x, y)'");
                }
                List<String> direction = ExpressionParser.splitArguments(m.group(3));
                if (direction.size() != 2) {
                    throw error(segment, "Push direction must have exactly two components");
                }
                actions.add(new PushAction(nameRef(m.group(1)), expr(m.group(2), segment),
                        expr(direction.get(0), segment), expr(direction.get(1), segment), segment.span()));
            }
            return actions;
        }

        private IfStmt parseIf(Segment segment, BlockContext context) {
            Block thenBlock = readBlock(segment, "if");
            Matcher m = match(IF_HEADER, thenBlock.header().trim(), segment, "Invalid if syntax, expected 'if expr {'");
            Expr condition = expr(m.group(1), segment);
            List<Stmt> thenBody = thenBlock.parse(context);
            List<Stmt> elseBody = List.of();

            Segment next = peekNonBlank();
            if (next != null && keyword(next.trimmed()).equals("else")) {
                pending.pollFirst();
                int at = next.text().indexOf("else");
                Segment afterElse = next.slice(at + "else".length());
                if (afterElse.trimmed().startsWith("if")) {
                    throw error(next, "'else if' is not supported, nest an if inside the else block");
                }
                Block elseBlock = readBlock(afterElse, "else");
                if (!elseBlock.header().isBlank()) {
                    throw error(next, "Unexpected text after 'else'");
                }
                elseBody = elseBlock.parse(context);
            }
            return new IfStmt(condition, thenBody, elseBody, segment.span());
        }

        private ForStmt parseFor(Segment segment, BlockContext context) {
            Block block = readBlock(segment, "for");
            Matcher m = match(FOR_HEADER, block.header().trim(), segment,
                    "Invalid for syntax, expected 'for var in start..end {'");
            return new ForStmt(m.group(1), expr(m.group(2), segment), expr(m.group(3), segment),
                    block.parse(context), segment.span());
        }

        private MatchStmt parseMatch(Segment segment, BlockContext context) {
            Block block = readBlock(segment, "match");
            Matcher m = match(MATCH_HEADER, block.header().trim(), segment, "Invalid match syntax, expected 'match expr {'");
            Expr scrutinee = expr(m.group(1), segment);

            Cursor inner = block.cursor();
            List<MatchArm> arms = new ArrayList<>();
            Segment armSegment;
            while ((armSegment = inner.nextStatement()) != null) {
                Block armBlock = inner.readBlock(armSegment, "match arm");
                Matcher arm = match(ARM_HEADER, armBlock.header().trim(), armSegment,
                        "Invalid match arm, expected 'N => {' or '_ => {'");
                MatchPattern pattern = arm.group(1).equals("_")
                        ? new MatchPattern.Wildcard()
                        : new MatchPattern.Literal(parseArmLiteral(arm.group(1), armSegment));
                arms.add(new MatchArm(pattern, armBlock.parse(context), armSegment.span()));
            }
            return new MatchStmt(scrutinee, arms, segment.span());
        }

        private long parseArmLiteral(String literal, Segment segment) {
            try {
                return Long.parseLong(literal);
            } catch (NumberFormatException e) {
                throw error(segment, "Match arm literal out of range: " + literal);
            }
        }

        // ==================== Conditions and observables ====================

        private ConditionExpr parseCondition(String text, Segment segment) {
            Matcher m = CONDITION.matcher(text);
            if (!m.matches() || m.group(3).startsWith("=")) {
                throw error(segment, "Invalid loop condition '" + text + "', expected 'position(a).x < expr', "
                        + "'position(a).y > expr' or 'distance(a, b) < expr'");
            }
            Observable observable = parseObservable(m.group(1).trim(), segment);
            return new ConditionExpr(observable, ConditionExpr.Comparison.fromSymbol(m.group(2)),
                    expr(m.group(3), segment));
        }

        private Observable parseObservable(String text, Segment segment) {
            Matcher position = POSITION_AXIS.matcher(text);
            if (position.matches()) {
                NameRef particle = nameRef(position.group(1));
                return position.group(2).equals("x")
                        ? new Observable.PositionX(particle)
                        : new Observable.PositionY(particle);
            }
            Matcher distance = DISTANCE.matcher(text);
            if (distance.matches()) {
                return new Observable.Distance(nameRef(distance.group(1)), nameRef(distance.group(2)));
            }
            throw error(segment, "Invalid observable '" + text + "', expected 'position(a).x', "
                    + "'position(a).y' or 'distance(a, b)'");
        }

        // ==================== Block extraction ====================

        /**
         * Reads a braced block that opens on {@code headerSegment} or on the
         * next non-blank line. Text following the closing brace is pushed
         * back as a new pending segment.
         */
        private Block readBlock(Segment headerSegment, String construct) {
            int brace = indexOutsideString(headerSegment.text(), '{');
            String header;
            Segment rest;
            if (brace >= 0) {
                header = headerSegment.text().substring(0, brace);
                rest = headerSegment.slice(brace + 1);
            } else {
                header = headerSegment.text();
                Segment next = peekNonBlank();
                if (next == null || !next.trimmed().startsWith("{")) {
                    throw error(headerSegment, "Expected '{' to open " + construct + " body");
                }
                pending.pollFirst();
                rest = next.slice(next.text().indexOf('{') + 1);
            }

            Deque<Segment> body = new ArrayDeque<>();
            int depth = 1;
            Segment current = rest;
            while (true) {
                if (current.isBlankOrComment()) {
                    body.add(current);
                    current = pending.pollFirst();
                    if (current == null) {
                        throw error(headerSegment, "Unclosed '{' in " + construct + " body");
                    }
                    continue;
                }
                boolean inString = false;
                String text = current.text();
                for (int i = 0; i < text.length(); i++) {
                    char c = text.charAt(i);
                    if (c == '"') {
                        inString = !inString;
                    } else if (!inString && c == '{') {
                        depth++;
                    } else if (!inString && c == '}') {
                        depth--;
                        if (depth == 0) {
                            body.add(current.slice(0, i));
                            Segment remainder = current.slice(i + 1);
                            if (!remainder.trimmed().isEmpty()) {
                                pending.addFirst(remainder);
                            }
                            return new Block(stripStatementEnd(header), body);
                        }
                    }
                }
                body.add(current);
                current = pending.pollFirst();
                if (current == null) {
                    throw error(headerSegment, "Unclosed '{' in " + construct + " body");
                }
            }
        }

        private Segment nextStatement() {
            Segment segment;
            while ((segment = pending.pollFirst()) != null) {
                if (!segment.isBlankOrComment()) {
                    return segment;
                }
            }
            return null;
        }

        private Segment peekNonBlank() {
            while (!pending.isEmpty() && pending.peekFirst().isBlankOrComment()) {
                pending.pollFirst();
            }
            return pending.peekFirst();
        }

        // ==================== Helpers ====================

        private Matcher match(Pattern pattern, String text, Segment segment, String message) {
            Matcher m = pattern.matcher(text.trim());
            if (!m.matches()) {
                throw error(segment, message);
            }
            return m;
        }

        private Expr expr(String text, Segment segment) {
            try {
                return ExpressionParser.parse(text);
            } catch (PhysParseException e) {
                throw error(segment, e.getDetail());
            }
        }

        private NameRef particleName(String text, Segment segment) {
            String t = text.trim();
            if (!t.matches(NAME)) {
                throw error(segment, "Invalid particle name '" + t + "'");
            }
            return nameRef(t);
        }

        private PhysParseException error(Segment segment, String message) {
            SourceLine line = segment.line();
            int start = segment.firstNonBlank();
            int column = start - line.offset() + 1;
            Span span = Span.of(start, Math.max(start, segment.offset() + segment.text().stripTrailing().length()));
            return new PhysParseException(message, span, line.number(), column, line.text());
        }

        /**
         * A braced body ready to be parsed into the same program.
         */
        private final class Block {
            private final String header;
            private final Deque<Segment> body;

            Block(String header, Deque<Segment> body) {
                this.header = header;
                this.body = body;
            }

            String header() {
                return header;
            }

            Cursor cursor() {
                return new Cursor(body, program);
            }

            List<Stmt> parse(BlockContext context) {
                return cursor().parseBlock(context);
            }
        }
    }

    private static String statementText(Segment segment) {
        return stripStatementEnd(segment.trimmed());
    }

    private static String stripStatementEnd(String text) {
        String t = text.trim();
        while (t.endsWith(";")) {
            t = t.substring(0, t.length() - 1).trim();
        }
        return t;
    }

    private static String keyword(String text) {
        Matcher m = KEYWORD.matcher(text);
        return m.lookingAt() ? m.group() : "";
    }

    private static NameRef nameRef(String token) {
        if (token.length() >= 2 && (token.startsWith("\"") && token.endsWith("\"")
                || token.startsWith("'") && token.endsWith("'"))) {
            return NameRef.literal(token.substring(1, token.length() - 1));
        }
        return NameRef.bare(token);
    }

    private static int indexOutsideString(String text, char target) {
        boolean inString = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"') {
                inString = !inString;
            } else if (!inString && c == target) {
                return i;
            }
        }
        return -1;
    }
}
