package io.github.cyfko.reverhttp.core.parsing;

import io.github.cyfko.reverhttp.core.ast.ArgValue;
import io.github.cyfko.reverhttp.core.ast.ArmAction;
import io.github.cyfko.reverhttp.core.ast.BodyField;
import io.github.cyfko.reverhttp.core.ast.DefaultsBlock;
import io.github.cyfko.reverhttp.core.ast.Directive;
import io.github.cyfko.reverhttp.core.ast.DirectiveArg;
import io.github.cyfko.reverhttp.core.ast.ErrorFlow;
import io.github.cyfko.reverhttp.core.ast.ImportDecl;
import io.github.cyfko.reverhttp.core.ast.MatchArm;
import io.github.cyfko.reverhttp.core.ast.MatchPattern;
import io.github.cyfko.reverhttp.core.ast.PackageArg;
import io.github.cyfko.reverhttp.core.ast.PackageCall;
import io.github.cyfko.reverhttp.core.ast.PipelineStep;
import io.github.cyfko.reverhttp.core.ast.Route;
import io.github.cyfko.reverhttp.core.ast.SourceFile;
import io.github.cyfko.reverhttp.core.ast.StepBody;
import io.github.cyfko.reverhttp.core.ast.TypeDecl;
import io.github.cyfko.reverhttp.core.lexer.Lexer;
import io.github.cyfko.reverhttp.core.lexer.LexerState;
import io.github.cyfko.reverhttp.core.lexer.Position;
import io.github.cyfko.reverhttp.core.lexer.RegexModeScope;
import io.github.cyfko.reverhttp.core.lexer.Token;
import io.github.cyfko.reverhttp.core.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static io.github.cyfko.reverhttp.core.lexer.TokenType.*;

/**
 * Error-accumulating recursive descent parser for ReverHTTP sources.
 * <p>
 * The parser keeps exactly two tokens of lookahead ({@code cur} and {@code peek}) and pulls tokens
 * from its {@link Lexer} on demand. It never throws on malformed input: every production returns a
 * best-effort node and reports problems to a {@link Diagnostics} collector, then resumes at the next
 * safe boundary.
 * </p>
 *
 * <h2>Grammar overview</h2>
 * <pre>
 * file      := (import | type | defaults | route | NEWLINE)*
 * import    := 'import' IDENT '=' ('@' '/' path | source ('@' version)?)
 * type      := 'type' IDENT '{' (name ':' name ','?)* '}'
 * defaults  := 'defaults' directive*
 * route     := METHOD path NEWLINE directive* ('|>' step)*
 * directive := ('cache' | 'cors' | 'auth') ('(' args ')')? ('as' IDENT)?
 * step      := (input | validate | transform | guard | match | respond | call) ('as' IDENT)? errorFlow?
 * errorFlow := '~>' INT body?
 * </pre>
 *
 * <h2>Recovery</h2>
 * <ul>
 *   <li>Unknown top-level tokens are reported and skipped one at a time.</li>
 *   <li>Malformed declarations and steps skip to the next {@code |>}, newline or HTTP method.</li>
 *   <li>Element lists that cannot make progress report the offending token and step over it, so
 *       no input can stall the parser.</li>
 * </ul>
 *
 * <p>
 * Instances are single-use and not thread-safe.
 * </p>
 *
 * @author Frank KOSSI
 * @since 0.1.0
 */
public class Parser {

    private final Lexer lexer;
    private final Diagnostics diagnostics;

    private Token cur;
    private Token peek;
    private LexerState curState;
    private LexerState peekState;

    /**
     * Creates a parser reporting to its own diagnostics collector.
     *
     * @param lexer token source
     */
    public Parser(Lexer lexer) {
        this(lexer, new Diagnostics());
    }

    /**
     * Creates a parser reporting to a caller-owned diagnostics collector.
     *
     * @param lexer       token source
     * @param diagnostics collector receiving every parse problem
     */
    public Parser(Lexer lexer, Diagnostics diagnostics) {
        this.lexer = Objects.requireNonNull(lexer, "lexer cannot be null");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics cannot be null");
        nextToken();
        nextToken();
    }

    /**
     * @return diagnostics reported so far, in order
     */
    public List<String> errors() {
        return diagnostics.asList();
    }

    /**
     * Parses a complete source unit.
     *
     * @return the syntax tree; partial when diagnostics were reported
     */
    public SourceFile parseFile() {
        List<ImportDecl> imports = new ArrayList<>();
        List<TypeDecl> types = new ArrayList<>();
        List<Route> routes = new ArrayList<>();
        DefaultsBlock defaults = null;

        skipNewlines();
        while (!curIs(EOF)) {
            if (curIs(IMPORT)) {
                ImportDecl decl = parseImport();
                if (decl != null) {
                    imports.add(decl);
                }
            } else if (curIs(TYPE)) {
                TypeDecl decl = parseType();
                if (decl != null) {
                    types.add(decl);
                }
            } else if (curIs(DEFAULTS)) {
                defaults = parseDefaults();
            } else if (cur.type().isHttpMethod()) {
                routes.add(parseRoute());
            } else {
                if (!curIs(ILLEGAL)) {
                    error(String.format("unexpected token %s (%s)", cur.type(), Diagnostics.quote(cur.literal())));
                }
                nextToken();
            }
            skipNewlines();
        }

        return new SourceFile(imports, types, defaults, routes);
    }

    // ---------------------------------------------------------------------------------------------
    // Declarations
    // ---------------------------------------------------------------------------------------------

    /**
     * {@code import <alias> = <source>[@<version>]} or {@code import <alias> = @/<path>}.
     */
    private ImportDecl parseImport() {
        Position pos = cur.position();
        nextToken(); // import

        // reserved words are accepted as aliases: "auth" or "delete" are common package names
        if (!cur.type().isWord()) {
            error("expected identifier after 'import', got " + cur.type());
            skipToNextStatement();
            return null;
        }
        String alias = cur.literal();

        if (!expectPeek(ASSIGN)) {
            skipToNextStatement();
            return null;
        }
        nextToken(); // =

        if (curIs(AT) && peekIs(SLASH)) {
            nextToken(); // @
            nextToken(); // /
            return new ImportDecl(pos, alias, "@/" + readUntilLineEnd(), "", true);
        }

        StringBuilder source = new StringBuilder();
        while (!curIs(AT) && !curIs(NEWLINE) && !curIs(EOF)) {
            source.append(cur.literal());
            nextToken();
        }
        if (source.length() == 0) {
            error("expected import source after '='");
        }

        String version = "";
        if (curIs(AT)) {
            nextToken(); // @
            version = readUntilLineEnd();
            if (version.isEmpty()) {
                error("expected version after '@'");
            }
        }
        return new ImportDecl(pos, alias, source.toString(), version, false);
    }

    /**
     * {@code type <Name> { field: type, ... }}
     */
    private TypeDecl parseType() {
        Position pos = cur.position();
        nextToken(); // type

        if (!curIs(IDENT)) {
            error("expected type name after 'type'");
            skipToNextStatement();
            return null;
        }
        String name = cur.literal();

        if (!expectPeek(LBRACE)) {
            skipToNextStatement();
            return null;
        }
        nextToken(); // {
        skipNewlines();

        List<TypeDecl.Field> fields = new ArrayList<>();
        while (!curIs(RBRACE) && !curIs(EOF)) {
            if (!cur.type().isWord()) {
                reportUnexpected("type " + name);
                nextToken();
                continue;
            }
            String fieldName = cur.literal();
            if (!expectPeek(COLON)) {
                nextToken();
                skipWithinList(RBRACE);
                continue;
            }
            nextToken(); // :

            String typeName = "";
            if (cur.type().isWord()) {
                typeName = cur.literal();
                nextToken();
            } else {
                error("expected type for field '" + fieldName + "'");
            }
            fields.add(new TypeDecl.Field(fieldName, typeName));

            if (curIs(COMMA)) {
                nextToken();
            }
            skipNewlines();
        }
        expectClosing(RBRACE, "type " + name);

        return new TypeDecl(pos, name, fields);
    }

    /**
     * {@code defaults} followed by directives, one per line.
     */
    private DefaultsBlock parseDefaults() {
        Position pos = cur.position();
        nextToken(); // defaults
        skipNewlines();

        List<Directive> directives = new ArrayList<>();
        while (cur.type().isDirective()) {
            directives.add(parseDirective());
            skipNewlines();
        }
        return new DefaultsBlock(pos, directives);
    }

    /**
     * {@code cache(...)}, {@code cors(...)} or {@code auth(...) [as name]}.
     */
    private Directive parseDirective() {
        Position pos = cur.position();
        String name = cur.literal();
        nextToken(); // directive name

        List<DirectiveArg> args = List.of();
        if (curIs(LPAREN)) {
            nextToken(); // (
            args = parseDirectiveArgs(name);
            expectClosing(RPAREN, name + " arguments");
        }

        return new Directive(pos, name, args, parseBinding());
    }

    private List<DirectiveArg> parseDirectiveArgs(String directive) {
        List<DirectiveArg> args = new ArrayList<>();

        while (!curIs(RPAREN) && !curIs(EOF) && !cur.type().isHttpMethod()) {
            if (curIs(NONE)) {
                args.add(DirectiveArg.none());
                nextToken();
            } else if (cur.type().isWord() && peekIs(COLON)) {
                String name = cur.literal();
                nextToken(); // name
                nextToken(); // :
                args.add(new DirectiveArg(name, parseArgValue()));
            } else if (curIs(IDENT) || curIs(INT) || curIs(STRING)) {
                args.add(new DirectiveArg(null, parseArgValue()));
            } else {
                reportUnexpected(directive + " arguments");
                nextToken();
            }

            if (curIs(COMMA)) {
                nextToken();
            }
        }
        return args;
    }

    /**
     * String, integer, string list, identifier, dotted path or {@code fn(arg)}.
     */
    private ArgValue parseArgValue() {
        switch (cur.type()) {
            case STRING: {
                String value = cur.literal();
                nextToken();
                return new ArgValue.Text(value);
            }
            case INT: {
                String value = cur.literal();
                nextToken();
                return new ArgValue.Int(value);
            }
            case LBRACKET:
                return parseStringList();
            case IDENT: {
                String name = cur.literal();
                nextToken();
                if (curIs(LPAREN)) {
                    nextToken(); // (
                    String argument = "";
                    if (curIs(IDENT)) {
                        argument = cur.literal();
                        nextToken();
                    } else {
                        error("expected identifier argument in " + name + "(...)");
                    }
                    expectClosing(RPAREN, name + "(...)");
                    return new ArgValue.Call(name, argument);
                }
                return new ArgValue.Ident(readDottedTail(name));
            }
            default:
                reportUnexpected("argument value");
                nextToken();
                return new ArgValue.Missing();
        }
    }

    private ArgValue parseStringList() {
        nextToken(); // [
        List<String> items = new ArrayList<>();
        while (!curIs(RBRACKET) && !curIs(EOF)) {
            if (curIs(STRING) || curIs(IDENT) || curIs(INT)) {
                items.add(cur.literal());
            } else if (!curIs(COMMA)) {
                reportUnexpected("list");
            }
            nextToken();
        }
        expectClosing(RBRACKET, "list");
        return new ArgValue.StringList(items);
    }

    // ---------------------------------------------------------------------------------------------
    // Routes and steps
    // ---------------------------------------------------------------------------------------------

    private Route parseRoute() {
        Position pos = cur.position();
        String method = cur.literal();
        nextToken(); // method

        String path = readPath();
        if (path.isEmpty()) {
            error("expected path after " + method);
        }
        skipNewlines();

        List<Directive> directives = new ArrayList<>();
        while (cur.type().isDirective()) {
            directives.add(parseDirective());
            skipNewlines();
        }

        List<PipelineStep> steps = new ArrayList<>();
        while (curIs(PIPE)) {
            PipelineStep step = parsePipelineStep();
            if (step != null) {
                steps.add(step);
            }
            skipNewlines();
        }

        return new Route(pos, method, path, directives, steps);
    }

    private PipelineStep parsePipelineStep() {
        Position pos = cur.position();
        nextToken(); // |>

        StepBody body;
        switch (cur.type()) {
            case INPUT:
                body = parseInput();
                break;
            case VALIDATE:
                body = parseValidate();
                break;
            case TRANSFORM:
                body = parseTransform();
                break;
            case GUARD:
                body = parseGuard();
                break;
            case MATCH:
                body = parseMatch();
                break;
            case RESPOND:
                body = parseRespond();
                break;
            case IDENT:
                body = parsePackageCall();
                break;
            default:
                error(String.format("expected step keyword, got %s (%s)", cur.type(), Diagnostics.quote(cur.literal())));
                skipToNextStatement();
                return null;
        }

        String bind = parseBinding();
        ErrorFlow errorFlow = curIs(ERROR) ? parseErrorFlow() : null;

        if (!curIs(NEWLINE) && !curIs(PIPE) && !curIs(EOF) && !cur.type().isHttpMethod()) {
            reportUnexpected("pipeline step");
            skipToNextStatement();
        }

        return new PipelineStep(pos, body, bind, errorFlow);
    }

    /**
     * {@code input(id: path.id, name: body.name)}
     */
    private StepBody.Input parseInput() {
        nextToken(); // input
        if (!curIs(LPAREN)) {
            error("expected '(' after 'input'");
            return new StepBody.Input(List.of());
        }
        nextToken(); // (

        List<StepBody.Input.Field> fields = new ArrayList<>();
        while (!curIs(RPAREN) && !curIs(EOF)) {
            Token start = cur;
            String name = null;
            String source = "";

            if (cur.type().isWord()) {
                name = cur.literal();
                nextToken();
            }
            if (curIs(COLON)) {
                nextToken(); // :
                source = parseDottedName();
            }
            if (name != null) {
                fields.add(new StepBody.Input.Field(name, source));
            }

            if (curIs(COMMA)) {
                nextToken();
            }
            stepOverIfStuck(start, "input");
        }
        expectClosing(RPAREN, "input");

        return new StepBody.Input(fields);
    }

    /**
     * {@code validate(id: int & min(1), email: string & format(email))}
     */
    private StepBody.Validate parseValidate() {
        nextToken(); // validate
        if (!curIs(LPAREN)) {
            error("expected '(' after 'validate'");
            return new StepBody.Validate(List.of());
        }
        nextToken(); // (

        List<StepBody.Validate.Rule> rules = new ArrayList<>();
        while (!curIs(RPAREN) && !curIs(EOF)) {
            Token start = cur;
            String field = null;
            List<StepBody.Validate.Constraint> constraints = List.of();

            if (cur.type().isWord()) {
                field = cur.literal();
                nextToken();
            }
            if (curIs(COLON)) {
                nextToken(); // :
                constraints = parseConstraints(field);
            }
            if (field != null) {
                rules.add(new StepBody.Validate.Rule(field, constraints));
            }

            if (curIs(COMMA)) {
                nextToken();
            }
            stepOverIfStuck(start, "validate");
        }
        expectClosing(RPAREN, "validate");

        return new StepBody.Validate(rules);
    }

    private List<StepBody.Validate.Constraint> parseConstraints(String field) {
        List<StepBody.Validate.Constraint> constraints = new ArrayList<>();

        StepBody.Validate.Constraint constraint = parseConstraint();
        if (constraint == null) {
            error("expected constraint for field '" + field + "'");
            return constraints;
        }
        constraints.add(constraint);

        while (curIs(AMPERSAND)) {
            nextToken(); // &
            constraint = parseConstraint();
            if (constraint == null) {
                error("expected constraint after '&'");
                break;
            }
            constraints.add(constraint);
        }
        return constraints;
    }

    /**
     * {@code int}, {@code min(1)}, {@code format(email)}
     */
    private StepBody.Validate.Constraint parseConstraint() {
        if (!curIs(IDENT)) {
            return null;
        }
        String name = cur.literal();
        nextToken();

        List<ArgValue> args = new ArrayList<>();
        if (curIs(LPAREN)) {
            nextToken(); // (
            while (!curIs(RPAREN) && !curIs(EOF)) {
                switch (cur.type()) {
                    case INT -> args.add(new ArgValue.Int(cur.literal()));
                    case STRING -> args.add(new ArgValue.Text(cur.literal()));
                    case IDENT -> args.add(new ArgValue.Ident(cur.literal()));
                    case COMMA -> { }
                    default -> reportUnexpected(name + "(...)");
                }
                nextToken();
            }
            expectClosing(RPAREN, name + "(...)");
        }
        return new StepBody.Validate.Constraint(name, args);
    }

    /**
     * {@code transform(id: int(id), name: trim(name))}
     */
    private StepBody.Transform parseTransform() {
        nextToken(); // transform
        if (!curIs(LPAREN)) {
            error("expected '(' after 'transform'");
            return new StepBody.Transform(List.of());
        }
        nextToken(); // (

        List<StepBody.Transform.Field> fields = new ArrayList<>();
        while (!curIs(RPAREN) && !curIs(EOF)) {
            Token start = cur;
            String name = null;
            String function = "";
            String source = null;

            if (cur.type().isWord()) {
                name = cur.literal();
                nextToken();
            }
            if (curIs(COLON)) {
                nextToken(); // :
                if (curIs(IDENT)) {
                    function = cur.literal();
                    nextToken();
                    if (curIs(LPAREN)) {
                        nextToken(); // (
                        if (curIs(IDENT)) {
                            source = cur.literal();
                            nextToken();
                        } else {
                            error("expected source variable in " + function + "(...)");
                        }
                        expectClosing(RPAREN, function + "(...)");
                    }
                } else {
                    error("expected function after '" + name + ":'");
                }
            }
            if (name != null) {
                fields.add(new StepBody.Transform.Field(name, function, source));
            }

            if (curIs(COMMA)) {
                nextToken();
            }
            stepOverIfStuck(start, "transform");
        }
        expectClosing(RPAREN, "transform");

        return new StepBody.Transform(fields);
    }

    /**
     * {@code guard expr} or {@code guard !expr}
     */
    private StepBody.Guard parseGuard() {
        nextToken(); // guard

        boolean negated = false;
        if (curIs(BANG)) {
            negated = true;
            nextToken();
        }

        String expression = parseDottedName();
        if (expression.isEmpty()) {
            error("expected expression after 'guard'");
        }
        return new StepBody.Guard(negated, expression);
    }

    /**
     * {@code match expr { pattern: action ... }}
     */
    private StepBody.Match parseMatch() {
        nextToken(); // match

        String scrutinee = parseDottedName();
        if (scrutinee.isEmpty()) {
            error("expected expression after 'match'");
        }

        if (!curIs(LBRACE)) {
            error("expected '{' after match expression");
            return new StepBody.Match(scrutinee, List.of());
        }
        nextToken(); // {
        skipNewlines();

        List<MatchArm> arms = new ArrayList<>();
        boolean sawDefault = false;
        while (!curIs(RBRACE) && !curIs(EOF)) {
            Token start = cur;
            MatchArm arm = parseMatchArm();
            if (arm != null) {
                if (sawDefault) {
                    diagnostics.report(arm.position(), arm.isDefault()
                            ? "duplicate wildcard arm in match block"
                            : "wildcard arm must be the last arm of a match block");
                }
                sawDefault |= arm.isDefault();
                arms.add(arm);
            }
            skipNewlines();
            stepOverIfStuck(start, "match block");
        }
        expectClosing(RBRACE, "match block");

        return new StepBody.Match(scrutinee, arms);
    }

    private MatchArm parseMatchArm() {
        Position pos = cur.position();

        MatchPattern pattern;
        if (curIs(UNDERSCORE)) {
            pattern = new MatchPattern.Wildcard();
            nextToken();
        } else {
            pattern = parsePattern();
            if (pattern == null) {
                error(String.format("expected match pattern, got %s (%s)", cur.type(), Diagnostics.quote(cur.literal())));
                skipWithinBlock(RBRACE);
                return null;
            }
        }

        if (!curIs(COLON)) {
            error("expected ':' after match pattern");
            skipWithinBlock(RBRACE);
            return null;
        }
        nextToken(); // :

        if (curIs(ERROR)) {
            return new MatchArm(pos, pattern, new ArmAction.ErrorOnly(), parseErrorFlow());
        }

        ArmAction action;
        if (curIs(IDENT) && peekIs(LPAREN)) {
            action = new ArmAction.Invoke(parsePackageCall());
        } else if (curIs(IDENT)) {
            action = new ArmAction.Reference(cur.literal());
            nextToken();
        } else {
            error("expected action or error flow after ':' in match arm");
            action = new ArmAction.Empty();
        }

        ErrorFlow errorFlow = curIs(ERROR) ? parseErrorFlow() : null;
        return new MatchArm(pos, pattern, action, errorFlow);
    }

    /**
     * Reads one pattern with the lexer in regex mode. A {@code /} already scanned as a path
     * separator by the lookahead is rescanned as a regex literal.
     *
     * @return the pattern, or {@code null} when the current token cannot start one
     */
    private MatchPattern parsePattern() {
        try (RegexModeScope ignored = lexer.enterRegexMode()) {
            if (curIs(SLASH)) {
                rescanCurrent();
            }

            switch (cur.type()) {
                case REGEX: {
                    String source = cur.literal();
                    nextToken();
                    return new MatchPattern.Regex(source);
                }
                case STRING: {
                    String first = cur.literal();
                    nextToken();
                    if (!curIs(COMMA)) {
                        return new MatchPattern.Literal(first);
                    }
                    List<String> values = new ArrayList<>();
                    values.add(first);
                    while (curIs(COMMA)) {
                        nextToken(); // ,
                        if (curIs(STRING)) {
                            values.add(cur.literal());
                            nextToken();
                        } else {
                            error("expected string after ',' in match pattern");
                        }
                    }
                    return new MatchPattern.Multi(values);
                }
                case INT: {
                    String first = cur.literal();
                    nextToken();
                    if (curIs(RANGE)) {
                        nextToken(); // ..
                        if (curIs(INT)) {
                            String last = cur.literal();
                            nextToken();
                            return new MatchPattern.Range(first, last);
                        }
                        error("expected integer after '..'");
                    }
                    return new MatchPattern.Literal(first);
                }
                case IDENT: {
                    String value = cur.literal();
                    nextToken();
                    return new MatchPattern.Literal(value);
                }
                default:
                    return null;
            }
        }
    }

    /**
     * {@code fetch(User, id)}, {@code create(User, { name, email })}, {@code redis-cache(key: "k")}
     */
    private PackageCall parsePackageCall() {
        String alias = cur.literal();
        nextToken(); // package alias

        if (!curIs(LPAREN)) {
            return new PackageCall(alias, List.of());
        }
        nextToken(); // (

        List<PackageArg> args = new ArrayList<>();
        while (!curIs(RPAREN) && !curIs(EOF)) {
            if (cur.type().isWord() && peekIs(COLON)) {
                String name = cur.literal();
                nextToken(); // name
                nextToken(); // :
                args.add(new PackageArg.Named(name, parseFieldValue(name)));
            } else if (curIs(LBRACE)) {
                args.add(new PackageArg.ObjectShorthand(parseObjectShorthand()));
            } else if (curIs(IDENT) && isUpperCase(cur.literal())) {
                args.add(new PackageArg.TypeRef(cur.literal()));
                nextToken();
            } else if (curIs(IDENT)) {
                args.add(new PackageArg.Positional(parseDottedName()));
            } else if (curIs(INT) || curIs(STRING)) {
                args.add(new PackageArg.Positional(cur.literal()));
                nextToken();
            } else {
                reportUnexpected(alias + " arguments");
                nextToken();
            }

            if (curIs(COMMA)) {
                nextToken();
            }
        }
        expectClosing(RPAREN, alias + " arguments");

        return new PackageCall(alias, args);
    }

    private List<String> parseObjectShorthand() {
        nextToken(); // {
        List<String> fields = new ArrayList<>();
        while (!curIs(RBRACE) && !curIs(EOF)) {
            if (cur.type().isWord()) {
                fields.add(cur.literal());
            } else if (!curIs(COMMA)) {
                reportUnexpected("object shorthand");
            }
            nextToken();
        }
        expectClosing(RBRACE, "object shorthand");
        return fields;
    }

    /**
     * {@code respond <status> [{ body }] [with headers { ... }]}
     */
    private StepBody.Respond parseRespond() {
        nextToken(); // respond

        String status = "";
        if (curIs(INT)) {
            status = cur.literal();
            nextToken();
        } else {
            error("expected status code after 'respond'");
        }

        List<BodyField> body = curIs(LBRACE) ? parseBodyFields() : List.of();

        List<BodyField> headers = List.of();
        if (curIs(WITH)) {
            nextToken(); // with
            if (!curIs(HEADERS)) {
                error("expected 'headers' after 'with'");
            } else {
                nextToken(); // headers
                if (curIs(LBRACE)) {
                    headers = parseBodyFields();
                } else {
                    error("expected '{' after 'with headers'");
                }
            }
        }

        return new StepBody.Respond(status, body, headers);
    }

    /**
     * {@code ~> <status> [{ body }]}
     */
    private ErrorFlow parseErrorFlow() {
        Position pos = cur.position();
        nextToken(); // ~>

        String status = "";
        if (curIs(INT)) {
            status = cur.literal();
            nextToken();
        } else {
            error("expected status code after '~>'");
        }

        List<BodyField> body = curIs(LBRACE) ? parseBodyFields() : List.of();
        return new ErrorFlow(pos, status, body);
    }

    private List<BodyField> parseBodyFields() {
        nextToken(); // {

        List<BodyField> fields = new ArrayList<>();
        while (!curIs(RBRACE) && !curIs(EOF)) {
            Token start = cur;
            String key = null;
            String value = "";

            if (cur.type().isWord() || curIs(STRING)) {
                key = cur.literal();
                nextToken();
            }
            if (curIs(COLON)) {
                nextToken(); // :
                value = parseFieldValue(key);
            }
            if (key != null) {
                fields.add(new BodyField(key, value));
            }

            if (curIs(COMMA)) {
                nextToken();
            }
            stepOverIfStuck(start, "body");
        }
        expectClosing(RBRACE, "body");

        return fields;
    }

    /**
     * String literal, integer literal or dotted path.
     */
    private String parseFieldValue(String key) {
        if (curIs(STRING) || curIs(INT)) {
            String value = cur.literal();
            nextToken();
            return value;
        }
        String path = parseDottedName();
        if (path.isEmpty()) {
            error("expected value for '" + key + "'");
        }
        return path;
    }

    private String parseBinding() {
        if (!curIs(AS)) {
            return null;
        }
        nextToken(); // as
        if (!curIs(IDENT)) {
            error("expected identifier after 'as'");
            return null;
        }
        String bind = cur.literal();
        nextToken();
        return bind;
    }

    private String parseDottedName() {
        if (!cur.type().isWord()) {
            return "";
        }
        String head = cur.literal();
        nextToken();
        return readDottedTail(head);
    }

    private String readDottedTail(String head) {
        StringBuilder path = new StringBuilder(head);
        while (curIs(DOT)) {
            nextToken(); // .
            if (cur.type().isWord()) {
                path.append('.').append(cur.literal());
                nextToken();
            } else {
                error("expected identifier after '.'");
            }
        }
        return path.toString();
    }

    // ---------------------------------------------------------------------------------------------
    // Token plumbing
    // ---------------------------------------------------------------------------------------------

    private void nextToken() {
        cur = peek;
        curState = peekState;
        peekState = lexer.snapshot();
        peek = lexer.nextToken();

        if (cur != null && cur.is(ILLEGAL)) {
            diagnostics.report(cur.position(), "illegal character '" + cur.literal() + "'");
        }
    }

    /**
     * Scans the current token again from its start, under the lexer's current mode.
     */
    private void rescanCurrent() {
        lexer.restore(curState);
        cur = lexer.nextToken();
        peekState = lexer.snapshot();
        peek = lexer.nextToken();
    }

    private boolean curIs(TokenType type) {
        return cur.type() == type;
    }

    private boolean peekIs(TokenType type) {
        return peek.type() == type;
    }

    /**
     * Advances when the lookahead has the expected type; reports and stays put otherwise.
     */
    private boolean expectPeek(TokenType type) {
        if (peekIs(type)) {
            nextToken();
            return true;
        }
        diagnostics.report(peek.position(), String.format("expected %s, got %s (%s)",
                type, peek.type(), Diagnostics.quote(peek.literal())));
        return false;
    }

    private void expectClosing(TokenType closing, String construct) {
        if (curIs(closing)) {
            nextToken();
        } else {
            error(String.format("expected '%s' to close %s, got %s", closing, construct, cur.type()));
        }
    }

    private void skipNewlines() {
        while (curIs(NEWLINE)) {
            nextToken();
        }
    }

    /**
     * Statement-level recovery: stops on {@code |>}, a newline, an HTTP method or end of input.
     */
    private void skipToNextStatement() {
        while (!curIs(EOF)) {
            if (curIs(PIPE) || curIs(NEWLINE) || cur.type().isHttpMethod()) {
                return;
            }
            nextToken();
        }
    }

    /**
     * Recovery inside a bracketed block: stops before {@code closing} or at end of input.
     */
    private void skipWithinBlock(TokenType closing) {
        while (!curIs(closing) && !curIs(EOF)) {
            nextToken();
        }
    }

    /**
     * Recovery inside a comma-separated list: stops after the next comma or before {@code closing}.
     */
    private void skipWithinList(TokenType closing) {
        while (!curIs(closing) && !curIs(EOF)) {
            if (curIs(COMMA)) {
                nextToken();
                return;
            }
            nextToken();
        }
    }

    private void stepOverIfStuck(Token start, String construct) {
        if (cur == start) {
            reportUnexpected(construct);
            nextToken();
        }
    }

    /**
     * Route path: the line's literals, cut short at {@code |>} when an unclosed bracket hides the
     * line break.
     */
    private String readPath() {
        StringBuilder path = new StringBuilder();
        while (!curIs(NEWLINE) && !curIs(PIPE) && !curIs(EOF)) {
            path.append(cur.literal());
            nextToken();
        }
        return path.toString();
    }

    private String readUntilLineEnd() {
        StringBuilder text = new StringBuilder();
        while (!curIs(NEWLINE) && !curIs(EOF)) {
            text.append(cur.literal());
            nextToken();
        }
        return text.toString();
    }

    private void reportUnexpected(String construct) {
        if (!curIs(ILLEGAL)) {
            error(String.format("unexpected %s (%s) in %s", cur.type(), Diagnostics.quote(cur.literal()), construct));
        }
    }

    private void error(String message) {
        diagnostics.report(cur.position(), message);
    }

    private static boolean isUpperCase(String text) {
        return !text.isEmpty() && Character.isUpperCase(text.charAt(0));
    }
}
