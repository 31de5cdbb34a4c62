package io.github.cyfko.reverhttp.core.impl;

import io.github.cyfko.reverhttp.core.api.FlowParser;
import io.github.cyfko.reverhttp.core.api.ParseResult;
import io.github.cyfko.reverhttp.core.ast.SourceFile;
import io.github.cyfko.reverhttp.core.config.CompilerPolicy;
import io.github.cyfko.reverhttp.core.lexer.Lexer;
import io.github.cyfko.reverhttp.core.lexer.Position;
import io.github.cyfko.reverhttp.core.parsing.Diagnostics;
import io.github.cyfko.reverhttp.core.parsing.Parser;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * Default {@link FlowParser}: one fresh {@link Lexer} and {@link Parser} per call.
 * <p>
 * Instances hold no mutable state and can parse independent sources from several threads.
 * </p>
 *
 * <h2>Source length limit</h2>
 * <p>
 * Sources longer than {@link CompilerPolicy#maxSourceLength()} are not tokenized. The result is an
 * empty tree with the single diagnostic
 * {@code file:1:1: source too long (N characters, max: M). Policy applied: P}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 0.1.0
 */
public class BasicFlowParser implements FlowParser {

    private static final Logger log = Logger.getLogger(BasicFlowParser.class.getName());

    private final CompilerPolicy policy;

    /**
     * Uses {@link CompilerPolicy#defaults()}.
     */
    public BasicFlowParser() {
        this(CompilerPolicy.defaults());
    }

    /**
     * @param policy limits applied to every source
     * @throws IllegalArgumentException if policy is null
     */
    public BasicFlowParser(CompilerPolicy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("Compiler policy is required");
        }
        this.policy = policy;
    }

    public CompilerPolicy getPolicy() {
        return policy;
    }

    @Override
    public ParseResult parse(String source, String file) {
        Objects.requireNonNull(source, "source text cannot be null");
        Objects.requireNonNull(file, "file identifier cannot be null");

        Diagnostics diagnostics = new Diagnostics();

        if (source.length() > policy.maxSourceLength()) {
            diagnostics.report(new Position(file, 1, 1), String.format(
                    "source too long (%d characters, max: %d). Policy applied: %s",
                    source.length(), policy.maxSourceLength(), policy.policyName()));
            log.fine(() -> String.format("Rejected %s: %d characters over policy %s",
                    file, source.length(), policy.policyName()));
            return new ParseResult(SourceFile.empty(), diagnostics.asList());
        }

        Parser parser = new Parser(new Lexer(source, file), diagnostics);
        SourceFile ast = parser.parseFile();

        log.fine(() -> String.format("Parsed %s: %d imports, %d types, %d routes, %d diagnostics",
                file, ast.imports().size(), ast.types().size(), ast.routes().size(), diagnostics.size()));

        return new ParseResult(ast, diagnostics.asList());
    }
}
