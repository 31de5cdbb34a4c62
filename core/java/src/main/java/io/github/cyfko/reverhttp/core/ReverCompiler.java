package io.github.cyfko.reverhttp.core;

import io.github.cyfko.reverhttp.core.api.FlowParser;
import io.github.cyfko.reverhttp.core.api.ParseResult;
import io.github.cyfko.reverhttp.core.ast.SourceFile;
import io.github.cyfko.reverhttp.core.config.CompilerPolicy;
import io.github.cyfko.reverhttp.core.generation.IrDocumentMerger;
import io.github.cyfko.reverhttp.core.generation.IrGenerator;
import io.github.cyfko.reverhttp.core.impl.BasicFlowParser;
import io.github.cyfko.reverhttp.core.ir.IrDocument;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Entry point of the compilation pipeline: source text to syntax tree to IR.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * ReverCompiler compiler = new ReverCompiler();
 *
 * // One source unit
 * CompilationResult result = compiler.compile(source, "users.flow");
 * if (result.isSuccessful()) {
 *     String json = new IrJsonWriter().write(result.ir());
 * }
 *
 * // Several units merged into one document
 * CompilationResult all = compiler.compileAll(Map.of("users.flow", users, "orders.flow", orders));
 * }</pre>
 *
 * <p>
 * Every call works on its own lexer and parser, so one compiler can serve several threads.
 * </p>
 *
 * @author Frank KOSSI
 * @since 0.1.0
 */
public class ReverCompiler {

    private static final Logger log = Logger.getLogger(ReverCompiler.class.getName());

    private final FlowParser parser;
    private final IrGenerator generator;

    /**
     * Uses {@link CompilerPolicy#defaults()}.
     */
    public ReverCompiler() {
        this(CompilerPolicy.defaults());
    }

    public ReverCompiler(CompilerPolicy policy) {
        this(new BasicFlowParser(policy), new IrGenerator());
    }

    /**
     * @param parser    parse entry point
     * @param generator IR generator
     */
    public ReverCompiler(FlowParser parser, IrGenerator generator) {
        this.parser = Objects.requireNonNull(parser, "parser cannot be null");
        this.generator = Objects.requireNonNull(generator, "generator cannot be null");
    }

    public ParseResult parse(String source, String file) {
        return parser.parse(source, file);
    }

    public IrDocument generate(SourceFile ast) {
        return generator.generate(ast);
    }

    /**
     * Parses and generates one unit. The IR is produced even when diagnostics were reported.
     */
    public CompilationResult compile(String source, String file) {
        ParseResult parsed = parser.parse(source, file);
        IrDocument ir = generator.generate(parsed.ast());
        return new CompilationResult(parsed.ast(), parsed.diagnostics(), ir);
    }

    /**
     * Compiles several units in the map's iteration order and merges the clean ones.
     * <p>
     * Diagnostics of every unit are collected; units with diagnostics are left out of the merged
     * document. The returned tree is that of the last unit, or an empty tree for an empty map.
     * </p>
     *
     * @param sources source text keyed by file identifier
     * @return the merged document and all diagnostics
     */
    public CompilationResult compileAll(Map<String, String> sources) {
        Objects.requireNonNull(sources, "sources cannot be null");

        List<IrDocument> documents = new ArrayList<>();
        List<String> diagnostics = new ArrayList<>();
        SourceFile last = SourceFile.empty();

        for (Map.Entry<String, String> entry : sources.entrySet()) {
            CompilationResult unit = compile(entry.getValue(), entry.getKey());
            last = unit.ast();
            if (unit.isSuccessful()) {
                documents.add(unit.ir());
            } else {
                diagnostics.addAll(unit.diagnostics());
                log.fine(() -> String.format("Skipping %s: %d diagnostics", entry.getKey(), unit.diagnostics().size()));
            }
        }

        return new CompilationResult(last, diagnostics, IrDocumentMerger.merge(documents));
    }
}
