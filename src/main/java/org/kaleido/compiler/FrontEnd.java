package org.kaleido.compiler;

import com.typesafe.config.Config;
import org.kaleido.compiler.api.CompilationException;
import org.kaleido.compiler.api.IFrontEnd;
import org.kaleido.compiler.api.ParsedProgram;
import org.kaleido.compiler.config.FrontEndOptions;
import org.kaleido.compiler.config.LoggingConfigurator;
import org.kaleido.compiler.diagnostics.DiagnosticsEngine;
import org.kaleido.compiler.frontend.lexer.Lexer;
import org.kaleido.compiler.frontend.parser.ParseError;
import org.kaleido.compiler.frontend.parser.ParseResult;
import org.kaleido.compiler.frontend.parser.Parser;
import org.kaleido.compiler.frontend.parser.ast.AstPrinter;
import org.kaleido.compiler.frontend.parser.ast.TopLevelNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The front-end driver. It runs a whole program through a fresh lexer and parser,
 * collects every error as a diagnostic and either returns the parsed items or fails
 * with a {@link CompilationException}.
 * <p>
 * With {@link FrontEndOptions#recover()} enabled, the driver resynchronizes at the next
 * ';' after an error, so a single run reports the errors of all top-level items (up to
 * {@link FrontEndOptions#maxErrors()}). Each call uses its own parser and operator table,
 * so an instance can be reused for any number of programs.
 */
public class FrontEnd implements IFrontEnd {

    private static final Logger LOG = LoggerFactory.getLogger(FrontEnd.class);

    private final FrontEndOptions options;

    /**
     * Creates a front end with the default options.
     */
    public FrontEnd() {
        this(FrontEndOptions.defaults());
    }

    /**
     * Creates a front end.
     * @param options The front-end options.
     */
    public FrontEnd(FrontEndOptions options) {
        this.options = options;
    }

    /**
     * Creates a front end from the application configuration and applies its logging settings.
     * @param config The resolved configuration, e.g. from {@link org.kaleido.compiler.config.ConfigLoader}.
     * @return The front end.
     */
    public static FrontEnd fromConfig(Config config) {
        LoggingConfigurator.configure(config);
        return new FrontEnd(FrontEndOptions.fromConfig(config));
    }

    /**
     * @return The options this front end runs with.
     */
    public FrontEndOptions getOptions() {
        return options;
    }

    @Override
    public ParsedProgram parse(List<String> sourceLines, String programName) throws CompilationException {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        String source = String.join("\n", sourceLines);
        Parser parser = new Parser(new Lexer(source, programName), options);

        List<TopLevelNode> items = new ArrayList<>();
        while (true) {
            ParseResult<Optional<TopLevelNode>> result = parser.parseTopLevelItem();
            if (result.isOk()) {
                Optional<TopLevelNode> item = result.value();
                if (item.isEmpty()) {
                    break;
                }
                items.add(item.get());
                if (LOG.isDebugEnabled()) {
                    LOG.debug("{}: parsed {}", programName, AstPrinter.print(item.get()));
                }
                continue;
            }

            ParseError error = result.error();
            diagnostics.reportError(describe(error), error.sourceInfo());
            if (!options.recover()) {
                break;
            }
            if (diagnostics.errorCount() >= options.maxErrors()) {
                diagnostics.reportWarning("Too many errors, stopped after " + options.maxErrors() + ".", error.sourceInfo());
                break;
            }
            parser.synchronize();
        }

        if (diagnostics.hasErrors()) {
            LOG.warn("{}: {} error(s) while parsing.", programName, diagnostics.errorCount());
            throw new CompilationException(diagnostics.summary(), diagnostics.getDiagnostics());
        }

        ParsedProgram program = new ParsedProgram(programName, items);
        LOG.info("{}: parsed {} function(s), {} extern(s), {} top-level expression(s).", programName,
                program.functions().size() - program.anonymousFunctions().size(),
                program.externs().size(),
                program.anonymousFunctions().size());
        return program;
    }

    private static String describe(ParseError error) {
        if (error.kind() == ParseError.Kind.LEXICAL_ERROR) {
            return error.message();
        }
        return error.message() + " Expected " + error.expected() + " but found " + error.found() + ".";
    }
}
