package org.nmlkit.parser;

import org.nmlkit.api.NamelistException;
import org.nmlkit.config.ReadOptions;
import org.nmlkit.diagnostics.DiagnosticsEngine;
import org.nmlkit.frontend.lexer.Scanner;
import org.nmlkit.model.Namelist;
import org.nmlkit.model.WriteOptions;

import java.io.Writer;

/**
 * Entry point for reading namelist text, either into a document or while rewriting it with a patch.
 * <p>
 * The whole input is held in memory and scanned once per call. Instances are not shared
 * between threads.
 */
public class StreamingParser {

    private final String input;
    private final ReadOptions options;
    private final DiagnosticsEngine diagnostics = new DiagnosticsEngine();

    public StreamingParser(String input) {
        this(input, ReadOptions.defaults());
    }

    public StreamingParser(String input, ReadOptions options) {
        this.input = input;
        this.options = options;
    }

    /**
     * Parses the input into a document.
     * @return The document.
     * @throws NamelistException on a lexical or syntax error.
     */
    public Namelist parse() throws NamelistException {
        return new StructuralParser(new Scanner(input, options).scanAll(), diagnostics, options.fileName()).parse();
    }

    /**
     * Writes the input to {@code out} with the values of {@code patch} substituted, keeping all
     * other text byte for byte.
     *
     * @param out The sink for the rewritten text. It is flushed but not closed.
     * @param patch The patch document.
     * @return The document the rewritten text describes.
     * @throws NamelistException on a lexical or syntax error, an incompatible patch value or a write failure.
     */
    public Namelist parseAndPatch(Writer out, Namelist patch) throws NamelistException {
        return parseAndPatch(out, patch, WriteOptions.defaults());
    }

    /**
     * Like {@link #parseAndPatch(Writer, Namelist)}, formatting patch values with the given options.
     * @param out The sink for the rewritten text.
     * @param patch The patch document.
     * @param writeOptions The options for formatting substituted and appended values.
     * @return The document the rewritten text describes.
     * @throws NamelistException on a lexical or syntax error, an incompatible patch value or a write failure.
     */
    public Namelist parseAndPatch(Writer out, Namelist patch, WriteOptions writeOptions) throws NamelistException {
        return new TemplatePatcher(new Scanner(input, options).scanAllIncludingWhitespace(), patch, out,
                writeOptions, options.fileName()).patch();
    }

    /**
     * Returns the warnings collected by {@link #parse()}.
     * @return The diagnostics engine.
     */
    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }
}
