package org.nmlkit;

import org.nmlkit.api.NamelistErrorCode;
import org.nmlkit.api.NamelistException;
import org.nmlkit.config.ReadOptions;
import org.nmlkit.model.Namelist;
import org.nmlkit.model.WriteOptions;
import org.nmlkit.parser.StreamingParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reading, writing and patching namelist documents.
 * <p>
 * Files are read fully into memory and decoded as UTF-8. Output files are written completely
 * or not at all from the caller's point of view: a failure while writing is reported as
 * {@link NamelistErrorCode#IO_ERROR}.
 */
public final class Namelists {

    private static final Logger log = LoggerFactory.getLogger(Namelists.class);

    private Namelists() {
        // Static utility
    }

    // region Reading

    public static Namelist read(Path path) throws NamelistException {
        return read(path, ReadOptions.defaults());
    }

    /**
     * Reads and parses a namelist file.
     * @param path The file.
     * @param options The read options; the file name for error positions is taken from {@code path}.
     * @return The document.
     * @throws NamelistException if the file cannot be read or does not parse.
     */
    public static Namelist read(Path path, ReadOptions options) throws NamelistException {
        String text = readText(path);
        Namelist namelist = new StreamingParser(text, options.withFileName(path.toString())).parse();
        log.info("Read {} group(s) from {}", namelist.size(), path);
        return namelist;
    }

    public static Namelist reads(String text) throws NamelistException {
        return reads(text, ReadOptions.defaults());
    }

    public static Namelist reads(String text, ReadOptions options) throws NamelistException {
        return new StreamingParser(text, options).parse();
    }

    // endregion

    // region Writing

    public static void write(Namelist namelist, Path path) throws NamelistException {
        write(namelist, path, WriteOptions.defaults());
    }

    /**
     * Writes a document in canonical form.
     * @param namelist The document.
     * @param path The target file.
     * @param options The write options.
     * @throws NamelistException with {@link NamelistErrorCode#FILE_ALREADY_EXISTS} if the file exists
     *                           and {@link WriteOptions#force()} is off, or {@link NamelistErrorCode#IO_ERROR}.
     */
    public static void write(Namelist namelist, Path path, WriteOptions options) throws NamelistException {
        if (Files.exists(path) && !options.force()) {
            throw new NamelistException(NamelistErrorCode.FILE_ALREADY_EXISTS,
                    "File already exists: " + path + " (enable force to overwrite)");
        }
        writeText(path, namelist.toFortranString(options));
        log.info("Wrote {} group(s) to {}", namelist.size(), path);
    }

    /**
     * Writes a document in canonical form to a sink. The sink is flushed but not closed.
     * @param namelist The document.
     * @param out The sink.
     * @param options The write options.
     * @throws NamelistException with {@link NamelistErrorCode#IO_ERROR} if the sink fails.
     */
    public static void writeTo(Namelist namelist, Writer out, WriteOptions options) throws NamelistException {
        try {
            out.write(namelist.toFortranString(options));
            out.flush();
        } catch (IOException e) {
            throw new NamelistException(NamelistErrorCode.IO_ERROR, "Failed to write namelist", e);
        }
    }

    public static String toText(Namelist namelist) {
        return toText(namelist, WriteOptions.defaults());
    }

    public static String toText(Namelist namelist, WriteOptions options) {
        return namelist.toFortranString(options);
    }

    // endregion

    // region Patching

    /**
     * Applies a patch document to a copy of the original.
     * @param original The original document, left unchanged.
     * @param patch The patch.
     * @return The patched copy.
     */
    public static Namelist patch(Namelist original, Namelist patch) {
        Namelist result = original.copy();
        result.applyPatch(patch);
        return result;
    }

    /**
     * Rewrites template text with a patch applied, keeping its layout and comments.
     * @param template The template text.
     * @param patch The patch.
     * @param out The sink for the rewritten text. It is flushed but not closed.
     * @return The document the rewritten text describes.
     * @throws NamelistException if the template does not parse, a patch value is incompatible or the sink fails.
     */
    public static Namelist patchToWriter(String template, Namelist patch, Writer out) throws NamelistException {
        return new StreamingParser(template).parseAndPatch(out, patch);
    }

    /**
     * Rewrites template text with a patch applied.
     * @param template The template text.
     * @param patch The patch.
     * @return The rewritten text.
     * @throws NamelistException if the template does not parse or a patch value is incompatible.
     */
    public static String patchToString(String template, Namelist patch) throws NamelistException {
        StringWriter out = new StringWriter();
        patchToWriter(template, patch, out);
        return out.toString();
    }

    /**
     * Patches a namelist file, keeping its layout and comments.
     * @param input The template file.
     * @param patch The patch.
     * @param output The file to write; may be the input itself.
     * @return The patched document.
     * @throws NamelistException if a file cannot be read or written, or the patch fails.
     */
    public static Namelist patchFile(Path input, Namelist patch, Path output) throws NamelistException {
        String template = readText(input);
        StringWriter out = new StringWriter();
        Namelist result = new StreamingParser(template, ReadOptions.defaults().withFileName(input.toString()))
                .parseAndPatch(out, patch);
        writeText(output, out.toString());
        log.info("Patched {} into {}", input, output);
        return result;
    }

    /**
     * Patches a template file, optionally writing the result.
     * @param input The template file.
     * @param patch The patch.
     * @param output The file to write, or {@code null} to only compute the patched document.
     * @return The patched document.
     * @throws NamelistException with {@link NamelistErrorCode#MISSING_TEMPLATE_INFO} if {@code input} is
     *                           {@code null}, or as {@link #patchFile(Path, Namelist, Path)}.
     */
    public static Namelist patchWithTemplate(Path input, Namelist patch, Path output) throws NamelistException {
        if (input == null) {
            throw new NamelistException(NamelistErrorCode.MISSING_TEMPLATE_INFO,
                    "Patching with a template requires an input file");
        }
        if (output != null) {
            return patchFile(input, patch, output);
        }
        String template = readText(input);
        return new StreamingParser(template, ReadOptions.defaults().withFileName(input.toString()))
                .parseAndPatch(Writer.nullWriter(), patch);
    }

    // endregion

    private static String readText(Path path) throws NamelistException {
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new NamelistException(NamelistErrorCode.IO_ERROR, "Failed to read " + path, e);
        }
    }

    private static void writeText(Path path, String text) throws NamelistException {
        try {
            Files.writeString(path, text, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new NamelistException(NamelistErrorCode.IO_ERROR, "Failed to write " + path, e);
        }
    }
}
