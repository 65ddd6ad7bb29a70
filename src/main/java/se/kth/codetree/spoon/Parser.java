package se.kth.codetree.spoon;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import se.kth.codetree.syntax.SourceLines;
import se.kth.codetree.util.LazyLogger;
import spoon.Launcher;
import spoon.compiler.Environment;
import spoon.reflect.CtModel;
import spoon.reflect.declaration.CtType;
import spoon.support.compiler.VirtualFile;

/**
 * Parses Java source files with Spoon and adapts the result to the syntax tree interface of the clause builder.
 */
public class Parser {
    public static final int COMPLIANCE_LEVEL = 17;

    private static final LazyLogger LOGGER = new LazyLogger(Parser.class);

    /**
     * Parse the contents of a single Java file. The module is named after the first type in the file.
     *
     * @param javaFileContents The contents of a single Java file.
     * @return The parsed source.
     */
    public static ParsedSource parse(String javaFileContents) {
        return parse(javaFileContents, null);
    }

    /**
     * Parse a Java file. The module is named after the file, without its extension.
     *
     * @param javaFile Path to a Java file.
     * @return The parsed source.
     */
    public static ParsedSource parse(Path javaFile) {
        String fileName = javaFile.getFileName().toString();
        String moduleName = fileName.endsWith(".java")
                ? fileName.substring(0, fileName.length() - ".java".length())
                : fileName;
        LOGGER.info(() -> "Parsing " + javaFile);
        return parse(read(javaFile), moduleName);
    }

    public static void setCodeTreeEnvironment(Environment env) {
        env.setNoClasspath(true);
        env.setCommentEnabled(false);
        env.setComplianceLevel(COMPLIANCE_LEVEL);
    }

    private static ParsedSource parse(String contents, String moduleName) {
        Launcher launcher = new Launcher();
        setCodeTreeEnvironment(launcher.getEnvironment());
        // parse from a virtual file so that the lines we index are exactly the ones Spoon saw
        launcher.addInputResource(new VirtualFile(contents));
        CtModel model = launcher.buildModel();

        List<CtType<?>> types = new ArrayList<>(model.getAllTypes());
        LOGGER.debug(() -> "Spoon model contains " + types.size() + " top-level types");

        SpoonSyntaxNode module = SpoonSyntaxNode.module(types, contents);
        String name = moduleName;
        if (name == null) {
            name = module.getBody().isEmpty() ? "<empty>" : module.getBody().get(0).getName();
        }
        return new ParsedSource(name, module, SourceLines.of(contents));
    }

    /**
     * Read the contents of a file.
     *
     * @param path Path to a file.
     * @return The contents of the file.
     */
    public static String read(Path path) {
        try {
            return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Error reading from " + path, e);
        }
    }
}
