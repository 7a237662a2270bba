package org.vadalog.vadacode;

import java.util.*;

/**
 * Signatures of the builtin annotations. A term label ending with {@code ?}
 * is optional.
 */
public final class VadalogBuiltins {

    private static final Map<String, SignatureHelp> ANNOTATIONS = new LinkedHashMap<>();

    static {
        register("bind", "Binds an input or output atom to a data source.",
                term("atomName", "Name of the atom to bind."),
                term("dataSource", "Name of the data source."),
                term("outermostContainer", "Outermost container, e.g. the database or directory."),
                term("innermostContainer", "Innermost container, e.g. the table or file."));
        register("implement", "Implements an atom with an external function.",
                term("implementationName", "Name of the implementation."),
                term("language", "Language of the implementation."),
                term("module", "Module containing the function."),
                term("functionName", "Name of the function."));
        register("include", "Includes a module.",
                term("moduleName", "Name of the module to include."));
        register("input", "Declares an atom whose facts are read from a data source.",
                term("atomName", "Name of the input atom."));
        register("library", "Imports a library under an alias.",
                term("alias", "Alias used to call the library functions."),
                term("libraryName", "Name of the library."),
                term("methodName?", "Method to call."),
                term("parameterString?", "Parameters passed to the library."));
        register("relaxedSafety", "Relaxes the safety checks of the reasoner.");
        register("output", "Declares an atom whose facts are returned by the reasoning.",
                term("atomName", "Name of the output atom."));
        register("mapping", "Maps a term of a bound atom to a column of the data source.",
                term("atomName", "Name of the atom."),
                term("positionInAtom", "0-based position of the term in the atom."),
                term("columnName", "Name of the column."),
                term("columnType", "Type of the column."));
        register("module", "Declares the module of the program.",
                term("moduleName", "Name of the module."));
        register("post", "Post-processes the facts of an output atom.",
                term("atomName", "Name of the atom."),
                term("directive", "Post-processing directive, e.g. orderby(1)."));
        register("qbind", "Binds an input atom to the result of a query.",
                term("atomName", "Name of the atom to bind."),
                term("data source", "Name of the data source."),
                term("outermost container", "Outermost container, e.g. the database."),
                term("query", "Query producing the facts."));
        register("saveChaseGraph", "Saves the chase graph of the reasoning.");
    }

    private VadalogBuiltins() {
    }

    private static SignatureTermHelp term(String label, String documentation) {
        return new SignatureTermHelp(label, documentation);
    }

    private static void register(String name, String documentation, SignatureTermHelp... terms) {
        StringJoiner labels = new StringJoiner(", ", "@" + name + "(", ").");
        for (SignatureTermHelp term : terms) {
            labels.add(term.getLabel());
        }
        String signature = terms.length == 0 ? "@" + name + "." : labels.toString();
        ANNOTATIONS.put(name, new SignatureHelp(name, signature, documentation, Arrays.asList(terms),
                SignatureSource.BUILTIN));
    }

    /**
     * @return the builtin annotation signature, or {@code null} for an unknown annotation
     */
    public static SignatureHelp getAnnotation(String name) {
        return ANNOTATIONS.get(name);
    }

    public static Collection<SignatureHelp> getAnnotations() {
        return Collections.unmodifiableCollection(ANNOTATIONS.values());
    }
}
