package org.vadalog.vadacode;

import org.antlr.v4.runtime.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.*;
import java.util.function.Predicate;

/**
 * One open Vadalog program. Every {@link #refresh()} re-parses and
 * re-analyzes the whole text and replaces all derived state.
 *
 * <p>Not thread-safe: callers must serialize the refreshes of a document.</p>
 */
public class VadalogDocument {
    private static final Logger log = LoggerFactory.getLogger(VadalogDocument.class);

    private final String uri;
    private final VadalogSettings settings;
    private String text;
    private Fragment selectedFragment;

    // Derived state, replaced by refresh()
    private List<VadalogDiagnostic> diagnostics = Collections.emptyList();
    private List<VadalogDiagnostic> fragmentViolationDiagnostics = Collections.emptyList();
    private List<VadalogToken> documentTokens = Collections.emptyList();
    private Map<String, SignatureHelp> signatureHelps = Collections.emptyMap();
    private Map<String, VadalogGenericBinding> bindings = Collections.emptyMap();
    private VadalogTreeWalker walker;

    public VadalogDocument(String uri, String text, VadalogSettings settings) {
        this.uri = uri;
        this.text = text;
        this.settings = settings;
        this.selectedFragment = settings.getDefaultFragment();
    }

    public VadalogDocument(String uri, String text) {
        this(uri, text, VadalogSettings.defaults());
    }

    public String getUri() { return uri; }
    public String getText() { return text; }
    public VadalogSettings getSettings() { return settings; }

    /**
     * Replaces the source text. Call {@link #refresh()} afterwards.
     */
    public void setText(String text) {
        this.text = text;
    }

    public Fragment getSelectedFragment() { return selectedFragment; }

    /**
     * Changes the fragment diagnostics are filtered for. Call {@link #refresh()}
     * afterwards, diagnostics are stale until then.
     */
    public void setSelectedFragment(Fragment selectedFragment) {
        this.selectedFragment = Objects.requireNonNull(selectedFragment, "selectedFragment");
    }

    // =====================================================================
    // LIFECYCLE
    // =====================================================================

    public void refresh() {
        log.debug("Refreshing {} for fragment {}", uri, selectedFragment);
        VadalogLexer lexer = new VadalogLexer(CharStreams.fromString(text));
        VadalogLexerErrorListener lexerErrors = setupErrorHandling(lexer);
        CommonTokenStream tokenStream = new CommonTokenStream(lexer);
        Map<Integer, VadalogToken> tokens = new VadalogTokensBuilder().buildFrom(tokenStream, uri);

        VadalogParser parser = new VadalogParser(tokenStream);
        VadalogParserErrorListener parserErrors = setupErrorHandling(parser);
        VadalogParser.ProgramContext tree = parser.program();

        List<VadalogDiagnostic> syntaxDiagnostics = new ArrayList<>(lexerErrors.getDiagnostics());
        syntaxDiagnostics.addAll(parserErrors.getDiagnostics());

        List<VadalogDiagnostic> allDiagnostics = new ArrayList<>();
        VadalogTreeWalker newWalker = new VadalogTreeWalker(tokens, tokenStream, uri);
        Map<String, SignatureHelp> newSignatureHelps = Collections.emptyMap();
        List<VadalogToken> newTokens = Collections.emptyList();
        try {
            newWalker.walk(tree);
            newWalker.analyseProgram();
            newSignatureHelps = new VadalogSignatureHelpBuilder().buildFrom(newWalker);
            allDiagnostics.addAll(newWalker.getDiagnostics());
            allDiagnostics.addAll(VadalogCallDiagnostics.checkAnnotations(newWalker.getAnnotationCalls()));
            allDiagnostics.addAll(VadalogCallDiagnostics.checkAtoms(newWalker.getAtomCalls(), newSignatureHelps));
            newTokens = newWalker.getTokens();
        } catch (RuntimeException e) {
            if (settings.isStrict()) {
                throw e;
            }
            log.error("Analysis of {} failed, only syntax diagnostics are reported", uri, e);
            allDiagnostics.clear();
        }
        allDiagnostics.addAll(syntaxDiagnostics);

        List<VadalogDiagnostic> violations = new ArrayList<>();
        List<VadalogDiagnostic> visible = new ArrayList<>();
        Set<Fragment> applicable = FragmentContainment.applicableFragments(true).get(selectedFragment);
        for (VadalogDiagnostic diagnostic : allDiagnostics) {
            Fragment violation = diagnostic.getFragmentViolation();
            if (violation != null) {
                violations.add(diagnostic);
            }
            if (violation == null || applicable.contains(violation)) {
                visible.add(diagnostic);
            }
        }

        walker = newWalker;
        diagnostics = Collections.unmodifiableList(visible);
        fragmentViolationDiagnostics = Collections.unmodifiableList(violations);
        documentTokens = newTokens;
        signatureHelps = Collections.unmodifiableMap(newSignatureHelps);
        bindings = newWalker.getBindings();
        log.debug("Refreshed {}: {} visible diagnostics out of {}", uri, visible.size(), allDiagnostics.size());
    }

    /**
     * Selects the most specific fragment the program still belongs to and
     * refreshes the diagnostics for it.
     */
    public Fragment autoDetectFragment() {
        selectedFragment = Fragment.SHOW_ALL_VIOLATIONS;
        refresh();
        selectedFragment = FragmentContainment.detectFragment(fragmentViolationDiagnostics);
        log.debug("Detected fragment {} for {}", selectedFragment, uri);
        refresh();
        return selectedFragment;
    }

    private VadalogLexerErrorListener setupErrorHandling(VadalogLexer lexer) {
        VadalogLexerErrorListener listener = new VadalogLexerErrorListener(uri);
        lexer.removeErrorListeners();
        lexer.addErrorListener(listener);
        return listener;
    }

    private VadalogParserErrorListener setupErrorHandling(VadalogParser parser) {
        VadalogParserErrorListener listener = new VadalogParserErrorListener(uri);
        parser.removeErrorListeners();
        parser.addErrorListener(listener);
        return listener;
    }

    // =====================================================================
    // RESULTS
    // =====================================================================

    /** Diagnostics visible for the selected fragment. */
    public List<VadalogDiagnostic> getDiagnostics() { return diagnostics; }

    /** Every fragment violation found by the last refresh, whatever the selected fragment. */
    public List<VadalogDiagnostic> getFragmentViolationDiagnostics() { return fragmentViolationDiagnostics; }

    public List<VadalogToken> getDocumentTokens() { return documentTokens; }
    public Map<String, SignatureHelp> getSignatureHelps() { return signatureHelps; }
    public Map<String, VadalogGenericBinding> getBindings() { return bindings; }

    /**
     * The walker of the last refresh, {@code null} before the first one.
     */
    public VadalogTreeWalker getWalker() { return walker; }

    public VadalogToken findToken(int line, int character) {
        return findToken(line, character, token -> true);
    }

    /**
     * The first document token at the 0-based position that satisfies the
     * predicate, or {@code null}.
     */
    public VadalogToken findToken(int line, int character, Predicate<VadalogToken> predicate) {
        for (VadalogToken token : documentTokens) {
            if (token.contains(line, character) && predicate.test(token)) {
                return token;
            }
        }
        return null;
    }

    // =====================================================================
    // COMMAND LINE
    // =====================================================================

    public static void main(String[] args) {
        if (args.length < 1) {
            System.err.println("Usage: java VadalogDocument <vada-file> [--fragment <label>|--auto-detect]");
            System.exit(1);
        }

        String file = args[0];
        VadalogSettings settings = VadalogSettings.load();
        Fragment fragment = null;
        boolean autoDetect = false;
        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--fragment":
                    if (i + 1 >= args.length) {
                        System.err.println("--fragment requires a fragment label");
                        System.exit(1);
                    }
                    fragment = Fragment.fromLabel(args[++i]);
                    break;
                case "--auto-detect":
                    autoDetect = true;
                    break;
                default:
                    System.err.println("Unknown option: " + args[i]);
                    System.exit(1);
            }
        }

        try {
            Path path = Paths.get(file);
            VadalogDocument document = new VadalogDocument(path.toUri().toString(),
                    Files.readString(path, StandardCharsets.UTF_8), settings);
            if (fragment != null) {
                document.setSelectedFragment(fragment);
            }
            if (autoDetect) {
                System.out.println("Detected fragment: " + document.autoDetectFragment());
            } else {
                document.refresh();
            }
            printDiagnostics(file, document.getDiagnostics());
        } catch (IOException e) {
            System.err.println("Cannot read " + file + ": " + e.getMessage());
            System.exit(1);
        }
    }

    private static void printDiagnostics(String file, List<VadalogDiagnostic> diagnostics) {
        for (VadalogDiagnostic diagnostic : diagnostics) {
            VadalogRange range = diagnostic.getRange();
            System.out.printf("%s:%d:%d: %s [%s] %s%s%n", file, range.getStartLine() + 1,
                    range.getStartCharacter() + 1, diagnostic.getSeverity(), diagnostic.getCode(),
                    diagnostic.getMessage(),
                    diagnostic.getFragmentViolation() != null ? " (" + diagnostic.getFragmentViolation() + ")" : "");
        }
        System.out.println(diagnostics.size() + " diagnostic(s)");
    }
}
