package org.vadalog.vadacode;

import org.antlr.v4.runtime.*;
import org.antlr.v4.runtime.tree.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Walks a Vadalog parse tree, building the {@link ProgramGraph}, the call
 * records and the binding declarations of the program. {@link #analyseProgram()}
 * then runs the program-level checks and the analyzer pipeline.
 *
 * <p>The walker never throws on malformed trees: missing children simply
 * produce less structure.</p>
 */
public class VadalogTreeWalker extends VadalogBaseVisitor<Void> {
    private static final Logger log = LoggerFactory.getLogger(VadalogTreeWalker.class);

    private final Map<Integer, VadalogToken> tokens;
    private final CommonTokenStream tokenStream;
    private final String uri;
    private final VadocParser vadocParser = new VadocParser();

    private final ProgramGraph programGraph = new ProgramGraph();
    private final DependencyGraph dependencyGraph = new DependencyGraph();

    // Call sites
    private final List<AtomCall> atomCalls = new ArrayList<>();
    private final List<AnnotationCall> annotationCalls = new ArrayList<>();

    // Declarations
    private final Map<String, VadalogGenericBinding> bindings = new LinkedHashMap<>();
    private final Map<String, List<VadalogMapping>> mappings = new LinkedHashMap<>();
    private final Map<String, List<VadocBlock>> vadocBlocks = new LinkedHashMap<>();
    private final Set<String> exportedAtoms = new LinkedHashSet<>();

    // Atom name universe
    private final Set<String> atomNames = new LinkedHashSet<>();
    private final Set<String> atomNamesInBody = new LinkedHashSet<>();
    private final Set<String> headAtomNames = new LinkedHashSet<>();
    private final Set<String> factAtomNames = new LinkedHashSet<>();
    private final Set<String> inputAtomNames = new LinkedHashSet<>();
    private final Set<String> outputAtomNames = new LinkedHashSet<>();
    private final Set<String> temporalAtomNames = new LinkedHashSet<>();
    private final Map<String, List<VadalogToken>> atomTokens = new LinkedHashMap<>();
    private final Map<String, List<VadalogToken>> inputAtomTokens = new LinkedHashMap<>();
    private final Map<String, List<VadalogToken>> outputAtomTokens = new LinkedHashMap<>();

    // Tokens collected for the program-level diagnostics
    private final List<VadalogToken> emptyDefinitionTokens = new ArrayList<>();
    private final List<VadalogToken> duplicateOutputTokens = new ArrayList<>();
    private final List<VadalogToken> unknownColumnTypeTokens = new ArrayList<>();
    private final List<VadalogToken> egdTokens = new ArrayList<>();
    private final Set<VadalogToken> suppressedTokens = new HashSet<>();
    private final List<VadalogDiagnostic> walkDiagnostics = new ArrayList<>();

    // Walk state
    private int ruleCount = 0;
    private String ruleId;
    private final List<String> headAtomsOfRule = new ArrayList<>();
    private boolean visitingHead;
    private boolean visitingBody;
    private boolean visitingFact;
    private boolean visitingNegation;
    private boolean visitingCondition;
    private boolean visitingLeftHandSide;
    private boolean visitingEgd;
    private boolean visitingAnnotationBody;
    private int bodyConjunctiveQueryTerm = -1;
    private int conditionIndex = -1;
    private int egdIndex = -1;
    private int aggregationIndex = -1;
    private int termPosition = -1;
    private VadalogToken currentAtomToken;
    private AtomCall currentAtomCall;
    private AnnotationCall currentAnnotationCall;
    private String lastAtomName;
    private VadalogToken lastAtomToken;
    private boolean visitingTemporalAnnotation;
    private VadocBlock activeVadoc;

    // Analysis results
    private final List<ProgramGraphAnalyzer> analyzers = defaultAnalyzers();
    private List<VadalogDiagnostic> diagnostics;
    private List<VadalogToken> documentTokens;

    public VadalogTreeWalker(Map<Integer, VadalogToken> tokens, CommonTokenStream tokenStream, String uri) {
        this.tokens = tokens;
        this.tokenStream = tokenStream;
        this.uri = uri;
    }

    /**
     * The analyzer pipeline in execution order. Tagging passes come first.
     */
    static List<ProgramGraphAnalyzer> defaultAnalyzers() {
        return new ArrayList<>(List.of(
                new GroundSemanticTagger(),
                new NoFactOutputAnalyzer(),
                new BindOnUnknownAnalyzer(),
                new NoVariablesInFactAnalyzer(),
                new AnonymousVariablesAnalyzer(),
                new NegationAnalyzer(),
                new NoKeywordInAtomNamesAnalyzer(),
                new AssignedVariableUsedInSameConditionAnalyzer(),
                new ConditionVariablesAnalyzer(),
                new PlainDatalogFragmentAnalyzer(),
                new LinearFragmentAnalyzer(),
                new AfratiLinearFragmentAnalyzer(),
                new WardedFragmentAnalyzer(),
                new GuardedFragmentAnalyzer(),
                new WeaklyGuardedFragmentAnalyzer(),
                new FrontierGuardedFragmentAnalyzer(),
                new WeaklyFrontierGuardedFragmentAnalyzer(),
                new ShyFragmentAnalyzer()));
    }

    public void walk(ParseTree tree) {
        if (tree != null) {
            visit(tree);
        }
        log.debug("Walked {}: {} rules, {} atom calls, {} annotation calls",
                uri, ruleCount, atomCalls.size(), annotationCalls.size());
    }

    private VadalogToken tokenOf(Token symbol) {
        return symbol != null ? tokens.get(symbol.getTokenIndex()) : null;
    }

    private VadalogToken tokenOf(TerminalNode node) {
        return node != null ? tokenOf(node.getSymbol()) : null;
    }

    private static String unquote(String text) {
        return text.replace("\"", "");
    }

    // =====================================================================
    // CLAUSES
    // =====================================================================

    @Override
    public Void visitClause(VadalogParser.ClauseContext ctx) {
        activeVadoc = readVadoc(ctx.getStart());
        openRule(ctx);
        visitChildren(ctx);
        activeVadoc = null;
        return null;
    }

    private void openRule(ParserRuleContext ctx) {
        ruleId = "R" + (++ruleCount);
        headAtomsOfRule.clear();
        lastAtomName = null;
        lastAtomToken = null;
        conditionIndex = -1;
        egdIndex = -1;
        aggregationIndex = -1;
        bodyConjunctiveQueryTerm = -1;

        Token start = ctx.getStart();
        Token stop = ctx.getStop() != null ? ctx.getStop() : start;
        int stopLength = Math.max(0, stop.getStopIndex() - stop.getStartIndex() + 1);
        VadalogRange range = new VadalogRange(start.getLine() - 1, start.getCharPositionInLine(),
                stop.getLine() - 1, stop.getCharPositionInLine() + stopLength);
        programGraph.addRule(ruleId, range, uri);
    }

    /**
     * Reads the {@code %%} lines directly before a clause. A block declaring
     * exports or marked silent belongs to the program, not to the clause.
     */
    private VadocBlock readVadoc(Token start) {
        if (tokenStream == null || start == null || start.getTokenIndex() < 0) {
            return null;
        }
        List<Token> hidden = tokenStream.getHiddenTokensToLeft(start.getTokenIndex());
        if (hidden == null) {
            return null;
        }
        LinkedList<String> lines = new LinkedList<>();
        for (int i = hidden.size() - 1; i >= 0; i--) {
            Token comment = hidden.get(i);
            if (comment.getType() != VadalogLexer.DOC_COMMENT) {
                break;
            }
            lines.addFirst(comment.getText());
        }
        if (lines.isEmpty()) {
            return null;
        }

        VadocBlock block = vadocParser.parse(lines);
        boolean programScope = false;
        for (VadocTag tag : block.getTags()) {
            if (VadocParser.EXPORTS.equals(tag.getTag())) {
                if (tag.getName() != null) {
                    exportedAtoms.add(tag.getName());
                }
                programScope = true;
            } else if (VadocParser.SILENT.equals(tag.getTag())) {
                programScope = true;
            }
        }
        return programScope ? null : block;
    }

    private void attachVadoc(String atomName) {
        if (activeVadoc != null) {
            vadocBlocks.computeIfAbsent(atomName, k -> new ArrayList<>()).add(activeVadoc);
            activeVadoc = null;
        }
    }

    @Override
    public Void visitFact(VadalogParser.FactContext ctx) {
        visitingFact = true;
        visitChildren(ctx);
        visitingFact = false;
        return null;
    }

    @Override
    public Void visitHead(VadalogParser.HeadContext ctx) {
        visitingHead = true;
        visitChildren(ctx);
        visitingHead = false;
        return null;
    }

    @Override
    public Void visitBody(VadalogParser.BodyContext ctx) {
        visitingBody = true;
        bodyConjunctiveQueryTerm = 0;
        visitChildren(ctx);
        visitingBody = false;
        bodyConjunctiveQueryTerm = -1;
        return null;
    }

    @Override
    public Void visitLiteral(VadalogParser.LiteralContext ctx) {
        visitChildren(ctx);
        bodyConjunctiveQueryTerm++;
        return null;
    }

    @Override
    public Void visitNegLiteral(VadalogParser.NegLiteralContext ctx) {
        visitingNegation = true;
        visitChildren(ctx);
        visitingNegation = false;
        return null;
    }

    @Override
    public Void visitTemporalAnnotation(VadalogParser.TemporalAnnotationContext ctx) {
        if (lastAtomName != null) {
            temporalAtomNames.add(lastAtomName);
        }
        visitingTemporalAnnotation = true;
        visitChildren(ctx);
        visitingTemporalAnnotation = false;
        return null;
    }

    // =====================================================================
    // ATOMS AND TERMS
    // =====================================================================

    @Override
    public Void visitAtom(VadalogParser.AtomContext ctx) {
        VadalogToken token = ctx.predicate() != null ? tokenOf(ctx.predicate().getStart()) : null;
        if (token == null || !(visitingHead || visitingBody || visitingFact)) {
            return null;
        }
        String name = token.getText();
        token.reclassify(TokenKind.ATOM);
        atomNames.add(name);

        AtomCallType callType;
        ProgramGraph.AtomLocation location;
        if (visitingHead) {
            token.addTag(TokenTag.HEAD);
            headAtomNames.add(name);
            headAtomsOfRule.add(name);
            dependencyGraph.addNode(name);
            callType = AtomCallType.HEAD;
            location = ProgramGraph.AtomLocation.HEAD;
        } else if (visitingBody) {
            token.addTag(TokenTag.BODY);
            atomNamesInBody.add(name);
            dependencyGraph.addNode(name);
            for (String headAtom : headAtomsOfRule) {
                dependencyGraph.addDependency(name, headAtom);
            }
            callType = AtomCallType.BODY;
            location = ProgramGraph.AtomLocation.BODY;
        } else {
            token.addTag(TokenTag.DEFINITION);
            factAtomNames.add(name);
            dependencyGraph.addNode(name);
            callType = AtomCallType.FACT;
            location = ProgramGraph.AtomLocation.FACT;
        }
        if (!visitingBody) {
            attachVadoc(name);
        }
        atomTokens.computeIfAbsent(name, k -> new ArrayList<>()).add(token);
        programGraph.addAtomToken(name, token, bodyConjunctiveQueryTerm, ruleId, location, visitingNegation);

        currentAtomCall = new AtomCall(name, token, callType);
        atomCalls.add(currentAtomCall);
        currentAtomToken = token;
        termPosition = -1;
        for (VadalogParser.TermContext term : ctx.term()) {
            visit(term);
        }
        currentAtomToken = null;
        currentAtomCall = null;
        lastAtomName = name;
        lastAtomToken = token;
        return null;
    }

    @Override
    public Void visitTerm(VadalogParser.TermContext ctx) {
        if (visitingAnnotationBody) {
            VadalogToken token = termToken(ctx);
            if (currentAnnotationCall != null && token != null) {
                currentAnnotationCall.addTerm(token);
            }
            return null;
        }
        if (currentAtomToken != null) {
            registerAtomTerm(ctx);
            return null;
        }
        // Terms of conditions and EGDs
        return visitChildren(ctx);
    }

    private void registerAtomTerm(VadalogParser.TermContext ctx) {
        termPosition++;
        VadalogToken token = termToken(ctx);
        if (token == null) {
            return;
        }
        currentAtomCall.addTerm(token);

        if (ctx.varTerm() != null) {
            programGraph.addVariableToken(token, ruleId, currentAtomToken, bodyConjunctiveQueryTerm, termPosition,
                    visitingHead, visitingNegation);
        } else if (visitingBody && token.getKind().isLiteral()) {
            programGraph.addConstantToken(token, ruleId, currentAtomToken, bodyConjunctiveQueryTerm, termPosition,
                    false);
        }
    }

    /**
     * The token standing for a term. Sets and lists get a synthetic token
     * spanning the whole collection.
     */
    private VadalogToken termToken(VadalogParser.TermContext ctx) {
        if (ctx.listTerm() != null || ctx.setConstTerm() != null) {
            Token start = ctx.getStart();
            Token stop = ctx.getStop() != null ? ctx.getStop() : start;
            int length = Math.max(1, stop.getStopIndex() - start.getStartIndex() + 1);
            TokenKind kind = ctx.listTerm() != null ? TokenKind.LIST : TokenKind.SET;
            return new VadalogToken(start.getLine() - 1, start.getCharPositionInLine(), length, uri, ctx.getText(),
                    kind);
        }
        // Negative numbers start with a minus sign which has no token
        return ctx.getStop() != null ? tokenOf(ctx.getStop()) : tokenOf(ctx.getStart());
    }

    @Override
    public Void visitVarTerm(VadalogParser.VarTermContext ctx) {
        VadalogToken token = tokenOf(ctx.VAR());
        if (token == null || ruleId == null) {
            return null;
        }
        if (visitingTemporalAnnotation) {
            if (lastAtomToken != null) {
                programGraph.addTemporalVariableToken(token, ruleId, lastAtomToken, visitingHead);
            }
        } else if (visitingCondition) {
            programGraph.addConditionVariableToken(token, ruleId, conditionIndex, visitingLeftHandSide);
            visitingLeftHandSide = false;
        } else if (visitingEgd) {
            programGraph.addEGDVariableToken(token, ruleId, egdIndex);
        }
        return null;
    }

    // =====================================================================
    // CONDITIONS, EGDS AND AGGREGATIONS
    // =====================================================================

    @Override
    public Void visitCondition(VadalogParser.ConditionContext ctx) {
        conditionIndex++;
        programGraph.addCondition(ctx.getText(), ruleId, conditionIndex, ctx.eqCondition() != null);
        visitingCondition = true;
        visitChildren(ctx);
        visitingCondition = false;
        visitingLeftHandSide = false;
        bodyConjunctiveQueryTerm++;
        return null;
    }

    @Override
    public Void visitEqCondition(VadalogParser.EqConditionContext ctx) {
        visitingLeftHandSide = true;
        return visitChildren(ctx);
    }

    @Override
    public Void visitEgdHead(VadalogParser.EgdHeadContext ctx) {
        egdIndex++;
        VadalogToken eq = tokenOf(ctx.EQ());
        if (eq != null) {
            programGraph.addEGDToken(eq, ruleId, egdIndex);
            egdTokens.add(eq);
        }
        visitingEgd = true;
        visitChildren(ctx);
        visitingEgd = false;
        return null;
    }

    @Override
    public Void visitAggregationExpression(VadalogParser.AggregationExpressionContext ctx) {
        VadalogParser.AggregationContext aggregation = ctx.aggregation();
        if (aggregation == null || aggregation.getStart() == null) {
            return null;
        }
        aggregationIndex++;
        String type = aggregation.getStart().getText().toLowerCase();
        programGraph.addAggregation(aggregation.getText(), ruleId, type, aggregationIndex);

        VadalogParser.VarListContext varList = aggregation.getRuleContext(VadalogParser.VarListContext.class, 0);
        if (varList != null) {
            List<TerminalNode> contributors = varList.VAR();
            for (int i = 0; i < contributors.size(); i++) {
                VadalogToken contributor = tokenOf(contributors.get(i));
                if (contributor != null) {
                    programGraph.addContributorVariable(contributor, ruleId, aggregationIndex, i);
                }
            }
        }
        return visitChildren(ctx);
    }

    // =====================================================================
    // ANNOTATIONS
    // =====================================================================

    @Override
    public Void visitAnnotationBody(VadalogParser.AnnotationBodyContext ctx) {
        VadalogToken at = tokenOf(ctx.AT());
        if (at != null) {
            at.reclassify(TokenKind.ANNOTATION);
        }
        VadalogParser.AtomContext atom = ctx.atom();
        VadalogToken nameToken = atom != null && atom.predicate() != null ? tokenOf(atom.predicate().getStart()) : null;
        if (nameToken == null) {
            return null;
        }
        nameToken.reclassify(TokenKind.ANNOTATION);

        currentAnnotationCall = new AnnotationCall(nameToken);
        annotationCalls.add(currentAnnotationCall);
        visitingAnnotationBody = true;
        for (VadalogParser.TermContext term : atom.term()) {
            visit(term);
        }
        visitingAnnotationBody = false;
        List<VadalogToken> terms = currentAnnotationCall.getTerms();
        currentAnnotationCall = null;

        switch (nameToken.getText()) {
            case "output":
                declareOutput(nameToken, terms);
                break;
            case "input":
                declareInput(nameToken, terms);
                break;
            case "bind":
            case "qbind":
                declareBinding(nameToken, terms);
                break;
            case "mapping":
                declareMapping(nameToken, terms);
                break;
            case "post":
                if (isAtomNameTerm(terms)) {
                    programGraph.addPostAtomToken(terms.get(0), ruleId);
                    suppressedTokens.add(terms.get(0));
                }
                break;
            default:
                break;
        }
        return null;
    }

    private static boolean isAtomNameTerm(List<VadalogToken> terms) {
        return !terms.isEmpty() && terms.get(0).getKind() == TokenKind.STRING;
    }

    private void declareOutput(VadalogToken nameToken, List<VadalogToken> terms) {
        if (terms.isEmpty()) {
            emptyDefinitionTokens.add(nameToken);
            return;
        }
        if (!isAtomNameTerm(terms)) {
            return;
        }
        String atomName = unquote(terms.get(0).getText());
        VadalogToken atomToken = programGraph.addOutputAtomToken(terms.get(0), ruleId);
        suppressedTokens.add(terms.get(0));
        if (!outputAtomNames.add(atomName)) {
            duplicateOutputTokens.add(atomToken);
        }
        outputAtomTokens.computeIfAbsent(atomName, k -> new ArrayList<>()).add(atomToken);
        atomCalls.add(new AtomCall(atomName, atomToken, AtomCallType.OUTPUT));
    }

    private void declareInput(VadalogToken nameToken, List<VadalogToken> terms) {
        if (terms.isEmpty()) {
            emptyDefinitionTokens.add(nameToken);
            return;
        }
        if (!isAtomNameTerm(terms)) {
            return;
        }
        String atomName = unquote(terms.get(0).getText());
        VadalogToken atomToken = programGraph.addInputAtomToken(terms.get(0), ruleId);
        suppressedTokens.add(terms.get(0));
        inputAtomNames.add(atomName);
        dependencyGraph.addNode(atomName);
        inputAtomTokens.computeIfAbsent(atomName, k -> new ArrayList<>()).add(atomToken);
        atomCalls.add(new AtomCall(atomName, atomToken, AtomCallType.INPUT));
        attachVadoc(atomName);
    }

    private void declareBinding(VadalogToken nameToken, List<VadalogToken> terms) {
        if (terms.isEmpty()) {
            emptyDefinitionTokens.add(nameToken);
            return;
        }
        if (!isAtomNameTerm(terms)) {
            return;
        }
        String atomName = unquote(terms.get(0).getText());
        VadalogToken atomToken = programGraph.addBindingAtomToken(terms.get(0), ruleId);
        suppressedTokens.add(terms.get(0));

        String dataSource = termText(terms, 1);
        String outermost = termText(terms, 2);
        String last = termText(terms, 3);
        VadalogGenericBinding binding = "qbind".equals(nameToken.getText())
                ? new VadalogQueryBinding(atomToken, atomName, dataSource, outermost, last)
                : new VadalogBinding(atomToken, atomName, dataSource, outermost, last);
        bindings.put(atomName, binding);
    }

    private static String termText(List<VadalogToken> terms, int index) {
        return index < terms.size() ? unquote(terms.get(index).getText()) : null;
    }

    private void declareMapping(VadalogToken nameToken, List<VadalogToken> terms) {
        if (terms.isEmpty()) {
            emptyDefinitionTokens.add(nameToken);
            return;
        }
        if (!isAtomNameTerm(terms)) {
            return;
        }
        String atomName = unquote(terms.get(0).getText());
        VadalogToken atomToken = programGraph.addMappingAtomToken(terms.get(0), ruleId);
        suppressedTokens.add(terms.get(0));
        if (terms.size() < 4) {
            // Wrong arity is reported against the builtin signature
            return;
        }

        VadalogToken positionToken = terms.get(1);
        if (positionToken.getKind() != TokenKind.INT) {
            walkDiagnostics.add(VadalogDiagnostic.of(positionToken, DiagnosticCode.MAPPING_POSITION_MUST_BE_INDEX,
                    Map.of("position", positionToken.getText())));
            return;
        }
        int position;
        try {
            position = Integer.parseInt(positionToken.getText());
        } catch (NumberFormatException e) {
            log.debug("Mapping position {} out of range", positionToken.getText());
            walkDiagnostics.add(VadalogDiagnostic.of(positionToken, DiagnosticCode.MAPPING_POSITION_MUST_BE_INDEX,
                    Map.of("position", positionToken.getText())));
            return;
        }

        VadalogToken columnTypeToken = terms.get(3);
        TokenKind columnType = columnTypeOf(unquote(columnTypeToken.getText()));
        if (columnType == null) {
            unknownColumnTypeTokens.add(columnTypeToken);
            return;
        }
        mappings.computeIfAbsent(atomName, k -> new ArrayList<>())
                .add(new VadalogMapping(atomToken, atomName, position, termText(terms, 2), columnType));
    }

    static TokenKind columnTypeOf(String columnType) {
        switch (columnType.toLowerCase()) {
            case "string":
                return TokenKind.STRING;
            case "int":
            case "integer":
                return TokenKind.INT;
            case "double":
                return TokenKind.DOUBLE;
            case "boolean":
                return TokenKind.BOOLEAN;
            case "date":
                return TokenKind.DATE;
            case "list":
                return TokenKind.LIST;
            case "set":
                return TokenKind.SET;
            case "unknown":
                return TokenKind.UNKNOWN;
            default:
                return null;
        }
    }

    // =====================================================================
    // PROGRAM ANALYSIS
    // =====================================================================

    /**
     * Runs the program-level checks and the analyzer pipeline over the walked
     * program, then freezes token kinds.
     */
    public void analyseProgram() {
        if (diagnostics != null) {
            return;
        }
        List<VadalogDiagnostic> result = new ArrayList<>(walkDiagnostics);
        Set<String> declaredAtomNames = new LinkedHashSet<>(inputAtomNames);
        declaredAtomNames.addAll(factAtomNames);
        declaredAtomNames.addAll(headAtomNames);

        for (VadalogToken token : emptyDefinitionTokens) {
            result.add(VadalogDiagnostic.of(token, DiagnosticCode.ERR_EMPTY_DEFINITION));
        }

        List<VadalogToken> unusedAtomTokens = new ArrayList<>();
        atomTokens.forEach((name, atomTokensOfName) -> {
            if (!atomNamesInBody.contains(name) && !outputAtomNames.contains(name) && !exportedAtoms.contains(name)) {
                unusedAtomTokens.addAll(atomTokensOfName);
            }
        });
        // Document order
        unusedAtomTokens.sort(Comparator.comparingInt(VadalogToken::getLine).thenComparingInt(VadalogToken::getColumn));
        for (VadalogToken token : unusedAtomTokens) {
            result.add(VadalogDiagnostic.of(token, DiagnosticCode.ERR_UNUSED_ATOM, Map.of("atom", token.getText())));
        }

        for (String name : inputAtomNames) {
            for (VadalogToken token : atomTokens.getOrDefault(name, Collections.emptyList())) {
                if (token.hasTag(TokenTag.HEAD)) {
                    result.add(VadalogDiagnostic.of(token, DiagnosticCode.ERR_INPUT_ATOM_IN_HEAD_0,
                            Map.of("atom", name)));
                }
            }
        }

        for (VadalogToken token : unknownColumnTypeTokens) {
            result.add(VadalogDiagnostic.of(token, DiagnosticCode.ERR_UNKNOWN_MAPPING_COLUMN_TYPE,
                    Map.of("columnType", token.getText())));
        }

        for (String name : atomNames) {
            if (!declaredAtomNames.contains(name)) {
                for (VadalogToken token : atomTokens.get(name)) {
                    result.add(VadalogDiagnostic.of(token, DiagnosticCode.ERR_UNDECLARED_ATOM_0,
                            Map.of("atom", name)));
                }
            }
        }

        for (VadalogToken token : duplicateOutputTokens) {
            result.add(VadalogDiagnostic.of(token, DiagnosticCode.ERR_ATOM_0_ALREADY_OUTPUT,
                    Map.of("atom", token.getText())));
        }

        outputAtomTokens.forEach((name, outputTokens) -> {
            if (!declaredAtomNames.contains(name)) {
                for (VadalogToken token : outputTokens) {
                    result.add(VadalogDiagnostic.of(token, DiagnosticCode.ERR_NON_EXISTING_OUTPUT_0,
                            Map.of("atom", name)));
                }
            }
        });

        inputAtomTokens.forEach((name, inputTokens) -> {
            if (!bindings.containsKey(name)) {
                for (VadalogToken token : inputTokens) {
                    result.add(VadalogDiagnostic.of(token, DiagnosticCode.ERR_NO_BINDINGS_FOR_INPUT_0,
                            Map.of("atom", name)));
                }
            }
        });

        outputAtomTokens.forEach((name, outputTokens) -> {
            if (!bindings.containsKey(name)) {
                for (VadalogToken token : outputTokens) {
                    result.add(VadalogDiagnostic.of(token, DiagnosticCode.NO_BINDINGS_FOR_OUTPUT_0,
                            Map.of("atom", name)));
                }
            }
        });

        markTemporalAtoms();

        for (VadalogGenericBinding binding : bindings.values()) {
            List<VadalogToken> inputTokens = inputAtomTokens.get(binding.getAtomName());
            binding.setInput(inputTokens != null);
            binding.setInputToken(inputTokens != null ? inputTokens.get(0) : null);
        }

        for (VadalogToken token : egdTokens) {
            result.add(VadalogDiagnostic.of(token, DiagnosticCode.HINT_EGD_0_1));
        }

        programGraph.analyze();
        List<VadalogDiagnostic> analyzerDiagnostics = new ArrayList<>();
        for (ProgramGraphAnalyzer analyzer : analyzers) {
            analyzer.analyze(programGraph);
            analyzerDiagnostics.addAll(analyzer.getDiagnostics());
        }

        for (VadalogToken token : programGraph.getUndeclaredVariableTokens()) {
            result.add(VadalogDiagnostic.of(token, DiagnosticCode.UNDECLARED_VARIABLE,
                    Map.of("variable", token.getText())));
        }
        result.addAll(analyzerDiagnostics);

        for (VadalogToken token : programGraph.getMarkedNullVariableTokens()) {
            token.addModifier(TokenModifier.EXISTENTIAL);
        }

        documentTokens = buildDocumentTokens();
        diagnostics = result;
        log.debug("Analysed {}: {} diagnostics, {} tokens", uri, diagnostics.size(), documentTokens.size());
    }

    private void markTemporalAtoms() {
        for (String name : temporalAtomNames) {
            dependencyGraph.markTemporal(name);
        }
        Set<String> temporal = dependencyGraph.getTemporalNodes();
        programGraph.getTokenNodesOfAtoms(temporal, ProgramGraph.RulePart.ALL).values()
                .forEach(tokenNodes -> tokenNodes.forEach(node -> node.getToken().addModifier(TokenModifier.TEMPORAL)));
    }

    private List<VadalogToken> buildDocumentTokens() {
        for (VadalogToken token : tokens.values()) {
            token.freeze();
        }
        List<VadalogToken> result = new ArrayList<>();
        result.addAll(programGraph.getVariableTokens());
        result.addAll(programGraph.getAtomTokens());
        for (VadalogToken token : tokens.values()) {
            if (token.getKind() != TokenKind.VARIABLE && token.getKind() != TokenKind.ATOM
                    && !suppressedTokens.contains(token)) {
                result.add(token);
            }
        }
        for (VadalogToken token : result) {
            token.freeze();
        }
        result.sort(VadalogToken.BY_POSITION);
        return Collections.unmodifiableList(result);
    }

    private void checkAnalysed() {
        if (diagnostics == null) {
            throw new IllegalStateException("Program not analysed yet, call analyseProgram() first");
        }
    }

    // =====================================================================
    // ACCESSORS
    // =====================================================================

    /**
     * @throws IllegalStateException before {@link #analyseProgram()}
     */
    public List<VadalogDiagnostic> getDiagnostics() {
        checkAnalysed();
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Document tokens sorted by position, with variable and atom tokens
     * carrying their analysis attributes.
     *
     * @throws IllegalStateException before {@link #analyseProgram()}
     */
    public List<VadalogToken> getTokens() {
        checkAnalysed();
        return documentTokens;
    }

    public ProgramGraph getProgramGraph() { return programGraph; }
    public DependencyGraph getDependencyGraph() { return dependencyGraph; }
    public List<ProgramGraphAnalyzer> getAnalyzers() { return Collections.unmodifiableList(analyzers); }

    public List<AtomCall> getAtomCalls() { return Collections.unmodifiableList(atomCalls); }
    public List<AnnotationCall> getAnnotationCalls() { return Collections.unmodifiableList(annotationCalls); }

    public Map<String, VadalogGenericBinding> getBindings() { return Collections.unmodifiableMap(bindings); }
    public Map<String, List<VadalogMapping>> getMappings() { return Collections.unmodifiableMap(mappings); }
    public Map<String, List<VadocBlock>> getVadocBlocks() { return Collections.unmodifiableMap(vadocBlocks); }
    public Set<String> getExportedAtoms() { return Collections.unmodifiableSet(exportedAtoms); }

    public Set<String> getAtomNames() { return Collections.unmodifiableSet(atomNames); }
    public Set<String> getInputAtomNames() { return Collections.unmodifiableSet(inputAtomNames); }
    public Set<String> getOutputAtomNames() { return Collections.unmodifiableSet(outputAtomNames); }
}
