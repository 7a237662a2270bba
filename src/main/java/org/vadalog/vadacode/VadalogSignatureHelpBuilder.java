package org.vadalog.vadacode;

import java.util.*;

/**
 * Derives one signature per atom name from the walked program. Sources, in
 * priority order: the first head call, facts, {@code @mapping}s of inputs,
 * body calls and finally vaDoc blocks, which refine or create signatures.
 */
public class VadalogSignatureHelpBuilder {

    public Map<String, SignatureHelp> buildFrom(VadalogTreeWalker walker) {
        Map<String, SignatureHelp> signatures = new LinkedHashMap<>();

        for (AtomCall call : walker.getAtomCalls()) {
            if (call.getCallType() == AtomCallType.HEAD && !signatures.containsKey(call.getName())) {
                List<SignatureTermHelp> terms = new ArrayList<>();
                for (VadalogToken term : call.getTerms()) {
                    SignatureTermHelp help = new SignatureTermHelp(term.getText(), null);
                    help.setToken(term);
                    help.setType(term.getKind());
                    terms.add(help);
                }
                signatures.put(call.getName(), signature(call, terms, SignatureSource.USAGE));
            }
        }

        for (AtomCall call : walker.getAtomCalls()) {
            if (call.getCallType() == AtomCallType.FACT && !signatures.containsKey(call.getName())) {
                signatures.put(call.getName(), signature(call, numberedTerms(call), SignatureSource.FACT));
            }
        }

        walker.getMappings().forEach((atomName, mappings) -> {
            if (!walker.getInputAtomNames().contains(atomName)) {
                return;
            }
            List<VadalogMapping> ordered = new ArrayList<>(mappings);
            ordered.sort(Comparator.comparingInt(VadalogMapping::getPosition));
            List<SignatureTermHelp> terms = new ArrayList<>();
            for (VadalogMapping mapping : ordered) {
                SignatureTermHelp help = new SignatureTermHelp(mapping.getColumnName(), null);
                help.setType(mapping.getColumnType());
                terms.add(help);
            }
            SignatureHelp help = new SignatureHelp(atomName, signatureText(atomName, terms), null, terms,
                    SignatureSource.INPUT);
            help.setToken(ordered.get(0).getToken());
            signatures.put(atomName, help);
        });

        for (AtomCall call : walker.getAtomCalls()) {
            if (call.getCallType() != AtomCallType.BODY) {
                continue;
            }
            SignatureHelp existing = signatures.get(call.getName());
            if (existing == null || (existing.getTerms().isEmpty() && !call.getTerms().isEmpty())) {
                signatures.put(call.getName(), signature(call, numberedTerms(call), SignatureSource.USAGE));
            }
        }

        walker.getVadocBlocks().forEach((atomName, blocks) -> {
            for (VadocBlock block : blocks) {
                applyVadoc(signatures, atomName, block);
            }
        });
        return signatures;
    }

    private static SignatureHelp signature(AtomCall call, List<SignatureTermHelp> terms, SignatureSource source) {
        SignatureHelp help = new SignatureHelp(call.getName(), signatureText(call.getName(), terms), null, terms, source);
        help.setToken(call.getAtom());
        return help;
    }

    private static List<SignatureTermHelp> numberedTerms(AtomCall call) {
        List<SignatureTermHelp> terms = new ArrayList<>();
        for (int i = 0; i < call.getTerms().size(); i++) {
            VadalogToken term = call.getTerms().get(i);
            SignatureTermHelp help = new SignatureTermHelp("Term" + (i + 1), null);
            help.setToken(term);
            help.setType(term.getKind());
            terms.add(help);
        }
        return terms;
    }

    static String signatureText(String name, List<SignatureTermHelp> terms) {
        StringJoiner joiner = new StringJoiner(", ", name + "(", ").");
        for (SignatureTermHelp term : terms) {
            joiner.add(term.getLabel());
        }
        return joiner.toString();
    }

    private static void applyVadoc(Map<String, SignatureHelp> signatures, String atomName, VadocBlock block) {
        List<VadocTag> termTags = new ArrayList<>();
        for (VadocTag tag : block.getTags()) {
            if (VadocParser.TERM.equals(tag.getTag())) {
                termTags.add(tag);
            }
        }
        String documentation = block.getDescription().isEmpty() ? null : block.getDescription();

        SignatureHelp help = signatures.get(atomName);
        if (help == null) {
            help = new SignatureHelp(atomName, atomName + "().", documentation, Collections.emptyList(),
                    SignatureSource.DOCUMENTATION);
            signatures.put(atomName, help);
        } else if (documentation != null) {
            help.setDocumentation(documentation);
        }

        List<SignatureTermHelp> terms = help.getTerms();
        for (int i = 0; i < termTags.size(); i++) {
            VadocTag tag = termTags.get(i);
            if (i >= terms.size()) {
                terms.add(new SignatureTermHelp(null, null));
            }
            SignatureTermHelp term = terms.get(i);
            if (tag.getName() != null) {
                term.setLabel(tag.getName());
            }
            if (!tag.getDescription().isEmpty()) {
                term.setDocumentation(tag.getDescription());
            }
            if (tag.getType() != null) {
                TokenKind type = VadalogTreeWalker.columnTypeOf(tag.getType());
                if (type != null) {
                    term.setType(type);
                }
            }
        }
        help.setSignature(signatureText(atomName, terms));
    }
}
