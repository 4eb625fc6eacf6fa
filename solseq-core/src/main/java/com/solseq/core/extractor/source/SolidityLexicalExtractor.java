package com.solseq.core.extractor.source;

import com.solseq.core.extractor.ExtractionResult;
import com.solseq.core.extractor.base.AbstractRegexExtractor;
import com.solseq.core.model.BodyEffect;
import com.solseq.core.model.ContractKind;
import com.solseq.core.model.ContractUnit;
import com.solseq.core.model.EventUnit;
import com.solseq.core.model.FunctionUnit;
import com.solseq.core.model.Parameter;
import com.solseq.core.model.StateVariable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.MatchResult;
import java.util.stream.Collectors;

import static com.solseq.core.extractor.source.SolidityPatterns.BASE_NAME;
import static com.solseq.core.extractor.source.SolidityPatterns.DECLARATION_HEADER;
import static com.solseq.core.extractor.source.SolidityPatterns.FUNCTION_TYPE_VARIABLE;
import static com.solseq.core.extractor.source.SolidityPatterns.IGNORED_MEMBER_KEYWORDS;
import static com.solseq.core.extractor.source.SolidityPatterns.LEADING_WORD;

/**
 * Extracts contract drafts directly from Solidity source text, without a compiler.
 *
 * <p>The extractor is a small state machine over brace depth and keyword anchors:
 * <ol>
 *   <li>Top level: {@code contract}, {@code interface}, {@code library} and
 *       {@code abstract contract} headers at depth 0, with their {@code is} lists.</li>
 *   <li>Declaration body: members are cut at depth 0, each ending at {@code ;} or at
 *       the brace closing its block. The leading keyword decides what the member is;
 *       a member without one is read as a state variable.</li>
 *   <li>Function bodies: handed to {@link SourceStatementClassifier}.</li>
 * </ol>
 *
 * <p>Extraction is approximate and never throws for malformed source: an unclosed
 * block runs to the end of the buffer and is reported as a warning, and unrecognised
 * members are skipped.
 */
public class SolidityLexicalExtractor extends AbstractRegexExtractor<List<SourceBuffer>> {

    private static final String EXTRACTOR_ID = "solidity-source";
    private static final String EXTRACTOR_DISPLAY_NAME = "Solidity Source Extractor";

    private static final Set<String> FUNCTION_KEYWORDS = Set.of("function", "constructor", "fallback", "receive");

    @Override
    public String getId() {
        return EXTRACTOR_ID;
    }

    @Override
    public String getDisplayName() {
        return EXTRACTOR_DISPLAY_NAME;
    }

    @Override
    public ExtractionResult extract(List<SourceBuffer> buffers) {
        Objects.requireNonNull(buffers, "buffers must not be null");
        if (buffers.isEmpty()) {
            return emptyResult();
        }

        List<String> warnings = new ArrayList<>();
        List<Declaration> declarations = new ArrayList<>();
        for (SourceBuffer buffer : buffers) {
            log.debug("Scanning source buffer: {}", buffer.sourceId());
            declarations.addAll(scanDeclarations(buffer, new SourceText(buffer.text()), warnings));
        }

        Map<String, List<String>> basesByContract = new HashMap<>();
        Map<String, Set<String>> variablesByContract = new HashMap<>();
        for (Declaration declaration : declarations) {
            basesByContract.computeIfAbsent(declaration.name(), key -> new ArrayList<>()).addAll(declaration.bases());
            variablesByContract.computeIfAbsent(declaration.name(), key -> new LinkedHashSet<>())
                .addAll(declaration.stateVariables().stream().map(StateVariable::name).toList());
        }

        List<ContractUnit> contracts = new ArrayList<>();
        for (Declaration declaration : declarations) {
            Set<String> visibleVariables = visibleNames(declaration.name(), basesByContract, variablesByContract);
            contracts.add(complete(declaration, visibleVariables, warnings));
        }
        return buildResult(contracts, warnings);
    }

    // ==================== Top level ====================

    private List<Declaration> scanDeclarations(SourceBuffer buffer, SourceText text, List<String> warnings) {
        List<Declaration> declarations = new ArrayList<>();
        int resumeAt = 0;
        for (MatchResult header : findMatches(DECLARATION_HEADER, text.mask())) {
            if (header.start() < resumeAt || text.depthAt(header.start()) != 0) {
                continue;
            }
            String name = extractGroup(header, 3);
            ContractKind kind = extractGroup(header, 1) != null
                ? ContractKind.ABSTRACT_CONTRACT
                : ContractKind.fromKeyword(extractGroup(header, 2));

            int open = header.end() - 1;
            int close = text.matchingBrace(open);
            if (close < 0) {
                warnings.add("Unbalanced braces in " + kind.keyword() + " " + name + " (" + buffer.sourceId()
                    + "); body truncated at end of input");
                close = text.length();
            }

            List<String> bases = parseBases(extractGroup(header, 4), name, warnings);
            List<Member> members = scanMembers(text, open + 1, close, name, buffer.sourceId(), warnings);

            List<StateVariable> stateVariables = new ArrayList<>();
            List<EventUnit> events = new ArrayList<>();
            List<Member> functions = new ArrayList<>();
            for (Member member : members) {
                classifyMember(member, name, stateVariables, events, functions);
            }

            log.debug("Found {} {} in {} ({} members)", kind.keyword(), name, buffer.sourceId(), members.size());
            declarations.add(new Declaration(name, kind, bases, buffer.sourceId(), text, stateVariables, events, functions));
            resumeAt = close + 1;
        }
        return declarations;
    }

    private List<String> parseBases(String inheritance, String contractName, List<String> warnings) {
        if (inheritance == null || inheritance.isBlank()) {
            return List.of();
        }
        Set<String> bases = new LinkedHashSet<>();
        for (String specifier : SignatureParser.splitTopLevel(inheritance)) {
            MatchResult base = findFirst(BASE_NAME, specifier);
            if (base == null) {
                continue;
            }
            if (!bases.add(base.group(1))) {
                warnings.add("Duplicate base '" + base.group(1) + "' in inheritance list of " + contractName + " ignored");
            }
        }
        return List.copyOf(bases);
    }

    // ==================== Declaration body ====================

    private List<Member> scanMembers(SourceText text, int start, int end, String contractName,
                                     String sourceId, List<String> warnings) {
        String mask = text.mask();
        List<Member> members = new ArrayList<>();
        int memberStart = start;
        int i = start;
        while (i < end) {
            char c = mask.charAt(i);
            if (c == ';') {
                members.add(new Member(header(text, memberStart, i), -1, -1));
                memberStart = i + 1;
                i++;
            } else if (c == '{') {
                int close = text.matchingBrace(i);
                if (close < 0 || close > end) {
                    warnings.add("Unbalanced braces in member of " + contractName + " (" + sourceId
                        + "); member truncated at end of declaration");
                    close = end;
                }
                members.add(new Member(header(text, memberStart, i), i + 1, close));
                memberStart = close + 1;
                i = close + 1;
            } else if (c == '(') {
                int close = text.matchingParen(i);
                i = close < 0 || close >= end ? end : close + 1;
            } else {
                i++;
            }
        }
        if (memberStart < end && !mask.substring(memberStart, end).isBlank()) {
            log.debug("Ignoring unterminated trailing member in {}: {}", contractName, header(text, memberStart, end));
        }
        return members;
    }

    private static String header(SourceText text, int start, int end) {
        return text.code().substring(start, end).trim().replaceAll("\\s+", " ");
    }

    private void classifyMember(Member member, String contractName, List<StateVariable> stateVariables,
                                List<EventUnit> events, List<Member> functions) {
        MatchResult leading = findFirst(LEADING_WORD, member.header());
        String keyword = leading == null ? "" : leading.group(1);

        if (FUNCTION_KEYWORDS.contains(keyword) && !isFunctionTypeVariable(member)) {
            functions.add(member);
        } else if ("event".equals(keyword)) {
            SignatureParser.parseEvent(member.header()).ifPresentOrElse(
                events::add,
                () -> log.debug("Skipping unparseable event in {}: {}", contractName, member.header()));
        } else if (IGNORED_MEMBER_KEYWORDS.contains(keyword)) {
            log.debug("Skipping {} member in {}", keyword, contractName);
        } else if (!member.hasBody() && !member.header().isEmpty()) {
            SignatureParser.parseStateVariable(member.header()).ifPresentOrElse(
                stateVariables::add,
                () -> log.debug("Skipping unrecognised member in {}: {}", contractName, member.header()));
        } else if (!member.header().isEmpty()) {
            log.debug("Skipping unrecognised block member in {}: {}", contractName, member.header());
        }
    }

    private boolean isFunctionTypeVariable(Member member) {
        return !member.hasBody() && matches(FUNCTION_TYPE_VARIABLE, member.header());
    }

    // ==================== Function bodies ====================

    private ContractUnit complete(Declaration declaration, Set<String> visibleVariables, List<String> warnings) {
        Set<String> eventNames = declaration.events().stream().map(EventUnit::name).collect(Collectors.toSet());
        List<FunctionUnit> functions = new ArrayList<>();
        for (Member member : declaration.functions()) {
            Optional<SignatureParser.FunctionSignature> parsed =
                SignatureParser.parseFunction(member.header(), declaration.name());
            if (parsed.isEmpty()) {
                warnings.add("Skipped unparseable function header in " + declaration.name() + ": " + member.header());
                continue;
            }
            SignatureParser.FunctionSignature signature = parsed.get();

            Set<String> localNames = new LinkedHashSet<>();
            signature.parameters().stream().filter(Parameter::isNamed).forEach(p -> localNames.add(p.name()));
            signature.returns().stream().filter(Parameter::isNamed).forEach(p -> localNames.add(p.name()));

            List<BodyEffect> effects = member.hasBody()
                ? SourceStatementClassifier.classify(declaration.text(), member.bodyStart(), member.bodyEnd(),
                    visibleVariables, localNames, eventNames)
                : List.of();

            functions.add(new FunctionUnit(
                signature.name(),
                signature.kind(),
                signature.visibility(),
                signature.mutability(),
                signature.parameters(),
                signature.returns(),
                effects
            ));
        }

        return new ContractUnit(
            declaration.name(),
            declaration.kind(),
            declaration.bases(),
            declaration.origin(),
            declaration.stateVariables(),
            functions,
            declaration.events()
        );
    }

    /**
     * A member of a declaration body: its header and, for block members, the body range.
     */
    private record Member(String header, int bodyStart, int bodyEnd) {
        boolean hasBody() {
            return bodyStart >= 0;
        }
    }

    private record Declaration(
        String name,
        ContractKind kind,
        List<String> bases,
        String origin,
        SourceText text,
        List<StateVariable> stateVariables,
        List<EventUnit> events,
        List<Member> functions
    ) {
    }
}
