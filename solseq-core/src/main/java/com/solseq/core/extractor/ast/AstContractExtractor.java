package com.solseq.core.extractor.ast;

import com.solseq.core.ast.AstDocument;
import com.solseq.core.ast.AstNode;
import com.solseq.core.ast.NodeAccessor;
import com.solseq.core.ast.SolcNodeAccessor;
import com.solseq.core.extractor.ExtractionResult;
import com.solseq.core.extractor.base.AbstractExtractor;
import com.solseq.core.model.BodyEffect;
import com.solseq.core.model.ContractKind;
import com.solseq.core.model.ContractUnit;
import com.solseq.core.model.EventParameter;
import com.solseq.core.model.EventUnit;
import com.solseq.core.model.FunctionKind;
import com.solseq.core.model.FunctionUnit;
import com.solseq.core.model.Parameter;
import com.solseq.core.model.StateMutability;
import com.solseq.core.model.StateVariable;
import com.solseq.core.model.Visibility;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Extracts contract drafts from a solc AST document.
 *
 * <p>All node reads go through a {@link NodeAccessor}, so compact and legacy ASTs are
 * handled by the same code. Extraction runs in two passes: the first collects every
 * ContractDefinition with its state variables and bases, the second classifies function
 * bodies, which lets a function recognise state variables inherited from another
 * contract of the same document.
 *
 * <p>Missing properties degrade to defaults (public visibility, non-payable, empty names)
 * instead of failing; the document itself was validated by
 * {@link com.solseq.core.ast.AstDocumentReader}.
 */
public class AstContractExtractor extends AbstractExtractor<AstDocument> {

    private static final String EXTRACTOR_ID = "solidity-ast";
    private static final String EXTRACTOR_DISPLAY_NAME = "Solidity AST Extractor";

    private static final String CONTRACT_DEFINITION = "ContractDefinition";
    private static final String FUNCTION_DEFINITION = "FunctionDefinition";
    private static final String EVENT_DEFINITION = "EventDefinition";
    private static final String VARIABLE_DECLARATION = "VariableDeclaration";

    private final NodeAccessor accessor;
    private final ExpressionPrinter printer;
    private final AstStatementClassifier classifier;

    public AstContractExtractor() {
        this(new SolcNodeAccessor());
    }

    public AstContractExtractor(NodeAccessor accessor) {
        this.accessor = Objects.requireNonNull(accessor, "accessor must not be null");
        this.printer = new ExpressionPrinter(accessor);
        this.classifier = new AstStatementClassifier(accessor, printer);
    }

    @Override
    public String getId() {
        return EXTRACTOR_ID;
    }

    @Override
    public String getDisplayName() {
        return EXTRACTOR_DISPLAY_NAME;
    }

    @Override
    public ExtractionResult extract(AstDocument document) {
        Objects.requireNonNull(document, "document must not be null");
        if (document.sources().isEmpty()) {
            log.debug("AST document has no source units");
            return emptyResult();
        }

        List<String> warnings = new ArrayList<>();
        List<Skeleton> skeletons = new ArrayList<>();
        for (AstDocument.Source source : document.sources()) {
            accessor.findAll(source.root(), node -> accessor.isKind(node, CONTRACT_DEFINITION))
                .map(node -> skeleton(node, source.sourceId(), warnings))
                .flatMap(Optional::stream)
                .forEach(skeletons::add);
        }

        Map<String, List<String>> basesByContract = new HashMap<>();
        Map<String, Set<String>> variablesByContract = new HashMap<>();
        for (Skeleton skeleton : skeletons) {
            basesByContract.computeIfAbsent(skeleton.name(), key -> new ArrayList<>()).addAll(skeleton.bases());
            variablesByContract.computeIfAbsent(skeleton.name(), key -> new LinkedHashSet<>())
                .addAll(skeleton.stateVariables().stream().map(StateVariable::name).toList());
        }

        List<ContractUnit> contracts = new ArrayList<>();
        for (Skeleton skeleton : skeletons) {
            Set<String> visibleVariables = visibleNames(skeleton.name(), basesByContract, variablesByContract);
            contracts.add(complete(skeleton, visibleVariables));
        }
        return buildResult(contracts, warnings);
    }

    // ==================== First pass ====================

    private Optional<Skeleton> skeleton(AstNode contract, String sourceId, List<String> warnings) {
        String name = accessor.stringProperty(contract, "name").orElse("");
        if (name.isBlank()) {
            warnings.add("Skipped unnamed ContractDefinition in " + sourceId);
            return Optional.empty();
        }

        ContractKind kind = ContractKind.fromKeyword(accessor.stringProperty(contract, "contractKind").orElse(null));
        if (kind == ContractKind.CONTRACT && accessor.booleanProperty(contract, "abstract")) {
            kind = ContractKind.ABSTRACT_CONTRACT;
        }

        Set<String> bases = new LinkedHashSet<>();
        for (AstNode specifier : accessor.childList(contract, "baseContracts")) {
            String base = accessor.child(specifier, "baseName").map(this::baseName).orElse("");
            if (!base.isEmpty() && !bases.add(base)) {
                warnings.add("Duplicate base '" + base + "' in inheritance list of " + name + " ignored");
            }
        }

        List<AstNode> members = accessor.childList(contract, "nodes");
        List<StateVariable> stateVariables = members.stream()
            .filter(member -> accessor.isKind(member, VARIABLE_DECLARATION))
            .map(this::stateVariable)
            .toList();
        List<EventUnit> events = members.stream()
            .filter(member -> accessor.isKind(member, EVENT_DEFINITION))
            .map(this::event)
            .toList();

        log.debug("Found {} {} in {} ({} members)", kind.keyword(), name, sourceId, members.size());
        return Optional.of(new Skeleton(name, kind, List.copyOf(bases), sourceId, members, stateVariables, events));
    }

    private String baseName(AstNode typeNode) {
        return accessor.stringProperty(typeNode, "name").orElseGet(() -> TypeNames.render(accessor, typeNode));
    }

    private StateVariable stateVariable(AstNode declaration) {
        String type = TypeNames.ofDeclaration(accessor, declaration);
        return new StateVariable(
            accessor.stringProperty(declaration, "name").orElse(""),
            type,
            Visibility.fromKeyword(accessor.stringProperty(declaration, "visibility").orElse(null))
                .orElse(Visibility.INTERNAL),
            TypeNames.isMapping(accessor, declaration, type)
        );
    }

    private EventUnit event(AstNode definition) {
        List<EventParameter> parameters = parameterDeclarations(definition, "parameters").stream()
            .map(declaration -> new EventParameter(
                accessor.stringProperty(declaration, "name").orElse(""),
                TypeNames.ofDeclaration(accessor, declaration),
                accessor.booleanProperty(declaration, "indexed")))
            .toList();
        return new EventUnit(accessor.stringProperty(definition, "name").orElse(""), parameters);
    }

    // ==================== Second pass ====================

    private ContractUnit complete(Skeleton skeleton, Set<String> visibleVariables) {
        Set<String> eventNames = skeleton.events().stream().map(EventUnit::name).collect(Collectors.toSet());
        List<FunctionUnit> functions = skeleton.members().stream()
            .filter(member -> accessor.isKind(member, FUNCTION_DEFINITION))
            .map(definition -> function(definition, skeleton.name(), visibleVariables, eventNames))
            .toList();

        return new ContractUnit(
            skeleton.name(),
            skeleton.kind(),
            skeleton.bases(),
            skeleton.origin(),
            skeleton.stateVariables(),
            functions,
            skeleton.events()
        );
    }

    private FunctionUnit function(AstNode definition, String contractName,
                                  Set<String> visibleVariables, Set<String> eventNames) {
        String declaredKind = accessor.stringProperty(definition, "kind").orElse("function");
        String name = accessor.stringProperty(definition, "name").orElse("");

        FunctionKind kind = FunctionKind.FUNCTION;
        if ("constructor".equals(declaredKind) || accessor.booleanProperty(definition, "isConstructor")
            || name.equals(contractName)) {
            kind = FunctionKind.CONSTRUCTOR;
            name = "constructor";
        } else if (name.isEmpty()) {
            name = "receive".equals(declaredKind) ? "receive" : "fallback";
        }

        List<Parameter> parameters = parameters(definition, "parameters");
        List<Parameter> returns = parameters(definition, "returnParameters");

        Set<String> localNames = new LinkedHashSet<>();
        parameters.stream().filter(Parameter::isNamed).forEach(parameter -> localNames.add(parameter.name()));
        returns.stream().filter(Parameter::isNamed).forEach(parameter -> localNames.add(parameter.name()));

        List<BodyEffect> effects = accessor.child(definition, "body")
            .map(body -> classifier.classify(body, visibleVariables, localNames, eventNames))
            .orElse(List.of());

        return new FunctionUnit(
            name,
            kind,
            Visibility.fromKeyword(accessor.stringProperty(definition, "visibility").orElse(null))
                .orElse(Visibility.PUBLIC),
            mutability(definition),
            parameters,
            returns,
            effects
        );
    }

    private StateMutability mutability(AstNode definition) {
        Optional<StateMutability> declared = accessor.stringProperty(definition, "stateMutability")
            .flatMap(StateMutability::fromKeyword);
        if (declared.isPresent()) {
            return declared.get();
        }
        if (accessor.booleanProperty(definition, "constant")) {
            return StateMutability.VIEW;
        }
        return accessor.booleanProperty(definition, "payable") ? StateMutability.PAYABLE : StateMutability.NONE;
    }

    private List<Parameter> parameters(AstNode owner, String role) {
        return parameterDeclarations(owner, role).stream()
            .map(declaration -> new Parameter(
                accessor.stringProperty(declaration, "name").orElse(""),
                TypeNames.ofDeclaration(accessor, declaration)))
            .toList();
    }

    private List<AstNode> parameterDeclarations(AstNode owner, String role) {
        return accessor.child(owner, role)
            .map(list -> accessor.childList(list, "parameters"))
            .orElse(List.of());
    }

    private record Skeleton(
        String name,
        ContractKind kind,
        List<String> bases,
        String origin,
        List<AstNode> members,
        List<StateVariable> stateVariables,
        List<EventUnit> events
    ) {
    }
}
