package com.solseq.core.generator.impl;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.solseq.core.correlate.CallEventCorrelator;
import com.solseq.core.correlate.DiagramMessage;
import com.solseq.core.generator.ColorPalette;
import com.solseq.core.generator.DiagramGenerator;
import com.solseq.core.generator.GeneratedDiagram;
import com.solseq.core.generator.GeneratorConfig;
import com.solseq.core.model.ContractKind;
import com.solseq.core.model.ContractModel;
import com.solseq.core.model.ContractUnit;
import com.solseq.core.model.EventParameter;
import com.solseq.core.model.EventUnit;
import com.solseq.core.model.ExternalReference;
import com.solseq.core.model.FunctionUnit;
import com.solseq.core.model.Parameter;
import com.solseq.core.model.StateVariable;

/**
 * Generates Mermaid sequence diagrams from contract models.
 *
 * <p>The output is a Markdown {@code ```mermaid} block with a fixed layout:
 * <ol>
 *   <li>Header: diagram type, title, autonumbering and the theme block of the selected palette</li>
 *   <li>Participants: {@code User} first, one per contract in model order, {@code Events} last.
 *       A contract whose sanitized name is already taken gets a numeric suffix, e.g. {@code Events_1}.</li>
 *   <li><b>User Interactions:</b> a call/return arrow pair for every public or external function</li>
 *   <li><b>Contract-to-Contract Interactions:</b> calls, emits and storage notes per function</li>
 *   <li><b>Event Definitions:</b> one note per declared event</li>
 *   <li><b>Contract Relationships:</b> function lists, inheritance, kinds, interactions and
 *       unresolved state variable types</li>
 *   <li>Legend</li>
 * </ol>
 *
 * <p>All four section titles are always written, so an empty model still renders a valid
 * diagram. Rendering is deterministic: it only iterates lists of the immutable model.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * DiagramGenerator generator = new MermaidSequenceGenerator();
 * GeneratedDiagram diagram = generator.generate(model, GeneratorConfig.defaults());
 * // diagram.content() starts with ```mermaid
 * }</pre>
 *
 * @see <a href="https://mermaid.js.org/syntax/sequenceDiagram.html">Mermaid Sequence Diagrams</a>
 */
public class MermaidSequenceGenerator implements DiagramGenerator {

    private static final Logger log = LoggerFactory.getLogger(MermaidSequenceGenerator.class);

    // Generator identification
    private static final String GENERATOR_ID = "mermaid-sequence";
    private static final String GENERATOR_DISPLAY_NAME = "Mermaid Sequence Diagram Generator";
    private static final String FILE_EXTENSION = "md";
    private static final String DIAGRAM_NAME = "contract-interactions";

    // Markdown formatting
    private static final String NEWLINE = "\n";
    private static final String CODE_BLOCK_START = "```mermaid\n";
    private static final String CODE_BLOCK_END = "```\n";

    // Synthetic participants
    private static final String USER = "User";
    private static final String USER_TITLE = "External User";
    private static final String EVENTS = "Events";
    private static final String EVENTS_TITLE = "Blockchain Events";

    // Section titles
    private static final String USER_SECTION = "User Interactions";
    private static final String CONTRACT_SECTION = "Contract-to-Contract Interactions";
    private static final String EVENT_SECTION = "Event Definitions";
    private static final String RELATIONSHIP_SECTION = "Contract Relationships";
    private static final String LEGEND_SECTION = "Diagram Legend";

    private static final String SEQUENCE_NUMBERS_DIRECTIVE = "%%{init: { 'sequence': { 'showSequenceNumbers': true } }}%%";
    private static final List<String> LEGEND_LINES = List.of(
        "User→Contract: Public/External function calls",
        "User←Contract: Function returns",
        "Contract→Contract: Internal interactions",
        "Contract→Events: Emitted events",
        "Colored sections indicate different interaction types"
    );

    // Participant descriptions list at most this many notable state variables
    private static final int MAX_PARTICIPANT_VARIABLES = 2;
    private static final List<String> NOTABLE_VARIABLE_HINTS = List.of(
        "owner", "admin", "token", "deployer", "implementation", "registry", "factory");

    private static final String ID_SANITIZATION_PATTERN = "[^a-zA-Z0-9_]";

    private final CallEventCorrelator correlator;

    public MermaidSequenceGenerator() {
        this(new CallEventCorrelator());
    }

    public MermaidSequenceGenerator(CallEventCorrelator correlator) {
        this.correlator = Objects.requireNonNull(correlator, "correlator must not be null");
    }

    @Override
    public String getId() {
        return GENERATOR_ID;
    }

    @Override
    public String getDisplayName() {
        return GENERATOR_DISPLAY_NAME;
    }

    @Override
    public String getFileExtension() {
        return FILE_EXTENSION;
    }

    @Override
    public GeneratedDiagram generate(ContractModel model, GeneratorConfig config) {
        Objects.requireNonNull(model, "model must not be null");
        Objects.requireNonNull(config, "config must not be null");
        log.debug("Generating sequence diagram for {} contract(s)", model.contracts().size());

        ColorPalette palette = config.palette();
        List<FunctionMessages> interactions = correlate(model);
        Map<String, String> ids = assignParticipantIds(model);

        StringBuilder sb = new StringBuilder();
        appendHeader(sb, config.title(), palette);
        appendParticipants(sb, model, ids);

        appendSectionTitle(sb, USER_SECTION, palette.userSection());
        appendUserInteractions(sb, model, ids);

        appendSectionTitle(sb, CONTRACT_SECTION, palette.contractSection());
        appendContractInteractions(sb, interactions, ids);

        appendSectionTitle(sb, EVENT_SECTION, palette.eventSection());
        appendEventDefinitions(sb, model, ids);

        appendSectionTitle(sb, RELATIONSHIP_SECTION, palette.relationshipSection());
        appendRelationships(sb, model, interactions, ids);

        appendLegend(sb, palette);
        sb.append(CODE_BLOCK_END);

        log.info("Generated Mermaid sequence diagram: {} participant(s), {} event(s)",
            model.contracts().size() + 2, model.eventCount());
        return new GeneratedDiagram(DIAGRAM_NAME, sb.toString(), getFileExtension());
    }

    // ==================== Header and participants ====================

    private void appendHeader(StringBuilder sb, String title, ColorPalette palette) {
        sb.append(CODE_BLOCK_START);
        sb.append("sequenceDiagram").append(NEWLINE);
        sb.append("title ").append(escape(title)).append(NEWLINE);
        sb.append("autonumber").append(NEWLINE);
        sb.append(NEWLINE);

        sb.append("%%{init: {").append(NEWLINE);
        sb.append("  'theme': 'base',").append(NEWLINE);
        sb.append("  'themeVariables': {").append(NEWLINE);
        appendThemeVariable(sb, "primaryColor", palette.primaryColor(), true);
        appendThemeVariable(sb, "primaryTextColor", palette.primaryTextColor(), true);
        appendThemeVariable(sb, "primaryBorderColor", palette.primaryBorderColor(), true);
        appendThemeVariable(sb, "lineColor", palette.lineColor(), true);
        appendThemeVariable(sb, "secondaryColor", palette.secondaryColor(), true);
        appendThemeVariable(sb, "tertiaryColor", palette.tertiaryColor(), false);
        sb.append("  }").append(NEWLINE);
        sb.append("}}%%").append(NEWLINE);
        sb.append(NEWLINE);
    }

    private void appendThemeVariable(StringBuilder sb, String name, String value, boolean more) {
        sb.append("    '").append(name).append("': '").append(value).append("'")
            .append(more ? "," : "").append(NEWLINE);
    }

    /**
     * Maps each contract name to a unique participant ID, in model order. The synthetic
     * participants are reserved; a clash appends {@code _1}, {@code _2}, ... to the sanitized name.
     */
    private Map<String, String> assignParticipantIds(ContractModel model) {
        Set<String> taken = new HashSet<>(List.of(USER, EVENTS));
        Map<String, String> ids = new LinkedHashMap<>();
        for (ContractUnit contract : model.contracts()) {
            if (ids.containsKey(contract.name())) {
                continue;
            }
            String base = sanitizeId(contract.name());
            String id = base;
            for (int suffix = 1; !taken.add(id); suffix++) {
                id = base + "_" + suffix;
            }
            if (!id.equals(base)) {
                log.debug("Participant ID {} is taken, using {} for contract {}", base, id, contract.name());
            }
            ids.put(contract.name(), id);
        }
        return ids;
    }

    private void appendParticipants(StringBuilder sb, ContractModel model, Map<String, String> ids) {
        appendParticipant(sb, USER, USER_TITLE);
        for (ContractUnit contract : model.contracts()) {
            appendParticipant(sb, participantId(ids, contract.name()), participantTitle(contract));
        }
        appendParticipant(sb, EVENTS, EVENTS_TITLE);
        sb.append(NEWLINE);
    }

    private void appendParticipant(StringBuilder sb, String id, String title) {
        sb.append("participant ").append(id).append(" as \"").append(escape(title)).append("\"")
            .append(NEWLINE);
    }

    /**
     * Builds {@code Name (kind)<br/>(var: type, ...)<br/>from file}; the kind only for
     * non-plain contracts, the variable list only when notable variables exist.
     */
    private String participantTitle(ContractUnit contract) {
        List<String> parts = new ArrayList<>();
        parts.add(contract.kind() == ContractKind.CONTRACT
            ? contract.name()
            : contract.name() + " (" + contract.kind().keyword() + ")");

        List<String> notable = contract.stateVariables().stream()
            .filter(this::isNotable)
            .limit(MAX_PARTICIPANT_VARIABLES)
            .map(variable -> variable.name() + ": " + variable.type())
            .toList();
        if (!notable.isEmpty()) {
            parts.add("(" + String.join(", ", notable) + ")");
        }

        if (!contract.origin().isEmpty()) {
            parts.add("from " + fileName(contract.origin()));
        }
        return String.join("<br/>", parts);
    }

    private boolean isNotable(StateVariable variable) {
        String name = variable.name().toLowerCase(Locale.ROOT);
        return NOTABLE_VARIABLE_HINTS.stream().anyMatch(name::contains);
    }

    // ==================== Sections ====================

    private void appendSectionTitle(StringBuilder sb, String title, String color) {
        sb.append("rect ").append(color).append(NEWLINE);
        sb.append("Note over ").append(USER).append(": ").append(title).append(NEWLINE);
        sb.append("end").append(NEWLINE);
        sb.append(NEWLINE);
    }

    private void appendUserInteractions(StringBuilder sb, ContractModel model, Map<String, String> ids) {
        int before = sb.length();
        for (ContractUnit contract : model.contracts()) {
            String id = participantId(ids, contract.name());
            for (FunctionUnit function : contract.functions()) {
                if (!function.isUserFacing()) {
                    continue;
                }
                FunctionPurposes.describe(function.name()).ifPresent(purpose ->
                    sb.append("Note over ").append(USER).append(",").append(id).append(": ").append(purpose)
                        .append(NEWLINE));
                sb.append(USER).append("->>+").append(id).append(": ")
                    .append(escape(function.name() + "(" + formatParameters(function.parameters()) + ")"))
                    .append(NEWLINE);
                sb.append(id).append("-->>-").append(USER).append(": ").append(escape(returnLabel(function)))
                    .append(NEWLINE);
            }
        }
        endSection(sb, before);
    }

    private void appendContractInteractions(StringBuilder sb, List<FunctionMessages> interactions,
                                            Map<String, String> ids) {
        for (FunctionMessages entry : interactions) {
            if (entry.messages().isEmpty()) {
                continue;
            }
            sb.append("Note right of ").append(participantId(ids, entry.contract().name()))
                .append(": Processing ").append(escape(entry.label())).append(NEWLINE);
            for (DiagramMessage message : entry.messages()) {
                appendMessage(sb, message, ids);
            }
            sb.append(NEWLINE);
        }
    }

    private void appendMessage(StringBuilder sb, DiagramMessage message, Map<String, String> ids) {
        if (message instanceof DiagramMessage.Call call) {
            String from = participantId(ids, call.from());
            String to = participantId(ids, call.to());
            FunctionPurposes.describe(call.function()).ifPresent(purpose ->
                sb.append("Note right of ").append(from).append(": ").append(purpose).append(NEWLINE));
            sb.append(from).append("->>+").append(to).append(": ")
                .append(escape(call.function() + "(" + String.join(", ", call.arguments()) + ")"))
                .append(NEWLINE);
            sb.append(to).append("-->>-").append(from).append(": return").append(NEWLINE);
        } else if (message instanceof DiagramMessage.Emit emit) {
            sb.append(participantId(ids, emit.from())).append("->>").append(EVENTS).append(": ")
                .append(escape("emit " + emit.event() + "(" + String.join(", ", emit.arguments()) + ")"))
                .append(NEWLINE);
        } else if (message instanceof DiagramMessage.StorageNote note) {
            sb.append("Note right of ").append(participantId(ids, note.contract())).append(": Storage update: ")
                .append(escape(note.description())).append(NEWLINE);
        }
    }

    private void appendEventDefinitions(StringBuilder sb, ContractModel model, Map<String, String> ids) {
        int before = sb.length();
        for (ContractUnit contract : model.contracts()) {
            String id = participantId(ids, contract.name());
            for (EventUnit event : contract.events()) {
                sb.append("Note over ").append(id).append(",").append(id).append(": Event: ")
                    .append(escape(event.name() + "(" + formatEventParameters(event.parameters()) + ")"))
                    .append(NEWLINE);
            }
        }
        endSection(sb, before);
    }

    private void appendRelationships(StringBuilder sb, ContractModel model, List<FunctionMessages> interactions,
                                     Map<String, String> ids) {
        int before = sb.length();
        for (ContractUnit contract : model.contracts()) {
            String functions = contract.functions().stream()
                .map(contract::labelOf)
                .distinct()
                .collect(Collectors.joining(", "));
            sb.append("Note over ").append(participantId(ids, contract.name())).append(": Functions: ")
                .append(functions.isEmpty() ? "(none)" : escape(functions)).append(NEWLINE);
        }

        for (ContractUnit contract : model.contracts()) {
            if (!contract.baseContracts().isEmpty()) {
                sb.append("Note right of ").append(participantId(ids, contract.name())).append(": Inherits from: ")
                    .append(escape(String.join(", ", contract.baseContracts()))).append(NEWLINE);
            }
        }

        for (ContractUnit contract : model.contracts()) {
            if (contract.kind() != ContractKind.CONTRACT) {
                sb.append("Note right of ").append(participantId(ids, contract.name())).append(": Type: ")
                    .append(contract.kind().keyword()).append(NEWLINE);
            }
        }

        Set<String> interactionPairs = new LinkedHashSet<>();
        for (FunctionMessages entry : interactions) {
            for (DiagramMessage message : entry.messages()) {
                if (message instanceof DiagramMessage.Call call && interactionPairs.add(call.from() + "->" + call.to())) {
                    sb.append("Note right of ").append(participantId(ids, call.from())).append(": Interacts with ")
                        .append(participantId(ids, call.to())).append(NEWLINE);
                }
            }
        }

        for (ExternalReference reference : model.externalReferences()) {
            sb.append("Note right of ").append(participantId(ids, reference.owner()))
                .append(": External reference: ")
                .append(escape(reference.variable() + " (" + reference.typeName() + ")")).append(NEWLINE);
        }
        endSection(sb, before);
    }

    private void appendLegend(StringBuilder sb, ColorPalette palette) {
        sb.append(SEQUENCE_NUMBERS_DIRECTIVE).append(NEWLINE);
        sb.append(NEWLINE);
        appendSectionTitle(sb, LEGEND_SECTION, palette.legendSection());
        for (String line : LEGEND_LINES) {
            sb.append("Note left of ").append(USER).append(": ").append(line).append(NEWLINE);
        }
    }

    /**
     * Separates a non-empty section body from whatever follows.
     */
    private void endSection(StringBuilder sb, int bodyStart) {
        if (sb.length() > bodyStart) {
            sb.append(NEWLINE);
        }
    }

    // ==================== Helpers ====================

    private List<FunctionMessages> correlate(ContractModel model) {
        List<FunctionMessages> interactions = new ArrayList<>();
        for (ContractUnit contract : model.contracts()) {
            for (FunctionUnit function : contract.functions()) {
                interactions.add(new FunctionMessages(
                    contract, contract.labelOf(function), correlator.correlate(model, contract, function)));
            }
        }
        return interactions;
    }

    private String formatParameters(List<Parameter> parameters) {
        return parameters.stream()
            .map(parameter -> parameter.isNamed() ? parameter.name() + ": " + parameter.type() : parameter.type())
            .collect(Collectors.joining(", "));
    }

    private String formatEventParameters(List<EventParameter> parameters) {
        return parameters.stream()
            .map(parameter -> {
                String declaration = parameter.type() + (parameter.indexed() ? " indexed" : "");
                return parameter.name().isEmpty() ? declaration : declaration + " " + parameter.name();
            })
            .collect(Collectors.joining(", "));
    }

    /**
     * Return arrow label: the return values, {@code (view function)} for read-only
     * functions without declared returns, or a bare {@code return}.
     */
    private String returnLabel(FunctionUnit function) {
        if (!function.returns().isEmpty()) {
            boolean allNamed = function.returns().stream().allMatch(Parameter::isNamed);
            String values = allNamed
                ? formatParameters(function.returns())
                : function.returns().stream().map(Parameter::type).collect(Collectors.joining(", "));
            return "return " + values;
        }
        return function.mutability().isReadOnly() ? "return (view function)" : "return";
    }

    private static String fileName(String origin) {
        int slash = Math.max(origin.lastIndexOf('/'), origin.lastIndexOf('\\'));
        return slash < 0 ? origin : origin.substring(slash + 1);
    }

    private String participantId(Map<String, String> ids, String contractName) {
        String id = ids.get(contractName);
        return id != null ? id : sanitizeId(contractName);
    }

    /**
     * Sanitizes a participant ID for Mermaid syntax.
     *
     * @param id raw identifier
     * @return ID containing only letters, digits and underscores
     */
    private String sanitizeId(String id) {
        if (id == null || id.isEmpty()) {
            return "unknown";
        }
        return id.replaceAll(ID_SANITIZATION_PATTERN, "_");
    }

    /**
     * Escapes text for message and note labels: double quotes become single quotes,
     * newlines become spaces, and semicolons use Mermaid's entity code.
     *
     * @param text raw text
     * @return text safe to embed in one diagram line
     */
    private String escape(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("\"", "'").replace("\n", " ").replace(";", "#59;");
    }

    private record FunctionMessages(ContractUnit contract, String label, List<DiagramMessage> messages) {
    }
}
