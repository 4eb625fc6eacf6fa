package com.solseq.core.ast;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link SolcNodeAccessor}, covering both solc AST dialects.
 */
class SolcNodeAccessorTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private SolcNodeAccessor accessor;

    @BeforeEach
    void setUp() {
        accessor = new SolcNodeAccessor();
    }

    private AstNode node(String json) throws Exception {
        return new AstNode(mapper.readTree(json));
    }

    @Test
    void nodeKind_compactNode_readsNodeType() throws Exception {
        AstNode node = node("""
            {"nodeType": "ContractDefinition", "id": 3, "name": "Vault"}
            """);

        assertThat(accessor.nodeKind(node)).isEqualTo("ContractDefinition");
    }

    @Test
    void nodeKind_legacyNode_readsName() throws Exception {
        AstNode node = node("""
            {"name": "ContractDefinition", "id": 3, "attributes": {"name": "Vault"}, "children": []}
            """);

        assertThat(accessor.nodeKind(node)).isEqualTo("ContractDefinition");
        assertThat(accessor.stringProperty(node, "name")).contains("Vault");
    }

    @Test
    void nodeKind_untaggedObject_returnsEmptyString() throws Exception {
        assertThat(accessor.nodeKind(node("{\"foo\": 1}"))).isEmpty();
    }

    @Test
    void childrenOf_compactNode_ordersChildrenBySourceOffset() throws Exception {
        // Given: solc writes keys alphabetically, so "arguments" precedes "expression"
        AstNode call = node("""
            {
              "arguments": [{"nodeType": "Identifier", "name": "amount", "src": "30:6:0"}],
              "expression": {"nodeType": "Identifier", "name": "pay", "src": "26:3:0"},
              "nodeType": "FunctionCall",
              "src": "26:11:0",
              "typeDescriptions": {"typeString": "tuple()"}
            }
            """);

        // When
        List<AstNode> children = accessor.childrenOf(call);

        // Then
        assertThat(children)
            .extracting(child -> accessor.stringProperty(child, "name").orElse(""))
            .containsExactly("pay", "amount");
    }

    @Test
    void childrenOf_compactNodeWithoutOffsets_keepsDocumentOrder() throws Exception {
        AstNode block = node("""
            {"nodeType": "Block", "statements": [
              {"nodeType": "Return", "id": 2},
              {"nodeType": "Break", "id": 1}
            ]}
            """);

        assertThat(accessor.childrenOf(block))
            .extracting(accessor::nodeKind)
            .containsExactly("Return", "Break");
    }

    @Test
    void stringProperty_typeString_readsTypeDescriptions() throws Exception {
        AstNode identifier = node("""
            {"nodeType": "Identifier", "name": "token", "typeDescriptions": {"typeString": "contract IERC20"}}
            """);

        assertThat(accessor.stringProperty(identifier, "typeString")).contains("contract IERC20");
    }

    @Test
    void stringProperty_legacyAliases_areTranslated() throws Exception {
        AstNode member = node("""
            {"name": "MemberAccess", "id": 9,
             "attributes": {"member_name": "sender", "type": "address"},
             "children": [{"name": "Identifier", "id": 8, "attributes": {"value": "msg", "type": "msg"}}]}
            """);

        AstNode receiver = accessor.child(member, "expression").orElseThrow();

        assertThat(accessor.stringProperty(member, "memberName")).contains("sender");
        assertThat(accessor.stringProperty(member, "typeString")).contains("address");
        assertThat(accessor.stringProperty(receiver, "name")).contains("msg");
        assertThat(accessor.stringProperty(member, "id")).contains("9");
    }

    @Test
    void stringProperty_absentOrNonScalar_returnsEmpty() throws Exception {
        AstNode node = node("""
            {"nodeType": "FunctionDefinition", "documentation": null, "modifiers": []}
            """);

        assertThat(accessor.stringProperty(node, "name")).isEmpty();
        assertThat(accessor.stringProperty(node, "documentation")).isEmpty();
        assertThat(accessor.stringProperty(node, "modifiers")).isEmpty();
        assertThat(accessor.booleanProperty(node, "virtual")).isFalse();
    }

    @Test
    void child_legacyFunction_resolvesParameterListsAndBody() throws Exception {
        AstNode function = node("""
            {"name": "FunctionDefinition", "id": 1, "attributes": {"name": "get"}, "children": [
              {"name": "ParameterList", "id": 2, "children": []},
              {"name": "ParameterList", "id": 3, "children": [
                {"name": "VariableDeclaration", "id": 4, "attributes": {"name": "", "type": "uint256"}}
              ]},
              {"name": "ModifierInvocation", "id": 5, "children": []},
              {"name": "Block", "id": 6, "children": []}
            ]}
            """);

        assertThat(accessor.child(function, "parameters").map(accessor::childrenOf)).hasValue(List.of());
        assertThat(accessor.child(function, "returnParameters"))
            .map(list -> accessor.childList(list, "parameters").size())
            .hasValue(1);
        assertThat(accessor.child(function, "body").map(accessor::nodeKind)).hasValue("Block");
    }

    @Test
    void child_legacyInterfaceFunction_hasNoBody() throws Exception {
        AstNode function = node("""
            {"name": "FunctionDefinition", "id": 1, "attributes": {"name": "f", "implemented": false}, "children": [
              {"name": "ParameterList", "id": 2, "children": []},
              {"name": "ParameterList", "id": 3, "children": []}
            ]}
            """);

        assertThat(accessor.child(function, "body")).isEmpty();
    }

    @Test
    void childList_legacyFunctionCall_skipsCallee() throws Exception {
        AstNode call = node("""
            {"name": "FunctionCall", "id": 1, "attributes": {"type": "tuple()"}, "children": [
              {"name": "Identifier", "id": 2, "attributes": {"value": "Incremented"}},
              {"name": "Identifier", "id": 3, "attributes": {"value": "count"}},
              {"name": "Literal", "id": 4, "attributes": {"value": "1"}}
            ]}
            """);

        assertThat(accessor.child(call, "expression").flatMap(callee -> accessor.stringProperty(callee, "name")))
            .contains("Incremented");
        assertThat(accessor.childList(call, "arguments")).hasSize(2);
    }

    @Test
    void childList_legacyContract_separatesBasesFromMembers() throws Exception {
        AstNode contract = node("""
            {"name": "ContractDefinition", "id": 1, "attributes": {"name": "Child"}, "children": [
              {"name": "InheritanceSpecifier", "id": 2, "children": [
                {"name": "UserDefinedTypeName", "id": 3, "attributes": {"name": "Base"}}
              ]},
              {"name": "VariableDeclaration", "id": 4, "attributes": {"name": "total"}}
            ]}
            """);

        assertThat(accessor.childList(contract, "baseContracts")).hasSize(1);
        assertThat(accessor.childList(contract, "nodes"))
            .extracting(accessor::nodeKind)
            .containsExactly("VariableDeclaration");
    }

    @Test
    void findAll_returnsMatchesInPreOrder() throws Exception {
        AstNode unit = node("""
            {"nodeType": "SourceUnit", "src": "0:100:0", "nodes": [
              {"nodeType": "ContractDefinition", "name": "A", "src": "0:40:0", "nodes": [
                {"nodeType": "ContractDefinition", "name": "Nested", "src": "10:5:0", "nodes": []}
              ]},
              {"nodeType": "ContractDefinition", "name": "B", "src": "50:40:0", "nodes": []}
            ]}
            """);

        List<String> names = accessor.findAll(unit, node -> accessor.isKind(node, "ContractDefinition"))
            .map(node -> accessor.stringProperty(node, "name").orElse(""))
            .toList();

        assertThat(names).containsExactly("A", "Nested", "B");
    }

    @Test
    void findAll_deeplyNestedTree_doesNotOverflowStack() {
        // Given: a chain of 20,000 nested blocks
        ObjectNode root = mapper.createObjectNode().put("nodeType", "Block");
        ObjectNode current = root;
        for (int i = 0; i < 20_000; i++) {
            ArrayNode statements = current.putArray("statements");
            current = statements.addObject().put("nodeType", "Block");
        }

        // When
        long count = accessor.findAll(new AstNode(root), node -> true).count();

        // Then
        assertThat(count).isEqualTo(20_001);
    }

    @Test
    void findAll_isLazy() throws Exception {
        // Given
        JsonNode tree = mapper.readTree("""
            {"nodeType": "SourceUnit", "nodes": [
              {"nodeType": "PragmaDirective"},
              {"nodeType": "ContractDefinition", "name": "First"},
              {"nodeType": "ContractDefinition", "name": "Second"},
              {"nodeType": "ContractDefinition", "name": "Third"}
            ]}
            """);
        AtomicInteger visited = new AtomicInteger();

        // When
        accessor.findAll(new AstNode(tree), node -> {
            visited.incrementAndGet();
            return accessor.isKind(node, "ContractDefinition");
        }).findFirst();

        // Then: SourceUnit, PragmaDirective, First
        assertThat(visited).hasValue(3);
    }
}
