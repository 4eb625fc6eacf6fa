package com.solseq.core.extractor.ast;

import com.solseq.core.ast.AstDocumentReader;
import com.solseq.core.ast.AstNode;
import com.solseq.core.ast.SolcNodeAccessor;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ExpressionPrinter} and {@link TypeNames}.
 */
class ExpressionPrinterTest {

    private final SolcNodeAccessor accessor = new SolcNodeAccessor();
    private final ExpressionPrinter printer = new ExpressionPrinter(accessor);

    /**
     * Wraps a node in a SourceUnit so it can be read through the public reader.
     */
    private AstNode parse(String nodeJson) {
        AstNode root = new AstDocumentReader()
            .read("{\"nodeType\": \"SourceUnit\", \"id\": 0, \"nodes\": [" + nodeJson + "]}")
            .sources().get(0).root();
        return accessor.childList(root, "nodes").get(0);
    }

    @Test
    void print_memberCallWithLiterals() {
        AstNode call = parse("""
            {"nodeType": "FunctionCall",
             "expression": {"nodeType": "MemberAccess", "memberName": "transfer",
               "expression": {"nodeType": "Identifier", "name": "token"}},
             "arguments": [
               {"nodeType": "Literal", "kind": "string", "value": "hello"},
               {"nodeType": "Literal", "kind": "number", "value": "1", "subdenomination": "ether"}
             ]}
            """);

        assertThat(printer.print(call)).isEqualTo("token.transfer(\"hello\", 1 ether)");
    }

    @Test
    void print_compoundAssignmentOnIndexAccess() {
        AstNode assignment = parse("""
            {"nodeType": "Assignment", "operator": "+=",
             "leftHandSide": {"nodeType": "IndexAccess",
               "baseExpression": {"nodeType": "Identifier", "name": "balances"},
               "indexExpression": {"nodeType": "Identifier", "name": "user"}},
             "rightHandSide": {"nodeType": "BinaryOperation", "operator": "*",
               "leftExpression": {"nodeType": "Identifier", "name": "amount"},
               "rightExpression": {"nodeType": "Literal", "kind": "number", "value": "2"}}}
            """);

        assertThat(printer.print(assignment)).isEqualTo("balances[user] += amount * 2");
    }

    @Test
    void print_unaryOperations() {
        AstNode delete = parse("""
            {"nodeType": "UnaryOperation", "operator": "delete", "prefix": true,
             "subExpression": {"nodeType": "Identifier", "name": "pending"}}
            """);
        AstNode prefix = parse("""
            {"nodeType": "UnaryOperation", "operator": "++", "prefix": true,
             "subExpression": {"nodeType": "Identifier", "name": "nonce"}}
            """);

        assertThat(printer.print(delete)).isEqualTo("delete pending");
        assertThat(printer.print(prefix)).isEqualTo("++nonce");
    }

    @Test
    void print_conditionalTupleAndNew() {
        AstNode conditional = parse("""
            {"nodeType": "Conditional",
             "condition": {"nodeType": "Identifier", "name": "ok"},
             "trueExpression": {"nodeType": "TupleExpression", "components": [
               {"nodeType": "Identifier", "name": "a"}, {"nodeType": "Identifier", "name": "b"}]},
             "falseExpression": {"nodeType": "NewExpression",
               "typeName": {"nodeType": "UserDefinedTypeName",
                 "pathNode": {"nodeType": "IdentifierPath", "name": "Pair"}}}}
            """);

        assertThat(printer.print(conditional)).isEqualTo("ok ? (a, b) : new Pair");
    }

    @Test
    void print_unknownKind_fallsBackToCleanTypeString() {
        AstNode node = parse("""
            {"nodeType": "InlineAssembly", "typeDescriptions": {"typeString": "struct Vault.Position storage ref"}}
            """);

        assertThat(printer.print(node)).isEqualTo("Vault.Position");
    }

    @Test
    void render_arrayAndNestedMapping() {
        AstNode array = parse("""
            {"nodeType": "ArrayTypeName",
             "baseType": {"nodeType": "ElementaryTypeName", "name": "address", "stateMutability": "payable"},
             "length": {"nodeType": "Literal", "kind": "number", "value": "3"}}
            """);
        AstNode mapping = parse("""
            {"nodeType": "Mapping",
             "keyType": {"nodeType": "ElementaryTypeName", "name": "address"},
             "valueType": {"nodeType": "Mapping",
               "keyType": {"nodeType": "ElementaryTypeName", "name": "address"},
               "valueType": {"nodeType": "ElementaryTypeName", "name": "uint256"}}}
            """);

        assertThat(TypeNames.render(accessor, array)).isEqualTo("address payable[3]");
        assertThat(TypeNames.render(accessor, mapping))
            .isEqualTo("mapping(address => mapping(address => uint256))");
    }

    @Test
    void clean_stripsKindPrefixesAndDataLocations() {
        assertThat(TypeNames.clean("contract IERC20")).isEqualTo("IERC20");
        assertThat(TypeNames.clean("uint256[] memory")).isEqualTo("uint256[]");
        assertThat(TypeNames.clean("struct Pool.Info storage pointer")).isEqualTo("Pool.Info");
        assertThat(TypeNames.clean("type(contract Token)")).isEqualTo("Token");
    }
}
