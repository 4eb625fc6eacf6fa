package com.solseq.core.ast;

import com.solseq.core.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link AstDocumentReader}.
 */
class AstDocumentReaderTest {

    private AstDocumentReader reader;

    @BeforeEach
    void setUp() {
        reader = new AstDocumentReader();
    }

    @Test
    void read_standardJsonOutput_usesSourceKeyAsSourceId() {
        AstDocument document = reader.read(TestFixtures.read("vault-standard-json.json"));

        assertThat(document.sources()).hasSize(1);
        assertThat(document.sources().get(0).sourceId()).isEqualTo("contracts/Vault.sol");
    }

    @Test
    void read_combinedJsonOutput_unwrapsUpperCaseAst() {
        AstDocument document = reader.read("""
            {"sources": {
              "A.sol": {"AST": {"nodeType": "SourceUnit", "id": 1, "nodes": []}},
              "B.sol": {"AST": {"nodeType": "SourceUnit", "id": 2, "nodes": []}}
            }, "version": "0.8.20"}
            """);

        assertThat(document.sources())
            .extracting(AstDocument.Source::sourceId)
            .containsExactly("A.sol", "B.sol");
    }

    @Test
    void read_legacyAstEntry_isAccepted() {
        AstDocument document = reader.read("""
            {"sources": {"Old.sol": {"legacyAST": {"name": "SourceUnit", "id": 7, "children": []}}}}
            """);

        assertThat(document.sources()).singleElement()
            .extracting(AstDocument.Source::sourceId)
            .isEqualTo("Old.sol");
    }

    @Test
    void read_bareLegacyUnit_usesAbsolutePathAttribute() {
        AstDocument document = reader.read(TestFixtures.read("counter-legacy.json"));

        assertThat(document.sources()).singleElement()
            .extracting(AstDocument.Source::sourceId)
            .isEqualTo("Counter.sol");
    }

    @Test
    void read_astWrapper_isUnwrapped() {
        AstDocument document = reader.read("""
            {"ast": {"nodeType": "SourceUnit", "id": 4, "absolutePath": "Wrapped.sol", "nodes": []}}
            """);

        assertThat(document.sources().get(0).sourceId()).isEqualTo("Wrapped.sol");
    }

    @Test
    void read_arrayOfUnits_fallsBackToNodeIdWithoutPath() {
        AstDocument document = reader.read("""
            [
              {"nodeType": "SourceUnit", "id": 11, "absolutePath": "One.sol", "nodes": []},
              {"nodeType": "SourceUnit", "id": 12, "nodes": []}
            ]
            """);

        assertThat(document.sources())
            .extracting(AstDocument.Source::sourceId)
            .containsExactly("One.sol", "ast-node:12");
    }

    @Test
    void read_invalidJson_throwsAstFormatException() {
        assertThatThrownBy(() -> reader.read("{\"nodeType\": \"SourceUnit\", "))
            .isInstanceOf(AstFormatException.class)
            .hasMessageContaining("not valid JSON");
    }

    @Test
    void read_emptyInput_throwsAstFormatException() {
        assertThatThrownBy(() -> reader.read(""))
            .isInstanceOf(AstFormatException.class);
    }

    @Test
    void read_scalarRoot_throwsAstFormatException() {
        assertThatThrownBy(() -> reader.read("42"))
            .isInstanceOf(AstFormatException.class)
            .hasMessageContaining("JSON object or array");
    }

    @Test
    void read_unitWithoutNodes_throwsAstFormatException() {
        assertThatThrownBy(() -> reader.read("{\"nodeType\": \"SourceUnit\", \"id\": 1}"))
            .isInstanceOf(AstFormatException.class)
            .hasMessageContaining("'nodes'");
    }

    @Test
    void read_rootThatIsNotSourceUnit_throwsAstFormatException() {
        assertThatThrownBy(() -> reader.read("{\"nodeType\": \"ContractDefinition\", \"nodes\": []}"))
            .isInstanceOf(AstFormatException.class)
            .hasMessageContaining("Expected a SourceUnit");
    }

    @Test
    void read_sourceEntryWithoutAst_throwsAstFormatException() {
        assertThatThrownBy(() -> reader.read("{\"sources\": {\"A.sol\": {\"id\": 0}}}"))
            .isInstanceOf(AstFormatException.class)
            .hasMessageContaining("A.sol");
    }

    @Test
    void read_nullInput_throwsNullPointerException() {
        assertThatThrownBy(() -> reader.read((String) null))
            .isInstanceOf(NullPointerException.class);
    }
}
