package com.solseq.core.extractor.source;

import com.solseq.core.TestFixtures;
import com.solseq.core.extractor.ExtractionResult;
import com.solseq.core.model.BodyEffect;
import com.solseq.core.model.ContractKind;
import com.solseq.core.model.ContractUnit;
import com.solseq.core.model.EventUnit;
import com.solseq.core.model.FunctionKind;
import com.solseq.core.model.FunctionUnit;
import com.solseq.core.model.Parameter;
import com.solseq.core.model.StateMutability;
import com.solseq.core.model.StateVariable;
import com.solseq.core.model.Visibility;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Functional tests for {@link SolidityLexicalExtractor}.
 *
 * <p>These tests validate the extractor's ability to:
 * <ul>
 *   <li>Find contract, interface, library and abstract contract declarations</li>
 *   <li>Split declaration bodies into members while ignoring braces in strings and comments</li>
 *   <li>Classify function bodies into calls, emits and storage writes</li>
 *   <li>Degrade gracefully on malformed input</li>
 * </ul>
 */
class SolidityLexicalExtractorTest {

    private SolidityLexicalExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new SolidityLexicalExtractor();
    }

    private ExtractionResult extract(String source) {
        return extractor.extract(List.of(new SourceBuffer("Inline.sol", source)));
    }

    private static ContractUnit contract(ExtractionResult result, String name) {
        return result.contracts().stream()
            .filter(contract -> contract.name().equals(name))
            .findFirst()
            .orElseThrow(() -> new AssertionError("No contract " + name));
    }

    private static FunctionUnit function(ContractUnit contract, String name) {
        return contract.functions().stream()
            .filter(function -> function.name().equals(name))
            .findFirst()
            .orElseThrow(() -> new AssertionError("No function " + name + " in " + contract.name()));
    }

    @Test
    void getId_returnsCorrectId() {
        assertThat(extractor.getId()).isEqualTo("solidity-source");
    }

    @Test
    void getDisplayName_returnsCorrectName() {
        assertThat(extractor.getDisplayName()).isEqualTo("Solidity Source Extractor");
    }

    @Test
    void extract_noBuffers_returnsEmptyResult() {
        assertThat(extractor.extract(List.of()).contracts()).isEmpty();
    }

    @Test
    @DisplayName("Declarations across buffers keep input order and kinds")
    void extract_multipleBuffers_findsAllDeclarations() {
        // When
        ExtractionResult result = extractor.extract(TestFixtures.sources("Ownable.sol", "Staking.sol"));

        // Then
        assertThat(result.warnings()).isEmpty();
        assertThat(result.contracts())
            .extracting(ContractUnit::name)
            .containsExactly("Ownable", "IERC20", "RewardPool", "Staking");
        assertThat(result.contracts())
            .extracting(ContractUnit::kind)
            .containsExactly(ContractKind.ABSTRACT_CONTRACT, ContractKind.INTERFACE, ContractKind.CONTRACT,
                ContractKind.CONTRACT);
        assertThat(contract(result, "Staking").baseContracts()).containsExactly("Ownable");
        assertThat(contract(result, "Staking").origin()).isEqualTo("Staking.sol");
    }

    @Test
    void extract_stateVariables_skipStructsAndKeepConstants() {
        ExtractionResult result = extractor.extract(TestFixtures.sources("Ownable.sol", "Staking.sol"));

        assertThat(contract(result, "Staking").stateVariables()).containsExactly(
            new StateVariable("stakingToken", "IERC20", Visibility.PUBLIC, false),
            new StateVariable("pool", "RewardPool", Visibility.PUBLIC, false),
            new StateVariable("stakes", "mapping(address => uint256)", Visibility.PUBLIC, true),
            new StateVariable("totalStaked", "uint256", Visibility.PRIVATE, false),
            new StateVariable("NAME", "string", Visibility.PUBLIC, false));
    }

    @Test
    void extract_functionsAndEvents_ignoreModifiers() {
        ExtractionResult result = extractor.extract(TestFixtures.sources("Ownable.sol", "Staking.sol"));

        ContractUnit ownable = contract(result, "Ownable");
        assertThat(ownable.functions()).extracting(FunctionUnit::name)
            .containsExactly("constructor", "transferOwnership");
        assertThat(ownable.events()).extracting(EventUnit::name).containsExactly("OwnershipTransferred");

        ContractUnit staking = contract(result, "Staking");
        assertThat(staking.functions()).extracting(FunctionUnit::name)
            .containsExactly("constructor", "stake", "unstake", "stakedOf", "_sync");
        assertThat(function(staking, "constructor").kind()).isEqualTo(FunctionKind.CONSTRUCTOR);
        assertThat(function(staking, "constructor").parameters()).containsExactly(
            new Parameter("token_", "IERC20"), new Parameter("pool_", "RewardPool"));
        assertThat(function(staking, "stakedOf").returns()).containsExactly(new Parameter("staked", "uint256"));
        assertThat(function(staking, "stakedOf").mutability()).isEqualTo(StateMutability.VIEW);
        assertThat(function(staking, "_sync").visibility()).isEqualTo(Visibility.INTERNAL);

        ContractUnit token = contract(result, "IERC20");
        assertThat(token.functions()).extracting(FunctionUnit::name).containsExactly("transferFrom", "transfer");
        assertThat(token.functions()).allSatisfy(function -> {
            assertThat(function.visibility()).isEqualTo(Visibility.EXTERNAL);
            assertThat(function.effects()).isEmpty();
        });
    }

    @Test
    @DisplayName("Body effects: calls precede the write of the same statement, strings are opaque")
    void extract_functionBody_classifiesEffectsInOrder() {
        ExtractionResult result = extractor.extract(TestFixtures.sources("Ownable.sol", "Staking.sol"));

        assertThat(function(contract(result, "Staking"), "stake").effects()).containsExactly(
            new BodyEffect.ExternalCall("stakingToken", "transferFrom",
                List.of("msg.sender", "address(this)", "amount")),
            new BodyEffect.StorageWrite("stakes", "stakes[msg.sender] += amount"),
            new BodyEffect.StorageWrite("totalStaked", "totalStaked += amount"),
            new BodyEffect.ExternalCall("pool", "notify", List.of("msg.sender", "amount")),
            new BodyEffect.EmitEvent("Staked", List.of("msg.sender", "amount")));
    }

    @Test
    void extract_localDeclaration_shadowsStateVariable() {
        ExtractionResult result = extractor.extract(TestFixtures.sources("Ownable.sol", "Staking.sol"));

        assertThat(function(contract(result, "Staking"), "unstake").effects()).containsExactly(
            new BodyEffect.StorageWrite("totalStaked", "totalStaked -= stakes"),
            new BodyEffect.ExternalCall("stakingToken", "transfer", List.of("msg.sender", "amount")),
            new BodyEffect.ExternalCall("stakingToken", "transfer", List.of("owner", "0")));
    }

    @Test
    void extract_inheritedStateVariable_isRecognised() {
        ExtractionResult result = extractor.extract(TestFixtures.sources("Ownable.sol", "Staking.sol"));

        assertThat(function(contract(result, "Ownable"), "transferOwnership").effects()).containsExactly(
            new BodyEffect.EmitEvent("OwnershipTransferred", List.of("owner", "newOwner")),
            new BodyEffect.StorageWrite("owner", "owner = newOwner"));
        assertThat(function(contract(result, "Staking"), "_sync").effects()).containsExactly(
            new BodyEffect.StorageWrite("totalStaked", "delete totalStaked"));
    }

    @Test
    @DisplayName("Pre-0.5 syntax: named constructor, constant and bare event calls")
    void extract_legacySyntax() {
        // Given
        String source = """
            pragma solidity ^0.4.24;

            contract Legacy {
                uint public total;
                event Added(uint amount);

                function Legacy() public {
                    total = 1;
                }

                function add(uint amount) public constant returns (uint) {
                    total += amount;
                    Added(amount);
                    return total;
                }
            }
            """;

        // When
        ContractUnit legacy = extract(source).contracts().get(0);

        // Then
        assertThat(legacy.functions()).extracting(FunctionUnit::name).containsExactly("constructor", "add");
        assertThat(function(legacy, "constructor").kind()).isEqualTo(FunctionKind.CONSTRUCTOR);
        FunctionUnit add = function(legacy, "add");
        assertThat(add.mutability()).isEqualTo(StateMutability.VIEW);
        assertThat(add.effects()).containsExactly(
            new BodyEffect.StorageWrite("total", "total += amount"),
            new BodyEffect.EmitEvent("Added", List.of("amount")));
    }

    @Test
    void extract_callOptionsAndGuardedWrites() {
        String source = """
            contract Router {
                Vault public vault;

                function route() external payable {
                    vault.deposit{value: msg.value}(msg.sender);
                    if (msg.value > 1 ether) counter++;
                }

                uint256 counter;
            }

            contract Vault {
                function deposit(address user) external payable {}
            }
            """;

        ExtractionResult result = extract(source);
        FunctionUnit route = function(contract(result, "Router"), "route");

        assertThat(route.mutability()).isEqualTo(StateMutability.PAYABLE);
        assertThat(route.effects()).containsExactly(
            new BodyEffect.ExternalCall("vault", "deposit", List.of("msg.sender")),
            new BodyEffect.StorageWrite("counter", "counter++"));
        assertThat(function(contract(result, "Vault"), "deposit").effects()).isEmpty();
    }

    @Test
    void extract_libraryAndNestedBlocks() {
        String source = """
            library MathLib {
                function max(uint256 a, uint256 b) internal pure returns (uint256) {
                    if (a > b) { return a; } else { return b; }
                }
            }
            """;

        ContractUnit library = extract(source).contracts().get(0);

        assertThat(library.kind()).isEqualTo(ContractKind.LIBRARY);
        assertThat(library.functions()).singleElement().satisfies(max -> {
            assertThat(max.mutability()).isEqualTo(StateMutability.PURE);
            assertThat(max.effects()).isEmpty();
        });
    }

    @Test
    @DisplayName("Unbalanced braces: partial extraction plus warnings")
    void extract_unbalancedBraces_degradesGracefully() {
        // When
        ExtractionResult result = extractor.extract(TestFixtures.sources("Broken.sol"));

        // Then
        assertThat(result.contracts()).singleElement().satisfies(broken -> {
            assertThat(broken.name()).isEqualTo("Broken");
            assertThat(broken.stateVariables()).extracting(StateVariable::name).containsExactly("value");
            assertThat(broken.events()).hasSize(1);
            assertThat(broken.functions()).singleElement().satisfies(set ->
                assertThat(set.effects()).containsExactly(
                    new BodyEffect.StorageWrite("value", "value = v"),
                    new BodyEffect.EmitEvent("Changed", List.of("v"))));
        });
        assertThat(result.warnings()).hasSize(2)
            .allSatisfy(warning -> assertThat(warning).contains("Unbalanced braces"));
    }

    @Test
    @DisplayName("Foreign statements in a body are skipped, valid ones still classified")
    void extract_foreignStatements_degradeGracefully() {
        // Given
        String source = """
            contract Odd {
                uint256 x;

                function f() public {
                    @@@ ??? ;; x = 1; assembly { sstore(0, 1) }
                }
            }
            """;

        // When
        ExtractionResult result = extract(source);

        // Then
        assertThat(function(contract(result, "Odd"), "f").effects())
            .containsExactly(new BodyEffect.StorageWrite("x", "x = 1"));
        assertThat(result.warnings()).isEmpty();
    }

    @Test
    void extract_nestedIndexWrites_recordRootVariable() {
        // Given
        String source = """
            contract Ledger {
                mapping(address => uint256) balances;
                mapping(address => Stake) stakes;
                address[] holders;

                function f(uint256 i) public {
                    balances[holders[i]] = 1;
                    stakes[holders[i + 1]].amount += balances[holders[i]];
                    balances[holders[i]] == 1;
                }
            }
            """;

        // When
        FunctionUnit f = function(contract(extract(source), "Ledger"), "f");

        // Then
        assertThat(f.effects()).containsExactly(
            new BodyEffect.StorageWrite("balances", "balances[holders[i]] = 1"),
            new BodyEffect.StorageWrite("stakes", "stakes[holders[i + 1]].amount += balances[holders[i]]"));
    }

    @Test
    void extract_functionTypeStateVariable_isNotAFunction() {
        // Given
        String source = """
            contract Hooks {
                function (uint256) external returns (uint256) callback;
                function (address) internal view public checker;
                uint256 x;

                function run() external {}
            }
            """;

        // When
        ContractUnit hooks = contract(extract(source), "Hooks");

        // Then
        assertThat(hooks.functions()).extracting(FunctionUnit::name).containsExactly("run");
        assertThat(hooks.stateVariables()).containsExactly(
            new StateVariable("callback", "function(uint256) external returns(uint256)", Visibility.INTERNAL, false),
            new StateVariable("checker", "function(address) internal view", Visibility.PUBLIC, false),
            new StateVariable("x", "uint256", Visibility.INTERNAL, false));
    }

    @Test
    void extract_sourceWithoutDeclarations_returnsNoContracts() {
        ExtractionResult result = extract("pragma solidity ^0.8.0;\nimport \"./Other.sol\";\n");

        assertThat(result.contracts()).isEmpty();
        assertThat(result.warnings()).isEmpty();
    }
}
