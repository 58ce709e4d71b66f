package io.decisionflow.core.graph;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.decisionflow.core.error.DecisionBuildException;
import io.decisionflow.core.model.DecisionGraph;
import io.decisionflow.core.model.DecisionNode;
import io.decisionflow.core.model.DecisionSpec;
import io.decisionflow.core.model.NodeContent;
import io.decisionflow.core.spi.NodeBuilder;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.slf4j.LoggerFactory;

/** Tests for {@link DecisionGraphCompiler}. */
class DecisionGraphCompilerTest {

    private final DecisionGraphCompiler compiler = new DecisionGraphCompiler();

    private static DecisionSpec function(String id) {
        return DecisionSpec.builder(id, "function").function("return input;").build();
    }

    @Nested
    @DisplayName("graph shape")
    class Shape {

        @Test
        void emptyInputGivesOnlySentinels() {
            DecisionGraph graph = compiler.compile(List.of());

            assertThat(graph.nodes()).hasSize(2);
            assertThat(graph.edges()).isEmpty();
            assertThat(graph.inputNode()).isEqualTo(DecisionNode.request());
            assertThat(graph.outputNode()).isEqualTo(DecisionNode.response());
        }

        @ParameterizedTest
        @ValueSource(ints = {1, 3, 10})
        void unconnectedDecisionsGiveNPlusTwoNodesAndNoEdges(int n) {
            List<DecisionSpec> specs = new ArrayList<>();
            for (int i = 0; i < n; i++) {
                specs.add(function("d" + i));
            }

            DecisionGraph graph = compiler.compile(specs);

            assertThat(graph.nodes()).hasSize(n + 2);
            assertThat(graph.edges()).isEmpty();
        }

        @ParameterizedTest
        @ValueSource(ints = {1, 3, 10})
        void oneSourceAndOneTargetEachGivesTwoNEdges(int n) {
            List<DecisionSpec> specs = new ArrayList<>();
            for (int i = 0; i < n; i++) {
                specs.add(DecisionSpec.builder("d" + i, "function")
                        .sources(i == 0 ? "request" : "d" + (i - 1))
                        .targets(i == n - 1 ? "response" : "d" + (i + 1))
                        .build());
            }

            DecisionGraph graph = compiler.compile(specs);

            assertThat(graph.nodes()).hasSize(n + 2);
            assertThat(graph.edges()).hasSize(2 * n);
            assertThat(graph.danglingEdges()).isEmpty();
        }

        @Test
        void decisionNodesKeepInputOrder() {
            DecisionGraph graph = compiler.compile(List.of(
                    function("c"),
                    DecisionSpec.builder("a", "table").inputs("x").outputs("y").build(),
                    DecisionSpec.builder("b", "expression").expression("$x + 1").inputs("y").build()));

            assertThat(graph.nodes())
                    .extracting(DecisionNode::id)
                    .containsExactly("request", "c", "a", "b", "response");
            assertThat(graph.nodes())
                    .extracting(n -> n.content().type())
                    .containsExactly("inputNode", "functionNode", "decisionTableNode", "expressionNode", "outputNode");
        }

        @Test
        void cyclesAndDanglingReferencesCompile() {
            DecisionGraph graph = compiler.compile(List.of(
                    DecisionSpec.builder("a", "function").targets("b").build(),
                    DecisionSpec.builder("b", "function").targets("a", "ghost").build()));

            assertThat(graph.edges()).hasSize(3);
            assertThat(graph.danglingEdges()).hasSize(1);
        }

        @Test
        void compilingTwiceGivesEqualGraphs() {
            List<DecisionSpec> specs = List.of(
                    DecisionSpec.builder("a", "table").rules(List.of(Map.of("x", "1"))).build(), function("b"));

            assertThat(compiler.compile(specs)).isEqualTo(compiler.compile(specs));
        }
    }

    @Nested
    @DisplayName("build errors")
    class BuildErrors {

        @Test
        void unknownKindIsBuildErrorNotCrash() {
            List<DecisionSpec> specs = List.of(function("a"), DecisionSpec.builder("b", "neural").build());

            assertThatThrownBy(() -> compiler.compile(specs))
                    .isInstanceOfSatisfying(DecisionBuildException.class, e -> {
                        assertThat(e.decisionId()).isEqualTo("b");
                        assertThat(e.kind()).isEqualTo("neural");
                    });
        }

        @Test
        void expressionWithoutInputsIsBuildError() {
            List<DecisionSpec> specs = List.of(DecisionSpec.builder("e", "expression").expression("1").build());

            assertThatThrownBy(() -> compiler.compile(specs)).isInstanceOf(DecisionBuildException.class);
        }

        @Test
        void duplicateIdIsBuildError() {
            assertThatThrownBy(() -> compiler.compile(List.of(function("a"), function("a"))))
                    .isInstanceOf(DecisionBuildException.class)
                    .hasMessageContaining("Duplicate decision id: 'a'");
        }

        @ParameterizedTest
        @ValueSource(strings = {"request", "response"})
        void sentinelIdIsReserved(String id) {
            assertThatThrownBy(() -> compiler.compile(List.of(function(id))))
                    .isInstanceOf(DecisionBuildException.class)
                    .hasMessageContaining("reserved");
        }

        @Test
        void skippingModeKeepsGoodDecisionsAndReportsBadOnes() {
            List<DecisionSpec> specs = List.of(
                    DecisionSpec.builder("a", "function").targets("b").build(),
                    DecisionSpec.builder("b", "neural").targets("c").build(),
                    function("c"));

            CompilationResult result = compiler.compileSkippingFailures(specs);

            assertThat(result.isComplete()).isFalse();
            assertThat(result.failures()).extracting(DecisionBuildException::decisionId).containsExactly("b");
            assertThat(result.graph().nodes())
                    .extracting(DecisionNode::id)
                    .containsExactly("request", "a", "c", "response");
            assertThat(result.graph().edges()).hasSize(2);
            assertThat(result.graph().danglingEdges()).hasSize(2);
        }

        @Test
        void skippingModeWithoutFailuresIsComplete() {
            CompilationResult result = compiler.compileSkippingFailures(List.of(function("a")));

            assertThat(result.isComplete()).isTrue();
            assertThat(result.graph()).isEqualTo(compiler.compile(List.of(function("a"))));
        }
    }

    @Nested
    @DisplayName("custom builders")
    class CustomBuilders {

        @Test
        void compilerUsesInjectedRegistry() {
            DecisionGraphCompiler functionsOnly = new DecisionGraphCompiler(
                    NodeBuilderRegistry.builder().register(new FunctionNodeBuilder()).build());

            assertThat(functionsOnly.compile(List.of(function("f"))).decisionNodes())
                    .extracting(DecisionNode::content)
                    .allMatch(c -> c instanceof NodeContent.Function);
            assertThatThrownBy(() -> functionsOnly.compile(List.of(DecisionSpec.builder("t", "table").build())))
                    .isInstanceOf(DecisionBuildException.class);
        }
    }

    @Nested
    @DisplayName("misbehaving builders")
    class MisbehavingBuilders {

        private DecisionGraphCompiler compilerWith(Function<DecisionSpec, DecisionNode> build) {
            NodeBuilder builder = new NodeBuilder() {
                @Override
                public String kind() {
                    return "rogue";
                }

                @Override
                public DecisionNode build(DecisionSpec spec) {
                    return build.apply(spec);
                }
            };
            return new DecisionGraphCompiler(NodeBuilderRegistry.builder()
                    .register(new FunctionNodeBuilder())
                    .register(builder)
                    .build());
        }

        private static DecisionSpec rogue(String id) {
            return DecisionSpec.builder(id, "rogue").build();
        }

        @Test
        void nodeWithForeignIdIsBuildError() {
            DecisionGraphCompiler rogueCompiler =
                    compilerWith(spec -> new DecisionNode("other", "other", new NodeContent.Function("")));

            assertThatThrownBy(() -> rogueCompiler.compile(List.of(rogue("a"), rogue("b"))))
                    .isInstanceOfSatisfying(DecisionBuildException.class, e -> {
                        assertThat(e.decisionId()).isEqualTo("a");
                        assertThat(e.getMessage()).contains("'other'");
                    });
        }

        @Test
        void sentinelNodeIsBuildError() {
            DecisionGraphCompiler rogueCompiler =
                    compilerWith(spec -> new DecisionNode(spec.id(), spec.id(), new NodeContent.Input()));

            assertThatThrownBy(() -> rogueCompiler.compile(List.of(rogue("a"))))
                    .isInstanceOf(DecisionBuildException.class)
                    .hasMessageContaining("inputNode");
        }

        @Test
        void missingNodeIsBuildError() {
            DecisionGraphCompiler rogueCompiler = compilerWith(spec -> null);

            assertThatThrownBy(() -> rogueCompiler.compile(List.of(rogue("a"))))
                    .isInstanceOf(DecisionBuildException.class)
                    .hasMessageContaining("returned no node");
        }

        @Test
        void skippingModeCollectsEveryRogueNode() {
            DecisionGraphCompiler rogueCompiler = compilerWith(spec -> switch (spec.id()) {
                case "sentinel" -> new DecisionNode(spec.id(), spec.id(), new NodeContent.Output());
                case "renamed" -> new DecisionNode("other", "other", new NodeContent.Function(""));
                default -> null;
            });

            CompilationResult result = rogueCompiler.compileSkippingFailures(
                    List.of(rogue("sentinel"), function("good"), rogue("renamed"), rogue("empty")));

            assertThat(result.failures())
                    .extracting(DecisionBuildException::decisionId)
                    .containsExactly("sentinel", "renamed", "empty");
            assertThat(result.graph().nodes())
                    .extracting(DecisionNode::id)
                    .containsExactly("request", "good", "response");
        }
    }

    @Nested
    @DisplayName("logging")
    class Logging {

        private Logger compilerLogger;
        private ListAppender<ILoggingEvent> logAppender;

        @BeforeEach
        void attachAppender() {
            compilerLogger = (Logger) LoggerFactory.getLogger(DecisionGraphCompiler.class);
            logAppender = new ListAppender<>();
            logAppender.start();
            compilerLogger.addAppender(logAppender);
        }

        @AfterEach
        void detachAppender() {
            compilerLogger.detachAppender(logAppender);
            logAppender.stop();
        }

        @Test
        void compilationLogsCountsAtInfo() {
            compiler.compile(List.of(DecisionSpec.builder("a", "function").sources("request").build()));

            assertThat(logAppender.list)
                    .filteredOn(e -> e.getLevel() == Level.INFO)
                    .extracting(ILoggingEvent::getFormattedMessage)
                    .containsExactly("Compiled decision graph: decisions=1, nodes=3, edges=1");
        }

        @Test
        void skippedDecisionIsLoggedAtWarn() {
            compiler.compileSkippingFailures(List.of(DecisionSpec.builder("x", "neural").build()));

            assertThat(logAppender.list)
                    .filteredOn(e -> e.getLevel() == Level.WARN)
                    .extracting(ILoggingEvent::getFormattedMessage)
                    .singleElement()
                    .asString()
                    .startsWith("Skipping decision x");
        }
    }
}
