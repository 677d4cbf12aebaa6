package com.pipeforge.compiler.compile;

import com.pipeforge.compiler.graph.GraphAnalysis;
import com.pipeforge.compiler.graph.GraphAnalyzer;
import com.pipeforge.compiler.graph.ProcessorChainSource;
import com.pipeforge.compiler.model.FlowKind;
import com.pipeforge.compiler.model.Node;
import com.pipeforge.compiler.model.PipelineGraph;
import com.pipeforge.compiler.model.PipelineSettings;
import com.pipeforge.compiler.workflow.BranchHandle;
import com.pipeforge.compiler.workflow.BranchTarget;
import com.pipeforge.compiler.workflow.ChainingState;
import com.pipeforge.compiler.workflow.ChoiceRule;
import com.pipeforge.compiler.workflow.ChoiceState;
import com.pipeforge.compiler.workflow.CompiledWorkflow;
import com.pipeforge.compiler.workflow.FailState;
import com.pipeforge.compiler.workflow.MapState;
import com.pipeforge.compiler.workflow.ParallelState;
import com.pipeforge.compiler.workflow.PassState;
import com.pipeforge.compiler.workflow.RetryPolicy;
import com.pipeforge.compiler.workflow.TaskState;
import com.pipeforge.compiler.workflow.WaitState;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.pipeforge.compiler.PipelineFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;

class StateSynthesizerTest {

    private final GraphAnalyzer    analyzer    = new GraphAnalyzer();
    private final StateSynthesizer synthesizer = new StateSynthesizer(analyzer, new GraphLinker());
    private final List<CompileWarning> warnings = new ArrayList<>();

    // ------------------------------------------------------------------
    // Task
    // ------------------------------------------------------------------

    @Test
    void task_firstCompute_carriesExecutionContextParameters() {
        Node node = compute("a", "Extract");
        CompileContext ctx = context(List.of(node), handlesFor("a"), "a");

        TaskState task = (TaskState) synthesizer.synthesize(node, "Extract_a", ctx).primaryState();

        assertThat(task.resource()).isEqualTo(ARN_PREFIX + "a");
        assertThat(task.parameters())
                .containsEntry("executionName.$", "$$.Execution.Name")
                .containsEntry("stateMachineArn.$", "$$.StateMachine.Id")
                .containsEntry("payload.$", "$");
    }

    @Test
    void task_otherCompute_passesInputThroughWithTwoTierRetry() {
        Node node = compute("b", "Proxy");
        PipelineSettings settings = new PipelineSettings(7, 4, null, null);
        CompileContext ctx = context(List.of(compute("a", "Extract"), node), handlesFor("a", "b"), "a", settings);

        TaskState task = (TaskState) synthesizer.synthesize(node, "Proxy_b", ctx).primaryState();

        assertThat(task.parameters()).isNull();
        assertThat(task.retry()).containsExactly(
                new RetryPolicy(List.of("Lambda.TooManyRequestsException"), 1, 5, 2.0),
                new RetryPolicy(List.of("States.ALL"), 4, 7, 2.0));
        assertThat(task.next()).isNull();
    }

    @Test
    void task_missingHandle_emitsDiagnosticPassAndWarning() {
        Node node = compute("a", "Extract");
        CompileContext ctx = context(List.of(node), HandleResolver.none(), "a");

        NodeStates states = synthesizer.synthesize(node, "Extract_a", ctx);

        assertThat(states.primaryState()).isInstanceOf(PassState.class);
        assertThat(((PassState) states.primaryState()).result())
                .isEqualTo(Map.of("message", "No compute handle for extract"));
        assertThat(warnings).singleElement()
                .satisfies(w -> {
                    assertThat(w.kind()).isEqualTo(CompileWarning.Kind.MISSING_HANDLE);
                    assertThat(w.elementId()).isEqualTo("a");
                });
    }

    // ------------------------------------------------------------------
    // Wait
    // ------------------------------------------------------------------

    @Test
    void wait_nonNumericDuration_defaultsToOneSecondWithWarning() {
        WaitState wait = waitWith(Map.of("parameters", Map.of("Duration", "abc")));

        assertThat(wait.seconds()).isEqualTo(1);
        assertThat(warnings).extracting(CompileWarning::kind).containsExactly(CompileWarning.Kind.INVALID_PARAMETER);
    }

    @Test
    void wait_fractionalDuration_isFloored() {
        assertThat(waitWith(Map.of("parameters", Map.of("Duration", "2.7"))).seconds()).isEqualTo(2);
        assertThat(warnings).isEmpty();
    }

    @Test
    void wait_negativeDuration_isClampedToZero() {
        assertThat(waitWith(Map.of("parameters", Map.of("Duration", -5))).seconds()).isZero();
    }

    @Test
    void wait_topLevelDuration_usedWhenParametersHaveNone() {
        assertThat(waitWith(Map.of("duration", 30)).seconds()).isEqualTo(30);
    }

    @Test
    void wait_noDuration_defaultsToOneSecond() {
        assertThat(waitWith(Map.of()).seconds()).isEqualTo(1);
        assertThat(warnings).isEmpty();
    }

    // ------------------------------------------------------------------
    // Choice / Fail / Parallel / Pass
    // ------------------------------------------------------------------

    @Test
    void choice_noConditions_emitsOneDefaultRuleAndOneDefaultPlaceholder() {
        Node node = flow("c", FlowKind.CHOICE);
        ChoiceState choice = (ChoiceState) synthesizer.synthesize(node, "Choice_c",
                context(List.of(node), HandleResolver.none(), null)).primaryState();

        assertThat(choice.choices()).singleElement().satisfies(rule -> {
            assertThat(rule.variable()).isEqualTo("$.metadata.externalJobStatus");
            assertThat(rule.operator()).isEqualTo(ChoiceRule.Operator.STRING_EQUALS);
            assertThat(rule.operand()).isEqualTo("Completed");
            assertThat(rule.next()).isEqualTo(BranchTarget.pending("c", BranchHandle.Branch.TRUE));
        });
        assertThat(choice.defaultTarget()).isEqualTo(BranchTarget.pending("c", BranchHandle.Branch.DEFAULT));
    }

    @Test
    void choice_configuredConditions_becomeStringEqualsRules() {
        Node node = flow("c", FlowKind.CHOICE, Map.of("choices", List.of(
                Map.of("variable", "$.status", "value", "READY"),
                Map.of("value", "Done"))));
        ChoiceState choice = (ChoiceState) synthesizer.synthesize(node, "Choice_c",
                context(List.of(node), HandleResolver.none(), null)).primaryState();

        assertThat(choice.choices()).extracting(ChoiceRule::variable)
                .containsExactly("$.status", "$.metadata.externalJobStatus");
        assertThat(choice.choices()).extracting(ChoiceRule::operand).containsExactly("READY", "Done");
        assertThat(warnings).extracting(CompileWarning::kind).containsExactly(CompileWarning.Kind.INVALID_PARAMETER);
    }

    @Test
    void choice_hasNoExits() {
        Node node = flow("c", FlowKind.CHOICE);
        NodeStates states = synthesizer.synthesize(node, "Choice_c",
                context(List.of(node), HandleResolver.none(), null));

        assertThat(states.exits()).isEmpty();
    }

    @Test
    void fail_withoutConfiguration_usesDefaultErrorAndCause() {
        Node node = flow("f", FlowKind.FAIL);
        FailState fail = (FailState) synthesizer.synthesize(node, "Fail_f",
                context(List.of(node), HandleResolver.none(), null)).primaryState();

        assertThat(fail.error()).isEqualTo("FlowFailure");
        assertThat(fail.cause()).isEqualTo("Flow step failed");
    }

    @Test
    void parallel_branchesArePassedThroughVerbatim() {
        Map<String, Object> branch = Map.of("StartAt", "A", "States", Map.of("A", Map.of("Type", "Pass", "End", true)));
        Node node = flow("p", FlowKind.PARALLEL, Map.of("branches", List.of(branch)));

        ParallelState parallel = (ParallelState) synthesizer.synthesize(node, "Parallel_p",
                context(List.of(node), HandleResolver.none(), null)).primaryState();

        assertThat(parallel.branches()).containsExactly(branch);
        assertThat(parallel.isEnd()).isTrue();
    }

    @Test
    void pass_withResult_keepsIt() {
        Node node = flow("p", FlowKind.PASS, Map.of("result", Map.of("ok", true)));

        PassState pass = (PassState) synthesizer.synthesize(node, "Pass_p",
                context(List.of(node), HandleResolver.none(), null)).primaryState();

        assertThat(pass.result()).isEqualTo(Map.of("ok", true));
    }

    // ------------------------------------------------------------------
    // Map
    // ------------------------------------------------------------------

    @Test
    void map_concurrencyWithinRange_isKept() {
        assertThat(mapWith(Map.of("parameters", Map.of("ConcurrencyLimit", 25))).maxConcurrency()).isEqualTo(25);
        assertThat(mapWith(Map.of("parameters", Map.of("ConcurrencyLimit", 40))).maxConcurrency()).isEqualTo(40);
    }

    @Test
    void map_concurrencyAboveForty_isClamped() {
        assertThat(mapWith(Map.of("parameters", Map.of("ConcurrencyLimit", 41))).maxConcurrency()).isEqualTo(40);
        assertThat(mapWith(Map.of("parameters", Map.of("ConcurrencyLimit", 500))).maxConcurrency()).isEqualTo(40);
    }

    @Test
    void map_concurrencyZeroOrAbsent_isOmitted() {
        assertThat(mapWith(Map.of("parameters", Map.of("ConcurrencyLimit", 0))).maxConcurrency()).isNull();
        assertThat(mapWith(Map.of()).maxConcurrency()).isNull();
    }

    @Test
    void map_invalidConcurrency_isOmittedWithWarning() {
        assertThat(mapWith(Map.of("parameters", Map.of("ConcurrencyLimit", "lots"))).maxConcurrency()).isNull();
        assertThat(warnings).extracting(CompileWarning::kind).containsExactly(CompileWarning.Kind.INVALID_PARAMETER);
    }

    @Test
    void map_itemsPathDefaultsToPayloadData() {
        MapState map = mapWith(Map.of());

        assertThat(map.itemsPath()).isEqualTo("$.payload.data");
        assertThat(map.parameters()).isEqualTo(Map.of("item.$", "$$.Map.Item.Value"));
        assertThat(map.retry()).last().extracting(RetryPolicy::maxAttempts).isEqualTo(5);
        assertThat(map.iterator().startAt()).isEqualTo("PassState");
    }

    @Test
    void map_configuredItemsPath_isUsed() {
        assertThat(mapWith(Map.of("itemsPath", "$.items")).itemsPath()).isEqualTo("$.items");
    }

    @Test
    void map_dualSource_emitsChoiceAndTwoMapsDifferingOnlyInItemsPath() {
        Node node = flow("m", FlowKind.MAP, Map.of("supportExternalPayload", true,
                "parameters", Map.of("ConcurrencyLimit", 10)));

        NodeStates states = synthesizer.synthesize(node, "Map_m",
                context(List.of(node), HandleResolver.none(), null));

        ChoiceState dispatch = (ChoiceState) states.primaryState();
        assertThat(dispatch.choices()).singleElement().satisfies(rule -> {
            assertThat(rule.variable()).isEqualTo("$.payload.data");
            assertThat(rule.operator()).isEqualTo(ChoiceRule.Operator.IS_PRESENT);
            assertThat(rule.next()).isEqualTo(BranchTarget.state("Map_m_Map"));
        });
        assertThat(dispatch.defaultTarget()).isEqualTo(BranchTarget.state("Map_m_StandardMap"));
        assertThat(states.exits()).containsExactly("Map_m_Map", "Map_m_StandardMap");

        MapState inline   = (MapState) states.states().get("Map_m_Map");
        MapState standard = (MapState) states.states().get("Map_m_StandardMap");
        assertThat(inline.itemsPath()).isEqualTo("$.payload.data");
        assertThat(standard.itemsPath()).isEqualTo("$.payload.externalTaskResults");
        assertThat(standard.withItemsPath(inline.itemsPath())).isEqualTo(inline);
    }

    @Test
    void map_processorChain_compilesToLinkedIterator() {
        Node map = flow("m", FlowKind.MAP);
        Node p1  = compute("p1", "Resize");
        Node p2  = compute("p2", "Watermark");
        CompileContext ctx = context(List.of(map, p1, p2), handlesFor("p1", "p2"), null,
                PipelineSettings.defaults(), ProcessorChainSource.fromMap(Map.of("m", List.of("p1", "p2"))));

        CompiledWorkflow iterator = ((MapState) synthesizer.synthesize(map, "Map_m", ctx).primaryState()).iterator();

        assertThat(iterator.startAt()).isEqualTo("Processor_0_Resize");
        assertThat(iterator.states()).containsOnlyKeys("Processor_0_Resize", "Processor_1_Watermark");
        assertThat(((ChainingState) iterator.state("Processor_0_Resize")).next()).isEqualTo("Processor_1_Watermark");
        assertThat(((ChainingState) iterator.state("Processor_1_Watermark")).isEnd()).isTrue();
        assertThat(((TaskState) iterator.state("Processor_0_Resize")).resource()).isEqualTo(ARN_PREFIX + "p1");
    }

    @Test
    void map_processorChainWithMissingHandle_degradesToNoOpIterator() {
        Node map = flow("m", FlowKind.MAP);
        Node p1  = compute("p1", "Resize");
        Node p2  = compute("p2", "Watermark");
        CompileContext ctx = context(List.of(map, p1, p2), handlesFor("p1"), null,
                PipelineSettings.defaults(), ProcessorChainSource.fromMap(Map.of("m", List.of("p1", "p2"))));

        CompiledWorkflow iterator = ((MapState) synthesizer.synthesize(map, "Map_m", ctx).primaryState()).iterator();

        assertThat(iterator.startAt()).isEqualTo("PassState");
        assertThat(iterator.states()).containsOnlyKeys("PassState");
        assertThat(warnings).extracting(CompileWarning::elementId).contains("p2");
    }

    @Test
    void map_processorChainWithFlowMember_degradesToNoOpIterator() {
        Node map    = flow("m", FlowKind.MAP);
        Node p1     = compute("p1", "Resize");
        Node choice = flow("ch", FlowKind.CHOICE);
        CompileContext ctx = context(List.of(map, p1, choice), handlesFor("p1"), null,
                PipelineSettings.defaults(), ProcessorChainSource.fromMap(Map.of("m", List.of("p1", "ch"))));

        CompiledWorkflow iterator = ((MapState) synthesizer.synthesize(map, "Map_m", ctx).primaryState()).iterator();

        assertThat(iterator.states()).containsOnlyKeys("PassState");
        assertThat(warnings).singleElement().satisfies(w -> {
            assertThat(w.kind()).isEqualTo(CompileWarning.Kind.INVALID_PARAMETER);
            assertThat(w.elementId()).isEqualTo("ch");
        });
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private WaitState waitWith(Map<String, Object> configuration) {
        Node node = flow("w", FlowKind.WAIT, configuration);
        return (WaitState) synthesizer.synthesize(node, "Wait_w",
                context(List.of(node), HandleResolver.none(), null)).primaryState();
    }

    private MapState mapWith(Map<String, Object> configuration) {
        Node node = flow("m", FlowKind.MAP, configuration);
        return (MapState) synthesizer.synthesize(node, "Map_m",
                context(List.of(node), HandleResolver.none(), null)).primaryState();
    }

    private CompileContext context(List<Node> nodes, HandleResolver handles, String firstComputeId) {
        return context(nodes, handles, firstComputeId, PipelineSettings.defaults());
    }

    private CompileContext context(List<Node> nodes, HandleResolver handles, String firstComputeId,
                                   PipelineSettings settings) {
        return context(nodes, handles, firstComputeId, settings, ProcessorChainSource.fromMap(Map.of()));
    }

    private CompileContext context(List<Node> nodes, HandleResolver handles, String firstComputeId,
                                   PipelineSettings settings, ProcessorChainSource chains) {
        GraphAnalysis analysis = analyzer.analyze(new PipelineGraph(PIPELINE, nodes, List.of(), settings));
        return new CompileContext(analysis, handles, chains, firstComputeId, warnings);
    }
}
