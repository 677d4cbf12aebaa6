package com.pipeforge.compiler.compile;

import com.pipeforge.compiler.model.Edge;
import com.pipeforge.compiler.model.FlowKind;
import com.pipeforge.compiler.model.Node;
import com.pipeforge.compiler.model.NodeRole;
import com.pipeforge.compiler.model.PipelineConfigurationException;
import com.pipeforge.compiler.model.PipelineSettings;
import com.pipeforge.compiler.workflow.ChainingState;
import com.pipeforge.compiler.workflow.CompiledWorkflow;
import com.pipeforge.compiler.workflow.MapState;
import com.pipeforge.compiler.workflow.PassState;
import com.pipeforge.compiler.workflow.TaskState;
import com.pipeforge.compiler.workflow.WorkflowState;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.pipeforge.compiler.PipelineFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkflowCompilerTest {

    private final WorkflowCompiler compiler = newWorkflowCompiler();

    @Test
    void compile_singleComputeNode_yieldsOneTerminalTask() {
        Node a = compute("a", "Extract");

        CompiledWorkflow workflow = compiler.compile(
                graph(List.of(trigger("t"), a), List.of(edge("t", "a"))), handlesFor("a"));

        assertThat(workflow.states()).hasSize(1);
        assertThat(workflow.startAt()).isEqualTo(stateOf(a));
        TaskState task = (TaskState) workflow.state(stateOf(a));
        assertThat(task.isEnd()).isTrue();
        assertThat(task.parameters()).containsKeys("executionName.$", "stateMachineArn.$", "payload.$");
    }

    @Test
    void compile_sequentialComputeNodes_visitsEveryStateInSourceOrder() {
        int n = 5;
        List<Node> nodes = new ArrayList<>(List.of(trigger("t")));
        List<Edge> edges = new ArrayList<>();
        String[] ids = new String[n];
        for (int i = 0; i < n; i++) {
            ids[i] = "c" + i;
            nodes.add(compute(ids[i], "Step" + i));
            edges.add(edge(i == 0 ? "t" : ids[i - 1], ids[i]));
        }

        CompiledWorkflow workflow = compiler.compile(graph(nodes, edges), handlesFor(ids));

        List<String> visited = new ArrayList<>();
        String current = workflow.startAt();
        while (current != null) {
            visited.add(current);
            current = ((ChainingState) workflow.state(current)).next();
        }
        assertThat(visited).containsExactly("Step0_c0", "Step1_c1", "Step2_c2", "Step3_c3", "Step4_c4");
    }

    @Test
    void compile_onlyFirstComputeCarriesExecutionContext() {
        Node a = compute("a", "Extract");
        Node b = compute("b", "Proxy");

        CompiledWorkflow workflow = compiler.compile(
                graph(List.of(trigger("t"), a, b), List.of(edge("t", "a"), edge("a", "b"))),
                handlesFor("a", "b"));

        assertThat(((TaskState) workflow.state(stateOf(a))).parameters()).isNotNull();
        assertThat(((TaskState) workflow.state(stateOf(b))).parameters()).isNull();
    }

    @Test
    void compile_noComputeNodes_yieldsSinglePassState() {
        CompiledWorkflow workflow = compiler.compile(
                graph(List.of(trigger("t"), flow("w", FlowKind.WAIT)), List.of(edge("t", "w"))),
                HandleResolver.none());

        assertThat(workflow.startAt()).isEqualTo("PassState");
        assertThat(workflow.states()).containsOnlyKeys("PassState");
        assertThat(workflow.state("PassState")).isEqualTo(PassState.terminal());
    }

    @Test
    void compile_setsCommentAndTimeoutFromSettings() {
        CompiledWorkflow workflow = compiler.compile(
                graph(List.of(compute("a", "Extract")), List.of(), new PipelineSettings(null, null, 900, null)),
                handlesFor("a"));

        assertThat(workflow.comment()).isEqualTo("State machine for pipeline " + PIPELINE);
        assertThat(workflow.timeoutSeconds()).isEqualTo(900);
    }

    @Test
    void compile_withoutTimeout_leavesItUnset() {
        CompiledWorkflow workflow = compiler.compile(graph(List.of(compute("a", "Extract")), List.of()),
                handlesFor("a"));

        assertThat(workflow.timeoutSeconds()).isNull();
    }

    @Test
    void compile_missingHandle_recordsWarningAndStillCompiles() {
        List<CompileWarning> warnings = new ArrayList<>();

        CompiledWorkflow workflow = compiler.compile(
                graph(List.of(compute("a", "Extract"), compute("b", "Proxy")), List.of(edge("a", "b"))),
                handlesFor("a"), warnings);

        assertThat(workflow.state("Proxy_b")).isInstanceOf(PassState.class);
        assertThat(((ChainingState) workflow.state("Extract_a")).next()).isEqualTo("Proxy_b");
        assertThat(warnings).extracting(CompileWarning::kind).containsExactly(CompileWarning.Kind.MISSING_HANDLE);
    }

    @Test
    void compile_mapWithProcessorChain_keepsChainOutOfTopLevel() {
        Node map = flow("m", FlowKind.MAP);
        CompiledWorkflow workflow = compiler.compile(graph(
                List.of(trigger("t"), compute("a", "Extract"), map, compute("p1", "Resize"), compute("p2", "Upload")),
                List.of(edge("t", "a"), edge("a", "m"), edge("m", "p1", Edge.PROCESSOR_HANDLE), edge("p1", "p2"))),
                handlesFor("a", "p1", "p2"));

        assertThat(workflow.states()).containsOnlyKeys("Extract_a", "Map_m");
        MapState mapState = (MapState) workflow.state("Map_m");
        assertThat(mapState.isEnd()).isTrue();
        assertThat(mapState.iterator().states()).containsOnlyKeys("Processor_0_Resize", "Processor_1_Upload");
        assertThat(((TaskState) mapState.iterator().state("Processor_0_Resize")).parameters()).isNull();
    }

    @Test
    void compile_dualSourceMap_linksBothMapsToSuccessor() {
        Node map = flow("m", FlowKind.MAP, Map.of("supportExternalPayload", true));
        CompiledWorkflow workflow = compiler.compile(graph(
                List.of(compute("a", "Extract"), map, compute("z", "Notify")),
                List.of(edge("a", "m"), edge("m", "z"))),
                handlesFor("a", "z"));

        assertThat(((ChainingState) workflow.state("Map_m_Map")).next()).isEqualTo("Notify_z");
        assertThat(((ChainingState) workflow.state("Map_m_StandardMap")).next()).isEqualTo("Notify_z");
        assertThat(((ChainingState) workflow.state("Extract_a")).next()).isEqualTo("Map_m");
    }

    @Test
    void compile_twoEntryPoints_throws() {
        assertThatThrownBy(() -> compiler.compile(graph(
                List.of(trigger("t"), compute("a", "Extract"), compute("b", "Proxy")),
                List.of(edge("t", "a"))), handlesFor("a", "b")))
                .isInstanceOf(PipelineConfigurationException.class)
                .hasMessageContaining("more than one entry");
    }

    @Test
    void compile_cycle_throws() {
        assertThatThrownBy(() -> compiler.compile(graph(
                List.of(compute("a", "Extract"), compute("b", "Proxy"), compute("c", "Index")),
                List.of(edge("a", "b"), edge("b", "c"), edge("c", "b"))), handlesFor("a", "b", "c")))
                .isInstanceOf(PipelineConfigurationException.class)
                .hasMessageContaining("cycle");
    }

    @Test
    void compile_nodeWithTwoDifferentSuccessors_throws() {
        assertThatThrownBy(() -> compiler.compile(graph(
                List.of(compute("a", "Extract"), compute("b", "Proxy"), compute("c", "Index")),
                List.of(edge("a", "b"), edge("a", "c"))), handlesFor("a", "b", "c")))
                .isInstanceOf(PipelineConfigurationException.class)
                .satisfies(e -> assertThat(((PipelineConfigurationException) e).getElementId()).isEqualTo("a"));
    }

    @Test
    void compile_stateNamesCombineLabelOperationAndId() {
        Node a = new Node("node-1", NodeRole.COMPUTE, "image_proxy", "Image Proxy",
                Map.of("operationId", "create"));

        CompiledWorkflow workflow = compiler.compile(graph(List.of(a), List.of()), handlesFor("node-1"));

        assertThat(workflow.startAt()).isEqualTo("Image_Proxy_create_node-1");
        WorkflowState state = workflow.state("Image_Proxy_create_node-1");
        assertThat(state).isInstanceOf(TaskState.class);
    }

    @Test
    void compile_chainEndingInChoice_degradesIteratorInsteadOfFailing() {
        List<CompileWarning> warnings = new ArrayList<>();

        CompiledWorkflow workflow = compiler.compile(graph(
                List.of(trigger("t"), compute("a", "Extract"), flow("m", FlowKind.MAP), compute("c", "Resize"),
                        flow("ch", FlowKind.CHOICE)),
                List.of(edge("t", "a"), edge("a", "m"), edge("m", "c", Edge.PROCESSOR_HANDLE), edge("c", "ch"))),
                handlesFor("a", "c"), warnings);

        assertThat(workflow.states()).containsOnlyKeys("Extract_a", "Map_m");
        assertThat(((MapState) workflow.state("Map_m")).iterator().states()).containsOnlyKeys("PassState");
        assertThat(warnings).extracting(CompileWarning::elementId).containsExactly("ch");
    }

    @Test
    void compile_sameCompilerTwice_doesNotCarryChainsBetweenGraphs() {
        compiler.compile(graph(
                List.of(compute("a", "Extract"), flow("m", FlowKind.MAP), compute("c", "Resize")),
                List.of(edge("a", "m"), edge("m", "c", Edge.PROCESSOR_HANDLE))),
                handlesFor("a", "c"));

        CompiledWorkflow second = compiler.compile(graph(
                List.of(compute("a", "Extract"), flow("m", FlowKind.MAP), compute("c", "Resize")),
                List.of(edge("a", "m"), edge("m", "c"))),
                handlesFor("a", "c"));

        assertThat(second.states()).containsOnlyKeys("Extract_a", "Map_m", "Resize_c");
        assertThat(((ChainingState) second.state("Map_m")).next()).isEqualTo("Resize_c");
        assertThat(((MapState) second.state("Map_m")).iterator().states()).containsOnlyKeys("PassState");
    }
}
