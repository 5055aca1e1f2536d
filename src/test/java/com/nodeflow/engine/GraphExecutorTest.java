package com.nodeflow.engine;

import com.nodeflow.TestNodes;
import com.nodeflow.api.NodeGraphCategory;
import com.nodeflow.model.NodeGraph;
import com.nodeflow.node.EventNode;
import com.nodeflow.util.NodeProfileListener;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;

public class GraphExecutorTest {

    private GraphExecutor executor;
    private NodeGraph controlFlow;
    private NodeGraph dataFlow;
    private List<String> log;

    @Before
    public void setUp() {
        executor = new GraphExecutor(EngineConfig.builder().executor(Runnable::run).build());
        log = new ArrayList<>();

        controlFlow = new NodeGraph("cf", NodeGraphCategory.CONTROL_FLOW);
        EventNode start = new EventNode();
        TestNodes.Step step = new TestNodes.Step("A", log);
        controlFlow.connect(start.exec(), step.in);
        controlFlow.setMainNode(start);

        dataFlow = new NodeGraph("df", NodeGraphCategory.DATA_FLOW);
        dataFlow.connect(new TestNodes.Source("S", 1).y, new TestNodes.PlusOne("P").x);
    }

    @Test
    public void testDispatchesByCategory() {
        ExecutionResult cf = executor.execute(controlFlow, CancellationToken.NONE);
        ExecutionResult df = executor.execute(dataFlow, CancellationToken.NONE);

        assertTrue(cf instanceof ControlFlowResult);
        assertTrue(df instanceof DataFlowResult);
        assertTrue(cf.isSuccess());
        assertTrue(df.isSuccess());
        assertEquals(List.of("A"), log);
    }

    @Test
    public void testEngineFor() {
        assertSame(executor.controlFlow(), executor.engineFor(NodeGraphCategory.CONTROL_FLOW));
        assertSame(executor.dataFlow(), executor.engineFor(NodeGraphCategory.DATA_FLOW));
        assertEquals("CONTROL_FLOW", controlFlow.getExecutionEngineKey());
    }

    @Test
    public void testListenersObserveBothEngines() {
        NodeProfileListener profile = new NodeProfileListener();
        executor.addListener(profile);

        executor.execute(controlFlow, CancellationToken.NONE);
        executor.execute(dataFlow, CancellationToken.NONE);

        // Start and A, then S and P
        assertEquals(4, profile.allStats().size());

        assertTrue(executor.removeListener(profile));
        assertFalse(executor.removeListener(profile));
        executor.execute(dataFlow, CancellationToken.NONE);
        assertEquals(1, profile.allStats().get(2).count);
    }

    @Test
    public void testExecuteAsync() throws Exception {
        ExecutionResult result = executor.executeAsync(dataFlow).get(5, TimeUnit.SECONDS);
        assertEquals(NodeGraphCategory.DATA_FLOW, result.category());
    }

    @Test
    public void testAsyncFailureCompletesExceptionally() throws Exception {
        controlFlow.setMainNode(null);
        try {
            executor.executeAsync(controlFlow, new CancellationToken()).get(5, TimeUnit.SECONDS);
            fail("Expected failure");
        } catch (java.util.concurrent.ExecutionException e) {
            assertTrue(e.getCause() instanceof GraphConsistencyException);
        }
    }
}
