package com.pgm.xdsl.io;

import com.pgm.xdsl.api.NodeKind;
import com.pgm.xdsl.api.StructureException;
import com.pgm.xdsl.api.UnsupportedKindException;
import com.pgm.xdsl.model.GraphModel;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class NodeFactoryTest {

    @Test
    public void testCreatesEachKindFromTag() {
        GraphModel.Builder b = GraphModel.builder();
        assertEquals(0, NodeFactory.createNode(b, "cpt", "C", List.of("x", "y")));
        assertEquals(1, NodeFactory.createNode(b, "decision", "D", List.of("go", "stop")));
        assertEquals(2, NodeFactory.createNode(b, "utility", "U", List.of()));

        GraphModel model = b.build();
        assertEquals(NodeKind.CHANCE, model.node("C").kind());
        assertEquals(NodeKind.DECISION, model.node("D").kind());
        assertEquals(NodeKind.UTILITY, model.node("U").kind());
    }

    @Test
    public void testKindNamesAreAccepted() {
        GraphModel.Builder b = GraphModel.builder();
        NodeFactory.createNode(b, "chance", "C", List.of("x"));

        assertEquals(NodeKind.CHANCE, b.kind("C"));
    }

    @Test
    public void testUtilityGetsSingleSlot() {
        GraphModel.Builder b = GraphModel.builder();
        NodeFactory.createNode(b, NodeKind.UTILITY, "U", List.of("ignored", "too"));

        GraphModel model = b.build();
        assertTrue(model.node("U").states().isEmpty());
        assertEquals(1, model.cardinality("U"));
    }

    @Test
    public void testUnsupportedKind() {
        try {
            NodeFactory.createNode(GraphModel.builder(), "mau", "M", List.of());
            fail("Expected UnsupportedKindException");
        } catch (UnsupportedKindException e) {
            assertEquals("mau", e.getKind());
        }
    }

    @Test(expected = UnsupportedKindException.class)
    public void testNullKind() {
        NodeFactory.createNode(GraphModel.builder(), (NodeKind) null, "X", List.of("a"));
    }

    @Test(expected = StructureException.class)
    public void testHandleCreatedOncePerId() {
        GraphModel.Builder b = GraphModel.builder();
        NodeFactory.createNode(b, NodeKind.CHANCE, "A", List.of("x"));
        NodeFactory.createNode(b, NodeKind.DECISION, "A", List.of("x"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEmptyIdRejected() {
        NodeFactory.createNode(GraphModel.builder(), NodeKind.CHANCE, "", List.of("x"));
    }
}
