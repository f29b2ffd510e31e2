package com.pgm.xdsl.codegen;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pgm.xdsl.io.XdslParser;
import com.pgm.xdsl.model.GraphModel;
import org.junit.Test;

import static org.junit.Assert.*;

public class JsonModelGeneratorTest {

    private static GraphModel model() {
        return new XdslParser().parseString("<smile><nodes>"
                + "<cpt id=\"A\"><state id=\"X\"/><state id=\"Y\"/><parents>B</parents>"
                + "<probabilities>0.2 0.8 0.6 0.4</probabilities></cpt>"
                + "<decision id=\"B\"><state id=\"yes\"/><state id=\"no\"/></decision>"
                + "<utility id=\"U\"><parents>B</parents><utilities>1 2</utilities></utility>"
                + "<mau id=\"M\"><parents>U</parents><weights>3</weights></mau>"
                + "</nodes></smile>");
    }

    @Test
    public void testModelIsSerialized() throws Exception {
        String json = new JsonModelGenerator().generate(model());
        JsonNode root = new ObjectMapper().readTree(json);

        JsonNode nodes = root.get("nodes");
        assertEquals(3, nodes.size());

        JsonNode a = nodes.get(0);
        assertEquals("A", a.get("id").asText());
        assertEquals("CHANCE", a.get("kind").asText());
        assertEquals("Y", a.get("states").get(1).asText());
        assertEquals("B", a.get("parents").get(0).asText());
        assertEquals(4, a.get("probabilities").size());
        assertEquals(0.6, a.get("probabilities").get(2).asDouble(), 0.0);

        JsonNode b = nodes.get(1);
        assertEquals("DECISION", b.get("kind").asText());
        assertNull("empty lists are omitted", b.get("parents"));
        assertNull(b.get("probabilities"));

        JsonNode u = nodes.get(2);
        assertEquals("UTILITY", u.get("kind").asText());
        assertNull(u.get("states"));
        assertEquals(3.0, u.get("utilities").get(0).asDouble(), 0.0);
        assertEquals(6.0, u.get("utilities").get(1).asDouble(), 0.0);

        assertEquals(2, root.get("arcs").size());
        assertEquals("B", root.get("arcs").get(0).get("parent").asText());
        assertEquals("A", root.get("arcs").get(0).get("child").asText());
        assertEquals(3.0, root.get("weights").get("U").asDouble(), 0.0);
    }

    @Test
    public void testDeterministic() {
        GraphModel model = model();
        assertEquals(new JsonModelGenerator().generate(model), new JsonModelGenerator().generate(model));
    }

    @Test
    public void testTargetsResolveByName() {
        assertEquals(GeneratorTarget.JSON, GeneratorTarget.fromString("json"));
        assertEquals(GeneratorTarget.PYAGRUM, GeneratorTarget.fromString("PyAgrum"));
        assertTrue(GeneratorTarget.MERMAID.create() instanceof MermaidCodeGenerator);
        assertEquals("py", GeneratorTarget.PYAGRUM.fileExtension());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownTarget() {
        GeneratorTarget.fromString("matlab");
    }
}
