package com.pgm.xdsl;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.Assert.*;

public class XdslConverterMainTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private static String resource(String name) throws Exception {
        return Path.of(XdslConverterMainTest.class.getResource("/xdsl/" + name).toURI()).toString();
    }

    @Test
    public void testWritesGeneratedCodeToFile() throws Exception {
        File out = new File(tmp.getRoot(), "network.py");

        int rc = XdslConverterMain.run(new String[] { resource("chance_and_decision.xdsl"), out.getPath() });

        assertEquals(0, rc);
        assertTrue(Files.readString(out.toPath()).contains("diag.addArc(B, A)"));
    }

    @Test
    public void testJsonTarget() throws Exception {
        File out = new File(tmp.getRoot(), "model.json");

        int rc = XdslConverterMain.run(new String[] {
                "--target=json", resource("oil_wildcatter.xdsl"), out.getPath(), "--strict" });

        assertEquals(0, rc);
        assertTrue(Files.readString(out.toPath()).contains("\"DrillPayoff\""));
    }

    @Test
    public void testConversionFailureReturnsOne() throws Exception {
        assertEquals(1, XdslConverterMain.run(new String[] { resource("malformed.xdsl") }));
    }

    @Test
    public void testUsageErrors() {
        assertEquals(2, XdslConverterMain.run(new String[0]));
        assertEquals(2, XdslConverterMain.run(new String[] { "a.xdsl", "--target=cobol" }));
        assertEquals(2, XdslConverterMain.run(new String[] { "a.xdsl", "b.py", "c" }));
    }
}
