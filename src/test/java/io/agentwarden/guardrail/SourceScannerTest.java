package io.agentwarden.guardrail;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

final class SourceScannerTest {

    private static List<String> resolvedCalls(SourceStructure structure) {
        return structure.calls().stream().map(SourceStructure.CallRef::resolved).toList();
    }

    @Test
    void resolvesImportAlias() {
        SourceStructure s = SourceScanner.scan("import subprocess as sp\nsp.run(['ls'])\n", "python");

        Assertions.assertTrue(resolvedCalls(s).contains("subprocess.run"), resolvedCalls(s).toString());
        Assertions.assertTrue(s.imports().stream().anyMatch(i -> i.module().equals("subprocess")));
    }

    @Test
    void resolvesFromImport() {
        SourceStructure s = SourceScanner.scan("from os import system\nsystem('id')\n", "python");

        Assertions.assertTrue(resolvedCalls(s).contains("os.system"), resolvedCalls(s).toString());
    }

    @Test
    void ignoresStringsAndComments() {
        String source = "# os.system('x')\n"
                + "message = \"subprocess.run(['rm'])\"\n"
                + "print(message)\n";
        SourceStructure s = SourceScanner.scan(source, "python");

        Assertions.assertEquals(List.of("print"), resolvedCalls(s));
        Assertions.assertTrue(s.imports().isEmpty());
    }

    @Test
    void slashCommentsInJava() {
        String source = "// Runtime.getRuntime().exec(\"ls\");\nint n = Math.max(1, 2);\n";
        SourceStructure s = SourceScanner.scan(source, "java");

        Assertions.assertEquals(List.of("Math.max"), resolvedCalls(s));
    }

    @Test
    void detectsRequireBinding() {
        SourceStructure s = SourceScanner.scan("const cp = require('child_process');\ncp.exec('ls');\n", "javascript");

        Assertions.assertTrue(resolvedCalls(s).contains("child_process.exec"), resolvedCalls(s).toString());
    }

    @Test
    void unwrapsFencedBlocks() {
        String reply = "Here you go:\n```python\nimport os\nos.system('ls')\n```\nDone.";
        SourceStructure s = SourceScanner.scanText(reply, null);

        Assertions.assertTrue(resolvedCalls(s).contains("os.system"));
        Assertions.assertEquals("import os\nos.system('ls')\n", SourceScanner.firstFencedBlock(reply).orElseThrow());
    }

    @Test
    void proseWithoutFencesScansNothing() {
        SourceStructure s = SourceScanner.scanText("Call eval(x) to see what happens.", SourceScanner.PROSE);

        Assertions.assertTrue(s.calls().isEmpty());
        Assertions.assertTrue(s.imports().isEmpty());
    }

    @Test
    void functionDefinitionIsNotACall() {
        SourceStructure s = SourceScanner.scan("def exec(x):\n    return x\n", "python");

        Assertions.assertTrue(s.calls().isEmpty(), resolvedCalls(s).toString());
    }

    @Test
    void reportsUnterminatedString() {
        SourceStructure s = SourceScanner.scan("x = 'open\n", "python");

        Assertions.assertFalse(s.problems().isEmpty());
    }

    @Test
    void languageForPath() {
        Assertions.assertEquals("python", SourceScanner.languageForPath("src/a.py"));
        Assertions.assertEquals(SourceScanner.PROSE, SourceScanner.languageForPath("README.md"));
        Assertions.assertNull(SourceScanner.languageForPath("Makefile"));
    }
}
