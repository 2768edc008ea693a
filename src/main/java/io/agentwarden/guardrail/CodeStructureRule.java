package io.agentwarden.guardrail;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Structural scan of code via {@link SourceScanner}. Because aliases are resolved, renaming an
 * import ({@code import subprocess as sp}) or pulling a single function out of a module
 * ({@code from os import system}) does not hide the call.
 */
public final class CodeStructureRule implements GuardrailRule {
    public static final String NAME = "code_structure";

    private static final List<String> BLOCKED_CALLS = List.of(
            "eval", "exec", "execfile", "compile", "__import__", "importlib.import_module",
            "os.system", "os.popen", "os.exec*", "os.spawn*", "os.fork", "os.kill",
            "os.remove", "os.unlink", "os.rmdir", "os.removedirs", "shutil.rmtree", "shutil.move",
            "subprocess.*", "pty.spawn", "child_process.*", "Function",
            "Runtime.getRuntime().exec", "java.lang.Runtime.getRuntime().exec", "ProcessBuilder", "java.lang.ProcessBuilder",
            "socket.*", "urllib.request.*", "urllib.urlopen", "requests.*", "httpx.*", "http.client.*",
            "ftplib.*", "smtplib.*", "telnetlib.*", "ctypes.*", "fetch", "XMLHttpRequest",
            "java.net.*"
    );
    private static final List<String> BLOCKED_MODULES = List.of(
            "subprocess", "pty", "socket", "urllib.request", "requests", "httpx", "http.client",
            "ftplib", "smtplib", "telnetlib", "ctypes", "child_process", "net", "http", "https", "dgram",
            "java.net", "java.lang.ProcessBuilder", "java.lang.Runtime"
    );
    private static final List<String> SENSITIVE_MODULES = List.of(
            "os", "shutil", "importlib", "pickle", "marshal", "fs", "java.lang.reflect", "java.nio.file"
    );

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<Violation> check(GuardrailContext context) {
        Set<Violation> out = new LinkedHashSet<>();
        for (String code : context.code()) {
            SourceStructure structure = SourceScanner.scanText(code, context.language());
            for (SourceStructure.ImportRef ref : structure.imports()) {
                if (matchesModule(BLOCKED_MODULES, ref.module())) {
                    out.add(Violation.block(NAME, "Import of restricted module '" + ref.module() + "' on line " + ref.line()));
                } else if (matchesModule(SENSITIVE_MODULES, ref.module())) {
                    out.add(Violation.warning(NAME, "Import of sensitive module '" + ref.module() + "'"));
                }
            }
            for (SourceStructure.CallRef call : structure.calls()) {
                if (matchesCall(call.resolved()) || matchesCall(call.name())) {
                    String shown = call.name().equals(call.resolved())
                            ? call.name()
                            : call.name() + " (" + call.resolved() + ")";
                    out.add(Violation.block(NAME, "Call to restricted function " + shown + " on line " + call.line()));
                }
            }
            for (String problem : structure.problems()) {
                out.add(Violation.warning(NAME, "Could not fully parse code: " + problem));
            }
        }
        return new ArrayList<>(out);
    }

    static boolean matchesModule(List<String> modules, String module) {
        for (String candidate : modules) {
            if (module.equals(candidate) || module.startsWith(candidate + ".")) {
                return true;
            }
        }
        return false;
    }

    static boolean matchesCall(String name) {
        for (String pattern : BLOCKED_CALLS) {
            if (pattern.endsWith("*")) {
                if (name.startsWith(pattern.substring(0, pattern.length() - 1))) {
                    return true;
                }
            } else if (pattern.equals(name)) {
                return true;
            }
        }
        return false;
    }
}
