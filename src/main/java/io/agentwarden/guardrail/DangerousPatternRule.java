package io.agentwarden.guardrail;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Raw-text scan. Works on anything, including prose and shell snippets the structural scanner
 * cannot parse, at the cost of matching inside comments and strings too.
 */
public final class DangerousPatternRule implements GuardrailRule {
    public static final String NAME = "dangerous_pattern";
    private static final int FLAGS = Pattern.CASE_INSENSITIVE;

    private static final List<PatternSpec> PATTERNS = List.of(
            block("shell", "recursive forced delete", "\\brm\\s+-(?:[a-z]*r[a-z]*f|[a-z]*f[a-z]*r)[a-z]*\\b"),
            block("shell", "privilege escalation", "\\bsudo\\s+"),
            block("shell", "world-writable chmod", "\\bchmod\\s+(?:-r\\s+)?777\\b"),
            block("shell", "pipe into a shell", "\\|\\s*(?:sh|bash|zsh)\\b"),
            block("shell", "filesystem format", "\\bmkfs(?:\\.\\w+)?\\b"),
            block("shell", "raw disk write", "\\bdd\\s+if="),
            block("shell", "fork bomb", ":\\(\\)\\s*\\{\\s*:\\s*\\|\\s*:\\s*&\\s*\\}\\s*;\\s*:"),
            block("shell", "shell=True subprocess", "shell\\s*=\\s*True"),
            block("code_execution", "eval call", "(?<![.\\w])eval\\s*\\("),
            block("code_execution", "exec call", "(?<![.\\w])exec\\s*\\("),
            block("code_execution", "dynamic import", "__import__\\s*\\("),
            block("code_execution", "os command execution", "\\bos\\.(?:system|popen|exec\\w*|spawn\\w*)\\s*\\("),
            block("code_execution", "subprocess usage", "\\bsubprocess\\.\\w+"),
            block("code_execution", "JVM process spawn", "Runtime\\.getRuntime\\(\\)\\.exec|new\\s+ProcessBuilder\\s*\\("),
            block("code_execution", "node child process", "require\\s*\\(\\s*['\"]child_process['\"]\\s*\\)"),
            block("code_execution", "Function constructor", "(?<![.\\w])(?:new\\s+)?Function\\s*\\(\\s*['\"]"),
            block("filesystem", "recursive filesystem removal", "\\bshutil\\.(?:rmtree|move)\\b|\\bos\\.(?:remove|unlink|rmdir)\\s*\\("),
            block("network", "raw socket", "\\bsocket\\.(?:socket|create_connection)\\b"),
            block("network", "HTTP client call", "\\burllib\\.request\\b|\\brequests\\.(?:get|post|put|delete|patch)\\s*\\("),
            block("network", "ftp or smtp client", "\\b(?:ftplib|smtplib|telnetlib)\\b"),
            block("network", "command-line download", "\\b(?:curl|wget)\\s+\\S*(?:https?|ftp)://"),
            block("network", "JVM network client", "new\\s+(?:java\\.net\\.)?(?:Socket|URL)\\s*\\("),
            block("credential", "private key material", "-----BEGIN [A-Z ]*PRIVATE KEY-----"),
            block("credential", "hard-coded secret",
                    "\\b(?:password|passwd|secret|api[_-]?key|access[_-]?token|auth[_-]?token)\\s*[:=]\\s*['\"][^'\"\\s]{4,}['\"]"),
            block("credential", "AWS access key id", "\\bAKIA[0-9A-Z]{16}\\b"),
            warn("reflection", "attribute reflection", "\\b(?:getattr|setattr|delattr)\\s*\\("),
            warn("reflection", "scope introspection", "\\b(?:globals|locals)\\s*\\(\\s*\\)"),
            warn("reflection", "dunder access", "__(?:class|dict|globals|builtins|subclasses)__")
    );

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<Violation> check(GuardrailContext context) {
        Set<String> seen = new LinkedHashSet<>();
        List<Violation> out = new ArrayList<>();
        for (String text : context.texts()) {
            for (PatternSpec spec : PATTERNS) {
                Matcher m = spec.pattern().matcher(text);
                if (m.find() && seen.add(spec.category() + "|" + spec.description())) {
                    out.add(new Violation(
                            NAME + "." + spec.category(),
                            spec.severity(),
                            spec.description() + " near '" + excerpt(m.group()) + "'"
                    ));
                }
            }
        }
        return out;
    }

    private static String excerpt(String match) {
        String flat = match.replaceAll("\\s+", " ").trim();
        return flat.length() <= 40 ? flat : flat.substring(0, 40) + "...";
    }

    private static PatternSpec block(String category, String description, String regex) {
        return new PatternSpec(category, Severity.BLOCK, description, Pattern.compile(regex, FLAGS));
    }

    private static PatternSpec warn(String category, String description, String regex) {
        return new PatternSpec(category, Severity.WARNING, description, Pattern.compile(regex, FLAGS));
    }

    private record PatternSpec(String category, Severity severity, String description, Pattern pattern) {
    }
}
