package io.agentwarden.guardrail;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lightweight lexer for Python, JavaScript and Java-like sources. It does not build a full syntax
 * tree; it drops comments and string contents, then recognises import statements, require calls
 * and call expressions on the remaining tokens. Text inside strings or comments can therefore
 * never produce a call or an import.
 */
public final class SourceScanner {
    private static final Pattern FENCE = Pattern.compile("```([\\w+#.-]*)[^\\n]*\\n(.*?)(?:```|\\z)", Pattern.DOTALL);
    private static final Set<String> HASH_COMMENT_LANGUAGES = Set.of(
            "python", "py", "ruby", "rb", "shell", "sh", "bash", "zsh", "yaml", "yml", "toml", "perl"
    );
    private static final Set<String> SLASH_COMMENT_LANGUAGES = Set.of(
            "java", "javascript", "js", "typescript", "ts", "jsx", "tsx", "c", "cpp", "c++", "h", "hpp",
            "go", "rust", "rs", "kotlin", "kt", "scala", "csharp", "cs", "swift"
    );
    /** Language tag for natural-language files; only their fenced code blocks are scanned. */
    public static final String PROSE = "text";
    private static final Set<String> DEFINITION_KEYWORDS = Set.of("def", "function", "class", "fun", "fn", "func");

    private SourceScanner() {
    }

    /** Scans fenced markdown blocks when present, otherwise the whole text. */
    public static SourceStructure scanText(String text, String language) {
        Matcher m = FENCE.matcher(text);
        StringBuilder blocks = new StringBuilder();
        String fenceLanguage = null;
        boolean fenced = false;
        while (m.find()) {
            fenced = true;
            if (fenceLanguage == null && !m.group(1).isBlank()) {
                fenceLanguage = m.group(1);
            }
            blocks.append(m.group(2)).append('\n');
        }
        boolean prose = PROSE.equals(language);
        if (!fenced) {
            return prose ? scan("", null) : scan(text, language);
        }
        return scan(blocks.toString(), language != null && !prose ? language : fenceLanguage);
    }

    /** Body of the first fenced block, if the text has one. */
    public static Optional<String> firstFencedBlock(String text) {
        Matcher m = FENCE.matcher(text);
        return m.find() ? Optional.of(m.group(2)) : Optional.empty();
    }

    /** Language name for a file extension, or null when the extension says nothing useful. */
    public static String languageForPath(String path) {
        if (path == null) {
            return null;
        }
        String ext = ExtensionAllowlistRule.extensionOf(path);
        if (ext == null) {
            return null;
        }
        return switch (ext) {
            case ".py" -> "python";
            case ".js", ".mjs", ".cjs", ".jsx" -> "javascript";
            case ".ts", ".tsx" -> "typescript";
            case ".java" -> "java";
            case ".kt" -> "kotlin";
            case ".go" -> "go";
            case ".rs" -> "rust";
            case ".c", ".h" -> "c";
            case ".cpp", ".hpp" -> "cpp";
            case ".rb" -> "ruby";
            case ".sh" -> "sh";
            case ".yaml", ".yml" -> "yaml";
            case ".toml" -> "toml";
            case ".md", ".txt" -> PROSE;
            default -> null;
        };
    }

    public static SourceStructure scan(String source, String language) {
        String lang = language == null ? "" : language.trim().toLowerCase(Locale.ROOT);
        boolean hashComments = !SLASH_COMMENT_LANGUAGES.contains(lang);
        boolean slashComments = !HASH_COMMENT_LANGUAGES.contains(lang);
        Lexer lexer = new Lexer(source, hashComments, slashComments);
        List<Token> tokens = lexer.tokenize();
        return new Parser(tokens, lexer.problems).parse();
    }

    enum Kind {
        IDENT,
        STRING,
        PUNCT,
        NEWLINE
    }

    record Token(Kind kind, String text, int line) {
        boolean is(String punct) {
            return kind == Kind.PUNCT && text.equals(punct);
        }

        boolean isIdent(String word) {
            return kind == Kind.IDENT && text.equals(word);
        }
    }

    private static final class Lexer {
        private final String src;
        private final boolean hashComments;
        private final boolean slashComments;
        private final List<Token> out = new ArrayList<>();
        private final List<String> problems = new ArrayList<>();
        private final Deque<Token> brackets = new ArrayDeque<>();
        private int pos;
        private int line = 1;

        Lexer(String src, boolean hashComments, boolean slashComments) {
            this.src = src == null ? "" : src;
            this.hashComments = hashComments;
            this.slashComments = slashComments;
        }

        List<Token> tokenize() {
            while (pos < src.length()) {
                char ch = src.charAt(pos);
                if (ch == '\n') {
                    out.add(new Token(Kind.NEWLINE, "\n", line));
                    line++;
                    pos++;
                } else if (Character.isWhitespace(ch)) {
                    pos++;
                } else if (ch == '#' && hashComments) {
                    skipToLineEnd();
                } else if (ch == '/' && slashComments && peek(1) == '/') {
                    skipToLineEnd();
                } else if (ch == '/' && slashComments && peek(1) == '*') {
                    skipBlockComment();
                } else if (ch == '"' || ch == '\'' || (ch == '`' && slashComments)) {
                    readString(ch);
                } else if (Character.isJavaIdentifierStart(ch)) {
                    int start = pos;
                    while (pos < src.length() && Character.isJavaIdentifierPart(src.charAt(pos))) {
                        pos++;
                    }
                    out.add(new Token(Kind.IDENT, src.substring(start, pos), line));
                } else {
                    punct(ch);
                    pos++;
                }
            }
            for (Token open : brackets) {
                problems.add("unclosed '" + open.text() + "' opened on line " + open.line());
            }
            return out;
        }

        private void punct(char ch) {
            Token token = new Token(Kind.PUNCT, String.valueOf(ch), line);
            switch (ch) {
                case '(', '[', '{' -> brackets.push(token);
                case ')', ']', '}' -> {
                    char expected = ch == ')' ? '(' : ch == ']' ? '[' : '{';
                    if (brackets.isEmpty() || brackets.peek().text().charAt(0) != expected) {
                        problems.add("unexpected '" + ch + "' on line " + line);
                    } else {
                        brackets.pop();
                    }
                }
                default -> {
                }
            }
            out.add(token);
        }

        private char peek(int offset) {
            int idx = pos + offset;
            return idx < src.length() ? src.charAt(idx) : '\0';
        }

        private void skipToLineEnd() {
            while (pos < src.length() && src.charAt(pos) != '\n') {
                pos++;
            }
        }

        private void skipBlockComment() {
            int startLine = line;
            pos += 2;
            while (pos < src.length() && !(src.charAt(pos) == '*' && peek(1) == '/')) {
                if (src.charAt(pos) == '\n') {
                    line++;
                }
                pos++;
            }
            if (pos >= src.length()) {
                problems.add("unterminated comment opened on line " + startLine);
                return;
            }
            pos += 2;
        }

        private void readString(char quote) {
            int startLine = line;
            boolean triple = quote != '`' && peek(1) == quote && peek(2) == quote;
            boolean multiline = triple || quote == '`';
            pos += triple ? 3 : 1;
            StringBuilder value = new StringBuilder();
            while (pos < src.length()) {
                char ch = src.charAt(pos);
                if (ch == '\\' && pos + 1 < src.length()) {
                    value.append(src.charAt(pos + 1));
                    pos += 2;
                    continue;
                }
                if (ch == '\n') {
                    if (!multiline) {
                        problems.add("unterminated string on line " + startLine);
                        out.add(new Token(Kind.STRING, value.toString(), startLine));
                        return;
                    }
                    line++;
                }
                if (ch == quote && (!triple || (peek(1) == quote && peek(2) == quote))) {
                    pos += triple ? 3 : 1;
                    out.add(new Token(Kind.STRING, value.toString(), startLine));
                    return;
                }
                value.append(ch);
                pos++;
            }
            problems.add("unterminated string on line " + startLine);
            out.add(new Token(Kind.STRING, value.toString(), startLine));
        }
    }

    private static final class Parser {
        private final List<Token> tokens;
        private final List<String> problems;
        private final List<SourceStructure.ImportRef> imports = new ArrayList<>();
        private final List<SourceStructure.CallRef> calls = new ArrayList<>();
        private final Map<String, String> bindings = new LinkedHashMap<>();

        Parser(List<Token> tokens, List<String> problems) {
            this.tokens = tokens;
            this.problems = problems;
        }

        SourceStructure parse() {
            for (int i = 0; i < tokens.size(); i++) {
                Token t = tokens.get(i);
                if (t.kind() != Kind.IDENT || afterDot(i)) {
                    continue;
                }
                if (t.text().equals("import") && !at(i + 1).is("(")) {
                    parseImport(i);
                } else if (t.text().equals("from") && statementStart(i)) {
                    parseFromImport(i);
                } else if ((t.text().equals("require") || t.text().equals("import"))
                        && at(i + 1).is("(") && at(i + 2).kind() == Kind.STRING) {
                    parseRequire(i);
                } else if (!t.text().equals("import")) {
                    parseCall(i);
                }
            }
            return new SourceStructure(imports, calls, bindings, problems);
        }

        // import a.b as c, d            (python)
        // import java.net.Socket;       (java)
        // import x from 'fs'            (javascript)
        private void parseImport(int i) {
            int end = statementEnd(i + 1);
            int stringAt = -1;
            for (int j = i + 1; j < end; j++) {
                if (tokens.get(j).kind() == Kind.STRING) {
                    stringAt = j;
                    break;
                }
            }
            if (stringAt >= 0) {
                parseEsImport(i + 1, stringAt);
                return;
            }
            boolean javaStyle = at(end).is(";");
            int j = i + 1;
            if (at(j).isIdent("static")) {
                j++;
            }
            while (j < end) {
                StringBuilder name = new StringBuilder();
                while (j < end && (tokens.get(j).kind() == Kind.IDENT || tokens.get(j).is(".") || tokens.get(j).is("*"))) {
                    if (tokens.get(j).isIdent("as")) {
                        break;
                    }
                    name.append(tokens.get(j).text());
                    j++;
                }
                String module = name.toString();
                if (!module.isEmpty()) {
                    imports.add(new SourceStructure.ImportRef(stripWildcard(module), tokens.get(i).line()));
                    if (at(j).isIdent("as") && at(j + 1).kind() == Kind.IDENT) {
                        bindings.put(at(j + 1).text(), module);
                        j += 2;
                    } else if (!module.endsWith("*")) {
                        if (javaStyle) {
                            bindings.put(lastSegment(module), module);
                        } else {
                            String first = firstSegment(module);
                            bindings.putIfAbsent(first, first);
                        }
                    }
                }
                if (at(j).is(",")) {
                    j++;
                } else if (j < end) {
                    j++;
                }
            }
        }

        private void parseEsImport(int from, int stringAt) {
            String module = tokens.get(stringAt).text();
            imports.add(new SourceStructure.ImportRef(module, tokens.get(stringAt).line()));
            boolean inBraces = false;
            for (int j = from; j < stringAt; j++) {
                Token t = tokens.get(j);
                if (t.is("{")) {
                    inBraces = true;
                } else if (t.is("}")) {
                    inBraces = false;
                } else if (t.kind() == Kind.IDENT && !t.text().equals("from") && !t.text().equals("as")
                        && !t.text().equals("type")) {
                    String local = t.text();
                    String target = inBraces ? module + "." + local : module;
                    if (at(j + 1).isIdent("as") && at(j + 2).kind() == Kind.IDENT) {
                        local = at(j + 2).text();
                        j += 2;
                    }
                    bindings.put(local, target);
                } else if (t.is("*") && at(j + 1).isIdent("as") && at(j + 2).kind() == Kind.IDENT) {
                    bindings.put(at(j + 2).text(), module);
                    j += 2;
                }
            }
        }

        // from a.b import c as d, e
        private void parseFromImport(int i) {
            int j = i + 1;
            StringBuilder name = new StringBuilder();
            while (at(j).kind() == Kind.IDENT && !at(j).isIdent("import") || at(j).is(".")) {
                name.append(at(j).text());
                j++;
            }
            if (!at(j).isIdent("import") || name.length() == 0) {
                return;
            }
            String module = name.toString();
            imports.add(new SourceStructure.ImportRef(module, tokens.get(i).line()));
            int end = statementEnd(j + 1);
            if (at(j + 1).is("(")) {
                end = closingParen(j + 1);
            }
            for (int k = j + 1; k < end; k++) {
                Token t = tokens.get(k);
                if (t.kind() != Kind.IDENT || t.text().equals("as")) {
                    continue;
                }
                String target = module + "." + t.text();
                String local = t.text();
                if (at(k + 1).isIdent("as") && at(k + 2).kind() == Kind.IDENT) {
                    local = at(k + 2).text();
                    k += 2;
                }
                imports.add(new SourceStructure.ImportRef(target, t.line()));
                bindings.put(local, target);
            }
        }

        // const cp = require('child_process'); const { exec } = require('child_process'); import('fs')
        private void parseRequire(int i) {
            String module = tokens.get(i + 2).text();
            String fn = tokens.get(i).text();
            imports.add(new SourceStructure.ImportRef(module, tokens.get(i).line()));
            calls.add(new SourceStructure.CallRef(fn, fn, tokens.get(i).line()));
            if (!at(i - 1).is("=")) {
                return;
            }
            Token before = at(i - 2);
            if (before.kind() == Kind.IDENT) {
                bindings.put(before.text(), module);
            } else if (before.is("}")) {
                for (int k = i - 3; k >= 0 && !tokens.get(k).is("{"); k--) {
                    Token t = tokens.get(k);
                    if (t.kind() == Kind.IDENT) {
                        String source = at(k - 1).is(":") ? at(k - 2).text() : t.text();
                        bindings.put(t.text(), module + "." + source);
                    }
                }
            }
        }

        private void parseCall(int i) {
            if (at(i - 1).kind() == Kind.IDENT && DEFINITION_KEYWORDS.contains(at(i - 1).text())) {
                return;
            }
            StringBuilder chain = new StringBuilder(tokens.get(i).text());
            int j = i + 1;
            while (true) {
                if (at(j).is(".") && at(j + 1).kind() == Kind.IDENT) {
                    chain.append('.').append(at(j + 1).text());
                    j += 2;
                } else if (at(j).is("(") && at(j + 1).is(")") && at(j + 2).is(".")) {
                    chain.append("()");
                    j += 2;
                } else {
                    break;
                }
            }
            if (!at(j).is("(")) {
                return;
            }
            String name = chain.toString();
            calls.add(new SourceStructure.CallRef(name, resolve(name), tokens.get(i).line()));
        }

        private String resolve(String name) {
            int cut = indexOfAny(name);
            String head = cut < 0 ? name : name.substring(0, cut);
            String bound = bindings.get(head);
            if (bound == null) {
                return name;
            }
            return cut < 0 ? bound : bound + name.substring(cut);
        }

        private static int indexOfAny(String name) {
            int dot = name.indexOf('.');
            int paren = name.indexOf('(');
            if (dot < 0) {
                return paren;
            }
            return paren < 0 ? dot : Math.min(dot, paren);
        }

        private boolean afterDot(int i) {
            return at(i - 1).is(".");
        }

        private boolean statementStart(int i) {
            Token prev = at(i - 1);
            return i == 0 || prev.kind() == Kind.NEWLINE || prev.is(";");
        }

        private int statementEnd(int from) {
            int j = from;
            while (j < tokens.size() && tokens.get(j).kind() != Kind.NEWLINE && !tokens.get(j).is(";")) {
                j++;
            }
            return j;
        }

        private int closingParen(int openAt) {
            int depth = 0;
            for (int j = openAt; j < tokens.size(); j++) {
                if (tokens.get(j).is("(")) {
                    depth++;
                } else if (tokens.get(j).is(")") && --depth == 0) {
                    return j;
                }
            }
            return tokens.size();
        }

        private Token at(int i) {
            if (i < 0 || i >= tokens.size()) {
                return new Token(Kind.NEWLINE, "", -1);
            }
            return tokens.get(i);
        }

        private static String stripWildcard(String module) {
            return module.endsWith(".*") ? module.substring(0, module.length() - 2) : module;
        }

        private static String firstSegment(String module) {
            int dot = module.indexOf('.');
            return dot < 0 ? module : module.substring(0, dot);
        }

        private static String lastSegment(String module) {
            int dot = module.lastIndexOf('.');
            return dot < 0 ? module : module.substring(dot + 1);
        }
    }
}
