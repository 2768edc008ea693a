package io.agentwarden;

import io.agentwarden.cli.WardenCommand;
import io.agentwarden.error.WardenException;
import io.agentwarden.util.Jsons;
import picocli.CommandLine;

import java.util.LinkedHashMap;
import java.util.Map;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }

    /** Command tree with domain failures reported as one JSON line on stderr. */
    public static CommandLine commandLine() {
        CommandLine cli = new CommandLine(new WardenCommand());
        cli.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof WardenException we) {
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("error", we.kind());
                out.put("message", we.getMessage());
                commandLine.getErr().println(Jsons.toCompactJson(out));
                return 1;
            }
            throw ex;
        });
        return cli;
    }
}
