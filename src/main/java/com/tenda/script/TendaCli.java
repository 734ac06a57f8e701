package com.tenda.script;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tenda.debug.Debug;
import com.tenda.debug.DebugLevel;
import com.tenda.debug.StreamDebugSink;
import com.tenda.script.ast.Program;
import com.tenda.script.json.AstFormatException;
import com.tenda.script.json.AstJsonReader;
import com.tenda.script.json.DiagnosticJson;
import com.tenda.script.json.JsonModuleLoader;
import com.tenda.script.json.ValueJson;
import com.tenda.script.runtime.RuntimeError;

/**
 * Runs a JSON syntax tree from disk.
 *
 *   --program=/path/main.json   (required)
 *   --modules=/path/dir         module root, default: the program's directory
 *   --max-call-depth=512
 *   --verbose                   debug log on stderr
 *   --pretty                    indented JSON output
 *
 * Exit codes: 0 the final value is printed on stdout, 1 the diagnostic is
 * printed on stderr (also when the value has no JSON form), 2 bad usage or an
 * unreadable program.
 */
public final class TendaCli {

    private static final ObjectMapper om = new ObjectMapper();

    public static void main(String[] args) {
        System.exit(run(args));
    }

    public static int run(String[] args) {
        Map<String, String> flags = parseArgs(args);

        String programPath = flags.get("program");
        if (programPath == null || programPath.isEmpty()) {
            System.err.println("Usage: TendaCli --program=<file.json> [--modules=<dir>] [--max-call-depth=<n>] [--verbose] [--pretty]");
            return 2;
        }
        boolean pretty = flags.containsKey("pretty");
        if (flags.containsKey("verbose")) {
            Debug.get().setSink(new StreamDebugSink(System.err));
            Debug.get().setThreshold(DebugLevel.DEBUG);
        }

        Path programFile = Path.of(programPath).toAbsolutePath();
        Path moduleRoot = flags.containsKey("modules")
                ? Path.of(flags.get("modules"))
                : programFile.getParent();

        TendaScript engine = new TendaScript();
        AstJsonReader reader = new AstJsonReader(om);
        try {
            if (flags.containsKey("max-call-depth")) {
                engine.setMaxCallDepth(Integer.parseInt(flags.get("max-call-depth")));
            }
            engine.setModuleLoader(new JsonModuleLoader(moduleRoot, reader));

            Program program = reader.read(programFile, moduleId(programFile));
            ExecutionResult result = engine.run(program);

            if (result.isSuccess()) {
                JsonNode value;
                try {
                    value = ValueJson.toJson(result.value());
                } catch (RuntimeError e) {
                    System.err.println(write(DiagnosticJson.toJson(e.diagnostic), pretty));
                    return 1;
                }
                System.out.println(write(value, pretty));
                return 0;
            }
            System.err.println(write(DiagnosticJson.toJson(result.diagnostic()), pretty));
            return 1;
        } catch (IOException | UncheckedIOException e) {
            System.err.println("Failed to read program: " + e.getMessage());
            return 2;
        } catch (AstFormatException e) {
            System.err.println("Malformed syntax tree: " + e.getMessage());
            return 2;
        } catch (IllegalArgumentException e) {
            System.err.println("Invalid argument: " + e.getMessage());
            return 2;
        }
    }

    private static String moduleId(Path file) {
        String name = file.getFileName().toString();
        return name.endsWith(".json") ? name.substring(0, name.length() - ".json".length()) : name;
    }

    private static String write(JsonNode n, boolean pretty) {
        try {
            return pretty ? om.writerWithDefaultPrettyPrinter().writeValueAsString(n) : om.writeValueAsString(n);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize result", e);
        }
    }

    /**
     * Minimal arg parser:
     *   --key=value, or --flag for booleans
     */
    static Map<String, String> parseArgs(String[] args) {
        Map<String, String> out = new HashMap<>();
        for (String a : args) {
            if (a.startsWith("--") && a.contains("=")) {
                int i = a.indexOf('=');
                out.put(a.substring(2, i), a.substring(i + 1));
            } else if (a.startsWith("--")) {
                out.put(a.substring(2), "true");
            }
        }
        return out;
    }

    private TendaCli() {}
}
