package com.fluxo.script;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fluxo.debug.Debug;
import com.fluxo.script.output.OutputEvent;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * fluxo &lt;dir | file...&gt; [--entry path] [--compat] [--json] [--config file]
 *
 * A directory runs as a workspace; files run together with their names as
 * paths. Exit code 1 when any error event was produced.
 */
public final class FluxoCli {

    public static void main(String[] args) {
        System.exit(run(args));
    }

    public static int run(String[] args) {
        List<String> inputs = new ArrayList<>();
        String entry = null;
        boolean json = false;
        boolean compat = false;
        Path configFile = null;

        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            switch (a) {
                case "--entry":
                    if (++i >= args.length) return usage("--entry needs a path");
                    entry = args[i];
                    break;
                case "--json":
                    json = true;
                    break;
                case "--compat":
                    compat = true;
                    break;
                case "--config":
                    if (++i >= args.length) return usage("--config needs a file");
                    configFile = Path.of(args[i]);
                    break;
                default:
                    if (a.startsWith("--")) return usage("unknown option " + a);
                    inputs.add(a);
            }
        }
        if (inputs.isEmpty()) return usage("no input");

        Debug.useSlf4j();
        FluxoConfig config = (configFile != null) ? FluxoConfig.fromFile(configFile) : FluxoConfig.fromClasspath();
        FluxoScript engine = config.applyTo(new FluxoScript());
        if (compat) engine.setMode(FluxoScript.Mode.COMPAT);

        ExecuteResult result;
        try {
            Path first = Path.of(inputs.get(0));
            if (inputs.size() == 1 && Files.isDirectory(first)) {
                result = engine.execute(new DirectorySourceProvider(first), null, entry);
            } else {
                List<SourceFile> files = new ArrayList<>();
                for (String in : inputs) {
                    Path p = Path.of(in);
                    files.add(new SourceFile(p.getFileName().toString(), Files.readString(p, StandardCharsets.UTF_8)));
                }
                result = engine.execute(files, entry != null ? entry : files.get(0).path());
            }
        } catch (IOException e) {
            System.err.println("Failed to read input: " + e.getMessage());
            return 3;
        }

        if (json) {
            try {
                ObjectMapper om = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
                System.out.println(om.writeValueAsString(result));
            } catch (IOException e) {
                System.err.println("Failed to render result: " + e.getMessage());
                return 3;
            }
        } else {
            if (result.error() != null) System.err.println("error: " + result.error());
            for (OutputEvent ev : result.events()) {
                System.out.println(ev);
            }
        }
        return result.hasErrors() ? 1 : 0;
    }

    private static int usage(String problem) {
        System.err.println(problem);
        System.err.println("Usage: fluxo <dir | file...> [--entry path] [--compat] [--json] [--config file]");
        return 2;
    }

    private FluxoCli() {}
}
