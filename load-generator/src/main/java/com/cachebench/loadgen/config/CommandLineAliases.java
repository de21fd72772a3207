package com.cachebench.loadgen.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Rewrites the short benchmark flags onto their {@code bench.*} property keys before Spring
 * sees the arguments, so that {@code --rps 5} and {@code --rps=5} both become
 * {@code --bench.rps=5}. Only the command line is consulted: an exported {@code HOST} or
 * {@code RPS} environment variable never changes a run.
 *
 * <p>Arguments that are not short flags pass through untouched.
 */
public final class CommandLineAliases {

    static final Map<String, String> ALIASES = Map.of(
        "host",         "bench.host",
        "rps",          "bench.rps",
        "duration",     "bench.duration-seconds",
        "warmup",       "bench.warmup-seconds",
        "queries-file", "bench.queries-file",
        "repeat-ratio", "bench.repeat-ratio");

    private CommandLineAliases() {}

    public static String[] expand(String... args) {
        List<String> out = new ArrayList<>(args.length);
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (!arg.startsWith("--")) {
                out.add(arg);
                continue;
            }
            String body = arg.substring(2);
            int eq = body.indexOf('=');
            String name = eq < 0 ? body : body.substring(0, eq);
            String target = ALIASES.get(name);
            if (target == null) {
                out.add(arg);
            } else if (eq >= 0) {
                out.add("--" + target + "=" + body.substring(eq + 1));
            } else if (i + 1 < args.length && !args[i + 1].startsWith("--")) {
                out.add("--" + target + "=" + args[++i]);
            } else {
                // bare flag with no value; let Spring report the empty property
                out.add("--" + target + "=");
            }
        }
        return out.toArray(new String[0]);
    }
}
