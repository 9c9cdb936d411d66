package com.odebridge;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import com.odebridge.debug.Debug;
import com.odebridge.debug.DebugLevel;
import com.odebridge.protocol.ModelJson;

/**
 * Command line front end: converts one script and prints the JSON view to stdout.
 *
 * <pre>
 * OdeBridgeCli [--lenient] [--rate-rules] [--tolerance x] [--compartment id] [--verbose | --log-level level] script.m
 * </pre>
 *
 * Exit codes: 0 converted, 1 conversion failed, 2 bad usage, 3 unreadable file.
 */
public final class OdeBridgeCli {

    public static void main(String[] args) {
        System.exit(run(args));
    }

    public static int run(String[] args) {
        OdeBridge bridge = new OdeBridge();
        String file = null;
        try {
            for (int i = 0; i < args.length; i++) {
                String a = args[i];
                switch (a) {
                    case "--lenient":
                        bridge.setMode(OdeBridge.Mode.LENIENT);
                        break;
                    case "--rate-rules":
                        bridge.setInferReactions(false);
                        break;
                    case "--tolerance":
                        bridge.setCoefficientTolerance(Double.parseDouble(value(args, ++i, a)));
                        break;
                    case "--compartment":
                        bridge.setCompartmentId(value(args, ++i, a));
                        break;
                    case "--verbose":
                        Debug.get().setSink(Debug.streamSink(System.err, DebugLevel.DEBUG));
                        break;
                    case "--log-level": {
                        DebugLevel level = DebugLevel.parse(value(args, ++i, a));
                        Debug.get().setThreshold(level);
                        Debug.get().setSink(Debug.streamSink(System.err, level));
                        break;
                    }
                    default:
                        if (a.startsWith("--") || file != null) throw new IllegalArgumentException("unexpected argument '" + a + "'");
                        file = a;
                }
            }
            if (file == null) throw new IllegalArgumentException("no script given");
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println("Usage: OdeBridgeCli [--lenient] [--rate-rules] [--tolerance x] [--compartment id] [--verbose | --log-level level] <script.m>");
            return 2;
        }

        final Path path = Path.of(file);
        final String source;
        try {
            source = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            System.err.println("Failed to read script file: " + path);
            e.printStackTrace(System.err);
            return 3;
        }

        ConversionResult result = bridge.convert(path.getFileName().toString(), source);
        System.out.println(ModelJson.write(result));
        for (ConversionError e : result.errors()) System.err.println(e.describe());
        return result.isSuccess() ? 0 : 1;
    }

    private static String value(String[] args, int i, String flag) {
        if (i >= args.length) throw new IllegalArgumentException(flag + " needs a value");
        return args[i];
    }

    private OdeBridgeCli() {}
}
