package com.fluxo.script;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Properties;

/**
 * Engine settings from a properties source.
 *
 * Keys: fluxo.mode (strict|compat), fluxo.maxCallDepth,
 * fluxo.maxLoopIterations, fluxo.maxDeferredTasks, fluxo.moduleTimeoutMillis.
 * Missing keys keep the engine defaults.
 */
public final class FluxoConfig {

    public static final String RESOURCE = "fluxo.properties";
    public static final long DEFAULT_MODULE_TIMEOUT_MILLIS = 5000L;

    private final Properties props;

    private FluxoConfig(Properties props) {
        this.props = props;
    }

    public static FluxoConfig empty() {
        return new FluxoConfig(new Properties());
    }

    public static FluxoConfig of(Properties props) {
        Properties copy = new Properties();
        copy.putAll(props);
        return new FluxoConfig(copy);
    }

    /** Loads {@value #RESOURCE} from the classpath; empty config if absent. */
    public static FluxoConfig fromClasspath() {
        Properties p = new Properties();
        try (InputStream in = FluxoConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) p.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
        return new FluxoConfig(p);
    }

    public static FluxoConfig fromFile(Path file) {
        Properties p = new Properties();
        try (InputStream in = Files.newInputStream(file)) {
            p.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
        return new FluxoConfig(p);
    }

    public FluxoScript.Mode mode(FluxoScript.Mode fallback) {
        String v = props.getProperty("fluxo.mode");
        if (v == null || v.isBlank()) return fallback;
        return FluxoScript.Mode.valueOf(v.trim().toUpperCase(Locale.ROOT));
    }

    public int intValue(String key, int fallback) {
        String v = props.getProperty(key);
        if (v == null || v.isBlank()) return fallback;
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + v, e);
        }
    }

    public long moduleTimeoutMillis() {
        String v = props.getProperty("fluxo.moduleTimeoutMillis");
        if (v == null || v.isBlank()) return DEFAULT_MODULE_TIMEOUT_MILLIS;
        try {
            return Long.parseLong(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid fluxo.moduleTimeoutMillis: " + v, e);
        }
    }

    public FluxoScript applyTo(FluxoScript engine) {
        engine.setMode(mode(engine.getMode()));
        engine.setMaxCallDepth(intValue("fluxo.maxCallDepth", engine.getMaxCallDepth()));
        engine.setMaxLoopIterations(intValue("fluxo.maxLoopIterations", engine.getMaxLoopIterations()));
        engine.setMaxDeferredTasks(intValue("fluxo.maxDeferredTasks", engine.getMaxDeferredTasks()));
        return engine;
    }
}
