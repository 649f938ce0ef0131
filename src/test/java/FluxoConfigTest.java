import com.fluxo.script.FluxoConfig;
import com.fluxo.script.FluxoScript;

import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class FluxoConfigTest {

    @Test
    public void classpathDefaults_matchTheEngineDefaults() {
        FluxoConfig cfg = FluxoConfig.fromClasspath();
        FluxoScript es = cfg.applyTo(new FluxoScript());

        assertEquals(FluxoScript.Mode.STRICT, es.getMode());
        assertEquals(256, es.getMaxCallDepth());
        assertEquals(5000L, cfg.moduleTimeoutMillis());
    }

    @Test
    public void propertiesOverrideSettings() {
        Properties p = new Properties();
        p.setProperty("fluxo.mode", "compat");
        p.setProperty("fluxo.maxLoopIterations", "10");
        p.setProperty("fluxo.moduleTimeoutMillis", "250");

        FluxoConfig cfg = FluxoConfig.of(p);
        FluxoScript es = cfg.applyTo(new FluxoScript());

        assertEquals(FluxoScript.Mode.COMPAT, es.getMode());
        assertEquals(10, es.getMaxLoopIterations());
        assertEquals(250L, cfg.moduleTimeoutMillis());
    }

    @Test
    public void loopLimit_stopsRunawayLoops() {
        Properties p = new Properties();
        p.setProperty("fluxo.maxLoopIterations", "100");
        FluxoScript es = FluxoConfig.of(p).applyTo(new FluxoScript());

        String msg = es.run("while (true) { }").get(0).message();
        assertTrue(msg.startsWith("RangeError:"), msg);
    }

    @Test
    public void badNumber_isReported() {
        Properties p = new Properties();
        p.setProperty("fluxo.maxCallDepth", "deep");
        assertThrows(IllegalArgumentException.class, () -> FluxoConfig.of(p).applyTo(new FluxoScript()));
    }
}
