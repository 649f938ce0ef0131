import com.fluxo.script.FluxoCli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class FluxoCliTest {

    @TempDir
    Path dir;

    @Test
    public void cleanWorkspace_exitsZero() throws Exception {
        Files.writeString(dir.resolve("main.fxo"), "console.log(\"hi\")");
        assertEquals(0, FluxoCli.run(new String[] { dir.toString(), "--json" }));
    }

    @Test
    public void errorEvents_exitOne() throws Exception {
        Path f = dir.resolve("bad.fxo");
        Files.writeString(f, "nope()");
        assertEquals(1, FluxoCli.run(new String[] { f.toString() }));
    }

    @Test
    public void compatFlag_allowsUndeclaredAssignment() throws Exception {
        Path f = dir.resolve("legacy.fxo");
        Files.writeString(f, "total = 3\nconsole.log(total)");
        assertEquals(1, FluxoCli.run(new String[] { f.toString() }));
        assertEquals(0, FluxoCli.run(new String[] { f.toString(), "--compat" }));
    }

    @Test
    public void badArguments_exitTwo() {
        assertEquals(2, FluxoCli.run(new String[0]));
        assertEquals(2, FluxoCli.run(new String[] { "--bogus" }));
        assertEquals(2, FluxoCli.run(new String[] { "x.fxo", "--entry" }));
    }
}
