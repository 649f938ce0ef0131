import com.fluxo.script.DirectorySourceProvider;
import com.fluxo.script.ExecuteResult;
import com.fluxo.script.FluxoScript;
import com.fluxo.script.errors.ModuleNotFoundError;
import com.fluxo.script.resolve.FileKind;
import com.fluxo.script.resolve.SourceUnit;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DirectorySourceProviderTest {

    @TempDir
    Path root;

    private void write(String rel, String text) throws Exception {
        Path p = root.resolve(rel);
        Files.createDirectories(p.getParent());
        Files.writeString(p, text, StandardCharsets.UTF_8);
    }

    @Test
    public void listsSourcesWithCanonicalPaths() throws Exception {
        write("ws/main.fxo", "console.log(1)");
        write("ws/lib/util.fxm", "module util { }");
        write("ws/notes.txt", "ignored");

        List<SourceUnit> units = new DirectorySourceProvider(root).listModulesAndScripts("ws");

        assertEquals(2, units.size());
        assertEquals("/lib/util.fxm", units.get(0).path());
        assertEquals(FileKind.MODULE, units.get(0).kind());
        assertEquals("/main.fxo", units.get(1).path());
    }

    @Test
    public void readFile_missingIsModuleNotFound() throws Exception {
        write("a.fxo", "x");
        DirectorySourceProvider p = new DirectorySourceProvider(root);

        assertEquals("x", p.readFile("/a.fxo"));
        assertThrows(ModuleNotFoundError.class, () -> p.readFile("/b.fxo"));
        assertThrows(ModuleNotFoundError.class, () -> p.readFile("/../outside.fxo"));
    }

    @Test
    public void unknownWorkspace_isRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new DirectorySourceProvider(root).listModulesAndScripts("nope"));
    }

    @Test
    public void executesAWorkspaceFromDisk() throws Exception {
        write("main.fxo", "import from \"./lib/util\" { twice }\nconsole.log(twice(5))");
        write("lib/util.fxm", "module util { export function twice(x) { return x * 2 } }");

        ExecuteResult r = new FluxoScript().execute(new DirectorySourceProvider(root), null, "/main.fxo");

        assertEquals(1, r.events().size());
        assertEquals("10", r.events().get(0).message());
    }
}
