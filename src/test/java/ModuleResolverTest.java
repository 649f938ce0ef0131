import com.fluxo.script.resolve.FileKind;
import com.fluxo.script.resolve.ModuleResolver;
import com.fluxo.script.resolve.SourceUnit;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ModuleResolverTest {

    private final ModuleResolver resolver = new ModuleResolver();

    @Test
    public void relativeSpecifiers_resolveAgainstImporterDirectory() {
        assertEquals("/app/lib/math.fxm", resolver.resolve("./lib/math", "/app/main.fxo"));
        assertEquals("/shared/util.fxm", resolver.resolve("../shared/util", "/app/main.fxo"));
        assertEquals("/app/sibling.fxm", resolver.resolve("sibling", "/app/main.fxo"));
    }

    @Test
    public void absoluteSpecifiers_ignoreTheImporter() {
        assertEquals("/m.fxm", resolver.resolve("/m", "/deep/dir/x.fxo"));
        assertEquals("/a/b.fxo", resolver.resolve("/a/./c/../b.fxo", "/x.fxo"));
    }

    @Test
    public void dotDotNeverClimbsAboveRoot() {
        assertEquals("/m.fxm", resolver.resolve("../../../m", "/a.fxo"));
    }

    @Test
    public void explicitExtension_isKept() {
        assertEquals("/helpers.fxo", resolver.resolve("helpers.fxo", "/main.fxo"));
        assertEquals("/lib/x.fxm", resolver.resolve("lib/x.fxm", "/main.fxo"));
    }

    @Test
    public void differentSpellings_shareOneCanonicalForm() {
        String a = resolver.resolve("./lib/../lib/m", "/main.fxo");
        String b = resolver.resolve("/lib/m.fxm", "/other/x.fxo");
        String c = resolver.resolve("lib//m", "/main.fxo");
        assertEquals(a, b);
        assertEquals(a, c);
    }

    @Test
    public void plan_putsModulesFirst_keepingCallerOrder() {
        List<SourceUnit> units = new ArrayList<>();
        units.add(SourceUnit.of("/s1.fxo", ""));
        units.add(SourceUnit.of("/z.fxm", ""));
        units.add(SourceUnit.of("/s2.fxo", ""));
        units.add(SourceUnit.of("/a.fxm", ""));

        List<SourceUnit> order = resolver.plan(units);

        List<String> paths = new ArrayList<>();
        for (SourceUnit u : order) paths.add(u.path());
        assertEquals(List.of("/z.fxm", "/a.fxm", "/s1.fxo", "/s2.fxo"), paths);
        assertEquals(FileKind.MODULE, order.get(0).kind());
        assertEquals(FileKind.SCRIPT, order.get(3).kind());
    }

    @Test
    public void plan_rejectsDuplicatePaths() {
        List<SourceUnit> units = List.of(SourceUnit.of("a.fxo", ""), SourceUnit.of("/a.fxo", ""));
        assertThrows(IllegalArgumentException.class, () -> resolver.plan(units));
    }

    @Test
    public void stem_namesFilesWithoutAModuleBlock() {
        assertEquals("util", ModuleResolver.stemOf("/lib/util.fxm"));
        assertEquals("main", ModuleResolver.stemOf("/main.fxo"));
    }
}
