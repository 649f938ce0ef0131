package com.fluxo.script;

import com.fluxo.script.errors.ModuleNotFoundError;
import com.fluxo.script.resolve.FileKind;
import com.fluxo.script.resolve.ModuleResolver;
import com.fluxo.script.resolve.SourceUnit;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Serves a workspace from a directory tree. Workspace ids name
 * subdirectories of the root; a null or empty id means the root itself.
 * Canonical paths are relative to the workspace directory.
 */
public final class DirectorySourceProvider implements SourceProvider {

    private final Path root;

    public DirectorySourceProvider(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public String readFile(String path) {
        String canonical = ModuleResolver.normalize(path);
        Path file = root.resolve(canonical.substring(1)).normalize();
        if (!file.startsWith(root) || !Files.isRegularFile(file)) {
            throw new ModuleNotFoundError(canonical);
        }
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }

    @Override
    public List<SourceUnit> listModulesAndScripts(String workspaceId) {
        Path base = (workspaceId == null || workspaceId.isBlank()) ? root : root.resolve(workspaceId).normalize();
        if (!base.startsWith(root) || !Files.isDirectory(base)) {
            throw new IllegalArgumentException("Unknown workspace: " + workspaceId);
        }
        List<Path> files;
        try (Stream<Path> walk = Files.walk(base)) {
            files = walk.filter(Files::isRegularFile)
                    .filter(DirectorySourceProvider::isSource)
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list " + base, e);
        }
        List<SourceUnit> out = new ArrayList<>(files.size());
        for (Path f : files) {
            String rel = base.relativize(f).toString().replace('\\', '/');
            try {
                out.add(SourceUnit.of(rel, Files.readString(f, StandardCharsets.UTF_8)));
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read " + f, e);
            }
        }
        return out;
    }

    private static boolean isSource(Path p) {
        String name = p.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(FileKind.MODULE_EXTENSION) || name.endsWith(FileKind.SCRIPT_EXTENSION)
                || FileKind.isHtml(name);
    }
}
