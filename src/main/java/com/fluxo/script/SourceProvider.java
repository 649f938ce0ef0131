package com.fluxo.script;

import com.fluxo.script.resolve.SourceUnit;

import java.util.List;

/** File storage as seen by the engine: read-only access by path. */
public interface SourceProvider {

    /** @throws com.fluxo.script.errors.ModuleNotFoundError when no file exists at {@code path} */
    String readFile(String path);

    /** Every module and script of the workspace, in the order the caller wants them run. */
    List<SourceUnit> listModulesAndScripts(String workspaceId);
}
