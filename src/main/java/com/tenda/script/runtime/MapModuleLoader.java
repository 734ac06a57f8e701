package com.tenda.script.runtime;

import java.util.LinkedHashMap;
import java.util.Map;

import com.tenda.script.ast.Program;

/** In-memory modules, for embedding hosts and tests. */
public final class MapModuleLoader implements ModuleLoader {

    private final Map<String, Program> modules = new LinkedHashMap<>();

    public MapModuleLoader put(String id, Program program) {
        modules.put(id, program);
        return this;
    }

    @Override
    public Program load(String id) {
        return modules.get(id);
    }
}
