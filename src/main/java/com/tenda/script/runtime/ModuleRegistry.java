package com.tenda.script.runtime;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import com.tenda.debug.Debug;
import com.tenda.script.ast.CaptureAnalyzer;
import com.tenda.script.ast.Program;

/**
 * Runs imported modules for one execution. Each module runs at most once, in
 * its own {@link Stack} over the same prelude base; importers receive the
 * module's exported cells, so a shared export stays aliased.
 */
public final class ModuleRegistry {

    private static final String TAG = "Modules";

    private final ModuleLoader loader;
    private final Environment base;
    private final Platform platform;
    private final int maxCallDepth;

    private final Map<String, Map<String, ValueCell>> loaded = new HashMap<>();
    private final Set<String> loading = new LinkedHashSet<>();

    public ModuleRegistry(ModuleLoader loader, Environment base, Platform platform, int maxCallDepth) {
        this.loader = loader;
        this.base = base;
        this.platform = platform;
        this.maxCallDepth = maxCallDepth;
    }

    /** Marks the entry program as in progress so that a module importing it is reported as a cycle. */
    public void enter(String moduleId) {
        loading.add(moduleId);
    }

    public void leave(String moduleId) {
        loading.remove(moduleId);
    }

    /**
     * @return the module's exports by name
     * @throws RuntimeError MODULE_NOT_FOUND, IMPORT_CYCLE, or whatever the module raised
     */
    public Map<String, ValueCell> load(String id) {
        Map<String, ValueCell> cached = loaded.get(id);
        if (cached != null) {
            Debug.get().d(TAG, "cache hit: " + id);
            return cached;
        }
        if (loading.contains(id)) {
            throw new RuntimeError(Diagnostic.importCycle(id));
        }

        Program program = (loader == null) ? null : loader.load(id);
        if (program == null) {
            throw new RuntimeError(Diagnostic.moduleNotFound(id));
        }
        CaptureAnalyzer.annotate(program);

        Debug.get().d(TAG, "loading module: " + id);
        loading.add(id);
        try {
            Interpreter interpreter = new Interpreter(new Stack(base, maxCallDepth), platform, this);
            ControlSignal result = interpreter.run(program);
            if (result.isRaised()) {
                throw new RuntimeError(result.diagnostic);
            }
            Map<String, ValueCell> exports = Collections.unmodifiableMap(interpreter.exports());
            loaded.put(id, exports);
            Debug.get().d(TAG, "module " + id + " exports " + exports.keySet());
            return exports;
        } finally {
            loading.remove(id);
        }
    }
}
