package com.tenda.script.json;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.tenda.debug.Debug;
import com.tenda.script.ast.Program;
import com.tenda.script.runtime.ModuleLoader;

/** Resolves module {@code id} to the syntax tree stored in {@code <root>/<id>.json}. */
public final class JsonModuleLoader implements ModuleLoader {

    private static final String TAG = "JsonModuleLoader";

    private final Path root;
    private final AstJsonReader reader;

    public JsonModuleLoader(Path root) {
        this(root, new AstJsonReader());
    }

    public JsonModuleLoader(Path root, AstJsonReader reader) {
        this.root = root.toAbsolutePath().normalize();
        this.reader = reader;
    }

    @Override
    public Program load(String id) {
        Path file = root.resolve(id + ".json").normalize();
        if (!file.startsWith(root)) {
            Debug.get().w(TAG, "module id escapes the module root: " + id);
            return null;
        }
        if (!Files.isRegularFile(file)) {
            Debug.get().d(TAG, "no module file for " + id + " at " + file);
            return null;
        }
        try {
            Debug.get().i(TAG, "reading module " + id + " from " + file);
            return reader.read(file, id);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read module " + id + " from " + file, e);
        }
    }

    public Path root() {
        return root;
    }
}
