package com.tenda.script.runtime;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ThreadLocalRandom;

/** Console-backed {@link Platform}. */
public final class SystemPlatform implements Platform {

    private final PrintStream out;
    private BufferedReader in;

    public SystemPlatform() {
        this(System.out);
    }

    public SystemPlatform(PrintStream out) {
        this.out = out;
    }

    @Override
    public void println(String text) {
        out.println(text);
        out.flush();
    }

    @Override
    public void print(String text) {
        out.print(text);
        out.flush();
    }

    @Override
    public synchronized String readLine() {
        if (in == null) in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        try {
            return in.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read standard input", e);
        }
    }

    @Override
    public double random() {
        return ThreadLocalRandom.current().nextDouble();
    }
}
