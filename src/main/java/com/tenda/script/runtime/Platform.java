package com.tenda.script.runtime;

/** Operating-system services the prelude needs. Swapped out by tests and embedding hosts. */
public interface Platform {

    /** Writes a line. */
    void println(String text);

    /** Writes without a line break. */
    void print(String text);

    /** Reads one line; null at end of input. */
    String readLine();

    /** Uniform in [0, 1). */
    double random();
}
