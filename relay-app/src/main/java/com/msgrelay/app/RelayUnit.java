package com.msgrelay.app;

/**
 * An independently scheduled part of the relay. {@link #run()} blocks for the lifetime of
 * the unit; {@link #stop()} may be called from any thread to make it return.
 */
public interface RelayUnit {

    String name();

    void run() throws Exception;

    void stop();
}
