package com.tyron.markj.testFramework;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

/**
 * Base class for tests that work on documents and files.
 * <p>
 * - Configures test logging once.
 * - Provides a fresh temporary directory and a {@link ManualDebouncer} per test.
 */
public abstract class BaseMarkupTest {

    @TempDir
    public Path temporaryFolder;

    protected ManualDebouncer debouncer;

    @BeforeEach
    public final void baseSetUp() throws Exception {
        TestLogging.configureOnce();
        debouncer = new ManualDebouncer();
        beforeEach();
    }

    @AfterEach
    public final void baseTearDown() {
        try {
            afterEach();
        } finally {
            debouncer.dispose();
        }
    }

    /**
     * Subclasses override for per-test setup.
     */
    protected void beforeEach() throws Exception {
    }

    /**
     * Subclasses override for per-test teardown.
     */
    protected void afterEach() {
    }

    protected static CaretText caret(String marked) {
        return CaretText.parse(marked);
    }
}
