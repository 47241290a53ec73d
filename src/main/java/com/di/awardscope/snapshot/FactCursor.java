package com.di.awardscope.snapshot;

import com.fasterxml.jackson.databind.MappingIterator;
import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Streams the facts of several fact files one after another, in the given file order and the
 * file's own row order. Only one file is open at a time.
 *
 * <p>Not thread-safe. Always close; closing releases the file currently open.
 */
@Slf4j
public class FactCursor implements Iterator<ContractFact>, Closeable {

    private final SnapshotFileReader reader;
    private final List<Path> files;
    private int nextFile;
    private MappingIterator<ContractFact> current;
    private long rowsRead;
    private boolean closed;

    FactCursor(SnapshotFileReader reader, List<Path> files) {
        this.reader = reader;
        this.files = List.copyOf(files);
    }

    @Override
    public boolean hasNext() {
        if (closed) return false;
        try {
            while (current == null || !current.hasNextValue()) {
                closeCurrent();
                if (nextFile >= files.size()) return false;
                Path file = files.get(nextFile++);
                log.debug("[FACT-SCAN] Opening {}", file);
                current = reader.openFacts(file);
            }
            return true;
        } catch (IOException e) {
            throw new SnapshotLoadException("Failed to read fact rows: " + e.getMessage(), e);
        }
    }

    @Override
    public ContractFact next() {
        if (!hasNext()) throw new NoSuchElementException();
        try {
            rowsRead++;
            return current.nextValue();
        } catch (IOException e) {
            throw new SnapshotLoadException("Failed to parse fact row " + rowsRead + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        try {
            closeCurrent();
        } catch (IOException e) {
            log.warn("[FACT-SCAN] Failed to close fact file: {}", e.getMessage());
        }
    }

    private void closeCurrent() throws IOException {
        if (current != null) {
            MappingIterator<ContractFact> c = current;
            current = null;
            c.close();
        }
    }
}
