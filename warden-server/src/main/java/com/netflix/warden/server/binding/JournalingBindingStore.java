/*
 * Copyright 2021 Netflix, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.netflix.warden.server.binding;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import javax.annotation.PreDestroy;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.netflix.warden.api.binding.model.Binding;
import com.netflix.warden.api.binding.service.BindingStore;
import com.netflix.warden.api.binding.service.BindingStoreException;
import com.netflix.warden.api.json.ObjectMappers;
import com.netflix.warden.common.runtime.WardenRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link BindingStore} recording each change as a JSON line in an append-only journal. The journal is replayed
 * on startup, and then compacted to one line per active binding. A change is visible only after its journal line
 * is written, and it is rolled back if the write fails. A failed write is cut off from the journal, so the file
 * always ends with a complete line.
 */
public class JournalingBindingStore implements BindingStore {

    private static final Logger logger = LoggerFactory.getLogger(JournalingBindingStore.class);

    private static final ObjectMapper MAPPER = ObjectMappers.defaultMapper();

    private final Path journalPath;
    private final InMemoryBindingStore delegate;
    private final Object journalLock = new Object();

    /**
     * Guarded by journalLock. Null after a failed reopen, in which case the next write opens it again.
     */
    private FileChannel channel;
    private long committedSize;

    public JournalingBindingStore(Path journalPath, WardenRuntime runtime) {
        this.journalPath = journalPath;
        this.delegate = new InMemoryBindingStore(runtime);
        replay();
        try {
            Path parent = journalPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            compact();
            this.committedSize = Files.size(journalPath);
            this.channel = openChannel();
        } catch (IOException e) {
            throw BindingStoreException.journalFailure(journalPath.toString(), e);
        }
    }

    @PreDestroy
    public void shutdown() {
        synchronized (journalLock) {
            closeChannel();
        }
    }

    @Override
    public Binding bind(String workloadId, String poolId) {
        synchronized (journalLock) {
            Binding binding = delegate.bind(workloadId, poolId);
            try {
                append(JournalEntry.bind(binding));
            } catch (IOException e) {
                delegate.unbind(workloadId);
                throw BindingStoreException.journalFailure(journalPath.toString(), e);
            }
            return binding;
        }
    }

    @Override
    public Optional<Binding> unbind(String workloadId) {
        synchronized (journalLock) {
            Optional<Binding> removed = delegate.unbind(workloadId);
            if (!removed.isPresent()) {
                return removed;
            }
            try {
                append(JournalEntry.unbind(workloadId));
            } catch (IOException e) {
                delegate.restore(removed.get());
                throw BindingStoreException.journalFailure(journalPath.toString(), e);
            }
            return removed;
        }
    }

    @Override
    public List<Binding> listBindings(String poolId) {
        return delegate.listBindings(poolId);
    }

    @Override
    public Optional<Binding> findBinding(String workloadId) {
        return delegate.findBinding(workloadId);
    }

    @Override
    public List<Binding> listAll() {
        return delegate.listAll();
    }

    @Override
    public <T> T executeInPoolLock(String poolId, Supplier<T> action) {
        return delegate.executeInPoolLock(poolId, action);
    }

    private void append(JournalEntry entry) throws IOException {
        ByteBuffer line = ByteBuffer.wrap((MAPPER.writeValueAsString(entry) + '\n').getBytes(StandardCharsets.UTF_8));
        try {
            if (channel == null) {
                channel = openChannel();
            }
            while (line.hasRemaining()) {
                channel.write(line);
            }
            committedSize = channel.position();
        } catch (IOException e) {
            reopenAfterFailure();
            throw e;
        }
    }

    /**
     * Drops the channel, which may hold a partially written line, and opens the journal again at the last
     * complete line.
     */
    private void reopenAfterFailure() {
        closeChannel();
        try {
            channel = openChannel();
        } catch (IOException e) {
            logger.warn("Cannot reopen binding journal {}, retrying on the next write", journalPath, e);
        }
    }

    private FileChannel openChannel() throws IOException {
        FileChannel opened = FileChannel.open(journalPath, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
        try {
            if (opened.size() > committedSize) {
                logger.warn("Truncating incomplete write at the end of binding journal {}: {} -> {} bytes", journalPath, opened.size(), committedSize);
                opened.truncate(committedSize);
            }
            opened.position(committedSize);
            return opened;
        } catch (IOException e) {
            opened.close();
            throw e;
        }
    }

    private void closeChannel() {
        if (channel == null) {
            return;
        }
        try {
            channel.close();
        } catch (IOException e) {
            logger.warn("Cannot close binding journal {}", journalPath, e);
        }
        channel = null;
    }

    /**
     * Rewrites the journal with the active bindings only. The new content is written to a temporary file first,
     * and moved over the journal in one step.
     */
    private void compact() throws IOException {
        Path compacted = journalPath.resolveSibling(journalPath.getFileName() + ".compacted");
        List<Binding> active = delegate.listAll();
        try (BufferedWriter writer = Files.newBufferedWriter(compacted, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            for (Binding binding : active) {
                writer.write(MAPPER.writeValueAsString(JournalEntry.bind(binding)));
                writer.newLine();
            }
        }
        Files.move(compacted, journalPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        logger.info("Binding journal {} compacted: activeBindings={}", journalPath, active.size());
    }

    /**
     * A malformed last line is the result of an interrupted write, and is skipped. A malformed line anywhere
     * else means the journal is corrupted.
     */
    private void replay() {
        if (!Files.exists(journalPath)) {
            logger.info("Binding journal {} not found, starting with an empty store", journalPath);
            return;
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(journalPath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw BindingStoreException.journalFailure(journalPath.toString(), e);
        }

        int applied = 0;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (line.isEmpty()) {
                continue;
            }
            JournalEntry entry;
            try {
                entry = MAPPER.readValue(line, JournalEntry.class);
            } catch (JsonProcessingException e) {
                if (i == lines.size() - 1) {
                    logger.warn("Skipping incomplete last line of binding journal {}: {}", journalPath, line);
                    break;
                }
                throw BindingStoreException.journalFailure(journalPath.toString(), e);
            }
            if (entry.getType() == JournalEntry.Type.Bind) {
                delegate.restore(entry.getBinding());
            } else {
                delegate.unbind(entry.getWorkloadId());
            }
            applied++;
        }
        logger.info("Binding journal {} replayed: entries={}, activeBindings={}", journalPath, applied, delegate.listAll().size());
    }
}
