/*
 * Copyright (C) 2021 Frode Randers
 * All rights reserved
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.gautelis.viewer.session;

import org.apache.commons.lang3.StringUtils;
import org.gautelis.viewer.Configuration;
import org.gautelis.viewer.InstanceLoader;
import org.gautelis.viewer.NotFoundException;
import org.gautelis.viewer.extract.FrameExtractor;
import org.gautelis.viewer.extract.MetadataExtractor;
import org.gautelis.viewer.io.InstanceDecoder;
import org.gautelis.viewer.io.NamedPayload;
import org.gautelis.viewer.io.ZipArchiveSource;
import org.gautelis.viewer.model.Instance;
import org.gautelis.viewer.model.Series;
import org.gautelis.viewer.series.SeriesAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point for viewing uploaded studies. Each upload of one or more ZIP
 * archives becomes a session, holding the series found in those archives.
 * <p>
 * All sessions share one bounded pool of render threads. When its queue is
 * full, pre-renders are dropped and requested renders run in the caller.
 */
public class SessionRegistry implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    public static final String NO_VALID_ARCHIVES = "No valid ZIP files found";

    private final Configuration config;
    private final InstanceLoader loader;
    private final SeriesAggregator aggregator;
    private final ThreadPoolExecutor renderPool;

    private final Map<String, Session> sessions = new LinkedHashMap<>();
    private final AtomicInteger sequence = new AtomicInteger();

    public SessionRegistry(Configuration config, InstanceDecoder decoder) {
        this.config = config;
        this.loader = new InstanceLoader(decoder);
        this.aggregator = new SeriesAggregator(
                new MetadataExtractor(), new FrameExtractor(config.normalizeOnExtraction()));

        AtomicInteger threadCount = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "frame-render-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        this.renderPool = new ThreadPoolExecutor(
                config.prerenderThreads(), config.prerenderThreads(),
                60L, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(config.prerenderQueueSize()),
                threadFactory,
                new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * Opens a new session from the uploaded archives. Archives that are not
     * readable ZIP files are reported in the summary and otherwise ignored.
     *
     * @throws UnreadableArchiveException if no archive could be read
     */
    public SessionSummary open(List<NamedPayload> archives) throws UnreadableArchiveException {
        List<String> rejected = new ArrayList<>();
        List<Instance> instances = new ArrayList<>();
        int accepted = 0;

        for (NamedPayload archive : archives) {
            String name = archive.getName();
            if (!StringUtils.endsWithIgnoreCase(name, ".zip")) {
                rejected.add(name + " (not a ZIP file)");
                continue;
            }
            if (archive.size() == 0) {
                rejected.add(name + " (empty file)");
                continue;
            }
            if (!ZipArchiveSource.isZip(archive.getBytes())) {
                rejected.add(name + " (invalid ZIP file)");
                continue;
            }

            try {
                instances.addAll(loader.load(new ZipArchiveSource(archive)));
                accepted++;

            } catch (IOException ioe) {
                String info = "Failed to read archive " + name + ": " + ioe.getMessage();
                log.warn(info, ioe);
                rejected.add(name + " (invalid ZIP file)");
            }
        }

        if (accepted == 0) {
            log.info("Rejected upload: {}", rejected);
            throw new UnreadableArchiveException(NO_VALID_ARCHIVES, rejected);
        }

        Map<String, Series> series = aggregator.aggregate(instances);
        String id = "session_" + sequence.getAndIncrement();
        Session session = new Session(id, series, rejected, config, renderPool);
        synchronized (sessions) {
            sessions.put(id, session);
        }
        log.info("Opened {} with {} series from {} instances ({} archives rejected)",
                id, series.size(), instances.size(), rejected.size());
        return session.summarize();
    }

    /**
     * @return ids of the open sessions, oldest first
     */
    public List<String> listSessions() {
        synchronized (sessions) {
            return new ArrayList<>(sessions.keySet());
        }
    }

    public Session getSession(String sessionId) throws NotFoundException {
        Session session;
        synchronized (sessions) {
            session = sessions.get(sessionId);
        }
        if (null == session) {
            throw new NotFoundException("Session not found: " + sessionId);
        }
        return session;
    }

    public void deleteSession(String sessionId) throws NotFoundException {
        Session removed;
        synchronized (sessions) {
            removed = sessions.remove(sessionId);
        }
        if (null == removed) {
            throw new NotFoundException("Session not found: " + sessionId);
        }
        log.info("Deleted {}", removed);
    }

    public EncodedFrame getFrame(String sessionId, String seriesUID, int frameIndex) throws NotFoundException {
        return getSession(sessionId).getFrame(seriesUID, frameIndex);
    }

    @Override
    public void close() {
        renderPool.shutdownNow();
        synchronized (sessions) {
            sessions.clear();
        }
    }
}
