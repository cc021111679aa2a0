/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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

package dev.mars.weft.core.process;

import io.vertx.core.Context;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * {@link Scheduler} backed by a Vert.x event-loop context. Every task runs on
 * the context's thread, so processes sharing a context interleave on one loop.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class VertxScheduler implements Scheduler {

    private static final Logger logger = LoggerFactory.getLogger(VertxScheduler.class);

    private final Context context;

    public VertxScheduler(Context context) {
        this.context = Objects.requireNonNull(context, "Context cannot be null");
    }

    /**
     * Creates a scheduler on a fresh event-loop context of the given Vert.x instance.
     */
    public static VertxScheduler create(Vertx vertx) {
        return new VertxScheduler(vertx.getOrCreateContext());
    }

    public Context getContext() {
        return context;
    }

    @Override
    public void schedule(Runnable task) {
        Objects.requireNonNull(task, "Task cannot be null");
        context.runOnContext(v -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                logger.error("Unhandled exception in scheduled task", e);
            }
        });
    }
}
