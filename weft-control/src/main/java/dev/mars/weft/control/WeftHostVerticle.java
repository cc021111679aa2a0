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

package dev.mars.weft.control;

import dev.mars.weft.core.config.WeftConfiguration;
import dev.mars.weft.core.persistence.Persister;
import dev.mars.weft.core.persistence.PersisterFactory;
import dev.mars.weft.core.persistence.ProcessBundler;
import dev.mars.weft.core.persistence.TypeRegistry;
import dev.mars.weft.core.process.ProcessEnvironment;
import dev.mars.weft.core.process.ProcessRegistry;
import dev.mars.weft.core.process.VertxScheduler;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Verticle hosting Weft processes.
 *
 * <p>On start-up it wires the host collaborators: the process registry, a
 * scheduler on the verticle's event-loop context, the configured checkpoint
 * store, the event bus communicator, the control router and the launcher
 * listening on the task address. Processes launched through the task queue
 * all run on this verticle's context.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-03-04
 */
public class WeftHostVerticle extends AbstractVerticle {

    private static final Logger logger = LoggerFactory.getLogger(WeftHostVerticle.class);

    private final WeftConfiguration config;
    private final TypeRegistry typeRegistry;

    private ProcessRegistry registry;
    private Persister persister;
    private ControlAddresses addresses;
    private ProcessControlRouter router;
    private ProcessEnvironment environment;
    private Communicator.Subscription taskSubscription;

    public WeftHostVerticle(TypeRegistry typeRegistry) {
        this(WeftConfiguration.get(), typeRegistry);
    }

    public WeftHostVerticle(WeftConfiguration config, TypeRegistry typeRegistry) {
        this.config = Objects.requireNonNull(config, "Configuration cannot be null");
        this.typeRegistry = Objects.requireNonNull(typeRegistry, "Type registry cannot be null");
    }

    @Override
    public void start(Promise<Void> startPromise) {
        logger.info("Starting WeftHostVerticle...");

        try {
            // 1. Checkpoint store
            ProcessBundler bundler = new ProcessBundler(typeRegistry);
            this.persister = PersisterFactory.create(config, bundler);

            // 2. Control plane
            Communicator communicator = new VertxCommunicator(vertx);
            this.addresses = new ControlAddresses(config.getAddressPrefix());
            this.registry = new ProcessRegistry();
            this.router = new ProcessControlRouter(communicator, addresses, registry,
                    config.getRetainedTerminated());
            router.start();
            CommunicatorBinding binding = new CommunicatorBinding(vertx, communicator, router, addresses,
                    config.getBroadcastTimeoutMs());

            // 3. Process environment on this verticle's event loop
            this.environment = ProcessEnvironment.builder()
                    .scheduler(new VertxScheduler(context))
                    .registry(registry)
                    .persister(persister)
                    .controlBinding(binding)
                    .build();

            // 4. Task queue
            ProcessLauncher launcher = new ProcessLauncher(environment, bundler);
            this.taskSubscription = communicator.addRpcSubscriber(addresses.tasks(), launcher::handle);

            logger.info("WeftHostVerticle started: tasks={}, broadcast={}, persistence={}",
                    addresses.tasks(), addresses.broadcast(), persister.getClass().getSimpleName());
            startPromise.complete();
        } catch (Exception e) {
            logger.error("Failed to start WeftHostVerticle", e);
            startPromise.fail(e);
        }
    }

    @Override
    public void stop(Promise<Void> stopPromise) {
        logger.info("Stopping WeftHostVerticle ({} live processes)...", registry == null ? 0 : registry.size());
        List<Future<Void>> closing = new ArrayList<>();
        if (taskSubscription != null) {
            closing.add(taskSubscription.unsubscribe());
        }
        if (router != null) {
            closing.add(router.close());
        }
        Future.all(closing)
                .onSuccess(v -> {
                    logger.info("WeftHostVerticle stopped");
                    stopPromise.complete();
                })
                .onFailure(err -> {
                    logger.warn("WeftHostVerticle stopped with errors: {}", err.getMessage());
                    stopPromise.complete();
                });
    }

    public ProcessEnvironment getEnvironment() {
        return environment;
    }

    public ProcessRegistry getRegistry() {
        return registry;
    }

    public Persister getPersister() {
        return persister;
    }

    public ControlAddresses getAddresses() {
        return addresses;
    }

    public WeftConfiguration getConfiguration() {
        return config;
    }
}
