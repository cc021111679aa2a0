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

import dev.mars.weft.core.process.Process;
import dev.mars.weft.core.process.ProcessRegistry;
import dev.mars.weft.core.process.ProcessState;
import dev.mars.weft.core.process.StatusReport;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Server side of the control protocol.
 *
 * <p>Each attached process gets an RPC subscription on its pid address. An
 * incoming message is decoded, applied on the process scheduler and answered
 * with a {@link ControlResponse}. The router also listens on the host broadcast
 * address and applies {@code pause_all}, {@code play_all} and {@code kill_all}
 * to every process in the {@link ProcessRegistry}.</p>
 *
 * <p>Commands are idempotent: pausing a paused process and killing a killed
 * one both reply {@code true}. A terminated process keeps its pid address and
 * answers from its final status report, so a redelivered kill still succeeds.
 * Only the most recent {@code retainedTerminated} of them are kept; older ones
 * lose their address and become unknown.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 * @version 1.0
 */
public class ProcessControlRouter {

    private static final Logger logger = LoggerFactory.getLogger(ProcessControlRouter.class);

    public static final int DEFAULT_RETAINED_TERMINATED = 1024;

    private final Communicator communicator;
    private final ControlAddresses addresses;
    private final ProcessRegistry registry;
    private final int retainedTerminated;
    private final Map<String, Endpoint> endpoints = new ConcurrentHashMap<>();
    // Retired pids, oldest first. Guarded by this.
    private final Map<String, Endpoint> retired = new LinkedHashMap<>();
    private Communicator.Subscription broadcastSubscription;

    public ProcessControlRouter(Communicator communicator, ControlAddresses addresses, ProcessRegistry registry) {
        this(communicator, addresses, registry, DEFAULT_RETAINED_TERMINATED);
    }

    public ProcessControlRouter(Communicator communicator, ControlAddresses addresses, ProcessRegistry registry,
                                int retainedTerminated) {
        this.communicator = Objects.requireNonNull(communicator, "Communicator cannot be null");
        this.addresses = Objects.requireNonNull(addresses, "Addresses cannot be null");
        this.registry = Objects.requireNonNull(registry, "Registry cannot be null");
        if (retainedTerminated < 0) {
            throw new IllegalArgumentException("Retained terminated count cannot be negative: " + retainedTerminated);
        }
        this.retainedTerminated = retainedTerminated;
    }


    /**
     * Subscribes to host broadcasts. Calling it again has no effect.
     */
    public synchronized void start() {
        if (broadcastSubscription == null) {
            broadcastSubscription = communicator.addBroadcastSubscriber(addresses.broadcast(), this::onBroadcast);
            logger.info("Control router listening on {}", addresses.broadcast());
        }
    }

    /**
     * Removes every subscription of this router.
     */
    public synchronized Future<Void> close() {
        List<Future<Void>> removals = new ArrayList<>();
        if (broadcastSubscription != null) {
            removals.add(broadcastSubscription.unsubscribe());
            broadcastSubscription = null;
        }
        endpoints.values().forEach(e -> removals.add(e.subscription.unsubscribe()));
        endpoints.clear();
        retired.clear();
        return Future.all(removals).mapEmpty();
    }

    // ==================== Process subscriptions ====================

    public void attach(Process process) {
        String pid = process.getPid();
        synchronized (this) {
            Endpoint existing = endpoints.get(pid);
            if (existing != null && existing.process == null) {
                // Reloaded from a checkpoint while its terminated twin is still retained.
                retired.remove(pid);
                existing.process = process;
            } else if (existing == null) {
                Endpoint endpoint = new Endpoint(pid, process);
                endpoint.subscription = communicator.addRpcSubscriber(addresses.process(pid), endpoint::handle);
                endpoints.put(pid, endpoint);
            }
        }
        logger.debug("Process<{}>: listening on {}", pid, addresses.process(pid));
    }

    /**
     * Detaches a process. A terminated process is retired: its address stays
     * and answers from the final status report. Any other process loses its
     * address.
     */
    public void detach(Process process) {
        String pid = process.getPid();
        Communicator.Subscription removed = null;
        List<Endpoint> evicted = new ArrayList<>();
        synchronized (this) {
            Endpoint endpoint = endpoints.get(pid);
            if (endpoint == null || endpoint.process != process) {
                return;
            }
            if (process.isTerminated() && retainedTerminated > 0) {
                endpoint.finalReport = process.getStatusReport();
                endpoint.process = null;
                retired.put(pid, endpoint);
                Iterator<Endpoint> oldest = retired.values().iterator();
                while (retired.size() > retainedTerminated) {
                    Endpoint eldest = oldest.next();
                    oldest.remove();
                    endpoints.remove(eldest.pid);
                    evicted.add(eldest);
                }
            } else {
                endpoints.remove(pid);
                removed = endpoint.subscription;
            }
        }
        if (removed != null) {
            unsubscribe(pid, removed);
        }
        for (Endpoint eldest : evicted) {
            logger.debug("Process<{}>: no longer retained", eldest.pid);
            unsubscribe(eldest.pid, eldest.subscription);
        }
    }

    private static void unsubscribe(String pid, Communicator.Subscription subscription) {
        subscription.unsubscribe().onFailure(err ->
            logger.warn("Process<{}>: failed to remove control subscription: {}", pid, err.getMessage()));
    }

    /**
     * Whether a live process listens on the pid address.
     */
    public boolean isAttached(String pid) {
        Endpoint endpoint = endpoints.get(pid);
        return endpoint != null && endpoint.process != null;
    }

    /**
     * Whether a terminated process still answers on the pid address.
     */
    public synchronized boolean isRetained(String pid) {
        return retired.containsKey(pid);
    }

    Future<JsonObject> onRpc(Process process, JsonObject json) {
        ControlMessage message;
        try {
            message = decode(process.getPid(), json);
        } catch (ControlException e) {
            return Future.succeededFuture(ControlResponse.error(ControlMessage.peekCorrelationId(json), e).toJson());
        }

        logger.debug("Process<{}>: received {}", process.getPid(), message.kind().getValue());
        Promise<JsonObject> reply = Promise.promise();
        process.getScheduler().schedule(() -> reply.complete(execute(process, message).toJson()));
        return reply.future();
    }

    private ControlResponse execute(Process process, ControlMessage message) {
        try {
            Object result = switch (message.kind()) {
                case PLAY -> process.play();
                case PAUSE -> process.pause(message.payloadString(ControlMessage.MESSAGE_KEY));
                case KILL -> process.kill(message.payloadString(ControlMessage.MESSAGE_KEY));
                case STATUS -> new JsonObject(process.getStatusReport().toMap());
                default -> throw ControlException.of(ControlErrorCode.UNKNOWN_INTENT, message.kind().getValue());
            };
            return ControlResponse.ok(message.correlationId(), result);
        } catch (ControlException e) {
            logger.warn("Process<{}>: rejected {}: {}", process.getPid(), message.kind().getValue(), e.getMessage());
            return ControlResponse.error(message.correlationId(), e);
        } catch (RuntimeException e) {
            logger.error("Process<{}>: failed to apply {}", process.getPid(), message.kind().getValue(), e);
            return ControlResponse.error(message.correlationId(), e);
        }
    }

    /**
     * Answers a message sent to a terminated process from its final status report.
     */
    Future<JsonObject> onRetiredRpc(StatusReport finalReport, JsonObject json) {
        String pid = finalReport.pid();
        ControlMessage message;
        try {
            message = decode(pid, json);
        } catch (ControlException e) {
            return Future.succeededFuture(ControlResponse.error(ControlMessage.peekCorrelationId(json), e).toJson());
        }

        logger.debug("Process<{}>: received {} after terminating in {}", pid, message.kind().getValue(),
            finalReport.label());
        ControlResponse response = switch (message.kind()) {
            case PLAY, PAUSE -> ControlResponse.ok(message.correlationId(), false);
            case KILL -> ControlResponse.ok(message.correlationId(), finalReport.label() == ProcessState.KILLED);
            case STATUS -> ControlResponse.ok(message.correlationId(), new JsonObject(finalReport.toMap()));
            default -> {
                ControlException e = ControlException.of(ControlErrorCode.UNKNOWN_INTENT, message.kind().getValue());
                logger.warn("Process<{}>: rejected {}: {}", pid, message.kind().getValue(), e.getMessage());
                yield ControlResponse.error(message.correlationId(), e);
            }
        };
        return Future.succeededFuture(response.toJson());
    }

    private static ControlMessage decode(String pid, JsonObject json) throws ControlException {
        try {
            ControlMessage message = ControlMessage.fromJson(json);
            if (message.pid() != null && !message.pid().equals(pid)) {
                throw ControlException.malformed("pid '" + message.pid() + "' sent to Process<" + pid + ">");
            }
            return message;
        } catch (ControlException e) {
            logger.warn("Process<{}>: rejected control message: {}", pid, e.getMessage());
            throw e;
        }
    }

    // ==================== Host broadcasts ====================

    void onBroadcast(JsonObject json) {
        ControlMessage message;
        try {
            message = ControlMessage.fromJson(json);
        } catch (ControlException e) {
            logger.debug("Ignoring undecodable broadcast: {}", e.getMessage());
            return;
        }
        if (message.kind().getTarget() != ControlIntent.Target.ALL) {
            return;
        }

        String text;
        try {
            text = message.payloadString(ControlMessage.MESSAGE_KEY);
        } catch (ControlException e) {
            logger.warn("Ignoring {} broadcast: {}", message.kind().getValue(), e.getMessage());
            return;
        }
        List<Process> processes = registry.getAll();
        logger.info("Applying {} to {} processes", message.kind().getValue(), processes.size());
        for (Process process : processes) {
            process.getScheduler().schedule(() -> applyToAll(process, message.kind(), text));
        }
    }

    private static void applyToAll(Process process, ControlIntent intent, String text) {
        switch (intent) {
            case PAUSE_ALL:
                process.pause(text);
                break;
            case PLAY_ALL:
                process.play();
                break;
            case KILL_ALL:
                process.kill(text);
                break;
            default:
                break;
        }
    }

    /**
     * The pid address of one process. It routes to the live process until the
     * process retires, then to its final status report.
     */
    private final class Endpoint {

        private final String pid;
        private volatile Process process;
        private volatile StatusReport finalReport;
        private Communicator.Subscription subscription;

        private Endpoint(String pid, Process process) {
            this.pid = pid;
            this.process = process;
        }

        private Future<JsonObject> handle(JsonObject json) {
            Process live = process;
            if (live != null) {
                return onRpc(live, json);
            }
            return onRetiredRpc(finalReport, json);
        }
    }
}
