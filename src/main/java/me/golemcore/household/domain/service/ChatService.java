/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.household.domain.service;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.household.domain.exception.HandshakeException;
import me.golemcore.household.domain.exception.ToolServerStartException;
import me.golemcore.household.domain.loop.OrchestrationResult;
import me.golemcore.household.domain.loop.ToolOrchestrationLoop;
import me.golemcore.household.domain.model.ChatReply;
import me.golemcore.household.domain.model.ChatSession;
import me.golemcore.household.domain.model.ConversationContext;
import me.golemcore.household.domain.model.Message;
import me.golemcore.household.domain.model.ToolServerDefinition;
import me.golemcore.household.domain.routing.DeterministicRouter;
import me.golemcore.household.domain.routing.RouteResult;
import me.golemcore.household.domain.tools.ToolServerRegistry;
import me.golemcore.household.infrastructure.config.AssistantProperties;
import me.golemcore.household.port.inbound.CommandPort;
import me.golemcore.household.port.outbound.ConversationHistoryPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point for one chat message.
 *
 * <p>
 * Order of handling: slash commands, then the deterministic router, then the
 * orchestration loop. Requests for the same session run one after another,
 * chained behind the previous request of that session, so a queued request
 * holds no worker thread while it waits. Different sessions run in parallel on
 * a fixed worker pool.
 */
@Service
@Slf4j
public class ChatService {

    static final String LLM_FAILURE_REPLY = "Sorry, I couldn't reach the language model. "
            + "Please try again in a moment.";
    static final String EMPTY_MESSAGE_REPLY = "Please type a question, or /help to see the commands.";

    private final CommandPort commandPort;
    private final DeterministicRouter router;
    private final ToolOrchestrationLoop loop;
    private final ConversationHistoryPort historyPort;
    private final ToolServerRegistry registry;
    private final Clock clock;
    private final int maxHistory;
    private final ExecutorService executor;
    private final Map<String, CompletableFuture<ChatReply>> sessionTails = new ConcurrentHashMap<>();

    public ChatService(CommandPort commandPort, DeterministicRouter router, ToolOrchestrationLoop loop,
            ConversationHistoryPort historyPort, ToolServerRegistry registry, AssistantProperties properties,
            Clock clock) {
        this.commandPort = commandPort;
        this.router = router;
        this.loop = loop;
        this.historyPort = historyPort;
        this.registry = registry;
        this.clock = clock;
        this.maxHistory = properties.getSession().getMaxHistory();
        AtomicInteger threadCounter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(Math.max(1, properties.getSession().getWorkerThreads()),
                runnable -> {
                    Thread thread = new Thread(runnable, "chat-worker-" + threadCounter.incrementAndGet());
                    thread.setDaemon(true);
                    return thread;
                });
    }

    /**
     * Handles one message asynchronously.
     *
     * @param requestedServerIds
     *            tool servers enabled for this request; {@code null} means the
     *            configured defaults
     */
    public CompletableFuture<ChatReply> handleMessage(String sessionId, String text, List<String> requestedServerIds) {
        if (sessionId == null || sessionId.isBlank()) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("sessionId must not be blank"));
        }
        CompletableFuture<ChatReply> tail = sessionTails.compute(sessionId, (id, previous) -> {
            CompletableFuture<ChatReply> after = previous != null ? previous : CompletableFuture.completedFuture(null);
            // A failed request must not stop the ones queued behind it
            return after.handleAsync((ignored, error) -> handleMessageSync(id, text, requestedServerIds), executor);
        });
        return tail.whenComplete((reply, error) -> sessionTails.remove(sessionId, tail));
    }

    /**
     * Processes one message on the calling thread. Callers must not run two
     * requests of the same session at once.
     */
    ChatReply handleMessageSync(String sessionId, String text, List<String> requestedServerIds) {
        return process(sessionId, text != null ? text.strip() : "", requestedServerIds);
    }

    int pendingSessionCount() {
        return sessionTails.size();
    }

    private ChatReply process(String sessionId, String text, List<String> requestedServerIds) {
        ChatSession session = historyPort.getOrCreate(sessionId);
        ConversationContext context = session.getContext();
        context.setEnabledToolServerIds(registry.normalizeEnabledServerIds(requestedServerIds));

        if (text.startsWith("/")) {
            return executeCommand(sessionId, text);
        }
        if (text.isEmpty()) {
            return new ChatReply(EMPTY_MESSAGE_REPLY, sessionId, ChatReply.Route.ERROR, List.of());
        }

        session.addMessage(Message.builder()
                .role(Message.ROLE_USER)
                .content(text)
                .timestamp(clock.instant())
                .build(), maxHistory);

        ChatReply reply = answer(session, text);
        session.addMessage(Message.builder()
                .role(Message.ROLE_ASSISTANT)
                .content(reply.text())
                .timestamp(clock.instant())
                .metadata(Map.of("route", reply.route().name(), "toolsCalled", reply.toolsCalled()))
                .build(), maxHistory);
        historyPort.save(session);
        return reply;
    }

    private ChatReply answer(ChatSession session, String text) {
        String sessionId = session.getId();
        ConversationContext context = session.getContext();

        Optional<RouteResult> routed = router.route(text, context);
        if (routed.isPresent()) {
            RouteResult result = routed.get();
            return new ChatReply(result.text(), sessionId, ChatReply.Route.DETERMINISTIC, result.toolCalls());
        }

        try {
            OrchestrationResult result = loop.run(sessionId, session.getMessages(), context);
            log.debug("Session {} answered in {} round(s), {} tool call(s)", sessionId, result.rounds(),
                    result.toolCalls().size());
            return new ChatReply(result.reply(), sessionId, ChatReply.Route.ORCHESTRATED, result.toolCalls());
        } catch (ToolServerStartException e) {
            log.warn("Session {}: tool server {} failed to start: {}", sessionId, e.getServerId(), e.getMessage());
            return new ChatReply(startFailureReply(e), sessionId, ChatReply.Route.ERROR, List.of());
        } catch (CompletionException e) {
            log.error("Session {}: language model call failed", sessionId, e);
            return new ChatReply(LLM_FAILURE_REPLY, sessionId, ChatReply.Route.ERROR, List.of());
        }
    }

    private ChatReply executeCommand(String sessionId, String text) {
        String[] parts = text.substring(1).strip().split("\\s+");
        String command = parts[0].toLowerCase(Locale.ROOT);
        List<String> args = Arrays.asList(parts).subList(1, parts.length);
        CommandPort.CommandResult result = commandPort.execute(command, args, sessionId);
        return new ChatReply(result.output(), sessionId, ChatReply.Route.COMMAND, List.of());
    }

    String startFailureReply(ToolServerStartException e) {
        String name = registry.resolve(e.getServerId())
                .map(ToolServerDefinition::getDisplayName)
                .orElse(e.getServerId());
        if (e instanceof HandshakeException) {
            return "I couldn't connect to the " + name + " tool server: it did not accept any supported "
                    + "protocol version. Please check that the server is up to date.";
        }
        return "I couldn't start the " + name + " tool server (" + e.getMessage()
                + "). Please check its installation and try again.";
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
