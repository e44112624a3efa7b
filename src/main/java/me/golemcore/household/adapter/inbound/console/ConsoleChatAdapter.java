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

package me.golemcore.household.adapter.inbound.console;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.household.domain.model.ChatReply;
import me.golemcore.household.domain.service.ChatService;
import me.golemcore.household.infrastructure.config.AssistantProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletionException;

/**
 * Chats over stdin/stdout, one message per line. {@code /quit} or end of input
 * stops the loop.
 */
@Component
@ConditionalOnProperty(prefix = "assistant.console", name = "enabled", havingValue = "true")
@Slf4j
public class ConsoleChatAdapter implements CommandLineRunner {

    private static final String QUIT = "/quit";

    private final ChatService chatService;
    private final String sessionId;
    private final Reader input;
    private final Writer output;

    @Autowired
    public ConsoleChatAdapter(ChatService chatService, AssistantProperties properties) {
        this(chatService, properties, new InputStreamReader(System.in, StandardCharsets.UTF_8),
                new PrintWriter(System.out, true, StandardCharsets.UTF_8));
    }

    ConsoleChatAdapter(ChatService chatService, AssistantProperties properties, Reader input, Writer output) {
        this.chatService = chatService;
        this.sessionId = properties.getConsole().getSessionId();
        this.input = input;
        this.output = output;
    }

    @Override
    public void run(String... args) {
        log.info("Console chat started for session {}", sessionId);
        PrintWriter out = output instanceof PrintWriter printWriter ? printWriter : new PrintWriter(output, true);
        BufferedReader reader = new BufferedReader(input);
        try {
            out.print("> ");
            out.flush();
            String line;
            while ((line = reader.readLine()) != null) {
                if (QUIT.equalsIgnoreCase(line.strip())) {
                    break;
                }
                if (!line.isBlank()) {
                    out.println(ask(line));
                }
                out.print("> ");
                out.flush();
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Console input failed", e);
        }
        out.println();
        out.flush();
        log.info("Console chat finished");
    }

    private String ask(String line) {
        try {
            ChatReply reply = chatService.handleMessage(sessionId, line, null).join();
            return reply.text();
        } catch (CompletionException e) {
            log.error("Console message failed", e);
            return "Something went wrong: " + e.getCause().getMessage();
        }
    }
}
