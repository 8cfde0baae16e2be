package me.golemcore.coder.infrastructure.config;

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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.coder.domain.service.command.CommandEnvironment;
import me.golemcore.coder.domain.service.command.CommandPermissionClassifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared infrastructure beans and startup logging.
 *
 * <p>
 * The command environment is filtered from the process environment once, here.
 * Nothing else reads ambient environment variables, so provider keys never
 * reach a child process.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final CoderProperties properties;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    public CommandEnvironment commandEnvironment() {
        return CommandEnvironment.filter(System.getenv(), properties.getShell().getAllowedEnvVars());
    }

    @Bean
    public CommandPermissionClassifier commandPermissionClassifier() {
        CoderProperties.ShellProperties shell = properties.getShell();
        return new CommandPermissionClassifier(shell.getAllowlist(), shell.getDenylist(),
                shell.getDenylistStandalone());
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService commandIoExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "command-io-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @PostConstruct
    public void init() {
        log.info("GolemCore Coder starting...");
        log.info("LLM Provider: {} ({}), model: {}", properties.getLlm().getProvider(),
                properties.getLlm().getBaseUrl(), properties.getLlm().getModel());
        log.info("Workspace: {}", properties.getShell().getWorkspace());
        log.info("Sessions: {}", properties.getStorage().getSessionsDirectory());
    }
}
