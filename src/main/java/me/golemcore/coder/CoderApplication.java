package me.golemcore.coder;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for GolemCore Coder.
 *
 * <p>
 * GolemCore Coder is a coding agent runtime built with Spring Boot: it runs
 * model turns against an OpenAI-compatible backend, authorizes and executes
 * workspace tools, and asks for human approval where the active mode requires
 * it.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Input Layer        → ConsoleAdapter, SessionCommandHandler
 * Domain Layer       → CodingAgent, Middleware, ModeManager, ToolAuthorizer, ApprovalGate
 * Infrastructure     → langchain4j model backend, JSON session logs, SecureCommandExecutor
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under {@code coder.*}
 * prefix.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class CoderApplication {

    public static void main(String[] args) {
        SpringApplication.run(CoderApplication.class, args);
    }

}
