package me.golemcore.agentlink;

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
 * Main Spring Boot application class for GolemCore AgentLink.
 *
 * <p>
 * Agents exchange structured messages over secure channels, and every
 * agent-initiated action is gated by human-in-the-loop governance before it
 * runs autonomously.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class AgentLinkApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgentLinkApplication.class, args);
    }
}
