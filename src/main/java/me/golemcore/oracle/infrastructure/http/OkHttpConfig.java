package me.golemcore.oracle.infrastructure.http;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.oracle.infrastructure.config.OracleProperties;
import okhttp3.ConnectionPool;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * The OkHttp client behind the completion service Feign client. Its read
 * timeout covers the slower of the two completion modes; each call still
 * narrows it through Feign request options.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class OkHttpConfig {

    private final OracleProperties properties;

    @Bean
    public OkHttpClient okHttpClient() {
        OracleProperties.HttpProperties http = properties.getHttp();
        Duration readTimeout = longestCompletionTimeout(properties.getLlm());
        log.debug("[Http] Completion client: connect {}, read {}, pool {}", http.getConnectTimeout(), readTimeout,
                http.getMaxIdleConnections());

        return new OkHttpClient.Builder()
                .connectTimeout(http.getConnectTimeout())
                .readTimeout(readTimeout)
                .writeTimeout(http.getWriteTimeout())
                .connectionPool(new ConnectionPool(http.getMaxIdleConnections(),
                        http.getKeepAliveDuration().toMillis(), TimeUnit.MILLISECONDS))
                .build();
    }

    static Duration longestCompletionTimeout(OracleProperties.LlmProperties llm) {
        Duration standard = llm.getRequestTimeout();
        Duration reasoning = llm.getReasoningRequestTimeout();
        return reasoning.compareTo(standard) > 0 ? reasoning : standard;
    }
}
