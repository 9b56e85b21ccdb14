package com.cronq.internal;

import com.cronq.CronTaskHandler;
import com.cronq.ExecutionResult;
import com.cronq.config.CronQProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CronTaskDispatcherTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private CronTaskDispatcher dispatcher;

    @AfterEach
    void tearDown() {
        if (dispatcher != null) {
            dispatcher.shutdownExecutor();
        }
    }

    @Test
    void shouldRouteOperandToHandlerOfOperator() throws Exception {
        dispatcher = new CronTaskDispatcher(List.of(handler("$api", (id, operand) -> "called " + operand.get("url").asText()),
                handler("$crud", (id, operand) -> "crud")), properties());

        ExecutionResult result = dispatcher
                .dispatch(UUID.randomUUID(), objectMapper.readTree("{\"$api\":{\"url\":\"https://example.org\"}}"))
                .get(5, TimeUnit.SECONDS);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.message()).isEqualTo("called https://example.org");
        assertThat(dispatcher.operators()).containsExactlyInAnyOrder("$api", "$crud");
    }

    @Test
    void shouldUseDefaultMessageWhenHandlerReturnsNothing() throws Exception {
        dispatcher = new CronTaskDispatcher(List.of(handler("$crud", (id, operand) -> null)), properties());

        ExecutionResult result = dispatcher.dispatch(UUID.randomUUID(), objectMapper.readTree("{\"$crud\":{}}"))
                .get(5, TimeUnit.SECONDS);

        assertThat(result).isEqualTo(ExecutionResult.success(CronTaskDispatcher.DEFAULT_SUCCESS_MESSAGE));
    }

    @Test
    void shouldReportHandlerExceptionAsFailure() throws Exception {
        dispatcher = new CronTaskDispatcher(List.of(handler("$api", (id, operand) -> {
            throw new IllegalStateException("remote returned 503");
        })), properties());

        ExecutionResult result = dispatcher.dispatch(UUID.randomUUID(), objectMapper.readTree("{\"$api\":{}}"))
                .get(5, TimeUnit.SECONDS);

        assertThat(result).isEqualTo(ExecutionResult.failure("remote returned 503"));
    }

    @Test
    void shouldFailUnknownOperatorAndMalformedTask() throws Exception {
        dispatcher = new CronTaskDispatcher(List.of(), properties());

        assertThat(dispatcher.dispatch(UUID.randomUUID(), objectMapper.readTree("{\"$shell\":{}}")).get().isSuccess())
                .isFalse();
        assertThat(dispatcher.dispatch(UUID.randomUUID(), objectMapper.readTree("{\"a\":1,\"b\":2}")).get().message())
                .contains("exactly one operator");
        assertThat(dispatcher.dispatch(UUID.randomUUID(), null).get().isSuccess()).isFalse();
    }

    @Test
    void shouldRejectDuplicateOrBlankOperators() {
        assertThatThrownBy(() -> new CronTaskDispatcher(
                List.of(handler("$api", (id, operand) -> "a"), handler("$api", (id, operand) -> "b")), properties()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Duplicate operator '$api'");
        assertThatThrownBy(() -> new CronTaskDispatcher(List.of(handler(" ", (id, operand) -> "a")), properties()))
                .isInstanceOf(IllegalStateException.class);
    }

    private static CronQProperties properties() {
        CronQProperties properties = new CronQProperties();
        properties.getExecution().setWorkerCount(2);
        return properties;
    }

    private static CronTaskHandler handler(String operator, Execution execution) {
        return new CronTaskHandler() {
            @Override
            public String getOperator() {
                return operator;
            }

            @Override
            public String execute(UUID jobId, JsonNode operand) throws Exception {
                return execution.run(jobId, operand);
            }
        };
    }

    @FunctionalInterface
    private interface Execution {
        String run(UUID jobId, JsonNode operand) throws Exception;
    }
}
