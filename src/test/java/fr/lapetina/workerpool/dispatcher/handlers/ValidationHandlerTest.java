package fr.lapetina.workerpool.dispatcher.handlers;

import fr.lapetina.workerpool.dispatcher.JobEvent;
import fr.lapetina.workerpool.domain.model.ErrorType;
import fr.lapetina.workerpool.domain.model.Job;
import fr.lapetina.workerpool.domain.model.SubmitOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ValidationHandlerTest {

    private ValidationHandler handler;
    private JobEvent event;

    @BeforeEach
    void setUp() {
        handler = new ValidationHandler(20);
        event = new JobEvent();
    }

    private Job job(String payload) {
        return new Job("caller-1", payload, SubmitOptions.defaults(), 3);
    }

    @Test
    @DisplayName("should accept a valid payload")
    void shouldAcceptValidPayload() {
        event.initialize(job("Hello, world!"));

        handler.onEvent(event, 7, true);

        assertThat(event.hasError()).isFalse();
        assertThat(event.getSequence()).isEqualTo(7);
    }

    @Test
    @DisplayName("should reject a blank payload")
    void shouldRejectBlankPayload() {
        event.initialize(job("   "));

        handler.onEvent(event, 0, true);

        assertThat(event.getErrorType()).isEqualTo(ErrorType.VALIDATION_ERROR);
        assertThat(event.getErrorMessage()).contains("required");
    }

    @Test
    @DisplayName("should reject a missing payload")
    void shouldRejectNullPayload() {
        event.initialize(job(null));

        handler.onEvent(event, 0, true);

        assertThat(event.getErrorType()).isEqualTo(ErrorType.VALIDATION_ERROR);
    }

    @Test
    @DisplayName("should reject a payload over the maximum length")
    void shouldRejectOversizedPayload() {
        event.initialize(job("x".repeat(21)));

        handler.onEvent(event, 0, true);

        assertThat(event.getErrorType()).isEqualTo(ErrorType.VALIDATION_ERROR);
        assertThat(event.getErrorMessage()).contains("20");
    }

    @Test
    @DisplayName("should handle an empty slot")
    void shouldHandleNullJob() {
        event.initialize(null);

        handler.onEvent(event, 0, true);

        assertThat(event.getErrorType()).isEqualTo(ErrorType.VALIDATION_ERROR);
    }

    @Test
    @DisplayName("should require a positive maximum length")
    void shouldRejectInvalidMaximum() {
        assertThatThrownBy(() -> new ValidationHandler(0)).isInstanceOf(IllegalArgumentException.class);
        assertThat(ValidationHandler.withDefaults().getMaxPayloadLength()).isEqualTo(100_000);
    }
}
