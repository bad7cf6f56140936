package com.phillippitts.callagent.presentation.exception;

import com.phillippitts.callagent.exception.ProfileNotFoundException;
import com.phillippitts.callagent.exception.SynthesisException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void unknownProfileReturns404WithoutNumber() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleProfileNotFound(new ProfileNotFoundException("+61390000000"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().errorCode()).isEqualTo("ProfileNotFoundException");
        assertThat(response.getBody().toString()).doesNotContain("+61390000000");
    }

    @Test
    void engineFailureReturns503() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleEngineFailure(new SynthesisException("voice service down", "voice-1"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().errorCode()).isEqualTo("SynthesisException");
        assertThat(response.getBody().message()).isEqualTo("Call engine temporarily unavailable");
        assertThat(response.getBody().timestamp()).isNotNull();
    }

    @Test
    void unexpectedErrorReturns500WithoutInternals() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleUnexpected(new IllegalStateException("secret internal state"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().errorCode()).isEqualTo("InternalServerError");
        assertThat(response.getBody().toString()).doesNotContain("secret internal state");
    }
}
