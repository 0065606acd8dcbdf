package com.fantasygolf.engine.exception;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.junit.jupiter.api.Assertions.*;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void testHandleValidation_UnprocessableWithField() {
        ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
            handler.handleValidation(new ValidationException("multiplier", "must be a positive number"));

        assertEquals(HttpStatus.UNPROCESSABLE_ENTITY, response.getStatusCode());
        assertEquals("VALIDATION_ERROR", response.getBody().getErrorCode());
        assertEquals("multiplier", response.getBody().getField());
    }

    @Test
    void testHandleNotFound() {
        ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
            handler.handleNotFound(new GolferNotFoundException("Golfer not found with id: g9"));

        assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
        assertNull(response.getBody().getField());
    }

    @Test
    void testHandleEngineException_PersistenceIsServerError() {
        ResponseEntity<GlobalExceptionHandler.ErrorResponse> response = handler.handleEngineException(
            new PersistenceException("Failed to write price for golfer g1", new IllegalStateException()));

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        assertEquals("PERSISTENCE_ERROR", response.getBody().getErrorCode());
    }
}
