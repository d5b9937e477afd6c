package com.ownding.camera.common;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void mapsEveryErrorKindToItsStatus() {
        assertEquals(HttpStatus.NOT_FOUND, GlobalExceptionHandler.statusOf(ErrorKind.NOT_FOUND));
        assertEquals(HttpStatus.CONFLICT, GlobalExceptionHandler.statusOf(ErrorKind.CONFLICT));
        assertEquals(HttpStatus.BAD_REQUEST, GlobalExceptionHandler.statusOf(ErrorKind.VALIDATION));
    }

    @Test
    void registryExceptionKeepsItsMessage() {
        ResponseEntity<ApiResult<Void>> response = handler.handleRegistryException(
                RegistryException.conflict("Feed port 554 is already in use"));

        assertEquals(409, response.getStatusCode().value());
        assertNotNull(response.getBody());
        assertEquals(409, response.getBody().code());
        assertEquals("Feed port 554 is already in use", response.getBody().message());
    }

    @Test
    void unexpectedErrorsAreNotDowngraded() {
        ResponseEntity<ApiResult<Void>> response = handler.handleOther(new IllegalStateException("broken store"));

        assertEquals(500, response.getStatusCode().value());
        assertEquals(500, response.getBody().code());
    }
}
