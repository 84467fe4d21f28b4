package com.arkive.exception;

import com.arkive.models.dto.response.ResponseTemplate;
import jakarta.servlet.RequestDispatcher;
import jakarta.servlet.http.HttpServletRequest;
import org.junit.jupiter.api.Test;
import org.springframework.boot.web.servlet.error.DefaultErrorAttributes;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ArkiveErrorControllerTest {

    private final ArkiveErrorController errorController = new ArkiveErrorController(new DefaultErrorAttributes());

    @Test
    void handleErrorWithoutException() {
        HttpServletRequest request = new MockHttpServletRequest();
        request.setAttribute(RequestDispatcher.ERROR_STATUS_CODE, 401);
        request.setAttribute(RequestDispatcher.ERROR_MESSAGE, "Invalid username or password");

        ArkiveErrorController spyController = spy(errorController);
        ResponseEntity<ResponseTemplate<Void>> response = spyController.handleError(request);

        assertEquals(401, response.getStatusCode().value());
        assertNotNull(response.getBody());
        assertEquals("Invalid username or password", response.getBody().getMessage());
        assertEquals("Unauthorized", response.getBody().getCode());
        assertNull(response.getBody().getData());
        verify(spyController, never()).logException(any());
    }

    @Test
    void handleErrorWithException() {
        HttpServletRequest request = new MockHttpServletRequest();
        request.setAttribute(RequestDispatcher.ERROR_STATUS_CODE, 500);
        request.setAttribute(RequestDispatcher.ERROR_MESSAGE, "boom");
        Exception exception = new IllegalStateException("boom");
        request.setAttribute(RequestDispatcher.ERROR_EXCEPTION, exception);

        ArkiveErrorController spyController = spy(errorController);
        ResponseEntity<ResponseTemplate<Void>> response = spyController.handleError(request);

        assertEquals(500, response.getStatusCode().value());
        assertNotNull(response.getBody());
        assertEquals("Internal Server Error", response.getBody().getCode());
        verify(spyController).logException(exception);
    }
}
