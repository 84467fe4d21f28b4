package com.arkive.exception;

import com.arkive.models.dto.response.ResponseTemplate;
import jakarta.servlet.RequestDispatcher;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.web.servlet.error.AbstractErrorController;
import org.springframework.boot.web.error.ErrorAttributeOptions;
import org.springframework.boot.web.servlet.error.ErrorAttributes;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.Objects;

/**
 * Renders container level errors (filter rejections, unmapped paths, {@code ResponseStatusException}) in the
 * {@link ResponseTemplate} shape.
 */
@RestController
@Slf4j
public class ArkiveErrorController extends AbstractErrorController {
    public ArkiveErrorController(ErrorAttributes errorAttributes) {
        super(errorAttributes);
    }

    @RequestMapping("/error")
    public ResponseEntity<ResponseTemplate<Void>> handleError(HttpServletRequest request) {
        HttpStatus status = this.getStatus(request);
        Map<String, Object> errorAttributes = this.getErrorAttributes(request, ErrorAttributeOptions.defaults().including(ErrorAttributeOptions.Include.MESSAGE));
        if (request.getAttribute(RequestDispatcher.ERROR_EXCEPTION) instanceof Throwable throwable) {
            logException(throwable);
        }
        String message = Objects.toString(errorAttributes.get("message"), status.getReasonPhrase());
        String code = Objects.toString(errorAttributes.get("error"), status.getReasonPhrase());
        return new ResponseEntity<>(ResponseTemplate.error(message, code), status);
    }

    void logException(Throwable throwable) {
        log.error("Exception occurred", throwable);
    }
}
