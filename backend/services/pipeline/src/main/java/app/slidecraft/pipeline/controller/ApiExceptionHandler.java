package app.slidecraft.pipeline.controller;

import app.slidecraft.pipeline.controller.dto.ValidationErrorResponse;
import app.slidecraft.pipeline.domain.type.TaskErrorKind;
import app.slidecraft.pipeline.error.ValidationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(ValidationException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ValidationErrorResponse handleValidation(ValidationException ex) {
        return new ValidationErrorResponse(ex.kind(), ex.field(), ex.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ValidationErrorResponse handleUnreadable(HttpMessageNotReadableException ex) {
        return new ValidationErrorResponse(TaskErrorKind.VALIDATION, "body", "Request body is not valid JSON");
    }
}
