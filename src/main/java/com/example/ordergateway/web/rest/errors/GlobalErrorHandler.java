package com.example.ordergateway.web.rest.errors;

import com.example.ordergateway.exception.TokenException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.stream.Collectors;

/**
 * Global Error Handler
 *
 * Request-shape failures and unexpected exceptions, rendered as {@code {"detail": ...}}
 * without exposing internals. Order and auth outcomes are translated by the controllers
 * and the bearer filter, not here.
 */
@Slf4j
@RestControllerAdvice
public class GlobalErrorHandler {

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<Object> handleValidationException(
      MethodArgumentNotValidException ex, WebRequest request) {

    String errors = ex.getBindingResult().getFieldErrors().stream()
        .map(FieldError::getDefaultMessage)
        .sorted()
        .collect(Collectors.joining(", "));

    log.debug("Validation failed for {}: {}", extractPath(request), errors);
    return ErrorResponses.of(HttpStatus.UNPROCESSABLE_ENTITY, errors);
  }

  @ExceptionHandler(MissingServletRequestParameterException.class)
  public ResponseEntity<Object> handleMissingParams(
      MissingServletRequestParameterException ex, WebRequest request) {

    return ErrorResponses.of(HttpStatus.UNPROCESSABLE_ENTITY,
                             String.format("Missing required parameter: %s", ex.getParameterName()));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<Object> handleUnreadableBody(
      HttpMessageNotReadableException ex, WebRequest request) {

    log.debug("Unreadable request body for {}: {}", extractPath(request), ex.getMessage());
    return ErrorResponses.of(HttpStatus.UNPROCESSABLE_ENTITY, "Malformed request body");
  }

  @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
  public ResponseEntity<Object> handleMediaTypeNotSupported(
      HttpMediaTypeNotSupportedException ex, WebRequest request) {

    return ErrorResponses.of(HttpStatus.UNSUPPORTED_MEDIA_TYPE,
                             String.format("Content type %s not supported", ex.getContentType()));
  }

  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  public ResponseEntity<Object> handleMethodNotSupported(
      HttpRequestMethodNotSupportedException ex, WebRequest request) {

    return ErrorResponses.of(HttpStatus.METHOD_NOT_ALLOWED,
                             String.format("Method %s not supported", ex.getMethod()));
  }

  @ExceptionHandler({NoResourceFoundException.class, NoHandlerFoundException.class})
  public ResponseEntity<Object> handleNoRoute(
      Exception ex, WebRequest request) {

    log.debug("No route for {}", extractPath(request));
    return ErrorResponses.of(HttpStatus.NOT_FOUND, ErrorResponses.NOT_FOUND);
  }

  @ExceptionHandler(TokenException.class)
  public ResponseEntity<Object> handleTokenException(
      TokenException ex, WebRequest request) {
    log.error("Token error on {}", extractPath(request), ex);
    return ErrorResponses.of(HttpStatus.INTERNAL_SERVER_ERROR, ErrorResponses.INTERNAL_ERROR);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<Object> handleGenericException(
      Exception ex, WebRequest request) {
    log.error("Unexpected error on {}", extractPath(request), ex);
    return ErrorResponses.of(HttpStatus.INTERNAL_SERVER_ERROR, ErrorResponses.INTERNAL_ERROR);
  }

  private String extractPath(WebRequest request) {
    String description = request.getDescription(false);
    return description.replace("uri=", "");
  }
}
