package com.infomedia.abacox.storemigration.controller;

import com.infomedia.abacox.storemigration.exception.JobAlreadyRunningException;
import com.infomedia.abacox.storemigration.exception.SourceApiException;
import com.infomedia.abacox.storemigration.exception.TargetApiException;
import com.infomedia.abacox.storemigration.exception.UnknownEntityKindException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.net.URI;

@RestControllerAdvice
@Log4j2
public class ApiExceptionHandler {

    @ExceptionHandler(JobAlreadyRunningException.class)
    public ResponseEntity<ProblemDetail> handleJobConflict(JobAlreadyRunningException e, HttpServletRequest request) {
        return respond(HttpStatus.CONFLICT, e.getMessage(), request);
    }

    @ExceptionHandler({UnknownEntityKindException.class, IllegalArgumentException.class,
            ConstraintViolationException.class})
    public ResponseEntity<ProblemDetail> handleBadRequest(RuntimeException e, HttpServletRequest request) {
        log.debug("Rejected request {}: {}", request.getRequestURI(), e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, e.getMessage(), request);
    }

    @ExceptionHandler({SourceApiException.class, TargetApiException.class})
    public ResponseEntity<ProblemDetail> handleRemoteFailure(RuntimeException e, HttpServletRequest request) {
        log.error("Remote API call failed while serving {}", request.getRequestURI(), e);
        return respond(HttpStatus.BAD_GATEWAY, e.getMessage(), request);
    }

    private static ResponseEntity<ProblemDetail> respond(HttpStatus status, String detail, HttpServletRequest request) {
        ProblemDetail pd = ErrorController.problem(status, detail);
        pd.setInstance(URI.create(request.getRequestURI()));
        return ResponseEntity.status(status).contentType(MediaType.APPLICATION_PROBLEM_JSON).body(pd);
    }
}
