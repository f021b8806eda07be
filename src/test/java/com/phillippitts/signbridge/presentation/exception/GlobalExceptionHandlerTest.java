package com.phillippitts.signbridge.presentation.exception;

import com.phillippitts.signbridge.exception.CacheDeserializationException;
import com.phillippitts.signbridge.exception.MediationTimeoutException;
import com.phillippitts.signbridge.exception.PersistenceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.MethodParameter;
import org.springframework.http.HttpInputMessage;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BeanPropertyBindingResult;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void unknownScenarioIsBadRequest() {
        ResponseEntity<?> response = handler.handleIllegalArgument(
                new IllegalArgumentException("Unknown scenario: clinic"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().toString())
                .contains("InvalidRequest")
                .contains("Unknown scenario: clinic");
    }

    @Test
    void validationFailureListsFields() throws NoSuchMethodException {
        BeanPropertyBindingResult result = new BeanPropertyBindingResult(new Object(), "termRequest");
        result.addError(new FieldError("termRequest", "phrase", "must not be blank"));
        result.addError(new FieldError("termRequest", "mediatedText", "must not be blank"));
        MethodParameter parameter = new MethodParameter(
                GlobalExceptionHandlerTest.class.getDeclaredMethod("validationFailureListsFields"), -1);
        MethodArgumentNotValidException ex = new MethodArgumentNotValidException(parameter, result);

        ResponseEntity<?> response = handler.handleValidation(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().toString())
                .contains("ValidationFailed")
                .contains("phrase must not be blank")
                .contains("mediatedText must not be blank");
    }

    @Test
    void malformedBodyIsBadRequest() {
        HttpMessageNotReadableException ex = new HttpMessageNotReadableException(
                "JSON parse error", new IOException("Unexpected character"), mock(HttpInputMessage.class));

        ResponseEntity<?> response = handler.handleUnreadable(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().toString()).contains("MalformedBody");
    }

    @Test
    void writeToReadOnlyTableIsConflict() {
        ResponseEntity<?> response = handler.handleUnsupported(
                new UnsupportedOperationException("Phrase table 'emergency' is immutable"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody().toString()).contains("immutable");
    }

    @Test
    void persistenceFailureHidesNamespace() {
        PersistenceException ex = new CacheDeserializationException("signbridge_sign_cache", "bad blob",
                new IllegalStateException());

        ResponseEntity<?> response = handler.handlePersistence(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().toString())
                .contains("CacheDeserializationException")
                .contains("Storage temporarily unavailable")
                .doesNotContain("signbridge_sign_cache");
    }

    @Test
    void domainFailureIsServiceUnavailable() {
        ResponseEntity<?> response = handler.handleDomainFailure(new MediationTimeoutException(1500));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().toString())
                .contains("MediationTimeoutException")
                .contains("Please retry in a few seconds");
    }

    @Test
    void unexpectedErrorDoesNotLeakDetails() {
        ResponseEntity<?> response = handler.handleUnexpected(new RuntimeException("secret patient data"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().toString())
                .contains("InternalServerError")
                .doesNotContain("secret patient data");
    }
}
