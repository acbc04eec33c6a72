package dev.sidechain.exception;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.MessageSource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.RequestPath;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.validation.BindingResult;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("GlobalExceptionHandler")
class GlobalExceptionHandlerTest {

    @Mock
    private MessageSource messageSource;

    @Mock
    private ServerWebExchange exchange;

    @Mock
    private ServerHttpRequest request;

    @Mock
    private HttpHeaders headers;

    @Mock
    private RequestPath requestPath;

    @InjectMocks
    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        lenient().when(exchange.getRequest()).thenReturn(request);
        lenient().when(request.getHeaders()).thenReturn(headers);
        lenient().when(request.getPath()).thenReturn(requestPath);
        lenient().when(requestPath.value()).thenReturn("/api/v1/notifications");
        lenient().when(headers.getFirst(HttpHeaders.ACCEPT_LANGUAGE)).thenReturn(null);
        // message codes resolve to themselves
        lenient().when(messageSource.getMessage(anyString(), any(), anyString(), any(Locale.class)))
                .thenAnswer(inv -> inv.getArgument(0));
    }

    @Nested
    @DisplayName("Domain exceptions")
    class DomainExceptions {

        @Test
        @DisplayName("should map ResourceNotFoundException to 404")
        void shouldReturn404() {
            var ex = new ResourceNotFoundException("User", "u-404");

            StepVerifier.create(handler.handleResourceNotFound(ex, exchange))
                    .assertNext(resp -> {
                        assertThat(resp.getStatus()).isEqualTo(404);
                        assertThat(resp.getPath()).isEqualTo("/api/v1/notifications");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should map ExternalServiceException to 503 without the upstream detail")
        void shouldReturn503() {
            var ex = new ExternalServiceException("stream", "Connection refused: feeds.internal:443");

            StepVerifier.create(handler.handleExternalService(ex, exchange))
                    .assertNext(resp -> {
                        assertThat(resp.getStatus()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE.value());
                        assertThat(resp.getMessage()).isEqualTo("error.external_unavailable");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should sanitize class names out of IllegalArgumentException messages")
        void shouldSanitizeIllegalArgument() {
            var ex = new IllegalArgumentException("Bad value in dev.sidechain.service.PresenceTracker");

            StepVerifier.create(handler.handleIllegalArgument(ex, exchange))
                    .assertNext(resp -> {
                        assertThat(resp.getStatus()).isEqualTo(400);
                        assertThat(resp.getMessage()).doesNotContain("dev.sidechain").contains("[class]");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should keep a plain IllegalArgumentException message")
        void shouldKeepPlainMessage() {
            var ex = new IllegalArgumentException("Unknown notification category: pokes");

            StepVerifier.create(handler.handleIllegalArgument(ex, exchange))
                    .assertNext(resp -> assertThat(resp.getMessage()).isEqualTo("Unknown notification category: pokes"))
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("Framework exceptions")
    class FrameworkExceptions {

        @Test
        @DisplayName("should return field-level validation errors")
        void shouldReturn400WithFieldErrors() {
            WebExchangeBindException ex = mock(WebExchangeBindException.class);
            BindingResult bindingResult = mock(BindingResult.class);
            FieldError fieldError = new FieldError("request", "userIds", "size must be between 0 and 100");
            when(ex.getBindingResult()).thenReturn(bindingResult);
            when(bindingResult.getFieldErrors()).thenReturn(List.of(fieldError));

            StepVerifier.create(handler.handleValidationErrors(ex, exchange))
                    .assertNext(resp -> {
                        assertThat(resp.getStatus()).isEqualTo(400);
                        assertThat(resp.getValidationErrors()).containsEntry("userIds", "size must be between 0 and 100");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should map AccessDeniedException to 403")
        void shouldReturn403() {
            StepVerifier.create(handler.handleAccessDeniedException(new AccessDeniedException("nope"), exchange))
                    .assertNext(resp -> assertThat(resp.getStatus()).isEqualTo(403))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should keep the status of a ResponseStatusException")
        void shouldPreserveResponseStatus() {
            var ex = new ResponseStatusException(HttpStatus.TOO_MANY_REQUESTS);

            StepVerifier.create(handler.handleResponseStatusException(ex, exchange))
                    .assertNext(entity -> {
                        assertThat(entity.getStatusCode()).isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
                        assertThat(entity.getBody()).isNotNull();
                        assertThat(entity.getBody().getError()).isEqualTo("error.rate_limit_exceeded");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should hide unexpected exceptions behind a generic 500")
        void shouldReturn500() {
            StepVerifier.create(handler.handleGenericException(new NullPointerException("secret detail"), exchange))
                    .assertNext(resp -> {
                        assertThat(resp.getStatus()).isEqualTo(500);
                        assertThat(resp.getMessage()).doesNotContain("secret");
                    })
                    .verifyComplete();
        }
    }
}
