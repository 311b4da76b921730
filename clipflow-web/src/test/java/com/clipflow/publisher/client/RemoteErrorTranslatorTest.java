package com.clipflow.publisher.client;

import com.clipflow.publisher.exception.CredentialException;
import com.clipflow.publisher.exception.NetworkException;
import com.clipflow.publisher.exception.PipelineException;
import com.clipflow.publisher.exception.RateLimitException;
import com.clipflow.publisher.exception.RemoteRejectionException;
import com.clipflow.publisher.exception.RemoteTransientException;
import com.clipflow.publisher.model.Platform;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class RemoteErrorTranslatorTest {

    private final RemoteErrorTranslator translator = new RemoteErrorTranslator(new ObjectMapper());

    private static HttpClientErrorException clientError(HttpStatus status, String body) {
        return new HttpClientErrorException(status, status.getReasonPhrase(), body.getBytes(StandardCharsets.UTF_8),
                StandardCharsets.UTF_8);
    }

    @Test
    void translate_shouldClassifyByStatus() {
        assertInstanceOf(RateLimitException.class,
                translator.translate("OpenAI", clientError(HttpStatus.TOO_MANY_REQUESTS, "")));
        assertInstanceOf(RemoteRejectionException.class,
                translator.translate("OpenAI", clientError(HttpStatus.BAD_REQUEST, "{}")));

        PipelineException serverError = translator.translate("OpenAI",
                new HttpServerErrorException(HttpStatus.BAD_GATEWAY, "Bad Gateway", new byte[0], StandardCharsets.UTF_8));
        assertInstanceOf(RemoteTransientException.class, serverError);
        assertTrue(serverError.isRetryable());
    }

    @Test
    void translate_shouldTreatUnreachableHostAsNetworkFailure() {
        PipelineException error = translator.translate("AssemblyAI", new ResourceAccessException("Connection refused"));

        assertInstanceOf(NetworkException.class, error);
        assertFalse(error.isRetryable());
    }

    @Test
    void translate_shouldIncludeGraphErrorMessage() {
        PipelineException error = translator.translate("Facebook Graph", clientError(HttpStatus.BAD_REQUEST,
                "{\"error\":{\"message\":\"Unsupported post request\",\"code\":100}}"));

        assertTrue(error.getMessage().contains("Unsupported post request"), error.getMessage());
        assertEquals(400, ((RemoteRejectionException) error).getStatusCode());
    }

    @Test
    void translateGraph_shouldDetectRejectedTokens() {
        PipelineException expired = translator.translateGraph(Platform.INSTAGRAM, clientError(HttpStatus.BAD_REQUEST,
                "{\"error\":{\"message\":\"Error validating access token: Session has expired\",\"code\":190}}"));
        PipelineException unauthorized = translator.translateGraph(Platform.FACEBOOK, clientError(HttpStatus.UNAUTHORIZED, ""));

        assertInstanceOf(CredentialException.class, expired);
        assertEquals(Platform.INSTAGRAM, ((CredentialException) expired).getPlatform());
        assertInstanceOf(CredentialException.class, unauthorized);
    }

    @Test
    void translateGraph_shouldDetectThrottling() {
        PipelineException error = translator.translateGraph(Platform.FACEBOOK, clientError(HttpStatus.BAD_REQUEST,
                "{\"error\":{\"message\":\"Application request limit reached\",\"code\":4}}"));

        assertInstanceOf(RateLimitException.class, error);
    }

    @Test
    void translateGraph_shouldFallBackToStatusClassification() {
        PipelineException error = translator.translateGraph(Platform.FACEBOOK, clientError(HttpStatus.NOT_FOUND,
                "{\"error\":{\"message\":\"Unknown path components\",\"code\":2500}}"));

        assertInstanceOf(RemoteRejectionException.class, error);
    }
}
