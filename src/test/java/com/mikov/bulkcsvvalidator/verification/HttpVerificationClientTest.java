package com.mikov.bulkcsvvalidator.verification;

import com.mikov.bulkcsvvalidator.config.PipelineConfiguration;
import com.mikov.bulkcsvvalidator.config.PipelineSettings;
import com.mikov.bulkcsvvalidator.model.VerificationStatus;
import com.mikov.bulkcsvvalidator.validation.AddressPreFilter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.net.SocketTimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

/**
 * Tests the HTTP verification client against a mocked verification service.
 */
class HttpVerificationClientTest {
    private static final String BASE_URL = "http://verifier.test/verify-email";

    private MockRestServiceServer server;
    private HttpVerificationClient client;

    @BeforeEach
    void setUp() {
        final var restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        final var settings = PipelineSettings.builder()
            .verificationBaseUrl(BASE_URL)
            .build();
        client = new HttpVerificationClient(restTemplate, PipelineConfiguration.exponentialRetry(3, 1, 2),
            new AddressPreFilter(), settings);
    }

    private static String body(final String email, final String status) {
        return "{\"email\":\"" + email + "\",\"email_status\":\"" + status
            + "\",\"email_mx\":\"mx.example.com\",\"provider\":\"example\",\"extra\":1}";
    }

    @Test
    void validAnswerIsMappedToValid() {
        server.expect(requestTo(BASE_URL + "?email=a%40x.com"))
            .andExpect(method(HttpMethod.GET))
            .andRespond(withSuccess(body("a@x.com", "valid"), MediaType.APPLICATION_JSON));

        final var outcome = client.verify(" a@x.com ");

        assertThat(outcome.getStatus()).isEqualTo(VerificationStatus.VALID);
        assertThat(outcome.getLabel()).isEqualTo("valid");
        assertThat(outcome.getMxInfo()).isEqualTo("mx.example.com");
        assertThat(outcome.getProvider()).isEqualTo("example");
        server.verify();
    }

    @Test
    void otherServiceStatusIsUnverifiableAndKeepsItsLabel() {
        server.expect(requestTo(BASE_URL + "?email=b%40y.org"))
            .andRespond(withSuccess(body("b@y.org", "catch-all"), MediaType.APPLICATION_JSON));

        final var outcome = client.verify("b@y.org");

        assertThat(outcome.getStatus()).isEqualTo(VerificationStatus.UNVERIFIABLE);
        assertThat(outcome.getLabel()).isEqualTo("catch-all");
        server.verify();
    }

    @Test
    void addressIsEncodedIntoTheQuery() {
        server.expect(queryParam("email", "first%2Blast%40x.com"))
            .andRespond(withSuccess(body("first+last@x.com", "invalid"), MediaType.APPLICATION_JSON));

        assertThat(client.verify("first+last@x.com").getStatus()).isEqualTo(VerificationStatus.INVALID);
        server.verify();
    }

    @Test
    void transientFailureIsRetriedUntilTheServiceAnswers() {
        server.expect(ExpectedCount.once(), requestTo(BASE_URL + "?email=a%40x.com"))
            .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));
        server.expect(ExpectedCount.once(), requestTo(BASE_URL + "?email=a%40x.com"))
            .andRespond(withSuccess(body("a@x.com", "valid"), MediaType.APPLICATION_JSON));

        assertThat(client.verify("a@x.com").getStatus()).isEqualTo(VerificationStatus.VALID);
        server.verify();
    }

    @Test
    void exhaustedRetriesDegradeToServiceErrorOutcome() {
        server.expect(ExpectedCount.times(3), requestTo(BASE_URL + "?email=a%40x.com"))
            .andRespond(withException(new SocketTimeoutException("read timed out")));

        final var outcome = client.verify("a@x.com");

        assertThat(outcome.getStatus()).isEqualTo(VerificationStatus.INVALID);
        assertThat(outcome.getMxInfo()).isEqualTo("error");
        assertThat(outcome.getProvider()).isEqualTo("error");
        assertThat(outcome.isServiceError()).isTrue();
        server.verify();
    }

    @Test
    void missingStatusCountsAsFailedAttempt() {
        server.expect(ExpectedCount.times(3), requestTo(BASE_URL + "?email=a%40x.com"))
            .andRespond(withSuccess("{\"email\":\"a@x.com\"}", MediaType.APPLICATION_JSON));

        assertThat(client.verify("a@x.com").isServiceError()).isTrue();
        server.verify();
    }

    @Test
    void emptyOrMalformedAddressesNeverReachTheService() {
        assertThat(client.verify("undefined").getStatus()).isEqualTo(VerificationStatus.INVALID);
        assertThat(client.verify("").getReason()).isEqualTo("Email is null or empty");
        assertThat(client.verify("no-at-sign").getReason()).isEqualTo("Email fails structural check");
        server.verify();
    }
}
